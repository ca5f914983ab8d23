/*
 * Copyright 2025 The Diagarg Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.diagarg.util;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Static methods for converting characters and strings to and from their quoted debug form, e.g.
 * {@code '\n'} or {@code "a\tb"}.
 *
 * <p>The escapes are {@code \0 \t \r \n \\}, the enclosing quote, and <code>&#92;u{hex}</code> for
 * anything that wouldn't be visible (or unambiguous) when printed, such as control characters,
 * unpaired surrogates, combining marks and all whitespace other than a plain space.
 */
public class StringUtil {

  // Statics only
  private StringUtil() {}

  /** Returns the given code point enclosed in single quotes, escaped as necessary. */
  public static String quoteChar(int codePoint) {
    StringBuilder sb = new StringBuilder(8).append('\'');
    appendEscaped(sb, codePoint, '\'');
    return sb.append('\'').toString();
  }

  /** Returns the given string enclosed in double quotes, escaped as necessary. */
  public static String quoteString(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    s.codePoints().forEach(cp -> appendEscaped(sb, cp, '"'));
    return sb.append('"').toString();
  }

  /**
   * The inverse of {@link #quoteChar}: given a single-quoted character with optional escapes,
   * returns its code point. Throws an IllegalArgumentException if {@code quoted} is not a single
   * quoted character.
   */
  public static int unquoteChar(String quoted) {
    checkArgument(
        quoted.length() >= 3 && quoted.startsWith("'") && quoted.endsWith("'"),
        "Not a quoted character: %s",
        quoted);
    String body = unescape(quoted.substring(1, quoted.length() - 1));
    checkArgument(body.codePointCount(0, body.length()) == 1, "Not a single character: %s", quoted);
    return body.codePointAt(0);
  }

  /** Undoes the escapes added by {@link #quoteChar} and {@link #quoteString}. */
  public static String unescape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      checkArgument(i + 1 < s.length(), "Dangling escape in %s", s);
      char next = s.charAt(++i);
      switch (next) {
        case '0' -> sb.append('\0');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case 'n' -> sb.append('\n');
        case '\\', '\'', '"' -> sb.append(next);
        case 'u' -> {
          int close = s.indexOf('}', i);
          checkArgument(
              i + 1 < s.length() && s.charAt(i + 1) == '{' && close > i + 2,
              "Bad unicode escape in %s",
              s);
          sb.appendCodePoint(Integer.parseInt(s.substring(i + 2, close), 16));
          i = close;
        }
        default -> throw new IllegalArgumentException("Unknown escape \\" + next + " in " + s);
      }
    }
    return sb.toString();
  }

  private static void appendEscaped(StringBuilder sb, int cp, char quote) {
    switch (cp) {
      case '\0' -> sb.append("\\0");
      case '\t' -> sb.append("\\t");
      case '\r' -> sb.append("\\r");
      case '\n' -> sb.append("\\n");
      case '\\' -> sb.append("\\\\");
      default -> {
        if (cp == quote) {
          sb.append('\\').append(quote);
        } else if (isPrintable(cp)) {
          sb.appendCodePoint(cp);
        } else {
          sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
        }
      }
    }
  }

  private static boolean isPrintable(int cp) {
    switch (Character.getType(cp)) {
      case Character.CONTROL,
          Character.FORMAT,
          Character.UNASSIGNED,
          Character.SURROGATE,
          Character.PRIVATE_USE,
          Character.LINE_SEPARATOR,
          Character.PARAGRAPH_SEPARATOR,
          Character.NON_SPACING_MARK,
          Character.ENCLOSING_MARK:
        return false;
      case Character.SPACE_SEPARATOR:
        return cp == ' ';
      default:
        return true;
    }
  }
}
