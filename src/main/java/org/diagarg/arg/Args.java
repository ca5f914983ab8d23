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

package org.diagarg.arg;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.function.UnaryOperator;
import org.diagarg.arg.ArgumentValue.Num;
import org.diagarg.util.StringUtil;

/**
 * A statics-only class that converts values of types which can't implement {@link IntoArgument}
 * (primitives and JDK classes) into ArgumentValues.
 *
 * <p>All of these methods are total. Overloads are chosen by the compiler, so a value with a
 * dedicated method here is never converted by the generic {@link #display} fallback unless the
 * caller asks for it by name.
 */
public class Args {

  // Statics only
  private Args() {}

  public static ArgumentValue of(byte value) {
    return Num.of(value);
  }

  public static ArgumentValue of(short value) {
    return Num.of(value);
  }

  public static ArgumentValue of(int value) {
    return Num.of(value);
  }

  public static ArgumentValue of(long value) {
    return Num.of(value);
  }

  /** Converts {@code value} interpreted as an unsigned 8-bit integer. */
  public static ArgumentValue ofUnsigned(byte value) {
    return Num.of(Byte.toUnsignedLong(value));
  }

  /** Converts {@code value} interpreted as an unsigned 16-bit integer. */
  public static ArgumentValue ofUnsigned(short value) {
    return Num.of(Short.toUnsignedLong(value));
  }

  /** Converts {@code value} interpreted as an unsigned 32-bit integer. */
  public static ArgumentValue ofUnsigned(int value) {
    return Num.of(Integer.toUnsignedLong(value));
  }

  /** Converts {@code value} interpreted as an unsigned 64-bit integer. */
  public static ArgumentValue ofUnsigned(long value) {
    return Num.ofUnsigned(value);
  }

  /**
   * BigIntegers may not fit in a Num, so they are always converted to their decimal string (which
   * is also how 128-bit values are rendered).
   */
  public static ArgumentValue of(BigInteger value) {
    return ArgumentValue.str(value.toString());
  }

  /** Returns {@code Str("true")} or {@code Str("false")}. */
  public static ArgumentValue of(boolean value) {
    return ArgumentValue.str(value ? "true" : "false");
  }

  /**
   * Returns the character in quotes, with escapes for anything that would be invisible or
   * ambiguous (e.g. {@code '\n'} becomes the four characters {@code '\n'}).
   */
  public static ArgumentValue of(char value) {
    return ArgumentValue.str(StringUtil.quoteChar(value));
  }

  /** Like {@link #of(char)}, for characters outside the basic multilingual plane. */
  public static ArgumentValue ofCodePoint(int codePoint) {
    return ArgumentValue.str(StringUtil.quoteChar(codePoint));
  }

  public static ArgumentValue of(CharSequence value) {
    return ArgumentValue.str(value.toString());
  }

  /** Paths are converted to the platform's usual display form (not quoted or escaped). */
  public static ArgumentValue of(Path path) {
    return ArgumentValue.str(path.toString());
  }

  public static ArgumentValue of(File file) {
    return ArgumentValue.str(file.getPath());
  }

  /**
   * Converts a NUL-terminated C string. Bytes after the first NUL (if any) are ignored, and bytes
   * that aren't valid UTF-8 are replaced with U+FFFD.
   */
  public static ArgumentValue ofCString(byte[] bytes) {
    int length = 0;
    while (length < bytes.length && bytes[length] != 0) {
      length++;
    }
    return ArgumentValue.str(new String(bytes, 0, length, UTF_8));
  }

  /**
   * Converts an exception (an I/O error, a NumberFormatException from parsing, ...) to its
   * message, or to its {@code toString()} if it doesn't have one.
   */
  public static ArgumentValue of(Throwable error) {
    String msg = error.getMessage();
    return ArgumentValue.str((msg != null) ? msg : error.toString());
  }

  public static ArgumentValue of(IntoArgument value) {
    return value.intoArgument();
  }

  /**
   * Converts a value that the caller doesn't own, by converting a copy of it. The conversion never
   * sees (or describes) {@code referent} itself.
   */
  public static <T extends IntoArgument> ArgumentValue ofShared(
      T referent, UnaryOperator<T> copier) {
    return copier.apply(referent).intoArgument();
  }

  /**
   * Converts any object using its {@code toString()}. This is the fallback for types that have a
   * reasonable textual form but no dedicated conversion.
   */
  public static ArgumentValue display(Object value) {
    return ArgumentValue.str(String.valueOf(value));
  }

  /**
   * Returns a StrListSepByAnd containing the display form of each item enclosed in backticks, in
   * the order they were provided.
   */
  public static ArgumentValue backtickedList(Iterable<?> items) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Object item : items) {
      builder.add("`" + item + "`");
    }
    return ArgumentValue.strList(builder.build());
  }
}
