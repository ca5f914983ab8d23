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

package org.diagarg.subdiag;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Map;

/**
 * The replacement text of a suggestion, with {@code {name}} placeholders for the subdiagnostic's
 * fields. Doubled braces stand for literal braces.
 *
 * <p>Templates are parsed when they are created, and rendered when the subdiagnostic is created;
 * both throw IllegalArgumentException on a mismatch, so a subdiagnostic that was constructed
 * successfully can always be added.
 */
public final class CodeTemplate {
  private final String template;

  /**
   * Alternating literal text and placeholder names, starting and ending with literal text (which
   * may be empty).
   */
  private final ImmutableList<String> parts;

  private CodeTemplate(String template, ImmutableList<String> parts) {
    this.template = template;
    this.parts = parts;
  }

  public static CodeTemplate of(String template) {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < template.length(); i++) {
      char c = template.charAt(i);
      if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
        literal.append('{');
        i++;
      } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
        literal.append('}');
        i++;
      } else if (c == '{') {
        int close = template.indexOf('}', i);
        checkArgument(close > i + 1, "Bad placeholder in code template %s", template);
        parts.add(literal.toString());
        literal.setLength(0);
        parts.add(template.substring(i + 1, close));
        i = close;
      } else {
        checkArgument(c != '}', "Unmatched } in code template %s", template);
        literal.append(c);
      }
    }
    parts.add(literal.toString());
    return new CodeTemplate(template, parts.build());
  }

  /** Returns the names of the placeholders used by this template. */
  public ImmutableSet<String> placeholders() {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    for (int i = 1; i < parts.size(); i += 2) {
      result.add(parts.get(i));
    }
    return result.build();
  }

  /**
   * Returns this template with each placeholder replaced by the corresponding value. Values that
   * aren't used are ignored; a placeholder with no value is an error.
   */
  public String render(Map<String, String> values) {
    StringBuilder sb = new StringBuilder(parts.get(0));
    for (int i = 1; i < parts.size(); i += 2) {
      String name = parts.get(i);
      String value = values.get(name);
      checkArgument(value != null, "No value for {%s} in code template %s", name, template);
      sb.append(value).append(parts.get(i + 1));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return template;
  }
}
