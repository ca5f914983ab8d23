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

package org.diagarg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.antlr.v4.runtime.Token;
import org.jspecify.annotations.Nullable;

/**
 * A region of source text that a diagnostic (or one of its labels, notes, or suggestions) refers
 * to. Lines and columns are 1-based; {@code length} is in chars and may be zero.
 */
public final class Span {
  /** A placeholder for diagnostics that don't correspond to any source text. */
  public static final Span DUMMY = new Span("<dummy>", 0, 0, 0);

  public final String source;
  public final int line;
  public final int column;
  public final int length;

  public Span(String source, int line, int column, int length) {
    checkArgument(
        line >= 0 && column >= 0 && length >= 0, "Bad span %s:%s:%s", line, column, length);
    this.source = checkNotNull(source);
    this.line = line;
    this.column = column;
    this.length = length;
  }

  /**
   * Returns a Span covering the given ANTLR token.
   *
   * @param source identifies the source of the token, e.g. a filename
   */
  public static Span of(Object source, @Nullable Token token) {
    if (token == null) {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      return new Span(String.valueOf(source), 0, 0, 0);
    }
    int length = 0;
    if (token.getStartIndex() >= 0 && token.getStopIndex() >= token.getStartIndex()) {
      length = token.getStopIndex() - token.getStartIndex() + 1;
    }
    return new Span(
        String.valueOf(source), token.getLine(), token.getCharPositionInLine() + 1, length);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Span other
        && source.equals(other.source)
        && line == other.line
        && column == other.column
        && length == other.length;
  }

  @Override
  public int hashCode() {
    return ((source.hashCode() * 31 + line) * 31 + column) * 31 + length;
  }

  @Override
  public String toString() {
    return String.format("%s:%s:%s+%s", source, line, column, length);
  }
}
