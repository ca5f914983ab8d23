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
import static com.google.common.base.Preconditions.checkNotNull;

import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * A location in the compiler's own (Java) source, e.g. where a delayed bug was reported. Displayed
 * as {@code file:line:column}; the JVM doesn't record columns, so captured locations always use
 * column 1.
 */
public final class DiagnosticLocation implements IntoArgument {
  private static final StackWalker WALKER = StackWalker.getInstance();

  public final String file;
  public final int line;
  public final int column;

  public DiagnosticLocation(String file, int line, int column) {
    checkArgument(line >= 0 && column >= 0, "Bad location %s:%s", line, column);
    this.file = checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns the location of the code that called {@code here()}. */
  public static DiagnosticLocation here() {
    return fromStack(1);
  }

  /**
   * Returns the location of the call to the method that called {@code caller()}; i.e. a method
   * that wants to record where it was called from can call this.
   */
  public static DiagnosticLocation caller() {
    return fromStack(2);
  }

  /** Returns the location of the given frame, counting the caller of this method as frame 0. */
  private static DiagnosticLocation fromStack(int frame) {
    return WALKER
        .walk(frames -> frames.skip(frame + 1).findFirst())
        .map(DiagnosticLocation::of)
        .orElseGet(() -> new DiagnosticLocation("<unknown>", 0, 0));
  }

  private static DiagnosticLocation of(StackWalker.StackFrame frame) {
    String file = frame.getFileName();
    return new DiagnosticLocation(
        (file == null) ? "<unknown>" : file, Math.max(frame.getLineNumber(), 0), 1);
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(toString());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof DiagnosticLocation other
        && file.equals(other.file)
        && line == other.line
        && column == other.column;
  }

  @Override
  public int hashCode() {
    return (file.hashCode() * 31 + line) * 31 + column;
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + column;
  }
}
