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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * The compiler's own call stack at some point, e.g. where a delayed bug was reported, so that it
 * can be included in the eventual diagnostic.
 *
 * <p>A Backtrace may be "disabled" (no frames were captured), in which case it displays as {@code
 * disabled backtrace}. Otherwise each frame is displayed on two lines:
 *
 * <pre>
 *    0: org.example.Parser.parseItem
 *              at Parser.java:123
 * </pre>
 */
public final class Backtrace implements IntoArgument {
  private static final Backtrace DISABLED = new Backtrace(ImmutableList.of());

  private static final StackWalker WALKER = StackWalker.getInstance();

  private final ImmutableList<StackTraceElement> frames;

  private Backtrace(ImmutableList<StackTraceElement> frames) {
    this.frames = frames;
  }

  /**
   * Captures the current thread's stack, starting with the caller of {@code capture()}. This walks
   * the whole stack, so it is not cheap; it is expected to be called rarely.
   */
  public static Backtrace capture() {
    ImmutableList<StackTraceElement> frames =
        WALKER.walk(
            s ->
                s.skip(1)
                    .map(StackWalker.StackFrame::toStackTraceElement)
                    .collect(ImmutableList.toImmutableList()));
    return new Backtrace(frames);
  }

  /** Returns a Backtrace with the given frames, innermost first. */
  public static Backtrace of(List<StackTraceElement> frames) {
    return frames.isEmpty() ? DISABLED : new Backtrace(ImmutableList.copyOf(frames));
  }

  /** Returns the stack at which {@code t} was created. */
  public static Backtrace of(Throwable t) {
    return of(ImmutableList.copyOf(t.getStackTrace()));
  }

  /** Returns a Backtrace with no frames. */
  public static Backtrace disabled() {
    return DISABLED;
  }

  public boolean isCaptured() {
    return !frames.isEmpty();
  }

  public ImmutableList<StackTraceElement> frames() {
    return frames;
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(toString());
  }

  @Override
  public String toString() {
    if (frames.isEmpty()) {
      return "disabled backtrace";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < frames.size(); i++) {
      StackTraceElement frame = frames.get(i);
      if (i != 0) {
        sb.append('\n');
      }
      sb.append(String.format("%4d: %s.%s", i, frame.getClassName(), frame.getMethodName()));
      sb.append("\n             at ").append(location(frame));
    }
    return sb.toString();
  }

  private static String location(StackTraceElement frame) {
    String file = (frame.getFileName() == null) ? "<unknown>" : frame.getFileName();
    return (frame.getLineNumber() < 0) ? file : file + ":" + frame.getLineNumber();
  }
}
