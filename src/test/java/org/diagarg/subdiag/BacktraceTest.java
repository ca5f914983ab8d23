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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.diagarg.arg.ArgumentValue;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BacktraceTest {

  @Test
  public void disabled() {
    assertThat(Backtrace.disabled().isCaptured()).isFalse();
    assertThat(Backtrace.disabled().toString()).isEqualTo("disabled backtrace");
    assertThat(Backtrace.of(ImmutableList.of())).isSameInstanceAs(Backtrace.disabled());
    assertThat(Backtrace.disabled().intoArgument())
        .isEqualTo(ArgumentValue.str("disabled backtrace"));
  }

  @Test
  public void frames() {
    Backtrace backtrace =
        Backtrace.of(
            ImmutableList.of(
                new StackTraceElement("a.Parser", "parseItem", "Parser.java", 123),
                new StackTraceElement("a.Driver", "run", null, -1)));
    assertThat(backtrace.isCaptured()).isTrue();
    assertThat(backtrace.toString())
        .isEqualTo(
            "   0: a.Parser.parseItem\n"
                + "             at Parser.java:123\n"
                + "   1: a.Driver.run\n"
                + "             at <unknown>");
  }

  @Test
  public void captureStartsWithTheCaller() {
    Backtrace backtrace = Backtrace.capture();
    assertThat(backtrace.isCaptured()).isTrue();
    StackTraceElement first = backtrace.frames().get(0);
    assertThat(first.getClassName()).isEqualTo(BacktraceTest.class.getName());
    assertThat(first.getMethodName()).isEqualTo("captureStartsWithTheCaller");
  }

  @Test
  public void fromThrowable() {
    Backtrace backtrace = Backtrace.of(new IllegalStateException());
    assertThat(backtrace.frames().get(0).getMethodName()).isEqualTo("fromThrowable");
  }
}
