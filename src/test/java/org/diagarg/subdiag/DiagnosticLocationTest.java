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

import org.diagarg.arg.ArgumentValue;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DiagnosticLocationTest {

  /** Returns the location this method was called from. */
  private static DiagnosticLocation whereWasICalled() {
    return DiagnosticLocation.caller();
  }

  @Test
  public void here() {
    DiagnosticLocation first = DiagnosticLocation.here();
    DiagnosticLocation second = DiagnosticLocation.here();
    assertThat(first.file).isEqualTo("DiagnosticLocationTest.java");
    assertThat(first.column).isEqualTo(1);
    assertThat(second.line).isEqualTo(first.line + 1);
  }

  @Test
  public void caller() {
    DiagnosticLocation here = DiagnosticLocation.here();
    DiagnosticLocation called = whereWasICalled();
    assertThat(called.file).isEqualTo("DiagnosticLocationTest.java");
    assertThat(called.line).isEqualTo(here.line + 1);
  }

  @Test
  public void display() {
    DiagnosticLocation location = new DiagnosticLocation("Parser.java", 42, 1);
    assertThat(location.toString()).isEqualTo("Parser.java:42:1");
    assertThat(location.intoArgument()).isEqualTo(ArgumentValue.str("Parser.java:42:1"));
    assertThat(location).isEqualTo(new DiagnosticLocation("Parser.java", 42, 1));
  }
}
