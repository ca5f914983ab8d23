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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.diagarg.Level;
import org.diagarg.MockDiagCtxt;
import org.diagarg.Span;
import org.diagarg.Templates;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.ArgumentValue.Num;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SubdiagnosticTest {

  private static final Span SPAN_A = new Span("lib.rs", 3, 5, 4);
  private static final Span SPAN_B = new Span("lib.rs", 7, 1, 2);

  private final MockDiagCtxt dcx = new MockDiagCtxt();
  private final MockDiagCtxt.Builder diag =
      dcx.create(Level.ERROR, Templates.TARGET_MISSING_ALIGNMENT);

  @Test
  public void singleLabelManySpans() {
    diag.subdiagnostic(new SingleLabelManySpans(ImmutableList.of(SPAN_A, SPAN_B), "here"));
    assertThat(diag.args()).isEmpty();
    assertThat(diag.children())
        .containsExactly("label lib.rs:3:5+4 \"here\"", "label lib.rs:7:1+2 \"here\"")
        .inOrder();
    assertThrows(
        IllegalArgumentException.class, () -> new SingleLabelManySpans(ImmutableList.of(), "x"));
  }

  @Test
  public void expectedLifetimeParameter() {
    diag.subdiagnostic(new ExpectedLifetimeParameter(SPAN_A, 2));
    assertThat(diag.args()).containsExactly("count", Num.of(2));
    assertThat(diag.children())
        .containsExactly("label lib.rs:3:5+4 errors_expected_lifetime_parameter");
  }

  @Test
  public void invalidFlushedDelayedDiagnosticLevel() {
    diag.subdiagnostic(new InvalidFlushedDelayedDiagnosticLevel(SPAN_B, Level.WARNING));
    assertThat(diag.args()).containsExactly("level", ArgumentValue.str("warning"));
    assertThat(diag.children())
        .containsExactly("note lib.rs:7:1+2 errors_invalid_flushed_delayed_diagnostic_level");
  }

  @Test
  public void indicateAnonymousLifetime() {
    diag.subdiagnostic(new IndicateAnonymousLifetime(SPAN_A, 1, "Foo<'_>"));
    assertThat(diag.args())
        .containsExactly("count", Num.of(1), "suggestion", ArgumentValue.str("Foo<'_>"))
        .inOrder();
    assertThat(diag.children())
        .containsExactly(
            "suggestion lib.rs:3:5+4 errors_indicate_anonymous_lifetime \"Foo<'_>\""
                + " UNSPECIFIED verbose");
  }

  @Test
  public void delayedAtWithoutBacktrace() {
    DelayedAt delayed =
        DelayedAt.of(SPAN_A, new DiagnosticLocation("Parser.java", 10, 1), Backtrace.disabled());
    assertThat(delayed.template).isEqualTo(Templates.DELAYED_AT_WITHOUT_NEWLINE);
    diag.subdiagnostic(delayed);
    assertThat(diag.args())
        .containsExactly(
            "emitted_at", ArgumentValue.str("Parser.java:10:1"),
            "note", ArgumentValue.str("disabled backtrace"))
        .inOrder();
    assertThat(diag.children())
        .containsExactly("note lib.rs:3:5+4 errors_delayed_at_without_newline");
  }

  @Test
  public void delayedAtWithBacktrace() {
    Backtrace backtrace =
        Backtrace.of(
            ImmutableList.of(new StackTraceElement("a.Parser", "parse", "Parser.java", 12)));
    DelayedAt delayed = DelayedAt.of(SPAN_A, DiagnosticLocation.here(), backtrace);
    assertThat(delayed.template).isEqualTo(Templates.DELAYED_AT_WITH_NEWLINE);
    assertThat(delayed.emittedAt.file).isEqualTo("SubdiagnosticTest.java");
    // The template can also be chosen explicitly.
    assertThat(DelayedAt.withoutNewline(SPAN_A, delayed.emittedAt, backtrace).template)
        .isEqualTo(Templates.DELAYED_AT_WITHOUT_NEWLINE);
  }

  @Test
  public void subdiagnosticsMergeInOrder() {
    diag.arg("count", 7)
        .subdiagnostic(new ExpectedLifetimeParameter(SPAN_A, 1))
        .subdiagnostic(new SingleLabelManySpans(ImmutableList.of(SPAN_B), "also here"))
        .subdiagnostic(new InvalidFlushedDelayedDiagnosticLevel(SPAN_B, Level.NOTE));
    // The second binding of "count" replaces the first, but keeps its position.
    assertThat(diag.toString())
        .isEqualTo(
            "error errors_target_missing_alignment\n"
                + "  count=Num(1)\n"
                + "  level=Str(\"note\")\n"
                + "  label lib.rs:3:5+4 errors_expected_lifetime_parameter\n"
                + "  label lib.rs:7:1+2 \"also here\"\n"
                + "  note lib.rs:7:1+2 errors_invalid_flushed_delayed_diagnostic_level");
  }
}
