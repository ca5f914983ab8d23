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

import static com.google.common.base.Preconditions.checkNotNull;

import org.diagarg.Diag;
import org.diagarg.Span;
import org.diagarg.TemplateKey;
import org.diagarg.Templates;

/**
 * A note on a delayed bug, saying where in the compiler it was originally reported and (if one was
 * captured) the compiler's stack at that point.
 *
 * <p>There are two templates: if the backtrace was captured it is shown starting on a new line
 * after the location, otherwise the "disabled backtrace" text follows the location on the same
 * line.
 */
public final class DelayedAt implements Diag.Subdiagnostic {
  public final Span span;
  public final DiagnosticLocation emittedAt;
  public final Backtrace note;
  public final TemplateKey template;

  private DelayedAt(Span span, DiagnosticLocation emittedAt, Backtrace note, TemplateKey template) {
    this.span = checkNotNull(span);
    this.emittedAt = checkNotNull(emittedAt);
    this.note = checkNotNull(note);
    this.template = template;
  }

  /** Chooses the template according to whether {@code note} has any frames. */
  public static DelayedAt of(Span span, DiagnosticLocation emittedAt, Backtrace note) {
    return note.isCaptured()
        ? withNewline(span, emittedAt, note)
        : withoutNewline(span, emittedAt, note);
  }

  public static DelayedAt withNewline(Span span, DiagnosticLocation emittedAt, Backtrace note) {
    return new DelayedAt(span, emittedAt, note, Templates.DELAYED_AT_WITH_NEWLINE);
  }

  public static DelayedAt withoutNewline(Span span, DiagnosticLocation emittedAt, Backtrace note) {
    return new DelayedAt(span, emittedAt, note, Templates.DELAYED_AT_WITHOUT_NEWLINE);
  }

  @Override
  public void addTo(Diag.Builder diag) {
    diag.arg("emitted_at", emittedAt);
    diag.arg("note", note);
    diag.spanNote(span, template);
  }
}
