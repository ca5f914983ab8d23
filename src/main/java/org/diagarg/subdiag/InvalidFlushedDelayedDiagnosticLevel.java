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
import org.diagarg.Level;
import org.diagarg.Span;
import org.diagarg.Templates;

/**
 * A note added when a delayed diagnostic is flushed with a level that delayed diagnostics may not
 * have (anything but a bug).
 */
public final class InvalidFlushedDelayedDiagnosticLevel implements Diag.Subdiagnostic {
  public final Span span;
  public final Level level;

  public InvalidFlushedDelayedDiagnosticLevel(Span span, Level level) {
    this.span = checkNotNull(span);
    this.level = checkNotNull(level);
  }

  @Override
  public void addTo(Diag.Builder diag) {
    diag.arg("level", level);
    diag.spanNote(span, Templates.INVALID_FLUSHED_DELAYED_DIAGNOSTIC_LEVEL);
  }
}
