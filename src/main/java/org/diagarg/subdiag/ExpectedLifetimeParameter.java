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

import org.diagarg.Diag;
import org.diagarg.Span;
import org.diagarg.Templates;

/** Labels a place where {@code count} lifetime parameters were expected but not given. */
public final class ExpectedLifetimeParameter implements Diag.Subdiagnostic {
  public final Span span;
  public final int count;

  public ExpectedLifetimeParameter(Span span, int count) {
    checkArgument(count >= 0, "Negative count");
    this.span = checkNotNull(span);
    this.count = count;
  }

  @Override
  public void addTo(Diag.Builder diag) {
    diag.arg("count", count);
    diag.spanLabel(span, Templates.EXPECTED_LIFETIME_PARAMETER);
  }
}
