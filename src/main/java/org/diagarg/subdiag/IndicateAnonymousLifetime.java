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

import com.google.common.collect.ImmutableMap;
import org.diagarg.Diag;
import org.diagarg.Diag.Applicability;
import org.diagarg.Diag.SuggestionStyle;
import org.diagarg.Span;
import org.diagarg.Templates;

/**
 * Suggests writing out elided lifetimes, e.g. replacing {@code Foo} with {@code Foo<'_>}. The
 * suggested code is always shown, even when it is short.
 */
public final class IndicateAnonymousLifetime implements Diag.Subdiagnostic {
  private static final CodeTemplate CODE = CodeTemplate.of("{suggestion}");

  public final Span span;
  public final int count;
  public final String suggestion;

  /** The replacement text; rendered from {@link #CODE} when this subdiagnostic is created. */
  private final String code;

  public IndicateAnonymousLifetime(Span span, int count, String suggestion) {
    checkArgument(count >= 0, "Negative count");
    this.span = checkNotNull(span);
    this.count = count;
    this.suggestion = checkNotNull(suggestion);
    this.code = CODE.render(ImmutableMap.of("suggestion", suggestion));
  }

  @Override
  public void addTo(Diag.Builder diag) {
    diag.arg("count", count);
    diag.arg("suggestion", suggestion);
    diag.spanSuggestion(
        span,
        Templates.INDICATE_ANONYMOUS_LIFETIME,
        code,
        Applicability.UNSPECIFIED,
        SuggestionStyle.SHOW_ALWAYS);
  }
}
