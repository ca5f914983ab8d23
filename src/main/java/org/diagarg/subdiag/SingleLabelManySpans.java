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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.diagarg.Diag;
import org.diagarg.Span;

/**
 * Highlights several spans with the same fixed label, e.g. every argument that has the same
 * problem. The label is not a template and has no arguments.
 */
public final class SingleLabelManySpans implements Diag.Subdiagnostic {
  public final ImmutableList<Span> spans;
  public final String label;

  public SingleLabelManySpans(List<Span> spans, String label) {
    checkArgument(!spans.isEmpty(), "No spans to label");
    this.spans = ImmutableList.copyOf(spans);
    this.label = checkNotNull(label);
  }

  @Override
  public void addTo(Diag.Builder diag) {
    diag.spanLabels(spans, label);
  }
}
