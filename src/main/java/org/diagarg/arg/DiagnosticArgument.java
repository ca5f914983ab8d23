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

package org.diagarg.arg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named ArgumentValue, ready to be bound into a diagnostic template. Templates refer to
 * arguments by name, so a diagnostic has at most one argument with a given name.
 */
public final class DiagnosticArgument {
  public final String name;
  public final ArgumentValue value;

  public DiagnosticArgument(String name, ArgumentValue value) {
    checkArgument(!name.isEmpty(), "Argument name may not be empty");
    this.name = name;
    this.value = checkNotNull(value);
  }

  /** Converts {@code value} and pairs it with {@code name}. */
  public static DiagnosticArgument of(String name, IntoArgument value) {
    return new DiagnosticArgument(name, value.intoArgument());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof DiagnosticArgument other
        && name.equals(other.name)
        && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + value.hashCode();
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
