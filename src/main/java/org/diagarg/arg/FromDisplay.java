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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Adapts any object to IntoArgument using its {@code toString()}; useful when a diagnostic field
 * should hold "something printable" without committing to a particular type.
 */
public final class FromDisplay implements IntoArgument {
  private final Object value;

  private FromDisplay(Object value) {
    this.value = value;
  }

  public static FromDisplay of(Object value) {
    return new FromDisplay(checkNotNull(value));
  }

  @Override
  public ArgumentValue intoArgument() {
    return Args.display(value);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
