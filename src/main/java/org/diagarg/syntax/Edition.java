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

package org.diagarg.syntax;

import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/** The editions of the language; each edition may reserve new keywords or change semantics. */
public enum Edition implements IntoArgument {
  EDITION_2015,
  EDITION_2018,
  EDITION_2021,
  EDITION_2024;

  /** The edition used when none has been specified. */
  public static final Edition DEFAULT = EDITION_2015;

  public String label() {
    return switch (this) {
      case EDITION_2015 -> "2015";
      case EDITION_2018 -> "2018";
      case EDITION_2021 -> "2021";
      case EDITION_2024 -> "2024";
    };
  }

  public boolean atLeast(Edition other) {
    return compareTo(other) >= 0;
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(label());
  }

  @Override
  public String toString() {
    return label();
  }
}
