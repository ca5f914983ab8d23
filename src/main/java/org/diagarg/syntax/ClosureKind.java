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

/** Which of the closure traits a closure implements, from most to least permissive caller. */
public enum ClosureKind implements IntoArgument {
  FN,
  FN_MUT,
  FN_ONCE;

  /** The name of the corresponding trait. */
  public String traitName() {
    return switch (this) {
      case FN -> "Fn";
      case FN_MUT -> "FnMut";
      case FN_ONCE -> "FnOnce";
    };
  }

  /** Returns true if a closure of this kind can be used where {@code other} is expected. */
  public boolean extendsKind(ClosureKind other) {
    return compareTo(other) <= 0;
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(traitName());
  }
}
