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

/**
 * The order in which the kinds of generic parameters must be declared: lifetimes first, then
 * types and consts (which may be interleaved).
 */
public enum ParamKindOrd implements IntoArgument {
  LIFETIME,
  TYPE_OR_CONST;

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(toString());
  }

  @Override
  public String toString() {
    return switch (this) {
      case LIFETIME -> "lifetime";
      case TYPE_OR_CONST -> "type and const";
    };
  }
}
