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

package org.diagarg.target;

import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/** Where debug information is written. */
public enum SplitDebuginfo implements IntoArgument {
  /** Debug information is left in the object files and linked into the output. */
  OFF,
  /** Debug information is collected into a separate file next to the output. */
  PACKED,
  /** Debug information is left in the object files, which the output refers to. */
  UNPACKED;

  public String optionName() {
    return switch (this) {
      case OFF -> "off";
      case PACKED -> "packed";
      case UNPACKED -> "unpacked";
    };
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(optionName());
  }

  @Override
  public String toString() {
    return optionName();
  }
}
