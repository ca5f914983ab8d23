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

/** Which functions get stack-smashing protection, from least to most. */
public enum StackProtector implements IntoArgument {
  /** Disable stack canary generation. */
  NONE,
  /** Only functions with character arrays of at least eight bytes are protected. */
  BASIC,
  /** Functions that contain any array, or that take the address of a local, are protected. */
  STRONG,
  /** Every function is protected. */
  ALL;

  /** The name used to select this option, which is also how it is displayed. */
  public String optionName() {
    return switch (this) {
      case NONE -> "none";
      case BASIC -> "basic";
      case STRONG -> "strong";
      case ALL -> "all";
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
