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

package org.diagarg;

import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * The level that a lint has been set to. When converted to a diagnostic argument a LintLevel
 * becomes the command-line flag that sets it, so that messages can tell the user e.g. "{@code
 * -D unused} implied by {@code -D warnings}".
 */
public enum LintLevel implements IntoArgument {
  ALLOW,
  WARN,
  /** Like WARN, but can't be overridden by ALLOW attributes. */
  FORCE_WARN,
  DENY,
  /** Like DENY, but can't be overridden. */
  FORBID,
  EXPECT;

  public String cmdFlag() {
    return switch (this) {
      case ALLOW -> "-A";
      case WARN -> "-W";
      case FORCE_WARN -> "--force-warn";
      case DENY -> "-D";
      case FORBID -> "-F";
      case EXPECT -> "--expect";
    };
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(cmdFlag());
  }
}
