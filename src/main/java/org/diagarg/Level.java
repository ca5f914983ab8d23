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

/** The severity with which a diagnostic is emitted. */
public enum Level implements IntoArgument {
  /** An internal compiler error, reported immediately. */
  BUG,
  /** An internal compiler error that is only reported if compilation would otherwise succeed. */
  DELAYED_BUG,
  /** An error that stops compilation immediately. */
  FATAL,
  ERROR,
  WARNING,
  NOTE,
  /** A note that is only emitted the first time it is generated. */
  ONCE_NOTE,
  HELP,
  /** A help message that is only emitted the first time it is generated. */
  ONCE_HELP,
  /** Additional information about a failure, e.g. "aborting due to previous error". */
  FAILURE_NOTE,
  /** Only used for lints that have been allowed; never displayed. */
  ALLOW,
  /** Only used for lints that are expected to fire; never displayed. */
  EXPECT;

  /** Returns the prefix used when displaying a diagnostic at this level. */
  public String label() {
    return switch (this) {
      case BUG, DELAYED_BUG -> "error: internal compiler error";
      case FATAL, ERROR -> "error";
      case WARNING -> "warning";
      case NOTE, ONCE_NOTE -> "note";
      case HELP, ONCE_HELP -> "help";
      case FAILURE_NOTE -> "failure-note";
      // These are never displayed, but we still need something to say about them.
      case ALLOW -> "allow";
      case EXPECT -> "expect";
    };
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
