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
 * The kinds of item bodies that are evaluated at compile time.
 *
 * <p>As a diagnostic argument a ConstContext becomes an identifier-like key ({@code const_fn},
 * {@code static}, {@code const}) that message templates can select on; {@link #keywordName} is
 * the form to show the user directly.
 */
public enum ConstContext implements IntoArgument {
  CONST_FN,
  STATIC,
  CONST;

  public String keywordName() {
    return switch (this) {
      case CONST_FN -> "const fn";
      case STATIC -> "static";
      case CONST -> "const";
    };
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(
        switch (this) {
          case CONST_FN -> "const_fn";
          case STATIC -> "static";
          case CONST -> "const";
        });
  }
}
