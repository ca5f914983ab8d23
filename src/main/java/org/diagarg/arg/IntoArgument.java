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

/**
 * Implemented by any type whose values may appear as an argument in a diagnostic message.
 *
 * <p>{@link #intoArgument} must be total (it may not throw for any instance of the implementing
 * type, including instances in an "invalid" state; those should fall back to some textual
 * description) and pure (no I/O, and no changes to this or any other object). A value is
 * conceptually handed over to the diagnostic when it is converted, so callers should not expect
 * to do anything further with it.
 *
 * <p>Types that can't implement this interface (primitives, Strings, Paths, ...) are converted by
 * the static methods in {@link Args}.
 */
public interface IntoArgument {
  ArgumentValue intoArgument();
}
