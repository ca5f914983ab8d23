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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;
import org.jspecify.annotations.Nullable;

/** The visibility marker on an item or field, e.g. {@code pub} or {@code pub(crate)}. */
public final class Visibility implements IntoArgument {

  /** The forms a Visibility may take. */
  public enum Kind {
    /** {@code pub} */
    PUBLIC,
    /** {@code pub(crate)}, {@code pub(super)}, {@code pub(in some::path)}, ... */
    RESTRICTED,
    /** No marker; the item has its default visibility. */
    INHERITED
  }

  public static final Visibility PUBLIC = new Visibility(Kind.PUBLIC, null, false);
  public static final Visibility INHERITED = new Visibility(Kind.INHERITED, null, false);

  public final Kind kind;

  /** The path that a RESTRICTED visibility is restricted to; null for other kinds. */
  public final @Nullable Path path;

  /**
   * True if a RESTRICTED visibility was written without {@code in}, e.g. {@code pub(crate)}
   * rather than {@code pub(in crate)}.
   */
  public final boolean shorthand;

  private Visibility(Kind kind, @Nullable Path path, boolean shorthand) {
    this.kind = kind;
    this.path = path;
    this.shorthand = shorthand;
  }

  public static Visibility restricted(Path path, boolean shorthand) {
    return new Visibility(Kind.RESTRICTED, checkNotNull(path), shorthand);
  }

  /** Returns {@code pub(crate)}. */
  public static Visibility crate() {
    return restricted(Path.parse("crate"), true);
  }

  /**
   * The pretty-printer emits a visibility with a trailing space (so that it can be followed
   * directly by the item); as an argument we only want the marker itself.
   */
  @Override
  public ArgumentValue intoArgument() {
    String text = PrettyPrinter.visToString(this);
    return ArgumentValue.str(CharMatcher.whitespace().trimTrailingFrom(text));
  }

  @Override
  public String toString() {
    return PrettyPrinter.visToString(this);
  }
}
