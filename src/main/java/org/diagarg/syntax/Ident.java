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

import org.diagarg.Span;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/** An identifier together with the span where it appeared. */
public final class Ident implements IntoArgument {
  public final Symbol name;
  public final Span span;

  /** True if this identifier was written with an {@code r#} prefix. */
  public final boolean isRaw;

  public Ident(Symbol name, Span span, boolean isRaw) {
    this.name = checkNotNull(name);
    this.span = checkNotNull(span);
    this.isRaw = isRaw;
  }

  /** Returns a non-raw Ident with a dummy span. */
  public static Ident of(String name) {
    return new Ident(Symbol.intern(name), Span.DUMMY, false);
  }

  /**
   * Returns an Ident for a name that may not have been written in source, guessing that it would
   * have needed to be raw if it is reserved in the given edition.
   */
  public static Ident withRawGuess(Symbol name, Span span, Edition edition) {
    return new Ident(name, span, name.isRawGuess(edition));
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(toString());
  }

  /** Identifiers are equal if they have the same name and rawness; spans are ignored. */
  @Override
  public boolean equals(Object obj) {
    return obj instanceof Ident other && name == other.name && isRaw == other.isRaw;
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 2 + (isRaw ? 1 : 0);
  }

  /**
   * Reserved words are shown with an {@code r#} prefix even if this Ident wasn't written that way,
   * since they can only appear as identifiers if they were.
   */
  @Override
  public String toString() {
    return (isRaw || name.isRawGuess(Edition.DEFAULT)) ? "r#" + name : name.toString();
  }
}
