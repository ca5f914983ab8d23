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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * An interned string, used for identifiers, keywords, and literal text. Symbols with the same name
 * are always the same object.
 *
 * <p>When converted to a diagnostic argument a Symbol is written the way it would have to appear
 * in source code, i.e. reserved words get an {@code r#} prefix.
 */
public final class Symbol implements IntoArgument {
  private static final Interner<Symbol> INTERNER = Interners.newWeakInterner();

  /** Reserved in every edition, including the ones that aren't used (yet). */
  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "as", "break", "const", "continue", "crate", "else", "enum", "extern", "false", "fn",
          "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref",
          "return", "self", "Self", "static", "struct", "super", "trait", "true", "type",
          "unsafe", "use", "where", "while", "abstract", "become", "box", "do", "final", "macro",
          "override", "priv", "typeof", "unsized", "virtual", "yield");

  /** Reserved starting with the 2018 edition. */
  private static final ImmutableSet<String> KEYWORDS_2018 =
      ImmutableSet.of("async", "await", "dyn", "try");

  /** Reserved starting with the 2024 edition. */
  private static final ImmutableSet<String> KEYWORDS_2024 = ImmutableSet.of("gen");

  /** Symbols that may appear where an identifier is expected but that aren't identifiers. */
  private static final ImmutableSet<String> SPECIAL =
      ImmutableSet.of("", "_", "{{root}}", "$crate");

  /** Keywords that are also path segments, which can never be written as raw identifiers. */
  private static final ImmutableSet<String> PATH_SEGMENT_KEYWORDS =
      ImmutableSet.of("super", "self", "Self", "crate");

  public final String name;

  private Symbol(String name) {
    this.name = name;
  }

  public static Symbol intern(String name) {
    return INTERNER.intern(new Symbol(checkNotNull(name)));
  }

  /** Returns true if this symbol can't be used as an ordinary identifier in the given edition. */
  public boolean isReserved(Edition edition) {
    return SPECIAL.contains(name)
        || KEYWORDS.contains(name)
        || (edition.atLeast(Edition.EDITION_2018) && KEYWORDS_2018.contains(name))
        || (edition.atLeast(Edition.EDITION_2024) && KEYWORDS_2024.contains(name));
  }

  public boolean isPathSegmentKeyword() {
    return PATH_SEGMENT_KEYWORDS.contains(name)
        || name.equals("{{root}}")
        || name.equals("$crate");
  }

  /** Returns true if this symbol may be written with an {@code r#} prefix. */
  public boolean canBeRaw() {
    return !name.isEmpty() && !name.equals("_") && !isPathSegmentKeyword();
  }

  /**
   * Returns true if this symbol, appearing as an identifier in the given edition, must have been
   * written as a raw identifier.
   */
  public boolean isRawGuess(Edition edition) {
    return canBeRaw() && isReserved(edition);
  }

  /** Returns this symbol as it would be written as an identifier in the default edition. */
  public String toIdentString() {
    return isRawGuess(Edition.DEFAULT) ? "r#" + name : name;
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(toIdentString());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Symbol other && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
