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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * A literal token, e.g. {@code 42u8}, {@code "abc"}, or {@code r#"raw"#}. The symbol holds the
 * literal's text exactly as written between its delimiters (so escapes have not been processed).
 */
public final class Lit {

  /** The different forms of literal. */
  public enum Kind {
    BOOL,
    BYTE,
    CHAR,
    INTEGER,
    FLOAT,
    STR,
    /** A raw string, {@code r"..."} with some number of {@code #} on each side. */
    STR_RAW,
    BYTE_STR,
    BYTE_STR_RAW,
    /** A literal that couldn't be lexed; its symbol is the raw source text. */
    ERR
  }

  public final Kind kind;
  public final Symbol symbol;
  public final @Nullable Symbol suffix;

  /** The number of {@code #} delimiters; only non-zero for STR_RAW and BYTE_STR_RAW. */
  public final int rawHashes;

  private Lit(Kind kind, Symbol symbol, @Nullable Symbol suffix, int rawHashes) {
    this.kind = checkNotNull(kind);
    this.symbol = checkNotNull(symbol);
    this.suffix = suffix;
    this.rawHashes = rawHashes;
  }

  public static Lit of(Kind kind, String text) {
    checkArgument(kind != Kind.STR_RAW && kind != Kind.BYTE_STR_RAW, "Use Lit.raw()");
    return new Lit(kind, Symbol.intern(text), null, 0);
  }

  public static Lit withSuffix(Kind kind, String text, String suffix) {
    checkArgument(kind != Kind.STR_RAW && kind != Kind.BYTE_STR_RAW, "Use Lit.raw()");
    return new Lit(kind, Symbol.intern(text), Symbol.intern(suffix), 0);
  }

  /** Returns a raw string literal (or raw byte string literal, if {@code bytes} is true). */
  public static Lit raw(boolean bytes, String text, int rawHashes) {
    checkArgument(rawHashes >= 0 && rawHashes <= 255, "Bad raw string delimiter count");
    return new Lit(bytes ? Kind.BYTE_STR_RAW : Kind.STR_RAW, Symbol.intern(text), null, rawHashes);
  }

  @Override
  public String toString() {
    return PrettyPrinter.literalToString(this);
  }
}
