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

import org.diagarg.Span;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;
import org.jspecify.annotations.Nullable;

/** A single token: its kind, its location, and (for non-punctuation kinds) its contents. */
public final class Token implements IntoArgument {
  public final TokenKind kind;
  public final Span span;

  /**
   * The identifier (for IDENT), the lifetime name including its leading {@code '} (for LIFETIME),
   * or the comment text (for DOC_COMMENT); null for other kinds.
   */
  public final @Nullable Symbol symbol;

  /** The literal, if this is a LITERAL token. */
  public final @Nullable Lit lit;

  /** True for an IDENT written with an {@code r#} prefix. */
  public final boolean isRaw;

  private Token(
      TokenKind kind, Span span, @Nullable Symbol symbol, @Nullable Lit lit, boolean isRaw) {
    this.kind = kind;
    this.span = checkNotNull(span);
    this.symbol = symbol;
    this.lit = lit;
    this.isRaw = isRaw;
  }

  /** Returns a punctuation token (or EOF). */
  public static Token punct(TokenKind kind, Span span) {
    checkArgument(kind.fixedText() != null || kind == TokenKind.EOF, "%s is not punctuation", kind);
    return new Token(kind, span, null, null, false);
  }

  public static Token ident(Symbol name, boolean isRaw, Span span) {
    return new Token(TokenKind.IDENT, span, name, null, isRaw);
  }

  /** {@code name} should include the leading {@code '}, e.g. {@code "'a"}. */
  public static Token lifetime(Symbol name, Span span) {
    checkArgument(name.name.startsWith("'"), "Lifetime without quote: %s", name);
    return new Token(TokenKind.LIFETIME, span, name, null, false);
  }

  public static Token literal(Lit lit, Span span) {
    return new Token(TokenKind.LITERAL, span, null, checkNotNull(lit), false);
  }

  /** {@code text} is the complete comment, including its {@code ///} or {@code /**}. */
  public static Token docComment(String text, Span span) {
    return new Token(TokenKind.DOC_COMMENT, span, Symbol.intern(text), null, false);
  }

  public static Token eof(Span span) {
    return new Token(TokenKind.EOF, span, null, null, false);
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(PrettyPrinter.tokenToString(this));
  }

  @Override
  public String toString() {
    return PrettyPrinter.tokenToString(this);
  }
}
