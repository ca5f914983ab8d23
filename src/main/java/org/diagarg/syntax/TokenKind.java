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
import org.jspecify.annotations.Nullable;

/**
 * The kinds of token produced by the lexer. Punctuation kinds have fixed text; the others
 * (identifiers, lifetimes, literals, doc comments, and end-of-file) carry data in their Token and
 * are described generically when only the kind is known.
 */
public enum TokenKind implements IntoArgument {
  EQ("="),
  LT("<"),
  LE("<="),
  EQ_EQ("=="),
  NE("!="),
  GE(">="),
  GT(">"),
  AND_AND("&&"),
  OR_OR("||"),
  NOT("!"),
  TILDE("~"),
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  PERCENT("%"),
  CARET("^"),
  AND("&"),
  OR("|"),
  SHL("<<"),
  SHR(">>"),
  PLUS_EQ("+="),
  MINUS_EQ("-="),
  STAR_EQ("*="),
  SLASH_EQ("/="),
  AT("@"),
  DOT("."),
  DOT_DOT(".."),
  DOT_DOT_DOT("..."),
  DOT_DOT_EQ("..="),
  COMMA(","),
  SEMI(";"),
  COLON(":"),
  PATH_SEP("::"),
  R_ARROW("->"),
  L_ARROW("<-"),
  FAT_ARROW("=>"),
  POUND("#"),
  DOLLAR("$"),
  QUESTION("?"),
  SINGLE_QUOTE("'"),
  OPEN_PAREN("("),
  CLOSE_PAREN(")"),
  OPEN_BRACE("{"),
  CLOSE_BRACE("}"),
  OPEN_BRACKET("["),
  CLOSE_BRACKET("]"),
  IDENT(null),
  LIFETIME(null),
  LITERAL(null),
  DOC_COMMENT(null),
  EOF(null);

  private final @Nullable String text;

  TokenKind(@Nullable String text) {
    this.text = text;
  }

  /** Returns the text of a punctuation token, or null if this kind's tokens carry data. */
  public @Nullable String fixedText() {
    return text;
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(PrettyPrinter.tokenKindToString(this));
  }
}
