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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.diagarg.Span;
import org.diagarg.arg.ArgumentValue;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PrettyPrinterTest {

  private static final Expr A = Expr.path("a");
  private static final Expr B = Expr.path("b");
  private static final Expr C = Expr.path("c");

  private static Expr binary(BinOp op, Expr left, Expr right) {
    return new Expr.Binary(op, left, right);
  }

  private static Expr cast(Expr operand, String type) {
    return new Expr.Cast(operand, Path.parse(type));
  }

  private static String print(Expr expr) {
    return PrettyPrinter.exprToString(expr);
  }

  @Test
  public void binaryPrecedence() {
    assertThat(print(binary(BinOp.MUL, binary(BinOp.ADD, A, B), C))).isEqualTo("(a + b) * c");
    assertThat(print(binary(BinOp.ADD, A, binary(BinOp.MUL, B, C)))).isEqualTo("a + b * c");
    assertThat(print(binary(BinOp.SUB, binary(BinOp.SUB, A, B), C))).isEqualTo("a - b - c");
    assertThat(print(binary(BinOp.SUB, A, binary(BinOp.SUB, B, C)))).isEqualTo("a - (b - c)");
    assertThat(print(binary(BinOp.OR, binary(BinOp.AND, A, B), C))).isEqualTo("a && b || c");
    assertThat(print(binary(BinOp.AND, A, binary(BinOp.OR, B, C)))).isEqualTo("a && (b || c)");
  }

  @Test
  public void comparisonsDoNotChain() {
    assertThat(print(binary(BinOp.LT, binary(BinOp.LT, A, B), C))).isEqualTo("(a < b) < c");
    assertThat(print(binary(BinOp.EQ, A, binary(BinOp.NE, B, C)))).isEqualTo("a == (b != c)");
    assertThat(print(binary(BinOp.LE, binary(BinOp.ADD, A, B), C))).isEqualTo("a + b <= c");
  }

  @Test
  public void castOnTheLeftOfLessThanOrShift() {
    assertThat(print(binary(BinOp.LT, cast(A, "u8"), B))).isEqualTo("(a as u8) < b");
    assertThat(print(binary(BinOp.SHL, cast(A, "u8"), B))).isEqualTo("(a as u8) << b");
    assertThat(print(binary(BinOp.ADD, cast(A, "u8"), B))).isEqualTo("a as u8 + b");
    assertThat(print(binary(BinOp.GT, cast(A, "u8"), B))).isEqualTo("a as u8 > b");
    assertThat(print(binary(BinOp.LT, B, cast(A, "u8")))).isEqualTo("b < a as u8");
  }

  @Test
  public void castsAndPrefixOperators() {
    assertThat(print(cast(binary(BinOp.ADD, A, B), "u32"))).isEqualTo("(a + b) as u32");
    assertThat(print(cast(cast(A, "u8"), "u32"))).isEqualTo("a as u8 as u32");
    assertThat(print(new Expr.Unary(UnOp.NEG, binary(BinOp.ADD, A, B)))).isEqualTo("-(a + b)");
    assertThat(print(new Expr.Unary(UnOp.NOT, new Expr.Unary(UnOp.DEREF, A)))).isEqualTo("!*a");
    assertThat(print(new Expr.AddrOf(true, A))).isEqualTo("&mut a");
    assertThat(print(new Expr.AddrOf(false, cast(A, "u8")))).isEqualTo("&(a as u8)");
  }

  @Test
  public void postfixOperators() {
    Expr deref = new Expr.Unary(UnOp.DEREF, A);
    assertThat(print(new Expr.MethodCall(deref, Ident.of("len"), ImmutableList.of())))
        .isEqualTo("(*a).len()");
    assertThat(print(new Expr.Call(Expr.path("std::mem::swap"), ImmutableList.of(A, B))))
        .isEqualTo("std::mem::swap(a, b)");
    assertThat(print(new Expr.Field(new Expr.Field(A, Ident.of("b")), Ident.of("c"))))
        .isEqualTo("a.b.c");
    assertThat(print(new Expr.Index(A, binary(BinOp.ADD, B, Expr.integer(1)))))
        .isEqualTo("a[b + 1]");
    assertThat(print(new Expr.Unary(UnOp.NEG, new Expr.Index(A, B)))).isEqualTo("-a[b]");
  }

  @Test
  public void negativeLiterals() {
    Expr minusOne = Expr.integer(-1);
    assertThat(print(new Expr.MethodCall(minusOne, Ident.of("abs"), ImmutableList.of())))
        .isEqualTo("(-1).abs()");
    assertThat(print(new Expr.Field(minusOne, Ident.of("0")))).isEqualTo("(-1).0");
    assertThat(print(binary(BinOp.MUL, minusOne, B))).isEqualTo("-1 * b");
    assertThat(print(cast(minusOne, "u8"))).isEqualTo("-1 as u8");
    assertThat(print(new Expr.MethodCall(Expr.integer(1), Ident.of("abs"), ImmutableList.of())))
        .isEqualTo("1.abs()");
  }

  @Test
  public void groupingExpressions() {
    assertThat(print(new Expr.Tuple(ImmutableList.of(A)))).isEqualTo("(a,)");
    assertThat(print(new Expr.Tuple(ImmutableList.of()))).isEqualTo("()");
    assertThat(print(new Expr.Tuple(ImmutableList.of(A, B)))).isEqualTo("(a, b)");
    assertThat(print(new Expr.Array(ImmutableList.of(Expr.integer(1), Expr.integer(-2)))))
        .isEqualTo("[1, -2]");
    // Explicit parentheses are kept even where they aren't needed.
    assertThat(print(new Expr.Paren(A))).isEqualTo("(a)");
  }

  @Test
  public void paths() {
    assertThat(Path.parse("::std::mem::swap").toString()).isEqualTo("::std::mem::swap");
    Path vec = Path.parse("Vec").withArgs(Path.parse("u8"));
    assertThat(vec.toString()).isEqualTo("Vec<u8>");
    Path map = Path.parse("std::collections::HashMap").withArgs(Path.parse("K"), vec);
    assertThat(map.toString()).isEqualTo("std::collections::HashMap<K, Vec<u8>>");
    assertThat(map.intoArgument()).isEqualTo(ArgumentValue.str(map.toString()));
    assertThat(Path.parse("foo::match").intoArgument())
        .isEqualTo(ArgumentValue.str("foo::r#match"));
    assertThat(Path.parse("self").isIdent("self")).isTrue();
    assertThat(Path.parse("::self").isIdent("self")).isFalse();
  }

  @Test
  public void literals() {
    assertThat(Lit.of(Lit.Kind.STR, "hi").toString()).isEqualTo("\"hi\"");
    assertThat(Lit.of(Lit.Kind.BYTE_STR, "hi").toString()).isEqualTo("b\"hi\"");
    assertThat(Lit.of(Lit.Kind.CHAR, "a").toString()).isEqualTo("'a'");
    assertThat(Lit.of(Lit.Kind.BYTE, "a").toString()).isEqualTo("b'a'");
    assertThat(Lit.of(Lit.Kind.BOOL, "true").toString()).isEqualTo("true");
    assertThat(Lit.withSuffix(Lit.Kind.INTEGER, "1", "u8").toString()).isEqualTo("1u8");
    assertThat(Lit.withSuffix(Lit.Kind.FLOAT, "2.5", "f32").toString()).isEqualTo("2.5f32");
    assertThat(Lit.raw(false, "a\"b", 1).toString()).isEqualTo("r#\"a\"b\"#");
    assertThat(Lit.raw(true, "x", 0).toString()).isEqualTo("br\"x\"");
  }

  @Test
  public void tokens() {
    Span span = Span.DUMMY;
    assertThat(Token.punct(TokenKind.SHL, span).toString()).isEqualTo("<<");
    assertThat(Token.punct(TokenKind.PATH_SEP, span).toString()).isEqualTo("::");
    assertThat(Token.ident(Symbol.intern("match"), true, span).toString()).isEqualTo("r#match");
    assertThat(Token.ident(Symbol.intern("x"), false, span).toString()).isEqualTo("x");
    assertThat(Token.lifetime(Symbol.intern("'a"), span).toString()).isEqualTo("'a");
    assertThat(Token.literal(Lit.of(Lit.Kind.STR, "s"), span).intoArgument())
        .isEqualTo(ArgumentValue.str("\"s\""));
    assertThat(Token.docComment("/// doc", span).toString()).isEqualTo("/// doc");
    assertThat(Token.eof(span).toString()).isEqualTo("<eof>");
  }

  @Test
  public void tokenKinds() {
    assertThat(PrettyPrinter.tokenKindToString(TokenKind.FAT_ARROW)).isEqualTo("=>");
    assertThat(PrettyPrinter.tokenKindToString(TokenKind.IDENT)).isEqualTo("identifier");
    assertThat(PrettyPrinter.tokenKindToString(TokenKind.DOC_COMMENT)).isEqualTo("doc comment");
    for (TokenKind kind : TokenKind.values()) {
      assertThat(PrettyPrinter.tokenKindToString(kind)).isNotEmpty();
    }
  }

  @Test
  public void visibilities() {
    assertThat(Visibility.PUBLIC.toString()).isEqualTo("pub ");
    assertThat(Visibility.PUBLIC.intoArgument()).isEqualTo(ArgumentValue.str("pub"));
    assertThat(Visibility.INHERITED.toString()).isEmpty();
    assertThat(Visibility.INHERITED.intoArgument()).isEqualTo(ArgumentValue.str(""));
    assertThat(Visibility.crate().toString()).isEqualTo("pub(crate) ");
    assertThat(Visibility.crate().intoArgument()).isEqualTo(ArgumentValue.str("pub(crate)"));
    assertThat(Visibility.restricted(Path.parse("super"), true).intoArgument())
        .isEqualTo(ArgumentValue.str("pub(super)"));
    assertThat(Visibility.restricted(Path.parse("self"), false).intoArgument())
        .isEqualTo(ArgumentValue.str("pub(in self)"));
    assertThat(Visibility.restricted(Path.parse("crate::a::b"), true).intoArgument())
        .isEqualTo(ArgumentValue.str("pub(in crate::a::b)"));
  }

  @Test
  public void expressionArguments() {
    Expr expr = binary(BinOp.MUL, binary(BinOp.ADD, A, Expr.integer(1)), B);
    assertThat(expr.intoArgument()).isEqualTo(ArgumentValue.str("(a + 1) * b"));
  }
}
