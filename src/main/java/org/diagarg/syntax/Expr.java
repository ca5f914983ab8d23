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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * An expression. Each form of expression is a nested subclass; the private constructor ensures
 * that there are no others, and {@link Visitor} has a method for each of them.
 *
 * <p>Exprs are immutable. Parentheses are only those that were written explicitly (as a {@link
 * Paren}); the pretty-printer adds whatever others are needed.
 */
public abstract class Expr implements IntoArgument {

  /** The precedence of a cast ({@code x as T}). */
  static final int PREC_CAST = 14;

  /** The precedence of prefix operators. */
  static final int PREC_PREFIX = 50;

  /** The precedence of calls, field accesses, and indexing. */
  static final int PREC_POSTFIX = 60;

  /** The precedence of expressions that never need parentheses. */
  static final int PREC_ATOM = 99;

  private Expr() {}

  /** Higher binds more tightly. */
  public abstract int precedence();

  public abstract void accept(Visitor visitor);

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(PrettyPrinter.exprToString(this));
  }

  @Override
  public String toString() {
    return PrettyPrinter.exprToString(this);
  }

  /** Has one method for each subclass of Expr. */
  public interface Visitor {
    void visitLiteral(Literal expr);

    void visitPathExpr(PathExpr expr);

    void visitUnary(Unary expr);

    void visitBinary(Binary expr);

    void visitCast(Cast expr);

    void visitAddrOf(AddrOf expr);

    void visitCall(Call expr);

    void visitMethodCall(MethodCall expr);

    void visitField(Field expr);

    void visitIndex(Index expr);

    void visitParen(Paren expr);

    void visitTuple(Tuple expr);

    void visitArray(Array expr);
  }

  /** Returns a Literal. */
  public static Expr lit(Lit lit) {
    return new Literal(lit);
  }

  /** Returns a PathExpr for the given path, parsed by {@link Path#parse}. */
  public static Expr path(String path) {
    return new PathExpr(Path.parse(path));
  }

  /** An integer literal with no suffix. */
  public static Expr integer(long value) {
    return new Literal(Lit.of(Lit.Kind.INTEGER, Long.toString(value)));
  }

  /** A literal such as {@code 1}, {@code "s"}, or {@code true}. */
  public static final class Literal extends Expr {
    public final Lit lit;

    public Literal(Lit lit) {
      this.lit = checkNotNull(lit);
    }

    /** A negative number is printed with a leading minus, so it binds like a prefix operator. */
    @Override
    public int precedence() {
      return lit.symbol.name.startsWith("-") ? PREC_PREFIX : PREC_ATOM;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitLiteral(this);
    }
  }

  /** A reference to a variable, constant, function, ... by path. */
  public static final class PathExpr extends Expr {
    public final Path path;

    public PathExpr(Path path) {
      this.path = checkNotNull(path);
    }

    @Override
    public int precedence() {
      return PREC_ATOM;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitPathExpr(this);
    }
  }

  /** {@code -x}, {@code !x}, or {@code *x}. */
  public static final class Unary extends Expr {
    public final UnOp op;
    public final Expr operand;

    public Unary(UnOp op, Expr operand) {
      this.op = checkNotNull(op);
      this.operand = checkNotNull(operand);
    }

    @Override
    public int precedence() {
      return PREC_PREFIX;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitUnary(this);
    }
  }

  /** {@code x + y}, {@code x && y}, ... */
  public static final class Binary extends Expr {
    public final BinOp op;
    public final Expr left;
    public final Expr right;

    public Binary(BinOp op, Expr left, Expr right) {
      this.op = checkNotNull(op);
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    @Override
    public int precedence() {
      return op.precedence;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitBinary(this);
    }
  }

  /** {@code x as T} */
  public static final class Cast extends Expr {
    public final Expr operand;
    public final Path type;

    public Cast(Expr operand, Path type) {
      this.operand = checkNotNull(operand);
      this.type = checkNotNull(type);
    }

    @Override
    public int precedence() {
      return PREC_CAST;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitCast(this);
    }
  }

  /** {@code &x} or {@code &mut x} */
  public static final class AddrOf extends Expr {
    public final boolean mutable;
    public final Expr operand;

    public AddrOf(boolean mutable, Expr operand) {
      this.mutable = mutable;
      this.operand = checkNotNull(operand);
    }

    @Override
    public int precedence() {
      return PREC_PREFIX;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitAddrOf(this);
    }
  }

  /** {@code f(x, y)} */
  public static final class Call extends Expr {
    public final Expr function;
    public final ImmutableList<Expr> args;

    public Call(Expr function, List<Expr> args) {
      this.function = checkNotNull(function);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public int precedence() {
      return PREC_POSTFIX;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitCall(this);
    }
  }

  /** {@code x.f(y, z)} */
  public static final class MethodCall extends Expr {
    public final Expr receiver;
    public final Ident method;
    public final ImmutableList<Expr> args;

    public MethodCall(Expr receiver, Ident method, List<Expr> args) {
      this.receiver = checkNotNull(receiver);
      this.method = checkNotNull(method);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public int precedence() {
      return PREC_POSTFIX;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitMethodCall(this);
    }
  }

  /** {@code x.f} or {@code x.0} */
  public static final class Field extends Expr {
    public final Expr receiver;
    public final Ident field;

    public Field(Expr receiver, Ident field) {
      this.receiver = checkNotNull(receiver);
      this.field = checkNotNull(field);
    }

    @Override
    public int precedence() {
      return PREC_POSTFIX;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitField(this);
    }
  }

  /** {@code x[i]} */
  public static final class Index extends Expr {
    public final Expr receiver;
    public final Expr index;

    public Index(Expr receiver, Expr index) {
      this.receiver = checkNotNull(receiver);
      this.index = checkNotNull(index);
    }

    @Override
    public int precedence() {
      return PREC_POSTFIX;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitIndex(this);
    }
  }

  /** An explicitly parenthesized expression. */
  public static final class Paren extends Expr {
    public final Expr inner;

    public Paren(Expr inner) {
      this.inner = checkNotNull(inner);
    }

    @Override
    public int precedence() {
      return PREC_ATOM;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitParen(this);
    }
  }

  /** {@code ()}, {@code (x,)}, {@code (x, y)}, ... */
  public static final class Tuple extends Expr {
    public final ImmutableList<Expr> elements;

    public Tuple(List<Expr> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public int precedence() {
      return PREC_ATOM;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitTuple(this);
    }
  }

  /** {@code [x, y, z]} */
  public static final class Array extends Expr {
    public final ImmutableList<Expr> elements;

    public Array(List<Expr> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public int precedence() {
      return PREC_ATOM;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visitArray(this);
    }
  }
}
