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

import java.util.List;

/**
 * Converts syntax fragments back to source text, adding parentheses only where they're needed to
 * preserve the structure of an expression.
 *
 * <p>The output is meant for diagnostics, not for re-parsing; e.g. no attempt is made to preserve
 * the original spacing or comments.
 */
public final class PrettyPrinter implements Expr.Visitor {

  /** A precedence higher than any expression's, used when parentheses are always required. */
  private static final int PREC_FORCE_PAREN = 100;

  private final StringBuilder sb = new StringBuilder();

  private PrettyPrinter() {}

  public static String exprToString(Expr expr) {
    PrettyPrinter printer = new PrettyPrinter();
    expr.accept(printer);
    return printer.sb.toString();
  }

  public static String pathToString(Path path) {
    PrettyPrinter printer = new PrettyPrinter();
    printer.printPath(path);
    return printer.sb.toString();
  }

  static String pathSegmentToString(Path.Segment segment) {
    PrettyPrinter printer = new PrettyPrinter();
    printer.printSegment(segment);
    return printer.sb.toString();
  }

  public static String literalToString(Lit lit) {
    String text = lit.symbol.name;
    String result =
        switch (lit.kind) {
          case BOOL, INTEGER, FLOAT, ERR -> text;
          case BYTE -> "b'" + text + "'";
          case CHAR -> "'" + text + "'";
          case STR -> "\"" + text + "\"";
          case BYTE_STR -> "b\"" + text + "\"";
          case STR_RAW -> rawString("r", text, lit.rawHashes);
          case BYTE_STR_RAW -> rawString("br", text, lit.rawHashes);
        };
    return (lit.suffix == null) ? result : result + lit.suffix;
  }

  private static String rawString(String prefix, String text, int hashes) {
    String delim = "#".repeat(hashes);
    return prefix + delim + "\"" + text + "\"" + delim;
  }

  /**
   * Returns the text of a token kind. Kinds whose tokens carry data (identifiers, literals, ...)
   * are described rather than shown.
   */
  public static String tokenKindToString(TokenKind kind) {
    String text = kind.fixedText();
    if (text != null) {
      return text;
    }
    return switch (kind) {
      case IDENT -> "identifier";
      case LIFETIME -> "lifetime";
      case LITERAL -> "literal";
      case DOC_COMMENT -> "doc comment";
      case EOF -> "<eof>";
      // Everything else has fixed text.
      default -> kind.name();
    };
  }

  public static String tokenToString(Token token) {
    return switch (token.kind) {
      case IDENT -> token.isRaw ? "r#" + token.symbol : String.valueOf(token.symbol);
      case LIFETIME, DOC_COMMENT -> String.valueOf(token.symbol);
      case LITERAL -> literalToString(checkNotNull(token.lit));
      default -> tokenKindToString(token.kind);
    };
  }

  /**
   * Returns the visibility as it would appear before an item, i.e. with a trailing space unless it
   * is empty.
   */
  public static String visToString(Visibility vis) {
    return switch (vis.kind) {
      case PUBLIC -> "pub ";
      case INHERITED -> "";
      case RESTRICTED -> restrictedToString(checkNotNull(vis.path), vis.shorthand);
    };
  }

  private static String restrictedToString(Path path, boolean shorthand) {
    String pathString = pathToString(path);
    if (shorthand && (path.isIdent("crate") || path.isIdent("self") || path.isIdent("super"))) {
      return "pub(" + pathString + ") ";
    }
    return "pub(in " + pathString + ") ";
  }

  private void printPath(Path path) {
    if (path.global) {
      sb.append("::");
    }
    for (int i = 0; i < path.segments.size(); i++) {
      if (i != 0) {
        sb.append("::");
      }
      printSegment(path.segments.get(i));
    }
  }

  private void printSegment(Path.Segment segment) {
    sb.append(segment.ident);
    if (!segment.args.isEmpty()) {
      sb.append('<');
      for (int i = 0; i < segment.args.size(); i++) {
        if (i != 0) {
          sb.append(", ");
        }
        printPath(segment.args.get(i));
      }
      sb.append('>');
    }
  }

  /** Prints {@code expr}, in parentheses if its precedence is lower than {@code minPrecedence}. */
  private void printMaybeParen(Expr expr, int minPrecedence) {
    if (expr.precedence() < minPrecedence) {
      sb.append('(');
      expr.accept(this);
      sb.append(')');
    } else {
      expr.accept(this);
    }
  }

  private void printCommaSeparated(List<Expr> exprs) {
    for (int i = 0; i < exprs.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      exprs.get(i).accept(this);
    }
  }

  @Override
  public void visitLiteral(Expr.Literal expr) {
    sb.append(literalToString(expr.lit));
  }

  @Override
  public void visitPathExpr(Expr.PathExpr expr) {
    printPath(expr.path);
  }

  @Override
  public void visitUnary(Expr.Unary expr) {
    sb.append(expr.op.symbol);
    printMaybeParen(expr.operand, Expr.PREC_PREFIX);
  }

  @Override
  public void visitBinary(Expr.Binary expr) {
    int prec = expr.op.precedence;
    // Left-associative operators can take an operand of the same precedence on the left;
    // comparisons can't.
    int leftPrec = expr.op.isComparison() ? prec + 1 : prec;
    int rightPrec = prec + 1;
    // "x as T < y" and "x as T << y" would parse the "<" as the start of generic arguments.
    if (expr.left instanceof Expr.Cast && (expr.op == BinOp.LT || expr.op == BinOp.SHL)) {
      leftPrec = PREC_FORCE_PAREN;
    }
    printMaybeParen(expr.left, leftPrec);
    sb.append(' ').append(expr.op.symbol).append(' ');
    printMaybeParen(expr.right, rightPrec);
  }

  @Override
  public void visitCast(Expr.Cast expr) {
    printMaybeParen(expr.operand, Expr.PREC_CAST);
    sb.append(" as ");
    printPath(expr.type);
  }

  @Override
  public void visitAddrOf(Expr.AddrOf expr) {
    sb.append(expr.mutable ? "&mut " : "&");
    printMaybeParen(expr.operand, Expr.PREC_PREFIX);
  }

  @Override
  public void visitCall(Expr.Call expr) {
    printMaybeParen(expr.function, Expr.PREC_POSTFIX);
    sb.append('(');
    printCommaSeparated(expr.args);
    sb.append(')');
  }

  @Override
  public void visitMethodCall(Expr.MethodCall expr) {
    printMaybeParen(expr.receiver, Expr.PREC_POSTFIX);
    sb.append('.').append(expr.method).append('(');
    printCommaSeparated(expr.args);
    sb.append(')');
  }

  @Override
  public void visitField(Expr.Field expr) {
    printMaybeParen(expr.receiver, Expr.PREC_POSTFIX);
    sb.append('.').append(expr.field);
  }

  @Override
  public void visitIndex(Expr.Index expr) {
    printMaybeParen(expr.receiver, Expr.PREC_POSTFIX);
    sb.append('[');
    expr.index.accept(this);
    sb.append(']');
  }

  @Override
  public void visitParen(Expr.Paren expr) {
    sb.append('(');
    expr.inner.accept(this);
    sb.append(')');
  }

  @Override
  public void visitTuple(Expr.Tuple expr) {
    sb.append('(');
    printCommaSeparated(expr.elements);
    if (expr.elements.size() == 1) {
      sb.append(',');
    }
    sb.append(')');
  }

  @Override
  public void visitArray(Expr.Array expr) {
    sb.append('[');
    printCommaSeparated(expr.elements);
    sb.append(']');
  }
}
