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

/** The binary operators, with the precedence used when deciding where parentheses are needed. */
public enum BinOp {
  MUL("*", 13),
  DIV("/", 13),
  REM("%", 13),
  ADD("+", 12),
  SUB("-", 12),
  SHL("<<", 11),
  SHR(">>", 11),
  BIT_AND("&", 10),
  BIT_XOR("^", 9),
  BIT_OR("|", 8),
  EQ("==", 7),
  LT("<", 7),
  LE("<=", 7),
  NE("!=", 7),
  GE(">=", 7),
  GT(">", 7),
  AND("&&", 6),
  OR("||", 5);

  public final String symbol;

  /** Higher binds more tightly. */
  public final int precedence;

  BinOp(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  /**
   * Comparisons don't associate ({@code a < b < c} is an error), so an operand that is itself a
   * comparison always needs parentheses. All other operators are left-associative.
   */
  public boolean isComparison() {
    return precedence == 7;
  }
}
