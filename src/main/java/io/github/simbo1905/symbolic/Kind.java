// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

/// Kind tag for every expression node. Consumers `switch` over this enum without a `default`
/// branch so that adding a constant here fails to compile until each of them handles it.
///
/// Each record permitted by [Expr] owns exactly one constant, named by [#nodeType()], and returns
/// it from `kind()`. Consumers cast to that record after switching, so a new record must add its
/// own constant rather than reuse an existing one.
public enum Kind {
  NUMBER(3, null, "Number", Expr.NumberNode.class),
  SYMBOL(3, null, "Symbol", Expr.SymbolNode.class),
  ADD(0, "+", "Add", Expr.AddNode.class),
  SUB(0, "-", "Sub", Expr.SubNode.class),
  MUL(1, "*", "Mul", Expr.MulNode.class),
  DIV(1, "/", "Div", Expr.DivNode.class),
  POW(2, "^", "Pow", Expr.PowNode.class);

  final int precedence;
  final String symbol;     // null for terminals
  final String displayName;
  final Class<? extends Expr> nodeType;

  Kind(int precedence, String symbol, String displayName, Class<? extends Expr> nodeType) {
    this.precedence = precedence;
    this.symbol = symbol;
    this.displayName = displayName;
    this.nodeType = nodeType;
  }

  /// Binding strength: higher binds tighter. Terminals are 3 and are never parenthesized.
  public int precedence() {
    return precedence;
  }

  /// Operator display symbol, `null` for terminals
  public String symbol() {
    return symbol;
  }

  public String displayName() {
    return displayName;
  }

  /// The record class that reports this kind
  public Class<? extends Expr> nodeType() {
    return nodeType;
  }

  public boolean isTerminal() {
    return symbol == null;
  }
}
