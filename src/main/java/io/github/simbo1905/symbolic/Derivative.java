// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.symbolic.Expr.*;

/// Symbolic differentiation as a [Postorder.ContextualFold] whose context is the variable name.
///
/// Each rule gets the derivatives of the operands (`d0`, `d1`) and can reach the original
/// operands through `expr.operands()`. Results are built with the [Expr] factories and are not
/// simplified, so `d/dx (x + 1)` is `1 + 0`.
///
/// The power rule assumes an exponent that is constant with respect to the variable. An exponent
/// that mentions the variable still gets `d0 * b * a ^ (b - 1)`, which is not the true derivative.
public final class Derivative implements Postorder.ContextualFold<String, Expr> {

  static final Derivative RULES = new Derivative();

  private Derivative() {
  }

  /// Differentiate `expr` with respect to `variable`
  public static Expr differentiate(@NotNull Expr expr, @NotNull String variable) {
    Objects.requireNonNull(expr, "Expression cannot be null");
    Objects.requireNonNull(variable, "Variable cannot be null");
    LOGGER.fine(() -> "Differentiating with respect to " + variable);
    return Postorder.evaluate(expr, RULES, variable);
  }

  /// Differentiate `order` times. Order zero returns `expr` itself.
  public static Expr differentiate(@NotNull Expr expr, @NotNull String variable, int order) {
    Objects.requireNonNull(expr, "Expression cannot be null");
    Objects.requireNonNull(variable, "Variable cannot be null");
    if (order < 0) {
      throw new IllegalArgumentException("Derivative order must not be negative: " + order);
    }
    Expr result = expr;
    for (int i = 0; i < order; i++) {
      result = differentiate(result, variable);
    }
    return result;
  }

  @Override
  public Expr apply(Expr expr, List<Expr> derivatives, String variable) {
    final List<Expr> operands = expr.operands();
    return switch (expr.kind()) {
      case NUMBER -> num(0);
      case SYMBOL -> ((SymbolNode) expr).name().equals(variable) ? num(1) : num(0);
      case ADD -> add(derivatives.get(0), derivatives.get(1));
      case SUB -> sub(derivatives.get(0), derivatives.get(1));
      // d0 * b + d1 * a
      case MUL -> add(
          mul(derivatives.get(0), operands.get(1)),
          mul(derivatives.get(1), operands.get(0)));
      // (d0 * b - d1 * a) / b ^ 2
      case DIV -> div(
          sub(mul(derivatives.get(0), operands.get(1)), mul(derivatives.get(1), operands.get(0))),
          pow(operands.get(1), 2));
      // d0 * b * a ^ (b - 1)
      case POW -> mul(
          mul(derivatives.get(0), operands.get(1)),
          pow(operands.get(0), sub(operands.get(1), 1)));
    };
  }
}
