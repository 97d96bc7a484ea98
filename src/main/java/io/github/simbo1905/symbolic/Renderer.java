// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import static io.github.simbo1905.symbolic.Expr.LOGGER;

/// Text forms of an expression.
///
/// Both walk the tree top-down with an explicit stack of pending nodes and literal fragments so
/// that deep trees never recurse. A shared node is written out every time it is referenced.
public final class Renderer {

  static final String RENDER_STYLE_PROPERTY = "io.github.simbo1905.symbolic.RenderStyle";
  static final RenderStyle RENDER_STYLE = RenderStyle.valueOf(System.getProperty(RENDER_STYLE_PROPERTY, "SPACED"));

  static {
    LOGGER.fine(() -> "Default render style " + RENDER_STYLE);
  }

  private Renderer() {
  }

  /// Infix form using the configured default [RenderStyle]
  public static String render(@NotNull Expr expr) {
    return render(expr, RENDER_STYLE);
  }

  /// Infix form `LEFT SYM RIGHT`. An operand is parenthesized only when its precedence is strictly
  /// lower than its parent's, so `(x + y) * z` but `x * y + z`. Associativity is not considered:
  /// `sub(x, sub(y, z))` renders as `x - y - z`.
  public static String render(@NotNull Expr expr, @NotNull RenderStyle style) {
    Objects.requireNonNull(expr, "Expression cannot be null");
    Objects.requireNonNull(style, "Render style cannot be null");

    final StringBuilder out = new StringBuilder();
    final Deque<Object> work = new ArrayDeque<>();
    work.push(expr);

    while (!work.isEmpty()) {
      final Object item = work.pop();
      if (item instanceof String fragment) {
        out.append(fragment);
        continue;
      }
      final Expr next = (Expr) item;
      final String text = switch (next.kind()) {
        case NUMBER, SYMBOL -> String.valueOf(((Expr.Terminal) next).value());
        case ADD, SUB, MUL, DIV, POW -> {
          final Expr.Operator operator = (Expr.Operator) next;
          // pushed right to left
          pushOperand(work, operator.right(), operator);
          work.push(style.infix(operator.symbol()));
          pushOperand(work, operator.left(), operator);
          yield "";
        }
      };
      out.append(text);
    }
    return out.toString();
  }

  private static void pushOperand(Deque<Object> work, Expr operand, Expr parent) {
    if (operand.precedence() < parent.precedence()) {
      work.push(")");
      work.push(operand);
      work.push("(");
    } else {
      work.push(operand);
    }
  }

  /// Structural debug form such as `Mul(Add('x', 1), 'y')`: operators by kind name, numbers as
  /// their value and symbol names quoted.
  public static String toTreeString(@NotNull Expr expr) {
    Objects.requireNonNull(expr, "Expression cannot be null");

    final StringBuilder out = new StringBuilder();
    final Deque<Object> work = new ArrayDeque<>();
    work.push(expr);

    while (!work.isEmpty()) {
      final Object item = work.pop();
      if (item instanceof String fragment) {
        out.append(fragment);
        continue;
      }
      final Expr next = (Expr) item;
      final String text = switch (next.kind()) {
        case NUMBER -> String.valueOf(((Expr.NumberNode) next).value());
        case SYMBOL -> "'" + ((Expr.SymbolNode) next).name() + "'";
        case ADD, SUB, MUL, DIV, POW -> {
          final Expr.Operator operator = (Expr.Operator) next;
          work.push(")");
          work.push(operator.right());
          work.push(", ");
          work.push(operator.left());
          yield operator.kind().displayName() + "(";
        }
      };
      out.append(text);
    }
    return out.toString();
  }
}
