// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

import org.jetbrains.annotations.NotNull;

import java.util.*;

import static io.github.simbo1905.symbolic.Expr.LOGGER;

/// Bottom-up fold over an expression DAG using an explicit work stack rather than the call stack,
/// so chains tens of thousands of nodes deep are fine.
///
/// Results are memoized by node identity ([IdentityHashMap]), never by record equality: a node
/// instance referenced by many parents is folded once, while two separately built value-equal
/// nodes are folded once each. Cyclic graphs never terminate and are not detected.
public final class Postorder {

  private Postorder() {
  }

  /// A fold step. `operandResults` holds the already computed results of `expr.operands()` in the
  /// same positions (empty for terminals).
  @FunctionalInterface
  public interface Fold<R> {
    R apply(Expr expr, List<R> operandResults);
  }

  /// A fold step that also receives a caller supplied context such as the variable being differentiated.
  @FunctionalInterface
  public interface ContextualFold<C, R> {
    R apply(Expr expr, List<R> operandResults, C context);
  }

  public static <C, R> R evaluate(@NotNull Expr root, @NotNull ContextualFold<C, R> fold, C context) {
    Objects.requireNonNull(fold, "Fold cannot be null");
    return evaluate(root, (expr, operandResults) -> fold.apply(expr, operandResults, context));
  }

  public static <R> R evaluate(@NotNull Expr root, @NotNull Fold<R> fold) {
    Objects.requireNonNull(root, "Root expression cannot be null");
    Objects.requireNonNull(fold, "Fold cannot be null");

    final Map<Expr, R> results = new IdentityHashMap<>();
    final Deque<Expr> work = new ArrayDeque<>();
    work.push(root);
    int peak = 1;

    while (!work.isEmpty()) {
      final Expr expr = work.pop();
      if (results.containsKey(expr)) {
        // shared operand pushed by more than one parent before it was folded
        continue;
      }

      final List<Expr> operands = expr.operands();
      final List<Expr> pending = new ArrayList<>(operands.size());
      for (Expr operand : operands) {
        if (!results.containsKey(operand)) {
          pending.add(operand);
        }
      }

      if (pending.isEmpty()) {
        final List<R> operandResults = new ArrayList<>(operands.size());
        for (Expr operand : operands) {
          operandResults.add(results.get(operand));
        }
        results.put(expr, fold.apply(expr, Collections.unmodifiableList(operandResults)));
      } else {
        work.push(expr);
        // reversed so the left operand is popped first
        for (int i = pending.size() - 1; i >= 0; i--) {
          work.push(pending.get(i));
        }
        peak = Math.max(peak, work.size());
      }
    }

    final int maxDepth = peak;
    LOGGER.finer(() -> "Postorder folded " + results.size() + " distinct nodes with peak work stack " + maxDepth);
    return results.get(root);
  }
}
