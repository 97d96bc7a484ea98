// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

import java.util.*;

/// Structural `equals` and `hashCode` for operator records. Both walk with explicit stacks and
/// visit each distinct node (or pair of nodes) once, so deep chains and heavily shared DAGs cost
/// time linear in the number of distinct nodes.
final class Structure {

  private Structure() {
  }

  static final Postorder.Fold<Integer> HASH = (node, hashes) -> switch (node.kind()) {
    case NUMBER, SYMBOL -> 31 * node.kind().ordinal() + ((Expr.Terminal) node).value().hashCode();
    case ADD, SUB, MUL, DIV, POW -> (31 * node.kind().ordinal() + hashes.get(0)) * 31 + hashes.get(1);
  };

  static int hash(Expr expr) {
    return Postorder.evaluate(expr, HASH);
  }

  static boolean equal(Expr first, Expr second) {
    final Map<Expr, Set<Expr>> compared = new IdentityHashMap<>();
    final Deque<Expr[]> work = new ArrayDeque<>();
    work.push(new Expr[]{first, second});

    while (!work.isEmpty()) {
      final Expr[] pair = work.pop();
      final Expr left = pair[0];
      final Expr right = pair[1];
      if (left == right) {
        continue;
      }
      // a pair already scheduled is checked by whoever scheduled it first
      if (!compared.computeIfAbsent(left, ignored -> Collections.newSetFromMap(new IdentityHashMap<>())).add(right)) {
        continue;
      }
      if (left.kind() != right.kind()) {
        return false;
      }
      final boolean same = switch (left.kind()) {
        case NUMBER, SYMBOL -> ((Expr.Terminal) left).value().equals(((Expr.Terminal) right).value());
        case ADD, SUB, MUL, DIV, POW -> {
          final Expr.Operator l = (Expr.Operator) left;
          final Expr.Operator r = (Expr.Operator) right;
          work.push(new Expr[]{l.right(), r.right()});
          work.push(new Expr[]{l.left(), r.left()});
          yield true;
        }
      };
      if (!same) {
        return false;
      }
    }
    return true;
  }
}
