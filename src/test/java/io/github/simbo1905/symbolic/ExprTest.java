// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static io.github.simbo1905.symbolic.Expr.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/// Node model and construction
class ExprTest {

  final SymbolNode x = sym("x");
  final SymbolNode y = sym("y");

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @BeforeEach
  void setUp() {
    LOGGER.fine(() -> "Starting ExprTest test");
  }

  @AfterEach
  void tearDown() {
    LOGGER.fine(() -> "Finished ExprTest test");
  }

  @Nested
  @DisplayName("Node kinds")
  class NodeKinds {

    @Test
    @DisplayName("Terminals have no operands and the highest precedence")
    void terminals() {
      NumberNode three = num(3);
      assertThat(three.kind()).isEqualTo(Kind.NUMBER);
      assertThat(three.value()).isEqualTo(3);
      assertThat(three.operands()).isEmpty();
      assertThat(three.precedence()).isEqualTo(3);

      assertThat(x.kind()).isEqualTo(Kind.SYMBOL);
      assertThat(x.value()).isEqualTo("x");
      assertThat(x.operands()).isEmpty();
      assertThat(x.precedence()).isEqualTo(3);
    }

    @Test
    @DisplayName("Operators expose kind, precedence and symbol")
    void operators() {
      assertOperator(add(x, y), Kind.ADD, 0, "+");
      assertOperator(sub(x, y), Kind.SUB, 0, "-");
      assertOperator(mul(x, y), Kind.MUL, 1, "*");
      assertOperator(div(x, y), Kind.DIV, 1, "/");
      assertOperator(pow(x, y), Kind.POW, 2, "^");
    }

    private void assertOperator(Expr expr, Kind kind, int precedence, String symbol) {
      assertThat(expr).isInstanceOf(Operator.class);
      Operator operator = (Operator) expr;
      assertThat(operator.kind()).isEqualTo(kind);
      assertThat(operator.precedence()).isEqualTo(precedence);
      assertThat(operator.symbol()).isEqualTo(symbol);
      assertThat(operator.operands()).containsExactly(x, y);
      assertThat(operator.left()).isSameAs(x);
      assertThat(operator.right()).isSameAs(y);
    }

    @Test
    @DisplayName("Pow names its operands base and exponent")
    void powOperands() {
      PowNode power = (PowNode) pow(x, 2);
      assertThat(power.base()).isSameAs(x);
      assertThat(power.exponent()).isEqualTo(num(2));
      assertThat(power.operands()).containsExactly(power.left(), power.right());
    }

    @Test
    @DisplayName("Every kind is either a terminal or an operator")
    void kindTable() {
      assertThat(List.of(Kind.values()))
          .filteredOn(Kind::isTerminal)
          .containsExactly(Kind.NUMBER, Kind.SYMBOL);
      for (Kind kind : Kind.values()) {
        assertThat(kind.symbol() == null).isEqualTo(kind.isTerminal());
      }
    }

    @Test
    @DisplayName("Value equal nodes are equal records but distinct instances")
    void structuralEquality() {
      Expr a = add(sym("x"), 1);
      Expr b = add(sym("x"), 1);
      assertThat(a).isEqualTo(b).isNotSameAs(b);
      assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    @DisplayName("toString is the rendered form")
    void toStringRenders() {
      assertThat(mul(add(x, 1), y)).hasToString("(x + 1) * y");
      assertThat(num(2.5)).hasToString("2.5");
    }
  }

  @Nested
  @DisplayName("Construction")
  class Construction {

    @Test
    @DisplayName("Right literal is wrapped as a number")
    void rightLiteral() {
      Operator expr = (Operator) sub(x, 1);
      assertThat(expr.left()).isSameAs(x);
      assertThat(expr.right()).isEqualTo(num(1));
    }

    @Test
    @DisplayName("Left literal keeps operand order for subtraction and division")
    void leftLiteralKeepsOrder() {
      Operator difference = (Operator) sub(5, x);
      assertThat(difference.left()).isEqualTo(num(5));
      assertThat(difference.right()).isSameAs(x);
      assertThat(difference).hasToString("5 - x");

      Operator quotient = (Operator) div(1, x);
      assertThat(quotient.left()).isEqualTo(num(1));
      assertThat(quotient.right()).isSameAs(x);
      assertThat(quotient).hasToString("1 / x");

      assertThat(pow(2, x)).hasToString("2 ^ x");
    }

    @Test
    @DisplayName("Two literals build an operator over two numbers")
    void twoLiterals() {
      assertThat(add(1, 2)).isEqualTo(new AddNode(num(1), num(2)));
      assertThat(div(1.5, 3L)).isEqualTo(new DivNode(num(1.5), num(3L)));
    }

    @Test
    @DisplayName("Fluent methods build the same trees as the factories")
    void fluent() {
      assertThat(x.plus(y)).isEqualTo(add(x, y));
      assertThat(x.plus(1)).isEqualTo(add(x, 1));
      assertThat(x.minus(1)).isEqualTo(sub(x, 1));
      assertThat(x.times(y)).isEqualTo(mul(x, y));
      assertThat(x.dividedBy(2)).isEqualTo(div(x, 2));
      assertThat(x.raisedTo(3)).isEqualTo(pow(x, 3));
      assertThat(x.times(x).plus(1)).hasToString("x * x + 1");
    }

    @Test
    @DisplayName("Operands are shared, not copied")
    void sharedOperands() {
      Expr square = mul(x, x);
      Operator sum = (Operator) add(square, square);
      assertThat(sum.left()).isSameAs(square);
      assertThat(sum.right()).isSameAs(square);
      assertThat(((Operator) square).left()).isSameAs(((Operator) square).right());
    }

    @Test
    @DisplayName("Division by zero is a valid symbolic expression")
    void divisionByZero() {
      assertThat(div(x, 0)).hasToString("x / 0");
    }

    @Test
    @DisplayName("Null operands are rejected")
    void nulls() {
      assertThrows(NullPointerException.class, () -> sym(null));
      assertThrows(NullPointerException.class, () -> num(null));
      assertThrows(NullPointerException.class, () -> add(x, (Expr) null));
      assertThrows(NullPointerException.class, () -> pow((Expr) null, 2));
    }
  }

  @Nested
  @DisplayName("Kinds and records")
  class KindsAndRecords {

    @Test
    @DisplayName("Every record owns exactly one kind")
    void eachRecordOwnsOneKind() {
      Set<Class<?>> records = new HashSet<>();
      Deque<Class<?>> pending = new ArrayDeque<>(List.of(Expr.class));
      while (!pending.isEmpty()) {
        Class<?> type = pending.pop();
        if (type.isSealed()) {
          pending.addAll(List.of(type.getPermittedSubclasses()));
        } else {
          records.add(type);
        }
      }

      Set<Class<?>> owners = new HashSet<>();
      for (Kind kind : Kind.values()) {
        assertThat(owners.add(kind.nodeType())).isTrue();
      }
      assertThat(owners).isEqualTo(records);
    }

    @Test
    @DisplayName("Each record reports the kind that names it")
    void recordsReportTheirKind() {
      List<Expr> samples = List.of(num(1), x, add(x, y), sub(x, y), mul(x, y), div(x, y), pow(x, y));
      assertThat(samples).hasSize(Kind.values().length);
      for (Expr sample : samples) {
        assertThat(sample.kind().nodeType()).isEqualTo(sample.getClass());
      }
    }
  }

  @Nested
  @DisplayName("Number values")
  class NumberValues {

    @Test
    @DisplayName("Mutable numbers are copied at construction")
    void mutableNumbersCopied() {
      AtomicInteger counter = new AtomicInteger(5);
      NumberNode fromCounter = num(counter);
      counter.set(9);
      assertThat(fromCounter.value()).isEqualTo(5);
      assertThat(fromCounter).hasToString("5");

      LongAdder adder = new LongAdder();
      adder.add(7);
      NumberNode fromAdder = num(adder);
      adder.add(1);
      assertThat(fromAdder.value()).isEqualTo(7L);
    }

    @Test
    @DisplayName("Immutable numbers are kept as given")
    void immutableNumbersKept() {
      BigDecimal tenth = new BigDecimal("0.1");
      assertThat(num(tenth).value()).isSameAs(tenth);
      assertThat(num(2.5).value()).isEqualTo(2.5);
      assertThat(num(3L).value()).isEqualTo(3L);
    }
  }

  @Nested
  @DisplayName("Equality on large trees")
  class LargeTreeEquality {

    static final int DEPTH = 10_000;

    Expr chain(Number innermost) {
      Expr expr = add(sym("x"), innermost);
      for (int i = 1; i < DEPTH; i++) {
        expr = add(expr, 1);
      }
      return expr;
    }

    Expr doubling(int levels) {
      Expr expr = sym("x");
      for (int i = 0; i < levels; i++) {
        expr = add(expr, expr);
      }
      return expr;
    }

    @Test
    @DisplayName("Deep chains compare and hash without recursion")
    void deepChain() {
      Expr first = chain(1);
      Expr second = chain(1);
      Expr different = chain(2);

      assertThat(first.equals(second)).isTrue();
      assertThat(first.hashCode()).isEqualTo(second.hashCode());
      assertThat(first.equals(different)).isFalse();

      Set<Expr> set = new HashSet<>();
      set.add(first);
      assertThat(set.contains(second)).isTrue();
      assertThat(set.contains(different)).isFalse();
    }

    @Test
    @DisplayName("Shared DAGs compare and hash once per distinct node")
    void doublingDag() {
      Expr first = doubling(64);
      Expr second = doubling(64);

      assertThat(first.equals(second)).isTrue();
      assertThat(first.hashCode()).isEqualTo(second.hashCode());
      assertThat(first.equals(doubling(63))).isFalse();

      Map<Expr, String> map = new HashMap<>();
      map.put(first, "dag");
      assertThat(map.get(second)).isEqualTo("dag");
    }

    @Test
    @DisplayName("Operators of different kinds are not equal")
    void kindsDiffer() {
      assertThat(add(x, y)).isNotEqualTo(sub(x, y));
      assertThat(pow(x, 2)).isNotEqualTo(pow(2, x));
      assertThat(mul(x, 1)).isNotEqualTo(mul(x, 1L));
      assertThat(add(x, y)).isNotEqualTo("x + y");
    }
  }
}
