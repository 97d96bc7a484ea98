// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.symbolic;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/// Symbolic arithmetic expression. A tree (more exactly a DAG, since a node may be shared by
/// several parents) of immutable records: terminals carry a number or a symbol name, operators
/// carry exactly two ordered operands.
///
/// Records compare structurally with `equals` and `hashCode`, which walk the tree without recursion
/// (see [Structure]). Evaluation caches results by node identity instead, see [Postorder]. Reuse an
/// instance to share work; a value-equal copy is evaluated again.
public sealed interface Expr permits Expr.Terminal, Expr.Operator {

  Logger LOGGER = Logger.getLogger(Expr.class.getName());

  Kind kind();

  /// The operands in order: empty for terminals, `[left, right]` for operators
  List<Expr> operands();

  default int precedence() {
    return kind().precedence();
  }

  /// Leaf with a literal value
  sealed interface Terminal extends Expr permits NumberNode, SymbolNode {
    Object value();

    @Override
    default List<Expr> operands() {
      return List.of();
    }
  }

  /// Binary operator with a left and right operand fixed at construction
  sealed interface Operator extends Expr permits AddNode, SubNode, MulNode, DivNode, PowNode {
    Expr left();

    Expr right();

    default String symbol() {
      return kind().symbol();
    }

    @Override
    default List<Expr> operands() {
      return List.of(left(), right());
    }
  }

  record NumberNode(Number value) implements Terminal {
    // kept as given, anything else is copied
    private static final Set<Class<?>> IMMUTABLE_NUMBERS = Set.of(
        Byte.class, Short.class, Integer.class, Long.class,
        Float.class, Double.class, BigInteger.class, BigDecimal.class);

    public NumberNode {
      Objects.requireNonNull(value, "Number value cannot be null");
      value = snapshot(value);
    }

    /// Mutable or unknown `Number` types such as `AtomicInteger` or `LongAdder` are copied into an
    /// immutable box holding their current value.
    private static Number snapshot(Number value) {
      if (IMMUTABLE_NUMBERS.contains(value.getClass())) {
        return value;
      }
      if (value instanceof AtomicInteger) {
        return value.intValue();
      }
      if (value instanceof AtomicLong || value instanceof LongAdder || value instanceof LongAccumulator) {
        return value.longValue();
      }
      return value.doubleValue();
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    @Override
    public String toString() {
      return Renderer.render(this);
    }
  }

  record SymbolNode(String name) implements Terminal {
    public SymbolNode {
      Objects.requireNonNull(name, "Symbol name cannot be null");
    }

    @Override
    public String value() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.SYMBOL;
    }

    @Override
    public String toString() {
      return Renderer.render(this);
    }
  }

  record AddNode(Expr left, Expr right) implements Operator {
    public AddNode {
      Objects.requireNonNull(left, "Left operand cannot be null");
      Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.ADD;
    }

    @Override
    public String toString() {
      return Renderer.render(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Expr other && Structure.equal(this, other);
    }

    @Override
    public int hashCode() {
      return Structure.hash(this);
    }
  }

  record SubNode(Expr left, Expr right) implements Operator {
    public SubNode {
      Objects.requireNonNull(left, "Left operand cannot be null");
      Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.SUB;
    }

    @Override
    public String toString() {
      return Renderer.render(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Expr other && Structure.equal(this, other);
    }

    @Override
    public int hashCode() {
      return Structure.hash(this);
    }
  }

  record MulNode(Expr left, Expr right) implements Operator {
    public MulNode {
      Objects.requireNonNull(left, "Left operand cannot be null");
      Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.MUL;
    }

    @Override
    public String toString() {
      return Renderer.render(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Expr other && Structure.equal(this, other);
    }

    @Override
    public int hashCode() {
      return Structure.hash(this);
    }
  }

  record DivNode(Expr left, Expr right) implements Operator {
    public DivNode {
      Objects.requireNonNull(left, "Left operand cannot be null");
      Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.DIV;
    }

    @Override
    public String toString() {
      return Renderer.render(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Expr other && Structure.equal(this, other);
    }

    @Override
    public int hashCode() {
      return Structure.hash(this);
    }
  }

  record PowNode(Expr base, Expr exponent) implements Operator {
    public PowNode {
      Objects.requireNonNull(base, "Base cannot be null");
      Objects.requireNonNull(exponent, "Exponent cannot be null");
    }

    @Override
    public Expr left() {
      return base;
    }

    @Override
    public Expr right() {
      return exponent;
    }

    @Override
    public Kind kind() {
      return Kind.POW;
    }

    @Override
    public String toString() {
      return Renderer.render(this);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Expr other && Structure.equal(this, other);
    }

    @Override
    public int hashCode() {
      return Structure.hash(this);
    }
  }

  // Terminals

  static NumberNode num(@NotNull Number value) {
    return new NumberNode(value);
  }

  static SymbolNode sym(@NotNull String name) {
    return new SymbolNode(name);
  }

  // Operators. Literals are wrapped as NumberNode, operand order is always kept as given.

  static Expr add(@NotNull Expr left, @NotNull Expr right) {
    return new AddNode(left, right);
  }

  static Expr add(@NotNull Expr left, @NotNull Number right) {
    return new AddNode(left, num(right));
  }

  static Expr add(@NotNull Number left, @NotNull Expr right) {
    return new AddNode(num(left), right);
  }

  static Expr add(@NotNull Number left, @NotNull Number right) {
    return new AddNode(num(left), num(right));
  }

  static Expr sub(@NotNull Expr left, @NotNull Expr right) {
    return new SubNode(left, right);
  }

  static Expr sub(@NotNull Expr left, @NotNull Number right) {
    return new SubNode(left, num(right));
  }

  static Expr sub(@NotNull Number left, @NotNull Expr right) {
    return new SubNode(num(left), right);
  }

  static Expr sub(@NotNull Number left, @NotNull Number right) {
    return new SubNode(num(left), num(right));
  }

  static Expr mul(@NotNull Expr left, @NotNull Expr right) {
    return new MulNode(left, right);
  }

  static Expr mul(@NotNull Expr left, @NotNull Number right) {
    return new MulNode(left, num(right));
  }

  static Expr mul(@NotNull Number left, @NotNull Expr right) {
    return new MulNode(num(left), right);
  }

  static Expr mul(@NotNull Number left, @NotNull Number right) {
    return new MulNode(num(left), num(right));
  }

  static Expr div(@NotNull Expr left, @NotNull Expr right) {
    return new DivNode(left, right);
  }

  static Expr div(@NotNull Expr left, @NotNull Number right) {
    return new DivNode(left, num(right));
  }

  static Expr div(@NotNull Number left, @NotNull Expr right) {
    return new DivNode(num(left), right);
  }

  static Expr div(@NotNull Number left, @NotNull Number right) {
    return new DivNode(num(left), num(right));
  }

  static Expr pow(@NotNull Expr base, @NotNull Expr exponent) {
    return new PowNode(base, exponent);
  }

  static Expr pow(@NotNull Expr base, @NotNull Number exponent) {
    return new PowNode(base, num(exponent));
  }

  static Expr pow(@NotNull Number base, @NotNull Expr exponent) {
    return new PowNode(num(base), exponent);
  }

  static Expr pow(@NotNull Number base, @NotNull Number exponent) {
    return new PowNode(num(base), num(exponent));
  }

  // Fluent forms with this expression as the left operand, e.g. `x.times(x).plus(1)`

  default Expr plus(@NotNull Expr right) {
    return add(this, right);
  }

  default Expr plus(@NotNull Number right) {
    return add(this, right);
  }

  default Expr minus(@NotNull Expr right) {
    return sub(this, right);
  }

  default Expr minus(@NotNull Number right) {
    return sub(this, right);
  }

  default Expr times(@NotNull Expr right) {
    return mul(this, right);
  }

  default Expr times(@NotNull Number right) {
    return mul(this, right);
  }

  default Expr dividedBy(@NotNull Expr right) {
    return div(this, right);
  }

  default Expr dividedBy(@NotNull Number right) {
    return div(this, right);
  }

  default Expr raisedTo(@NotNull Expr exponent) {
    return pow(this, exponent);
  }

  default Expr raisedTo(@NotNull Number exponent) {
    return pow(this, exponent);
  }
}
