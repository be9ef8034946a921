package fhdl.ast;

import java.math.BigInteger;
import java.util.Set;

/**
 * A constant. The stored value is normalized to the shape: truncated for unsigned shapes and sign-extended for signed shapes.
 * Constants are not hashable, since two numerically equal constants are not required to be the same node.
 */
public final class Const extends Value {
  private final BigInteger value;
  private final Shape shape;

  /** Constant of minimal shape for value: signed iff value is negative. */
  public Const(BigInteger value) { this(value, Shape.of(Shape.bitsFor(value, false), value.signum() < 0)); }
  public Const(long value) { this(BigInteger.valueOf(value)); }
  public Const(long value, int width) { this(BigInteger.valueOf(value), Shape.unsigned(width)); }
  public Const(long value, Shape shape) { this(BigInteger.valueOf(value), shape); }

  public Const(BigInteger value, Shape shape) {
    this.shape = shape;
    this.value = normalize(value, shape);
  }

  /**
   * Truncates value to the width of shape and reinterprets it according to the signedness of shape.
   */
  public static BigInteger normalize(BigInteger value, Shape shape) {
    int width = shape.getWidth();
    BigInteger mask = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    BigInteger truncated = value.and(mask);
    if (shape.isSigned() && truncated.testBit(width - 1))
      truncated = truncated.subtract(BigInteger.ONE.shiftLeft(width));
    return truncated;
  }

  public BigInteger getValue() { return value; }
  public long longValue() { return value.longValueExact(); }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public Set<Signal> rhsSignals() {
    return signalSet();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitConst(this);
  }

  @Override
  public int hashCode() {
    throw new UnsupportedOperationException("Constants are not hashable");
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public String toString() {
    return String.format("(const %d'%sd%s)", shape.getWidth(), shape.isSigned() ? "s" : "", value);
  }
}
