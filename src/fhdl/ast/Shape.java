package fhdl.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Width and signedness of a bit vector, together with the promotion rules used when values of different shapes are combined.
 * Shapes are compared by value. A zero-width shape is always unsigned.
 */
public final class Shape {
  private final int width;
  private final boolean signed;

  private Shape(int width, boolean signed) {
    this.width = width;
    this.signed = signed && width > 0;
  }

  /**
   * @param width number of bits, must not be negative
   * @param signed whether the vector is interpreted as two's complement
   * @return the shape
   */
  public static Shape of(int width, boolean signed) {
    if (width < 0)
      throw new HdlTypeException(String.format("Width must be a non-negative integer, not '%d'", width));
    return new Shape(width, signed);
  }
  public static Shape unsigned(int width) { return of(width, false); }

  /**
   * @throws HdlTypeException if width does not fit an int
   */
  static int checkedWidth(long width) {
    if (width > Integer.MAX_VALUE)
      throw new HdlTypeException(String.format("Width %d is too large to be represented", width));
    return (int)width;
  }
  public static Shape signed(int width) { return of(width, true); }

  /**
   * Smallest shape that can represent every integer of the half-open range [start, stop).
   * An empty range yields the shape of its bounds, so range(0) is a 1-bit unsigned shape.
   */
  public static Shape range(long start, long stop) {
    long last = stop - 1;
    boolean signed = start < 0 || (stop > start && last < 0);
    int width = Math.max(bitsFor(BigInteger.valueOf(start), signed), bitsFor(BigInteger.valueOf(last), signed));
    return of(width, signed);
  }
  public static Shape range(long stop) { return range(0, stop); }

  /**
   * Shape that holds every constant of an integer-valued enumeration.
   * @param enumClass an enum implementing {@link HdlEnum}
   * @return the shape
   */
  public static <E extends Enum<E> & HdlEnum> Shape ofEnum(Class<E> enumClass) {
    return ofEnumConstants(enumClass.getEnumConstants());
  }

  static Shape ofEnumConstants(Object[] constants) {
    long min = 0, max = 0;
    for (Object constant : constants) {
      long value = ((HdlEnum)constant).value();
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    boolean signed = min < 0;
    int width = Math.max(bitsFor(BigInteger.valueOf(min), signed), bitsFor(BigInteger.valueOf(max), signed));
    return of(width, signed);
  }

  /**
   * Number of bits needed to represent value. Zero and one need a single bit; negative values always need a sign bit.
   * @param value the integer
   * @param requireSignBit whether a sign bit must be accounted for even if value is not negative
   * @return the number of bits
   */
  public static int bitsFor(BigInteger value, boolean requireSignBit) {
    int bits;
    if (value.signum() > 0) {
      bits = log2Ceil(value.add(BigInteger.ONE));
    } else {
      requireSignBit = true;
      bits = log2Ceil(value.negate());
    }
    return requireSignBit ? bits + 1 : bits;
  }
  public static int bitsFor(long value, boolean requireSignBit) { return bitsFor(BigInteger.valueOf(value), requireSignBit); }
  public static int bitsFor(long value) { return bitsFor(value, false); }

  /** Ceiling of log2(n) for n >= 0, with log2Ceil(0) == 0. */
  static int log2Ceil(BigInteger n) {
    if (n.signum() == 0)
      return 0;
    return n.subtract(BigInteger.ONE).bitLength();
  }

  public int getWidth() { return width; }
  public boolean isSigned() { return signed; }

  /**
   * Shape of a bitwise operation (and multiplexer) between this and other.
   * If exactly one operand is signed, the unsigned operand gains a bit so that its values stay representable.
   */
  public Shape unify(Shape other) {
    if (signed == other.signed)
      return of(Math.max(width, other.width), signed);
    if (!signed)
      return of(Math.max(checkedWidth(width + 1L), other.width), true);
    return of(Math.max(width, checkedWidth(other.width + 1L)), true);
  }

  /** Shape of this + other and this - other; one carry bit above {@link #unify(Shape)}. */
  public Shape sum(Shape other) {
    Shape unified = unify(other);
    return of(checkedWidth(unified.width + 1L), unified.signed);
  }

  /** Shape of this * other. */
  public Shape product(Shape other) { return of(checkedWidth((long)width + other.width), signed || other.signed); }

  /**
   * Shape of this shifted left by an amount of shape amount. A signed amount may be negative, i.e. shift right.
   */
  public Shape shiftLeft(Shape amount) {
    long extra = amount.signed ? (1L << (amount.width - 1)) - 1 : (1L << amount.width) - 1;
    return shifted(amount, extra);
  }

  /**
   * Shape of this shifted right by an amount of shape amount. A negative signed amount shifts left by up to 2^(w-1).
   */
  public Shape shiftRight(Shape amount) {
    long extra = amount.signed ? 1L << (amount.width - 1) : 0;
    return shifted(amount, extra);
  }

  private Shape shifted(Shape amount, long extra) {
    if (amount.width >= 31 || width + extra > Integer.MAX_VALUE)
      throw new HdlTypeException(String.format("Shift amount of shape %s is too wide to compute a result width", amount));
    return of((int)(width + extra), signed);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Shape other = (Shape)obj;
    return width == other.width && signed == other.signed;
  }
  @Override
  public int hashCode() {
    return Objects.hash(width, signed);
  }
  @Override
  public String toString() {
    return String.format("(%d, %s)", width, signed ? "signed" : "unsigned");
  }
}
