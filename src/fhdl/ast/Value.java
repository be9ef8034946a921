package fhdl.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable hardware expression node. Nodes are shared by reference between expressions and fragments;
 * two separately built but structurally equal expressions are distinct nodes.
 *
 * The shape of every node is inferred when it is constructed, and every construction-time check happens eagerly,
 * so a Value that exists is always valid.
 */
public abstract class Value {

  /**
   * Converts an object to a Value.
   * Values are returned as is, integers become {@link Const}s of minimal width, booleans become 1-bit constants,
   * and constants of an {@link HdlEnum} enumeration become constants with the shape of their enumeration.
   * @param obj the object to convert
   * @return the Value
   * @throws HdlTypeException if obj has no hardware representation
   */
  public static Value wrap(Object obj) {
    if (obj instanceof Value)
      return (Value)obj;
    if (obj instanceof Integer || obj instanceof Long || obj instanceof Short || obj instanceof Byte)
      return new Const(((Number)obj).longValue());
    if (obj instanceof BigInteger)
      return new Const((BigInteger)obj);
    if (obj instanceof Boolean)
      return new Const((Boolean)obj ? 1 : 0, Shape.unsigned(1));
    if (obj instanceof Enum<?>) {
      if (!(obj instanceof HdlEnum))
        throw new HdlTypeException("Only enumerations with integer values can be converted to hardware values");
      Enum<?> constant = (Enum<?>)obj;
      Shape shape = Shape.ofEnumConstants(constant.getDeclaringClass().getEnumConstants());
      return new Const(((HdlEnum)obj).value(), shape);
    }
    throw new HdlTypeException(String.format("Object '%s' is not a hardware value", obj));
  }

  static List<Value> wrapAll(Object... objs) {
    List<Value> values = new ArrayList<>(objs.length);
    for (Object obj : objs)
      values.add(wrap(obj));
    return values;
  }

  /**
   * @return the width and signedness of this expression
   */
  public abstract Shape shape();

  /**
   * @return the width of this expression in bits
   */
  public int width() { return shape().getWidth(); }

  /**
   * Signals this expression drives when used as the target of an assignment.
   * @return the signals, in first-use order
   * @throws HdlTypeException if this expression cannot be assigned to
   */
  public Set<Signal> lhsSignals() { throw new HdlTypeException(String.format("Value %s cannot be used in assignments", this)); }

  /**
   * @return the signals this expression reads, in first-use order
   */
  public abstract Set<Signal> rhsSignals();

  public abstract <R> R accept(ValueVisitor<R> visitor);

  // Unary operators

  public Operator invert() { return new Operator("~", this); }
  /** Arithmetic negation. The result is signed and one bit wider if this is unsigned. */
  public Operator neg() { return new Operator("-", this); }
  /** @return 1 if any bit is set */
  public Operator bool() { return new Operator("b", this); }
  /** @return 1 if any bit is set */
  public Operator any() { return new Operator("r|", this); }
  /** @return 1 if all bits are set */
  public Operator all() { return new Operator("r&", this); }
  /** @return the parity of the bits */
  public Operator reduceXor() { return new Operator("r^", this); }
  /** @return 1 if no bit is set */
  public Operator logicalNot() { return bool().invert(); }

  // Binary operators

  public Operator add(Object other) { return new Operator("+", this, wrap(other)); }
  public Operator sub(Object other) { return new Operator("-", this, wrap(other)); }
  public Operator mul(Object other) { return new Operator("*", this, wrap(other)); }
  public Operator and(Object other) { return new Operator("&", this, wrap(other)); }
  public Operator or(Object other) { return new Operator("|", this, wrap(other)); }
  public Operator xor(Object other) { return new Operator("^", this, wrap(other)); }
  public Operator shl(Object amount) { return new Operator("<<", this, wrap(amount)); }
  public Operator shr(Object amount) { return new Operator(">>", this, wrap(amount)); }

  public Operator equalTo(Object other) { return new Operator("==", this, wrap(other)); }
  public Operator notEqualTo(Object other) { return new Operator("!=", this, wrap(other)); }
  public Operator lessThan(Object other) { return new Operator("<", this, wrap(other)); }
  public Operator lessOrEqual(Object other) { return new Operator("<=", this, wrap(other)); }
  public Operator greaterThan(Object other) { return new Operator(">", this, wrap(other)); }
  public Operator greaterOrEqual(Object other) { return new Operator(">=", this, wrap(other)); }

  /**
   * Two-way multiplexer. A selector wider than one bit is reduced with {@link #bool()}.
   * @param sel the selector
   * @param whenTrue value if sel is non-zero
   * @param whenFalse value if sel is zero
   * @return the multiplexer
   */
  public static Operator mux(Object sel, Object whenTrue, Object whenFalse) {
    Value selValue = wrap(sel);
    if (selValue.width() != 1)
      selValue = selValue.bool();
    return new Operator("m", selValue, wrap(whenTrue), wrap(whenFalse));
  }

  // Slicing

  /**
   * Selects one bit. Negative indices count from the most significant end.
   * @throws HdlRangeException if index does not address a bit of this value
   */
  public Slice bit(int index) {
    int n = width();
    if (index < -n || index >= n)
      throw new HdlRangeException(String.format("Cannot index %d bits into %d-bit value", index, n));
    if (index < 0)
      index += n;
    return new Slice(this, index, index + 1);
  }

  /**
   * Selects bits [start, end). Negative bounds count from the most significant end.
   */
  public Slice slice(int start, int end) { return new Slice(this, start, end); }

  /**
   * Selects every step-th bit, starting at the least significant bit for a positive step and at the most significant bit for
   * a negative step. A step of one returns a plain slice of the whole value.
   * @param step the stride, must not be zero
   * @return the selected bits
   */
  public Value stride(int step) {
    int n = width();
    if (step == 0)
      throw new HdlTypeException("Slice step cannot be zero");
    if (step == 1)
      return new Slice(this, 0, n);
    List<Value> bits = new ArrayList<>();
    if (step > 0) {
      for (int i = 0; i < n; i += step)
        bits.add(new Slice(this, i, i + 1));
    } else {
      for (int i = n - 1; i >= 0; i += step)
        bits.add(new Slice(this, i, i + 1));
    }
    return new Cat(bits);
  }

  /**
   * Selects width bits starting at bit offset. A constant offset folds into a {@link Slice}.
   * @throws HdlRangeException if a constant offset selects bits outside this value
   */
  public Value bitSelect(Object offset, int width) {
    Value offsetValue = wrap(offset);
    if (offsetValue instanceof Const) {
      BigInteger start = ((Const)offsetValue).getValue();
      try {
        return slice(start.intValueExact(), Math.addExact(start.intValueExact(), width));
      } catch (ArithmeticException e) {
        throw new HdlRangeException(String.format("Cannot select %d bits at offset %s of %d-bit value", width, start, width()), e);
      }
    }
    return new Part(this, offsetValue, width, 1);
  }

  /**
   * Selects the offset-th word of width bits. A constant offset folds into a {@link Slice}.
   * @throws HdlRangeException if a constant offset selects a word outside this value
   */
  public Value wordSelect(Object offset, int width) {
    Value offsetValue = wrap(offset);
    if (offsetValue instanceof Const && width > 0) {
      BigInteger index = ((Const)offsetValue).getValue();
      if (index.signum() < 0 || index.compareTo(BigInteger.valueOf(width() / width)) >= 0)
        throw new HdlRangeException(String.format("Cannot select word %s of %d bits from %d-bit value", index, width, width()));
      int start = Math.multiplyExact(index.intValueExact(), width);
      return slice(start, Math.addExact(start, width));
    }
    return new Part(this, offsetValue, width, width);
  }

  /**
   * Tests this value against integer, bit-string ('0', '1', '-' for don't care) or enumeration patterns.
   * @see PatternMatcher
   */
  public Value matches(Object... patterns) { return PatternMatcher.matches(this, patterns); }

  /**
   * @param rhs the value to assign
   * @return a statement assigning rhs to this
   */
  public Assign eq(Object rhs) { return new Assign(this, wrap(rhs)); }

  static Set<Signal> signalSet() { return new LinkedHashSet<>(); }

  static Set<Signal> unionRhs(Iterable<? extends Value> values) {
    Set<Signal> signals = signalSet();
    for (Value value : values)
      signals.addAll(value.rhsSignals());
    return signals;
  }
}
