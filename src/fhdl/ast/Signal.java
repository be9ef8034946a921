package fhdl.ast;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * A named, assignable bit vector. Signals are compared and hashed by identity.
 *
 * Besides its shape, a signal carries the value it takes on reset, whether it is excluded from domain resets,
 * a map of vendor attributes (opaque to this library, e.g. placement constraints) and an optional decoder that renders
 * its integer values for display.
 */
public class Signal extends Value {
  public static final String DEFAULT_NAME = "$signal";

  private final Shape shape;
  private final String name;
  private final BigInteger reset;
  private final boolean resetLess;
  private final Map<String, Object> attrs;
  private final LongFunction<String> decoder;

  public Signal() { this(Shape.unsigned(1)); }
  public Signal(int width) { this(Shape.unsigned(width)); }
  public Signal(Shape shape) { this(shape, DEFAULT_NAME); }
  public Signal(int width, String name) { this(Shape.unsigned(width), name); }
  public Signal(Shape shape, String name) { this(builder(shape).name(name)); }

  protected Signal(Builder builder) {
    this.shape = builder.shape;
    this.name = builder.name;
    this.reset = builder.reset;
    this.resetLess = builder.resetLess;
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attrs));
    this.decoder = builder.decoder;

    int resetWidth = Shape.bitsFor(reset, shape.isSigned());
    if (reset.signum() != 0 && resetWidth > shape.getWidth()) {
      HdlWarnings.warn(HdlWarning.Kind.RESET_VALUE_TOO_WIDE,
                       String.format("Reset value %s requires %d bits to represent, but the signal only has %d bits", reset, resetWidth,
                                     shape.getWidth()));
    }
  }

  public static Builder builder(Shape shape) { return new Builder(shape); }
  public static Builder builder(int width) { return new Builder(Shape.unsigned(width)); }

  /** Signal that can hold every integer in [0, stop). */
  public static Signal range(long stop) { return new Signal(Shape.range(stop)); }
  /** Signal that can hold every integer in [start, stop). */
  public static Signal range(long start, long stop) { return new Signal(Shape.range(start, stop)); }

  /**
   * Signal with the shape of an integer-valued enumeration and a decoder printing constant names.
   */
  public static <E extends Enum<E> & HdlEnum> Signal enumeration(Class<E> enumClass) {
    return enumeration(enumClass, DEFAULT_NAME);
  }
  public static <E extends Enum<E> & HdlEnum> Signal enumeration(Class<E> enumClass, String name) {
    return builder(Shape.ofEnum(enumClass)).name(name).decoder(enumDecoder(enumClass)).build();
  }

  /**
   * Decoder rendering a value as {@code NAME/value} if it belongs to the enumeration, else as a plain number.
   */
  public static <E extends Enum<E> & HdlEnum> LongFunction<String> enumDecoder(Class<E> enumClass) {
    return value -> {
      for (E constant : enumClass.getEnumConstants()) {
        if (constant.value() == value)
          return String.format("%s/%d", constant.name(), value);
      }
      return Long.toString(value);
    };
  }

  /**
   * Creates a signal shaped like other. If other is a signal, its reset value, reset-less flag, attributes and decoder are copied.
   * @param other a value or anything {@link Value#wrap(Object)} accepts
   * @param name name of the new signal; if null, derived from other and nameSuffix
   * @param nameSuffix appended to the name of other if name is null and other is a signal
   * @return the new signal
   */
  public static Signal like(Object other, String name, String nameSuffix) {
    Value otherValue = wrap(other);
    if (name == null) {
      if (nameSuffix != null && otherValue instanceof Signal)
        name = ((Signal)otherValue).name + nameSuffix;
      else
        name = "$like";
    }
    Builder builder = builder(otherValue.shape()).name(name);
    if (otherValue instanceof Signal) {
      Signal otherSignal = (Signal)otherValue;
      builder.reset(otherSignal.reset).resetLess(otherSignal.resetLess).attrs(otherSignal.attrs).decoder(otherSignal.decoder);
    }
    return builder.build();
  }
  public static Signal like(Object other) { return like(other, null, null); }

  public String getName() { return name; }
  public BigInteger getReset() { return reset; }
  public boolean isResetLess() { return resetLess; }
  /** @return the read-only vendor attribute map */
  public Map<String, Object> getAttrs() { return attrs; }
  /** @return the decoder, or null if values are displayed as plain numbers */
  public LongFunction<String> getDecoder() { return decoder; }

  /**
   * Renders value for display using the decoder, or as a plain number.
   */
  public String decode(long value) { return decoder != null ? decoder.apply(value) : Long.toString(value); }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> signals = signalSet();
    signals.add(this);
    return signals;
  }

  @Override
  public Set<Signal> rhsSignals() {
    return lhsSignals();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSignal(this);
  }

  @Override
  public String toString() {
    return String.format("(sig %s)", name);
  }

  /**
   * Builder for signals with non-default reset value, attributes or decoder.
   */
  public static class Builder {
    private final Shape shape;
    private String name = DEFAULT_NAME;
    private BigInteger reset = BigInteger.ZERO;
    private boolean resetLess = false;
    private final Map<String, Object> attrs = new LinkedHashMap<>();
    private LongFunction<String> decoder = null;

    Builder(Shape shape) { this.shape = shape; }

    public Builder name(String name) {
      if (name == null)
        throw new HdlTypeException("Signal name must be a string, not 'null'");
      this.name = name;
      return this;
    }
    public Builder reset(long reset) { return reset(BigInteger.valueOf(reset)); }
    public Builder reset(BigInteger reset) {
      this.reset = reset;
      return this;
    }
    /** Sets the reset value from a constant of an integer-valued enumeration. */
    public Builder reset(HdlEnum reset) { return reset(reset.value()); }
    public Builder resetLess(boolean resetLess) {
      this.resetLess = resetLess;
      return this;
    }
    /**
     * Adds a vendor attribute. Values are scalars (strings, numbers, booleans) or constraint objects.
     */
    public Builder attr(String key, Object value) {
      this.attrs.put(key, value);
      return this;
    }
    public Builder attrs(Map<String, ?> attrs) {
      this.attrs.putAll(attrs);
      return this;
    }
    public Builder decoder(LongFunction<String> decoder) {
      this.decoder = decoder;
      return this;
    }
    public Signal build() { return new Signal(this); }
  }
}
