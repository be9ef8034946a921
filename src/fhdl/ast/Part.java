package fhdl.ast;

import java.util.Set;

/**
 * A window of width bits at a dynamic position: bit offset * stride of the operand.
 * Bit selection uses stride 1, word selection uses a stride equal to the width.
 */
public final class Part extends Value {
  private final Value value;
  private final Value offset;
  private final int width;
  private final int stride;

  public Part(Object value, Object offset, int width, int stride) {
    if (width < 0)
      throw new HdlTypeException(String.format("Part width must be a non-negative integer, not '%d'", width));
    if (stride <= 0)
      throw new HdlTypeException(String.format("Part stride must be a positive integer, not '%d'", stride));
    this.value = wrap(value);
    this.offset = wrap(offset);
    this.width = width;
    this.stride = stride;
  }

  public Value getValue() { return value; }
  public Value getOffset() { return offset; }
  public int getStride() { return stride; }

  @Override
  public Shape shape() {
    return Shape.unsigned(width);
  }

  @Override
  public Set<Signal> lhsSignals() {
    return value.lhsSignals();
  }

  @Override
  public Set<Signal> rhsSignals() {
    Set<Signal> signals = value.rhsSignals();
    signals.addAll(offset.rhsSignals());
    return signals;
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitPart(this);
  }

  @Override
  public String toString() {
    return String.format("(part %s %s %d %d)", value, offset, width, stride);
  }
}
