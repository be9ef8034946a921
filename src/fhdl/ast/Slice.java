package fhdl.ast;

import java.util.Set;

/**
 * Bits [start, end) of a value. Negative bounds are resolved against the operand width when the slice is built,
 * so afterwards 0 &lt;= start &lt;= end &lt;= width holds.
 */
public final class Slice extends Value {
  private final Value value;
  private final int start;
  private final int end;

  public Slice(Object value, int start, int end) {
    this.value = wrap(value);
    int n = this.value.width();
    if (start < -n || start > n)
      throw new HdlRangeException(String.format("Cannot start slice %d bits into %d-bit value", start, n));
    if (start < 0)
      start += n;
    if (end < -n || end > n)
      throw new HdlRangeException(String.format("Cannot end slice %d bits into %d-bit value", end, n));
    if (end < 0)
      end += n;
    if (start > end)
      throw new HdlRangeException(String.format("Slice start %d must be less than slice end %d", start, end));
    this.start = start;
    this.end = end;
  }

  public Value getValue() { return value; }
  public int getStart() { return start; }
  public int getEnd() { return end; }

  @Override
  public Shape shape() {
    return Shape.unsigned(end - start);
  }

  @Override
  public Set<Signal> lhsSignals() {
    return value.lhsSignals();
  }

  @Override
  public Set<Signal> rhsSignals() {
    return value.rhsSignals();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSlice(this);
  }

  @Override
  public String toString() {
    return String.format("(slice %s %d:%d)", value, start, end);
  }
}
