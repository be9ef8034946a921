package fhdl.ast;

import java.util.Set;

/**
 * A value repeated count times, equivalent to a {@link Cat} of count copies.
 */
public final class Repl extends Value {
  private final Value value;
  private final int count;
  private final Shape shape;

  public Repl(Object value, int count) {
    if (count < 0)
      throw new HdlTypeException(String.format("Replication count must be a non-negative integer, not '%d'", count));
    this.value = wrap(value);
    this.count = count;
    this.shape = Shape.unsigned(Shape.checkedWidth((long)this.value.width() * count));
  }

  public Value getValue() { return value; }
  public int getCount() { return count; }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public Set<Signal> rhsSignals() {
    return value.rhsSignals();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitRepl(this);
  }

  @Override
  public String toString() {
    return String.format("(repl %s %d)", value, count);
  }
}
