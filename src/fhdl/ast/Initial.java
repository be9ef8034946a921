package fhdl.ast;

import java.util.Set;

/**
 * 1 during the first simulated step, 0 afterwards. Only meaningful to simulators.
 */
public final class Initial extends Value {

  @Override
  public Shape shape() {
    return Shape.unsigned(1);
  }

  @Override
  public Set<Signal> rhsSignals() {
    return signalSet();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitInitial(this);
  }

  @Override
  public String toString() {
    return "(initial)";
  }
}
