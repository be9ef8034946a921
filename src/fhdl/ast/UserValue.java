package fhdl.ast;

import java.util.Set;
import java.util.function.Supplier;

/**
 * A value defined by user code in terms of other values. {@link #lower()} is called at most once, on the first query;
 * every later query uses the cached result.
 *
 * Not safe for concurrent first use.
 */
public abstract class UserValue extends Value {
  private Value lowered = null;

  /**
   * Builds the value this user value stands for. Called at most once.
   * @return a value or anything {@link Value#wrap(Object)} accepts
   */
  protected abstract Object lower();

  /**
   * @return the memoized lowering
   */
  public final Value lowered() {
    if (lowered == null)
      lowered = wrap(lower());
    return lowered;
  }

  /**
   * Wraps a deferred computation.
   * @param lower called at most once
   * @return the user value
   */
  public static UserValue of(Supplier<?> lower) {
    return new UserValue() {
      @Override
      protected Object lower() {
        return lower.get();
      }
    };
  }

  @Override
  public Shape shape() {
    return lowered().shape();
  }

  @Override
  public Set<Signal> lhsSignals() {
    return lowered().lhsSignals();
  }

  @Override
  public Set<Signal> rhsSignals() {
    return lowered().rhsSignals();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitUserValue(this);
  }

  @Override
  public String toString() {
    return lowered == null ? "(uservalue)" : String.format("(uservalue %s)", lowered);
  }
}
