package fhdl.ast;

import java.util.Set;

/**
 * Assignment of rhs to lhs. The left-hand side must be assignable, i.e. built from signals through slices, parts,
 * concatenations and array proxies; this is checked on construction.
 */
public final class Assign extends Statement {
  private final Value lhs;
  private final Value rhs;

  public Assign(Object lhs, Object rhs) {
    this.lhs = Value.wrap(lhs);
    this.rhs = Value.wrap(rhs);
    this.lhs.lhsSignals();
  }

  public Value getLhs() { return lhs; }
  public Value getRhs() { return rhs; }

  @Override
  public Set<Signal> lhsSignals() {
    return lhs.lhsSignals();
  }

  /**
   * Everything the right-hand side reads, plus what the left-hand side reads without driving it, e.g. the offset of a part.
   */
  @Override
  public Set<Signal> rhsSignals() {
    Set<Signal> signals = rhs.rhsSignals();
    Set<Signal> lhsRead = lhs.rhsSignals();
    lhsRead.removeAll(lhs.lhsSignals());
    signals.addAll(lhsRead);
    return signals;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) {
    return visitor.visitAssign(this);
  }

  @Override
  public String toString() {
    return String.format("(eq %s %s)", lhs, rhs);
  }
}
