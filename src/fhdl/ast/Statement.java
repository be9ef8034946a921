package fhdl.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A statement of a fragment: an assignment or a switch over assignments.
 */
public abstract class Statement {
  /** @return the signals this statement drives, in first-use order */
  public abstract Set<Signal> lhsSignals();
  /** @return the signals this statement reads, in first-use order */
  public abstract Set<Signal> rhsSignals();

  public abstract <R> R accept(StatementVisitor<R> visitor);

  static Set<Signal> unionLhs(Iterable<? extends Statement> statements) {
    Set<Signal> signals = new LinkedHashSet<>();
    for (Statement statement : statements)
      signals.addAll(statement.lhsSignals());
    return signals;
  }

  static Set<Signal> unionRhs(Iterable<? extends Statement> statements) {
    Set<Signal> signals = new LinkedHashSet<>();
    for (Statement statement : statements)
      signals.addAll(statement.rhsSignals());
    return signals;
  }
}
