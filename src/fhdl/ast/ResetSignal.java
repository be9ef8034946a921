package fhdl.ast;

import java.util.Set;

/**
 * The reset of a named domain. Replaced by the domain's reset signal when a fragment is prepared.
 * If allowResetLess is set, referring to the reset of a reset-less domain yields a constant zero instead of an error.
 */
public final class ResetSignal extends Value {
  private final String domain;
  private final boolean allowResetLess;

  public ResetSignal() { this(Domains.SYNC); }
  public ResetSignal(String domain) { this(domain, false); }

  public ResetSignal(String domain, boolean allowResetLess) {
    if (domain == null)
      throw new HdlTypeException("Clock domain name must be a string, not 'null'");
    if (domain.equals(Domains.COMB))
      throw new DomainException(String.format("Domain '%s' does not have a reset", domain));
    this.domain = domain;
    this.allowResetLess = allowResetLess;
  }

  public String getDomain() { return domain; }
  public boolean isResetLessAllowed() { return allowResetLess; }

  @Override
  public Shape shape() {
    return Shape.unsigned(1);
  }

  @Override
  public Set<Signal> lhsSignals() {
    return signalSet();
  }

  @Override
  public Set<Signal> rhsSignals() {
    return signalSet();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitResetSignal(this);
  }

  @Override
  public String toString() {
    return String.format("(rst %s)", domain);
  }
}
