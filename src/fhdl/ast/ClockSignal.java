package fhdl.ast;

import java.util.Set;

/**
 * The clock of a named domain. Replaced by the domain's clock signal when a fragment is prepared.
 */
public final class ClockSignal extends Value {
  private final String domain;

  public ClockSignal() { this(Domains.SYNC); }

  public ClockSignal(String domain) {
    if (domain == null)
      throw new HdlTypeException("Clock domain name must be a string, not 'null'");
    if (domain.equals(Domains.COMB))
      throw new DomainException(String.format("Domain '%s' does not have a clock", domain));
    this.domain = domain;
  }

  public String getDomain() { return domain; }

  @Override
  public Shape shape() {
    return Shape.unsigned(1);
  }

  /** Nothing until lowered; the domain's clock becomes the driven signal. */
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
    return visitor.visitClockSignal(this);
  }

  @Override
  public String toString() {
    return String.format("(clk %s)", domain);
  }
}
