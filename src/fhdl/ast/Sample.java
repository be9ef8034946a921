package fhdl.ast;

import java.util.Set;

/**
 * The value of a signal or constant a number of clock cycles in the past of a domain. Only meaningful to simulators and
 * formal tools; code emitters reject it.
 */
public final class Sample extends Value {
  private final Value value;
  private final int clocks;
  private final String domain;

  /**
   * @param value a signal, clock/reset pseudo-signal, constant or {@link Initial}
   * @param clocks how many cycles in the past, must not be negative
   * @param domain the sampling domain, or null for the domain of the statement the sample appears in
   */
  public Sample(Object value, int clocks, String domain) {
    this.value = wrap(value);
    if (!(this.value instanceof Signal || this.value instanceof Const || this.value instanceof ClockSignal ||
          this.value instanceof ResetSignal || this.value instanceof Initial))
      throw new HdlTypeException(String.format("Sampled value must be a signal or a constant, not %s", this.value));
    if (clocks < 0)
      throw new HdlTypeException(String.format("Cannot sample a value %d cycles in the future", -clocks));
    if (Domains.COMB.equals(domain))
      throw new DomainException(String.format("Domain '%s' cannot be sampled", domain));
    this.clocks = clocks;
    this.domain = domain;
  }

  public static Sample past(Object value, int clocks, String domain) { return new Sample(value, clocks, domain); }
  public static Sample past(Object value) { return past(value, 1, null); }

  /** 1 if value did not change between the last two samples. */
  public static Operator stable(Object value, int clocks, String domain) {
    return new Sample(value, clocks + 1, domain).equalTo(new Sample(value, clocks, domain));
  }
  public static Operator stable(Object value) { return stable(value, 0, null); }

  /** 1 if value went from 0 to 1 between the last two samples. */
  public static Operator rose(Object value, int clocks, String domain) {
    return new Sample(value, clocks + 1, domain).invert().and(new Sample(value, clocks, domain));
  }
  public static Operator rose(Object value) { return rose(value, 0, null); }

  /** 1 if value went from 1 to 0 between the last two samples. */
  public static Operator fell(Object value, int clocks, String domain) {
    return new Sample(value, clocks + 1, domain).and(new Sample(value, clocks, domain).invert());
  }
  public static Operator fell(Object value) { return fell(value, 0, null); }

  public Value getValue() { return value; }
  public int getClocks() { return clocks; }
  /** @return the domain, or null if taken from the enclosing statement */
  public String getDomain() { return domain; }

  @Override
  public Shape shape() {
    return value.shape();
  }

  /** A sample reads no signal in the current cycle. */
  @Override
  public Set<Signal> rhsSignals() {
    return signalSet();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSample(this);
  }

  @Override
  public String toString() {
    return String.format("(sample %s @ %s[%d])", value, domain == null ? "<default>" : domain, clocks);
  }
}
