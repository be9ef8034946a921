package fhdl.ir;

import fhdl.ast.ClockSignal;
import fhdl.ast.Const;
import fhdl.ast.DomainException;
import fhdl.ast.ResetSignal;
import fhdl.ast.Value;
import java.util.Map;

/**
 * Replaces clock and reset pseudo-signals with the signals of their domains.
 */
public class DomainLowerer extends ValueTransformer {
  private final Map<String, ClockDomain> domains;

  /**
   * @param domains the domains visible to the transformed statements, by name
   */
  public DomainLowerer(Map<String, ClockDomain> domains) {
    this.domains = domains;
  }

  private ClockDomain resolve(Value context, String domain) {
    ClockDomain clockDomain = domains.get(domain);
    if (clockDomain == null)
      throw new DomainException(String.format("Signal %s refers to nonexistent domain '%s'", context, domain));
    return clockDomain;
  }

  @Override
  public Value visitClockSignal(ClockSignal value) {
    return resolve(value, value.getDomain()).getClk();
  }

  /**
   * @throws DomainException if the domain is reset-less and value does not allow that
   */
  @Override
  public Value visitResetSignal(ResetSignal value) {
    ClockDomain clockDomain = resolve(value, value.getDomain());
    if (clockDomain.isResetLess()) {
      if (!value.isResetLessAllowed())
        throw new DomainException(String.format("Signal %s refers to reset of reset-less domain '%s'", value, value.getDomain()));
      return new Const(0, 1);
    }
    return clockDomain.getRst();
  }
}
