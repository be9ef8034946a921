package fhdl.ir;

import fhdl.ast.DomainException;
import fhdl.ast.Domains;
import fhdl.ast.HdlTypeException;
import fhdl.ast.Signal;

/**
 * A named clock domain with its clock signal and, unless reset-less, its reset signal.
 * The signals of the sync domain are called clk and rst, those of any other domain name_clk and name_rst.
 */
public final class ClockDomain {
  private final String name;
  private final Signal clk;
  private final Signal rst;
  private final boolean asyncReset;

  public ClockDomain() { this(Domains.SYNC); }
  public ClockDomain(String name) { this(name, false, false); }

  /**
   * @param name the domain name, not comb
   * @param resetLess if set, the domain has no reset signal
   * @param asyncReset whether the reset acts asynchronously
   */
  public ClockDomain(String name, boolean resetLess, boolean asyncReset) {
    if (name == null)
      throw new HdlTypeException("Clock domain name must be specified explicitly");
    if (name.equals(Domains.COMB))
      throw new DomainException(String.format("Domain '%s' may not be clocked", name));
    this.name = name;
    this.clk = new Signal(1, signalName(name, "clk"));
    this.rst = resetLess ? null : new Signal(1, signalName(name, "rst"));
    this.asyncReset = asyncReset;
  }

  private static String signalName(String domain, String signal) {
    return domain.equals(Domains.SYNC) ? signal : domain + "_" + signal;
  }

  public String getName() { return name; }
  public Signal getClk() { return clk; }
  /** @return the reset signal, or null for a reset-less domain */
  public Signal getRst() { return rst; }
  public boolean isResetLess() { return rst == null; }
  public boolean isAsyncReset() { return asyncReset; }

  @Override
  public String toString() {
    return String.format("(domain %s)", name);
  }
}
