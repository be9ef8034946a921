package fhdl.ast;

/**
 * Names of the built-in clock domains.
 */
public final class Domains {
  /** The combinational pseudo-domain. It has neither a clock nor a reset. */
  public static final String COMB = "comb";
  /** The default synchronous domain. */
  public static final String SYNC = "sync";

  private Domains() {}
}
