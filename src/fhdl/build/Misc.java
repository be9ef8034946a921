package fhdl.build;

/**
 * Any other vendor constraint, written as KEY=VALUE or as a bare flag.
 */
public final class Misc extends Constraint {
  private final String misc;

  public Misc(String misc) { this.misc = misc.trim(); }

  public String getMisc() { return misc; }

  /** @return the part before '=', or the whole text for a flag */
  @Override
  public String attributeKey() {
    int separator = misc.indexOf('=');
    return separator < 0 ? misc : misc.substring(0, separator).trim();
  }

  /** @return the part after '=', or true for a flag */
  @Override
  public Object attributeValue() {
    int separator = misc.indexOf('=');
    return separator < 0 ? Boolean.TRUE : misc.substring(separator + 1).trim();
  }

  @Override
  public String toString() {
    return String.format("Misc('%s')", misc);
  }
}
