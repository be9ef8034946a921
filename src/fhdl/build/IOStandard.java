package fhdl.build;

/** I/O standard of a resource, e.g. LVCMOS33. */
public final class IOStandard extends Constraint {
  public static final String KEY = "IOSTANDARD";

  private final String name;

  public IOStandard(String name) { this.name = name.trim(); }

  public String getName() { return name; }

  @Override
  public String attributeKey() {
    return KEY;
  }

  @Override
  public Object attributeValue() {
    return name;
  }

  @Override
  public String toString() {
    return String.format("IOStandard('%s')", name);
  }
}
