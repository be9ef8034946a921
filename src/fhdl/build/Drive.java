package fhdl.build;

/** Output drive strength of a resource. */
public final class Drive extends Constraint {
  public static final String KEY = "DRIVE";

  private final String strength;

  public Drive(String strength) { this.strength = strength.trim(); }

  public String getStrength() { return strength; }

  @Override
  public String attributeKey() {
    return KEY;
  }

  @Override
  public Object attributeValue() {
    return strength;
  }

  @Override
  public String toString() {
    return String.format("Drive('%s')", strength);
  }
}
