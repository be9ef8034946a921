package fhdl.ir;

public enum PortDirection {
  INPUT("i"),
  OUTPUT("o"),
  INOUT("io");

  private final String shortName;

  PortDirection(String shortName) { this.shortName = shortName; }

  /** @return i, o or io */
  public String getShortName() { return shortName; }
}
