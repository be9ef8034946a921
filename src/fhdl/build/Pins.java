package fhdl.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Package pins of a resource, one per bit, least significant first. */
public final class Pins extends Constraint {
  public static final String KEY = "PINS";

  private final List<String> pins;

  /**
   * @param identifiers whitespace separated pin names; several strings are joined
   */
  public Pins(String... identifiers) {
    List<String> pins = new ArrayList<>();
    for (String identifier : identifiers) {
      String normalized = normalizeWhitespace(identifier);
      if (!normalized.isEmpty())
        Collections.addAll(pins, normalized.split(" "));
    }
    this.pins = List.copyOf(pins);
  }

  public List<String> getPins() { return pins; }
  public int size() { return pins.size(); }

  @Override
  public String attributeKey() {
    return KEY;
  }

  @Override
  public Object attributeValue() {
    return String.join(" ", pins);
  }

  @Override
  public String toString() {
    return String.format("Pins('%s')", String.join(" ", pins));
  }
}
