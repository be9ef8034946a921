package fhdl.build;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named part of a resource with its own constraints, e.g. the tx line of a serial port.
 * Subsignals structure a resource and are not stored as signal attributes.
 */
public final class Subsignal extends Constraint {
  private final String name;
  private final Set<Constraint> constraints;

  public Subsignal(String name, Constraint... constraints) {
    this.name = name;
    this.constraints = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(constraints)));
  }

  public String getName() { return name; }
  public Set<Constraint> getConstraints() { return constraints; }

  @Override
  public String attributeKey() {
    throw new UnsupportedOperationException("Subsignal " + name + " is not a signal attribute");
  }

  @Override
  public Object attributeValue() {
    throw new UnsupportedOperationException("Subsignal " + name + " is not a signal attribute");
  }

  @Override
  public String toString() {
    return String.format("Subsignal('%s', %s)", name, constraints.stream().map(Constraint::toString).collect(Collectors.joining(", ")));
  }
}
