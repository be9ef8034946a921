package fhdl.build;

import java.util.ArrayList;
import java.util.List;

/**
 * An I/O resource of a platform, identified by name and number, e.g. led#0.
 */
public record Resource(String name, int number, List<Constraint> constraints, List<Subsignal> subsignals) {
  public Resource {
    constraints = List.copyOf(constraints);
    subsignals = List.copyOf(subsignals);
  }

  /** Splits constraints into subsignals and the rest. */
  public static Resource of(String name, int number, Constraint... constraints) {
    List<Constraint> plain = new ArrayList<>();
    List<Subsignal> subsignals = new ArrayList<>();
    for (Constraint constraint : constraints) {
      if (constraint instanceof Subsignal)
        subsignals.add((Subsignal)constraint);
      else
        plain.add(constraint);
    }
    return new Resource(name, number, plain, subsignals);
  }

  public String identifier() { return name + "#" + number; }
}
