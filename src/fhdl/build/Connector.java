package fhdl.build;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named board connector. Its pin groups are numbered or named.
 */
public record Connector(String name, Map<Object, Pins> pins) {
  public Connector {
    pins = Collections.unmodifiableMap(new LinkedHashMap<>(pins));
  }

  /**
   * Builds a connector from a pin definition:
   * a string (one group, numbered 0), a list of strings (groups numbered from 0) or a map of named groups.
   * @throws IllegalArgumentException for any other definition
   */
  public static Connector make(String name, Object definition) {
    Map<Object, Pins> pins = new LinkedHashMap<>();
    if (definition instanceof String) {
      pins.put(0, new Pins((String)definition));
    } else if (definition instanceof List<?>) {
      List<?> groups = (List<?>)definition;
      for (int i = 0; i < groups.size(); ++i)
        pins.put(i, new Pins(String.valueOf(groups.get(i))));
    } else if (definition instanceof Map<?, ?>) {
      ((Map<?, ?>)definition).forEach((key, value) -> pins.put(key, new Pins(String.valueOf(value))));
    } else {
      throw new IllegalArgumentException(String.format("Connector '%s' has an invalid pin definition: %s", name, definition));
    }
    return new Connector(name, pins);
  }
}
