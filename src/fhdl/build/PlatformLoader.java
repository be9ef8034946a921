package fhdl.build;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a platform description from YAML.
 *
 * <pre>
 * name: alu_example
 * tool: vivado
 * io:
 *   - name: a
 *     number: 0
 *     pins: "10 11 12"
 *     iostandard: LVCMOS33
 *     drive: "8"
 *     misc: [PULLUP=TRUE]
 *     subsignals:
 *       - name: tx
 *         pins: "A1"
 * connectors:
 *   - name: pmod
 *     pins: "1 2 3 4"
 * parameters:
 *   vivado:
 *     part: xc7a35ticsg324-1L
 * files: [top.xdc]
 * </pre>
 *
 * Unknown keys are logged and ignored.
 */
public final class PlatformLoader {
  protected static final Logger logger = LogManager.getLogger();

  private PlatformLoader() {}

  public static Platform load(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    }
  }

  /**
   * @throws IllegalArgumentException if the description is malformed
   */
  public static Platform load(InputStream in) {
    Object data = new Yaml().load(in);
    if (!(data instanceof Map<?, ?>))
      throw new IllegalArgumentException("Platform description must be a mapping");
    Map<?, ?> description = (Map<?, ?>)data;
    Object name = description.get("name");
    if (!(name instanceof String))
      throw new IllegalArgumentException("Platform description must have a name");
    Platform.Builder builder = Platform.builder((String)name);
    for (Map.Entry<?, ?> entry : description.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      switch (key) {
      case "name":
        break;
      case "tool":
        builder.tool(String.valueOf(value));
        break;
      case "io":
        for (Map<?, ?> io : asListOfMaps(value, "io"))
          builder.resource(parseResource(io));
        break;
      case "connectors":
        for (Map<?, ?> connector : asListOfMaps(value, "connectors"))
          builder.connector(Connector.make(requireString(connector, "name", "connector"), connector.get("pins")));
        break;
      case "parameters":
        asMap(value, "parameters").forEach((tool, values) -> asMap(values, "parameters of " + tool)
                                                           .forEach((k, v) -> builder.parameter(String.valueOf(tool), String.valueOf(k), v)));
        break;
      case "files":
        for (Object file : asList(value, "files"))
          builder.file(String.valueOf(file));
        break;
      default:
        logger.warn("Ignoring unknown platform key {}", key);
        break;
      }
    }
    return builder.build();
  }

  private static Resource parseResource(Map<?, ?> io) {
    String name = requireString(io, "name", "io");
    Object number = io.containsKey("number") ? io.get("number") : Integer.valueOf(0);
    if (!(number instanceof Integer))
      throw new IllegalArgumentException(String.format("Resource %s must have an integer number, not %s", name, number));
    List<Constraint> constraints = parseConstraints(io, "resource " + name);
    if (io.containsKey("subsignals")) {
      for (Map<?, ?> sub : asListOfMaps(io.get("subsignals"), "subsignals of " + name)) {
        String subName = requireString(sub, "name", "subsignal of " + name);
        constraints.add(new Subsignal(subName, parseConstraints(sub, "subsignal " + subName).toArray(new Constraint[0])));
      }
    }
    return Resource.of(name, (Integer)number, constraints.toArray(new Constraint[0]));
  }

  private static List<Constraint> parseConstraints(Map<?, ?> definition, String context) {
    List<Constraint> constraints = new ArrayList<>();
    for (Map.Entry<?, ?> entry : definition.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      switch (key) {
      case "name":
      case "number":
      case "subsignals":
        break;
      case "pins":
        constraints.add(new Pins(String.valueOf(value)));
        break;
      case "iostandard":
        constraints.add(new IOStandard(String.valueOf(value)));
        break;
      case "drive":
        constraints.add(new Drive(String.valueOf(value)));
        break;
      case "misc":
        if (value instanceof List<?>) {
          for (Object misc : (List<?>)value)
            constraints.add(new Misc(String.valueOf(misc)));
        } else {
          constraints.add(new Misc(String.valueOf(value)));
        }
        break;
      default:
        logger.warn("Ignoring unknown key {} of {}", key, context);
        break;
      }
    }
    return constraints;
  }

  private static String requireString(Map<?, ?> map, String key, String context) {
    Object value = map.get(key);
    if (!(value instanceof String))
      throw new IllegalArgumentException(String.format("Entry of %s must have a string '%s'", context, key));
    return (String)value;
  }

  private static List<?> asList(Object value, String context) {
    if (!(value instanceof List<?>))
      throw new IllegalArgumentException(String.format("%s must be a list", context));
    return (List<?>)value;
  }

  private static List<Map<?, ?>> asListOfMaps(Object value, String context) {
    List<Map<?, ?>> maps = new ArrayList<>();
    for (Object item : asList(value, context))
      maps.add(asMap(item, context));
    return maps;
  }

  private static Map<?, ?> asMap(Object value, String context) {
    if (!(value instanceof Map<?, ?>))
      throw new IllegalArgumentException(String.format("Entries of %s must be mappings", context));
    return (Map<?, ?>)value;
  }
}
