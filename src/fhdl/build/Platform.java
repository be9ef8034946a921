package fhdl.build;

import fhdl.ast.Shape;
import fhdl.ast.Signal;
import fhdl.ast.Value;
import fhdl.ir.Elaboratable;
import fhdl.lib.io.DdrInput;
import fhdl.lib.io.DdrOutput;
import fhdl.lib.io.DifferentialInput;
import fhdl.lib.io.DifferentialOutput;
import fhdl.lib.io.TSTriple;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The target board or device as seen during elaboration: its I/O resources, connectors, tool parameters and extra source
 * files.
 *
 * Designs obtain top-level port signals with {@link #request(String, int)}. Vendor platforms subclass this and override
 * the primitive hooks ({@link #getTristate}, {@link #getDifferentialInput}, ...) to supply device-specific buffers.
 */
public class Platform {
  protected static final Logger logger = LogManager.getLogger();

  private final String name;
  private final String tool;
  private final Map<String, Resource> resources;
  private final Map<String, Connector> connectors;
  private final Map<String, Map<String, Object>> parameters;
  private final List<String> files;
  private final Map<String, Signal> requested = new LinkedHashMap<>();

  protected Platform(Builder builder) {
    this.name = builder.name.toLowerCase();
    this.tool = builder.tool;
    this.resources = Collections.unmodifiableMap(new LinkedHashMap<>(builder.resources));
    this.connectors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.connectors));
    Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
    builder.parameters.forEach((toolName, values) -> parameters.put(toolName, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
    this.parameters = Collections.unmodifiableMap(parameters);
    this.files = List.copyOf(builder.files);
  }

  public static Builder builder(String name) { return new Builder(name); }

  /** @return the platform name, lower case */
  public String getName() { return name; }
  /** @return the name of the vendor tool, or null */
  public String getTool() { return tool; }
  public Map<String, Resource> getResources() { return resources; }
  public Map<String, Connector> getConnectors() { return connectors; }
  /** @return parameters for each vendor tool */
  public Map<String, Map<String, Object>> getParameters() { return parameters; }
  public List<String> getFiles() { return files; }

  public Optional<Resource> lookup(String name, int number) { return Optional.ofNullable(resources.get(name + "#" + number)); }

  /**
   * Returns the port signal of a resource without subsignals. Requesting the same resource again returns the same signal.
   * @return a signal as wide as the resource has pins, carrying its constraints as attributes
   * @throws IllegalArgumentException if the resource does not exist or has subsignals
   */
  public Signal request(String name, int number) {
    Resource resource = find(name, number);
    if (!resource.subsignals().isEmpty())
      throw new IllegalArgumentException(String.format("Resource %s has subsignals %s; request one of them", resource.identifier(),
                                                       resource.subsignals().stream().map(Subsignal::getName).collect(Collectors.toList())));
    return requested.computeIfAbsent(resource.identifier(), key -> makePort(name + "_" + number, resource.constraints()));
  }

  /**
   * Returns the port signal of a subsignal. The constraints of the resource apply to the subsignal as well, unless the
   * subsignal overrides them.
   * @throws IllegalArgumentException if the resource or subsignal does not exist
   */
  public Signal request(String name, int number, String subsignal) {
    Resource resource = find(name, number);
    Subsignal sub = resource.subsignals()
                        .stream()
                        .filter(candidate -> candidate.getName().equals(subsignal))
                        .findFirst()
                        .orElseThrow(() -> new IllegalArgumentException(
                            String.format("Resource %s has no subsignal '%s'", resource.identifier(), subsignal)));
    List<Constraint> constraints = new ArrayList<>(resource.constraints());
    constraints.addAll(sub.getConstraints());
    return requested.computeIfAbsent(resource.identifier() + "." + subsignal,
                                     key -> makePort(name + "_" + number + "__" + subsignal, constraints));
  }

  private Resource find(String name, int number) {
    return lookup(name, number)
        .orElseThrow(() -> new IllegalArgumentException(String.format("Resource %s#%d does not exist on platform %s", name, number, this.name)));
  }

  private static Signal makePort(String name, List<Constraint> constraints) {
    int width = 1;
    Map<String, Object> attrs = new LinkedHashMap<>();
    for (Constraint constraint : constraints) {
      if (constraint instanceof Subsignal)
        continue;
      if (constraint instanceof Pins)
        width = ((Pins)constraint).size();
      attrs.put(constraint.attributeKey(), constraint.attributeValue());
    }
    logger.debug("Requested port {} with {} pins", name, width);
    return Signal.builder(Shape.unsigned(width)).name(name).attrs(attrs).build();
  }

  /** @return the signals requested so far, in request order */
  public List<Signal> getRequestedPorts() { return List.copyOf(requested.values()); }

  // Primitive hooks. A vendor platform returns the design object implementing the primitive.

  public Optional<Elaboratable> getTristate(TSTriple triple, Value io) { return Optional.empty(); }
  public Optional<Elaboratable> getDifferentialInput(DifferentialInput buffer) { return Optional.empty(); }
  public Optional<Elaboratable> getDifferentialOutput(DifferentialOutput buffer) { return Optional.empty(); }
  public Optional<Elaboratable> getDdrInput(DdrInput buffer) { return Optional.empty(); }
  public Optional<Elaboratable> getDdrOutput(DdrOutput buffer) { return Optional.empty(); }

  @Override
  public String toString() {
    return String.format("Platform(%s)", name);
  }

  public static class Builder {
    private final String name;
    private String tool = null;
    private final Map<String, Resource> resources = new LinkedHashMap<>();
    private final Map<String, Connector> connectors = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
    private final List<String> files = new ArrayList<>();

    Builder(String name) {
      if (name == null || name.isEmpty())
        throw new IllegalArgumentException("Platform name must be a non-empty string");
      this.name = name;
    }

    public Builder tool(String tool) {
      this.tool = tool;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a resource with the same name and number exists
     */
    public Builder resource(Resource resource) {
      if (resources.putIfAbsent(resource.identifier(), resource) != null)
        throw new IllegalArgumentException(String.format("Resource %s is already defined", resource.identifier()));
      return this;
    }
    public Builder resource(String name, int number, Constraint... constraints) { return resource(Resource.of(name, number, constraints)); }

    public Builder connector(Connector connector) {
      if (connectors.putIfAbsent(connector.name(), connector) != null)
        throw new IllegalArgumentException(String.format("Connector %s is already defined", connector.name()));
      return this;
    }

    public Builder parameter(String tool, String key, Object value) {
      parameters.computeIfAbsent(tool, t -> new LinkedHashMap<>()).put(key, value);
      return this;
    }

    public Builder file(String file) {
      files.add(file);
      return this;
    }

    public Platform build() { return new Platform(this); }
  }
}
