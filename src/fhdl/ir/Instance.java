package fhdl.ir;

import fhdl.ast.Const;
import fhdl.ast.HdlTypeException;
import fhdl.ast.Value;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A black-box primitive: a type name, literal parameters, port bindings and opaque attributes.
 * Emitters render it as an instantiation of the named cell.
 */
public final class Instance {
  /** A value bound to a named port of the primitive. */
  public record Port(Value value, PortDirection direction) {}

  private final String type;
  private final Map<String, Object> parameters;
  private final Map<String, Port> ports;
  private final Map<String, Object> attrs;

  private Instance(String type, Map<String, Object> parameters, Map<String, Port> ports, Map<String, Object> attrs) {
    this.type = type;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.ports = Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    this.attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
  }

  public static Builder builder(String type) { return new Builder(type); }

  public String getType() { return type; }
  public Map<String, Object> getParameters() { return parameters; }
  /** @return the port bindings in declaration order */
  public Map<String, Port> getPorts() { return ports; }
  public Map<String, Object> getAttrs() { return attrs; }

  /**
   * Copy of this instance with every bound value replaced by fn(value).
   */
  Instance mapPorts(UnaryOperator<Value> fn) {
    Map<String, Port> mapped = new LinkedHashMap<>();
    boolean changed = false;
    for (Map.Entry<String, Port> entry : ports.entrySet()) {
      Port port = entry.getValue();
      Value value = fn.apply(port.value());
      changed = changed || value != port.value();
      mapped.put(entry.getKey(), new Port(value, port.direction()));
    }
    return changed ? new Instance(type, parameters, mapped, attrs) : this;
  }

  @Override
  public String toString() {
    return String.format("(instance %s %s)", type, ports.keySet());
  }

  public static class Builder {
    private final String type;
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final Map<String, Port> ports = new LinkedHashMap<>();
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    Builder(String type) {
      if (type == null || type.isEmpty())
        throw new HdlTypeException("Instance type must be a non-empty string");
      this.type = type;
    }

    /**
     * @param value an integer, string, boolean or constant
     */
    public Builder parameter(String name, Object value) {
      if (!(value instanceof Integer || value instanceof Long || value instanceof BigInteger || value instanceof String ||
            value instanceof Boolean || value instanceof Const))
        throw new HdlTypeException(String.format("Instance parameter '%s' must be a literal value, not %s", name, value));
      parameters.put(name, value);
      return this;
    }
    public Builder input(String name, Object value) { return port(name, Value.wrap(value), PortDirection.INPUT); }
    /** @throws HdlTypeException if value cannot be assigned to */
    public Builder output(String name, Object value) {
      Value wrapped = Value.wrap(value);
      wrapped.lhsSignals();
      return port(name, wrapped, PortDirection.OUTPUT);
    }
    /** @throws HdlTypeException if value cannot be assigned to */
    public Builder inout(String name, Object value) {
      Value wrapped = Value.wrap(value);
      wrapped.lhsSignals();
      return port(name, wrapped, PortDirection.INOUT);
    }
    public Builder attr(String name, Object value) {
      attrs.put(name, value);
      return this;
    }

    private Builder port(String name, Value value, PortDirection direction) {
      if (ports.containsKey(name))
        throw new HdlTypeException(String.format("Instance port '%s' is already bound", name));
      ports.put(name, new Port(value, direction));
      return this;
    }

    public Instance build() { return new Instance(type, parameters, ports, attrs); }
  }
}
