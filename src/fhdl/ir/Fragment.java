package fhdl.ir;

import fhdl.ast.ClockSignal;
import fhdl.ast.Domains;
import fhdl.ast.DomainException;
import fhdl.ast.HdlTypeException;
import fhdl.ast.HdlWarning;
import fhdl.ast.HdlWarnings;
import fhdl.ast.ResetSignal;
import fhdl.ast.Signal;
import fhdl.ast.Statement;
import fhdl.ast.Value;
import fhdl.build.Platform;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A node of the elaborated design: ports, statements grouped by domain, the signals driven from each domain,
 * primitive instances, child fragments, clock domains and a flatten hint for emitters.
 *
 * A fragment owns its statement lists and its children; the values its statements refer to are shared.
 */
public class Fragment implements Elaboratable {
  protected static final Logger logger = LogManager.getLogger();

  /** A child fragment, optionally named for the hierarchy. */
  public record Subfragment(Fragment fragment, String name) {}
  /** A primitive instance, optionally named. */
  public record NamedInstance(String name, Instance instance) {}

  private final Map<Signal, PortDirection> ports = new LinkedHashMap<>();
  private final Map<String, List<Statement>> statements = new LinkedHashMap<>();
  private final Map<String, Set<Signal>> drivers = new LinkedHashMap<>();
  private final List<NamedInstance> instances = new ArrayList<>();
  private final List<Subfragment> subfragments = new ArrayList<>();
  private final Map<String, ClockDomain> domains = new LinkedHashMap<>();
  private boolean flatten = false;

  // Ports

  public void addPort(Signal signal, PortDirection direction) { ports.put(signal, direction); }

  public void addPorts(Collection<? extends Signal> signals, PortDirection direction) {
    for (Signal signal : signals)
      ports.put(signal, direction);
  }

  /**
   * @param directions the directions to include; all directions if none given
   * @return the ports with one of the directions, in insertion order
   */
  public Map<Signal, PortDirection> ports(PortDirection... directions) {
    Set<PortDirection> wanted = directions.length == 0 ? EnumSet.allOf(PortDirection.class) : EnumSet.of(directions[0], directions);
    Map<Signal, PortDirection> result = new LinkedHashMap<>();
    ports.forEach((signal, direction) -> {
      if (wanted.contains(direction))
        result.put(signal, direction);
    });
    return result;
  }

  // Statements and drivers

  /**
   * Appends statements to a domain and records their left-hand side signals as driven from that domain.
   * @throws DomainException if a signal is already driven from another domain of this fragment
   */
  public void addStatements(String domain, Collection<? extends Statement> added) {
    for (Statement statement : added) {
      for (Signal signal : statement.lhsSignals())
        addDriver(signal, domain);
    }
    statements.computeIfAbsent(domain, d -> new ArrayList<>()).addAll(added);
  }

  /**
   * @throws DomainException if signal is already driven from another domain of this fragment
   */
  public void addDriver(Signal signal, String domain) {
    for (Map.Entry<String, Set<Signal>> entry : drivers.entrySet()) {
      if (!entry.getKey().equals(domain) && entry.getValue().contains(signal))
        throw new DomainException(String.format("Driver-driver conflict: trying to drive %s from d.%s, but it is already driven from d.%s",
                                                signal, domain, entry.getKey()));
    }
    drivers.computeIfAbsent(domain, d -> new LinkedHashSet<>()).add(signal);
  }

  /** @return the domains with statements, comb included */
  public Set<String> statementDomains() { return Collections.unmodifiableSet(statements.keySet()); }

  public List<Statement> statements(String domain) {
    return Collections.unmodifiableList(statements.getOrDefault(domain, List.of()));
  }

  /** @return all statements of all domains */
  public List<Statement> allStatements() {
    return statements.values().stream().flatMap(List::stream).collect(Collectors.toList());
  }

  /** @return the signals driven from each domain */
  public Map<String, Set<Signal>> drivers() {
    Map<String, Set<Signal>> result = new LinkedHashMap<>();
    drivers.forEach((domain, signals) -> result.put(domain, Collections.unmodifiableSet(signals)));
    return result;
  }

  /** @return all signals driven by statements of this fragment */
  public Set<Signal> drivenSignals() {
    Set<Signal> result = new LinkedHashSet<>();
    drivers.values().forEach(result::addAll);
    return result;
  }

  // Hierarchy

  public void addInstance(String name, Instance instance) { instances.add(new NamedInstance(name, instance)); }
  public List<NamedInstance> instances() { return Collections.unmodifiableList(instances); }

  public void addSubfragment(Fragment fragment, String name) { subfragments.add(new Subfragment(fragment, name)); }
  public void addSubfragment(Fragment fragment) { addSubfragment(fragment, null); }
  public List<Subfragment> subfragments() { return Collections.unmodifiableList(subfragments); }

  /**
   * @throws DomainException if a different domain of the same name is already present
   */
  public void addDomains(ClockDomain... added) {
    for (ClockDomain domain : added) {
      ClockDomain existing = domains.get(domain.getName());
      if (existing != null && existing != domain)
        throw new DomainException(String.format("Domain '%s' is already defined", domain.getName()));
      domains.put(domain.getName(), domain);
    }
  }
  public Map<String, ClockDomain> domains() { return Collections.unmodifiableMap(domains); }

  public boolean isFlatten() { return flatten; }
  /** Asks emitters to inline this fragment into its parent. */
  public void setFlatten(boolean flatten) { this.flatten = flatten; }

  /**
   * @return every signal this fragment refers to through its ports, statements or instances, each once
   */
  public Set<Signal> signals() {
    Set<Signal> result = new LinkedHashSet<>(ports.keySet());
    for (Statement statement : allStatements()) {
      result.addAll(statement.lhsSignals());
      result.addAll(statement.rhsSignals());
    }
    for (NamedInstance named : instances) {
      for (Instance.Port port : named.instance().getPorts().values())
        result.addAll(port.value().rhsSignals());
    }
    return result;
  }

  @Override
  public Elaboratable elaborate(Platform platform) {
    return this;
  }

  // Elaboration

  private static final ThreadLocal<ElaborationSession> session = new ThreadLocal<>();

  /**
   * Elaborates a design object into a fragment, following delegation until a Fragment is produced.
   * Within one top-level call every object is elaborated at most once; asking for the same object again returns the same
   * fragment.
   * @param obj a Fragment or an Elaboratable
   * @param platform the target platform, may be null
   * @return the fragment
   * @throws HdlTypeException if obj cannot be elaborated or its elaboration depends on itself
   */
  public static Fragment get(Object obj, Platform platform) {
    ElaborationSession current = session.get();
    if (current != null)
      return current.elaborate(obj, platform);
    current = new ElaborationSession();
    session.set(current);
    try {
      return current.elaborate(obj, platform);
    } finally {
      session.remove();
    }
  }

  private static final class ElaborationSession {
    private final Map<Object, Fragment> elaborated = new IdentityHashMap<>();
    private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

    Fragment elaborate(Object obj, Platform platform) {
      List<Object> chain = new ArrayList<>();
      Object current = obj;
      Fragment fragment;
      while (true) {
        if (current == null) {
          if (chain.isEmpty())
            throw new HdlTypeException("Object null cannot be elaborated");
          throw new HdlTypeException(String.format("Elaboratable %s returned null", chain.get(chain.size() - 1)));
        }
        if (current instanceof Fragment) {
          fragment = (Fragment)current;
          break;
        }
        Fragment known = elaborated.get(current);
        if (known != null) {
          fragment = known;
          break;
        }
        if (!(current instanceof Elaboratable))
          throw new HdlTypeException(String.format("Object %s cannot be elaborated", current));
        if (!inProgress.add(current))
          throw new HdlTypeException(String.format("Elaboratable %s is part of an elaboration cycle", current));
        chain.add(current);
        logger.debug("Elaborating {}", current);
        current = ((Elaboratable)current).elaborate(platform);
      }
      for (Object done : chain) {
        elaborated.put(done, fragment);
        inProgress.remove(done);
      }
      return fragment;
    }
  }

  // Preparation

  /**
   * Produces a closed copy of this fragment hierarchy for emitters.
   *
   * Domains are propagated to the top and back down, and domains that are used but never defined are created. Clock and
   * reset pseudo-signals are then replaced by the domain signals, conflicting drivers are resolved by flattening, and port
   * directions are resolved. The clock and reset of every created domain become ports.
   * @param requestedPorts signals (or clock/reset pseudo-signals) that must be visible at the top
   * @return the prepared fragment; this fragment is not modified
   * @throws HdlTypeException if a requested port is not a signal
   * @throws DomainException on conflicting or unresolvable domains
   */
  public Fragment prepare(Collection<? extends Value> requestedPorts) {
    for (Value port : requestedPorts) {
      if (!(port instanceof Signal || port instanceof ClockSignal || port instanceof ResetSignal))
        throw new HdlTypeException(String.format("Only signals may be added as ports, not %s", port));
    }
    Fragment fragment = copy();
    fragment.propagateDomainsUp(new ArrayList<>(List.of("top")));
    List<ClockDomain> created = fragment.createMissingDomains();
    fragment.propagateDomainsDown();
    fragment.lowerDomains();
    fragment.resolveHierarchyConflicts(new ArrayList<>(List.of("top")));

    Set<Signal> ports = new LinkedHashSet<>();
    for (ClockDomain domain : created) {
      ports.add(domain.getClk());
      if (!domain.isResetLess())
        ports.add(domain.getRst());
    }
    DomainLowerer lowerer = new DomainLowerer(fragment.domains);
    for (Value port : requestedPorts) {
      Value lowered = lowerer.transform(port);
      if (lowered instanceof Signal)
        ports.add((Signal)lowered);
    }
    fragment.propagatePorts(ports);
    fragment.resolveTopLevelPorts(ports);
    if (logger.isTraceEnabled())
      logger.trace("Prepared fragment:\n{}", FragmentInfo.format(fragment));
    return fragment;
  }

  public Fragment prepare(Value... requestedPorts) { return prepare(List.of(requestedPorts)); }

  /** Copies the hierarchy. A fragment used at several places is copied for each of them. */
  private Fragment copy() {
    Fragment result = new Fragment();
    result.ports.putAll(ports);
    statements.forEach((domain, list) -> result.statements.put(domain, new ArrayList<>(list)));
    drivers.forEach((domain, signals) -> result.drivers.put(domain, new LinkedHashSet<>(signals)));
    result.instances.addAll(instances);
    for (Subfragment sub : subfragments)
      result.subfragments.add(new Subfragment(sub.fragment().copy(), sub.name()));
    result.domains.putAll(domains);
    result.flatten = flatten;
    return result;
  }

  private static String hierarchyName(List<String> hierarchy) { return String.join(".", hierarchy); }

  private static String subfragmentName(Subfragment sub, int index) {
    return sub.name() != null ? sub.name() : "<unnamed #" + index + ">";
  }

  private void propagateDomainsUp(List<String> hierarchy) {
    Map<String, ClockDomain> seen = new LinkedHashMap<>();
    Map<String, List<String>> definedBy = new LinkedHashMap<>();
    for (int i = 0; i < subfragments.size(); ++i) {
      Subfragment sub = subfragments.get(i);
      List<String> subHierarchy = new ArrayList<>(hierarchy);
      subHierarchy.add(subfragmentName(sub, i));
      sub.fragment().propagateDomainsUp(subHierarchy);
      for (ClockDomain domain : sub.fragment().domains.values()) {
        ClockDomain previous = seen.putIfAbsent(domain.getName(), domain);
        definedBy.computeIfAbsent(domain.getName(), n -> new ArrayList<>()).add(subfragmentName(sub, i));
        if (previous != null && previous != domain)
          throw new DomainException(String.format("Domain '%s' is defined by subfragments %s of fragment '%s'", domain.getName(),
                                                  definedBy.get(domain.getName()), hierarchyName(hierarchy)));
      }
    }
    for (ClockDomain domain : seen.values()) {
      ClockDomain own = domains.get(domain.getName());
      if (own != null && own != domain)
        throw new DomainException(String.format("Domain '%s' of fragment '%s' is also defined by one of its subfragments",
                                                domain.getName(), hierarchyName(hierarchy)));
      domains.put(domain.getName(), domain);
    }
  }

  private void propagateDomainsDown() {
    for (Subfragment sub : subfragments) {
      for (ClockDomain domain : domains.values())
        sub.fragment().domains.putIfAbsent(domain.getName(), domain);
      sub.fragment().propagateDomainsDown();
    }
  }

  private void collectUsedDomains(Set<String> used) {
    DomainCollector collector = new DomainCollector(used);
    for (Map.Entry<String, List<Statement>> entry : statements.entrySet()) {
      if (!entry.getKey().equals(Domains.COMB))
        used.add(entry.getKey());
      entry.getValue().forEach(collector::transform);
    }
    for (NamedInstance named : instances)
      collector.transform(named.instance());
    for (Subfragment sub : subfragments)
      sub.fragment().collectUsedDomains(used);
  }

  private List<ClockDomain> createMissingDomains() {
    Set<String> used = new LinkedHashSet<>();
    collectUsedDomains(used);
    List<ClockDomain> created = new ArrayList<>();
    for (String name : used) {
      if (domains.containsKey(name))
        continue;
      logger.debug("Creating missing domain '{}'", name);
      ClockDomain domain = new ClockDomain(name);
      domains.put(name, domain);
      created.add(domain);
    }
    return created;
  }

  /**
   * Flattens children into this fragment wherever a signal is driven from more than one fragment, or a child asks to
   * be flattened.
   * @return the signals driven anywhere in this hierarchy
   */
  private Set<Signal> resolveHierarchyConflicts(List<String> hierarchy) {
    Map<Signal, List<String>> driverNames = new LinkedHashMap<>();
    Map<Signal, Set<Subfragment>> driverSubfragments = new LinkedHashMap<>();
    Set<Subfragment> toFlatten = new LinkedHashSet<>();
    for (Signal signal : drivenSignals()) {
      driverNames.computeIfAbsent(signal, s -> new ArrayList<>()).add(hierarchyName(hierarchy));
      driverSubfragments.computeIfAbsent(signal, s -> new LinkedHashSet<>());
    }
    for (int i = 0; i < subfragments.size(); ++i) {
      Subfragment sub = subfragments.get(i);
      List<String> subHierarchy = new ArrayList<>(hierarchy);
      subHierarchy.add(subfragmentName(sub, i));
      if (sub.fragment().flatten)
        toFlatten.add(sub);
      for (Signal signal : sub.fragment().resolveHierarchyConflicts(subHierarchy)) {
        driverNames.computeIfAbsent(signal, s -> new ArrayList<>()).add(hierarchyName(subHierarchy));
        driverSubfragments.computeIfAbsent(signal, s -> new LinkedHashSet<>()).add(sub);
      }
    }
    for (Map.Entry<Signal, List<String>> entry : driverNames.entrySet()) {
      if (entry.getValue().size() < 2)
        continue;
      HdlWarnings.warn(HdlWarning.Kind.MULTIPLE_DRIVERS,
                       String.format("Signal '%s' is driven from multiple fragments: %s; hierarchy will be flattened",
                                     entry.getKey().getName(), String.join(", ", entry.getValue())));
      toFlatten.addAll(driverSubfragments.get(entry.getKey()));
    }
    if (toFlatten.isEmpty())
      return driverNames.keySet();
    for (Subfragment sub : toFlatten)
      mergeSubfragment(sub);
    return resolveHierarchyConflicts(hierarchy);
  }

  private void mergeSubfragment(Subfragment sub) {
    subfragments.remove(sub);
    Fragment child = sub.fragment();
    child.ports.forEach(ports::putIfAbsent);
    child.statements.forEach((domain, list) -> statements.computeIfAbsent(domain, d -> new ArrayList<>()).addAll(list));
    child.drivers.forEach((domain, signals) -> signals.forEach(signal -> addDriver(signal, domain)));
    instances.addAll(child.instances);
    subfragments.addAll(child.subfragments);
    child.domains.forEach(domains::putIfAbsent);
  }

  private void lowerDomains() {
    DomainLowerer lowerer = new DomainLowerer(domains);
    statements.replaceAll((domain, list) -> lowerer.transformAll(list));
    // Clock and reset pseudo-signals only become drivers once lowered.
    statements.forEach((domain, list) -> list.forEach(statement -> statement.lhsSignals().forEach(signal -> addDriver(signal, domain))));
    instances.replaceAll(named -> new NamedInstance(named.name(), lowerer.transform(named.instance())));
    for (Subfragment sub : subfragments)
      sub.fragment().lowerDomains();
  }

  private record PortSets(Set<Signal> ins, Set<Signal> outs, Set<Signal> inouts) {}

  /**
   * Resolves port directions bottom-up. A signal used but not driven by a fragment or its children is an input; a signal
   * asked for by the parent and driven here is an output; inouts of primitives propagate to the top.
   */
  private PortSets propagatePorts(Set<Signal> requested) {
    Set<Signal> selfDriven = new LinkedHashSet<>();
    Set<Signal> selfUsed = new LinkedHashSet<>();
    Set<Signal> inouts = new LinkedHashSet<>();
    for (Statement statement : allStatements()) {
      selfDriven.addAll(statement.lhsSignals());
      selfUsed.addAll(statement.rhsSignals());
    }
    for (String domain : statements.keySet()) {
      if (domain.equals(Domains.COMB))
        continue;
      ClockDomain clockDomain = domains.get(domain);
      selfUsed.add(clockDomain.getClk());
      if (!clockDomain.isResetLess())
        selfUsed.add(clockDomain.getRst());
    }
    for (NamedInstance named : instances) {
      for (Instance.Port port : named.instance().getPorts().values()) {
        switch (port.direction()) {
        case INPUT:
          selfUsed.addAll(port.value().rhsSignals());
          break;
        case OUTPUT:
          selfDriven.addAll(port.value().lhsSignals());
          selfUsed.addAll(nonDrivenReads(port.value()));
          break;
        case INOUT:
          inouts.addAll(port.value().lhsSignals());
          break;
        }
      }
    }

    Set<Signal> ins = new LinkedHashSet<>(selfUsed);
    ins.removeAll(selfDriven);
    Set<Signal> outs = new LinkedHashSet<>(requested);
    outs.retainAll(selfDriven);

    // A child provides what this fragment and its other children use.
    List<Set<Signal>> subUses = new ArrayList<>();
    for (Subfragment sub : subfragments) {
      Set<Signal> uses = new LinkedHashSet<>();
      sub.fragment().collectUses(uses);
      subUses.add(uses);
    }
    Set<Signal> subOuts = new LinkedHashSet<>();
    for (int i = 0; i < subfragments.size(); ++i) {
      Set<Signal> subRequested = new LinkedHashSet<>(selfUsed);
      subRequested.addAll(requested);
      for (int j = 0; j < subfragments.size(); ++j) {
        if (j != i)
          subRequested.addAll(subUses.get(j));
      }
      PortSets subPorts = subfragments.get(i).fragment().propagatePorts(subRequested);
      Set<Signal> subIns = new LinkedHashSet<>(subPorts.ins());
      subIns.removeAll(selfDriven);
      ins.addAll(subIns);
      subOuts.addAll(subPorts.outs());
      inouts.addAll(subPorts.inouts());
    }
    ins.removeAll(subOuts);
    Set<Signal> provided = new LinkedHashSet<>(requested);
    provided.retainAll(subOuts);
    outs.addAll(provided);
    ins.removeAll(inouts);
    outs.removeAll(inouts);

    addPorts(inouts, PortDirection.INOUT);
    addPorts(ins, PortDirection.INPUT);
    addPorts(outs, PortDirection.OUTPUT);
    return new PortSets(ports(PortDirection.INPUT).keySet(), ports(PortDirection.OUTPUT).keySet(), ports(PortDirection.INOUT).keySet());
  }

  /** Collects the signals read anywhere in this hierarchy, clocks and resets of clocked domains included. */
  private void collectUses(Set<Signal> uses) {
    for (Statement statement : allStatements())
      uses.addAll(statement.rhsSignals());
    for (String domain : statements.keySet()) {
      ClockDomain clockDomain = domains.get(domain);
      if (domain.equals(Domains.COMB) || clockDomain == null)
        continue;
      uses.add(clockDomain.getClk());
      if (!clockDomain.isResetLess())
        uses.add(clockDomain.getRst());
    }
    for (NamedInstance named : instances) {
      for (Instance.Port port : named.instance().getPorts().values()) {
        if (port.direction() == PortDirection.INPUT)
          uses.addAll(port.value().rhsSignals());
        else if (port.direction() == PortDirection.OUTPUT)
          uses.addAll(nonDrivenReads(port.value()));
      }
    }
    for (Subfragment sub : subfragments)
      sub.fragment().collectUses(uses);
  }

  private static Set<Signal> nonDrivenReads(Value value) {
    Set<Signal> reads = value.rhsSignals();
    reads.removeAll(value.lhsSignals());
    return reads;
  }

  /**
   * At the top, a requested port that is read somewhere in the hierarchy as well as driven is bidirectional,
   * and a requested port that nothing touches is an input.
   */
  private void resolveTopLevelPorts(Set<Signal> requested) {
    Set<Signal> readAnywhere = new LinkedHashSet<>();
    collectReads(readAnywhere);
    for (Signal signal : requested) {
      PortDirection direction = ports.get(signal);
      if (direction == null)
        ports.put(signal, PortDirection.INPUT);
      else if (direction == PortDirection.OUTPUT && readAnywhere.contains(signal))
        ports.put(signal, PortDirection.INOUT);
    }
  }

  private void collectReads(Set<Signal> reads) {
    for (Statement statement : allStatements())
      reads.addAll(statement.rhsSignals());
    for (NamedInstance named : instances) {
      for (Instance.Port port : named.instance().getPorts().values()) {
        if (port.direction() == PortDirection.INPUT)
          reads.addAll(port.value().rhsSignals());
      }
    }
    for (Subfragment sub : subfragments)
      sub.fragment().collectReads(reads);
  }

  /** Records the domains of clock and reset pseudo-signals without changing anything. */
  private static final class DomainCollector extends ValueTransformer {
    private final Set<String> used;

    DomainCollector(Set<String> used) { this.used = used; }

    @Override
    public Value visitClockSignal(ClockSignal value) {
      used.add(value.getDomain());
      return value;
    }

    @Override
    public Value visitResetSignal(ResetSignal value) {
      used.add(value.getDomain());
      return value;
    }
  }

  @Override
  public String toString() {
    return String.format("(fragment %d statements, %d instances, %d subfragments)", allStatements().size(), instances.size(),
                         subfragments.size());
  }
}
