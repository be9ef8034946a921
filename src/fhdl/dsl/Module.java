package fhdl.dsl;

import fhdl.ast.Cat;
import fhdl.ast.DomainException;
import fhdl.ast.Domains;
import fhdl.ast.HdlTypeException;
import fhdl.ast.PatternMatcher;
import fhdl.ast.Signal;
import fhdl.ast.Statement;
import fhdl.ast.Switch;
import fhdl.ast.Value;
import fhdl.build.Platform;
import fhdl.ir.ClockDomain;
import fhdl.ir.Elaboratable;
import fhdl.ir.Fragment;
import fhdl.ir.Instance;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Imperative builder for a fragment.
 *
 * <pre>
 * Module m = new Module();
 * m.when(sel.equalTo(0), () -&gt; m.comb(o.eq(a.add(b))))
 *  .elseWhen(sel.equalTo(1), () -&gt; m.comb(o.eq(a.sub(b))))
 *  .otherwise(() -&gt; m.comb(o.eq(0)));
 * </pre>
 *
 * Statements added inside a body only take effect when the conditions of that body hold. A conditional chain is closed
 * by the next statement or control block added at the same level.
 */
public class Module implements Elaboratable {
  protected static final Logger logger = LogManager.getLogger();

  private record Submodule(String name, Object elaboratable) {}
  private record NamedInstance(String name, Instance instance) {}

  /** Statements of one nesting level, by domain, plus the conditional chain that is still open at that level. */
  private static final class Frame {
    final Map<String, List<Statement>> statements = new LinkedHashMap<>();
    PendingControl pending = null;
  }

  private interface PendingControl {
    /** Lowers the control block into per-domain statements. */
    Map<String, List<Statement>> lower();
  }

  private final Deque<Frame> frames = new ArrayDeque<>();
  private final Map<Signal, String> driving = new LinkedHashMap<>();
  private final List<Submodule> submodules = new ArrayList<>();
  private final Set<String> submoduleNames = new LinkedHashSet<>();
  private final List<NamedInstance> instances = new ArrayList<>();
  private final Map<String, ClockDomain> domains = new LinkedHashMap<>();
  private boolean flatten = false;

  public Module() { frames.push(new Frame()); }

  // Statements

  /** Adds combinational statements. */
  public Module comb(Statement... statements) { return domain(Domains.COMB, List.of(statements)); }
  public Module comb(Collection<? extends Statement> statements) { return domain(Domains.COMB, statements); }

  /** Adds statements clocked by the sync domain. */
  public Module sync(Statement... statements) { return domain(Domains.SYNC, List.of(statements)); }
  public Module sync(Collection<? extends Statement> statements) { return domain(Domains.SYNC, statements); }

  public Module domain(String domain, Statement... statements) { return domain(domain, List.of(statements)); }

  /**
   * Adds statements to a domain.
   * @throws DomainException if a signal assigned by statements is already driven from another domain
   */
  public Module domain(String domain, Collection<? extends Statement> statements) {
    if (domain == null)
      throw new HdlTypeException("Domain name must be a string, not 'null'");
    Frame frame = flush();
    for (Statement statement : statements) {
      for (Signal signal : statement.lhsSignals()) {
        String previous = driving.putIfAbsent(signal, domain);
        if (previous != null && !previous.equals(domain))
          throw new DomainException(String.format("Driver-driver conflict: trying to drive %s from d.%s, but it is already driven from d.%s",
                                                  signal, domain, previous));
      }
      frame.statements.computeIfAbsent(domain, d -> new ArrayList<>()).add(statement);
    }
    return this;
  }

  // Control flow

  /**
   * Opens a conditional chain. A condition wider than one bit is true if any bit is set.
   * @param condition the condition
   * @param body adds the statements active while condition holds
   * @return the chain, to add elseWhen and otherwise branches
   */
  public When when(Object condition, Runnable body) {
    Frame frame = flush();
    When chain = new When();
    chain.add(condition, body);
    frame.pending = chain;
    return chain;
  }

  /**
   * Opens a switch over value. Cases are tested in order; the first matching case wins.
   */
  public SwitchOn switchOn(Object value) {
    Frame frame = flush();
    SwitchOn chain = new SwitchOn(Value.wrap(value));
    frame.pending = chain;
    return chain;
  }

  private Map<String, List<Statement>> runBody(Runnable body) {
    Frame frame = new Frame();
    frames.push(frame);
    try {
      body.run();
      flush();
    } finally {
      frames.pop();
    }
    return frame.statements;
  }

  /** Lowers the open control block of the innermost level, if any. */
  private Frame flush() {
    Frame frame = frames.peek();
    if (frame.pending != null) {
      PendingControl pending = frame.pending;
      frame.pending = null;
      pending.lower().forEach((domain, list) -> frame.statements.computeIfAbsent(domain, d -> new ArrayList<>()).addAll(list));
    }
    return frame;
  }

  private void checkPending(PendingControl control, String operation) {
    if (frames.peek().pending != control)
      throw new IllegalStateException(String.format("%s must directly follow the block it continues", operation));
  }

  /**
   * An if/else-if/else chain, lowered into one {@link Switch} per domain over the concatenation of all conditions.
   */
  public final class When implements PendingControl {
    private final List<Value> conditions = new ArrayList<>();
    private final List<Map<String, List<Statement>>> bodies = new ArrayList<>();
    private Map<String, List<Statement>> otherwiseBody = null;

    private When() {}

    private void add(Object condition, Runnable body) {
      Value test = Value.wrap(condition);
      if (test.width() != 1)
        test = test.bool();
      conditions.add(test);
      bodies.add(runBody(body));
    }

    /**
     * @throws IllegalStateException if the chain was already closed by otherwise or by a later statement
     */
    public When elseWhen(Object condition, Runnable body) {
      checkPending(this, "elseWhen");
      add(condition, body);
      return this;
    }

    /**
     * @throws IllegalStateException if the chain was already closed
     */
    public void otherwise(Runnable body) {
      checkPending(this, "otherwise");
      otherwiseBody = runBody(body);
      flush();
    }

    @Override
    public Map<String, List<Statement>> lower() {
      int n = conditions.size();
      Set<String> usedDomains = new LinkedHashSet<>();
      bodies.forEach(body -> usedDomains.addAll(body.keySet()));
      if (otherwiseBody != null)
        usedDomains.addAll(otherwiseBody.keySet());
      Map<String, List<Statement>> result = new LinkedHashMap<>();
      for (String domain : usedDomains) {
        List<Switch.Case> cases = new ArrayList<>();
        for (int i = 0; i < n; ++i) {
          String pattern = "-".repeat(n - i - 1) + "1" + "0".repeat(i);
          cases.add(new Switch.Case(List.of(pattern), bodies.get(i).getOrDefault(domain, List.of())));
        }
        if (otherwiseBody != null)
          cases.add(new Switch.Case(List.of(), otherwiseBody.getOrDefault(domain, List.of())));
        result.put(domain, List.of(new Switch(new Cat(conditions), cases)));
      }
      return result;
    }
  }

  /**
   * A switch over one value. Patterns are integers, bit strings or enumeration constants, see {@link PatternMatcher}.
   */
  public final class SwitchOn implements PendingControl {
    private final Value test;
    private final List<List<String>> patterns = new ArrayList<>();
    private final List<Map<String, List<Statement>>> bodies = new ArrayList<>();

    private SwitchOn(Value test) { this.test = test; }

    public SwitchOn match(Object pattern, Runnable body) { return match(List.of(pattern), body); }

    /**
     * Adds a case matching any of patterns. Integer patterns wider than the value never match; a case left with no
     * pattern is dropped.
     * @throws IllegalStateException if the switch was already closed
     */
    public SwitchOn match(List<?> casePatterns, Runnable body) {
      checkPending(this, "match");
      List<String> normalized = new ArrayList<>();
      for (Object pattern : casePatterns) {
        Optional<String> bits = PatternMatcher.normalize(pattern, test.width());
        bits.ifPresent(normalized::add);
      }
      Map<String, List<Statement>> statements = runBody(body);
      if (!casePatterns.isEmpty() && normalized.isEmpty())
        return this;
      patterns.add(normalized);
      bodies.add(statements);
      return this;
    }

    /** Adds the default case and closes the switch. */
    public void otherwise(Runnable body) {
      checkPending(this, "otherwise");
      patterns.add(List.of());
      bodies.add(runBody(body));
      flush();
    }

    @Override
    public Map<String, List<Statement>> lower() {
      Set<String> usedDomains = new LinkedHashSet<>();
      bodies.forEach(body -> usedDomains.addAll(body.keySet()));
      Map<String, List<Statement>> result = new LinkedHashMap<>();
      for (String domain : usedDomains) {
        List<Switch.Case> cases = new ArrayList<>();
        for (int i = 0; i < patterns.size(); ++i)
          cases.add(new Switch.Case(patterns.get(i), bodies.get(i).getOrDefault(domain, List.of())));
        result.put(domain, List.of(new Switch(test, cases)));
      }
      return result;
    }
  }

  // Hierarchy

  public Module submodule(Object elaboratable) { return submodule(null, elaboratable); }

  /**
   * @param name name in the hierarchy, or null
   * @param elaboratable a Fragment or Elaboratable
   * @throws HdlTypeException if elaboratable cannot be elaborated or name is taken
   */
  public Module submodule(String name, Object elaboratable) {
    if (!(elaboratable instanceof Elaboratable))
      throw new HdlTypeException(String.format("Trying to add %s, which does not implement Elaboratable, as a submodule", elaboratable));
    if (name != null && !submoduleNames.add(name))
      throw new HdlTypeException(String.format("Submodule named '%s' already exists", name));
    submodules.add(new Submodule(name, elaboratable));
    return this;
  }

  public Module instance(String name, Instance instance) {
    instances.add(new NamedInstance(name, instance));
    return this;
  }

  /**
   * @throws DomainException if a domain of the same name was already added
   */
  public Module addDomain(ClockDomain... added) {
    for (ClockDomain domain : added) {
      if (domains.putIfAbsent(domain.getName(), domain) != null)
        throw new DomainException(String.format("Clock domain named '%s' already exists", domain.getName()));
    }
    return this;
  }

  public Module setFlatten(boolean flatten) {
    this.flatten = flatten;
    return this;
  }

  /**
   * Builds a new fragment from the statements, submodules, instances and domains added so far.
   * Submodules are elaborated through {@link Fragment#get(Object, Platform)}.
   */
  @Override
  public Fragment elaborate(Platform platform) {
    Frame root = flush();
    Fragment fragment = new Fragment();
    for (Submodule submodule : submodules)
      fragment.addSubfragment(Fragment.get(submodule.elaboratable(), platform), submodule.name());
    root.statements.forEach(fragment::addStatements);
    for (NamedInstance named : instances)
      fragment.addInstance(named.name(), named.instance());
    fragment.addDomains(domains.values().toArray(new ClockDomain[0]));
    fragment.setFlatten(flatten);
    logger.debug("Elaborated module with {} submodules and {} instances", submodules.size(), instances.size());
    return fragment;
  }
}
