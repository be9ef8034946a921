package fhdl.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Selects the statements of the first case whose patterns match the test value.
 * Patterns are bit strings as accepted by {@link PatternMatcher}, each exactly as wide as the test value.
 * A case without patterns is the default case and matches everything.
 */
public final class Switch extends Statement {
  /**
   * @param patterns bit strings, empty for the default case
   * @param statements statements active when a pattern matches
   */
  public record Case(List<String> patterns, List<Statement> statements) {
    public Case {
      patterns = List.copyOf(patterns);
      statements = List.copyOf(statements);
    }
    public boolean isDefault() { return patterns.isEmpty(); }
  }

  private final Value test;
  private final List<Case> cases;

  /**
   * @throws HdlTypeException if a pattern contains characters other than 0, 1 and -
   * @throws HdlRangeException if a pattern is not as wide as test
   */
  public Switch(Object test, List<Case> cases) {
    this.test = Value.wrap(test);
    List<Case> normalized = new ArrayList<>(cases.size());
    for (Case c : cases) {
      List<String> patterns = new ArrayList<>(c.patterns().size());
      for (String pattern : c.patterns())
        patterns.add(PatternMatcher.normalize(pattern, this.test.width()).get());
      normalized.add(new Case(patterns, c.statements()));
    }
    this.cases = List.copyOf(normalized);
  }

  public Value getTest() { return test; }
  public List<Case> getCases() { return cases; }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> signals = Value.signalSet();
    for (Case c : cases)
      signals.addAll(unionLhs(c.statements()));
    return signals;
  }

  @Override
  public Set<Signal> rhsSignals() {
    Set<Signal> signals = test.rhsSignals();
    for (Case c : cases)
      signals.addAll(unionRhs(c.statements()));
    return signals;
  }

  @Override
  public <R> R accept(StatementVisitor<R> visitor) {
    return visitor.visitSwitch(this);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("(switch ").append(test);
    for (Case c : cases) {
      String body = c.statements().stream().map(Statement::toString).collect(Collectors.joining(" "));
      builder.append(' ');
      if (c.isDefault())
        builder.append("(default");
      else
        builder.append("(case ").append(String.join(" ", c.patterns()));
      if (!body.isEmpty())
        builder.append(' ').append(body);
      builder.append(')');
    }
    return builder.append(')').toString();
  }
}
