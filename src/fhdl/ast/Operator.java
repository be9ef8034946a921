package fhdl.ast;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Application of a unary, binary or ternary operator. The result shape follows the promotion rules in {@link Shape}.
 *
 * Unary: {@code ~ - b r| r& r^}. Binary: {@code + - * & | ^ << >> == != < <= > >=}. Ternary: {@code m} (selector, if true, if false).
 */
public final class Operator extends Value {
  private final String operator;
  private final List<Value> operands;
  private final Shape shape;

  public Operator(String operator, Value... operands) { this(operator, List.of(operands)); }

  public Operator(String operator, List<Value> operands) {
    this.operator = operator;
    this.operands = List.copyOf(operands);
    this.shape = inferShape();
  }

  private Shape inferShape() {
    if (operands.size() == 1) {
      Shape a = operands.get(0).shape();
      switch (operator) {
      case "~":
        return a;
      case "-":
        return a.isSigned() ? a : Shape.signed(a.getWidth() + 1);
      case "b":
      case "r|":
      case "r&":
      case "r^":
        return Shape.unsigned(1);
      default:
        break;
      }
    } else if (operands.size() == 2) {
      Shape a = operands.get(0).shape();
      Shape b = operands.get(1).shape();
      switch (operator) {
      case "+":
      case "-":
        return a.sum(b);
      case "*":
        return a.product(b);
      case "&":
      case "|":
      case "^":
        return a.unify(b);
      case "<<":
        return a.shiftLeft(b);
      case ">>":
        return a.shiftRight(b);
      case "==":
      case "!=":
      case "<":
      case "<=":
      case ">":
      case ">=":
        return Shape.unsigned(1);
      default:
        break;
      }
    } else if (operands.size() == 3 && operator.equals("m")) {
      if (operands.get(0).width() != 1)
        throw new HdlTypeException(String.format("Multiplexer selector %s must be 1 bit wide", operands.get(0)));
      return operands.get(1).shape().unify(operands.get(2).shape());
    }
    throw new HdlTypeException(String.format("Operator '%s' cannot be applied to %d operands", operator, operands.size()));
  }

  public String getOperator() { return operator; }
  public List<Value> getOperands() { return Collections.unmodifiableList(operands); }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public Set<Signal> rhsSignals() {
    return unionRhs(operands);
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitOperator(this);
  }

  @Override
  public String toString() {
    return String.format("(%s %s)", operator, operands.stream().map(Value::toString).collect(Collectors.joining(" ")));
  }
}
