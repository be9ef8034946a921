package fhdl.ir;

import fhdl.ast.ArrayProxy;
import fhdl.ast.Assign;
import fhdl.ast.Cat;
import fhdl.ast.ClockSignal;
import fhdl.ast.Const;
import fhdl.ast.Initial;
import fhdl.ast.Operator;
import fhdl.ast.Part;
import fhdl.ast.Repl;
import fhdl.ast.ResetSignal;
import fhdl.ast.Sample;
import fhdl.ast.Signal;
import fhdl.ast.Slice;
import fhdl.ast.Statement;
import fhdl.ast.StatementVisitor;
import fhdl.ast.Switch;
import fhdl.ast.Value;
import fhdl.ast.ValueVisitor;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds values and statements bottom-up. Subclasses override the visit methods of the nodes they replace;
 * a node whose children are unchanged is returned as is, so untouched subexpressions stay shared.
 */
public class ValueTransformer implements ValueVisitor<Value>, StatementVisitor<Statement> {

  public Value transform(Value value) { return value.accept(this); }

  public Statement transform(Statement statement) { return statement.accept(this); }

  public List<Statement> transformAll(List<Statement> statements) {
    List<Statement> result = new ArrayList<>(statements.size());
    for (Statement statement : statements)
      result.add(transform(statement));
    return result;
  }

  /** Applies this transformer to every port binding of instance. */
  public Instance transform(Instance instance) { return instance.mapPorts(this::transform); }

  private List<Value> transformValues(List<Value> values, boolean[] changed) {
    List<Value> result = new ArrayList<>(values.size());
    for (Value value : values) {
      Value transformed = transform(value);
      changed[0] = changed[0] || transformed != value;
      result.add(transformed);
    }
    return result;
  }

  @Override
  public Value visitConst(Const value) {
    return value;
  }

  @Override
  public Value visitSignal(Signal value) {
    return value;
  }

  @Override
  public Value visitClockSignal(ClockSignal value) {
    return value;
  }

  @Override
  public Value visitResetSignal(ResetSignal value) {
    return value;
  }

  @Override
  public Value visitOperator(Operator value) {
    boolean[] changed = {false};
    List<Value> operands = transformValues(value.getOperands(), changed);
    return changed[0] ? new Operator(value.getOperator(), operands) : value;
  }

  @Override
  public Value visitSlice(Slice value) {
    Value inner = transform(value.getValue());
    return inner != value.getValue() ? new Slice(inner, value.getStart(), value.getEnd()) : value;
  }

  @Override
  public Value visitPart(Part value) {
    Value inner = transform(value.getValue());
    Value offset = transform(value.getOffset());
    if (inner == value.getValue() && offset == value.getOffset())
      return value;
    return new Part(inner, offset, value.width(), value.getStride());
  }

  @Override
  public Value visitCat(Cat value) {
    boolean[] changed = {false};
    List<Value> parts = transformValues(value.getParts(), changed);
    return changed[0] ? new Cat(parts) : value;
  }

  @Override
  public Value visitRepl(Repl value) {
    Value inner = transform(value.getValue());
    return inner != value.getValue() ? new Repl(inner, value.getCount()) : value;
  }

  @Override
  public Value visitArrayProxy(ArrayProxy value) {
    boolean[] changed = {false};
    List<Value> elems = transformValues(value.elemValues(), changed);
    Value index = transform(value.getIndex());
    if (!changed[0] && index == value.getIndex())
      return value;
    return new ArrayProxy(elems, index);
  }

  @Override
  public Value visitSample(Sample value) {
    Value inner = transform(value.getValue());
    return inner != value.getValue() ? new Sample(inner, value.getClocks(), value.getDomain()) : value;
  }

  @Override
  public Value visitInitial(Initial value) {
    return value;
  }

  @Override
  public Statement visitAssign(Assign statement) {
    Value lhs = transform(statement.getLhs());
    Value rhs = transform(statement.getRhs());
    if (lhs == statement.getLhs() && rhs == statement.getRhs())
      return statement;
    return new Assign(lhs, rhs);
  }

  @Override
  public Statement visitSwitch(Switch statement) {
    Value test = transform(statement.getTest());
    boolean changed = test != statement.getTest();
    List<Switch.Case> cases = new ArrayList<>();
    for (Switch.Case c : statement.getCases()) {
      List<Statement> statements = new ArrayList<>();
      for (Statement inner : c.statements()) {
        Statement transformed = transform(inner);
        changed = changed || transformed != inner;
        statements.add(transformed);
      }
      cases.add(new Switch.Case(c.patterns(), statements));
    }
    return changed ? new Switch(test, cases) : statement;
  }
}
