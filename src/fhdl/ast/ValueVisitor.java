package fhdl.ast;

/**
 * Dispatch over the closed set of value node kinds.
 * @param <R> result of a visit
 */
public interface ValueVisitor<R> {
  R visitConst(Const value);
  R visitSignal(Signal value);
  R visitClockSignal(ClockSignal value);
  R visitResetSignal(ResetSignal value);
  R visitOperator(Operator value);
  R visitSlice(Slice value);
  R visitPart(Part value);
  R visitCat(Cat value);
  R visitRepl(Repl value);
  R visitArrayProxy(ArrayProxy value);
  R visitSample(Sample value);
  R visitInitial(Initial value);

  /** User values are visited through their lowering unless a visitor needs to see them. */
  default R visitUserValue(UserValue value) { return value.lowered().accept(this); }
}
