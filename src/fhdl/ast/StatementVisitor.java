package fhdl.ast;

/**
 * Dispatch over statement kinds.
 * @param <R> result of a visit
 */
public interface StatementVisitor<R> {
  R visitAssign(Assign statement);
  R visitSwitch(Switch statement);
}
