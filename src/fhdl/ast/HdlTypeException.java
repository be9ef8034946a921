package fhdl.ast;

/**
 * Thrown when an operand has an invalid shape or a value of the wrong kind is used to build an expression.
 */
public class HdlTypeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public HdlTypeException(String message) { super(message); }
  public HdlTypeException(String message, Throwable cause) { super(message, cause); }
}
