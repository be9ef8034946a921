package fhdl.ast;

/**
 * Thrown when a static index, slice bound or match pattern does not fit the width of the addressed value.
 */
public class HdlRangeException extends IndexOutOfBoundsException {
  private static final long serialVersionUID = 1L;

  public HdlRangeException(String message) { super(message); }

  public HdlRangeException(String message, Throwable cause) {
    super(message);
    initCause(cause);
  }
}
