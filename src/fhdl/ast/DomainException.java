package fhdl.ast;

/**
 * Thrown for invalid uses of clock domains, e.g. asking for the clock of the combinational domain.
 */
public class DomainException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public DomainException(String message) { super(message); }
}
