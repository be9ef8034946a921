package fhdl.ast;

/**
 * Thrown when an {@link Array} is mutated after it has been indexed with a dynamic value.
 */
public class ArrayFrozenException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public ArrayFrozenException(String message) { super(message); }
}
