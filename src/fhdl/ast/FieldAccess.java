package fhdl.ast;

/**
 * An aggregate whose members can be selected by name, so that an {@link Array} of them supports
 * {@link ArrayProxy#field(String)}.
 */
public interface FieldAccess {
  /** @return the member called name, or null if there is none */
  Object getField(String name);
}
