package fhdl.ast;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.RandomAccess;
import java.util.stream.Collectors;

/**
 * A mutable list of arbitrary elements that can be indexed with a hardware value, e.g. to build lookup tables.
 *
 * Indexing with an int returns the stored element. Indexing with a {@link Value} returns an {@link ArrayProxy} and
 * freezes the array: from then on every mutation fails with an {@link ArrayFrozenException}.
 * Elements may be anything {@link Value#wrap(Object)} accepts, nested arrays and lists, or maps and {@link FieldAccess}
 * aggregates whose members are selected through {@link ArrayProxy#field(String)}.
 */
public class Array<E> extends AbstractList<E> implements RandomAccess {
  private final List<E> inner;
  private String frozenBy = null;

  public Array() { this.inner = new ArrayList<>(); }
  public Array(Collection<? extends E> elements) { this.inner = new ArrayList<>(elements); }

  @SafeVarargs
  public static <E> Array<E> of(E... elements) {
    return new Array<>(List.of(elements));
  }

  @Override
  public E get(int index) {
    return inner.get(index);
  }

  /**
   * Indexes this array with a dynamic value and freezes it.
   * @param index the index expression
   * @return a value selecting one element at run time
   */
  public ArrayProxy get(Value index) {
    if (frozenBy == null) {
      StackWalker.StackFrame caller = StackWalker.getInstance()
                                          .walk(frames -> frames.filter(frame -> !frame.getClassName().equals(Array.class.getName()) &&
                                                                       !frame.getClassName().equals(ArrayProxy.class.getName()))
                                                              .findFirst()
                                                              .orElse(null));
      frozenBy = String.format("%s (%s)", caller == null ? "<unknown>" : caller.getFileName() + ":" + caller.getLineNumber(), index);
    }
    return new ArrayProxy(this, index);
  }

  public boolean isFrozen() { return frozenBy != null; }

  private void checkMutable() {
    if (frozenBy != null)
      throw new ArrayFrozenException("Array can no longer be mutated after it was indexed with a value at " + frozenBy);
  }

  @Override
  public E set(int index, E element) {
    checkMutable();
    return inner.set(index, element);
  }

  @Override
  public void add(int index, E element) {
    checkMutable();
    inner.add(index, element);
    ++modCount;
  }

  @Override
  public E remove(int index) {
    checkMutable();
    ++modCount;
    return inner.remove(index);
  }

  @Override
  public int size() {
    return inner.size();
  }

  @Override
  public String toString() {
    String elements = inner.stream().map(String::valueOf).collect(Collectors.joining(", "));
    return String.format("(array %s[%s])", frozenBy == null ? "mutable " : "", elements);
  }
}
