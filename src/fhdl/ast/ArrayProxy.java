package fhdl.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One element of a frozen {@link Array}, selected by a dynamic index.
 *
 * Indexing a proxy or accessing a field of a proxy distributes over the elements, so that
 * {@code array.get(i).field("x")} selects {@code x} from the i-th element and {@code matrix.get(i).get(j)} selects
 * from nested arrays.
 */
public final class ArrayProxy extends Value {
  private final List<?> elems;
  private final Value index;

  /**
   * @param elems the elements to select from; read as is, so callers other than {@link Array} must not mutate it afterwards
   * @param index the index expression
   */
  public ArrayProxy(List<?> elems, Value index) {
    this.elems = elems;
    this.index = index;
  }

  public List<?> getElems() { return elems; }
  public Value getIndex() { return index; }

  /** The elements as values. */
  public List<Value> elemValues() {
    List<Value> values = new ArrayList<>(elems.size());
    for (Object elem : elems)
      values.add(wrap(elem));
    return values;
  }

  /**
   * Selects the index-th item of every element, then this proxy's element of the results.
   */
  public ArrayProxy get(int index) {
    List<Object> selected = new ArrayList<>(elems.size());
    for (Object elem : elems) {
      if (elem instanceof List<?>)
        selected.add(((List<?>)elem).get(index));
      else if (elem instanceof Value)
        selected.add(((Value)elem).bit(index));
      else
        throw new HdlTypeException(String.format("Array element %s cannot be indexed", elem));
    }
    return new ArrayProxy(selected, this.index);
  }

  /**
   * Indexes every element with a dynamic value, then selects this proxy's element of the results.
   */
  public ArrayProxy get(Value index) {
    List<Object> selected = new ArrayList<>(elems.size());
    for (Object elem : elems) {
      if (elem instanceof Array<?>)
        selected.add(((Array<?>)elem).get(index));
      else if (elem instanceof ArrayProxy)
        selected.add(((ArrayProxy)elem).get(index));
      else
        throw new HdlTypeException(String.format("Array element %s cannot be indexed with a value", elem));
    }
    return new ArrayProxy(selected, this.index);
  }

  /**
   * Selects the field called name of every element, then this proxy's element of the results.
   * Elements may be maps, {@link FieldAccess} aggregates, or nested proxies.
   */
  public ArrayProxy field(String name) {
    List<Object> selected = new ArrayList<>(elems.size());
    for (Object elem : elems)
      selected.add(fieldOf(elem, name));
    return new ArrayProxy(selected, this.index);
  }

  private static Object fieldOf(Object elem, String name) {
    if (elem instanceof ArrayProxy)
      return ((ArrayProxy)elem).field(name);
    Object field = null;
    if (elem instanceof Map<?, ?>)
      field = ((Map<?, ?>)elem).get(name);
    else if (elem instanceof FieldAccess)
      field = ((FieldAccess)elem).getField(name);
    else
      throw new HdlTypeException(String.format("Array element %s has no fields", elem));
    if (field == null)
      throw new HdlTypeException(String.format("Array element %s has no field '%s'", elem, name));
    return field;
  }

  /**
   * The shape of the union of all elements: wide enough for every element, signed if any element is signed.
   */
  @Override
  public Shape shape() {
    int width = 0;
    boolean signed = false;
    for (Value elem : elemValues()) {
      Shape shape = elem.shape();
      width = Math.max(width, shape.getWidth() + (shape.isSigned() ? 1 : 0));
      signed = signed || shape.isSigned();
    }
    return Shape.of(width, signed);
  }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> signals = signalSet();
    for (Value elem : elemValues())
      signals.addAll(elem.lhsSignals());
    return signals;
  }

  @Override
  public Set<Signal> rhsSignals() {
    Set<Signal> signals = index.rhsSignals();
    signals.addAll(unionRhs(elemValues()));
    return signals;
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitArrayProxy(this);
  }

  @Override
  public String toString() {
    return String.format("(proxy %s %s)", elems, index);
  }
}
