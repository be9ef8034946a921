package fhdl.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Concatenation. The first part ends up in the least significant bits.
 */
public final class Cat extends Value {
  private final List<Value> parts;
  private final Shape shape;

  /**
   * @param parts values, or iterables of values, that are flattened in order
   */
  public Cat(Object... parts) {
    List<Value> flat = new ArrayList<>();
    for (Object part : parts)
      flatten(part, flat);
    this.parts = Collections.unmodifiableList(flat);
    this.shape = shapeOf(this.parts);
  }

  public Cat(List<? extends Value> parts) {
    this.parts = List.copyOf(parts);
    this.shape = shapeOf(this.parts);
  }

  private static Shape shapeOf(List<Value> parts) {
    long width = 0;
    for (Value part : parts)
      width += part.width();
    return Shape.unsigned(Shape.checkedWidth(width));
  }

  private static void flatten(Object part, List<Value> out) {
    if (part instanceof Iterable<?>) {
      for (Object inner : (Iterable<?>)part)
        flatten(inner, out);
    } else {
      out.add(wrap(part));
    }
  }

  public List<Value> getParts() { return parts; }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public Set<Signal> lhsSignals() {
    Set<Signal> signals = signalSet();
    for (Value part : parts)
      signals.addAll(part.lhsSignals());
    return signals;
  }

  @Override
  public Set<Signal> rhsSignals() {
    return unionRhs(parts);
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitCat(this);
  }

  @Override
  public String toString() {
    if (parts.isEmpty())
      return "(cat)";
    return String.format("(cat %s)", parts.stream().map(Value::toString).collect(Collectors.joining(" ")));
  }
}
