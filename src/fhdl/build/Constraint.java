package fhdl.build;

/**
 * A placement or electrical constraint of a platform resource.
 * Constraints are compared and hashed by their rendering, so whitespace differences in their text do not matter.
 *
 * When a resource is requested, every constraint except {@link Subsignal} is stored on the port signal as an ordinary
 * attribute under {@link #attributeKey()}.
 */
public abstract class Constraint {
  /** @return the key of the signal attribute holding this constraint */
  public abstract String attributeKey();
  /** @return the value of the signal attribute holding this constraint */
  public abstract Object attributeValue();

  @Override
  public abstract String toString();

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return toString().equals(obj.toString());
  }

  static String normalizeWhitespace(String text) {
    return String.join(" ", text.trim().split("\\s+"));
  }
}
