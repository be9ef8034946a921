package fhdl.ast;

/**
 * An advisory diagnostic produced while building an expression. Warnings never abort construction.
 * @param kind what was suspicious
 * @param message human-readable description
 */
public record HdlWarning(Kind kind, String message) {
  public enum Kind {
    /** A reset value needs more bits than the signal has. */
    RESET_VALUE_TOO_WIDE,
    /** A match pattern is wider than the matched value and can never be true. */
    PATTERN_NEVER_MATCHES,
    /** A signal is driven from more than one fragment. */
    MULTIPLE_DRIVERS
  }

  @Override
  public String toString() {
    return String.format("%s: %s", kind, message);
  }
}
