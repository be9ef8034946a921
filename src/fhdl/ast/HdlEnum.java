package fhdl.ast;

/**
 * Implemented by Java enums whose constants stand for integer values in hardware.
 * Such constants can be used wherever a value is expected, and their enumeration can serve as a signal shape.
 */
public interface HdlEnum {
  /**
   * @return the integer this constant encodes
   */
  long value();
}
