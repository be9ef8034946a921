package fhdl.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiles match patterns into comparisons.
 *
 * A pattern is an integer, a string of '0', '1' and '-' (don't care) bits with the most significant bit first, or a constant
 * of an {@link HdlEnum} enumeration. Whitespace inside bit strings is ignored. A negative integer matches its two's
 * complement bits, whatever the signedness of the value under test.
 */
public final class PatternMatcher {
  private PatternMatcher() {}

  /**
   * Builds a 1-bit value that is set iff value matches any of the patterns.
   * @param value the value under test
   * @param patterns the patterns
   * @return constant 0 if there is no pattern, a single comparison for one pattern, else the OR of all comparisons
   * @throws HdlTypeException if a pattern has the wrong type or contains characters other than 0, 1 and -
   * @throws HdlRangeException if a bit string pattern does not have the width of value
   */
  public static Value matches(Value value, Object... patterns) {
    List<Value> comparisons = new ArrayList<>();
    for (Object pattern : patterns) {
      if (isInteger(pattern) && toBigInteger(pattern).signum() >= 0) {
        BigInteger integer = toBigInteger(pattern);
        if (!fitsWidth(integer, value.width()))
          continue;
        comparisons.add(value.equalTo(integer));
        continue;
      }
      Optional<String> normalized = normalize(pattern, value.width());
      if (normalized.isEmpty())
        continue;
      String bits = normalized.get();
      Shape shape = Shape.unsigned(bits.length());
      comparisons.add(value.and(new Const(mask(bits), shape)).equalTo(new Const(bitsValue(bits), shape)));
    }
    if (comparisons.isEmpty())
      return new Const(0, 1);
    if (comparisons.size() == 1)
      return comparisons.get(0);
    return new Cat(comparisons).any();
  }

  /**
   * Converts a pattern into a bit string of exactly width characters.
   * @param pattern the pattern
   * @param width the width of the value under test
   * @return the bit string, or empty if pattern is an integer too wide to ever match (a warning is raised)
   */
  public static Optional<String> normalize(Object pattern, int width) {
    if (isInteger(pattern)) {
      BigInteger integer = toBigInteger(pattern);
      if (!fitsWidth(integer, width))
        return Optional.empty();
      return Optional.of(toBits(integer, width));
    }
    if (pattern instanceof HdlEnum && pattern instanceof Enum<?>)
      return Optional.of(toBits(BigInteger.valueOf(((HdlEnum)pattern).value()), width));
    if (!(pattern instanceof String))
      throw new HdlTypeException(String.format("Match pattern must be an integer, a string, or an enumeration, not %s", pattern));
    String bits = ((String)pattern).replaceAll("\\s+", "");
    if (!bits.matches("[01-]*"))
      throw new HdlTypeException(String.format("Match pattern '%s' must consist of 0, 1, and - (don't care) bits", bits));
    if (bits.length() != width)
      throw new HdlRangeException(
          String.format("Match pattern '%s' must have the same width as match value (which is %d)", bits, width));
    return Optional.of(bits);
  }

  /** @return a value with a 1 at every position of bits that is not a don't care */
  public static BigInteger mask(String bits) {
    return new BigInteger("0" + bits.replace('0', '1').replace('-', '0'), 2);
  }

  /** @return the value of bits with don't cares cleared */
  public static BigInteger bitsValue(String bits) {
    return new BigInteger("0" + bits.replace('-', '0'), 2);
  }

  private static boolean isInteger(Object pattern) {
    return pattern instanceof Integer || pattern instanceof Long || pattern instanceof Short || pattern instanceof Byte ||
        pattern instanceof BigInteger;
  }

  private static BigInteger toBigInteger(Object pattern) {
    if (pattern instanceof BigInteger)
      return (BigInteger)pattern;
    return BigInteger.valueOf(((Number)pattern).longValue());
  }

  private static boolean fitsWidth(BigInteger integer, int width) {
    if (Shape.bitsFor(integer, false) <= width)
      return true;
    HdlWarnings.warn(HdlWarning.Kind.PATTERN_NEVER_MATCHES,
                     String.format("Match pattern '%s' is wider than match value (which has width %d); comparison will never be true",
                                   integer.signum() < 0 ? integer.toString() : integer.toString(2), width));
    return false;
  }

  /** Two's complement bit string of integer, truncated or zero-extended to width. */
  private static String toBits(BigInteger integer, int width) {
    if (width == 0)
      return "";
    BigInteger truncated = Const.normalize(integer, Shape.unsigned(width));
    StringBuilder bits = new StringBuilder(truncated.toString(2));
    while (bits.length() < width)
      bits.insert(0, '0');
    return bits.toString();
  }
}
