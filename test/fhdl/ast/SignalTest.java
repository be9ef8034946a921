package fhdl.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SignalTest {

  @Test
  void testDefaults() {
    Signal s = new Signal();
    Assertions.assertEquals(Shape.unsigned(1), s.shape());
    Assertions.assertEquals("$signal", s.getName());
    Assertions.assertEquals(BigInteger.ZERO, s.getReset());
    Assertions.assertFalse(s.isResetLess());
    Assertions.assertTrue(s.getAttrs().isEmpty());
    Assertions.assertNull(s.getDecoder());
    Assertions.assertEquals("(sig $signal)", s.toString());
  }

  @Test
  void testShape() {
    Assertions.assertEquals(Shape.unsigned(4), new Signal(4).shape());
    Assertions.assertEquals(Shape.signed(4), new Signal(Shape.signed(4)).shape());
    Assertions.assertEquals(Shape.unsigned(0), new Signal(0).shape());
  }

  @Test
  void testRange() {
    Assertions.assertEquals(Shape.unsigned(4), Signal.range(16).shape());
    Assertions.assertEquals(Shape.unsigned(4), Signal.range(4, 16).shape());
    Assertions.assertEquals(Shape.signed(5), Signal.range(-4, 16).shape());
    Assertions.assertEquals(Shape.signed(6), Signal.range(-20, 16).shape());
    Assertions.assertEquals(Shape.unsigned(1), Signal.range(0).shape());
    Assertions.assertEquals(Shape.unsigned(1), Signal.range(1).shape());
  }

  @Test
  void testName() {
    Assertions.assertEquals("foo", new Signal(2, "foo").getName());
    var e = Assertions.assertThrows(HdlTypeException.class, () -> Signal.builder(2).name(null));
    Assertions.assertEquals("Signal name must be a string, not 'null'", e.getMessage());
  }

  @Test
  void testResetTooWide() {
    List<HdlWarning> warnings = HdlWarnings.collect(() -> Signal.builder(3).reset(8).build());
    Assertions.assertEquals(1, warnings.size());
    Assertions.assertEquals(HdlWarning.Kind.RESET_VALUE_TOO_WIDE, warnings.get(0).kind());
    Assertions.assertEquals("Reset value 8 requires 4 bits to represent, but the signal only has 3 bits", warnings.get(0).message());

    Assertions.assertEquals(1, HdlWarnings.collect(() -> Signal.builder(Shape.signed(3)).reset(4).build()).size());
    Assertions.assertEquals(1, HdlWarnings.collect(() -> Signal.builder(Shape.signed(3)).reset(-5).build()).size());
    Assertions.assertTrue(HdlWarnings.collect(() -> Signal.builder(Shape.signed(3)).reset(-4).build()).isEmpty());
    Assertions.assertTrue(HdlWarnings.collect(() -> Signal.builder(3).reset(7).build()).isEmpty());
  }

  @Test
  void testNestedCollectors() {
    List<HdlWarning> inner = new ArrayList<>();
    List<HdlWarning> outer = HdlWarnings.collect(() -> inner.addAll(HdlWarnings.collect(() -> Signal.builder(1).reset(2).build())));
    Assertions.assertEquals(1, inner.size());
    Assertions.assertEquals(1, outer.size());
  }

  @Test
  void testResetAndAttrs() {
    Signal s = Signal.builder(4).name("s").reset(Enums.UnsignedEnum.BAZ).resetLess(true).attr("keep", true).build();
    Assertions.assertEquals(BigInteger.valueOf(3), s.getReset());
    Assertions.assertTrue(s.isResetLess());
    Assertions.assertEquals(Map.of("keep", true), s.getAttrs());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> s.getAttrs().put("x", 1));
  }

  @Test
  void testLike() {
    Signal other = Signal.builder(Shape.signed(4)).name("other").reset(3).resetLess(true).attr("keep", 1).build();
    Signal s1 = Signal.like(other);
    Assertions.assertEquals(Shape.signed(4), s1.shape());
    Assertions.assertEquals("$like", s1.getName());
    Assertions.assertEquals(BigInteger.valueOf(3), s1.getReset());
    Assertions.assertTrue(s1.isResetLess());
    Assertions.assertEquals(Map.of("keep", 1), s1.getAttrs());

    Assertions.assertEquals("other_next", Signal.like(other, null, "_next").getName());
    Assertions.assertEquals("named", Signal.like(other, "named", "_next").getName());

    Signal s2 = Signal.like(10);
    Assertions.assertEquals(Shape.unsigned(4), s2.shape());
    Assertions.assertEquals(BigInteger.ZERO, s2.getReset());
  }

  @Test
  void testEnumeration() {
    Signal s = Signal.enumeration(Enums.UnsignedEnum.class);
    Assertions.assertEquals(Shape.unsigned(2), s.shape());
    Assertions.assertEquals("FOO/1", s.decode(1));
    Assertions.assertEquals("BAZ/3", s.decode(3));
    Assertions.assertEquals("0", s.decode(0));
    Assertions.assertEquals(Shape.signed(2), Signal.enumeration(Enums.SignedEnum.class, "e").shape());
    Assertions.assertEquals("FOO/-1", Signal.enumeration(Enums.SignedEnum.class, "e").decode(-1));
  }

  @Test
  void testDecoderLikeCopies() {
    Signal s = Signal.enumeration(Enums.UnsignedEnum.class);
    Assertions.assertEquals("BAR/2", Signal.like(s).decode(2));
  }

  @Test
  void testIdentity() {
    Signal a = new Signal(1, "x");
    Signal b = new Signal(1, "x");
    Assertions.assertNotEquals(a, b);
    Assertions.assertEquals(List.of(a), List.copyOf(a.lhsSignals()));
    Assertions.assertEquals(List.of(a), List.copyOf(a.rhsSignals()));
  }

  @Test
  void testFreshSignalSets() {
    Signal a = new Signal();
    a.rhsSignals().clear();
    Assertions.assertEquals(1, a.rhsSignals().size());
  }
}
