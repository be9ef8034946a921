package fhdl.build;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConstraintTest {

  @Test
  void testPins() {
    Pins pins = new Pins("1 2 3");
    Assertions.assertEquals(3, pins.size());
    Assertions.assertEquals("Pins('1 2 3')", pins.toString());
    Assertions.assertEquals(Pins.KEY, pins.attributeKey());
    Assertions.assertEquals("1 2 3", pins.attributeValue());
    Assertions.assertEquals("Pins('1 2 3')", new Pins(" 1  2\t", "3 ").toString());
    Assertions.assertEquals(0, new Pins("  ").size());
  }

  @Test
  void testEqualityByRendering() {
    Assertions.assertEquals(new Pins("1 2 3"), new Pins("1\n2 3"));
    Assertions.assertEquals(new Pins("1 2 3").hashCode(), new Pins("1\n2 3").hashCode());
    Assertions.assertNotEquals(new Pins("1 2 3"), new Pins("1 2"));
    Assertions.assertNotEquals(new IOStandard("X"), new Misc("X"));
  }

  @Test
  void testIOStandard() {
    IOStandard standard = new IOStandard(" LVCMOS33 ");
    Assertions.assertEquals("IOStandard('LVCMOS33')", standard.toString());
    Assertions.assertEquals("IOSTANDARD", standard.attributeKey());
    Assertions.assertEquals("LVCMOS33", standard.attributeValue());
  }

  @Test
  void testDrive() {
    Drive drive = new Drive(" 8 ");
    Assertions.assertEquals("Drive('8')", drive.toString());
    Assertions.assertEquals("DRIVE", drive.attributeKey());
    Assertions.assertEquals("8", drive.attributeValue());
  }

  @Test
  void testMisc() {
    Misc slew = new Misc("SLEW = FAST");
    Assertions.assertEquals("Misc('SLEW = FAST')", slew.toString());
    Assertions.assertEquals("SLEW", slew.attributeKey());
    Assertions.assertEquals("FAST", slew.attributeValue());
    Misc pullup = new Misc("PULLUP");
    Assertions.assertEquals("PULLUP", pullup.attributeKey());
    Assertions.assertEquals(Boolean.TRUE, pullup.attributeValue());
  }

  @Test
  void testSubsignal() {
    Subsignal sub = new Subsignal("foo", new Pins("1 2 3"));
    Assertions.assertEquals("Subsignal('foo', Pins('1 2 3'))", sub.toString());
    Subsignal nested = new Subsignal("foo", new Subsignal("bar", new Pins("1")), new Pins("2"));
    Assertions.assertEquals("Subsignal('foo', Subsignal('bar', Pins('1')), Pins('2'))", nested.toString());
    Assertions.assertEquals(1, new Subsignal("foo", new Pins("1"), new Pins("1")).getConstraints().size());
    Assertions.assertThrows(UnsupportedOperationException.class, sub::attributeKey);
    Assertions.assertThrows(UnsupportedOperationException.class, sub::attributeValue);
  }
}
