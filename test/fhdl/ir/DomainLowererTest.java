package fhdl.ir;

import fhdl.ast.Array;
import fhdl.ast.Assign;
import fhdl.ast.ClockSignal;
import fhdl.ast.DomainException;
import fhdl.ast.ResetSignal;
import fhdl.ast.Sample;
import fhdl.ast.Signal;
import fhdl.ast.Statement;
import fhdl.ast.Switch;
import fhdl.ast.Value;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DomainLowererTest {
  private ClockDomain sync;
  private ClockDomain pix;
  private DomainLowerer lowerer;

  @BeforeEach
  void setUp() {
    sync = new ClockDomain();
    pix = new ClockDomain("pix", true, false);
    lowerer = new DomainLowerer(Map.of("sync", sync, "pix", pix));
  }

  @Test
  void testClockSignal() {
    Assertions.assertSame(sync.getClk(), lowerer.transform(new ClockSignal()));
    Assertions.assertSame(pix.getClk(), lowerer.transform(new ClockSignal("pix")));
  }

  @Test
  void testResetSignal() {
    Assertions.assertSame(sync.getRst(), lowerer.transform(new ResetSignal()));
    Assertions.assertEquals("(const 1'd0)", lowerer.transform(new ResetSignal("pix", true)).toString());
    var e = Assertions.assertThrows(DomainException.class, () -> lowerer.transform(new ResetSignal("pix")));
    Assertions.assertEquals("Signal (rst pix) refers to reset of reset-less domain 'pix'", e.getMessage());
  }

  @Test
  void testUnknownDomain() {
    var e = Assertions.assertThrows(DomainException.class, () -> lowerer.transform(new ClockSignal("other")));
    Assertions.assertEquals("Signal (clk other) refers to nonexistent domain 'other'", e.getMessage());
  }

  @Test
  void testNested() {
    Signal s = new Signal(4, "s");
    Value value = s.add(new ClockSignal()).slice(0, 2);
    Assertions.assertEquals("(slice (+ (sig s) (sig clk)) 0:2)", lowerer.transform(value).toString());
  }

  @Test
  void testUnchangedShared() {
    Signal s = new Signal(4, "s");
    Signal t = new Signal(4, "t");
    Value value = s.add(t).bitSelect(t, 2);
    Assertions.assertSame(value, lowerer.transform(value));
    Assign assign = s.eq(t);
    Assertions.assertSame(assign, lowerer.transform(assign));
    Value proxy = Array.of(s, t).get(t);
    Assertions.assertSame(proxy, lowerer.transform(proxy));
    Value sample = Sample.past(s);
    Assertions.assertSame(sample, lowerer.transform(sample));
  }

  @Test
  void testSwitch() {
    Signal s = new Signal(1, "s");
    Signal o = new Signal(1, "o");
    Switch sw = new Switch(s, List.of(new Switch.Case(List.of("1"), List.of(o.eq(new ClockSignal()))),
                                      new Switch.Case(List.of(), List.of(o.eq(0)))));
    Statement lowered = lowerer.transform(sw);
    Assertions.assertEquals("(switch (sig s) (case 1 (eq (sig o) (sig clk))) (default (eq (sig o) (const 1'd0))))", lowered.toString());
    Switch plain = new Switch(s, List.of(new Switch.Case(List.of("1"), List.of(o.eq(0)))));
    Assertions.assertSame(plain, lowerer.transform(plain));
  }
}
