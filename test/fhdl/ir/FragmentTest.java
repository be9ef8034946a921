package fhdl.ir;

import fhdl.ast.Assign;
import fhdl.ast.ClockSignal;
import fhdl.ast.Const;
import fhdl.ast.DomainException;
import fhdl.ast.Domains;
import fhdl.ast.HdlTypeException;
import fhdl.ast.HdlWarning;
import fhdl.ast.HdlWarnings;
import fhdl.ast.ResetSignal;
import fhdl.ast.Shape;
import fhdl.ast.Signal;
import fhdl.build.Platform;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FragmentTest {
  private Signal x;
  private Signal y;

  @BeforeEach
  void setUp() {
    x = new Signal(4, "x");
    y = new Signal(4, "y");
  }

  static class CountingDesign implements Elaboratable {
    final Fragment fragment = new Fragment();
    int calls = 0;

    @Override
    public Elaboratable elaborate(Platform platform) {
      ++calls;
      return fragment;
    }
  }

  static class NamedDesign implements Elaboratable {
    private final String name;
    Elaboratable next = null;

    NamedDesign(String name) { this.name = name; }

    @Override
    public Elaboratable elaborate(Platform platform) {
      return next;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  @Test
  void testPortDirections() {
    Fragment f = new Fragment();
    f.addStatements(Domains.COMB, List.of(x.eq(y)));
    Fragment p = f.prepare(x, y);
    Assertions.assertEquals(Map.of(x, PortDirection.OUTPUT, y, PortDirection.INPUT), p.ports());
    Assertions.assertTrue(f.ports().isEmpty());
  }

  @Test
  void testUntouchedPortIsInput() {
    Fragment p = new Fragment().prepare(x);
    Assertions.assertEquals(Map.of(x, PortDirection.INPUT), p.ports());
  }

  @Test
  void testDrivenAndReadPortIsInout() {
    Fragment top = new Fragment();
    top.addStatements(Domains.COMB, List.of(y.eq(x)));
    Fragment sub = new Fragment();
    sub.addStatements(Domains.COMB, List.of(x.eq(1)));
    top.addSubfragment(sub, "sub");
    Fragment p = top.prepare(x, y);
    Assertions.assertEquals(PortDirection.INOUT, p.ports().get(x));
    Assertions.assertEquals(PortDirection.OUTPUT, p.ports().get(y));
    Assertions.assertEquals(Map.of(x, PortDirection.OUTPUT), p.subfragments().get(0).fragment().ports());
  }

  @Test
  void testSubfragmentInputsPropagate() {
    Fragment top = new Fragment();
    Fragment sub = new Fragment();
    sub.addStatements(Domains.COMB, List.of(y.eq(x)));
    top.addSubfragment(sub);
    Fragment p = top.prepare(y);
    Assertions.assertEquals(Map.of(x, PortDirection.INPUT, y, PortDirection.OUTPUT), p.ports());
  }

  @Test
  void testSiblingDrivenSignalIsInternal() {
    Signal a = new Signal(4, "a");
    Signal o = new Signal(4, "o");
    for (boolean producerFirst : new boolean[] {true, false}) {
      Fragment producer = new Fragment();
      producer.addStatements(Domains.COMB, List.of(x.eq(a)));
      Fragment consumer = new Fragment();
      consumer.addStatements(Domains.COMB, List.of(o.eq(x)));
      Fragment top = new Fragment();
      top.addSubfragment(producerFirst ? producer : consumer, producerFirst ? "producer" : "consumer");
      top.addSubfragment(producerFirst ? consumer : producer, producerFirst ? "consumer" : "producer");

      Fragment p = top.prepare(a, o);
      Assertions.assertEquals(Map.of(a, PortDirection.INPUT, o, PortDirection.OUTPUT), p.ports());
      Fragment preparedProducer = p.subfragments().get(producerFirst ? 0 : 1).fragment();
      Fragment preparedConsumer = p.subfragments().get(producerFirst ? 1 : 0).fragment();
      Assertions.assertEquals(PortDirection.OUTPUT, preparedProducer.ports().get(x));
      Assertions.assertEquals(PortDirection.INPUT, preparedConsumer.ports().get(x));
    }
  }

  @Test
  void testInstancePorts() {
    Signal a = new Signal(1, "a");
    Signal io = new Signal(1, "io");
    Fragment f = new Fragment();
    f.addInstance("u", Instance.builder("BUF").input("A", a).output("Y", y).inout("IO", io).build());
    Fragment p = f.prepare(a, y, io);
    Assertions.assertEquals(Map.of(a, PortDirection.INPUT, y, PortDirection.OUTPUT, io, PortDirection.INOUT), p.ports());
  }

  @Test
  void testSyncCreatesDomain() {
    Fragment f = new Fragment();
    f.addStatements(Domains.SYNC, List.of(x.eq(y)));
    Fragment p = f.prepare(x, y);
    ClockDomain sync = p.domains().get(Domains.SYNC);
    Assertions.assertNotNull(sync);
    Assertions.assertEquals(PortDirection.INPUT, p.ports().get(sync.getClk()));
    Assertions.assertEquals(PortDirection.INPUT, p.ports().get(sync.getRst()));
    Assertions.assertEquals(PortDirection.OUTPUT, p.ports().get(x));
    Assertions.assertTrue(f.domains().isEmpty());
  }

  @Test
  void testClockSignalLowered() {
    Signal o = new Signal(1, "o");
    Fragment f = new Fragment();
    f.addStatements(Domains.COMB, List.of(o.eq(new ClockSignal("pix"))));
    Fragment p = f.prepare(o);
    Assertions.assertEquals("(eq (sig o) (sig pix_clk))", p.statements(Domains.COMB).get(0).toString());
    ClockDomain pix = p.domains().get("pix");
    Assertions.assertEquals(PortDirection.INPUT, p.ports().get(pix.getClk()));
    Assertions.assertEquals(PortDirection.INPUT, p.ports().get(pix.getRst()));
  }

  @Test
  void testDrivenClockIsDriver() {
    ClockDomain cd = new ClockDomain();
    Signal clkIn = new Signal(1, "clk_in");
    Fragment f = new Fragment();
    f.addDomains(cd);
    f.addStatements(Domains.COMB, List.of(new ClockSignal().eq(clkIn)));
    Fragment p = f.prepare(clkIn);
    Assertions.assertEquals(Set.of(cd.getClk()), p.drivers().get(Domains.COMB));
    Assertions.assertEquals(PortDirection.INPUT, p.ports().get(clkIn));
  }

  @Test
  void testClockDrivenFromTwoFragments() {
    Signal a = new Signal(1, "a");
    Signal b = new Signal(1, "b");
    Fragment top = new Fragment();
    top.addStatements(Domains.COMB, List.of(new ClockSignal("pix").eq(a)));
    Fragment sub = new Fragment();
    sub.addStatements(Domains.COMB, List.of(new ClockSignal("pix").eq(b)));
    top.addSubfragment(sub, "sub");
    Fragment[] prepared = new Fragment[1];
    List<HdlWarning> warnings = HdlWarnings.collect(() -> prepared[0] = top.prepare(a, b));
    Assertions.assertEquals(1, warnings.size());
    Assertions.assertEquals("Signal 'pix_clk' is driven from multiple fragments: top, top.sub; hierarchy will be flattened",
                            warnings.get(0).message());
    Assertions.assertTrue(prepared[0].subfragments().isEmpty());
  }

  @Test
  void testClockDriverConflict() {
    ClockDomain cd = new ClockDomain();
    Signal a = new Signal(1, "a");
    Signal b = new Signal(1, "b");
    Fragment f = new Fragment();
    f.addDomains(cd);
    f.addStatements(Domains.COMB, List.of(new ClockSignal().eq(a)));
    f.addStatements("pix", List.of(cd.getClk().eq(b)));
    var e = Assertions.assertThrows(DomainException.class, () -> f.prepare(a, b));
    Assertions.assertEquals("Driver-driver conflict: trying to drive (sig clk) from d.comb, but it is already driven from d.pix",
                            e.getMessage());
  }

  @Test
  void testDomainPropagatesDown() {
    ClockDomain cd = new ClockDomain();
    Signal o = new Signal(1, "o");
    Fragment top = new Fragment();
    top.addDomains(cd);
    Fragment sub = new Fragment();
    sub.addStatements(Domains.COMB, List.of(o.eq(new ClockSignal())));
    top.addSubfragment(sub, "sub");
    Fragment p = top.prepare(o);
    Assign lowered = (Assign)p.subfragments().get(0).fragment().statements(Domains.COMB).get(0);
    Assertions.assertSame(cd.getClk(), lowered.getRhs());
    Assertions.assertEquals(PortDirection.INPUT, p.ports().get(cd.getClk()));
  }

  @Test
  void testResetOfResetLessDomain() {
    Signal o = new Signal(1, "o");
    Fragment f = new Fragment();
    f.addDomains(new ClockDomain(Domains.SYNC, true, false));
    f.addStatements(Domains.COMB, List.of(o.eq(new ResetSignal())));
    var e = Assertions.assertThrows(DomainException.class, () -> f.prepare(o));
    Assertions.assertEquals("Signal (rst sync) refers to reset of reset-less domain 'sync'", e.getMessage());

    Fragment allowed = new Fragment();
    allowed.addDomains(new ClockDomain(Domains.SYNC, true, false));
    allowed.addStatements(Domains.COMB, List.of(o.eq(new ResetSignal(Domains.SYNC, true))));
    Assertions.assertEquals("(eq (sig o) (const 1'd0))", allowed.prepare(o).statements(Domains.COMB).get(0).toString());
  }

  @Test
  void testDomainConflict() {
    Fragment top = new Fragment();
    Fragment a = new Fragment();
    a.addDomains(new ClockDomain());
    Fragment b = new Fragment();
    b.addDomains(new ClockDomain());
    top.addSubfragment(a, "a");
    top.addSubfragment(b, "b");
    var e = Assertions.assertThrows(DomainException.class, () -> top.prepare());
    Assertions.assertEquals("Domain 'sync' is defined by subfragments [a, b] of fragment 'top'", e.getMessage());
  }

  @Test
  void testDuplicateDomain() {
    Fragment f = new Fragment();
    ClockDomain cd = new ClockDomain();
    f.addDomains(cd);
    f.addDomains(cd);
    var e = Assertions.assertThrows(DomainException.class, () -> f.addDomains(new ClockDomain()));
    Assertions.assertEquals("Domain 'sync' is already defined", e.getMessage());
  }

  @Test
  void testMultipleDriversFlatten() {
    Fragment top = new Fragment();
    top.addStatements(Domains.COMB, List.of(x.eq(1)));
    Fragment sub = new Fragment();
    sub.addStatements(Domains.COMB, List.of(x.eq(2)));
    top.addSubfragment(sub, "sub");
    Fragment[] prepared = new Fragment[1];
    List<HdlWarning> warnings = HdlWarnings.collect(() -> prepared[0] = top.prepare(x));
    Assertions.assertEquals(1, warnings.size());
    Assertions.assertEquals(HdlWarning.Kind.MULTIPLE_DRIVERS, warnings.get(0).kind());
    Assertions.assertEquals("Signal 'x' is driven from multiple fragments: top, top.sub; hierarchy will be flattened",
                            warnings.get(0).message());
    Assertions.assertTrue(prepared[0].subfragments().isEmpty());
    Assertions.assertEquals(2, prepared[0].statements(Domains.COMB).size());
    Assertions.assertEquals(1, top.subfragments().size());
  }

  @Test
  void testFlattenFlag() {
    Fragment top = new Fragment();
    Fragment sub = new Fragment();
    sub.addStatements(Domains.COMB, List.of(x.eq(y)));
    sub.setFlatten(true);
    top.addSubfragment(sub);
    List<HdlWarning> warnings = HdlWarnings.collect(() -> {
      Fragment p = top.prepare(x);
      Assertions.assertTrue(p.subfragments().isEmpty());
      Assertions.assertEquals(Map.of(x, PortDirection.OUTPUT, y, PortDirection.INPUT), p.ports());
    });
    Assertions.assertTrue(warnings.isEmpty());
  }

  @Test
  void testNonSignalPort() {
    var e = Assertions.assertThrows(HdlTypeException.class, () -> new Fragment().prepare(new Const(1)));
    Assertions.assertEquals("Only signals may be added as ports, not (const 1'd1)", e.getMessage());
    Assertions.assertThrows(HdlTypeException.class, () -> new Fragment().prepare(x.add(1)));
  }

  @Test
  void testDriverConflict() {
    Fragment f = new Fragment();
    f.addStatements(Domains.COMB, List.of(x.eq(1)));
    var e = Assertions.assertThrows(DomainException.class, () -> f.addStatements(Domains.SYNC, List.of(x.eq(0))));
    Assertions.assertEquals("Driver-driver conflict: trying to drive (sig x) from d.sync, but it is already driven from d.comb",
                            e.getMessage());
    f.addStatements(Domains.COMB, List.of(x.eq(2)));
    Assertions.assertEquals(Map.of(Domains.COMB, Set.of(x)), f.drivers());
  }

  @Test
  void testSignals() {
    Fragment f = new Fragment();
    f.addPort(x, PortDirection.INPUT);
    f.addStatements(Domains.COMB, List.of(y.eq(x), x.eq(y)));
    Assertions.assertEquals(List.of(x, y), List.copyOf(f.signals()));
  }

  @Test
  void testPortsFilter() {
    Fragment f = new Fragment();
    f.addPort(x, PortDirection.INPUT);
    f.addPort(y, PortDirection.OUTPUT);
    Assertions.assertEquals(Map.of(x, PortDirection.INPUT), f.ports(PortDirection.INPUT));
    Assertions.assertEquals(Map.of(x, PortDirection.INPUT, y, PortDirection.OUTPUT),
                            f.ports(PortDirection.INPUT, PortDirection.OUTPUT));
    Assertions.assertEquals(2, f.ports().size());
  }

  @Test
  void testGetFragment() {
    Fragment f = new Fragment();
    Assertions.assertSame(f, Fragment.get(f, null));
  }

  @Test
  void testGetMemoized() {
    CountingDesign inner = new CountingDesign();
    Fragment[] seen = new Fragment[2];
    Elaboratable outer = platform -> {
      seen[0] = Fragment.get(inner, platform);
      seen[1] = Fragment.get(inner, platform);
      Fragment f = new Fragment();
      f.addSubfragment(seen[0]);
      return f;
    };
    Fragment f = Fragment.get(outer, null);
    Assertions.assertSame(inner.fragment, seen[0]);
    Assertions.assertSame(seen[0], seen[1]);
    Assertions.assertEquals(1, inner.calls);
    Assertions.assertSame(inner.fragment, f.subfragments().get(0).fragment());
  }

  @Test
  void testGetDelegation() {
    NamedDesign a = new NamedDesign("a");
    NamedDesign b = new NamedDesign("b");
    Fragment f = new Fragment();
    a.next = b;
    b.next = f;
    Assertions.assertSame(f, Fragment.get(a, null));
  }

  @Test
  void testGetCycle() {
    NamedDesign a = new NamedDesign("a");
    a.next = a;
    var e = Assertions.assertThrows(HdlTypeException.class, () -> Fragment.get(a, null));
    Assertions.assertEquals("Elaboratable a is part of an elaboration cycle", e.getMessage());

    NamedDesign b = new NamedDesign("b");
    NamedDesign c = new NamedDesign("c");
    b.next = c;
    c.next = b;
    e = Assertions.assertThrows(HdlTypeException.class, () -> Fragment.get(b, null));
    Assertions.assertEquals("Elaboratable b is part of an elaboration cycle", e.getMessage());
  }

  @Test
  void testGetRecursiveCycle() {
    Elaboratable[] self = new Elaboratable[1];
    self[0] = platform -> Fragment.get(self[0], platform);
    Assertions.assertThrows(HdlTypeException.class, () -> Fragment.get(self[0], null));
  }

  @Test
  void testGetErrors() {
    var e = Assertions.assertThrows(HdlTypeException.class, () -> Fragment.get("foo", null));
    Assertions.assertEquals("Object foo cannot be elaborated", e.getMessage());
    e = Assertions.assertThrows(HdlTypeException.class, () -> Fragment.get(null, null));
    Assertions.assertEquals("Object null cannot be elaborated", e.getMessage());
    e = Assertions.assertThrows(HdlTypeException.class, () -> Fragment.get(new NamedDesign("empty"), null));
    Assertions.assertEquals("Elaboratable empty returned null", e.getMessage());
  }

  @Test
  void testFragmentInfo() {
    Signal s = new Signal(Shape.signed(4), "s");
    Fragment f = new Fragment();
    f.addStatements(Domains.COMB, List.of(s.eq(y)));
    Fragment p = f.prepare(s, y);
    Assertions.assertEquals("inputs: y(4)\noutputs: s(4, signed)\ninouts: \nsignals: y(4), s(4, signed)\n", FragmentInfo.format(p));
  }
}
