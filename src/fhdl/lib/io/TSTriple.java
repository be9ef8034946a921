package fhdl.lib.io;

import fhdl.ast.Shape;
import fhdl.ast.Signal;
import fhdl.ast.Value;
import fhdl.build.Platform;
import fhdl.ir.Elaboratable;
import fhdl.ir.Fragment;

/**
 * The three signals of a tristate pin: output value o, output enable oe and input value i.
 * A triple elaborates to nothing; connect it to a pin with {@link #getTristate(Value)}.
 */
public class TSTriple implements Elaboratable {
  private final Signal o;
  private final Signal oe;
  private final Signal i;

  public TSTriple(int width) { this(Shape.unsigned(width), null); }
  public TSTriple(Shape shape, String name) { this(shape, 0, 0, 0, name); }

  /**
   * @param name prefix of the signal names, or null for default names
   */
  public TSTriple(Shape shape, long resetO, long resetOe, long resetI, String name) {
    this.o = Signal.builder(shape).name(signalName(name, "_o")).reset(resetO).build();
    this.oe = Signal.builder(Shape.unsigned(1)).name(signalName(name, "_oe")).reset(resetOe).build();
    this.i = Signal.builder(shape).name(signalName(name, "_i")).reset(resetI).build();
  }

  static String signalName(String prefix, String suffix) { return prefix == null ? Signal.DEFAULT_NAME : prefix + suffix; }

  public Signal getO() { return o; }
  public Signal getOe() { return oe; }
  public Signal getI() { return i; }
  public int width() { return o.width(); }

  @Override
  public Elaboratable elaborate(Platform platform) {
    return new Fragment();
  }

  /** @return a buffer driving io from this triple */
  public Tristate getTristate(Value io) { return new Tristate(this, io); }
}
