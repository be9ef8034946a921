package fhdl.lib.io;

import fhdl.ast.Shape;
import fhdl.ast.Signal;
import fhdl.build.Platform;
import fhdl.ir.Elaboratable;

/** Differential output buffer from i to the pin pair oP/oN. Only available through the platform. */
public class DifferentialOutput implements Elaboratable {
  private final Signal oP;
  private final Signal oN;
  private final Signal i;

  public DifferentialOutput(int width) { this(Shape.unsigned(width), null); }

  public DifferentialOutput(Shape shape, String name) {
    this.oP = new Signal(shape, TSTriple.signalName(name, "_o_p"));
    this.oN = new Signal(shape, TSTriple.signalName(name, "_o_n"));
    this.i = new Signal(shape, TSTriple.signalName(name, "_i"));
  }

  public Signal getOP() { return oP; }
  public Signal getON() { return oN; }
  public Signal getI() { return i; }
  public int width() { return i.width(); }

  @Override
  public Elaboratable elaborate(Platform platform) {
    if (platform == null)
      throw Buffers.unsupported(this, platform);
    return platform.getDifferentialOutput(this).orElseThrow(() -> Buffers.unsupported(this, platform));
  }
}
