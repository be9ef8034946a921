package fhdl.lib.io;

import fhdl.ast.Shape;
import fhdl.ast.Signal;
import fhdl.build.Platform;
import fhdl.ir.Elaboratable;

/** Differential input buffer from the pin pair iP/iN to o. Only available through the platform. */
public class DifferentialInput implements Elaboratable {
  private final Signal iP;
  private final Signal iN;
  private final Signal o;

  public DifferentialInput(int width) { this(Shape.unsigned(width), null); }

  public DifferentialInput(Shape shape, String name) {
    this.iP = new Signal(shape, TSTriple.signalName(name, "_i_p"));
    this.iN = new Signal(shape, TSTriple.signalName(name, "_i_n"));
    this.o = new Signal(shape, TSTriple.signalName(name, "_o"));
  }

  public Signal getIP() { return iP; }
  public Signal getIN() { return iN; }
  public Signal getO() { return o; }
  public int width() { return iP.width(); }

  /**
   * @throws UnsupportedOperationException if the platform has no differential input buffer
   */
  @Override
  public Elaboratable elaborate(Platform platform) {
    if (platform == null)
      throw Buffers.unsupported(this, platform);
    return platform.getDifferentialInput(this).orElseThrow(() -> Buffers.unsupported(this, platform));
  }
}
