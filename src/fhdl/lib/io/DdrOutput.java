package fhdl.lib.io;

import fhdl.ast.Domains;
import fhdl.ast.Shape;
import fhdl.ast.Signal;
import fhdl.build.Platform;
import fhdl.ir.Elaboratable;

/**
 * Double data rate output: o carries i1 after the rising and i2 after the falling clock edge of the domain.
 * Only available through the platform.
 */
public class DdrOutput implements Elaboratable {
  private final Signal i1;
  private final Signal i2;
  private final Signal o;
  private final String domain;

  public DdrOutput(int width) { this(Shape.unsigned(width), null, Domains.SYNC); }

  public DdrOutput(Shape shape, String name, String domain) {
    this.i1 = new Signal(shape, TSTriple.signalName(name, "_i1"));
    this.i2 = new Signal(shape, TSTriple.signalName(name, "_i2"));
    this.o = new Signal(shape, TSTriple.signalName(name, "_o"));
    this.domain = domain;
  }

  public Signal getI1() { return i1; }
  public Signal getI2() { return i2; }
  public Signal getO() { return o; }
  public String getDomain() { return domain; }
  public int width() { return i1.width(); }

  @Override
  public Elaboratable elaborate(Platform platform) {
    if (platform == null)
      throw Buffers.unsupported(this, platform);
    return platform.getDdrOutput(this).orElseThrow(() -> Buffers.unsupported(this, platform));
  }
}
