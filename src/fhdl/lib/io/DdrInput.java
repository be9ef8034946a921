package fhdl.lib.io;

import fhdl.ast.Domains;
import fhdl.ast.Shape;
import fhdl.ast.Signal;
import fhdl.build.Platform;
import fhdl.ir.Elaboratable;

/**
 * Double data rate input: i is sampled on both clock edges of the domain into o1 (rising) and o2 (falling).
 * Only available through the platform.
 */
public class DdrInput implements Elaboratable {
  private final Signal i;
  private final Signal o1;
  private final Signal o2;
  private final String domain;

  public DdrInput(int width) { this(Shape.unsigned(width), null, Domains.SYNC); }

  public DdrInput(Shape shape, String name, String domain) {
    this.i = new Signal(shape, TSTriple.signalName(name, "_i"));
    this.o1 = new Signal(shape, TSTriple.signalName(name, "_o1"));
    this.o2 = new Signal(shape, TSTriple.signalName(name, "_o2"));
    this.domain = domain;
  }

  public Signal getI() { return i; }
  public Signal getO1() { return o1; }
  public Signal getO2() { return o2; }
  public String getDomain() { return domain; }
  public int width() { return i.width(); }

  @Override
  public Elaboratable elaborate(Platform platform) {
    if (platform == null)
      throw Buffers.unsupported(this, platform);
    return platform.getDdrInput(this).orElseThrow(() -> Buffers.unsupported(this, platform));
  }
}
