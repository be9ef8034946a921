package fhdl.lib.io;

import fhdl.ast.Value;
import fhdl.build.Platform;
import fhdl.dsl.Module;
import fhdl.ir.Elaboratable;
import fhdl.ir.Fragment;
import fhdl.ir.Instance;
import java.util.Optional;

/**
 * Tristate buffer between a triple and a pin. Uses the platform's buffer if it has one, else a generic
 * {@code $tribuf} primitive that is flattened into the parent.
 */
public class Tristate implements Elaboratable {
  private final TSTriple triple;
  private final Value io;

  public Tristate(TSTriple triple, Value io) {
    this.triple = triple;
    this.io = io;
  }

  public TSTriple getTriple() { return triple; }
  public Value getIo() { return io; }

  @Override
  public Elaboratable elaborate(Platform platform) {
    if (platform != null) {
      Optional<Elaboratable> vendor = platform.getTristate(triple, io);
      if (vendor.isPresent())
        return vendor.get();
    }
    Module m = new Module();
    m.comb(triple.getI().eq(io));
    m.instance("$tribuf", Instance.builder("$tribuf")
                              .parameter("WIDTH", io.width())
                              .input("EN", triple.getOe())
                              .input("A", triple.getO())
                              .output("Y", io)
                              .build());
    Fragment fragment = m.elaborate(platform);
    fragment.setFlatten(true);
    return fragment;
  }
}
