package fhdl.ir;

import fhdl.build.Platform;

/**
 * A design object. Elaboration either produces a {@link Fragment} or delegates to another design object;
 * {@link Fragment#get(Object, Platform)} follows the delegation chain.
 */
public interface Elaboratable {
  /**
   * @param platform the target platform, or null if elaborating without one
   * @return a Fragment, or another Elaboratable to elaborate in turn
   */
  Elaboratable elaborate(Platform platform);
}
