package fhdl.lib.io;

import fhdl.build.Platform;

final class Buffers {
  private Buffers() {}

  static UnsupportedOperationException unsupported(Object buffer, Platform platform) {
    return new UnsupportedOperationException(String.format("%s not implemented by %s", buffer.getClass().getSimpleName(),
                                                           platform == null ? "the absent platform" : platform));
  }
}
