package fhdl.build;

import fhdl.ast.Signal;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlatformLoaderTest {

  private static Platform loadExample() throws IOException {
    try (InputStream in = PlatformLoaderTest.class.getResourceAsStream("/fhdl/build/alu_example.yaml")) {
      Assertions.assertNotNull(in);
      return PlatformLoader.load(in);
    }
  }

  private static Platform loadText(String text) {
    return PlatformLoader.load(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testLoadExample() throws IOException {
    Platform platform = loadExample();
    Assertions.assertEquals("alu_example", platform.getName());
    Assertions.assertEquals("vivado", platform.getTool());
    Assertions.assertEquals(List.of("op#0", "a#0", "b#0", "o#0", "serial#0"), List.copyOf(platform.getResources().keySet()));
    Assertions.assertEquals(List.of("alu_example.xdc"), platform.getFiles());
    Assertions.assertEquals(Map.of("part", "xc7a35ticsg324-1L", "jobs", 4), platform.getParameters().get("vivado"));
  }

  @Test
  void testConstraints() throws IOException {
    Platform platform = loadExample();
    Signal o = platform.request("o", 0);
    Assertions.assertEquals(7, o.width());
    Assertions.assertEquals(Map.of("PINS", "30 31 32 33 34 35 36", "IOSTANDARD", "LVCMOS33", "DRIVE", "8", "SLEW", "FAST", "PULLUP", true),
                            o.getAttrs());
    Assertions.assertEquals(1, platform.request("op", 0).width());
    Signal rx = platform.request("serial", 0, "rx");
    Assertions.assertEquals("A2", rx.getAttrs().get("PINS"));
    Assertions.assertEquals("LVCMOS33", rx.getAttrs().get("IOSTANDARD"));
    Assertions.assertEquals("LVCMOS18", platform.request("serial", 0, "tx").getAttrs().get("IOSTANDARD"));
  }

  @Test
  void testConnectors() throws IOException {
    Map<String, Connector> connectors = loadExample().getConnectors();
    Assertions.assertEquals(Map.of(0, new Pins("40 41 42 43")), connectors.get("pmod").pins());
    Assertions.assertEquals(Map.of(0, new Pins("50 51"), 1, new Pins("52 53")), connectors.get("header").pins());
    Assertions.assertEquals(List.of("TCK", "TMS"), List.copyOf(connectors.get("jtag").pins().keySet()));
  }

  @Test
  void testLoadFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("board.yaml");
    Files.writeString(file, "name: Board\nio:\n  - name: led\n    pins: \"A1 A2\"\n");
    Platform platform = PlatformLoader.load(file);
    Assertions.assertEquals("board", platform.getName());
    Assertions.assertEquals(2, platform.request("led", 0).width());
  }

  @Test
  void testMalformed() {
    var e = Assertions.assertThrows(IllegalArgumentException.class, () -> loadText("- a\n- b\n"));
    Assertions.assertEquals("Platform description must be a mapping", e.getMessage());
    e = Assertions.assertThrows(IllegalArgumentException.class, () -> loadText("tool: vivado\n"));
    Assertions.assertEquals("Platform description must have a name", e.getMessage());
    e = Assertions.assertThrows(IllegalArgumentException.class, () -> loadText("name: x\nio:\n  - name: led\n    number: one\n"));
    Assertions.assertEquals("Resource led must have an integer number, not one", e.getMessage());
    e = Assertions.assertThrows(IllegalArgumentException.class, () -> loadText("name: x\nio: led\n"));
    Assertions.assertEquals("io must be a list", e.getMessage());
    e = Assertions.assertThrows(IllegalArgumentException.class, () -> loadText("name: x\nconnectors:\n  - pins: \"1\"\n"));
    Assertions.assertEquals("Entry of connector must have a string 'name'", e.getMessage());
  }
}
