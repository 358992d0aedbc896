package regmap.config;

import java.io.InputStream;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;
import regmap.model.Endianness;

class ConfigLoaderTest {
  private final ConfigLoader loader = new ConfigLoader();

  static RegisterFileConfig loadResource(String name) throws Exception {
    try (InputStream in = ConfigLoaderTest.class.getResourceAsStream("/regfiles/" + name)) {
      Assertions.assertNotNull(in, "missing test resource " + name);
      return new ConfigLoader().load(in, name);
    }
  }

  @Test
  void testDemo() throws Exception {
    RegisterFileConfig config = loadResource("demo.yaml");
    Assertions.assertEquals("demo", config.name());
    Assertions.assertEquals(32, config.busWidth());
    Assertions.assertEquals(Endianness.LITTLE, config.endianness());
    Assertions.assertEquals(8, config.fields().size());

    FieldConfig enable = config.fields().get(0);
    Assertions.assertEquals("enable", enable.name());
    Assertions.assertEquals(0, enable.highBit());
    Assertions.assertEquals(0, enable.lowBit());
    Assertions.assertEquals(new ControlConfig(0), enable.behavior());

    FieldConfig mode = config.fields().get(1);
    Assertions.assertEquals(7, mode.highBit());
    Assertions.assertEquals(4, mode.lowBit());
    Assertions.assertEquals(new ControlConfig(3), mode.behavior());

    FieldConfig version = config.fields().get(2);
    Assertions.assertFalse(version.hasBitrange());
    Assertions.assertEquals(new ConstantConfig(0x12), version.behavior());

    Assertions.assertEquals(new StatusConfig(), config.fields().get(3).behavior());
    Assertions.assertEquals(new ExternalConfig(true, false, true), config.fields().get(4).behavior());

    PermissionConfig permissions = config.fields().get(5).permissions();
    Assertions.assertEquals(new PermissionConfig(false, true, true, false, true, true), permissions);
    Assertions.assertEquals(PermissionConfig.ALLOW_ALL, enable.permissions());

    Assertions.assertEquals(new StrobeConfig(), config.fields().get(6).behavior());
    FieldConfig lane = config.fields().get(7);
    Assertions.assertEquals(4, lane.repeat());
    Assertions.assertNull(lane.fieldRepeat());
    Assertions.assertNull(lane.stride());
  }

  @Test
  void testRepetitionKeys() throws RegmapException {
    RegisterFileConfig config = loader.load("name: r\n"
                                            + "bus-width: 64\n"
                                            + "endianness: big\n"
                                            + "fields:\n"
                                            + "  - name: f\n"
                                            + "    register-name: reg\n"
                                            + "    address: '0x1-0'\n"
                                            + "    bitrange: 3..0\n"
                                            + "    repeat: 8\n"
                                            + "    field-repeat: 2\n"
                                            + "    stride: -16\n"
                                            + "    field-stride: -4\n"
                                            + "    endianness: le\n"
                                            + "    behavior: {type: control}\n");
    Assertions.assertEquals(64, config.busWidth());
    Assertions.assertEquals(Endianness.BIG, config.endianness());
    FieldConfig field = config.fields().get(0);
    Assertions.assertEquals("reg", field.registerName());
    Assertions.assertEquals("0x1-0", field.address());
    Assertions.assertEquals(8, field.repeat());
    Assertions.assertEquals(2, field.fieldRepeat());
    Assertions.assertEquals(-16L, field.stride());
    Assertions.assertEquals(-4, field.fieldStride());
    Assertions.assertEquals(Endianness.LITTLE, field.endianness());
  }

  @Test
  void testCustomBehavior() throws RegmapException {
    RegisterFileConfig config =
        loader.load("name: r\nfields:\n  - name: f\n    address: 0\n    behavior: {type: counter, saturate: true, step: 2}\n");
    Assertions.assertEquals(new CustomConfig("counter", Map.of("saturate", true, "step", 2)), config.fields().get(0).behavior());
  }

  @Test
  void testUnknownKeysAreIgnored() throws RegmapException {
    RegisterFileConfig config =
        loader.load("name: r\ncolor: blue\nfields:\n  - name: f\n    address: 0\n    doc: nothing\n    behavior: status\n");
    Assertions.assertEquals(1, config.fields().size());
  }

  private void assertConfigError(String yaml, String messagePart) {
    RegmapException e = Assertions.assertThrows(RegmapException.class, () -> loader.load(yaml));
    Assertions.assertEquals(DiagnosticCategory.CONFIGURATION, e.getCategory());
    Assertions.assertTrue(e.getDiagnostic().message().contains(messagePart), e.getDiagnostic().message());
  }

  @Test
  void testErrors() {
    assertConfigError("fields: []\n", "has no name");
    assertConfigError("- a\n- b\n", "must be a mapping");
    assertConfigError("name: r\nbus-width: 16\n", "bus width must be 32 or 64");
    assertConfigError("name: r\nendianness: middle\n", "unknown endianness 'middle'");
    assertConfigError("name: r\nfields: {}\n", "`fields` must be a list");
    assertConfigError("name: r\nfields:\n  - name: f\n    behavior: status\n", "field `f` has no address");
    assertConfigError("name: r\nfields:\n  - name: f\n    address: 0\n", "field `f` has no behavior");
    assertConfigError("name: r\nfields:\n  - name: f\n    address: 0\n    behavior: constant\n", "needs a value");
    assertConfigError("name: r\nfields:\n  - name: f\n    address: 0\n    behavior: {reset: 1}\n", "has no type");
    assertConfigError("name: r\nfields:\n  - name: f\n    address: 0\n    behavior: {type: external, read: false, write: false}\n",
                      "readable, writable or both");
    assertConfigError("name: r\nfields:\n  - name: f\n    address: 0\n    bitrange: 0..3\n    behavior: status\n", "invalid bitrange");
    assertConfigError("name: r\nfields:\n  - name: f\n    address: 0\n    repeat: 2\n    field-repeat: 3\n    behavior: status\n",
                      "field-repeat 3 outside 1..2");
    assertConfigError("name: r\nfields:\n  - name: f\n    address: 0\n    repeat: two\n    behavior: status\n", "must be an integer");
    assertConfigError("name: [r\n", "malformed YAML");
  }

  @Test
  void testParseBitrange() throws RegmapException {
    Assertions.assertArrayEquals(new int[] {7, 0}, ConfigLoader.parseBitrange("7..0"));
    Assertions.assertArrayEquals(new int[] {31, 24}, ConfigLoader.parseBitrange(" 31 .. 24 "));
    Assertions.assertArrayEquals(new int[] {3, 3}, ConfigLoader.parseBitrange("3"));
    Assertions.assertArrayEquals(new int[] {5, 5}, ConfigLoader.parseBitrange(5));
    Assertions.assertThrows(RegmapException.class, () -> ConfigLoader.parseBitrange("7:0"));
    Assertions.assertThrows(RegmapException.class, () -> ConfigLoader.parseBitrange(1.5));
  }
}
