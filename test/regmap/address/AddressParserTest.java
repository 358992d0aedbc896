package regmap.address;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

class AddressParserTest {

  @Test
  void testNumbers() throws RegmapException {
    AddressParser parser = new AddressParser(2, 32);
    Assertions.assertEquals(MaskedAddress.of(8, 0xFFFFFFFCL, 32), parser.parse(8));
    Assertions.assertEquals(MaskedAddress.of(8, 0xFFFFFFFCL, 32), parser.parse(8L));
    Assertions.assertEquals(MaskedAddress.of(1, 32), parser.parse(true));
    Assertions.assertEquals(MaskedAddress.of(0, 32), parser.parse(false));
  }

  @Test
  void testSuffixes() throws RegmapException {
    AddressParser parser = new AddressParser();
    Assertions.assertEquals("0x00000010/4", parser.parse("16/4").toDocString());
    Assertions.assertEquals("0x00000010/2", parser.parse("0x10|0x3").toDocString());
    Assertions.assertEquals(MaskedAddress.of(0x10, 0xF0, 32), parser.parse("0x13&0xF0"));
    Assertions.assertEquals(MaskedAddress.of(0x1000, 32), parser.parse("0x1_000"));
  }

  @Test
  void testHexWildcards() throws RegmapException {
    AddressParser parser = new AddressParser(0, 8);
    Assertions.assertEquals("0001----", parser.parse("0x1-").toBitString());
    Assertions.assertEquals("000001-1", parser.parse("0x[01-1]").toBitString());
    Assertions.assertEquals("1010-1-1", parser.parse("0xA[-1-1]").toBitString());
  }

  @Test
  void testBinary() throws RegmapException {
    AddressParser parser = new AddressParser(0, 8);
    Assertions.assertEquals("000001-0", parser.parse("0b1-0").toBitString());
    Assertions.assertEquals("0000-1--", parser.parse("0b-1--").toBitString());
    Assertions.assertEquals("00001100", parser.parse("0b11_00").toBitString());
  }

  @Test
  void testDefaultMaskIgnoresWordLsbs() throws RegmapException {
    AddressParser parser = new AddressParser(3, 32);
    Assertions.assertEquals("0x00000008/3", parser.parse("0x8").toDocString());
    Assertions.assertEquals("0x00000008", parser.parse("0x8|0").toDocString());
  }

  @Test
  void testErrors() {
    AddressParser parser = new AddressParser(0, 8);
    RegmapException e = Assertions.assertThrows(RegmapException.class, () -> parser.parse(0x100));
    Assertions.assertEquals(DiagnosticCategory.CONFIGURATION, e.getCategory());
    Assertions.assertEquals("address 0x100 is out of range for 8 bits", e.getDiagnostic().message());

    e = Assertions.assertThrows(RegmapException.class, () -> parser.parse("0x12345"));
    Assertions.assertTrue(e.getDiagnostic().message().contains("out of range for 8 bits"));

    e = Assertions.assertThrows(RegmapException.class, () -> parser.parse("abc"));
    Assertions.assertEquals("invalid address specification 'abc'", e.getDiagnostic().message());

    e = Assertions.assertThrows(RegmapException.class, () -> parser.parse("0x[01]"));
    Assertions.assertTrue(e.getDiagnostic().message().startsWith("nibble pattern must be of the form [bbbb]"));

    e = Assertions.assertThrows(RegmapException.class, () -> parser.parse("0xZ"));
    Assertions.assertTrue(e.getDiagnostic().message().contains("illegal hex digit"));

    Assertions.assertThrows(RegmapException.class, () -> parser.parse(new Object()));
  }

  @Test
  void testParseInteger() {
    Assertions.assertEquals(255, AddressParser.parseInteger("0xFF"));
    Assertions.assertEquals(5, AddressParser.parseInteger("0b101"));
    Assertions.assertEquals(8, AddressParser.parseInteger("0o10"));
    Assertions.assertEquals(-16, AddressParser.parseInteger("-0x10"));
    Assertions.assertEquals(1000, AddressParser.parseInteger("1_000"));
  }
}
