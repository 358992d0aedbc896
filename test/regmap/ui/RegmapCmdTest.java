package regmap.ui;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.MissingOptionException;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RegmapCmdTest {

  @Test
  void testFlags() throws ParseException {
    RegmapConfig cfg = new RegmapConfig();
    CommandLine line = RegmapCmd.parse(new String[] {"-i", "regs.yaml", "--optimize", "-s", "-o", "out"}, cfg);
    Assertions.assertEquals("regs.yaml", line.getOptionValue("i"));
    Assertions.assertEquals("out", line.getOptionValue("o"));
    Assertions.assertTrue(cfg.optimize_decoders);
    Assertions.assertTrue(cfg.strict_drc);
    Assertions.assertFalse(cfg.allow_decoder_overlap);
  }

  @Test
  void testDefaults() throws ParseException {
    RegmapConfig cfg = new RegmapConfig();
    CommandLine line = RegmapCmd.parse(new String[] {"--input", "regs.yaml"}, cfg);
    Assertions.assertFalse(line.hasOption("o"));
    Assertions.assertFalse(cfg.optimize_decoders);
    Assertions.assertFalse(cfg.strict_drc);
  }

  @Test
  void testMissingInput() {
    Assertions.assertThrows(MissingOptionException.class, () -> RegmapCmd.parse(new String[] {"-O"}, new RegmapConfig()));
  }
}
