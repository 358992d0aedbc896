package regmap.ui;

/** Tool options of one generator run. */
public class RegmapConfig {
  /** Omit decoder conditions on bits that are constant over all mapped addresses. */
  public boolean optimize_decoders = false;
  /** Accept overlapping address patterns in the decoders; each match then runs all actions. */
  public boolean allow_decoder_overlap = false;
  /** Treat design rule warnings as errors. */
  public boolean strict_drc = false;
  /** Appended to the register file name to form the decoder output file name. */
  public String output_suffix = "_decoder.vhd";
}
