package regmap;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regmap.address.Direction;
import regmap.behavior.BehaviorRegistry;
import regmap.config.RegisterFileConfig;
import regmap.decoder.DecoderNode;
import regmap.decoder.DecoderPrinter;
import regmap.decoder.DecoderSynthesizer;
import regmap.drc.DRC;
import regmap.drc.RegmapException;
import regmap.model.Block;
import regmap.model.RegisterFile;
import regmap.model.RegisterFileBuilder;
import regmap.ui.RegmapConfig;
import regmap.util.FileWriter;
import regmap.util.VHDL;

/**
 * Entry point of the register file compiler: compiles descriptions, synthesizes the address decoders and writes them
 * out.
 */
public class Regmap {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final RegmapConfig cfg;
  private final BehaviorRegistry behaviors;
  private final VHDL vhdl = new VHDL();

  public Regmap(RegmapConfig cfg, BehaviorRegistry behaviors) {
    this.cfg = cfg;
    this.behaviors = behaviors;
  }

  public Regmap(RegmapConfig cfg) { this(cfg, BehaviorRegistry.standard()); }

  public Regmap() { this(new RegmapConfig()); }

  public BehaviorRegistry getBehaviors() { return behaviors; }

  public RegisterFile Compile(RegisterFileConfig config) throws RegmapException {
    logger.debug("Compiling register file {} with {} field entries", config.name(), config.fields().size());
    return new RegisterFileBuilder(behaviors).build(config);
  }

  /** Synthesizes the decoder of one direction of a compiled register file. */
  public DecoderNode<Block> Synthesize(RegisterFile registerFile, Direction direction) throws RegmapException {
    DecoderSynthesizer<Block> synthesizer =
        new DecoderSynthesizer<>(registerFile.getAddressSpace(direction).getWidth(), cfg.optimize_decoders, cfg.allow_decoder_overlap, false);
    synthesizer.addAll(registerFile.getAddressSpace(direction));
    return synthesizer.synthesize();
  }

  /** Renders both decoders of a compiled register file as VHDL processes. */
  public String RenderDecoders(RegisterFile registerFile) throws RegmapException {
    StringBuilder sb = new StringBuilder();
    sb.append(vhdl.CreateComment("Address decoders for register file " + registerFile.getName())).append("\n");
    for (Direction direction : Direction.values()) {
      DecoderNode<Block> decoder = Synthesize(registerFile, direction);
      String prefix = direction == Direction.READ ? "r" : "w";
      int tagWidth = registerFile.getDeferTags(direction).getWidth();
      DecoderPrinter<Block> printer = new DecoderPrinter<>(prefix + "_addr", block -> RenderBlock(block, prefix, tagWidth), vhdl);
      String body = printer.print(decoder);
      if (body.isEmpty())
        body = "null;";
      sb.append("\n");
      sb.append(vhdl.CreateInProc(false, direction.getModeName() + "_decoder", body));
      logger.debug("{} decoder: {} claim(s), {} branch(es)", direction, registerFile.getAddressSpace(direction).getClaims().size(),
                   decoder.countBranches());
    }
    return sb.toString();
  }

  private List<String> RenderBlock(Block block, String prefix, int tagWidth) {
    List<String> lines = new ArrayList<>();
    lines.add(vhdl.CreateComment(block.getOwner() + ", word " + block.getIndex() + " of " + block.getRegister().getWordCount()));
    lines.add(prefix + "_sel_" + block.getName() + " <= '1';");
    if (block.getDeferTag() != null)
      lines.add(prefix + "_tag <= " + block.getDeferTag().toLiteral(tagWidth) + ";");
    return lines;
  }

  /**
   * Compiles the description, runs the design rule checks and writes the decoders to
   * {@code <outPath>/<name><suffix>}.
   * @return false if compilation failed or a fatal design rule violation was found
   */
  public boolean Generate(RegisterFileConfig config, String outPath) {
    RegisterFile registerFile;
    String decoders;
    try {
      registerFile = Compile(config);
      // Check errors
      DRC drc = new DRC(registerFile);
      drc.SetErrLevel(cfg.strict_drc);
      drc.CheckAll();
      if (drc.HasFatalError()) {
        logger.fatal("Exiting due to DRC failure.");
        return false;
      }
      decoders = RenderDecoders(registerFile);
    } catch (RegmapException e) {
      logger.fatal(e.getDiagnostic().render());
      return false;
    }

    FileWriter writer = new FileWriter();
    writer.UpdateContent(registerFile.getName() + cfg.output_suffix, decoders);
    boolean success = writer.WriteFiles(outPath);
    if (success)
      logger.info("Generated register file {} with {} register(s)", registerFile.getName(), registerFile.getRegisters().size());
    return success;
  }
}
