package regmap.ui;

import java.io.File;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import regmap.Regmap;
import regmap.config.ConfigLoader;
import regmap.config.RegisterFileConfig;
import regmap.drc.RegmapException;

public class RegmapCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("regmapcmd - compile a register file description into address decoders", options);
    System.exit(-1);
  };

  static {
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("regfile.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the register file")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files; defaults to results")
                          .build());
    options.addOption(Option.builder("O").longOpt("optimize").required(false).desc("Omit decoder conditions on constant address bits").build());
    options.addOption(Option.builder("s").longOpt("strict").required(false).desc("Treat design rule warnings as errors").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    //////////   collect options   //////////
    RegmapConfig cfg = new RegmapConfig();
    String inputFile = "";
    String outputDir = "";
    try {
      CommandLine line = parse(args, cfg);
      inputFile = line.getOptionValue("i");
      outputDir = line.hasOption("o") ? line.getOptionValue("o") : "results";

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    //////////   load description and generate   //////////
    RegisterFileConfig regfile;
    try {
      regfile = new ConfigLoader().load(new File(inputFile));
    } catch (RegmapException e) {
      logger.fatal(e.getDiagnostic().render());
      System.exit(1);
      return;
    }
    boolean success = new Regmap(cfg).Generate(regfile, outputDir);

    System.exit(success ? 0 : 1);
  }

  /**
   * Parses the command line and transfers the tool flags into {@code cfg}.
   * Prints the help text and exits if requested.
   */
  static CommandLine parse(String[] args, RegmapConfig cfg) throws ParseException {
    CommandLineParser parser = new DefaultParser();
    // help must work without the required options
    if (args.length == 1 && (args[0].equals("-h") || args[0].equals("--help")))
      printHelpAndExit(options);
    CommandLine line = parser.parse(options, args);
    if (line.hasOption("h"))
      printHelpAndExit(options);
    cfg.optimize_decoders = line.hasOption("O");
    cfg.strict_drc = line.hasOption("s");
    return line;
  }
}
