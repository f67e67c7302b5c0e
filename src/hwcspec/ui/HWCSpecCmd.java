package hwcspec.ui;

import hwcspec.HWCSpec;
import hwcspec.SpecConsistencyException;
import hwcspec.data.CounterVisibility;
import hwcspec.data.SpecDatab;
import hwcspec.data.SpecFormatException;
import hwcspec.data.SpecWriter;
import hwcspec.drc.CheckResult;
import hwcspec.drc.SpecDRC;
import hwcspec.equation.EquationRenderer;
import hwcspec.equation.UnmappedConstantException;
import hwcspec.view.CounterView;
import hwcspec.view.IndexedView;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class HWCSpecCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("hwcspeccmd - validate a GPU hardware counter specification and compile per-product counter views", options);
    System.exit(-1);
  };

  static {
    options.addOption(Option.builder("d")
                          .longOpt("database")
                          .argName("directory")
                          .hasArg()
                          .required(true)
                          .desc("Directory holding the counter specification database")
                          .build());
    options.addOption(Option.builder("w").longOpt("overwrite").required(false).desc("Rewrite the counter files to apply suggested edits").build());
    options.addOption(Option.builder("p")
                          .longOpt("product")
                          .argName("product name")
                          .hasArg()
                          .required(false)
                          .desc("Print the counter expressions of a product")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("visibility")
                          .argName("level")
                          .hasArg()
                          .required(false)
                          .desc("Highest counter visibility printed for --product. Must be one of: " +
                                Stream.of(CounterVisibility.values()).map(level -> level.name().toLowerCase(Locale.ROOT)).toList())
                          .build());
    options.addOption(Option.builder().longOpt("native-only").required(false).desc("Print no derived counters for --product").build());
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

    HWCSpecConfig config = null;
    try {
      config = parseArgs(args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }
    System.exit(run(config, System.out));
  }

  /**
   * Parses the command line into tool options and applies the requested log level.
   * @param args command line arguments
   * @return the tool options
   * @throws ParseException if the command line is invalid
   */
  static HWCSpecConfig parseArgs(String[] args) throws ParseException {
    CommandLine line = new DefaultParser().parse(options, args);

    // print help if requested
    if (line.hasOption("h")) {
      printHelpAndExit(options);
    }

    HWCSpecConfig config = new HWCSpecConfig();
    config.database_dir = line.getOptionValue("d");
    config.overwrite = line.hasOption("w");
    config.product = line.getOptionValue("p", "");
    config.allow_derived = !line.hasOption("native-only");
    if (line.hasOption("visibility")) {
      String level = line.getOptionValue("visibility");
      config.max_visibility = parseVisibility(level).orElseThrow(() -> new ParseException("Unknown visibility level " + level));
    }

    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    return config;
  }

  static Optional<CounterVisibility> parseVisibility(String level) {
    return Stream.of(CounterVisibility.values())
        .filter(value -> value.name().equalsIgnoreCase(level.replace(' ', '_')) || value.serialName.equalsIgnoreCase(level))
        .findAny();
  }

  /**
   * Validates the database and carries out the requested actions.
   * @param config the tool options
   * @param out stream receiving the counter expression listing
   * @return the process exit code, 0 if no failures were detected
   */
  static int run(HWCSpecConfig config, PrintStream out) {
    assert config.database_dir != null && !config.database_dir.isEmpty() : "No database directory selected!";
    File root = new File(config.database_dir);

    HWCSpec spec;
    try {
      spec = HWCSpec.load(root);
    } catch (SpecFormatException e) {
      logger.error("Cannot load the counter specification: {}", e.getMessage());
      return 1;
    }

    List<CheckResult> results = new SpecDRC(spec).runAll();
    int errors = CheckResult.totalErrors(results);
    logger.debug("Failures by kind: {}", SpecDRC.countByKind(results));

    if (config.overwrite) {
      try {
        new SpecWriter().writeCounters(spec.getDatabase().counters(), new File(root, SpecDatab.COUNTERS_DIR));
      } catch (IOException e) {
        logger.error("Cannot write the counter database: {}", e.getMessage());
        errors++;
      }
    }

    if (!config.product.isEmpty()) {
      try {
        printExpressions(spec, config, out);
      } catch (SpecConsistencyException e) {
        logger.error("Cannot compile {}: {}", config.product, e.getMessage());
        errors++;
      }
    }

    if (errors > 0) {
      logger.error("Total of {} failures detected", errors);
      return 1;
    }
    logger.info("No failures detected");
    return 0;
  }

  private static void printExpressions(HWCSpec spec, HWCSpecConfig config, PrintStream out) {
    // Expressions are rendered against the complete view, they may use counters that are filtered out
    IndexedView full = spec.getIndexedViewFor(config.product);
    IndexedView shown = full.filter(config.max_visibility, config.allow_derived);
    logger.info("{} of {} counters of {} shown", shown.size(), full.size(), config.product);
    for (CounterView counter : shown.counters()) {
      out.println(counter.getMachineName() + " (" + counter.getStableId() + ")");
      if (counter.isDerived()) {
        if (counter.getEquationAstResolved().isEmpty()) {
          out.println("  unresolved: " + counter.getEquationResolveError().orElse("equation does not parse"));
          continue;
        }
        out.println("  machine:    " + EquationRenderer.machineNameExpression(full, counter));
        out.println("  hardware:   " + EquationRenderer.sourceNameExpression(full, counter));
      } else {
        out.println("  hardware:   " + counter.getSourceName().orElse(""));
      }
      try {
        out.println("  streamline: " + EquationRenderer.streamlineExpression(full, counter));
      } catch (UnmappedConstantException e) {
        logger.warn("No Streamline expression for {}: {}", counter.getMachineName(), e.getMessage());
      }
    }
  }
}
