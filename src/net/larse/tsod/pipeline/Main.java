/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsod.pipeline;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import net.larse.tsod.algorithms.AdaptiveVarianceDetector;
import net.larse.tsod.algorithms.DiffDetector;
import net.larse.tsod.timeseries.MissingValuePolicy;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * detect &lt;csv&gt; --config &lt;json&gt; [--output-dir out] [--columns a,b] [--all]
 *     [--fill ffill|interpolate|drop] [--threads n]
 * generate-config &lt;csv&gt; [--output config.json] [--overwrite]
 * analyze-thresholds &lt;csv&gt; --config &lt;json&gt; [--output-dir analysis]
 *     [--output-prefix threshold_report] [--columns a,b]
 * edit-config &lt;json&gt; [--list] [--show column] [--copy source target]
 *     [--set column path value]... [--bulk-set path value a,b] [--save-as out] [--backup]
 * </pre>
 */
public final class Main {
  private static final Logger logger = LogManager.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  private static final String DETECT = "detect";
  private static final String GENERATE_CONFIG = "generate-config";
  private static final String ANALYZE_THRESHOLDS = "analyze-thresholds";
  private static final String EDIT_CONFIG = "edit-config";

  private static final Splitter COLUMN_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length == 0) {
      printUsage();
      return EXIT_FAILURE;
    }
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    try {
      switch (args[0]) {
        case DETECT:
          return detect(rest);
        case GENERATE_CONFIG:
          return generateConfig(rest);
        case ANALYZE_THRESHOLDS:
          return analyzeThresholds(rest);
        case EDIT_CONFIG:
          return editConfig(rest);
        case "help":
        case "-h":
        case "--help":
          printUsage();
          return EXIT_OK;
        default:
          logger.error("Unknown command '{}'", args[0]);
          printUsage();
          return EXIT_FAILURE;
      }
    } catch (ParseException | IllegalArgumentException e) {
      logger.error("Invalid arguments: {}", e.getMessage());
      return EXIT_FAILURE;
    } catch (IOException e) {
      logger.error("I/O error: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  static Options detectOptions() {
    Options options = new Options();
    options.addOption(Option.builder().longOpt("config").hasArg().argName("json").required()
        .desc("column configuration file").build());
    options.addOption(Option.builder().longOpt("output-dir").hasArg().argName("dir")
        .desc("directory for the labeled files (default: output)").build());
    options.addOption(Option.builder().longOpt("columns").hasArg().argName("a,b")
        .desc("comma separated columns to process").build());
    options.addOption(Option.builder().longOpt("all")
        .desc("process every configured column (default)").build());
    options.addOption(Option.builder().longOpt("fill").hasArg().argName("policy")
        .desc("missing values: ffill (default), interpolate or drop").build());
    options.addOption(Option.builder().longOpt("threads").hasArg().argName("n")
        .desc("worker threads (default: 1)").build());
    return options;
  }

  static Options generateConfigOptions() {
    Options options = new Options();
    options.addOption(Option.builder("o").longOpt("output").hasArg().argName("json")
        .desc("configuration file to write (default: config.json)").build());
    options.addOption(Option.builder("f").longOpt("overwrite")
        .desc("replace an existing configuration").build());
    return options;
  }

  static Options analyzeOptions() {
    Options options = new Options();
    options.addOption(Option.builder().longOpt("config").hasArg().argName("json").required()
        .desc("column configuration file").build());
    options.addOption(Option.builder().longOpt("output-dir").hasArg().argName("dir")
        .desc("directory for the report (default: analysis)").build());
    options.addOption(Option.builder().longOpt("output-prefix").hasArg().argName("prefix")
        .desc("report file prefix (default: threshold_report)").build());
    options.addOption(Option.builder().longOpt("columns").hasArg().argName("a,b")
        .desc("comma separated columns to analyze").build());
    return options;
  }

  static Options editConfigOptions() {
    Options options = new Options();
    options.addOption(Option.builder().longOpt("list")
        .desc("print the configured columns").build());
    options.addOption(Option.builder().longOpt("show").hasArg().argName("column")
        .desc("print the entry of a column").build());
    options.addOption(Option.builder().longOpt("copy").numberOfArgs(2)
        .argName("source> <target").desc("copy the entry of source over target").build());
    options.addOption(Option.builder().longOpt("set").numberOfArgs(3)
        .argName("column> <path> <value")
        .desc("set one parameter, e.g. ts_params.q 3; may be repeated").build());
    options.addOption(Option.builder().longOpt("bulk-set").numberOfArgs(3)
        .argName("path> <value> <a,b")
        .desc("set one parameter on several columns").build());
    options.addOption(Option.builder().longOpt("save-as").hasArg().argName("json")
        .desc("file for the edited configuration (default: config_edited.json)").build());
    options.addOption(Option.builder().longOpt("backup")
        .desc("copy the input to <name>.bak.json before saving").build());
    return options;
  }

  private static int detect(String[] args) throws ParseException, IOException {
    CommandLine cmd = new DefaultParser().parse(detectOptions(), args);
    CsvTable table = CsvTable.read(inputPath(cmd));
    DetectionConfig config = DetectionConfig.load(Paths.get(cmd.getOptionValue("config")));

    DetectionPipeline.Args pipelineArgs = new DetectionPipeline.Args();
    if (cmd.hasOption("fill")) {
      pipelineArgs.fillPolicy = MissingValuePolicy.fromName(cmd.getOptionValue("fill"));
    }
    if (cmd.hasOption("threads")) {
      pipelineArgs.threads = Integer.parseInt(cmd.getOptionValue("threads"));
    }
    List<String> columns = cmd.hasOption("all") ? null : columns(cmd);

    RunSummary summary = new DetectionPipeline(config, pipelineArgs).run(table, columns);
    ResultWriter writer = new ResultWriter(Paths.get(cmd.getOptionValue("output-dir", "output")));
    for (ColumnOutcome outcome : summary.getOutcomes()) {
      if (outcome.isSuccess()) {
        Path path = writer.write(outcome.getColumn(), outcome.getResult(), table);
        logger.info("{}: saved {}", outcome.getColumn(), path);
      }
    }
    logger.info("Columns processed: {}, errors: {}", summary.processed(), summary.errors());
    return summary.processed() > 0 ? EXIT_OK : EXIT_FAILURE;
  }

  private static int generateConfig(String[] args) throws ParseException, IOException {
    CommandLine cmd = new DefaultParser().parse(generateConfigOptions(), args);
    CsvTable table = CsvTable.read(inputPath(cmd));
    Path output = Paths.get(cmd.getOptionValue("output", "config.json"));
    new ConfigGenerator().generate(table, output, cmd.hasOption("overwrite"));
    return EXIT_OK;
  }

  private static int analyzeThresholds(String[] args) throws ParseException, IOException {
    CommandLine cmd = new DefaultParser().parse(analyzeOptions(), args);
    CsvTable table = CsvTable.read(inputPath(cmd));
    DetectionConfig config = DetectionConfig.load(Paths.get(cmd.getOptionValue("config")));

    ThresholdAnalysis analysis = new ThresholdAnalysis();
    List<ThresholdAnalysis.ColumnAnalysis> results = analysis.run(table, config, columns(cmd));
    analysis.write(Paths.get(cmd.getOptionValue("output-dir", "analysis")),
        cmd.getOptionValue("output-prefix", "threshold_report"), results);
    return EXIT_OK;
  }

  /**
   * Applies copies, then sets, then bulk sets, prints what was asked for and saves when
   * anything was edited or --save-as was given. The input file is never modified.
   */
  private static int editConfig(String[] args) throws ParseException, IOException {
    CommandLine cmd = new DefaultParser().parse(editConfigOptions(), args);
    Path input = inputPath(cmd);
    ConfigEditor editor = ConfigEditor.load(input);
    boolean edited = false;

    if (cmd.hasOption("copy")) {
      String[] values = cmd.getOptionValues("copy");
      editor.copy(values[0], values[1]);
      edited = true;
    }
    if (cmd.hasOption("set")) {
      String[] values = cmd.getOptionValues("set");
      if (values.length % 3 != 0) {
        throw new ParseException("--set takes <column> <path> <value>");
      }
      for (int i = 0; i < values.length; i += 3) {
        editor.set(values[i], values[i + 1], values[i + 2]);
      }
      edited = true;
    }
    if (cmd.hasOption("bulk-set")) {
      String[] values = cmd.getOptionValues("bulk-set");
      editor.bulkSet(values[0], values[1], COLUMN_SPLITTER.splitToList(values[2]));
      edited = true;
    }

    if (cmd.hasOption("list")) {
      List<String> columns = editor.list();
      for (int i = 0; i < columns.size(); i++) {
        System.out.println((i + 1) + ". " + columns.get(i));
      }
    }
    if (cmd.hasOption("show")) {
      System.out.println(editor.show(cmd.getOptionValue("show")));
    }
    if (edited || cmd.hasOption("save-as")) {
      Path output = Paths.get(cmd.getOptionValue("save-as", "config_edited.json"));
      if (output.toAbsolutePath().normalize().equals(input.toAbsolutePath().normalize())) {
        throw new ParseException("--save-as must not name the input configuration");
      }
      editor.save(output, input, cmd.hasOption("backup"));
    }
    return EXIT_OK;
  }

  private static Path inputPath(CommandLine cmd) throws ParseException {
    if (cmd.getArgs().length != 1) {
      throw new ParseException("expected exactly one input file, got " + cmd.getArgList());
    }
    return Paths.get(cmd.getArgs()[0]);
  }

  private static List<String> columns(CommandLine cmd) {
    return cmd.hasOption("columns")
        ? COLUMN_SPLITTER.splitToList(cmd.getOptionValue("columns"))
        : null;
  }

  private static void printUsage() {
    System.out.print(usage());
  }

  /** Command synopses followed by the detector parameters a configuration entry accepts. */
  static String usage() {
    StringWriter out = new StringWriter();
    PrintWriter writer = new PrintWriter(out);
    HelpFormatter formatter = new HelpFormatter();
    int width = formatter.getWidth();
    int leftPad = formatter.getLeftPadding();
    int descPad = formatter.getDescPadding();
    formatter.printHelp(writer, width, "tsod " + DETECT + " <csv>", null, detectOptions(),
        leftPad, descPad, null, true);
    formatter.printHelp(writer, width, "tsod " + GENERATE_CONFIG + " <csv>", null,
        generateConfigOptions(), leftPad, descPad, null, true);
    formatter.printHelp(writer, width, "tsod " + ANALYZE_THRESHOLDS + " <csv>", null,
        analyzeOptions(), leftPad, descPad, null, true);
    formatter.printHelp(writer, width, "tsod " + EDIT_CONFIG + " <json>", null,
        editConfigOptions(), leftPad, descPad, null, true);
    printParameters(writer, "outlier_params of the diff detector:",
        new DiffDetector.Args().describe());
    printParameters(writer, "ts_params of the adaptive_variance detector:",
        new AdaptiveVarianceDetector.Args().describe());
    writer.flush();
    return out.toString();
  }

  private static void printParameters(PrintWriter writer, String title, List<String> lines) {
    writer.println();
    writer.println(title);
    for (String line : lines) {
      writer.println("  " + line);
    }
  }
}
