/*
 * Copyright 2026 The Syntax Tree Translation Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.syntaxtree.conformance;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.gson.stream.JsonWriter;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;
import org.syntaxtree.ast.SyntaxNode.Program;
import org.syntaxtree.parser.ParseException;
import org.syntaxtree.parser.SyntaxTreeParser;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.translation.ParserTranslator;
import org.syntaxtree.whitequark.Node;
import org.syntaxtree.whitequark.RubyVersion;
import org.syntaxtree.whitequark.WhitequarkParser;

/**
 * Runs the conformance corpus from the command line. Exits with 0 when no case failed, 1 when
 * a case failed or could not run, and 2 for bad flags.
 *
 * <pre>
 * java org.syntaxtree.conformance.ConformanceRunner --ruby_version=3.0 --check_locations
 * </pre>
 */
public class ConformanceRunner {
  static final int EXIT_SUCCESS = 0;
  static final int EXIT_FAILURES = 1;
  static final int EXIT_BAD_FLAGS = 2;

  private static final Logger logger = Logger.getLogger(ConformanceRunner.class.getName());

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(name = "--corpus", usage = "The corpus file to run. Defaults to the bundled corpus")
    private File corpus = null;

    @Option(
        name = "--suppressions",
        usage = "A rules file with more suppressions. You may specify multiple")
    private List<File> suppressions = new ArrayList<>();

    @Option(
        name = "--ruby_version",
        usage = "The Ruby version the reference parser accepts, such as 3.1")
    private String rubyVersion = RubyVersion.LATEST.toString();

    @Option(name = "--engine", usage = "The Ruby engine suppressions are selected for")
    private String engine = Environment.DEFAULT_ENGINE;

    @Option(
        name = "--check_locations",
        handler = BooleanOptionHandler.class,
        usage = "Compares source maps as well as tree shapes. On by default when "
            + ConformanceOptions.PARSER_LOCATION_VARIABLE + " is set")
    private boolean checkLocations =
        System.getenv(ConformanceOptions.PARSER_LOCATION_VARIABLE) != null;

    @Option(name = "--filter", usage = "Only runs cases matching this label pattern")
    private String filter = null;

    @Option(name = "--json_report", usage = "Writes the results as JSON to this file")
    private File jsonReport = null;

    @Option(
        name = "--print_tree",
        handler = BooleanOptionHandler.class,
        usage = "Prints the reference and translated trees of each case and exits")
    private boolean printTree = false;

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for case reports")
    private String loggingLevel = Level.INFO.getName();
  }

  private final Flags flags = new Flags();
  private final String[] args;
  private final PrintStream out;
  private final PrintStream err;

  public ConformanceRunner(String[] args, PrintStream out, PrintStream err) {
    this.args = args.clone();
    this.out = out;
    this.err = err;
  }

  /** Runs the corpus and returns the exit status. */
  public int run() {
    CmdLineParser parser = new CmdLineParser(flags);
    ConformanceOptions options;
    Level loggingLevel;
    try {
      parser.parseArgument(processArgs(args));
      options = createOptions();
      loggingLevel = Level.parse(flags.loggingLevel);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return EXIT_BAD_FLAGS;
    } catch (IllegalArgumentException e) {
      err.println("ERROR - " + e.getMessage());
      parser.printUsage(err);
      return EXIT_BAD_FLAGS;
    }
    if (flags.displayHelp) {
      parser.printUsage(out);
      return EXIT_SUCCESS;
    }
    Logger.getLogger("org.syntaxtree").setLevel(loggingLevel);

    ImmutableList<TestCase> testCases = selectCases(options);
    if (options.isPrintTree()) {
      printTrees(options, testCases);
      return EXIT_SUCCESS;
    }

    SuppressionRegistry registry =
        SuppressionRegistries.buildSuppressionRegistry(options.getEnvironment());
    for (File file : options.getSuppressionFiles()) {
      registry = registry.union(SuppressionRegistry.fromFile(file, options.getEnvironment()));
    }
    logger.fine("running " + testCases.size() + " cases for " + options.getEnvironment());
    ImmutableList<CaseResult> results =
        DifferentialHarness.create(options, registry).runAll(testCases);
    new LoggingOutcomeReporter(logger).reportAll(results);
    if (options.getJsonReport() != null) {
      writeJsonReport(options.getJsonReport(), results);
    }
    for (CaseResult result : results) {
      if (result.outcome().isFailure()) {
        return EXIT_FAILURES;
      }
    }
    return EXIT_SUCCESS;
  }

  /** Splits {@code --flag=value} into the two tokens args4j expects. */
  private static List<String> processArgs(String[] args) {
    Pattern argPattern = Pattern.compile("(--?[a-zA-Z_]+)=(.*)");
    List<String> processedArgs = new ArrayList<>();
    for (String arg : args) {
      Matcher matcher = argPattern.matcher(arg);
      if (matcher.matches()) {
        processedArgs.add(matcher.group(1));
        processedArgs.add(matcher.group(2));
      } else {
        processedArgs.add(arg);
      }
    }
    return processedArgs;
  }

  @VisibleForTesting
  ConformanceOptions createOptions() {
    return new ConformanceOptions(flags.checkLocations)
        .setRubyVersion(RubyVersion.parse(flags.rubyVersion))
        .setEngine(flags.engine)
        .setCorpus(flags.corpus)
        .setSuppressionFiles(flags.suppressions)
        .setFilter(flags.filter == null ? null : LabelPattern.compile(flags.filter))
        .setJsonReport(flags.jsonReport)
        .setPrintTree(flags.printTree);
  }

  private static ImmutableList<TestCase> selectCases(ConformanceOptions options) {
    ImmutableList<TestCase> corpus = options.getCorpus() == null
        ? CorpusLoader.loadBundled()
        : CorpusLoader.load(options.getCorpus());
    LabelPattern filter = options.getFilter();
    if (filter == null) {
      return corpus;
    }
    ImmutableList.Builder<TestCase> selected = ImmutableList.builder();
    for (TestCase testCase : corpus) {
      if (filter.matches(testCase.label())) {
        selected.add(testCase);
      }
    }
    return selected.build();
  }

  private void printTrees(ConformanceOptions options, List<TestCase> testCases) {
    for (TestCase testCase : testCases) {
      out.println("# " + testCase.label());
      SourceBuffer buffer = new SourceBuffer(testCase.source());
      try {
        Node expected = WhitequarkParser.forVersion(options.getRubyVersion()).parse(buffer);
        out.println(expected == null ? "nil" : expected.toSexp());
      } catch (ParseException e) {
        out.println("reference parser: " + e.getMessage());
      }
      try {
        Program program = SyntaxTreeParser.create().parse(testCase.source());
        Node actual = new ParserTranslator(buffer).translate(program);
        out.println(actual == null ? "nil" : actual.toSexp());
      } catch (ParseException e) {
        out.println("primary parser: " + e.getMessage());
      }
    }
    out.flush();
  }

  private static void writeJsonReport(File file, List<CaseResult> results) {
    try (JsonWriter jsonWriter = new JsonWriter(
        new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), UTF_8)))) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginArray();
      for (CaseResult result : results) {
        jsonWriter.beginObject();
        jsonWriter.name("label").value(result.label());
        jsonWriter.name("outcome").value(result.outcome().name());
        if (result.rule() != null) {
          jsonWriter.name("rule").value(result.rule().toString());
        }
        if (result.difference() != null) {
          jsonWriter.name("path").value(result.difference().path());
          jsonWriter.name("reason").value(result.difference().reason());
        }
        if (result.message() != null) {
          jsonWriter.name("message").value(result.message());
        }
        if (result.staleSuppression()) {
          jsonWriter.name("staleSuppression").value(true);
        }
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static void main(String[] args) {
    System.exit(new ConformanceRunner(args, System.out, System.err).run());
  }
}
