/*
 * Copyright 2026 The Closure Compiler Authors.
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
package com.google.nnet.analysis;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * Command line tool that checks the computations described by JSON files (see {@link
 * ComputationJsonReader}). Diagnostics are logged; the process exits with status 1 if any
 * computation is malformed.
 */
public final class AnalyzerMain {

  private static final Logger logger = Logger.getLogger(AnalyzerMain.class.getName());

  @Option(
      name = "--check_rewrite",
      handler = BooleanOptionHandler.class,
      usage = "Also check that no variable is modified after it has been read.")
  private boolean checkRewrite = false;

  @Option(
      name = "--check_undefined",
      handler = BooleanOptionHandler.class,
      usage = "Check that no variable is read before it is written. Defaults to true.")
  private boolean checkUndefined = true;

  @Option(
      name = "--print_accesses",
      handler = BooleanOptionHandler.class,
      usage = "Print the per-buffer and per-instruction accesses of each valid computation.")
  private boolean printAccesses = false;

  @Argument private List<String> files = new ArrayList<>();

  public static void main(String[] args) throws IOException, CmdLineException {
    System.exit(new AnalyzerMain().run(args));
  }

  /** Checks every file named in {@code args} and returns the exit status. */
  int run(String[] args) throws IOException, CmdLineException {
    CmdLineParser parser = new CmdLineParser(this);
    parser.parseArgument(args);
    if (files.isEmpty()) {
      parser.printUsage(System.err);
      return 1;
    }

    CheckOptions options =
        new CheckOptions()
            .setCheckRewrite(checkRewrite)
            .setCheckUndefined(checkUndefined)
            .setPrintAccesses(printAccesses);
    LoggerErrorManager errorManager = new LoggerErrorManager(logger);
    // One context for the whole run, so the unused-input warning appears once.
    CheckContext context = new CheckContext(errorManager);

    int status = 0;
    for (String filename : files) {
      if (!checkFile(filename, options, context)) {
        status = 1;
      }
    }
    errorManager.generateReport();
    return status;
  }

  private static boolean checkFile(String filename, CheckOptions options, CheckContext context)
      throws IOException {
    ComputationJsonReader reader;
    try {
      reader = ComputationJsonReader.parse(Files.asCharSource(new File(filename), UTF_8).read());
    } catch (ComputationParseException e) {
      logger.severe(filename + ": " + e.getMessage());
      return false;
    }
    ComputationAnalysis analysis;
    try {
      analysis =
          new ComputationChecker(
                  options, reader.getComponents(), reader.getComputation(), context)
              .check();
    } catch (MalformedComputationException e) {
      // Already reported through the context's error handler.
      logger.fine(filename + " is malformed");
      return false;
    }
    if (options.getPrintAccesses()) {
      System.out.println(filename + ":");
      System.out.print(AccessTracePrinter.printBufferAccesses(analysis));
      System.out.print(AccessTracePrinter.printInstructionAttributes(analysis));
    }
    return true;
  }

  /**
   * Accepts {@code --flag}, {@code --flag true} and {@code --flag false}. A following argument
   * that is not a boolean word is left for the next handler.
   */
  public static class BooleanOptionHandler extends OptionHandler<Boolean> {
    private static final ImmutableSet<String> TRUES = ImmutableSet.of("true", "on", "yes", "1");
    private static final ImmutableSet<String> FALSES = ImmutableSet.of("false", "off", "no", "0");

    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      if (params.size() == 0) {
        setter.addValue(true);
        return 0;
      }
      String param = params.getParameter(0).toLowerCase(Locale.ROOT);
      if (TRUES.contains(param)) {
        setter.addValue(true);
      } else if (FALSES.contains(param)) {
        setter.addValue(false);
      } else {
        setter.addValue(true);
        return 0;
      }
      return 1;
    }

    @Override
    public String getDefaultMetaVariable() {
      return null;
    }
  }
}
