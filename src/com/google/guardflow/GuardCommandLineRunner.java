/*
 * Copyright 2026 The Guardflow Authors.
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

package com.google.guardflow;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import com.google.guardflow.cfg.BasicBlock;
import com.google.guardflow.cfg.CfgDotFormatter;
import com.google.guardflow.cfg.ControlFlowGraph;
import com.google.guardflow.cfg.ControlFlowGraphParseException;
import com.google.guardflow.cfg.ControlFlowGraphParser;
import com.google.guardflow.ir.SyntaxNode;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Checks from the command line whether a call is guarded by a platform test.
 *
 * <p>The control flow graph is read from a JSON description (see {@link ControlFlowGraphParser}).
 * The target is either the only call to a function ({@code --call}) or a statement given by its
 * syntax id ({@code --target}).
 *
 * <p>Exit status: 0 if the call is guaranteed to run on {@code --platform}, 1 if it is not, 2 on
 * usage, input or lookup errors.
 */
public class GuardCommandLineRunner {

  private static final Logger logger = Logger.getLogger(GuardCommandLineRunner.class.getName());

  static final int GUARANTEED = 0;
  static final int NOT_GUARANTEED = 1;
  static final int ERROR = 2;

  private static class Flags {
    @Option(name = "--help", usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--cfg",
        metaVar = "FILE",
        usage = "The JSON description of the control flow graph to analyze")
    private String cfg = null;

    @Option(
        name = "--call",
        metaVar = "NAME",
        usage = "The function whose only call site is checked",
        forbids = {"--target"})
    private String call = null;

    @Option(
        name = "--target",
        metaVar = "ID",
        usage = "The syntax id of the statement to check",
        forbids = {"--call"})
    private String target = null;

    @Option(
        name = "--platform",
        metaVar = "NAME",
        usage = "The platform the target must be guarded by")
    private String platform = "Windows";

    @Option(
        name = "--platform_check_function",
        metaVar = "NAME",
        usage =
            "A single-argument function recognized as a platform test. You may specify"
                + " multiple. Defaults to IsOSPlatform, isOSPlatform and isPlatform")
    private List<String> platformCheckFunctions = new ArrayList<>();

    @Option(
        name = "--merge_agreeing_paths",
        usage = "Keep a platform test established by every path joining at a block")
    private boolean mergeAgreeingPaths = false;

    @Option(
        name = "--dot_output_file",
        metaVar = "FILE",
        usage = "Also writes the control flow graph as a Graphviz dot file")
    private String dotOutputFile = null;

    @Option(name = "--json_output", usage = "Prints the result as a JSON object")
    private boolean jsonOutput = false;

    @Option(
        name = "--logging_level",
        hidden = true,
        usage = "The logging level (standard java.util.logging.Level values) for the analysis")
    private String loggingLevel = Level.WARNING.getName();
  }

  private final Flags flags = new Flags();
  private final CmdLineParser parser = new CmdLineParser(flags);
  private final PrintStream out;
  private final PrintStream err;
  private final boolean isConfigValid;

  GuardCommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    boolean valid = true;
    try {
      parser.parseArgument(args);
      if (!flags.displayHelp) {
        validateFlags();
      }
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      valid = false;
    }
    this.isConfigValid = valid;
  }

  private void validateFlags() throws CmdLineException {
    if (flags.cfg == null) {
      throw new CmdLineException(parser, "--cfg is required");
    }
    if (flags.call == null && flags.target == null) {
      throw new CmdLineException(parser, "One of --call or --target is required");
    }
    for (String function : flags.platformCheckFunctions) {
      if (function.isEmpty()) {
        throw new CmdLineException(parser, "--platform_check_function needs a non-empty name");
      }
    }
    try {
      Level.parse(flags.loggingLevel);
    } catch (IllegalArgumentException e) {
      throw new CmdLineException(parser, "Bad value for --logging_level: " + flags.loggingLevel, e);
    }
  }

  GuardAnalysisOptions createOptions() {
    GuardAnalysisOptions options = new GuardAnalysisOptions();
    if (!flags.platformCheckFunctions.isEmpty()) {
      options.setPlatformCheckFunctions(flags.platformCheckFunctions);
    }
    options.setMergeAgreeingPaths(flags.mergeAgreeingPaths);
    return options;
  }

  /** Runs the query and returns the exit status. */
  int run() {
    if (!isConfigValid || flags.displayHelp) {
      parser.printUsage(isConfigValid ? out : err);
      return isConfigValid ? GUARANTEED : ERROR;
    }
    Logger.getLogger("com.google.guardflow").setLevel(Level.parse(flags.loggingLevel));

    try {
      return doRun();
    } catch (IOException | ControlFlowGraphParseException | GuardLookupException e) {
      err.println("ERROR - " + e.getMessage());
      return ERROR;
    }
  }

  private int doRun() throws IOException, ControlFlowGraphParseException {
    String json = Files.asCharSource(new File(flags.cfg), UTF_8).read();
    ControlFlowGraph cfg = ControlFlowGraphParser.parse(json);
    logger.fine("Read " + cfg.getBlocks().size() + " blocks from " + flags.cfg);

    if (flags.dotOutputFile != null) {
      Files.asCharSink(new File(flags.dotOutputFile), UTF_8).write(CfgDotFormatter.toDot(cfg));
    }

    SyntaxNode statement =
        flags.call != null
            ? PlatformGuardFinder.findCallStatement(cfg, flags.call)
            : PlatformGuardFinder.findSyntax(cfg, flags.target);
    BasicBlock block = PlatformGuardFinder.findBlock(cfg, statement);
    PlatformCheck guard = new PlatformGuardFinder(createOptions()).findGuard(cfg, block);
    boolean guaranteed = guard.isGuaranteed(flags.platform, false);

    if (flags.jsonOutput) {
      new JsonGuardReportGenerator(out).generateReport(statement, block, guard, flags.platform);
    } else if (guaranteed) {
      out.println("All good");
    } else {
      out.println("Sorry, you must be on " + flags.platform);
    }
    return guaranteed ? GUARANTEED : NOT_GUARANTEED;
  }

  public static void main(String[] args) {
    System.exit(new GuardCommandLineRunner(args, System.out, System.err).run());
  }
}
