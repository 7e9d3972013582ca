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
package com.google.pygor.translate;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.Files;
import com.google.pygor.ast.AstJsonReader;
import com.google.pygor.ast.AstReadException;
import com.google.pygor.ast.Module;
import com.google.pygor.gen.CodePrinter;
import com.google.pygor.gen.GoFile;
import com.google.pygor.gen.RenderException;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * CommandLineRunner translates the syntax trees named on the command line and writes the
 * translated files to standard output, one after the other.
 *
 * <p>Each input is the JSON dump of one parsed source module. A module that fails to translate
 * stops the run unless {@code --ignore} is given.
 */
public class CommandLineRunner {
  private static final Logger logger = Logger.getLogger(CommandLineRunner.class.getName());

  /** The logger of every translator class, whose level {@code --logging_level} sets. */
  private static final Logger rootLogger = Logger.getLogger("com.google.pygor");

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--panic",
        handler = BooleanOptionHandler.class,
        usage = "Stop with an error on a construct that has no translation, instead of leaving a"
            + " marker comment in its place")
    private boolean panic = false;

    @Option(
        name = "--verbose",
        handler = BooleanOptionHandler.class,
        usage = "Trace scopes and statements as they are translated")
    private boolean verbose = false;

    @Option(
        name = "--lines",
        handler = BooleanOptionHandler.class,
        usage = "Precede every translated statement with a comment giving its source line")
    private boolean lines = false;

    @Option(
        name = "--ignore",
        handler = BooleanOptionHandler.class,
        usage = "Replace statements that fail to translate with an error comment, and report"
            + " files that fail to render without stopping")
    private boolean ignore = false;

    @Option(
        name = "--lambda_values",
        handler = BooleanOptionHandler.class,
        usage = "Translate a lambda into a function value rather than a function literal"
            + " called in place")
    private boolean lambdaValues = false;

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for the"
            + " translator's own messages")
    private String loggingLevel = Level.WARNING.getName();

    @Option(
        name = "--runtime_package",
        usage = "Import path of the support package the translated code calls into")
    private String runtimePackage = TranslatorOptions.DEFAULT_RUNTIME_PACKAGE;

    @Argument(metaVar = "FILE", usage = "JSON syntax tree dumps to translate")
    private List<String> files = new ArrayList<>();
  }

  private final Flags flags = new Flags();
  private final String[] args;
  private final PrintStream out;
  private final PrintStream err;

  public CommandLineRunner(String[] args) {
    this(args, System.out, System.err);
  }

  @VisibleForTesting
  CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.args = args.clone();
    this.out = out;
    this.err = err;
  }

  /** Runs the translator and returns the exit status. */
  public int run() {
    CmdLineParser parser = new CmdLineParser(flags);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return 1;
    }
    if (flags.displayHelp) {
      out.println("Usage: pygor [options] FILE...");
      parser.printUsage(out);
      return 0;
    }
    if (flags.files.isEmpty()) {
      err.println("ERROR - no input files.");
      parser.printUsage(err);
      return 1;
    }
    try {
      rootLogger.setLevel(Level.parse(flags.loggingLevel));
    } catch (IllegalArgumentException e) {
      err.println("ERROR - bad --logging_level: " + flags.loggingLevel);
      return 1;
    }

    TranslatorOptions options = createOptions();
    CodePrinter printer = new CodePrinter(options.getRuntimePackage());
    for (String file : flags.files) {
      if (!translateFile(file, options, printer)) {
        return 1;
      }
    }
    return 0;
  }

  @VisibleForTesting
  TranslatorOptions createOptions() {
    TranslatorOptions options = new TranslatorOptions();
    options.setUnknownConstructMode(
        flags.panic
            ? TranslatorOptions.UnknownConstructMode.PANIC
            : TranslatorOptions.UnknownConstructMode.COMMENT);
    options.setContinueAfterErrors(flags.ignore);
    options.setEmitLineNumbers(flags.lines);
    options.setVerbose(flags.verbose);
    options.setLambdasAsValues(flags.lambdaValues);
    options.setRuntimePackage(flags.runtimePackage);
    return options;
  }

  /** Translates and prints one file. Returns false if the run has to stop. */
  private boolean translateFile(String file, TranslatorOptions options, CodePrinter printer) {
    ErrorManager errorManager = new LoggerErrorManager(logger);
    try {
      String json = Files.asCharSource(new File(file), UTF_8).read();
      Module module = AstJsonReader.read(file, json);
      GoFile translated = new ModuleTranslator(options, errorManager).translate(module);
      out.print(printer.print(translated));
      out.flush();
      return true;
    } catch (IOException e) {
      err.println("ERROR - cannot read " + file + ": " + e.getMessage());
      return false;
    } catch (AstReadException e) {
      err.println("ERROR - " + file + ": " + e.getMessage());
      return false;
    } catch (TranslationException e) {
      // Reported to the error manager already.
      err.println("ERROR - " + file + ": translation failed");
      return false;
    } catch (RenderException e) {
      if (flags.ignore) {
        out.println("ERROR: " + file + ": " + e.getMessage());
        return true;
      }
      err.println("ERROR - " + file + ": " + e.getMessage());
      return false;
    } finally {
      errorManager.generateReport();
    }
  }

  public static void main(String[] args) {
    System.exit(new CommandLineRunner(args).run());
  }
}
