/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.minic.ui;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.minic.common.Logging;
import exm.minic.common.Settings;
import exm.minic.common.exceptions.InvalidOptionException;
import exm.minic.common.exceptions.MiniCFatal;

/**
 * Command line interface to the MiniC front end.  Options can also be
 * passed as Java properties.  See Settings.java for handling of these
 * options; command line flags take precedence.
 */
public class Main {
  private static final String FRONTEND_FLAG = "F";
  private static final String COMPARE_FLAG = "C";

  public static void main(String[] args) {
    int exitCode = run(args);
    if (exitCode != ExitCode.SUCCESS.code()) {
      System.exit(exitCode);
    }
  }

  /**
   * Run the compiler with the given command line
   * @return process exit code
   */
  public static int run(String[] args) {
    try {
      Settings.initMiniCProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }

    try {
      Args minicArgs = processArgs(args);
      Logger logger = setupLogging();
      MiniCompiler compiler = new MiniCompiler(logger);

      if (minicArgs.outputFilename == null) {
        compiler.compile(minicArgs.inputFilename, System.out);
      } else {
        // Buffer so that a failed run leaves no output file behind
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        compiler.compile(minicArgs.inputFilename, buffer);
        writeOutput(buffer, new File(minicArgs.outputFilename));
      }
      return ExitCode.SUCCESS.code();
    } catch (MiniCFatal ex) {
      return ex.exitCode;
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option frontend = new Option(FRONTEND_FLAG, "frontend", true,
        "Front end to parse with: " + Settings.FRONTEND_ANTLR + " or "
        + Settings.FRONTEND_HANDWRITTEN);
    opts.addOption(frontend);

    opts.addOption(COMPARE_FLAG, "compare", false,
                   "Check that all front ends produce the same tree");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new MiniCFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(FRONTEND_FLAG)) {
      Settings.set(Settings.FRONTEND, cmd.getOptionValue(FRONTEND_FLAG));
    }
    if (cmd.hasOption(COMPARE_FLAG)) {
      Settings.set(Settings.COMPARE_FRONTENDS, "true");
    }
    try {
      Settings.validateProperties();
    } catch (InvalidOptionException ex) {
      System.err.println(ex.getMessage());
      usage(opts);
      throw new MiniCFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, "
              + "but got " + remainingArgs.length + " arguments");
      usage(opts);
      throw new MiniCFatal(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    Args result = new Args(input, output);
    recordArgValues(result);
    return result;
  }

  /**
   * Store in properties for later logging
   * @param args
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
  }

  private static Logger setupLogging() {
    try {
      String logfile = Settings.get(Settings.LOG_FILE);
      boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
      Logger logger = Logging.setupLogging(logfile, trace);
      if (logger.isDebugEnabled()) {
        for (String key: Settings.getKeys()) {
          logger.debug("Setting " + key + "=" + Settings.get(key));
        }
      }
      return logger;
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      throw new MiniCFatal(ExitCode.ERROR_COMMAND.code());
    }
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("minic [options] <input> [<output>]", opts);
  }

  private static void writeOutput(ByteArrayOutputStream buffer,
                                  File output) {
    try {
      FileUtils.writeByteArrayToFile(output, buffer.toByteArray());
    } catch (IOException e) {
      System.err.println("Error writing output file " + output + ": "
                         + e.getMessage());
      throw new MiniCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;

    public Args(String inputFilename, String outputFilename) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
    }
  }
}
