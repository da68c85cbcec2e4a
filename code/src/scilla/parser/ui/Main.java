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
package scilla.parser.ui;

import java.io.File;
import java.io.PrintStream;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import scilla.parser.common.Logging;
import scilla.parser.common.Settings;
import scilla.parser.common.exceptions.AstVisitException;
import scilla.parser.common.exceptions.ContractIOException;
import scilla.parser.common.exceptions.InvalidOptionException;
import scilla.parser.common.exceptions.InvalidSyntaxException;
import scilla.parser.common.exceptions.ScillaException;
import scilla.parser.common.exceptions.ScillaFatal;
import scilla.parser.common.exceptions.StackMismatchException;
import scilla.parser.common.lang.Contract;
import scilla.parser.common.lang.Field;
import scilla.parser.common.lang.FieldList;
import scilla.parser.common.lang.Transition;

/**
 * Command line interface to the contract parser.  Logging options
 * can also be passed as Java properties.  See Settings.java.
 */
public class Main {
  private static final String VERBOSE_FLAG = "v";
  private static final String LOG_FLAG = "l";

  public static void main(String[] args) {
    try {
      String input = processArgs(args);
      Logger logger = setup();
      run(logger, input, System.out);
    } catch (ScillaFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  static Options initOptions() {
    Options opts = new Options();
    opts.addOption(VERBOSE_FLAG, "verbose", false, "Log at TRACE level (with -l)");
    opts.addOption(LOG_FLAG, "log", true, "Write debug log to file");
    return opts;
  }

  /**
   * Parse the command line, recording options in Settings
   * @param args
   * @return the input file name
   * @throws ScillaFatal with ERROR_COMMAND on bad arguments
   */
  static String processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      throw new ScillaFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      throw new ScillaFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(VERBOSE_FLAG)) {
      Settings.set(Settings.LOG_TRACE, "true");
    }
    if (cmd.hasOption(LOG_FLAG)) {
      Settings.set(Settings.LOG_FILE, cmd.getOptionValue(LOG_FLAG));
    }
    Settings.set(Settings.INPUT_FILENAME, remainingArgs[0]);
    return remainingArgs[0];
  }

  private static Logger setup() {
    try {
      Settings.initProperties();
      String logfile = Settings.get(Settings.LOG_FILE);
      boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
      return Logging.setupLogging(logfile, trace);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      throw new ScillaFatal(ExitCode.ERROR_COMMAND.code());
    }
  }

  /**
   * Parse the input and print the contract to out.
   * @throws ScillaFatal with the exit code for any failure
   */
  static void run(Logger logger, String input, PrintStream out) {
    try {
      Contract contract = ContractParser.parseContractFile(new File(input));
      print(contract, Settings.getBoolean(Settings.PRINT_TYPES), out);
      logger.debug("Done: " + input);
    } catch (ContractIOException e) {
      System.err.println("scilla-parser: " + e.getMessage());
      throw new ScillaFatal(ExitCode.ERROR_IO.code());
    } catch (InvalidSyntaxException e) {
      userError(logger, input, e);
      throw new ScillaFatal(ExitCode.ERROR_USER.code());
    } catch (StackMismatchException e) {
      reportInternalError(e);
      throw new ScillaFatal(ExitCode.ERROR_INTERNAL.code());
    } catch (AstVisitException e) {
      userError(logger, input, e);
      throw new ScillaFatal(ExitCode.ERROR_USER.code());
    } catch (InvalidOptionException e) {
      System.err.println("Error setting up options: " + e.getMessage());
      throw new ScillaFatal(ExitCode.ERROR_COMMAND.code());
    } catch (ScillaException e) {
      userError(logger, input, e);
      throw new ScillaFatal(ExitCode.ERROR_USER.code());
    } catch (RuntimeException e) {
      reportInternalError(e);
      throw new ScillaFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  static void print(Contract contract, boolean types, PrintStream out) {
    out.println("contract " + contract.name());
    out.println("init params:");
    printFields(contract.initParams(), types, out);
    out.println("fields:");
    printFields(contract.fields(), types, out);
    out.println("transitions:");
    for (Transition t: contract.transitions()) {
      out.println("  " + t.name());
      for (Field param: t.params()) {
        out.println("    " + fieldString(param, types));
      }
    }
  }

  private static void printFields(FieldList fields, boolean types,
                                  PrintStream out) {
    for (Field f: fields) {
      out.println("  " + fieldString(f, types));
    }
  }

  private static String fieldString(Field f, boolean types) {
    if (types) {
      return f.name() + " : " + f.type();
    }
    return f.name();
  }

  private static void userError(Logger logger, String input,
                                ScillaException e) {
    System.err.println("scilla-parser error in " + input + ":");
    System.err.println(e.getMessage());
    if (logger.isDebugEnabled()) {
      logger.debug("Failed on " + input, e);
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("SCILLA PARSER INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("scilla-parser [options] <contract.scilla>", opts);
  }
}
