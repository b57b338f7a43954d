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

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import exm.minic.ast.AstNode;
import exm.minic.common.Settings;
import exm.minic.common.exceptions.InvalidOptionException;
import exm.minic.common.exceptions.InvalidSyntaxException;
import exm.minic.common.exceptions.LexicalException;
import exm.minic.common.exceptions.MiniCFatal;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.common.exceptions.UserException;
import exm.minic.frontend.CSTWalker;
import exm.minic.frontend.FrontEndKind;
import exm.minic.frontend.cst.ParseNode;

/**
 * Runs a front end and the translator over an input file
 */
public class MiniCompiler {

  private final Logger logger;

  public MiniCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Translate the input file and write a dump of the AST.  Nothing is
   * written unless translation succeeds.
   * @param inputFile
   * @param output stream for the AST dump, left open
   * @throws MiniCFatal with the exit code if anything goes wrong
   */
  public void compile(String inputFile, OutputStream output) {
    try {
      logger.debug("minic starting on " + inputFile);
      String source = readInput(inputFile);
      AstNode ast = translate(inputFile, source);
      String dump = ast.printTree();
      try {
        IOUtils.write(dump, output, StandardCharsets.UTF_8);
        output.flush();
      } catch (IOException e) {
        System.err.println("I/O error while writing to output");
        System.err.println(e.getMessage());
        throw new MiniCFatal(ExitCode.ERROR_IO.code());
      }
      logger.debug("minic done");
    }
    catch (MiniCFatal e) {
      // Rethrow
      throw e;
    }
    catch (LexicalException e) {
      reportUserError(e);
      throw new MiniCFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (InvalidSyntaxException e) {
      reportUserError(e);
      throw new MiniCFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      reportUserError(e);
      throw new MiniCFatal(ExitCode.ERROR_USER.code());
    }
    catch (InvalidOptionException e) {
      System.err.println("minic error: " + e.getMessage());
      throw new MiniCFatal(ExitCode.ERROR_COMMAND.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new MiniCFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (Throwable e) {
      // Translator contract violation or other bug
      reportInternalError(e);
      throw new MiniCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Parse with the front end selected in settings and translate.
   * If front end comparison is enabled, the input is parsed with every
   * front end and the resulting trees must be identical.
   * @return root of the AST
   */
  public AstNode translate(String inputFile, String source)
      throws UserException, InvalidOptionException {
    FrontEndKind selected = FrontEndKind.fromSettings();
    AstNode ast = translate(selected, inputFile, source);

    if (Settings.getBoolean(Settings.COMPARE_FRONTENDS)) {
      for (FrontEndKind other: FrontEndKind.values()) {
        if (other == selected) {
          continue;
        }
        AstNode otherAst = translate(other, inputFile, source);
        if (!ast.sameStructure(otherAst)) {
          logger.debug(selected.settingName() + " front end:\n"
                                              + ast.printTree());
          logger.debug(other.settingName() + " front end:\n"
                                              + otherAst.printTree());
          throw new MiniCRuntimeError("Front ends " + selected.settingName()
              + " and " + other.settingName() + " produced different trees"
              + " for " + inputFile);
        }
        logger.debug("Front ends " + selected.settingName() + " and "
                     + other.settingName() + " agree");
      }
    }
    return ast;
  }

  public AstNode translate(FrontEndKind frontEnd, String inputFile,
                           String source) throws UserException {
    logger.debug("Parsing " + inputFile + " with " + frontEnd.settingName()
                 + " front end");
    ParseNode cst = frontEnd.create().parse(inputFile, source);
    return new CSTWalker().walk(inputFile, cst);
  }

  private String readInput(String inputFile) {
    try {
      return FileUtils.readFileToString(new File(inputFile),
                                        StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Error reading input file " + inputFile + ": "
                         + e.getMessage());
      throw new MiniCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private void reportUserError(UserException e) {
    System.err.println("minic error:");
    System.err.println(e.getMessage());
    if (logger.isDebugEnabled())
      logger.debug(ExceptionUtils.getStackTrace(e));
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("MINIC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
