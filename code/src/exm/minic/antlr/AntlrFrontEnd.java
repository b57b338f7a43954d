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
package exm.minic.antlr;

import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.tree.CommonTree;
import org.apache.log4j.Logger;

import exm.minic.antlr.gen.MiniCLexer;
import exm.minic.antlr.gen.MiniCParser;
import exm.minic.common.Logging;
import exm.minic.common.exceptions.InvalidSyntaxException;
import exm.minic.common.exceptions.LexicalException;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.common.exceptions.UserException;
import exm.minic.frontend.FrontEnd;
import exm.minic.frontend.cst.ParseNode;

/**
 * Front end using the ANTLR-generated lexer and parser
 */
public class AntlrFrontEnd implements FrontEnd {

  private final Logger logger = Logging.getMiniCLogger();

  @Override
  public ParseNode parse(String inputFile, String source)
                                          throws UserException {
    MiniCLexer lexer = new MiniCLexer(new ANTLRStringStream(source));
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    MiniCParser parser = new MiniCParser(tokens);

    MiniCParser.compileUnit_return unit;
    try {
      unit = parser.compileUnit();
    } catch (RecognitionException e) {
      throw new InvalidSyntaxException(inputFile, e.line,
                parser.getErrorMessage(e, parser.getTokenNames()));
    }

    /*
     * ANTLR recovers from errors and carries on, so the tree may be
     * returned even though input was bad.  Lexer errors take priority
     * since they usually cause the parser errors.
     */
    if (!lexer.getErrors().isEmpty()) {
      logErrors(inputFile, lexer.getErrors(), lexer.getErrorLines());
      throw new LexicalException(inputFile, lexer.getErrorLines().get(0),
                                 lexer.getErrors().get(0));
    }
    if (!parser.getErrors().isEmpty()) {
      logErrors(inputFile, parser.getErrors(), parser.getErrorLines());
      throw new InvalidSyntaxException(inputFile,
              parser.getErrorLines().get(0), parser.getErrors().get(0));
    }

    if (unit == null || !(unit.getTree() instanceof CommonTree)) {
      throw new MiniCRuntimeError("Parser returned no tree for "
                                  + inputFile);
    }
    logger.debug("Parsed " + tokens.size() + " tokens from " + inputFile);
    return new AntlrParseNode((CommonTree)unit.getTree());
  }

  private void logErrors(String inputFile, List<String> errors,
                         List<Integer> lines) {
    for (int i = 0; i < errors.size(); i++) {
      logger.debug(inputFile + ":" + lines.get(i) + ": " + errors.get(i));
    }
  }
}
