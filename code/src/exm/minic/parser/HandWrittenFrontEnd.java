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
package exm.minic.parser;

import java.util.List;

import org.apache.log4j.Logger;

import exm.minic.common.Logging;
import exm.minic.common.exceptions.UserException;
import exm.minic.frontend.FrontEnd;
import exm.minic.frontend.cst.ParseNode;

/**
 * Front end built from {@link Scanner} and {@link Parser}
 */
public class HandWrittenFrontEnd implements FrontEnd {

  private final Logger logger = Logging.getMiniCLogger();

  @Override
  public ParseNode parse(String inputFile, String source)
                                            throws UserException {
    List<Token> tokens = new Scanner(inputFile, source).scanTokens();
    logger.debug("Scanned " + tokens.size() + " tokens from " + inputFile);
    return new Parser(inputFile, tokens).parse();
  }
}
