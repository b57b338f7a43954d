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
package exm.minic.frontend;

import exm.minic.common.exceptions.UserException;
import exm.minic.frontend.cst.ParseNode;

/**
 * A lexer and parser pair that turns MiniC source into a parse tree.
 * Lexical and syntax errors are reported by throwing; a parse tree is
 * only returned for valid input.
 */
public interface FrontEnd {

  /**
   * @param inputFile name of input, used in error messages
   * @param source complete source text
   * @return root of parse tree, a COMPILE_UNIT
   * @throws UserException if the input has lexical or syntax errors
   */
  public ParseNode parse(String inputFile, String source)
                                            throws UserException;
}
