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
package exm.minic.frontend.tree;

import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

/**
 * Function definition header and body.  Functions take no parameters.
 */
public class FunctionDecl {
  private final ParseNode returnType;
  private final String name;
  private final int line;
  private final ParseNode body;

  private FunctionDecl(ParseNode returnType, String name, int line,
                       ParseNode body) {
    this.returnType = returnType;
    this.name = name;
    this.line = line;
    this.body = body;
  }

  public ParseNode getReturnType() {
    return returnType;
  }

  public String getName() {
    return name;
  }

  /**
   * @return line of the function name
   */
  public int getLine() {
    return line;
  }

  public ParseNode getBody() {
    return body;
  }

  public static FunctionDecl fromCST(ParseNode node) {
    if (node.rule() != Rule.FUNC_DEF) {
      throw new MiniCRuntimeError("Expected function definition but got "
                                  + node);
    }
    ParseNode name = node.terminal(TokenKind.ID);
    return new FunctionDecl(node.terminal(TokenKind.INT), name.text(),
                            name.line(), node.child(Rule.BLOCK));
  }
}
