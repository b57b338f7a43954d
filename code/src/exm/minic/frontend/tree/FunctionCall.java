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

import java.util.Collections;
import java.util.List;

import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

/**
 * A call to a named function with positional arguments
 */
public class FunctionCall {
  private final String function;
  private final int line;
  /** Argument expressions in order, empty for f() */
  private final List<ParseNode> args;

  private FunctionCall(String function, int line, List<ParseNode> args) {
    this.function = function;
    this.line = line;
    this.args = args;
  }

  public String function() {
    return function;
  }

  /**
   * @return line of the function name
   */
  public int line() {
    return line;
  }

  public List<ParseNode> args() {
    return args;
  }

  public static FunctionCall fromCST(ParseNode node) {
    if (node.rule() != Rule.CALL_EXP) {
      throw new MiniCRuntimeError("Expected call but got " + node);
    }
    ParseNode name = node.terminal(TokenKind.ID);
    ParseNode argList = node.optChild(Rule.ARG_LIST);
    List<ParseNode> args;
    if (argList == null) {
      args = Collections.emptyList();
    } else {
      args = argList.nonTerminals();
      if (args.isEmpty()) {
        throw new MiniCRuntimeError("Empty argument list for call to "
                                    + name.text() + " at " + node);
      }
    }
    return new FunctionCall(name.text(), name.line(), args);
  }
}
