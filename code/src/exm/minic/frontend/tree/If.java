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

import java.util.List;

import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;

public class If {

  private final ParseNode condition;
  private final ParseNode thenBlock;
  private final ParseNode elseBlock;

  public If(ParseNode condition, ParseNode thenBlock, ParseNode elseBlock) {
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  public ParseNode getCondition() {
    return condition;
  }

  public ParseNode getThenBlock() {
    return thenBlock;
  }

  /**
   * @return else branch, null if none
   */
  public ParseNode getElseBlock() {
    return elseBlock;
  }

  public boolean hasElse() {
    return elseBlock != null;
  }

  public static If fromCST(ParseNode node) {
    if (node.rule() != Rule.IF_STMT) {
      throw new MiniCRuntimeError("Expected if statement but got " + node);
    }
    List<ParseNode> parts = node.nonTerminals();
    int count = parts.size();
    if (count < 2 || count > 3)
      throw new MiniCRuntimeError("if: child count > 3 or < 2 at " + node);
    ParseNode elseBlock = (count == 3) ? parts.get(2) : null;
    return new If(parts.get(0), parts.get(1), elseBlock);
  }
}
