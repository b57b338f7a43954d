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

import java.util.ArrayList;
import java.util.List;

import exm.minic.ast.AstKind;
import exm.minic.ast.AstNode;
import exm.minic.ast.BasicType;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

/**
 * One declaration line, e.g. int a, b, c;
 * All names share the base type.
 */
public class VariableDeclaration {
  private final ParseNode type;
  private final List<ParseNode> names;

  private VariableDeclaration(ParseNode type, List<ParseNode> names) {
    this.type = type;
    this.names = names;
  }

  public List<ParseNode> getNames() {
    return names;
  }

  /**
   * Build the declaration statement: one VAR_DECL per name.  The type is
   * resolved once and each VAR_DECL gets its own copy of the leaf.
   */
  public AstNode toAST() {
    AstNode decl = AstNode.newContainer(AstKind.DECL_STMT, type.line());
    BasicType baseType = TypeTree.resolve(type);
    for (ParseNode name: names) {
      AstNode typeLeaf = AstNode.newType(baseType, type.line());
      AstNode id = AstNode.newVarId(name.text(), name.line());
      decl.insertSonNode(AstNode.newBinary(AstKind.VAR_DECL, name.line(),
                                           typeLeaf, id));
    }
    return decl;
  }

  public static VariableDeclaration fromCST(ParseNode node) {
    if (node.rule() != Rule.VAR_DECL) {
      throw new MiniCRuntimeError("Expected declaration but got " + node);
    }
    ParseNode type = node.terminal(TokenKind.INT);
    List<ParseNode> names = new ArrayList<ParseNode>();
    for (ParseNode tok: node.terminals()) {
      if (tok.tokenKind() == TokenKind.ID) {
        names.add(tok);
      }
    }
    if (names.isEmpty()) {
      throw new MiniCRuntimeError("Declaration without names at " + node);
    }
    return new VariableDeclaration(type, names);
  }
}
