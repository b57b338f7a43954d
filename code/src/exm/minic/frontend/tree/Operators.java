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

import java.util.EnumMap;
import java.util.Map;

import exm.minic.ast.AstKind;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

/**
 * Operator tokens accepted at each precedence level, and the AST node
 * kind each one produces
 */
public class Operators {

  private static final Map<Rule, Map<TokenKind, AstKind>> binaryOps
            = new EnumMap<Rule, Map<TokenKind, AstKind>>(Rule.class);

  private static final Map<TokenKind, AstKind> unaryOps
            = new EnumMap<TokenKind, AstKind>(TokenKind.class);

  static {
    addBinary(Rule.LOGIC_OR_EXP, TokenKind.OR, AstKind.LOGIC_OR);
    addBinary(Rule.LOGIC_AND_EXP, TokenKind.AND, AstKind.LOGIC_AND);
    addBinary(Rule.EQ_EXP, TokenKind.EQ, AstKind.EQ);
    addBinary(Rule.EQ_EXP, TokenKind.NE, AstKind.NEQ);
    addBinary(Rule.REL_EXP, TokenKind.LT, AstKind.LT);
    addBinary(Rule.REL_EXP, TokenKind.GT, AstKind.GT);
    addBinary(Rule.REL_EXP, TokenKind.LE, AstKind.LE);
    addBinary(Rule.REL_EXP, TokenKind.GE, AstKind.GE);
    addBinary(Rule.ADD_EXP, TokenKind.ADD, AstKind.ADD);
    addBinary(Rule.ADD_EXP, TokenKind.SUB, AstKind.SUB);
    addBinary(Rule.MUL_EXP, TokenKind.MUL, AstKind.MUL);
    addBinary(Rule.MUL_EXP, TokenKind.DIV, AstKind.DIV);
    addBinary(Rule.MUL_EXP, TokenKind.MOD, AstKind.MOD);

    unaryOps.put(TokenKind.SUB, AstKind.NEG);
    unaryOps.put(TokenKind.NOT, AstKind.NOT);
  }

  private static void addBinary(Rule level, TokenKind tok, AstKind kind) {
    Map<TokenKind, AstKind> ops = binaryOps.get(level);
    if (ops == null) {
      ops = new EnumMap<TokenKind, AstKind>(TokenKind.class);
      binaryOps.put(level, ops);
    }
    ops.put(tok, kind);
  }

  /**
   * @param level precedence level the operator appeared at
   * @param op operator token
   * @return node kind for the operator
   * @throws MiniCRuntimeError if the operator doesn't belong to the level
   */
  public static AstKind binaryOp(Rule level, ParseNode op) {
    Map<TokenKind, AstKind> ops = binaryOps.get(level);
    AstKind kind = (ops == null) ? null : ops.get(op.tokenKind());
    if (kind == null) {
      throw new MiniCRuntimeError("Operator " + op
                          + " is not valid at precedence level " + level);
    }
    return kind;
  }

  public static AstKind unaryOp(ParseNode op) {
    AstKind kind = unaryOps.get(op.tokenKind());
    if (kind == null) {
      throw new MiniCRuntimeError(op + " is not a unary operator");
    }
    return kind;
  }
}
