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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.tree.CommonTree;

import exm.minic.antlr.gen.MiniCParser;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.AbstractParseNode;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

/**
 * View of an ANTLR tree as a {@link ParseNode}.  Imaginary tokens in the
 * grammar map to rules, all other tokens are terminals.
 */
public class AntlrParseNode extends AbstractParseNode {
  private final CommonTree tree;
  private final Rule rule;

  /** Wrapped children, created on first access */
  private List<ParseNode> children = null;

  public AntlrParseNode(CommonTree tree) {
    this.tree = tree;
    this.rule = ruleFor(tree.getType());
  }

  @Override
  public Rule rule() {
    return rule;
  }

  @Override
  public TokenKind tokenKind() {
    if (rule != Rule.TERMINAL) {
      throw new MiniCRuntimeError(rule + " is not a token");
    }
    return tokenKindFor(tree.getType());
  }

  @Override
  public String text() {
    return tree.getText();
  }

  @Override
  public int line() {
    return tree.getLine();
  }

  @Override
  public List<ParseNode> children() {
    if (children == null) {
      List<ParseNode> wrapped = new ArrayList<ParseNode>(
                                          tree.getChildCount());
      for (int i = 0; i < tree.getChildCount(); i++) {
        wrapped.add(new AntlrParseNode((CommonTree)tree.getChild(i)));
      }
      children = Collections.unmodifiableList(wrapped);
    }
    return children;
  }

  private static Rule ruleFor(int type) {
    switch (type) {
      case MiniCParser.COMPILE_UNIT: return Rule.COMPILE_UNIT;
      case MiniCParser.FUNC_DEF: return Rule.FUNC_DEF;
      case MiniCParser.VAR_DECL: return Rule.VAR_DECL;
      case MiniCParser.BLOCK: return Rule.BLOCK;
      case MiniCParser.RETURN_STMT: return Rule.RETURN_STMT;
      case MiniCParser.ASSIGN_STMT: return Rule.ASSIGN_STMT;
      case MiniCParser.EXPR_STMT: return Rule.EXPR_STMT;
      case MiniCParser.IF_STMT: return Rule.IF_STMT;
      case MiniCParser.WHILE_STMT: return Rule.WHILE_STMT;
      case MiniCParser.BREAK_STMT: return Rule.BREAK_STMT;
      case MiniCParser.CONTINUE_STMT: return Rule.CONTINUE_STMT;
      case MiniCParser.LOGIC_OR_EXP: return Rule.LOGIC_OR_EXP;
      case MiniCParser.LOGIC_AND_EXP: return Rule.LOGIC_AND_EXP;
      case MiniCParser.EQ_EXP: return Rule.EQ_EXP;
      case MiniCParser.REL_EXP: return Rule.REL_EXP;
      case MiniCParser.ADD_EXP: return Rule.ADD_EXP;
      case MiniCParser.MUL_EXP: return Rule.MUL_EXP;
      case MiniCParser.UNARY_OP_EXP: return Rule.UNARY_OP_EXP;
      case MiniCParser.CALL_EXP: return Rule.CALL_EXP;
      case MiniCParser.ARG_LIST: return Rule.ARG_LIST;
      case MiniCParser.LITERAL_EXP: return Rule.LITERAL_EXP;
      case MiniCParser.LVAL: return Rule.LVAL;
      default: return Rule.TERMINAL;
    }
  }

  private static TokenKind tokenKindFor(int type) {
    switch (type) {
      case MiniCParser.LPAREN: return TokenKind.LPAREN;
      case MiniCParser.RPAREN: return TokenKind.RPAREN;
      case MiniCParser.LBRACE: return TokenKind.LBRACE;
      case MiniCParser.RBRACE: return TokenKind.RBRACE;
      case MiniCParser.SEMI: return TokenKind.SEMI;
      case MiniCParser.COMMA: return TokenKind.COMMA;
      case MiniCParser.ASSIGN: return TokenKind.ASSIGN;
      case MiniCParser.ADD: return TokenKind.ADD;
      case MiniCParser.SUB: return TokenKind.SUB;
      case MiniCParser.MUL: return TokenKind.MUL;
      case MiniCParser.DIV: return TokenKind.DIV;
      case MiniCParser.MOD: return TokenKind.MOD;
      case MiniCParser.LT: return TokenKind.LT;
      case MiniCParser.GT: return TokenKind.GT;
      case MiniCParser.LE: return TokenKind.LE;
      case MiniCParser.GE: return TokenKind.GE;
      case MiniCParser.EQ: return TokenKind.EQ;
      case MiniCParser.NE: return TokenKind.NE;
      case MiniCParser.AND: return TokenKind.AND;
      case MiniCParser.OR: return TokenKind.OR;
      case MiniCParser.NOT: return TokenKind.NOT;
      case MiniCParser.INT: return TokenKind.INT;
      case MiniCParser.RETURN: return TokenKind.RETURN;
      case MiniCParser.IF: return TokenKind.IF;
      case MiniCParser.ELSE: return TokenKind.ELSE;
      case MiniCParser.WHILE: return TokenKind.WHILE;
      case MiniCParser.BREAK: return TokenKind.BREAK;
      case MiniCParser.CONTINUE: return TokenKind.CONTINUE;
      case MiniCParser.ID: return TokenKind.ID;
      case MiniCParser.INT_CONST: return TokenKind.INT_CONST;
      case MiniCParser.EOF: return TokenKind.EOF;
      default:
        throw new MiniCRuntimeError("Unexpected token type " + type
                                    + " in parse tree");
    }
  }
}
