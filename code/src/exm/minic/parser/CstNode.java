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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.AbstractParseNode;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

/**
 * Parse tree node built by the hand-written {@link Parser}
 */
public class CstNode extends AbstractParseNode {
  private final Rule rule;
  private final int line;
  /** Null unless this is a terminal */
  private final Token token;
  private final List<ParseNode> children = new ArrayList<ParseNode>();

  public CstNode(Rule rule, int line) {
    this(rule, line, null);
  }

  private CstNode(Rule rule, int line, Token token) {
    this.rule = rule;
    this.line = line;
    this.token = token;
  }

  public static CstNode terminal(Token token) {
    return new CstNode(Rule.TERMINAL, token.line, token);
  }

  /**
   * Append child
   * @return this node
   */
  CstNode add(ParseNode child) {
    assert(token == null) : "Terminal can't have children";
    children.add(child);
    return this;
  }

  CstNode addToken(Token tok) {
    return add(terminal(tok));
  }

  @Override
  public Rule rule() {
    return rule;
  }

  @Override
  public TokenKind tokenKind() {
    if (token == null) {
      throw new MiniCRuntimeError(rule + " is not a token");
    }
    return token.kind;
  }

  @Override
  public String text() {
    if (token == null) {
      throw new MiniCRuntimeError(rule + " is not a token");
    }
    return token.lexeme;
  }

  @Override
  public int line() {
    return line;
  }

  @Override
  public List<ParseNode> children() {
    return Collections.unmodifiableList(children);
  }
}
