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
package exm.minic.frontend.cst;

import java.util.List;

/**
 * A node of a concrete parse tree, as seen by the translator.
 *
 * Any front end can supply a parse by implementing this view over its own
 * tree representation; {@link AbstractParseNode} derives the role-based
 * accessors from {@link #rule()} and {@link #children()}.
 */
public interface ParseNode {

  /**
   * @return production matched, or {@link Rule#TERMINAL} for a token
   */
  Rule rule();

  /**
   * @return kind of token. Only valid for terminals
   */
  TokenKind tokenKind();

  /**
   * @return source text of a token
   */
  String text();

  /**
   * @return line of the token, or of the token that defines a
   *        production, 0 if unknown
   */
  int line();

  /**
   * @return children in source order, empty for terminals
   */
  List<ParseNode> children();

  int childCount();

  ParseNode child(int i);

  /**
   * @return the only child matching the rule
   */
  ParseNode child(Rule rule);

  /**
   * @return the only child matching the rule, or null if absent
   */
  ParseNode optChild(Rule rule);

  /**
   * @return all children that are productions, in source order
   */
  List<ParseNode> nonTerminals();

  /**
   * @return all children that are tokens, in source order
   */
  List<ParseNode> terminals();

  /**
   * @return the first token child of this kind
   */
  ParseNode terminal(TokenKind kind);

  boolean isTerminal();
}
