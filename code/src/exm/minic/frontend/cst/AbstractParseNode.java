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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.minic.common.exceptions.MiniCRuntimeError;

/**
 * Role-based child lookup shared by all parse tree representations.
 * Subclasses only supply the node's own rule, token and children.
 */
public abstract class AbstractParseNode implements ParseNode {

  /** Children grouped by rule, built on first lookup */
  private ListMultimap<Rule, ParseNode> byRule = null;

  @Override
  public boolean isTerminal() {
    return rule() == Rule.TERMINAL;
  }

  @Override
  public int childCount() {
    return children().size();
  }

  @Override
  public ParseNode child(int i) {
    List<ParseNode> children = children();
    if (i < 0 || i >= children.size()) {
      throw new MiniCRuntimeError("No child " + i + " of " + describe()
                        + ": it has " + children.size() + " children");
    }
    return children.get(i);
  }

  @Override
  public ParseNode child(Rule rule) {
    List<ParseNode> matches = index().get(rule);
    if (matches.size() != 1) {
      throw new MiniCRuntimeError("Expected one " + rule + " child of "
              + describe() + " but found " + matches.size());
    }
    return matches.get(0);
  }

  @Override
  public ParseNode optChild(Rule rule) {
    List<ParseNode> matches = index().get(rule);
    if (matches.isEmpty()) {
      return null;
    } else if (matches.size() > 1) {
      throw new MiniCRuntimeError("Expected at most one " + rule
              + " child of " + describe() + " but found " + matches.size());
    }
    return matches.get(0);
  }

  @Override
  public List<ParseNode> nonTerminals() {
    List<ParseNode> result = new ArrayList<ParseNode>();
    for (ParseNode child: children()) {
      if (!child.isTerminal()) {
        result.add(child);
      }
    }
    return result;
  }

  @Override
  public List<ParseNode> terminals() {
    return Collections.unmodifiableList(index().get(Rule.TERMINAL));
  }

  @Override
  public ParseNode terminal(TokenKind kind) {
    for (ParseNode tok: index().get(Rule.TERMINAL)) {
      if (tok.tokenKind() == kind) {
        return tok;
      }
    }
    throw new MiniCRuntimeError("Expected " + kind.description()
                                + " token in " + describe());
  }

  private ListMultimap<Rule, ParseNode> index() {
    if (byRule == null) {
      byRule = ArrayListMultimap.create();
      for (ParseNode child: children()) {
        byRule.put(child.rule(), child);
      }
    }
    return byRule;
  }

  /**
   * @return short description for error messages
   */
  public String describe() {
    if (isTerminal()) {
      return tokenKind() + " '" + text() + "' at line " + line();
    }
    return rule() + " at line " + line();
  }

  @Override
  public String toString() {
    return describe();
  }
}
