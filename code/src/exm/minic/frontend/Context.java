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

import exm.minic.frontend.cst.ParseNode;

/**
 * Position of the translator in the input: the file being translated,
 * the line of the construct being translated and how deeply nested it is.
 * Used for log and error messages only.
 */
public class Context {

  public static final int ROOT_LEVEL = 0;

  private final String inputFile;
  private int line = 0;

  /** Nesting depth of the construct being translated */
  private int level = ROOT_LEVEL;

  public Context(String inputFile) {
    this.inputFile = inputFile;
  }

  /**
   * Update the line from a parse node.  Nodes without line information
   * leave the current line unchanged.
   */
  public void syncFilePos(ParseNode node) {
    if (node.line() > 0) {
      this.line = node.line();
    }
  }

  public void enter() {
    level++;
  }

  public void exit() {
    assert(level > ROOT_LEVEL) : "Unbalanced exit at " + getLocation();
    level--;
  }

  public String getInputFile() {
    return inputFile;
  }

  public int getLine() {
    return line;
  }

  public final int getLevel() {
    return level;
  }

  /**
     @return E.g.; "file.c:42: "
   */
  public String getLocation() {
    return getInputFile() + ":" + getLine() + ": ";
  }

  @Override
  public String toString() {
    return getInputFile() + ":" + getLine();
  }
}
