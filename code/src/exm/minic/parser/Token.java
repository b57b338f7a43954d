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

import exm.minic.frontend.cst.TokenKind;

/**
 * A token produced by {@link Scanner}
 */
public class Token {
  public final TokenKind kind;
  public final String lexeme;
  public final int line;

  public Token(TokenKind kind, String lexeme, int line) {
    this.kind = kind;
    this.lexeme = lexeme;
    this.line = line;
  }

  /**
   * @return description for use in error messages
   */
  public String describe() {
    if (kind == TokenKind.EOF) {
      return kind.description();
    }
    return kind.description() + " '" + lexeme + "'";
  }

  @Override
  public String toString() {
    return kind + " '" + lexeme + "' @" + line;
  }
}
