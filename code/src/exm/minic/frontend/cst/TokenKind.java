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

/**
 * Kinds of token the MiniC front ends produce.
 */
public enum TokenKind {
  LPAREN("'('"),
  RPAREN("')'"),
  LBRACE("'{'"),
  RBRACE("'}'"),
  SEMI("';'"),
  COMMA("','"),

  ASSIGN("'='"),
  ADD("'+'"),
  SUB("'-'"),
  MUL("'*'"),
  DIV("'/'"),
  MOD("'%'"),
  LT("'<'"),
  GT("'>'"),
  LE("'<='"),
  GE("'>='"),
  EQ("'=='"),
  NE("'!='"),
  AND("'&&'"),
  OR("'||'"),
  NOT("'!'"),

  INT("'int'"),
  RETURN("'return'"),
  IF("'if'"),
  ELSE("'else'"),
  WHILE("'while'"),
  BREAK("'break'"),
  CONTINUE("'continue'"),

  ID("identifier"),
  INT_CONST("integer literal"),
  EOF("end of input"),
  ;

  private final String description;

  private TokenKind(String description) {
    this.description = description;
  }

  /**
   * @return description for use in error messages
   */
  public String description() {
    return description;
  }
}
