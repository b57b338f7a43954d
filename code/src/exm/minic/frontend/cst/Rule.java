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
 * Grammar productions, one per alternative the translator distinguishes.
 *
 * Children are listed in source order.  Tokens that only delimit syntax
 * (parentheses, braces, commas, semicolons) may be omitted by a front end.
 */
public enum Rule {
  /** (FUNC_DEF | VAR_DECL)* */
  COMPILE_UNIT,
  /** INT ID BLOCK.  Line of the function name */
  FUNC_DEF,
  /** INT ID+.  Line of INT */
  VAR_DECL,
  /** (statement | VAR_DECL)*.  Line of the opening brace */
  BLOCK,

  /** expr.  Line of RETURN */
  RETURN_STMT,
  /** LVAL expr.  Line of the '=' */
  ASSIGN_STMT,
  /** expr?.  An empty statement has no children */
  EXPR_STMT,
  /** expr statement statement?.  Line of IF */
  IF_STMT,
  /** expr statement.  Line of WHILE */
  WHILE_STMT,
  /** No children.  Line of BREAK */
  BREAK_STMT,
  /** No children.  Line of CONTINUE */
  CONTINUE_STMT,

  /*
   * Binary precedence levels, loosest first.  Each holds one or more
   * operands of the next level, and the operator tokens between them.
   * A parenthesised expression appears directly as its LOGIC_OR_EXP.
   */
  LOGIC_OR_EXP,
  LOGIC_AND_EXP,
  EQ_EXP,
  REL_EXP,
  ADD_EXP,
  MUL_EXP,

  /** (SUB | NOT) unary-operand.  Line of the operator */
  UNARY_OP_EXP,
  /** ID ARG_LIST?.  Line of the function name */
  CALL_EXP,
  /** expr+ */
  ARG_LIST,
  /** INT_CONST */
  LITERAL_EXP,
  /** ID */
  LVAL,

  /** A token */
  TERMINAL,
  ;

  public boolean isStatement() {
    switch (this) {
      case BLOCK:
      case RETURN_STMT:
      case ASSIGN_STMT:
      case EXPR_STMT:
      case IF_STMT:
      case WHILE_STMT:
      case BREAK_STMT:
      case CONTINUE_STMT:
        return true;
      default:
        return false;
    }
  }
}
