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
package exm.minic.ast;

/**
 * Kinds of AST node.  Each kind fixes how many children a node of that
 * kind may have.
 */
public enum AstKind {
  /* Leaves, carrying a payload */
  LEAF_LITERAL_UINT(Arity.LEAF),
  LEAF_VAR_ID(Arity.LEAF),
  LEAF_TYPE(Arity.LEAF),

  /* Containers, children in source order */
  COMPILE_UNIT(Arity.CONTAINER),
  BLOCK(Arity.CONTAINER),
  DECL_STMT(Arity.CONTAINER),
  FUNC_FORMAL_PARAMS(Arity.CONTAINER),
  FUNC_REAL_PARAMS(Arity.CONTAINER),

  /* Function definition: return type, formal params, body.
   * The name is held on the node itself */
  FUNC_DEF(Arity.TERNARY),
  /* Function call: callee name, real params */
  FUNC_CALL(Arity.BINARY),
  /* Variable definition: type, name */
  VAR_DECL(Arity.BINARY),

  /* Statements */
  RETURN(Arity.UNARY),
  ASSIGN(Arity.BINARY),
  IF(Arity.BINARY),
  IF_ELSE(Arity.TERNARY),
  WHILE(Arity.BINARY),
  BREAK(Arity.LEAF),
  CONTINUE(Arity.LEAF),

  /* Binary operators */
  ADD(Arity.BINARY, "+"),
  SUB(Arity.BINARY, "-"),
  MUL(Arity.BINARY, "*"),
  DIV(Arity.BINARY, "/"),
  MOD(Arity.BINARY, "%"),
  LT(Arity.BINARY, "<"),
  GT(Arity.BINARY, ">"),
  LE(Arity.BINARY, "<="),
  GE(Arity.BINARY, ">="),
  EQ(Arity.BINARY, "=="),
  NEQ(Arity.BINARY, "!="),
  LOGIC_AND(Arity.BINARY, "&&"),
  LOGIC_OR(Arity.BINARY, "||"),

  /* Unary operators */
  NEG(Arity.UNARY, "-"),
  NOT(Arity.UNARY, "!"),
  ;

  public static enum Arity {
    LEAF(0),
    UNARY(1),
    BINARY(2),
    TERNARY(3),
    CONTAINER(-1);

    /** Required child count, -1 if any number is allowed */
    private final int childCount;

    private Arity(int childCount) {
      this.childCount = childCount;
    }

    public int childCount() {
      return childCount;
    }

    public boolean isFixed() {
      return childCount >= 0;
    }
  }

  private final Arity arity;

  /** Operator as written in source, null if not an operator */
  private final String opSymbol;

  private AstKind(Arity arity) {
    this(arity, null);
  }

  private AstKind(Arity arity, String opSymbol) {
    this.arity = arity;
    this.opSymbol = opSymbol;
  }

  public Arity arity() {
    return arity;
  }

  public String opSymbol() {
    return opSymbol;
  }

  public boolean isContainer() {
    return arity == Arity.CONTAINER;
  }

  public boolean isOperator() {
    return opSymbol != null;
  }

  /**
   * @return true if nodes of this kind carry a payload
   */
  public boolean isPayloadLeaf() {
    return this == LEAF_LITERAL_UINT || this == LEAF_VAR_ID ||
           this == LEAF_TYPE;
  }
}
