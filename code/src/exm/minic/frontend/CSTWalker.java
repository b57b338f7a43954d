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

import exm.minic.ast.AstKind;
import exm.minic.ast.AstNode;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.tree.FunctionDecl;
import exm.minic.frontend.tree.If;
import exm.minic.frontend.tree.TypeTree;
import exm.minic.frontend.tree.VariableDeclaration;

/**
 * Translates a MiniC parse tree, from either front end, into an AST.
 *
 * The walk is a single depth-first pass: each method translates one
 * construct and returns the subtree for it.  Any unexpected shape in the
 * parse tree is a bug and aborts translation with
 * {@link MiniCRuntimeError}; no partial tree is returned.
 */
public class CSTWalker {

  private final ExprWalker exprWalker = new ExprWalker();

  /**
   * Translate a whole compile unit.
   * @param inputFile name of input, for logging
   * @param root COMPILE_UNIT parse node
   * @return root of the AST, frozen
   */
  public AstNode walk(String inputFile, ParseNode root) {
    Context context = new Context(inputFile);
    if (root.rule() != Rule.COMPILE_UNIT) {
      throw new MiniCRuntimeError("Expected compile unit at root but got "
                                  + root);
    }
    LogHelper.debug(context, "Translating " + inputFile);

    AstNode unit = AstNode.newContainer(AstKind.COMPILE_UNIT, 1);
    for (ParseNode decl: root.children()) {
      context.syncFilePos(decl);
      switch (decl.rule()) {
        case FUNC_DEF:
          unit.insertSonNode(functionDefinition(context, decl));
          break;
        case VAR_DECL:
          unit.insertSonNode(declaration(context, decl));
          break;
        default:
          throw new MiniCRuntimeError("Unexpected " + decl
                                      + " at top level of " + inputFile);
      }
    }
    unit.freeze();
    LogHelper.debug(context, "Translated " + unit.childCount()
                    + " top-level definitions");
    return unit;
  }

  private AstNode functionDefinition(Context context, ParseNode node) {
    FunctionDecl fn = FunctionDecl.fromCST(node);
    LogHelper.trace(context, "function " + fn.getName());
    AstNode returnType = TypeTree.typeLeaf(fn.getReturnType());
    AstNode params = AstNode.newContainer(AstKind.FUNC_FORMAL_PARAMS,
                                          fn.getLine());
    AstNode body = block(context, fn.getBody());
    return AstNode.newFuncDef(returnType, fn.getName(), fn.getLine(),
                              params, body);
  }

  private AstNode declaration(Context context, ParseNode node) {
    VariableDeclaration decl = VariableDeclaration.fromCST(node);
    LogHelper.trace(context, "declare " + decl.getNames().size()
                    + " variables");
    return decl.toAST();
  }

  private AstNode block(Context context, ParseNode node) {
    if (node.rule() != Rule.BLOCK) {
      throw new MiniCRuntimeError("Expected block but got " + node);
    }
    AstNode block = AstNode.newContainer(AstKind.BLOCK, node.line());
    context.enter();
    for (ParseNode item: node.children()) {
      AstNode stmt = blockItem(context, item);
      // Empty statements produce nothing
      if (stmt != null) {
        block.insertSonNode(stmt);
      }
    }
    context.exit();
    return block;
  }

  /**
   * Translate a statement or declaration
   * @return the subtree, or null for an empty statement
   */
  private AstNode blockItem(Context context, ParseNode node) {
    context.syncFilePos(node);
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(context, node.rule().toString());
      LogHelper.logChildren(context, node);
    }
    return switch (node.rule()) {
      case VAR_DECL -> declaration(context, node);
      case BLOCK -> block(context, node);
      case RETURN_STMT -> AstNode.newUnary(AstKind.RETURN, node.line(),
                                    exprWalker.walkExpr(context,
                                          onlyNonTerminal(node)));
      case ASSIGN_STMT -> assignment(context, node);
      case EXPR_STMT -> exprStatement(context, node);
      case IF_STMT -> ifStatement(context, node);
      case WHILE_STMT -> whileLoop(context, node);
      case BREAK_STMT -> AstNode.newLeaf(AstKind.BREAK, node.line());
      case CONTINUE_STMT -> AstNode.newLeaf(AstKind.CONTINUE, node.line());
      case COMPILE_UNIT, FUNC_DEF, LOGIC_OR_EXP, LOGIC_AND_EXP, EQ_EXP,
           REL_EXP, ADD_EXP, MUL_EXP, UNARY_OP_EXP, CALL_EXP, ARG_LIST,
           LITERAL_EXP, LVAL, TERMINAL ->
        throw new MiniCRuntimeError("Unexpected " + node
                                    + " in statement position");
    };
  }

  private AstNode assignment(Context context, ParseNode node) {
    AstNode target = exprWalker.lValue(node.child(Rule.LVAL));
    ParseNode value = null;
    for (ParseNode child: node.nonTerminals()) {
      if (child.rule() != Rule.LVAL) {
        value = child;
      }
    }
    if (value == null) {
      throw new MiniCRuntimeError("Assignment without value at " + node);
    }
    return AstNode.newBinary(AstKind.ASSIGN, node.line(), target,
                             exprWalker.walkExpr(context, value));
  }

  /**
   * The expression itself, without a wrapping node
   * @return null for an empty statement
   */
  private AstNode exprStatement(Context context, ParseNode node) {
    if (node.childCount() == 0) {
      return null;
    }
    return exprWalker.walkExpr(context, onlyNonTerminal(node));
  }

  private AstNode ifStatement(Context context, ParseNode node) {
    If ifStmt = If.fromCST(node);
    AstNode cond = exprWalker.walkExpr(context, ifStmt.getCondition());
    AstNode thenBranch = body(context, ifStmt.getThenBlock());
    if (ifStmt.hasElse()) {
      AstNode elseBranch = body(context, ifStmt.getElseBlock());
      return AstNode.newFixed(AstKind.IF_ELSE, node.line(), cond,
                              thenBranch, elseBranch);
    } else {
      return AstNode.newBinary(AstKind.IF, node.line(), cond, thenBranch);
    }
  }

  private AstNode whileLoop(Context context, ParseNode node) {
    if (node.nonTerminals().size() != 2) {
      throw new MiniCRuntimeError("while: expected condition and body at "
                                  + node);
    }
    AstNode cond = exprWalker.walkExpr(context, node.nonTerminals().get(0));
    AstNode body = body(context, node.nonTerminals().get(1));
    return AstNode.newBinary(AstKind.WHILE, node.line(), cond, body);
  }

  /**
   * Body of if, else or while.  An empty statement becomes an empty block
   * so the parent keeps its fixed number of children.
   */
  private AstNode body(Context context, ParseNode node) {
    context.enter();
    AstNode stmt = blockItem(context, node);
    context.exit();
    if (stmt == null) {
      return AstNode.newContainer(AstKind.BLOCK, node.line());
    }
    return stmt;
  }

  private static ParseNode onlyNonTerminal(ParseNode node) {
    if (node.nonTerminals().size() != 1) {
      throw new MiniCRuntimeError("Expected one subexpression in " + node
                      + " but found " + node.nonTerminals().size());
    }
    return node.nonTerminals().get(0);
  }
}
