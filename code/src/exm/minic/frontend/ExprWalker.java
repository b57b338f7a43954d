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

import java.util.List;

import exm.minic.ast.AstKind;
import exm.minic.ast.AstNode;
import exm.minic.common.exceptions.MiniCRuntimeError;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;
import exm.minic.frontend.tree.FunctionCall;
import exm.minic.frontend.tree.Literals;
import exm.minic.frontend.tree.Operators;

/**
 * Translates expressions.
 *
 * Each binary precedence level is a flat list of operands and operators,
 * which is folded left to right into a left-associative tree.  A level
 * with no operators produces no node of its own.
 */
public class ExprWalker {

  /**
   * Translate any expression node
   * @param context
   * @param node a precedence level, unary, call, literal or lvalue node
   * @return root of translated subtree
   */
  public AstNode walkExpr(Context context, ParseNode node) {
    context.syncFilePos(node);
    return switch (node.rule()) {
      case LOGIC_OR_EXP, LOGIC_AND_EXP, EQ_EXP, REL_EXP, ADD_EXP, MUL_EXP ->
        binaryLevel(context, node);
      case UNARY_OP_EXP -> unaryOp(context, node);
      case CALL_EXP -> functionCall(context, node);
      case LITERAL_EXP -> literal(node);
      case LVAL -> lValue(node);
      case COMPILE_UNIT, FUNC_DEF, VAR_DECL, BLOCK, RETURN_STMT, ASSIGN_STMT,
           EXPR_STMT, IF_STMT, WHILE_STMT, BREAK_STMT, CONTINUE_STMT,
           ARG_LIST, TERMINAL ->
        throw new MiniCRuntimeError("Unexpected " + node
                                    + " in expression at " + context);
    };
  }

  private AstNode binaryLevel(Context context, ParseNode level) {
    List<ParseNode> operands = level.nonTerminals();
    List<ParseNode> operators = level.terminals();
    if (operands.size() != operators.size() + 1) {
      throw new MiniCRuntimeError(level + " has " + operands.size()
              + " operands for " + operators.size() + " operators");
    }

    AstNode result = walkExpr(context, operands.get(0));
    for (int i = 0; i < operators.size(); i++) {
      ParseNode op = operators.get(i);
      AstKind kind = Operators.binaryOp(level.rule(), op);
      AstNode right = walkExpr(context, operands.get(i + 1));
      result = AstNode.newBinary(kind, op.line(), result, right);
    }
    if (!operators.isEmpty()) {
      LogHelper.trace(context, level.rule() + ": folded "
                      + operators.size() + " operators");
    }
    return result;
  }

  private AstNode unaryOp(Context context, ParseNode node) {
    List<ParseNode> ops = node.terminals();
    List<ParseNode> operands = node.nonTerminals();
    if (ops.size() != 1 || operands.size() != 1) {
      throw new MiniCRuntimeError("Malformed unary expression " + node);
    }
    ParseNode op = ops.get(0);
    AstKind kind = Operators.unaryOp(op);
    return AstNode.newUnary(kind, op.line(), walkExpr(context,
                                                      operands.get(0)));
  }

  /**
   * Callee name leaf and argument list.  The argument list is always
   * present, even when empty.
   */
  public AstNode functionCall(Context context, ParseNode node) {
    FunctionCall call = FunctionCall.fromCST(node);
    LogHelper.trace(context, "call " + call.function() + " with "
                    + call.args().size() + " args");
    AstNode params = AstNode.newContainer(AstKind.FUNC_REAL_PARAMS,
                                          call.line());
    context.enter();
    for (ParseNode arg: call.args()) {
      params.insertSonNode(walkExpr(context, arg));
    }
    context.exit();
    AstNode callee = AstNode.newVarId(call.function(), call.line());
    return AstNode.newBinary(AstKind.FUNC_CALL, call.line(), callee, params);
  }

  private AstNode literal(ParseNode node) {
    ParseNode tok = node.terminal(TokenKind.INT_CONST);
    return AstNode.newLiteral(Literals.parseIntLiteral(tok.text()),
                              tok.line());
  }

  /**
   * @return identifier leaf for a variable reference
   */
  public AstNode lValue(ParseNode node) {
    if (node.rule() != Rule.LVAL) {
      throw new MiniCRuntimeError("Expected lvalue but got " + node);
    }
    ParseNode id = node.terminal(TokenKind.ID);
    return AstNode.newVarId(id.text(), id.line());
  }
}
