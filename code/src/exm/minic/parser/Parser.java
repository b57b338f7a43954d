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

import java.util.List;

import exm.minic.common.exceptions.InvalidSyntaxException;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

/**
 * Recursive descent parser for MiniC.  Builds a parse tree with the
 * shape described by {@link Rule}.  Stops at the first syntax error.
 */
public class Parser {

  /** Binary precedence levels, loosest first */
  private static final Rule LEVELS[] = {
    Rule.LOGIC_OR_EXP, Rule.LOGIC_AND_EXP, Rule.EQ_EXP,
    Rule.REL_EXP, Rule.ADD_EXP, Rule.MUL_EXP,
  };

  /** Operators accepted at each level */
  private static final TokenKind LEVEL_OPS[][] = {
    { TokenKind.OR },
    { TokenKind.AND },
    { TokenKind.EQ, TokenKind.NE },
    { TokenKind.LT, TokenKind.GT, TokenKind.LE, TokenKind.GE },
    { TokenKind.ADD, TokenKind.SUB },
    { TokenKind.MUL, TokenKind.DIV, TokenKind.MOD },
  };

  private final String inputFile;
  private final List<Token> tokens;
  private int current = 0;

  /**
   * @param inputFile name for error messages
   * @param tokens tokens ending with EOF
   */
  public Parser(String inputFile, List<Token> tokens) {
    this.inputFile = inputFile;
    this.tokens = tokens;
  }

  /**
   * compileUnit := (funcDef | varDecl)* EOF
   * @return root of parse tree
   * @throws InvalidSyntaxException
   */
  public CstNode parse() throws InvalidSyntaxException {
    CstNode unit = new CstNode(Rule.COMPILE_UNIT, peek().line);
    while (!check(TokenKind.EOF)) {
      // Both start with "int ID": a function has '(' next
      if (check(TokenKind.INT) && checkAhead(2, TokenKind.LPAREN)) {
        unit.add(funcDef());
      } else {
        unit.add(varDecl());
      }
    }
    consume(TokenKind.EOF, "Expected end of input");
    return unit;
  }

  private CstNode funcDef() throws InvalidSyntaxException {
    Token type = consume(TokenKind.INT, "Expected return type");
    Token name = consume(TokenKind.ID, "Expected function name");
    consume(TokenKind.LPAREN, "Expected '(' after function name");
    consume(TokenKind.RPAREN, "Expected ')': functions take no parameters");
    CstNode fn = new CstNode(Rule.FUNC_DEF, name.line);
    fn.addToken(type);
    fn.addToken(name);
    fn.add(block());
    return fn;
  }

  private CstNode varDecl() throws InvalidSyntaxException {
    Token type = consume(TokenKind.INT, "Expected declaration");
    CstNode decl = new CstNode(Rule.VAR_DECL, type.line);
    decl.addToken(type);
    decl.addToken(consume(TokenKind.ID, "Expected variable name"));
    while (match(TokenKind.COMMA)) {
      decl.addToken(consume(TokenKind.ID, "Expected variable name after ','"));
    }
    consume(TokenKind.SEMI, "Expected ';' after declaration");
    return decl;
  }

  private CstNode block() throws InvalidSyntaxException {
    Token lbrace = consume(TokenKind.LBRACE, "Expected '{'");
    CstNode block = new CstNode(Rule.BLOCK, lbrace.line);
    while (!check(TokenKind.RBRACE) && !check(TokenKind.EOF)) {
      if (check(TokenKind.INT)) {
        block.add(varDecl());
      } else {
        block.add(statement());
      }
    }
    consume(TokenKind.RBRACE, "Expected '}' to close block opened at line "
                              + lbrace.line);
    return block;
  }

  private CstNode statement() throws InvalidSyntaxException {
    Token tok = peek();
    switch (tok.kind) {
      case RETURN: {
        advance();
        CstNode ret = new CstNode(Rule.RETURN_STMT, tok.line);
        ret.add(expr());
        consume(TokenKind.SEMI, "Expected ';' after return value");
        return ret;
      }
      case LBRACE:
        return block();
      case IF: {
        advance();
        CstNode stmt = new CstNode(Rule.IF_STMT, tok.line);
        consume(TokenKind.LPAREN, "Expected '(' after 'if'");
        stmt.add(expr());
        consume(TokenKind.RPAREN, "Expected ')' after if condition");
        stmt.add(statement());
        // else binds to nearest if
        if (match(TokenKind.ELSE)) {
          stmt.add(statement());
        }
        return stmt;
      }
      case WHILE: {
        advance();
        CstNode stmt = new CstNode(Rule.WHILE_STMT, tok.line);
        consume(TokenKind.LPAREN, "Expected '(' after 'while'");
        stmt.add(expr());
        consume(TokenKind.RPAREN, "Expected ')' after loop condition");
        stmt.add(statement());
        return stmt;
      }
      case BREAK:
        advance();
        consume(TokenKind.SEMI, "Expected ';' after 'break'");
        return new CstNode(Rule.BREAK_STMT, tok.line);
      case CONTINUE:
        advance();
        consume(TokenKind.SEMI, "Expected ';' after 'continue'");
        return new CstNode(Rule.CONTINUE_STMT, tok.line);
      case ID:
        if (checkAhead(1, TokenKind.ASSIGN)) {
          return assignStatement();
        }
        return exprStatement();
      default:
        return exprStatement();
    }
  }

  private CstNode assignStatement() throws InvalidSyntaxException {
    CstNode lval = lVal();
    Token eq = consume(TokenKind.ASSIGN, "Expected '='");
    CstNode stmt = new CstNode(Rule.ASSIGN_STMT, eq.line);
    stmt.add(lval);
    stmt.add(expr());
    consume(TokenKind.SEMI, "Expected ';' after assignment");
    return stmt;
  }

  private CstNode exprStatement() throws InvalidSyntaxException {
    if (check(TokenKind.SEMI)) {
      return new CstNode(Rule.EXPR_STMT, advance().line);
    }
    CstNode e = expr();
    Token semi = consume(TokenKind.SEMI, "Expected ';' after expression");
    return new CstNode(Rule.EXPR_STMT, semi.line).add(e);
  }

  private CstNode expr() throws InvalidSyntaxException {
    return binaryLevel(0);
  }

  /**
   * One precedence level: operand (op operand)*
   * @param level index into LEVELS
   */
  private CstNode binaryLevel(int level) throws InvalidSyntaxException {
    if (level == LEVELS.length) {
      return unary();
    }
    CstNode node = new CstNode(LEVELS[level], peek().line);
    node.add(binaryLevel(level + 1));
    while (check(LEVEL_OPS[level])) {
      node.addToken(advance());
      node.add(binaryLevel(level + 1));
    }
    return node;
  }

  private CstNode unary() throws InvalidSyntaxException {
    if (check(TokenKind.SUB, TokenKind.NOT)) {
      Token op = advance();
      CstNode node = new CstNode(Rule.UNARY_OP_EXP, op.line);
      node.addToken(op);
      node.add(unary());
      return node;
    } else if (check(TokenKind.ID) && checkAhead(1, TokenKind.LPAREN)) {
      return call();
    } else {
      return primary();
    }
  }

  private CstNode call() throws InvalidSyntaxException {
    Token name = advance();
    consume(TokenKind.LPAREN, "Expected '('");
    CstNode call = new CstNode(Rule.CALL_EXP, name.line);
    call.addToken(name);
    if (!check(TokenKind.RPAREN)) {
      CstNode args = new CstNode(Rule.ARG_LIST, peek().line);
      args.add(expr());
      while (match(TokenKind.COMMA)) {
        args.add(expr());
      }
      call.add(args);
    }
    consume(TokenKind.RPAREN, "Expected ')' after arguments");
    return call;
  }

  private CstNode primary() throws InvalidSyntaxException {
    Token tok = peek();
    switch (tok.kind) {
      case LPAREN: {
        advance();
        CstNode inner = expr();
        consume(TokenKind.RPAREN, "Expected ')'");
        return inner;
      }
      case INT_CONST:
        advance();
        return new CstNode(Rule.LITERAL_EXP, tok.line).addToken(tok);
      case ID:
        return lVal();
      default:
        throw error(tok, "Expected expression");
    }
  }

  private CstNode lVal() throws InvalidSyntaxException {
    Token id = consume(TokenKind.ID, "Expected variable name");
    return new CstNode(Rule.LVAL, id.line).addToken(id);
  }

  private Token consume(TokenKind kind, String message)
      throws InvalidSyntaxException {
    if (check(kind)) {
      return advance();
    }
    throw error(peek(), message);
  }

  private InvalidSyntaxException error(Token tok, String message) {
    return new InvalidSyntaxException(inputFile, tok.line, message
                                      + " but found " + tok.describe());
  }

  private boolean match(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean check(TokenKind ...kinds) {
    TokenKind next = peek().kind;
    for (TokenKind kind: kinds) {
      if (next == kind) {
        return true;
      }
    }
    return false;
  }

  private boolean checkAhead(int offset, TokenKind kind) {
    int i = current + offset;
    return i < tokens.size() && tokens.get(i).kind == kind;
  }

  private Token advance() {
    Token tok = peek();
    if (tok.kind != TokenKind.EOF) {
      current++;
    }
    return tok;
  }

  private Token peek() {
    return tokens.get(current);
  }
}
