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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.minic.common.exceptions.LexicalException;
import exm.minic.frontend.cst.TokenKind;

/**
 * Hand-written scanner for MiniC.  Converts source text into a list of
 * tokens, ending with an EOF token.  Whitespace and comments are skipped.
 */
public class Scanner {

  private static final Map<String, TokenKind> keywords;

  static {
    keywords = new HashMap<String, TokenKind>();
    keywords.put("int", TokenKind.INT);
    keywords.put("return", TokenKind.RETURN);
    keywords.put("if", TokenKind.IF);
    keywords.put("else", TokenKind.ELSE);
    keywords.put("while", TokenKind.WHILE);
    keywords.put("break", TokenKind.BREAK);
    keywords.put("continue", TokenKind.CONTINUE);
  }

  private final String inputFile;
  private final String source;
  private final List<Token> tokens = new ArrayList<Token>();

  /** Start of current token */
  private int start = 0;
  /** Next character to read */
  private int current = 0;
  private int line = 1;

  public Scanner(String inputFile, String source) {
    this.inputFile = inputFile;
    this.source = source;
  }

  /**
   * Scan the whole input
   * @return tokens in order, ending with EOF
   * @throws LexicalException on the first character that starts no token
   */
  public List<Token> scanTokens() throws LexicalException {
    while (!isAtEnd()) {
      start = current;
      scanToken();
    }
    tokens.add(new Token(TokenKind.EOF, "", line));
    return tokens;
  }

  private void scanToken() throws LexicalException {
    char c = advance();
    switch (c) {
      case '(': addToken(TokenKind.LPAREN); break;
      case ')': addToken(TokenKind.RPAREN); break;
      case '{': addToken(TokenKind.LBRACE); break;
      case '}': addToken(TokenKind.RBRACE); break;
      case ';': addToken(TokenKind.SEMI); break;
      case ',': addToken(TokenKind.COMMA); break;
      case '+': addToken(TokenKind.ADD); break;
      case '-': addToken(TokenKind.SUB); break;
      case '*': addToken(TokenKind.MUL); break;
      case '%': addToken(TokenKind.MOD); break;
      case '=':
        addToken(match('=') ? TokenKind.EQ : TokenKind.ASSIGN);
        break;
      case '!':
        addToken(match('=') ? TokenKind.NE : TokenKind.NOT);
        break;
      case '<':
        addToken(match('=') ? TokenKind.LE : TokenKind.LT);
        break;
      case '>':
        addToken(match('=') ? TokenKind.GE : TokenKind.GT);
        break;
      case '&':
        if (!match('&')) {
          throw error("Unexpected character '&': did you mean '&&'?");
        }
        addToken(TokenKind.AND);
        break;
      case '|':
        if (!match('|')) {
          throw error("Unexpected character '|': did you mean '||'?");
        }
        addToken(TokenKind.OR);
        break;
      case '/':
        if (match('/')) {
          lineComment();
        } else if (match('*')) {
          blockComment();
        } else {
          addToken(TokenKind.DIV);
        }
        break;
      case ' ':
      case '\t':
      case '\r':
        break;
      case '\n':
        line++;
        break;
      default:
        if (isDigit(c)) {
          number(c);
        } else if (isIdentStart(c)) {
          identifier();
        } else {
          throw error("Unexpected character '" + c + "'");
        }
        break;
    }
  }

  private void lineComment() {
    while (peek() != '\n' && !isAtEnd()) {
      advance();
    }
  }

  private void blockComment() throws LexicalException {
    int startLine = line;
    while (!(peek() == '*' && peekNext() == '/')) {
      if (isAtEnd()) {
        throw new LexicalException(inputFile, startLine,
                                   "Unterminated block comment");
      }
      if (advance() == '\n') {
        line++;
      }
    }
    // Closing */
    advance();
    advance();
  }

  /**
   * Integer literal.  The lexeme is kept as written: the radix is worked
   * out when the literal is translated.
   */
  private void number(char first) throws LexicalException {
    if (first == '0') {
      if (peek() == 'x' || peek() == 'X') {
        advance();
        if (!isHexDigit(peek())) {
          throw error("Hexadecimal literal '" + currentLexeme()
                      + "' has no digits");
        }
        while (isHexDigit(peek())) {
          advance();
        }
      } else {
        while (peek() >= '0' && peek() <= '7') {
          advance();
        }
      }
    } else {
      while (isDigit(peek())) {
        advance();
      }
    }
    addToken(TokenKind.INT_CONST);
  }

  private void identifier() {
    while (isIdentStart(peek()) || isDigit(peek())) {
      advance();
    }
    TokenKind kind = keywords.get(currentLexeme());
    addToken(kind != null ? kind : TokenKind.ID);
  }

  private LexicalException error(String message) {
    return new LexicalException(inputFile, line, message);
  }

  private void addToken(TokenKind kind) {
    tokens.add(new Token(kind, currentLexeme(), line));
  }

  private String currentLexeme() {
    return source.substring(start, current);
  }

  private boolean match(char expected) {
    if (isAtEnd() || source.charAt(current) != expected) {
      return false;
    }
    current++;
    return true;
  }

  private char advance() {
    return source.charAt(current++);
  }

  private char peek() {
    return isAtEnd() ? '\0' : source.charAt(current);
  }

  private char peekNext() {
    return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
  }

  private boolean isAtEnd() {
    return current >= source.length();
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(char c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }
}
