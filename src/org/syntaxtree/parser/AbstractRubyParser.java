/*
 * Copyright 2026 The Syntax Tree Translation Authors.
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
 * limitations under the License.
 */
package org.syntaxtree.parser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.source.SourceRange;

/**
 * Token navigation and local variable scopes shared by the recursive descent parsers. A parser
 * instance parses a single buffer once.
 */
public abstract class AbstractRubyParser {

  private static final ImmutableSet<String> STATEMENT_END_KEYWORDS =
      ImmutableSet.of("end", "else", "elsif", "when", "rescue", "ensure", "in");

  private static final ImmutableSet<String> MODIFIER_KEYWORDS =
      ImmutableSet.of("if", "unless", "while", "until", "rescue", "and", "or", "then", "do");

  private static final ImmutableSet<String> ARGUMENT_KEYWORDS =
      ImmutableSet.of("nil", "true", "false", "self", "defined?", "__FILE__", "__LINE__", "not");

  protected final SourceBuffer buffer;
  private final ImmutableList<Token> tokens;
  private int index;
  private final Deque<Scope> scopes = new ArrayDeque<>();

  /** Whether a {@code do} after a call starts its block, rather than belonging to a loop. */
  protected boolean allowDoBlock = true;

  private static final class Scope {
    final Set<String> names = new HashSet<>();
    final boolean inherits;

    Scope(boolean inherits) {
      this.inherits = inherits;
    }
  }

  protected AbstractRubyParser(SourceBuffer buffer) {
    this.buffer = buffer;
    this.tokens = new Lexer(buffer).tokenize();
    scopes.push(new Scope(false));
  }

  // Tokens

  protected Token peek() {
    return tokens.get(index);
  }

  protected Token peek(int ahead) {
    return tokens.get(Math.min(index + ahead, tokens.size() - 1));
  }

  protected Token previous() {
    return tokens.get(index - 1);
  }

  @CanIgnoreReturnValue
  protected Token next() {
    Token token = tokens.get(index);
    if (index < tokens.size() - 1) {
      index++;
    }
    return token;
  }

  protected boolean at(TokenType type) {
    return peek().is(type);
  }

  protected boolean atOperator(String operator) {
    return peek().isOperator(operator);
  }

  protected boolean atKeyword(String keyword) {
    return peek().isKeyword(keyword);
  }

  protected boolean acceptOperator(String operator) {
    if (atOperator(operator)) {
      next();
      return true;
    }
    return false;
  }

  protected boolean acceptKeyword(String keyword) {
    if (atKeyword(keyword)) {
      next();
      return true;
    }
    return false;
  }

  @CanIgnoreReturnValue
  protected Token expect(TokenType type) {
    if (!at(type)) {
      throw error(peek(), "expected " + type + " but found " + describe(peek()));
    }
    return next();
  }

  @CanIgnoreReturnValue
  protected Token expectOperator(String operator) {
    if (!atOperator(operator)) {
      throw error(peek(), "expected '" + operator + "' but found " + describe(peek()));
    }
    return next();
  }

  @CanIgnoreReturnValue
  protected Token expectKeyword(String keyword) {
    if (!atKeyword(keyword)) {
      throw error(peek(), "expected '" + keyword + "' but found " + describe(peek()));
    }
    return next();
  }

  protected void skipNewlines() {
    while (at(TokenType.NEWLINE)) {
      next();
    }
  }

  protected void skipTerminators() {
    while (at(TokenType.NEWLINE) || at(TokenType.SEMICOLON)) {
      next();
    }
  }

  protected boolean atTerminator() {
    return at(TokenType.NEWLINE) || at(TokenType.SEMICOLON);
  }

  /** Whether the current token closes a statement sequence. */
  protected boolean atStatementsEnd() {
    Token token = peek();
    switch (token.type()) {
      case EOF:
      case EMBEXPR_END:
        return true;
      case OPERATOR:
        return token.value().equals("}") || token.value().equals(")");
      case KEYWORD:
        return STATEMENT_END_KEYWORDS.contains(token.value());
      default:
        return false;
    }
  }

  /** Whether the current token ends a parenthesis-free argument list. */
  protected boolean atArgumentsEnd() {
    Token token = peek();
    if (atTerminator() || atStatementsEnd() || token.is(TokenType.EOF)) {
      return true;
    }
    if (token.is(TokenType.KEYWORD)) {
      return MODIFIER_KEYWORDS.contains(token.value());
    }
    return token.isOperator("]") || token.isOperator(":");
  }

  /**
   * Whether the current token, which follows a method name, starts a parenthesis-free argument
   * list. Needs whitespace before the token; an operator only counts when it is glued to its
   * operand, as in {@code foo -1} or {@code foo *args}.
   */
  protected boolean atCommandArgumentStart() {
    Token token = peek();
    if (!token.spaceBefore()) {
      return false;
    }
    switch (token.type()) {
      case IDENTIFIER:
      case CONSTANT:
      case IVAR:
      case GVAR:
      case CVAR:
      case BACKREF:
      case INTEGER:
      case FLOAT:
      case RATIONAL:
      case IMAGINARY:
      case LABEL:
      case SYMBOL:
      case STRING_BEGIN:
      case DSYMBOL_BEGIN:
      case REGEXP_BEGIN:
        return true;
      case KEYWORD:
        return ARGUMENT_KEYWORDS.contains(token.value());
      case OPERATOR:
        switch (token.value()) {
          case "[":
          case "->":
          case "::":
          case "!":
            return true;
          case "-":
          case "*":
          case "**":
          case "&":
            return !peek(1).spaceBefore();
          default:
            return false;
        }
      default:
        return false;
    }
  }

  /** Whether a {@code -} or {@code +} at the current token is glued to a numeric literal. */
  protected boolean atSignedNumber() {
    Token sign = peek();
    Token number = peek(1);
    return (sign.isOperator("-") || sign.isOperator("+"))
        && isNumber(number)
        && number.start() == sign.end();
  }

  protected static boolean isNumber(Token token) {
    switch (token.type()) {
      case INTEGER:
      case FLOAT:
      case RATIONAL:
      case IMAGINARY:
        return true;
      default:
        return false;
    }
  }

  /**
   * Whether the current {@code ::} calls a method, as in {@code foo::bar} or {@code Foo::Bar()},
   * rather than naming a constant.
   */
  protected boolean atColonCall() {
    Token colons = peek();
    if (!colons.isOperator("::") || colons.spaceBefore()) {
      return false;
    }
    Token name = peek(1);
    if (name.is(TokenType.IDENTIFIER)) {
      return true;
    }
    Token paren = peek(2);
    return name.is(TokenType.CONSTANT) && paren.isOperator("(") && !paren.spaceBefore();
  }

  /** Whether the string starting at the current token is a quoted label, {@code "key":}. */
  protected boolean atStringLabel() {
    if (!at(TokenType.STRING_BEGIN)) {
      return false;
    }
    int depth = 0;
    for (int ahead = 0; ; ahead++) {
      Token token = peek(ahead);
      switch (token.type()) {
        case STRING_BEGIN:
        case DSYMBOL_BEGIN:
          depth++;
          break;
        case STRING_END:
          depth--;
          if (depth == 0) {
            return false;
          }
          break;
        case LABEL_END:
          depth--;
          if (depth == 0) {
            return true;
          }
          break;
        case EOF:
          return false;
        default:
          break;
      }
    }
  }

  /**
   * The binding power of a binary operator token, or -1 when the token is not one. Higher binds
   * tighter.
   */
  protected static int binaryPrecedence(Token token) {
    if (!token.is(TokenType.OPERATOR)) {
      return -1;
    }
    switch (token.value()) {
      case "||":
        return 1;
      case "&&":
        return 2;
      case "<=>":
      case "==":
      case "===":
      case "!=":
      case "=~":
      case "!~":
        return 3;
      case "<":
      case "<=":
      case ">":
      case ">=":
        return 4;
      case "|":
      case "^":
        return 5;
      case "&":
        return 6;
      case "<<":
      case ">>":
        return 7;
      case "+":
      case "-":
        return 8;
      case "*":
      case "/":
      case "%":
        return 9;
      case "**":
        return 10;
      default:
        return -1;
    }
  }

  protected static boolean isAssignmentOperator(Token token) {
    if (!token.is(TokenType.OPERATOR)) {
      return false;
    }
    String value = token.value();
    return value.length() >= 2
        && value.endsWith("=")
        && !value.equals("==")
        && !value.equals("!=")
        && !value.equals(">=")
        && !value.equals("<=")
        && !value.equals("===");
  }

  // Scopes

  /** Opens a scope; a block scope sees the names of the enclosing one, a definition does not. */
  protected void pushScope(boolean inherits) {
    scopes.push(new Scope(inherits));
  }

  protected void popScope() {
    scopes.pop();
  }

  protected void declare(String name) {
    scopes.peek().names.add(name);
  }

  protected boolean isLocal(String name) {
    for (Scope scope : scopes) {
      if (scope.names.contains(name)) {
        return true;
      }
      if (!scope.inherits) {
        return false;
      }
    }
    return false;
  }

  // Ranges

  protected SourceRange range(Token token) {
    return buffer.range(token.start(), token.end());
  }

  protected SourceRange range(int start, int end) {
    return buffer.range(start, end);
  }

  protected ParseException error(Token token, String message) {
    return new ParseException(message, buffer, token.start());
  }

  private static String describe(Token token) {
    return token.is(TokenType.EOF) ? "end-of-input" : "'" + token.value() + "'";
  }
}
