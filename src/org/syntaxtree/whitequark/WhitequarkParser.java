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
package org.syntaxtree.whitequark;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.parser.AbstractRubyParser;
import org.syntaxtree.parser.Literals;
import org.syntaxtree.parser.ParseException;
import org.syntaxtree.parser.Token;
import org.syntaxtree.parser.TokenType;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.source.SourceRange;

/**
 * A recursive descent parser that builds the parser gem's AST directly, for the same Ruby subset
 * as {@link org.syntaxtree.parser.SyntaxTreeParser}. Version dependent syntax is accepted or
 * rejected according to the configured {@link RubyVersion}, and a parameter list of just {@code
 * (...)} is built in the form the gem used for that version.
 */
public final class WhitequarkParser extends AbstractRubyParser {

  /** Returns a {@link ReferenceParser} that accepts the syntax of {@code version}. */
  public static ReferenceParser forVersion(RubyVersion version) {
    return buffer -> new WhitequarkParser(buffer, version).parseProgram();
  }

  private final RubyVersion version;
  private final Builder builder;

  /** Tokens and nodes of a parenthesized or bracketed list. */
  private record Delimited(Token open, List<Node> nodes, Token close) {}

  public WhitequarkParser(SourceBuffer buffer, RubyVersion version) {
    super(buffer);
    this.version = version;
    this.builder = new Builder(buffer);
  }

  public @Nullable Node parseProgram() {
    List<Node> statements = parseStatements();
    if (!at(TokenType.EOF)) {
      throw error(peek(), "unexpected '" + peek().value() + "'");
    }
    return builder.compstmt(statements);
  }

  // Statements

  private List<Node> parseStatements() {
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = true;
    List<Node> statements = new ArrayList<>();
    skipTerminators();
    while (!atStatementsEnd()) {
      statements.add(parseStatement());
      if (!atStatementsEnd() && !atTerminator()) {
        throw error(peek(), "unexpected '" + peek().value() + "'");
      }
      skipTerminators();
    }
    allowDoBlock = savedAllowDoBlock;
    return statements;
  }

  private @Nullable Node parseCompstmt() {
    return builder.compstmt(parseStatements());
  }

  private Node parseStatement() {
    Node node = atOperator("*") ? parseMultipleAssignment(null) : parseExpressionStatement();
    if (atOperator(",")) {
      node = isPlainAssignment(node) ? parseAssignedValues(node) : parseMultipleAssignment(node);
    }
    while (peek().is(TokenType.KEYWORD)) {
      Token keyword = peek();
      switch (keyword.value()) {
        case "if":
          next();
          node = builder.conditionMod(node, null, keyword, parseExpressionStatement());
          break;
        case "unless":
          next();
          node = builder.conditionMod(null, node, keyword, parseExpressionStatement());
          break;
        case "while":
          next();
          node = builder.loopMod(NodeType.WHILE, node, keyword, parseExpressionStatement());
          break;
        case "until":
          next();
          node = builder.loopMod(NodeType.UNTIL, node, keyword, parseExpressionStatement());
          break;
        case "rescue":
          {
            next();
            node = rescueModifier(node, keyword, parseExpressionStatement());
            break;
          }
        default:
          return node;
      }
    }
    return node;
  }

  /** An assignment rescues its right hand side rather than itself. */
  private Node rescueModifier(Node statement, Token keyword, Node value) {
    if (Builder.isAssignment(statement)) {
      Node assigned = statement.getNode(statement.getChildCount() - 1);
      return builder.withAssignedValue(statement, rescueModifier(assigned, keyword, value));
    }
    Node rescueBody = builder.rescueBody(keyword, null, null, null, null, value);
    return builder.beginBody(statement, ImmutableList.of(rescueBody), null, null, null, null);
  }

  private static boolean isPlainAssignment(Node node) {
    return Builder.isAssignment(node)
        && !node.isType(NodeType.OP_ASGN)
        && !node.isType(NodeType.OR_ASGN)
        && !node.isType(NodeType.AND_ASGN)
        && !node.isType(NodeType.MASGN);
  }

  /** {@code a = 1, 2} assigns an array of the values. */
  private Node parseAssignedValues(Node assignment) {
    Node first = assignment.getNode(assignment.getChildCount() - 1);
    List<Node> values = new ArrayList<>();
    if (first.isType(NodeType.ARRAY) && first.getLocation().getBegin() == null) {
      values.addAll(first.getNodeChildren());
    } else {
      values.add(first);
    }
    while (acceptOperator(",")) {
      skipNewlines();
      values.add(parseMultipleValue());
    }
    return builder.withAssignedValue(assignment, builder.array(null, values, null));
  }

  /**
   * {@code a, *b = c}. {@code first} is the already parsed first target, or null when the
   * statement starts with a splat.
   */
  private Node parseMultipleAssignment(@Nullable Node first) {
    List<Node> targets = new ArrayList<>();
    if (first != null) {
      targets.add(multipleTarget(first));
      expectOperator(",");
    }
    while (!atOperator("=")) {
      if (atOperator("*")) {
        Token star = next();
        Node target = atOperator(",") || atOperator("=")
            ? null
            : multipleTarget(parsePostfix(parsePrimary()));
        targets.add(builder.splat(star, target));
      } else {
        targets.add(multipleTarget(parsePostfix(parsePrimary())));
      }
      if (!acceptOperator(",")) {
        break;
      }
    }
    Token equals = expectOperator("=");
    skipNewlines();
    List<Node> values = new ArrayList<>();
    do {
      skipNewlines();
      values.add(parseMultipleValue());
    } while (acceptOperator(","));
    Node rhs = values.size() == 1 && !values.get(0).isType(NodeType.SPLAT)
        ? values.get(0)
        : builder.array(null, values, null);
    return builder.multiAssign(builder.multiLhs(targets), equals, rhs);
  }

  private Node multipleTarget(Node node) {
    Node target = builder.assignable(node);
    declareTarget(target);
    return target;
  }

  private Node parseMultipleValue() {
    if (atOperator("*")) {
      Token star = next();
      return builder.splat(star, parseTernary());
    }
    return parseExpression();
  }

  private Node parseExpressionStatement() {
    Node left = parseNotExpression();
    while (atKeyword("and") || atKeyword("or")) {
      Token operator = next();
      skipNewlines();
      Node right = parseNotExpression();
      NodeType type = operator.value().equals("and") ? NodeType.AND : NodeType.OR;
      left = builder.logicalOp(type, left, operator, right);
    }
    return left;
  }

  private Node parseNotExpression() {
    if (!atKeyword("not")) {
      return parseExpression();
    }
    Token keyword = next();
    if (atOperator("(") && !peek().spaceBefore()) {
      Token open = next();
      skipNewlines();
      Node operand = atOperator(")") ? null : parseExpressionStatement();
      skipNewlines();
      Token close = expectOperator(")");
      return builder.notOp(keyword, open, operand, close);
    }
    return builder.notOp(keyword, null, parseNotExpression(), null);
  }

  private Node parseExpression() {
    Node left = parseTernary();
    Token token = peek();
    if (token.isOperator("=")) {
      Node target = builder.assignable(left);
      declareTarget(target);
      next();
      skipNewlines();
      if (atOperator("*")) {
        Token star = next();
        Node splat = builder.splat(star, parseTernary());
        return builder.assign(target, token, builder.array(null, ImmutableList.of(splat), null));
      }
      return builder.assign(target, token, parseExpression());
    }
    if (isAssignmentOperator(token)) {
      if (left.getChild(0) == null && Builder.isBareCall(left)) {
        declare(((RubySymbol) left.getChild(1)).name());
      }
      next();
      skipNewlines();
      return builder.opAssign(left, token, parseExpression());
    }
    return left;
  }

  private void declareTarget(Node target) {
    if (target.isType(NodeType.LVASGN)) {
      declare(((RubySymbol) target.getChild(0)).name());
    }
  }

  private Node parseTernary() {
    Node cond = parseRange();
    if (!atOperator("?")) {
      return cond;
    }
    Token question = next();
    skipNewlines();
    Node ifTrue = parseTernary();
    skipNewlines();
    Token colon = expectOperator(":");
    skipNewlines();
    Node ifFalse = parseTernary();
    return builder.ternary(cond, question, ifTrue, colon, ifFalse);
  }

  private Node parseRange() {
    if (atOperator("..") || atOperator("...")) {
      Token operator = next();
      return builder.range(null, operator, parseBinary(1));
    }
    Node left = parseBinary(1);
    if (!atOperator("..") && !atOperator("...")) {
      return left;
    }
    Token operator = next();
    Node right = atArgumentsEnd() || atOperator(",") ? null : parseBinary(1);
    return builder.range(left, operator, right);
  }

  private Node parseBinary(int minPrecedence) {
    Node left = parseUnary();
    while (true) {
      Token operator = peek();
      int precedence = binaryPrecedence(operator);
      if (precedence < minPrecedence) {
        return left;
      }
      next();
      skipNewlines();
      Node right =
          operator.value().equals("**") ? parseBinary(precedence) : parseBinary(precedence + 1);
      switch (operator.value()) {
        case "&&":
          left = builder.logicalOp(NodeType.AND, left, operator, right);
          break;
        case "||":
          left = builder.logicalOp(NodeType.OR, left, operator, right);
          break;
        case "=~":
          left = builder.matchOp(left, operator, right);
          break;
        default:
          left = builder.binaryOp(left, operator, right);
      }
    }
  }

  private Node parseUnary() {
    Token token = peek();
    if (atSignedNumber()) {
      next();
      Node number = parseNumber(next());
      if (token.isOperator("-") && atOperator("**")) {
        // -2 ** 2 is -(2 ** 2).
        Token power = next();
        skipNewlines();
        Node exponent = parseBinary(binaryPrecedence(power));
        return builder.unaryOp(token, builder.binaryOp(number, power, exponent));
      }
      return parsePostfix(builder.unaryNum(token, number));
    }
    if (token.isOperator("!")) {
      next();
      return builder.notOp(token, null, parseUnary(), null);
    }
    if (token.isOperator("-") || token.isOperator("+") || token.isOperator("~")) {
      next();
      return builder.unaryOp(token, parseUnary());
    }
    return parsePostfix(parsePrimary());
  }

  // Calls and postfix operators

  private Node parsePostfix(Node receiver) {
    Node node = receiver;
    while (true) {
      Token token = peek();
      if (token.isOperator(".") || token.isOperator("&.") || atColonCall()) {
        next();
        Token name = next();
        if (!name.is(TokenType.IDENTIFIER) && !name.is(TokenType.CONSTANT)) {
          throw error(name, "expected a method name");
        }
        if (atOperator("(") && !peek().spaceBefore()) {
          Delimited arguments = parseCallParens();
          node = builder.callMethod(node, token, name, arguments.open(), arguments.nodes(),
              arguments.close());
        } else if (atCommandArgumentStart()) {
          Node call = builder.callMethod(node, token, name, null, parseCommandArguments(), null);
          return atKeyword("do") && allowDoBlock ? parseBlock(call) : call;
        } else {
          node = builder.callMethod(node, token, name, null, ImmutableList.of(), null);
        }
      } else if (token.isOperator("::") && !token.spaceBefore()) {
        next();
        node = builder.constFetch(node, token, expect(TokenType.CONSTANT));
      } else if (token.isOperator("[") && !token.spaceBefore()) {
        next();
        skipNewlines();
        List<Node> indexes = atOperator("]") ? ImmutableList.of() : parseArgs("]");
        skipNewlines();
        Token close = expectOperator("]");
        node = builder.index(node, token, indexes, close);
      } else if ((token.isOperator("{") || (token.isKeyword("do") && allowDoBlock))
          && acceptsBlock(node)) {
        node = parseBlock(node);
      } else {
        return node;
      }
    }
  }

  /** Calls without arguments or with parenthesized ones, and {@code super}, take a block. */
  private static boolean acceptsBlock(Node node) {
    if (node.isType(NodeType.SEND) || node.isType(NodeType.CSEND)) {
      return Builder.isBareCall(node) || node.getLocation().getBegin() != null;
    }
    return node.isType(NodeType.ZSUPER)
        || (node.isType(NodeType.SUPER) && node.getLocation().getBegin() != null);
  }

  private Delimited parseCallParens() {
    Token open = expectOperator("(");
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = true;
    skipNewlines();
    List<Node> arguments = atOperator(")") ? ImmutableList.of() : parseArgs(")");
    skipNewlines();
    Token close = expectOperator(")");
    allowDoBlock = savedAllowDoBlock;
    return new Delimited(open, arguments, close);
  }

  private List<Node> parseCommandArguments() {
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = false;
    List<Node> arguments = parseArgs(null);
    allowDoBlock = savedAllowDoBlock;
    return arguments;
  }

  /** Parses arguments, collecting trailing pairs into a hash without braces. */
  private List<Node> parseArgs(@Nullable String closer) {
    List<Node> arguments = new ArrayList<>();
    List<Node> pairs = new ArrayList<>();
    while (true) {
      if (closer != null) {
        skipNewlines();
        if (atOperator(closer)) {
          break;
        }
      }
      Node argument = parseArgument();
      if (argument.isType(NodeType.PAIR) || argument.isType(NodeType.KWSPLAT)) {
        pairs.add(argument);
      } else {
        if (!pairs.isEmpty()) {
          if (!argument.isType(NodeType.BLOCK_PASS)) {
            throw error(peek(), "positional argument after keyword arguments");
          }
          arguments.add(builder.associate(null, pairs, null));
          pairs = new ArrayList<>();
        }
        arguments.add(argument);
      }
      if (!acceptOperator(",")) {
        break;
      }
    }
    if (!pairs.isEmpty()) {
      arguments.add(builder.associate(null, pairs, null));
    }
    return arguments;
  }

  private Node parseArgument() {
    Token token = peek();
    if (token.is(TokenType.LABEL)) {
      next();
      skipNewlines();
      return builder.pairKeyword(token, parseExpression());
    }
    if (atStringLabel()) {
      next();
      List<Node> parts = parseStringParts(!token.value().equals("'"), false);
      Token labelEnd = expect(TokenType.LABEL_END);
      skipNewlines();
      return builder.pairQuoted(token, parts, labelEnd, parseExpression());
    }
    if (token.isOperator("*")) {
      next();
      if (atOperator(",") || atOperator(")") || atOperator("]")) {
        return builder.splat(token, null);
      }
      return builder.splat(token, parseTernary());
    }
    if (token.isOperator("**")) {
      next();
      return builder.kwsplat(token, parseTernary());
    }
    if (token.isOperator("&")) {
      next();
      return builder.blockPass(token, atOperator(")") ? null : parseTernary());
    }
    if (token.isOperator("...") && peek(1).isOperator(")")) {
      next();
      requireVersion(token, RubyVersion.RUBY_2_7, "argument forwarding");
      return builder.forwardedArgs(token);
    }
    Node value = parseExpression();
    if (atOperator("=>")) {
      Token assoc = next();
      skipNewlines();
      return builder.pair(value, assoc, parseExpression());
    }
    return value;
  }

  private Node parseBlock(Node call) {
    Token open = next();
    boolean braces = open.isOperator("{");
    pushScope(true);
    skipNewlines();
    Node args;
    if (atOperator("||")) {
      Token pipes = next();
      args = builder.args(pipes, ImmutableList.of(), pipes);
    } else if (atOperator("|")) {
      Token pipe = next();
      List<Node> params = atOperator("|") || at(TokenType.SEMICOLON)
          ? new ArrayList<>()
          : new ArrayList<>(parseParameters(true));
      if (params.size() == 1 && params.get(0).isType(NodeType.ARG)) {
        params.set(0, builder.procarg0(params.get(0)));
      }
      params.addAll(parseBlockLocals());
      Token close = expectOperator("|");
      args = builder.args(pipe, params, close);
    } else {
      args = builder.args(null, ImmutableList.of(), null);
    }
    Node body;
    Token close;
    if (braces) {
      body = parseCompstmt();
      close = expectOperator("}");
    } else {
      body = parseBodyStmt();
      close = expectKeyword("end");
    }
    popScope();
    return builder.block(call, open, args, body, close);
  }

  private List<Node> parseBlockLocals() {
    List<Node> locals = new ArrayList<>();
    if (!at(TokenType.SEMICOLON)) {
      return locals;
    }
    next();
    do {
      Token name = expect(TokenType.IDENTIFIER);
      declare(name.value());
      locals.add(builder.shadowarg(name));
    } while (acceptOperator(","));
    return locals;
  }

  // Parameters

  private List<Node> parseParameters(boolean block) {
    List<Node> params = new ArrayList<>();
    while (true) {
      Token token = next();
      if (token.is(TokenType.IDENTIFIER)) {
        declare(token.value());
        if (atOperator("=")) {
          Token equals = next();
          Node value = block ? parsePostfix(parsePrimary()) : parseTernary();
          params.add(builder.optarg(token, equals, value));
        } else {
          params.add(builder.arg(token));
        }
      } else if (token.is(TokenType.LABEL)) {
        declare(token.value().substring(0, token.value().length() - 1));
        if (atOperator(",") || atParametersEnd()) {
          params.add(builder.kwarg(token));
        } else {
          Node value = block ? parsePostfix(parsePrimary()) : parseTernary();
          params.add(builder.kwoptarg(token, value));
        }
      } else if (token.isOperator("*")) {
        params.add(builder.prefixArg(NodeType.RESTARG, token, parseParameterName()));
      } else if (token.isOperator("**")) {
        params.add(builder.prefixArg(NodeType.KWRESTARG, token, parseParameterName()));
      } else if (token.isOperator("&")) {
        params.add(builder.prefixArg(NodeType.BLOCKARG, token, parseParameterName()));
      } else if (token.isOperator("...") && !block) {
        requireVersion(token, RubyVersion.RUBY_2_7, "argument forwarding");
        if (!params.isEmpty()) {
          requireVersion(token, RubyVersion.RUBY_3_0, "leading arguments before '...'");
        }
        params.add(builder.forwardArg(token));
      } else {
        throw error(token, "unexpected '" + token.value() + "' in parameters");
      }
      if (!acceptOperator(",")) {
        return params;
      }
      skipNewlines();
    }
  }

  private @Nullable Token parseParameterName() {
    if (!at(TokenType.IDENTIFIER)) {
      return null;
    }
    Token name = next();
    declare(name.value());
    return name;
  }

  private boolean atParametersEnd() {
    return atOperator(")") || atOperator("|") || atTerminator() || at(TokenType.EOF);
  }

  private void requireVersion(Token token, RubyVersion required, String feature) {
    if (!version.isAtLeast(required)) {
      throw error(token, feature + " requires Ruby " + required + " (parsing as " + version + ")");
    }
  }

  // Primary expressions

  private Node parsePrimary() {
    Token token = peek();
    switch (token.type()) {
      case INTEGER:
      case FLOAT:
      case RATIONAL:
      case IMAGINARY:
        return parseNumber(next());
      case STRING_BEGIN:
        {
          Node string = parseString();
          if (!at(TokenType.STRING_BEGIN)) {
            return builder.stringCompose(null, ImmutableList.of(string), null);
          }
          List<Node> strings = new ArrayList<>();
          strings.add(string);
          while (at(TokenType.STRING_BEGIN)) {
            strings.add(parseString());
          }
          return builder.stringCompose(null, strings, null);
        }
      case DSYMBOL_BEGIN:
        {
          next();
          List<Node> parts = parseStringParts(!token.value().equals(":'"), false);
          return builder.symbolCompose(token, parts, expect(TokenType.STRING_END));
        }
      case SYMBOL:
        return builder.symbol(next());
      case REGEXP_BEGIN:
        {
          next();
          List<Node> parts = parseStringParts(true, true);
          return builder.regexpCompose(token, parts, expect(TokenType.REGEXP_END));
        }
      case IVAR:
        return builder.variable(NodeType.IVAR, next());
      case GVAR:
        return builder.variable(NodeType.GVAR, next());
      case CVAR:
        return builder.variable(NodeType.CVAR, next());
      case BACKREF:
        return builder.backReference(next());
      case CONSTANT:
        return builder.constant(next());
      case IDENTIFIER:
        return parseIdentifier();
      case KEYWORD:
        return parseKeyword();
      case OPERATOR:
        switch (token.value()) {
          case "(":
            {
              next();
              Node body = parseCompstmt();
              return builder.begin(token, body, expectOperator(")"));
            }
          case "[":
            {
              next();
              boolean savedAllowDoBlock = allowDoBlock;
              allowDoBlock = true;
              skipNewlines();
              List<Node> elements = atOperator("]") ? ImmutableList.of() : parseArgs("]");
              skipNewlines();
              Token close = expectOperator("]");
              allowDoBlock = savedAllowDoBlock;
              return builder.array(token, elements, close);
            }
          case "{":
            return parseHash();
          case "->":
            return parseLambda();
          case "::":
            next();
            return builder.constGlobal(token, expect(TokenType.CONSTANT));
          default:
            break;
        }
        break;
      default:
        break;
    }
    throw error(token, "unexpected '" + token.value() + "'");
  }

  private Node parseNumber(Token token) {
    switch (token.type()) {
      case INTEGER:
        return builder.integer(token);
      case RATIONAL:
        return builder.rational(token);
      case IMAGINARY:
        return builder.complex(token);
      default:
        return builder.floatNumber(token);
    }
  }

  private Node parseIdentifier() {
    Token name = next();
    boolean call = atOperator("(") && !peek().spaceBefore();
    if (isLocal(name.value()) && !call) {
      return builder.variable(NodeType.LVAR, name);
    }
    if (call) {
      Delimited arguments = parseCallParens();
      return builder.callMethod(null, null, name, arguments.open(), arguments.nodes(),
          arguments.close());
    }
    if (atCommandArgumentStart()) {
      Node command = builder.callMethod(null, null, name, null, parseCommandArguments(), null);
      return atKeyword("do") && allowDoBlock ? parseBlock(command) : command;
    }
    return builder.callMethod(null, null, name, null, ImmutableList.of(), null);
  }

  private Node parseString() {
    Token open = expect(TokenType.STRING_BEGIN);
    List<Node> parts = parseStringParts(!open.value().equals("'"), false);
    return builder.stringCompose(open, parts, expect(TokenType.STRING_END));
  }

  /** One {@code str} per content token, which is at most one line; regexp content stays raw. */
  private List<Node> parseStringParts(boolean interpolating, boolean raw) {
    List<Node> parts = new ArrayList<>();
    while (true) {
      if (at(TokenType.STRING_CONTENT)) {
        Token content = next();
        String value = raw ? content.value() : Literals.unescape(content.value(), interpolating);
        parts.add(builder.stringInternal(content, value));
      } else if (at(TokenType.EMBEXPR_BEGIN)) {
        Token open = next();
        Node body = parseCompstmt();
        parts.add(builder.begin(open, body, expect(TokenType.EMBEXPR_END)));
      } else {
        return parts;
      }
    }
  }

  private Node parseHash() {
    Token open = next();
    List<Node> pairs = new ArrayList<>();
    skipNewlines();
    while (!atOperator("}")) {
      Node pair = parseArgument();
      if (!pair.isType(NodeType.PAIR) && !pair.isType(NodeType.KWSPLAT)) {
        throw error(peek(), "expected '=>'");
      }
      pairs.add(pair);
      if (!acceptOperator(",")) {
        break;
      }
      skipNewlines();
    }
    skipNewlines();
    return builder.associate(open, pairs, expectOperator("}"));
  }

  private Node parseLambda() {
    Token arrow = next();
    pushScope(true);
    Node args;
    if (atOperator("(")) {
      Token open = next();
      skipNewlines();
      List<Node> params = atOperator(")") || at(TokenType.SEMICOLON)
          ? new ArrayList<>()
          : new ArrayList<>(parseParameters(false));
      params.addAll(parseBlockLocals());
      skipNewlines();
      args = builder.args(open, params, expectOperator(")"));
    } else if (at(TokenType.IDENTIFIER) || at(TokenType.LABEL) || atOperator("*")
        || atOperator("**") || atOperator("&")) {
      args = builder.args(null, parseParameters(false), null);
    } else {
      args = builder.args(null, ImmutableList.of(), null);
    }
    Token open;
    Node body;
    Token close;
    if (atOperator("{")) {
      open = next();
      body = parseCompstmt();
      close = expectOperator("}");
    } else {
      open = expectKeyword("do");
      body = parseBodyStmt();
      close = expectKeyword("end");
    }
    popScope();
    return builder.block(builder.lambda(arrow), open, args, body, close);
  }

  // Keywords

  private Node parseKeyword() {
    Token token = peek();
    switch (token.value()) {
      case "nil":
      case "true":
      case "false":
      case "self":
      case "__FILE__":
      case "__LINE__":
        return builder.keywordLiteral(next());
      case "if":
      case "unless":
        return parseConditional();
      case "while":
      case "until":
        return parseLoop();
      case "for":
        return parseFor();
      case "case":
        return parseCase();
      case "begin":
        {
          next();
          Node body = parseBodyStmt();
          return builder.beginKeyword(token, body, expectKeyword("end"));
        }
      case "def":
        return parseDef();
      case "class":
        return parseClass();
      case "module":
        {
          next();
          Node name = parseConstantPath();
          pushScope(false);
          Node body = parseBodyStmt();
          Token end = expectKeyword("end");
          popScope();
          return builder.defModule(token, name, body, end);
        }
      case "return":
      case "break":
      case "next":
        {
          next();
          List<Node> args = atArgumentsEnd() ? ImmutableList.of() : parseCommandArguments();
          return builder.keywordCmd(jumpType(token), token, null, args, null);
        }
      case "redo":
        return builder.keywordCmd(NodeType.REDO, next(), null, ImmutableList.of(), null);
      case "retry":
        return builder.keywordCmd(NodeType.RETRY, next(), null, ImmutableList.of(), null);
      case "yield":
        return parseYieldOrSuper(NodeType.YIELD);
      case "super":
        return parseYieldOrSuper(NodeType.SUPER);
      case "alias":
        return parseAlias();
      case "undef":
        {
          next();
          List<Node> names = new ArrayList<>();
          do {
            names.add(parseMethodNameSymbol());
          } while (acceptOperator(","));
          return builder.undefMethod(token, names);
        }
      case "defined?":
        {
          next();
          if (atOperator("(") && !peek().spaceBefore()) {
            Token open = next();
            skipNewlines();
            Node value = parseExpressionStatement();
            skipNewlines();
            Token close = expectOperator(")");
            return builder.keywordCmd(NodeType.DEFINED, token, open, ImmutableList.of(value),
                close);
          }
          return builder.keywordCmd(NodeType.DEFINED, token, null,
              ImmutableList.of(parseExpression()), null);
        }
      case "not":
        return parseNotExpression();
      default:
        throw error(token, "unexpected '" + token.value() + "'");
    }
  }

  private static NodeType jumpType(Token keyword) {
    switch (keyword.value()) {
      case "return":
        return NodeType.RETURN;
      case "break":
        return NodeType.BREAK;
      default:
        return NodeType.NEXT;
    }
  }

  /**
   * Skips the separator between a clause header and its body. Returns the {@code keyword} token
   * when present, or else the first semicolon, which the gem records as the clause's begin.
   */
  private @Nullable Token parseClauseSeparator(String keyword) {
    Token semicolon = null;
    while (atTerminator()) {
      Token terminator = next();
      if (semicolon == null && terminator.is(TokenType.SEMICOLON)) {
        semicolon = terminator;
      }
    }
    if (atKeyword(keyword)) {
      Token token = next();
      skipTerminators();
      return token;
    }
    return semicolon;
  }

  private Node parseConditional() {
    Token keyword = next();
    Node cond = parseExpressionStatement();
    Token then = parseClauseSeparator("then");
    Node body = parseCompstmt();
    Token elseToken = null;
    Node elseBody = null;
    if (keyword.isKeyword("unless")) {
      if (atKeyword("else")) {
        elseToken = next();
        elseBody = parseCompstmt();
      }
      Token end = expectKeyword("end");
      return builder.condition(keyword, cond, then, elseBody, elseToken, body, end);
    }
    if (atKeyword("else")) {
      elseToken = next();
      elseBody = parseCompstmt();
    } else if (atKeyword("elsif")) {
      elseToken = peek();
      elseBody = parseElsif();
    }
    Token end = expectKeyword("end");
    return builder.condition(keyword, cond, then, body, elseToken, elseBody, end);
  }

  private Node parseElsif() {
    Token keyword = expectKeyword("elsif");
    Node cond = parseExpressionStatement();
    Token then = parseClauseSeparator("then");
    Node body = parseCompstmt();
    Token elseToken = null;
    Node elseBody = null;
    if (atKeyword("else")) {
      elseToken = next();
      elseBody = parseCompstmt();
    } else if (atKeyword("elsif")) {
      elseToken = peek();
      elseBody = parseElsif();
    }
    return builder.condition(keyword, cond, then, body, elseToken, elseBody, null);
  }

  private Node parseLoop() {
    Token keyword = next();
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = false;
    Node cond = parseExpressionStatement();
    allowDoBlock = savedAllowDoBlock;
    Token doToken = parseClauseSeparator("do");
    Node body = parseCompstmt();
    Token end = expectKeyword("end");
    NodeType type = keyword.isKeyword("while") ? NodeType.WHILE : NodeType.UNTIL;
    return builder.loop(type, keyword, cond, doToken, body, end);
  }

  private Node parseFor() {
    Token keyword = next();
    Token name = expect(TokenType.IDENTIFIER);
    declare(name.value());
    Node iterator = builder.variable(NodeType.LVASGN, name);
    Token in = expectKeyword("in");
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = false;
    Node iteratee = parseExpressionStatement();
    allowDoBlock = savedAllowDoBlock;
    Token doToken = parseClauseSeparator("do");
    Node body = parseCompstmt();
    Token end = expectKeyword("end");
    return builder.forLoop(keyword, iterator, in, iteratee, doToken, body, end);
  }

  private Node parseCase() {
    Token keyword = next();
    Node expr = atTerminator() ? null : parseExpressionStatement();
    skipTerminators();
    if (!atKeyword("when")) {
      throw error(peek(), "expected 'when'");
    }
    List<Node> whens = new ArrayList<>();
    while (atKeyword("when")) {
      Token when = next();
      List<Node> patterns = new ArrayList<>();
      do {
        skipNewlines();
        patterns.add(parseArgument());
      } while (acceptOperator(","));
      Token then = parseClauseSeparator("then");
      whens.add(builder.when(when, patterns, then, parseCompstmt()));
    }
    Token elseToken = null;
    Node elseBody = null;
    if (atKeyword("else")) {
      elseToken = next();
      elseBody = parseCompstmt();
    }
    Token end = expectKeyword("end");
    return builder.caseNode(keyword, expr, whens, elseToken, elseBody, end);
  }

  private @Nullable Node parseBodyStmt() {
    Node body = parseCompstmt();
    List<Node> rescueBodies = new ArrayList<>();
    while (atKeyword("rescue")) {
      rescueBodies.add(parseRescue());
    }
    Token elseToken = null;
    Node elseBody = null;
    if (atKeyword("else")) {
      if (rescueBodies.isEmpty()) {
        throw error(peek(), "else without rescue is useless");
      }
      elseToken = next();
      elseBody = parseCompstmt();
    }
    Token ensureToken = null;
    Node ensureBody = null;
    if (atKeyword("ensure")) {
      ensureToken = next();
      ensureBody = parseCompstmt();
    }
    if (rescueBodies.isEmpty() && ensureToken == null) {
      return body;
    }
    return builder.beginBody(body, rescueBodies, elseToken, elseBody, ensureToken, ensureBody);
  }

  private Node parseRescue() {
    Token keyword = expectKeyword("rescue");
    List<Node> exceptions = new ArrayList<>();
    if (!atTerminator() && !atKeyword("then") && !atOperator("=>")) {
      do {
        skipNewlines();
        exceptions.add(parseTernary());
      } while (acceptOperator(","));
    }
    Node exceptionList = exceptions.isEmpty() ? null : builder.array(null, exceptions, null);
    Token assoc = null;
    Node variable = null;
    if (atOperator("=>")) {
      assoc = next();
      Token name = next();
      if (name.is(TokenType.IDENTIFIER)) {
        declare(name.value());
        variable = builder.variable(NodeType.LVASGN, name);
      } else if (name.is(TokenType.IVAR)) {
        variable = builder.variable(NodeType.IVASGN, name);
      } else {
        throw error(name, "unsupported rescue variable");
      }
    }
    Token then = parseClauseSeparator("then");
    Node body = parseCompstmt();
    return builder.rescueBody(keyword, exceptionList, assoc, variable, then, body);
  }

  private Node parseDef() {
    Token keyword = next();
    Node definee = null;
    Token dot = null;
    if (atKeyword("self") && peek(1).isOperator(".")) {
      definee = builder.keywordLiteral(next());
      dot = next();
    }
    Token name = next();
    if (!name.is(TokenType.IDENTIFIER) && !name.is(TokenType.CONSTANT)) {
      throw error(name, "expected a method name");
    }
    int nameEnd = name.end();
    if (atOperator("=") && !peek().spaceBefore() && peek(1).isOperator("(")
        && !peek(1).spaceBefore()) {
      nameEnd = next().end();
    }
    SourceRange nameRange = buffer.range(name.start(), nameEnd);

    pushScope(false);
    Node args;
    if (atOperator("(")) {
      Token open = next();
      skipNewlines();
      List<Node> params = atOperator(")") ? ImmutableList.of() : parseParameters(false);
      skipNewlines();
      Token close = expectOperator(")");
      if (params.size() == 1 && params.get(0).isType(NodeType.FORWARD_ARG)
          && version.isAtMost(RubyVersion.RUBY_3_0)) {
        args = builder.forwardOnlyArgs(open, close);
      } else {
        args = builder.args(open, params, close);
      }
    } else if (!atTerminator() && !atOperator("=")) {
      args = builder.args(null, parseParameters(false), null);
    } else {
      args = builder.args(null, ImmutableList.of(), null);
    }

    if (atOperator("=")) {
      Token equals = next();
      requireVersion(equals, RubyVersion.RUBY_3_0, "endless method definition");
      skipNewlines();
      Node body = parseExpression();
      popScope();
      return builder.defEndlessMethod(keyword, definee, dot, name, args, equals, body);
    }
    Node body = parseBodyStmt();
    Token end = expectKeyword("end");
    popScope();
    if (definee != null) {
      return builder.defSingleton(keyword, definee, dot, name, nameRange, args, body, end);
    }
    return builder.defMethod(keyword, name, nameRange, args, body, end);
  }

  private Node parseClass() {
    Token keyword = next();
    if (atOperator("<<")) {
      Token lshift = next();
      Node target = parseExpression();
      pushScope(false);
      Node body = parseBodyStmt();
      Token end = expectKeyword("end");
      popScope();
      return builder.defSclass(keyword, lshift, target, body, end);
    }
    Node name = parseConstantPath();
    Token lt = null;
    Node superclass = null;
    if (atOperator("<")) {
      lt = next();
      superclass = parseExpression();
    }
    pushScope(false);
    Node body = parseBodyStmt();
    Token end = expectKeyword("end");
    popScope();
    return builder.defClass(keyword, name, lt, superclass, body, end);
  }

  private Node parseConstantPath() {
    Node node;
    if (atOperator("::")) {
      Token colons = next();
      node = builder.constGlobal(colons, expect(TokenType.CONSTANT));
    } else {
      node = builder.constant(expect(TokenType.CONSTANT));
    }
    while (atOperator("::")) {
      Token colons = next();
      node = builder.constFetch(node, colons, expect(TokenType.CONSTANT));
    }
    return node;
  }

  private Node parseYieldOrSuper(NodeType type) {
    Token keyword = next();
    if (atOperator("(") && !peek().spaceBefore()) {
      Delimited arguments = parseCallParens();
      return builder.keywordCmd(type, keyword, arguments.open(), arguments.nodes(),
          arguments.close());
    }
    if (atCommandArgumentStart()) {
      return builder.keywordCmd(type, keyword, null, parseCommandArguments(), null);
    }
    NodeType bare = type == NodeType.SUPER ? NodeType.ZSUPER : type;
    return builder.keywordCmd(bare, keyword, null, ImmutableList.of(), null);
  }

  private Node parseAlias() {
    Token keyword = next();
    if (at(TokenType.GVAR)) {
      Node to = builder.variable(NodeType.GVAR, next());
      Node from = builder.variable(NodeType.GVAR, expect(TokenType.GVAR));
      return builder.alias(keyword, to, from);
    }
    Node to = parseMethodNameSymbol();
    Node from = parseMethodNameSymbol();
    return builder.alias(keyword, to, from);
  }

  private Node parseMethodNameSymbol() {
    Token token = next();
    switch (token.type()) {
      case SYMBOL:
        return builder.symbol(token);
      case IDENTIFIER:
      case CONSTANT:
      case KEYWORD:
        return builder.symbolInternal(token);
      default:
        throw new ParseException("expected a method name", buffer, token.start());
    }
  }
}
