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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.ast.SyntaxNode;
import org.syntaxtree.ast.SyntaxNode.ARef;
import org.syntaxtree.ast.SyntaxNode.ARefField;
import org.syntaxtree.ast.SyntaxNode.Alias;
import org.syntaxtree.ast.SyntaxNode.ArgBlock;
import org.syntaxtree.ast.SyntaxNode.ArgParen;
import org.syntaxtree.ast.SyntaxNode.ArgStar;
import org.syntaxtree.ast.SyntaxNode.Args;
import org.syntaxtree.ast.SyntaxNode.ArgsForward;
import org.syntaxtree.ast.SyntaxNode.ArrayLiteral;
import org.syntaxtree.ast.SyntaxNode.Assign;
import org.syntaxtree.ast.SyntaxNode.Assoc;
import org.syntaxtree.ast.SyntaxNode.AssocSplat;
import org.syntaxtree.ast.SyntaxNode.Backref;
import org.syntaxtree.ast.SyntaxNode.BareAssocHash;
import org.syntaxtree.ast.SyntaxNode.Begin;
import org.syntaxtree.ast.SyntaxNode.Binary;
import org.syntaxtree.ast.SyntaxNode.BlockArg;
import org.syntaxtree.ast.SyntaxNode.BlockNode;
import org.syntaxtree.ast.SyntaxNode.BlockVar;
import org.syntaxtree.ast.SyntaxNode.BodyStmt;
import org.syntaxtree.ast.SyntaxNode.Break;
import org.syntaxtree.ast.SyntaxNode.CVar;
import org.syntaxtree.ast.SyntaxNode.CallNode;
import org.syntaxtree.ast.SyntaxNode.Case;
import org.syntaxtree.ast.SyntaxNode.ClassDeclaration;
import org.syntaxtree.ast.SyntaxNode.Command;
import org.syntaxtree.ast.SyntaxNode.CommandCall;
import org.syntaxtree.ast.SyntaxNode.Const;
import org.syntaxtree.ast.SyntaxNode.ConstPathField;
import org.syntaxtree.ast.SyntaxNode.ConstPathRef;
import org.syntaxtree.ast.SyntaxNode.ConstRef;
import org.syntaxtree.ast.SyntaxNode.DefNode;
import org.syntaxtree.ast.SyntaxNode.Defined;
import org.syntaxtree.ast.SyntaxNode.DynaSymbol;
import org.syntaxtree.ast.SyntaxNode.Else;
import org.syntaxtree.ast.SyntaxNode.Elsif;
import org.syntaxtree.ast.SyntaxNode.Ensure;
import org.syntaxtree.ast.SyntaxNode.FCall;
import org.syntaxtree.ast.SyntaxNode.Field;
import org.syntaxtree.ast.SyntaxNode.FloatLiteral;
import org.syntaxtree.ast.SyntaxNode.For;
import org.syntaxtree.ast.SyntaxNode.GVar;
import org.syntaxtree.ast.SyntaxNode.HashLiteral;
import org.syntaxtree.ast.SyntaxNode.IVar;
import org.syntaxtree.ast.SyntaxNode.Ident;
import org.syntaxtree.ast.SyntaxNode.IfNode;
import org.syntaxtree.ast.SyntaxNode.IfOp;
import org.syntaxtree.ast.SyntaxNode.Imaginary;
import org.syntaxtree.ast.SyntaxNode.Int;
import org.syntaxtree.ast.SyntaxNode.Kw;
import org.syntaxtree.ast.SyntaxNode.KwRestParam;
import org.syntaxtree.ast.SyntaxNode.Label;
import org.syntaxtree.ast.SyntaxNode.Lambda;
import org.syntaxtree.ast.SyntaxNode.LambdaVar;
import org.syntaxtree.ast.SyntaxNode.MAssign;
import org.syntaxtree.ast.SyntaxNode.MLHS;
import org.syntaxtree.ast.SyntaxNode.MRHS;
import org.syntaxtree.ast.SyntaxNode.MethodAddBlock;
import org.syntaxtree.ast.SyntaxNode.ModuleDeclaration;
import org.syntaxtree.ast.SyntaxNode.Next;
import org.syntaxtree.ast.SyntaxNode.Not;
import org.syntaxtree.ast.SyntaxNode.Op;
import org.syntaxtree.ast.SyntaxNode.OpAssign;
import org.syntaxtree.ast.SyntaxNode.Params;
import org.syntaxtree.ast.SyntaxNode.Paren;
import org.syntaxtree.ast.SyntaxNode.Program;
import org.syntaxtree.ast.SyntaxNode.RangeNode;
import org.syntaxtree.ast.SyntaxNode.RationalLiteral;
import org.syntaxtree.ast.SyntaxNode.Redo;
import org.syntaxtree.ast.SyntaxNode.RegexpLiteral;
import org.syntaxtree.ast.SyntaxNode.Rescue;
import org.syntaxtree.ast.SyntaxNode.RescueEx;
import org.syntaxtree.ast.SyntaxNode.RescueMod;
import org.syntaxtree.ast.SyntaxNode.RestParam;
import org.syntaxtree.ast.SyntaxNode.Retry;
import org.syntaxtree.ast.SyntaxNode.ReturnNode;
import org.syntaxtree.ast.SyntaxNode.SClass;
import org.syntaxtree.ast.SyntaxNode.Statements;
import org.syntaxtree.ast.SyntaxNode.StringConcat;
import org.syntaxtree.ast.SyntaxNode.StringEmbExpr;
import org.syntaxtree.ast.SyntaxNode.StringLiteral;
import org.syntaxtree.ast.SyntaxNode.Super;
import org.syntaxtree.ast.SyntaxNode.SymbolLiteral;
import org.syntaxtree.ast.SyntaxNode.TStringContent;
import org.syntaxtree.ast.SyntaxNode.TopConstField;
import org.syntaxtree.ast.SyntaxNode.TopConstRef;
import org.syntaxtree.ast.SyntaxNode.Unary;
import org.syntaxtree.ast.SyntaxNode.Undef;
import org.syntaxtree.ast.SyntaxNode.UnlessNode;
import org.syntaxtree.ast.SyntaxNode.UntilNode;
import org.syntaxtree.ast.SyntaxNode.VCall;
import org.syntaxtree.ast.SyntaxNode.VarAlias;
import org.syntaxtree.ast.SyntaxNode.VarField;
import org.syntaxtree.ast.SyntaxNode.VarRef;
import org.syntaxtree.ast.SyntaxNode.When;
import org.syntaxtree.ast.SyntaxNode.WhileNode;
import org.syntaxtree.ast.SyntaxNode.YieldNode;
import org.syntaxtree.ast.SyntaxNode.ZSuper;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.source.SourceRange;

/**
 * A recursive descent parser that builds the Syntax Tree schema.
 *
 * <p>The tree keeps the shape of the concrete syntax: parentheses, statement lists and argument
 * lists all get nodes, bare identifiers are {@link VCall}s until they are assigned, and string
 * content that spans lines stays in one {@link TStringContent}.
 */
public final class SyntaxTreeParser extends AbstractRubyParser {

  /** Returns a {@link PrimaryParser} that parses each source with a fresh instance. */
  public static PrimaryParser create() {
    return source -> new SyntaxTreeParser(new SourceBuffer(source)).parseProgram();
  }

  public SyntaxTreeParser(SourceBuffer buffer) {
    super(buffer);
  }

  public Program parseProgram() {
    Statements statements = parseStatements();
    if (!at(TokenType.EOF)) {
      throw error(peek(), "unexpected '" + peek().value() + "'");
    }
    return new Program(statements, range(0, buffer.length()));
  }

  // Statements

  private Statements parseStatements() {
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = true;
    List<SyntaxNode> body = new ArrayList<>();
    skipTerminators();
    while (!atStatementsEnd()) {
      body.add(parseStatement());
      if (!atStatementsEnd() && !atTerminator()) {
        throw error(peek(), "unexpected '" + peek().value() + "'");
      }
      skipTerminators();
    }
    allowDoBlock = savedAllowDoBlock;
    SourceRange location =
        body.isEmpty()
            ? range(peek().start(), peek().start())
            : join(body.get(0), body.get(body.size() - 1));
    return new Statements(ImmutableList.copyOf(body), location);
  }

  private SyntaxNode parseStatement() {
    SyntaxNode node = atOperator("*") ? parseMultipleAssignment(null) : parseExpressionStatement();
    if (atOperator(",")) {
      node = node instanceof Assign
          ? parseAssignedValues((Assign) node)
          : parseMultipleAssignment(node);
    }
    while (true) {
      Token token = peek();
      if (!token.is(TokenType.KEYWORD)) {
        return node;
      }
      switch (token.value()) {
        case "if":
        case "unless":
        case "while":
        case "until":
          {
            next();
            SyntaxNode predicate = parseExpressionStatement();
            Statements statements = new Statements(ImmutableList.of(node), node.location());
            SourceRange location = join(node, predicate);
            if (token.value().equals("if")) {
              node = new IfNode(predicate, statements, null, true, location);
            } else if (token.value().equals("unless")) {
              node = new UnlessNode(predicate, statements, null, true, location);
            } else if (token.value().equals("while")) {
              node = new WhileNode(predicate, statements, true, location);
            } else {
              node = new UntilNode(predicate, statements, true, location);
            }
            break;
          }
        case "rescue":
          {
            next();
            node = rescueModifier(node, parseExpressionStatement());
            break;
          }
        default:
          return node;
      }
    }
  }

  /** An assignment rescues its value, as in {@code x = (1 rescue 2)}, not itself. */
  private SyntaxNode rescueModifier(SyntaxNode statement, SyntaxNode value) {
    if (statement instanceof Assign) {
      Assign assign = (Assign) statement;
      SyntaxNode rescued = rescueModifier(assign.value(), value);
      return new Assign(assign.target(), rescued, join(assign.target(), rescued));
    }
    if (statement instanceof MAssign) {
      MAssign assign = (MAssign) statement;
      SyntaxNode rescued = rescueModifier(assign.value(), value);
      return new MAssign(assign.target(), rescued, join(assign.target(), rescued));
    }
    if (statement instanceof OpAssign) {
      OpAssign assign = (OpAssign) statement;
      SyntaxNode rescued = rescueModifier(assign.value(), value);
      return new OpAssign(assign.target(), assign.operator(), rescued,
          join(assign.target(), rescued));
    }
    return new RescueMod(statement, value, join(statement, value));
  }

  /** {@code a = 1, 2} assigns the values on the right as an {@link MRHS}. */
  private SyntaxNode parseAssignedValues(Assign assign) {
    List<SyntaxNode> values = new ArrayList<>();
    if (assign.value() instanceof MRHS) {
      values.addAll(((MRHS) assign.value()).parts());
    } else {
      values.add(assign.value());
    }
    while (acceptOperator(",")) {
      skipNewlines();
      values.add(parseMultipleValue());
    }
    MRHS value = new MRHS(ImmutableList.copyOf(values),
        join(values.get(0), values.get(values.size() - 1)));
    return new Assign(assign.target(), value, join(assign.target(), value));
  }

  /**
   * {@code a, *b = c}. {@code first} is the already parsed first target, or null when the
   * statement starts with a splat.
   */
  private SyntaxNode parseMultipleAssignment(@Nullable SyntaxNode first) {
    List<SyntaxNode> targets = new ArrayList<>();
    if (first != null) {
      targets.add(toAssignmentTarget(first, peek()));
      expectOperator(",");
    }
    while (!atOperator("=")) {
      Token token = peek();
      if (token.isOperator("*")) {
        next();
        if (atOperator(",") || atOperator("=")) {
          targets.add(new ArgStar(null, range(token)));
        } else {
          SyntaxNode target = toAssignmentTarget(parsePostfix(parsePrimary()), token);
          targets.add(new ArgStar(target, range(token.start(), target.endChar())));
        }
      } else {
        targets.add(toAssignmentTarget(parsePostfix(parsePrimary()), token));
      }
      if (!acceptOperator(",")) {
        break;
      }
    }
    MLHS target = new MLHS(ImmutableList.copyOf(targets),
        join(targets.get(0), targets.get(targets.size() - 1)));
    expectOperator("=");
    List<SyntaxNode> values = new ArrayList<>();
    do {
      skipNewlines();
      values.add(parseMultipleValue());
    } while (acceptOperator(","));
    SyntaxNode value = values.size() == 1 && !(values.get(0) instanceof ArgStar)
        ? values.get(0)
        : new MRHS(ImmutableList.copyOf(values),
            join(values.get(0), values.get(values.size() - 1)));
    return new MAssign(target, value, join(target, value));
  }

  private SyntaxNode parseMultipleValue() {
    Token token = peek();
    if (token.isOperator("*")) {
      next();
      SyntaxNode value = parseTernary();
      return new ArgStar(value, range(token.start(), value.endChar()));
    }
    return parseExpression();
  }

  /** {@code and}, {@code or} and {@code not}. */
  private SyntaxNode parseExpressionStatement() {
    SyntaxNode left = parseNotExpression();
    while (atKeyword("and") || atKeyword("or")) {
      String operator = next().value();
      skipNewlines();
      SyntaxNode right = parseNotExpression();
      left = new Binary(left, operator, right, join(left, right));
    }
    return left;
  }

  private SyntaxNode parseNotExpression() {
    if (!atKeyword("not")) {
      return parseExpression();
    }
    Token keyword = next();
    if (atOperator("(") && !peek().spaceBefore()) {
      next();
      skipNewlines();
      SyntaxNode operand = atOperator(")") ? null : parseExpressionStatement();
      skipNewlines();
      Token close = expectOperator(")");
      return new Not(operand, true, range(keyword.start(), close.end()));
    }
    SyntaxNode operand = parseNotExpression();
    return new Not(operand, false, range(keyword.start(), operand.endChar()));
  }

  /** Assignment and operator assignment, which associate to the right. */
  private SyntaxNode parseExpression() {
    SyntaxNode left = parseTernary();
    Token token = peek();
    if (token.isOperator("=")) {
      SyntaxNode target = toAssignmentTarget(left, token);
      next();
      skipNewlines();
      SyntaxNode value;
      if (atOperator("*")) {
        SyntaxNode splat = parseMultipleValue();
        value = new MRHS(ImmutableList.of(splat), splat.location());
      } else {
        value = parseExpression();
      }
      return new Assign(target, value, join(left, value));
    }
    if (isAssignmentOperator(token)) {
      SyntaxNode target = toAssignmentTarget(left, token);
      next();
      skipNewlines();
      SyntaxNode value = parseExpression();
      return new OpAssign(target, new Op(token.value(), range(token)), value, join(left, value));
    }
    return left;
  }

  private SyntaxNode toAssignmentTarget(SyntaxNode node, Token operator) {
    if (node instanceof VCall) {
      Ident name = ((VCall) node).value();
      declare(name.value());
      return new VarField(name, node.location());
    }
    if (node instanceof VarRef) {
      SyntaxNode value = ((VarRef) node).value();
      if (value instanceof Kw) {
        throw error(operator, "Can't assign to " + ((Kw) value).value());
      }
      return new VarField(value, node.location());
    }
    if (node instanceof ConstPathRef) {
      ConstPathRef path = (ConstPathRef) node;
      return new ConstPathField(path.parent(), path.constant(), node.location());
    }
    if (node instanceof TopConstRef) {
      return new TopConstField(((TopConstRef) node).constant(), node.location());
    }
    if (node instanceof CallNode && ((CallNode) node).arguments() == null) {
      CallNode call = (CallNode) node;
      return new Field(call.receiver(), call.operator(), call.message(), node.location());
    }
    if (node instanceof ARef) {
      ARef ref = (ARef) node;
      return new ARefField(ref.collection(), ref.index(), node.location());
    }
    throw error(operator, "unexpected assignment target");
  }

  private SyntaxNode parseTernary() {
    SyntaxNode predicate = parseRange();
    if (!atOperator("?")) {
      return predicate;
    }
    next();
    skipNewlines();
    SyntaxNode truthy = parseTernary();
    skipNewlines();
    expectOperator(":");
    skipNewlines();
    SyntaxNode falsy = parseTernary();
    return new IfOp(predicate, truthy, falsy, join(predicate, falsy));
  }

  private SyntaxNode parseRange() {
    if (atOperator("..") || atOperator("...")) {
      Token operator = next();
      SyntaxNode right = parseBinary(1);
      return new RangeNode(
          null, new Op(operator.value(), range(operator)), right,
          range(operator.start(), right.endChar()));
    }
    SyntaxNode left = parseBinary(1);
    if (!atOperator("..") && !atOperator("...")) {
      return left;
    }
    Token operator = next();
    SyntaxNode right = atArgumentsEnd() || atOperator(",") ? null : parseBinary(1);
    int end = right != null ? right.endChar() : operator.end();
    return new RangeNode(
        left, new Op(operator.value(), range(operator)), right, range(left.startChar(), end));
  }

  private SyntaxNode parseBinary(int minPrecedence) {
    SyntaxNode left = parseUnary();
    while (true) {
      Token operator = peek();
      int precedence = binaryPrecedence(operator);
      if (precedence < minPrecedence) {
        return left;
      }
      next();
      skipNewlines();
      SyntaxNode right =
          operator.value().equals("**") ? parseBinary(precedence) : parseBinary(precedence + 1);
      left = new Binary(left, operator.value(), right, join(left, right));
    }
  }

  private SyntaxNode parseUnary() {
    Token token = peek();
    if (atSignedNumber()) {
      next();
      SyntaxNode number = parseNumber(next());
      return parsePostfix(
          new Unary(new Op(token.value(), range(token)), number,
              range(token.start(), number.endChar())));
    }
    if (token.isOperator("!")
        || token.isOperator("-")
        || token.isOperator("+")
        || token.isOperator("~")) {
      next();
      SyntaxNode operand = parseUnary();
      return new Unary(
          new Op(token.value(), range(token)), operand, range(token.start(), operand.endChar()));
    }
    return parsePostfix(parsePrimary());
  }

  // Calls and postfix operators

  private SyntaxNode parsePostfix(SyntaxNode receiver) {
    SyntaxNode node = receiver;
    while (true) {
      Token token = peek();
      if (token.isOperator(".") || token.isOperator("&.") || atColonCall()) {
        next();
        Token name = next();
        if (!name.is(TokenType.IDENTIFIER) && !name.is(TokenType.CONSTANT)) {
          throw error(name, "expected a method name");
        }
        SyntaxNode message = name.is(TokenType.CONSTANT)
            ? new Const(name.value(), range(name))
            : new Ident(name.value(), range(name));
        Op operator = new Op(token.value(), range(token));
        if (atOperator("(") && !peek().spaceBefore()) {
          ArgParen arguments = parseArgParen();
          node = new CallNode(node, operator, message, arguments,
              range(node.startChar(), arguments.endChar()));
        } else if (atCommandArgumentStart()) {
          Args arguments = parseCommandArguments();
          BlockNode block = atKeyword("do") && allowDoBlock ? parseBlock() : null;
          int end = block != null ? block.endChar() : arguments.endChar();
          return new CommandCall(node, operator, message, arguments, block,
              range(node.startChar(), end));
        } else {
          node = new CallNode(node, operator, message, null, range(node.startChar(), name.end()));
        }
      } else if (token.isOperator("::") && !token.spaceBefore()) {
        next();
        Token name = expect(TokenType.CONSTANT);
        node = new ConstPathRef(node, new Const(name.value(), range(name)),
            range(node.startChar(), name.end()));
      } else if (token.isOperator("[") && !token.spaceBefore()) {
        next();
        skipNewlines();
        Args index = atOperator("]") ? null : parseArgs("]");
        skipNewlines();
        Token close = expectOperator("]");
        node = new ARef(node, index, range(node.startChar(), close.end()));
      } else if ((token.isOperator("{") || (token.isKeyword("do") && allowDoBlock))
          && acceptsBlock(node)) {
        BlockNode block = parseBlock();
        node = new MethodAddBlock(node, block, range(node.startChar(), block.endChar()));
      } else {
        return node;
      }
    }
  }

  private static boolean acceptsBlock(SyntaxNode node) {
    return node instanceof VCall
        || node instanceof FCall
        || node instanceof CallNode
        || node instanceof ZSuper
        || (node instanceof Super && ((Super) node).arguments() instanceof ArgParen);
  }

  private ArgParen parseArgParen() {
    Token open = expectOperator("(");
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = true;
    skipNewlines();
    SyntaxNode arguments = null;
    if (!atOperator(")")) {
      Args args = parseArgs(")");
      arguments =
          args.parts().size() == 1 && args.parts().get(0) instanceof ArgsForward
              ? args.parts().get(0)
              : args;
    }
    skipNewlines();
    Token close = expectOperator(")");
    allowDoBlock = savedAllowDoBlock;
    return new ArgParen(arguments, range(open.start(), close.end()));
  }

  private Args parseCommandArguments() {
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = false;
    Args arguments = parseArgs(null);
    allowDoBlock = savedAllowDoBlock;
    return arguments;
  }

  /**
   * Parses a comma separated argument list. Trailing {@code key => value} and {@code key: value}
   * pairs are grouped into a {@link BareAssocHash}. {@code closer} is the closing bracket, or null
   * for an argument list without parentheses.
   */
  private Args parseArgs(@Nullable String closer) {
    List<SyntaxNode> parts = new ArrayList<>();
    List<SyntaxNode> assocs = new ArrayList<>();
    while (true) {
      if (closer != null) {
        skipNewlines();
        if (atOperator(closer)) {
          break;
        }
      }
      SyntaxNode argument = parseArgument();
      if (argument instanceof Assoc || argument instanceof AssocSplat) {
        assocs.add(argument);
      } else {
        if (!assocs.isEmpty()) {
          if (!(argument instanceof ArgBlock)) {
            throw error(peek(), "positional argument after keyword arguments");
          }
          parts.add(bareHash(assocs));
          assocs.clear();
        }
        parts.add(argument);
      }
      if (!acceptOperator(",")) {
        break;
      }
    }
    if (!assocs.isEmpty()) {
      parts.add(bareHash(assocs));
    }
    return new Args(ImmutableList.copyOf(parts), join(parts.get(0), parts.get(parts.size() - 1)));
  }

  private BareAssocHash bareHash(List<SyntaxNode> assocs) {
    return new BareAssocHash(
        ImmutableList.copyOf(assocs), join(assocs.get(0), assocs.get(assocs.size() - 1)));
  }

  private SyntaxNode parseArgument() {
    Token token = peek();
    if (token.is(TokenType.LABEL)) {
      next();
      Label label = new Label(token.value(), range(token));
      skipNewlines();
      SyntaxNode value = parseExpression();
      return new Assoc(label, value, join(label, value));
    }
    if (atStringLabel()) {
      next();
      List<SyntaxNode> parts = parseStringParts();
      Token close = expect(TokenType.LABEL_END);
      DynaSymbol key = new DynaSymbol(
          parts, String.valueOf(close.value().charAt(0)), range(token.start(), close.end()));
      skipNewlines();
      SyntaxNode value = parseExpression();
      return new Assoc(key, value, join(key, value));
    }
    if (token.isOperator("*")) {
      next();
      if (atOperator(",") || atOperator(")") || atOperator("]")) {
        return new ArgStar(null, range(token));
      }
      SyntaxNode value = parseTernary();
      return new ArgStar(value, range(token.start(), value.endChar()));
    }
    if (token.isOperator("**")) {
      next();
      SyntaxNode value = parseTernary();
      return new AssocSplat(value, range(token.start(), value.endChar()));
    }
    if (token.isOperator("&")) {
      next();
      if (atOperator(")")) {
        return new ArgBlock(null, range(token));
      }
      SyntaxNode value = parseTernary();
      return new ArgBlock(value, range(token.start(), value.endChar()));
    }
    if (token.isOperator("...") && peek(1).isOperator(")")) {
      next();
      return new ArgsForward(range(token));
    }
    SyntaxNode value = parseExpression();
    if (atOperator("=>")) {
      next();
      skipNewlines();
      SyntaxNode hashValue = parseExpression();
      return new Assoc(value, hashValue, join(value, hashValue));
    }
    return value;
  }

  private BlockNode parseBlock() {
    Token open = next();
    boolean braces = open.isOperator("{");
    pushScope(true);
    skipNewlines();
    BlockVar blockVar = atOperator("|") || atOperator("||") ? parseBlockVar() : null;
    SyntaxNode body;
    Token close;
    if (braces) {
      body = parseStatements();
      close = expectOperator("}");
    } else {
      body = parseBodyStmt();
      close = expectKeyword("end");
    }
    popScope();
    SyntaxNode opening =
        braces ? new Op("{", range(open)) : new Kw(open.value(), range(open));
    return new BlockNode(opening, blockVar, body, range(open.start(), close.end()));
  }

  private BlockVar parseBlockVar() {
    Token open = next();
    if (open.isOperator("||")) {
      return new BlockVar(
          emptyParams(open.start() + 1), ImmutableList.of(), range(open));
    }
    Params params = atOperator("|") || at(TokenType.SEMICOLON)
        ? emptyParams(peek().start())
        : parseParameters(true);
    List<Ident> locals = parseBlockLocals();
    Token close = expectOperator("|");
    return new BlockVar(params, locals, range(open.start(), close.end()));
  }

  private List<Ident> parseBlockLocals() {
    List<Ident> locals = new ArrayList<>();
    if (!at(TokenType.SEMICOLON)) {
      return locals;
    }
    next();
    do {
      Token name = expect(TokenType.IDENTIFIER);
      declare(name.value());
      locals.add(new Ident(name.value(), range(name)));
    } while (acceptOperator(","));
    return ImmutableList.copyOf(locals);
  }

  // Parameters

  private Params emptyParams(int offset) {
    return new Params(ImmutableList.of(), ImmutableList.of(), null, ImmutableList.of(),
        ImmutableList.of(), null, null, range(offset, offset));
  }

  /**
   * Parses a parameter list. Defaults of block parameters are primary expressions, so that the
   * closing {@code |} is not read as an operator.
   */
  private Params parseParameters(boolean block) {
    List<Ident> requireds = new ArrayList<>();
    List<Params.OptionalParam> optionals = new ArrayList<>();
    RestParam rest = null;
    List<Ident> posts = new ArrayList<>();
    List<Params.KeywordParam> keywords = new ArrayList<>();
    SyntaxNode keywordRest = null;
    BlockArg blockArg = null;
    int start = peek().start();
    while (true) {
      Token token = next();
      if (token.is(TokenType.IDENTIFIER)) {
        declare(token.value());
        Ident name = new Ident(token.value(), range(token));
        if (acceptOperator("=")) {
          SyntaxNode value = block ? parsePostfix(parsePrimary()) : parseTernary();
          optionals.add(new Params.OptionalParam(name, value));
        } else if (rest == null && optionals.isEmpty()) {
          requireds.add(name);
        } else {
          posts.add(name);
        }
      } else if (token.is(TokenType.LABEL)) {
        String name = token.value().substring(0, token.value().length() - 1);
        declare(name);
        SyntaxNode value = null;
        if (!atOperator(",") && !atParametersEnd()) {
          value = block ? parsePostfix(parsePrimary()) : parseTernary();
        }
        keywords.add(new Params.KeywordParam(new Label(token.value(), range(token)), value));
      } else if (token.isOperator("*")) {
        Ident name = parseParameterName();
        rest = new RestParam(
            name, range(token.start(), name != null ? name.endChar() : token.end()));
      } else if (token.isOperator("**")) {
        Ident name = parseParameterName();
        keywordRest = new KwRestParam(
            name, range(token.start(), name != null ? name.endChar() : token.end()));
      } else if (token.isOperator("&")) {
        Ident name = parseParameterName();
        blockArg = new BlockArg(
            name, range(token.start(), name != null ? name.endChar() : token.end()));
      } else if (token.isOperator("...") && !block) {
        keywordRest = new ArgsForward(range(token));
      } else {
        throw error(token, "unexpected '" + token.value() + "' in parameters");
      }
      if (!acceptOperator(",")) {
        break;
      }
      skipNewlines();
    }
    return new Params(
        ImmutableList.copyOf(requireds),
        ImmutableList.copyOf(optionals),
        rest,
        ImmutableList.copyOf(posts),
        ImmutableList.copyOf(keywords),
        keywordRest,
        blockArg,
        range(start, previous().end()));
  }

  private @Nullable Ident parseParameterName() {
    if (!at(TokenType.IDENTIFIER)) {
      return null;
    }
    Token name = next();
    declare(name.value());
    return new Ident(name.value(), range(name));
  }

  private boolean atParametersEnd() {
    return atOperator(")") || atOperator("|") || atTerminator() || at(TokenType.EOF);
  }

  // Primary expressions

  private SyntaxNode parsePrimary() {
    Token token = peek();
    switch (token.type()) {
      case INTEGER:
      case FLOAT:
      case RATIONAL:
      case IMAGINARY:
        return parseNumber(next());
      case STRING_BEGIN:
        {
          SyntaxNode string = parseString();
          while (at(TokenType.STRING_BEGIN)) {
            SyntaxNode right = parseString();
            string = new StringConcat(string, right, join(string, right));
          }
          return string;
        }
      case DSYMBOL_BEGIN:
        {
          next();
          List<SyntaxNode> parts = parseStringParts();
          Token close = expect(TokenType.STRING_END);
          return new DynaSymbol(parts, token.value(), range(token.start(), close.end()));
        }
      case SYMBOL:
        next();
        return new SymbolLiteral(
            symbolValue(token.value(), range(token.start() + 1, token.end())), range(token));
      case REGEXP_BEGIN:
        {
          next();
          List<SyntaxNode> parts = parseStringParts();
          Token close = expect(TokenType.REGEXP_END);
          return new RegexpLiteral(
              token.value(), close.value(), parts, range(token.start(), close.end()));
        }
      case IVAR:
        next();
        return new VarRef(new IVar(token.value(), range(token)), range(token));
      case GVAR:
        next();
        return new VarRef(new GVar(token.value(), range(token)), range(token));
      case CVAR:
        next();
        return new VarRef(new CVar(token.value(), range(token)), range(token));
      case BACKREF:
        next();
        return new VarRef(new Backref(token.value(), range(token)), range(token));
      case CONSTANT:
        next();
        return new VarRef(new Const(token.value(), range(token)), range(token));
      case IDENTIFIER:
        return parseIdentifier();
      case KEYWORD:
        return parseKeyword();
      case OPERATOR:
        switch (token.value()) {
          case "(":
            return parseParen();
          case "[":
            return parseArray();
          case "{":
            return parseHash();
          case "->":
            return parseLambda();
          case "::":
            {
              next();
              Token name = expect(TokenType.CONSTANT);
              return new TopConstRef(
                  new Const(name.value(), range(name)), range(token.start(), name.end()));
            }
          default:
            break;
        }
        break;
      default:
        break;
    }
    throw error(token, "unexpected '" + token.value() + "'");
  }

  private SyntaxNode parseNumber(Token token) {
    switch (token.type()) {
      case INTEGER:
        return new Int(token.value(), range(token));
      case RATIONAL:
        return new RationalLiteral(token.value(), range(token));
      case IMAGINARY:
        return new Imaginary(token.value(), range(token));
      default:
        return new FloatLiteral(token.value(), range(token));
    }
  }

  private SyntaxNode parseIdentifier() {
    Token token = next();
    Ident name = new Ident(token.value(), range(token));
    boolean call = atOperator("(") && !peek().spaceBefore();
    if (isLocal(token.value()) && !call) {
      return new VarRef(name, name.location());
    }
    if (call) {
      ArgParen arguments = parseArgParen();
      return new FCall(name, arguments, range(token.start(), arguments.endChar()));
    }
    if (atCommandArgumentStart()) {
      Args arguments = parseCommandArguments();
      BlockNode block = atKeyword("do") && allowDoBlock ? parseBlock() : null;
      int end = block != null ? block.endChar() : arguments.endChar();
      return new Command(name, arguments, block, range(token.start(), end));
    }
    return new VCall(name, name.location());
  }

  private SyntaxNode symbolValue(String name, SourceRange location) {
    if (name.startsWith("@@")) {
      return new CVar(name, location);
    } else if (name.startsWith("@")) {
      return new IVar(name, location);
    } else if (name.startsWith("$")) {
      return new GVar(name, location);
    } else if (Lexer.KEYWORDS.contains(name)) {
      return new Kw(name, location);
    } else if (Character.isUpperCase(name.charAt(0))) {
      return new Const(name, location);
    } else if (Lexer.isIdentifierStart(name.charAt(0))) {
      return new Ident(name, location);
    }
    return new Op(name, location);
  }

  private StringLiteral parseString() {
    Token open = expect(TokenType.STRING_BEGIN);
    List<SyntaxNode> parts = parseStringParts();
    Token close = expect(TokenType.STRING_END);
    return new StringLiteral(parts, open.value(), range(open.start(), close.end()));
  }

  /** Parses content and interpolations up to the closing delimiter, merging adjacent content. */
  private List<SyntaxNode> parseStringParts() {
    List<SyntaxNode> parts = new ArrayList<>();
    while (true) {
      if (at(TokenType.STRING_CONTENT)) {
        Token first = next();
        StringBuilder value = new StringBuilder(first.value());
        int end = first.end();
        while (at(TokenType.STRING_CONTENT)) {
          Token more = next();
          value.append(more.value());
          end = more.end();
        }
        parts.add(new TStringContent(value.toString(), range(first.start(), end)));
      } else if (at(TokenType.EMBEXPR_BEGIN)) {
        Token open = next();
        Statements statements = parseStatements();
        Token close = expect(TokenType.EMBEXPR_END);
        parts.add(new StringEmbExpr(statements, range(open.start(), close.end())));
      } else {
        return ImmutableList.copyOf(parts);
      }
    }
  }

  private SyntaxNode parseParen() {
    Token open = next();
    Statements contents = parseStatements();
    Token close = expectOperator(")");
    return new Paren(new Op("(", range(open)), contents, range(open.start(), close.end()));
  }

  private SyntaxNode parseArray() {
    Token open = next();
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = true;
    skipNewlines();
    Args contents = atOperator("]") ? null : parseArgs("]");
    skipNewlines();
    Token close = expectOperator("]");
    allowDoBlock = savedAllowDoBlock;
    return new ArrayLiteral(new Op("[", range(open)), contents, range(open.start(), close.end()));
  }

  private SyntaxNode parseHash() {
    Token open = next();
    List<SyntaxNode> assocs = new ArrayList<>();
    skipNewlines();
    while (!atOperator("}")) {
      SyntaxNode assoc = parseArgument();
      if (!(assoc instanceof Assoc) && !(assoc instanceof AssocSplat)) {
        throw error(peek(), "expected '=>'");
      }
      assocs.add(assoc);
      if (!acceptOperator(",")) {
        break;
      }
      skipNewlines();
    }
    skipNewlines();
    Token close = expectOperator("}");
    return new HashLiteral(ImmutableList.copyOf(assocs), range(open.start(), close.end()));
  }

  private SyntaxNode parseLambda() {
    Token arrow = next();
    pushScope(true);
    SyntaxNode params;
    if (atOperator("(")) {
      Token open = next();
      skipNewlines();
      Params inner = atOperator(")") || at(TokenType.SEMICOLON)
          ? emptyParams(peek().start())
          : parseParameters(false);
      List<Ident> locals = parseBlockLocals();
      skipNewlines();
      Token close = expectOperator(")");
      LambdaVar var = new LambdaVar(inner, locals, range(open.end(), close.start()));
      params = new Paren(new Op("(", range(open)), var, range(open.start(), close.end()));
    } else if (at(TokenType.IDENTIFIER) || at(TokenType.LABEL) || atOperator("*")
        || atOperator("**") || atOperator("&")) {
      Params inner = parseParameters(false);
      params = new LambdaVar(inner, ImmutableList.of(), inner.location());
    } else {
      params = new LambdaVar(
          emptyParams(arrow.end()), ImmutableList.of(), range(arrow.end(), arrow.end()));
    }
    SyntaxNode body;
    Token close;
    if (atOperator("{")) {
      next();
      body = parseStatements();
      close = expectOperator("}");
    } else {
      expectKeyword("do");
      body = parseBodyStmt();
      close = expectKeyword("end");
    }
    popScope();
    return new Lambda(params, body, range(arrow.start(), close.end()));
  }

  // Keywords

  private SyntaxNode parseKeyword() {
    Token token = peek();
    switch (token.value()) {
      case "nil":
      case "true":
      case "false":
      case "self":
      case "__FILE__":
      case "__LINE__":
        next();
        return new VarRef(new Kw(token.value(), range(token)), range(token));
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
          BodyStmt bodystmt = parseBodyStmt();
          Token end = expectKeyword("end");
          return new Begin(bodystmt, range(token.start(), end.end()));
        }
      case "def":
        return parseDef();
      case "class":
        return parseClass();
      case "module":
        {
          next();
          SyntaxNode constant = parseConstantPath();
          pushScope(false);
          BodyStmt bodystmt = parseBodyStmt();
          Token end = expectKeyword("end");
          popScope();
          return new ModuleDeclaration(constant, bodystmt, range(token.start(), end.end()));
        }
      case "return":
      case "break":
      case "next":
        return parseJump();
      case "redo":
        next();
        return new Redo(range(token));
      case "retry":
        next();
        return new Retry(range(token));
      case "yield":
        return parseYield();
      case "super":
        return parseSuper();
      case "alias":
        return parseAlias();
      case "undef":
        {
          next();
          List<SyntaxNode> symbols = new ArrayList<>();
          do {
            symbols.add(parseMethodNameSymbol());
          } while (acceptOperator(","));
          return new Undef(ImmutableList.copyOf(symbols),
              range(token.start(), symbols.get(symbols.size() - 1).endChar()));
        }
      case "defined?":
        {
          next();
          if (atOperator("(") && !peek().spaceBefore()) {
            next();
            skipNewlines();
            SyntaxNode value = parseExpressionStatement();
            skipNewlines();
            Token close = expectOperator(")");
            return new Defined(value, range(token.start(), close.end()));
          }
          SyntaxNode value = parseExpression();
          return new Defined(value, range(token.start(), value.endChar()));
        }
      case "not":
        return parseNotExpression();
      default:
        throw error(token, "unexpected '" + token.value() + "'");
    }
  }

  /** Skips the separator between a clause header and its body. */
  private void parseClauseSeparator(String keyword) {
    skipTerminators();
    if (acceptKeyword(keyword)) {
      skipTerminators();
    }
  }

  private SyntaxNode parseConditional() {
    Token keyword = next();
    SyntaxNode predicate = parseExpressionStatement();
    parseClauseSeparator("then");
    Statements statements = parseStatements();
    if (keyword.isKeyword("unless")) {
      Else consequent = atKeyword("else") ? parseElse() : null;
      Token end = expectKeyword("end");
      return new UnlessNode(predicate, statements, consequent, false,
          range(keyword.start(), end.end()));
    }
    SyntaxNode consequent = parseIfTail();
    Token end = expectKeyword("end");
    return new IfNode(predicate, statements, consequent, false, range(keyword.start(), end.end()));
  }

  private @Nullable SyntaxNode parseIfTail() {
    if (atKeyword("else")) {
      return parseElse();
    }
    if (!atKeyword("elsif")) {
      return null;
    }
    Token keyword = next();
    SyntaxNode predicate = parseExpressionStatement();
    parseClauseSeparator("then");
    Statements statements = parseStatements();
    SyntaxNode consequent = parseIfTail();
    int end = consequent != null ? consequent.endChar() : statements.endChar();
    return new Elsif(predicate, statements, consequent, range(keyword.start(), end));
  }

  private Else parseElse() {
    Token keyword = expectKeyword("else");
    Statements statements = parseStatements();
    return new Else(new Kw("else", range(keyword)), statements,
        range(keyword.start(), statements.endChar()));
  }

  private SyntaxNode parseLoop() {
    Token keyword = next();
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = false;
    SyntaxNode predicate = parseExpressionStatement();
    allowDoBlock = savedAllowDoBlock;
    parseClauseSeparator("do");
    Statements statements = parseStatements();
    Token end = expectKeyword("end");
    SourceRange location = range(keyword.start(), end.end());
    return keyword.isKeyword("while")
        ? new WhileNode(predicate, statements, false, location)
        : new UntilNode(predicate, statements, false, location);
  }

  private SyntaxNode parseFor() {
    Token keyword = next();
    Token name = expect(TokenType.IDENTIFIER);
    declare(name.value());
    VarField index = new VarField(new Ident(name.value(), range(name)), range(name));
    expectKeyword("in");
    boolean savedAllowDoBlock = allowDoBlock;
    allowDoBlock = false;
    SyntaxNode collection = parseExpressionStatement();
    allowDoBlock = savedAllowDoBlock;
    parseClauseSeparator("do");
    Statements statements = parseStatements();
    Token end = expectKeyword("end");
    return new For(index, collection, statements, range(keyword.start(), end.end()));
  }

  private SyntaxNode parseCase() {
    Token keyword = next();
    SyntaxNode value = atTerminator() ? null : parseExpressionStatement();
    skipTerminators();
    if (!atKeyword("when")) {
      throw error(peek(), "expected 'when'");
    }
    When consequent = parseWhen();
    Token end = expectKeyword("end");
    return new Case(value, consequent, range(keyword.start(), end.end()));
  }

  private When parseWhen() {
    Token keyword = expectKeyword("when");
    List<SyntaxNode> patterns = new ArrayList<>();
    do {
      skipNewlines();
      patterns.add(parseArgument());
    } while (acceptOperator(","));
    Args arguments = new Args(ImmutableList.copyOf(patterns),
        join(patterns.get(0), patterns.get(patterns.size() - 1)));
    parseClauseSeparator("then");
    Statements statements = parseStatements();
    SyntaxNode consequent = null;
    if (atKeyword("when")) {
      consequent = parseWhen();
    } else if (atKeyword("else")) {
      consequent = parseElse();
    }
    int end = consequent != null ? consequent.endChar() : statements.endChar();
    return new When(arguments, statements, consequent, range(keyword.start(), end));
  }

  private BodyStmt parseBodyStmt() {
    Statements statements = parseStatements();
    Rescue rescueClause = atKeyword("rescue") ? parseRescue() : null;
    Else elseClause = null;
    if (atKeyword("else")) {
      if (rescueClause == null) {
        throw error(peek(), "else without rescue is useless");
      }
      elseClause = parseElse();
    }
    Ensure ensureClause = null;
    if (atKeyword("ensure")) {
      Token keyword = next();
      Statements ensureStatements = parseStatements();
      ensureClause = new Ensure(new Kw("ensure", range(keyword)), ensureStatements,
          range(keyword.start(), ensureStatements.endChar()));
    }
    SyntaxNode last = statements;
    if (ensureClause != null) {
      last = ensureClause;
    } else if (elseClause != null) {
      last = elseClause;
    } else if (rescueClause != null) {
      last = rescueClause;
    }
    return new BodyStmt(
        statements, rescueClause, elseClause, ensureClause, join(statements, last));
  }

  private Rescue parseRescue() {
    Token keyword = expectKeyword("rescue");
    List<SyntaxNode> exceptions = new ArrayList<>();
    if (!atTerminator() && !atKeyword("then") && !atOperator("=>")) {
      do {
        skipNewlines();
        exceptions.add(parseTernary());
      } while (acceptOperator(","));
    }
    SyntaxNode variable = null;
    int variableStart = peek().start();
    if (acceptOperator("=>")) {
      Token name = next();
      SyntaxNode target;
      if (name.is(TokenType.IDENTIFIER)) {
        declare(name.value());
        target = new Ident(name.value(), range(name));
      } else if (name.is(TokenType.IVAR)) {
        target = new IVar(name.value(), range(name));
      } else {
        throw error(name, "unsupported rescue variable");
      }
      variable = new VarField(target, range(name));
    }
    RescueEx exception = null;
    if (!exceptions.isEmpty() || variable != null) {
      int start = exceptions.isEmpty() ? variableStart : exceptions.get(0).startChar();
      exception = new RescueEx(ImmutableList.copyOf(exceptions), variable,
          range(start, previous().end()));
    }
    parseClauseSeparator("then");
    Statements statements = parseStatements();
    Rescue consequent = atKeyword("rescue") ? parseRescue() : null;
    int end = consequent != null ? consequent.endChar() : statements.endChar();
    return new Rescue(exception, statements, consequent, range(keyword.start(), end));
  }

  private SyntaxNode parseDef() {
    Token keyword = next();
    SyntaxNode target = null;
    Op operator = null;
    if (atKeyword("self") && peek(1).isOperator(".")) {
      Token self = next();
      target = new VarRef(new Kw("self", range(self)), range(self));
      Token dot = next();
      operator = new Op(".", range(dot));
    }
    Token nameToken = next();
    if (!nameToken.is(TokenType.IDENTIFIER) && !nameToken.is(TokenType.CONSTANT)) {
      throw error(nameToken, "expected a method name");
    }
    String name = nameToken.value();
    int nameEnd = nameToken.end();
    if (atOperator("=") && !peek().spaceBefore() && peek(1).isOperator("(")
        && !peek(1).spaceBefore()) {
      name += "=";
      nameEnd = next().end();
    }
    Ident nameNode = new Ident(name, range(nameToken.start(), nameEnd));

    pushScope(false);
    SyntaxNode params = null;
    if (atOperator("(")) {
      Token open = next();
      skipNewlines();
      Params inner = atOperator(")") ? emptyParams(peek().start()) : parseParameters(false);
      skipNewlines();
      Token close = expectOperator(")");
      params = new Paren(new Op("(", range(open)), inner, range(open.start(), close.end()));
    } else if (!atTerminator() && !atOperator("=")) {
      params = parseParameters(false);
    }

    if (atOperator("=")) {
      next();
      skipNewlines();
      SyntaxNode body = parseExpression();
      popScope();
      return new DefNode(target, operator, nameNode, params, body,
          range(keyword.start(), body.endChar()));
    }
    BodyStmt bodystmt = parseBodyStmt();
    Token end = expectKeyword("end");
    popScope();
    return new DefNode(target, operator, nameNode, params, bodystmt,
        range(keyword.start(), end.end()));
  }

  private SyntaxNode parseClass() {
    Token keyword = next();
    if (atOperator("<<")) {
      next();
      SyntaxNode target = parseExpression();
      pushScope(false);
      BodyStmt bodystmt = parseBodyStmt();
      Token end = expectKeyword("end");
      popScope();
      return new SClass(target, bodystmt, range(keyword.start(), end.end()));
    }
    SyntaxNode constant = parseConstantPath();
    SyntaxNode superclass = null;
    if (acceptOperator("<")) {
      superclass = parseExpression();
    }
    pushScope(false);
    BodyStmt bodystmt = parseBodyStmt();
    Token end = expectKeyword("end");
    popScope();
    return new ClassDeclaration(constant, superclass, bodystmt, range(keyword.start(), end.end()));
  }

  /** The name of a class or module: {@code Foo}, {@code Foo::Bar} or {@code ::Foo}. */
  private SyntaxNode parseConstantPath() {
    SyntaxNode node;
    if (atOperator("::")) {
      Token colons = next();
      Token name = expect(TokenType.CONSTANT);
      node = new TopConstRef(new Const(name.value(), range(name)),
          range(colons.start(), name.end()));
    } else {
      Token name = expect(TokenType.CONSTANT);
      Const constant = new Const(name.value(), range(name));
      if (!atOperator("::")) {
        return new ConstRef(constant, range(name));
      }
      node = new VarRef(constant, range(name));
    }
    while (atOperator("::")) {
      next();
      Token name = expect(TokenType.CONSTANT);
      node = new ConstPathRef(node, new Const(name.value(), range(name)),
          range(node.startChar(), name.end()));
    }
    return node;
  }

  private SyntaxNode parseJump() {
    Token keyword = next();
    Args arguments = atArgumentsEnd() ? null : parseCommandArguments();
    SourceRange location =
        range(keyword.start(), arguments != null ? arguments.endChar() : keyword.end());
    switch (keyword.value()) {
      case "return":
        return new ReturnNode(arguments, location);
      case "break":
        return new Break(arguments, location);
      default:
        return new Next(arguments, location);
    }
  }

  private SyntaxNode parseYield() {
    Token keyword = next();
    if (atOperator("(") && !peek().spaceBefore()) {
      Token open = next();
      skipNewlines();
      Args contents = atOperator(")") ? null : parseArgs(")");
      skipNewlines();
      Token close = expectOperator(")");
      Paren paren = new Paren(new Op("(", range(open)), contents,
          range(open.start(), close.end()));
      return new YieldNode(paren, range(keyword.start(), close.end()));
    }
    if (atCommandArgumentStart()) {
      Args arguments = parseCommandArguments();
      return new YieldNode(arguments, range(keyword.start(), arguments.endChar()));
    }
    return new YieldNode(null, range(keyword));
  }

  private SyntaxNode parseSuper() {
    Token keyword = next();
    if (atOperator("(") && !peek().spaceBefore()) {
      ArgParen arguments = parseArgParen();
      return new Super(arguments, range(keyword.start(), arguments.endChar()));
    }
    if (atCommandArgumentStart()) {
      Args arguments = parseCommandArguments();
      return new Super(arguments, range(keyword.start(), arguments.endChar()));
    }
    return new ZSuper(range(keyword));
  }

  private SyntaxNode parseAlias() {
    Token keyword = next();
    if (at(TokenType.GVAR)) {
      Token left = next();
      Token right = expect(TokenType.GVAR);
      return new VarAlias(new GVar(left.value(), range(left)),
          new GVar(right.value(), range(right)), range(keyword.start(), right.end()));
    }
    SyntaxNode left = parseMethodNameSymbol();
    SyntaxNode right = parseMethodNameSymbol();
    return new Alias(left, right, range(keyword.start(), right.endChar()));
  }

  /** A method name in {@code alias} or {@code undef}, written bare or as a symbol. */
  private SymbolLiteral parseMethodNameSymbol() {
    Token token = next();
    switch (token.type()) {
      case SYMBOL:
        return new SymbolLiteral(
            symbolValue(token.value(), range(token.start() + 1, token.end())), range(token));
      case IDENTIFIER:
      case CONSTANT:
      case KEYWORD:
        return new SymbolLiteral(symbolValue(token.value(), range(token)), range(token));
      default:
        throw error(token, "expected a method name");
    }
  }

  private SourceRange join(SyntaxNode first, SyntaxNode last) {
    return range(first.startChar(), last.endChar());
  }
}
