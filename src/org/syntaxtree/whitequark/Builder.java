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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.parser.Literals;
import org.syntaxtree.parser.ParseException;
import org.syntaxtree.parser.Token;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.source.SourceRange;

/**
 * Creates parser gem nodes from tokens and child nodes. Each factory method corresponds to a
 * method of {@code Parser::Builders::Default} and computes the same source map, so {@link
 * WhitequarkParser} never assembles a map itself.
 */
final class Builder {
  private final SourceBuffer buffer;

  Builder(SourceBuffer buffer) {
    this.buffer = buffer;
  }

  // Literals

  Node integer(Token token) {
    return Node.of(NodeType.INT, SourceMap.operator(null, loc(token)),
        Literals.integerValue(token.value()));
  }

  Node floatNumber(Token token) {
    return Node.of(NodeType.FLOAT, SourceMap.operator(null, loc(token)),
        Literals.floatValue(token.value()));
  }

  Node rational(Token token) {
    String text = token.value();
    return Node.of(NodeType.RATIONAL, SourceMap.operator(null, loc(token)),
        RubyRational.parse(text.substring(0, text.length() - 1)));
  }

  Node complex(Token token) {
    return Node.of(NodeType.COMPLEX, SourceMap.operator(null, loc(token)),
        RubyComplex.parse(token.value()));
  }

  /** A numeric literal with a sign glued to it, such as {@code -1}. */
  Node unaryNum(Token sign, Node numeric) {
    Object value = numeric.getChild(0);
    if (sign.value().equals("-")) {
      value = NumericValues.negate(value);
    }
    SourceRange operator = loc(sign);
    return numeric.updated(null, ImmutableList.of(value),
        SourceMap.operator(operator, operator.join(numeric.getExpression())));
  }

  /** One piece of string or regexp content, unquoted. */
  Node stringInternal(Token token, String value) {
    return Node.of(NodeType.STR, SourceMap.collection(null, null, loc(token)), value);
  }

  Node stringCompose(@Nullable Token begin, List<Node> parts, @Nullable Token end) {
    if (parts.isEmpty()) {
      return Node.of(NodeType.STR, stringMap(begin, parts, end), "");
    }
    if (parts.size() == 1 && (parts.get(0).isType(NodeType.STR)
        || parts.get(0).isType(NodeType.DSTR))) {
      Node part = parts.get(0);
      if (begin == null && end == null) {
        return part;
      }
      return part.updated(null, null, stringMap(begin, parts, end));
    }
    return new Node(NodeType.DSTR, parts, stringMap(begin, parts, end));
  }

  Node symbol(Token token) {
    SourceRange range = loc(token);
    return Node.of(NodeType.SYM,
        SourceMap.collection(buffer.rangeLength(range.beginPos(), 1), null, range),
        RubySymbol.of(token.value()));
  }

  /** A method name used where a symbol is expected, as in {@code alias foo bar}. */
  Node symbolInternal(Token token) {
    return Node.of(NodeType.SYM, SourceMap.collection(null, null, loc(token)),
        RubySymbol.of(token.value()));
  }

  Node symbolCompose(Token begin, List<Node> parts, Token end) {
    return symbolCompose(parts, collectionMap(begin, parts, end));
  }

  private static Node symbolCompose(List<Node> parts, SourceMap map) {
    if (parts.isEmpty()) {
      return Node.of(NodeType.SYM, map, RubySymbol.of(""));
    }
    if (parts.size() == 1 && parts.get(0).isType(NodeType.STR)) {
      return Node.of(NodeType.SYM, map, RubySymbol.of((String) parts.get(0).getChild(0)));
    }
    return new Node(NodeType.DSYM, parts, map);
  }

  /**
   * A regexp literal. {@code end} covers the closing slash and any flags after it; the flags
   * become the trailing {@code regopt} node.
   */
  Node regexpCompose(Token begin, List<Node> parts, Token end) {
    SourceRange slash = buffer.rangeLength(end.start(), 1);
    SourceRange flagsRange = buffer.range(end.start() + 1, end.end());
    ImmutableSortedSet.Builder<String> flags = ImmutableSortedSet.naturalOrder();
    for (char c : end.value().substring(1).toCharArray()) {
      flags.add(String.valueOf(c));
    }
    List<Object> optionChildren = new ArrayList<>();
    for (String flag : flags.build()) {
      optionChildren.add(RubySymbol.of(flag));
    }
    Node options = new Node(NodeType.REGOPT, optionChildren, SourceMap.map(flagsRange));
    List<Node> children = new ArrayList<>(parts);
    children.add(options);
    return new Node(NodeType.REGEXP, children,
        SourceMap.collection(loc(begin), slash, loc(begin).join(flagsRange)));
  }

  Node array(@Nullable Token begin, List<Node> elements, @Nullable Token end) {
    return new Node(NodeType.ARRAY, elements, collectionMap(begin, elements, end));
  }

  /** A hash literal, or a bare hash of trailing arguments when the brackets are null. */
  Node associate(@Nullable Token begin, List<Node> pairs, @Nullable Token end) {
    return new Node(NodeType.HASH, pairs, collectionMap(begin, pairs, end));
  }

  Node pair(Node key, Token assoc, Node value) {
    return Node.of(NodeType.PAIR, SourceMap.operator(loc(assoc), join(key, value)), key, value);
  }

  /** A {@code key: value} pair. The key symbol covers the label without its colon. */
  Node pairKeyword(Token label, Node value) {
    SourceRange range = loc(label);
    SourceRange name = buffer.adjust(range, 0, -1);
    SourceRange colon = buffer.range(range.endPos() - 1, range.endPos());
    Node key = Node.of(NodeType.SYM, SourceMap.collection(null, null, name),
        RubySymbol.of(labelName(label)));
    return Node.of(NodeType.PAIR,
        SourceMap.operator(colon, range.join(value.getExpression())), key, value);
  }

  /**
   * A {@code "key": value} pair. {@code labelEnd} is the closing quote and the colon; the key
   * symbol stops before the colon.
   */
  Node pairQuoted(Token begin, List<Node> parts, Token labelEnd, Node value) {
    SourceRange end = loc(labelEnd);
    SourceRange quote = buffer.adjust(end, 0, -1);
    SourceRange colon = buffer.range(end.endPos() - 1, end.endPos());
    Node key = symbolCompose(parts,
        SourceMap.collection(loc(begin), quote, loc(begin).join(quote)));
    return Node.of(NodeType.PAIR,
        SourceMap.operator(colon, loc(begin).join(value.getExpression())), key, value);
  }

  Node kwsplat(Token star, Node value) {
    return Node.of(NodeType.KWSPLAT, SourceMap.operator(loc(star), joinTo(star, value)), value);
  }

  Node splat(Token star, @Nullable Node value) {
    if (value == null) {
      return Node.of(NodeType.SPLAT, SourceMap.operator(loc(star), loc(star)));
    }
    return Node.of(NodeType.SPLAT, SourceMap.operator(loc(star), joinTo(star, value)), value);
  }

  Node blockPass(Token ampersand, @Nullable Node value) {
    SourceRange expression = value == null ? loc(ampersand) : joinTo(ampersand, value);
    return Node.of(NodeType.BLOCK_PASS, SourceMap.operator(loc(ampersand), expression), value);
  }

  Node range(@Nullable Node left, Token operator, @Nullable Node right) {
    SourceRange begin = left != null ? left.getExpression() : loc(operator);
    SourceRange end = right != null ? right.getExpression() : loc(operator);
    NodeType type = operator.value().equals("..") ? NodeType.IRANGE : NodeType.ERANGE;
    return Node.of(type, SourceMap.operator(loc(operator), begin.join(end)), left, right);
  }

  /** {@code nil}, {@code true}, {@code false}, {@code self}, {@code __FILE__}, {@code __LINE__}. */
  Node keywordLiteral(Token token) {
    SourceMap map = SourceMap.map(loc(token));
    switch (token.value()) {
      case "nil":
        return Node.of(NodeType.NIL, map);
      case "true":
        return Node.of(NodeType.TRUE, map);
      case "false":
        return Node.of(NodeType.FALSE, map);
      case "self":
        return Node.of(NodeType.SELF, map);
      case "__FILE__":
        return Node.of(NodeType.STR, map, buffer.getName());
      case "__LINE__":
        return Node.of(NodeType.INT, map, BigInteger.valueOf(buffer.lineOf(token.start())));
      default:
        throw new IllegalArgumentException("not a keyword literal: " + token);
    }
  }

  // Variables and constants

  Node variable(NodeType type, Token token) {
    return Node.of(type, SourceMap.variable(loc(token), loc(token)),
        RubySymbol.of(token.value()));
  }

  /** {@code $1} becomes {@code nth_ref} and {@code $&} becomes {@code back_ref}. */
  Node backReference(Token token) {
    String name = token.value();
    SourceMap map = SourceMap.map(loc(token));
    if (Character.isDigit(name.charAt(1))) {
      return Node.of(NodeType.NTH_REF, map, new BigInteger(name.substring(1)));
    }
    return Node.of(NodeType.BACK_REF, map, RubySymbol.of(name));
  }

  Node constant(Token name) {
    return Node.of(NodeType.CONST, SourceMap.constant(null, loc(name), loc(name)), null,
        RubySymbol.of(name.value()));
  }

  Node constFetch(Node scope, Token colons, Token name) {
    return Node.of(NodeType.CONST,
        SourceMap.constant(loc(colons), loc(name), joinFrom(scope, name)), scope,
        RubySymbol.of(name.value()));
  }

  Node constGlobal(Token colons, Token name) {
    Node cbase = Node.of(NodeType.CBASE, SourceMap.map(loc(colons)));
    return Node.of(NodeType.CONST,
        SourceMap.constant(loc(colons), loc(name), loc(colons).join(loc(name))), cbase,
        RubySymbol.of(name.value()));
  }

  /**
   * Turns a reference into the target of an assignment. A receiverless call without arguments
   * becomes a local variable.
   *
   * @throws ParseException if the node cannot be assigned to
   */
  Node assignable(Node node) {
    switch (node.getType()) {
      case LVAR:
        return node.updated(NodeType.LVASGN, null, null);
      case IVAR:
        return node.updated(NodeType.IVASGN, null, null);
      case GVAR:
        return node.updated(NodeType.GVASGN, null, null);
      case CVAR:
        return node.updated(NodeType.CVASGN, null, null);
      case CONST:
        return node.updated(NodeType.CASGN, null, null);
      case SEND:
      case CSEND:
        if (!isBareCall(node)) {
          break;
        }
        if (node.getChild(0) == null) {
          SourceRange name = node.getLocation().getSelector();
          return Node.of(NodeType.LVASGN, SourceMap.variable(name, name), node.getChild(1));
        }
        String selector = ((RubySymbol) node.getChild(1)).name();
        return node.updated(null,
            ImmutableList.of(node.getNode(0), RubySymbol.of(selector + "=")), null);
      case INDEX:
        return node.updated(NodeType.INDEXASGN, null, null);
      default:
        break;
    }
    SourceRange expression = node.getExpression();
    throw new ParseException(
        "cannot assign to " + node.getType(), buffer, expression.beginPos());
  }

  Node assign(Node target, Token equals, Node value) {
    SourceMap map =
        target.getLocation().withOperator(loc(equals)).withExpression(join(target, value));
    return target.append(value).updated(null, null, map);
  }

  /** The targets of {@code a, *b = ...}, without parentheses. */
  Node multiLhs(List<Node> targets) {
    return new Node(NodeType.MLHS, targets, collectionMap(null, targets, null));
  }

  Node multiAssign(Node lhs, Token equals, Node rhs) {
    return Node.of(NodeType.MASGN, SourceMap.operator(loc(equals), join(lhs, rhs)), lhs, rhs);
  }

  /**
   * {@code lhs op= rhs}. Variables become assignment nodes, while calls keep their {@code send}
   * form and an index becomes {@code indexasgn}.
   */
  Node opAssign(Node lhs, Token operator, Node value) {
    Node target;
    if ((lhs.isType(NodeType.SEND) || lhs.isType(NodeType.CSEND)) && lhs.getChild(0) != null) {
      target = lhs;
    } else if (lhs.isType(NodeType.INDEX)) {
      target = lhs.updated(NodeType.INDEXASGN, null, null);
    } else {
      target = assignable(lhs);
    }
    SourceMap map =
        target.getLocation().withOperator(loc(operator)).withExpression(join(lhs, value));
    String name = operator.value().substring(0, operator.value().length() - 1);
    switch (name) {
      case "||":
        return Node.of(NodeType.OR_ASGN, map, target, value);
      case "&&":
        return Node.of(NodeType.AND_ASGN, map, target, value);
      default:
        return Node.of(NodeType.OP_ASGN, map, target, RubySymbol.of(name), value);
    }
  }

  /** Replaces the value of an assignment built by {@link #assign} or {@link #opAssign}. */
  Node withAssignedValue(Node assignment, Node value) {
    List<@Nullable Object> children = new ArrayList<>(assignment.getChildren());
    children.set(children.size() - 1, value);
    SourceMap map = assignment.getLocation()
        .withExpression(assignment.getExpression().join(value.getExpression()));
    return assignment.updated(null, children, map);
  }

  /** Whether {@code node} is an assignment whose last child is the assigned value. */
  static boolean isAssignment(Node node) {
    switch (node.getType()) {
      case LVASGN:
      case IVASGN:
      case GVASGN:
      case CVASGN:
      case CASGN:
      case INDEXASGN:
      case OP_ASGN:
      case OR_ASGN:
      case AND_ASGN:
      case MASGN:
        return node.getChildCount() > 0 && node.getLocation().getOperator() != null;
      case SEND:
      case CSEND:
        // Attribute assignment is the only call with an operator.
        return node.getLocation().getOperator() != null;
      default:
        return false;
    }
  }

  /** Whether {@code node} is a call with no arguments and no parentheses. */
  static boolean isBareCall(Node node) {
    return (node.isType(NodeType.SEND) || node.isType(NodeType.CSEND))
        && node.getChildCount() == 2
        && node.getLocation().getBegin() == null
        && node.getLocation().getSelector() != null;
  }

  // Calls

  Node callMethod(
      @Nullable Node receiver,
      @Nullable Token dot,
      Token selector,
      @Nullable Token lparen,
      List<Node> args,
      @Nullable Token rparen) {
    NodeType type = dot != null && dot.value().equals("&.") ? NodeType.CSEND : NodeType.SEND;
    List<Object> children = new ArrayList<>();
    children.add(receiver);
    children.add(RubySymbol.of(selector.value()));
    children.addAll(rewriteHashArgsToKwargs(args));
    return new Node(type, children, sendMap(receiver, dot, selector, lparen, args, rparen));
  }

  Node binaryOp(Node receiver, Token operator, Node argument) {
    return Node.of(NodeType.SEND, binaryOpMap(receiver, operator, argument), receiver,
        RubySymbol.of(operator.value()), argument);
  }

  /** {@code =~}, which binds named captures when the receiver is a literal regexp. */
  Node matchOp(Node receiver, Token operator, Node argument) {
    if (isStaticRegexp(receiver)) {
      return Node.of(NodeType.MATCH_WITH_LVASGN, binaryOpMap(receiver, operator, argument),
          receiver, argument);
    }
    return binaryOp(receiver, operator, argument);
  }

  Node logicalOp(NodeType type, Node left, Token operator, Node right) {
    return Node.of(type, SourceMap.operator(loc(operator), join(left, right)), left, right);
  }

  /** {@code -x}, {@code +x} and {@code ~x}. */
  Node unaryOp(Token operator, Node receiver) {
    String selector = operator.value();
    if (selector.equals("-") || selector.equals("+")) {
      selector += "@";
    }
    return Node.of(NodeType.SEND,
        SourceMap.send(null, loc(operator), null, null, joinTo(operator, receiver)), receiver,
        RubySymbol.of(selector));
  }

  /**
   * {@code !x}, {@code not x} and {@code not(x)}. The parenthesized form with nothing inside
   * negates an empty {@code begin}.
   */
  Node notOp(Token not, @Nullable Token lparen, @Nullable Node receiver, @Nullable Token rparen) {
    if (lparen == null) {
      return Node.of(NodeType.SEND,
          SourceMap.send(null, loc(not), null, null, joinTo(not, receiver)), receiver,
          RubySymbol.of("!"));
    }
    SourceMap map =
        SourceMap.send(null, loc(not), loc(lparen), loc(rparen), loc(not).join(loc(rparen)));
    if (receiver == null) {
      Node empty = Node.of(NodeType.BEGIN,
          SourceMap.collection(loc(lparen), loc(rparen), loc(lparen).join(loc(rparen))));
      return Node.of(NodeType.SEND, map, empty, RubySymbol.of("!"));
    }
    return Node.of(NodeType.SEND, map, receiver, RubySymbol.of("!"));
  }

  Node index(Node receiver, Token lbracket, List<Node> indexes, Token rbracket) {
    List<Object> children = new ArrayList<>();
    children.add(receiver);
    children.addAll(indexes);
    return new Node(NodeType.INDEX, children,
        SourceMap.index(loc(lbracket), loc(rbracket), joinFrom(receiver, rbracket)));
  }

  Node block(Node call, Token begin, Node args, @Nullable Node body, Token end) {
    return Node.of(NodeType.BLOCK,
        SourceMap.collection(loc(begin), loc(end), joinFrom(call, end)), call, args, body);
  }

  Node lambda(Token arrow) {
    return Node.of(NodeType.LAMBDA, SourceMap.map(loc(arrow)));
  }

  Node forwardedArgs(Token dots) {
    return Node.of(NodeType.FORWARDED_ARGS, SourceMap.map(loc(dots)));
  }

  // Parameters

  Node args(@Nullable Token begin, List<Node> args, @Nullable Token end) {
    return new Node(NodeType.ARGS, args, collectionMap(begin, args, end));
  }

  Node arg(Token name) {
    return variable(NodeType.ARG, name);
  }

  Node optarg(Token name, Token equals, Node value) {
    return Node.of(NodeType.OPTARG,
        SourceMap.variable(loc(name), joinTo(name, value)).withOperator(loc(equals)),
        RubySymbol.of(name.value()), value);
  }

  /** {@code *rest}, {@code **options} and {@code &block}, any of which may be anonymous. */
  Node prefixArg(NodeType type, Token operator, @Nullable Token name) {
    if (name == null) {
      return Node.of(type, SourceMap.variable(null, loc(operator)));
    }
    return Node.of(type, SourceMap.variable(loc(name), loc(operator).join(loc(name))),
        RubySymbol.of(name.value()));
  }

  Node kwarg(Token label) {
    SourceRange range = loc(label);
    return Node.of(NodeType.KWARG,
        SourceMap.variable(buffer.adjust(range, 0, -1), range), RubySymbol.of(labelName(label)));
  }

  Node kwoptarg(Token label, Node value) {
    SourceRange range = loc(label);
    return Node.of(NodeType.KWOPTARG,
        SourceMap.variable(buffer.adjust(range, 0, -1), range.join(value.getExpression())),
        RubySymbol.of(labelName(label)), value);
  }

  Node shadowarg(Token name) {
    return variable(NodeType.SHADOWARG, name);
  }

  /** Wraps the only parameter of a block, as in {@code |x|}. */
  Node procarg0(Node arg) {
    return Node.of(NodeType.PROCARG0, SourceMap.collection(null, null, arg.getExpression()), arg);
  }

  Node forwardArg(Token dots) {
    return Node.of(NodeType.FORWARD_ARG, SourceMap.map(loc(dots)));
  }

  /** The pre-3.1 node for a parameter list that is exactly {@code (...)}. */
  Node forwardOnlyArgs(Token lparen, Token rparen) {
    return Node.of(NodeType.FORWARD_ARGS,
        SourceMap.collection(loc(lparen), loc(rparen), loc(lparen).join(loc(rparen))));
  }

  // Definitions

  Node defMethod(Token def, Token name, SourceRange nameRange, Node args, @Nullable Node body,
      Token end) {
    return Node.of(NodeType.DEF,
        SourceMap.methodDefinition(loc(def), null, nameRange, loc(end), null,
            loc(def).join(loc(end))),
        RubySymbol.of(methodName(name, nameRange)), args, body);
  }

  Node defSingleton(Token def, Node definee, Token dot, Token name, SourceRange nameRange,
      Node args, @Nullable Node body, Token end) {
    return Node.of(NodeType.DEFS,
        SourceMap.methodDefinition(loc(def), loc(dot), nameRange, loc(end), null,
            loc(def).join(loc(end))),
        definee, RubySymbol.of(methodName(name, nameRange)), args, body);
  }

  Node defEndlessMethod(Token def, @Nullable Node definee, @Nullable Token dot, Token name,
      Node args, Token equals, Node body) {
    SourceMap map = SourceMap.methodDefinition(loc(def), loc(dot), loc(name), null,
        loc(equals), joinTo(def, body));
    if (definee == null) {
      return Node.of(NodeType.DEF, map, RubySymbol.of(name.value()), args, body);
    }
    return Node.of(NodeType.DEFS, map, definee, RubySymbol.of(name.value()), args, body);
  }

  Node defClass(Token keyword, Node name, @Nullable Token lt, @Nullable Node superclass,
      @Nullable Node body, Token end) {
    return Node.of(NodeType.CLASS,
        SourceMap.definition(loc(keyword), loc(lt), name.getExpression(), loc(end),
            loc(keyword).join(loc(end))),
        name, superclass, body);
  }

  Node defSclass(Token keyword, Token lshift, Node target, @Nullable Node body, Token end) {
    return Node.of(NodeType.SCLASS,
        SourceMap.definition(loc(keyword), loc(lshift), null, loc(end),
            loc(keyword).join(loc(end))),
        target, body);
  }

  Node defModule(Token keyword, Node name, @Nullable Node body, Token end) {
    return Node.of(NodeType.MODULE,
        SourceMap.definition(loc(keyword), null, name.getExpression(), loc(end),
            loc(keyword).join(loc(end))),
        name, body);
  }

  // Control flow

  Node condition(Token keyword, Node cond, @Nullable Token begin, @Nullable Node ifTrue,
      @Nullable Token elseToken, @Nullable Node ifFalse, @Nullable Token end) {
    return Node.of(NodeType.IF,
        conditionMap(keyword, cond, begin, ifTrue, elseToken, ifFalse, end),
        cond, ifTrue, ifFalse);
  }

  /** {@code body if cond}; {@code unless} passes the body as {@code ifFalse}. */
  Node conditionMod(@Nullable Node ifTrue, @Nullable Node ifFalse, Token keyword, Node cond) {
    Node body = ifTrue != null ? ifTrue : ifFalse;
    return Node.of(NodeType.IF, keywordModMap(body, keyword, cond), cond, ifTrue, ifFalse);
  }

  Node ternary(Node cond, Token question, Node ifTrue, Token colon, Node ifFalse) {
    return Node.of(NodeType.IF,
        SourceMap.ternary(loc(question), loc(colon), join(cond, ifFalse)), cond, ifTrue, ifFalse);
  }

  Node loop(NodeType type, Token keyword, Node cond, @Nullable Token doToken,
      @Nullable Node body, Token end) {
    return Node.of(type,
        SourceMap.keyword(loc(keyword), loc(doToken), loc(end), loc(keyword).join(loc(end))),
        cond, body);
  }

  /** {@code body while cond}. A {@code begin} body makes it a post-condition loop. */
  Node loopMod(NodeType type, Node body, Token keyword, Node cond) {
    NodeType loopType = type;
    if (body.isType(NodeType.KWBEGIN)) {
      loopType = type == NodeType.WHILE ? NodeType.WHILE_POST : NodeType.UNTIL_POST;
    }
    return Node.of(loopType, keywordModMap(body, keyword, cond), cond, body);
  }

  Node forLoop(Token keyword, Node iterator, Token in, Node iteratee, @Nullable Token doToken,
      @Nullable Node body, Token end) {
    return Node.of(NodeType.FOR,
        SourceMap.forLoop(loc(keyword), loc(in), loc(doToken), loc(end),
            loc(keyword).join(loc(end))),
        iterator, iteratee, body);
  }

  Node caseNode(Token keyword, @Nullable Node expr, List<Node> whens,
      @Nullable Token elseToken, @Nullable Node elseBody, Token end) {
    List<Object> children = new ArrayList<>();
    children.add(expr);
    children.addAll(whens);
    children.add(elseBody);
    return new Node(NodeType.CASE, children,
        SourceMap.condition(loc(keyword), null, loc(elseToken), loc(end),
            loc(keyword).join(loc(end))));
  }

  Node when(Token keyword, List<Node> patterns, @Nullable Token then, @Nullable Node body) {
    List<Object> children = new ArrayList<>(patterns);
    children.add(body);
    SourceRange end = body != null
        ? body.getExpression()
        : patterns.get(patterns.size() - 1).getExpression();
    return new Node(NodeType.WHEN, children,
        SourceMap.keyword(loc(keyword), loc(then), null, loc(keyword).join(end)));
  }

  /**
   * {@code return}, {@code break}, {@code next}, {@code yield}, {@code super}, {@code zsuper},
   * {@code redo}, {@code retry} and {@code defined?}.
   */
  Node keywordCmd(NodeType type, Token keyword, @Nullable Token lparen, List<Node> args,
      @Nullable Token rparen) {
    List<Node> children = args;
    if (type == NodeType.YIELD || type == NodeType.SUPER) {
      children = rewriteHashArgsToKwargs(args);
    }
    SourceRange end;
    if (rparen != null) {
      end = loc(rparen);
    } else if (!args.isEmpty()) {
      end = args.get(args.size() - 1).getExpression();
    } else {
      end = loc(keyword);
    }
    return new Node(type, children,
        SourceMap.keyword(loc(keyword), loc(lparen), loc(rparen), loc(keyword).join(end)));
  }

  Node undefMethod(Token keyword, List<Node> names) {
    return new Node(NodeType.UNDEF, names,
        SourceMap.keyword(loc(keyword), null, null,
            loc(keyword).join(names.get(names.size() - 1).getExpression())));
  }

  Node alias(Token keyword, Node to, Node from) {
    return Node.of(NodeType.ALIAS,
        SourceMap.keyword(loc(keyword), null, null, joinTo(keyword, from)), to, from);
  }

  // Grouping and bodies

  /** Groups statements; a single statement is returned as is and none gives null. */
  @Nullable Node compstmt(List<Node> statements) {
    if (statements.isEmpty()) {
      return null;
    }
    if (statements.size() == 1) {
      return statements.get(0);
    }
    return new Node(NodeType.BEGIN, statements, collectionMap(null, statements, null));
  }

  /** Parentheses and string interpolation. */
  Node begin(Token begin, @Nullable Node body, Token end) {
    return wrap(NodeType.BEGIN, begin, body, end);
  }

  Node beginKeyword(Token begin, @Nullable Node body, Token end) {
    return wrap(NodeType.KWBEGIN, begin, body, end);
  }

  private Node wrap(NodeType type, Token begin, @Nullable Node body, Token end) {
    SourceMap map = SourceMap.collection(loc(begin), loc(end), loc(begin).join(loc(end)));
    if (body == null) {
      return Node.of(type, map);
    }
    if (isImplicitBegin(body)) {
      return new Node(type, body.getChildren(), map);
    }
    return Node.of(type, map, body);
  }

  /** A {@code begin} that only groups statements, without delimiters of its own. */
  static boolean isImplicitBegin(Node node) {
    return node.isType(NodeType.BEGIN)
        && node.getLocation().getBegin() == null
        && node.getLocation().getEnd() == null;
  }

  Node beginBody(@Nullable Node body, List<Node> rescueBodies, @Nullable Token elseToken,
      @Nullable Node elseBody, @Nullable Token ensureToken, @Nullable Node ensureBody) {
    Node result = body;
    if (!rescueBodies.isEmpty()) {
      List<Object> children = new ArrayList<>();
      children.add(result);
      children.addAll(rescueBodies);
      children.add(elseBody);
      result = new Node(NodeType.RESCUE, children,
          ehKeywordMap(result, null, rescueBodies, elseToken, elseBody));
    } else {
      checkArgument(elseToken == null, "else without rescue");
    }
    if (ensureToken != null) {
      List<@Nullable Node> ensureBodies = new ArrayList<>();
      ensureBodies.add(ensureBody);
      result = Node.of(NodeType.ENSURE,
          ehKeywordMap(result, ensureToken, ensureBodies, null, null), result, ensureBody);
    }
    return result;
  }

  Node rescueBody(Token keyword, @Nullable Node exceptions, @Nullable Token assoc,
      @Nullable Node variable, @Nullable Token then, @Nullable Node body) {
    SourceRange end;
    if (body != null) {
      end = body.getExpression();
    } else if (then != null) {
      end = loc(then);
    } else if (variable != null) {
      end = variable.getExpression();
    } else if (exceptions != null) {
      end = exceptions.getExpression();
    } else {
      end = loc(keyword);
    }
    return Node.of(NodeType.RESBODY,
        SourceMap.rescueBody(loc(keyword), loc(assoc), loc(then), loc(keyword).join(end)),
        exceptions, variable, body);
  }

  // Maps

  private SourceMap sendMap(@Nullable Node receiver, @Nullable Token dot, Token selector,
      @Nullable Token lparen, List<Node> args, @Nullable Token rparen) {
    SourceRange begin = receiver != null ? receiver.getExpression() : loc(selector);
    SourceRange end;
    if (rparen != null) {
      end = loc(rparen);
    } else if (!args.isEmpty()) {
      end = args.get(args.size() - 1).getExpression();
    } else {
      end = loc(selector);
    }
    return SourceMap.send(loc(dot), loc(selector), loc(lparen), loc(rparen), begin.join(end));
  }

  private SourceMap binaryOpMap(Node left, Token operator, Node right) {
    return SourceMap.send(null, loc(operator), null, null, join(left, right));
  }

  private SourceMap keywordModMap(Node body, Token keyword, Node cond) {
    return SourceMap.keyword(loc(keyword), null, null, join(body, cond));
  }

  private SourceMap conditionMap(Token keyword, Node cond, @Nullable Token begin,
      @Nullable Node body, @Nullable Token elseToken, @Nullable Node elseBody,
      @Nullable Token end) {
    SourceRange last;
    if (end != null) {
      last = loc(end);
    } else if (elseBody != null) {
      last = elseBody.getExpression();
    } else if (elseToken != null) {
      last = loc(elseToken);
    } else if (body != null) {
      last = body.getExpression();
    } else if (begin != null) {
      last = loc(begin);
    } else {
      last = cond.getExpression();
    }
    return SourceMap.condition(loc(keyword), loc(begin), loc(elseToken), loc(end),
        loc(keyword).join(last));
  }

  private SourceMap ehKeywordMap(@Nullable Node body, @Nullable Token keyword,
      List<@Nullable Node> bodies, @Nullable Token elseToken, @Nullable Node elseBody) {
    SourceRange begin;
    if (body != null) {
      begin = body.getExpression();
    } else if (keyword != null) {
      begin = loc(keyword);
    } else {
      begin = bodies.get(0).getExpression();
    }
    SourceRange end;
    if (elseToken != null) {
      end = elseBody != null ? elseBody.getExpression() : loc(elseToken);
    } else if (bodies.get(bodies.size() - 1) != null) {
      end = bodies.get(bodies.size() - 1).getExpression();
    } else {
      end = loc(keyword);
    }
    return SourceMap.condition(loc(keyword), null, loc(elseToken), null, begin.join(end));
  }

  private SourceMap stringMap(@Nullable Token begin, List<Node> parts, @Nullable Token end) {
    return collectionMap(begin, parts, end);
  }

  private SourceMap collectionMap(@Nullable Token begin, List<Node> parts, @Nullable Token end) {
    SourceRange expression;
    if (begin != null && end != null) {
      expression = loc(begin).join(loc(end));
    } else if (parts.isEmpty()) {
      expression = null;
    } else {
      expression = join(parts.get(0), parts.get(parts.size() - 1));
    }
    return SourceMap.collection(loc(begin), loc(end), expression);
  }

  /** Marks a trailing bare hash of call arguments as keyword arguments. */
  private static List<Node> rewriteHashArgsToKwargs(List<Node> args) {
    int size = args.size();
    List<Node> result = new ArrayList<>(args);
    if (size > 0 && isBareHash(args.get(size - 1))) {
      result.set(size - 1, args.get(size - 1).updated(NodeType.KWARGS, null, null));
    } else if (size > 1 && args.get(size - 1).isType(NodeType.BLOCK_PASS)
        && isBareHash(args.get(size - 2))) {
      result.set(size - 2, args.get(size - 2).updated(NodeType.KWARGS, null, null));
    }
    return result;
  }

  private static boolean isBareHash(Node node) {
    return node.isType(NodeType.HASH)
        && node.getLocation().getBegin() == null
        && node.getLocation().getEnd() == null;
  }

  private static boolean isStaticRegexp(Node node) {
    if (!node.isType(NodeType.REGEXP)) {
      return false;
    }
    for (Node part : node.getNodeChildren()) {
      if (!part.isType(NodeType.STR) && !part.isType(NodeType.REGOPT)) {
        return false;
      }
    }
    return true;
  }

  private static String labelName(Token label) {
    return label.value().substring(0, label.value().length() - 1);
  }

  private String methodName(Token name, SourceRange nameRange) {
    return buffer.source(nameRange).equals(name.value()) ? name.value() : name.value() + "=";
  }

  // Ranges

  private @Nullable SourceRange loc(@Nullable Token token) {
    return token == null ? null : buffer.range(token.start(), token.end());
  }

  private static SourceRange join(Node first, Node last) {
    return first.getExpression().join(last.getExpression());
  }

  private SourceRange joinTo(Token first, Node last) {
    return loc(first).join(last.getExpression());
  }

  private SourceRange joinFrom(Node first, Token last) {
    return first.getExpression().join(loc(last));
  }
}
