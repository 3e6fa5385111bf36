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
package org.syntaxtree.translation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.math.BigInteger;
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
import org.syntaxtree.ast.Visitor;
import org.syntaxtree.parser.Literals;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.source.SourceRange;
import org.syntaxtree.whitequark.Node;
import org.syntaxtree.whitequark.NodeType;
import org.syntaxtree.whitequark.NumericValues;
import org.syntaxtree.whitequark.RubyComplex;
import org.syntaxtree.whitequark.RubyRational;
import org.syntaxtree.whitequark.RubySymbol;
import org.syntaxtree.whitequark.SourceMap;

/**
 * Translates a Syntax Tree into the parser gem's AST, source maps included.
 *
 * <p>The primary tree keeps tokens the gem folds into maps, such as parentheses around arguments,
 * and leaves out some tokens the gem records, such as the {@code =} of an assignment or the
 * {@code then} of a conditional. The latter are found by searching the source between the
 * neighboring nodes.
 *
 * <p>Nodes whose translation depends on their parent, such as parameter lists, block variables
 * and {@code else} clauses, are translated by the parent through helper methods; visiting one of
 * them directly throws {@link TranslationException}. A translator holds no state besides its
 * configuration, so one instance can translate any number of trees from its buffer.
 */
public final class ParserTranslator implements Visitor<Node> {
  private final SourceBuffer buffer;
  private final ForwardArgsStyle forwardArgsStyle;

  public ParserTranslator(SourceBuffer buffer) {
    this(buffer, ForwardArgsStyle.MODERN);
  }

  public ParserTranslator(SourceBuffer buffer, ForwardArgsStyle forwardArgsStyle) {
    this.buffer = checkNotNull(buffer);
    this.forwardArgsStyle = checkNotNull(forwardArgsStyle);
  }

  /** Translates a program. Returns null when it has no statements, as the gem does. */
  public @Nullable Node translate(Program program) {
    return visitProgram(program);
  }

  private Node visit(SyntaxNode node) {
    return node.accept(this);
  }

  private @Nullable Node visitOrNull(@Nullable SyntaxNode node) {
    return node == null ? null : visit(node);
  }

  // Tokens

  @Override
  public Node visitIdent(Ident node) {
    return variable(NodeType.LVAR, node);
  }

  @Override
  public Node visitConst(Const node) {
    SourceRange range = srangeNode(node);
    return Node.of(NodeType.CONST, SourceMap.constant(null, range, range), null,
        RubySymbol.of(node.value()));
  }

  @Override
  public Node visitIVar(IVar node) {
    return variable(NodeType.IVAR, node);
  }

  @Override
  public Node visitGVar(GVar node) {
    return variable(NodeType.GVAR, node);
  }

  @Override
  public Node visitCVar(CVar node) {
    return variable(NodeType.CVAR, node);
  }

  /** {@code $1} is an {@code nth_ref}; {@code $&} and its kin are a {@code back_ref}. */
  @Override
  public Node visitBackref(Backref node) {
    SourceMap map = SourceMap.map(srangeNode(node));
    String value = node.value();
    if (Character.isDigit(value.charAt(1))) {
      return Node.of(NodeType.NTH_REF, map, new BigInteger(value.substring(1)));
    }
    return Node.of(NodeType.BACK_REF, map, RubySymbol.of(value));
  }

  @Override
  public Node visitKw(Kw node) {
    SourceMap map = SourceMap.map(srangeNode(node));
    switch (node.value()) {
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
        return Node.of(NodeType.INT, map, BigInteger.valueOf(buffer.lineOf(node.startChar())));
      default:
        throw new TranslationException("unexpected keyword " + node.value());
    }
  }

  @Override
  public Node visitOp(Op node) {
    throw contextual(node);
  }

  @Override
  public Node visitLabel(Label node) {
    throw contextual(node);
  }

  @Override
  public Node visitTStringContent(TStringContent node) {
    throw contextual(node);
  }

  // Literals

  @Override
  public Node visitInt(Int node) {
    return Node.of(NodeType.INT, SourceMap.operator(null, srangeNode(node)),
        Literals.integerValue(node.value()));
  }

  @Override
  public Node visitFloat(FloatLiteral node) {
    return Node.of(NodeType.FLOAT, SourceMap.operator(null, srangeNode(node)),
        Literals.floatValue(node.value()));
  }

  @Override
  public Node visitRational(RationalLiteral node) {
    String value = node.value();
    return Node.of(NodeType.RATIONAL, SourceMap.operator(null, srangeNode(node)),
        RubyRational.parse(value.substring(0, value.length() - 1)));
  }

  @Override
  public Node visitImaginary(Imaginary node) {
    return Node.of(NodeType.COMPLEX, SourceMap.operator(null, srangeNode(node)),
        RubyComplex.parse(node.value()));
  }

  @Override
  public Node visitStringLiteral(StringLiteral node) {
    List<Node> parts = stringParts(node.parts(), !node.quote().equals("'"), false);
    SourceMap map = SourceMap.collection(
        srangeLength(node.startChar(), 1), srangeLength(node.endChar(), -1), srangeNode(node));
    if (parts.isEmpty()) {
      return Node.of(NodeType.STR, map, "");
    }
    if (parts.size() == 1 && parts.get(0).isType(NodeType.STR)) {
      return parts.get(0).updated(null, null, map);
    }
    return new Node(NodeType.DSTR, parts, map);
  }

  @Override
  public Node visitStringEmbExpr(StringEmbExpr node) {
    return wrapStatements(NodeType.BEGIN, srangeLength(node.startChar(), 2),
        srangeLength(node.endChar(), -1), srangeNode(node), compstmt(node.statements()));
  }

  /** Adjacent literals become one {@code dstr} holding each literal. */
  @Override
  public Node visitStringConcat(StringConcat node) {
    List<Node> parts = new ArrayList<>();
    collectConcatenated(node, parts);
    return new Node(NodeType.DSTR, parts, SourceMap.collection(null, null, srangeNode(node)));
  }

  private void collectConcatenated(SyntaxNode node, List<Node> parts) {
    if (node instanceof StringConcat) {
      collectConcatenated(((StringConcat) node).left(), parts);
      collectConcatenated(((StringConcat) node).right(), parts);
    } else {
      parts.add(visit(node));
    }
  }

  @Override
  public Node visitSymbolLiteral(SymbolLiteral node) {
    SourceRange range = srangeNode(node);
    SourceRange colon =
        buffer.charAt(node.startChar()) == ':' ? srangeLength(node.startChar(), 1) : null;
    return Node.of(NodeType.SYM, SourceMap.collection(colon, null, range),
        RubySymbol.of(tokenValue(node.value())));
  }

  /**
   * {@code :"sym"}, or the key of a {@code "sym": value} pair, whose quote is a single character
   * and whose range ends with the colon.
   */
  @Override
  public Node visitDynaSymbol(DynaSymbol node) {
    String quote = node.quote();
    List<Node> parts = stringParts(node.parts(), !quote.endsWith("'"), false);
    SourceMap map;
    if (quote.length() == 1) {
      map = SourceMap.collection(srangeLength(node.startChar(), 1),
          srangeLength(node.endChar() - 1, -1), srange(node.startChar(), node.endChar() - 1));
    } else {
      map = SourceMap.collection(srangeLength(node.startChar(), quote.length()),
          srangeLength(node.endChar(), -1), srangeNode(node));
    }
    if (parts.isEmpty()) {
      return Node.of(NodeType.SYM, map, RubySymbol.of(""));
    }
    if (parts.size() == 1 && parts.get(0).isType(NodeType.STR)) {
      return Node.of(NodeType.SYM, map, RubySymbol.of((String) parts.get(0).getChild(0)));
    }
    return new Node(NodeType.DSYM, parts, map);
  }

  @Override
  public Node visitArrayLiteral(ArrayLiteral node) {
    List<Node> elements = node.contents() == null
        ? ImmutableList.of()
        : arguments(node.contents().parts(), false);
    return new Node(NodeType.ARRAY, elements, SourceMap.collection(
        srangeLength(node.startChar(), 1), srangeLength(node.endChar(), -1), srangeNode(node)));
  }

  @Override
  public Node visitHashLiteral(HashLiteral node) {
    return new Node(NodeType.HASH, visitAll(node.assocs()), SourceMap.collection(
        srangeLength(node.startChar(), 1), srangeLength(node.endChar(), -1), srangeNode(node)));
  }

  /** Trailing pairs without braces. Call arguments turn this into {@code kwargs}. */
  @Override
  public Node visitBareAssocHash(BareAssocHash node) {
    return new Node(NodeType.HASH, visitAll(node.assocs()),
        SourceMap.collection(null, null, srangeNode(node)));
  }

  @Override
  public Node visitAssoc(Assoc node) {
    Node value = visit(node.value());
    if (node.key() instanceof Label) {
      Label label = (Label) node.key();
      Node key = Node.of(NodeType.SYM,
          SourceMap.collection(null, null, srange(label.startChar(), label.endChar() - 1)),
          RubySymbol.of(label.value().substring(0, label.value().length() - 1)));
      return Node.of(NodeType.PAIR,
          SourceMap.operator(srangeLength(label.endChar(), -1), srangeNode(node)), key, value);
    }
    if (node.key() instanceof DynaSymbol && ((DynaSymbol) node.key()).quote().length() == 1) {
      return Node.of(NodeType.PAIR,
          SourceMap.operator(srangeLength(node.key().endChar(), -1), srangeNode(node)),
          visit(node.key()), value);
    }
    SourceRange arrow = srangeFindBetween(node.key(), node.value(), "=>");
    return Node.of(NodeType.PAIR, SourceMap.operator(arrow, srangeNode(node)),
        visit(node.key()), value);
  }

  @Override
  public Node visitAssocSplat(AssocSplat node) {
    return Node.of(NodeType.KWSPLAT,
        SourceMap.operator(srangeLength(node.startChar(), 2), srangeNode(node)),
        visit(node.value()));
  }

  @Override
  public Node visitRange(RangeNode node) {
    NodeType type = node.operator().value().equals("..") ? NodeType.IRANGE : NodeType.ERANGE;
    return Node.of(type, SourceMap.operator(srangeNode(node.operator()), srangeNode(node)),
        visitOrNull(node.left()), visitOrNull(node.right()));
  }

  /**
   * A regexp keeps one raw {@code str} per line and ends with a {@code regopt} holding its flags,
   * sorted and without duplicates.
   */
  @Override
  public Node visitRegexpLiteral(RegexpLiteral node) {
    int slash = node.endChar() - node.ending().length();
    ImmutableSortedSet<String> flags = ImmutableSortedSet.copyOf(
        node.ending().substring(1).chars().mapToObj(c -> String.valueOf((char) c)).iterator());
    List<Object> flagSymbols = new ArrayList<>();
    for (String flag : flags) {
      flagSymbols.add(RubySymbol.of(flag));
    }
    Node options =
        new Node(NodeType.REGOPT, flagSymbols, SourceMap.map(srange(slash + 1, node.endChar())));
    List<Node> children = new ArrayList<>(stringParts(node.parts(), true, true));
    children.add(options);
    return new Node(NodeType.REGEXP, children, SourceMap.collection(
        srangeLength(node.startChar(), node.beginning().length()), srangeLength(slash, 1),
        srangeNode(node)));
  }

  /**
   * Translates the content of a string, symbol or regexp. Content spanning several lines becomes
   * one {@code str} per line.
   */
  private List<Node> stringParts(List<SyntaxNode> parts, boolean interpolating, boolean raw) {
    List<Node> result = new ArrayList<>();
    for (SyntaxNode part : parts) {
      if (!(part instanceof TStringContent)) {
        result.add(visit(part));
        continue;
      }
      TStringContent content = (TStringContent) part;
      String value = content.value();
      int lineStart = 0;
      int i = 0;
      while (i < value.length()) {
        char c = value.charAt(i);
        if (c == '\\') {
          i += 2;
          continue;
        }
        i++;
        if (c == '\n') {
          result.add(stringLine(content, lineStart, i, interpolating, raw));
          lineStart = i;
        }
      }
      if (lineStart < value.length()) {
        result.add(stringLine(content, lineStart, value.length(), interpolating, raw));
      }
    }
    return result;
  }

  private Node stringLine(
      TStringContent content, int begin, int end, boolean interpolating, boolean raw) {
    String text = content.value().substring(begin, Math.min(end, content.value().length()));
    String value = raw ? text : Literals.unescape(text, interpolating);
    SourceRange range = srange(content.startChar() + begin,
        Math.min(content.startChar() + end, content.endChar()));
    return Node.of(NodeType.STR, SourceMap.collection(null, null, range), value);
  }

  // Variables and constants

  @Override
  public Node visitVarRef(VarRef node) {
    return visit(node.value());
  }

  @Override
  public Node visitVCall(VCall node) {
    SourceRange range = srangeNode(node);
    return Node.of(NodeType.SEND, SourceMap.send(null, range, null, null, range), null,
        RubySymbol.of(node.value().value()));
  }

  /** An assignment target. {@link #visitAssign} adds the value and the operator. */
  @Override
  public Node visitVarField(VarField node) {
    SyntaxNode value = node.value();
    if (value instanceof Ident) {
      return variable(NodeType.LVASGN, value);
    } else if (value instanceof IVar) {
      return variable(NodeType.IVASGN, value);
    } else if (value instanceof GVar) {
      return variable(NodeType.GVASGN, value);
    } else if (value instanceof CVar) {
      return variable(NodeType.CVASGN, value);
    } else if (value instanceof Const) {
      SourceRange range = srangeNode(value);
      return Node.of(NodeType.CASGN, SourceMap.constant(null, range, range), null,
          RubySymbol.of(((Const) value).value()));
    }
    throw new TranslationException("cannot assign to " + value);
  }

  @Override
  public Node visitConstRef(ConstRef node) {
    return visit(node.constant());
  }

  @Override
  public Node visitConstPathRef(ConstPathRef node) {
    return constPath(NodeType.CONST, node.parent(), node.constant(), node);
  }

  @Override
  public Node visitConstPathField(ConstPathField node) {
    return constPath(NodeType.CASGN, node.parent(), node.constant(), node);
  }

  private Node constPath(NodeType type, SyntaxNode parent, Const constant, SyntaxNode node) {
    return Node.of(type,
        SourceMap.constant(srangeFindBetween(parent, constant, "::"), srangeNode(constant),
            srangeNode(node)),
        visit(parent), RubySymbol.of(constant.value()));
  }

  @Override
  public Node visitTopConstRef(TopConstRef node) {
    return topConst(NodeType.CONST, node.constant(), node);
  }

  @Override
  public Node visitTopConstField(TopConstField node) {
    return topConst(NodeType.CASGN, node.constant(), node);
  }

  private Node topConst(NodeType type, Const constant, SyntaxNode node) {
    SourceRange colons = srangeLength(node.startChar(), 2);
    return Node.of(type, SourceMap.constant(colons, srangeNode(constant), srangeNode(node)),
        Node.of(NodeType.CBASE, SourceMap.map(colons)), RubySymbol.of(constant.value()));
  }

  // Calls

  @Override
  public Node visitCall(CallNode node) {
    ArgParen parens = node.arguments();
    List<Node> arguments = parens == null ? ImmutableList.of() : parenArguments(parens);
    return send(callType(node.operator()), visit(node.receiver()), srangeNode(node.operator()),
        node.message(), parens, arguments, srangeNode(node));
  }

  @Override
  public Node visitFCall(FCall node) {
    return send(NodeType.SEND, null, null, node.value(), node.arguments(),
        parenArguments(node.arguments()), srangeNode(node));
  }

  @Override
  public Node visitCommand(Command node) {
    Node call = send(NodeType.SEND, null, null, node.message(), null,
        arguments(node.arguments().parts(), true),
        srange(node.startChar(), node.arguments().endChar()));
    return node.block() == null ? call : block(call, node.block());
  }

  @Override
  public Node visitCommandCall(CommandCall node) {
    Node call = send(callType(node.operator()), visit(node.receiver()),
        srangeNode(node.operator()), node.message(), null,
        arguments(node.arguments().parts(), true),
        srange(node.startChar(), node.arguments().endChar()));
    return node.block() == null ? call : block(call, node.block());
  }

  private static NodeType callType(Op operator) {
    return operator.value().equals("&.") ? NodeType.CSEND : NodeType.SEND;
  }

  private Node send(
      NodeType type,
      @Nullable Node receiver,
      @Nullable SourceRange dot,
      SyntaxNode message,
      @Nullable ArgParen parens,
      List<Node> arguments,
      SourceRange expression) {
    List<@Nullable Object> children = new ArrayList<>();
    children.add(receiver);
    children.add(RubySymbol.of(tokenValue(message)));
    children.addAll(arguments);
    SourceRange lparen = parens == null ? null : srangeLength(parens.startChar(), 1);
    SourceRange rparen = parens == null ? null : srangeLength(parens.endChar(), -1);
    return new Node(type, children,
        SourceMap.send(dot, srangeNode(message), lparen, rparen, expression));
  }

  private List<Node> parenArguments(ArgParen parens) {
    SyntaxNode arguments = parens.arguments();
    if (arguments == null) {
      return ImmutableList.of();
    }
    if (arguments instanceof ArgsForward) {
      return ImmutableList.of(visit(arguments));
    }
    return arguments(((Args) arguments).parts(), true);
  }

  /**
   * Translates an argument list. When {@code keywordArguments} is set, a trailing hash without
   * braces, or one just before a block argument, becomes {@code kwargs}.
   */
  private List<Node> arguments(List<SyntaxNode> parts, boolean keywordArguments) {
    List<Node> result = visitAll(parts);
    if (!keywordArguments) {
      return result;
    }
    int size = result.size();
    if (size > 0 && parts.get(size - 1) instanceof BareAssocHash) {
      result.set(size - 1, result.get(size - 1).updated(NodeType.KWARGS, null, null));
    } else if (size > 1 && parts.get(size - 1) instanceof ArgBlock
        && parts.get(size - 2) instanceof BareAssocHash) {
      result.set(size - 2, result.get(size - 2).updated(NodeType.KWARGS, null, null));
    }
    return result;
  }

  @Override
  public Node visitArgParen(ArgParen node) {
    throw contextual(node);
  }

  @Override
  public Node visitArgs(Args node) {
    throw contextual(node);
  }

  @Override
  public Node visitArgStar(ArgStar node) {
    SourceMap map = SourceMap.operator(srangeLength(node.startChar(), 1), srangeNode(node));
    if (node.value() == null) {
      return Node.of(NodeType.SPLAT, map);
    }
    return Node.of(NodeType.SPLAT, map, visit(node.value()));
  }

  @Override
  public Node visitArgBlock(ArgBlock node) {
    return Node.of(NodeType.BLOCK_PASS,
        SourceMap.operator(srangeLength(node.startChar(), 1), srangeNode(node)),
        visitOrNull(node.value()));
  }

  @Override
  public Node visitArgsForward(ArgsForward node) {
    return Node.of(NodeType.FORWARDED_ARGS, SourceMap.map(srangeNode(node)));
  }

  @Override
  public Node visitARef(ARef node) {
    return index(NodeType.INDEX, node.collection(), node.index(), node);
  }

  @Override
  public Node visitARefField(ARefField node) {
    return index(NodeType.INDEXASGN, node.collection(), node.index(), node);
  }

  private Node index(NodeType type, SyntaxNode collection, @Nullable Args index, SyntaxNode node) {
    List<@Nullable Object> children = new ArrayList<>();
    children.add(visit(collection));
    if (index != null) {
      children.addAll(arguments(index.parts(), false));
    }
    return new Node(type, children, SourceMap.index(
        srangeFind(collection.endChar(), node.endChar(), "["), srangeLength(node.endChar(), -1),
        srangeNode(node)));
  }

  /** {@code recv.name}, the target of {@code recv.name = value}. */
  @Override
  public Node visitField(Field node) {
    String name = tokenValue(node.name()) + "=";
    return Node.of(callType(node.operator()), fieldMap(node), visit(node.parent()),
        RubySymbol.of(name));
  }

  private SourceMap fieldMap(Field node) {
    return SourceMap.send(srangeNode(node.operator()), srangeNode(node.name()), null, null,
        srangeNode(node));
  }

  @Override
  public Node visitMethodAddBlock(MethodAddBlock node) {
    return block(visit(node.call()), node.block());
  }

  @Override
  public Node visitBlock(BlockNode node) {
    throw contextual(node);
  }

  @Override
  public Node visitBlockVar(BlockVar node) {
    throw contextual(node);
  }

  /** Wraps {@code call} in a {@code block} node for {@code block}. */
  private Node block(Node call, BlockNode block) {
    boolean braces = block.opening() instanceof Op;
    SourceRange open = srangeNode(block.opening());
    SourceRange close = srangeLength(block.endChar(), braces ? -1 : -3);
    Node body = braces
        ? compstmt((Statements) block.bodystmt())
        : bodyStmt((BodyStmt) block.bodystmt());
    return Node.of(NodeType.BLOCK,
        SourceMap.collection(open, close, call.getExpression().join(close)), call,
        blockArgs(block.blockVar()), body);
  }

  private Node blockArgs(@Nullable BlockVar blockVar) {
    if (blockVar == null) {
      return emptyArgs();
    }
    SourceRange range = srangeNode(blockVar);
    if (buffer.source(range).equals("||")) {
      return Node.of(NodeType.ARGS, SourceMap.collection(range, range, range));
    }
    List<Node> params = new ArrayList<>(parameters(blockVar.params(), true));
    if (params.size() == 1 && params.get(0).isType(NodeType.ARG)) {
      Node arg = params.get(0);
      params.set(0, Node.of(NodeType.PROCARG0,
          SourceMap.collection(null, null, arg.getExpression()), arg));
    }
    params.addAll(shadowArgs(blockVar.locals()));
    return new Node(NodeType.ARGS, params, SourceMap.collection(
        srangeLength(blockVar.startChar(), 1), srangeLength(blockVar.endChar(), -1), range));
  }

  private List<Node> shadowArgs(List<Ident> locals) {
    List<Node> result = new ArrayList<>();
    for (Ident local : locals) {
      result.add(variable(NodeType.SHADOWARG, local));
    }
    return result;
  }

  /** {@code ->(x) { x }} becomes a {@code block} whose call is {@code (lambda)}. */
  @Override
  public Node visitLambda(Lambda node) {
    Node lambda = Node.of(NodeType.LAMBDA, SourceMap.map(srangeLength(node.startChar(), 2)));
    Node args;
    int paramsEnd;
    if (node.params() instanceof Paren) {
      Paren paren = (Paren) node.params();
      LambdaVar var = (LambdaVar) paren.contents();
      List<Node> params = new ArrayList<>(parameters(var.params(), false));
      params.addAll(shadowArgs(var.locals()));
      args = new Node(NodeType.ARGS, params, SourceMap.collection(
          srangeLength(paren.startChar(), 1), srangeLength(paren.endChar(), -1),
          srangeNode(paren)));
      paramsEnd = paren.endChar();
    } else {
      LambdaVar var = (LambdaVar) node.params();
      args = argsWithoutParens(parameters(var.params(), false));
      paramsEnd = var.params().empty() ? node.startChar() + 2 : var.endChar();
    }
    boolean braces = buffer.charAt(node.endChar() - 1) == '}';
    SourceRange open = srangeFind(paramsEnd, node.endChar(), braces ? "{" : "do");
    SourceRange close = srangeLength(node.endChar(), braces ? -1 : -3);
    Node body = braces
        ? compstmt((Statements) node.statements())
        : bodyStmt((BodyStmt) node.statements());
    return Node.of(NodeType.BLOCK, SourceMap.collection(open, close, srangeNode(node)), lambda,
        args, body);
  }

  @Override
  public Node visitLambdaVar(LambdaVar node) {
    throw contextual(node);
  }

  // Operators

  @Override
  public Node visitBinary(Binary node) {
    String operator = node.operator();
    SourceRange operatorRange = srangeFindBetween(node.left(), node.right(), operator);
    Node left = visit(node.left());
    Node right = visit(node.right());
    switch (operator) {
      case "&&":
      case "and":
        return Node.of(NodeType.AND, SourceMap.operator(operatorRange, srangeNode(node)), left,
            right);
      case "||":
      case "or":
        return Node.of(NodeType.OR, SourceMap.operator(operatorRange, srangeNode(node)), left,
            right);
      case "=~":
        if (isStaticRegexp(node.left())) {
          return Node.of(NodeType.MATCH_WITH_LVASGN,
              SourceMap.send(null, operatorRange, null, null, srangeNode(node)), left, right);
        }
        break;
      default:
        break;
    }
    return Node.of(NodeType.SEND, SourceMap.send(null, operatorRange, null, null,
        srangeNode(node)), left, RubySymbol.of(operator), right);
  }

  private static boolean isStaticRegexp(SyntaxNode node) {
    if (!(node instanceof RegexpLiteral)) {
      return false;
    }
    for (SyntaxNode part : ((RegexpLiteral) node).parts()) {
      if (!(part instanceof TStringContent)) {
        return false;
      }
    }
    return true;
  }

  /** A sign glued to a numeric literal folds into the literal. */
  @Override
  public Node visitUnary(Unary node) {
    String operator = node.operator().value();
    SourceRange operatorRange = srangeNode(node.operator());
    SyntaxNode statement = node.statement();
    boolean numeric = statement instanceof Int
        || statement instanceof FloatLiteral
        || statement instanceof RationalLiteral
        || statement instanceof Imaginary;
    if ((operator.equals("-") || operator.equals("+")) && numeric
        && statement.startChar() == node.operator().endChar()) {
      Node literal = visit(statement);
      Object value = literal.getChild(0);
      if (operator.equals("-")) {
        value = NumericValues.negate(value);
      }
      return literal.updated(null, ImmutableList.of(value),
          SourceMap.operator(operatorRange, srangeNode(node)));
    }
    String selector;
    switch (operator) {
      case "-":
        selector = "-@";
        break;
      case "+":
        selector = "+@";
        break;
      default:
        selector = operator;
    }
    return Node.of(NodeType.SEND, SourceMap.send(null, operatorRange, null, null,
        srangeNode(node)), visit(statement), RubySymbol.of(selector));
  }

  @Override
  public Node visitNot(Not node) {
    SourceRange keyword = srangeLength(node.startChar(), 3);
    if (!node.parentheses()) {
      return Node.of(NodeType.SEND, SourceMap.send(null, keyword, null, null, srangeNode(node)),
          visit(node.statement()), RubySymbol.of("!"));
    }
    SourceRange lparen = srangeFind(keyword.endPos(), node.endChar(), "(");
    SourceRange rparen = srangeLength(node.endChar(), -1);
    Node receiver = node.statement() == null
        ? Node.of(NodeType.BEGIN, SourceMap.collection(lparen, rparen, lparen.join(rparen)))
        : visit(node.statement());
    return Node.of(NodeType.SEND,
        SourceMap.send(null, keyword, lparen, rparen, srangeNode(node)), receiver,
        RubySymbol.of("!"));
  }

  /** The target's own map gains the {@code =} and widens to the whole assignment. */
  @Override
  public Node visitAssign(Assign node) {
    Node target = visit(node.target());
    SourceMap map = target.getLocation()
        .withOperator(srangeFindBetween(node.target(), node.value(), "="))
        .withExpression(srangeNode(node));
    return target.append(visit(node.value())).updated(null, null, map);
  }

  /** {@code a, b = 1, 2}. */
  @Override
  public Node visitMAssign(MAssign node) {
    SourceRange equals = srangeFindBetween(node.target(), node.value(), "=");
    return Node.of(NodeType.MASGN, SourceMap.operator(equals, srangeNode(node)),
        visit(node.target()), visit(node.value()));
  }

  @Override
  public Node visitMLHS(MLHS node) {
    return new Node(NodeType.MLHS, visitAll(node.parts()),
        SourceMap.collection(null, null, srangeNode(node)));
  }

  /** Several values, or a splat, on the right of an assignment make an array without brackets. */
  @Override
  public Node visitMRHS(MRHS node) {
    return new Node(NodeType.ARRAY, arguments(node.parts(), false),
        SourceMap.collection(null, null, srangeNode(node)));
  }

  @Override
  public Node visitOpAssign(OpAssign node) {
    Node target;
    if (node.target() instanceof Field) {
      Field field = (Field) node.target();
      target = Node.of(callType(field.operator()), fieldMap(field), visit(field.parent()),
          RubySymbol.of(tokenValue(field.name())));
    } else {
      target = visit(node.target());
    }
    String operator = node.operator().value();
    SourceMap map = target.getLocation()
        .withOperator(srangeNode(node.operator()))
        .withExpression(srangeNode(node));
    Node value = visit(node.value());
    switch (operator) {
      case "||=":
        return Node.of(NodeType.OR_ASGN, map, target, value);
      case "&&=":
        return Node.of(NodeType.AND_ASGN, map, target, value);
      default:
        return Node.of(NodeType.OP_ASGN, map, target,
            RubySymbol.of(operator.substring(0, operator.length() - 1)), value);
    }
  }

  @Override
  public Node visitDefined(Defined node) {
    SourceRange keyword = srangeLength(node.startChar(), "defined?".length());
    boolean parens = keyword.endPos() < buffer.length()
        && buffer.charAt(keyword.endPos()) == '('
        && buffer.charAt(node.endChar() - 1) == ')';
    SourceRange lparen = parens ? srangeLength(keyword.endPos(), 1) : null;
    SourceRange rparen = parens ? srangeLength(node.endChar(), -1) : null;
    return Node.of(NodeType.DEFINED,
        SourceMap.keyword(keyword, lparen, rparen, srangeNode(node)), visit(node.value()));
  }

  // Control flow

  @Override
  public Node visitIf(IfNode node) {
    if (node.modifier()) {
      return modifierIf(node.predicate(), node.statements(), "if", true);
    }
    return condition(srangeLength(node.startChar(), 2), node.predicate(), node.statements(),
        node.consequent(), srangeLength(node.endChar(), -3));
  }

  @Override
  public Node visitUnless(UnlessNode node) {
    if (node.modifier()) {
      return modifierIf(node.predicate(), node.statements(), "unless", false);
    }
    SourceRange keyword = srangeLength(node.startChar(), 6);
    SourceRange begin = clauseBegin(node.predicate().endChar(), node.statements().startChar(),
        "then");
    Else consequent = node.consequent();
    Node elseBody = consequent == null ? null : compstmt(consequent.statements());
    SourceRange elseRange = consequent == null ? null : srangeNode(consequent.keyword());
    return Node.of(NodeType.IF,
        SourceMap.condition(keyword, begin, elseRange, srangeLength(node.endChar(), -3),
            srangeNode(node)),
        visit(node.predicate()), elseBody, compstmt(node.statements()));
  }

  private Node modifierIf(
      SyntaxNode predicate, Statements statements, String keyword, boolean positive) {
    Node body = compstmt(statements);
    SourceRange keywordRange = srangeFindBetween(statements, predicate, keyword);
    SourceMap map = SourceMap.keyword(keywordRange, null, null,
        srange(statements.startChar(), predicate.endChar()));
    return Node.of(NodeType.IF, map, visit(predicate), positive ? body : null,
        positive ? null : body);
  }

  @Override
  public Node visitElsif(Elsif node) {
    return condition(srangeLength(node.startChar(), 5), node.predicate(), node.statements(),
        node.consequent(), null);
  }

  /**
   * An {@code if} or {@code elsif}. The clause after it, an {@link Elsif} or {@link Else}, is
   * inlined as the third child. Without an {@code end} keyword the expression stops at the last
   * part present.
   */
  private Node condition(SourceRange keyword, SyntaxNode predicate, Statements statements,
      @Nullable SyntaxNode consequent, @Nullable SourceRange end) {
    Node cond = visit(predicate);
    SourceRange begin = clauseBegin(predicate.endChar(), statements.startChar(), "then");
    Node body = compstmt(statements);
    SourceRange elseRange = null;
    Node elseBody = null;
    if (consequent instanceof Else) {
      Else elseClause = (Else) consequent;
      elseRange = srangeNode(elseClause.keyword());
      elseBody = compstmt(elseClause.statements());
    } else if (consequent instanceof Elsif) {
      elseRange = srangeLength(consequent.startChar(), 5);
      elseBody = visit(consequent);
    }
    SourceRange last;
    if (end != null) {
      last = end;
    } else if (elseBody != null) {
      last = elseBody.getExpression();
    } else if (elseRange != null) {
      last = elseRange;
    } else if (body != null) {
      last = body.getExpression();
    } else if (begin != null) {
      last = begin;
    } else {
      last = cond.getExpression();
    }
    return Node.of(NodeType.IF,
        SourceMap.condition(keyword, begin, elseRange, end, keyword.join(last)), cond, body,
        elseBody);
  }

  @Override
  public Node visitElse(Else node) {
    throw contextual(node);
  }

  @Override
  public Node visitIfOp(IfOp node) {
    return Node.of(NodeType.IF,
        SourceMap.ternary(srangeFindBetween(node.predicate(), node.truthy(), "?"),
            srangeFindBetween(node.truthy(), node.falsy(), ":"), srangeNode(node)),
        visit(node.predicate()), visit(node.truthy()), visit(node.falsy()));
  }

  @Override
  public Node visitWhile(WhileNode node) {
    return loop(NodeType.WHILE, "while", node.predicate(), node.statements(), node.modifier(),
        node);
  }

  @Override
  public Node visitUntil(UntilNode node) {
    return loop(NodeType.UNTIL, "until", node.predicate(), node.statements(), node.modifier(),
        node);
  }

  private Node loop(NodeType type, String keyword, SyntaxNode predicate, Statements statements,
      boolean modifier, SyntaxNode node) {
    Node body = compstmt(statements);
    if (modifier) {
      NodeType loopType = type;
      if (statements.body().size() == 1 && statements.body().get(0) instanceof Begin) {
        loopType = type == NodeType.WHILE ? NodeType.WHILE_POST : NodeType.UNTIL_POST;
      }
      return Node.of(loopType,
          SourceMap.keyword(srangeFindBetween(statements, predicate, keyword), null, null,
              srangeNode(node)),
          visit(predicate), body);
    }
    SourceRange begin = clauseBegin(predicate.endChar(), statements.startChar(), "do");
    return Node.of(type,
        SourceMap.keyword(srangeLength(node.startChar(), keyword.length()), begin,
            srangeLength(node.endChar(), -3), srangeNode(node)),
        visit(predicate), body);
  }

  @Override
  public Node visitFor(For node) {
    SourceRange begin = clauseBegin(node.collection().endChar(), node.statements().startChar(),
        "do");
    return Node.of(NodeType.FOR,
        SourceMap.forLoop(srangeLength(node.startChar(), 3),
            srangeFindBetween(node.index(), node.collection(), "in"), begin,
            srangeLength(node.endChar(), -3), srangeNode(node)),
        visit(node.index()), visit(node.collection()), compstmt(node.statements()));
  }

  /** Children are the subject, each {@code when}, then the {@code else} body or nil. */
  @Override
  public Node visitCase(Case node) {
    List<@Nullable Object> children = new ArrayList<>();
    children.add(visitOrNull(node.value()));
    SyntaxNode clause = node.consequent();
    SourceRange elseRange = null;
    Node elseBody = null;
    while (clause != null) {
      if (clause instanceof When) {
        children.add(visit(clause));
        clause = ((When) clause).consequent();
      } else {
        Else elseClause = (Else) clause;
        elseRange = srangeNode(elseClause.keyword());
        elseBody = compstmt(elseClause.statements());
        clause = null;
      }
    }
    children.add(elseBody);
    return new Node(NodeType.CASE, children,
        SourceMap.condition(srangeLength(node.startChar(), 4), null, elseRange,
            srangeLength(node.endChar(), -3), srangeNode(node)));
  }

  /** A single {@code when} clause; {@link #visitCase} walks the chain. */
  @Override
  public Node visitWhen(When node) {
    List<SyntaxNode> patterns = node.arguments().parts();
    SyntaxNode lastPattern = patterns.get(patterns.size() - 1);
    SourceRange keyword = srangeLength(node.startChar(), 4);
    SourceRange begin = clauseBegin(lastPattern.endChar(), node.statements().startChar(), "then");
    Node body = compstmt(node.statements());
    List<@Nullable Object> children = new ArrayList<>(visitAll(patterns));
    children.add(body);
    SourceRange end = body != null ? body.getExpression() : srangeNode(lastPattern);
    return new Node(NodeType.WHEN, children,
        SourceMap.keyword(keyword, begin, null, keyword.join(end)));
  }

  @Override
  public Node visitParen(Paren node) {
    Node body = node.contents() instanceof Statements
        ? compstmt((Statements) node.contents())
        : visitOrNull(node.contents());
    return wrapStatements(NodeType.BEGIN, srangeLength(node.startChar(), 1),
        srangeLength(node.endChar(), -1), srangeNode(node), body);
  }

  // Definitions

  @Override
  public Node visitDef(DefNode node) {
    SourceRange keyword = srangeLength(node.startChar(), 3);
    SourceRange name = srangeNode(node.name());
    RubySymbol symbol = RubySymbol.of(tokenValue(node.name()));
    Node args = definitionArgs(node.params());
    Node definee = visitOrNull(node.target());
    SourceRange dot = node.operator() == null ? null : srangeNode(node.operator());
    NodeType type = definee == null ? NodeType.DEF : NodeType.DEFS;

    SourceMap map;
    Node body;
    if (node.bodystmt() instanceof BodyStmt) {
      body = bodyStmt((BodyStmt) node.bodystmt());
      map = SourceMap.methodDefinition(keyword, dot, name, srangeLength(node.endChar(), -3), null,
          srangeNode(node));
    } else {
      int headerEnd = node.params() != null ? node.params().endChar() : node.name().endChar();
      SourceRange assignment = srangeFind(headerEnd, node.bodystmt().startChar(), "=");
      body = visit(node.bodystmt());
      map = SourceMap.methodDefinition(keyword, dot, name, null, assignment, srangeNode(node));
    }
    if (definee == null) {
      return Node.of(type, map, symbol, args, body);
    }
    return Node.of(type, map, definee, symbol, args, body);
  }

  private Node definitionArgs(@Nullable SyntaxNode params) {
    if (params == null) {
      return emptyArgs();
    }
    if (!(params instanceof Paren)) {
      return argsWithoutParens(parameters((Params) params, false));
    }
    Paren paren = (Paren) params;
    SourceRange lparen = srangeLength(paren.startChar(), 1);
    SourceRange rparen = srangeLength(paren.endChar(), -1);
    Params inner = (Params) paren.contents();
    if (forwardArgsStyle == ForwardArgsStyle.LEGACY && isOnlyForwarding(inner)) {
      return Node.of(NodeType.FORWARD_ARGS,
          SourceMap.collection(lparen, rparen, srangeNode(paren)));
    }
    return new Node(NodeType.ARGS, parameters(inner, false),
        SourceMap.collection(lparen, rparen, srangeNode(paren)));
  }

  private static boolean isOnlyForwarding(Params params) {
    return params.keywordRest() instanceof ArgsForward
        && params.requireds().isEmpty()
        && params.optionals().isEmpty()
        && params.rest() == null
        && params.posts().isEmpty()
        && params.keywords().isEmpty()
        && params.block() == null;
  }

  private Node emptyArgs() {
    return Node.of(NodeType.ARGS, SourceMap.collection(null, null, null));
  }

  private Node argsWithoutParens(List<Node> params) {
    if (params.isEmpty()) {
      return emptyArgs();
    }
    SourceRange expression = params.get(0).getExpression()
        .join(params.get(params.size() - 1).getExpression());
    return new Node(NodeType.ARGS, params, SourceMap.collection(null, null, expression));
  }

  @Override
  public Node visitParams(Params node) {
    throw contextual(node);
  }

  /** The parameter nodes in Ruby's order; {@code block} is unused until blocks differ. */
  private List<Node> parameters(Params params, boolean block) {
    List<Node> result = new ArrayList<>();
    for (Ident required : params.requireds()) {
      result.add(variable(NodeType.ARG, required));
    }
    for (Params.OptionalParam optional : params.optionals()) {
      SourceRange name = srangeNode(optional.name());
      SourceRange equals = srangeFindBetween(optional.name(), optional.value(), "=");
      result.add(Node.of(NodeType.OPTARG,
          SourceMap.variable(name, srange(name.beginPos(), optional.value().endChar()))
              .withOperator(equals),
          RubySymbol.of(optional.name().value()), visit(optional.value())));
    }
    if (params.rest() != null) {
      result.add(visit(params.rest()));
    }
    for (Ident post : params.posts()) {
      result.add(variable(NodeType.ARG, post));
    }
    for (Params.KeywordParam keyword : params.keywords()) {
      Label label = keyword.name();
      SourceRange name = srange(label.startChar(), label.endChar() - 1);
      RubySymbol symbol = RubySymbol.of(label.value().substring(0, label.value().length() - 1));
      if (keyword.value() == null) {
        result.add(Node.of(NodeType.KWARG, SourceMap.variable(name, srangeNode(label)), symbol));
      } else {
        result.add(Node.of(NodeType.KWOPTARG,
            SourceMap.variable(name, srange(label.startChar(), keyword.value().endChar())),
            symbol, visit(keyword.value())));
      }
    }
    if (params.keywordRest() instanceof ArgsForward) {
      result.add(Node.of(NodeType.FORWARD_ARG, SourceMap.map(srangeNode(params.keywordRest()))));
    } else if (params.keywordRest() != null) {
      result.add(visit(params.keywordRest()));
    }
    if (params.block() != null) {
      result.add(visit(params.block()));
    }
    return result;
  }

  @Override
  public Node visitRestParam(RestParam node) {
    return prefixedParam(NodeType.RESTARG, node.name(), node);
  }

  @Override
  public Node visitKwRestParam(KwRestParam node) {
    return prefixedParam(NodeType.KWRESTARG, node.name(), node);
  }

  @Override
  public Node visitBlockArg(BlockArg node) {
    return prefixedParam(NodeType.BLOCKARG, node.name(), node);
  }

  private Node prefixedParam(NodeType type, @Nullable Ident name, SyntaxNode node) {
    if (name == null) {
      return Node.of(type, SourceMap.variable(null, srangeNode(node)));
    }
    return Node.of(type, SourceMap.variable(srangeNode(name), srangeNode(node)),
        RubySymbol.of(name.value()));
  }

  @Override
  public Node visitClass(ClassDeclaration node) {
    Node name = visit(node.constant());
    SourceRange operator = node.superclass() == null
        ? null
        : srangeFindBetween(node.constant(), node.superclass(), "<");
    return Node.of(NodeType.CLASS,
        SourceMap.definition(srangeLength(node.startChar(), 5), operator, name.getExpression(),
            srangeLength(node.endChar(), -3), srangeNode(node)),
        name, visitOrNull(node.superclass()), bodyStmt(node.bodystmt()));
  }

  @Override
  public Node visitSClass(SClass node) {
    SourceRange keyword = srangeLength(node.startChar(), 5);
    return Node.of(NodeType.SCLASS,
        SourceMap.definition(keyword, srangeFind(keyword.endPos(), node.target().startChar(), "<<"),
            null, srangeLength(node.endChar(), -3), srangeNode(node)),
        visit(node.target()), bodyStmt(node.bodystmt()));
  }

  @Override
  public Node visitModule(ModuleDeclaration node) {
    Node name = visit(node.constant());
    return Node.of(NodeType.MODULE,
        SourceMap.definition(srangeLength(node.startChar(), 6), null, name.getExpression(),
            srangeLength(node.endChar(), -3), srangeNode(node)),
        name, bodyStmt(node.bodystmt()));
  }

  // Bodies

  @Override
  public @Nullable Node visitProgram(Program node) {
    return compstmt(node.statements());
  }

  @Override
  public @Nullable Node visitStatements(Statements node) {
    return compstmt(node);
  }

  /** No statements give null, one gives itself, and more are grouped in a {@code begin}. */
  private @Nullable Node compstmt(Statements statements) {
    List<Node> body = visitAll(statements.body());
    if (body.isEmpty()) {
      return null;
    }
    if (body.size() == 1) {
      return body.get(0);
    }
    return new Node(NodeType.BEGIN, body, SourceMap.collection(null, null,
        body.get(0).getExpression().join(body.get(body.size() - 1).getExpression())));
  }

  @Override
  public @Nullable Node visitBodyStmt(BodyStmt node) {
    return bodyStmt(node);
  }

  /**
   * A body with optional {@code rescue}, {@code else} and {@code ensure} clauses. Without clauses
   * only the statements remain.
   */
  private @Nullable Node bodyStmt(BodyStmt node) {
    Node result = compstmt(node.statements());
    if (node.rescueClause() != null) {
      List<Node> rescueBodies = new ArrayList<>();
      for (Rescue clause = node.rescueClause(); clause != null; clause = clause.consequent()) {
        rescueBodies.add(visit(clause));
      }
      Else elseClause = node.elseClause();
      SourceRange elseRange = elseClause == null ? null : srangeNode(elseClause.keyword());
      Node elseBody = elseClause == null ? null : compstmt(elseClause.statements());
      SourceRange begin =
          result != null ? result.getExpression() : rescueBodies.get(0).getExpression();
      SourceRange end;
      if (elseRange != null) {
        end = elseBody != null ? elseBody.getExpression() : elseRange;
      } else {
        end = rescueBodies.get(rescueBodies.size() - 1).getExpression();
      }
      List<@Nullable Object> children = new ArrayList<>();
      children.add(result);
      children.addAll(rescueBodies);
      children.add(elseBody);
      result = new Node(NodeType.RESCUE, children,
          SourceMap.condition(null, null, elseRange, null, begin.join(end)));
    } else if (node.elseClause() != null) {
      throw new TranslationException("else without rescue at " + srangeNode(node.elseClause()));
    }
    Ensure ensureClause = node.ensureClause();
    if (ensureClause != null) {
      SourceRange keyword = srangeNode(ensureClause.keyword());
      Node ensureBody = compstmt(ensureClause.statements());
      SourceRange begin = result != null ? result.getExpression() : keyword;
      SourceRange end = ensureBody != null ? ensureBody.getExpression() : keyword;
      result = Node.of(NodeType.ENSURE,
          SourceMap.condition(keyword, null, null, null, begin.join(end)), result, ensureBody);
    }
    return result;
  }

  @Override
  public Node visitBegin(Begin node) {
    return wrapStatements(NodeType.KWBEGIN, srangeLength(node.startChar(), 5),
        srangeLength(node.endChar(), -3), srangeNode(node), bodyStmt(node.bodystmt()));
  }

  /**
   * A {@code begin} or {@code kwbegin} with delimiters. A body that is itself a group of
   * statements is flattened into it.
   */
  private Node wrapStatements(NodeType type, SourceRange begin, SourceRange end,
      SourceRange expression, @Nullable Node body) {
    SourceMap map = SourceMap.collection(begin, end, expression);
    if (body == null) {
      return Node.of(type, map);
    }
    if (body.isType(NodeType.BEGIN) && body.getLocation().getBegin() == null
        && body.getLocation().getEnd() == null) {
      return new Node(type, body.getChildren(), map);
    }
    return Node.of(type, map, body);
  }

  /** One {@code rescue} clause as a {@code resbody}; {@link #bodyStmt} walks the chain. */
  @Override
  public Node visitRescue(Rescue node) {
    SourceRange keyword = srangeLength(node.startChar(), 6);
    RescueEx exception = node.exception();
    Node exceptions = null;
    Node variable = null;
    SourceRange assoc = null;
    int headerEnd = keyword.endPos();
    if (exception != null) {
      if (!exception.exceptions().isEmpty()) {
        List<Node> list = visitAll(exception.exceptions());
        exceptions = new Node(NodeType.ARRAY, list, SourceMap.collection(null, null,
            list.get(0).getExpression().join(list.get(list.size() - 1).getExpression())));
        headerEnd = list.get(list.size() - 1).getExpression().endPos();
      }
      if (exception.variable() != null) {
        assoc = srangeFind(headerEnd, exception.variable().startChar(), "=>");
        variable = visit(exception.variable());
        headerEnd = exception.variable().endChar();
      }
    }
    SourceRange begin = clauseBegin(headerEnd, node.statements().startChar(), "then");
    Node body = compstmt(node.statements());
    SourceRange end;
    if (body != null) {
      end = body.getExpression();
    } else if (begin != null) {
      end = begin;
    } else if (variable != null) {
      end = variable.getExpression();
    } else if (exceptions != null) {
      end = exceptions.getExpression();
    } else {
      end = keyword;
    }
    return Node.of(NodeType.RESBODY,
        SourceMap.rescueBody(keyword, assoc, begin, keyword.join(end)), exceptions, variable,
        body);
  }

  @Override
  public Node visitRescueEx(RescueEx node) {
    throw contextual(node);
  }

  @Override
  public Node visitEnsure(Ensure node) {
    throw contextual(node);
  }

  @Override
  public Node visitRescueMod(RescueMod node) {
    SourceRange keyword = srangeFindBetween(node.statement(), node.value(), "rescue");
    Node value = visit(node.value());
    Node rescueBody = Node.of(NodeType.RESBODY,
        SourceMap.rescueBody(keyword, null, null, keyword.join(value.getExpression())), null,
        null, value);
    return Node.of(NodeType.RESCUE,
        SourceMap.condition(null, null, null, null, srangeNode(node)), visit(node.statement()),
        rescueBody, null);
  }

  // Jumps

  @Override
  public Node visitReturn(ReturnNode node) {
    return jump(NodeType.RETURN, "return", node.arguments(), node);
  }

  @Override
  public Node visitBreak(Break node) {
    return jump(NodeType.BREAK, "break", node.arguments(), node);
  }

  @Override
  public Node visitNext(Next node) {
    return jump(NodeType.NEXT, "next", node.arguments(), node);
  }

  private Node jump(NodeType type, String keyword, @Nullable Args arguments, SyntaxNode node) {
    List<Node> children =
        arguments == null ? ImmutableList.of() : arguments(arguments.parts(), false);
    return new Node(type, children, SourceMap.keyword(
        srangeLength(node.startChar(), keyword.length()), null, null, srangeNode(node)));
  }

  @Override
  public Node visitRedo(Redo node) {
    SourceRange range = srangeNode(node);
    return Node.of(NodeType.REDO, SourceMap.keyword(range, null, null, range));
  }

  @Override
  public Node visitRetry(Retry node) {
    return Node.of(NodeType.RETRY,
        SourceMap.keyword(srangeNode(node), null, null, srangeNode(node)));
  }

  @Override
  public Node visitYield(YieldNode node) {
    SourceRange keyword = srangeLength(node.startChar(), 5);
    SyntaxNode arguments = node.arguments();
    if (arguments instanceof Paren) {
      Paren paren = (Paren) arguments;
      List<Node> children = paren.contents() == null
          ? ImmutableList.of()
          : arguments(((Args) paren.contents()).parts(), true);
      return new Node(NodeType.YIELD, children, SourceMap.keyword(keyword,
          srangeLength(paren.startChar(), 1), srangeLength(paren.endChar(), -1),
          srangeNode(node)));
    }
    List<Node> children = arguments == null
        ? ImmutableList.of()
        : arguments(((Args) arguments).parts(), true);
    return new Node(NodeType.YIELD, children,
        SourceMap.keyword(keyword, null, null, srangeNode(node)));
  }

  @Override
  public Node visitSuper(Super node) {
    SourceRange keyword = srangeLength(node.startChar(), 5);
    if (node.arguments() instanceof ArgParen) {
      ArgParen parens = (ArgParen) node.arguments();
      return new Node(NodeType.SUPER, parenArguments(parens), SourceMap.keyword(keyword,
          srangeLength(parens.startChar(), 1), srangeLength(parens.endChar(), -1),
          srangeNode(node)));
    }
    return new Node(NodeType.SUPER, arguments(((Args) node.arguments()).parts(), true),
        SourceMap.keyword(keyword, null, null, srangeNode(node)));
  }

  @Override
  public Node visitZSuper(ZSuper node) {
    return Node.of(NodeType.ZSUPER,
        SourceMap.keyword(srangeNode(node), null, null, srangeNode(node)));
  }

  // Aliases

  @Override
  public Node visitAlias(Alias node) {
    return Node.of(NodeType.ALIAS,
        SourceMap.keyword(srangeLength(node.startChar(), 5), null, null, srangeNode(node)),
        visit(node.left()), visit(node.right()));
  }

  @Override
  public Node visitVarAlias(VarAlias node) {
    return Node.of(NodeType.ALIAS,
        SourceMap.keyword(srangeLength(node.startChar(), 5), null, null, srangeNode(node)),
        visit(node.left()), visit(node.right()));
  }

  @Override
  public Node visitUndef(Undef node) {
    return new Node(NodeType.UNDEF, visitAll(node.symbols()),
        SourceMap.keyword(srangeLength(node.startChar(), 5), null, null, srangeNode(node)));
  }

  // Helpers

  private List<Node> visitAll(List<? extends SyntaxNode> nodes) {
    List<Node> result = new ArrayList<>(nodes.size());
    for (SyntaxNode node : nodes) {
      result.add(visit(node));
    }
    return result;
  }

  private Node variable(NodeType type, SyntaxNode token) {
    SourceRange range = srangeNode(token);
    return Node.of(type, SourceMap.variable(range, range), RubySymbol.of(tokenValue(token)));
  }

  /**
   * The range the gem records as the begin of a clause: the {@code keyword} ({@code then} or
   * {@code do}) when it is written, otherwise the first semicolon after the header.
   */
  private @Nullable SourceRange clauseBegin(int headerEnd, int bodyStart, String keyword) {
    SourceRange range = srangeSearch(headerEnd, bodyStart, keyword);
    return range != null ? range : srangeSearch(headerEnd, bodyStart, ";");
  }

  private static String tokenValue(SyntaxNode token) {
    if (token instanceof Ident) {
      return ((Ident) token).value();
    } else if (token instanceof Const) {
      return ((Const) token).value();
    } else if (token instanceof Kw) {
      return ((Kw) token).value();
    } else if (token instanceof Op) {
      return ((Op) token).value();
    } else if (token instanceof IVar) {
      return ((IVar) token).value();
    } else if (token instanceof GVar) {
      return ((GVar) token).value();
    } else if (token instanceof CVar) {
      return ((CVar) token).value();
    }
    throw new TranslationException("expected a name but got " + token);
  }

  private static TranslationException contextual(SyntaxNode node) {
    return new TranslationException(
        node.getClass().getSimpleName() + " is only translated as part of its parent");
  }

  // Source ranges

  SourceRange srange(int start, int end) {
    return buffer.range(start, end);
  }

  /** A range of {@code length} characters from {@code start}, or before it when negative. */
  SourceRange srangeLength(int start, int length) {
    return buffer.rangeLength(start, length);
  }

  SourceRange srangeNode(SyntaxNode node) {
    return srange(node.startChar(), node.endChar());
  }

  /** The first occurrence of {@code needle} in the range, or null. */
  @Nullable SourceRange srangeSearch(int start, int end, String needle) {
    int index = buffer.indexOf(needle, start, end);
    return index < 0 ? null : srange(index, index + needle.length());
  }

  @Nullable SourceRange srangeSearchBetween(SyntaxNode first, SyntaxNode last, String needle) {
    return srangeSearch(first.endChar(), last.startChar(), needle);
  }

  /**
   * Like {@link #srangeSearch} but the needle must be there.
   *
   * @throws TranslationException if it is not
   */
  SourceRange srangeFind(int start, int end, String needle) {
    SourceRange range = srangeSearch(start, end, needle);
    if (range == null) {
      throw new TranslationException(String.format("Could not find %s in %s",
          Node.inspectString(needle), Node.inspectString(buffer.slice(start, end))));
    }
    return range;
  }

  SourceRange srangeFindBetween(SyntaxNode first, SyntaxNode last, String needle) {
    return srangeFind(first.endChar(), last.startChar(), needle);
  }
}
