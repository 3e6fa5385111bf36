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
package org.syntaxtree.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.source.SourceRange;

/**
 * A node of the Syntax Tree concrete syntax tree. Each node kind is a record nested in this
 * interface, and {@link Visitor} has one method per kind, so adding a kind without teaching every
 * visitor about it does not compile.
 *
 * <p>Nodes are plain values. Nothing points from a child back to its parent; code that needs the
 * enclosing node passes it down explicitly.
 */
public interface SyntaxNode {

  SourceRange location();

  <R> R accept(Visitor<R> visitor);

  /** The non-null child nodes, in source order. */
  List<SyntaxNode> childNodes();

  default int startChar() {
    return location().beginPos();
  }

  default int endChar() {
    return location().endPos();
  }

  /**
   * Flattens the given parts into a child list. Parts may be nodes, lists of nodes, or null, which
   * are skipped.
   */
  static List<SyntaxNode> nodes(@Nullable Object... parts) {
    ImmutableList.Builder<SyntaxNode> builder = ImmutableList.builder();
    for (Object part : parts) {
      if (part instanceof SyntaxNode) {
        builder.add((SyntaxNode) part);
      } else if (part instanceof List) {
        for (Object element : (List<?>) part) {
          if (element instanceof SyntaxNode) {
            builder.add((SyntaxNode) element);
          } else if (element instanceof Params.OptionalParam) {
            Params.OptionalParam optional = (Params.OptionalParam) element;
            builder.add(optional.name(), optional.value());
          } else if (element instanceof Params.KeywordParam) {
            Params.KeywordParam keyword = (Params.KeywordParam) element;
            builder.add(keyword.name());
            if (keyword.value() != null) {
              builder.add(keyword.value());
            }
          }
        }
      }
    }
    return builder.build();
  }

  // Tokens

  /** A local variable or method name. */
  record Ident(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIdent(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record Const(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConst(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record IVar(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIVar(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record GVar(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGVar(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** {@code $1} or {@code $&}, a regexp match reference. */
  record Backref(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBackref(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record CVar(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCVar(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** A keyword such as {@code nil}, {@code self} or {@code __LINE__}. */
  record Kw(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitKw(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** An operator or punctuation token. */
  record Op(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOp(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** A hash key or keyword parameter, including its trailing colon. */
  record Label(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLabel(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** Raw string content, escapes left as written. */
  record TStringContent(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTStringContent(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  // Literals

  /** An integer literal; the value is the source text. */
  record Int(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInt(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record FloatLiteral(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFloat(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** {@code 1r} or {@code 1.5r}; the value is the source text. */
  record RationalLiteral(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRational(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** {@code 2i} or {@code 1ri}. */
  record Imaginary(String value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitImaginary(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record StringLiteral(List<SyntaxNode> parts, String quote, SourceRange location)
      implements SyntaxNode {
    public boolean interpolates() {
      return !quote.equals("'");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStringLiteral(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parts);
    }
  }

  /** {@code #{...}} inside a string, symbol or regexp. */
  record StringEmbExpr(Statements statements, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStringEmbExpr(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(statements);
    }
  }

  /** Adjacent string literals, {@code "a" "b"}. */
  record StringConcat(SyntaxNode left, SyntaxNode right, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStringConcat(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(left, right);
    }
  }

  /** {@code :foo}, or a bare method name in {@code alias} and {@code undef}. */
  record SymbolLiteral(SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSymbolLiteral(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  /** A quoted symbol such as {@code :"foo#{bar}"}. */
  record DynaSymbol(List<SyntaxNode> parts, String quote, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDynaSymbol(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parts);
    }
  }

  record ArrayLiteral(@Nullable Op lbracket, @Nullable Args contents, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArrayLiteral(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(lbracket, contents);
    }
  }

  record HashLiteral(List<SyntaxNode> assocs, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitHashLiteral(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(assocs);
    }
  }

  /** Hash arguments written without braces. */
  record BareAssocHash(List<SyntaxNode> assocs, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBareAssocHash(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(assocs);
    }
  }

  record Assoc(SyntaxNode key, SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssoc(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(key, value);
    }
  }

  record AssocSplat(SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssocSplat(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  record RangeNode(
      @Nullable SyntaxNode left, Op operator, @Nullable SyntaxNode right, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRange(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(left, operator, right);
    }
  }

  /** A regexp literal; {@code ending} is the closing delimiter plus its flags. */
  record RegexpLiteral(
      String beginning, String ending, List<SyntaxNode> parts, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRegexpLiteral(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parts);
    }
  }

  // Variables and constants

  /** A reference to a variable, constant or keyword value. */
  record VarRef(SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVarRef(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  /** A bare identifier that is not a known local, so it is a method call. */
  record VCall(Ident value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVCall(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  /** The target of an assignment. */
  record VarField(SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVarField(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  /** The name of a class or module. */
  record ConstRef(Const constant, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConstRef(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(constant);
    }
  }

  record ConstPathRef(SyntaxNode parent, Const constant, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConstPathRef(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parent, constant);
    }
  }

  record ConstPathField(SyntaxNode parent, Const constant, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConstPathField(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parent, constant);
    }
  }

  record TopConstRef(Const constant, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTopConstRef(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(constant);
    }
  }

  record TopConstField(Const constant, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTopConstField(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(constant);
    }
  }

  // Calls

  /** {@code a.b}, {@code a&.b(1)} or {@code A::b()}. */
  record CallNode(
      SyntaxNode receiver,
      Op operator,
      SyntaxNode message,
      @Nullable ArgParen arguments,
      SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(receiver, operator, message, arguments);
    }
  }

  /** A receiverless call with parentheses, {@code foo(1)}. */
  record FCall(SyntaxNode value, ArgParen arguments, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFCall(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value, arguments);
    }
  }

  /** A receiverless call without parentheses, {@code foo 1}. */
  record Command(
      SyntaxNode message, Args arguments, @Nullable BlockNode block, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCommand(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(message, arguments, block);
    }
  }

  /** A call with a receiver and without parentheses, {@code a.b 1}. */
  record CommandCall(
      SyntaxNode receiver,
      Op operator,
      SyntaxNode message,
      Args arguments,
      @Nullable BlockNode block,
      SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCommandCall(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(receiver, operator, message, arguments, block);
    }
  }

  /** Parenthesized call arguments; {@code arguments} is {@link Args} or {@link ArgsForward}. */
  record ArgParen(@Nullable SyntaxNode arguments, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArgParen(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(arguments);
    }
  }

  record Args(List<SyntaxNode> parts, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArgs(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parts);
    }
  }

  record ArgStar(@Nullable SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArgStar(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  record ArgBlock(@Nullable SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArgBlock(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  /** {@code ...} in a parameter list or an argument list. */
  record ArgsForward(SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitArgsForward(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record ARef(SyntaxNode collection, @Nullable Args index, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitARef(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(collection, index);
    }
  }

  record ARefField(SyntaxNode collection, @Nullable Args index, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitARefField(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(collection, index);
    }
  }

  /** An attribute assignment target, {@code a.b} in {@code a.b = 1}. */
  record Field(SyntaxNode parent, Op operator, SyntaxNode name, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitField(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parent, operator, name);
    }
  }

  record MethodAddBlock(SyntaxNode call, BlockNode block, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMethodAddBlock(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(call, block);
    }
  }

  /**
   * A block. {@code opening} is the {@code {} operator or the {@code do} keyword; the body is
   * {@link Statements} for braces and {@link BodyStmt} for {@code do}.
   */
  record BlockNode(
      SyntaxNode opening, @Nullable BlockVar blockVar, SyntaxNode bodystmt, SourceRange location)
      implements SyntaxNode {
    public boolean keywords() {
      return opening instanceof Kw;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBlock(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(opening, blockVar, bodystmt);
    }
  }

  /** Block parameters between pipes, with block-local names after a semicolon. */
  record BlockVar(Params params, List<Ident> locals, SourceRange location) implements SyntaxNode {
    /** Whether this is a lone required parameter, which the block may auto-splat. */
    public boolean arg0() {
      return params.requireds().size() == 1
          && params.optionals().isEmpty()
          && params.rest() == null
          && params.posts().isEmpty()
          && params.keywords().isEmpty()
          && params.keywordRest() == null
          && params.block() == null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBlockVar(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(params, locals);
    }
  }

  /** {@code -> (x) { x }}; params is a {@link LambdaVar} or a {@link Paren} around one. */
  record Lambda(SyntaxNode params, SyntaxNode statements, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLambda(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(params, statements);
    }
  }

  record LambdaVar(Params params, List<Ident> locals, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLambdaVar(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(params, locals);
    }
  }

  // Operators

  record Binary(SyntaxNode left, String operator, SyntaxNode right, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(left, right);
    }
  }

  record Unary(Op operator, SyntaxNode statement, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(operator, statement);
    }
  }

  /** The {@code not} keyword operator. */
  record Not(@Nullable SyntaxNode statement, boolean parentheses, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNot(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(statement);
    }
  }

  record Assign(SyntaxNode target, SyntaxNode value, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(target, value);
    }
  }

  record OpAssign(SyntaxNode target, Op operator, SyntaxNode value, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOpAssign(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(target, operator, value);
    }
  }

  /** {@code a, b = 1, 2}. */
  record MAssign(MLHS target, SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMAssign(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(target, value);
    }
  }

  /** The targets of a multiple assignment, each a field or an {@link ArgStar} of one. */
  record MLHS(List<SyntaxNode> parts, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMLHS(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parts);
    }
  }

  /** Several values, or a splat, on the right of an assignment. */
  record MRHS(List<SyntaxNode> parts, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMRHS(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(parts);
    }
  }

  record Defined(SyntaxNode value, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDefined(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value);
    }
  }

  // Control flow

  record IfNode(
      SyntaxNode predicate,
      Statements statements,
      @Nullable SyntaxNode consequent,
      boolean modifier,
      SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return modifier ? nodes(statements, predicate) : nodes(predicate, statements, consequent);
    }
  }

  record UnlessNode(
      SyntaxNode predicate,
      Statements statements,
      @Nullable Else consequent,
      boolean modifier,
      SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnless(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return modifier ? nodes(statements, predicate) : nodes(predicate, statements, consequent);
    }
  }

  record Elsif(
      SyntaxNode predicate,
      Statements statements,
      @Nullable SyntaxNode consequent,
      SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitElsif(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(predicate, statements, consequent);
    }
  }

  record Else(Kw keyword, Statements statements, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitElse(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(keyword, statements);
    }
  }

  /** The ternary operator. */
  record IfOp(SyntaxNode predicate, SyntaxNode truthy, SyntaxNode falsy, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIfOp(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(predicate, truthy, falsy);
    }
  }

  record WhileNode(
      SyntaxNode predicate, Statements statements, boolean modifier, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return modifier ? nodes(statements, predicate) : nodes(predicate, statements);
    }
  }

  record UntilNode(
      SyntaxNode predicate, Statements statements, boolean modifier, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUntil(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return modifier ? nodes(statements, predicate) : nodes(predicate, statements);
    }
  }

  record For(SyntaxNode index, SyntaxNode collection, Statements statements, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFor(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(index, collection, statements);
    }
  }

  record Case(@Nullable SyntaxNode value, When consequent, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCase(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(value, consequent);
    }
  }

  /** A {@code when} clause; the consequent is the next {@link When} or the {@link Else}. */
  record When(
      Args arguments, Statements statements, @Nullable SyntaxNode consequent, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitWhen(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(arguments, statements, consequent);
    }
  }

  /** Parentheses around an expression, or around the parameters of a method definition. */
  record Paren(Op lparen, @Nullable SyntaxNode contents, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitParen(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(lparen, contents);
    }
  }

  // Definitions

  /**
   * A method definition. The body is a {@link BodyStmt}, except for endless definitions, where it
   * is the expression after {@code =}.
   */
  record DefNode(
      @Nullable SyntaxNode target,
      @Nullable Op operator,
      SyntaxNode name,
      @Nullable SyntaxNode params,
      SyntaxNode bodystmt,
      SourceRange location)
      implements SyntaxNode {
    public boolean endless() {
      return !(bodystmt instanceof BodyStmt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDef(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(target, operator, name, params, bodystmt);
    }
  }

  /** A parameter list, grouped by parameter kind as Ruby orders them. */
  record Params(
      List<Ident> requireds,
      List<OptionalParam> optionals,
      @Nullable RestParam rest,
      List<Ident> posts,
      List<KeywordParam> keywords,
      @Nullable SyntaxNode keywordRest,
      @Nullable BlockArg block,
      SourceRange location)
      implements SyntaxNode {

    /** {@code name = value}. */
    public record OptionalParam(Ident name, SyntaxNode value) {}

    /** {@code name:} or {@code name: value}. */
    public record KeywordParam(Label name, @Nullable SyntaxNode value) {}

    public boolean empty() {
      return requireds.isEmpty()
          && optionals.isEmpty()
          && rest == null
          && posts.isEmpty()
          && keywords.isEmpty()
          && keywordRest == null
          && block == null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitParams(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(requireds, optionals, rest, posts, keywords, keywordRest, block);
    }
  }

  record RestParam(@Nullable Ident name, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRestParam(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(name);
    }
  }

  record KwRestParam(@Nullable Ident name, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitKwRestParam(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(name);
    }
  }

  record BlockArg(@Nullable Ident name, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBlockArg(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(name);
    }
  }

  record ClassDeclaration(
      SyntaxNode constant,
      @Nullable SyntaxNode superclass,
      BodyStmt bodystmt,
      SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitClass(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(constant, superclass, bodystmt);
    }
  }

  /** {@code class << self}. */
  record SClass(SyntaxNode target, BodyStmt bodystmt, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSClass(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(target, bodystmt);
    }
  }

  record ModuleDeclaration(SyntaxNode constant, BodyStmt bodystmt, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitModule(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(constant, bodystmt);
    }
  }

  // Bodies

  record Program(Statements statements, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitProgram(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(statements);
    }
  }

  /**
   * A statement sequence. An empty sequence has a zero-width location at the token that closes
   * it.
   */
  record Statements(List<SyntaxNode> body, SourceRange location) implements SyntaxNode {
    public boolean empty() {
      return body.isEmpty();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStatements(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(body);
    }
  }

  /** The body of a definition, block or {@code begin}, with its optional clauses. */
  record BodyStmt(
      Statements statements,
      @Nullable Rescue rescueClause,
      @Nullable Else elseClause,
      @Nullable Ensure ensureClause,
      SourceRange location)
      implements SyntaxNode {
    public boolean empty() {
      return statements.empty() && rescueClause == null && elseClause == null
          && ensureClause == null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBodyStmt(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(statements, rescueClause, elseClause, ensureClause);
    }
  }

  record Begin(BodyStmt bodystmt, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBegin(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(bodystmt);
    }
  }

  /** A {@code rescue} clause; the consequent is the next clause in the chain. */
  record Rescue(
      @Nullable RescueEx exception,
      Statements statements,
      @Nullable Rescue consequent,
      SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRescue(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(exception, statements, consequent);
    }
  }

  /** The exception list and variable of a rescue clause. */
  record RescueEx(
      List<SyntaxNode> exceptions, @Nullable SyntaxNode variable, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRescueEx(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(exceptions, variable);
    }
  }

  record Ensure(Kw keyword, Statements statements, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEnsure(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(keyword, statements);
    }
  }

  /** {@code statement rescue value}. */
  record RescueMod(SyntaxNode statement, SyntaxNode value, SourceRange location)
      implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRescueMod(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(statement, value);
    }
  }

  // Jumps

  record ReturnNode(@Nullable Args arguments, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReturn(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(arguments);
    }
  }

  record Break(@Nullable Args arguments, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBreak(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(arguments);
    }
  }

  record Next(@Nullable Args arguments, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNext(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(arguments);
    }
  }

  record Redo(SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRedo(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  record Retry(SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRetry(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  /** {@code yield}; arguments are null, {@link Args}, or a {@link Paren} around {@link Args}. */
  record YieldNode(@Nullable SyntaxNode arguments, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitYield(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(arguments);
    }
  }

  /** {@code super} with arguments, either {@link ArgParen} or {@link Args}. */
  record Super(SyntaxNode arguments, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSuper(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(arguments);
    }
  }

  /** A bare {@code super}, which forwards the current arguments. */
  record ZSuper(SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitZSuper(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return ImmutableList.of();
    }
  }

  // Aliases

  /** {@code alias foo bar}; both sides are symbols. */
  record Alias(SyntaxNode left, SyntaxNode right, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAlias(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(left, right);
    }
  }

  /** {@code alias $foo $bar}. */
  record VarAlias(GVar left, GVar right, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVarAlias(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(left, right);
    }
  }

  record Undef(List<SyntaxNode> symbols, SourceRange location) implements SyntaxNode {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUndef(this);
    }

    @Override
    public List<SyntaxNode> childNodes() {
      return nodes(symbols);
    }
  }
}
