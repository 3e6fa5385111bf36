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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.base.CaseFormat;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.source.SourceRange;

/**
 * The location information of a {@link Node}, modeled on {@code Parser::Source::Map} and its
 * subclasses. A map has a {@link Kind}, an optional expression range, and the named {@link Part}s
 * its kind allows.
 *
 * <p>A map does not know which node owns it. Equality covers the kind, the expression and every
 * part, and nothing else.
 */
public final class SourceMap {

  /** The parser gem map class this map stands for. */
  public enum Kind {
    MAP(),
    COLLECTION(Part.BEGIN, Part.END),
    CONDITION(Part.KEYWORD, Part.BEGIN, Part.ELSE, Part.END),
    CONSTANT(Part.DOUBLE_COLON, Part.NAME, Part.OPERATOR),
    DEFINITION(Part.KEYWORD, Part.OPERATOR, Part.NAME, Part.END),
    FOR(Part.KEYWORD, Part.IN, Part.BEGIN, Part.END),
    INDEX(Part.BEGIN, Part.END, Part.OPERATOR),
    KEYWORD(Part.KEYWORD, Part.BEGIN, Part.END),
    METHOD_DEFINITION(Part.KEYWORD, Part.OPERATOR, Part.NAME, Part.END, Part.ASSIGNMENT),
    OPERATOR(Part.OPERATOR),
    RESCUE_BODY(Part.KEYWORD, Part.ASSOC, Part.BEGIN),
    SEND(Part.DOT, Part.SELECTOR, Part.BEGIN, Part.END, Part.OPERATOR),
    TERNARY(Part.QUESTION, Part.COLON),
    VARIABLE(Part.NAME, Part.OPERATOR);

    private final ImmutableSet<Part> parts;

    Kind(Part... parts) {
      this.parts = ImmutableSet.copyOf(parts);
    }

    public ImmutableSet<Part> getParts() {
      return parts;
    }

    String displayName() {
      return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
    }
  }

  /** A named sub-range of a map. */
  public enum Part {
    KEYWORD,
    BEGIN,
    END,
    ELSE,
    OPERATOR,
    SELECTOR,
    DOT,
    NAME,
    DOUBLE_COLON,
    QUESTION,
    COLON,
    ASSOC,
    ASSIGNMENT,
    IN;

    public String displayName() {
      return Ascii.toLowerCase(name());
    }
  }

  private final Kind kind;
  private final @Nullable SourceRange expression;
  private final ImmutableMap<Part, SourceRange> parts;

  private SourceMap(
      Kind kind, @Nullable SourceRange expression, Map<Part, SourceRange> parts) {
    for (Part part : parts.keySet()) {
      checkArgument(kind.parts.contains(part), "%s map has no %s", kind, part);
    }
    this.kind = checkNotNull(kind);
    this.expression = expression;
    this.parts = Maps.immutableEnumMap(parts);
  }

  private static SourceMap create(
      Kind kind, @Nullable SourceRange expression, Object... namedRanges) {
    EnumMap<Part, SourceRange> parts = new EnumMap<>(Part.class);
    for (int i = 0; i < namedRanges.length; i += 2) {
      Object range = namedRanges[i + 1];
      if (range != null) {
        parts.put((Part) namedRanges[i], (SourceRange) range);
      }
    }
    return new SourceMap(kind, expression, parts);
  }

  public static SourceMap map(@Nullable SourceRange expression) {
    return create(Kind.MAP, expression);
  }

  public static SourceMap collection(
      @Nullable SourceRange begin, @Nullable SourceRange end, @Nullable SourceRange expression) {
    return create(Kind.COLLECTION, expression, Part.BEGIN, begin, Part.END, end);
  }

  public static SourceMap condition(
      @Nullable SourceRange keyword,
      @Nullable SourceRange begin,
      @Nullable SourceRange elseRange,
      @Nullable SourceRange end,
      @Nullable SourceRange expression) {
    return create(
        Kind.CONDITION,
        expression,
        Part.KEYWORD, keyword,
        Part.BEGIN, begin,
        Part.ELSE, elseRange,
        Part.END, end);
  }

  public static SourceMap constant(
      @Nullable SourceRange doubleColon, SourceRange name, SourceRange expression) {
    return create(Kind.CONSTANT, expression, Part.DOUBLE_COLON, doubleColon, Part.NAME, name);
  }

  public static SourceMap definition(
      SourceRange keyword,
      @Nullable SourceRange operator,
      @Nullable SourceRange name,
      SourceRange end,
      SourceRange expression) {
    return create(
        Kind.DEFINITION,
        expression,
        Part.KEYWORD, keyword,
        Part.OPERATOR, operator,
        Part.NAME, name,
        Part.END, end);
  }

  public static SourceMap forLoop(
      SourceRange keyword,
      SourceRange in,
      @Nullable SourceRange begin,
      SourceRange end,
      SourceRange expression) {
    return create(
        Kind.FOR,
        expression,
        Part.KEYWORD, keyword,
        Part.IN, in,
        Part.BEGIN, begin,
        Part.END, end);
  }

  public static SourceMap index(SourceRange begin, SourceRange end, SourceRange expression) {
    return create(Kind.INDEX, expression, Part.BEGIN, begin, Part.END, end);
  }

  public static SourceMap keyword(
      SourceRange keyword,
      @Nullable SourceRange begin,
      @Nullable SourceRange end,
      SourceRange expression) {
    return create(
        Kind.KEYWORD, expression, Part.KEYWORD, keyword, Part.BEGIN, begin, Part.END, end);
  }

  public static SourceMap methodDefinition(
      SourceRange keyword,
      @Nullable SourceRange operator,
      SourceRange name,
      @Nullable SourceRange end,
      @Nullable SourceRange assignment,
      SourceRange expression) {
    return create(
        Kind.METHOD_DEFINITION,
        expression,
        Part.KEYWORD, keyword,
        Part.OPERATOR, operator,
        Part.NAME, name,
        Part.END, end,
        Part.ASSIGNMENT, assignment);
  }

  public static SourceMap operator(@Nullable SourceRange operator, SourceRange expression) {
    return create(Kind.OPERATOR, expression, Part.OPERATOR, operator);
  }

  public static SourceMap rescueBody(
      SourceRange keyword,
      @Nullable SourceRange assoc,
      @Nullable SourceRange begin,
      SourceRange expression) {
    return create(
        Kind.RESCUE_BODY,
        expression,
        Part.KEYWORD, keyword,
        Part.ASSOC, assoc,
        Part.BEGIN, begin);
  }

  public static SourceMap send(
      @Nullable SourceRange dot,
      @Nullable SourceRange selector,
      @Nullable SourceRange begin,
      @Nullable SourceRange end,
      SourceRange expression) {
    return create(
        Kind.SEND,
        expression,
        Part.DOT, dot,
        Part.SELECTOR, selector,
        Part.BEGIN, begin,
        Part.END, end);
  }

  public static SourceMap ternary(
      SourceRange question, SourceRange colon, SourceRange expression) {
    return create(Kind.TERNARY, expression, Part.QUESTION, question, Part.COLON, colon);
  }

  public static SourceMap variable(@Nullable SourceRange name, SourceRange expression) {
    return create(Kind.VARIABLE, expression, Part.NAME, name);
  }

  public Kind getKind() {
    return kind;
  }

  public @Nullable SourceRange getExpression() {
    return expression;
  }

  public @Nullable SourceRange get(Part part) {
    return parts.get(part);
  }

  public ImmutableMap<Part, SourceRange> getParts() {
    return parts;
  }

  public @Nullable SourceRange getBegin() {
    return parts.get(Part.BEGIN);
  }

  public @Nullable SourceRange getEnd() {
    return parts.get(Part.END);
  }

  public @Nullable SourceRange getKeyword() {
    return parts.get(Part.KEYWORD);
  }

  public @Nullable SourceRange getOperator() {
    return parts.get(Part.OPERATOR);
  }

  public @Nullable SourceRange getName() {
    return parts.get(Part.NAME);
  }

  public @Nullable SourceRange getSelector() {
    return parts.get(Part.SELECTOR);
  }

  /** Returns a copy of this map with a different expression range. */
  public SourceMap withExpression(@Nullable SourceRange newExpression) {
    return new SourceMap(kind, newExpression, parts);
  }

  /** Returns a copy of this map with the operator part set, for assignments. */
  public SourceMap withOperator(SourceRange operator) {
    checkArgument(kind.parts.contains(Part.OPERATOR), "%s map has no operator", kind);
    EnumMap<Part, SourceRange> newParts = new EnumMap<>(Part.class);
    newParts.putAll(parts);
    newParts.put(Part.OPERATOR, operator);
    return new SourceMap(kind, expression, newParts);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SourceMap)) {
      return false;
    }
    SourceMap that = (SourceMap) o;
    return kind == that.kind
        && Objects.equals(expression, that.expression)
        && parts.equals(that.parts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, expression, parts);
  }

  @Override
  public String toString() {
    MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(kind.displayName());
    for (Map.Entry<Part, SourceRange> entry : parts.entrySet()) {
      helper.add(entry.getKey().displayName(), entry.getValue());
    }
    return helper.add("expression", expression).toString();
  }
}
