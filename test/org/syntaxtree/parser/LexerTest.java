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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.source.SourceBuffer;

@RunWith(JUnit4.class)
public final class LexerTest {

  private static ImmutableList<Token> lex(String source) {
    return new Lexer(new SourceBuffer(source)).tokenize();
  }

  private static ImmutableList<TokenType> types(String source) {
    return lex(source).stream().map(Token::type).collect(toImmutableList());
  }

  private static ImmutableList<String> values(String source) {
    return lex(source).stream().map(Token::value).collect(toImmutableList());
  }

  @Test
  public void testIdentifiersKeywordsAndConstants() {
    assertThat(types("foo if Bar"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.KEYWORD, TokenType.CONSTANT, TokenType.EOF)
        .inOrder();
    assertThat(values("empty? save!")).containsExactly("empty?", "save!", "").inOrder();
  }

  @Test
  public void testVariables() {
    assertThat(types("@a @@b $c"))
        .containsExactly(TokenType.IVAR, TokenType.CVAR, TokenType.GVAR, TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testNumbers() {
    assertThat(types("1 1.5 1e3 0x1f 1_000"))
        .containsExactly(
            TokenType.INTEGER,
            TokenType.FLOAT,
            TokenType.FLOAT,
            TokenType.INTEGER,
            TokenType.INTEGER,
            TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testNumericSuffixes() {
    assertThat(types("1r 1.5r 2i 1ri 1e3i"))
        .containsExactly(
            TokenType.RATIONAL,
            TokenType.RATIONAL,
            TokenType.IMAGINARY,
            TokenType.IMAGINARY,
            TokenType.IMAGINARY,
            TokenType.EOF)
        .inOrder();
    assertThat(values("1ri")).containsExactly("1ri", "").inOrder();
  }

  @Test
  public void testSuffixNeedsAWordBoundary() {
    assertThat(types("1if"))
        .containsExactly(TokenType.INTEGER, TokenType.KEYWORD, TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testRegexpReferences() {
    assertThat(types("$1 $12 $& $` $' $+ $~ $0"))
        .containsExactly(
            TokenType.BACKREF,
            TokenType.BACKREF,
            TokenType.BACKREF,
            TokenType.BACKREF,
            TokenType.BACKREF,
            TokenType.BACKREF,
            TokenType.GVAR,
            TokenType.GVAR,
            TokenType.EOF)
        .inOrder();
    assertThat(values("$12")).containsExactly("$12", "").inOrder();
  }

  @Test
  public void testQuotedLabelEnd() {
    assertThat(types("{'b': 2}"))
        .containsExactly(
            TokenType.OPERATOR,
            TokenType.STRING_BEGIN,
            TokenType.STRING_CONTENT,
            TokenType.LABEL_END,
            TokenType.INTEGER,
            TokenType.OPERATOR,
            TokenType.EOF)
        .inOrder();
    Token labelEnd = lex("{\"b\": 2}").get(3);
    assertThat(labelEnd.value()).isEqualTo("\":");
    assertThat(labelEnd.start()).isEqualTo(3);
    assertThat(labelEnd.end()).isEqualTo(5);
  }

  @Test
  public void testQuotedLabelNeedsALabelPosition() {
    assertThat(types("x = 'b'"))
        .containsExactly(
            TokenType.IDENTIFIER,
            TokenType.OPERATOR,
            TokenType.STRING_BEGIN,
            TokenType.STRING_CONTENT,
            TokenType.STRING_END,
            TokenType.EOF)
        .inOrder();
    assertThat(types("{'b'::C => 1}")).doesNotContain(TokenType.LABEL_END);
  }

  @Test
  public void testSymbolValueExcludesColon() {
    Token symbol = lex(":foo").get(0);
    assertThat(symbol.type()).isEqualTo(TokenType.SYMBOL);
    assertThat(symbol.value()).isEqualTo("foo");
    assertThat(symbol.start()).isEqualTo(0);
    assertThat(symbol.end()).isEqualTo(4);

    assertThat(values(":[] :<=>")).containsExactly("[]", "<=>", "").inOrder();
  }

  @Test
  public void testLabelIncludesColon() {
    ImmutableList<Token> tokens = lex("{ foo: 1 }");
    assertThat(tokens.get(1).type()).isEqualTo(TokenType.LABEL);
    assertThat(tokens.get(1).value()).isEqualTo("foo:");
  }

  @Test
  public void testTernaryColonIsAnOperator() {
    assertThat(values("a ? b : c")).containsExactly("a", "?", "b", ":", "c", "").inOrder();
  }

  @Test
  public void testInterpolatedString() {
    assertThat(types("\"a#{b}c\""))
        .containsExactly(
            TokenType.STRING_BEGIN,
            TokenType.STRING_CONTENT,
            TokenType.EMBEXPR_BEGIN,
            TokenType.IDENTIFIER,
            TokenType.EMBEXPR_END,
            TokenType.STRING_CONTENT,
            TokenType.STRING_END,
            TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testRegexpEndCarriesFlags() {
    ImmutableList<Token> tokens = lex("/foo/im");
    assertThat(tokens.get(0).type()).isEqualTo(TokenType.REGEXP_BEGIN);
    assertThat(tokens.get(2).type()).isEqualTo(TokenType.REGEXP_END);
    assertThat(tokens.get(2).value()).isEqualTo("/im");
  }

  @Test
  public void testSlashAfterValueIsDivision() {
    assertThat(types("a / b"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER, TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testNewlinesOnlyWhereAStatementCanEnd() {
    assertThat(types("a +\nb"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER, TokenType.EOF)
        .inOrder();
    assertThat(types("a\nb"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testLeadingDotContinuesTheStatement() {
    assertThat(types("foo\n  .bar"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.IDENTIFIER, TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testCommentsAreSkipped() {
    assertThat(values("a # note\nb")).containsExactly("a", "\n", "b", "").inOrder();
  }

  @Test
  public void testTrailingNewlineIsDropped() {
    assertThat(types("a\n")).containsExactly(TokenType.IDENTIFIER, TokenType.EOF).inOrder();
  }

  @Test
  public void testSpaceBefore() {
    ImmutableList<Token> tokens = lex("foo (1) foo(1)");
    assertThat(tokens.get(1).spaceBefore()).isTrue();
    assertThat(tokens.get(5).spaceBefore()).isFalse();
  }

  @Test
  public void testSemicolon() {
    assertThat(types("a; b"))
        .containsExactly(
            TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.IDENTIFIER, TokenType.EOF)
        .inOrder();
  }

  @Test
  public void testBareAtSignIsAnError() {
    ParseException e = assertThrows(ParseException.class, () -> lex("@ foo"));
    assertThat(e.getLine()).isEqualTo(1);
    assertThat(e.getColumn()).isEqualTo(0);
    assertThat(e).hasMessageThat().startsWith("1:0: ");
  }

  @Test
  public void testUnterminatedInterpolation() {
    assertThrows(ParseException.class, () -> lex("\"#{a"));
  }
}
