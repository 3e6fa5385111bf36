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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.ast.SyntaxNode.Op;
import org.syntaxtree.ast.SyntaxNode.Program;
import org.syntaxtree.parser.SyntaxTreeParser;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.whitequark.Node;
import org.syntaxtree.whitequark.RubyVersion;
import org.syntaxtree.whitequark.SourceMap;
import org.syntaxtree.whitequark.WhitequarkParser;

/** Tests for {@link ParserTranslator}. */
@RunWith(JUnit4.class)
public final class ParserTranslatorTest {

  private static @Nullable Node translate(String source) {
    return translate(source, ForwardArgsStyle.MODERN);
  }

  private static @Nullable Node translate(String source, ForwardArgsStyle style) {
    SourceBuffer buffer = new SourceBuffer(source);
    Program program = new SyntaxTreeParser(buffer).parseProgram();
    return new ParserTranslator(buffer, style).translate(program);
  }

  /** Checks the translation against the reference parser, locations included. */
  private static void assertTranslatesLikeReference(String source) {
    SourceBuffer buffer = new SourceBuffer(source);
    Node expected = WhitequarkParser.forVersion(RubyVersion.LATEST).parse(buffer);
    Node actual = translate(source);
    assertWithMessage("expected:\n%s\nactual:\n%s", expected, actual)
        .that(actual.isEquivalentTo(expected, true))
        .isTrue();
  }

  @Test
  public void testEmptyProgram() {
    assertThat(translate("")).isNull();
    assertThat(translate("\n\n")).isNull();
  }

  @Test
  public void testAlias() {
    assertThat(translate("alias foo bar").toSexp())
        .isEqualTo("(alias\n  (sym :foo)\n  (sym :bar))");
    assertTranslatesLikeReference("alias foo bar\n");
    assertTranslatesLikeReference("alias :foo :bar\n");
  }

  @Test
  public void testGlobalAlias() {
    assertThat(translate("alias $foo $bar").toSexp())
        .isEqualTo("(alias\n  (gvar :$foo)\n  (gvar :$bar))");
    assertTranslatesLikeReference("alias $foo $bar\n");
  }

  @Test
  public void testStatements() {
    assertThat(translate("foo\nbar").toSexp())
        .isEqualTo("(begin\n  (send nil :foo)\n  (send nil :bar))");
    assertTranslatesLikeReference("foo; bar\n");
  }

  @Test
  public void testLocalVariables() {
    assertThat(translate("foo = 1; foo").toSexp())
        .isEqualTo("(begin\n  (lvasgn :foo\n    (int 1))\n  (lvar :foo))");
  }

  @Test
  public void testCalls() {
    assertTranslatesLikeReference("foo.bar(1, *baz, &blk)\n");
    assertTranslatesLikeReference("foo&.bar\n");
    assertTranslatesLikeReference("foo.bar baz\n");
    assertTranslatesLikeReference("fun(foo: 1)\n");
    assertTranslatesLikeReference("foo[1, 2] = 3\n");
  }

  @Test
  public void testKeywordArguments() {
    assertThat(translate("fun(foo: 1)").toSexp())
        .isEqualTo("(send nil :fun\n  (kwargs\n    (pair\n      (sym :foo)\n      (int 1))))");
  }

  @Test
  public void testBlocks() {
    assertTranslatesLikeReference("foo { |x| x }\n");
    assertTranslatesLikeReference("foo do |a, b = 1, *c, &d| end\n");
    assertTranslatesLikeReference("foo { || }\n");
    assertTranslatesLikeReference("->(a; b) { a }\n");
  }

  @Test
  public void testSingleBlockParameterIsProcarg0() {
    assertThat(translate("foo { |x| }").toSexp())
        .isEqualTo("(block\n  (send nil :foo)\n  (args\n    (procarg0\n      (arg :x))) nil)");
  }

  @Test
  public void testDefinitions() {
    assertTranslatesLikeReference("def foo(a, b = 1, *c, d:, e: 2, **f, &g); end\n");
    assertTranslatesLikeReference("def self.foo; end\n");
    assertTranslatesLikeReference("def foo = 42\n");
    assertTranslatesLikeReference("class Foo < Bar; def baz; end; end\n");
    assertTranslatesLikeReference("module A::B; end\n");
    assertTranslatesLikeReference("class << self; end\n");
  }

  @Test
  public void testConditionalsAndLoops() {
    assertTranslatesLikeReference("if foo; bar; elsif baz; 1; else 2; end\n");
    assertTranslatesLikeReference("unless foo then bar end\n");
    assertTranslatesLikeReference("bar if foo\n");
    assertTranslatesLikeReference("foo ? 1 : 2\n");
    assertTranslatesLikeReference("while foo do bar end\n");
    assertTranslatesLikeReference("begin bar end until foo\n");
    assertTranslatesLikeReference("for a in b; a; end\n");
    assertTranslatesLikeReference("case foo; when 1, 2 then bar; else baz; end\n");
  }

  @Test
  public void testPostConditionLoop() {
    assertThat(translate("begin meth end while foo").toSexp())
        .isEqualTo("(while_post\n  (send nil :foo)\n  (kwbegin\n    (send nil :meth)))");
  }

  @Test
  public void testExceptionHandling() {
    assertTranslatesLikeReference("begin; a; rescue Foo => e; b; else; c; ensure; d; end\n");
    assertTranslatesLikeReference("a rescue b\n");
    assertTranslatesLikeReference("def foo; a; rescue; b; end\n");
  }

  @Test
  public void testLiterals() {
    assertTranslatesLikeReference("[1, 2.5, :sym, 'str', nil, true, self]\n");
    assertTranslatesLikeReference("{ 1 => 2, foo: \"a#{b}c\", **rest }\n");
    assertTranslatesLikeReference("/ab#{c}/im\n");
    assertTranslatesLikeReference(":\"foo#{bar}\"\n");
    assertTranslatesLikeReference("'foo' \"bar\"\n");
    assertTranslatesLikeReference("1..2; 1...; ..3\n");
  }

  @Test
  public void testUnarySignIsPartOfTheNumber() {
    assertThat(translate("-2 ** 10").toSexp())
        .isEqualTo("(send\n  (int -2) :**\n  (int 10))");
  }

  @Test
  public void testRescueModifierWrapsAssignedValue() {
    assertThat(translate("x = 1 rescue 2").toSexp())
        .isEqualTo("(lvasgn :x\n  (rescue\n    (int 1)\n"
            + "    (resbody nil nil\n      (int 2)) nil))");
    assertThat(translate("a += 1 rescue 2").toSexp())
        .isEqualTo("(op_asgn\n  (lvasgn :a) :+\n  (rescue\n    (int 1)\n"
            + "    (resbody nil nil\n      (int 2)) nil))");
    assertTranslatesLikeReference("x = 1 rescue 2\n");
    assertTranslatesLikeReference("a += 1 rescue 2\n");
    assertTranslatesLikeReference("foo.bar = baz rescue nil\n");
    assertTranslatesLikeReference("a, b = c rescue d\n");
  }

  @Test
  public void testMultipleAssignment() {
    assertThat(translate("a, b = 1, 2").toSexp())
        .isEqualTo("(masgn\n  (mlhs\n    (lvasgn :a)\n    (lvasgn :b))\n"
            + "  (array\n    (int 1)\n    (int 2)))");
    assertThat(translate("a, *b = c").toSexp())
        .isEqualTo("(masgn\n  (mlhs\n    (lvasgn :a)\n    (splat\n      (lvasgn :b)))\n"
            + "  (send nil :c))");
    assertTranslatesLikeReference("a, b = 1, 2\n");
    assertTranslatesLikeReference("a, = foo\n");
    assertTranslatesLikeReference("*a, b = c\n");
    assertTranslatesLikeReference("a, * = *b\n");
    assertTranslatesLikeReference("@a, $b, C = 1, *d\n");
    assertTranslatesLikeReference("foo.bar, baz[0] = 1, 2\n");
  }

  @Test
  public void testArrayAssignment() {
    assertThat(translate("a = *b").toSexp())
        .isEqualTo("(lvasgn :a\n  (array\n    (splat\n      (send nil :b))))");
    assertThat(translate("a = 1, 2").toSexp())
        .isEqualTo("(lvasgn :a\n  (array\n    (int 1)\n    (int 2)))");
    assertTranslatesLikeReference("a = *b\n");
    assertTranslatesLikeReference("a = *b, 1\n");
    assertTranslatesLikeReference("a = 1, *b\n");
  }

  @Test
  public void testRegexpReferences() {
    assertThat(translate("$1").toSexp()).isEqualTo("(nth_ref 1)");
    assertThat(translate("$&").toSexp()).isEqualTo("(back_ref :$&)");
    assertTranslatesLikeReference("$1; $12; $&; $`; $'; $+\n");
    assertTranslatesLikeReference("foo $1\n");
  }

  @Test
  public void testDoubleColonCall() {
    assertThat(translate("foo::bar").toSexp()).isEqualTo("(send\n  (send nil :foo) :bar)");
    Node call = translate("foo::bar(1)");
    assertThat(call.getLocation().get(SourceMap.Part.DOT).toString()).isEqualTo("3...5");
    assertTranslatesLikeReference("foo::bar\n");
    assertTranslatesLikeReference("Foo::Bar(1)\n");
    assertTranslatesLikeReference("foo::bar baz\n");
    assertTranslatesLikeReference("Foo::Bar\n");
  }

  @Test
  public void testQuotedLabels() {
    assertThat(translate("{a: 1, 'b': 2}").toSexp())
        .isEqualTo("(hash\n  (pair\n    (sym :a)\n    (int 1))\n"
            + "  (pair\n    (sym :b)\n    (int 2)))");
    Node pair = translate("{'b': 2}").getNode(0);
    assertThat(pair.getLocation().getOperator().toString()).isEqualTo("4...5");
    assertThat(pair.getExpression().toString()).isEqualTo("1...7");
    Node key = pair.getNode(0);
    assertThat(key.getLocation().getBegin().toString()).isEqualTo("1...2");
    assertThat(key.getLocation().getEnd().toString()).isEqualTo("3...4");
    assertThat(key.getExpression().toString()).isEqualTo("1...4");
    assertTranslatesLikeReference("{'b': 2}\n");
    assertTranslatesLikeReference("{\"a#{b}\": 1}\n");
    assertTranslatesLikeReference("foo(\"a\": 1, 'b': 2)\n");
  }

  @Test
  public void testRationalAndImaginary() {
    assertThat(translate("1r").toSexp()).isEqualTo("(rational (1/1))");
    assertThat(translate("1.5r").toSexp()).isEqualTo("(rational (3/2))");
    assertThat(translate("1i").toSexp()).isEqualTo("(complex (0+1i))");
    assertThat(translate("-2.5i").toSexp()).isEqualTo("(complex (0-2.5i))");
    assertThat(translate("-3r").toSexp()).isEqualTo("(rational (-3/1))");
    assertThat(translate("1ri").toSexp()).isEqualTo("(complex (0+(1/1)*i))");
    assertTranslatesLikeReference("[1r, 1.5r, 2i, 2.5i, 1ri, -1r, -2i, 0x10r]\n");
  }

  @Test
  public void testLocationsMatchTheGem() {
    Node alias = translate("alias foo bar");
    assertThat(alias.getExpression().toString()).isEqualTo("0...13");
    assertThat(alias.getLocation().getKeyword().toString()).isEqualTo("0...5");

    Node assign = translate("x = 1");
    assertThat(assign.getLocation().getOperator().toString()).isEqualTo("2...3");
    assertThat(assign.getLocation().getName().toString()).isEqualTo("0...1");
    assertThat(assign.getExpression().toString()).isEqualTo("0...5");

    Node opAssign = translate("a += 1");
    assertThat(opAssign.getLocation().getOperator().toString()).isEqualTo("2...4");
    assertThat(opAssign.getExpression().toString()).isEqualTo("0...6");

    Node negative = translate("-2.5");
    assertThat(negative.getLocation().getOperator().toString()).isEqualTo("0...1");
    assertThat(negative.getExpression().toString()).isEqualTo("0...4");

    Node masgn = translate("a, b = 1, 2");
    assertThat(masgn.getLocation().getOperator().toString()).isEqualTo("5...6");
    assertThat(masgn.getExpression().toString()).isEqualTo("0...11");
    assertThat(masgn.getNode(0).getExpression().toString()).isEqualTo("0...4");
    assertThat(masgn.getNode(1).getLocation().getBegin()).isNull();
    assertThat(masgn.getNode(1).getExpression().toString()).isEqualTo("7...11");
  }

  @Test
  public void testClauseLocationsJoinKeywordAndBody() {
    Node when = translate("case foo; when 1 then bar; end").getNode(1);
    assertThat(when.getLocation().getKeyword().toString()).isEqualTo("10...14");
    assertThat(when.getLocation().getBegin().toString()).isEqualTo("17...21");
    assertThat(when.getExpression().toString()).isEqualTo("10...25");

    Node rescue = translate("foo rescue bar");
    assertThat(rescue.getExpression().toString()).isEqualTo("0...14");
    Node rescueBody = rescue.getNode(1);
    assertThat(rescueBody.getLocation().getKeyword().toString()).isEqualTo("4...10");
    assertThat(rescueBody.getExpression().toString()).isEqualTo("4...14");

    Node assign = translate("x = 1 rescue 2");
    assertThat(assign.getExpression().toString()).isEqualTo("0...14");
    Node rescued = assign.getNode(1);
    assertThat(rescued.getExpression().toString()).isEqualTo("4...14");
    assertThat(rescued.getNode(1).getLocation().getKeyword().toString()).isEqualTo("6...12");
  }

  @Test
  public void testForwardingStyles() {
    String source = "def foo(...); bar(...); end";
    assertThat(translate(source, ForwardArgsStyle.MODERN).toSexp())
        .isEqualTo("(def :foo\n  (args\n    (forward_arg))\n"
            + "  (send nil :bar\n    (forwarded_args)))");
    assertThat(translate(source, ForwardArgsStyle.LEGACY).toSexp())
        .isEqualTo("(def :foo\n  (forward_args)\n  (send nil :bar\n    (forwarded_args)))");
  }

  @Test
  public void testTranslationIsDeterministic() {
    String source = "def foo(a)\n  a.each { |x| puts \"#{x}\" } rescue nil\nend\n";
    Node first = translate(source);
    Node second = translate(source);
    assertThat(first.isEquivalentTo(second, true)).isTrue();
    assertThat(first.toSexp()).isEqualTo(second.toSexp());
  }

  @Test
  public void testContextualNodesCannotBeTranslatedAlone() {
    SourceBuffer buffer = new SourceBuffer("+");
    ParserTranslator translator = new ParserTranslator(buffer);
    TranslationException e =
        assertThrows(TranslationException.class, () -> translator.visitOp(
            new Op("+", buffer.range(0, 1))));
    assertThat(e).hasMessageThat().isEqualTo("Op is only translated as part of its parent");
  }

  @Test
  public void testFindReportsTheMissingNeedle() {
    ParserTranslator translator = new ParserTranslator(new SourceBuffer("foo bar"));
    assertThat(translator.srangeFind(0, 7, "bar").beginPos()).isEqualTo(4);
    assertThat(translator.srangeSearch(0, 5, "bar")).isNull();
    TranslationException e =
        assertThrows(TranslationException.class, () -> translator.srangeFind(0, 5, "bar"));
    assertThat(e).hasMessageThat().isEqualTo("Could not find \"bar\" in \"foo b\"");
  }
}
