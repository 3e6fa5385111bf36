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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.parser.ParseException;
import org.syntaxtree.source.SourceBuffer;

@RunWith(JUnit4.class)
public final class WhitequarkParserTest {

  private static Node parse(String source) {
    return parse(source, RubyVersion.LATEST);
  }

  private static Node parse(String source, RubyVersion version) {
    return WhitequarkParser.forVersion(version).parse(new SourceBuffer(source));
  }

  private static String sexp(String source) {
    return parse(source).toSexp();
  }

  @Test
  public void testEmptyProgramIsNull() {
    assertThat(parse("\n")).isNull();
  }

  @Test
  public void testStatementsAreWrappedInBegin() {
    assertThat(sexp("foo; bar")).isEqualTo("(begin\n  (send nil :foo)\n  (send nil :bar))");
  }

  @Test
  public void testAlias() {
    assertThat(sexp("alias foo bar")).isEqualTo("(alias\n  (sym :foo)\n  (sym :bar))");
    assertThat(sexp("alias $a $b")).isEqualTo("(alias\n  (gvar :$a)\n  (gvar :$b))");
  }

  @Test
  public void testLocalVariables() {
    assertThat(sexp("foo = 1; foo"))
        .isEqualTo("(begin\n  (lvasgn :foo\n    (int 1))\n  (lvar :foo))");
  }

  @Test
  public void testNegativePowerBindsTheSignLast() {
    assertThat(sexp("-2 ** 10"))
        .isEqualTo("(send\n  (send\n    (int 2) :**\n    (int 10)) :-@)");
    assertThat(sexp("-2")).isEqualTo("(int -2)");
  }

  @Test
  public void testKeywordArgumentsAreKwargs() {
    assertThat(sexp("foo(a: 1)"))
        .isEqualTo("(send nil :foo\n  (kwargs\n    (pair\n      (sym :a)\n      (int 1))))");
    assertThat(sexp("{ a: 1 }")).isEqualTo("(hash\n  (pair\n    (sym :a)\n    (int 1)))");
  }

  @Test
  public void testSendLocation() {
    SourceMap map = parse("foo.bar(1)").getLocation();
    assertThat(map.getKind()).isEqualTo(SourceMap.Kind.SEND);
    assertThat(map.get(SourceMap.Part.DOT).beginPos()).isEqualTo(3);
    assertThat(map.getSelector().beginPos()).isEqualTo(4);
    assertThat(map.getSelector().endPos()).isEqualTo(7);
    assertThat(map.getBegin().beginPos()).isEqualTo(7);
    assertThat(map.getEnd().beginPos()).isEqualTo(9);
    assertThat(map.getExpression().endPos()).isEqualTo(10);
  }

  @Test
  public void testClauseBeginIsTheFirstSemicolon() {
    SourceMap map = parse("if foo; bar; end").getLocation();
    assertThat(map.getBegin().beginPos()).isEqualTo(6);
    assertThat(parse("if foo then bar; end").getLocation().getBegin().endPos()).isEqualTo(11);
    assertThat(parse("if foo\nbar\nend").getLocation().getBegin()).isNull();
  }

  @Test
  public void testForwardArgsBefore31AreLegacy() {
    String source = "def foo(...); end";
    assertThat(parse(source, RubyVersion.RUBY_3_0).toSexp())
        .isEqualTo("(def :foo\n  (forward_args) nil)");
    assertThat(parse(source, RubyVersion.RUBY_3_1).toSexp())
        .isEqualTo("(def :foo\n  (args\n    (forward_arg)) nil)");
  }

  @Test
  public void testVersionGates() {
    ParseException endless =
        assertThrows(ParseException.class, () -> parse("def foo = 1", RubyVersion.RUBY_2_7));
    assertThat(endless.getDetails()).contains("requires Ruby 3.0");

    assertThrows(
        ParseException.class, () -> parse("def foo(a, ...); end", RubyVersion.RUBY_2_7));
    assertThat(parse("def foo(a, ...); end", RubyVersion.RUBY_3_0)).isNotNull();
  }

  @Test
  public void testElseWithoutRescue() {
    ParseException e =
        assertThrows(ParseException.class, () -> parse("begin; foo; else; bar; end"));
    assertThat(e.getDetails()).isEqualTo("else without rescue is useless");
  }

  @Test
  public void testRescueModifierWrapsAssignedValue() {
    assertThat(sexp("x = 1 rescue 2"))
        .isEqualTo("(lvasgn :x\n  (rescue\n    (int 1)\n"
            + "    (resbody nil nil\n      (int 2)) nil))");
    assertThat(sexp("a += 1 rescue 2"))
        .isEqualTo("(op_asgn\n  (lvasgn :a) :+\n  (rescue\n    (int 1)\n"
            + "    (resbody nil nil\n      (int 2)) nil))");
    assertThat(sexp("foo rescue bar"))
        .isEqualTo("(rescue\n  (send nil :foo)\n  (resbody nil nil\n    (send nil :bar)) nil)");
  }

  @Test
  public void testMultipleAssignment() {
    assertThat(sexp("a, b = 1, 2"))
        .isEqualTo("(masgn\n  (mlhs\n    (lvasgn :a)\n    (lvasgn :b))\n"
            + "  (array\n    (int 1)\n    (int 2)))");
    assertThat(sexp("a, b = c; a"))
        .isEqualTo("(begin\n  (masgn\n    (mlhs\n      (lvasgn :a)\n      (lvasgn :b))\n"
            + "    (send nil :c))\n  (lvar :a))");
    assertThat(sexp("*a, b.c = d"))
        .isEqualTo("(masgn\n  (mlhs\n    (splat\n      (lvasgn :a))\n"
            + "    (send\n      (send nil :b) :c=))\n  (send nil :d))");
    assertThrows(ParseException.class, () -> parse("a, 1 = 2"));
  }

  @Test
  public void testSplatAndListAssignments() {
    assertThat(sexp("a = *b"))
        .isEqualTo("(lvasgn :a\n  (array\n    (splat\n      (send nil :b))))");
    assertThat(sexp("a = *b, 1"))
        .isEqualTo("(lvasgn :a\n  (array\n    (splat\n      (send nil :b))\n    (int 1)))");
    assertThat(sexp("foo(a = 1, 2)"))
        .isEqualTo("(send nil :foo\n  (lvasgn :a\n    (int 1))\n  (int 2))");
  }

  @Test
  public void testRegexpReferences() {
    assertThat(sexp("$1")).isEqualTo("(nth_ref 1)");
    assertThat(sexp("$&")).isEqualTo("(back_ref :$&)");
    assertThat(sexp("$~")).isEqualTo("(gvar :$~)");
  }

  @Test
  public void testDoubleColonCall() {
    assertThat(sexp("foo::bar")).isEqualTo("(send\n  (send nil :foo) :bar)");
    assertThat(sexp("Foo::Bar()")).isEqualTo("(send\n  (const nil :Foo) :Bar)");
    assertThat(sexp("Foo::Bar")).isEqualTo("(const\n  (const nil :Foo) :Bar)");
  }

  @Test
  public void testQuotedLabels() {
    assertThat(sexp("{'b': 2}")).isEqualTo("(hash\n  (pair\n    (sym :b)\n    (int 2)))");
    assertThat(sexp("{\"a#{b}\": 1}"))
        .isEqualTo("(hash\n  (pair\n    (dsym\n      (str \"a\")\n      (begin\n"
            + "        (send nil :b)))\n    (int 1)))");
    assertThat(sexp("{'a#{b}': 1}")).isEqualTo("(hash\n  (pair\n    (sym :\"a\\#{b}\")\n"
        + "    (int 1)))");
  }

  @Test
  public void testRationalAndImaginary() {
    assertThat(sexp("1.5r")).isEqualTo("(rational (3/2))");
    assertThat(sexp("-1r")).isEqualTo("(rational (-1/1))");
    assertThat(sexp("2i")).isEqualTo("(complex (0+2i))");
    assertThat(sexp("-2i")).isEqualTo("(complex (0-2i))");
    assertThat(sexp("1ri")).isEqualTo("(complex (0+(1/1)*i))");
    SourceMap map = parse("-2.5").getLocation();
    assertThat(map.getOperator().toString()).isEqualTo("0...1");
    assertThat(map.getExpression().toString()).isEqualTo("0...4");
  }
}
