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
package org.syntaxtree.conformance;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.whitequark.Node;
import org.syntaxtree.whitequark.RubyVersion;
import org.syntaxtree.whitequark.WhitequarkParser;

@RunWith(JUnit4.class)
public final class TreeComparatorTest {
  private final TreeComparator shapes = new TreeComparator(false);
  private final TreeComparator locations = new TreeComparator(true);

  private static Node parse(String source) {
    return WhitequarkParser.forVersion(RubyVersion.LATEST).parse(new SourceBuffer(source));
  }

  @Test
  public void testEqualTrees() {
    assertThat(shapes.compare(parse("foo(1)"), parse("foo(1)"))).isNull();
    assertThat(locations.compare(parse("foo(1)"), parse("foo(1)"))).isNull();
    assertThat(shapes.compare(null, null)).isNull();
  }

  @Test
  public void testValueMismatchNamesThePath() {
    TreeDifference difference = shapes.compare(parse("foo; bar"), parse("foo; baz"));
    assertThat(difference.path()).isEqualTo("/begin/send[1]");
    assertThat(difference.reason()).isEqualTo("child 1 expected :bar but was :baz");
    assertThat(difference.expected().toSexp()).isEqualTo("(send nil :bar)");
    assertThat(difference.actual().toSexp()).isEqualTo("(send nil :baz)");
  }

  @Test
  public void testTypeMismatch() {
    TreeDifference difference = shapes.compare(parse("[foo]"), parse("[1]"));
    assertThat(difference.path()).isEqualTo("/array/send[0]");
    assertThat(difference.reason()).isEqualTo("expected send but was int");
  }

  @Test
  public void testChildCountMismatch() {
    TreeDifference difference = shapes.compare(parse("foo(1)"), parse("foo(1, 2)"));
    assertThat(difference.path()).isEqualTo("/send");
    assertThat(difference.reason()).isEqualTo("expected 3 children but was 4");
  }

  @Test
  public void testLocationsOnlyCompareWhenAsked() {
    Node expected = parse("foo(1)");
    Node actual = parse("foo( 1)");
    assertThat(shapes.compare(expected, actual)).isNull();

    TreeDifference difference = locations.compare(expected, actual);
    assertThat(difference.path()).isEqualTo("/send");
    assertThat(difference.reason()).isEqualTo("expression range expected 0...6 but was 0...7");
  }

  @Test
  public void testEmptyPrograms() {
    TreeDifference difference = shapes.compare(null, parse("foo"));
    assertThat(difference.path()).isEqualTo("/send");
    assertThat(difference.reason()).isEqualTo("expected an empty program");
    assertThat(shapes.compare(parse("foo"), null).reason())
        .isEqualTo("translated to an empty program");
  }

  @Test
  public void testDescribeShowsBothTrees() {
    TreeDifference difference = shapes.compare(parse("foo"), parse("bar"));
    assertThat(difference.describe())
        .isEqualTo("at /send: child 1 expected :foo but was :bar\n"
            + "expected:\n(send nil :foo)\nactual:\n(send nil :bar)");
    assertThat(difference.toString()).isEqualTo("/send: child 1 expected :foo but was :bar");
  }
}
