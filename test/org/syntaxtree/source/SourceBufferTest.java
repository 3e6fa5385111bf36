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
package org.syntaxtree.source;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceBufferTest {
  private final SourceBuffer buffer = new SourceBuffer("foo\nbar baz\n");

  @Test
  public void testLinesAndColumns() {
    assertThat(buffer.lineOf(0)).isEqualTo(1);
    assertThat(buffer.lineOf(3)).isEqualTo(1);
    assertThat(buffer.lineOf(4)).isEqualTo(2);
    assertThat(buffer.columnOf(8)).isEqualTo(4);
    assertThat(buffer.lineOf(12)).isEqualTo(3);
    assertThat(buffer.getLineCount()).isEqualTo(3);
    assertThat(buffer.getLine(2)).isEqualTo("bar baz");
    assertThat(buffer.getLine(3)).isEmpty();
  }

  @Test
  public void testRange() {
    SourceRange range = buffer.range(4, 11);
    assertThat(buffer.source(range)).isEqualTo("bar baz");
    assertThat(range.startLine()).isEqualTo(2);
    assertThat(range.startColumn()).isEqualTo(0);
    assertThat(range.endColumn()).isEqualTo(7);
    assertThat(range.length()).isEqualTo(7);
    assertThat(range.toString()).isEqualTo("4...11");
  }

  @Test
  public void testRangeLengthCountsBackwards() {
    assertThat(buffer.rangeLength(11, -3)).isEqualTo(buffer.range(8, 11));
    assertThat(buffer.rangeLength(4, 3)).isEqualTo(buffer.range(4, 7));
  }

  @Test
  public void testAdjust() {
    assertThat(buffer.adjust(buffer.range(4, 11), 4, 0)).isEqualTo(buffer.range(8, 11));
  }

  @Test
  public void testJoinAndContains() {
    SourceRange foo = buffer.range(0, 3);
    SourceRange baz = buffer.range(8, 11);
    SourceRange joined = baz.join(foo);
    assertThat(joined).isEqualTo(buffer.range(0, 11));
    assertThat(joined.contains(foo)).isTrue();
    assertThat(foo.contains(joined)).isFalse();
  }

  @Test
  public void testIndexOfStaysWithinBounds() {
    assertThat(buffer.indexOf("baz", 0, 12)).isEqualTo(8);
    assertThat(buffer.indexOf("baz", 0, 10)).isEqualTo(-1);
    assertThat(buffer.indexOf("qux", 0, 12)).isEqualTo(-1);
  }

  @Test
  public void testBadRangeIsRejected() {
    assertThrows(IndexOutOfBoundsException.class, () -> buffer.range(5, 4));
    assertThrows(IndexOutOfBoundsException.class, () -> buffer.range(0, 100));
  }

  @Test
  public void testDefaultName() {
    assertThat(buffer.getName()).isEqualTo(SourceBuffer.DEFAULT_NAME);
    assertThat(new SourceBuffer("a.rb", "").getName()).isEqualTo("a.rb");
  }
}
