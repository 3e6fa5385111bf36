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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CorpusLoaderTest {

  @Test
  public void testParse() {
    ImmutableList<TestCase> cases = CorpusLoader.parse(ImmutableList.of(
        "ignored preamble",
        "!!! test_alias:1904",
        "alias foo bar",
        "!!! test_multiple:1",
        "foo",
        "bar",
        "!!! test_empty:2"));
    assertThat(cases)
        .containsExactly(
            new TestCase("test_alias:1904", "alias foo bar\n"),
            new TestCase("test_multiple:1", "foo\nbar\n"),
            new TestCase("test_empty:2", "\n"))
        .inOrder();
  }

  @Test
  public void testName() {
    assertThat(new TestCase("test_alias:1904", "").name()).isEqualTo("test_alias");
    assertThat(new TestCase("test_alias", "").name()).isEqualTo("test_alias");
  }

  @Test
  public void testDuplicateLabelsAreRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> CorpusLoader.parse(ImmutableList.of("!!! a:1", "x", "!!! a:1", "y")));
    assertThat(e).hasMessageThat().contains("a:1");
  }

  @Test
  public void testBundledCorpus() {
    ImmutableList<TestCase> cases = CorpusLoader.loadBundled();
    assertThat(cases.size()).isGreaterThan(100);
    Set<String> labels = new HashSet<>();
    for (TestCase testCase : cases) {
      assertThat(labels.add(testCase.label())).isTrue();
      assertThat(testCase.source()).endsWith("\n");
    }
    assertThat(labels).containsAtLeast(
        "test_alias:1908", "test_alias_gvar:1921", "test_forward_arg:7800",
        "test_unary_num_pow_precedence:3505");
  }
}
