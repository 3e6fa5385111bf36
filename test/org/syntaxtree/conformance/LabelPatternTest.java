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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LabelPatternTest {

  @Test
  public void testExactLabel() {
    LabelPattern pattern = LabelPattern.compile("test_alias:12");
    assertThat(pattern.matches("test_alias:12")).isTrue();
    assertThat(pattern.matches("test_alias:13")).isFalse();
    assertThat(pattern.matches("test_alias_gvar:12")).isFalse();
  }

  @Test
  public void testWildcardDiscriminator() {
    LabelPattern pattern = LabelPattern.compile("test_forward_arg:*");
    assertThat(pattern.matches("test_forward_arg:7800")).isTrue();
    assertThat(pattern.matches("test_forward_arg:1")).isTrue();
    assertThat(pattern.matches("test_forward_arg_with_open_args:10770")).isFalse();
  }

  @Test
  public void testWithoutDiscriminatorMatchesEveryCaseOfTheName() {
    LabelPattern pattern = LabelPattern.compile("test_alias");
    assertThat(pattern.matches("test_alias:1904")).isTrue();
    assertThat(pattern.matches("test_alias")).isTrue();
    assertThat(pattern.matches("test_aliases:1")).isFalse();
  }

  @Test
  public void testNamePrefix() {
    LabelPattern pattern = LabelPattern.compile("test_pattern_matching_*:*");
    assertThat(pattern.matches("test_pattern_matching_hash:8971")).isTrue();
    assertThat(pattern.matches("test_pattern:1")).isFalse();
  }

  @Test
  public void testSplitsOnTheLastColon() {
    LabelPattern pattern = LabelPattern.compile("a:b:3");
    assertThat(pattern.matches("a:b:3")).isTrue();
    assertThat(pattern.matches("a:3")).isFalse();
  }

  @Test
  public void testEqualityIsByPattern() {
    assertThat(LabelPattern.compile(" foo:1 ")).isEqualTo(LabelPattern.compile("foo:1"));
    assertThat(LabelPattern.compile("foo:1").toString()).isEqualTo("foo:1");
  }

  @Test
  public void testMalformedPatterns() {
    assertThrows(IllegalArgumentException.class, () -> LabelPattern.compile(""));
    assertThrows(IllegalArgumentException.class, () -> LabelPattern.compile(":12"));
    assertThrows(IllegalArgumentException.class, () -> LabelPattern.compile("foo:"));
  }
}
