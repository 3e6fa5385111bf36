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
import static org.syntaxtree.conformance.VersionPredicate.Comparison.AT_MOST;
import static org.syntaxtree.conformance.VersionPredicate.Comparison.EQUAL;
import static org.syntaxtree.conformance.VersionPredicate.Comparison.LESS;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.whitequark.RubyVersion;

@RunWith(JUnit4.class)
public final class VersionPredicateTest {

  @Test
  public void testVersionsCompareNumerically() {
    VersionPredicate predicate = VersionPredicate.version(LESS, RubyVersion.parse("3.2"));
    assertThat(predicate.test(Environment.of(RubyVersion.parse("3.10")))).isFalse();
    assertThat(predicate.test(Environment.of(RubyVersion.parse("3.1.4")))).isTrue();
  }

  @Test
  public void testComparisons() {
    Environment ruby30 = Environment.of(RubyVersion.RUBY_3_0);
    assertThat(VersionPredicate.version(AT_MOST, RubyVersion.RUBY_3_0).test(ruby30)).isTrue();
    assertThat(VersionPredicate.version(LESS, RubyVersion.RUBY_3_0).test(ruby30)).isFalse();
    assertThat(VersionPredicate.version(EQUAL, RubyVersion.RUBY_3_1).test(ruby30)).isFalse();
  }

  @Test
  public void testVersionOrEngine() {
    VersionPredicate predicate =
        VersionPredicate.versionOrEngine(LESS, RubyVersion.RUBY_3_2, "truffleruby");
    assertThat(predicate.test(new Environment(RubyVersion.LATEST, "truffleruby"))).isTrue();
    assertThat(predicate.test(new Environment(RubyVersion.LATEST, "ruby"))).isFalse();
    assertThat(predicate.test(new Environment(RubyVersion.RUBY_3_1, "ruby"))).isTrue();
  }

  @Test
  public void testToString() {
    assertThat(VersionPredicate.version(AT_MOST, RubyVersion.RUBY_3_0).toString())
        .isEqualTo("<= 3.0");
    assertThat(VersionPredicate.engine("jruby").toString()).isEqualTo("engine=jruby");
  }
}
