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
import static org.syntaxtree.conformance.SuppressionRule.known;
import static org.syntaxtree.conformance.SuppressionRule.todo;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.CharSource;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.whitequark.RubyVersion;

@RunWith(JUnit4.class)
public final class SuppressionRegistryTest {
  private static final Environment LATEST = Environment.of(RubyVersion.LATEST);

  private static final ImmutableList<SuppressionRule> RULES =
      ImmutableList.of(
          known("test_unary_num_pow_precedence:3505"),
          todo("test_forward_arg:*"),
          todo("test_dedenting_heredoc:334"),
          known("test_forward_arg:7800"));

  @Test
  public void testMatches() {
    SuppressionRegistry registry = SuppressionRegistry.of(RULES, LATEST);
    assertThat(registry.matches("test_unary_num_pow_precedence:3505")).isTrue();
    assertThat(registry.matches("test_unary_num_pow_precedence:3496")).isFalse();
    assertThat(registry.matches("test_forward_arg:1")).isTrue();
    assertThat(SuppressionRegistry.empty().matches("test_forward_arg:1")).isFalse();
  }

  @Test
  public void testKnownFailuresArePreferred() {
    SuppressionRegistry registry = SuppressionRegistry.of(RULES, LATEST);
    assertThat(registry.match("test_forward_arg:7800")).isEqualTo(known("test_forward_arg:7800"));
    assertThat(registry.match("test_forward_arg:1")).isEqualTo(todo("test_forward_arg:*"));
  }

  @Test
  public void testOrderIndependence() {
    SuppressionRegistry forward = SuppressionRegistry.of(RULES, LATEST);
    SuppressionRegistry reversed = SuppressionRegistry.of(Lists.reverse(RULES), LATEST);
    assertThat(forward.getRules()).isEqualTo(reversed.getRules());
    for (String label :
        ImmutableList.of(
            "test_forward_arg:7800", "test_forward_arg:2", "test_dedenting_heredoc:334",
            "test_alias:1904")) {
      assertThat(reversed.match(label)).isEqualTo(forward.match(label));
    }
  }

  @Test
  public void testOrderIndependenceAcrossPredicates() {
    SuppressionRule atLeast = known("test_forward_arg:7800")
        .when(VersionPredicate.version(VersionPredicate.Comparison.AT_LEAST, RubyVersion.RUBY_2_7));
    SuppressionRule plain = known("test_forward_arg:7800");
    ImmutableList<SuppressionRule> rules = ImmutableList.of(atLeast, plain);
    SuppressionRegistry forward = SuppressionRegistry.of(rules, LATEST);
    SuppressionRegistry reversed = SuppressionRegistry.of(Lists.reverse(rules), LATEST);
    assertThat(forward.match("test_forward_arg:7800")).isEqualTo(atLeast);
    assertThat(reversed.match("test_forward_arg:7800")).isEqualTo(atLeast);
  }

  @Test
  public void testKnownFailureMarkerIsStripped() {
    SuppressionRegistry registry = SuppressionRegistry.of(RULES, LATEST);
    assertThat(registry.matches("test_dedenting_heredoc:334 (known failure)")).isTrue();
    assertThat(registry.matches("test_dedenting_heredoc:390 (known failure)")).isFalse();
  }

  @Test
  public void testRulesOutsideTheEnvironmentAreDropped() {
    SuppressionRule rule = todo("test_forward_arg:*")
        .when(VersionPredicate.version(VersionPredicate.Comparison.AT_MOST, RubyVersion.RUBY_3_0));
    assertThat(SuppressionRegistry.of(ImmutableList.of(rule), LATEST).getRules()).isEmpty();
    assertThat(
            SuppressionRegistry.of(ImmutableList.of(rule), Environment.of(RubyVersion.RUBY_2_7))
                .getRules())
        .containsExactly(rule);
  }

  @Test
  public void testUnion() {
    SuppressionRegistry first = SuppressionRegistry.of(ImmutableList.of(known("a:1")), LATEST);
    SuppressionRegistry second = SuppressionRegistry.of(ImmutableList.of(todo("b:*")), LATEST);
    SuppressionRegistry union = first.union(second);
    assertThat(union.matches("a:1")).isTrue();
    assertThat(union.matches("b:2")).isTrue();
    assertThat(union.getRules()).hasSize(2);
  }

  @Test
  public void testParse() {
    String rules = Joiner.on('\n').join(
        "# Suppressions for the nightly run.",
        "known test_unary_num_pow_precedence:3505",
        "",
        "todo test_forward_arg:*  <= 3.0   # legacy forwarding",
        "known test_newline_in_hash_argument:11057 < 3.2 engine=truffleruby",
        "todo test_only_on_jruby:* engine=jruby");
    SuppressionRegistry ruby30 =
        SuppressionRegistry.parse(CharSource.wrap(rules), Environment.of(RubyVersion.RUBY_3_0));
    assertThat(ruby30.getRules()).hasSize(3);
    assertThat(ruby30.matches("test_forward_arg:7800")).isTrue();
    assertThat(ruby30.matches("test_only_on_jruby:1")).isFalse();

    SuppressionRegistry truffle = SuppressionRegistry.parse(
        CharSource.wrap(rules), new Environment(RubyVersion.LATEST, "truffleruby"));
    assertThat(truffle.matches("test_newline_in_hash_argument:11057")).isTrue();
    assertThat(truffle.matches("test_forward_arg:7800")).isFalse();
  }

  @Test
  public void testParseRejectsMalformedLines() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> SuppressionRegistry.parse(
            CharSource.wrap("known a:1\nmaybe b:2\n"), LATEST));
    assertThat(e).hasMessageThat().startsWith("line 2: ");

    assertThrows(IllegalArgumentException.class,
        () -> SuppressionRegistry.parse(CharSource.wrap("todo a:1 <= \n"), LATEST));
    assertThrows(IllegalArgumentException.class,
        () -> SuppressionRegistry.parse(CharSource.wrap("todo a:1 ~ 3.0\n"), LATEST));
    assertThrows(IllegalArgumentException.class,
        () -> SuppressionRegistry.parse(CharSource.wrap("todo\n"), LATEST));
  }
}
