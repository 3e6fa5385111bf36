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
import org.syntaxtree.whitequark.RubyVersion;

@RunWith(JUnit4.class)
public final class SuppressionRegistriesTest {

  private static SuppressionRegistry registry(String version) {
    return SuppressionRegistries.buildSuppressionRegistry(RubyVersion.parse(version), "ruby");
  }

  @Test
  public void testStaticListsApplyEverywhere() {
    for (String version : new String[] {"2.7", "3.0", "3.1", "3.2", "3.3"}) {
      SuppressionRegistry registry = registry(version);
      assertThat(registry.matches("test_unary_num_pow_precedence:3505")).isTrue();
      assertThat(registry.matches("test_lvar_injecting_match:3778")).isTrue();
      assertThat(registry.matches("test_forwarded_restarg:1")).isTrue();
      assertThat(registry.matches("test_control_meta_escape_chars_in_regexp__since_31:5")).isTrue();
      assertThat(registry.matches("test_alias:1904")).isFalse();
    }
  }

  @Test
  public void testRuby27() {
    SuppressionRegistry registry = registry("2.7");
    assertThat(registry.matches("test_pattern_matching_hash:1")).isTrue();
    assertThat(registry.matches("test_pattern_matching_single_line:9552")).isTrue();
    assertThat(registry.matches("test_forward_arg:7800")).isTrue();
    assertThat(registry.matches("test_if_while_after_class__since_32:11004")).isTrue();
  }

  @Test
  public void testForwardingSuppressedUpTo30() {
    assertThat(registry("3.0").matches("test_forward_arg:7800")).isTrue();
    assertThat(registry("3.0").matches("test_forward_arg_with_open_args:10770")).isTrue();
    assertThat(registry("3.0").matches("test_pattern_matching_hash:1")).isFalse();
    assertThat(registry("3.1").matches("test_forward_arg:7800")).isFalse();
    assertThat(registry("3.3").matches("test_forward_args_legacy:7812")).isFalse();
  }

  @Test
  public void testRuby31() {
    assertThat(registry("3.1").matches("test_multiple_pattern_matches:11086")).isTrue();
    assertThat(registry("3.2").matches("test_multiple_pattern_matches:11086")).isFalse();
    assertThat(registry("3.0").matches("test_multiple_pattern_matches:11102")).isFalse();
  }

  @Test
  public void testBefore32OrTruffleRuby() {
    assertThat(registry("3.1").matches("test_newline_in_hash_argument:11057")).isTrue();
    assertThat(registry("3.2").matches("test_newline_in_hash_argument:11057")).isFalse();
    assertThat(
            SuppressionRegistries.buildSuppressionRegistry(RubyVersion.LATEST, "truffleruby")
                .matches("test_if_while_after_class__since_32:11014"))
        .isTrue();
  }

  @Test
  public void testPureFunction() {
    Environment environment = Environment.of(RubyVersion.RUBY_3_0);
    assertThat(SuppressionRegistries.buildSuppressionRegistry(environment).getRules())
        .isEqualTo(SuppressionRegistries.buildSuppressionRegistry(environment).getRules());
  }
}
