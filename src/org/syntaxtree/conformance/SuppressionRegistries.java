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

import static org.syntaxtree.conformance.SuppressionRule.known;
import static org.syntaxtree.conformance.SuppressionRule.todo;
import static org.syntaxtree.conformance.VersionPredicate.Comparison.AT_MOST;
import static org.syntaxtree.conformance.VersionPredicate.Comparison.EQUAL;
import static org.syntaxtree.conformance.VersionPredicate.Comparison.LESS;

import com.google.common.collect.ImmutableList;
import org.syntaxtree.whitequark.RubyVersion;

/** The suppressions that ship with the bundled corpus. */
public final class SuppressionRegistries {
  private SuppressionRegistries() {}

  static final ImmutableList<SuppressionRule> KNOWN_FAILURES =
      ImmutableList.of(
          // Unary minus binds tighter than ** in Ruby's own parser.
          known("test_unary_num_pow_precedence:3505"),
          // A named capture in a regexp on the left of =~ declares locals.
          known("test_lvar_injecting_match:3778"),
          known("test_pattern_matching_hash:8971"),
          known("test_pattern_matching_hash_with_string_keys:9016"),
          known("test_pattern_matching_hash_with_string_keys:9027"),
          known("test_pattern_matching_hash_with_string_keys:9038"),
          known("test_pattern_matching_hash_with_string_keys:9060"),
          known("test_pattern_matching_hash_with_string_keys:9071"),
          known("test_pattern_matching_hash_with_string_keys:9082"),
          known("test_pattern_matching_expr_in_paren:9206"),
          known("test_pattern_matching_single_line_allowed_omission_of_parentheses:*"),
          known("test_control_meta_escape_chars_in_regexp__since_31:*"));

  static final ImmutableList<SuppressionRule> TODO_FAILURES =
      ImmutableList.of(
          todo("test_dedenting_heredoc:334"),
          todo("test_dedenting_heredoc:390"),
          todo("test_dedenting_heredoc:399"),
          todo("test_slash_newline_in_heredocs:7194"),
          todo("test_parser_slash_slash_n_escaping_in_literals:*"),
          todo("test_cond_match_current_line:4801"),
          todo("test_forwarded_restarg:*"),
          todo("test_forwarded_kwrestarg:*"),
          todo("test_forwarded_argument_with_restarg:*"),
          todo("test_forwarded_argument_with_kwrestarg:*"));

  /** Rules that only apply to some versions or engines. */
  static final ImmutableList<SuppressionRule> CONDITIONAL_FAILURES =
      ImmutableList.<SuppressionRule>builder()
          .addAll(
              restrict(
                  VersionPredicate.version(AT_MOST, RubyVersion.RUBY_2_7),
                  todo("test_pattern_matching_hash:*"),
                  todo("test_pattern_matching_single_line:9552")))
          .addAll(
              // Up to 3.0 the reference emits (forward_args) for a (...) parameter list.
              restrict(
                  VersionPredicate.version(AT_MOST, RubyVersion.RUBY_3_0),
                  todo("test_forward_arg:*"),
                  todo("test_forward_args_legacy:*"),
                  todo("test_endless_method_forwarded_args_legacy:*"),
                  todo("test_trailing_forward_arg:*"),
                  todo("test_forward_arg_with_open_args:10770")))
          .addAll(
              restrict(
                  VersionPredicate.version(EQUAL, RubyVersion.RUBY_3_1),
                  known("test_multiple_pattern_matches:11086"),
                  known("test_multiple_pattern_matches:11102")))
          .addAll(
              restrict(
                  VersionPredicate.versionOrEngine(LESS, RubyVersion.RUBY_3_2, "truffleruby"),
                  known("test_if_while_after_class__since_32:11004"),
                  known("test_if_while_after_class__since_32:11014"),
                  known("test_newline_in_hash_argument:11057")))
          .build();

  private static ImmutableList<SuppressionRule> restrict(
      VersionPredicate predicate, SuppressionRule... rules) {
    ImmutableList.Builder<SuppressionRule> restricted = ImmutableList.builder();
    for (SuppressionRule rule : rules) {
      restricted.add(rule.when(predicate));
    }
    return restricted.build();
  }

  /** Builds the registry for a Ruby version and engine. */
  public static SuppressionRegistry buildSuppressionRegistry(RubyVersion version, String engine) {
    Environment environment = new Environment(version, engine);
    return SuppressionRegistry.of(
        ImmutableList.<SuppressionRule>builder()
            .addAll(KNOWN_FAILURES)
            .addAll(TODO_FAILURES)
            .addAll(CONDITIONAL_FAILURES)
            .build(),
        environment);
  }

  public static SuppressionRegistry buildSuppressionRegistry(Environment environment) {
    return buildSuppressionRegistry(environment.version(), environment.engine());
  }
}
