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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.io.CharSource;
import com.google.common.io.Files;
import com.google.errorprone.annotations.Immutable;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.whitequark.RubyVersion;

/**
 * The suppression rules active in one environment. Rules form a set: any matching rule
 * suppresses a case, so the order in which they were added is irrelevant.
 */
@Immutable
public final class SuppressionRegistry {
  /** Appended to a case label by test runners that already expect it to fail. */
  static final String KNOWN_FAILURE_MARKER = " (known failure)";

  private static final Splitter WORD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private static final SuppressionRegistry EMPTY = new SuppressionRegistry(ImmutableSet.of());

  private final ImmutableSet<SuppressionRule> rules;

  private SuppressionRegistry(ImmutableSet<SuppressionRule> rules) {
    this.rules = rules;
  }

  public static SuppressionRegistry empty() {
    return EMPTY;
  }

  /** Keeps the rules that apply to {@code environment}. */
  public static SuppressionRegistry of(
      Iterable<SuppressionRule> rules, Environment environment) {
    checkNotNull(environment);
    ImmutableSet.Builder<SuppressionRule> active = ImmutableSet.builder();
    for (SuppressionRule rule : rules) {
      if (rule.appliesTo(environment)) {
        active.add(rule);
      }
    }
    return new SuppressionRegistry(active.build());
  }

  public SuppressionRegistry union(SuppressionRegistry other) {
    return new SuppressionRegistry(
        ImmutableSet.<SuppressionRule>builder().addAll(rules).addAll(other.rules).build());
  }

  public ImmutableSet<SuppressionRule> getRules() {
    return rules;
  }

  public boolean matches(String label) {
    return match(label) != null;
  }

  /**
   * Returns a rule matching {@code label}, or null. When several match, known failures are
   * preferred over todos, then the rule with the smallest pattern.
   */
  public @Nullable SuppressionRule match(String label) {
    String stripped = label.endsWith(KNOWN_FAILURE_MARKER)
        ? label.substring(0, label.length() - KNOWN_FAILURE_MARKER.length())
        : label;
    SuppressionRule best = null;
    for (SuppressionRule rule : rules) {
      if (!rule.pattern().matches(label) && !rule.pattern().matches(stripped)) {
        continue;
      }
      if (best == null || compare(rule, best) < 0) {
        best = rule;
      }
    }
    return best;
  }

  private static int compare(SuppressionRule a, SuppressionRule b) {
    return ComparisonChain.start()
        .compare(a.category(), b.category())
        .compare(a.pattern().getPattern(), b.pattern().getPattern())
        .compare(String.valueOf(a.predicate()), String.valueOf(b.predicate()))
        .result();
  }

  /** Loads a rules file. See {@link #parse(CharSource, Environment)} for the format. */
  public static SuppressionRegistry fromFile(File file, Environment environment) {
    return parse(Files.asCharSource(file, UTF_8), environment);
  }

  /**
   * Parses rules, one per line:
   *
   * <pre>
   * known|todo &lt;pattern&gt; [&lt;op&gt; &lt;version&gt;] [engine=&lt;name&gt;]
   * </pre>
   *
   * where {@code op} is one of {@code < <= == >= >}. Text after {@code #} is a comment.
   *
   * @throws IllegalArgumentException for a malformed line
   */
  public static SuppressionRegistry parse(CharSource source, Environment environment) {
    List<String> lines;
    try {
      lines = source.readLines();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    ImmutableSet.Builder<SuppressionRule> rules = ImmutableSet.builder();
    int lineNumber = 0;
    for (String line : lines) {
      lineNumber++;
      int comment = line.indexOf('#');
      String content = comment < 0 ? line : line.substring(0, comment);
      List<String> words = WORD_SPLITTER.splitToList(content);
      if (words.isEmpty()) {
        continue;
      }
      try {
        rules.add(parseRule(words));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "line " + lineNumber + ": " + e.getMessage() + ": " + line, e);
      }
    }
    return of(rules.build(), environment);
  }

  private static SuppressionRule parseRule(List<String> words) {
    if (words.size() < 2) {
      throw new IllegalArgumentException("expected a category and a pattern");
    }
    SuppressionCategory category = SuppressionCategory.forKeyword(words.get(0));
    LabelPattern pattern = LabelPattern.compile(words.get(1));
    List<String> rest = words.subList(2, words.size());
    String engine = null;
    if (!rest.isEmpty() && rest.get(rest.size() - 1).startsWith("engine=")) {
      engine = Iterables.getLast(rest).substring("engine=".length());
      rest = rest.subList(0, rest.size() - 1);
    }
    VersionPredicate predicate;
    if (rest.isEmpty()) {
      predicate = engine == null ? null : VersionPredicate.engine(engine);
    } else if (rest.size() == 2) {
      VersionPredicate.Comparison comparison = VersionPredicate.Comparison.forSymbol(rest.get(0));
      RubyVersion version = RubyVersion.parse(rest.get(1));
      predicate = engine == null
          ? VersionPredicate.version(comparison, version)
          : VersionPredicate.versionOrEngine(comparison, version, engine);
    } else {
      throw new IllegalArgumentException("expected <op> <version> after the pattern");
    }
    return new SuppressionRule(pattern, category, predicate);
  }

  @Override
  public String toString() {
    return rules.toString();
  }
}
