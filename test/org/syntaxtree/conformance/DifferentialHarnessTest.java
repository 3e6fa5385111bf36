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
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.whitequark.RubyVersion;
import org.syntaxtree.whitequark.WhitequarkParser;

@RunWith(JUnit4.class)
public final class DifferentialHarnessTest {
  private static final TestCase FORWARD_ARG =
      new TestCase("test_forward_arg:7800", "def foo(...); bar(...); end\n");

  private static DifferentialHarness harness(RubyVersion version) {
    return DifferentialHarness.create(options(version));
  }

  private static ConformanceOptions options(RubyVersion version) {
    return new ConformanceOptions(true).setRubyVersion(version);
  }

  @Test
  public void testAliasPasses() {
    CaseResult result =
        harness(RubyVersion.LATEST).run(new TestCase("test_alias:1908", "alias foo bar\n"));
    assertThat(result.outcome()).isEqualTo(Outcome.PASS);
    assertThat(result.rule()).isNull();
    assertThat(result.staleSuppression()).isFalse();
  }

  @Test
  public void testGlobalAliasPasses() {
    CaseResult result =
        harness(RubyVersion.LATEST).run(new TestCase("test_alias_gvar:1921", "alias $a $b\n"));
    assertThat(result.outcome()).isEqualTo(Outcome.PASS);
  }

  @Test
  public void testForwardArgSuppressedBefore31() {
    for (RubyVersion version : ImmutableList.of(RubyVersion.RUBY_2_7, RubyVersion.RUBY_3_0)) {
      CaseResult result = harness(version).run(FORWARD_ARG);
      assertWithMessage(version.toString()).that(result.outcome()).isEqualTo(Outcome.SUPPRESSED);
      assertThat(result.rule()).isEqualTo(SuppressionRule.todo("test_forward_arg:*")
          .when(VersionPredicate.version(
              VersionPredicate.Comparison.AT_MOST, RubyVersion.RUBY_3_0)));
      assertThat(result.difference().path()).isEqualTo("/def/forward_args[1]");
    }
  }

  @Test
  public void testForwardArgPassesFrom31() {
    for (RubyVersion version : ImmutableList.of(RubyVersion.RUBY_3_1, RubyVersion.LATEST)) {
      CaseResult result = harness(version).run(FORWARD_ARG);
      assertWithMessage(version.toString()).that(result.outcome()).isEqualTo(Outcome.PASS);
      assertThat(result.staleSuppression()).isFalse();
    }
  }

  @Test
  public void testPassingCaseWithARuleIsStale() {
    SuppressionRegistry registry = SuppressionRegistry.of(
        ImmutableList.of(SuppressionRule.todo("test_forward_arg:*")),
        Environment.of(RubyVersion.LATEST));
    CaseResult result =
        DifferentialHarness.create(options(RubyVersion.LATEST), registry).run(FORWARD_ARG);
    assertThat(result.outcome()).isEqualTo(Outcome.PASS);
    assertThat(result.staleSuppression()).isTrue();
  }

  @Test
  public void testUnsuppressedMismatchFails() {
    CaseResult result =
        harness(RubyVersion.LATEST).run(new TestCase("test_negative_power:1", "-2 ** 10\n"));
    assertThat(result.outcome()).isEqualTo(Outcome.FAIL);
    assertThat(result.difference().path()).isEqualTo("/send");
    assertThat(result.message()).startsWith("at /send: ");
  }

  @Test
  public void testKnownFailureIsSuppressed() {
    CaseResult result = harness(RubyVersion.LATEST)
        .run(new TestCase("test_unary_num_pow_precedence:3505", "-2 ** 10\n"));
    assertThat(result.outcome()).isEqualTo(Outcome.SUPPRESSED);
    assertThat(result.rule().category()).isEqualTo(SuppressionCategory.KNOWN_FAILURE);
  }

  @Test
  public void testReferenceRejectionSkips() {
    CaseResult result = harness(RubyVersion.RUBY_2_7)
        .run(new TestCase("test_endless_method:9840", "def foo() = 42\n"));
    assertThat(result.outcome()).isEqualTo(Outcome.SKIPPED);
    assertThat(result.message()).contains("requires Ruby 3.0");
  }

  @Test
  public void testPrimaryRejectionIsAConfigurationError() {
    TestCase invalid = new TestCase("test_invalid:1", "foo(\n");
    assertThrows(HarnessConfigurationException.class,
        () -> harness(RubyVersion.LATEST).run(invalid));
  }

  @Test
  public void testRunAllIsolatesErrors() {
    TestCase invalid = new TestCase("test_invalid:1", "foo(\n");
    TestCase valid = new TestCase("test_alias:1908", "alias foo bar\n");
    ImmutableList<CaseResult> results =
        harness(RubyVersion.LATEST).runAll(ImmutableList.of(invalid, valid));
    assertThat(results.get(0).outcome()).isEqualTo(Outcome.ERROR);
    assertThat(results.get(0).message()).contains("test_invalid:1");
    assertThat(results.get(1).outcome()).isEqualTo(Outcome.PASS);
  }

  @Test
  public void testUnexpectedExceptionBecomesAnError() {
    DifferentialHarness broken = new DifferentialHarness(
        source -> {
          throw new IllegalStateException("primary parser is broken");
        },
        WhitequarkParser.forVersion(RubyVersion.LATEST),
        SuppressionRegistry.empty(),
        false);
    ImmutableList<CaseResult> results =
        broken.runAll(ImmutableList.of(new TestCase("test_nil:66", "nil\n")));
    assertThat(results.get(0).outcome()).isEqualTo(Outcome.ERROR);
    assertThat(results.get(0).message()).isEqualTo("primary parser is broken");
  }

  @Test
  public void testBundledCorpusConforms() {
    ImmutableList<TestCase> corpus = CorpusLoader.loadBundled();
    for (RubyVersion version : ImmutableList.of(
        RubyVersion.RUBY_2_7, RubyVersion.RUBY_3_0, RubyVersion.RUBY_3_1, RubyVersion.LATEST)) {
      for (CaseResult result : harness(version).runAll(corpus)) {
        assertWithMessage("%s on %s: %s", result.label(), version, result.message())
            .that(result.outcome().isFailure())
            .isFalse();
      }
    }
  }

  @Test
  public void testBundledCorpusMostlyPasses() {
    ImmutableList<CaseResult> results = harness(RubyVersion.LATEST).runAll(
        CorpusLoader.loadBundled());
    LoggingOutcomeReporter.Summary summary = LoggingOutcomeReporter.Summary.of(results);
    assertThat(summary.suppressed()).isEqualTo(1);
    assertThat(summary.skipped()).isEqualTo(0);
    assertThat(summary.passed()).isEqualTo(results.size() - 1);
  }
}
