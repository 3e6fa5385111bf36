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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.ast.SyntaxNode.Program;
import org.syntaxtree.parser.ParseException;
import org.syntaxtree.parser.PrimaryParser;
import org.syntaxtree.parser.SyntaxTreeParser;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.translation.ParserTranslator;
import org.syntaxtree.whitequark.Node;
import org.syntaxtree.whitequark.ReferenceParser;
import org.syntaxtree.whitequark.WhitequarkParser;

/**
 * Runs corpus cases through both parsers and compares the reference tree with the translation
 * of the primary tree.
 *
 * <p>A harness holds no mutable state, so cases may run concurrently.
 */
public final class DifferentialHarness {
  private static final Logger logger = Logger.getLogger(DifferentialHarness.class.getName());

  private final PrimaryParser primaryParser;
  private final ReferenceParser referenceParser;
  private final SuppressionRegistry registry;
  private final TreeComparator comparator;

  public DifferentialHarness(
      PrimaryParser primaryParser,
      ReferenceParser referenceParser,
      SuppressionRegistry registry,
      boolean checkLocations) {
    this.primaryParser = checkNotNull(primaryParser);
    this.referenceParser = checkNotNull(referenceParser);
    this.registry = checkNotNull(registry);
    this.comparator = new TreeComparator(checkLocations);
  }

  /** Creates a harness for the options' environment with the bundled suppressions. */
  public static DifferentialHarness create(ConformanceOptions options) {
    return create(
        options, SuppressionRegistries.buildSuppressionRegistry(options.getEnvironment()));
  }

  public static DifferentialHarness create(
      ConformanceOptions options, SuppressionRegistry registry) {
    return new DifferentialHarness(
        SyntaxTreeParser.create(),
        WhitequarkParser.forVersion(options.getRubyVersion()),
        registry,
        options.isCheckLocations());
  }

  /**
   * Runs one case.
   *
   * @throws HarnessConfigurationException if the primary parser rejects the snippet
   * @throws org.syntaxtree.translation.TranslationException if the translation fails
   */
  public CaseResult run(TestCase testCase) {
    String label = testCase.label();
    SourceBuffer buffer = new SourceBuffer(testCase.source());

    Program program;
    try {
      program = primaryParser.parse(testCase.source());
    } catch (ParseException e) {
      throw new HarnessConfigurationException(
          "the corpus case " + label + " is not valid for the primary parser: " + e.getMessage(),
          e);
    }

    Node expected;
    try {
      expected = referenceParser.parse(buffer);
    } catch (ParseException e) {
      logger.fine("reference parser rejected " + label + ": " + e.getMessage());
      return CaseResult.skipped(label, e.getMessage());
    }

    Node actual = new ParserTranslator(buffer).translate(program);
    TreeDifference difference = comparator.compare(expected, actual);
    SuppressionRule rule = registry.match(label);
    if (difference == null) {
      return CaseResult.pass(label, rule);
    }
    if (rule != null) {
      return CaseResult.suppressed(label, rule, difference);
    }
    return CaseResult.fail(label, difference);
  }

  /**
   * Runs every case. A case that throws is reported as an ERROR and does not stop the rest.
   */
  public ImmutableList<CaseResult> runAll(List<TestCase> testCases) {
    ImmutableList.Builder<CaseResult> results = ImmutableList.builder();
    for (TestCase testCase : testCases) {
      results.add(runIsolated(testCase));
    }
    return results.build();
  }

  private CaseResult runIsolated(TestCase testCase) {
    try {
      return run(testCase);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "error running " + testCase.label(), e);
      return CaseResult.error(testCase.label(), describe(e));
    }
  }

  private static String describe(RuntimeException e) {
    @Nullable String message = e.getMessage();
    return message != null ? message : Throwables.getStackTraceAsString(e);
  }

  public SuppressionRegistry getRegistry() {
    return registry;
  }
}
