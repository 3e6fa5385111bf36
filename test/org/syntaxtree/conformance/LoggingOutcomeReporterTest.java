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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.syntaxtree.source.SourceBuffer;
import org.syntaxtree.whitequark.Node;
import org.syntaxtree.whitequark.NodeType;
import org.syntaxtree.whitequark.SourceMap;

@RunWith(JUnit4.class)
public final class LoggingOutcomeReporterTest {
  private final List<LogRecord> records = new ArrayList<>();
  private final Logger logger = Logger.getAnonymousLogger();
  private LoggingOutcomeReporter reporter;

  @Before
  public void setUp() {
    logger.setUseParentHandlers(false);
    logger.setLevel(Level.ALL);
    logger.addHandler(new Handler() {
      @Override
      public void publish(LogRecord record) {
        records.add(record);
      }

      @Override
      public void flush() {}

      @Override
      public void close() {}
    });
    reporter = new LoggingOutcomeReporter(logger);
  }

  private static TreeDifference difference() {
    Node nil = Node.of(NodeType.NIL, SourceMap.map(new SourceBuffer("nil").range(0, 3)));
    return new TreeDifference("/nil", nil, null, "translated to an empty program");
  }

  @Test
  public void testFailureIsSevere() {
    reporter.report(CaseResult.fail("test_nil:66", difference()));
    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage()).startsWith("test_nil:66 failed at /nil: ");
  }

  @Test
  public void testStaleSuppressionIsAWarning() {
    reporter.report(CaseResult.pass("test_nil:66", SuppressionRule.todo("test_nil:*")));
    assertThat(records.get(0).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(0).getMessage()).contains("still suppressed by todo test_nil:*");
  }

  @Test
  public void testPassIsSilent() {
    reporter.report(CaseResult.pass("test_nil:66", null));
    assertThat(records).isEmpty();
  }

  @Test
  public void testSuppressedAndSkippedAreFine() {
    reporter.report(CaseResult.suppressed("test_nil:66", SuppressionRule.known("test_nil:66"),
        difference()));
    reporter.report(CaseResult.skipped("test_nil:67", "requires Ruby 3.0"));
    assertThat(records).hasSize(2);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.FINE);
    assertThat(records.get(1).getLevel()).isEqualTo(Level.FINE);
  }

  @Test
  public void testSummary() {
    ImmutableList<CaseResult> results = ImmutableList.of(
        CaseResult.pass("a:1", null),
        CaseResult.pass("a:2", null),
        CaseResult.skipped("a:3", "unsupported"),
        CaseResult.error("a:4", "boom"));
    LoggingOutcomeReporter.Summary summary = LoggingOutcomeReporter.Summary.of(results);
    assertThat(summary).isEqualTo(new LoggingOutcomeReporter.Summary(2, 0, 0, 1, 1));

    reporter.printSummary(results);
    LogRecord last = records.get(records.size() - 1);
    assertThat(last.getLevel()).isEqualTo(Level.WARNING);
    assertThat(last.getParameters()).asList().containsExactly(2, 0, 0, 1, 1).inOrder();
  }

  @Test
  public void testCleanSummaryIsInfo() {
    reporter.reportAll(ImmutableList.of(CaseResult.pass("a:1", null)));
    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);
  }
}
