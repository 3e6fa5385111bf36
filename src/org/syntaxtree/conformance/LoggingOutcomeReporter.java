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

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs case results. Failures and errors are logged at SEVERE, stale suppressions at WARNING,
 * and suppressed or skipped cases at FINE.
 */
public class LoggingOutcomeReporter {
  private final Logger logger;

  public LoggingOutcomeReporter(Logger logger) {
    this.logger = logger;
  }

  public void report(CaseResult result) {
    switch (result.outcome()) {
      case FAIL:
        logger.severe(result.label() + " failed " + result.message());
        break;
      case ERROR:
        logger.severe(result.label() + " could not run: " + result.message());
        break;
      case SUPPRESSED:
        logger.fine(result.label() + " suppressed by " + result.rule() + " "
            + result.difference());
        break;
      case SKIPPED:
        logger.fine(result.label() + " skipped: " + result.message());
        break;
      case PASS:
        if (result.staleSuppression()) {
          logger.warning(result.label() + " passes but is still suppressed by " + result.rule());
        }
        break;
    }
  }

  /** Reports each result, then the summary. */
  public void reportAll(List<CaseResult> results) {
    for (CaseResult result : results) {
      report(result);
    }
    printSummary(results);
  }

  public void printSummary(List<CaseResult> results) {
    Summary summary = Summary.of(results);
    Level level = summary.failed() + summary.errors() == 0 ? Level.INFO : Level.WARNING;
    logger.log(level, "{0} passed, {1} failed, {2} suppressed, {3} skipped, {4} error(s)",
        new Object[] {
          summary.passed(), summary.failed(), summary.suppressed(), summary.skipped(),
          summary.errors()
        });
  }

  /** Counts of each outcome. */
  public record Summary(int passed, int failed, int suppressed, int skipped, int errors) {
    public static Summary of(List<CaseResult> results) {
      int[] counts = new int[Outcome.values().length];
      for (CaseResult result : results) {
        counts[result.outcome().ordinal()]++;
      }
      return new Summary(
          counts[Outcome.PASS.ordinal()],
          counts[Outcome.FAIL.ordinal()],
          counts[Outcome.SUPPRESSED.ordinal()],
          counts[Outcome.SKIPPED.ordinal()],
          counts[Outcome.ERROR.ordinal()]);
    }
  }
}
