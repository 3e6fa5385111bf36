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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * The outcome of running one corpus case.
 *
 * @param label the case label
 * @param outcome the classification
 * @param rule the suppression rule that matched, if any
 * @param difference the first mismatch, for FAIL and SUPPRESSED
 * @param message details for SKIPPED and ERROR
 * @param staleSuppression whether the case passed although a rule still suppresses it
 */
public record CaseResult(
    String label,
    Outcome outcome,
    @Nullable SuppressionRule rule,
    @Nullable TreeDifference difference,
    @Nullable String message,
    boolean staleSuppression) {
  public CaseResult {
    checkNotNull(label);
    checkNotNull(outcome);
    checkArgument(!staleSuppression || (outcome == Outcome.PASS && rule != null),
        "only a passing case with a matching rule is stale");
  }

  static CaseResult pass(String label, @Nullable SuppressionRule rule) {
    return new CaseResult(label, Outcome.PASS, rule, null, null, rule != null);
  }

  static CaseResult fail(String label, TreeDifference difference) {
    return new CaseResult(label, Outcome.FAIL, null, difference, difference.describe(), false);
  }

  static CaseResult suppressed(String label, SuppressionRule rule, TreeDifference difference) {
    return new CaseResult(label, Outcome.SUPPRESSED, rule, difference, null, false);
  }

  static CaseResult skipped(String label, String message) {
    return new CaseResult(label, Outcome.SKIPPED, null, null, message, false);
  }

  static CaseResult error(String label, String message) {
    return new CaseResult(label, Outcome.ERROR, null, null, message, false);
  }
}
