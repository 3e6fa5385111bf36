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

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * Marks the cases matching {@code pattern} as expected failures, optionally only in some
 * environments.
 */
@Immutable
public record SuppressionRule(
    LabelPattern pattern, SuppressionCategory category, @Nullable VersionPredicate predicate) {
  public SuppressionRule {
    checkNotNull(pattern);
    checkNotNull(category);
  }

  public static SuppressionRule known(String pattern) {
    return new SuppressionRule(LabelPattern.compile(pattern), SuppressionCategory.KNOWN_FAILURE,
        null);
  }

  public static SuppressionRule todo(String pattern) {
    return new SuppressionRule(LabelPattern.compile(pattern), SuppressionCategory.TODO_FAILURE,
        null);
  }

  /** Returns a copy that only applies where {@code newPredicate} holds. */
  public SuppressionRule when(VersionPredicate newPredicate) {
    return new SuppressionRule(pattern, category, newPredicate);
  }

  public boolean appliesTo(Environment environment) {
    return predicate == null || predicate.test(environment);
  }

  @Override
  public String toString() {
    String rule = category.getKeyword() + " " + pattern;
    return predicate == null ? rule : rule + " " + predicate;
  }
}
