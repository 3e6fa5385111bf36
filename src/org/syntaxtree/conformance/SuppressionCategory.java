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

/** Why a case is expected to fail. */
public enum SuppressionCategory {
  /** A deviation between the two parsers that is not going to be fixed. */
  KNOWN_FAILURE("known"),
  /** A gap in the translation that should eventually be closed. */
  TODO_FAILURE("todo");

  private final String keyword;

  SuppressionCategory(String keyword) {
    this.keyword = keyword;
  }

  /** The word that introduces a rule of this category in a rules file. */
  public String getKeyword() {
    return keyword;
  }

  static SuppressionCategory forKeyword(String keyword) {
    for (SuppressionCategory category : values()) {
      if (category.keyword.equals(keyword)) {
        return category;
      }
    }
    throw new IllegalArgumentException("unknown suppression category: " + keyword);
  }
}
