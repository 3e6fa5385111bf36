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

/**
 * One snippet of the corpus.
 *
 * @param label unique within a corpus, such as {@code test_alias:105}
 * @param source the snippet, ending with a newline
 */
public record TestCase(String label, String source) {
  public TestCase {
    checkNotNull(label);
    checkNotNull(source);
    checkArgument(!label.isEmpty(), "empty test case label");
  }

  /** The label up to its last {@code :}, or the whole label when it has none. */
  public String name() {
    int colon = label.lastIndexOf(':');
    return colon < 0 ? label : label.substring(0, colon);
  }
}
