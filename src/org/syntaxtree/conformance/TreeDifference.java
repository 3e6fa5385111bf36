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

import org.jspecify.annotations.Nullable;
import org.syntaxtree.whitequark.Node;

/**
 * The first place where two reference trees disagree.
 *
 * @param path the position of the differing node, such as {@code /begin/send[1]}
 * @param expected the subtree produced by the reference parser, or null where it has none
 * @param actual the translated subtree, or null where it has none
 * @param reason what differs at {@code path}
 */
public record TreeDifference(
    String path, @Nullable Node expected, @Nullable Node actual, String reason) {
  public TreeDifference {
    checkNotNull(path);
    checkNotNull(reason);
  }

  /** A multi-line description with both subtrees. */
  public String describe() {
    return "at "
        + path
        + ": "
        + reason
        + "\nexpected:\n"
        + render(expected)
        + "\nactual:\n"
        + render(actual);
  }

  private static String render(@Nullable Node node) {
    return node == null ? "nil" : node.toSexp();
  }

  @Override
  public String toString() {
    return path + ": " + reason;
  }
}
