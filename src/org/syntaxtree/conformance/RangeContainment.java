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

import com.google.common.collect.ImmutableList;
import org.syntaxtree.ast.SyntaxNode;
import org.syntaxtree.source.SourceRange;
import org.syntaxtree.whitequark.Node;

/** Checks that every node's range lies inside its parent's, in either tree schema. */
public final class RangeContainment {
  private RangeContainment() {}

  /** Describes each Syntax Tree node that escapes its parent. */
  public static ImmutableList<String> violations(SyntaxNode root) {
    ImmutableList.Builder<String> violations = ImmutableList.builder();
    check(root, violations);
    return violations.build();
  }

  private static void check(SyntaxNode parent, ImmutableList.Builder<String> violations) {
    for (SyntaxNode child : parent.childNodes()) {
      if (!parent.location().contains(child.location())) {
        violations.add(describe(
            child.getClass().getSimpleName(), child.location(),
            parent.getClass().getSimpleName(), parent.location()));
      }
      check(child, violations);
    }
  }

  /**
   * Describes each reference node whose expression escapes its parent's. Nodes without an
   * expression, such as an empty {@code args}, are not checked.
   */
  public static ImmutableList<String> violations(Node root) {
    ImmutableList.Builder<String> violations = ImmutableList.builder();
    check(root, violations);
    return violations.build();
  }

  private static void check(Node parent, ImmutableList.Builder<String> violations) {
    SourceRange outer = parent.getExpression();
    for (Node child : parent.getNodeChildren()) {
      SourceRange inner = child.getExpression();
      if (outer != null && inner != null && !outer.contains(inner)) {
        violations.add(describe(
            child.getType().getName(), inner, parent.getType().getName(), outer));
      }
      check(child, violations);
    }
  }

  private static String describe(
      String child, SourceRange inner, String parent, SourceRange outer) {
    return child + " at " + inner + " is outside " + parent + " at " + outer;
  }
}
