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

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.source.SourceRange;
import org.syntaxtree.whitequark.Node;
import org.syntaxtree.whitequark.SourceMap;

/**
 * Finds the first difference between two reference trees in a depth-first walk.
 *
 * <p>A path names every node from the root by its type; below the root each step carries the
 * child index, so {@code /begin/send[1]/int[2]} is the third child of the second statement.
 */
public final class TreeComparator {
  private final boolean checkLocations;

  public TreeComparator(boolean checkLocations) {
    this.checkLocations = checkLocations;
  }

  /** Returns null when the trees are equivalent. */
  public @Nullable TreeDifference compare(@Nullable Node expected, @Nullable Node actual) {
    if (expected == null || actual == null) {
      if (expected == actual) {
        return null;
      }
      String path = "/" + (expected != null ? expected : actual).getType().getName();
      return new TreeDifference(path, expected, actual,
          expected == null ? "expected an empty program" : "translated to an empty program");
    }
    return compare("/" + expected.getType().getName(), expected, actual);
  }

  private @Nullable TreeDifference compare(String path, Node expected, Node actual) {
    if (expected.getType() != actual.getType()) {
      return new TreeDifference(path, expected, actual,
          "expected " + expected.getType().getName() + " but was " + actual.getType().getName());
    }
    if (checkLocations) {
      String reason = compareLocations(expected.getLocation(), actual.getLocation());
      if (reason != null) {
        return new TreeDifference(path, expected, actual, reason);
      }
    }
    int count = Math.min(expected.getChildCount(), actual.getChildCount());
    for (int i = 0; i < count; i++) {
      Object mine = expected.getChild(i);
      Object theirs = actual.getChild(i);
      if (mine instanceof Node && theirs instanceof Node) {
        Node child = (Node) mine;
        TreeDifference difference =
            compare(path + "/" + child.getType().getName() + "[" + i + "]", child, (Node) theirs);
        if (difference != null) {
          return difference;
        }
      } else if (!Objects.equals(mine, theirs)) {
        return new TreeDifference(path, expected, actual,
            "child " + i + " expected " + Node.inspect(mine) + " but was " + Node.inspect(theirs));
      }
    }
    if (expected.getChildCount() != actual.getChildCount()) {
      return new TreeDifference(path, expected, actual,
          "expected " + expected.getChildCount() + " children but was "
              + actual.getChildCount());
    }
    return null;
  }

  private static @Nullable String compareLocations(SourceMap expected, SourceMap actual) {
    if (expected.getKind() != actual.getKind()) {
      return "expected a " + expected.getKind() + " map but was " + actual.getKind();
    }
    if (!Objects.equals(expected.getExpression(), actual.getExpression())) {
      return rangeMismatch("expression", expected.getExpression(), actual.getExpression());
    }
    for (SourceMap.Part part : expected.getKind().getParts()) {
      if (!Objects.equals(expected.get(part), actual.get(part))) {
        return rangeMismatch(part.displayName(), expected.get(part), actual.get(part));
      }
    }
    return null;
  }

  private static String rangeMismatch(
      String name, @Nullable SourceRange expected, @Nullable SourceRange actual) {
    return name + " range expected " + expected + " but was " + actual;
  }
}
