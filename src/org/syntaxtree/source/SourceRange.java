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
package org.syntaxtree.source;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;

/**
 * A span of characters in a {@link SourceBuffer}. Offsets are zero based and the end offset is
 * exclusive; lines are one based and columns are zero based.
 *
 * <p>Equality is exact: two ranges covering the same text at different offsets are different.
 */
@Immutable
public record SourceRange(
    int beginPos, int endPos, int startLine, int startColumn, int endLine, int endColumn) {

  public SourceRange {
    checkArgument(beginPos >= 0, "negative begin offset %s", beginPos);
    if (endPos < beginPos) {
      throw new IllegalStateException(
          "Recorded bad position information\n"
              + "begin-pos: " + beginPos + "\n"
              + "end-pos: " + endPos);
    }
    if (endLine < startLine) {
      throw new IllegalStateException(
          "Recorded bad position information\n"
              + "start-line: " + startLine + "\n"
              + "end-line: " + endLine);
    }
  }

  public int length() {
    return endPos - beginPos;
  }

  public boolean isEmpty() {
    return beginPos == endPos;
  }

  /** Returns the smallest range covering both this range and {@code other}. */
  public SourceRange join(SourceRange other) {
    SourceRange first = beginPos <= other.beginPos ? this : other;
    SourceRange last = endPos >= other.endPos ? this : other;
    return new SourceRange(
        first.beginPos,
        last.endPos,
        first.startLine,
        first.startColumn,
        last.endLine,
        last.endColumn);
  }

  /** Whether {@code other} lies entirely inside this range. */
  public boolean contains(SourceRange other) {
    return beginPos <= other.beginPos && other.endPos <= endPos;
  }

  @Override
  public String toString() {
    return beginPos + "..." + endPos;
  }
}
