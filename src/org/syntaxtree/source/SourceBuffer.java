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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Source text plus the line table needed to turn offsets into line and column positions. Both
 * parsers and the translator create their {@link SourceRange}s through the same buffer, so ranges
 * built on either side of a comparison are directly comparable.
 */
public final class SourceBuffer {
  /** The name the reference parser reports for in-memory sources. */
  public static final String DEFAULT_NAME = "(string)";

  private final String name;
  private final String source;
  private final int[] lineStarts;

  public SourceBuffer(String name, String source) {
    this.name = checkNotNull(name);
    this.source = checkNotNull(source);
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        starts.add(i + 1);
      }
    }
    this.lineStarts = Ints.toArray(starts);
  }

  public SourceBuffer(String source) {
    this(DEFAULT_NAME, source);
  }

  public String getName() {
    return name;
  }

  public String getSource() {
    return source;
  }

  public int length() {
    return source.length();
  }

  public char charAt(int offset) {
    return source.charAt(offset);
  }

  /** Returns the text between the two offsets. */
  public String slice(int beginPos, int endPos) {
    checkPositionIndexes(beginPos, endPos, source.length());
    return source.substring(beginPos, endPos);
  }

  /** Returns the one-based line of the given offset. */
  public int lineOf(int offset) {
    checkPositionIndexes(offset, offset, source.length());
    int index = Arrays.binarySearch(lineStarts, offset);
    return index >= 0 ? index + 1 : -index - 1;
  }

  /** Returns the zero-based column of the given offset. */
  public int columnOf(int offset) {
    return offset - lineStarts[lineOf(offset) - 1];
  }

  public int getLineCount() {
    return lineStarts.length;
  }

  /** Returns the text of the given one-based line, without its terminator. */
  public String getLine(int line) {
    checkElementIndex(line - 1, lineStarts.length);
    int begin = lineStarts[line - 1];
    int end = line < lineStarts.length ? lineStarts[line] - 1 : source.length();
    return source.substring(begin, end);
  }

  public SourceRange range(int beginPos, int endPos) {
    checkPositionIndexes(beginPos, endPos, source.length());
    return new SourceRange(
        beginPos, endPos, lineOf(beginPos), columnOf(beginPos), lineOf(endPos), columnOf(endPos));
  }

  /**
   * Returns a range of {@code length} characters starting at {@code start}. A negative length
   * counts backwards, so {@code rangeLength(end, -3)} covers the three characters before {@code
   * end}.
   */
  public SourceRange rangeLength(int start, int length) {
    return length >= 0 ? range(start, start + length) : range(start + length, start);
  }

  /** Returns {@code range} with its begin and end offsets moved by the given amounts. */
  public SourceRange adjust(SourceRange range, int beginDelta, int endDelta) {
    return range(range.beginPos() + beginDelta, range.endPos() + endDelta);
  }

  /** Returns the text covered by {@code range}. */
  public String source(SourceRange range) {
    return slice(range.beginPos(), range.endPos());
  }

  /**
   * Returns the first occurrence of {@code needle} between the two offsets, or -1 when there is
   * none.
   */
  public int indexOf(String needle, int beginPos, int endPos) {
    int index = source.indexOf(needle, beginPos);
    return index >= 0 && index + needle.length() <= endPos ? index : -1;
  }
}
