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
package org.syntaxtree.parser;

import org.syntaxtree.source.SourceBuffer;

/**
 * Thrown when source text cannot be parsed. The message is formatted as {@code
 * line:column: details}.
 */
@SuppressWarnings("serial")
public class ParseException extends RuntimeException {
  private final String details;
  private final int offset;
  private final int line;
  private final int column;

  public ParseException(String details, SourceBuffer buffer, int offset) {
    this(details, offset, buffer.lineOf(offset), buffer.columnOf(offset));
  }

  public ParseException(String details, int offset, int line, int column) {
    super(line + ":" + column + ": " + details);
    this.details = details;
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  /** The message without the position prefix. */
  public String getDetails() {
    return details;
  }

  public int getOffset() {
    return offset;
  }

  /** One-based line of the error. */
  public int getLine() {
    return line;
  }

  /** Zero-based column of the error. */
  public int getColumn() {
    return column;
  }
}
