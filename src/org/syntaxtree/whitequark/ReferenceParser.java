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
package org.syntaxtree.whitequark;

import org.jspecify.annotations.Nullable;
import org.syntaxtree.parser.ParseException;
import org.syntaxtree.source.SourceBuffer;

/** Parses source into the parser gem's AST. This is the expected side of a conformance check. */
@FunctionalInterface
public interface ReferenceParser {

  /**
   * Returns the tree for the whole buffer, or null when the buffer holds no statements.
   *
   * @throws ParseException if the source is not valid for this parser's Ruby version
   */
  @Nullable Node parse(SourceBuffer buffer);
}
