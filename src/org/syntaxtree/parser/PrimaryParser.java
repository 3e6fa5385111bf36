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

import org.syntaxtree.ast.SyntaxNode.Program;

/** Parses source text into the Syntax Tree schema. */
@FunctionalInterface
public interface PrimaryParser {

  /**
   * Parses a whole program.
   *
   * @throws ParseException if the source is not valid in the supported subset of Ruby
   */
  Program parse(String source);
}
