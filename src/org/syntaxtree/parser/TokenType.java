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

/** The kinds of {@link Token} the {@link Lexer} produces. */
public enum TokenType {
  IDENTIFIER,
  CONSTANT,
  IVAR,
  GVAR,
  CVAR,
  /** {@code $1} or one of {@code $& $` $' $+}. */
  BACKREF,
  INTEGER,
  FLOAT,
  /** A number with an {@code r} suffix; the value includes the suffix. */
  RATIONAL,
  /** A number with an {@code i} or {@code ri} suffix; the value includes the suffix. */
  IMAGINARY,
  KEYWORD,
  /** {@code name:}; the value includes the colon. */
  LABEL,
  /** {@code :name}; the value excludes the colon, the range includes it. */
  SYMBOL,
  OPERATOR,
  STRING_BEGIN,
  STRING_CONTENT,
  STRING_END,
  /** The closing quote and colon of a quoted label, as in {@code "key": value}. */
  LABEL_END,
  /** {@code :"} or {@code :'}. The symbol is closed by a {@link #STRING_END}. */
  DSYMBOL_BEGIN,
  REGEXP_BEGIN,
  /** The closing slash; the value includes the trailing flags. */
  REGEXP_END,
  EMBEXPR_BEGIN,
  EMBEXPR_END,
  NEWLINE,
  SEMICOLON,
  EOF
}
