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

import com.google.errorprone.annotations.Immutable;

/**
 * A lexical token. {@code start} and {@code end} are character offsets into the source, and
 * {@code spaceBefore} records whether whitespace separates the token from the previous one, which
 * decides between unary and binary operators and between commands and plain references.
 */
@Immutable
public record Token(TokenType type, String value, int start, int end, boolean spaceBefore) {

  public boolean is(TokenType otherType) {
    return type == otherType;
  }

  public boolean is(TokenType otherType, String otherValue) {
    return type == otherType && value.equals(otherValue);
  }

  public boolean isOperator(String operator) {
    return is(TokenType.OPERATOR, operator);
  }

  public boolean isKeyword(String keyword) {
    return is(TokenType.KEYWORD, keyword);
  }

  @Override
  public String toString() {
    return type + "(" + value + ")@" + start;
  }
}
