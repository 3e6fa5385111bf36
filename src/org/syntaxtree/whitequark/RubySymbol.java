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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.regex.Pattern;

/**
 * A symbol child of a {@link Node}, such as the method name of a {@code send}. Kept distinct from
 * {@link String} children, which hold string literal values, because the two print differently.
 */
@Immutable
public record RubySymbol(String name) {
  private static final Pattern PLAIN =
      Pattern.compile("(?:[@$]|@@)?[A-Za-z_][A-Za-z0-9_]*|[A-Za-z_][A-Za-z0-9_]*[?!=]"
          + "|\\$(?:[1-9][0-9]*|[~*$?!@/\\\\;,.=:<>\"&`'+0]|-\\w)");

  private static final ImmutableSet<String> OPERATORS =
      ImmutableSet.of(
          "+", "-", "*", "/", "%", "**", "==", "!=", "<", ">", "<=", ">=", "<=>", "===", "=~",
          "!~", "!", "~", "+@", "-@", "[]", "[]=", "<<", ">>", "&", "|", "^");

  public RubySymbol {
    checkNotNull(name);
  }

  public static RubySymbol of(String name) {
    return new RubySymbol(name);
  }

  /** Prints the symbol the way Ruby's {@code Symbol#inspect} does. */
  @Override
  public String toString() {
    if (PLAIN.matcher(name).matches() || OPERATORS.contains(name)) {
      return ":" + name;
    }
    return ":" + Node.inspectString(name);
  }
}
