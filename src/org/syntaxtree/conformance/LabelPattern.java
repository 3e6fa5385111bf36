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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * A pattern over case labels, written {@code name:discriminator}.
 *
 * <p>The name must match exactly, unless it ends in {@code *}, which matches any suffix. The
 * discriminator after the last {@code :} is matched exactly, or by anything when it is {@code
 * *}. A pattern without a {@code :} matches every discriminator of its name.
 */
@Immutable
public final class LabelPattern {
  private static final String WILDCARD = "*";

  private final String pattern;
  private final String name;
  private final @Nullable String discriminator;

  private LabelPattern(String pattern, String name, @Nullable String discriminator) {
    this.pattern = pattern;
    this.name = name;
    this.discriminator = discriminator;
  }

  public static LabelPattern compile(String pattern) {
    checkNotNull(pattern);
    String trimmed = pattern.trim();
    checkArgument(!trimmed.isEmpty(), "empty label pattern");
    int colon = trimmed.lastIndexOf(':');
    if (colon < 0) {
      return new LabelPattern(trimmed, trimmed, null);
    }
    String name = trimmed.substring(0, colon);
    String discriminator = trimmed.substring(colon + 1);
    checkArgument(!name.isEmpty(), "label pattern without a name: %s", pattern);
    checkArgument(!discriminator.isEmpty(), "label pattern without a discriminator: %s", pattern);
    return new LabelPattern(trimmed, name, discriminator);
  }

  public boolean matches(String label) {
    int colon = label.lastIndexOf(':');
    String labelName = colon < 0 ? label : label.substring(0, colon);
    String labelDiscriminator = colon < 0 ? "" : label.substring(colon + 1);
    return matchesName(labelName) && matchesDiscriminator(labelDiscriminator);
  }

  private boolean matchesName(String labelName) {
    if (name.endsWith(WILDCARD)) {
      return labelName.startsWith(name.substring(0, name.length() - 1));
    }
    return name.equals(labelName);
  }

  private boolean matchesDiscriminator(String labelDiscriminator) {
    return discriminator == null
        || discriminator.equals(WILDCARD)
        || discriminator.equals(labelDiscriminator);
  }

  /** The pattern as written. */
  public String getPattern() {
    return pattern;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof LabelPattern && pattern.equals(((LabelPattern) o).pattern);
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public String toString() {
    return pattern;
  }
}
