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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ComparisonChain;
import com.google.errorprone.annotations.Immutable;
import java.util.List;

/**
 * A Ruby language version, compared numerically on major and then minor. Patch levels are parsed
 * and ignored, since no behavior here depends on them.
 */
@Immutable
public record RubyVersion(int major, int minor) implements Comparable<RubyVersion> {

  public static final RubyVersion RUBY_2_7 = new RubyVersion(2, 7);
  public static final RubyVersion RUBY_3_0 = new RubyVersion(3, 0);
  public static final RubyVersion RUBY_3_1 = new RubyVersion(3, 1);
  public static final RubyVersion RUBY_3_2 = new RubyVersion(3, 2);

  /** The version used when none is configured. */
  public static final RubyVersion LATEST = new RubyVersion(3, 3);

  public RubyVersion {
    checkArgument(major >= 0 && minor >= 0, "bad version %s.%s", major, minor);
  }

  /** Parses {@code "3.1"} or {@code "3.1.4"}. */
  public static RubyVersion parse(String text) {
    List<String> parts = Splitter.on('.').trimResults().splitToList(text);
    checkArgument(parts.size() >= 2 && parts.size() <= 3, "not a Ruby version: %s", text);
    try {
      return new RubyVersion(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a Ruby version: " + text, e);
    }
  }

  public boolean isAtLeast(RubyVersion other) {
    return compareTo(other) >= 0;
  }

  public boolean isAtMost(RubyVersion other) {
    return compareTo(other) <= 0;
  }

  @Override
  public int compareTo(RubyVersion other) {
    return ComparisonChain.start()
        .compare(major, other.major)
        .compare(minor, other.minor)
        .result();
  }

  @Override
  public String toString() {
    return major + "." + minor;
  }
}
