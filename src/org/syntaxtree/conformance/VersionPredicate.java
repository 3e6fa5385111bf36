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

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.whitequark.RubyVersion;

/**
 * Restricts a suppression rule to some environments. The predicate holds when the version
 * comparison holds or the engine matches; a part that is absent never holds on its own.
 */
@Immutable
public final class VersionPredicate {

  /** How the environment's version compares to the predicate's. */
  public enum Comparison {
    LESS("<"),
    AT_MOST("<="),
    EQUAL("=="),
    AT_LEAST(">="),
    GREATER(">");

    private final String symbol;

    Comparison(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    boolean test(int order) {
      switch (this) {
        case LESS:
          return order < 0;
        case AT_MOST:
          return order <= 0;
        case EQUAL:
          return order == 0;
        case AT_LEAST:
          return order >= 0;
        case GREATER:
          return order > 0;
      }
      throw new AssertionError(this);
    }

    static Comparison forSymbol(String symbol) {
      for (Comparison comparison : values()) {
        if (comparison.symbol.equals(symbol)) {
          return comparison;
        }
      }
      throw new IllegalArgumentException("unknown version comparison: " + symbol);
    }
  }

  private final @Nullable Comparison comparison;
  private final @Nullable RubyVersion version;
  private final @Nullable String engine;

  private VersionPredicate(
      @Nullable Comparison comparison, @Nullable RubyVersion version, @Nullable String engine) {
    checkArgument((comparison == null) == (version == null), "comparison without a version");
    checkArgument(version != null || engine != null, "empty version predicate");
    this.comparison = comparison;
    this.version = version;
    this.engine = engine;
  }

  public static VersionPredicate version(Comparison comparison, RubyVersion version) {
    return new VersionPredicate(comparison, version, null);
  }

  public static VersionPredicate engine(String engine) {
    return new VersionPredicate(null, null, engine);
  }

  /** Holds when the version comparison holds or the environment runs on {@code engine}. */
  public static VersionPredicate versionOrEngine(
      Comparison comparison, RubyVersion version, String engine) {
    return new VersionPredicate(comparison, version, engine);
  }

  public boolean test(Environment environment) {
    if (comparison != null && comparison.test(environment.version().compareTo(version))) {
      return true;
    }
    return engine != null && engine.equals(environment.engine());
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof VersionPredicate)) {
      return false;
    }
    VersionPredicate that = (VersionPredicate) o;
    return comparison == that.comparison
        && Objects.equals(version, that.version)
        && Objects.equals(engine, that.engine);
  }

  @Override
  public int hashCode() {
    return Objects.hash(comparison, version, engine);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (comparison != null) {
      sb.append(comparison.getSymbol()).append(' ').append(version);
    }
    if (engine != null) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append("engine=").append(engine);
    }
    return sb.toString();
  }
}
