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

import static com.google.common.base.Preconditions.checkNotNull;

import org.syntaxtree.whitequark.RubyVersion;

/**
 * The Ruby the reference parser stands in for. Suppression rules are selected against it.
 *
 * @param version the language version
 * @param engine the interpreter, such as {@code ruby} or {@code truffleruby}
 */
public record Environment(RubyVersion version, String engine) {
  public static final String DEFAULT_ENGINE = "ruby";

  public Environment {
    checkNotNull(version);
    checkNotNull(engine);
  }

  public static Environment of(RubyVersion version) {
    return new Environment(version, DEFAULT_ENGINE);
  }

  @Override
  public String toString() {
    return engine + " " + version;
  }
}
