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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharSource;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a corpus of labeled snippets.
 *
 * <p>A line starting with {@code "!!! "} begins a case; the rest of the line is its label and
 * the lines up to the next marker are its source. Lines before the first marker are ignored.
 */
public final class CorpusLoader {
  static final String MARKER = "!!! ";

  /** The corpus shipped next to this class. */
  public static final String BUNDLED_CORPUS = "parser.txt";

  private static final Joiner LINE_JOINER = Joiner.on('\n');

  private CorpusLoader() {}

  public static ImmutableList<TestCase> loadBundled() {
    return load(Resources.asCharSource(
        Resources.getResource(CorpusLoader.class, BUNDLED_CORPUS), UTF_8));
  }

  public static ImmutableList<TestCase> load(File file) {
    return load(Files.asCharSource(file, UTF_8));
  }

  public static ImmutableList<TestCase> load(CharSource source) {
    try {
      return parse(source.readLines());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Splits corpus lines into cases. Each source is its lines joined with newlines, plus a
   * trailing newline.
   *
   * @throws IllegalArgumentException if two cases share a label
   */
  public static ImmutableList<TestCase> parse(List<String> lines) {
    ImmutableList.Builder<TestCase> cases = ImmutableList.builder();
    Set<String> labels = new HashSet<>();
    String label = null;
    List<String> body = new ArrayList<>();
    for (String line : lines) {
      if (line.startsWith(MARKER)) {
        if (label != null) {
          cases.add(new TestCase(label, LINE_JOINER.join(body) + "\n"));
        }
        label = line.substring(MARKER.length());
        if (!labels.add(label)) {
          throw new IllegalArgumentException("duplicate corpus label: " + label);
        }
        body.clear();
      } else if (label != null) {
        body.add(line);
      }
    }
    if (label != null) {
      cases.add(new TestCase(label, LINE_JOINER.join(body) + "\n"));
    }
    return cases.build();
  }
}
