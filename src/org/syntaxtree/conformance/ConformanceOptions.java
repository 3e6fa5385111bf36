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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.File;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.syntaxtree.whitequark.RubyVersion;

/** Options for a conformance run. */
public class ConformanceOptions {
  /** When set in the environment, locations are compared by default. */
  public static final String PARSER_LOCATION_VARIABLE = "PARSER_LOCATION";

  private RubyVersion rubyVersion = RubyVersion.LATEST;

  private String engine = Environment.DEFAULT_ENGINE;

  private boolean checkLocations;

  /** The corpus to run. Null means the bundled one. */
  private @Nullable File corpus;

  /** Rules files whose suppressions are added to the bundled ones. */
  private ImmutableList<File> suppressionFiles = ImmutableList.of();

  /** Only cases matching this pattern run. */
  private @Nullable LabelPattern filter;

  private @Nullable File jsonReport;

  private boolean printTree;

  public ConformanceOptions() {
    this(System.getenv(PARSER_LOCATION_VARIABLE) != null);
  }

  ConformanceOptions(boolean checkLocations) {
    this.checkLocations = checkLocations;
  }

  public RubyVersion getRubyVersion() {
    return rubyVersion;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setRubyVersion(RubyVersion rubyVersion) {
    this.rubyVersion = checkNotNull(rubyVersion);
    return this;
  }

  public String getEngine() {
    return engine;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setEngine(String engine) {
    this.engine = checkNotNull(engine);
    return this;
  }

  public Environment getEnvironment() {
    return new Environment(rubyVersion, engine);
  }

  public boolean isCheckLocations() {
    return checkLocations;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setCheckLocations(boolean checkLocations) {
    this.checkLocations = checkLocations;
    return this;
  }

  public @Nullable File getCorpus() {
    return corpus;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setCorpus(@Nullable File corpus) {
    this.corpus = corpus;
    return this;
  }

  public ImmutableList<File> getSuppressionFiles() {
    return suppressionFiles;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setSuppressionFiles(List<File> suppressionFiles) {
    this.suppressionFiles = ImmutableList.copyOf(suppressionFiles);
    return this;
  }

  public @Nullable LabelPattern getFilter() {
    return filter;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setFilter(@Nullable LabelPattern filter) {
    this.filter = filter;
    return this;
  }

  public @Nullable File getJsonReport() {
    return jsonReport;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setJsonReport(@Nullable File jsonReport) {
    this.jsonReport = jsonReport;
    return this;
  }

  public boolean isPrintTree() {
    return printTree;
  }

  @CanIgnoreReturnValue
  public ConformanceOptions setPrintTree(boolean printTree) {
    this.printTree = printTree;
    return this;
  }
}
