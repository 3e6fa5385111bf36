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

/** The classification of one corpus case. */
public enum Outcome {
  /** The translated tree equals the reference tree. */
  PASS,
  /** The trees differ and no suppression covers the case. */
  FAIL,
  /** The trees differ and a suppression rule covers the case. */
  SUPPRESSED,
  /** The reference parser rejected the snippet for the configured version. */
  SKIPPED,
  /** The case could not be run at all. */
  ERROR;

  public boolean isFailure() {
    return this == FAIL || this == ERROR;
  }
}
