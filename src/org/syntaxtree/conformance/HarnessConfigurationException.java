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

/**
 * Thrown when the harness is misconfigured, for example when the corpus holds a snippet the
 * primary parser cannot parse.
 */
@SuppressWarnings("serial")
public class HarnessConfigurationException extends RuntimeException {
  public HarnessConfigurationException(String message) {
    super(message);
  }

  public HarnessConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
