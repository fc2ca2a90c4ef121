/*
 * Copyright 2026 The Closure Compiler Authors.
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
package com.google.nnet.analysis;

import static java.util.Objects.requireNonNull;

import java.io.Serializable;

/**
 * A problem found in a computation.
 *
 * @param type the type of the problem
 * @param description the formatted message
 * @param defaultLevel the level the type declares
 */
public record ComputationError(DiagnosticType type, String description, CheckLevel defaultLevel)
    implements Serializable {
  public ComputationError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates an error of the given type.
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message; each is converted with
   *     {@link String#valueOf(Object)}
   */
  public static ComputationError make(DiagnosticType type, Object... arguments) {
    String[] strings = new String[arguments.length];
    for (int i = 0; i < arguments.length; i++) {
      strings[i] = String.valueOf(arguments[i]);
    }
    return new ComputationError(type, type.format(strings), type.level);
  }

  /** Formats this error for the given reporting level, e.g. {@code ERROR - [KEY] message}. */
  public String format(CheckLevel level) {
    return level + " - [" + type.key + "] " + description;
  }

  @Override
  public String toString() {
    return type.key + ". " + description;
  }
}
