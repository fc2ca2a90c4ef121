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

import java.text.MessageFormat;

/**
 * The type of an analysis error or warning. Types are compared by key; the checks declare them
 * as constants next to the code that reports them.
 */
public final class DiagnosticType {

  /** Unique identifier, such as {@code NNET_BUFFER_ALLOCATED_TWICE}. */
  public final String key;

  /** A {@link MessageFormat} pattern whose arguments are preformatted indices. */
  public final String template;

  public final CheckLevel level;

  public static DiagnosticType error(String key, String template) {
    return new DiagnosticType(key, CheckLevel.ERROR, template);
  }

  public static DiagnosticType warning(String key, String template) {
    return new DiagnosticType(key, CheckLevel.WARNING, template);
  }

  private DiagnosticType(String key, CheckLevel level, String template) {
    this.key = key;
    this.level = level;
    this.template = template;
  }

  String format(String... arguments) {
    // Strings rather than ints so that indices are not rendered with grouping.
    return MessageFormat.format(template, (Object[]) arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + ": " + template;
  }
}
