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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * An error handler that keeps every error and warning reported to it, in order, and writes them
 * out when {@link #generateReport()} is called.
 *
 * <p>This error manager does not produce any output, but subclasses can override the {@link
 * #println(CheckLevel, ComputationError)} method to generate custom output.
 */
public abstract class BasicErrorManager implements ErrorHandler {

  private final List<ComputationError> errors = new ArrayList<>();
  private final List<ComputationError> warnings = new ArrayList<>();

  @Override
  public void report(CheckLevel level, ComputationError error) {
    switch (level) {
      case ERROR:
        errors.add(error);
        break;
      case WARNING:
        warnings.add(error);
        break;
      case OFF:
        break;
    }
  }

  public int getErrorCount() {
    return errors.size();
  }

  public int getWarningCount() {
    return warnings.size();
  }

  public ImmutableList<ComputationError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  public ImmutableList<ComputationError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  public void generateReport() {
    for (ComputationError error : errors) {
      println(CheckLevel.ERROR, error);
    }
    for (ComputationError warning : warnings) {
      println(CheckLevel.WARNING, warning);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, ComputationError error);

  /** Print the summary of the check - number of errors and warnings. */
  protected abstract void printSummary();
}
