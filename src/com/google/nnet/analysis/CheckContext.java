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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.HashSet;
import java.util.Set;

/**
 * State shared by the checks a caller runs over one or more computations: where diagnostics go,
 * and which once-only warnings have already been emitted. The caller owns the context and
 * decides how long "once" lasts by how long it keeps the context.
 */
public final class CheckContext {

  private final ErrorHandler errorHandler;
  private final Set<DiagnosticType> warnedOnce = new HashSet<>();

  public CheckContext(ErrorHandler errorHandler) {
    this.errorHandler = checkNotNull(errorHandler);
  }

  public ErrorHandler getErrorHandler() {
    return errorHandler;
  }

  /** Reports an error at its type's default level. */
  void report(ComputationError error) {
    if (error.defaultLevel().isOn()) {
      errorHandler.report(error.defaultLevel(), error);
    }
  }

  /**
   * Reports an error and returns the exception that aborts the check, for the caller to throw.
   */
  MalformedComputationException fail(DiagnosticType type, Object... arguments) {
    ComputationError error = ComputationError.make(type, arguments);
    report(error);
    return new MalformedComputationException(error);
  }

  /**
   * Reports the error unless another error of the same type was already reported through this
   * method. Returns whether it was reported.
   */
  boolean reportOnce(ComputationError error) {
    if (!warnedOnce.add(error.type())) {
      return false;
    }
    report(error);
    return true;
  }

  boolean hasReported(DiagnosticType type) {
    return warnedOnce.contains(type);
  }
}
