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

/**
 * Thrown when a computation violates one of the invariants the analysis relies on. These are
 * never recoverable: they mean the compiler or an optimization pass produced a bad program.
 */
public final class MalformedComputationException extends RuntimeException {
  private static final long serialVersionUID = 1;

  private final ComputationError error;

  public MalformedComputationException(ComputationError error) {
    super(error.toString());
    this.error = error;
  }

  static MalformedComputationException make(DiagnosticType type, Object... arguments) {
    return new MalformedComputationException(ComputationError.make(type, arguments));
  }

  public ComputationError getError() {
    return error;
  }

  public DiagnosticType getType() {
    return error.type();
  }
}
