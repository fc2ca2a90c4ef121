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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Options for {@link ComputationChecker}. */
public class CheckOptions {

  /**
   * Whether to check that no variable is written after it has been read. This holds for freshly
   * compiled computations only; turn it off once the optimizer may reuse storage or run
   * components in place.
   */
  private boolean checkRewrite = false;

  /** Whether to check that no variable of a non-input buffer is read before it is written. */
  private boolean checkUndefined = true;

  /** Whether the command line tool prints the access traces after checking. */
  private boolean printAccesses = false;

  public boolean getCheckRewrite() {
    return checkRewrite;
  }

  @CanIgnoreReturnValue
  public CheckOptions setCheckRewrite(boolean checkRewrite) {
    this.checkRewrite = checkRewrite;
    return this;
  }

  public boolean getCheckUndefined() {
    return checkUndefined;
  }

  @CanIgnoreReturnValue
  public CheckOptions setCheckUndefined(boolean checkUndefined) {
    this.checkUndefined = checkUndefined;
    return this;
  }

  public boolean getPrintAccesses() {
    return printAccesses;
  }

  @CanIgnoreReturnValue
  public CheckOptions setPrintAccesses(boolean printAccesses) {
    this.printAccesses = printAccesses;
    return this;
  }
}
