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
package com.google.nnet.ir;

/** Flags a component declares about how it reads and writes its operands. */
public enum Capability {
  /** Propagate may use the same view for input and output. */
  PROPAGATE_IN_PLACE,
  /** Backprop may use the same view for the output derivative and the input derivative. */
  BACKPROP_IN_PLACE,
  /** Propagate adds to its output instead of overwriting it. */
  PROPAGATE_ADDS,
  /** Backprop adds to the input derivative instead of overwriting it. */
  BACKPROP_ADDS,
  /** The component accumulates statistics in a store-stats instruction. */
  STORES_STATS,
  /** The component has learnable parameters that backprop updates. */
  UPDATABLE,
  /** Each output row depends only on the same input row, so row counts are preserved. */
  SIMPLE,
  BACKPROP_NEEDS_INPUT,
  BACKPROP_NEEDS_OUTPUT
}
