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

/** The operation tag of an {@link Instruction}. */
public enum Opcode {
  ALLOC_ZEROED,
  ALLOC_UNDEFINED,
  DEALLOC,
  PROPAGATE,
  STORE_STATS,
  BACKPROP,
  MATRIX_COPY,
  MATRIX_ADD,
  COPY_ROWS,
  ADD_ROWS,
  COPY_ROWS_MULTI,
  ADD_ROWS_MULTI,
  COPY_TO_ROWS_MULTI,
  ADD_TO_ROWS_MULTI,
  ADD_ROW_RANGES,
  NO_OP,
  /** Separates the forward pass from the backward pass. */
  PASS_MARKER;

  public boolean isAllocation() {
    return this == ALLOC_ZEROED || this == ALLOC_UNDEFINED;
  }

  /** True for the row-gathering opcodes that read a list of (view, row) sources. */
  public boolean isGatherMulti() {
    return this == COPY_ROWS_MULTI || this == ADD_ROWS_MULTI;
  }

  /** True for the opcodes that scatter rows of one view into a list of (view, row) targets. */
  public boolean isScatterMulti() {
    return this == COPY_TO_ROWS_MULTI || this == ADD_TO_ROWS_MULTI;
  }
}
