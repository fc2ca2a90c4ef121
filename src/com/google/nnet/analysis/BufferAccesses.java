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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** The access history of one buffer, plus how it comes into and goes out of existence. */
public final class BufferAccesses {

  /** Marks a missing allocation or deallocation instruction. */
  public static final int NONE = -1;

  private final ImmutableList<Access> accesses;
  private final int allocateInstruction;
  private final int deallocateInstruction;
  private final boolean isInput;
  private final boolean isOutput;

  BufferAccesses(
      ImmutableList<Access> accesses,
      int allocateInstruction,
      int deallocateInstruction,
      boolean isInput,
      boolean isOutput) {
    this.accesses = accesses;
    this.allocateInstruction = allocateInstruction;
    this.deallocateInstruction = deallocateInstruction;
    this.isInput = isInput;
    this.isOutput = isOutput;
  }

  /**
   * Accesses in instruction order. Allocation and deallocation do not appear here, except that a
   * zeroed allocation is a write.
   */
  public ImmutableList<Access> getAccesses() {
    return accesses;
  }

  /** The allocating instruction, or {@link #NONE} for buffers supplied by the caller. */
  public int getAllocateInstruction() {
    return allocateInstruction;
  }

  /** The deallocating instruction, or {@link #NONE} for buffers handed back to the caller. */
  public int getDeallocateInstruction() {
    return deallocateInstruction;
  }

  /** Whether the caller supplies the buffer's contents. */
  public boolean isInput() {
    return isInput;
  }

  /** Whether the buffer's contents are handed back to the caller. */
  public boolean isOutput() {
    return isOutput;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BufferAccesses)) {
      return false;
    }
    BufferAccesses other = (BufferAccesses) o;
    return accesses.equals(other.accesses)
        && allocateInstruction == other.allocateInstruction
        && deallocateInstruction == other.deallocateInstruction
        && isInput == other.isInput
        && isOutput == other.isOutput;
  }

  @Override
  public int hashCode() {
    return Objects.hash(accesses, allocateInstruction, deallocateInstruction, isInput, isOutput);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("allocate", allocateInstruction)
        .add("deallocate", deallocateInstruction)
        .add("isInput", isInput)
        .add("isOutput", isOutput)
        .add("accesses", accesses)
        .toString();
  }
}
