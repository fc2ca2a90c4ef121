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
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What one instruction reads and writes, at the granularity of variables, views and buffers.
 * Every set is sorted and free of duplicates.
 */
public final class InstructionAttributes {

  private final ImmutableSortedSet<Integer> variablesRead;
  private final ImmutableSortedSet<Integer> variablesWritten;
  private final ImmutableSortedSet<Integer> viewsRead;
  private final ImmutableSortedSet<Integer> viewsWritten;
  private final ImmutableSortedSet<Integer> buffersRead;
  private final ImmutableSortedSet<Integer> buffersWritten;
  private final boolean hasSideEffects;

  private InstructionAttributes(Builder builder) {
    this.variablesRead = ImmutableSortedSet.copyOf(builder.variablesRead);
    this.variablesWritten = ImmutableSortedSet.copyOf(builder.variablesWritten);
    this.viewsRead = ImmutableSortedSet.copyOf(builder.viewsRead);
    this.viewsWritten = ImmutableSortedSet.copyOf(builder.viewsWritten);
    this.buffersRead = ImmutableSortedSet.copyOf(builder.buffersRead);
    this.buffersWritten = ImmutableSortedSet.copyOf(builder.buffersWritten);
    this.hasSideEffects = builder.hasSideEffects;
  }

  static Builder builder() {
    return new Builder();
  }

  public ImmutableSortedSet<Integer> getVariablesRead() {
    return variablesRead;
  }

  public ImmutableSortedSet<Integer> getVariablesWritten() {
    return variablesWritten;
  }

  public ImmutableSortedSet<Integer> getViewsRead() {
    return viewsRead;
  }

  public ImmutableSortedSet<Integer> getViewsWritten() {
    return viewsWritten;
  }

  public ImmutableSortedSet<Integer> getBuffersRead() {
    return buffersRead;
  }

  public ImmutableSortedSet<Integer> getBuffersWritten() {
    return buffersWritten;
  }

  /**
   * True if the instruction changes state outside the buffers, such as the parameters of an
   * updatable component. Such an instruction must not be removed even when nothing reads what it
   * writes.
   */
  public boolean hasSideEffects() {
    return hasSideEffects;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof InstructionAttributes)) {
      return false;
    }
    InstructionAttributes other = (InstructionAttributes) o;
    return variablesRead.equals(other.variablesRead)
        && variablesWritten.equals(other.variablesWritten)
        && viewsRead.equals(other.viewsRead)
        && viewsWritten.equals(other.viewsWritten)
        && buffersRead.equals(other.buffersRead)
        && buffersWritten.equals(other.buffersWritten)
        && hasSideEffects == other.hasSideEffects;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        variablesRead,
        variablesWritten,
        viewsRead,
        viewsWritten,
        buffersRead,
        buffersWritten,
        hasSideEffects);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("variablesRead", variablesRead)
        .add("variablesWritten", variablesWritten)
        .add("buffersRead", buffersRead)
        .add("buffersWritten", buffersWritten)
        .add("hasSideEffects", hasSideEffects)
        .toString();
  }

  /** Accumulates accesses in any order; {@link #build()} sorts and de-duplicates them. */
  static final class Builder {
    private final List<Integer> variablesRead = new ArrayList<>();
    private final List<Integer> variablesWritten = new ArrayList<>();
    private final List<Integer> viewsRead = new ArrayList<>();
    private final List<Integer> viewsWritten = new ArrayList<>();
    private final List<Integer> buffersRead = new ArrayList<>();
    private final List<Integer> buffersWritten = new ArrayList<>();
    private boolean hasSideEffects = false;

    private Builder() {}

    void addVariablesRead(int start, int end) {
      for (int v = start; v < end; v++) {
        variablesRead.add(v);
      }
    }

    void addVariablesWritten(int start, int end) {
      for (int v = start; v < end; v++) {
        variablesWritten.add(v);
      }
    }

    void addViewRead(int view) {
      viewsRead.add(view);
    }

    void addViewWritten(int view) {
      viewsWritten.add(view);
    }

    void addBufferRead(int buffer) {
      buffersRead.add(buffer);
    }

    void addBufferWritten(int buffer) {
      buffersWritten.add(buffer);
    }

    @CanIgnoreReturnValue
    Builder setHasSideEffects(boolean hasSideEffects) {
      this.hasSideEffects = hasSideEffects;
      return this;
    }

    InstructionAttributes build() {
      return new InstructionAttributes(this);
    }
  }
}
