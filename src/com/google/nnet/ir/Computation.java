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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Objects;

/**
 * A compiled, linear program for the forward and backward passes of a network, expressed over a
 * fixed set of buffers and views into them. Instances are immutable; build them with {@link
 * #builder()}.
 *
 * <p>Entry 0 of the buffer table and of the view table is the empty buffer and empty view
 * respectively. The builder inserts both, so the first buffer or view added gets index 1.
 */
public final class Computation {

  private final ImmutableList<BufferInfo> buffers;
  private final ImmutableList<ViewInfo> views;
  private final ImmutableList<Instruction> instructions;
  private final ImmutableList<ImmutableList<Integer>> indexes;
  private final ImmutableList<ImmutableList<RowRef>> indexesMulti;
  private final ImmutableList<ImmutableList<RowRange>> indexesRanges;
  private final int precomputedIndexesCount;
  private final ImmutableList<EndpointBinding> endpoints;

  private Computation(Builder builder) {
    this.buffers = builder.buffers.build();
    this.views = builder.views.build();
    this.instructions = builder.instructions.build();
    this.indexes = builder.indexes.build();
    this.indexesMulti = builder.indexesMulti.build();
    this.indexesRanges = builder.indexesRanges.build();
    this.precomputedIndexesCount = builder.precomputedIndexesCount;
    this.endpoints = builder.endpoints.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder holding a copy of this computation, for producing rewritten versions. */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.buffers = ImmutableList.<BufferInfo>builder().addAll(buffers);
    b.views = ImmutableList.<ViewInfo>builder().addAll(views);
    b.numBuffers = buffers.size();
    b.numViews = views.size();
    b.instructions.addAll(instructions);
    b.numInstructions = instructions.size();
    b.indexes.addAll(indexes);
    b.numIndexes = indexes.size();
    b.indexesMulti.addAll(indexesMulti);
    b.numIndexesMulti = indexesMulti.size();
    b.indexesRanges.addAll(indexesRanges);
    b.numIndexesRanges = indexesRanges.size();
    b.precomputedIndexesCount = precomputedIndexesCount;
    b.endpoints.addAll(endpoints);
    return b;
  }

  /** All buffers, including the empty buffer at index 0. */
  public ImmutableList<BufferInfo> getBuffers() {
    return buffers;
  }

  /** All views, including the empty view at index 0. */
  public ImmutableList<ViewInfo> getViews() {
    return views;
  }

  public ImmutableList<Instruction> getInstructions() {
    return instructions;
  }

  /** Per-row source index lists used by {@link Opcode#COPY_ROWS} and {@link Opcode#ADD_ROWS}. */
  public ImmutableList<ImmutableList<Integer>> getIndexes() {
    return indexes;
  }

  /** Per-row (view, row) lists used by the four {@code *_ROWS_MULTI} opcodes. */
  public ImmutableList<ImmutableList<RowRef>> getIndexesMulti() {
    return indexesMulti;
  }

  /** Per-row source ranges used by {@link Opcode#ADD_ROW_RANGES}. */
  public ImmutableList<ImmutableList<RowRange>> getIndexesRanges() {
    return indexesRanges;
  }

  /**
   * Number of precomputed-indexes objects available to non-simple components. Valid operand
   * values run from 0 ("none") up to and including this count.
   */
  public int getPrecomputedIndexesCount() {
    return precomputedIndexesCount;
  }

  public ImmutableList<EndpointBinding> getEndpoints() {
    return endpoints;
  }

  public int getBufferCount() {
    return buffers.size();
  }

  public int getViewCount() {
    return views.size();
  }

  public int getInstructionCount() {
    return instructions.size();
  }

  public BufferInfo getBuffer(int index) {
    return buffers.get(index);
  }

  public ViewInfo getView(int index) {
    return views.get(index);
  }

  public Instruction getInstruction(int index) {
    return instructions.get(index);
  }

  /** Whether the view covers every row and column of its buffer. */
  public boolean isWholeBuffer(int viewIndex) {
    ViewInfo view = views.get(viewIndex);
    BufferInfo buffer = buffers.get(view.bufferIndex());
    return view.rowOffset() == 0
        && view.colOffset() == 0
        && view.numRows() == buffer.numRows()
        && view.numCols() == buffer.numCols();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Computation)) {
      return false;
    }
    Computation other = (Computation) o;
    return buffers.equals(other.buffers)
        && views.equals(other.views)
        && instructions.equals(other.instructions)
        && indexes.equals(other.indexes)
        && indexesMulti.equals(other.indexesMulti)
        && indexesRanges.equals(other.indexesRanges)
        && precomputedIndexesCount == other.precomputedIndexesCount
        && endpoints.equals(other.endpoints);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        buffers,
        views,
        instructions,
        indexes,
        indexesMulti,
        indexesRanges,
        precomputedIndexesCount,
        endpoints);
  }

  /** Builder for {@link Computation}. Every {@code add} method returns the new entry's index. */
  public static final class Builder {
    private ImmutableList.Builder<BufferInfo> buffers =
        ImmutableList.<BufferInfo>builder().add(BufferInfo.EMPTY);
    private ImmutableList.Builder<ViewInfo> views =
        ImmutableList.<ViewInfo>builder().add(ViewInfo.EMPTY);
    private final ImmutableList.Builder<Instruction> instructions = ImmutableList.builder();
    private final ImmutableList.Builder<ImmutableList<Integer>> indexes = ImmutableList.builder();
    private final ImmutableList.Builder<ImmutableList<RowRef>> indexesMulti =
        ImmutableList.builder();
    private final ImmutableList.Builder<ImmutableList<RowRange>> indexesRanges =
        ImmutableList.builder();
    private final ImmutableList.Builder<EndpointBinding> endpoints = ImmutableList.builder();
    private int numBuffers = 1;
    private int numViews = 1;
    private int numInstructions = 0;
    private int numIndexes = 0;
    private int numIndexesMulti = 0;
    private int numIndexesRanges = 0;
    private int precomputedIndexesCount = 0;

    private Builder() {}

    @CanIgnoreReturnValue
    public int addBuffer(int numRows, int numCols) {
      buffers.add(new BufferInfo(numRows, numCols));
      return numBuffers++;
    }

    @CanIgnoreReturnValue
    public int addView(int buffer, int rowOffset, int numRows, int colOffset, int numCols) {
      checkArgument(buffer > 0, "views of the empty buffer are implicit");
      views.add(new ViewInfo(buffer, rowOffset, numRows, colOffset, numCols));
      return numViews++;
    }

    /** Adds a buffer together with a view covering all of it, returning the view's index. */
    public int addBufferWithView(int numRows, int numCols) {
      int buffer = addBuffer(numRows, numCols);
      return addView(buffer, 0, numRows, 0, numCols);
    }

    @CanIgnoreReturnValue
    public int add(Instruction instruction) {
      instructions.add(checkNotNull(instruction));
      return numInstructions++;
    }

    @CanIgnoreReturnValue
    public int addIndexes(List<Integer> rowIndexes) {
      indexes.add(ImmutableList.copyOf(rowIndexes));
      return numIndexes++;
    }

    @CanIgnoreReturnValue
    public int addIndexesMulti(List<RowRef> pairs) {
      indexesMulti.add(ImmutableList.copyOf(pairs));
      return numIndexesMulti++;
    }

    @CanIgnoreReturnValue
    public int addIndexesRanges(List<RowRange> ranges) {
      indexesRanges.add(ImmutableList.copyOf(ranges));
      return numIndexesRanges++;
    }

    @CanIgnoreReturnValue
    public Builder setPrecomputedIndexesCount(int count) {
      checkArgument(count >= 0, count);
      this.precomputedIndexesCount = count;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addEndpoint(EndpointBinding binding) {
      endpoints.add(checkNotNull(binding));
      return this;
    }

    public int getInstructionCount() {
      return numInstructions;
    }

    public Computation build() {
      return new Computation(this);
    }
  }
}
