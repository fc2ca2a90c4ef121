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

import com.google.common.base.MoreObjects;
import java.util.Arrays;

/**
 * One step of a {@link Computation}. Each operand shape has its own subclass with named fields,
 * and the {@link Opcode} tells the variants that share a shape apart (for example
 * {@link Opcode#MATRIX_COPY} and {@link Opcode#MATRIX_ADD} are both {@link ViewToView}).
 *
 * <p>Operands are indices into the tables of the owning computation: buffers, views, the
 * component registry, or one of the auxiliary row tables. Nothing here checks that they are in
 * range; that is the job of the computation checker.
 */
public abstract class Instruction {

  private final Opcode opcode;

  private Instruction(Opcode opcode) {
    this.opcode = checkNotNull(opcode);
  }

  public final Opcode getOpcode() {
    return opcode;
  }

  /** Operand values in declaration order, used for equality and printing. */
  abstract int[] operands();

  @Override
  public final boolean equals(Object o) {
    if (!(o instanceof Instruction)) {
      return false;
    }
    Instruction other = (Instruction) o;
    return opcode == other.opcode && Arrays.equals(operands(), other.operands());
  }

  @Override
  public final int hashCode() {
    return 31 * opcode.hashCode() + Arrays.hashCode(operands());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(getClass().getSimpleName())
        .add("opcode", opcode)
        .add("operands", Arrays.toString(operands()))
        .toString();
  }

  public static BufferInstruction allocZeroed(int buffer) {
    return new BufferInstruction(Opcode.ALLOC_ZEROED, buffer);
  }

  public static BufferInstruction allocUndefined(int buffer) {
    return new BufferInstruction(Opcode.ALLOC_UNDEFINED, buffer);
  }

  public static BufferInstruction dealloc(int buffer) {
    return new BufferInstruction(Opcode.DEALLOC, buffer);
  }

  public static Propagate propagate(
      int component, int precomputedIndexes, int inputView, int outputView) {
    return new Propagate(component, precomputedIndexes, inputView, outputView);
  }

  public static StoreStats storeStats(int component, int view) {
    return new StoreStats(component, view);
  }

  public static Backprop backprop(
      int node,
      int precomputedIndexes,
      int inputView,
      int outputView,
      int outputDerivView,
      int inputDerivView) {
    return new Backprop(
        node, precomputedIndexes, inputView, outputView, outputDerivView, inputDerivView);
  }

  public static ViewToView matrixCopy(int destView, int srcView) {
    return new ViewToView(Opcode.MATRIX_COPY, destView, srcView);
  }

  public static ViewToView matrixAdd(int destView, int srcView) {
    return new ViewToView(Opcode.MATRIX_ADD, destView, srcView);
  }

  public static GatherRows copyRows(int destView, int srcView, int indexes) {
    return new GatherRows(Opcode.COPY_ROWS, destView, srcView, indexes);
  }

  public static GatherRows addRows(int destView, int srcView, int indexes) {
    return new GatherRows(Opcode.ADD_ROWS, destView, srcView, indexes);
  }

  public static RowsMulti copyRowsMulti(int destView, int indexesMulti) {
    return new RowsMulti(Opcode.COPY_ROWS_MULTI, destView, indexesMulti);
  }

  public static RowsMulti addRowsMulti(int destView, int indexesMulti) {
    return new RowsMulti(Opcode.ADD_ROWS_MULTI, destView, indexesMulti);
  }

  public static RowsMulti copyToRowsMulti(int srcView, int indexesMulti) {
    return new RowsMulti(Opcode.COPY_TO_ROWS_MULTI, srcView, indexesMulti);
  }

  public static RowsMulti addToRowsMulti(int srcView, int indexesMulti) {
    return new RowsMulti(Opcode.ADD_TO_ROWS_MULTI, srcView, indexesMulti);
  }

  public static AddRowRanges addRowRanges(int destView, int srcView, int ranges) {
    return new AddRowRanges(destView, srcView, ranges);
  }

  public static NoOp noOp() {
    return new NoOp(Opcode.NO_OP);
  }

  public static NoOp passMarker() {
    return new NoOp(Opcode.PASS_MARKER);
  }

  /** Allocation or deallocation of a whole buffer. */
  public static final class BufferInstruction extends Instruction {
    private final int buffer;

    private BufferInstruction(Opcode opcode, int buffer) {
      super(opcode);
      checkArgument(opcode.isAllocation() || opcode == Opcode.DEALLOC, opcode);
      this.buffer = buffer;
    }

    public int getBuffer() {
      return buffer;
    }

    @Override
    int[] operands() {
      return new int[] {buffer};
    }
  }

  /** Forward propagation of one component from an input view to an output view. */
  public static final class Propagate extends Instruction {
    private final int component;
    private final int precomputedIndexes;
    private final int inputView;
    private final int outputView;

    private Propagate(int component, int precomputedIndexes, int inputView, int outputView) {
      super(Opcode.PROPAGATE);
      this.component = component;
      this.precomputedIndexes = precomputedIndexes;
      this.inputView = inputView;
      this.outputView = outputView;
    }

    public int getComponent() {
      return component;
    }

    public int getPrecomputedIndexes() {
      return precomputedIndexes;
    }

    public int getInputView() {
      return inputView;
    }

    public int getOutputView() {
      return outputView;
    }

    @Override
    int[] operands() {
      return new int[] {component, precomputedIndexes, inputView, outputView};
    }
  }

  /** Accumulates a component's statistics from the output view of its forward pass. */
  public static final class StoreStats extends Instruction {
    private final int component;
    private final int view;

    private StoreStats(int component, int view) {
      super(Opcode.STORE_STATS);
      this.component = component;
      this.view = view;
    }

    public int getComponent() {
      return component;
    }

    public int getView() {
      return view;
    }

    @Override
    int[] operands() {
      return new int[] {component, view};
    }
  }

  /**
   * Backward pass through the component of a network node. Every view except the output
   * derivative may be 0 when the component does not need it.
   */
  public static final class Backprop extends Instruction {
    private final int node;
    private final int precomputedIndexes;
    private final int inputView;
    private final int outputView;
    private final int outputDerivView;
    private final int inputDerivView;

    private Backprop(
        int node,
        int precomputedIndexes,
        int inputView,
        int outputView,
        int outputDerivView,
        int inputDerivView) {
      super(Opcode.BACKPROP);
      this.node = node;
      this.precomputedIndexes = precomputedIndexes;
      this.inputView = inputView;
      this.outputView = outputView;
      this.outputDerivView = outputDerivView;
      this.inputDerivView = inputDerivView;
    }

    public int getNode() {
      return node;
    }

    public int getPrecomputedIndexes() {
      return precomputedIndexes;
    }

    public int getInputView() {
      return inputView;
    }

    public int getOutputView() {
      return outputView;
    }

    public int getOutputDerivView() {
      return outputDerivView;
    }

    public int getInputDerivView() {
      return inputDerivView;
    }

    @Override
    int[] operands() {
      return new int[] {
        node, precomputedIndexes, inputView, outputView, outputDerivView, inputDerivView
      };
    }
  }

  /** Copies or adds one view into another view of the same shape. */
  public static final class ViewToView extends Instruction {
    private final int destView;
    private final int srcView;

    private ViewToView(Opcode opcode, int destView, int srcView) {
      super(opcode);
      checkArgument(opcode == Opcode.MATRIX_COPY || opcode == Opcode.MATRIX_ADD, opcode);
      this.destView = destView;
      this.srcView = srcView;
    }

    public int getDestView() {
      return destView;
    }

    public int getSrcView() {
      return srcView;
    }

    @Override
    int[] operands() {
      return new int[] {destView, srcView};
    }
  }

  /**
   * Copies or adds rows of a source view into a destination view, where row {@code i} of the
   * destination takes source row {@code indexes[i]}, or nothing if that entry is -1.
   */
  public static final class GatherRows extends Instruction {
    private final int destView;
    private final int srcView;
    private final int indexes;

    private GatherRows(Opcode opcode, int destView, int srcView, int indexes) {
      super(opcode);
      checkArgument(opcode == Opcode.COPY_ROWS || opcode == Opcode.ADD_ROWS, opcode);
      this.destView = destView;
      this.srcView = srcView;
      this.indexes = indexes;
    }

    public int getDestView() {
      return destView;
    }

    public int getSrcView() {
      return srcView;
    }

    /** Index into {@link Computation#getIndexes()}. */
    public int getIndexes() {
      return indexes;
    }

    @Override
    int[] operands() {
      return new int[] {destView, srcView, indexes};
    }
  }

  /**
   * The four row-list opcodes that pair each row of one view with a (view, row) entry of an
   * {@code indexesMulti} table. For the gathering variants {@link #getView()} is the
   * destination; for the scattering variants it is the source.
   */
  public static final class RowsMulti extends Instruction {
    private final int view;
    private final int indexesMulti;

    private RowsMulti(Opcode opcode, int view, int indexesMulti) {
      super(opcode);
      checkArgument(opcode.isGatherMulti() || opcode.isScatterMulti(), opcode);
      this.view = view;
      this.indexesMulti = indexesMulti;
    }

    public int getView() {
      return view;
    }

    /** Index into {@link Computation#getIndexesMulti()}. */
    public int getIndexesMulti() {
      return indexesMulti;
    }

    @Override
    int[] operands() {
      return new int[] {view, indexesMulti};
    }
  }

  /** Adds to each destination row the sum of a range of source rows. */
  public static final class AddRowRanges extends Instruction {
    private final int destView;
    private final int srcView;
    private final int ranges;

    private AddRowRanges(int destView, int srcView, int ranges) {
      super(Opcode.ADD_ROW_RANGES);
      this.destView = destView;
      this.srcView = srcView;
      this.ranges = ranges;
    }

    public int getDestView() {
      return destView;
    }

    public int getSrcView() {
      return srcView;
    }

    /** Index into {@link Computation#getIndexesRanges()}. */
    public int getRanges() {
      return ranges;
    }

    @Override
    int[] operands() {
      return new int[] {destView, srcView, ranges};
    }
  }

  /** An instruction that does nothing; the pass marker is one of these. */
  public static final class NoOp extends Instruction {
    private NoOp(Opcode opcode) {
      super(opcode);
      checkArgument(opcode == Opcode.NO_OP || opcode == Opcode.PASS_MARKER, opcode);
    }

    @Override
    int[] operands() {
      return new int[0];
    }
  }
}
