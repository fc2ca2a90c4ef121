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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.nnet.ir.BufferInfo;
import com.google.nnet.ir.Computation;
import com.google.nnet.ir.ViewInfo;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Splits every buffer of a computation into "variables", the finest units whose reads and writes
 * the analysis tracks.
 *
 * <p>A buffer is split along its columns only. The split points are the distinct column offsets
 * and column ends of all views of the buffer, so every view covers a run of whole variables. For
 * example a 10-column buffer with views over columns [0,10), [0,4) and [4,10) has split points
 * {0, 4, 10} and two variables. Row sub-ranges are not tracked; a view that does not cover every
 * row of its buffer is handled conservatively by {@link #recordAccessForView}.
 *
 * <p>Variables are numbered globally. Buffer 1 owns the first block of indices, buffer 2 the next
 * block and so on; the empty buffer 0 owns none.
 */
public final class ComputationVariables {

  static final DiagnosticType VIEW_BUFFER_OUT_OF_RANGE =
      DiagnosticType.error(
          "NNET_VIEW_BUFFER_OUT_OF_RANGE", "View {0} refers to buffer {1}, which does not exist.");

  static final DiagnosticType BUFFER_WITHOUT_VARIABLES =
      DiagnosticType.error(
          "NNET_BUFFER_WITHOUT_VARIABLES",
          "Buffer m{0} has no views, so it cannot be split into variables.");

  static final DiagnosticType VIEW_NOT_ON_SPLIT_POINTS =
      DiagnosticType.error(
          "NNET_VIEW_NOT_ON_SPLIT_POINTS",
          "Internal error: columns [{1},{2}) of view {0} do not line up with the split points"
              + " {3} of buffer m{4}.");

  static final DiagnosticType INCONSISTENT_VARIABLE_BUFFER =
      DiagnosticType.error(
          "NNET_INCONSISTENT_VARIABLE_BUFFER",
          "Internal error: variable v{0} is claimed by both buffer m{1} and buffer m{2}.");

  static final DiagnosticType VARIABLE_NOT_COVERED =
      DiagnosticType.error(
          "NNET_VARIABLE_NOT_COVERED", "Internal error: variable v{0} is not covered by any view.");

  // Sorted, unique column split points per buffer; empty for buffer 0.
  private final ImmutableList<ImmutableSortedSet<Integer>> splitPoints;
  // bufferToFirstVariable[b] is the first variable of buffer b; the last entry is the total.
  private final int[] bufferToFirstVariable;
  private final int[] viewVariableStart;
  private final int[] viewVariableEnd;
  private final int[] viewToBuffer;
  private final boolean[] viewIsFullRow;
  private final boolean[] viewIsWholeBuffer;
  private final int[] variableToBuffer;

  private ComputationVariables(Computation computation) {
    int numBuffers = computation.getBufferCount();
    int numViews = computation.getViewCount();

    this.splitPoints = computeSplitPoints(computation);

    bufferToFirstVariable = new int[numBuffers + 1];
    for (int b = 1; b < numBuffers; b++) {
      int numVariables = splitPoints.get(b).size() - 1;
      bufferToFirstVariable[b + 1] = bufferToFirstVariable[b] + numVariables;
    }

    viewVariableStart = new int[numViews];
    viewVariableEnd = new int[numViews];
    viewToBuffer = new int[numViews];
    viewIsFullRow = new boolean[numViews];
    viewIsWholeBuffer = new boolean[numViews];
    for (int v = 1; v < numViews; v++) {
      computeVariableRange(computation, v);
    }

    variableToBuffer = computeVariableToBuffer();
  }

  /**
   * Partitions the buffers of {@code computation}.
   *
   * @throws MalformedComputationException if some view refers to a missing buffer, or a buffer
   *     has no views
   */
  public static ComputationVariables create(Computation computation) {
    return new ComputationVariables(computation);
  }

  private static ImmutableList<ImmutableSortedSet<Integer>> computeSplitPoints(
      Computation computation) {
    int numBuffers = computation.getBufferCount();
    ImmutableList<ViewInfo> views = computation.getViews();
    List<TreeSet<Integer>> points = new ArrayList<>(numBuffers);
    for (int b = 0; b < numBuffers; b++) {
      points.add(new TreeSet<>());
    }
    for (int v = 1; v < views.size(); v++) {
      ViewInfo view = views.get(v);
      int b = view.bufferIndex();
      if (b < 1 || b >= numBuffers) {
        throw MalformedComputationException.make(VIEW_BUFFER_OUT_OF_RANGE, v, b);
      }
      points.get(b).add(view.colOffset());
      points.get(b).add(view.colEnd());
    }
    ImmutableList.Builder<ImmutableSortedSet<Integer>> result = ImmutableList.builder();
    result.add(ImmutableSortedSet.of());
    for (int b = 1; b < numBuffers; b++) {
      // At least the start and end of some view.
      if (points.get(b).size() < 2) {
        throw MalformedComputationException.make(BUFFER_WITHOUT_VARIABLES, b);
      }
      result.add(ImmutableSortedSet.copyOf(points.get(b)));
    }
    return result.build();
  }

  private void computeVariableRange(Computation computation, int v) {
    ViewInfo view = computation.getView(v);
    int b = view.bufferIndex();
    BufferInfo buffer = computation.getBuffer(b);
    int[] split = splitPoints.get(b).stream().mapToInt(Integer::intValue).toArray();
    OptionalInt start = findSplitPoint(split, view.colOffset());
    OptionalInt end = findSplitPoint(split, view.colEnd());
    if (!start.isPresent() || !end.isPresent() || end.getAsInt() <= start.getAsInt()) {
      throw MalformedComputationException.make(
          VIEW_NOT_ON_SPLIT_POINTS, v, view.colOffset(), view.colEnd(), Arrays.toString(split), b);
    }
    int offset = bufferToFirstVariable[b];
    viewVariableStart[v] = offset + start.getAsInt();
    viewVariableEnd[v] = offset + end.getAsInt();
    viewToBuffer[v] = b;
    viewIsFullRow[v] = view.rowOffset() == 0 && view.numRows() == buffer.numRows();
    viewIsWholeBuffer[v] = computation.isWholeBuffer(v);
  }

  /** Returns the position of {@code value} in the sorted {@code split}, if it is there. */
  static OptionalInt findSplitPoint(int[] split, int value) {
    int pos = Arrays.binarySearch(split, value);
    return pos >= 0 ? OptionalInt.of(pos) : OptionalInt.empty();
  }

  private int[] computeVariableToBuffer() {
    int[] result = new int[getVariableCount()];
    Arrays.fill(result, -1);
    for (int v = 1; v < viewToBuffer.length; v++) {
      int b = viewToBuffer[v];
      for (int variable = viewVariableStart[v]; variable < viewVariableEnd[v]; variable++) {
        if (result[variable] == -1) {
          result[variable] = b;
        } else if (result[variable] != b) {
          throw MalformedComputationException.make(
              INCONSISTENT_VARIABLE_BUFFER, variable, result[variable], b);
        }
      }
    }
    for (int variable = 0; variable < result.length; variable++) {
      if (result[variable] == -1) {
        throw MalformedComputationException.make(VARIABLE_NOT_COVERED, variable);
      }
    }
    return result;
  }

  public int getVariableCount() {
    return bufferToFirstVariable[bufferToFirstVariable.length - 1];
  }

  /** The number of buffers, including the empty buffer. */
  public int getBufferCount() {
    return splitPoints.size();
  }

  public int getBufferForVariable(int variable) {
    checkElementIndex(variable, variableToBuffer.length, "variable");
    return variableToBuffer[variable];
  }

  /** The column split points of a buffer, including 0 and the buffer's column count. */
  public ImmutableSortedSet<Integer> getSplitPoints(int buffer) {
    return splitPoints.get(buffer);
  }

  /** The first variable of {@code buffer}. */
  public int getVariableStartForBuffer(int buffer) {
    checkElementIndex(buffer, splitPoints.size(), "buffer");
    return bufferToFirstVariable[buffer];
  }

  /** One past the last variable of {@code buffer}. */
  public int getVariableEndForBuffer(int buffer) {
    checkElementIndex(buffer, splitPoints.size(), "buffer");
    return bufferToFirstVariable[buffer + 1];
  }

  public int getVariableStartForView(int view) {
    checkElementIndex(view, viewVariableStart.length, "view");
    return viewVariableStart[view];
  }

  public int getVariableEndForView(int view) {
    checkElementIndex(view, viewVariableEnd.length, "view");
    return viewVariableEnd[view];
  }

  /** The variables a view covers, in increasing order. Empty for the empty view. */
  public ImmutableList<Integer> getVariablesForView(int view) {
    return range(getVariableStartForView(view), getVariableEndForView(view));
  }

  public ImmutableList<Integer> getVariablesForBuffer(int buffer) {
    return range(getVariableStartForBuffer(buffer), getVariableEndForBuffer(buffer));
  }

  private static ImmutableList<Integer> range(int start, int end) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (int v = start; v < end; v++) {
      builder.add(v);
    }
    return builder.build();
  }

  /** Whether the view spans every row of its buffer. */
  public boolean isFullRowView(int view) {
    checkElementIndex(view, viewIsFullRow.length, "view");
    return viewIsFullRow[view];
  }

  /**
   * Records that an instruction touches {@code view} in the given way.
   *
   * <p>A write through a view that does not span all rows of its buffer leaves the other rows of
   * the same variables intact, so it also counts as a read of those variables. In the same way,
   * a write through a view that is not the whole buffer also counts as a read of the buffer.
   * The empty view records nothing.
   */
  void recordAccessForView(int view, AccessType accessType, InstructionAttributes.Builder attr) {
    if (view == 0) {
      return;
    }
    checkElementIndex(view, viewToBuffer.length, "view");
    int buffer = viewToBuffer[view];
    int start = viewVariableStart[view];
    int end = viewVariableEnd[view];
    switch (accessType) {
      case READ:
        attr.addVariablesRead(start, end);
        attr.addBufferRead(buffer);
        attr.addViewRead(view);
        break;
      case WRITE:
        attr.addVariablesWritten(start, end);
        attr.addViewWritten(view);
        attr.addBufferWritten(buffer);
        if (!viewIsFullRow[view]) {
          attr.addVariablesRead(start, end);
        }
        if (!viewIsWholeBuffer[view]) {
          attr.addBufferRead(buffer);
        }
        break;
      case READ_WRITE:
        attr.addVariablesWritten(start, end);
        attr.addVariablesRead(start, end);
        attr.addViewWritten(view);
        attr.addViewRead(view);
        attr.addBufferWritten(buffer);
        attr.addBufferRead(buffer);
        break;
    }
  }

  /** Records a write of every variable of a whole buffer, as done by zeroed allocation. */
  void recordWriteForBuffer(int buffer, InstructionAttributes.Builder attr) {
    attr.addVariablesWritten(getVariableStartForBuffer(buffer), getVariableEndForBuffer(buffer));
    attr.addBufferWritten(buffer);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ComputationVariables)) {
      return false;
    }
    ComputationVariables other = (ComputationVariables) o;
    return splitPoints.equals(other.splitPoints)
        && Arrays.equals(bufferToFirstVariable, other.bufferToFirstVariable)
        && Arrays.equals(viewVariableStart, other.viewVariableStart)
        && Arrays.equals(viewVariableEnd, other.viewVariableEnd)
        && Arrays.equals(viewToBuffer, other.viewToBuffer)
        && Arrays.equals(viewIsFullRow, other.viewIsFullRow)
        && Arrays.equals(viewIsWholeBuffer, other.viewIsWholeBuffer)
        && Arrays.equals(variableToBuffer, other.variableToBuffer);
  }

  @Override
  public int hashCode() {
    return 31 * splitPoints.hashCode() + Arrays.hashCode(variableToBuffer);
  }
}
