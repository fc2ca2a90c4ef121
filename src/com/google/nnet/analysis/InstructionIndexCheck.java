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

import com.google.common.collect.ImmutableList;
import com.google.nnet.ir.BufferInfo;
import com.google.nnet.ir.Capability;
import com.google.nnet.ir.ComponentProperties;
import com.google.nnet.ir.ComponentRegistry;
import com.google.nnet.ir.Computation;
import com.google.nnet.ir.Instruction;
import com.google.nnet.ir.Instruction.AddRowRanges;
import com.google.nnet.ir.Instruction.Backprop;
import com.google.nnet.ir.Instruction.BufferInstruction;
import com.google.nnet.ir.Instruction.GatherRows;
import com.google.nnet.ir.Instruction.Propagate;
import com.google.nnet.ir.Instruction.RowsMulti;
import com.google.nnet.ir.Instruction.StoreStats;
import com.google.nnet.ir.Instruction.ViewToView;
import com.google.nnet.ir.RowRange;
import com.google.nnet.ir.RowRef;
import com.google.nnet.ir.ViewInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks that every index in a computation is in range and that the shapes of the views line up
 * with each other and with the components that use them. This runs before the access analysis,
 * which assumes all of it.
 */
final class InstructionIndexCheck {

  static final DiagnosticType BAD_VIEW =
      DiagnosticType.error(
          "NNET_BAD_VIEW",
          "View {0} (buffer m{1}, rows [{2},{3}), columns [{4},{5})) does not fit inside its"
              + " buffer.");

  static final DiagnosticType BUFFER_INDEX_OUT_OF_RANGE =
      DiagnosticType.error(
          "NNET_BUFFER_INDEX_OUT_OF_RANGE", "Instruction c{0}: buffer index {1} out of range.");

  static final DiagnosticType VIEW_INDEX_OUT_OF_RANGE =
      DiagnosticType.error(
          "NNET_VIEW_INDEX_OUT_OF_RANGE", "Instruction c{0}: view index {1} out of range.");

  static final DiagnosticType TABLE_INDEX_OUT_OF_RANGE =
      DiagnosticType.error(
          "NNET_TABLE_INDEX_OUT_OF_RANGE",
          "Instruction c{0}: index {1} into the {2} table out of range.");

  static final DiagnosticType COMPONENT_INDEX_OUT_OF_RANGE =
      DiagnosticType.error(
          "NNET_COMPONENT_INDEX_OUT_OF_RANGE",
          "Instruction c{0}: component index {1} out of range.");

  static final DiagnosticType BAD_BACKPROP_NODE =
      DiagnosticType.error(
          "NNET_BAD_BACKPROP_NODE",
          "Instruction c{0}: node {1} is out of range or not a component node.");

  static final DiagnosticType PRECOMPUTED_INDEXES_FOR_SIMPLE_COMPONENT =
      DiagnosticType.error(
          "NNET_PRECOMPUTED_INDEXES_FOR_SIMPLE_COMPONENT",
          "Instruction c{0}: precomputed indexes {1} given for a simple component.");

  static final DiagnosticType MISSING_INPUT_VIEW =
      DiagnosticType.error(
          "NNET_MISSING_INPUT_VIEW", "Instruction c{0}: simple component needs an input view.");

  static final DiagnosticType DIM_MISMATCH =
      DiagnosticType.error(
          "NNET_DIM_MISMATCH",
          "Instruction c{0}: {1} view {2} has {3} columns but {4} are expected.");

  static final DiagnosticType NUM_ROWS_MISMATCH =
      DiagnosticType.error(
          "NNET_NUM_ROWS_MISMATCH",
          "Instruction c{0}: views {1} and {2} should have the same number of rows ({3} vs {4}).");

  static final DiagnosticType UNSUPPORTED_IN_PLACE =
      DiagnosticType.error(
          "NNET_UNSUPPORTED_IN_PLACE",
          "Instruction c{0}: view {1} used for both input and output, which {2} does not"
              + " support.");

  static final DiagnosticType STORE_STATS_NOT_SUPPORTED =
      DiagnosticType.error(
          "NNET_STORE_STATS_NOT_SUPPORTED",
          "Instruction c{0}: component {1} does not store stats.");

  static final DiagnosticType BACKPROP_OPERAND_NEEDED =
      DiagnosticType.error(
          "NNET_BACKPROP_OPERAND_NEEDED",
          "Instruction c{0}: backprop needs the {1} view, but none is supplied.");

  static final DiagnosticType BACKPROP_WITHOUT_EFFECT =
      DiagnosticType.error(
          "NNET_BACKPROP_WITHOUT_EFFECT",
          "Instruction c{0}: backprop computes no input derivative and the component is not"
              + " updatable.");

  static final DiagnosticType SELF_OPERATION =
      DiagnosticType.error(
          "NNET_SELF_OPERATION", "Instruction c{0}: view {1} is both source and destination.");

  static final DiagnosticType ROW_LIST_SIZE_MISMATCH =
      DiagnosticType.error(
          "NNET_ROW_LIST_SIZE_MISMATCH",
          "Instruction c{0}: row list has {1} entries but view {2} has {3} rows.");

  static final DiagnosticType ROW_INDEX_OUT_OF_RANGE =
      DiagnosticType.error(
          "NNET_ROW_INDEX_OUT_OF_RANGE",
          "Instruction c{0}: row index {1} out of range for view {2} with {3} rows.");

  static final DiagnosticType BAD_SENTINEL =
      DiagnosticType.error(
          "NNET_BAD_SENTINEL",
          "Instruction c{0}: pair {1} has view -1, so its row must be -1 as well.");

  static final DiagnosticType DUPLICATE_SCATTER_TARGET =
      DiagnosticType.error(
          "NNET_DUPLICATE_SCATTER_TARGET",
          "Instruction c{0}: duplicate destination {1} in {2} instruction.");

  static final DiagnosticType BAD_ROW_RANGE =
      DiagnosticType.error(
          "NNET_BAD_ROW_RANGE",
          "Instruction c{0}: row range {1} out of range for source view {2} with {3} rows.");

  private final CheckContext context;
  private final ComponentRegistry components;
  private final Computation computation;
  private final int numBuffers;
  private final int numViews;

  InstructionIndexCheck(
      CheckContext context, ComponentRegistry components, Computation computation) {
    this.context = context;
    this.components = components;
    this.computation = computation;
    this.numBuffers = computation.getBufferCount();
    this.numViews = computation.getViewCount();
  }

  void check() {
    checkViews();
    for (int c = 0; c < computation.getInstructionCount(); c++) {
      checkInstruction(c, computation.getInstruction(c));
    }
  }

  private void checkViews() {
    for (int v = 1; v < numViews; v++) {
      ViewInfo view = computation.getView(v);
      int b = view.bufferIndex();
      boolean ok = b >= 1 && b < numBuffers;
      if (ok) {
        BufferInfo buffer = computation.getBuffer(b);
        ok =
            view.rowOffset() >= 0
                && view.numRows() > 0
                && view.rowOffset() <= buffer.numRows() - view.numRows()
                && view.colOffset() >= 0
                && view.numCols() > 0
                && view.colOffset() <= buffer.numCols() - view.numCols();
      }
      if (!ok) {
        throw context.fail(
            BAD_VIEW, v, b, view.rowOffset(), view.rowEnd(), view.colOffset(), view.colEnd());
      }
    }
  }

  private void checkInstruction(int c, Instruction instruction) {
    switch (instruction.getOpcode()) {
      case ALLOC_ZEROED:
      case ALLOC_UNDEFINED:
      case DEALLOC:
        {
          int b = ((BufferInstruction) instruction).getBuffer();
          if (b < 1 || b >= numBuffers) {
            throw context.fail(BUFFER_INDEX_OUT_OF_RANGE, c, b);
          }
          break;
        }
      case PROPAGATE:
        checkPropagate(c, (Propagate) instruction);
        break;
      case STORE_STATS:
        checkStoreStats(c, (StoreStats) instruction);
        break;
      case BACKPROP:
        checkBackprop(c, (Backprop) instruction);
        break;
      case MATRIX_COPY:
      case MATRIX_ADD:
        {
          ViewToView v = (ViewToView) instruction;
          checkView(c, v.getDestView(), false);
          checkView(c, v.getSrcView(), false);
          checkSameRows(c, v.getDestView(), v.getSrcView());
          checkCols(c, "source", v.getSrcView(), view(v.getDestView()).numCols());
          if (v.getDestView() == v.getSrcView()) {
            throw context.fail(SELF_OPERATION, c, v.getDestView());
          }
          break;
        }
      case COPY_ROWS:
      case ADD_ROWS:
        checkGatherRows(c, (GatherRows) instruction);
        break;
      case COPY_ROWS_MULTI:
      case ADD_ROWS_MULTI:
      case COPY_TO_ROWS_MULTI:
      case ADD_TO_ROWS_MULTI:
        checkRowsMulti(c, (RowsMulti) instruction);
        break;
      case ADD_ROW_RANGES:
        checkAddRowRanges(c, (AddRowRanges) instruction);
        break;
      case NO_OP:
      case PASS_MARKER:
        break;
      default:
        throw context.fail(AccessClassifier.UNKNOWN_OPCODE, c, instruction.getOpcode());
    }
  }

  private void checkPropagate(int c, Propagate p) {
    ComponentProperties component = checkComponent(c, p.getComponent());
    checkPrecomputedIndexes(c, p.getPrecomputedIndexes(), component);
    boolean simple = component.has(Capability.SIMPLE);
    checkView(c, p.getInputView(), true);
    checkView(c, p.getOutputView(), false);
    // Non-simple components may occasionally run without input.
    if (p.getInputView() == 0 && simple) {
      throw context.fail(MISSING_INPUT_VIEW, c);
    }
    if (p.getInputView() != 0) {
      checkCols(c, "input", p.getInputView(), component.getInputDim());
    }
    checkCols(c, "output", p.getOutputView(), component.getOutputDim());
    if (simple) {
      checkSameRows(c, p.getInputView(), p.getOutputView());
    }
    if (p.getInputView() == p.getOutputView() && !component.has(Capability.PROPAGATE_IN_PLACE)) {
      throw context.fail(UNSUPPORTED_IN_PLACE, c, p.getInputView(), "propagate");
    }
  }

  private void checkStoreStats(int c, StoreStats s) {
    ComponentProperties component = checkComponent(c, s.getComponent());
    if (!component.has(Capability.STORES_STATS)) {
      throw context.fail(STORE_STATS_NOT_SUPPORTED, c, s.getComponent());
    }
    checkView(c, s.getView(), false);
    checkCols(c, "stats", s.getView(), component.getOutputDim());
  }

  private void checkBackprop(int c, Backprop b) {
    int node = b.getNode();
    if (node < 0 || node >= components.getNodeCount() || !components.isComponentNode(node)) {
      throw context.fail(BAD_BACKPROP_NODE, c, node);
    }
    ComponentProperties component = components.getComponentForNode(node);
    checkPrecomputedIndexes(c, b.getPrecomputedIndexes(), component);
    int in = b.getInputView();
    int out = b.getOutputView();
    int outDeriv = b.getOutputDerivView();
    int inDeriv = b.getInputDerivView();
    checkView(c, in, true);
    checkView(c, out, true);
    checkView(c, outDeriv, false);
    checkView(c, inDeriv, true);
    if (component.has(Capability.BACKPROP_NEEDS_INPUT) && in == 0) {
      throw context.fail(BACKPROP_OPERAND_NEEDED, c, "input");
    }
    if (component.has(Capability.BACKPROP_NEEDS_OUTPUT) && out == 0) {
      throw context.fail(BACKPROP_OPERAND_NEEDED, c, "output");
    }
    if (inDeriv == 0 && !component.has(Capability.UPDATABLE)) {
      throw context.fail(BACKPROP_WITHOUT_EFFECT, c);
    }
    if (outDeriv == inDeriv && !component.has(Capability.BACKPROP_IN_PLACE)) {
      throw context.fail(UNSUPPORTED_IN_PLACE, c, outDeriv, "backprop");
    }
    if (in != 0) {
      checkCols(c, "input", in, component.getInputDim());
    }
    if (out != 0) {
      checkCols(c, "output", out, component.getOutputDim());
    }
    checkCols(c, "output-deriv", outDeriv, component.getOutputDim());
    if (inDeriv != 0) {
      checkCols(c, "input-deriv", inDeriv, component.getInputDim());
    }
    if (in != 0 && inDeriv != 0) {
      checkSameRows(c, in, inDeriv);
    }
    if (out != 0) {
      checkSameRows(c, out, outDeriv);
    }
    if (component.has(Capability.SIMPLE) && inDeriv != 0) {
      checkSameRows(c, outDeriv, inDeriv);
    }
  }

  private void checkGatherRows(int c, GatherRows g) {
    int dest = g.getDestView();
    int src = g.getSrcView();
    checkView(c, dest, false);
    checkView(c, src, false);
    ImmutableList<Integer> indexes =
        checkTable(c, computation.getIndexes(), g.getIndexes(), "indexes");
    checkRowListSize(c, indexes.size(), dest);
    checkCols(c, "source", src, view(dest).numCols());
    int srcRows = view(src).numRows();
    for (int row : indexes) {
      if (row < -1 || row >= srcRows) {
        throw context.fail(ROW_INDEX_OUT_OF_RANGE, c, row, src, srcRows);
      }
    }
    if (dest == src) {
      throw context.fail(SELF_OPERATION, c, dest);
    }
  }

  private void checkRowsMulti(int c, RowsMulti m) {
    int self = m.getView();
    checkView(c, self, false);
    ImmutableList<RowRef> pairs =
        checkTable(c, computation.getIndexesMulti(), m.getIndexesMulti(), "indexes-multi");
    checkRowListSize(c, pairs.size(), self);
    int numCols = view(self).numCols();
    for (RowRef pair : pairs) {
      if (pair.viewIndex() == -1) {
        if (pair.row() != -1) {
          throw context.fail(BAD_SENTINEL, c, pair);
        }
        continue;
      }
      checkView(c, pair.viewIndex(), false);
      int rows = view(pair.viewIndex()).numRows();
      if (pair.row() < 0 || pair.row() >= rows) {
        throw context.fail(ROW_INDEX_OUT_OF_RANGE, c, pair.row(), pair.viewIndex(), rows);
      }
      if (pair.viewIndex() == self) {
        throw context.fail(SELF_OPERATION, c, self);
      }
      checkCols(c, "row-list", pair.viewIndex(), numCols);
    }
    if (m.getOpcode().isScatterMulti()) {
      // Two rows scattered to the same cell would race when run in parallel.
      List<RowRef> sorted = new ArrayList<>(pairs);
      Collections.sort(sorted);
      for (int i = 1; i < sorted.size(); i++) {
        RowRef pair = sorted.get(i);
        if (!pair.isNone() && pair.equals(sorted.get(i - 1))) {
          throw context.fail(DUPLICATE_SCATTER_TARGET, c, pair, m.getOpcode());
        }
      }
    }
  }

  private void checkAddRowRanges(int c, AddRowRanges r) {
    int dest = r.getDestView();
    int src = r.getSrcView();
    checkView(c, dest, false);
    checkView(c, src, false);
    ImmutableList<RowRange> ranges =
        checkTable(c, computation.getIndexesRanges(), r.getRanges(), "indexes-ranges");
    checkRowListSize(c, ranges.size(), dest);
    checkCols(c, "source", src, view(dest).numCols());
    int srcRows = view(src).numRows();
    for (RowRange range : ranges) {
      // Empty ranges repeat a valid index; -1 is never allowed.
      if (range.start() < 0 || range.end() < range.start() || range.end() > srcRows) {
        throw context.fail(BAD_ROW_RANGE, c, range, src, srcRows);
      }
    }
  }

  private ComponentProperties checkComponent(int c, int componentIndex) {
    if (componentIndex < 0 || componentIndex >= components.getComponentCount()) {
      throw context.fail(COMPONENT_INDEX_OUT_OF_RANGE, c, componentIndex);
    }
    return components.getComponent(componentIndex);
  }

  private void checkPrecomputedIndexes(int c, int index, ComponentProperties component) {
    if (index < 0 || index > computation.getPrecomputedIndexesCount()) {
      throw context.fail(TABLE_INDEX_OUT_OF_RANGE, c, index, "precomputed-indexes");
    }
    if (index != 0 && component.has(Capability.SIMPLE)) {
      throw context.fail(PRECOMPUTED_INDEXES_FOR_SIMPLE_COMPONENT, c, index);
    }
  }

  private void checkView(int c, int viewIndex, boolean allowEmpty) {
    int min = allowEmpty ? 0 : 1;
    if (viewIndex < min || viewIndex >= numViews) {
      throw context.fail(VIEW_INDEX_OUT_OF_RANGE, c, viewIndex);
    }
  }

  private <T> T checkTable(int c, ImmutableList<T> table, int index, String name) {
    if (index < 0 || index >= table.size()) {
      throw context.fail(TABLE_INDEX_OUT_OF_RANGE, c, index, name);
    }
    return table.get(index);
  }

  private void checkCols(int c, String role, int viewIndex, int expected) {
    int actual = view(viewIndex).numCols();
    if (actual != expected) {
      throw context.fail(DIM_MISMATCH, c, role, viewIndex, actual, expected);
    }
  }

  private void checkSameRows(int c, int view1, int view2) {
    int rows1 = view(view1).numRows();
    int rows2 = view(view2).numRows();
    if (rows1 != rows2) {
      throw context.fail(NUM_ROWS_MISMATCH, c, view1, view2, rows1, rows2);
    }
  }

  private void checkRowListSize(int c, int size, int viewIndex) {
    int rows = view(viewIndex).numRows();
    if (size != rows) {
      throw context.fail(ROW_LIST_SIZE_MISMATCH, c, size, viewIndex, rows);
    }
  }

  private ViewInfo view(int index) {
    return computation.getView(index);
  }
}
