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

import static com.google.common.truth.Truth.assertThat;
import static com.google.nnet.analysis.SampleComputations.AFFINE;
import static com.google.nnet.analysis.SampleComputations.AFFINE_NODE;
import static com.google.nnet.analysis.SampleComputations.CONV;
import static com.google.nnet.analysis.SampleComputations.REGISTRY;
import static com.google.nnet.analysis.SampleComputations.STATS;
import static com.google.nnet.analysis.SampleComputations.STATS_NODE;
import static com.google.nnet.analysis.SampleComputations.SUM;
import static com.google.nnet.analysis.SampleComputations.SUM_NODE;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.nnet.ir.Computation;
import com.google.nnet.ir.Instruction;
import com.google.nnet.ir.RowRange;
import com.google.nnet.ir.RowRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link InstructionIndexCheck}. Views 1 to 4 are the whole buffers of {@link
 * SampleComputations#layout()}: 8x4, 8x3, 8x3 and 8x4.
 */
@RunWith(JUnit4.class)
public final class InstructionIndexCheckTest {

  private CollectingErrorManager errorManager;
  private Computation.Builder builder;

  @Before
  public void setUp() {
    errorManager = new CollectingErrorManager();
    builder = SampleComputations.layout();
  }

  private void check() {
    new InstructionIndexCheck(new CheckContext(errorManager), REGISTRY, builder.build()).check();
  }

  private void assertValid(Instruction instruction) {
    builder.add(instruction);
    check();
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  private void assertError(Instruction instruction, DiagnosticType expected) {
    builder.add(instruction);
    MalformedComputationException e =
        assertThrows(MalformedComputationException.class, this::check);
    assertThat(e.getType()).isEqualTo(expected);
    assertThat(errorManager.getErrors()).containsExactly(e.getError());
  }

  private static List<RowRef> pairs(RowRef... first) {
    List<RowRef> pairs = new ArrayList<>(Collections.nCopies(8, RowRef.NONE));
    for (int i = 0; i < first.length; i++) {
      pairs.set(i, first[i]);
    }
    return pairs;
  }

  @Test
  public void testViewOutsideBuffer() {
    builder.addView(1, 4, 8, 0, 4);
    MalformedComputationException e =
        assertThrows(MalformedComputationException.class, this::check);
    assertThat(e.getType()).isEqualTo(InstructionIndexCheck.BAD_VIEW);
    assertThat(e).hasMessageThat().contains("rows [4,12)");
  }

  @Test
  public void testViewOffsetNearIntMaxRejected() {
    builder.addView(1, Integer.MAX_VALUE, 1, 0, 4);
    MalformedComputationException e =
        assertThrows(MalformedComputationException.class, this::check);
    assertThat(e.getType()).isEqualTo(InstructionIndexCheck.BAD_VIEW);
  }

  @Test
  public void testColumnOffsetNearIntMaxRejected() {
    builder.addView(1, 0, 8, Integer.MAX_VALUE, 2);
    MalformedComputationException e =
        assertThrows(MalformedComputationException.class, this::check);
    assertThat(e.getType()).isEqualTo(InstructionIndexCheck.BAD_VIEW);
  }

  @Test
  public void testEmptyViewRejected() {
    builder.addView(1, 0, 8, 2, 0);
    assertThrows(MalformedComputationException.class, this::check);
  }

  @Test
  public void testBufferIndex() {
    assertValid(Instruction.allocZeroed(4));
    assertError(Instruction.allocZeroed(0), InstructionIndexCheck.BUFFER_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testBufferIndexTooLarge() {
    assertError(Instruction.dealloc(5), InstructionIndexCheck.BUFFER_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testPropagate() {
    assertValid(Instruction.propagate(AFFINE, 0, 1, 2));
  }

  @Test
  public void testComponentIndex() {
    assertError(
        Instruction.propagate(9, 0, 1, 2), InstructionIndexCheck.COMPONENT_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testSimpleComponentNeedsInput() {
    assertError(Instruction.propagate(AFFINE, 0, 0, 2), InstructionIndexCheck.MISSING_INPUT_VIEW);
  }

  @Test
  public void testOtherComponentMayRunWithoutInput() {
    assertValid(Instruction.propagate(CONV, 0, 0, 2));
  }

  @Test
  public void testPrecomputedIndexes() {
    builder.setPrecomputedIndexesCount(1);
    assertValid(Instruction.propagate(CONV, 1, 1, 2));
  }

  @Test
  public void testPrecomputedIndexesOutOfRange() {
    builder.setPrecomputedIndexesCount(1);
    assertError(
        Instruction.propagate(CONV, 2, 1, 2), InstructionIndexCheck.TABLE_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testPrecomputedIndexesForSimpleComponent() {
    builder.setPrecomputedIndexesCount(1);
    assertError(
        Instruction.propagate(AFFINE, 1, 1, 2),
        InstructionIndexCheck.PRECOMPUTED_INDEXES_FOR_SIMPLE_COMPONENT);
  }

  @Test
  public void testDimMismatch() {
    assertError(Instruction.propagate(AFFINE, 0, 2, 3), InstructionIndexCheck.DIM_MISMATCH);
  }

  @Test
  public void testNumRowsMismatch() {
    int fewerRows = builder.addView(2, 0, 4, 0, 3);
    assertError(
        Instruction.propagate(AFFINE, 0, 1, fewerRows), InstructionIndexCheck.NUM_ROWS_MISMATCH);
  }

  @Test
  public void testInPlacePropagate() {
    assertValid(Instruction.propagate(STATS, 0, 2, 2));
  }

  @Test
  public void testInPlacePropagateUnsupported() {
    assertError(Instruction.propagate(SUM, 0, 2, 2), InstructionIndexCheck.UNSUPPORTED_IN_PLACE);
  }

  @Test
  public void testStoreStats() {
    assertValid(Instruction.storeStats(STATS, 2));
  }

  @Test
  public void testStoreStatsUnsupported() {
    assertError(
        Instruction.storeStats(AFFINE, 2), InstructionIndexCheck.STORE_STATS_NOT_SUPPORTED);
  }

  @Test
  public void testBackprop() {
    assertValid(Instruction.backprop(AFFINE_NODE, 0, 1, 0, 3, 4));
  }

  @Test
  public void testBackpropOfOtherNode() {
    assertError(
        Instruction.backprop(0, 0, 1, 0, 3, 4), InstructionIndexCheck.BAD_BACKPROP_NODE);
  }

  @Test
  public void testBackpropNeedsInput() {
    assertError(
        Instruction.backprop(AFFINE_NODE, 0, 0, 0, 3, 4),
        InstructionIndexCheck.BACKPROP_OPERAND_NEEDED);
  }

  @Test
  public void testBackpropNeedsOutput() {
    assertError(
        Instruction.backprop(STATS_NODE, 0, 0, 0, 3, 2),
        InstructionIndexCheck.BACKPROP_OPERAND_NEEDED);
  }

  @Test
  public void testBackpropWithoutEffect() {
    assertError(
        Instruction.backprop(STATS_NODE, 0, 0, 2, 3, 0),
        InstructionIndexCheck.BACKPROP_WITHOUT_EFFECT);
  }

  @Test
  public void testBackpropOnlyUpdatingParameters() {
    assertValid(Instruction.backprop(AFFINE_NODE, 0, 1, 0, 3, 0));
  }

  @Test
  public void testBackpropInPlace() {
    assertValid(Instruction.backprop(STATS_NODE, 0, 0, 2, 3, 3));
  }

  @Test
  public void testBackpropInPlaceUnsupported() {
    assertError(
        Instruction.backprop(SUM_NODE, 0, 0, 0, 3, 3),
        InstructionIndexCheck.UNSUPPORTED_IN_PLACE);
  }

  @Test
  public void testCopyToSelf() {
    assertError(Instruction.matrixCopy(2, 2), InstructionIndexCheck.SELF_OPERATION);
  }

  @Test
  public void testViewIndex() {
    assertError(Instruction.matrixAdd(2, 99), InstructionIndexCheck.VIEW_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testCopyRows() {
    int table = builder.addIndexes(ImmutableList.of(7, 6, 5, -1, -1, 2, 1, 0));
    assertValid(Instruction.copyRows(2, 3, table));
  }

  @Test
  public void testRowsTableIndex() {
    assertError(Instruction.copyRows(2, 3, 0), InstructionIndexCheck.TABLE_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testRowListSize() {
    int table = builder.addIndexes(ImmutableList.of(0, 1, 2));
    assertError(
        Instruction.addRows(2, 3, table), InstructionIndexCheck.ROW_LIST_SIZE_MISMATCH);
  }

  @Test
  public void testRowIndexBelowSentinel() {
    int table = builder.addIndexes(ImmutableList.of(0, 1, 2, 3, 4, 5, 6, -2));
    assertError(
        Instruction.copyRows(2, 3, table), InstructionIndexCheck.ROW_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testRowIndexPastEnd() {
    int table = builder.addIndexes(ImmutableList.of(0, 1, 2, 3, 4, 5, 6, 8));
    assertError(
        Instruction.copyRows(2, 3, table), InstructionIndexCheck.ROW_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testGatherMultiAllowsRepeatedSources() {
    int table = builder.addIndexesMulti(pairs(new RowRef(3, 0), new RowRef(3, 0)));
    assertValid(Instruction.copyRowsMulti(2, table));
  }

  @Test
  public void testScatterMulti() {
    int table = builder.addIndexesMulti(pairs(new RowRef(3, 0), new RowRef(3, 1)));
    assertValid(Instruction.addToRowsMulti(2, table));
  }

  @Test
  public void testScatterDuplicateTarget() {
    int table = builder.addIndexesMulti(pairs(new RowRef(3, 0), new RowRef(3, 0)));
    assertError(
        Instruction.copyToRowsMulti(2, table), InstructionIndexCheck.DUPLICATE_SCATTER_TARGET);
  }

  @Test
  public void testBadSentinel() {
    int table = builder.addIndexesMulti(pairs(new RowRef(-1, 3)));
    assertError(Instruction.addRowsMulti(2, table), InstructionIndexCheck.BAD_SENTINEL);
  }

  @Test
  public void testMultiFromSelf() {
    int table = builder.addIndexesMulti(pairs(new RowRef(2, 0)));
    assertError(Instruction.copyRowsMulti(2, table), InstructionIndexCheck.SELF_OPERATION);
  }

  @Test
  public void testMultiColumnMismatch() {
    int table = builder.addIndexesMulti(pairs(new RowRef(1, 0)));
    assertError(Instruction.copyRowsMulti(2, table), InstructionIndexCheck.DIM_MISMATCH);
  }

  private int addRanges(RowRange last) {
    ImmutableList.Builder<RowRange> ranges = ImmutableList.builder();
    for (int row = 0; row < 7; row++) {
      ranges.add(new RowRange(row, row + 1));
    }
    return builder.addIndexesRanges(ranges.add(last).build());
  }

  @Test
  public void testAddRowRanges() {
    int table = addRanges(new RowRange(8, 8));
    assertValid(Instruction.addRowRanges(2, 3, table));
  }

  @Test
  public void testRowRangeReversed() {
    int table = addRanges(new RowRange(3, 2));
    assertError(Instruction.addRowRanges(2, 3, table), InstructionIndexCheck.BAD_ROW_RANGE);
  }

  @Test
  public void testRowRangePastEnd() {
    int table = addRanges(new RowRange(0, 9));
    assertError(Instruction.addRowRanges(2, 3, table), InstructionIndexCheck.BAD_ROW_RANGE);
  }
}
