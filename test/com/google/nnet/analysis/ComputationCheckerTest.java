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
import static com.google.nnet.analysis.SampleComputations.REGISTRY;
import static com.google.nnet.analysis.SampleComputations.STATS;
import static org.junit.Assert.assertThrows;

import com.google.nnet.ir.Computation;
import com.google.nnet.ir.EndpointBinding;
import com.google.nnet.ir.Instruction;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ComputationChecker}. */
@RunWith(JUnit4.class)
public final class ComputationCheckerTest {

  private CollectingErrorManager errorManager;
  private CheckContext context;
  private CheckOptions options;

  @Before
  public void setUp() {
    errorManager = new CollectingErrorManager();
    context = new CheckContext(errorManager);
    options = new CheckOptions();
  }

  private ComputationAnalysis check(Computation computation) {
    return new ComputationChecker(options, REGISTRY, computation, context).check();
  }

  /** Runs the checker, expecting it to fail, and returns the reported error type. */
  private DiagnosticType checkError(Computation computation) {
    MalformedComputationException e =
        assertThrows(MalformedComputationException.class, () -> check(computation));
    assertThat(errorManager.getErrors()).containsExactly(e.getError());
    return e.getType();
  }

  @Test
  public void testValidComputation() {
    ComputationAnalysis analysis = check(SampleComputations.forwardBackward());
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
    assertThat(errorManager.getWarningCount()).isEqualTo(0);
    assertThat(analysis)
        .isEqualTo(ComputationAnalysis.analyze(REGISTRY, SampleComputations.forwardBackward()));
  }

  @Test
  public void testValidComputationWithAllChecks() {
    options.setCheckRewrite(true).setCheckUndefined(true);
    check(SampleComputations.forwardBackward());
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  @Test
  public void testIndexErrorReported() {
    Computation.Builder builder = SampleComputations.layout();
    builder.add(Instruction.dealloc(7));
    assertThat(checkError(builder.build()))
        .isEqualTo(InstructionIndexCheck.BUFFER_INDEX_OUT_OF_RANGE);
  }

  @Test
  public void testAnalysisErrorReported() {
    Computation.Builder builder = SampleComputations.layout();
    builder.add(Instruction.allocUndefined(2));
    builder.add(Instruction.allocUndefined(2));
    assertThat(checkError(builder.build()))
        .isEqualTo(AccessHistoryBuilder.BUFFER_ALLOCATED_TWICE);
  }

  @Test
  public void testNoMarker() {
    Computation.Builder builder = SampleComputations.layout();
    SampleComputations.addForward(builder);
    SampleComputations.addBackward(builder);
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.WRONG_MARKER_COUNT);
  }

  @Test
  public void testTwoMarkers() {
    Computation.Builder builder = SampleComputations.layout();
    SampleComputations.addForward(builder);
    builder.add(Instruction.passMarker());
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.WRONG_MARKER_COUNT);
    assertThat(errorManager.getErrors().get(0).description()).contains("found 2");
  }

  @Test
  public void testBackpropBeforeMarker() {
    Computation.Builder builder = SampleComputations.layout();
    SampleComputations.addForward(builder);
    SampleComputations.addBackward(builder);
    builder.add(Instruction.passMarker());
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.BACKPROP_BEFORE_MARKER);
  }

  @Test
  public void testForwardAfterMarker() {
    Computation.Builder builder = SampleComputations.layout();
    builder.add(Instruction.allocUndefined(2));
    builder.add(Instruction.passMarker());
    builder.add(Instruction.propagate(AFFINE, 0, 1, 2));
    SampleComputations.addBackward(builder);
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.FORWARD_AFTER_MARKER);
  }

  @Test
  public void testAccessedBeforeAllocation() {
    Computation.Builder builder = SampleComputations.layout();
    builder.add(Instruction.propagate(AFFINE, 0, 1, 2));
    builder.add(Instruction.allocUndefined(2));
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    assertThat(checkError(builder.build()))
        .isEqualTo(ComputationChecker.ACCESSED_BEFORE_ALLOCATION);
  }

  @Test
  public void testAccessedAfterDeallocation() {
    Computation.Builder builder = SampleComputations.layout();
    SampleComputations.addForward(builder);
    builder.add(Instruction.passMarker());
    builder.add(Instruction.allocZeroed(4));
    builder.add(Instruction.dealloc(1));
    builder.add(Instruction.backprop(AFFINE_NODE, 0, 1, 0, 3, 4));
    builder.add(Instruction.dealloc(3));
    assertThat(checkError(builder.build()))
        .isEqualTo(ComputationChecker.ACCESSED_AFTER_DEALLOCATION);
  }

  @Test
  public void testInputBufferAllocated() {
    Computation.Builder builder = SampleComputations.layout();
    builder.add(Instruction.allocUndefined(1));
    SampleComputations.addForward(builder);
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.INPUT_BUFFER_ALLOCATED);
  }

  @Test
  public void testOutputBufferDeallocated() {
    Computation.Builder builder = SampleComputations.forwardBackward().toBuilder();
    builder.add(Instruction.dealloc(2));
    assertThat(checkError(builder.build()))
        .isEqualTo(ComputationChecker.OUTPUT_BUFFER_DEALLOCATED);
  }

  @Test
  public void testBufferNotDeallocated() {
    Computation.Builder builder = SampleComputations.layout();
    SampleComputations.addForward(builder);
    builder.add(Instruction.passMarker());
    builder.add(Instruction.allocZeroed(4));
    builder.add(Instruction.backprop(AFFINE_NODE, 0, 1, 0, 3, 4));
    builder.add(Instruction.dealloc(1));
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.BUFFER_NOT_DEALLOCATED);
  }

  @Test
  public void testBufferNotAllocated() {
    Computation.Builder builder = SampleComputations.layout();
    builder.add(Instruction.propagate(AFFINE, 0, 1, 2));
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.BUFFER_NOT_ALLOCATED);
  }

  @Test
  public void testTemporaryBufferLifecycle() {
    // m5 is allocated, written once, read once and deallocated.
    Computation.Builder builder = SampleComputations.layout();
    int scratch = builder.addBufferWithView(8, 3);
    builder.add(Instruction.allocUndefined(2));
    builder.add(Instruction.allocUndefined(5));
    builder.add(Instruction.propagate(AFFINE, 0, 1, scratch));
    builder.add(Instruction.matrixCopy(2, scratch));
    builder.add(Instruction.dealloc(5));
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    ComputationAnalysis analysis = check(builder.build());

    BufferAccesses accesses = analysis.getBufferAccesses(5);
    assertThat(accesses.getAllocateInstruction()).isEqualTo(1);
    assertThat(accesses.getDeallocateInstruction()).isEqualTo(4);
    assertThat(accesses.getAccesses())
        .containsExactly(new Access(2, AccessType.WRITE), new Access(3, AccessType.READ))
        .inOrder();
  }

  @Test
  public void testUnusedInputWarnsOncePerContext() {
    Computation.Builder builder = SampleComputations.layout();
    int unused = builder.addBuffer(8, 4);
    builder.addView(unused, 0, 8, 0, 4);
    builder.addEndpoint(EndpointBinding.input(SampleComputations.EXTRA_INPUT_NODE, unused, 0));
    SampleComputations.addForward(builder);
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    builder.add(Instruction.dealloc(unused));
    Computation computation = builder.build();

    check(computation);
    check(computation);
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
    assertThat(errorManager.getWarningCount()).isEqualTo(1);
    assertThat(errorManager.getWarnings().get(0).type())
        .isEqualTo(ComputationChecker.UNUSED_INPUT);
    assertThat(context.hasReported(ComputationChecker.UNUSED_INPUT)).isTrue();

    // A fresh context warns again.
    new ComputationChecker(options, REGISTRY, computation, new CheckContext(errorManager))
        .check();
    assertThat(errorManager.getWarningCount()).isEqualTo(2);
  }

  @Test
  public void testUnusedTemporaryBuffer() {
    Computation.Builder builder = SampleComputations.layout();
    int unused = builder.addBuffer(8, 4);
    builder.addView(unused, 0, 8, 0, 4);
    builder.add(Instruction.allocUndefined(unused));
    SampleComputations.addForward(builder);
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    builder.add(Instruction.dealloc(unused));
    assertThat(checkError(builder.build())).isEqualTo(ComputationChecker.BUFFER_NEVER_ACCESSED);
  }

  /**
   * Reads a scratch buffer m5 by adding to it right after an undefined allocation, unless
   * {@code zeroed}.
   */
  private static Computation readScratch(boolean zeroed) {
    Computation.Builder builder = SampleComputations.layout();
    int scratch = builder.addBufferWithView(8, 3);
    SampleComputations.addForward(builder);
    builder.add(zeroed ? Instruction.allocZeroed(5) : Instruction.allocUndefined(5));
    builder.add(Instruction.matrixAdd(scratch, 2));
    builder.add(Instruction.dealloc(5));
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    return builder.build();
  }

  @Test
  public void testReadBeforeWrite() {
    assertThat(checkError(readScratch(false)))
        .isEqualTo(ComputationChecker.VARIABLE_READ_BEFORE_WRITE);
  }

  @Test
  public void testReadAfterZeroing() {
    check(readScratch(true));
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  @Test
  public void testUndefinedCheckCanBeDisabled() {
    options.setCheckUndefined(false);
    check(readScratch(false));
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  /**
   * Writes m2, reads it into a scratch buffer m5 and then writes m2 again, either in place or
   * by copying back.
   */
  private static Computation rewriteAfterRead(boolean inPlace) {
    Computation.Builder builder = SampleComputations.layout();
    int scratch = builder.addBufferWithView(8, 3);
    SampleComputations.addForward(builder);
    builder.add(Instruction.allocUndefined(5));
    builder.add(Instruction.matrixCopy(scratch, 2));
    if (inPlace) {
      builder.add(Instruction.propagate(STATS, 0, 2, 2));
    } else {
      builder.add(Instruction.matrixCopy(2, scratch));
    }
    builder.add(Instruction.dealloc(5));
    builder.add(Instruction.passMarker());
    SampleComputations.addBackward(builder);
    return builder.build();
  }

  @Test
  public void testRewriteAfterRead() {
    options.setCheckRewrite(true);
    assertThat(checkError(rewriteAfterRead(false)))
        .isEqualTo(ComputationChecker.VARIABLE_MODIFIED_AFTER_READ);
    assertThat(errorManager.getErrors().get(0).description()).contains("v1");
  }

  @Test
  public void testInPlaceRewriteAfterRead() {
    options.setCheckRewrite(true);
    assertThat(checkError(rewriteAfterRead(true)))
        .isEqualTo(ComputationChecker.VARIABLE_MODIFIED_AFTER_READ);
  }

  @Test
  public void testRewriteCheckOffByDefault() {
    check(rewriteAfterRead(true));
    check(rewriteAfterRead(false));
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  @Test
  public void testReadWithoutLaterWritePasses() {
    // v0 of the input is read twice and never written.
    options.setCheckRewrite(true);
    ComputationAnalysis analysis = check(SampleComputations.forwardBackward());
    assertThat(analysis.getVariableAccesses(0))
        .containsExactly(new Access(1, AccessType.READ), new Access(4, AccessType.READ))
        .inOrder();
  }
}
