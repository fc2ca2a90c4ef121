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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.nnet.ir.ComponentRegistry;
import com.google.nnet.ir.Computation;
import com.google.nnet.ir.Opcode;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Verifies that a computation is well formed: every index is in range, the forward and backward
 * passes are in order, buffers are used only while allocated, no variable is read before it is
 * written and, optionally, no variable is overwritten after it has been read.
 *
 * <p>The first problem found is reported to the context's error handler and thrown as a {@link
 * MalformedComputationException}; no partial result is produced. The one tolerated condition is
 * an input buffer that is never used, which is reported as a warning once per {@link
 * CheckContext}.
 */
public final class ComputationChecker {

  private static final Logger logger = Logger.getLogger(ComputationChecker.class.getName());

  static final DiagnosticType WRONG_MARKER_COUNT =
      DiagnosticType.error(
          "NNET_WRONG_MARKER_COUNT", "Expected exactly one pass marker, found {0}.");

  static final DiagnosticType BACKPROP_BEFORE_MARKER =
      DiagnosticType.error(
          "NNET_BACKPROP_BEFORE_MARKER",
          "Instruction c{0}: backprop occurs before the pass marker at c{1}.");

  static final DiagnosticType FORWARD_AFTER_MARKER =
      DiagnosticType.error(
          "NNET_FORWARD_AFTER_MARKER",
          "Instruction c{0}: {1} occurs after the pass marker at c{2}.");

  static final DiagnosticType INPUT_BUFFER_ALLOCATED =
      DiagnosticType.error(
          "NNET_INPUT_BUFFER_ALLOCATED", "Input buffer m{0} is allocated by c{1}.");

  static final DiagnosticType BUFFER_NOT_ALLOCATED =
      DiagnosticType.error("NNET_BUFFER_NOT_ALLOCATED", "Buffer m{0} is never allocated.");

  static final DiagnosticType OUTPUT_BUFFER_DEALLOCATED =
      DiagnosticType.error(
          "NNET_OUTPUT_BUFFER_DEALLOCATED", "Output buffer m{0} is deallocated by c{1}.");

  static final DiagnosticType BUFFER_NOT_DEALLOCATED =
      DiagnosticType.error("NNET_BUFFER_NOT_DEALLOCATED", "Buffer m{0} is never deallocated.");

  static final DiagnosticType BUFFER_NEVER_ACCESSED =
      DiagnosticType.error("NNET_BUFFER_NEVER_ACCESSED", "Buffer m{0} is never accessed.");

  static final DiagnosticType ACCESSED_BEFORE_ALLOCATION =
      DiagnosticType.error(
          "NNET_ACCESSED_BEFORE_ALLOCATION",
          "Buffer m{0} is accessed by c{1} before it is allocated by c{2}.");

  static final DiagnosticType ACCESSED_AFTER_DEALLOCATION =
      DiagnosticType.error(
          "NNET_ACCESSED_AFTER_DEALLOCATION",
          "Buffer m{0} is accessed by c{1} after it is deallocated by c{2}.");

  static final DiagnosticType UNUSED_INPUT =
      DiagnosticType.warning(
          "NNET_UNUSED_INPUT",
          "Buffer m{0} is never accessed. Allowing because it is an input (un-needed input or"
              + " derivative?). Will warn only once.");

  static final DiagnosticType VARIABLE_NEVER_USED =
      DiagnosticType.error(
          "NNET_VARIABLE_NEVER_USED", "Variable v{0} (part of buffer m{1}) is never used.");

  static final DiagnosticType VARIABLE_READ_BEFORE_WRITE =
      DiagnosticType.error(
          "NNET_VARIABLE_READ_BEFORE_WRITE",
          "Variable v{0} (part of buffer m{1}) is read by c{2} before it is written to.");

  static final DiagnosticType VARIABLE_MODIFIED_AFTER_READ =
      DiagnosticType.error(
          "NNET_VARIABLE_MODIFIED_AFTER_READ",
          "Variable v{0} (part of buffer m{1}) is modified by c{2} after being read by c{3}"
              + " (this is not expected before optimization).");

  private final CheckOptions options;
  private final ComponentRegistry components;
  private final Computation computation;
  private final CheckContext context;

  public ComputationChecker(
      CheckOptions options,
      ComponentRegistry components,
      Computation computation,
      CheckContext context) {
    this.options = checkNotNull(options);
    this.components = checkNotNull(components);
    this.computation = checkNotNull(computation);
    this.context = checkNotNull(context);
  }

  /**
   * Runs all enabled checks.
   *
   * @return the analysis the checks were run on, for callers that need it afterwards
   * @throws MalformedComputationException on the first problem found
   */
  public ComputationAnalysis check() {
    new InstructionIndexCheck(context, components, computation).check();
    ComputationAnalysis analysis = analyze();
    logger.fine(
        () ->
            "Analyzed "
                + computation.getInstructionCount()
                + " instructions over "
                + analysis.getVariables().getVariableCount()
                + " variables");
    checkOrder();
    checkBufferAccesses(analysis);
    if (options.getCheckUndefined()) {
      checkUndefined(analysis);
    }
    if (options.getCheckRewrite()) {
      checkRewrite(analysis);
    }
    return analysis;
  }

  private ComputationAnalysis analyze() {
    try {
      return ComputationAnalysis.analyze(components, computation);
    } catch (MalformedComputationException e) {
      context.report(e.getError());
      throw e;
    }
  }

  /**
   * Checks that there is exactly one pass marker, with no backprop before it and no propagate or
   * store-stats after it.
   */
  void checkOrder() {
    int numMarkers = 0;
    int markerLocation = -1;
    for (int c = 0; c < computation.getInstructionCount(); c++) {
      if (computation.getInstruction(c).getOpcode() == Opcode.PASS_MARKER) {
        markerLocation = c;
        numMarkers++;
      }
    }
    if (numMarkers != 1) {
      throw context.fail(WRONG_MARKER_COUNT, numMarkers);
    }
    for (int c = 0; c < computation.getInstructionCount(); c++) {
      Opcode opcode = computation.getInstruction(c).getOpcode();
      if (c < markerLocation && opcode == Opcode.BACKPROP) {
        throw context.fail(BACKPROP_BEFORE_MARKER, c, markerLocation);
      }
      if (c > markerLocation && (opcode == Opcode.PROPAGATE || opcode == Opcode.STORE_STATS)) {
        throw context.fail(FORWARD_AFTER_MARKER, c, opcode, markerLocation);
      }
    }
  }

  /**
   * Checks that buffers are never used before they are allocated or after they are deallocated,
   * and that only buffers that are not inputs or outputs are allocated and deallocated.
   */
  void checkBufferAccesses(ComputationAnalysis analysis) {
    ImmutableList<BufferAccesses> bufferAccesses = analysis.getBufferAccesses();
    for (int b = 1; b < bufferAccesses.size(); b++) {
      BufferAccesses accesses = bufferAccesses.get(b);
      ImmutableList<Access> list = accesses.getAccesses();
      if (accesses.isInput()) {
        if (accesses.getAllocateInstruction() != BufferAccesses.NONE) {
          throw context.fail(INPUT_BUFFER_ALLOCATED, b, accesses.getAllocateInstruction());
        }
      } else {
        if (accesses.getAllocateInstruction() == BufferAccesses.NONE) {
          throw context.fail(BUFFER_NOT_ALLOCATED, b);
        }
        if (list.isEmpty()) {
          throw context.fail(BUFFER_NEVER_ACCESSED, b);
        }
        int first = list.get(0).instructionIndex();
        if (first < accesses.getAllocateInstruction()) {
          throw context.fail(
              ACCESSED_BEFORE_ALLOCATION, b, first, accesses.getAllocateInstruction());
        }
      }
      if (accesses.isOutput()) {
        if (accesses.getDeallocateInstruction() != BufferAccesses.NONE) {
          throw context.fail(OUTPUT_BUFFER_DEALLOCATED, b, accesses.getDeallocateInstruction());
        }
      } else {
        if (accesses.getDeallocateInstruction() == BufferAccesses.NONE) {
          throw context.fail(BUFFER_NOT_DEALLOCATED, b);
        }
        if (list.isEmpty()) {
          // An input can go unused, e.g. a derivative that is supplied but not needed.
          if (!accesses.isInput()) {
            throw context.fail(BUFFER_NEVER_ACCESSED, b);
          }
          context.reportOnce(ComputationError.make(UNUSED_INPUT, b));
        } else {
          int last = list.get(list.size() - 1).instructionIndex();
          if (last >= accesses.getDeallocateInstruction()) {
            throw context.fail(
                ACCESSED_AFTER_DEALLOCATION, b, last, accesses.getDeallocateInstruction());
          }
        }
      }
    }
  }

  /** Checks that every variable of a non-input buffer is first accessed by a pure write. */
  void checkUndefined(ComputationAnalysis analysis) {
    ComputationVariables variables = analysis.getVariables();
    for (int v = 0; v < variables.getVariableCount(); v++) {
      int buffer = variables.getBufferForVariable(v);
      if (analysis.getBufferAccesses(buffer).isInput()) {
        continue;
      }
      ImmutableList<Access> accesses = analysis.getVariableAccesses(v);
      if (accesses.isEmpty()) {
        throw context.fail(VARIABLE_NEVER_USED, v, buffer);
      }
      Access first = accesses.get(0);
      if (first.accessType() != AccessType.WRITE) {
        throw context.fail(VARIABLE_READ_BEFORE_WRITE, v, buffer, first.instructionIndex());
      }
    }
  }

  /**
   * Checks that no variable is modified after it has been read. This holds before optimization;
   * optimizations that run components in place or share storage break it on purpose, so they
   * must turn this check off.
   */
  void checkRewrite(ComputationAnalysis analysis) {
    ComputationVariables variables = analysis.getVariables();
    for (int v = 0; v < variables.getVariableCount(); v++) {
      int buffer = variables.getBufferForVariable(v);
      ImmutableList<Access> accesses = analysis.getVariableAccesses(v);
      if (accesses.isEmpty() && !analysis.getBufferAccesses(buffer).isInput()) {
        throw context.fail(VARIABLE_NEVER_USED, v, buffer);
      }
      @Nullable Access firstPureRead = null;
      for (Access access : accesses) {
        if (firstPureRead == null) {
          if (access.accessType() == AccessType.READ) {
            firstPureRead = access;
          }
        } else if (access.accessType().isWrite()) {
          throw context.fail(
              VARIABLE_MODIFIED_AFTER_READ,
              v,
              buffer,
              access.instructionIndex(),
              firstPureRead.instructionIndex());
        }
      }
    }
  }
}
