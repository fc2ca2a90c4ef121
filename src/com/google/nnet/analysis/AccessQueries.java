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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.nnet.ir.Computation;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Point questions about a finished {@link ComputationAnalysis}, as asked by the optimizer when
 * deciding whether a rewrite is safe. All methods are stateless and may be called concurrently.
 */
public final class AccessQueries {

  private AccessQueries() {}

  /**
   * Returns true if the buffer is accessed before {@code instructionIndex}, not counting its
   * allocation. When the first access is the (zeroing) allocation itself, the second access
   * decides.
   *
   * <p>Note that a buffer zeroed at c0 and written at c1 counts as accessed before c2. A query
   * that looks only at the first access, and answers false whenever that access is the
   * allocation, would report it as untouched.
   */
  public static boolean isBufferAccessedBefore(
      ComputationAnalysis analysis, int buffer, int instructionIndex) {
    BufferAccesses access = bufferAccesses(analysis, buffer);
    ImmutableList<Access> accesses = access.getAccesses();
    if (accesses.isEmpty()) {
      return false;
    }
    int first = accesses.get(0).instructionIndex();
    if (first != access.getAllocateInstruction()) {
      // e.g. the buffer was not zeroed on allocation.
      return first < instructionIndex;
    }
    return accesses.size() > 1 && accesses.get(1).instructionIndex() < instructionIndex;
  }

  /** Returns true if the buffer is accessed after {@code instructionIndex}. */
  public static boolean isBufferAccessedAfter(
      ComputationAnalysis analysis, int buffer, int instructionIndex) {
    // Deallocation does not appear among the accesses.
    ImmutableList<Access> accesses = bufferAccesses(analysis, buffer).getAccesses();
    return !accesses.isEmpty()
        && accesses.get(accesses.size() - 1).instructionIndex() > instructionIndex;
  }

  /** Returns true if something other than a pure read touches the buffer after the instruction. */
  public static boolean isBufferWrittenAfter(
      ComputationAnalysis analysis, int buffer, int instructionIndex) {
    ImmutableList<Access> accesses = bufferAccesses(analysis, buffer).getAccesses();
    for (Access access : accesses.reverse()) {
      if (access.instructionIndex() <= instructionIndex) {
        return false;
      }
      if (access.accessType().isWrite()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the first instruction after {@code instructionIndex} that writes to any variable of
   * {@code view}, or empty if there is none.
   */
  public static OptionalInt firstWriteToViewAfter(
      ComputationAnalysis analysis, int view, int instructionIndex) {
    checkElementIndex(
        instructionIndex, analysis.getInstructionAttributes().size(), "instructionIndex");
    int answer = -1;
    for (int variable : analysis.getVariables().getVariablesForView(view)) {
      // Latest accesses first; stop once we are back at the instruction.
      for (Access access : analysis.getVariableAccesses(variable).reverse()) {
        if (access.instructionIndex() <= instructionIndex) {
          break;
        }
        if (access.accessType().isWrite()
            && (answer == -1 || access.instructionIndex() < answer)) {
          answer = access.instructionIndex();
        }
      }
    }
    return answer == -1 ? OptionalInt.empty() : OptionalInt.of(answer);
  }

  /** Lists the views of each buffer, indexed by buffer; entry 0 is empty. */
  public static ImmutableList<ImmutableList<Integer>> computeViewLists(Computation computation) {
    List<List<Integer>> lists = new ArrayList<>();
    for (int b = 0; b < computation.getBufferCount(); b++) {
      lists.add(new ArrayList<>());
    }
    for (int v = 1; v < computation.getViewCount(); v++) {
      int b = computation.getView(v).bufferIndex();
      checkArgument(b > 0 && b < computation.getBufferCount(), "view %s has bad buffer %s", v, b);
      lists.get(b).add(v);
    }
    ImmutableList.Builder<ImmutableList<Integer>> result = ImmutableList.builder();
    for (List<Integer> list : lists) {
      result.add(ImmutableList.copyOf(list));
    }
    return result.build();
  }

  private static BufferAccesses bufferAccesses(ComputationAnalysis analysis, int buffer) {
    checkArgument(
        buffer > 0 && buffer < analysis.getBufferAccesses().size(), "bad buffer %s", buffer);
    return analysis.getBufferAccesses(buffer);
  }
}
