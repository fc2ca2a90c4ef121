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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import com.google.nnet.ir.Computation;
import com.google.nnet.ir.EndpointBinding;
import com.google.nnet.ir.Instruction;
import com.google.nnet.ir.Instruction.BufferInstruction;
import com.google.nnet.ir.Opcode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns the per-instruction attributes around into per-variable and per-buffer access
 * histories, and works out the allocation, deallocation and input/output status of each buffer.
 */
final class AccessHistoryBuilder {

  static final DiagnosticType BUFFER_ALLOCATED_TWICE =
      DiagnosticType.error(
          "NNET_BUFFER_ALLOCATED_TWICE", "Buffer m{0} is allocated twice, by c{1} and c{2}.");

  static final DiagnosticType BUFFER_DEALLOCATED_TWICE =
      DiagnosticType.error(
          "NNET_BUFFER_DEALLOCATED_TWICE", "Buffer m{0} is deallocated twice, by c{1} and c{2}.");

  static final DiagnosticType ENDPOINT_BUFFER_OUT_OF_RANGE =
      DiagnosticType.error(
          "NNET_ENDPOINT_BUFFER_OUT_OF_RANGE",
          "Node {0} is bound to buffer m{1}, which is not a valid buffer.");

  static final DiagnosticType DUPLICATE_ENDPOINT_BINDING =
      DiagnosticType.error(
          "NNET_DUPLICATE_ENDPOINT_BINDING",
          "Buffer m{0} is bound as an {1} more than once (node {2}).");

  private AccessHistoryBuilder() {}

  /** Builds the access list of every variable, indexed by variable. */
  static ImmutableList<ImmutableList<Access>> computeVariableAccesses(
      int numVariables, List<InstructionAttributes> attributes) {
    List<List<Access>> accesses = newLists(numVariables);
    for (int c = 0; c < attributes.size(); c++) {
      InstructionAttributes attr = attributes.get(c);
      appendAccesses(c, attr.getVariablesRead(), attr.getVariablesWritten(), accesses);
    }
    return freeze(accesses);
  }

  /** Builds the access record of every buffer, indexed by buffer; entry 0 is the empty buffer. */
  static ImmutableList<BufferAccesses> computeBufferAccesses(
      Computation computation, List<InstructionAttributes> attributes) {
    int numBuffers = computation.getBufferCount();
    List<List<Access>> accesses = newLists(numBuffers);
    int[] allocate = new int[numBuffers];
    int[] deallocate = new int[numBuffers];
    Arrays.fill(allocate, BufferAccesses.NONE);
    Arrays.fill(deallocate, BufferAccesses.NONE);

    for (int c = 0; c < attributes.size(); c++) {
      InstructionAttributes attr = attributes.get(c);
      appendAccesses(c, attr.getBuffersRead(), attr.getBuffersWritten(), accesses);

      Instruction instruction = computation.getInstruction(c);
      Opcode opcode = instruction.getOpcode();
      if (opcode.isAllocation()) {
        int b = ((BufferInstruction) instruction).getBuffer();
        if (allocate[b] != BufferAccesses.NONE) {
          throw MalformedComputationException.make(BUFFER_ALLOCATED_TWICE, b, allocate[b], c);
        }
        allocate[b] = c;
      } else if (opcode == Opcode.DEALLOC) {
        int b = ((BufferInstruction) instruction).getBuffer();
        if (deallocate[b] != BufferAccesses.NONE) {
          throw MalformedComputationException.make(BUFFER_DEALLOCATED_TWICE, b, deallocate[b], c);
        }
        deallocate[b] = c;
      }
    }

    boolean[] isInput = new boolean[numBuffers];
    boolean[] isOutput = new boolean[numBuffers];
    for (EndpointBinding binding : computation.getEndpoints()) {
      int value = binding.valueBuffer();
      int deriv = binding.derivBuffer();
      checkEndpointBuffer(binding, value, numBuffers);
      if (binding.hasDeriv()) {
        checkEndpointBuffer(binding, deriv, numBuffers);
      }
      // An input node's derivative is handed back to the caller; an output node's derivative is
      // supplied by it.
      if (binding.role() == EndpointBinding.Role.INPUT) {
        setFlag(isInput, value, "input", binding);
        if (binding.hasDeriv()) {
          setFlag(isOutput, deriv, "output", binding);
        }
      } else {
        setFlag(isOutput, value, "output", binding);
        if (binding.hasDeriv()) {
          setFlag(isInput, deriv, "input", binding);
        }
      }
    }

    ImmutableList.Builder<BufferAccesses> result = ImmutableList.builder();
    for (int b = 0; b < numBuffers; b++) {
      result.add(
          new BufferAccesses(
              ImmutableList.copyOf(accesses.get(b)),
              allocate[b],
              deallocate[b],
              isInput[b],
              isOutput[b]));
    }
    return result.build();
  }

  private static void checkEndpointBuffer(EndpointBinding binding, int buffer, int numBuffers) {
    if (buffer < 1 || buffer >= numBuffers) {
      throw MalformedComputationException.make(
          ENDPOINT_BUFFER_OUT_OF_RANGE, binding.nodeIndex(), buffer);
    }
  }

  private static void setFlag(boolean[] flags, int buffer, String role, EndpointBinding binding) {
    if (flags[buffer]) {
      throw MalformedComputationException.make(
          DUPLICATE_ENDPOINT_BINDING, buffer, role, binding.nodeIndex());
    }
    flags[buffer] = true;
  }

  /** Appends one access for each index that is read or written, in increasing index order. */
  private static void appendAccesses(
      int instructionIndex,
      ImmutableSortedSet<Integer> read,
      ImmutableSortedSet<Integer> written,
      List<List<Access>> accesses) {
    for (int index : ImmutableSortedSet.copyOf(Sets.union(read, written))) {
      AccessType type = AccessType.of(read.contains(index), written.contains(index));
      accesses.get(index).add(new Access(instructionIndex, type));
    }
  }

  private static List<List<Access>> newLists(int n) {
    List<List<Access>> lists = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      lists.add(new ArrayList<>());
    }
    return lists;
  }

  private static ImmutableList<ImmutableList<Access>> freeze(List<List<Access>> lists) {
    ImmutableList.Builder<ImmutableList<Access>> result = ImmutableList.builder();
    for (List<Access> list : lists) {
      result.add(ImmutableList.copyOf(list));
    }
    return result.build();
  }
}
