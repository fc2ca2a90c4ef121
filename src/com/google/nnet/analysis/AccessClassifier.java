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
import com.google.nnet.ir.RowRef;
import java.util.List;

/**
 * Works out which variables, views and buffers each instruction reads and writes.
 *
 * <p>Most opcodes read their source views and write their destination. The exceptions are where
 * the old contents of the destination survive the instruction, which makes the access a
 * read-write:
 *
 * <ul>
 *   <li>components that add into their output (or input derivative) instead of overwriting it;
 *   <li>{@code ADD_*} opcodes;
 *   <li>{@code COPY_ROWS} when some destination row has no source (index -1);
 *   <li>scatters into other views, which never cover every row of their targets.
 * </ul>
 *
 * <p>{@code COPY_ROWS_MULTI} is a pure write even with sentinel entries, since rows without a
 * source are set to zero.
 */
final class AccessClassifier {

  static final DiagnosticType UNKNOWN_OPCODE =
      DiagnosticType.error("NNET_UNKNOWN_OPCODE", "Instruction c{0} has unknown opcode {1}.");

  private final ComponentRegistry components;
  private final Computation computation;
  private final ComputationVariables variables;

  AccessClassifier(
      ComponentRegistry components, Computation computation, ComputationVariables variables) {
    this.components = components;
    this.computation = computation;
    this.variables = variables;
  }

  /** Classifies every instruction of the computation, in order. */
  ImmutableList<InstructionAttributes> classifyAll() {
    ImmutableList.Builder<InstructionAttributes> result = ImmutableList.builder();
    for (int c = 0; c < computation.getInstructionCount(); c++) {
      result.add(classify(c));
    }
    return result.build();
  }

  InstructionAttributes classify(int instructionIndex) {
    Instruction instruction = computation.getInstruction(instructionIndex);
    InstructionAttributes.Builder attr = InstructionAttributes.builder();
    switch (instruction.getOpcode()) {
      case ALLOC_ZEROED:
        // Zeroing counts as a write.
        variables.recordWriteForBuffer(((BufferInstruction) instruction).getBuffer(), attr);
        break;
      case ALLOC_UNDEFINED:
      case DEALLOC:
        // Tracked through BufferAccesses instead.
        break;
      case PROPAGATE:
        {
          Propagate p = (Propagate) instruction;
          ComponentProperties component = components.getComponent(p.getComponent());
          variables.recordAccessForView(p.getInputView(), AccessType.READ, attr);
          variables.recordAccessForView(
              p.getOutputView(),
              component.has(Capability.PROPAGATE_ADDS) ? AccessType.READ_WRITE : AccessType.WRITE,
              attr);
          break;
        }
      case STORE_STATS:
        // TODO(nnet): the component's stats change here, yet unlike an updatable backprop this
        // is not marked as a side effect. Decide whether dead code elimination may drop it.
        variables.recordAccessForView(((StoreStats) instruction).getView(), AccessType.READ, attr);
        break;
      case BACKPROP:
        {
          Backprop b = (Backprop) instruction;
          ComponentProperties component = components.getComponentForNode(b.getNode());
          variables.recordAccessForView(b.getInputView(), AccessType.READ, attr);
          variables.recordAccessForView(b.getOutputView(), AccessType.READ, attr);
          variables.recordAccessForView(b.getOutputDerivView(), AccessType.READ, attr);
          variables.recordAccessForView(
              b.getInputDerivView(),
              component.has(Capability.BACKPROP_ADDS) ? AccessType.READ_WRITE : AccessType.WRITE,
              attr);
          if (component.has(Capability.UPDATABLE)) {
            attr.setHasSideEffects(true);
          }
          break;
        }
      case MATRIX_COPY:
        {
          ViewToView v = (ViewToView) instruction;
          variables.recordAccessForView(v.getDestView(), AccessType.WRITE, attr);
          variables.recordAccessForView(v.getSrcView(), AccessType.READ, attr);
          break;
        }
      case MATRIX_ADD:
        {
          ViewToView v = (ViewToView) instruction;
          variables.recordAccessForView(v.getDestView(), AccessType.READ_WRITE, attr);
          variables.recordAccessForView(v.getSrcView(), AccessType.READ, attr);
          break;
        }
      case ADD_ROWS:
        {
          GatherRows g = (GatherRows) instruction;
          variables.recordAccessForView(g.getDestView(), AccessType.READ_WRITE, attr);
          variables.recordAccessForView(g.getSrcView(), AccessType.READ, attr);
          break;
        }
      case COPY_ROWS:
        {
          GatherRows g = (GatherRows) instruction;
          // Rows with no source keep their old value, so the result depends on it.
          boolean hasMissingRows = computation.getIndexes().get(g.getIndexes()).contains(-1);
          variables.recordAccessForView(
              g.getDestView(), hasMissingRows ? AccessType.READ_WRITE : AccessType.WRITE, attr);
          variables.recordAccessForView(g.getSrcView(), AccessType.READ, attr);
          break;
        }
      case ADD_ROWS_MULTI:
        {
          RowsMulti m = (RowsMulti) instruction;
          variables.recordAccessForView(m.getView(), AccessType.READ_WRITE, attr);
          for (int view : viewsIn(computation.getIndexesMulti().get(m.getIndexesMulti()))) {
            variables.recordAccessForView(view, AccessType.READ, attr);
          }
          break;
        }
      case COPY_ROWS_MULTI:
        {
          RowsMulti m = (RowsMulti) instruction;
          variables.recordAccessForView(m.getView(), AccessType.WRITE, attr);
          for (int view : viewsIn(computation.getIndexesMulti().get(m.getIndexesMulti()))) {
            variables.recordAccessForView(view, AccessType.READ, attr);
          }
          break;
        }
      case ADD_TO_ROWS_MULTI:
      case COPY_TO_ROWS_MULTI:
        {
          RowsMulti m = (RowsMulti) instruction;
          variables.recordAccessForView(m.getView(), AccessType.READ, attr);
          // Even a copy leaves the rows it does not target untouched.
          for (int view : viewsIn(computation.getIndexesMulti().get(m.getIndexesMulti()))) {
            variables.recordAccessForView(view, AccessType.READ_WRITE, attr);
          }
          break;
        }
      case ADD_ROW_RANGES:
        {
          AddRowRanges r = (AddRowRanges) instruction;
          variables.recordAccessForView(r.getDestView(), AccessType.READ_WRITE, attr);
          variables.recordAccessForView(r.getSrcView(), AccessType.READ, attr);
          break;
        }
      case NO_OP:
      case PASS_MARKER:
        break;
      default:
        throw MalformedComputationException.make(
            UNKNOWN_OPCODE, instructionIndex, instruction.getOpcode());
    }
    return attr.build();
  }

  /** The distinct views named in a row-pair list, ignoring {@link RowRef#NONE}. */
  static ImmutableSortedSet<Integer> viewsIn(List<RowRef> pairs) {
    ImmutableSortedSet.Builder<Integer> views = ImmutableSortedSet.naturalOrder();
    for (RowRef pair : pairs) {
      if (!pair.isNone()) {
        views.add(pair.viewIndex());
      }
    }
    return views.build();
  }
}
