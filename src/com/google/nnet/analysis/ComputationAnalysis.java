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
import com.google.nnet.ir.ComponentRegistry;
import com.google.nnet.ir.Computation;
import java.util.Objects;

/**
 * Everything the analysis knows about one computation: how its buffers split into variables,
 * what each instruction reads and writes, and the access history of every variable and buffer.
 *
 * <p>The result is computed once from an unchanging computation and never modified afterwards,
 * so it may be shared between threads. A changed computation needs a fresh analysis.
 *
 * <p>The analysis assumes every operand index is in range; run {@link ComputationChecker}, or
 * at least its index check, on computations of unknown provenance.
 */
public final class ComputationAnalysis {

  private final ComputationVariables variables;
  private final ImmutableList<InstructionAttributes> instructionAttributes;
  private final ImmutableList<ImmutableList<Access>> variableAccesses;
  private final ImmutableList<BufferAccesses> bufferAccesses;

  private ComputationAnalysis(
      ComputationVariables variables,
      ImmutableList<InstructionAttributes> instructionAttributes,
      ImmutableList<ImmutableList<Access>> variableAccesses,
      ImmutableList<BufferAccesses> bufferAccesses) {
    this.variables = variables;
    this.instructionAttributes = instructionAttributes;
    this.variableAccesses = variableAccesses;
    this.bufferAccesses = bufferAccesses;
  }

  /**
   * Analyzes {@code computation}.
   *
   * @throws MalformedComputationException if the views do not partition the buffers cleanly, a
   *     buffer is allocated or deallocated twice, or an endpoint binding is repeated
   */
  public static ComputationAnalysis analyze(
      ComponentRegistry components, Computation computation) {
    ComputationVariables variables = ComputationVariables.create(computation);
    ImmutableList<InstructionAttributes> attributes =
        new AccessClassifier(components, computation, variables).classifyAll();
    return new ComputationAnalysis(
        variables,
        attributes,
        AccessHistoryBuilder.computeVariableAccesses(variables.getVariableCount(), attributes),
        AccessHistoryBuilder.computeBufferAccesses(computation, attributes));
  }

  public ComputationVariables getVariables() {
    return variables;
  }

  /** Attributes of every instruction, indexed by instruction. */
  public ImmutableList<InstructionAttributes> getInstructionAttributes() {
    return instructionAttributes;
  }

  public InstructionAttributes getInstructionAttributes(int instructionIndex) {
    return instructionAttributes.get(instructionIndex);
  }

  /** Access histories, indexed by variable. */
  public ImmutableList<ImmutableList<Access>> getVariableAccesses() {
    return variableAccesses;
  }

  public ImmutableList<Access> getVariableAccesses(int variable) {
    return variableAccesses.get(variable);
  }

  /** Access records, indexed by buffer; entry 0 belongs to the empty buffer. */
  public ImmutableList<BufferAccesses> getBufferAccesses() {
    return bufferAccesses;
  }

  public BufferAccesses getBufferAccesses(int buffer) {
    return bufferAccesses.get(buffer);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ComputationAnalysis)) {
      return false;
    }
    ComputationAnalysis other = (ComputationAnalysis) o;
    return variables.equals(other.variables)
        && instructionAttributes.equals(other.instructionAttributes)
        && variableAccesses.equals(other.variableAccesses)
        && bufferAccesses.equals(other.bufferAccesses);
  }

  @Override
  public int hashCode() {
    return Objects.hash(variables, instructionAttributes, variableAccesses, bufferAccesses);
  }
}
