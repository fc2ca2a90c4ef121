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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Collection;

/**
 * Prints access traces in a compact text form for debugging, one line per buffer or instruction.
 *
 * <pre>
 * m1: alloc=c0, dealloc=c5, accesses=c0(w) c2(r) c3(rw)
 * c2: r(v0,v1) w(v2) r(m1) w(m2)
 * c3: r(v2) w(v3) r(m2) w(m3) side-effects
 * </pre>
 */
public final class AccessTracePrinter {

  private static final Joiner COMMA = Joiner.on(',');
  private static final Joiner SPACE = Joiner.on(' ');

  private AccessTracePrinter() {}

  /** Prints the access record of every buffer except the empty one. */
  public static String printBufferAccesses(ComputationAnalysis analysis) {
    StringBuilder sb = new StringBuilder();
    ImmutableList<BufferAccesses> buffers = analysis.getBufferAccesses();
    for (int b = 1; b < buffers.size(); b++) {
      BufferAccesses a = buffers.get(b);
      sb.append('m').append(b).append(": alloc=").append(instruction(a.getAllocateInstruction()));
      sb.append(", dealloc=").append(instruction(a.getDeallocateInstruction()));
      if (a.isInput()) {
        sb.append(", input");
      }
      if (a.isOutput()) {
        sb.append(", output");
      }
      sb.append(", accesses=");
      SPACE.appendTo(sb, a.getAccesses());
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Prints the variables and buffers each instruction reads and writes. */
  public static String printInstructionAttributes(ComputationAnalysis analysis) {
    StringBuilder sb = new StringBuilder();
    ImmutableList<InstructionAttributes> attributes = analysis.getInstructionAttributes();
    for (int c = 0; c < attributes.size(); c++) {
      InstructionAttributes attr = attributes.get(c);
      ImmutableList.Builder<String> parts = ImmutableList.builder();
      addPart(parts, "r", "v", attr.getVariablesRead());
      addPart(parts, "w", "v", attr.getVariablesWritten());
      addPart(parts, "r", "m", attr.getBuffersRead());
      addPart(parts, "w", "m", attr.getBuffersWritten());
      if (attr.hasSideEffects()) {
        parts.add("side-effects");
      }
      sb.append('c').append(c).append(':');
      for (String part : parts.build()) {
        sb.append(' ').append(part);
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static void addPart(
      ImmutableList.Builder<String> parts, String kind, String prefix, Collection<Integer> items) {
    if (items.isEmpty()) {
      return;
    }
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int item : items) {
      names.add(prefix + item);
    }
    parts.add(kind + "(" + COMMA.join(names.build()) + ")");
  }

  private static String instruction(int index) {
    return index == BufferAccesses.NONE ? "none" : "c" + index;
  }
}
