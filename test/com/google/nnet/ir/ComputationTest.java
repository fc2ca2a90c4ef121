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
package com.google.nnet.ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Computation}. */
@RunWith(JUnit4.class)
public final class ComputationTest {

  @Test
  public void testEmptyEntriesArePreinserted() {
    Computation computation = Computation.builder().build();
    assertThat(computation.getBufferCount()).isEqualTo(1);
    assertThat(computation.getViewCount()).isEqualTo(1);
    assertThat(computation.getBuffer(0)).isEqualTo(new BufferInfo(0, 0));
    assertThat(computation.getView(0)).isEqualTo(new ViewInfo(0, 0, 0, 0, 0));
    assertThat(computation.getInstructionCount()).isEqualTo(0);
  }

  @Test
  public void testIndicesStartAtOne() {
    Computation.Builder builder = Computation.builder();
    assertThat(builder.addBuffer(4, 10)).isEqualTo(1);
    assertThat(builder.addBuffer(4, 3)).isEqualTo(2);
    assertThat(builder.addView(1, 0, 4, 0, 10)).isEqualTo(1);
    assertThat(builder.addView(1, 0, 4, 0, 4)).isEqualTo(2);
    assertThat(builder.addBufferWithView(2, 2)).isEqualTo(3);
    assertThat(builder.add(Instruction.passMarker())).isEqualTo(0);
    assertThat(builder.add(Instruction.noOp())).isEqualTo(1);
    assertThat(builder.addIndexes(ImmutableList.of(0, -1))).isEqualTo(0);
    assertThat(builder.addIndexesMulti(ImmutableList.of(RowRef.NONE))).isEqualTo(0);
    assertThat(builder.addIndexesRanges(ImmutableList.of(new RowRange(0, 1)))).isEqualTo(0);
    assertThat(builder.getInstructionCount()).isEqualTo(2);

    Computation computation = builder.build();
    assertThat(computation.getBufferCount()).isEqualTo(4);
    assertThat(computation.getView(3).bufferIndex()).isEqualTo(3);
    assertThat(computation.getIndexes()).containsExactly(ImmutableList.of(0, -1));
  }

  @Test
  public void testIsWholeBuffer() {
    Computation.Builder builder = Computation.builder();
    int buffer = builder.addBuffer(4, 10);
    int whole = builder.addView(buffer, 0, 4, 0, 10);
    int leftColumns = builder.addView(buffer, 0, 4, 0, 4);
    int topRows = builder.addView(buffer, 0, 2, 0, 10);
    Computation computation = builder.build();

    assertThat(computation.isWholeBuffer(whole)).isTrue();
    assertThat(computation.isWholeBuffer(leftColumns)).isFalse();
    assertThat(computation.isWholeBuffer(topRows)).isFalse();
  }

  @Test
  public void testViewOfEmptyBufferRejected() {
    Computation.Builder builder = Computation.builder();
    assertThrows(IllegalArgumentException.class, () -> builder.addView(0, 0, 0, 0, 0));
  }

  @Test
  public void testNegativeDimensionsRejected() {
    Computation.Builder builder = Computation.builder();
    assertThrows(IllegalArgumentException.class, () -> builder.addBuffer(-1, 3));
    assertThrows(
        IllegalArgumentException.class, () -> builder.setPrecomputedIndexesCount(-1));
  }

  @Test
  public void testToBuilderCopiesAndExtends() {
    Computation.Builder builder = Computation.builder();
    int view = builder.addBufferWithView(3, 3);
    builder.add(Instruction.allocZeroed(1));
    builder.setPrecomputedIndexesCount(2);
    builder.addEndpoint(EndpointBinding.input(0, 1, 0));
    Computation original = builder.build();

    assertThat(original.toBuilder().build()).isEqualTo(original);
    assertThat(original.toBuilder().build().hashCode()).isEqualTo(original.hashCode());

    Computation.Builder extended = original.toBuilder();
    assertThat(extended.addView(1, 0, 1, 0, 3)).isEqualTo(view + 1);
    assertThat(extended.add(Instruction.dealloc(1))).isEqualTo(1);
    Computation rewritten = extended.build();
    assertThat(rewritten).isNotEqualTo(original);
    assertThat(rewritten.getPrecomputedIndexesCount()).isEqualTo(2);
    assertThat(original.getInstructionCount()).isEqualTo(1);
  }
}
