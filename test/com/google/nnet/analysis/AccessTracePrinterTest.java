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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AccessTracePrinter}. */
@RunWith(JUnit4.class)
public final class AccessTracePrinterTest {

  private final ComputationAnalysis analysis =
      ComputationAnalysis.analyze(
          SampleComputations.REGISTRY, SampleComputations.forwardBackward());

  @Test
  public void testPrintBufferAccesses() {
    assertThat(AccessTracePrinter.printBufferAccesses(analysis))
        .isEqualTo(
            "m1: alloc=none, dealloc=c5, input, accesses=c1(r) c4(r)\n"
                + "m2: alloc=c0, dealloc=none, output, accesses=c1(w)\n"
                + "m3: alloc=none, dealloc=c6, input, accesses=c4(r)\n"
                + "m4: alloc=c3, dealloc=none, output, accesses=c3(w) c4(w)\n");
  }

  @Test
  public void testPrintInstructionAttributes() {
    assertThat(AccessTracePrinter.printInstructionAttributes(analysis))
        .isEqualTo(
            "c0:\n"
                + "c1: r(v0) w(v1) r(m1) w(m2)\n"
                + "c2:\n"
                + "c3: w(v3) w(m4)\n"
                + "c4: r(v0,v2) w(v3) r(m1,m3) w(m4) side-effects\n"
                + "c5:\n"
                + "c6:\n");
  }
}
