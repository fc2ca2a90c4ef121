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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SimpleComponentRegistry} and {@link SimpleComponent}. */
@RunWith(JUnit4.class)
public final class SimpleComponentRegistryTest {

  @Test
  public void testNodes() {
    SimpleComponentRegistry.Builder builder = SimpleComponentRegistry.builder();
    int affine = builder.addComponent(SimpleComponent.of(4, 3, Capability.UPDATABLE));
    int relu = builder.addComponent(SimpleComponent.of(3, 3, Capability.SIMPLE));
    assertThat(builder.addOtherNode()).isEqualTo(0);
    assertThat(builder.addComponentNode(affine)).isEqualTo(1);
    assertThat(builder.addComponentNode(relu)).isEqualTo(2);
    SimpleComponentRegistry registry = builder.build();

    assertThat(registry.getComponentCount()).isEqualTo(2);
    assertThat(registry.getNodeCount()).isEqualTo(3);
    assertThat(registry.isComponentNode(0)).isFalse();
    assertThat(registry.isComponentNode(2)).isTrue();
    assertThat(registry.getComponentForNode(2)).isSameInstanceAs(registry.getComponent(relu));
    assertThat(registry.getComponentForNode(1).has(Capability.UPDATABLE)).isTrue();
    assertThat(registry.getComponentForNode(1).has(Capability.SIMPLE)).isFalse();
  }

  @Test
  public void testUnknownComponentRejected() {
    SimpleComponentRegistry.Builder builder = SimpleComponentRegistry.builder();
    assertThrows(IllegalArgumentException.class, () -> builder.addComponentNode(0));
  }

  @Test
  public void testComponentDims() {
    SimpleComponent component = SimpleComponent.of(5, 2, Capability.SIMPLE);
    assertThat(component.getInputDim()).isEqualTo(5);
    assertThat(component.getOutputDim()).isEqualTo(2);
    assertThat(component.getCapabilities()).containsExactly(Capability.SIMPLE);
    assertThrows(IllegalArgumentException.class, () -> SimpleComponent.of(0, 2));
  }
}
