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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * An immutable {@link ComponentRegistry} backed by lists. Nodes are either component nodes,
 * which refer to a component by index, or other nodes (inputs, outputs, descriptors) that carry
 * no component.
 */
public final class SimpleComponentRegistry implements ComponentRegistry {

  private static final int NOT_A_COMPONENT = -1;

  private final ImmutableList<ComponentProperties> components;
  // Component index per node, or NOT_A_COMPONENT.
  private final ImmutableList<Integer> nodeComponents;

  private SimpleComponentRegistry(
      ImmutableList<ComponentProperties> components, ImmutableList<Integer> nodeComponents) {
    this.components = components;
    this.nodeComponents = nodeComponents;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public int getComponentCount() {
    return components.size();
  }

  @Override
  public ComponentProperties getComponent(int componentIndex) {
    return components.get(componentIndex);
  }

  @Override
  public int getNodeCount() {
    return nodeComponents.size();
  }

  @Override
  public boolean isComponentNode(int nodeIndex) {
    return nodeComponents.get(nodeIndex) != NOT_A_COMPONENT;
  }

  @Override
  public ComponentProperties getComponentForNode(int nodeIndex) {
    int component = nodeComponents.get(nodeIndex);
    checkArgument(component != NOT_A_COMPONENT, "node %s is not a component node", nodeIndex);
    return components.get(component);
  }

  /** Builder for {@link SimpleComponentRegistry}. */
  public static final class Builder {
    private final List<ComponentProperties> components = new ArrayList<>();
    private final List<Integer> nodeComponents = new ArrayList<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public int addComponent(ComponentProperties component) {
      components.add(checkNotNull(component));
      return components.size() - 1;
    }

    /** Adds a node that computes the given component, returning the node index. */
    @CanIgnoreReturnValue
    public int addComponentNode(int componentIndex) {
      checkArgument(
          componentIndex >= 0 && componentIndex < components.size(),
          "no component %s",
          componentIndex);
      nodeComponents.add(componentIndex);
      return nodeComponents.size() - 1;
    }

    /** Adds a node without a component, such as an input or output node. */
    @CanIgnoreReturnValue
    public int addOtherNode() {
      nodeComponents.add(NOT_A_COMPONENT);
      return nodeComponents.size() - 1;
    }

    public SimpleComponentRegistry build() {
      return new SimpleComponentRegistry(
          ImmutableList.copyOf(components), ImmutableList.copyOf(nodeComponents));
    }
  }
}
