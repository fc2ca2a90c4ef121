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

/**
 * Lookup of components and network nodes by index. Propagate and store-stats instructions name
 * components directly; backprop instructions name a node, which must be a component node.
 */
public interface ComponentRegistry {

  int getComponentCount();

  ComponentProperties getComponent(int componentIndex);

  int getNodeCount();

  boolean isComponentNode(int nodeIndex);

  /**
   * Returns the component computed by a node.
   *
   * @throws IllegalArgumentException if the node is not a component node
   */
  ComponentProperties getComponentForNode(int nodeIndex);
}
