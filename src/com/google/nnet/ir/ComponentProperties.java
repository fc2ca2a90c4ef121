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

import com.google.common.collect.ImmutableSet;

/**
 * The read-only facts about a component that the analysis needs: its dimensions and its
 * capability flags. The analysis never depends on concrete component classes.
 */
public interface ComponentProperties {

  int getInputDim();

  int getOutputDim();

  ImmutableSet<Capability> getCapabilities();

  default boolean has(Capability capability) {
    return getCapabilities().contains(capability);
  }
}
