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

import com.google.common.collect.ImmutableSet;

/** A plain value implementation of {@link ComponentProperties}. */
public record SimpleComponent(int inputDim, int outputDim, ImmutableSet<Capability> capabilities)
    implements ComponentProperties {

  public SimpleComponent {
    checkArgument(inputDim > 0 && outputDim > 0, "bad dims %s -> %s", inputDim, outputDim);
  }

  public static SimpleComponent of(int inputDim, int outputDim, Capability... capabilities) {
    return new SimpleComponent(inputDim, outputDim, ImmutableSet.copyOf(capabilities));
  }

  @Override
  public int getInputDim() {
    return inputDim;
  }

  @Override
  public int getOutputDim() {
    return outputDim;
  }

  @Override
  public ImmutableSet<Capability> getCapabilities() {
    return capabilities;
  }
}
