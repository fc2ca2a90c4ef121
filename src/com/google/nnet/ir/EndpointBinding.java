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
 * Associates a graph endpoint (an input or output node) with the buffers that carry its value
 * and, optionally, its derivative.
 *
 * <p>For an input node the value buffer is supplied by the caller and the derivative buffer, if
 * any, is handed back. For an output node it is the other way around.
 *
 * @param nodeIndex the endpoint's node index
 * @param role whether the node is an input or an output of the graph
 * @param valueBuffer buffer holding the node's value; never 0
 * @param derivBuffer buffer holding the node's derivative, or 0 if none was requested
 */
public record EndpointBinding(int nodeIndex, Role role, int valueBuffer, int derivBuffer) {

  /** The direction of a graph endpoint. */
  public enum Role {
    INPUT,
    OUTPUT
  }

  public static EndpointBinding input(int nodeIndex, int valueBuffer, int derivBuffer) {
    return new EndpointBinding(nodeIndex, Role.INPUT, valueBuffer, derivBuffer);
  }

  public static EndpointBinding output(int nodeIndex, int valueBuffer, int derivBuffer) {
    return new EndpointBinding(nodeIndex, Role.OUTPUT, valueBuffer, derivBuffer);
  }

  public boolean hasDeriv() {
    return derivBuffer != 0;
  }
}
