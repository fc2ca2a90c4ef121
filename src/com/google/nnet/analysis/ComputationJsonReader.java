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
import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.nnet.ir.Capability;
import com.google.nnet.ir.Computation;
import com.google.nnet.ir.EndpointBinding;
import com.google.nnet.ir.Instruction;
import com.google.nnet.ir.Opcode;
import com.google.nnet.ir.RowRange;
import com.google.nnet.ir.RowRef;
import com.google.nnet.ir.SimpleComponent;
import com.google.nnet.ir.SimpleComponentRegistry;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a component registry and a computation from a JSON document of this shape:
 *
 * <pre>{@code
 * {
 *   "components": [{"inputDim": 4, "outputDim": 4, "capabilities": ["SIMPLE"]}],
 *   "nodes": [{}, {"component": 0}, {}],
 *   "buffers": [[8, 4], [8, 4]],
 *   "views": [[1, 0, 8, 0, 4], [2, 0, 8, 0, 4]],
 *   "indexes": [[0, 1, -1]],
 *   "indexesMulti": [[[1, 0], [-1, -1]]],
 *   "indexesRanges": [[[0, 2]]],
 *   "precomputedIndexesCount": 0,
 *   "endpoints": [{"node": 0, "role": "INPUT", "value": 1, "deriv": 0}],
 *   "instructions": [{"op": "PROPAGATE", "args": [0, 0, 1, 2]}]
 * }
 * }</pre>
 *
 * Buffers and views are numbered from 1 in the order listed; the empty buffer and view are
 * implicit. Nodes without a {@code component} are not component nodes.
 */
public final class ComputationJsonReader {

  private final SimpleComponentRegistry components;
  private final Computation computation;

  private ComputationJsonReader(SimpleComponentRegistry components, Computation computation) {
    this.components = components;
    this.computation = computation;
  }

  public SimpleComponentRegistry getComponents() {
    return components;
  }

  public Computation getComputation() {
    return computation;
  }

  public static ComputationJsonReader parse(String contents) throws ComputationParseException {
    try {
      JsonObject root = new Gson().fromJson(contents, JsonObject.class);
      if (root == null) {
        throw new ComputationParseException("Empty computation description");
      }
      return new ComputationJsonReader(readComponents(root), readComputation(root));
    } catch (JsonParseException
        | IllegalStateException
        | IllegalArgumentException
        | UnsupportedOperationException ex) {
      throw new ComputationParseException("Invalid computation description: " + ex, ex);
    }
  }

  private static SimpleComponentRegistry readComponents(JsonObject root)
      throws ComputationParseException {
    SimpleComponentRegistry.Builder builder = SimpleComponentRegistry.builder();
    for (JsonElement each : array(root, "components")) {
      JsonObject component = each.getAsJsonObject();
      ImmutableSet.Builder<Capability> capabilities = ImmutableSet.builder();
      for (JsonElement capability : array(component, "capabilities")) {
        capabilities.add(Capability.valueOf(capability.getAsString()));
      }
      builder.addComponent(
          new SimpleComponent(
              member(component, "inputDim").getAsInt(),
              member(component, "outputDim").getAsInt(),
              capabilities.build()));
    }
    for (JsonElement each : array(root, "nodes")) {
      JsonObject node = each.getAsJsonObject();
      if (node.has("component")) {
        builder.addComponentNode(member(node, "component").getAsInt());
      } else {
        builder.addOtherNode();
      }
    }
    return builder.build();
  }

  private static Computation readComputation(JsonObject root) throws ComputationParseException {
    Computation.Builder builder = Computation.builder();
    for (JsonElement each : array(root, "buffers")) {
      int[] dims = ints(each, 2, "buffer");
      builder.addBuffer(dims[0], dims[1]);
    }
    for (JsonElement each : array(root, "views")) {
      int[] v = ints(each, 5, "view");
      builder.addView(v[0], v[1], v[2], v[3], v[4]);
    }
    for (JsonElement each : array(root, "indexes")) {
      List<Integer> rows = new ArrayList<>();
      for (JsonElement row : each.getAsJsonArray()) {
        rows.add(row.getAsInt());
      }
      builder.addIndexes(rows);
    }
    for (JsonElement each : array(root, "indexesMulti")) {
      List<RowRef> pairs = new ArrayList<>();
      for (JsonElement pair : each.getAsJsonArray()) {
        int[] p = ints(pair, 2, "row pair");
        pairs.add(new RowRef(p[0], p[1]));
      }
      builder.addIndexesMulti(pairs);
    }
    for (JsonElement each : array(root, "indexesRanges")) {
      List<RowRange> ranges = new ArrayList<>();
      for (JsonElement range : each.getAsJsonArray()) {
        int[] r = ints(range, 2, "row range");
        ranges.add(new RowRange(r[0], r[1]));
      }
      builder.addIndexesRanges(ranges);
    }
    if (root.has("precomputedIndexesCount")) {
      builder.setPrecomputedIndexesCount(member(root, "precomputedIndexesCount").getAsInt());
    }
    for (JsonElement each : array(root, "endpoints")) {
      JsonObject endpoint = each.getAsJsonObject();
      builder.addEndpoint(
          new EndpointBinding(
              member(endpoint, "node").getAsInt(),
              EndpointBinding.Role.valueOf(member(endpoint, "role").getAsString()),
              member(endpoint, "value").getAsInt(),
              endpoint.has("deriv") ? member(endpoint, "deriv").getAsInt() : 0));
    }
    for (JsonElement each : array(root, "instructions")) {
      JsonObject instruction = each.getAsJsonObject();
      Opcode opcode = Opcode.valueOf(member(instruction, "op").getAsString());
      int[] args =
          instruction.has("args") ? ints(member(instruction, "args"), -1, "args") : new int[0];
      builder.add(makeInstruction(opcode, args));
    }
    return builder.build();
  }

  private static Instruction makeInstruction(Opcode opcode, int[] a)
      throws ComputationParseException {
    checkArgCount(opcode, a, expectedArgCount(opcode));
    switch (opcode) {
      case ALLOC_ZEROED:
        return Instruction.allocZeroed(a[0]);
      case ALLOC_UNDEFINED:
        return Instruction.allocUndefined(a[0]);
      case DEALLOC:
        return Instruction.dealloc(a[0]);
      case PROPAGATE:
        return Instruction.propagate(a[0], a[1], a[2], a[3]);
      case STORE_STATS:
        return Instruction.storeStats(a[0], a[1]);
      case BACKPROP:
        return Instruction.backprop(a[0], a[1], a[2], a[3], a[4], a[5]);
      case MATRIX_COPY:
        return Instruction.matrixCopy(a[0], a[1]);
      case MATRIX_ADD:
        return Instruction.matrixAdd(a[0], a[1]);
      case COPY_ROWS:
        return Instruction.copyRows(a[0], a[1], a[2]);
      case ADD_ROWS:
        return Instruction.addRows(a[0], a[1], a[2]);
      case COPY_ROWS_MULTI:
        return Instruction.copyRowsMulti(a[0], a[1]);
      case ADD_ROWS_MULTI:
        return Instruction.addRowsMulti(a[0], a[1]);
      case COPY_TO_ROWS_MULTI:
        return Instruction.copyToRowsMulti(a[0], a[1]);
      case ADD_TO_ROWS_MULTI:
        return Instruction.addToRowsMulti(a[0], a[1]);
      case ADD_ROW_RANGES:
        return Instruction.addRowRanges(a[0], a[1], a[2]);
      case NO_OP:
        return Instruction.noOp();
      case PASS_MARKER:
        return Instruction.passMarker();
    }
    throw new ComputationParseException("Unknown opcode " + opcode);
  }

  private static int expectedArgCount(Opcode opcode) {
    switch (opcode) {
      case ALLOC_ZEROED:
      case ALLOC_UNDEFINED:
      case DEALLOC:
        return 1;
      case STORE_STATS:
      case MATRIX_COPY:
      case MATRIX_ADD:
      case COPY_ROWS_MULTI:
      case ADD_ROWS_MULTI:
      case COPY_TO_ROWS_MULTI:
      case ADD_TO_ROWS_MULTI:
        return 2;
      case COPY_ROWS:
      case ADD_ROWS:
      case ADD_ROW_RANGES:
        return 3;
      case PROPAGATE:
        return 4;
      case BACKPROP:
        return 6;
      case NO_OP:
      case PASS_MARKER:
        return 0;
    }
    throw new IllegalArgumentException("Unknown opcode " + opcode);
  }

  private static void checkArgCount(Opcode opcode, int[] args, int expected)
      throws ComputationParseException {
    if (args.length != expected) {
      throw new ComputationParseException(
          opcode + " takes " + expected + " arguments, got " + args.length);
    }
  }

  /** Returns the value of a required member, which must be present and not {@code null}. */
  private static JsonElement member(JsonObject object, String key)
      throws ComputationParseException {
    JsonElement value = object.get(key);
    if (value == null || value.isJsonNull()) {
      throw new ComputationParseException("Missing key \"" + key + "\" in " + object);
    }
    return value;
  }

  private static ImmutableList<JsonElement> array(JsonObject object, String key)
      throws ComputationParseException {
    if (!object.has(key)) {
      return ImmutableList.of();
    }
    JsonArray array = member(object, key).getAsJsonArray();
    return ImmutableList.copyOf(array);
  }

  /** Reads an array of ints, checking its length unless {@code length} is negative. */
  private static int[] ints(JsonElement element, int length, String what)
      throws ComputationParseException {
    JsonArray array = element.getAsJsonArray();
    if (length >= 0 && array.size() != length) {
      throw new ComputationParseException(
          "Expected " + length + " numbers for " + what + ", got " + array);
    }
    int[] result = new int[array.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = array.get(i).getAsInt();
    }
    return result;
  }
}
