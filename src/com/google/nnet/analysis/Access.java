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

/**
 * One touch of a variable or buffer by one instruction.
 *
 * @param instructionIndex position of the instruction in the computation
 * @param accessType how it was touched
 */
public record Access(int instructionIndex, AccessType accessType) {
  @Override
  public String toString() {
    return "c" + instructionIndex + "(" + accessType.getShortName() + ")";
  }
}
