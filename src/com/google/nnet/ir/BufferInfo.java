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

/**
 * Dimensions of one buffer ("matrix") of a {@link Computation}. Index 0 of the buffer table is
 * always the empty buffer.
 *
 * @param numRows number of rows
 * @param numCols number of columns
 */
public record BufferInfo(int numRows, int numCols) {
  public BufferInfo {
    checkArgument(
        numRows >= 0 && numCols >= 0, "negative buffer dimension %sx%s", numRows, numCols);
  }

  static final BufferInfo EMPTY = new BufferInfo(0, 0);
}
