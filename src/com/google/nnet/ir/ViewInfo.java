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
 * A rectangular region of a buffer. Instructions operate on views, never on buffers directly
 * (allocation and deallocation aside). Index 0 of the view table is the empty view.
 *
 * @param bufferIndex the buffer this view aliases
 * @param rowOffset first row covered
 * @param numRows number of rows covered
 * @param colOffset first column covered
 * @param numCols number of columns covered
 */
public record ViewInfo(int bufferIndex, int rowOffset, int numRows, int colOffset, int numCols) {

  static final ViewInfo EMPTY = new ViewInfo(0, 0, 0, 0, 0);

  /** The first column past the end of this view. */
  public int colEnd() {
    return colOffset + numCols;
  }

  public int rowEnd() {
    return rowOffset + numRows;
  }
}
