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
 * One element of an {@code indexesMulti} table: a (view, row) pair naming a row of some view.
 * The pair {@link #NONE} marks a row with no source (for gathers) or no destination (for
 * scatters).
 */
public record RowRef(int viewIndex, int row) implements Comparable<RowRef> {

  public static final RowRef NONE = new RowRef(-1, -1);

  public boolean isNone() {
    return viewIndex == -1;
  }

  @Override
  public int compareTo(RowRef other) {
    int c = Integer.compare(viewIndex, other.viewIndex);
    return c != 0 ? c : Integer.compare(row, other.row);
  }

  @Override
  public String toString() {
    return "(" + viewIndex + "," + row + ")";
  }
}
