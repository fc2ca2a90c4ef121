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

/** How an instruction touches a variable or buffer. */
public enum AccessType {
  READ("r"),
  WRITE("w"),
  READ_WRITE("rw");

  private final String shortName;

  AccessType(String shortName) {
    this.shortName = shortName;
  }

  /** Whether the access may change the contents, i.e. anything but a pure read. */
  public boolean isWrite() {
    return this != READ;
  }

  static AccessType of(boolean isRead, boolean isWritten) {
    if (isRead && isWritten) {
      return READ_WRITE;
    }
    return isRead ? READ : WRITE;
  }

  String getShortName() {
    return shortName;
  }
}
