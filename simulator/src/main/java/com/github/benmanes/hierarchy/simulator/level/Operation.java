/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
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
package com.github.benmanes.hierarchy.simulator.level;

import static java.util.Locale.US;

import org.jspecify.annotations.Nullable;

/**
 * The request types that a cache level services.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum Operation {

  /** Loads the block, fetching it from the backing side on a miss. */
  READ("R"),

  /** Stores into the block, allocating it on a miss. */
  WRITE("W"),

  /**
   * A dirty block pushed into this level from the requester side while that level drops it. Only
   * records the dirty state and never cascades toward the backing side.
   */
  WRITEBACK("B");

  private final String code;

  Operation(String code) {
    this.code = code;
  }

  /** Returns the single letter code used by traces and reports. */
  public String code() {
    return code;
  }

  /**
   * Returns the operation for the textual code, ignoring case.
   *
   * @throws ProtocolException if the code is not recognized
   */
  public static Operation fromCode(@Nullable String code) {
    if (code != null) {
      String normalized = code.trim().toUpperCase(US);
      for (Operation operation : values()) {
        if (operation.code.equals(normalized)) {
          return operation;
        }
      }
    }
    throw new ProtocolException("Unknown operation code: " + code);
  }
}
