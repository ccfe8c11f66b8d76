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
package com.github.benmanes.hierarchy.simulator.parser;

import static java.util.Objects.requireNonNull;

import com.github.benmanes.hierarchy.simulator.level.Operation;

/**
 * A memory request recorded in a trace.
 *
 * @param operation the type of request
 * @param address the requested byte address
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public record MemoryAccess(Operation operation, long address) {

  public MemoryAccess {
    requireNonNull(operation);
  }

  public static MemoryAccess read(long address) {
    return new MemoryAccess(Operation.READ, address);
  }

  public static MemoryAccess write(long address) {
    return new MemoryAccess(Operation.WRITE, address);
  }

  @Override
  public String toString() {
    return operation.code() + " 0x" + Long.toHexString(address);
  }
}
