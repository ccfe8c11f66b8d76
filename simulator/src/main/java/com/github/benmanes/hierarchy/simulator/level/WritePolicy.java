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

/**
 * The write policies that a cache level can be configured with.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum WritePolicy {

  /**
   * Dirty data reaches the backing side only when its block is evicted or invalidated, and a write
   * miss allocates the block (write-allocate).
   */
  WRITE_BACK;

  /** Returns the policy based on its configuration name, such as {@code write-back}. */
  public static WritePolicy named(String name) {
    String normalized = name.trim().replace('-', '_').toUpperCase(US);
    for (WritePolicy policy : values()) {
      if (policy.name().equals(normalized)) {
        return policy;
      }
    }
    throw new ConfigurationException("Unsupported write policy: " + name);
  }
}
