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

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import com.github.benmanes.hierarchy.simulator.level.CacheSet.Node;

/**
 * The replacement policy of a set. A policy only reorders the set's list on an access and names
 * the victim; the owning level removes it.
 * <p>
 * Every set keeps its blocks on a list in insertion order, with new blocks appended to the tail.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum EvictionPolicy {

  /** Evicts blocks based on insertion order. */
  FIFO {
    @Override void onAccess(Node node) {
      // do nothing
    }
    @Override @Nullable Node findVictim(Node sentinel) {
      return (sentinel.next == sentinel) ? null : sentinel.next;
    }
  },

  /** Evicts blocks based on how recently they are used, with the least recent evicted first. */
  LRU {
    @Override void onAccess(Node node) {
      node.moveToTail();
    }
    @Override @Nullable Node findVictim(Node sentinel) {
      return (sentinel.next == sentinel) ? null : sentinel.next;
    }
  },

  /** Evicts blocks based on how recently they are used, with the most recent evicted first. */
  MRU {
    @Override void onAccess(Node node) {
      node.moveToTail();
    }
    @Override @Nullable Node findVictim(Node sentinel) {
      return (sentinel.prev == sentinel) ? null : sentinel.prev;
    }
  };

  public String label() {
    return StringUtils.capitalize(name().toLowerCase(US));
  }

  /** Returns the policy based on its configuration name, ignoring case. */
  public static EvictionPolicy named(String name) {
    for (EvictionPolicy policy : values()) {
      if (policy.name().equalsIgnoreCase(name.trim())) {
        return policy;
      }
    }
    throw new ConfigurationException("Unknown eviction policy: " + name);
  }

  /** Performs any reordering required by the policy after a block was hit. */
  abstract void onAccess(Node node);

  /** Returns the victim block to evict, or null if the set is empty. */
  abstract @Nullable Node findVictim(Node sentinel);
}
