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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * The registry of a hierarchy's levels, ordered from the requester edge (position 0) to the
 * backing edge. A level refers to its neighbors only by its position in this registry.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
final class Topology {
  private final List<CacheLevel> levels;

  private boolean sealed;

  Topology() {
    this.levels = new ArrayList<>();
  }

  /** Appends the level to the backing edge and returns its position. */
  int register(CacheLevel level) {
    checkState(!sealed, "The topology can no longer be modified");
    levels.add(level);
    return levels.size() - 1;
  }

  /** Prevents any further levels from being registered. */
  void seal() {
    sealed = true;
  }

  /** Returns the level closer to the originating request, or null at the requester edge. */
  @Nullable CacheLevel requesterSide(int position) {
    return (position == 0) ? null : levels.get(position - 1);
  }

  /** Returns the level closer to main memory, or null at the backing edge. */
  @Nullable CacheLevel backingSide(int position) {
    return (position + 1 < levels.size()) ? levels.get(position + 1) : null;
  }
}
