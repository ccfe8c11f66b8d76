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

import static com.github.benmanes.hierarchy.simulator.level.ConfigurationException.checkConfiguration;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A chain of cache levels, from the requester edge that services the originating requests to the
 * backing edge that is closest to main memory. Each hierarchy is fully isolated, so independent
 * hierarchies may be driven concurrently, but the requests to a single hierarchy must be
 * serialized by the caller.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class CacheHierarchy {
  private final ImmutableList<CacheLevel> levels;

  private CacheHierarchy(ImmutableList<CacheLevel> levels) {
    this.levels = levels;
  }

  /** Returns the levels, from the requester edge to the backing edge. */
  public ImmutableList<CacheLevel> levels() {
    return levels;
  }

  /** Returns the level at the position, where zero is the requester edge. */
  public CacheLevel level(int position) {
    return levels.get(position);
  }

  /** Returns the level with the given name. */
  public CacheLevel level(String name) {
    return levels.stream()
        .filter(level -> level.name().equals(name))
        .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown level: " + name));
  }

  /** Returns the level that services the originating requests. */
  public CacheLevel requesterEdge() {
    return levels.get(0);
  }

  /** Returns the level closest to main memory. */
  public CacheLevel backingEdge() {
    return levels.get(levels.size() - 1);
  }

  /** Issues the request to the requester edge. */
  public void access(Operation operation, long address) {
    requesterEdge().access(operation, address);
  }

  /**
   * Issues the request for the textual operation code to the requester edge.
   *
   * @throws ProtocolException if the operation code is not recognized
   */
  public void access(String code, long address) {
    requesterEdge().access(code, address);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("levels", levels).toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final List<LevelConfig> configs;

    private Function<LevelConfig, HierarchyNotifier> notifiers;

    Builder() {
      this.configs = new ArrayList<>();
      this.notifiers = config -> HierarchyNotifier.disabled();
    }

    /** Appends a level at the backing edge of the hierarchy. */
    @CanIgnoreReturnValue
    public Builder level(LevelConfig config) {
      configs.add(requireNonNull(config));
      return this;
    }

    /** Appends every level, in order from the requester edge to the backing edge. */
    @CanIgnoreReturnValue
    public Builder levels(Iterable<LevelConfig> configs) {
      configs.forEach(this::level);
      return this;
    }

    /** Specifies the function that supplies each level with its notifier. */
    @CanIgnoreReturnValue
    public Builder notifiers(Function<LevelConfig, HierarchyNotifier> notifiers) {
      this.notifiers = requireNonNull(notifiers);
      return this;
    }

    /**
     * Returns a new hierarchy with its levels wired together.
     *
     * @throws ConfigurationException if no levels were specified, if two share a name, or if a
     *     level's block is larger than the block of its backing side
     */
    public CacheHierarchy build() {
      checkConfiguration(!configs.isEmpty(), "at least one level must be specified");
      Set<String> names = new HashSet<>();
      for (LevelConfig config : configs) {
        checkConfiguration(names.add(config.name()), "duplicate level name: %s", config.name());
      }
      for (int i = 1; i < configs.size(); i++) {
        LevelConfig requester = configs.get(i - 1);
        LevelConfig backing = configs.get(i);
        checkConfiguration(requester.blockSize() <= backing.blockSize(),
            "%s block size (%s) exceeds the %s block size (%s)", requester.name(),
            requester.blockSize(), backing.name(), backing.blockSize());
      }

      var topology = new Topology();
      var levels = ImmutableList.<CacheLevel>builderWithExpectedSize(configs.size());
      for (LevelConfig config : configs) {
        levels.add(new CacheLevel(config, requireNonNull(notifiers.apply(config)), topology));
      }
      topology.seal();
      return new CacheHierarchy(levels.build());
    }
  }
}
