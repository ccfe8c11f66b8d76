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

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The geometry and policies of one cache level. The geometry is validated on construction, so a
 * config that exists can always be built into a level.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public record LevelConfig(String name, long size, long blockSize, int associativity,
    EvictionPolicy evictionPolicy, WritePolicy writePolicy) {

  public LevelConfig {
    requireNonNull(name);
    requireNonNull(evictionPolicy);
    requireNonNull(writePolicy);
    checkConfiguration(StringUtils.isNotBlank(name), "level name must be specified");
    AddressDecoder.forGeometry(size, blockSize, associativity);
  }

  /** Returns the number of sets, {@code size / (blockSize * associativity)}. */
  public int numberOfSets() {
    return Math.toIntExact(size / (blockSize * associativity));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
    private WritePolicy writePolicy = WritePolicy.WRITE_BACK;
    private @Nullable String name;
    private int associativity;
    private long blockSize;
    private long size;

    @CanIgnoreReturnValue
    public Builder name(String name) {
      this.name = requireNonNull(name);
      return this;
    }
    @CanIgnoreReturnValue
    public Builder size(long size) {
      this.size = size;
      return this;
    }
    @CanIgnoreReturnValue
    public Builder blockSize(long blockSize) {
      this.blockSize = blockSize;
      return this;
    }
    @CanIgnoreReturnValue
    public Builder associativity(int associativity) {
      this.associativity = associativity;
      return this;
    }
    @CanIgnoreReturnValue
    public Builder evictionPolicy(EvictionPolicy evictionPolicy) {
      this.evictionPolicy = requireNonNull(evictionPolicy);
      return this;
    }
    @CanIgnoreReturnValue
    public Builder writePolicy(WritePolicy writePolicy) {
      this.writePolicy = requireNonNull(writePolicy);
      return this;
    }
    public LevelConfig build() {
      checkConfiguration(name != null, "level name must be specified");
      return new LevelConfig(name, size, blockSize, associativity, evictionPolicy, writePolicy);
    }
  }
}
