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
package com.github.benmanes.hierarchy.simulator;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.util.List;

import com.github.benmanes.hierarchy.simulator.level.EvictionPolicy;
import com.github.benmanes.hierarchy.simulator.level.LevelConfig;
import com.github.benmanes.hierarchy.simulator.level.WritePolicy;
import com.github.benmanes.hierarchy.simulator.parser.ErrorPolicy;
import com.github.benmanes.hierarchy.simulator.parser.TraceFormat;
import com.github.benmanes.hierarchy.simulator.report.ReportFormat;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * The simulator's configuration. See <tt>reference.conf</tt> for the available settings.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public class BasicSettings {
  private final Config config;

  public BasicSettings(Config config) {
    this.config = requireNonNull(config);
  }

  /** Returns the levels of the hierarchy, from the requester edge to the backing edge. */
  public ImmutableList<LevelConfig> levels() {
    List<? extends Config> levels = config().getConfigList("levels");
    if (levels.isEmpty()) {
      throw new ConfigException.BadValue(config().origin(), "levels",
          "at least one level must be specified");
    }
    return levels.stream()
        .map(LevelSettings::new)
        .map(LevelSettings::toLevelConfig)
        .collect(toImmutableList());
  }

  public TraceSettings trace() {
    return new TraceSettings();
  }

  public ReportSettings report() {
    return new ReportSettings();
  }

  /** Returns the config resolved at the simulator's path. */
  public Config config() {
    return config;
  }

  /** The settings of a single level. */
  static final class LevelSettings {
    private final Config config;

    LevelSettings(Config config) {
      this.config = requireNonNull(config);
    }

    public String name() {
      return config.getString("name").trim();
    }
    public long size() {
      return config.getBytes("size");
    }
    public long blockSize() {
      return config.getBytes("block-size");
    }
    public int associativity() {
      return config.getInt("associativity");
    }
    public EvictionPolicy evictionPolicy() {
      return EvictionPolicy.named(config.getString("eviction-policy"));
    }
    public WritePolicy writePolicy() {
      return config.hasPath("write-policy")
          ? WritePolicy.named(config.getString("write-policy"))
          : WritePolicy.WRITE_BACK;
    }
    LevelConfig toLevelConfig() {
      return new LevelConfig(name(), size(), blockSize(),
          associativity(), evictionPolicy(), writePolicy());
    }
  }

  public final class TraceSettings {
    public TraceFormat format() {
      return TraceFormat.named(config().getString("trace.files.format"));
    }
    public List<String> paths() {
      return config().getStringList("trace.files.paths");
    }
    public long skip() {
      return config().getLong("trace.skip");
    }
    public long limit() {
      return config().getLong("trace.limit");
    }
    public ErrorPolicy onError() {
      return ErrorPolicy.named(config().getString("trace.on-error"));
    }
  }

  public final class ReportSettings {
    public ReportFormat format() {
      return ReportFormat.valueOf(config().getString("report.format").trim().toUpperCase(US));
    }
    public String output() {
      return config().getString("report.output").trim();
    }
  }
}
