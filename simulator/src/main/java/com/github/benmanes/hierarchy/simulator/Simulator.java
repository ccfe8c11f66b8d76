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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

import com.github.benmanes.hierarchy.simulator.level.CacheHierarchy;
import com.github.benmanes.hierarchy.simulator.parser.MemoryAccess;
import com.github.benmanes.hierarchy.simulator.parser.TraceReader;
import com.github.benmanes.hierarchy.simulator.stats.LevelStats;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A simulator that replays the recorded memory accesses through a cache hierarchy and generates a
 * per-level report. See <tt>reference.conf</tt> for details on the configuration.
 * <p>
 * Each level reports how its requests were serviced. A miss may occur due to,
 * <ul>
 *   <li>Compulsory: the first reference misses and the block must be loaded
 *   <li>Capacity: the level is not large enough to contain the needed blocks
 *   <li>Conflict: multiple blocks are mapped to the same set
 *   <li>Inclusion: a level closer to memory evicted the block and invalidated this copy
 * </ul>
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class Simulator {
  static final Logger logger = System.getLogger(Simulator.class.getName());

  private final BasicSettings settings;

  public Simulator(Config config) {
    settings = new BasicSettings(config.getConfig("hierarchy-simulator"));
  }

  /** Replays the trace through a new hierarchy, prints the report, and returns the statistics. */
  public ImmutableList<LevelStats> run() {
    Map<String, LevelStats> stats = new HashMap<>();
    var hierarchy = CacheHierarchy.builder()
        .levels(settings.levels())
        .notifiers(config -> stats.computeIfAbsent(config.name(), name -> new LevelStats(config)))
        .build();

    var trace = settings.trace().format().readFiles(
        settings.trace().paths(), settings.trace().onError());
    var stopwatch = Stopwatch.createStarted();
    long replayed = replay(hierarchy, trace, settings.trace().skip(), settings.trace().limit());
    logger.log(Level.INFO, "Replayed {0} accesses through {1} levels in {2}",
        replayed, hierarchy.levels().size(), stopwatch);

    var results = hierarchy.levels().stream()
        .map(level -> stats.get(level.name()))
        .collect(toImmutableList());
    settings.report().format().create(settings.config()).print(results);
    return results;
  }

  /**
   * Issues each access in the trace to the hierarchy, in order.
   *
   * @return the number of accesses replayed
   */
  static long replay(CacheHierarchy hierarchy, TraceReader trace, long skip, long limit) {
    long replayed = 0;
    try (Stream<MemoryAccess> events = trace.events().skip(skip).limit(limit)) {
      for (Iterator<MemoryAccess> i = events.iterator(); i.hasNext();) {
        MemoryAccess access = i.next();
        hierarchy.access(access.operation(), access.address());
        replayed++;
      }
    }
    return replayed;
  }

  public static void main(String[] args) {
    java.util.logging.Logger.getLogger("").setLevel(java.util.logging.Level.WARNING);
    var simulator = new Simulator(ConfigFactory.load());
    var stopwatch = Stopwatch.createStarted();
    simulator.run();
    System.out.printf(US, "Executed in %s%n", stopwatch);
  }
}
