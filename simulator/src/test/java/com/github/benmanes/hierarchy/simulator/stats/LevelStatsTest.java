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
package com.github.benmanes.hierarchy.simulator.stats;

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import java.util.function.LongSupplier;

import org.testng.annotations.Test;

import com.github.benmanes.hierarchy.simulator.level.CacheHierarchy;
import com.github.benmanes.hierarchy.simulator.level.EvictionPolicy;
import com.github.benmanes.hierarchy.simulator.level.LevelConfig;
import com.github.benmanes.hierarchy.simulator.level.Operation;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class LevelStatsTest {
  static final LevelConfig L1 = LevelConfig.builder().name("L1")
      .size(64).blockSize(16).associativity(1).evictionPolicy(EvictionPolicy.FIFO).build();
  static final LevelConfig L2 = LevelConfig.builder().name("L2")
      .size(128).blockSize(16).associativity(2).build();

  @Test
  public void idle() {
    var stats = new LevelStats(L1);
    assertThat(stats.requestCount()).isEqualTo(0);
    assertThat(stats.hitRate()).isEqualTo(1.0);
    assertThat(stats.missRate()).isEqualTo(0.0);
    assertThat(stats.name()).isEqualTo("L1");
    assertThat(stats.geometry()).isEqualTo("64 B / 16 B x 1-way Fifo");
  }

  @Test
  public void counts() {
    var stats = new LevelStats(L1);
    stats.reportHit(Operation.READ, 0);
    stats.reportHit(Operation.READ, 0);
    stats.reportHit(Operation.WRITE, 0);
    stats.reportMiss(Operation.READ, 0);
    stats.reportMiss(Operation.WRITE, 0);
    stats.reportHit(Operation.WRITEBACK, 0);
    stats.reportWriteback(0);
    stats.reportEviction(0);
    stats.reportEviction(0);

    assertThat(stats.readHitCount()).isEqualTo(2);
    assertThat(stats.writeHitCount()).isEqualTo(1);
    assertThat(stats.readMissCount()).isEqualTo(1);
    assertThat(stats.writeMissCount()).isEqualTo(1);
    assertThat(stats.hitCount()).isEqualTo(3);
    assertThat(stats.missCount()).isEqualTo(2);
    assertThat(stats.requestCount()).isEqualTo(5);
    assertThat(stats.hitRate()).isWithin(1e-9).of(0.6);
    assertThat(stats.missRate()).isWithin(1e-9).of(0.4);
    assertThat(stats.writebacksReceived()).isEqualTo(1);
    assertThat(stats.writebacksIssued()).isEqualTo(1);
    assertThat(stats.evictionCount()).isEqualTo(2);
  }

  @Test
  public void writebackMiss_unexpected() {
    var stats = new LevelStats(L1);
    assertThrows(IllegalArgumentException.class, () -> stats.reportMiss(Operation.WRITEBACK, 0));
  }

  @Test
  public void metrics() {
    var stats = new LevelStats(L1);
    stats.reportMiss(Operation.READ, 0);

    assertThat(stats.metrics().keySet()).containsAtLeast(
        "Level", "Geometry", "Hit Rate", "Miss Rate", "Hits", "Misses", "Requests",
        "Write-backs Issued", "Evictions").inOrder();
    var misses = (LongSupplier) stats.metrics().get("Misses").value();
    assertThat(misses.getAsLong()).isEqualTo(1);
    assertThat(stats.metrics().get("Read Hits").required()).isFalse();
  }

  @Test
  public void twoLevelScenario() {
    var l1 = new LevelStats(L1);
    var l2 = new LevelStats(L2);
    var hierarchy = CacheHierarchy.builder()
        .level(L1).level(L2)
        .notifiers(config -> config.name().equals("L1") ? l1 : l2)
        .build();

    hierarchy.access(Operation.WRITE, 0x00);
    hierarchy.access(Operation.READ, 0x40);
    hierarchy.access(Operation.READ, 0x40);

    assertThat(l1.writeMissCount()).isEqualTo(1);
    assertThat(l1.readMissCount()).isEqualTo(1);
    assertThat(l1.readHitCount()).isEqualTo(1);
    assertThat(l1.writebacksIssued()).isEqualTo(1);
    assertThat(l1.evictionCount()).isEqualTo(1);

    assertThat(l2.readMissCount()).isEqualTo(2);
    assertThat(l2.hitCount()).isEqualTo(0);
    assertThat(l2.writebacksReceived()).isEqualTo(1);
    assertThat(l2.writebacksIssued()).isEqualTo(0);
  }

  @Test
  public void toString_containsCounters() {
    var stats = new LevelStats(L1);
    stats.reportEviction(0);
    assertThat(stats.toString()).contains("evictionCount=1");
  }
}
