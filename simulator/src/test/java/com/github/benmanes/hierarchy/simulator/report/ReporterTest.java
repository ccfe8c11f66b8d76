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
package com.github.benmanes.hierarchy.simulator.report;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;

import org.testng.annotations.Test;

import com.github.benmanes.hierarchy.simulator.level.EvictionPolicy;
import com.github.benmanes.hierarchy.simulator.level.LevelConfig;
import com.github.benmanes.hierarchy.simulator.level.Operation;
import com.github.benmanes.hierarchy.simulator.stats.LevelStats;
import com.github.benmanes.hierarchy.simulator.stats.LevelStats.Metric;
import com.github.benmanes.hierarchy.simulator.stats.LevelStats.Metric.MetricType;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ReporterTest {

  @Test
  public void csv() throws IOException {
    Path output = Files.createTempDirectory("report").resolve("nested/levels.csv");
    ReportFormat.CSV.create(config("csv", output)).print(results());

    List<String> lines = Files.readAllLines(output, UTF_8);
    assertThat(lines).hasSize(3);
    assertThat(lines.get(0)).isEqualTo("Level,Geometry,Hit Rate,Miss Rate,Hits,Misses,"
        + "Requests,Read Hits,Read Misses,Write Misses,Write-backs Received,"
        + "Write-backs Issued,Evictions");
    assertThat(lines.get(1)).isEqualTo(
        "L1,64 B / 16 B x 1-way Lru,33.33,66.67,1,2,3,1,1,1,,1,1");
    assertThat(lines.get(2)).isEqualTo(
        "L2,128 B / 16 B x 2-way Lru,0.00,100.00,0,2,2,,2,,1,0,0");
  }

  @Test
  public void table() throws IOException {
    Path output = Files.createTempFile("report", ".txt");
    ReportFormat.TABLE.create(config("table", output)).print(results());

    String report = Files.readString(output, UTF_8);
    assertThat(report).contains("Hit Rate");
    assertThat(report).contains("33.33 %");
    assertThat(report).contains("100.00 %");
    assertThat(report).contains("128 B / 16 B x 2-way Lru");
    assertThat(report).doesNotContain("Write Hits");
  }

  @Test
  public void metrics_format() {
    var metrics = Metrics.builder().build();
    var stats = new LevelStats(level("L1", 64, 1));

    assertThat(metrics.format(null)).isEmpty();
    assertThat(metrics.format(stats.metrics().get("Level"))).isEqualTo("L1");
    assertThat(metrics.format(stats.metrics().get("Read Hits"))).isEmpty();

    stats.reportHit(Operation.READ, 0);
    assertThat(metrics.format(stats.metrics().get("Read Hits"))).isEqualTo("1");
    assertThat(metrics.format(stats.metrics().get("Hit Rate"))).isEqualTo("100.0");
  }

  @Test
  public void metrics_formatZero() {
    var metrics = Metrics.builder().build();
    var stats = new LevelStats(level("L1", 64, 1));
    stats.reportMiss(Operation.READ, 0);

    // required metrics print a zero; optional ones are left blank
    assertThat(metrics.format(stats.metrics().get("Hit Rate"))).isEqualTo("0.0");
    assertThat(metrics.format(stats.metrics().get("Evictions"))).isEqualTo("0");
    assertThat(metrics.format(stats.metrics().get("Write Misses"))).isEmpty();

    stats.addMetric(new Metric.Builder().name("Spill Rate")
        .value((DoubleSupplier) () -> 0.0).type(MetricType.PERCENT));
    assertThat(metrics.format(stats.metrics().get("Spill Rate"))).isEmpty();
  }

  @Test
  public void metric_valueMustMatchType() {
    var builder = new Metric.Builder().name("Hit Rate")
        .value((LongSupplier) () -> 1L).type(MetricType.PERCENT);
    assertThrows(IllegalArgumentException.class, builder::build);
  }

  /** Returns the statistics of a Write(0x00), Read(0x40), Read(0x40) replay. */
  private static List<LevelStats> results() {
    var l1 = new LevelStats(level("L1", 64, 1));
    l1.reportMiss(Operation.WRITE, 0x00);
    l1.reportMiss(Operation.READ, 0x40);
    l1.reportWriteback(0x00);
    l1.reportEviction(0x00);
    l1.reportHit(Operation.READ, 0x40);

    var l2 = new LevelStats(level("L2", 128, 2));
    l2.reportMiss(Operation.READ, 0x00);
    l2.reportHit(Operation.WRITEBACK, 0x00);
    l2.reportMiss(Operation.READ, 0x40);
    return List.of(l1, l2);
  }

  private static LevelConfig level(String name, long size, int associativity) {
    return LevelConfig.builder().name(name).size(size).blockSize(16)
        .associativity(associativity).evictionPolicy(EvictionPolicy.LRU).build();
  }

  private static Config config(String format, Path output) {
    return ConfigFactory.parseMap(ImmutableMap.of(
        "report.format", format,
        "report.output", output.toString()));
  }
}
