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

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import org.testng.annotations.Test;

import com.github.benmanes.hierarchy.simulator.level.ConfigurationException;
import com.github.benmanes.hierarchy.simulator.level.EvictionPolicy;
import com.github.benmanes.hierarchy.simulator.level.WritePolicy;
import com.github.benmanes.hierarchy.simulator.parser.ErrorPolicy;
import com.github.benmanes.hierarchy.simulator.parser.TraceFormat;
import com.github.benmanes.hierarchy.simulator.report.ReportFormat;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class BasicSettingsTest {

  @Test
  public void reference() {
    var settings = settings("");
    var levels = settings.levels();
    assertThat(levels).hasSize(3);
    assertThat(levels.get(0).name()).isEqualTo("L1");
    assertThat(levels.get(0).size()).isEqualTo(32 * 1024);
    assertThat(levels.get(0).blockSize()).isEqualTo(64);
    assertThat(levels.get(0).evictionPolicy()).isEqualTo(EvictionPolicy.LRU);
    assertThat(levels.get(0).writePolicy()).isEqualTo(WritePolicy.WRITE_BACK);
    assertThat(levels.get(2).size()).isEqualTo(8 * 1024 * 1024);

    assertThat(settings.trace().format()).isEqualTo(TraceFormat.TEXT);
    assertThat(settings.trace().onError()).isEqualTo(ErrorPolicy.ABORT);
    assertThat(settings.trace().skip()).isEqualTo(0);
    assertThat(settings.trace().limit()).isEqualTo(Long.MAX_VALUE);
    assertThat(settings.report().format()).isEqualTo(ReportFormat.TABLE);
    assertThat(settings.report().output()).isEqualTo("console");
  }

  @Test
  public void levels_overridden() {
    var settings = settings("levels = [ { name = C, size = 1 KiB, block-size = 32 B,"
        + " associativity = 4, eviction-policy = MRU } ]");
    var level = settings.levels().get(0);
    assertThat(level.name()).isEqualTo("C");
    assertThat(level.numberOfSets()).isEqualTo(8);
    assertThat(level.evictionPolicy()).isEqualTo(EvictionPolicy.MRU);
    assertThat(level.writePolicy()).isEqualTo(WritePolicy.WRITE_BACK);
  }

  @Test
  public void levels_empty() {
    assertThrows(ConfigException.BadValue.class, () -> settings("levels = []").levels());
  }

  @Test
  public void levels_invalidGeometry() {
    var settings = settings("levels = [ { name = C, size = 96, block-size = 32,"
        + " associativity = 1, eviction-policy = lru } ]");
    assertThrows(ConfigurationException.class, settings::levels);
  }

  @Test
  public void levels_unknownPolicy() {
    var settings = settings("levels = [ { name = C, size = 64, block-size = 16,"
        + " associativity = 1, eviction-policy = random } ]");
    assertThrows(ConfigurationException.class, settings::levels);
  }

  @Test
  public void levels_unsupportedWritePolicy() {
    var settings = settings("levels = [ { name = C, size = 64, block-size = 16,"
        + " associativity = 1, eviction-policy = lru, write-policy = write-through } ]");
    assertThrows(ConfigurationException.class, settings::levels);
  }

  private static BasicSettings settings(String overrides) {
    var config = ConfigFactory.parseString(overrides)
        .withFallback(ConfigFactory.load().getConfig("hierarchy-simulator"));
    return new BasicSettings(config);
  }
}
