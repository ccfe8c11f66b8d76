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

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.github.benmanes.hierarchy.simulator.BasicSettings;
import com.github.benmanes.hierarchy.simulator.stats.LevelStats;
import com.github.benmanes.hierarchy.simulator.stats.LevelStats.Metric;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;

/**
 * A skeletal plain text implementation applicable for printing to the console or a file.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public abstract class TextReporter implements Reporter {
  private final BasicSettings settings;

  protected TextReporter(Config config) {
    this.settings = new BasicSettings(config);
  }

  @Override
  public void print(List<LevelStats> results) {
    var headers = getHeaders(results);
    String report = assemble(headers, results);

    String output = settings.report().output();
    if (output.equalsIgnoreCase("console")) {
      System.out.println(report);
      return;
    }
    try {
      var path = Path.of(output);
      var parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, report, UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Returns the column headers in declaration order, omitting optional columns with no data. */
  private ImmutableSet<String> getHeaders(Collection<LevelStats> results) {
    var columns = results.stream()
        .flatMap(levelStats -> levelStats.metrics().values().stream())
        .filter(metric -> metric.required() || !metrics().format(metric).isEmpty())
        .map(Metric::name)
        .collect(toImmutableSet());
    return results.stream()
        .flatMap(levelStats -> levelStats.metrics().keySet().stream())
        .filter(columns::contains)
        .collect(toImmutableSet());
  }

  /** Returns the configuration for how to work with metrics. */
  protected abstract Metrics metrics();

  /** Assembles an aggregated report. */
  protected abstract String assemble(Set<String> headers, List<LevelStats> results);
}
