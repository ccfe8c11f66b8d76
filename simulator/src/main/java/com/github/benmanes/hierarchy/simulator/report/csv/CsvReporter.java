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
package com.github.benmanes.hierarchy.simulator.report.csv;

import static java.util.Locale.US;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;

import com.github.benmanes.hierarchy.simulator.report.Metrics;
import com.github.benmanes.hierarchy.simulator.report.TextReporter;
import com.github.benmanes.hierarchy.simulator.stats.LevelStats;
import com.typesafe.config.Config;

import de.siegmar.fastcsv.writer.CsvWriter;

/**
 * A plain text report that prints comma-separated values, one record per level.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class CsvReporter extends TextReporter {
  private final Metrics metrics;

  public CsvReporter(Config config) {
    super(config);
    this.metrics = Metrics.builder()
        .percentFormatter(value -> String.format(US, "%.2f", 100 * value))
        .countFormatter(Long::toString)
        .build();
  }

  @Override
  protected String assemble(Set<String> headers, List<LevelStats> results) {
    try (var output = new StringWriter();
         var writer = CsvWriter.builder().build(output)) {
      writer.writeRecord(headers);
      for (LevelStats levelStats : results) {
        writer.writeRecord(headers.stream()
            .map(levelStats.metrics()::get)
            .map(metrics::format)
            .toList());
      }
      writer.flush();
      return output.toString();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  protected Metrics metrics() {
    return metrics;
  }
}
