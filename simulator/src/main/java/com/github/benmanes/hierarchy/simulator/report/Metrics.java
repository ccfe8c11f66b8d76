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

import static java.util.Objects.requireNonNull;

import java.util.function.DoubleFunction;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import java.util.function.LongFunction;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.github.benmanes.hierarchy.simulator.stats.LevelStats.Metric;
import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Formats the value of a level's {@link Metric} by its type. A count or rate of zero is shown as
 * blank unless the metric is required in every report.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public record Metrics(Function<Object, String> objectFormatter,
    LongFunction<String> countFormatter, DoubleFunction<String> percentFormatter) {

  public Metrics {
    requireNonNull(objectFormatter);
    requireNonNull(countFormatter);
    requireNonNull(percentFormatter);
  }

  /** Returns the stringified value for the metric; empty if absent. */
  public String format(@Nullable Metric metric) {
    if (metric == null) {
      return "";
    }
    switch (metric.type()) {
      case NUMBER: {
        long count = ((LongSupplier) metric.value()).getAsLong();
        return ((count == 0) && !metric.required()) ? "" : countFormatter().apply(count);
      }
      case PERCENT: {
        double rate = ((DoubleSupplier) metric.value()).getAsDouble();
        return ((rate == 0.0) && !metric.required()) ? "" : percentFormatter().apply(rate);
      }
      case OBJECT: {
        Object value = ((Supplier<?>) metric.value()).get();
        return (value == null) ? "" : MoreObjects.firstNonNull(objectFormatter().apply(value), "");
      }
      default:
        throw new IllegalArgumentException("Unknown metric type: " + metric.type());
    }
  }

  public static Metrics.Builder builder() {
    return new Metrics.Builder()
        .percentFormatter(rate -> Double.toString(100 * rate))
        .objectFormatter(Object::toString)
        .countFormatter(Long::toString);
  }

  public static final class Builder {
    private @Nullable Function<Object, String> objectFormatter;
    private @Nullable DoubleFunction<String> percentFormatter;
    private @Nullable LongFunction<String> countFormatter;

    @CanIgnoreReturnValue
    public Builder objectFormatter(Function<Object, String> objectFormatter) {
      this.objectFormatter = requireNonNull(objectFormatter);
      return this;
    }
    @CanIgnoreReturnValue
    public Builder percentFormatter(DoubleFunction<String> percentFormatter) {
      this.percentFormatter = requireNonNull(percentFormatter);
      return this;
    }
    @CanIgnoreReturnValue
    public Builder countFormatter(LongFunction<String> countFormatter) {
      this.countFormatter = requireNonNull(countFormatter);
      return this;
    }
    public Metrics build() {
      return new Metrics(requireNonNull(objectFormatter),
          requireNonNull(countFormatter), requireNonNull(percentFormatter));
    }
  }
}
