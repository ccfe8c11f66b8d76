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

import static com.github.benmanes.hierarchy.simulator.stats.LevelStats.Metric.MetricType.NUMBER;
import static com.github.benmanes.hierarchy.simulator.stats.LevelStats.Metric.MetricType.OBJECT;
import static com.github.benmanes.hierarchy.simulator.stats.LevelStats.Metric.MetricType.PERCENT;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.builder.ToStringStyle.MULTI_LINE_STYLE;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.jspecify.annotations.Nullable;

import com.github.benmanes.hierarchy.simulator.level.HierarchyNotifier;
import com.github.benmanes.hierarchy.simulator.level.LevelConfig;
import com.github.benmanes.hierarchy.simulator.level.Operation;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Statistics gathered from the events of one cache level. The counters are registered as named
 * metrics, in declaration order, so that a report can print them as columns.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class LevelStats implements HierarchyNotifier {
  private final Map<String, Metric> metrics;
  private final String name;
  private final String geometry;

  private long readHitCount;
  private long readMissCount;
  private long writeHitCount;
  private long writeMissCount;
  private long writebacksReceived;
  private long writebacksIssued;
  private long evictionCount;

  @SuppressWarnings("this-escape")
  public LevelStats(LevelConfig config) {
    this.name = config.name();
    this.metrics = new LinkedHashMap<>();
    this.geometry = String.format(US, "%,d B / %d B x %d-way %s", config.size(),
        config.blockSize(), config.associativity(), config.evictionPolicy().label());

    addMetric(new Metric.Builder()
        .name("Level").value((Supplier<?>) this::name).type(OBJECT).required(true));
    addMetric(new Metric.Builder()
        .name("Geometry").value((Supplier<?>) this::geometry).type(OBJECT).required(true));
    addMetric(new Metric.Builder()
        .name("Hit Rate").value((DoubleSupplier) this::hitRate).type(PERCENT).required(true));
    addMetric(new Metric.Builder()
        .name("Miss Rate").value((DoubleSupplier) this::missRate).type(PERCENT).required(true));
    addMetric(new Metric.Builder()
        .name("Hits").value((LongSupplier) this::hitCount).type(NUMBER).required(true));
    addMetric(new Metric.Builder()
        .name("Misses").value((LongSupplier) this::missCount).type(NUMBER).required(true));
    addMetric(new Metric.Builder()
        .name("Requests").value((LongSupplier) this::requestCount).type(NUMBER).required(true));
    addMetric("Read Hits", this::readHitCount);
    addMetric("Read Misses", this::readMissCount);
    addMetric("Write Hits", this::writeHitCount);
    addMetric("Write Misses", this::writeMissCount);
    addMetric("Write-backs Received", this::writebacksReceived);
    addMetric(new Metric.Builder().name("Write-backs Issued")
        .value((LongSupplier) this::writebacksIssued).type(NUMBER).required(true));
    addMetric(new Metric.Builder().name("Evictions")
        .value((LongSupplier) this::evictionCount).type(NUMBER).required(true));
  }

  public void addMetric(Metric.Builder metricBuilder) {
    var metric = metricBuilder.build();
    metrics.put(metric.name(), requireNonNull(metric));
  }

  public void addMetric(String name, LongSupplier supplier) {
    addMetric(new Metric.Builder().name(name).value(supplier).type(NUMBER));
  }

  public Map<String, Metric> metrics() {
    return metrics;
  }

  public String name() {
    return name;
  }

  public String geometry() {
    return geometry;
  }

  @Override
  public void reportHit(Operation operation, long address) {
    switch (operation) {
      case READ:
        readHitCount++;
        break;
      case WRITE:
        writeHitCount++;
        break;
      case WRITEBACK:
        writebacksReceived++;
        break;
      default:
        throw new IllegalArgumentException("Unknown operation: " + operation);
    }
  }

  @Override
  public void reportMiss(Operation operation, long address) {
    switch (operation) {
      case READ:
        readMissCount++;
        break;
      case WRITE:
        writeMissCount++;
        break;
      default:
        throw new IllegalArgumentException("Unexpected miss for " + operation);
    }
  }

  @Override
  public void reportWriteback(long blockAddress) {
    writebacksIssued++;
  }

  @Override
  public void reportEviction(long blockAddress) {
    evictionCount++;
  }

  public long readHitCount() {
    return readHitCount;
  }

  public long readMissCount() {
    return readMissCount;
  }

  public long writeHitCount() {
    return writeHitCount;
  }

  public long writeMissCount() {
    return writeMissCount;
  }

  /** Returns the number of dirty blocks pushed into this level from the requester side. */
  public long writebacksReceived() {
    return writebacksReceived;
  }

  /** Returns the number of dirty blocks this level wrote back toward the backing side. */
  public long writebacksIssued() {
    return writebacksIssued;
  }

  public long evictionCount() {
    return evictionCount;
  }

  /** Returns the number of read and write hits; write-back notifications are not requests. */
  public long hitCount() {
    return readHitCount + writeHitCount;
  }

  public long missCount() {
    return readMissCount + writeMissCount;
  }

  public long requestCount() {
    return hitCount() + missCount();
  }

  public double hitRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 1.0 : (double) hitCount() / requestCount;
  }

  public double missRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 0.0 : (double) missCount() / requestCount;
  }

  @Override
  public String toString() {
    return ToStringBuilder.reflectionToString(this, MULTI_LINE_STYLE);
  }

  public record Metric(String name, Object value, MetricType type, boolean required) {
    public enum MetricType {
      /** A count supplied by a {@link LongSupplier}. */
      NUMBER(LongSupplier.class),
      /** A rate in [0, 1] supplied by a {@link DoubleSupplier}. */
      PERCENT(DoubleSupplier.class),
      /** A descriptive value supplied by a {@link Supplier}. */
      OBJECT(Supplier.class);

      private final Class<?> supplierType;

      MetricType(Class<?> supplierType) {
        this.supplierType = supplierType;
      }

      boolean accepts(Object value) {
        return supplierType.isInstance(value);
      }
    }

    public Metric {
      requireNonNull(type);
      requireNonNull(name);
      requireNonNull(value);
      checkArgument(type.accepts(value), "%s metric %s is not supplied by a %s",
          type, name, type.supplierType.getSimpleName());
    }

    public static final class Builder {
      private @Nullable MetricType type;
      private @Nullable Object value;
      private @Nullable String name;
      private boolean required;

      @CanIgnoreReturnValue
      public Builder name(String name) {
        this.name = requireNonNull(name);
        return this;
      }
      @CanIgnoreReturnValue
      public Builder value(Supplier<?> value) {
        this.value = requireNonNull(value);
        return this;
      }
      @CanIgnoreReturnValue
      public Builder value(LongSupplier value) {
        this.value = requireNonNull(value);
        return this;
      }
      @CanIgnoreReturnValue
      public Builder value(DoubleSupplier value) {
        this.value = requireNonNull(value);
        return this;
      }
      @CanIgnoreReturnValue
      public Builder type(MetricType type) {
        this.type = requireNonNull(type);
        return this;
      }
      @CanIgnoreReturnValue
      public Builder required(boolean required) {
        this.required = required;
        return this;
      }
      public Metric build() {
        requireNonNull(type);
        requireNonNull(name);
        requireNonNull(value);
        return new Metric(name, value, type, required);
      }
    }
  }
}
