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
package com.github.benmanes.hierarchy.simulator.parser;

import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Stream;

import com.github.benmanes.hierarchy.simulator.parser.address.AddressTraceReader;
import com.github.benmanes.hierarchy.simulator.parser.lackey.LackeyTraceReader;
import com.github.benmanes.hierarchy.simulator.parser.text.OperationTraceReader;
import com.google.common.base.Splitter;

/**
 * The trace file formats.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@SuppressWarnings("ImmutableEnumChecker")
public enum TraceFormat {
  TEXT(OperationTraceReader::new),
  ADDRESS(AddressTraceReader::new),
  LACKEY(LackeyTraceReader::new);

  private final BiFunction<String, ErrorPolicy, TraceReader> factory;

  TraceFormat(BiFunction<String, ErrorPolicy, TraceReader> factory) {
    this.factory = requireNonNull(factory);
  }

  /**
   * Returns a new reader for streaming the events from the trace files, in order. A path may be
   * prefixed by a format name, such as {@code lackey:/traces/ls.txt}, to override this format for
   * that file.
   *
   * @param filePaths the path to the files in the trace's format
   * @param errorPolicy the handling of malformed records
   * @return a reader for streaming the events from the files
   */
  public TraceReader readFiles(List<String> filePaths, ErrorPolicy errorPolicy) {
    requireNonNull(errorPolicy);
    return new TraceReader() {
      @Override public Stream<MemoryAccess> events() {
        return readers().stream().flatMap(TraceReader::events);
      }

      private List<TraceReader> readers() {
        return filePaths.stream().map(path -> {
          List<String> parts = Splitter.on(':').limit(2).splitToList(path);
          if ((parts.size() == 2) && isFormat(parts.get(0))) {
            return named(parts.get(0)).factory.apply(parts.get(1), errorPolicy);
          }
          return factory.apply(path, errorPolicy);
        }).collect(toList());
      }
    };
  }

  /** Returns the format based on its configuration name. */
  public static TraceFormat named(String name) {
    return TraceFormat.valueOf(name.trim().replace('-', '_').toUpperCase(US));
  }

  private static boolean isFormat(String name) {
    for (TraceFormat format : values()) {
      if (format.name().equalsIgnoreCase(name.trim().replace('-', '_'))) {
        return true;
      }
    }
    return false;
  }
}
