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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.stream.Stream;

import com.google.common.io.Closeables;

/**
 * A skeletal implementation that reads the trace file line by line as textual data. Blank lines
 * and lines starting with {@code #} are ignored.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public abstract class TextTraceReader extends AbstractTraceReader {
  static final Logger logger = System.getLogger(TextTraceReader.class.getName());

  protected TextTraceReader(String filePath, ErrorPolicy errorPolicy) {
    super(filePath, errorPolicy);
  }

  @Override
  public Stream<MemoryAccess> events() {
    return lines().flatMap(this::parseRecord);
  }

  /**
   * Returns the accesses described by a single trace record.
   *
   * @throws IllegalArgumentException if the record is malformed
   */
  protected abstract Stream<MemoryAccess> parse(String line);

  /** Returns a stream of each meaningful line in the trace file. */
  @SuppressWarnings("PMD.CloseResource")
  protected Stream<String> lines() {
    InputStream input = readFile();
    Reader reader = new InputStreamReader(input, UTF_8);
    return new BufferedReader(reader).lines().map(String::trim)
        .filter(line -> !line.isEmpty() && !line.startsWith("#"))
        .onClose(() -> Closeables.closeQuietly(input));
  }

  private Stream<MemoryAccess> parseRecord(String line) {
    try {
      return parse(line);
    } catch (IllegalArgumentException e) {
      if (errorPolicy == ErrorPolicy.ABORT) {
        throw e;
      }
      logger.log(Level.WARNING, "Skipped malformed record in {0}: {1} ({2})",
          filePath, line, e.getMessage());
      return Stream.empty();
    }
  }

  /**
   * Returns the unsigned hexadecimal address, with or without a {@code 0x} prefix.
   *
   * @throws IllegalArgumentException if the value is not a hexadecimal number
   */
  protected static long parseAddress(String value) {
    String digits = value.trim();
    if (digits.startsWith("0x") || digits.startsWith("0X")) {
      digits = digits.substring(2);
    }
    if (digits.isEmpty()) {
      throw new IllegalArgumentException("Missing address: " + value);
    }
    return Long.parseUnsignedLong(digits, 16);
  }
}
