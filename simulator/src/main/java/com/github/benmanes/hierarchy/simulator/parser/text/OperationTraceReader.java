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
package com.github.benmanes.hierarchy.simulator.parser.text;

import java.util.List;
import java.util.stream.Stream;

import com.github.benmanes.hierarchy.simulator.level.Operation;
import com.github.benmanes.hierarchy.simulator.level.ProtocolException;
import com.github.benmanes.hierarchy.simulator.parser.ErrorPolicy;
import com.github.benmanes.hierarchy.simulator.parser.MemoryAccess;
import com.github.benmanes.hierarchy.simulator.parser.TextTraceReader;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * A reader for plain text traces where each record is an operation code and a hexadecimal
 * address, such as {@code R 0x1f40} or {@code W 2a0}. Any further fields on the line are ignored.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class OperationTraceReader extends TextTraceReader {
  private static final Splitter SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().limit(3);

  public OperationTraceReader(String filePath, ErrorPolicy errorPolicy) {
    super(filePath, errorPolicy);
  }

  @Override
  protected Stream<MemoryAccess> parse(String line) {
    List<String> fields = SPLITTER.splitToList(line);
    if (fields.size() < 2) {
      throw new IllegalArgumentException("Expected an operation and address: " + line);
    }
    Operation operation = Operation.fromCode(fields.get(0));
    if (operation == Operation.WRITEBACK) {
      throw new ProtocolException("Write-backs are issued by the hierarchy: " + line);
    }
    return Stream.of(new MemoryAccess(operation, parseAddress(fields.get(1))));
  }
}
