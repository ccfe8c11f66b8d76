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
package com.github.benmanes.hierarchy.simulator.parser.address;

import java.util.stream.Stream;

import com.github.benmanes.hierarchy.simulator.level.ProtocolException;
import com.github.benmanes.hierarchy.simulator.parser.ErrorPolicy;
import com.github.benmanes.hierarchy.simulator.parser.MemoryAccess;
import com.github.benmanes.hierarchy.simulator.parser.TextTraceReader;

/**
 * A reader for the trace files of application load and store instructions, provided by
 * <a href="http://cseweb.ucsd.edu/classes/fa07/cse240a/project1.html">UC SD</a>. Each record is
 * {@code l|s <address> <instructions since the last access>}.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class AddressTraceReader extends TextTraceReader {

  public AddressTraceReader(String filePath, ErrorPolicy errorPolicy) {
    super(filePath, errorPolicy);
  }

  @Override
  protected Stream<MemoryAccess> parse(String line) {
    String[] fields = line.split("\\s+", 3);
    if (fields.length < 2) {
      throw new IllegalArgumentException("Expected an instruction and address: " + line);
    }
    long address = parseAddress(fields[1]);
    switch (fields[0]) {
      case "l":
        return Stream.of(MemoryAccess.read(address));
      case "s":
        return Stream.of(MemoryAccess.write(address));
      default:
        throw new ProtocolException("Unknown instruction: " + fields[0]);
    }
  }
}
