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
package com.github.benmanes.hierarchy.simulator.parser.lackey;

import java.util.stream.Stream;

import com.github.benmanes.hierarchy.simulator.level.ProtocolException;
import com.github.benmanes.hierarchy.simulator.parser.ErrorPolicy;
import com.github.benmanes.hierarchy.simulator.parser.MemoryAccess;
import com.github.benmanes.hierarchy.simulator.parser.TextTraceReader;

/**
 * A reader for the data accesses recorded by Valgrind's
 * <a href="https://valgrind.org/docs/manual/lk-manual.html">Lackey</a> tool with
 * {@code --trace-mem=yes}. Each record is {@code I|L|S|M <address>,<size>}, where a modify is a
 * load followed by a store to the same address. Instruction fetches are not data accesses and are
 * ignored.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class LackeyTraceReader extends TextTraceReader {

  public LackeyTraceReader(String filePath, ErrorPolicy errorPolicy) {
    super(filePath, errorPolicy);
  }

  @Override
  protected Stream<MemoryAccess> parse(String line) {
    if (line.startsWith("==")) {
      // valgrind's own output
      return Stream.empty();
    }
    String[] fields = line.split("\\s+", 2);
    if (fields.length < 2) {
      throw new IllegalArgumentException("Expected an access type and address: " + line);
    }
    int comma = fields[1].indexOf(',');
    long address = parseAddress((comma < 0) ? fields[1] : fields[1].substring(0, comma));
    switch (fields[0]) {
      case "I":
        return Stream.empty();
      case "L":
        return Stream.of(MemoryAccess.read(address));
      case "S":
        return Stream.of(MemoryAccess.write(address));
      case "M":
        return Stream.of(MemoryAccess.read(address), MemoryAccess.write(address));
      default:
        throw new ProtocolException("Unknown access type: " + fields[0]);
    }
  }
}
