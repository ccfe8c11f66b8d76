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

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import org.testng.annotations.Test;

import com.github.benmanes.hierarchy.simulator.level.ProtocolException;
import com.github.benmanes.hierarchy.simulator.parser.ErrorPolicy;
import com.github.benmanes.hierarchy.simulator.parser.MemoryAccess;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class LackeyTraceReaderTest {

  @Test
  public void events() {
    var reader = new LackeyTraceReader("/traces/valgrind.lackey", ErrorPolicy.ABORT);
    try (var events = reader.events()) {
      assertThat(events.toList()).containsExactly(
          MemoryAccess.write(0x7ff000398L),
          MemoryAccess.read(0x0421e3b0L),
          MemoryAccess.read(0x0421e3c0L),
          MemoryAccess.write(0x0421e3c0L)).inOrder();
    }
  }

  @Test
  public void parse_unknownType() {
    var reader = new LackeyTraceReader("/traces/valgrind.lackey", ErrorPolicy.ABORT);
    assertThrows(ProtocolException.class, () -> reader.parse("X 0421e3c0,4"));
    assertThat(reader.parse("==1== summary").count()).isEqualTo(0);
  }
}
