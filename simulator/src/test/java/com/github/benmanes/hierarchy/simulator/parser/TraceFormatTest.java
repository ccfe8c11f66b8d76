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

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

/**
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class TraceFormatTest {

  @Test
  public void named() {
    assertThat(TraceFormat.named("text")).isEqualTo(TraceFormat.TEXT);
    assertThat(TraceFormat.named(" Lackey ")).isEqualTo(TraceFormat.LACKEY);
    assertThrows(IllegalArgumentException.class, () -> TraceFormat.named("binary"));
    assertThat(ErrorPolicy.named("skip")).isEqualTo(ErrorPolicy.SKIP);
  }

  @Test
  public void readFiles_concatenated() {
    var trace = TraceFormat.TEXT.readFiles(ImmutableList.of(
        "/traces/operations.trace", "address:/traces/address.trace"), ErrorPolicy.ABORT);
    try (var events = trace.events()) {
      assertThat(events.toList()).containsExactly(
          MemoryAccess.write(0x00), MemoryAccess.read(0x40),
          MemoryAccess.read(0x40), MemoryAccess.write(0x80),
          MemoryAccess.read(0x1fffff50L), MemoryAccess.write(0x1fffff58L),
          MemoryAccess.read(0x7ffff000L)).inOrder();
    }
  }

  @Test
  public void readFiles_formatPrefix() {
    var trace = TraceFormat.TEXT.readFiles(
        ImmutableList.of("lackey:/traces/valgrind.lackey"), ErrorPolicy.ABORT);
    try (var events = trace.events()) {
      assertThat(events.count()).isEqualTo(4);
    }
  }

  @Test
  public void readFiles_lazy() {
    var trace = TraceFormat.TEXT.readFiles(
        ImmutableList.of("/traces/operations.trace"), ErrorPolicy.ABORT);
    try (var events = trace.events()) {
      assertThat(events.limit(1).toList()).containsExactly(MemoryAccess.write(0x00));
    }
  }

  @Test
  public void memoryAccess_toString() {
    assertThat(MemoryAccess.write(0x1f40).toString()).isEqualTo("W 0x1f40");
  }
}
