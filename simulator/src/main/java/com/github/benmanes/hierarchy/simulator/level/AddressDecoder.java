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
package com.github.benmanes.hierarchy.simulator.level;

import static com.github.benmanes.hierarchy.simulator.level.ConfigurationException.checkConfiguration;

import com.google.common.base.MoreObjects;
import com.google.common.math.LongMath;
import com.google.errorprone.annotations.Immutable;

/**
 * Splits a byte address into its tag, set index and block offset, and reassembles a block address
 * from a tag and set index. Addresses are treated as unsigned 64-bit values.
 * <pre>
 *   | tag | index | offset |
 * </pre>
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@Immutable
public final class AddressDecoder {
  static final long MAXIMUM_SETS = 1L << 30;

  /** log_2(block size) */
  private final int offsetBits;
  /** log_2(number of sets) */
  private final int indexBits;
  private final long offsetMask;
  private final long indexMask;

  private AddressDecoder(long blockSize, long numberOfSets) {
    checkConfiguration(blockSize > 0 && LongMath.isPowerOfTwo(blockSize),
        "block size must be a power of two: %d", blockSize);
    checkConfiguration(numberOfSets > 0 && LongMath.isPowerOfTwo(numberOfSets),
        "number of sets must be a power of two: %d", numberOfSets);
    checkConfiguration(numberOfSets <= MAXIMUM_SETS, "too many sets: %d", numberOfSets);
    this.offsetBits = Long.numberOfTrailingZeros(blockSize);
    this.indexBits = Long.numberOfTrailingZeros(numberOfSets);
    this.offsetMask = blockSize - 1;
    this.indexMask = numberOfSets - 1;
  }

  /** Returns a decoder for the given block size and number of sets. */
  public static AddressDecoder of(long blockSize, long numberOfSets) {
    return new AddressDecoder(blockSize, numberOfSets);
  }

  /**
   * Returns a decoder for a cache of the given geometry, where the number of sets is
   * {@code size / (blockSize * associativity)}.
   *
   * @throws ConfigurationException if the geometry does not divide evenly into a power of two
   *         number of sets
   */
  public static AddressDecoder forGeometry(long size, long blockSize, int associativity) {
    checkConfiguration(size > 0, "size must be positive: %d", size);
    checkConfiguration(blockSize > 0, "block size must be positive: %d", blockSize);
    checkConfiguration(associativity > 0, "associativity must be positive: %d", associativity);

    long setBytes = LongMath.checkedMultiply(blockSize, associativity);
    checkConfiguration((size % setBytes) == 0,
        "size %d is not a multiple of block size %d x associativity %d",
        size, blockSize, associativity);
    return new AddressDecoder(blockSize, size / setBytes);
  }

  public long blockSize() {
    return offsetMask + 1;
  }

  public int numberOfSets() {
    return Math.toIntExact(indexMask + 1);
  }

  /** Returns the set index of the address. */
  public int index(long address) {
    return (int) ((address >>> offsetBits) & indexMask);
  }

  /** Returns the tag of the address, the bits above the index and offset. */
  public long tag(long address) {
    return address >>> (indexBits + offsetBits);
  }

  /** Returns the byte offset of the address within its block. */
  public long offset(long address) {
    return address & offsetMask;
  }

  /** Returns the address with its block offset cleared. */
  public long blockAlign(long address) {
    return address & ~offsetMask;
  }

  /** Returns the block address that the tag and set index were decoded from. */
  public long recompose(long tag, int index) {
    return (tag << (indexBits + offsetBits)) | ((long) index << offsetBits);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("blockSize", blockSize())
        .add("numberOfSets", numberOfSets())
        .toString();
  }
}
