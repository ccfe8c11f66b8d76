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

import static java.util.Objects.requireNonNull;

import java.util.OptionalLong;

import org.jspecify.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A set-associative, write-back and write-allocate cache level of an inclusive hierarchy.
 * <p>
 * A level has up to two neighbors: the <em>requester side</em>, the level closer to the
 * originating request, and the <em>backing side</em>, the level closer to main memory. The
 * neighbors are resolved through the hierarchy's {@link Topology} and are never owned by the
 * level. The protocol between adjacent levels is,
 * <ul>
 *   <li>a miss allocates the block after fetching it from the backing side with a read
 *   <li>a dirty block that is dropped is first written back to the backing side
 *   <li>a block that is evicted is first invalidated on the requester side, so that a block
 *       resident on the requester side is always resident here
 * </ul>
 * <p>
 * Writes are recorded as dirty at the requester edge, the level that services the originating
 * request. A level further from the requester becomes dirty only when a write-back notification
 * arrives, or when it allocates a block that its backing side holds dirty.
 * <p>
 * This class is not thread-safe; a request is fully resolved, including all cascaded misses,
 * evictions, and write-backs, before the next may be issued.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class CacheLevel {
  private final HierarchyNotifier notifier;
  private final AddressDecoder decoder;
  private final Topology topology;
  private final LevelConfig config;
  private final CacheSet[] sets;
  private final int position;

  @SuppressWarnings("this-escape")
  CacheLevel(LevelConfig config, HierarchyNotifier notifier, Topology topology) {
    this.decoder = AddressDecoder.forGeometry(
        config.size(), config.blockSize(), config.associativity());
    this.notifier = HierarchyNotifier.guarded(notifier);
    this.topology = requireNonNull(topology);
    this.config = requireNonNull(config);
    this.sets = new CacheSet[decoder.numberOfSets()];
    for (int i = 0; i < sets.length; i++) {
      sets[i] = new CacheSet(config.associativity(), config.evictionPolicy());
    }
    this.position = topology.register(this);
  }

  public String name() {
    return config.name();
  }

  public EvictionPolicy evictionPolicy() {
    return config.evictionPolicy();
  }

  public int associativity() {
    return config.associativity();
  }

  public int numberOfSets() {
    return sets.length;
  }

  /** Returns the level closer to the originating request, or null if this is the requester edge. */
  public @Nullable CacheLevel requesterSide() {
    return topology.requesterSide(position);
  }

  /** Returns the level closer to main memory, or null if this is the backing edge. */
  public @Nullable CacheLevel backingSide() {
    return topology.backingSide(position);
  }

  /** Returns if a write is recorded as dirty by this level. */
  private boolean isRequesterEdge() {
    return requesterSide() == null;
  }

  /**
   * Services the request for the textual operation code.
   *
   * @throws ProtocolException if the operation code is not recognized, before any state changes
   */
  public void access(String code, long address) {
    access(Operation.fromCode(code), address);
  }

  /**
   * Services the request, cascading a miss to the backing side and an eviction to the requester
   * side.
   *
   * @param operation the type of request
   * @param address the byte address; any value is accepted
   * @throws ProtocolException if the operation is absent, before any state changes
   */
  public void access(@Nullable Operation operation, long address) {
    if (operation == null) {
      throw new ProtocolException("Missing operation for address " + Long.toHexString(address));
    }

    long blockAddress = decoder.blockAlign(address);
    int index = decoder.index(blockAddress);
    long tag = decoder.tag(blockAddress);
    CacheSet set = sets[index];

    switch (operation) {
      case WRITEBACK:
        onWriteback(set, index, tag, address);
        return;
      case READ:
      case WRITE:
        if (set.contains(tag)) {
          onHit(set, tag, operation, address);
        } else {
          onMiss(set, index, tag, operation, address);
        }
        return;
      default:
        throw new ProtocolException("Unsupported operation: " + operation);
    }
  }

  /** Records the dirty block pushed from the requester side, without fetching it. */
  private void onWriteback(CacheSet set, int index, long tag, long address) {
    if (set.contains(tag)) {
      set.setDirty(tag, true);
    } else {
      if (set.isFull()) {
        evict(index);
      }
      set.insert(tag, /* dirty= */ true);
    }
    notifier.reportHit(Operation.WRITEBACK, address);
  }

  private void onHit(CacheSet set, long tag, Operation operation, long address) {
    notifier.reportHit(operation, address);
    if ((operation == Operation.WRITE) && isRequesterEdge()) {
      set.setDirty(tag, true);
    }
    set.touch(tag);
  }

  private void onMiss(CacheSet set, int index, long tag, Operation operation, long address) {
    notifier.reportMiss(operation, address);
    if (set.isFull()) {
      evict(index);
    }

    // write-allocate: a write miss still reads the block's current data
    long blockAddress = decoder.recompose(tag, index);
    CacheLevel backing = backingSide();
    if (backing != null) {
      backing.access(Operation.READ, address);
    }

    boolean dirty = ((operation == Operation.WRITE) && isRequesterEdge())
        || ((backing != null) && backing.isDirty(blockAddress));
    set.insert(tag, dirty);
  }

  /**
   * Evicts the victim chosen by the set's policy, if any. The block is first invalidated on the
   * requester side and then dropped from this level, writing it back if dirty.
   */
  void evict(int index) {
    OptionalLong victim = sets[index].selectVictim();
    if (victim.isPresent()) {
      invalidate(decoder.recompose(victim.getAsLong(), index), /* propagateToRequester= */ true);
    }
  }

  /**
   * Drops the block containing the address, if resident. A dirty block is reported and written
   * back to the backing side before it is removed.
   * <p>
   * The requester side copies are invalidated first, while the block is still resident here, so
   * that their write-backs are absorbed by this level and carried further by its own write-back.
   *
   * @param address the byte address of the block to invalidate
   * @param propagateToRequester if the block is also invalidated on the requester side
   */
  public void invalidate(long address, boolean propagateToRequester) {
    long blockAddress = decoder.blockAlign(address);
    int index = decoder.index(blockAddress);
    long tag = decoder.tag(blockAddress);
    CacheSet set = sets[index];
    if (!set.contains(tag)) {
      return;
    }

    if (propagateToRequester) {
      invalidateRequesterSide(blockAddress);
      if (!set.contains(tag)) {
        // dropped by a write-back that allocated into this set
        return;
      }
    }

    if (set.isDirty(tag)) {
      notifier.reportWriteback(blockAddress);
      CacheLevel backing = backingSide();
      if (backing != null) {
        backing.access(Operation.WRITEBACK, blockAddress);
      }
      set.setDirty(tag, false);
    }
    set.remove(tag);
    notifier.reportEviction(blockAddress);
  }

  /** Invalidates every requester side block that lies within this level's block. */
  private void invalidateRequesterSide(long blockAddress) {
    CacheLevel requester = requesterSide();
    if (requester == null) {
      return;
    }
    long step = requester.decoder.blockSize();
    long blocks = decoder.blockSize() / step;
    for (long i = 0; i < blocks; i++) {
      long address = blockAddress + (i * step);
      requester.invalidate(address, /* propagateToRequester= */ true);
    }
  }

  /** Returns if the block containing the address is resident. */
  public boolean hasBlock(long address) {
    long blockAddress = decoder.blockAlign(address);
    return sets[decoder.index(blockAddress)].contains(decoder.tag(blockAddress));
  }

  /** Returns if the block containing the address is resident and dirty. */
  public boolean isDirty(long address) {
    long blockAddress = decoder.blockAlign(address);
    CacheSet set = sets[decoder.index(blockAddress)];
    long tag = decoder.tag(blockAddress);
    return set.contains(tag) && set.isDirty(tag);
  }

  /** Returns the number of blocks resident in the set. */
  public int setSize(int index) {
    return sets[index].size();
  }

  /** Returns the address of every resident block, ordered by set. */
  public ImmutableList<Long> residentBlocks() {
    var blocks = ImmutableList.<Long>builder();
    for (int index = 0; index < sets.length; index++) {
      for (long tag : sets[index].tags()) {
        blocks.add(decoder.recompose(tag, index));
      }
    }
    return blocks.build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name())
        .add("size", config.size())
        .add("blockSize", config.blockSize())
        .add("associativity", config.associativity())
        .add("evictionPolicy", config.evictionPolicy())
        .toString();
  }
}
