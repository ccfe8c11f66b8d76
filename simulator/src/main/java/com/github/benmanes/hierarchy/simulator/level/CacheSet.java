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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.OptionalLong;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * The resident blocks of one set, keyed by tag. The blocks are kept on a doubly-linked list in
 * the order maintained by the {@link EvictionPolicy}, with the oldest (or least recently used)
 * block at the head, so that touching a block and selecting a victim are constant time.
 * <p>
 * A set never holds more than {@code associativity} blocks; the owning level must evict before
 * inserting into a full set. Inserting into a full set or removing an absent tag is a contract
 * violation and fails with an {@link IllegalStateException}.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class CacheSet {
  final Long2ObjectMap<Node> data;
  final EvictionPolicy policy;
  final int associativity;
  final Node sentinel;

  public CacheSet(int associativity, EvictionPolicy policy) {
    checkArgument(associativity > 0, "associativity must be positive: %s", associativity);
    this.data = new Long2ObjectOpenHashMap<>(associativity);
    this.policy = requireNonNull(policy);
    this.associativity = associativity;
    this.sentinel = new Node();
  }

  public boolean contains(long tag) {
    return data.containsKey(tag);
  }

  /** Returns if the resident block has been modified since it was last written back. */
  public boolean isDirty(long tag) {
    return node(tag).dirty;
  }

  public void setDirty(long tag, boolean dirty) {
    node(tag).dirty = dirty;
  }

  /** Adds the block as the most recent entry of the set. */
  public void insert(long tag, boolean dirty) {
    checkState(!isFull(), "Capacity exceeded: set is full (%s blocks)", associativity);
    checkState(!data.containsKey(tag), "Tag %s is already resident", tag);

    var node = new Node(tag, dirty, sentinel);
    data.put(tag, node);
    node.appendToTail();
  }

  public void remove(long tag) {
    Node node = data.remove(tag);
    checkState(node != null, "Not found: tag %s is not resident", tag);
    node.remove();
  }

  /** Applies the policy's recency update for a hit on the block. */
  public void touch(long tag) {
    policy.onAccess(node(tag));
  }

  /** Returns the tag that the policy would evict next, or empty if the set is empty. */
  public OptionalLong selectVictim() {
    Node victim = policy.findVictim(sentinel);
    return (victim == null) ? OptionalLong.empty() : OptionalLong.of(victim.tag);
  }

  public int size() {
    return data.size();
  }

  public boolean isEmpty() {
    return data.isEmpty();
  }

  public boolean isFull() {
    return data.size() >= associativity;
  }

  public int associativity() {
    return associativity;
  }

  /** Returns the resident tags from the head of the list (oldest) to the tail (newest). */
  public ImmutableList<Long> tags() {
    var tags = ImmutableList.<Long>builderWithExpectedSize(data.size());
    for (Node node = sentinel.next; node != sentinel; node = node.next) {
      tags.add(node.tag);
    }
    return tags.build();
  }

  private Node node(long tag) {
    Node node = data.get(tag);
    checkState(node != null, "Not found: tag %s is not resident", tag);
    return node;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("policy", policy)
        .add("associativity", associativity)
        .add("tags", tags())
        .toString();
  }

  /** A block on the double-linked list. */
  static final class Node {
    final Node sentinel;
    final long tag;

    boolean dirty;
    Node prev;
    Node next;

    /** Creates a new sentinel node. */
    Node() {
      this.tag = Long.MIN_VALUE;
      this.sentinel = this;
      this.prev = this;
      this.next = this;
    }

    /** Creates a new, unlinked node. */
    Node(long tag, boolean dirty, Node sentinel) {
      this.sentinel = sentinel;
      this.dirty = dirty;
      this.tag = tag;
      this.prev = this;
      this.next = this;
    }

    /** Appends the node to the tail of the list. */
    void appendToTail() {
      Node tail = sentinel.prev;
      sentinel.prev = this;
      tail.next = this;
      next = sentinel;
      prev = tail;
    }

    /** Removes the node from the list. */
    void remove() {
      prev.next = next;
      next.prev = prev;
      prev = next = this;
    }

    /** Moves the node to the tail. */
    void moveToTail() {
      // unlink
      prev.next = next;
      next.prev = prev;

      // link
      next = sentinel;
      prev = sentinel.prev;
      sentinel.prev = this;
      prev.next = this;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("tag", tag)
          .add("dirty", dirty)
          .toString();
    }
  }
}
