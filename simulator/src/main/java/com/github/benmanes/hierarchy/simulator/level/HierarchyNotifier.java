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

/**
 * Receives the events of a single cache level. The level does not interpret the outcome of a
 * notification; an exception thrown by an implementation is logged and the request continues.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public interface HierarchyNotifier {

  /**
   * Records that the request was serviced by a resident block. A write-back notification is
   * always recorded as a hit.
   *
   * @param operation the type of request
   * @param address the requested byte address
   */
  void reportHit(Operation operation, long address);

  /**
   * Records that the request's block was not resident and was allocated.
   *
   * @param operation the type of request
   * @param address the requested byte address
   */
  void reportMiss(Operation operation, long address);

  /**
   * Records that a dirty block is being written back toward the backing side.
   *
   * @param blockAddress the block aligned address
   */
  void reportWriteback(long blockAddress);

  /**
   * Records that a block was removed from the level, by eviction or invalidation.
   *
   * @param blockAddress the block aligned address
   */
  void reportEviction(long blockAddress);

  /**
   * Returns a notifier that does not record any events.
   *
   * @return a notifier that does not record events
   */
  static HierarchyNotifier disabled() {
    return DisabledNotifier.INSTANCE;
  }

  /**
   * Returns a notifier that suppresses and logs any exception thrown by the delegate.
   *
   * @param notifier the notifier to delegate to
   * @return a notifier that suppresses and logs any exception thrown by the delegate
   */
  static HierarchyNotifier guarded(HierarchyNotifier notifier) {
    return (notifier instanceof GuardedNotifier) || (notifier instanceof DisabledNotifier)
        ? notifier
        : new GuardedNotifier(notifier);
  }
}
