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

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * A {@link HierarchyNotifier} implementation that suppresses and logs any exception thrown by the
 * delegate <tt>notifier</tt>, so that a failing listener cannot abort a cascade midway.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@SuppressWarnings("PMD.AvoidDuplicateLiterals")
final class GuardedNotifier implements HierarchyNotifier {
  static final Logger logger = System.getLogger(GuardedNotifier.class.getName());

  final HierarchyNotifier delegate;

  GuardedNotifier(HierarchyNotifier delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  public void reportHit(Operation operation, long address) {
    try {
      delegate.reportHit(operation, address);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by notifier", t);
    }
  }

  @Override
  public void reportMiss(Operation operation, long address) {
    try {
      delegate.reportMiss(operation, address);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by notifier", t);
    }
  }

  @Override
  public void reportWriteback(long blockAddress) {
    try {
      delegate.reportWriteback(blockAddress);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by notifier", t);
    }
  }

  @Override
  public void reportEviction(long blockAddress) {
    try {
      delegate.reportEviction(blockAddress);
    } catch (Throwable t) {
      logger.log(Level.WARNING, "Exception thrown by notifier", t);
    }
  }

  @Override
  public String toString() {
    return delegate.toString();
  }
}
