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
 * A {@link HierarchyNotifier} implementation that does not record any events.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
enum DisabledNotifier implements HierarchyNotifier {
  INSTANCE;

  @Override
  public void reportHit(Operation operation, long address) {}

  @Override
  public void reportMiss(Operation operation, long address) {}

  @Override
  public void reportWriteback(long blockAddress) {}

  @Override
  public void reportEviction(long blockAddress) {}
}
