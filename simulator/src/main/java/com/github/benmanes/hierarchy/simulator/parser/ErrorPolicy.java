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

import static java.util.Locale.US;

/**
 * The handling of a trace record that cannot be parsed.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public enum ErrorPolicy {

  /** Logs and discards the record, continuing with the rest of the trace. */
  SKIP,

  /** Fails the replay with the parsing error. */
  ABORT;

  /** Returns the policy based on its configuration name. */
  public static ErrorPolicy named(String name) {
    return ErrorPolicy.valueOf(name.trim().toUpperCase(US));
  }
}
