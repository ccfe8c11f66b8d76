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

import static java.util.Locale.US;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a cache level is constructed with a geometry or policy that cannot be simulated.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
public final class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  /** Throws a {@link ConfigurationException} if the expression is false. */
  @FormatMethod
  static void checkConfiguration(boolean expression, String format, Object... args) {
    if (!expression) {
      throw new ConfigurationException(String.format(US, format, args));
    }
  }
}
