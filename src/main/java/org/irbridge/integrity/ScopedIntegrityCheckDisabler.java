/*
 * Copyright 2025 The IRBridge Authors
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

package org.irbridge.integrity;

import org.irbridge.node.NodeBuilder;

/**
 * Disables a NodeBuilder's integrity checks until closed, then restores whatever setting was in
 * effect when it was created. Intended for use in a try-with-resources statement.
 */
final class ScopedIntegrityCheckDisabler implements AutoCloseable {
  private final NodeBuilder builder;
  private final boolean saved;

  ScopedIntegrityCheckDisabler(NodeBuilder builder) {
    this.builder = builder;
    this.saved = builder.integrityChecksEnabled();
    builder.setIntegrityChecks(false);
  }

  @Override
  public void close() {
    builder.setIntegrityChecks(saved);
  }
}
