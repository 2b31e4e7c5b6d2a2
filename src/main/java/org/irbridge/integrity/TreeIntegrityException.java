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

import com.google.common.collect.ImmutableSet;

/**
 * Thrown by {@link org.irbridge.node.NodeBuilder} when an integrity check fails. Carries the
 * diagnostics from the failing check.
 */
public class TreeIntegrityException extends RuntimeException {

  public final String errors;

  public final ImmutableSet<Violation> violations;

  public TreeIntegrityException(String errors, ImmutableSet<Violation> violations) {
    super("IR tree integrity check failed " + violations + ":\n" + errors);
    this.errors = errors;
    this.violations = violations;
  }
}
