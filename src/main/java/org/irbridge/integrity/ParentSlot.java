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

import org.irbridge.node.Bnode;

/**
 * One attachment point in the tree: the child at index {@code slot} of {@code parent} (or, for
 * instructions, the instruction at index {@code slot} of an expression). Since Bnodes use identity
 * equality, two ParentSlots are equal only if they name the same parent object.
 */
public record ParentSlot(Bnode parent, int slot) {

  @Override
  public String toString() {
    return "#" + parent.id() + "[" + slot + "]";
  }
}
