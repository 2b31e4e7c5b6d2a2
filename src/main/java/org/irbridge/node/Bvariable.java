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

package org.irbridge.node;

/**
 * A variable referenced by {@link NodeFlavor#VAR} expressions. Locals are assigned a JVM local
 * slot; globals live at module scope and have {@code slot == -1}.
 */
public record Bvariable(String name, String type, boolean isGlobal, int slot) {

  /** Returns a local variable stored in the given local slot. */
  public static Bvariable local(String name, String type, int slot) {
    return new Bvariable(name, type, false, slot);
  }

  /** Returns a module-scope variable. */
  public static Bvariable global(String name, String type) {
    return new Bvariable(name, type, true, -1);
  }
}
