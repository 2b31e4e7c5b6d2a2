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

import java.util.List;
import org.jspecify.annotations.Nullable;

/** A statement node. Statements own no instructions and are never cloned. */
public final class Bstatement extends Bnode {

  /** The label name of a LABEL_STMT or GOTO_STMT; otherwise null. */
  private final @Nullable String label;

  Bstatement(int id, NodeFlavor flavor, @Nullable String label, List<? extends Bnode> kids) {
    super(id, flavor, kids);
    assert flavor.isStatement() : flavor;
    this.label = label;
  }

  @Override
  public boolean isStmt() {
    return true;
  }

  public @Nullable String label() {
    return label;
  }

  @Override
  String describe() {
    return (label == null) ? flavor().mnemonic : flavor().mnemonic + " " + label;
  }
}
