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

/**
 * The kinds of integrity failure an {@link IntegrityVisitor} can find. All of them indicate a bug
 * in the code that built the tree.
 */
public enum Violation {
  /** A statement was attached under more than one parent. */
  STATEMENT_SHARING,
  /** An instruction was attached to more than one expression. */
  INSTRUCTION_SHARING,
  /** An expression was attached under more than one parent and the sharing was reported. */
  UNREPAIRABLE_EXPRESSION_SHARING,
  /** A shared subtree recorded for repair turned out not to be clonable. */
  REPAIR_CLASSIFICATION_FAILURE
}
