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
 * The specific kind of a {@link Bnode}. Each flavor belongs to exactly one of the two node kinds
 * (expression or statement).
 */
public enum NodeFlavor {
  CONST("const", false),
  VAR("var", false),
  CONVERSION("conv", false),
  DEREF("deref", false),
  ADDRESS("addr", false),
  STRUCT_FIELD("field", false),
  ARRAY_INDEX("index", false),
  BINARY_OP("binop", false),
  UNARY_OP("unop", false),
  COMPOUND("compound", false),
  CONDITIONAL("cond", false),
  CALL("call", false),
  ERROR("error", false),

  EXPR_STMT("exprstmt", true),
  BLOCK_STMT("block", true),
  IF_STMT("if", true),
  RETURN_STMT("return", true),
  LABEL_STMT("label", true),
  GOTO_STMT("goto", true);

  /** The name used for nodes of this flavor in dumps. */
  public final String mnemonic;

  private final boolean isStatement;

  NodeFlavor(String mnemonic, boolean isStatement) {
    this.mnemonic = mnemonic;
    this.isStatement = isStatement;
  }

  /** True if nodes of this flavor are {@link Bstatement}s. */
  public boolean isStatement() {
    return isStatement;
  }
}
