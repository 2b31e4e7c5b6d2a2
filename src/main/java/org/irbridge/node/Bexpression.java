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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.irbridge.util.StringUtil;
import org.jspecify.annotations.Nullable;
import org.objectweb.asm.tree.AbstractInsnNode;

/**
 * An expression node. In addition to its children, an expression may own a sequence of low-level
 * instructions (ASM instruction nodes) that implement the leaf operation it contributes; these are
 * never shared with another expression.
 */
public final class Bexpression extends Bnode {

  private final String type;

  private final @Nullable Operator op;

  /**
   * Flavor-specific data: the Long value of a CONST, the {@link Bvariable} of a VAR, the Integer
   * field index of a STRUCT_FIELD, the String callee name of a CALL; otherwise null.
   */
  private final @Nullable Object payload;

  private final List<AbstractInsnNode> instructions = new ArrayList<>();

  Bexpression(
      int id,
      NodeFlavor flavor,
      String type,
      @Nullable Operator op,
      @Nullable Object payload,
      List<? extends Bnode> kids) {
    super(id, flavor, kids);
    assert !flavor.isStatement();
    this.type = type;
    this.op = op;
    this.payload = payload;
  }

  @Override
  public boolean isStmt() {
    return false;
  }

  @Override
  public Bexpression castToBexpression() {
    return this;
  }

  /** The name of this expression's type, e.g. {@code "int64"} or {@code "*T"}. */
  public String type() {
    return type;
  }

  /** The operator of a BINARY_OP or UNARY_OP expression. */
  public Operator op() {
    Preconditions.checkState(op != null, "%s has no operator", flavor());
    return op;
  }

  public long constValue() {
    Preconditions.checkState(flavor() == NodeFlavor.CONST);
    return (Long) payload;
  }

  public Bvariable var() {
    Preconditions.checkState(flavor() == NodeFlavor.VAR);
    return (Bvariable) payload;
  }

  public int fieldIndex() {
    Preconditions.checkState(flavor() == NodeFlavor.STRUCT_FIELD);
    return (Integer) payload;
  }

  public String callee() {
    Preconditions.checkState(flavor() == NodeFlavor.CALL);
    return (String) payload;
  }

  /** Flavor-specific data, for use by {@link NodeBuilder#cloneSubtree}. */
  @Nullable Object payload() {
    return payload;
  }

  /** Returns an unmodifiable view of the instructions owned by this expression. */
  public List<AbstractInsnNode> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  void appendInstruction(AbstractInsnNode insn) {
    instructions.add(insn);
  }

  @Override
  String describe() {
    StringBuilder sb = new StringBuilder(flavor().mnemonic);
    switch (flavor()) {
      case CONST -> sb.append(' ').append(payload);
      case VAR -> sb.append(' ').append(var().name());
      case STRUCT_FIELD -> sb.append(" .").append(payload);
      case CALL -> sb.append(' ').append(payload);
      case BINARY_OP, UNARY_OP -> sb.append(' ').append(op.symbol);
      default -> {}
    }
    return sb.append(' ').append(type).toString();
  }

  @Override
  void dumpExtras(StringBuilder sb, int depth) {
    for (AbstractInsnNode insn : instructions) {
      StringUtil.indent(sb, depth).append("| ").append(Instructions.print(insn)).append('\n');
    }
  }
}
