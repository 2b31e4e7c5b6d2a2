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

import org.objectweb.asm.Opcodes;

/**
 * Operators for {@link NodeFlavor#BINARY_OP} and {@link NodeFlavor#UNARY_OP} expressions, with the
 * JVM opcode that implements each on long operands.
 *
 * <p>Booleans are longs holding 0 or 1, so the logical operators lower to the bitwise ones; the
 * operands of ANDAND and OROR are both evaluated (short-circuit forms are built as CONDITIONAL
 * expressions). Comparisons lower to {@code LCMP}, leaving -1, 0 or 1 for the enclosing statement
 * to branch on.
 */
public enum Operator {
  PLUS("+", Opcodes.LADD),
  MINUS("-", Opcodes.LSUB),
  MULT("*", Opcodes.LMUL),
  DIV("/", Opcodes.LDIV),
  MOD("%", Opcodes.LREM),
  AND("&", Opcodes.LAND),
  OR("|", Opcodes.LOR),
  XOR("^", Opcodes.LXOR),
  LSHIFT("<<", Opcodes.LSHL),
  RSHIFT(">>", Opcodes.LSHR),
  EQ("==", Opcodes.LCMP),
  NOTEQ("!=", Opcodes.LCMP),
  LT("<", Opcodes.LCMP),
  LE("<=", Opcodes.LCMP),
  GT(">", Opcodes.LCMP),
  GE(">=", Opcodes.LCMP),
  ANDAND("&&", Opcodes.LAND),
  OROR("||", Opcodes.LOR),
  // xor with 1; NodeBuilder pushes the 1 first
  NOT("!", Opcodes.LXOR),
  NEGATE("neg", Opcodes.LNEG);

  public final String symbol;

  /** The JVM opcode that implements this operator on long operands. */
  public final int opcode;

  Operator(String symbol, int opcode) {
    this.symbol = symbol;
    this.opcode = opcode;
  }

  /** True if this operator may be used in a {@link NodeFlavor#UNARY_OP}. */
  public boolean isUnary() {
    return this == NOT || this == NEGATE;
  }
}
