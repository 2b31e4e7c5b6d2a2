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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.irbridge.integrity.IntegrityControl;
import org.irbridge.integrity.IntegrityVisitor;
import org.irbridge.integrity.TreeIntegrityException;
import org.jspecify.annotations.Nullable;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.InsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

/**
 * A NodeBuilder creates the {@link Bnode}s of a function's IR tree, attaching the low-level
 * instructions that implement each leaf operation.
 *
 * <p>If integrity checks are enabled each newly created node is examined by an incremental-mode
 * {@link IntegrityVisitor}, which records the node's children as attached to it; attaching a node
 * that already has a parent is either deferred (if the sharing is repairable) or reported by
 * throwing a {@link TreeIntegrityException}. When the function body is complete, {@link
 * #finishFunctionBody} runs a batch-mode check that repairs any deferred sharing.
 *
 * <p>Module-scope constants and global variable references are cached and returned to any number
 * of parents; they are exempt from the single-parent rule.
 */
public class NodeBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The class that owns module-scope functions and globals in emitted code. */
  static final String MODULE_OWNER = "irbridge/Module";

  /** Pointers are represented as references to a cell class with a single {@code long} field. */
  static final String POINTER_OWNER = "irbridge/Pointer";

  private int nextId;

  /** If false, new nodes are not examined; toggled off while repairs are in progress. */
  private boolean integrityChecks;

  /** The checker used for each new node; its parent tables persist for this builder's lifetime. */
  private final IntegrityVisitor incrementalChecker;

  /** The options used by {@link #finishFunctionBody}. */
  public IntegrityControl batchControl = IntegrityControl.batch();

  /** Every node that has been handed out as a module-scope value. */
  private final Set<Bexpression> moduleScopeValues = Sets.newIdentityHashSet();

  private final Map<Long, Bexpression> moduleConsts = new HashMap<>();

  private final Map<String, Bexpression> globalRefs = new HashMap<>();

  /** Created lazily; there is one error expression per builder. */
  private Bexpression errorExpr;

  /** Creates a NodeBuilder with integrity checks enabled. */
  public NodeBuilder() {
    this(true);
  }

  public NodeBuilder(boolean integrityChecks) {
    this.integrityChecks = integrityChecks;
    this.incrementalChecker = new IntegrityVisitor(this, IntegrityControl.incremental());
  }

  public boolean integrityChecksEnabled() {
    return integrityChecks;
  }

  public void setIntegrityChecks(boolean enabled) {
    this.integrityChecks = enabled;
  }

  /**
   * True if {@code expr} is a module-scope value (a cached constant or global reference) that may
   * legitimately appear under any number of parents.
   */
  public boolean moduleScopeValue(Bexpression expr) {
    return moduleScopeValues.contains(expr);
  }

  /** Returns the number of nodes created by this builder so far. */
  public int numNodes() {
    return nextId;
  }

  // Expressions

  /** Returns a new (function-local) integer constant. */
  public Bexpression mkConst(String type, long value) {
    Bexpression result = newExpr(NodeFlavor.CONST, type, null, value, ImmutableList.of());
    result.appendInstruction(new LdcInsnNode(value));
    return finish(result);
  }

  /** Returns the shared module-scope constant with the given value. */
  public Bexpression mkModuleConst(long value) {
    return moduleConsts.computeIfAbsent(
        value,
        v -> moduleValue(newExpr(NodeFlavor.CONST, "int64", null, v, ImmutableList.of())));
  }

  /** Returns the shared reference to a global variable. */
  public Bexpression mkGlobalVarRef(Bvariable global) {
    Preconditions.checkArgument(global.isGlobal(), "%s is not a global", global.name());
    return globalRefs.computeIfAbsent(
        global.name(),
        name ->
            moduleValue(newExpr(NodeFlavor.VAR, global.type(), null, global, ImmutableList.of())));
  }

  /** Returns a new reference to a local variable. */
  public Bexpression mkVar(Bvariable local) {
    Preconditions.checkArgument(!local.isGlobal(), "use mkGlobalVarRef for %s", local.name());
    Bexpression result = newExpr(NodeFlavor.VAR, local.type(), null, local, ImmutableList.of());
    result.appendInstruction(new VarInsnNode(Opcodes.LLOAD, local.slot()));
    return finish(result);
  }

  public Bexpression mkConversion(String type, Bexpression expr) {
    Bexpression result =
        newExpr(NodeFlavor.CONVERSION, type, null, null, ImmutableList.of(expr));
    result.appendInstruction(new TypeInsnNode(Opcodes.CHECKCAST, internalName(type)));
    return finish(result);
  }

  /** Returns an expression that loads the value {@code ptr} points to. */
  public Bexpression mkDeref(String type, Bexpression ptr) {
    Bexpression result = newExpr(NodeFlavor.DEREF, type, null, null, ImmutableList.of(ptr));
    result.appendInstruction(new FieldInsnNode(Opcodes.GETFIELD, POINTER_OWNER, "value", "J"));
    return finish(result);
  }

  public Bexpression mkAddress(Bexpression expr) {
    return finish(
        newExpr(NodeFlavor.ADDRESS, "*" + expr.type(), null, null, ImmutableList.of(expr)));
  }

  public Bexpression mkStructField(String type, Bexpression struct, int fieldIndex) {
    Preconditions.checkArgument(fieldIndex >= 0);
    Bexpression result =
        newExpr(NodeFlavor.STRUCT_FIELD, type, null, fieldIndex, ImmutableList.of(struct));
    result.appendInstruction(
        new FieldInsnNode(Opcodes.GETFIELD, internalName(struct.type()), "f" + fieldIndex, "J"));
    return finish(result);
  }

  public Bexpression mkArrayIndex(String type, Bexpression array, Bexpression index) {
    Bexpression result =
        newExpr(NodeFlavor.ARRAY_INDEX, type, null, null, ImmutableList.of(array, index));
    result.appendInstruction(new InsnNode(Opcodes.LALOAD));
    return finish(result);
  }

  public Bexpression mkBinaryOp(Operator op, Bexpression left, Bexpression right) {
    Preconditions.checkArgument(!op.isUnary(), "%s is not a binary operator", op);
    Bexpression result =
        newExpr(NodeFlavor.BINARY_OP, left.type(), op, null, ImmutableList.of(left, right));
    result.appendInstruction(new InsnNode(op.opcode));
    return finish(result);
  }

  public Bexpression mkUnaryOp(Operator op, Bexpression expr) {
    Preconditions.checkArgument(op.isUnary(), "%s is not a unary operator", op);
    Bexpression result =
        newExpr(NodeFlavor.UNARY_OP, expr.type(), op, null, ImmutableList.of(expr));
    if (op == Operator.NOT) {
      result.appendInstruction(new LdcInsnNode(1L));
    }
    result.appendInstruction(new InsnNode(op.opcode));
    return finish(result);
  }

  /** Returns an expression that executes {@code stmt} and then evaluates {@code result}. */
  public Bexpression mkCompound(Bstatement stmt, Bexpression result) {
    return finish(
        newExpr(NodeFlavor.COMPOUND, result.type(), null, null, ImmutableList.of(stmt, result)));
  }

  public Bexpression mkConditional(Bexpression cond, Bexpression ifTrue, Bexpression ifFalse) {
    return finish(
        newExpr(
            NodeFlavor.CONDITIONAL,
            ifTrue.type(),
            null,
            null,
            ImmutableList.of(cond, ifTrue, ifFalse)));
  }

  public Bexpression mkCall(String type, String callee, List<Bexpression> args) {
    Bexpression result = newExpr(NodeFlavor.CALL, type, null, callee, args);
    result.appendInstruction(
        new MethodInsnNode(
            Opcodes.INVOKESTATIC,
            MODULE_OWNER,
            callee,
            "(" + "J".repeat(args.size()) + ")J",
            false));
    return finish(result);
  }

  /**
   * Returns the error expression, used in place of subexpressions that failed to type check. The
   * same node is returned on every call.
   */
  public Bexpression mkErrorExpr() {
    if (errorExpr == null) {
      errorExpr = newExpr(NodeFlavor.ERROR, "error", null, null, ImmutableList.of());
    }
    return errorExpr;
  }

  /**
   * Appends an instruction to an existing expression. Normally each mk* method attaches the
   * instructions it needs; this is for callers that materialize additional leaf operations.
   */
  @CanIgnoreReturnValue
  public Bexpression appendInstruction(Bexpression expr, AbstractInsnNode insn) {
    expr.appendInstruction(insn);
    return finish(expr);
  }

  /**
   * Replaces a binary operation with a new one that has the same children and a different
   * operator. The children are detached from {@code binop} before being attached to the result, so
   * they are not reported as shared.
   */
  public Bexpression rebuildBinaryOp(Bexpression binop, Operator newOp) {
    Preconditions.checkArgument(binop.flavor() == NodeFlavor.BINARY_OP);
    for (int i = 0; i < binop.numChildren(); i++) {
      incrementalChecker.removeChildEdge(binop.child(i), binop, i);
    }
    return mkBinaryOp(newOp, (Bexpression) binop.child(0), (Bexpression) binop.child(1));
  }

  // Statements

  public Bstatement mkExprStmt(Bexpression expr) {
    return finish(newStmt(NodeFlavor.EXPR_STMT, null, ImmutableList.of(expr)));
  }

  public Bstatement mkBlock(List<? extends Bnode> stmts) {
    for (Bnode stmt : stmts) {
      Preconditions.checkArgument(stmt.isStmt(), "block elements must be statements");
    }
    return finish(newStmt(NodeFlavor.BLOCK_STMT, null, stmts));
  }

  /** Appends {@code stmt} to an existing block. */
  @CanIgnoreReturnValue
  public Bstatement addStatement(Bstatement block, Bstatement stmt) {
    Preconditions.checkArgument(block.flavor() == NodeFlavor.BLOCK_STMT);
    block.appendChild(stmt);
    return finish(block);
  }

  public Bstatement mkIf(Bexpression cond, Bstatement thenStmt, @Nullable Bstatement elseStmt) {
    List<Bnode> kids = new ArrayList<>();
    kids.add(cond);
    kids.add(thenStmt);
    if (elseStmt != null) {
      kids.add(elseStmt);
    }
    return finish(newStmt(NodeFlavor.IF_STMT, null, kids));
  }

  public Bstatement mkReturn(@Nullable Bexpression value) {
    return finish(
        newStmt(
            NodeFlavor.RETURN_STMT,
            null,
            (value == null) ? ImmutableList.of() : ImmutableList.of(value)));
  }

  public Bstatement mkLabel(String label) {
    return finish(newStmt(NodeFlavor.LABEL_STMT, label, ImmutableList.of()));
  }

  public Bstatement mkGoto(String label) {
    return finish(newStmt(NodeFlavor.GOTO_STMT, label, ImmutableList.of()));
  }

  // Cloning

  /**
   * Returns a deep copy of the given expression subtree, with copies of all attached instructions.
   * Module-scope values and the error expression are shared rather than copied. Statements cannot
   * be cloned.
   */
  public Bexpression cloneSubtree(Bexpression expr) {
    if (moduleScopeValue(expr) || expr.flavor() == NodeFlavor.ERROR) {
      return expr;
    }
    List<Bnode> kids = new ArrayList<>(expr.numChildren());
    for (Bnode kid : expr.children()) {
      Bexpression kidExpr = kid.castToBexpression();
      Preconditions.checkArgument(kidExpr != null, "can't clone a subtree containing statements");
      kids.add(cloneSubtree(kidExpr));
    }
    Bexpression result =
        newExpr(expr.flavor(), expr.type(), opOrNull(expr), expr.payload(), kids);
    Map<LabelNode, LabelNode> labels = Instructions.cloneLabels(expr.instructions());
    for (AbstractInsnNode insn : expr.instructions()) {
      result.appendInstruction(insn.clone(labels));
    }
    logger.atFinest().log("cloned #%s as #%s", expr.id(), result.id());
    return finish(result);
  }

  // Batch checking

  /**
   * Checks the completed body of a function, repairing any sharing that was deferred while the
   * body was being built. Returns {@code body}, which may have been modified.
   *
   * @throws TreeIntegrityException if the body contains sharing that can't be repaired
   */
  @CanIgnoreReturnValue
  public Bstatement finishFunctionBody(Bstatement body) {
    IntegrityVisitor checker = new IntegrityVisitor(this, batchControl);
    if (!checker.examine(body)) {
      logger.atWarning().log("Integrity check failed for function body:\n%s", checker.errors());
      throw new TreeIntegrityException(checker.errors(), checker.violations());
    }
    incrementalChecker.absorbRepairs(checker);
    logger.atFine().log("Checked function body:\n%s", lazy(body::toString));
    return body;
  }

  private static @Nullable Operator opOrNull(Bexpression expr) {
    return switch (expr.flavor()) {
      case BINARY_OP, UNARY_OP -> expr.op();
      default -> null;
    };
  }

  private Bexpression moduleValue(Bexpression expr) {
    moduleScopeValues.add(expr);
    return expr;
  }

  private Bexpression newExpr(
      NodeFlavor flavor,
      String type,
      @Nullable Operator op,
      @Nullable Object payload,
      List<? extends Bnode> kids) {
    return new Bexpression(nextId++, flavor, type, op, payload, kids);
  }

  private Bstatement newStmt(
      NodeFlavor flavor, @Nullable String label, List<? extends Bnode> kids) {
    return new Bstatement(nextId++, flavor, label, kids);
  }

  /** If integrity checks are enabled, examines the edges from {@code node} to its children. */
  private <T extends Bnode> T finish(T node) {
    if (integrityChecks && !incrementalChecker.examine(node)) {
      logger.atWarning().log("Integrity check failed:\n%s", incrementalChecker.errors());
      throw new TreeIntegrityException(
          incrementalChecker.errors(), incrementalChecker.violations());
    }
    return node;
  }

  /** Converts a type name such as {@code "*T"} or {@code "S"} to a JVM internal class name. */
  private static String internalName(String type) {
    return "irbridge/types/" + type.replace("*", "Ptr_");
  }
}
