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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.irbridge.integrity.IntegrityControl.DumpPointers;
import org.irbridge.integrity.IntegrityControl.RepairReporting;
import org.irbridge.integrity.IntegrityControl.VisitMode;
import org.irbridge.node.Bexpression;
import org.irbridge.node.Bnode;
import org.irbridge.node.Instructions;
import org.irbridge.node.NodeBuilder;
import org.irbridge.node.NodeFlavor;
import org.irbridge.node.Operator;
import org.irbridge.util.StringUtil;
import org.jspecify.annotations.Nullable;
import org.objectweb.asm.tree.AbstractInsnNode;

/**
 * An IntegrityVisitor checks that the nodes built by a {@link NodeBuilder} form a tree: each
 * tracked node (any statement, or any expression that is not a module-scope value) and each
 * instruction must have a single parent.
 *
 * <p>The visitor remembers the first (parent, slot) at which it saw each node. A later sighting at
 * a different location is sharing, and that location is added to the sharing ledger. Statement
 * and instruction sharing is always an error. Expression sharing may be repaired by cloning if
 * the shared subtree only contains a few simple flavors (see {@link #isRepairable}); a
 * {@link VisitMode#BATCH} check does so, replacing each recorded location's child with a clone and
 * leaving the original at the location where it was first seen. An {@link VisitMode#INCREMENTAL}
 * check only looks at the edges from the examined node to its direct children (which are assumed
 * to have been checked when they were built), and defers repairs to a later batch check.
 *
 * <p>The sharing ledger, the share counts and the diagnostics are reset at the start of each call
 * to {@link #examine}. In batch mode the parent tables are reset too, since each call walks the
 * whole subtree again; in incremental mode they persist, since each call only adds the edges of
 * one new node.
 */
public class IntegrityVisitor {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final NodeBuilder builder;

  public final IntegrityControl control;

  /** For each tracked node, the location where it was first seen. */
  private final Map<Bnode, ParentSlot> nodeParents = new IdentityHashMap<>();

  /** For each instruction, the location where it was first seen. */
  private final Map<AbstractInsnNode, ParentSlot> instParents = new IdentityHashMap<>();

  /** Locations at which an already-tracked node was seen again; in discovery order. */
  private final Set<ParentSlot> sharing = new LinkedHashSet<>();

  /** A location whose shared child was replaced by a clone of it. */
  public record Rewiring(Bexpression original, Bexpression copy, ParentSlot slot) {}

  /** The locations rewritten by the most recent repair. */
  private final List<Rewiring> rewirings = new ArrayList<>();

  private int exprShareCount;
  private int stmtShareCount;
  private int instShareCount;

  private final EnumSet<Violation> violations = EnumSet.noneOf(Violation.class);

  /** Diagnostics for the current (or most recent) call to {@link #examine}. */
  private StringBuilder log = new StringBuilder();

  public IntegrityVisitor(NodeBuilder builder, IntegrityControl control) {
    this.builder = builder;
    this.control = control;
  }

  /**
   * Checks {@code node} (and, in batch mode, its entire subtree). Returns true if no unrepairable
   * sharing was found; in batch mode any repairable sharing will have been repaired. If false is
   * returned, {@link #errors} describes the problems found.
   */
  public boolean examine(Bnode node) {
    resetPass();
    visit(node);

    // Instruction and statement sharing are not repairable.
    if (instShareCount != 0 || stmtShareCount != 0) {
      return false;
    }
    // Any expression sharing that was counted has already been reported.
    if (exprShareCount != 0) {
      return false;
    }
    if (control.visitMode() == VisitMode.INCREMENTAL) {
      if (!sharing.isEmpty()) {
        logger.atFine().log("Deferring repair of %s shared locations", sharing.size());
      }
      sharing.clear();
      return true;
    }
    if (sharing.isEmpty()) {
      return true;
    }
    return repair(node);
  }

  /** Returns the diagnostics from the most recent call to {@link #examine}. */
  public String errors() {
    return log.toString();
  }

  /** Returns the kinds of failure found by the most recent call to {@link #examine}. */
  public ImmutableSet<Violation> violations() {
    return Sets.immutableEnumSet(violations);
  }

  public int exprShareCount() {
    return exprShareCount;
  }

  public int stmtShareCount() {
    return stmtShareCount;
  }

  public int instShareCount() {
    return instShareCount;
  }

  /** Returns the locations rewritten by the most recent call to {@link #examine}. */
  public ImmutableList<Rewiring> rewirings() {
    return ImmutableList.copyOf(rewirings);
  }

  /** Returns the location recorded for {@code node}, or null if it is not being tracked. */
  @VisibleForTesting
  @Nullable ParentSlot recordedParent(Bnode node) {
    return nodeParents.get(node);
  }

  /** The number of locations currently in the sharing ledger. */
  @VisibleForTesting
  int pendingSharing() {
    return sharing.size();
  }

  private void resetPass() {
    if (control.visitMode() == VisitMode.BATCH) {
      nodeParents.clear();
      instParents.clear();
    }
    sharing.clear();
    rewirings.clear();
    exprShareCount = 0;
    stmtShareCount = 0;
    instShareCount = 0;
    violations.clear();
    log = new StringBuilder();
  }

  /**
   * Records the edges from {@code node} to each of its children and instructions. In batch mode,
   * each child's subtree is visited before the edge to it is recorded.
   */
  @VisibleForTesting
  void visit(Bnode node) {
    List<Bnode> kids = node.children();
    for (int i = 0; i < kids.size(); i++) {
      Bnode child = kids.get(i);
      if (control.visitMode() == VisitMode.BATCH) {
        visit(child);
      }
      recordChildEdge(child, node, i);
    }
    if (node instanceof Bexpression expr) {
      List<AbstractInsnNode> insts = expr.instructions();
      for (int i = 0; i < insts.size(); i++) {
        recordInstructionEdge(insts.get(i), expr, i);
      }
    }
  }

  private boolean shouldBeTracked(Bnode child) {
    return !(child instanceof Bexpression expr && builder.moduleScopeValue(expr));
  }

  /**
   * Records that {@code child} is attached at {@code parent}'s {@code slot}. If {@code child} was
   * previously seen at a different location, the new location is added to the sharing ledger and
   * (unless the sharing is repairable and repairable sharing is not being reported) counted and
   * described in the diagnostics.
   */
  void recordChildEdge(Bnode child, Bnode parent, int slot) {
    if (!shouldBeTracked(child)) {
      return;
    }
    ParentSlot prev = nodeParents.get(child);
    if (prev == null) {
      nodeParents.put(child, new ParentSlot(parent, slot));
      return;
    }
    if (prev.parent() == parent && prev.slot() == slot) {
      return;
    }
    // Error nodes are expected to be malformed; they are reported elsewhere.
    if (child.flavor() == NodeFlavor.ERROR) {
      return;
    }
    ParentSlot ps = new ParentSlot(parent, slot);
    if (!sharing.add(ps)) {
      // Already counted.
      return;
    }
    // Repairable sharing is not an error if it will be undone later.
    Bexpression expr = child.castToBexpression();
    if (expr != null
        && control.repairReporting() == RepairReporting.DONT_REPORT_REPAIRABLE_SHARING
        && isRepairable(expr)) {
      return;
    }
    String wh;
    if (child.isStmt()) {
      stmtShareCount++;
      violations.add(Violation.STATEMENT_SHARING);
      wh = "stmt";
    } else {
      exprShareCount++;
      violations.add(Violation.UNREPAIRABLE_EXPRESSION_SHARING);
      wh = "expr";
    }
    log.append("error: ").append(wh).append(" has multiple parents\n");
    log.append("child ").append(wh).append(":\n");
    dump(child);
    log.append("parent 1:\n");
    dump(prev.parent());
    log.append("parent 2:\n");
    dump(parent);
  }

  /**
   * Called when {@code child} is being detached from {@code parent} so that it can be reattached
   * elsewhere (e.g. when a node is rebuilt as a different node with the same children). The
   * recorded location is only forgotten if it is the one being detached; if the child is already
   * shared, its first location must be kept so that the sharing can still be repaired.
   */
  public void removeChildEdge(Bnode child, Bnode parent, int slot) {
    if (!shouldBeTracked(child)) {
      return;
    }
    ParentSlot prev = nodeParents.get(child);
    // Nodes built while checks were disabled were never recorded.
    if (prev != null && prev.parent() == parent && prev.slot() == slot) {
      nodeParents.remove(child);
    }
  }

  /**
   * Updates this visitor's parent table to reflect the repairs made by a batch-mode {@code
   * checker}. If this visitor had recorded a repaired node at a location that now holds its clone,
   * the node is moved to the location where the repair left it, and each clone is recorded at the
   * location it now occupies.
   */
  public void absorbRepairs(IntegrityVisitor checker) {
    for (Rewiring r : checker.rewirings) {
      if (r.slot().equals(nodeParents.get(r.original()))) {
        ParentSlot kept = checker.nodeParents.get(r.original());
        if (kept != null) {
          nodeParents.put(r.original(), kept);
        } else {
          nodeParents.remove(r.original());
        }
      }
      if (shouldBeTracked(r.copy())) {
        nodeParents.put(r.copy(), r.slot());
      }
    }
  }

  /**
   * Records that {@code inst} is the {@code slot}th instruction of {@code parent}. Instructions
   * can't be cloned here, so any sharing is counted as an error.
   */
  void recordInstructionEdge(AbstractInsnNode inst, Bexpression parent, int slot) {
    ParentSlot prev = instParents.get(inst);
    if (prev == null) {
      instParents.put(inst, new ParentSlot(parent, slot));
      return;
    }
    if (prev.parent() == parent && prev.slot() == slot) {
      return;
    }
    instShareCount++;
    violations.add(Violation.INSTRUCTION_SHARING);
    log.append("error: instruction has multiple parents\n");
    dump(inst);
    log.append("parent 1:\n");
    dump(prev.parent());
    log.append("parent 2:\n");
    dump(parent);
  }

  /**
   * Returns true if every node in the subtree rooted at {@code root} is a constant, variable
   * reference, conversion, dereference, struct field reference, or addition or subtraction. Such
   * subtrees are cheap to clone and have no side effects.
   */
  public static boolean isRepairable(Bexpression root) {
    Set<Bexpression> visited = Sets.newIdentityHashSet();
    Deque<Bexpression> workList = new ArrayDeque<>();
    visited.add(root);
    workList.push(root);
    while (!workList.isEmpty()) {
      Bexpression e = workList.pop();
      if (!isClonable(e)) {
        return false;
      }
      for (Bnode kid : e.children()) {
        // Every clonable flavor has only expression children.
        Bexpression ke = (Bexpression) kid;
        if (visited.add(ke)) {
          workList.push(ke);
        }
      }
    }
    return true;
  }

  private static boolean isClonable(Bexpression e) {
    return switch (e.flavor()) {
      case CONST, VAR, CONVERSION, DEREF, STRUCT_FIELD -> true;
      case BINARY_OP -> e.op() == Operator.PLUS || e.op() == Operator.MINUS;
      default -> false;
    };
  }

  /**
   * Replaces the child at each location in the sharing ledger with a clone. Every shared subtree
   * is classified before any location is rewritten, so if any of them can't be cloned the tree is
   * left unchanged and false is returned.
   *
   * <p>Integrity checks are disabled while the clones are built and installed.
   */
  @VisibleForTesting
  boolean repair(Bnode node) {
    try (ScopedIntegrityCheckDisabler disabler = new ScopedIntegrityCheckDisabler(builder)) {
      Set<Bexpression> verified = Sets.newIdentityHashSet();
      for (ParentSlot ps : sharing) {
        Bnode child = ps.parent().child(ps.slot());
        Bexpression expr = child.castToBexpression();
        if (expr != null && (verified.contains(expr) || isRepairable(expr))) {
          verified.add(expr);
          continue;
        }
        violations.add(Violation.REPAIR_CLASSIFICATION_FAILURE);
        log.append("error: unrepairable shared subtree at ").append(ps).append('\n');
        dump(child);
        log.append("parent:\n");
        dump(ps.parent());
        return false;
      }
      for (ParentSlot ps : sharing) {
        Bexpression child = (Bexpression) ps.parent().child(ps.slot());
        Bexpression clone = builder.cloneSubtree(child);
        ps.parent().replaceChild(ps.slot(), clone);
        rewirings.add(new Rewiring(child, clone, ps));
      }
      logger.atFine().log(
          "Repaired %s shared locations in #%s: %s",
          sharing.size(), node.id(), lazy(sharing::toString));
      sharing.clear();
      exprShareCount = 0;
      return true;
    }
  }

  private void dumpTag(String tag, String id) {
    log.append(tag).append(": ");
    if (control.dumpPointers() == DumpPointers.DUMP_POINTERS) {
      log.append(id);
    }
    log.append('\n');
  }

  private void dump(Bnode node) {
    dumpTag(node.isStmt() ? "stmt" : "expr", "#" + node.id());
    node.osdump(log, 0, control.dumpPointers() == DumpPointers.DUMP_POINTERS);
  }

  private void dump(AbstractInsnNode inst) {
    dumpTag("inst", StringUtil.id(inst));
    log.append(Instructions.print(inst)).append('\n');
  }
}
