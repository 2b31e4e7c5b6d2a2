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

/**
 * A Bnode is one element of the IR tree built by a {@link NodeBuilder}: either a {@link
 * Bexpression} or a {@link Bstatement}. Each Bnode has a {@link NodeFlavor} and an ordered list of
 * children.
 *
 * <p>The tree is expected to be a strict tree: apart from module-scope values, each node should be
 * reachable from exactly one (parent, slot) location. The builder does not enforce this when nodes
 * are created; see {@link org.irbridge.integrity.IntegrityVisitor}.
 *
 * <p>Bnodes do not override {@code equals()} or {@code hashCode()}; two distinct nodes with the
 * same structure are never equal.
 */
public abstract class Bnode {

  /** A stable handle for this node, unique within its NodeBuilder. */
  private final int id;

  private final NodeFlavor flavor;

  private final List<Bnode> kids;

  Bnode(int id, NodeFlavor flavor, List<? extends Bnode> kids) {
    this.id = id;
    this.flavor = flavor;
    this.kids = new ArrayList<>(kids);
  }

  public final int id() {
    return id;
  }

  public final NodeFlavor flavor() {
    return flavor;
  }

  /** True if this is a {@link Bstatement}. */
  public abstract boolean isStmt();

  /** Returns this node as a Bexpression, or null if it is a statement. */
  public @Nullable Bexpression castToBexpression() {
    return null;
  }

  /** Returns an unmodifiable view of this node's children. */
  public final List<Bnode> children() {
    return Collections.unmodifiableList(kids);
  }

  public final int numChildren() {
    return kids.size();
  }

  public final Bnode child(int slot) {
    return kids.get(slot);
  }

  /**
   * Replaces the child at {@code slot}. No integrity tracking is done here; callers that rewire
   * tracked nodes are responsible for keeping the trackers consistent.
   */
  public final void replaceChild(int slot, Bnode newChild) {
    Preconditions.checkElementIndex(slot, kids.size());
    kids.set(slot, Preconditions.checkNotNull(newChild));
  }

  /** Appends a child; only used by the builder when extending a block. */
  final void appendChild(Bnode newChild) {
    kids.add(newChild);
  }

  /** Returns a one-line description of this node, not including its children. */
  abstract String describe();

  /**
   * Appends a description of this node and its subtree to {@code sb}, one node per line, indented
   * by depth. If {@code includeIds} is true each line ends with the node's id.
   */
  public void osdump(StringBuilder sb, int depth, boolean includeIds) {
    StringUtil.indent(sb, depth).append(describe());
    if (includeIds) {
      sb.append(" #").append(id);
    }
    sb.append('\n');
    dumpExtras(sb, depth + 1);
    for (Bnode kid : kids) {
      kid.osdump(sb, depth + 1, includeIds);
    }
  }

  /** Subclasses may append additional lines (indented to {@code depth}) after the node itself. */
  void dumpExtras(StringBuilder sb, int depth) {}

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    osdump(sb, 0, false);
    return sb.toString();
  }
}
