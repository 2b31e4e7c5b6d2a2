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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.irbridge.integrity.TreeIntegrityException;
import org.irbridge.integrity.Violation;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LdcInsnNode;

@RunWith(JUnit4.class)
public class NodeBuilderTest {

  private NodeBuilder nb;

  private final Bvariable p = Bvariable.local("p", "*int64", 1);

  @Before
  public void setup() {
    nb = new NodeBuilder();
  }

  @Test
  public void sharedStatementThrowsWhenBuilt() {
    Bstatement s = nb.mkReturn(nb.mkConst("int64", 0));
    Bstatement unused = nb.mkBlock(ImmutableList.of(s));

    TreeIntegrityException e =
        assertThrows(TreeIntegrityException.class, () -> nb.mkIf(nb.mkVar(p), s, null));
    assertThat(e.violations).containsExactly(Violation.STATEMENT_SHARING);
    assertThat(e.errors).contains("error: stmt has multiple parents");
    // The incremental checker dumps ids.
    assertThat(e.errors).contains("stmt: #" + s.id());
    assertThat(e).hasMessageThat().contains("STATEMENT_SHARING");
  }

  @Test
  public void sharedCallThrowsWhenBuilt() {
    Bexpression call = nb.mkCall("int64", "next", ImmutableList.of());
    Bstatement unused = nb.mkExprStmt(call);

    TreeIntegrityException e =
        assertThrows(TreeIntegrityException.class, () -> nb.mkConversion("int32", call));
    assertThat(e.violations).containsExactly(Violation.UNREPAIRABLE_EXPRESSION_SHARING);
  }

  @Test
  public void repairableSharingIsRepairedWhenBodyIsFinished() {
    Bexpression ptr = nb.mkVar(p);
    Bexpression d1 = nb.mkDeref("int64", ptr);
    // Deferred by the incremental check.
    Bexpression d2 = nb.mkDeref("int64", ptr);
    Bstatement body = nb.mkBlock(ImmutableList.of(nb.mkExprStmt(d1)));
    nb.addStatement(body, nb.mkReturn(d2));

    assertThat(nb.finishFunctionBody(body)).isSameInstanceAs(body);
    assertThat(d1.child(0)).isSameInstanceAs(ptr);
    assertThat(d2.child(0)).isNotSameInstanceAs(ptr);
    assertThat(d2.child(0).toString()).isEqualTo(ptr.toString());
    assertThat(nb.integrityChecksEnabled()).isTrue();

    // A second check finds nothing more to do.
    int numNodes = nb.numNodes();
    nb.finishFunctionBody(body);
    assertThat(nb.numNodes()).isEqualTo(numNodes);
  }

  @Test
  public void finishFunctionBodyThrowsOnStatementSharing() {
    nb.setIntegrityChecks(false);
    Bstatement s = nb.mkGoto("top");
    Bstatement body =
        nb.mkBlock(ImmutableList.of(nb.mkLabel("top"), s, nb.mkIf(nb.mkVar(p), s, null)));
    nb.setIntegrityChecks(true);

    TreeIntegrityException e =
        assertThrows(TreeIntegrityException.class, () -> nb.finishFunctionBody(body));
    assertThat(e.violations).containsExactly(Violation.STATEMENT_SHARING);
    assertThat(e.errors).contains("goto top");
  }

  @Test
  public void rebuildBinaryOpReparentsChildren() {
    Bexpression call = nb.mkCall("int64", "f", ImmutableList.of());
    Bexpression c = nb.mkConst("int64", 2);
    Bexpression sum = nb.mkBinaryOp(Operator.PLUS, call, c);

    // Without detaching, the call (which can't be cloned) would appear to have two parents.
    Bexpression diff = nb.rebuildBinaryOp(sum, Operator.MINUS);
    assertThat(diff.op()).isEqualTo(Operator.MINUS);
    assertThat(diff.child(0)).isSameInstanceAs(call);
    assertThat(diff.child(1)).isSameInstanceAs(c);
    assertThat(diff.instructions()).hasSize(1);
    assertThat(diff.instructions().get(0).getOpcode()).isEqualTo(Opcodes.LSUB);
  }

  @Test
  public void rebuildBinaryOpKeepsExistingSharing() {
    Bexpression call = nb.mkCall("int64", "f", ImmutableList.of());
    Bexpression sum = nb.mkBinaryOp(Operator.PLUS, call, nb.mkConst("int64", 2));
    Bexpression rebuilt = nb.rebuildBinaryOp(sum, Operator.MINUS);
    assertThat(rebuilt.child(0)).isSameInstanceAs(call);

    // The call is attached to rebuilt now, so detaching it from sum again must not forget that.
    TreeIntegrityException e =
        assertThrows(TreeIntegrityException.class, () -> nb.rebuildBinaryOp(sum, Operator.MULT));
    assertThat(e.violations).containsExactly(Violation.UNREPAIRABLE_EXPRESSION_SHARING);
  }

  @Test
  public void cloneSubtreeCopiesAllButModuleScopeValues() {
    Bexpression k = nb.mkModuleConst(10);
    Bexpression field = nb.mkStructField("int64", nb.mkDeref("S", nb.mkVar(p)), 1);
    Bexpression expr = nb.mkBinaryOp(Operator.PLUS, field, k);

    Bexpression copy = nb.cloneSubtree(expr);
    assertThat(copy).isNotSameInstanceAs(expr);
    assertThat(copy.toString()).isEqualTo(expr.toString());
    assertThat(copy.child(0)).isNotSameInstanceAs(expr.child(0));
    assertThat(copy.child(1)).isSameInstanceAs(k);
    AbstractInsnNode insn = copy.instructions().get(0);
    assertThat(insn).isNotSameInstanceAs(expr.instructions().get(0));
    assertThat(Instructions.print(insn)).isEqualTo("LADD");
    assertThat(((Bexpression) copy.child(0)).fieldIndex()).isEqualTo(1);
  }

  @Test
  public void cloneSubtreeRejectsStatements() {
    Bexpression compound = nb.mkCompound(nb.mkLabel("l"), nb.mkConst("int64", 1));
    assertThrows(IllegalArgumentException.class, () -> nb.cloneSubtree(compound));
  }

  @Test
  public void moduleScopeValuesAreCached() {
    Bvariable g = Bvariable.global("g", "int64");
    assertThat(nb.mkModuleConst(3)).isSameInstanceAs(nb.mkModuleConst(3));
    assertThat(nb.mkModuleConst(3)).isNotSameInstanceAs(nb.mkModuleConst(4));
    assertThat(nb.mkGlobalVarRef(g)).isSameInstanceAs(nb.mkGlobalVarRef(g));
    assertThat(nb.moduleScopeValue(nb.mkGlobalVarRef(g))).isTrue();
    assertThat(nb.moduleScopeValue(nb.mkConst("int64", 3))).isFalse();
    assertThat(nb.mkErrorExpr()).isSameInstanceAs(nb.mkErrorExpr());
    assertThrows(IllegalArgumentException.class, () -> nb.mkVar(g));
    assertThrows(IllegalArgumentException.class, () -> nb.mkGlobalVarRef(p));
  }

  @Test
  public void moduleScopeValuesMayHaveManyParents() {
    Bexpression k = nb.mkModuleConst(1);
    Bstatement body = nb.mkBlock(ImmutableList.of());
    for (int i = 0; i < 4; i++) {
      nb.addStatement(body, nb.mkExprStmt(nb.mkBinaryOp(Operator.MULT, nb.mkVar(p), k)));
    }
    int numNodes = nb.numNodes();
    nb.finishFunctionBody(body);
    assertThat(nb.numNodes()).isEqualTo(numNodes);
    assertThat(body.numChildren()).isEqualTo(4);
  }

  @Test
  public void dumpIncludesInstructions() {
    Bexpression expr = nb.mkDeref("int64", nb.mkVar(p));
    assertThat(expr.toString())
        .isEqualTo(
            "deref int64\n"
                + "  | GETFIELD irbridge/Pointer.value : J\n"
                + "  var p *int64\n"
                + "    | LLOAD 1\n");
  }

  @Test
  public void cloneSubtreeRemapsLabels() {
    Bexpression x = nb.mkVar(p);
    LabelNode label = new LabelNode();
    nb.appendInstruction(x, new JumpInsnNode(Opcodes.IFEQ, label));
    nb.appendInstruction(x, label);

    Bexpression copy = nb.cloneSubtree(x);
    assertThat(copy.instructions()).hasSize(3);
    assertThat(copy.instructions()).doesNotContain(null);
    LabelNode copiedLabel = (LabelNode) copy.instructions().get(2);
    assertThat(copiedLabel).isNotSameInstanceAs(label);
    assertThat(((JumpInsnNode) copy.instructions().get(1)).label).isSameInstanceAs(copiedLabel);
    assertThat(copy.toString()).isEqualTo(x.toString());
  }

  @Test
  public void logicalNotFlipsTheLowBit() {
    Bexpression not = nb.mkUnaryOp(Operator.NOT, nb.mkVar(p));
    assertThat(not.instructions()).hasSize(2);
    AbstractInsnNode one = not.instructions().get(0);
    assertThat(one.getOpcode()).isEqualTo(Opcodes.LDC);
    assertThat(((LdcInsnNode) one).cst).isEqualTo(1L);
    assertThat(not.instructions().get(1).getOpcode()).isEqualTo(Opcodes.LXOR);

    Bexpression neg = nb.mkUnaryOp(Operator.NEGATE, nb.mkVar(p));
    assertThat(neg.instructions()).hasSize(1);
    assertThat(neg.instructions().get(0).getOpcode()).isEqualTo(Opcodes.LNEG);
  }
}
