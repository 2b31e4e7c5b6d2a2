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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assume.assumeFalse;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.irbridge.node.Bexpression;
import org.irbridge.node.Bvariable;
import org.irbridge.node.NodeBuilder;
import org.irbridge.node.Operator;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class RepairabilityTest {

  private NodeBuilder nb;
  private Bexpression x;

  @Before
  public void setup() {
    nb = new NodeBuilder(false);
    x = nb.mkVar(Bvariable.local("x", "*S", 1));
  }

  @Test
  public void onlyAdditionAndSubtractionAreRepairable(@TestParameter Operator op) {
    assumeFalse(op.isUnary());
    Bexpression binop = nb.mkBinaryOp(op, x, nb.mkConst("int64", 4));
    boolean expected = (op == Operator.PLUS || op == Operator.MINUS);
    assertThat(IntegrityVisitor.isRepairable(binop)).isEqualTo(expected);
  }

  @Test
  public void unaryOpsAreNotRepairable(@TestParameter({"NOT", "NEGATE"}) Operator op) {
    assertThat(IntegrityVisitor.isRepairable(nb.mkUnaryOp(op, x))).isFalse();
  }

  @Test
  public void whitelistedFlavors() {
    Bexpression field = nb.mkStructField("int64", nb.mkDeref("S", x), 2);
    Bexpression expr =
        nb.mkBinaryOp(Operator.MINUS, nb.mkConversion("int64", field), nb.mkModuleConst(9));
    assertThat(IntegrityVisitor.isRepairable(expr)).isTrue();
  }

  @Test
  public void otherFlavorsAreNotRepairable() {
    Bexpression c = nb.mkConst("int64", 0);
    assertThat(IntegrityVisitor.isRepairable(nb.mkAddress(x))).isFalse();
    assertThat(IntegrityVisitor.isRepairable(nb.mkArrayIndex("int64", x, c))).isFalse();
    assertThat(IntegrityVisitor.isRepairable(nb.mkCall("int64", "f", ImmutableList.of(c))))
        .isFalse();
    assertThat(IntegrityVisitor.isRepairable(nb.mkConditional(c, c, c))).isFalse();
    assertThat(
            IntegrityVisitor.isRepairable(nb.mkCompound(nb.mkLabel("l"), nb.mkConst("int64", 1))))
        .isFalse();
    assertThat(IntegrityVisitor.isRepairable(nb.mkErrorExpr())).isFalse();
  }

  @Test
  public void nestedUnrepairableNodeFails() {
    Bexpression product =
        nb.mkBinaryOp(Operator.MULT, nb.mkDeref("int64", x), nb.mkConst("int64", 3));
    Bexpression expr =
        nb.mkBinaryOp(Operator.PLUS, nb.mkConst("int64", 1), nb.mkConversion("int64", product));
    assertThat(IntegrityVisitor.isRepairable(expr)).isFalse();
  }
}
