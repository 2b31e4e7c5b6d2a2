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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.util.Textifier;
import org.objectweb.asm.util.TraceMethodVisitor;

/** Static-only helpers for the ASM instruction nodes attached to {@link Bexpression}s. */
public class Instructions {

  private Instructions() {}

  /** Returns the ASM textual form of a single instruction, without surrounding whitespace. */
  public static String print(AbstractInsnNode insn) {
    Textifier textifier = new Textifier();
    insn.accept(new TraceMethodVisitor(textifier));
    StringWriter sw = new StringWriter();
    textifier.print(new PrintWriter(sw));
    return sw.toString().trim();
  }

  /**
   * Maps each label among {@code insns} to a fresh LabelNode, in the form expected by {@link
   * AbstractInsnNode#clone}. Labels are local to the expression whose instructions contain them.
   */
  static Map<LabelNode, LabelNode> cloneLabels(List<AbstractInsnNode> insns) {
    Map<LabelNode, LabelNode> labels = new HashMap<>();
    for (AbstractInsnNode insn : insns) {
      if (insn instanceof LabelNode label) {
        labels.put(label, new LabelNode());
      }
    }
    return labels;
  }
}
