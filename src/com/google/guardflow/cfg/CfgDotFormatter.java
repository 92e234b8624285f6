/*
 * Copyright 2026 The Guardflow Authors.
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

package com.google.guardflow.cfg;

import com.google.common.base.CaseFormat;
import com.google.common.base.CharMatcher;
import com.google.guardflow.ir.Operation;
import com.google.guardflow.ir.SyntaxNode;
import java.io.IOException;

/**
 * Prints a control flow graph as a <a href="http://www.graphviz.org">Graphviz</a> dot file.
 *
 * <p>Each block becomes a box labelled with its ordinal and its operations; unreachable blocks are
 * dotted. Each branch becomes an edge labelled with the outcome of the branch value it is taken on
 * and the branch value itself.
 */
public final class CfgDotFormatter {
  private static final String INDENT = "    ";
  private static final String ARROW = " -> ";

  private final Appendable builder;

  private CfgDotFormatter(Appendable builder) {
    this.builder = builder;
  }

  /** Converts a control flow graph to dot. */
  public static String toDot(ControlFlowGraph cfg) {
    StringBuilder builder = new StringBuilder();
    try {
      appendDot(cfg, builder);
    } catch (IOException e) {
      throw new AssertionError("StringBuilder does not throw", e);
    }
    return builder.toString();
  }

  /** Writes the dot representation of a control flow graph to {@code builder}. */
  public static void appendDot(ControlFlowGraph cfg, Appendable builder) throws IOException {
    new CfgDotFormatter(builder).format(cfg);
  }

  private void format(ControlFlowGraph cfg) throws IOException {
    builder.append("digraph G {\n");
    for (BasicBlock block : cfg.getBlocks()) {
      StringBuilder text = new StringBuilder().append(block.getOrdinal()).append('\n');
      for (Operation op : block.getOperations()) {
        appendOperation(op, text);
      }
      builder
          .append(INDENT)
          .append(Integer.toString(block.getOrdinal()))
          .append(" [label = ")
          .append(quote(text.toString()))
          .append(", shape = box, style = ")
          .append(block.isReachable() ? "solid" : "dotted")
          .append("]\n");
    }
    for (BasicBlock block : cfg.getBlocks()) {
      for (ControlFlowBranch branch : ControlFlowGraph.successorsOf(block)) {
        builder
            .append(INDENT)
            .append(Integer.toString(block.getOrdinal()))
            .append(ARROW)
            .append(Integer.toString(branch.getDestination().getOrdinal()))
            .append(" [label = ")
            .append(quote(branchLabel(branch)))
            .append("]\n");
      }
    }
    builder.append("}\n");
  }

  private static String branchLabel(ControlFlowBranch branch) {
    BasicBlock source = branch.getSource();
    StringBuilder label = new StringBuilder();
    if (branch.isConditionalSuccessor()) {
      if (source.getConditionKind().isConditional()) {
        label.append(outcome(source.getConditionKind())).append('\n');
      }
    } else if (source.getConditionKind() == ConditionKind.WHEN_TRUE) {
      label.append(outcome(ConditionKind.WHEN_FALSE)).append('\n');
    }
    Operation branchValue = source.getBranchValue();
    if (branchValue != null) {
      label.append(' ');
      appendOperation(branchValue, label);
    }
    return CharMatcher.whitespace().trimFrom(label);
  }

  private static String outcome(ConditionKind kind) {
    return "[" + CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, kind.name()) + "]";
  }

  private static void appendOperation(Operation op, StringBuilder sb) {
    SyntaxNode syntax = op.getSyntax();
    if (syntax != null) {
      sb.append("// ").append(syntax.getText()).append('\n');
    }
    appendTree(op, 0, sb);
  }

  private static void appendTree(Operation op, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(op).append('\n');
    for (Operation child : op.children()) {
      appendTree(child, depth + 1, sb);
    }
  }

  /** Quotes a multi-line label, left-justifying every line. */
  private static String quote(String text) {
    String escaped =
        CharMatcher.whitespace()
            .trimTrailingFrom(text)
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\l");
    return "\"" + escaped + "\\l\"";
  }
}
