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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.guardflow.ir.IR;
import com.google.guardflow.ir.SyntaxNode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CfgDotFormatter}. */
@RunWith(JUnit4.class)
public final class CfgDotFormatterTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void testEmptyGraph() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock exit = builder.addExitBlock();
    builder.setFallThrough(entry, exit);

    assertThat(CfgDotFormatter.toDot(builder.build()))
        .isEqualTo(
            lines(
                "digraph G {",
                "    0 [label = \"0\\l\", shape = box, style = solid]",
                "    1 [label = \"1\\l\", shape = box, style = solid]",
                "    0 -> 1 [label = \"\\l\"]",
                "}"));
  }

  @Test
  public void testConditionalGraph() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock test = builder.addBlock();
    BasicBlock body =
        builder.addBlock(
            IR.exprResult(IR.call(IR.name("f"))).setSyntax(SyntaxNode.statement("f();")));
    BasicBlock exit = builder.addExitBlock();
    builder
        .setFallThrough(entry, test)
        .setConditional(test, exit, ConditionKind.WHEN_FALSE, IR.name("x"))
        .setFallThrough(test, body)
        .setFallThrough(body, exit);

    assertThat(CfgDotFormatter.toDot(builder.build()))
        .isEqualTo(
            lines(
                "digraph G {",
                "    0 [label = \"0\\l\", shape = box, style = solid]",
                "    1 [label = \"1\\l\", shape = box, style = solid]",
                "    2 [label = \"2\\l// f();\\lEXPR_RESULT\\l    CALL\\l        NAME f\\l\","
                    + " shape = box, style = solid]",
                "    3 [label = \"3\\l\", shape = box, style = solid]",
                "    0 -> 1 [label = \"\\l\"]",
                "    1 -> 3 [label = \"[WhenFalse]\\l NAME x\\l\"]",
                "    1 -> 2 [label = \"NAME x\\l\"]",
                "    2 -> 3 [label = \"\\l\"]",
                "}"));
  }

  @Test
  public void testFallThroughOfWhenTrueBranch() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock exit = builder.addExitBlock();
    builder
        .setConditional(entry, exit, ConditionKind.WHEN_TRUE, IR.name("x"))
        .setFallThrough(entry, exit);

    String dot = CfgDotFormatter.toDot(builder.build());

    assertThat(dot).contains("    0 -> 1 [label = \"[WhenTrue]\\l NAME x\\l\"]\n");
    assertThat(dot).contains("    0 -> 1 [label = \"[WhenFalse]\\l NAME x\\l\"]\n");
  }

  @Test
  public void testUnreachableBlockIsDotted() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    builder.addEntryBlock();
    builder.addExitBlock();

    assertThat(CfgDotFormatter.toDot(builder.build()))
        .contains("    1 [label = \"1\\l\", shape = box, style = dotted]");
  }

  @Test
  public void testEscapesQuotes() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock body = builder.addBlock(IR.exprResult(IR.string("a\"b\\c")));
    builder.setFallThrough(entry, body);

    assertThat(CfgDotFormatter.toDot(builder.build()))
        .contains("1\\lEXPR_RESULT\\l    STRING a\\\"b\\\\c\\l");
  }
}
