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

package com.google.guardflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.guardflow.GuardLookupException.Reason;
import com.google.guardflow.cfg.BasicBlock;
import com.google.guardflow.cfg.ConditionKind;
import com.google.guardflow.cfg.ControlFlowGraph;
import com.google.guardflow.ir.IR;
import com.google.guardflow.ir.Operation;
import com.google.guardflow.ir.SyntaxNode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PlatformGuardFinder}. */
@RunWith(JUnit4.class)
public final class PlatformGuardFinderTest {

  private SyntaxNode ifStatement;
  private SyntaxNode targetStatement;
  private SyntaxNode targetCall;
  private SyntaxNode otherStatement;
  private ControlFlowGraph cfg;
  private BasicBlock targetBlock;

  /**
   * <pre>
   * if (RuntimeInformation.IsOSPlatform(OSPlatform.Windows)) {
   *   target();
   * }
   * other();
   * </pre>
   */
  @Before
  public void setUp() {
    ifStatement =
        SyntaxNode.create(SyntaxNode.Kind.STATEMENT, "s1", "if (IsOSPlatform(Windows))", null);
    targetStatement = SyntaxNode.create(SyntaxNode.Kind.STATEMENT, "s2", "target();", ifStatement);
    targetCall = SyntaxNode.create(SyntaxNode.Kind.EXPRESSION, "e1", "target()", targetStatement);
    otherStatement = SyntaxNode.create(SyntaxNode.Kind.STATEMENT, "s3", "other();", null);

    Operation condition =
        IR.call(
            IR.getprop(IR.name("RuntimeInformation"), "IsOSPlatform"),
            IR.getprop(IR.name("OSPlatform"), "Windows"));
    condition.setSyntax(SyntaxNode.expression("IsOSPlatform(Windows)", ifStatement));

    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock test = builder.addBlock();
    targetBlock =
        builder.addBlock(
            IR.exprResult(IR.call(IR.name("target")).setSyntax(targetCall))
                .setSyntax(targetStatement));
    BasicBlock otherBlock =
        builder.addBlock(IR.exprResult(IR.call(IR.name("other"))).setSyntax(otherStatement));
    BasicBlock exit = builder.addExitBlock();
    builder
        .setFallThrough(entry, test)
        .setConditional(test, otherBlock, ConditionKind.WHEN_FALSE, condition)
        .setFallThrough(test, targetBlock)
        .setFallThrough(targetBlock, otherBlock)
        .setFallThrough(otherBlock, exit);
    cfg = builder.build();
  }

  private PlatformGuardFinder newFinder() {
    return new PlatformGuardFinder(new GuardAnalysisOptions());
  }

  @Test
  public void testFindBlock() {
    assertThat(PlatformGuardFinder.findBlock(cfg, targetStatement)).isSameInstanceAs(targetBlock);
  }

  @Test
  public void testFindBlockNotFound() {
    SyntaxNode missing = SyntaxNode.statement("missing();");

    GuardLookupException e =
        assertThrows(
            GuardLookupException.class, () -> PlatformGuardFinder.findBlock(cfg, missing));
    assertThat(e.getReason()).isEqualTo(Reason.NOT_FOUND);
    assertThat(e.getTarget()).isEqualTo("missing();");
  }

  @Test
  public void testFindBlockComparesIdentity() {
    SyntaxNode lookalike = SyntaxNode.create(SyntaxNode.Kind.STATEMENT, "s2", "target();", null);

    GuardLookupException e =
        assertThrows(
            GuardLookupException.class, () -> PlatformGuardFinder.findBlock(cfg, lookalike));
    assertThat(e.getReason()).isEqualTo(Reason.NOT_FOUND);
  }

  @Test
  public void testFindBlockAmbiguous() {
    SyntaxNode shared = SyntaxNode.statement("for (;;) {}");
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock first = builder.addBlock(IR.exprResult(IR.name("i")).setSyntax(shared));
    BasicBlock second = builder.addBlock(IR.exprResult(IR.name("j")).setSyntax(shared));
    builder.addExitBlock();
    builder.setFallThrough(entry, first).setFallThrough(first, second);
    ControlFlowGraph graph = builder.build();

    GuardLookupException e =
        assertThrows(
            GuardLookupException.class, () -> PlatformGuardFinder.findBlock(graph, shared));
    assertThat(e.getReason()).isEqualTo(Reason.AMBIGUOUS_MATCH);
    assertThat(e).hasMessageThat().contains("B1");
    assertThat(e).hasMessageThat().contains("B2");
  }

  @Test
  public void testFindCall() {
    Operation call = PlatformGuardFinder.findCall(cfg, "target");

    assertThat(call.isCall()).isTrue();
    assertThat(call.getSyntax()).isSameInstanceAs(targetCall);
  }

  @Test
  public void testFindCallNotFound() {
    GuardLookupException e =
        assertThrows(
            GuardLookupException.class, () -> PlatformGuardFinder.findCall(cfg, "missing"));
    assertThat(e.getReason()).isEqualTo(Reason.NOT_FOUND);
    assertThat(e.getTarget()).isEqualTo("missing");
  }

  @Test
  public void testFindCallAmbiguous() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock block =
        builder.addBlock(
            IR.exprResult(IR.call(IR.name("f"))), IR.exprResult(IR.call(IR.name("f"))));
    builder.addExitBlock();
    builder.setFallThrough(entry, block);
    ControlFlowGraph graph = builder.build();

    GuardLookupException e =
        assertThrows(GuardLookupException.class, () -> PlatformGuardFinder.findCall(graph, "f"));
    assertThat(e.getReason()).isEqualTo(Reason.AMBIGUOUS_MATCH);
    assertThat(e).hasMessageThat().isEqualTo("Found 2 calls to 'f'");
  }

  @Test
  public void testFindCallMatchesQualifiedCallee() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    Operation call = IR.call(IR.getprop(IR.name("Console"), "WriteLine"), IR.string("hi"));
    BasicBlock block = builder.addBlock(IR.exprResult(call));
    builder.addExitBlock();
    builder.setFallThrough(entry, block);
    ControlFlowGraph graph = builder.build();

    assertThat(PlatformGuardFinder.findCall(graph, "WriteLine")).isSameInstanceAs(call);
  }

  @Test
  public void testFindSyntax() {
    assertThat(PlatformGuardFinder.findSyntax(cfg, "s2")).isSameInstanceAs(targetStatement);
    assertThat(PlatformGuardFinder.findSyntax(cfg, "e1")).isSameInstanceAs(targetCall);
    assertThat(PlatformGuardFinder.findSyntax(cfg, "s1")).isSameInstanceAs(ifStatement);
  }

  @Test
  public void testFindSyntaxNotFound() {
    GuardLookupException e =
        assertThrows(GuardLookupException.class, () -> PlatformGuardFinder.findSyntax(cfg, "s9"));
    assertThat(e.getReason()).isEqualTo(Reason.NOT_FOUND);
  }

  @Test
  public void testEnclosingStatement() {
    assertThat(PlatformGuardFinder.enclosingStatement(targetCall))
        .isSameInstanceAs(targetStatement);
    assertThat(PlatformGuardFinder.enclosingStatement(targetStatement))
        .isSameInstanceAs(targetStatement);
    SyntaxNode orphan = SyntaxNode.create(SyntaxNode.Kind.EXPRESSION, null, "x", null);
    assertThat(PlatformGuardFinder.enclosingStatement(orphan)).isNull();
  }

  @Test
  public void testFindCallStatement() {
    assertThat(PlatformGuardFinder.findCallStatement(cfg, "target"))
        .isSameInstanceAs(targetStatement);
  }

  @Test
  public void testFindCallStatementWithoutSyntax() {
    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    BasicBlock entry = builder.addEntryBlock();
    BasicBlock block = builder.addBlock(IR.exprResult(IR.call(IR.name("f"))));
    builder.addExitBlock();
    builder.setFallThrough(entry, block);
    ControlFlowGraph graph = builder.build();

    GuardLookupException e =
        assertThrows(
            GuardLookupException.class, () -> PlatformGuardFinder.findCallStatement(graph, "f"));
    assertThat(e.getReason()).isEqualTo(Reason.NOT_FOUND);
  }

  @Test
  public void testFindGuard() {
    PlatformGuardFinder finder = newFinder();

    assertThat(finder.findGuard(cfg, targetStatement)).isEqualTo(PlatformCheck.of("Windows"));
    assertThat(finder.findGuard(cfg, otherStatement)).isEqualTo(PlatformCheck.unknown());
  }

  @Test
  public void testFindGuardForCall() {
    PlatformGuardFinder finder = newFinder();

    assertThat(finder.findGuardForCall(cfg, "target")).isEqualTo(PlatformCheck.of("Windows"));
    assertThat(finder.findGuardForCall(cfg, "other").isGuaranteed("Windows", false)).isFalse();
  }

  @Test
  public void testFindGuardWithConfiguredFunctions() {
    GuardAnalysisOptions options = new GuardAnalysisOptions();
    options.setPlatformCheckFunctions(ImmutableList.of("isLinux"));
    PlatformGuardFinder finder = new PlatformGuardFinder(options);

    assertThat(finder.findGuardForCall(cfg, "target")).isEqualTo(PlatformCheck.unknown());
  }
}
