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

import com.google.common.collect.ImmutableList;
import com.google.guardflow.ir.Operation;
import org.jspecify.annotations.Nullable;

/**
 * A basic block of a {@link ControlFlowGraph}: a straight-line sequence of operations with a
 * single entry and at most two exits.
 *
 * <p>Blocks are wired up by {@link ControlFlowGraph.Builder} and never change once the graph is
 * built.
 */
public final class BasicBlock {

  /** The role of a block in its graph. */
  public enum Kind {
    ENTRY,
    BLOCK,
    EXIT
  }

  private final int ordinal;
  private final Kind kind;
  private final ImmutableList<Operation> operations;

  private ImmutableList<ControlFlowBranch> predecessors = ImmutableList.of();
  private @Nullable ControlFlowBranch conditionalSuccessor;
  private @Nullable ControlFlowBranch fallThroughSuccessor;
  private @Nullable Operation branchValue;
  private ConditionKind conditionKind = ConditionKind.NONE;
  private boolean isReachable;

  BasicBlock(int ordinal, Kind kind, ImmutableList<Operation> operations) {
    this.ordinal = ordinal;
    this.kind = kind;
    this.operations = operations;
  }

  /** The index of this block in {@link ControlFlowGraph#getBlocks()}. */
  public int getOrdinal() {
    return ordinal;
  }

  public Kind getKind() {
    return kind;
  }

  public ImmutableList<Operation> getOperations() {
    return operations;
  }

  /**
   * The branches entering this block, ordered by source ordinal. A source's conditional branch
   * comes before its fall-through branch.
   */
  public ImmutableList<ControlFlowBranch> getPredecessors() {
    return predecessors;
  }

  public @Nullable ControlFlowBranch getConditionalSuccessor() {
    return conditionalSuccessor;
  }

  public @Nullable ControlFlowBranch getFallThroughSuccessor() {
    return fallThroughSuccessor;
  }

  /**
   * The value the block branches on. For a conditional block this is the condition; other blocks
   * may carry a returned or thrown value.
   */
  public @Nullable Operation getBranchValue() {
    return branchValue;
  }

  public ConditionKind getConditionKind() {
    return conditionKind;
  }

  /** Whether control can reach this block from the entry block. */
  public boolean isReachable() {
    return isReachable;
  }

  void setPredecessors(ImmutableList<ControlFlowBranch> predecessors) {
    this.predecessors = predecessors;
  }

  void setConditionalSuccessor(ControlFlowBranch branch, ConditionKind kind) {
    this.conditionalSuccessor = branch;
    this.conditionKind = kind;
  }

  void setFallThroughSuccessor(ControlFlowBranch branch) {
    this.fallThroughSuccessor = branch;
  }

  void setBranchValue(Operation branchValue) {
    this.branchValue = branchValue;
  }

  void setReachable(boolean isReachable) {
    this.isReachable = isReachable;
  }

  @Override
  public String toString() {
    return "B" + ordinal + (kind == Kind.BLOCK ? "" : " [" + kind + "]");
  }
}
