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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.guardflow.ir.Operation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Control flow graph of a single procedure, as produced by a front-end.
 *
 * <p>The first block is the entry block. Graphs are read-only once built, so any number of
 * analyses may run over one graph concurrently.
 */
public final class ControlFlowGraph {

  private final ImmutableList<BasicBlock> blocks;

  private ControlFlowGraph(ImmutableList<BasicBlock> blocks) {
    this.blocks = blocks;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** All blocks, indexed by ordinal. */
  public ImmutableList<BasicBlock> getBlocks() {
    return blocks;
  }

  public BasicBlock getBlock(int ordinal) {
    return blocks.get(ordinal);
  }

  public BasicBlock getEntry() {
    return blocks.get(0);
  }

  public boolean containsBlock(BasicBlock block) {
    int ordinal = block.getOrdinal();
    return ordinal < blocks.size() && blocks.get(ordinal) == block;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CFG:\n");
    for (BasicBlock block : blocks) {
      for (ControlFlowBranch branch : successorsOf(block)) {
        sb.append(branch).append('\n');
      }
    }
    return sb.toString();
  }

  static ImmutableList<ControlFlowBranch> successorsOf(BasicBlock block) {
    ImmutableList.Builder<ControlFlowBranch> successors = ImmutableList.builder();
    if (block.getConditionalSuccessor() != null) {
      successors.add(block.getConditionalSuccessor());
    }
    if (block.getFallThroughSuccessor() != null) {
      successors.add(block.getFallThroughSuccessor());
    }
    return successors.build();
  }

  /**
   * Assembles a {@link ControlFlowGraph}. Blocks get ordinals in the order they are added; the
   * entry block must be added first.
   *
   * <p>Typical usage:
   *
   * <pre>
   * ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
   * BasicBlock entry = builder.addEntryBlock();
   * BasicBlock body = builder.addBlock(statement);
   * BasicBlock exit = builder.addExitBlock();
   * builder.setFallThrough(entry, body).setFallThrough(body, exit);
   * ControlFlowGraph cfg = builder.build();
   * </pre>
   */
  public static final class Builder {
    private final List<BasicBlock> blocks = new ArrayList<>();
    private boolean built = false;

    private Builder() {}

    public BasicBlock addEntryBlock() {
      checkState(blocks.isEmpty(), "The entry block must be the first block");
      return newBlock(BasicBlock.Kind.ENTRY, ImmutableList.of());
    }

    public BasicBlock addBlock(Operation... operations) {
      return addBlock(Arrays.asList(operations));
    }

    public BasicBlock addBlock(List<Operation> operations) {
      checkState(!blocks.isEmpty(), "Add the entry block first");
      return newBlock(BasicBlock.Kind.BLOCK, ImmutableList.copyOf(operations));
    }

    public BasicBlock addExitBlock() {
      checkState(!blocks.isEmpty(), "Add the entry block first");
      return newBlock(BasicBlock.Kind.EXIT, ImmutableList.of());
    }

    private BasicBlock newBlock(BasicBlock.Kind kind, ImmutableList<Operation> operations) {
      checkState(!built, "Graph already built");
      BasicBlock block = new BasicBlock(blocks.size(), kind, operations);
      blocks.add(block);
      return block;
    }

    /** Makes {@code destination} the block control falls into when leaving {@code source}. */
    @CanIgnoreReturnValue
    public Builder setFallThrough(BasicBlock source, BasicBlock destination) {
      checkOwned(source);
      checkOwned(destination);
      checkArgument(
          source.getFallThroughSuccessor() == null, "%s already has a fall-through", source);
      checkArgument(source.getKind() != BasicBlock.Kind.EXIT, "The exit block has no successors");
      source.setFallThroughSuccessor(new ControlFlowBranch(source, destination, false));
      return this;
    }

    /**
     * Makes {@code destination} the conditional successor of {@code source}: control moves there
     * when {@code condition} evaluates as {@code kind} demands.
     */
    @CanIgnoreReturnValue
    public Builder setConditional(
        BasicBlock source, BasicBlock destination, ConditionKind kind, Operation condition) {
      checkOwned(source);
      checkOwned(destination);
      checkArgument(kind.isConditional(), "A conditional branch needs a condition kind");
      checkArgument(
          source.getConditionalSuccessor() == null,
          "%s already has a conditional successor",
          source);
      checkArgument(source.getBranchValue() == null, "%s already has a branch value", source);
      checkArgument(source.getKind() != BasicBlock.Kind.EXIT, "The exit block has no successors");
      source.setConditionalSuccessor(new ControlFlowBranch(source, destination, true), kind);
      source.setBranchValue(checkNotNull(condition));
      return this;
    }

    /** Attaches a non-conditional branch value, such as a returned expression, to a block. */
    @CanIgnoreReturnValue
    public Builder setBranchValue(BasicBlock block, Operation value) {
      checkOwned(block);
      checkArgument(block.getBranchValue() == null, "%s already has a branch value", block);
      block.setBranchValue(checkNotNull(value));
      return this;
    }

    public ControlFlowGraph build() {
      checkState(!built, "Graph already built");
      checkState(!blocks.isEmpty(), "A graph needs an entry block");
      built = true;

      List<List<ControlFlowBranch>> predecessors = new ArrayList<>();
      for (int i = 0; i < blocks.size(); i++) {
        predecessors.add(new ArrayList<>());
      }
      for (BasicBlock block : blocks) {
        for (ControlFlowBranch branch : successorsOf(block)) {
          predecessors.get(branch.getDestination().getOrdinal()).add(branch);
        }
      }
      for (BasicBlock block : blocks) {
        block.setPredecessors(ImmutableList.copyOf(predecessors.get(block.getOrdinal())));
      }

      markReachable(blocks.get(0));
      return new ControlFlowGraph(ImmutableList.copyOf(blocks));
    }

    private static void markReachable(BasicBlock entry) {
      Deque<BasicBlock> worklist = new ArrayDeque<>();
      entry.setReachable(true);
      worklist.push(entry);
      while (!worklist.isEmpty()) {
        for (ControlFlowBranch branch : successorsOf(worklist.pop())) {
          BasicBlock destination = branch.getDestination();
          if (!destination.isReachable()) {
            destination.setReachable(true);
            worklist.push(destination);
          }
        }
      }
    }

    private void checkOwned(BasicBlock block) {
      checkState(!built, "Graph already built");
      int ordinal = block.getOrdinal();
      checkArgument(
          ordinal < blocks.size() && blocks.get(ordinal) == block,
          "%s does not belong to this builder",
          block);
    }
  }
}
