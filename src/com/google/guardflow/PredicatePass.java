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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.guardflow.cfg.BasicBlock;
import com.google.guardflow.cfg.ConditionKind;
import com.google.guardflow.cfg.ControlFlowBranch;
import com.google.guardflow.cfg.ControlFlowGraph;
import com.google.guardflow.ir.Operation;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A backward pass that computes the predicate guaranteed to hold whenever control reaches a block.
 *
 * <p>Starting at the target block, the pass walks predecessor branches towards the entry. The
 * state of a branch is the state of its source block, conjoined with the source's branch condition
 * when the branch is taken on a known outcome of that condition. The states of all branches
 * entering a block are combined with {@link #or}.
 *
 * <p>Every block is visited at most once per query. A branch whose source has already been visited
 * (a loop back edge, or a block already reached through another path) contributes nothing. This
 * guarantees termination on cyclic graphs but loses loop-carried facts.
 *
 * <p>A subclass defines the predicate domain:
 *
 * <ol>
 *   <li>{@link #createEmptyState()}: the state of a block nothing is known about.
 *   <li>{@link #createState(boolean, Operation)}: the state implied by taking a branch whose
 *       condition evaluated to true (or false, if negated).
 *   <li>{@link #and}: the state after passing through two constraints.
 *   <li>{@link #or}: the state at a join of two paths.
 * </ol>
 *
 * Passes hold no state between calls to {@link #analyze}.
 *
 * @param <S> The predicate state type.
 */
public abstract class PredicatePass<S> {

  private static final Logger logger = Logger.getLogger(PredicatePass.class.getName());

  protected abstract S createEmptyState();

  protected abstract S createState(boolean negated, Operation condition);

  protected abstract S and(S state1, S state2);

  protected abstract S or(S state1, S state2);

  /** Computes the state guaranteed on entry to {@code block}. */
  public final S analyze(ControlFlowGraph graph, BasicBlock block) {
    checkArgument(graph.containsBlock(block), "%s is not a block of the graph", block);

    Set<BasicBlock> visited = new HashSet<>();
    Deque<Frame<S>> stack = new ArrayDeque<>();
    visited.add(block);
    stack.push(new Frame<>(block));

    while (true) {
      Frame<S> frame = stack.peek();
      ControlFlowBranch predecessor = frame.nextPredecessor(visited);
      if (predecessor != null) {
        BasicBlock source = predecessor.getSource();
        visited.add(source);
        frame.pending = predecessor;
        stack.push(new Frame<>(source));
        continue;
      }

      S state = frame.state != null ? frame.state : createEmptyState();
      stack.pop();
      Frame<S> caller = stack.peek();
      if (caller == null) {
        return state;
      }
      S edgeState = flowAlong(caller.pending, state);
      caller.pending = null;
      caller.state = caller.state == null ? edgeState : or(caller.state, edgeState);
    }
  }

  /** Applies the branch condition of {@code branch}'s source to the state of that source. */
  private S flowAlong(ControlFlowBranch branch, S sourceState) {
    BasicBlock source = branch.getSource();
    Operation condition = source.getBranchValue();
    if (condition == null) {
      return sourceState;
    }

    boolean negated;
    if (branch == source.getConditionalSuccessor()) {
      negated = source.getConditionKind() == ConditionKind.WHEN_FALSE;
    } else if (branch == source.getFallThroughSuccessor()) {
      negated = source.getConditionKind() == ConditionKind.WHEN_TRUE;
    } else {
      return sourceState;
    }
    return and(sourceState, createState(negated, condition));
  }

  /** A block whose predecessors are being walked. */
  private static final class Frame<S> {
    final BasicBlock block;
    int nextIndex = 0;
    @Nullable S state;
    @Nullable ControlFlowBranch pending;

    Frame(BasicBlock block) {
      this.block = block;
    }

    /** Returns the next predecessor whose source has not been visited, skipping the others. */
    @Nullable ControlFlowBranch nextPredecessor(Set<BasicBlock> visited) {
      List<ControlFlowBranch> predecessors = block.getPredecessors();
      while (nextIndex < predecessors.size()) {
        ControlFlowBranch branch = predecessors.get(nextIndex++);
        if (!visited.contains(branch.getSource())) {
          return branch;
        }
        if (logger.isLoggable(Level.FINEST)) {
          logger.finest("Ignoring back edge " + branch);
        }
      }
      return null;
    }
  }
}
