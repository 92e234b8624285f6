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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.guardflow.GuardLookupException.Reason;
import com.google.guardflow.cfg.BasicBlock;
import com.google.guardflow.cfg.ControlFlowGraph;
import com.google.guardflow.ir.Operation;
import com.google.guardflow.ir.SyntaxNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Answers "which platform check guards this statement?" for a control flow graph.
 *
 * <p>Typical usage:
 *
 * <pre>
 * PlatformCheck guard = new PlatformGuardFinder(options).findGuardForCall(cfg, "WindowsApi");
 * if (guard.isGuaranteed("Windows", false)) { ... }
 * </pre>
 *
 * Lookups that do not resolve to exactly one block throw {@link GuardLookupException}; an unknown
 * guard is a regular result.
 */
public final class PlatformGuardFinder {

  private static final Logger logger = Logger.getLogger(PlatformGuardFinder.class.getName());

  private final GuardAnalysisOptions options;

  public PlatformGuardFinder(GuardAnalysisOptions options) {
    this.options = checkNotNull(options);
  }

  /** Returns the check guaranteed to hold when {@code statement} executes. */
  public PlatformCheck findGuard(ControlFlowGraph cfg, SyntaxNode statement) {
    return findGuard(cfg, findBlock(cfg, statement));
  }

  /** Returns the check guaranteed to hold on entry to {@code block}. */
  public PlatformCheck findGuard(ControlFlowGraph cfg, BasicBlock block) {
    PlatformCheck guard = new PlatformCheckPass(options).analyze(cfg, block);
    logger.fine("Guard of " + block + ": " + guard);
    return guard;
  }

  /** Returns the check guaranteed to hold when the only call to {@code functionName} executes. */
  public PlatformCheck findGuardForCall(ControlFlowGraph cfg, String functionName) {
    return findGuard(cfg, findCallStatement(cfg, functionName));
  }

  /** Returns the unique block holding an operation lowered from {@code statement}. */
  public static BasicBlock findBlock(ControlFlowGraph cfg, SyntaxNode statement) {
    List<BasicBlock> matches = new ArrayList<>();
    for (BasicBlock block : cfg.getBlocks()) {
      for (Operation op : block.getOperations()) {
        if (op.getSyntax() == statement) {
          matches.add(block);
          break;
        }
      }
    }
    if (matches.isEmpty()) {
      throw new GuardLookupException(
          Reason.NOT_FOUND,
          statement.toString(),
          "No block contains the statement '%s'",
          statement);
    }
    if (matches.size() > 1) {
      throw new GuardLookupException(
          Reason.AMBIGUOUS_MATCH,
          statement.toString(),
          "The statement '%s' appears in several blocks: %s",
          statement,
          matches);
    }
    return matches.get(0);
  }

  /** Returns the only call to a function named {@code functionName} in the graph. */
  public static Operation findCall(ControlFlowGraph cfg, String functionName) {
    List<Operation> calls = new ArrayList<>();
    for (BasicBlock block : cfg.getBlocks()) {
      for (Operation op : block.getOperations()) {
        op.forEachDescendant(
            n -> {
              if (n.isCall() && functionName.equals(n.getCalleeName())) {
                calls.add(n);
              }
            });
      }
    }
    if (calls.isEmpty()) {
      throw new GuardLookupException(
          Reason.NOT_FOUND, functionName, "No call to '%s' found", functionName);
    }
    if (calls.size() > 1) {
      throw new GuardLookupException(
          Reason.AMBIGUOUS_MATCH,
          functionName,
          "Found %s calls to '%s'",
          calls.size(),
          functionName);
    }
    return calls.get(0);
  }

  /** Returns the syntax node the front-end gave the id {@code syntaxId}. */
  public static SyntaxNode findSyntax(ControlFlowGraph cfg, String syntaxId) {
    Set<SyntaxNode> matches = new LinkedHashSet<>();
    for (BasicBlock block : cfg.getBlocks()) {
      for (Operation op : block.getOperations()) {
        op.forEachDescendant(
            n -> {
              for (SyntaxNode s = n.getSyntax(); s != null; s = s.getParent()) {
                if (syntaxId.equals(s.getId())) {
                  matches.add(s);
                }
              }
            });
      }
    }
    if (matches.isEmpty()) {
      throw new GuardLookupException(
          Reason.NOT_FOUND, syntaxId, "No syntax node with id '%s'", syntaxId);
    }
    if (matches.size() > 1) {
      throw new GuardLookupException(
          Reason.AMBIGUOUS_MATCH, syntaxId, "Several syntax nodes have the id '%s'", syntaxId);
    }
    return matches.iterator().next();
  }

  /** Returns the nearest statement enclosing {@code syntax}, or {@code syntax} itself. */
  public static @Nullable SyntaxNode enclosingStatement(SyntaxNode syntax) {
    for (SyntaxNode s = syntax; s != null; s = s.getParent()) {
      if (s.isStatement()) {
        return s;
      }
    }
    return null;
  }

  /**
   * Returns the statement containing the only call to {@code functionName}. A call without syntax
   * of its own takes the syntax of the operation it was lowered into.
   */
  public static SyntaxNode findCallStatement(ControlFlowGraph cfg, String functionName) {
    Operation call = findCall(cfg, functionName);
    SyntaxNode syntax = call.getSyntax();
    if (syntax == null) {
      syntax = rootSyntax(cfg, call);
    }
    SyntaxNode statement = syntax == null ? null : enclosingStatement(syntax);
    if (statement == null) {
      throw new GuardLookupException(
          Reason.NOT_FOUND,
          functionName,
          "The call to '%s' is not part of a statement",
          functionName);
    }
    return statement;
  }

  private static @Nullable SyntaxNode rootSyntax(ControlFlowGraph cfg, Operation target) {
    for (BasicBlock block : cfg.getBlocks()) {
      for (Operation op : block.getOperations()) {
        boolean[] found = {false};
        op.forEachDescendant(n -> found[0] |= n == target);
        if (found[0]) {
          return op.getSyntax();
        }
      }
    }
    return null;
  }
}
