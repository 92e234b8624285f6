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

package com.google.guardflow.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * A node of the operation tree stored in the basic blocks of a control flow graph.
 *
 * <p>Operations are immutable apart from their syntax reference, which a front-end attaches once
 * after construction. Use {@link IR} to build them.
 */
public final class Operation {

  private final Token token;
  private final ImmutableList<Operation> children;
  private final @Nullable String string;
  private @Nullable SyntaxNode syntax;

  Operation(Token token, @Nullable String string, ImmutableList<Operation> children) {
    this.token = checkNotNull(token);
    int arity = token.arity();
    checkArgument(
        arity < 0 || arity == children.size(),
        "%s takes %s operands, got %s",
        token,
        arity,
        children.size());
    checkArgument(token != Token.CALL || !children.isEmpty(), "CALL needs a target");
    checkArgument(token != Token.RETURN || children.size() <= 1, "RETURN takes one operand");
    checkArgument(
        token.hasString() == (string != null), "Unexpected string payload for %s", token);
    this.string = string;
    this.children = children;
  }

  public Token getToken() {
    return token;
  }

  public ImmutableList<Operation> children() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public Operation getChildAtIndex(int i) {
    return children.get(i);
  }

  public Operation getFirstChild() {
    checkState(hasChildren(), "%s has no children", this);
    return children.get(0);
  }

  public Operation getSecondChild() {
    checkState(children.size() > 1, "%s has no second child", this);
    return children.get(1);
  }

  /**
   * The name of a NAME, the property of a GETPROP, the text of a literal or the target type of a
   * CAST.
   */
  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public @Nullable SyntaxNode getSyntax() {
    return syntax;
  }

  @CanIgnoreReturnValue
  public Operation setSyntax(SyntaxNode syntax) {
    checkState(this.syntax == null, "Syntax already set on %s", this);
    this.syntax = checkNotNull(syntax);
    return this;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isGetProp() {
    return token == Token.GETPROP;
  }

  /** For a CALL, the operation being called. */
  public Operation getCallTarget() {
    checkState(isCall(), "Not a call: %s", this);
    return children.get(0);
  }

  /** For a CALL, the argument operations. */
  public ImmutableList<Operation> getArguments() {
    checkState(isCall(), "Not a call: %s", this);
    return children.subList(1, children.size());
  }

  /**
   * For a CALL, the simple name of the function being called: the name of a NAME target, or the
   * last property of a GETPROP target. Returns null for computed targets.
   */
  public @Nullable String getCalleeName() {
    Operation target = getCallTarget();
    if (target.isName() || target.isGetProp()) {
      return target.getString();
    }
    return null;
  }

  /** Visits this operation and all its descendants in pre-order. */
  public void forEachDescendant(Consumer<Operation> consumer) {
    Deque<Operation> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Operation op = stack.pop();
      consumer.accept(op);
      for (Operation child : op.children.reverse()) {
        stack.push(child);
      }
    }
  }

  @Override
  public String toString() {
    return string == null ? token.toString() : token + " " + string;
  }
}
