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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * A node of the source syntax tree that an {@link Operation} was lowered from.
 *
 * <p>Syntax nodes are compared by identity: two operations belong to the same source construct iff
 * they reference the same {@code SyntaxNode} instance. The front-end owns the syntax tree; the
 * analysis only follows {@link #getParent()} links to find the statement enclosing an expression.
 */
public final class SyntaxNode {

  /** Whether the node is a statement or a part of one. */
  public enum Kind {
    STATEMENT,
    EXPRESSION
  }

  private final Kind kind;
  private final @Nullable String id;
  private final String text;
  private final @Nullable SyntaxNode parent;

  private SyntaxNode(Kind kind, @Nullable String id, String text, @Nullable SyntaxNode parent) {
    this.kind = checkNotNull(kind);
    this.id = id;
    this.text = checkNotNull(text);
    this.parent = parent;
  }

  public static SyntaxNode create(
      Kind kind, @Nullable String id, String text, @Nullable SyntaxNode parent) {
    return new SyntaxNode(kind, id, text, parent);
  }

  public static SyntaxNode statement(String text) {
    return new SyntaxNode(Kind.STATEMENT, null, text, null);
  }

  public static SyntaxNode expression(String text, SyntaxNode parent) {
    return new SyntaxNode(Kind.EXPRESSION, null, text, checkNotNull(parent));
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isStatement() {
    return kind == Kind.STATEMENT;
  }

  /** An optional name the front-end gave this node, used to select targets from the outside. */
  public @Nullable String getId() {
    return id;
  }

  /** The source text of the node. */
  public String getText() {
    return text;
  }

  public @Nullable SyntaxNode getParent() {
    return parent;
  }

  @Override
  public String toString() {
    return id == null ? text : id + ": " + text;
  }
}
