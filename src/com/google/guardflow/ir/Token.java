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

/**
 * The kinds of {@link Operation} a front-end may hand to the analysis.
 */
public enum Token {
  // Statements
  EXPR_RESULT,
  RETURN,
  ASSIGN,

  // References and literals
  NAME,
  GETPROP,
  STRING,
  NUMBER,
  TRUE,
  FALSE,
  NULL,

  CALL,
  CAST,

  // Unary operators
  NOT,
  BITNOT,
  NEG,

  // Binary operators
  AND,
  OR,
  BITAND,
  BITOR,
  BITXOR,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  ADD,
  SUB,

  EMPTY;

  /** Returns the number of operands the token requires, or -1 if it takes any number. */
  public int arity() {
    switch (this) {
      case NAME:
      case STRING:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
      case EMPTY:
        return 0;
      case EXPR_RESULT:
      case GETPROP:
      case CAST:
      case NOT:
      case BITNOT:
      case NEG:
        return 1;
      case ASSIGN:
      case AND:
      case OR:
      case BITAND:
      case BITOR:
      case BITXOR:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case ADD:
      case SUB:
        return 2;
      case RETURN:
      case CALL:
        return -1;
    }
    throw new IllegalStateException("Unexpected token " + this);
  }

  /** Whether operations of this kind carry a string payload. */
  public boolean hasString() {
    switch (this) {
      case NAME:
      case GETPROP:
      case STRING:
      case NUMBER:
      case CAST:
        return true;
      default:
        return false;
    }
  }
}
