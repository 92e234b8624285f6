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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An operation tree construction helper class. */
public class IR {

  private IR() {}

  public static Operation empty() {
    return new Operation(Token.EMPTY, null, ImmutableList.of());
  }

  public static Operation exprResult(Operation expr) {
    checkState(mayBeExpression(expr), expr);
    return unaryOp(Token.EXPR_RESULT, expr);
  }

  public static Operation returnNode() {
    return new Operation(Token.RETURN, null, ImmutableList.of());
  }

  public static Operation returnNode(Operation expr) {
    checkState(mayBeExpression(expr), expr);
    return unaryOp(Token.RETURN, expr);
  }

  public static Operation assign(Operation target, Operation expr) {
    checkState(target.isName() || target.isGetProp(), target);
    checkState(mayBeExpression(expr), expr);
    return binaryOp(Token.ASSIGN, target, expr);
  }

  public static Operation name(String name) {
    checkArgument(
        !name.isEmpty() && name.indexOf('.') == -1,
        "Invalid name '%s'. Did you mean to use IR.getprop?",
        name);
    return new Operation(Token.NAME, name, ImmutableList.of());
  }

  public static Operation getprop(Operation target, String prop, String... moreProps) {
    checkState(mayBeExpression(target));
    Operation result = getpropInternal(target, prop);
    for (String moreProp : moreProps) {
      result = getpropInternal(result, moreProp);
    }
    return result;
  }

  /** Builds a NAME or GETPROP chain from a dotted name such as {@code "OSPlatform.Windows"}. */
  public static Operation qualifiedName(String qname) {
    List<String> parts = ImmutableList.copyOf(qname.split("\\.", -1));
    Operation result = name(parts.get(0));
    for (String part : parts.subList(1, parts.size())) {
      result = getpropInternal(result, part);
    }
    return result;
  }

  private static Operation getpropInternal(Operation target, String prop) {
    checkArgument(!prop.isEmpty(), "Empty property name");
    return new Operation(Token.GETPROP, prop, ImmutableList.of(target));
  }

  public static Operation call(Operation target, Operation... args) {
    ImmutableList.Builder<Operation> children = ImmutableList.builder();
    children.add(target);
    for (Operation arg : args) {
      checkState(mayBeExpression(arg), arg);
      children.add(arg);
    }
    return new Operation(Token.CALL, null, children.build());
  }

  public static Operation cast(Operation expr, String type) {
    checkState(mayBeExpression(expr), expr);
    return new Operation(Token.CAST, type, ImmutableList.of(expr));
  }

  public static Operation string(String s) {
    return new Operation(Token.STRING, s, ImmutableList.of());
  }

  public static Operation number(double d) {
    String text = d == (long) d ? Long.toString((long) d) : Double.toString(d);
    return new Operation(Token.NUMBER, text, ImmutableList.of());
  }

  public static Operation trueNode() {
    return new Operation(Token.TRUE, null, ImmutableList.of());
  }

  public static Operation falseNode() {
    return new Operation(Token.FALSE, null, ImmutableList.of());
  }

  public static Operation nullNode() {
    return new Operation(Token.NULL, null, ImmutableList.of());
  }

  public static Operation not(Operation expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Operation bitnot(Operation expr) {
    return unaryOp(Token.BITNOT, expr);
  }

  public static Operation neg(Operation expr) {
    return unaryOp(Token.NEG, expr);
  }

  public static Operation and(Operation expr1, Operation expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Operation or(Operation expr1, Operation expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Operation bitand(Operation expr1, Operation expr2) {
    return binaryOp(Token.BITAND, expr1, expr2);
  }

  public static Operation bitor(Operation expr1, Operation expr2) {
    return binaryOp(Token.BITOR, expr1, expr2);
  }

  public static Operation eq(Operation expr1, Operation expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  public static Operation ne(Operation expr1, Operation expr2) {
    return binaryOp(Token.NE, expr1, expr2);
  }

  /**
   * "&lt;"
   */
  public static Operation lt(Operation expr1, Operation expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  /**
   * "&gt;"
   */
  public static Operation gt(Operation expr1, Operation expr2) {
    return binaryOp(Token.GT, expr1, expr2);
  }

  public static Operation add(Operation expr1, Operation expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Operation sub(Operation expr1, Operation expr2) {
    return binaryOp(Token.SUB, expr1, expr2);
  }

  /** Creates an operation of any token kind; used by front-ends that map their own trees. */
  public static Operation operation(
      Token token, @Nullable String string, List<Operation> children) {
    if (token == Token.NAME || token == Token.GETPROP) {
      checkArgument(string != null && !string.isEmpty(), "Empty name in %s", token);
    }
    return new Operation(token, string, ImmutableList.copyOf(children));
  }

  private static Operation unaryOp(Token token, Operation expr) {
    checkState(mayBeExpression(expr), expr);
    return new Operation(token, null, ImmutableList.of(expr));
  }

  private static Operation binaryOp(Token token, Operation expr1, Operation expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Operation(token, null, ImmutableList.of(expr1, expr2));
  }

  /**
   * It isn't possible to always determine if a detached operation is an expression, so just
   * reject statements.
   */
  private static boolean mayBeExpression(Operation op) {
    switch (op.getToken()) {
      case EXPR_RESULT:
      case RETURN:
      case EMPTY:
        return false;
      default:
        return true;
    }
  }
}
