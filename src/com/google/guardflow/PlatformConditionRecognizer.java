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

import com.google.common.collect.ImmutableSet;
import com.google.guardflow.ir.Operation;
import java.util.Map;

/**
 * Translates a branch condition into a {@link PlatformCheck}.
 *
 * <p>Recognized conditions are calls such as {@code IsOSPlatform(OSPlatform.Windows)}, whose
 * single argument is a member reference naming the platform, combined with logical or bitwise
 * negation and conjunction. Disjunctions, comparisons and all other operations are unknown.
 *
 * <p>The argument must be a GETPROP: a bare NAME such as {@code isPlatform(Windows)} is unknown.
 * Front-ends lower a resolved platform constant to a GETPROP on its declaring type.
 */
final class PlatformConditionRecognizer {

  private final ImmutableSet<String> platformCheckFunctions;

  PlatformConditionRecognizer(GuardAnalysisOptions options) {
    this.platformCheckFunctions = options.getPlatformCheckFunctions();
  }

  /** Recognizes {@code condition}, negating the result if the branch is taken when it fails. */
  PlatformCheck recognize(boolean negated, Operation condition) {
    PlatformCheck result = recognize(condition);
    return negated ? PlatformCheck.negate(result) : result;
  }

  /** Conjoins the checks for a sequence of (negated, condition) pairs. */
  PlatformCheck recognizeAll(Iterable<Map.Entry<Boolean, Operation>> conditions) {
    PlatformCheck result = PlatformCheck.empty();
    for (Map.Entry<Boolean, Operation> entry : conditions) {
      result = PlatformCheck.and(result, recognize(entry.getKey(), entry.getValue()));
    }
    return result;
  }

  PlatformCheck recognize(Operation condition) {
    switch (condition.getToken()) {
      case NOT:
      case BITNOT:
        return PlatformCheck.negate(recognize(condition.getFirstChild()));

      case AND:
      case BITAND:
        return PlatformCheck.and(
            recognize(condition.getFirstChild()), recognize(condition.getSecondChild()));

      case CALL:
        return recognizeCall(condition);

      default:
        return PlatformCheck.unknown();
    }
  }

  private PlatformCheck recognizeCall(Operation call) {
    String callee = call.getCalleeName();
    if (callee == null || !platformCheckFunctions.contains(callee)) {
      return PlatformCheck.unknown();
    }
    if (call.getArguments().size() != 1) {
      return PlatformCheck.unknown();
    }
    Operation argument = call.getArguments().get(0);
    if (!argument.isGetProp() || argument.getString().isEmpty()) {
      return PlatformCheck.unknown();
    }
    return PlatformCheck.of(argument.getString());
  }
}
