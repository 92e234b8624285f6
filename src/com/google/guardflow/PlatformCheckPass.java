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

import com.google.guardflow.ir.Operation;

/** Computes the {@link PlatformCheck} that holds on entry to a block. */
public final class PlatformCheckPass extends PredicatePass<PlatformCheck> {

  private final PlatformConditionRecognizer recognizer;
  private final boolean mergeAgreeingPaths;

  public PlatformCheckPass() {
    this(new GuardAnalysisOptions());
  }

  public PlatformCheckPass(GuardAnalysisOptions options) {
    this.recognizer = new PlatformConditionRecognizer(options);
    this.mergeAgreeingPaths = options.isMergeAgreeingPaths();
  }

  @Override
  protected PlatformCheck createEmptyState() {
    return PlatformCheck.empty();
  }

  @Override
  protected PlatformCheck createState(boolean negated, Operation condition) {
    return recognizer.recognize(negated, condition);
  }

  @Override
  protected PlatformCheck and(PlatformCheck state1, PlatformCheck state2) {
    return PlatformCheck.and(state1, state2);
  }

  @Override
  protected PlatformCheck or(PlatformCheck state1, PlatformCheck state2) {
    if (mergeAgreeingPaths && state1.isLeaf() && state1.equals(state2)) {
      return state1;
    }
    return PlatformCheck.or(state1, state2);
  }
}
