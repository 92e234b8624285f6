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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The edge object for the control flow graph. A branch leaves its source either as the source's
 * conditional successor or as its fall-through successor.
 */
public final class ControlFlowBranch {

  private final BasicBlock source;
  private final BasicBlock destination;
  private final boolean isConditionalSuccessor;

  ControlFlowBranch(BasicBlock source, BasicBlock destination, boolean isConditionalSuccessor) {
    this.source = checkNotNull(source);
    this.destination = checkNotNull(destination);
    this.isConditionalSuccessor = isConditionalSuccessor;
  }

  public BasicBlock getSource() {
    return source;
  }

  public BasicBlock getDestination() {
    return destination;
  }

  public boolean isConditionalSuccessor() {
    return isConditionalSuccessor;
  }

  @Override
  public String toString() {
    return source.getOrdinal()
        + (isConditionalSuccessor ? " -[" + source.getConditionKind() + "]-> " : " -> ")
        + destination.getOrdinal();
  }
}
