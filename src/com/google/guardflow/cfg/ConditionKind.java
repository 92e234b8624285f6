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

/**
 * Describes when the conditional successor of a {@link BasicBlock} is taken.
 */
public enum ConditionKind {
  /** The block has no conditional successor. */
  NONE,
  /** The conditional successor is taken if the branch value is true. */
  WHEN_TRUE,
  /** The conditional successor is taken if the branch value is false. */
  WHEN_FALSE;

  public boolean isConditional() {
    return this != NONE;
  }
}
