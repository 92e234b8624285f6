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

/**
 * Signals that the target of a guard query could not be resolved to exactly one location in the
 * control flow graph.
 */
public class GuardLookupException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Why the lookup failed. */
  public enum Reason {
    NOT_FOUND,
    AMBIGUOUS_MATCH
  }

  private final Reason reason;
  private final String target;

  GuardLookupException(Reason reason, String target, String message, Object... args) {
    super(String.format(message, args));
    this.reason = reason;
    this.target = target;
  }

  public Reason getReason() {
    return reason;
  }

  /** A description of the statement, call or syntax id that was looked up. */
  public String getTarget() {
    return target;
  }
}
