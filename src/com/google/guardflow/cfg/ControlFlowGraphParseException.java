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

/** A checked exception used to indicate that a graph description could not be parsed. */
public final class ControlFlowGraphParseException extends Exception {
  private static final long serialVersionUID = 1L;

  public ControlFlowGraphParseException(String message) {
    super(message);
  }

  public ControlFlowGraphParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
