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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import java.io.Serializable;

/** Options for the platform guard analysis. */
public class GuardAnalysisOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Names of the single-argument functions recognized as platform tests. */
  public static final ImmutableSet<String> DEFAULT_PLATFORM_CHECK_FUNCTIONS =
      ImmutableSet.of("IsOSPlatform", "isOSPlatform", "isPlatform");

  private ImmutableSet<String> platformCheckFunctions = DEFAULT_PLATFORM_CHECK_FUNCTIONS;

  /**
   * When two paths joining at a block establish the same platform test, keep that test instead of
   * giving up. Off by default: joins always produce an unknown check.
   */
  private boolean mergeAgreeingPaths = false;

  public GuardAnalysisOptions() {}

  public void setPlatformCheckFunctions(Iterable<String> names) {
    ImmutableSet<String> functions = ImmutableSet.copyOf(names);
    checkArgument(!functions.isEmpty(), "At least one platform check function is required");
    for (String name : functions) {
      checkArgument(!name.isEmpty(), "Empty platform check function name");
    }
    this.platformCheckFunctions = functions;
  }

  public ImmutableSet<String> getPlatformCheckFunctions() {
    return platformCheckFunctions;
  }

  public void setMergeAgreeingPaths(boolean mergeAgreeingPaths) {
    this.mergeAgreeingPaths = mergeAgreeingPaths;
  }

  public boolean isMergeAgreeingPaths() {
    return mergeAgreeingPaths;
  }
}
