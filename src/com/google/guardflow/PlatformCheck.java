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

import com.google.auto.value.AutoValue;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * What is known about the platform at a program point.
 *
 * <p>A check is either <i>empty</i> (no constraint was found), <i>unknown</i> (constraints were
 * found but cannot be expressed as a single platform test), or a leaf: the named platform test
 * held, or did not hold if negated, on every path reaching the point.
 */
@AutoValue
public abstract class PlatformCheck implements Serializable {

  /** The shape of a {@link PlatformCheck}. */
  public enum Kind {
    EMPTY,
    UNKNOWN,
    LEAF
  }

  private static final PlatformCheck EMPTY = new AutoValue_PlatformCheck(Kind.EMPTY, null, false);
  private static final PlatformCheck UNKNOWN =
      new AutoValue_PlatformCheck(Kind.UNKNOWN, null, false);

  public abstract Kind getKind();

  /** The platform name of a leaf; null otherwise. */
  public abstract @Nullable String getPlatform();

  /** Whether a leaf states that the platform test failed. Always false for non-leaves. */
  public abstract boolean isNegated();

  public static PlatformCheck empty() {
    return EMPTY;
  }

  public static PlatformCheck unknown() {
    return UNKNOWN;
  }

  /** The fact that the named platform test succeeded. */
  public static PlatformCheck of(String platform) {
    return leaf(platform, false);
  }

  static PlatformCheck leaf(String platform, boolean negated) {
    checkArgument(!platform.isEmpty(), "Empty platform name");
    return new AutoValue_PlatformCheck(Kind.LEAF, platform, negated);
  }

  public final boolean isEmpty() {
    return getKind() == Kind.EMPTY;
  }

  public final boolean isUnknown() {
    return getKind() == Kind.UNKNOWN;
  }

  public final boolean isLeaf() {
    return getKind() == Kind.LEAF;
  }

  /**
   * Whether this check proves that the platform test for {@code platform} had the given outcome.
   * Empty and unknown checks prove nothing.
   */
  public final boolean isGuaranteed(String platform, boolean negated) {
    return isLeaf() && platform.equals(getPlatform()) && isNegated() == negated;
  }

  public static PlatformCheck negate(PlatformCheck check) {
    if (!check.isLeaf()) {
      return check;
    }
    return leaf(check.getPlatform(), !check.isNegated());
  }

  /**
   * Both checks hold. Conjunctions of two different platform tests are not representable and
   * become unknown.
   */
  public static PlatformCheck and(PlatformCheck left, PlatformCheck right) {
    if (left.isEmpty()) {
      return right;
    }
    if (right.isEmpty()) {
      return left;
    }
    if (left.equals(right) && left.isLeaf()) {
      return left;
    }
    return UNKNOWN;
  }

  /**
   * One of the checks holds. A single platform test can only be claimed when every path agrees,
   * and no attempt is made to prove that here: the result is always unknown.
   */
  public static PlatformCheck or(PlatformCheck left, PlatformCheck right) {
    return UNKNOWN;
  }

  @Override
  public final String toString() {
    switch (getKind()) {
      case EMPTY:
        return "<empty>";
      case UNKNOWN:
        return "<unknown>";
      case LEAF:
        return (isNegated() ? "!" : "") + getPlatform();
    }
    throw new AssertionError(getKind());
  }
}
