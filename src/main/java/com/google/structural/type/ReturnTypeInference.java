/*
 * Copyright 2026 Google Inc. All Rights Reserved.
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

package com.google.structural.type;

import static java.util.Objects.requireNonNull;

import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * The pending inferred return type of a function without a return annotation.
 *
 * <p>This is the only mutable state reachable from a {@link Type}: all specialized or bound views
 * of a function share the same slot, so inference runs at most once. Instances compare by
 * identity.
 */
public final class ReturnTypeInference {

  private final Supplier<Type> inferrer;
  private @Nullable Type inferred;
  private boolean inferring;

  public ReturnTypeInference(Supplier<Type> inferrer) {
    this.inferrer = requireNonNull(inferrer);
  }

  /** A slot whose inference already completed. */
  public static ReturnTypeInference of(Type inferred) {
    ReturnTypeInference result = new ReturnTypeInference(() -> inferred);
    result.inferred = inferred;
    return result;
  }

  /** Returns the inferred type, or {@code null} if inference has not run yet. */
  public @Nullable Type inferredType() {
    return inferred;
  }

  public boolean isInferred() {
    return inferred != null;
  }

  /**
   * Runs inference if it has not completed. A re-entrant request for the same function (a
   * function whose body depends on its own return type) yields {@link Type#UNKNOWN}.
   */
  public Type infer() {
    if (inferred != null) {
      return inferred;
    }
    if (inferring) {
      return Type.UNKNOWN;
    }
    inferring = true;
    try {
      inferred = requireNonNull(inferrer.get());
    } finally {
      inferring = false;
    }
    return inferred;
  }

  @Override
  public String toString() {
    return inferred != null ? inferred.toString() : "<pending>";
  }
}
