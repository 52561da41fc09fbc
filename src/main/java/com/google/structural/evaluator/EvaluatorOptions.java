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

package com.google.structural.evaluator;

import com.google.auto.value.AutoValue;
import com.google.structural.sym.ClassSymbol;
import java.util.Optional;

/** Type evaluation options. */
@AutoValue
public abstract class EvaluatorOptions {

  /**
   * The nesting depth past which assignability checks stop descending and optimistically
   * succeed.
   */
  public abstract int maxTypeRecursionCount();

  /**
   * The placeholder class used in place of a record (TypedDict) class when it is compared against
   * a protocol.
   */
  public abstract Optional<ClassSymbol> typedDictFallback();

  /** Whether keyword-capable parameters must agree by name when comparing callables. */
  public abstract boolean enforceParameterNames();

  public static Builder builder() {
    return new AutoValue_EvaluatorOptions.Builder()
        .maxTypeRecursionCount(14)
        .typedDictFallback(ClassSymbol.TYPED_DICT_FALLBACK)
        .enforceParameterNames(true);
  }

  public static EvaluatorOptions defaults() {
    return builder().build();
  }

  public abstract Builder toBuilder();

  /** A builder for {@link EvaluatorOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder maxTypeRecursionCount(int maxTypeRecursionCount);

    public abstract Builder typedDictFallback(ClassSymbol typedDictFallback);

    public abstract Builder typedDictFallback(Optional<ClassSymbol> typedDictFallback);

    public abstract Builder enforceParameterNames(boolean enforceParameterNames);

    public abstract EvaluatorOptions build();
  }
}
