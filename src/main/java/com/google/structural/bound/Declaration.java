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

package com.google.structural.bound;

import com.google.auto.value.AutoValue;
import com.google.structural.type.Type;
import org.jspecify.annotations.Nullable;

/** A single declaration of a member symbol. */
@AutoValue
public abstract class Declaration {

  /** The declaration kind. */
  public enum Kind {
    VARIABLE,
    FUNCTION,
    CLASS,
    PARAMETER,
    ALIAS
  }

  public static Declaration create(
      Kind kind, boolean isFinal, @Nullable Type type, @Nullable Type inferredType) {
    return new AutoValue_Declaration(kind, isFinal, type, inferredType);
  }

  /** An annotated variable, e.g. {@code x: int}. */
  public static Declaration variable(Type type) {
    return create(Kind.VARIABLE, false, type, null);
  }

  /** A variable annotated with {@code Final[...]}. */
  public static Declaration finalVariable(Type type) {
    return create(Kind.VARIABLE, true, type, null);
  }

  /** An unannotated variable whose type is inferred from its assigned value. */
  public static Declaration inferredVariable(Type inferredType) {
    return create(Kind.VARIABLE, false, null, inferredType);
  }

  /** A {@code def} statement. */
  public static Declaration function(Type type) {
    return create(Kind.FUNCTION, false, type, null);
  }

  public abstract Kind kind();

  public abstract boolean isFinal();

  /** The declared (annotated) type, or {@code null} if there is no annotation. */
  public abstract @Nullable Type type();

  /** The type inferred from the declaration's value, if any. */
  public abstract @Nullable Type inferredType();

  public boolean hasTypeAnnotation() {
    return type() != null;
  }
}
