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

package com.google.structural.diag;

/**
 * An unrecoverable failure during type evaluation, e.g. a class that is referenced by a type but
 * missing from the environment.
 *
 * <p>Type mismatches are never reported this way; they are recorded in a {@link
 * DiagnosticAddendum}.
 */
public class TypeEvaluationError extends Error {

  /** An error kind. */
  public enum ErrorKind {
    CLASS_NOT_FOUND("could not resolve class %s"),
    INCONSISTENT_MRO("cannot create consistent method ordering for %s"),
    CYCLIC_HIERARCHY("cycle in class hierarchy: %s"),
    DUPLICATE_BASE_CLASS("duplicate base class %s in %s");

    private final String message;

    ErrorKind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  public static TypeEvaluationError format(ErrorKind kind, Object... args) {
    return new TypeEvaluationError(kind, kind.format(args));
  }

  private final ErrorKind kind;

  private TypeEvaluationError(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
