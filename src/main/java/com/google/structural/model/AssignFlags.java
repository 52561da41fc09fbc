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

package com.google.structural.model;

/** Flags that adjust the behaviour of an assignability check. */
public final class AssignFlags {
  public static final int DEFAULT = 0;

  /** Require the source and destination types to be equivalent, e.g. for mutable members. */
  public static final int ENFORCE_INVARIANCE = 1 << 0;

  /**
   * Solve type variables that appear in the source type rather than the destination type. Set
   * when comparing contravariant positions such as callable parameters.
   */
  public static final int REVERSE_TYPE_VAR_MATCHING = 1 << 1;

  /** Keep literal types when solving type variables instead of widening them. */
  public static final int RETAIN_LITERALS_FOR_TYPE_VAR = 1 << 2;

  public static boolean isSet(int flags, int flag) {
    return (flags & flag) == flag;
  }

  private AssignFlags() {}
}
