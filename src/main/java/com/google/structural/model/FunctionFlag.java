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

/** Function attribute bits. */
public final class FunctionFlag {
  /** A {@code @staticmethod}; never bound to a receiver. */
  public static final int STATIC_METHOD = 0x0001;

  /** A {@code @classmethod}; bound to the class object. */
  public static final int CLASS_METHOD = 0x0002;

  /** A constructor ({@code __new__}), which is bound like a class method when requested. */
  public static final int CONSTRUCTOR_METHOD = 0x0004;

  /** A module-level function or nested function that has no receiver parameter. */
  public static final int NOT_A_METHOD = 0x0008;

  private FunctionFlag() {}
}
