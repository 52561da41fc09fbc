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

/** Class attribute bits. */
public final class ClassFlag {
  /** The class is a structural protocol. */
  public static final int PROTOCOL = 0x0001;

  /** The class is a structural record with synthesized fields. */
  public static final int TYPED_DICT = 0x0002;

  /** The class is declared in the builtins or typing stubs. */
  public static final int BUILTIN = 0x0004;

  public static final int FINAL = 0x0008;

  private ClassFlag() {}
}
