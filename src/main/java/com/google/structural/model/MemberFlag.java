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

/** Member symbol attribute bits. */
public final class MemberFlag {
  /** Declared in the class body, e.g. a method or a class-level annotation. */
  public static final int CLASS_MEMBER = 0x0001;

  /** Assigned through the instance, e.g. {@code self.x = ...} inside a method. */
  public static final int INSTANCE_MEMBER = 0x0002;

  /** Explicitly declared as a class variable. */
  public static final int CLASS_VAR = 0x0004;

  /** Synthesized or special members that take no part in protocol matching. */
  public static final int IGNORED_FOR_PROTOCOL_MATCH = 0x0008;

  private MemberFlag() {}
}
