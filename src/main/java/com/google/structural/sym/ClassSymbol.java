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

package com.google.structural.sym;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * A class symbol.
 *
 * <p>Classes are identified by their fully qualified dotted name, e.g. {@code builtins.int}.
 * Symbols are immutable and do not hold any semantic information: members, ancestors and type
 * parameters are held externally in a {@link com.google.structural.bound.ClassInfo}.
 */
@Immutable
public class ClassSymbol implements Symbol {

  public static final ClassSymbol OBJECT = new ClassSymbol("builtins.object");
  public static final ClassSymbol TYPE = new ClassSymbol("builtins.type");
  public static final ClassSymbol INT = new ClassSymbol("builtins.int");
  public static final ClassSymbol BOOL = new ClassSymbol("builtins.bool");
  public static final ClassSymbol FLOAT = new ClassSymbol("builtins.float");
  public static final ClassSymbol STR = new ClassSymbol("builtins.str");
  public static final ClassSymbol PROTOCOL = new ClassSymbol("typing.Protocol");
  public static final ClassSymbol TYPED_DICT_FALLBACK = new ClassSymbol("typing._TypedDict");

  /** Stand-in type argument used when validating protocol variance. */
  public static final ClassSymbol VARIANCE_DUMMY = new ClassSymbol("<variance>.__varianceDummy");

  private final String qualifiedName;

  public ClassSymbol(String qualifiedName) {
    this.qualifiedName = qualifiedName;
  }

  @Override
  public int hashCode() {
    return qualifiedName.hashCode();
  }

  @Override
  public String toString() {
    return qualifiedName;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof ClassSymbol && qualifiedName.equals(((ClassSymbol) o).qualifiedName);
  }

  /** The fully qualified name of the class. */
  public String qualifiedName() {
    return qualifiedName;
  }

  @Override
  public Kind symKind() {
    return Kind.CLASS;
  }

  public String simpleName() {
    return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
  }

  public String moduleName() {
    int idx = qualifiedName.lastIndexOf('.');
    return idx != -1 ? qualifiedName.substring(0, idx) : "";
  }
}
