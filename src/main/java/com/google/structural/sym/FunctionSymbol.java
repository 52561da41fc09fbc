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
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A function symbol, used as the scope of function-level type variables. */
@Immutable
public class FunctionSymbol implements Symbol {

  private final @Nullable ClassSymbol owner;
  private final String name;

  public FunctionSymbol(@Nullable ClassSymbol owner, String name) {
    this.owner = owner;
    this.name = name;
  }

  /** The enclosing class, or {@code null} for module-level functions. */
  public @Nullable ClassSymbol owner() {
    return owner;
  }

  /** The function name. */
  public String name() {
    return name;
  }

  @Override
  public Kind symKind() {
    return Kind.FUNCTION;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, owner);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof FunctionSymbol)) {
      return false;
    }
    FunctionSymbol other = (FunctionSymbol) obj;
    return name.equals(other.name) && Objects.equals(owner, other.owner);
  }

  @Override
  public String toString() {
    return owner != null ? owner + "." + name : name;
  }
}
