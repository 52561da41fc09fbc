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

package com.google.structural.types;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.structural.sym.Symbol;
import com.google.structural.sym.TyVarSymbol;
import com.google.structural.type.Type;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A substitution context: solutions for the type variables of one or more scopes.
 *
 * <p>Only type variables owned by a solve-for scope may be solved; everything else is left
 * untouched when the context is applied. The synthesized {@code Self} variable is tracked
 * separately and stands for the implementing class wherever it was declared.
 */
public class TypeVarContext {

  private final Set<Symbol> solveForScopes = new LinkedHashSet<>();
  private final Map<TyVarSymbol, Type> solutions = new LinkedHashMap<>();
  private @Nullable Type selfType;

  /** A context that solves nothing. */
  public TypeVarContext() {}

  public TypeVarContext(Symbol solveForScope) {
    solveForScopes.add(solveForScope);
  }

  public void addSolveForScope(Symbol scope) {
    solveForScopes.add(scope);
  }

  public boolean hasSolveForScope(Symbol scope) {
    return solveForScopes.contains(scope);
  }

  public ImmutableSet<Symbol> solveForScopes() {
    return ImmutableSet.copyOf(solveForScopes);
  }

  /** Returns the solution for the given type variable, or {@code null}. */
  public @Nullable Type get(TyVarSymbol sym) {
    return solutions.get(sym);
  }

  public void set(TyVarSymbol sym, Type type) {
    checkArgument(
        hasSolveForScope(sym.owner()), "%s is not in a solve-for scope of this context", sym);
    solutions.put(sym, type);
  }

  public ImmutableMap<TyVarSymbol, Type> solutions() {
    return ImmutableMap.copyOf(solutions);
  }

  /** The type that replaces the synthesized {@code Self} variable, or {@code null}. */
  public @Nullable Type selfType() {
    return selfType;
  }

  public void setSelfType(Type selfType) {
    this.selfType = selfType;
  }

  public boolean isEmpty() {
    return solutions.isEmpty() && selfType == null;
  }

  public TypeVarContext copy() {
    TypeVarContext result = new TypeVarContext();
    result.copyFrom(this);
    return result;
  }

  /** Replaces the state of this context with that of {@code other}. */
  public void copyFrom(TypeVarContext other) {
    solveForScopes.clear();
    solveForScopes.addAll(other.solveForScopes);
    solutions.clear();
    solutions.putAll(other.solutions);
    selfType = other.selfType;
  }

  @Override
  public String toString() {
    return solutions + (selfType != null ? " Self=" + selfType : "");
  }
}
