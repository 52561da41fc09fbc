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

import com.google.structural.bound.ClassInfo;
import com.google.structural.bound.MemberInfo;
import com.google.structural.diag.DiagnosticAddendum;
import com.google.structural.env.ClassEnv;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.PropertyTy;
import com.google.structural.types.ClassMembers.ClassMember;
import com.google.structural.types.Specialize;
import com.google.structural.types.TypeVarContext;
import org.jspecify.annotations.Nullable;

/**
 * The type evaluation services that structural (protocol) assignability is built on.
 *
 * <p>Diagnostic addenda and type variable contexts are optional wherever they are annotated
 * {@code @Nullable}; a {@code null} addendum means the caller does not want an explanation.
 */
public interface TypeEvaluator {

  /** The bound classes visible to this evaluator. */
  ClassEnv env();

  EvaluatorOptions options();

  /** Specialization helpers backed by {@link #env()}. */
  Specialize specialize();

  /** Returns the bound class for the given symbol. */
  default ClassInfo getClassInfo(ClassSymbol sym) {
    return env().getInfo(sym);
  }

  /**
   * Returns true if a value of type {@code src} may be assigned to a location of type {@code
   * dest}, solving type variables of {@code context}'s scopes as a side effect.
   *
   * @param flags {@link com.google.structural.model.AssignFlags} bits
   */
  boolean canAssignType(
      Type dest,
      Type src,
      @Nullable DiagnosticAddendum diag,
      @Nullable TypeVarContext context,
      int flags,
      int recursionCount);

  /** Returns true if the two types are structurally identical. */
  boolean isTypeSame(Type type1, Type type2);

  /**
   * Binds a function or overloaded function to a receiver, removing the receiver parameter where
   * the access binds it.
   *
   * @param baseType the instance or class object the member is accessed through
   * @param memberClass the class that declares the member, used to specialize it
   * @param selfType if present, the class that {@code Self} refers to and whose class object is
   *     the receiver of a metaclass method
   * @return the bound type, or {@code null} if the receiver is not assignable to the function's
   *     first parameter
   */
  @Nullable Type bindFunctionToClassOrObject(
      @Nullable ClassTy baseType,
      Type memberType,
      @Nullable ClassTy memberClass,
      int recursionCount,
      boolean treatConstructorAsClassMember,
      @Nullable ClassTy selfType);

  default @Nullable Type bindFunctionToClassOrObject(
      @Nullable ClassTy baseType,
      Type memberType,
      @Nullable ClassTy memberClass,
      int recursionCount) {
    return bindFunctionToClassOrObject(
        baseType,
        memberType,
        memberClass,
        recursionCount,
        /* treatConstructorAsClassMember= */ false,
        /* selfType= */ null);
  }

  /** Runs return type inference for a function (or each overload) that has not been inferred. */
  void inferReturnTypeIfNecessary(Type type);

  /** Returns true if every accessor the destination property has is matched by the source. */
  boolean canAssignProperty(
      PropertyTy destProperty,
      PropertyTy srcProperty,
      ClassTy destClass,
      ClassTy srcClass,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      @Nullable TypeVarContext selfContext,
      int recursionCount);

  /**
   * Returns the type the property's getter returns, or {@code null} if it is not known and
   * {@code inferIfNeeded} is false.
   */
  @Nullable Type getGetterTypeFromProperty(PropertyTy property, boolean inferIfNeeded);

  /**
   * Compares the type arguments of two specializations of the same class, honouring the declared
   * variance of each type parameter.
   */
  boolean verifyTypeArgumentsAssignable(
      ClassTy dest,
      ClassTy src,
      @Nullable DiagnosticAddendum diag,
      @Nullable TypeVarContext context,
      int flags,
      int recursionCount);

  /** The placeholder class object used for record classes, or {@code null} if unavailable. */
  @Nullable ClassTy getTypedDictClassType();

  /** The declared type of a member, or {@code null} if it has no type annotation. */
  @Nullable Type getDeclaredTypeOfSymbol(MemberInfo symbol);

  /** The declared type of a member, falling back to its inferred type. */
  Type getEffectiveTypeOfSymbol(MemberInfo symbol);

  /** The effective type of a member, specialized for the class it was looked up through. */
  Type getTypeOfMember(ClassMember member);
}
