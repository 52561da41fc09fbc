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

import com.google.common.collect.ImmutableList;
import com.google.structural.bound.ClassInfo;
import com.google.structural.env.ClassEnv;
import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.FunctionTy;
import com.google.structural.type.Type.OverloadedTy;
import com.google.structural.type.Type.Param;
import com.google.structural.type.Type.PropertyTy;
import com.google.structural.type.Type.TyKind;
import com.google.structural.type.Type.TyVar;
import org.jspecify.annotations.Nullable;

/**
 * Applies type variable solutions to types, and specializes member types for the classes they are
 * accessed through.
 *
 * <p>For example, given:
 *
 * <pre>{@code
 * class Box(Generic[T]):
 *     def get(self) -> T: ...
 * class IntBox(Box[int]): ...
 * }</pre>
 *
 * <p>the type of {@code get} specialized for {@code IntBox} is {@code (self) -> int}.
 */
public class Specialize {

  private final ClassEnv env;

  public Specialize(ClassEnv env) {
    this.env = env;
  }

  /** Replaces every solved type variable in {@code type}. */
  public Type applySolvedTypeVars(Type type, TypeVarContext context) {
    if (context.isEmpty() && context.solveForScopes().isEmpty()) {
      return type;
    }
    switch (type.tyKind()) {
      case NONE_TY:
      case UNKNOWN_TY:
      case MODULE_TY:
        return type;
      case CLASS_TY:
        return applySolvedTypeVars((ClassTy) type, context);
      case TY_VAR:
        return applyTyVar((TyVar) type, context);
      case FUNCTION_TY:
        return applyFunction((FunctionTy) type, context);
      case OVERLOADED_TY:
        {
          ImmutableList.Builder<FunctionTy> overloads = ImmutableList.builder();
          for (FunctionTy overload : ((OverloadedTy) type).overloads()) {
            overloads.add(applyFunction(overload, context));
          }
          return OverloadedTy.create(overloads.build());
        }
      case PROPERTY_TY:
        {
          PropertyTy property = (PropertyTy) type;
          return PropertyTy.create(
              applyFunction(property.getter(), context),
              property.setter() != null ? applyFunction(property.setter(), context) : null,
              property.deleter() != null ? applyFunction(property.deleter(), context) : null);
        }
    }
    throw new AssertionError(type.tyKind());
  }

  /**
   * Replaces solved type variables in the type arguments of a class. A class that has not been
   * specialized is specialized with its own type parameters when the context solves for it.
   */
  public ClassTy applySolvedTypeVars(ClassTy type, TypeVarContext context) {
    ImmutableList<Type> targs = type.targs();
    if (targs == null) {
      if (!context.hasSolveForScope(type.sym())) {
        return type;
      }
      ClassInfo info = env.getInfo(type.sym());
      if (info.typeParameters().isEmpty()) {
        return type;
      }
      targs = ImmutableList.copyOf(info.typeParameters());
    }
    ImmutableList.Builder<Type> args = ImmutableList.builder();
    for (Type arg : targs) {
      args.add(applySolvedTypeVars(arg, context));
    }
    return type.withTypeArguments(args.build());
  }

  private Type applyTyVar(TyVar type, TypeVarContext context) {
    Type replacement = type.isSelf() ? context.selfType() : context.get(type.sym());
    return replacement != null ? replacement : type;
  }

  private FunctionTy applyFunction(FunctionTy type, TypeVarContext context) {
    ImmutableList.Builder<Param> params = ImmutableList.builder();
    for (Param param : type.params()) {
      params.add(param.withType(applySolvedTypeVars(param.type(), context)));
    }
    Type returnType = type.declaredReturnType();
    if (returnType == null && type.inference() != null) {
      // The inferred type may mention the variables being replaced.
      returnType = type.inference().infer();
    }
    return FunctionTy.create(
        type.sym(),
        params.build(),
        returnType != null ? applySolvedTypeVars(returnType, context) : null,
        type.flags(),
        type.inference());
  }

  /** Returns a context holding the type arguments of the given class. */
  public TypeVarContext buildTypeVarContextFromSpecializedClass(ClassTy classType) {
    TypeVarContext context = new TypeVarContext(classType.sym());
    ImmutableList<Type> targs = classType.targs();
    if (targs == null) {
      return context;
    }
    ImmutableList<TyVar> params = env.getInfo(classType.sym()).typeParameters();
    for (int i = 0; i < params.size() && i < targs.size(); i++) {
      context.set(params.get(i).sym(), targs.get(i));
    }
    return context;
  }

  /**
   * Specializes a member type using the type arguments of the class it was found in, and binds
   * {@code Self} to {@code selfClass} if one is given.
   */
  public Type partiallySpecializeType(
      Type type, ClassTy contextClass, @Nullable ClassTy selfClass) {
    if (contextClass.targs() == null && selfClass == null) {
      return type;
    }
    TypeVarContext context = buildTypeVarContextFromSpecializedClass(contextClass);
    if (selfClass != null) {
      populateTypeVarContextForSelfType(context, contextClass, selfClass);
    }
    return applySolvedTypeVars(type, context);
  }

  public Type partiallySpecializeType(Type type, ClassTy contextClass) {
    return partiallySpecializeType(type, contextClass, null);
  }

  /**
   * Expresses an ancestor of {@code srcType}, written in terms of the type parameters of {@code
   * srcType}'s class, with {@code srcType}'s type arguments.
   */
  public ClassTy specializeForBaseClass(ClassTy srcType, ClassTy baseClass) {
    if (baseClass.targs() == null && !baseClass.isSameGenericClass(srcType)) {
      return baseClass;
    }
    return applySolvedTypeVars(baseClass, buildTypeVarContextFromSpecializedClass(srcType));
  }

  /** Binds the synthesized {@code Self} variable to an instance of {@code selfClass}. */
  public static void populateTypeVarContextForSelfType(
      TypeVarContext context, ClassTy contextClass, ClassTy selfClass) {
    context.addSolveForScope(contextClass.sym());
    context.setSelfType(selfClass.asInstance());
  }

  /** Drops {@code *args: P.args} and {@code **kwargs: P.kwargs} from a signature. */
  public static Type removeParamSpecVariadicsFromSignature(Type type) {
    switch (type.tyKind()) {
      case FUNCTION_TY:
        return removeParamSpecVariadics((FunctionTy) type);
      case OVERLOADED_TY:
        {
          ImmutableList.Builder<FunctionTy> overloads = ImmutableList.builder();
          for (FunctionTy overload : ((OverloadedTy) type).overloads()) {
            overloads.add(removeParamSpecVariadics(overload));
          }
          return OverloadedTy.create(overloads.build());
        }
      default:
        return type;
    }
  }

  private static FunctionTy removeParamSpecVariadics(FunctionTy type) {
    ImmutableList.Builder<Param> params = ImmutableList.builder();
    boolean changed = false;
    for (Param param : type.params()) {
      if (param.category() != Param.Category.SIMPLE
          && param.type().tyKind() == TyKind.TY_VAR
          && ((TyVar) param.type()).isParamSpec()) {
        changed = true;
        continue;
      }
      params.add(param);
    }
    return changed ? type.withParams(params.build()) : type;
  }

  /** Returns true if the type is a literal, or (optionally) has a literal type argument. */
  public static boolean containsLiteralType(Type type, boolean includeTypeArgs) {
    if (type.tyKind() != TyKind.CLASS_TY) {
      return false;
    }
    ClassTy classTy = (ClassTy) type;
    if (classTy.literalValue() != null) {
      return true;
    }
    if (includeTypeArgs && classTy.targs() != null) {
      for (Type arg : classTy.targs()) {
        if (containsLiteralType(arg, true)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Widens a literal type to its class, e.g. {@code Literal[3]} to {@code int}. */
  public static Type stripLiteral(Type type) {
    return type.tyKind() == TyKind.CLASS_TY ? ((ClassTy) type).withoutLiteral() : type;
  }

  public ClassEnv env() {
    return env;
  }
}
