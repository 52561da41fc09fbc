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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.structural.bound.ClassInfo;
import com.google.structural.bound.Declaration;
import com.google.structural.bound.MemberInfo;
import com.google.structural.diag.AddendumMessage.Kind;
import com.google.structural.diag.DiagnosticAddendum;
import com.google.structural.env.ClassEnv;
import com.google.structural.model.AssignFlags;
import com.google.structural.model.FunctionFlag;
import com.google.structural.protocols.ProtocolAssignability;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.FunctionTy;
import com.google.structural.type.Type.ModuleTy;
import com.google.structural.type.Type.OverloadedTy;
import com.google.structural.type.Type.Param;
import com.google.structural.type.Type.PropertyTy;
import com.google.structural.type.Type.TyKind;
import com.google.structural.type.Type.TyVar;
import com.google.structural.types.ClassMembers;
import com.google.structural.types.ClassMembers.ClassMember;
import com.google.structural.types.Specialize;
import com.google.structural.types.TypeVarContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TypeEvaluator} over an environment of bound classes.
 *
 * <p>Assignability is nominal where the source class derives from the destination class, and
 * structural where the destination is a protocol. Type variables are solved into the given
 * context: for a destination type variable the source is a lower bound, and with {@link
 * AssignFlags#REVERSE_TYPE_VAR_MATCHING} (parameter positions) a source type variable is bounded
 * above by the destination.
 */
public class BasicTypeEvaluator implements TypeEvaluator {

  private final Logger logger = LoggerFactory.getLogger(BasicTypeEvaluator.class);

  private final ClassEnv env;
  private final EvaluatorOptions options;
  private final Specialize specialize;
  private final ProtocolAssignability protocols;

  public BasicTypeEvaluator(ClassEnv env, EvaluatorOptions options) {
    this.env = env.withClasses(syntheticClasses());
    this.options = options;
    this.specialize = new Specialize(this.env);
    this.protocols = new ProtocolAssignability(this);
  }

  public BasicTypeEvaluator(ClassEnv env) {
    this(env, EvaluatorOptions.defaults());
  }

  /** Classes the evaluator synthesizes for its own use. */
  private static ImmutableMap<ClassSymbol, ClassInfo> syntheticClasses() {
    ClassInfo varianceDummy =
        ClassInfo.builder(ClassSymbol.VARIANCE_DUMMY)
            .baseClasses(ImmutableList.of(ClassTy.OBJECT.asInstantiable()))
            .mro(
                ImmutableList.of(
                    ClassTy.instantiable(ClassSymbol.VARIANCE_DUMMY),
                    ClassTy.OBJECT.asInstantiable()))
            .build();
    return ImmutableMap.of(ClassSymbol.VARIANCE_DUMMY, varianceDummy);
  }

  @Override
  public ClassEnv env() {
    return env;
  }

  @Override
  public EvaluatorOptions options() {
    return options;
  }

  @Override
  public Specialize specialize() {
    return specialize;
  }

  /** The protocol assignability checks, and their in-flight comparisons. */
  public ProtocolAssignability protocols() {
    return protocols;
  }

  @Override
  public boolean canAssignType(
      Type dest,
      Type src,
      @Nullable DiagnosticAddendum diag,
      @Nullable TypeVarContext typeVarContext,
      int flags,
      int recursionCount) {
    if (recursionCount > options.maxTypeRecursionCount()) {
      return true;
    }
    recursionCount++;
    if (dest.equals(src)) {
      return true;
    }
    if (dest.tyKind() == TyKind.UNKNOWN_TY || src.tyKind() == TyKind.UNKNOWN_TY) {
      return true;
    }
    TypeVarContext context = typeVarContext != null ? typeVarContext : new TypeVarContext();
    boolean reverse = AssignFlags.isSet(flags, AssignFlags.REVERSE_TYPE_VAR_MATCHING);
    if (!reverse && isSolvable(dest, context)) {
      return assignToTypeVar(
          (TyVar) dest, src, /* upperBound= */ false, diag, context, flags, recursionCount);
    }
    if (reverse && isSolvable(src, context)) {
      return assignToTypeVar(
          (TyVar) src, dest, /* upperBound= */ true, diag, context, flags, recursionCount);
    }
    if (AssignFlags.isSet(flags, AssignFlags.ENFORCE_INVARIANCE)) {
      return assignInvariant(dest, src, diag, context, flags, recursionCount);
    }
    if (src.tyKind() == TyKind.TY_VAR) {
      if (dest.tyKind() == TyKind.TY_VAR) {
        return reportMismatch(diag, dest, src);
      }
      // An unsolved type variable may stand for any object.
      return canAssignType(dest, ClassTy.OBJECT, diag, context, flags, recursionCount);
    }
    switch (dest.tyKind()) {
      case CLASS_TY:
        return assignToClass((ClassTy) dest, src, diag, context, flags, recursionCount);
      case FUNCTION_TY:
        return assignToFunction((FunctionTy) dest, src, diag, context, flags, recursionCount);
      case OVERLOADED_TY:
        {
          boolean assignable = true;
          for (FunctionTy overload : ((OverloadedTy) dest).overloads()) {
            DiagnosticAddendum child = diag != null ? diag.createAddendum() : null;
            if (!canAssignType(overload, src, child, context, flags, recursionCount)) {
              if (child != null) {
                child.addMessage(Kind.OVERLOAD_NOT_ASSIGNABLE, overload);
              }
              assignable = false;
            }
          }
          return assignable;
        }
      case PROPERTY_TY:
        if (src.tyKind() == TyKind.PROPERTY_TY) {
          Type destGetter = getGetterTypeFromProperty((PropertyTy) dest, true);
          Type srcGetter = getGetterTypeFromProperty((PropertyTy) src, true);
          return canAssignType(destGetter, srcGetter, diag, context, flags, recursionCount);
        }
        return reportMismatch(diag, dest, src);
      case TY_VAR:
      case NONE_TY:
      case MODULE_TY:
        return reportMismatch(diag, dest, src);
      case UNKNOWN_TY:
        return true;
    }
    throw new AssertionError(dest.tyKind());
  }

  private static boolean isSolvable(Type type, TypeVarContext context) {
    if (type.tyKind() != TyKind.TY_VAR) {
      return false;
    }
    TyVar tyVar = (TyVar) type;
    return !tyVar.isSelf() && context.hasSolveForScope(tyVar.sym().owner());
  }

  /**
   * Records {@code value} as a bound for a type variable: a lower bound normally, an upper bound
   * for a type variable in a parameter position. An existing solution is kept if it satisfies the
   * new bound, and otherwise replaced if the new bound satisfies it.
   */
  private boolean assignToTypeVar(
      TyVar tyVar,
      Type value,
      boolean upperBound,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount) {
    Type candidate =
        AssignFlags.isSet(flags, AssignFlags.RETAIN_LITERALS_FOR_TYPE_VAR)
            ? value
            : Specialize.stripLiteral(value);
    Type current = context.get(tyVar.sym());
    if (current == null) {
      context.set(tyVar.sym(), candidate);
      return true;
    }
    if (AssignFlags.isSet(flags, AssignFlags.ENFORCE_INVARIANCE)) {
      if (isTypeSame(current, candidate)) {
        return true;
      }
    } else {
      Type lower = upperBound ? current : candidate;
      Type upper = upperBound ? candidate : current;
      if (isSubtype(lower, upper, recursionCount)) {
        return true;
      }
      if (isSubtype(upper, lower, recursionCount)) {
        context.set(tyVar.sym(), candidate);
        return true;
      }
    }
    if (diag != null) {
      diag.addMessage(Kind.TYPE_VAR_ASSIGNMENT_MISMATCH, value, tyVar);
    }
    return false;
  }

  private boolean isSubtype(Type sub, Type sup, int recursionCount) {
    return canAssignType(sup, sub, null, null, AssignFlags.DEFAULT, recursionCount);
  }

  private boolean assignInvariant(
      Type dest,
      Type src,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount) {
    if (dest.tyKind() == TyKind.CLASS_TY && src.tyKind() == TyKind.CLASS_TY) {
      ClassTy destClass = (ClassTy) dest;
      ClassTy srcClass = (ClassTy) src;
      if (!destClass.sym().equals(srcClass.sym())
          || destClass.instance() != srcClass.instance()
          || !Objects.equals(destClass.literalValue(), srcClass.literalValue())) {
        return reportNotSame(diag, dest, src);
      }
      ImmutableList<Type> destArgs = destClass.targs();
      ImmutableList<Type> srcArgs = srcClass.targs();
      if (destArgs == null || srcArgs == null) {
        return true;
      }
      if (destArgs.size() != srcArgs.size()) {
        return reportNotSame(diag, dest, src);
      }
      boolean same = true;
      for (int i = 0; i < destArgs.size(); i++) {
        if (!canAssignType(destArgs.get(i), srcArgs.get(i), null, context, flags, recursionCount)) {
          same = false;
        }
      }
      return same || reportNotSame(diag, dest, src);
    }
    return isTypeSame(dest, src) || reportNotSame(diag, dest, src);
  }

  private boolean assignToClass(
      ClassTy dest,
      Type src,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount) {
    boolean destIsObject = dest.instance() && dest.sym().equals(ClassSymbol.OBJECT);
    switch (src.tyKind()) {
      case CLASS_TY:
        return assignClassToClass(dest, (ClassTy) src, diag, context, flags, recursionCount);
      case MODULE_TY:
        if (destIsObject) {
          return true;
        }
        if (dest.instance() && getClassInfo(dest.sym()).isProtocol()) {
          return protocols.canAssignModuleToProtocol(
              dest, (ModuleTy) src, diag, context, flags, recursionCount);
        }
        return reportMismatch(diag, dest, src);
      case NONE_TY:
      case FUNCTION_TY:
      case OVERLOADED_TY:
      case PROPERTY_TY:
        return destIsObject || reportMismatch(diag, dest, src);
      case TY_VAR:
        return canAssignType(dest, ClassTy.OBJECT, diag, context, flags, recursionCount);
      case UNKNOWN_TY:
        return true;
    }
    throw new AssertionError(src.tyKind());
  }

  private boolean assignClassToClass(
      ClassTy dest,
      ClassTy src,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount) {
    if (!dest.instance()) {
      if (src.instance()) {
        return reportMismatch(diag, dest, src);
      }
      return assignNominal(dest, src, diag, context, flags, recursionCount);
    }
    if (src.instance()) {
      if (dest.literalValue() != null) {
        if (dest.sym().equals(src.sym()) && dest.literalValue().equals(src.literalValue())) {
          return true;
        }
        if (diag != null) {
          diag.addMessage(Kind.LITERAL_ASSIGNMENT_MISMATCH, src, dest);
        }
        return false;
      }
      if (dest.sym().equals(ClassSymbol.OBJECT)) {
        return true;
      }
      if (derivesFrom(src, dest.sym())) {
        return assignNominal(dest, src, diag, context, flags, recursionCount);
      }
      if (getClassInfo(dest.sym()).isProtocol()) {
        return protocols.canAssignClassToProtocol(
            dest,
            src,
            diag,
            context,
            flags,
            /* treatSourceAsInstantiable= */ false,
            recursionCount);
      }
      return reportMismatch(diag, dest, src);
    }

    // A class object, assigned to an instance type.
    if (dest.sym().equals(ClassSymbol.OBJECT)) {
      return true;
    }
    if (getClassInfo(dest.sym()).isProtocol()) {
      return protocols.canAssignClassToProtocol(
          dest, src, diag, context, flags, /* treatSourceAsInstantiable= */ true, recursionCount);
    }
    ClassTy metaclass = getClassInfo(src.sym()).metaclass();
    if (metaclass == null) {
      return dest.sym().equals(ClassSymbol.TYPE) || reportMismatch(diag, dest, src);
    }
    return canAssignType(dest, metaclass.asInstance(), diag, context, flags, recursionCount);
  }

  private boolean derivesFrom(ClassTy src, ClassSymbol ancestor) {
    for (ClassTy mroClass : getClassInfo(src.sym()).mro()) {
      if (mroClass.sym().equals(ancestor)) {
        return true;
      }
    }
    return false;
  }

  /** Assigns a class to one of its ancestors, comparing type arguments by declared variance. */
  private boolean assignNominal(
      ClassTy dest,
      ClassTy src,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount) {
    ClassInfo srcInfo = getClassInfo(src.sym());
    if (src.targs() == null && !srcInfo.typeParameters().isEmpty()) {
      // Omitted type arguments are unknown.
      ImmutableList.Builder<Type> unknowns = ImmutableList.builder();
      for (int i = 0; i < srcInfo.typeParameters().size(); i++) {
        unknowns.add(Type.UNKNOWN);
      }
      src = src.withTypeArguments(unknowns.build());
    }
    for (ClassTy mroClass : srcInfo.mro()) {
      if (mroClass.sym().equals(dest.sym())) {
        ClassTy ancestor = specialize.specializeForBaseClass(src, mroClass);
        return assignTypeArguments(
            dest,
            ancestor,
            diag,
            context,
            flags,
            recursionCount,
            /* skipUnsolvedTypeParameters= */ false);
      }
    }
    return reportMismatch(diag, dest, src);
  }

  private boolean assignToFunction(
      FunctionTy dest,
      Type src,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount) {
    switch (src.tyKind()) {
      case FUNCTION_TY:
        return assignFunction(dest, (FunctionTy) src, diag, context, flags, recursionCount);
      case OVERLOADED_TY:
        for (FunctionTy overload : ((OverloadedTy) src).overloads()) {
          TypeVarContext attempt = context.copy();
          if (assignFunction(dest, overload, null, attempt, flags, recursionCount)) {
            context.copyFrom(attempt);
            return true;
          }
        }
        if (diag != null) {
          diag.addMessage(Kind.NO_OVERLOAD_ASSIGNABLE, dest);
        }
        return false;
      case CLASS_TY:
        {
          ClassTy srcClass = (ClassTy) src;
          if (srcClass.instance()) {
            ClassMember call = ClassMembers.lookUpClassMember(specialize, srcClass, "__call__");
            if (call != null) {
              Type bound =
                  bindFunctionToClassOrObject(
                      srcClass, getTypeOfMember(call), call.classType(), recursionCount);
              if (bound != null) {
                return canAssignType(dest, bound, diag, context, flags, recursionCount);
              }
            }
          }
          return reportMismatch(diag, dest, src);
        }
      default:
        return reportMismatch(diag, dest, src);
    }
  }

  /**
   * Compares two signatures: positional parameters contravariantly and by name, the return type
   * covariantly.
   */
  private boolean assignFunction(
      FunctionTy dest,
      FunctionTy src,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount) {
    boolean assignable = true;
    List<Param> destPositional = positionalParams(dest);
    List<Param> srcPositional = positionalParams(src);
    Param srcVarArgs = findParam(src, Param.Category.VAR_ARGS);
    int paramFlags = flags ^ AssignFlags.REVERSE_TYPE_VAR_MATCHING;

    for (int i = 0; i < destPositional.size(); i++) {
      Param destParam = destPositional.get(i);
      Param srcParam;
      if (i < srcPositional.size()) {
        srcParam = srcPositional.get(i);
        if (options.enforceParameterNames()
            && !destParam.isPositionalOnly()
            && !destParam.name().equals(srcParam.name())) {
          if (diag != null) {
            diag.addMessage(Kind.PARAM_NAME_MISMATCH, srcParam.name(), destParam.name());
          }
          assignable = false;
        }
      } else if (srcVarArgs != null) {
        srcParam = srcVarArgs;
      } else {
        if (diag != null) {
          diag.addMessage(
              Kind.TOO_FEW_POSITIONAL_PARAMS, destPositional.size(), srcPositional.size());
        }
        assignable = false;
        break;
      }
      DiagnosticAddendum child = diag != null ? diag.createAddendum() : null;
      if (!canAssignType(
          srcParam.type(), destParam.type(), child, context, paramFlags, recursionCount)) {
        if (child != null) {
          child.addMessage(
              Kind.PARAM_TYPE_MISMATCH, destParam.name(), destParam.type(), srcParam.type());
        }
        assignable = false;
      }
    }

    for (int i = destPositional.size(); i < srcPositional.size(); i++) {
      if (!srcPositional.get(i).hasDefault()) {
        if (diag != null) {
          diag.addMessage(
              Kind.TOO_MANY_POSITIONAL_PARAMS, destPositional.size(), srcPositional.size());
        }
        assignable = false;
        break;
      }
    }

    Param destVarArgs = findParam(dest, Param.Category.VAR_ARGS);
    if (destVarArgs != null && srcVarArgs == null) {
      if (diag != null) {
        diag.addMessage(Kind.VAR_ARGS_MISSING, destVarArgs.name());
      }
      assignable = false;
    }
    Param destKwArgs = findParam(dest, Param.Category.KW_ARGS);
    if (destKwArgs != null && findParam(src, Param.Category.KW_ARGS) == null) {
      if (diag != null) {
        diag.addMessage(Kind.VAR_ARGS_MISSING, "*" + destKwArgs.name());
      }
      assignable = false;
    }

    inferReturnTypeIfNecessary(dest);
    inferReturnTypeIfNecessary(src);
    Type destReturn = dest.effectiveReturnType();
    Type srcReturn = src.effectiveReturnType();
    DiagnosticAddendum child = diag != null ? diag.createAddendum() : null;
    if (!canAssignType(destReturn, srcReturn, child, context, flags, recursionCount)) {
      if (child != null) {
        child.addMessage(Kind.RETURN_TYPE_MISMATCH, srcReturn, destReturn);
      }
      assignable = false;
    }
    return assignable;
  }

  private static List<Param> positionalParams(FunctionTy function) {
    List<Param> result = new ArrayList<>();
    for (Param param : function.params()) {
      if (param.category() == Param.Category.SIMPLE) {
        result.add(param);
      }
    }
    return result;
  }

  private static @Nullable Param findParam(FunctionTy function, Param.Category category) {
    for (Param param : function.params()) {
      if (param.category() == category) {
        return param;
      }
    }
    return null;
  }

  @Override
  public boolean isTypeSame(Type type1, Type type2) {
    if (type1.equals(type2)) {
      return true;
    }
    if (type1.tyKind() != type2.tyKind()) {
      return false;
    }
    switch (type1.tyKind()) {
      case CLASS_TY:
        {
          ClassTy class1 = (ClassTy) type1;
          ClassTy class2 = (ClassTy) type2;
          if (!class1.sym().equals(class2.sym())
              || class1.instance() != class2.instance()
              || !Objects.equals(class1.literalValue(), class2.literalValue())) {
            return false;
          }
          return isTypeListSame(class1.targs(), class2.targs());
        }
      case FUNCTION_TY:
        {
          FunctionTy function1 = (FunctionTy) type1;
          FunctionTy function2 = (FunctionTy) type2;
          if (function1.params().size() != function2.params().size()) {
            return false;
          }
          for (int i = 0; i < function1.params().size(); i++) {
            Param param1 = function1.params().get(i);
            Param param2 = function2.params().get(i);
            if (param1.category() != param2.category()
                || !param1.name().equals(param2.name())
                || !isTypeSame(param1.type(), param2.type())) {
              return false;
            }
          }
          return isTypeSame(function1.effectiveReturnType(), function2.effectiveReturnType());
        }
      case OVERLOADED_TY:
        {
          ImmutableList<FunctionTy> overloads1 = ((OverloadedTy) type1).overloads();
          ImmutableList<FunctionTy> overloads2 = ((OverloadedTy) type2).overloads();
          if (overloads1.size() != overloads2.size()) {
            return false;
          }
          for (int i = 0; i < overloads1.size(); i++) {
            if (!isTypeSame(overloads1.get(i), overloads2.get(i))) {
              return false;
            }
          }
          return true;
        }
      case PROPERTY_TY:
        return isTypeSame(((PropertyTy) type1).getter(), ((PropertyTy) type2).getter());
      case MODULE_TY:
      case TY_VAR:
        return false;
      case NONE_TY:
      case UNKNOWN_TY:
        return true;
    }
    throw new AssertionError(type1.tyKind());
  }

  private boolean isTypeListSame(
      @Nullable ImmutableList<Type> list1, @Nullable ImmutableList<Type> list2) {
    if (list1 == null || list2 == null) {
      return list1 == list2;
    }
    if (list1.size() != list2.size()) {
      return false;
    }
    for (int i = 0; i < list1.size(); i++) {
      if (!isTypeSame(list1.get(i), list2.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public @Nullable Type bindFunctionToClassOrObject(
      @Nullable ClassTy baseType,
      Type memberType,
      @Nullable ClassTy memberClass,
      int recursionCount,
      boolean treatConstructorAsClassMember,
      @Nullable ClassTy selfType) {
    switch (memberType.tyKind()) {
      case FUNCTION_TY:
        return bindFunction(
            baseType,
            (FunctionTy) memberType,
            memberClass,
            recursionCount,
            treatConstructorAsClassMember,
            selfType);
      case OVERLOADED_TY:
        {
          ImmutableList.Builder<FunctionTy> bound = ImmutableList.builder();
          for (FunctionTy overload : ((OverloadedTy) memberType).overloads()) {
            FunctionTy boundOverload =
                bindFunction(
                    baseType,
                    overload,
                    memberClass,
                    recursionCount,
                    treatConstructorAsClassMember,
                    selfType);
            if (boundOverload != null) {
              bound.add(boundOverload);
            }
          }
          ImmutableList<FunctionTy> overloads = bound.build();
          if (overloads.isEmpty()) {
            return null;
          }
          return overloads.size() == 1 ? overloads.get(0) : OverloadedTy.create(overloads);
        }
      default:
        return memberType;
    }
  }

  private @Nullable FunctionTy bindFunction(
      @Nullable ClassTy baseType,
      FunctionTy function,
      @Nullable ClassTy memberClass,
      int recursionCount,
      boolean treatConstructorAsClassMember,
      @Nullable ClassTy selfType) {
    ClassTy selfClass = selfType != null ? selfType : baseType;
    FunctionTy specialized = function;
    if (memberClass != null) {
      specialized =
          (FunctionTy) specialize.partiallySpecializeType(function, memberClass, selfClass);
    } else if (selfClass != null) {
      TypeVarContext selfContext = new TypeVarContext();
      selfContext.setSelfType(selfClass.asInstance());
      specialized = (FunctionTy) specialize.applySolvedTypeVars(function, selfContext);
    }
    if (baseType == null
        || function.isStaticMethod()
        || (function.flags() & FunctionFlag.NOT_A_METHOD) != 0) {
      return specialized;
    }

    ClassTy receiver;
    if (function.isClassMethod()
        || (function.isConstructorMethod() && treatConstructorAsClassMember)) {
      receiver = selfClass.asInstantiable();
    } else if (selfType != null || baseType.instance()) {
      receiver = baseType;
    } else {
      // Accessed through the class object: the receiver stays an explicit parameter.
      return specialized;
    }
    return bindReceiver(specialized, receiver, recursionCount);
  }

  /** Strips the receiver parameter, solving method-scoped type variables in its annotation. */
  private @Nullable FunctionTy bindReceiver(
      FunctionTy function, ClassTy receiver, int recursionCount) {
    if (function.params().isEmpty()) {
      return function;
    }
    Param first = function.params().get(0);
    if (first.category() != Param.Category.SIMPLE) {
      return function;
    }
    TypeVarContext context = new TypeVarContext(function.sym());
    if (!canAssignType(
        first.type(), receiver, null, context, AssignFlags.DEFAULT, recursionCount)) {
      logger.debug("cannot bind {} to receiver {}", function.name(), receiver);
      return null;
    }
    FunctionTy bound = function.withParams(function.params().subList(1, function.params().size()));
    return context.isEmpty() ? bound : (FunctionTy) specialize.applySolvedTypeVars(bound, context);
  }

  @Override
  public void inferReturnTypeIfNecessary(Type type) {
    switch (type.tyKind()) {
      case FUNCTION_TY:
        {
          FunctionTy function = (FunctionTy) type;
          if (function.declaredReturnType() == null && function.inference() != null) {
            function.inference().infer();
          }
          break;
        }
      case OVERLOADED_TY:
        for (FunctionTy overload : ((OverloadedTy) type).overloads()) {
          inferReturnTypeIfNecessary(overload);
        }
        break;
      default:
        break;
    }
  }

  @Override
  public boolean canAssignProperty(
      PropertyTy destProperty,
      PropertyTy srcProperty,
      ClassTy destClass,
      ClassTy srcClass,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      @Nullable TypeVarContext selfContext,
      int recursionCount) {
    boolean getterOk =
        assignAccessor(
            destProperty.getter(),
            srcProperty.getter(),
            Kind.MISSING_GETTER,
            Kind.INCOMPATIBLE_GETTER,
            destClass,
            srcClass,
            diag,
            context,
            selfContext,
            recursionCount);
    boolean setterOk =
        assignAccessor(
            destProperty.setter(),
            srcProperty.setter(),
            Kind.MISSING_SETTER,
            Kind.INCOMPATIBLE_SETTER,
            destClass,
            srcClass,
            diag,
            context,
            selfContext,
            recursionCount);
    boolean deleterOk =
        assignAccessor(
            destProperty.deleter(),
            srcProperty.deleter(),
            Kind.MISSING_DELETER,
            Kind.INCOMPATIBLE_DELETER,
            destClass,
            srcClass,
            diag,
            context,
            selfContext,
            recursionCount);
    return getterOk && setterOk && deleterOk;
  }

  private boolean assignAccessor(
      @Nullable FunctionTy destAccessor,
      @Nullable FunctionTy srcAccessor,
      Kind missing,
      Kind incompatible,
      ClassTy destClass,
      ClassTy srcClass,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      @Nullable TypeVarContext selfContext,
      int recursionCount) {
    if (destAccessor == null) {
      return true;
    }
    if (srcAccessor == null) {
      if (diag != null) {
        diag.addMessage(missing);
      }
      return false;
    }
    Type destType =
        selfContext != null
            ? specialize.applySolvedTypeVars(destAccessor, selfContext)
            : destAccessor;
    inferReturnTypeIfNecessary(srcAccessor);
    Type boundDest =
        bindFunctionToClassOrObject(destClass.asInstance(), destType, null, recursionCount);
    Type boundSrc =
        bindFunctionToClassOrObject(srcClass.asInstance(), srcAccessor, null, recursionCount);
    if (boundDest == null
        || boundSrc == null
        || !canAssignType(
            boundDest,
            boundSrc,
            diag != null ? diag.createAddendum() : null,
            context,
            AssignFlags.DEFAULT,
            recursionCount)) {
      if (diag != null) {
        diag.addMessage(incompatible);
      }
      return false;
    }
    return true;
  }

  @Override
  public @Nullable Type getGetterTypeFromProperty(PropertyTy property, boolean inferIfNeeded) {
    FunctionTy getter = property.getter();
    if (getter.declaredReturnType() != null) {
      return getter.declaredReturnType();
    }
    if (getter.inference() == null) {
      return Type.UNKNOWN;
    }
    return inferIfNeeded ? getter.inference().infer() : getter.inference().inferredType();
  }

  @Override
  public boolean verifyTypeArgumentsAssignable(
      ClassTy dest,
      ClassTy src,
      @Nullable DiagnosticAddendum diag,
      @Nullable TypeVarContext typeVarContext,
      int flags,
      int recursionCount) {
    return assignTypeArguments(
        dest,
        src,
        diag,
        typeVarContext != null ? typeVarContext : new TypeVarContext(),
        flags,
        recursionCount,
        /* skipUnsolvedTypeParameters= */ true);
  }

  /**
   * Compares the type arguments of two specializations of a class. If {@code
   * skipUnsolvedTypeParameters} is set, a source argument that is still one of the class's own
   * type parameters was left unconstrained, and matches anything.
   */
  private boolean assignTypeArguments(
      ClassTy dest,
      ClassTy src,
      @Nullable DiagnosticAddendum diag,
      TypeVarContext context,
      int flags,
      int recursionCount,
      boolean skipUnsolvedTypeParameters) {
    checkArgument(dest.isSameGenericClass(src), "%s is not a specialization of %s", src, dest);
    ImmutableList<Type> destArgs = dest.targs();
    ImmutableList<Type> srcArgs = src.targs();
    if (destArgs == null || srcArgs == null) {
      return true;
    }
    ImmutableList<TyVar> params = getClassInfo(dest.sym()).typeParameters();
    boolean assignable = true;
    for (int i = 0; i < params.size() && i < destArgs.size() && i < srcArgs.size(); i++) {
      TyVar param = params.get(i);
      Type destArg = destArgs.get(i);
      Type srcArg = srcArgs.get(i);
      if (skipUnsolvedTypeParameters
          && srcArg.tyKind() == TyKind.TY_VAR
          && ((TyVar) srcArg).sym().owner().equals(dest.sym())) {
        continue;
      }
      DiagnosticAddendum child = diag != null ? diag.createAddendum() : null;
      DiagnosticAddendum cause = child != null ? child.createAddendum() : null;
      Kind failure;
      boolean ok;
      if (param.isParamSpec()) {
        failure = Kind.TYPE_VAR_IS_INVARIANT;
        ok =
            canAssignType(
                destArg,
                srcArg,
                cause,
                context,
                flags | AssignFlags.ENFORCE_INVARIANCE,
                recursionCount);
      } else {
        switch (param.variance()) {
          case COVARIANT:
            failure = Kind.TYPE_VAR_IS_COVARIANT;
            ok = canAssignType(destArg, srcArg, cause, context, flags, recursionCount);
            break;
          case CONTRAVARIANT:
            failure = Kind.TYPE_VAR_IS_CONTRAVARIANT;
            ok =
                canAssignType(
                    srcArg,
                    destArg,
                    cause,
                    context,
                    flags ^ AssignFlags.REVERSE_TYPE_VAR_MATCHING,
                    recursionCount);
            break;
          case INVARIANT:
            failure = Kind.TYPE_VAR_IS_INVARIANT;
            ok =
                canAssignType(
                    destArg,
                    srcArg,
                    cause,
                    context,
                    flags | AssignFlags.ENFORCE_INVARIANCE,
                    recursionCount);
            break;
          default:
            throw new AssertionError(param.variance());
        }
      }
      if (!ok) {
        if (child != null) {
          child.addMessage(failure, param, srcArg, destArg);
        }
        assignable = false;
      }
    }
    return assignable;
  }

  @Override
  public @Nullable ClassTy getTypedDictClassType() {
    ClassSymbol fallback = options.typedDictFallback().orElse(null);
    if (fallback == null || !env.contains(fallback)) {
      return null;
    }
    return ClassTy.instantiable(fallback);
  }

  @Override
  public @Nullable Type getDeclaredTypeOfSymbol(MemberInfo symbol) {
    return symbol.declaredType();
  }

  @Override
  public Type getEffectiveTypeOfSymbol(MemberInfo symbol) {
    Type declared = symbol.declaredType();
    if (declared != null) {
      return declared;
    }
    for (Declaration decl : symbol.declarations().reverse()) {
      if (decl.inferredType() != null) {
        return decl.inferredType();
      }
    }
    return Type.UNKNOWN;
  }

  @Override
  public Type getTypeOfMember(ClassMember member) {
    return specialize.partiallySpecializeType(
        getEffectiveTypeOfSymbol(member.symbol()), member.classType());
  }

  private static boolean reportMismatch(@Nullable DiagnosticAddendum diag, Type dest, Type src) {
    if (diag != null) {
      diag.addMessage(Kind.TYPE_ASSIGNMENT_MISMATCH, src, dest);
    }
    return false;
  }

  private static boolean reportNotSame(@Nullable DiagnosticAddendum diag, Type dest, Type src) {
    if (diag != null) {
      diag.addMessage(Kind.TYPE_NOT_SAME, src, dest);
    }
    return false;
  }
}
