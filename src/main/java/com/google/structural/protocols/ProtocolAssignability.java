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

package com.google.structural.protocols;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verifyNotNull;

import com.google.structural.bound.ClassInfo;
import com.google.structural.bound.MemberInfo;
import com.google.structural.diag.AddendumMessage.Kind;
import com.google.structural.diag.DiagnosticAddendum;
import com.google.structural.evaluator.TypeEvaluator;
import com.google.structural.model.AssignFlags;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.ModuleTy;
import com.google.structural.type.Type.PropertyTy;
import com.google.structural.type.Type.TyKind;
import com.google.structural.types.ClassMembers;
import com.google.structural.types.ClassMembers.ClassMember;
import com.google.structural.types.Specialize;
import com.google.structural.types.TypeVarContext;
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural subtyping: decides whether a class instance, a class object or a module provides
 * every member a protocol requires, with compatible types.
 *
 * <p>Every mismatch is recorded in the diagnostic addendum, not just the first. A comparison that
 * exceeds the recursion limit, or that is already in progress further up the stack, is assumed to
 * succeed.
 */
public class ProtocolAssignability {

  private final Logger logger = LoggerFactory.getLogger(ProtocolAssignability.class);

  private final TypeEvaluator evaluator;
  private final Specialize specialize;
  private final ProtocolAssignmentStack assignmentStack;

  public ProtocolAssignability(TypeEvaluator evaluator) {
    this.evaluator = evaluator;
    this.specialize = evaluator.specialize();
    this.assignmentStack = new ProtocolAssignmentStack(evaluator::isTypeSame);
  }

  /** The comparisons currently in progress. */
  public ProtocolAssignmentStack assignmentStack() {
    return assignmentStack;
  }

  /**
   * Returns true if {@code srcType} structurally satisfies the protocol {@code destType}.
   *
   * @param treatSourceAsInstantiable compare the class object of {@code srcType}, rather than an
   *     instance of it, against the protocol
   */
  public boolean canAssignClassToProtocol(
      ClassTy destType,
      ClassTy srcType,
      @Nullable DiagnosticAddendum diag,
      @Nullable TypeVarContext typeVarContext,
      int flags,
      boolean treatSourceAsInstantiable,
      int recursionCount) {
    if (recursionCount > evaluator.options().maxTypeRecursionCount()) {
      logger.debug("recursion limit reached comparing {} to protocol {}", srcType, destType);
      return true;
    }
    recursionCount++;

    if (assignmentStack.contains(srcType, destType)) {
      logger.debug("{} is already being compared to protocol {}", srcType, destType);
      return true;
    }

    try (ProtocolAssignmentStack.Entry unused = assignmentStack.enter(srcType, destType)) {
      return new ClassComparison(
              destType,
              srcType,
              diag,
              typeVarContext,
              flags,
              treatSourceAsInstantiable,
              recursionCount)
          .run();
    }
  }

  /** The comparison of one class (or class object) against one protocol. */
  private class ClassComparison {
    private final ClassTy destType;
    private ClassTy srcType;
    private final @Nullable DiagnosticAddendum diag;
    private final @Nullable TypeVarContext typeVarContext;
    private final int flags;
    private final boolean treatSourceAsInstantiable;

    private final TypeVarContext genericDestTypeVarContext;
    private final TypeVarContext selfTypeVarContext;
    private final int recursionCount;
    private int assignFlags;

    ClassComparison(
        ClassTy destType,
        ClassTy srcType,
        @Nullable DiagnosticAddendum diag,
        @Nullable TypeVarContext typeVarContext,
        int flags,
        boolean treatSourceAsInstantiable,
        int recursionCount) {
      this.destType = destType;
      this.srcType = srcType;
      this.diag = diag;
      this.typeVarContext = typeVarContext;
      this.flags = flags;
      this.treatSourceAsInstantiable = treatSourceAsInstantiable;
      this.recursionCount = recursionCount;
      this.genericDestTypeVarContext = new TypeVarContext(destType.sym());
      this.selfTypeVarContext = new TypeVarContext(destType.sym());
    }

    boolean run() {
      if (AssignFlags.isSet(flags, AssignFlags.ENFORCE_INVARIANCE)) {
        return evaluator.isTypeSame(destType, srcType);
      }

      // Members of the protocol are solved in terms of its own type parameters, and checked
      // against the requested specialization at the end.
      ClassTy genericDestType = destType.withTypeArguments(null);
      Specialize.populateTypeVarContextForSelfType(selfTypeVarContext, destType, srcType);

      // Records are compared using the members of the placeholder class.
      if (evaluator.getClassInfo(srcType.sym()).isTypedDict()) {
        ClassTy typedDictClassType = evaluator.getTypedDictClassType();
        if (typedDictClassType != null) {
          srcType =
              srcType.instance()
                  ? typedDictClassType.asInstance()
                  : typedDictClassType.asInstantiable();
        }
      }

      assignFlags =
          Specialize.containsLiteralType(srcType, /* includeTypeArgs= */ true)
              ? AssignFlags.RETAIN_LITERALS_FOR_TYPE_VAR
              : AssignFlags.DEFAULT;

      boolean typesAreConsistent = true;
      Set<String> checkedSymbols = new HashSet<>();
      ClassInfo destInfo = evaluator.getClassInfo(destType.sym());
      for (ClassTy mroClass : destInfo.mro()) {
        if (!evaluator.getClassInfo(mroClass.sym()).isProtocol()) {
          continue;
        }
        for (MemberInfo symbol : evaluator.getClassInfo(mroClass.sym()).fields().values()) {
          String name = symbol.name();
          if (!symbol.isClassMember()
              || symbol.isIgnoredForProtocolMatch()
              || checkedSymbols.contains(name)) {
            continue;
          }
          if (!treatSourceAsInstantiable && name.equals("__class_getitem__")) {
            continue;
          }
          if (name.equals("__slots__")) {
            continue;
          }
          // A member redeclared by a more derived protocol was already checked.
          checkedSymbols.add(name);
          if (!assignMember(mroClass, symbol)) {
            typesAreConsistent = false;
          }
        }
      }

      if (typesAreConsistent
          && !destInfo.typeParameters().isEmpty()
          && destType.targs() != null) {
        ClassTy specializedDestProtocol =
            specialize.applySolvedTypeVars(genericDestType, genericDestTypeVarContext);
        if (!evaluator.verifyTypeArgumentsAssignable(
            destType, specializedDestProtocol, diag, typeVarContext, flags, recursionCount)) {
          typesAreConsistent = false;
        }
      }
      return typesAreConsistent;
    }

    private boolean assignMember(ClassTy mroClass, MemberInfo symbol) {
      String name = symbol.name();
      boolean isMemberFromMetaclass = false;
      ClassMember srcMemberInfo = null;

      ClassTy metaclass = evaluator.getClassInfo(srcType.sym()).metaclass();
      if (treatSourceAsInstantiable && metaclass != null) {
        srcMemberInfo = ClassMembers.lookUpClassMember(specialize, metaclass, name);
        isMemberFromMetaclass = srcMemberInfo != null;
      }
      if (srcMemberInfo == null) {
        srcMemberInfo = ClassMembers.lookUpClassMember(specialize, srcType, name);
      }
      if (srcMemberInfo == null) {
        if (diag != null) {
          diag.addMessage(Kind.PROTOCOL_MEMBER_MISSING, name);
        }
        return false;
      }

      boolean typesAreConsistent = true;
      Type destMemberType = evaluator.getDeclaredTypeOfSymbol(symbol);
      if (destMemberType != null) {
        if (!mroClass.isSameGenericClass(destType)) {
          destMemberType = specialize.partiallySpecializeType(destMemberType, mroClass);
        }

        Type symbolType = evaluator.getEffectiveTypeOfSymbol(srcMemberInfo.symbol());
        if (symbolType.tyKind() == TyKind.FUNCTION_TY) {
          evaluator.inferReturnTypeIfNecessary(symbolType);
        }
        Type srcMemberType =
            specialize.partiallySpecializeType(symbolType, srcMemberInfo.classType(), srcType);

        if (isFunctionOrOverloaded(srcMemberType)) {
          if (isMemberFromMetaclass) {
            Type boundSrcFunction =
                evaluator.bindFunctionToClassOrObject(
                    srcType,
                    srcMemberType,
                    /* memberClass= */ null,
                    recursionCount,
                    /* treatConstructorAsClassMember= */ false,
                    srcType);
            if (boundSrcFunction != null) {
              srcMemberType = Specialize.removeParamSpecVariadicsFromSignature(boundSrcFunction);
            }
            if (isFunctionOrOverloaded(destMemberType)) {
              Type boundDeclaredType =
                  evaluator.bindFunctionToClassOrObject(
                      srcType,
                      destMemberType,
                      /* memberClass= */ null,
                      recursionCount,
                      /* treatConstructorAsClassMember= */ false,
                      srcType);
              if (boundDeclaredType != null) {
                destMemberType =
                    Specialize.removeParamSpecVariadicsFromSignature(boundDeclaredType);
              }
            }
          } else {
            destMemberType = specialize.applySolvedTypeVars(destMemberType, selfTypeVarContext);
            Type boundSrcFunction =
                evaluator.bindFunctionToClassOrObject(
                    treatSourceAsInstantiable ? srcType.asInstantiable() : srcType.asInstance(),
                    srcMemberType,
                    srcMemberInfo.classType(),
                    recursionCount);
            if (boundSrcFunction != null) {
              srcMemberType = Specialize.removeParamSpecVariadicsFromSignature(boundSrcFunction);
            }
            if (isFunctionOrOverloaded(destMemberType)) {
              Type boundDeclaredType =
                  evaluator.bindFunctionToClassOrObject(
                      srcType.asInstance(),
                      destMemberType,
                      srcMemberInfo.classType(),
                      recursionCount);
              if (boundDeclaredType != null) {
                destMemberType =
                    Specialize.removeParamSpecVariadicsFromSignature(boundDeclaredType);
              }
            }
          }
        } else {
          destMemberType = specialize.applySolvedTypeVars(destMemberType, selfTypeVarContext);
        }

        DiagnosticAddendum subDiag = diag != null ? diag.createAddendum() : null;

        if (destMemberType.tyKind() == TyKind.PROPERTY_TY) {
          if (srcMemberType.tyKind() == TyKind.PROPERTY_TY && !treatSourceAsInstantiable) {
            if (!evaluator.canAssignProperty(
                (PropertyTy) destMemberType,
                (PropertyTy) srcMemberType,
                mroClass,
                srcType,
                subDiag != null ? subDiag.createAddendum() : null,
                genericDestTypeVarContext,
                selfTypeVarContext,
                recursionCount)) {
              if (subDiag != null) {
                subDiag.addMessage(Kind.MEMBER_TYPE_MISMATCH, name);
              }
              typesAreConsistent = false;
            }
          } else {
            // Compare the type the property produces with the candidate's plain member.
            Type getterType =
                evaluator.getGetterTypeFromProperty(
                    (PropertyTy) destMemberType, /* inferIfNeeded= */ true);
            if (getterType == null
                || !evaluator.canAssignType(
                    getterType,
                    srcMemberType,
                    subDiag != null ? subDiag.createAddendum() : null,
                    genericDestTypeVarContext,
                    assignFlags,
                    recursionCount)) {
              if (subDiag != null) {
                subDiag.addMessage(Kind.MEMBER_TYPE_MISMATCH, name);
              }
              typesAreConsistent = false;
            }
          }
        } else {
          // Mutable class and instance variables are invariant.
          boolean isInvariant = symbol.isMutableVariable();
          if (!evaluator.canAssignType(
              destMemberType,
              srcMemberType,
              subDiag != null ? subDiag.createAddendum() : null,
              genericDestTypeVarContext,
              isInvariant ? assignFlags | AssignFlags.ENFORCE_INVARIANCE : assignFlags,
              recursionCount)) {
            if (subDiag != null) {
              if (isInvariant) {
                subDiag.addMessage(Kind.MEMBER_IS_INVARIANT, name);
              }
              subDiag.addMessage(Kind.MEMBER_TYPE_MISMATCH, name);
            }
            typesAreConsistent = false;
          }
        }

        boolean isDestFinal = symbol.isFinalVariable();
        boolean isSrcFinal = srcMemberInfo.symbol().isFinalVariable();
        if (isDestFinal != isSrcFinal) {
          if (subDiag != null) {
            subDiag.addMessage(
                isDestFinal
                    ? Kind.MEMBER_IS_FINAL_IN_PROTOCOL
                    : Kind.MEMBER_IS_NOT_FINAL_IN_PROTOCOL,
                name);
          }
          typesAreConsistent = false;
        }
      }

      if (symbol.isClassVar() && !srcMemberInfo.symbol().isClassMember()) {
        if (diag != null) {
          diag.addMessage(Kind.PROTOCOL_MEMBER_CLASS_VAR, name);
        }
        typesAreConsistent = false;
      }
      return typesAreConsistent;
    }
  }

  /** Returns true if the module's top-level symbols satisfy the protocol {@code destType}. */
  public boolean canAssignModuleToProtocol(
      ClassTy destType,
      ModuleTy srcType,
      @Nullable DiagnosticAddendum diag,
      @Nullable TypeVarContext typeVarContext,
      int flags,
      int recursionCount) {
    if (recursionCount > evaluator.options().maxTypeRecursionCount()) {
      logger.debug("recursion limit reached comparing {} to protocol {}", srcType, destType);
      return true;
    }
    recursionCount++;

    boolean typesAreConsistent = true;
    Set<String> checkedSymbols = new HashSet<>();
    ClassTy genericDestType = destType.withTypeArguments(null);
    TypeVarContext genericDestTypeVarContext = new TypeVarContext(destType.sym());

    ClassInfo destInfo = evaluator.getClassInfo(destType.sym());
    for (ClassTy mroClass : destInfo.mro()) {
      if (!evaluator.getClassInfo(mroClass.sym()).isProtocol()) {
        continue;
      }
      for (MemberInfo symbol : evaluator.getClassInfo(mroClass.sym()).fields().values()) {
        String name = symbol.name();
        if (!symbol.isClassMember()
            || symbol.isIgnoredForProtocolMatch()
            || checkedSymbols.contains(name)) {
          continue;
        }
        checkedSymbols.add(name);

        MemberInfo memberSymbol = srcType.fields().get(name);
        if (memberSymbol == null) {
          if (diag != null) {
            diag.addMessage(Kind.PROTOCOL_MEMBER_MISSING, name);
          }
          typesAreConsistent = false;
          continue;
        }

        Type destMemberType = evaluator.getDeclaredTypeOfSymbol(symbol);
        if (destMemberType == null) {
          continue;
        }
        destMemberType = specialize.partiallySpecializeType(destMemberType, destType);
        Type srcMemberType = evaluator.getEffectiveTypeOfSymbol(memberSymbol);

        // Module functions have no receiver, so the protocol's methods are bound instead.
        if (isFunctionOrOverloaded(srcMemberType) && isFunctionOrOverloaded(destMemberType)) {
          Type boundDeclaredType =
              evaluator.bindFunctionToClassOrObject(
                  destType.asInstance(), destMemberType, destType, recursionCount);
          if (boundDeclaredType != null) {
            destMemberType = boundDeclaredType;
          }
        }

        DiagnosticAddendum subDiag = diag != null ? diag.createAddendum() : null;
        if (!evaluator.canAssignType(
            destMemberType,
            srcMemberType,
            subDiag != null ? subDiag.createAddendum() : null,
            genericDestTypeVarContext,
            AssignFlags.DEFAULT,
            recursionCount)) {
          if (subDiag != null) {
            subDiag.addMessage(Kind.MEMBER_TYPE_MISMATCH, name);
          }
          typesAreConsistent = false;
        }
      }
    }

    if (typesAreConsistent && !destInfo.typeParameters().isEmpty() && destType.targs() != null) {
      ClassTy specializedSrcProtocol =
          specialize.applySolvedTypeVars(genericDestType, genericDestTypeVarContext);
      if (!evaluator.verifyTypeArgumentsAssignable(
          destType, specializedSrcProtocol, diag, typeVarContext, flags, recursionCount)) {
        typesAreConsistent = false;
      }
    }
    return typesAreConsistent;
  }

  public boolean canAssignProtocolClassToSelf(ClassTy destType, ClassTy srcType) {
    return canAssignProtocolClassToSelf(destType, srcType, 0);
  }

  /**
   * Compares two specializations of the same generic protocol member by member, including the
   * members of its generic protocol bases. Used to work out the variance a protocol's type
   * parameters permit.
   */
  public boolean canAssignProtocolClassToSelf(
      ClassTy destType, ClassTy srcType, int recursionCount) {
    ClassInfo destInfo = evaluator.getClassInfo(destType.sym());
    checkArgument(destInfo.isProtocol(), "%s is not a protocol", destType);
    checkArgument(
        destType.isSameGenericClass(srcType), "%s and %s are different classes", destType, srcType);
    checkArgument(!destInfo.typeParameters().isEmpty(), "%s is not generic", destType);

    DiagnosticAddendum diag = new DiagnosticAddendum();
    TypeVarContext typeVarContext = new TypeVarContext();
    boolean isAssignable = true;

    for (MemberInfo symbol : destInfo.fields().values()) {
      if (!isAssignable || !symbol.isClassMember() || symbol.isIgnoredForProtocolMatch()) {
        continue;
      }
      ClassMember memberInfo =
          verifyNotNull(
              ClassMembers.lookUpClassMember(specialize, srcType, symbol.name()),
              "%s has no member %s",
              srcType,
              symbol.name());

      Type destMemberType = evaluator.getDeclaredTypeOfSymbol(symbol);
      if (destMemberType == null) {
        continue;
      }
      Type srcMemberType = evaluator.getTypeOfMember(memberInfo);
      destMemberType = specialize.partiallySpecializeType(destMemberType, destType);

      if (destMemberType.tyKind() == TyKind.PROPERTY_TY
          && srcMemberType.tyKind() == TyKind.PROPERTY_TY) {
        if (!evaluator.canAssignProperty(
            (PropertyTy) destMemberType,
            (PropertyTy) srcMemberType,
            destType,
            srcType,
            diag,
            typeVarContext,
            /* selfContext= */ null,
            recursionCount)) {
          isAssignable = false;
        }
      } else {
        int flags =
            symbol.isMutableVariable() ? AssignFlags.ENFORCE_INVARIANCE : AssignFlags.DEFAULT;
        if (!evaluator.canAssignType(
            destMemberType, srcMemberType, diag, typeVarContext, flags, recursionCount)) {
          isAssignable = false;
        }
      }
    }

    for (ClassTy baseClass : destInfo.baseClasses()) {
      ClassInfo baseInfo = evaluator.getClassInfo(baseClass.sym());
      if (baseInfo.isProtocol()
          && !baseInfo.isBuiltIn(ClassSymbol.OBJECT)
          && !baseInfo.isBuiltIn(ClassSymbol.PROTOCOL)
          && !baseInfo.typeParameters().isEmpty()) {
        ClassTy specializedDestBaseClass = specialize.specializeForBaseClass(destType, baseClass);
        ClassTy specializedSrcBaseClass = specialize.specializeForBaseClass(srcType, baseClass);
        if (!canAssignProtocolClassToSelf(
            specializedDestBaseClass, specializedSrcBaseClass, recursionCount)) {
          isAssignable = false;
        }
      }
    }
    return isAssignable;
  }

  private static boolean isFunctionOrOverloaded(Type type) {
    return type.tyKind() == TyKind.FUNCTION_TY || type.tyKind() == TyKind.OVERLOADED_TY;
  }
}
