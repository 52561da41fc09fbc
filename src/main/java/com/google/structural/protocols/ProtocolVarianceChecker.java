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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.structural.bound.ClassInfo;
import com.google.structural.diag.AddendumMessage.Kind;
import com.google.structural.diag.DiagnosticAddendum;
import com.google.structural.evaluator.TypeEvaluator;
import com.google.structural.model.Variance;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.TyVar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the declared variance of each type parameter of a generic protocol matches the way
 * the protocol's members use it.
 *
 * <p>For a type parameter {@code T}, the protocol is specialized twice: once with {@code T}
 * itself, and once with {@code object}. All other parameters are replaced by an unrelated
 * placeholder class. If the first specialization is assignable to the second, {@code T} may be
 * covariant; if the second is assignable to the first, contravariant; otherwise it must be
 * invariant.
 */
public class ProtocolVarianceChecker {

  private final Logger logger = LoggerFactory.getLogger(ProtocolVarianceChecker.class);

  private final TypeEvaluator evaluator;
  private final ProtocolAssignability protocols;

  public ProtocolVarianceChecker(TypeEvaluator evaluator, ProtocolAssignability protocols) {
    this.evaluator = evaluator;
    this.protocols = protocols;
  }

  /** Returns the variance the members of {@code protocol} permit for {@code typeParameter}. */
  public Variance expectedVariance(ClassSymbol protocol, TyVar typeParameter) {
    ClassInfo info = evaluator.getClassInfo(protocol);
    ImmutableList<TyVar> typeParameters = info.typeParameters();
    int index = typeParameters.indexOf(typeParameter);
    checkArgument(index >= 0, "%s is not a type parameter of %s", typeParameter, protocol);

    ClassTy dummy = ClassTy.instance(ClassSymbol.VARIANCE_DUMMY);
    ImmutableList.Builder<Type> srcTypeArgs = ImmutableList.builder();
    ImmutableList.Builder<Type> destTypeArgs = ImmutableList.builder();
    for (int i = 0; i < typeParameters.size(); i++) {
      TyVar param = typeParameters.get(i);
      if (param.isParamSpec()) {
        srcTypeArgs.add(param);
        destTypeArgs.add(param);
      } else if (i == index) {
        srcTypeArgs.add(ClassTy.OBJECT);
        destTypeArgs.add(param);
      } else {
        srcTypeArgs.add(dummy);
        destTypeArgs.add(dummy);
      }
    }
    ClassTy srcType = ClassTy.create(protocol, srcTypeArgs.build(), /* instance= */ true, null);
    ClassTy destType = ClassTy.create(protocol, destTypeArgs.build(), /* instance= */ true, null);

    if (protocols.canAssignProtocolClassToSelf(srcType, destType)) {
      return Variance.COVARIANT;
    }
    if (protocols.canAssignProtocolClassToSelf(destType, srcType)) {
      return Variance.CONTRAVARIANT;
    }
    return Variance.INVARIANT;
  }

  /** Returns the variance each type parameter of {@code protocol} permits, in declaration order. */
  public ImmutableMap<TyVar, Variance> expectedVariances(ClassSymbol protocol) {
    ImmutableMap.Builder<TyVar, Variance> result = ImmutableMap.builder();
    for (TyVar param : evaluator.getClassInfo(protocol).typeParameters()) {
      if (!param.isParamSpec()) {
        result.put(param, expectedVariance(protocol, param));
      }
    }
    return result.build();
  }

  /**
   * Reports each type parameter whose declared variance differs from the variance the members
   * permit. Does nothing for classes that are not generic protocols.
   *
   * @return true if every declared variance is the expected one
   */
  public boolean validate(ClassSymbol protocol, DiagnosticAddendum diag) {
    ClassInfo info = evaluator.getClassInfo(protocol);
    if (!info.isProtocol() || info.typeParameters().isEmpty()) {
      return true;
    }
    boolean valid = true;
    for (TyVar param : info.typeParameters()) {
      if (param.isParamSpec()) {
        continue;
      }
      Variance expected = expectedVariance(protocol, param);
      if (expected != param.variance()) {
        logger.debug(
            "{} in protocol {} is declared {} but used as {}",
            param,
            protocol,
            param.variance(),
            expected);
        diag.addMessage(mismatchKind(expected), param, protocol.simpleName());
        valid = false;
      }
    }
    return valid;
  }

  private static Kind mismatchKind(Variance expected) {
    switch (expected) {
      case COVARIANT:
        return Kind.PROTOCOL_VARIANCE_COVARIANT;
      case CONTRAVARIANT:
        return Kind.PROTOCOL_VARIANCE_CONTRAVARIANT;
      case INVARIANT:
        return Kind.PROTOCOL_VARIANCE_INVARIANT;
    }
    throw new AssertionError(expected);
  }
}
