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

package com.google.structural.binder;

import com.google.common.collect.ImmutableList;
import com.google.structural.bound.ClassInfo;
import com.google.structural.diag.TypeEvaluationError;
import com.google.structural.diag.TypeEvaluationError.ErrorKind;
import com.google.structural.env.ClassEnv;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.types.Specialize;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * Computes the C3 linearization of a class's ancestors.
 *
 * <p>Each ancestor is specialized in terms of the class's own type parameters, so that e.g. the MRO
 * of {@code class IntBox(Box[int])} contains {@code Box[int]} and not {@code Box[T]}.
 */
public class MroBinder {

  /** Binds the MRO of the class described by {@code builder}; its bases must be in {@code env}. */
  public static ClassInfo bind(ClassInfo.Builder builder, ClassEnv env) {
    ClassInfo unbound = builder.build();
    return unbound.toBuilder()
        .mro(new MroBinder(unbound.sym(), env).computeMro(unbound.baseClasses()))
        .build();
  }

  private final ClassSymbol origin;
  private final ClassEnv env;
  private final Specialize specialize;

  private MroBinder(ClassSymbol origin, ClassEnv env) {
    this.origin = origin;
    this.env = env;
    this.specialize = new Specialize(env);
  }

  private ImmutableList<ClassTy> computeMro(ImmutableList<ClassTy> declaredBases) {
    List<ClassTy> bases = new ArrayList<>(declaredBases);
    if (bases.isEmpty() && !origin.equals(ClassSymbol.OBJECT)) {
      bases.add(ClassTy.OBJECT.asInstantiable());
    }

    Set<ClassSymbol> seen = new HashSet<>();
    List<LinkedList<ClassTy>> sequences = new ArrayList<>();
    for (ClassTy base : bases) {
      if (base.sym().equals(origin)) {
        throw TypeEvaluationError.format(ErrorKind.CYCLIC_HIERARCHY, origin);
      }
      if (!seen.add(base.sym())) {
        throw TypeEvaluationError.format(ErrorKind.DUPLICATE_BASE_CLASS, base.sym(), origin);
      }
      LinkedList<ClassTy> sequence = new LinkedList<>();
      for (ClassTy ancestor : env.getInfo(base.sym()).mro()) {
        if (ancestor.sym().equals(origin)) {
          throw TypeEvaluationError.format(ErrorKind.CYCLIC_HIERARCHY, origin);
        }
        sequence.add(specialize.specializeForBaseClass(base, ancestor).asInstantiable());
      }
      sequences.add(sequence);
    }
    LinkedList<ClassTy> declared = new LinkedList<>();
    for (ClassTy base : bases) {
      declared.add(base.asInstantiable());
    }
    sequences.add(declared);

    ImmutableList.Builder<ClassTy> mro = ImmutableList.builder();
    mro.add(ClassTy.instantiable(origin));
    while (true) {
      sequences.removeIf(List::isEmpty);
      if (sequences.isEmpty()) {
        return mro.build();
      }
      ClassTy next = null;
      for (LinkedList<ClassTy> sequence : sequences) {
        ClassTy candidate = sequence.getFirst();
        if (!appearsInTail(candidate.sym(), sequences)) {
          next = candidate;
          break;
        }
      }
      if (next == null) {
        throw TypeEvaluationError.format(ErrorKind.INCONSISTENT_MRO, origin);
      }
      mro.add(next);
      for (LinkedList<ClassTy> sequence : sequences) {
        if (sequence.getFirst().sym().equals(next.sym())) {
          sequence.removeFirst();
        }
      }
    }
  }

  private static boolean appearsInTail(ClassSymbol sym, List<LinkedList<ClassTy>> sequences) {
    for (LinkedList<ClassTy> sequence : sequences) {
      for (int i = 1; i < sequence.size(); i++) {
        if (sequence.get(i).sym().equals(sym)) {
          return true;
        }
      }
    }
    return false;
  }
}
