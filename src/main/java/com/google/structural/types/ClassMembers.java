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

import com.google.auto.value.AutoValue;
import com.google.structural.bound.ClassInfo;
import com.google.structural.bound.MemberInfo;
import com.google.structural.type.Type.ClassTy;
import org.jspecify.annotations.Nullable;

/** Member lookup through a class's linearized ancestors. */
public final class ClassMembers {

  /** A member found on a class, together with the ancestor that declares it. */
  @AutoValue
  public abstract static class ClassMember {

    static ClassMember create(MemberInfo symbol, ClassTy classType) {
      return new AutoValue_ClassMembers_ClassMember(symbol, classType);
    }

    /** The member symbol, from the declaring class's own member table. */
    public abstract MemberInfo symbol();

    /**
     * The declaring class object, specialized with the type arguments of the class the lookup
     * started from.
     */
    public abstract ClassTy classType();

    public boolean isInstanceMember() {
      return symbol().isInstanceMember() && !symbol().isClassMember();
    }
  }

  /**
   * Looks up {@code name} in the MRO of {@code classType}, returning the most specific
   * declaration, or {@code null} if no ancestor declares it.
   */
  public static @Nullable ClassMember lookUpClassMember(
      Specialize specialize, ClassTy classType, String name) {
    ClassInfo info = specialize.env().getInfo(classType.sym());
    for (ClassTy mroClass : info.mro()) {
      MemberInfo symbol = specialize.env().getInfo(mroClass.sym()).fields().get(name);
      if (symbol != null) {
        ClassTy owner = specialize.specializeForBaseClass(classType, mroClass);
        return ClassMember.create(symbol, owner.asInstantiable());
      }
    }
    return null;
  }

  private ClassMembers() {}
}
