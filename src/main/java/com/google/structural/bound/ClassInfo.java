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

package com.google.structural.bound;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.structural.model.ClassFlag;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.TyVar;
import org.jspecify.annotations.Nullable;

/**
 * A bound class: its ancestors, type parameters and own members.
 *
 * <p>Ancestor types are expressed in terms of this class's own type parameters, e.g. the MRO of
 * {@code class Box(Generic[T], SupportsGet[T])} contains {@code SupportsGet[T]}.
 */
@AutoValue
public abstract class ClassInfo {

  /** The class symbol. */
  public abstract ClassSymbol sym();

  /** {@link ClassFlag} bits. */
  public abstract int flags();

  /** Declared type parameters, in order. */
  public abstract ImmutableList<TyVar> typeParameters();

  /** The direct base classes, as written. */
  public abstract ImmutableList<ClassTy> baseClasses();

  /**
   * The linearized ancestors, most specific first. The first entry is the class itself,
   * unspecialized.
   */
  public abstract ImmutableList<ClassTy> mro();

  /** The class's own members, in declaration order. */
  public abstract ImmutableMap<String, MemberInfo> fields();

  /** The class object of the metaclass, if it is not {@code type}. */
  public abstract @Nullable ClassTy metaclass();

  public boolean isProtocol() {
    return (flags() & ClassFlag.PROTOCOL) != 0;
  }

  public boolean isTypedDict() {
    return (flags() & ClassFlag.TYPED_DICT) != 0;
  }

  public boolean isFinal() {
    return (flags() & ClassFlag.FINAL) != 0;
  }

  /** Returns true if this is the given builtins or typing class. */
  public boolean isBuiltIn(ClassSymbol builtin) {
    return (flags() & ClassFlag.BUILTIN) != 0 && sym().equals(builtin);
  }

  /** Returns the type parameter with the given name, or {@code null}. */
  public @Nullable TyVar typeParameter(String name) {
    for (TyVar param : typeParameters()) {
      if (param.sym().name().equals(name)) {
        return param;
      }
    }
    return null;
  }

  /** An instance of this class specialized with its own type parameters. */
  public ClassTy selfSpecializedInstance() {
    if (typeParameters().isEmpty()) {
      return ClassTy.instance(sym());
    }
    return ClassTy.create(
        sym(), ImmutableList.<Type>copyOf(typeParameters()), /* instance= */ true, null);
  }

  public abstract Builder toBuilder();

  public static Builder builder(ClassSymbol sym) {
    return new AutoValue_ClassInfo.Builder()
        .sym(sym)
        .flags(0)
        .typeParameters(ImmutableList.of())
        .baseClasses(ImmutableList.of())
        .mro(ImmutableList.of())
        .metaclass(null);
  }

  /** A builder for {@link ClassInfo}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder sym(ClassSymbol sym);

    public abstract Builder flags(int flags);

    public abstract Builder typeParameters(ImmutableList<TyVar> typeParameters);

    public abstract Builder baseClasses(ImmutableList<ClassTy> baseClasses);

    public abstract Builder mro(ImmutableList<ClassTy> mro);

    public abstract Builder metaclass(@Nullable ClassTy metaclass);

    abstract ImmutableMap.Builder<String, MemberInfo> fieldsBuilder();

    abstract ClassSymbol sym();

    abstract int flags();

    @CanIgnoreReturnValue
    public Builder addFlags(int flags) {
      return flags(flags() | flags);
    }

    @CanIgnoreReturnValue
    public Builder addField(MemberInfo member) {
      fieldsBuilder().put(member.name(), member);
      return this;
    }

    public abstract ClassInfo build();
  }
}
