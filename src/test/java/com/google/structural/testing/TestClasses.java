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

package com.google.structural.testing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.structural.binder.MroBinder;
import com.google.structural.bound.ClassInfo;
import com.google.structural.bound.Declaration;
import com.google.structural.bound.MemberInfo;
import com.google.structural.env.ClassEnv;
import com.google.structural.evaluator.BasicTypeEvaluator;
import com.google.structural.evaluator.EvaluatorOptions;
import com.google.structural.model.ClassFlag;
import com.google.structural.model.FunctionFlag;
import com.google.structural.model.Variance;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.sym.FunctionSymbol;
import com.google.structural.sym.Symbol;
import com.google.structural.sym.TyVarSymbol;
import com.google.structural.type.ReturnTypeInference;
import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.FunctionTy;
import com.google.structural.type.Type.ModuleTy;
import com.google.structural.type.Type.Param;
import com.google.structural.type.Type.PropertyTy;
import com.google.structural.type.Type.TyVar;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Builds environments of bound classes for tests. */
public final class TestClasses {

  public static final ClassSymbol LIST = new ClassSymbol("builtins.list");

  public static final ClassTy INT = ClassTy.instance(ClassSymbol.INT);
  public static final ClassTy BOOL = ClassTy.instance(ClassSymbol.BOOL);
  public static final ClassTy FLOAT = ClassTy.instance(ClassSymbol.FLOAT);
  public static final ClassTy STR = ClassTy.instance(ClassSymbol.STR);
  public static final ClassTy OBJECT = ClassTy.OBJECT;

  private final ClassEnv.Builder classes = ClassEnv.builder();

  /** An environment holding the builtin classes. */
  public TestClasses() {
    declare(ClassSymbol.OBJECT).flags(ClassFlag.BUILTIN).define();
    declare(ClassSymbol.TYPE).flags(ClassFlag.BUILTIN).define();
    declare(ClassSymbol.INT).flags(ClassFlag.BUILTIN).define();
    declare(ClassSymbol.BOOL).flags(ClassFlag.BUILTIN).base(ClassSymbol.INT).define();
    declare(ClassSymbol.FLOAT).flags(ClassFlag.BUILTIN).define();
    declare(ClassSymbol.STR).flags(ClassFlag.BUILTIN).define();
    declare(ClassSymbol.PROTOCOL).flags(ClassFlag.BUILTIN).define();
    TyVar listItem = typeVar(LIST, "T", Variance.INVARIANT);
    declare(LIST)
        .flags(ClassFlag.BUILTIN)
        .typeParameters(listItem)
        .method("append", Type.NONE, Param.simple("item", listItem))
        .define();
    declare(ClassSymbol.TYPED_DICT_FALLBACK)
        .flags(ClassFlag.BUILTIN)
        .method("keys", ClassTy.instance(LIST, STR))
        .define();
  }

  public ClassBuilder declare(String qualifiedName) {
    return declare(new ClassSymbol(qualifiedName));
  }

  public ClassBuilder declare(ClassSymbol sym) {
    return new ClassBuilder(sym);
  }

  /** Declares a class deriving directly from {@code typing.Protocol}. */
  public ClassBuilder protocol(String qualifiedName) {
    return protocol(new ClassSymbol(qualifiedName));
  }

  public ClassBuilder protocol(ClassSymbol sym) {
    return declare(sym).flags(ClassFlag.PROTOCOL).base(ClassSymbol.PROTOCOL);
  }

  public ClassEnv env() {
    return classes.build();
  }

  public ClassInfo info(ClassSymbol sym) {
    return classes.get(sym);
  }

  public BasicTypeEvaluator evaluator() {
    return new BasicTypeEvaluator(env());
  }

  public BasicTypeEvaluator evaluator(EvaluatorOptions options) {
    return new BasicTypeEvaluator(env(), options);
  }

  public static TyVar typeVar(Symbol owner, String name, Variance variance) {
    return TyVar.create(new TyVarSymbol(owner, name), variance);
  }

  /** An instance method; a {@code self} parameter is added in front of {@code params}. */
  public static FunctionTy method(
      ClassSymbol owner, String name, Type returnType, Param... params) {
    return FunctionTy.create(
        new FunctionSymbol(owner, name),
        withReceiver("self", params),
        returnType,
        0,
        null);
  }

  /** A class method; a {@code cls} parameter is added in front of {@code params}. */
  public static FunctionTy classMethod(
      ClassSymbol owner, String name, Type returnType, Param... params) {
    return FunctionTy.create(
        new FunctionSymbol(owner, name),
        withReceiver("cls", params),
        returnType,
        FunctionFlag.CLASS_METHOD,
        null);
  }

  /** An instance method without a return annotation. */
  public static FunctionTy inferredMethod(
      ClassSymbol owner, String name, Supplier<Type> inferrer, Param... params) {
    return FunctionTy.create(
        new FunctionSymbol(owner, name),
        withReceiver("self", params),
        null,
        0,
        new ReturnTypeInference(inferrer));
  }

  /** A module-level function. */
  public static FunctionTy function(String name, Type returnType, Param... params) {
    return FunctionTy.create(
        new FunctionSymbol(null, name), returnType, FunctionFlag.NOT_A_METHOD, params);
  }

  public static PropertyTy readOnlyProperty(ClassSymbol owner, String name, Type type) {
    return PropertyTy.readOnly(method(owner, name, type));
  }

  public static PropertyTy settableProperty(ClassSymbol owner, String name, Type type) {
    return PropertyTy.create(
        method(owner, name, type),
        method(owner, name, Type.NONE, Param.simple("value", type)),
        null);
  }

  public static ModuleTy module(String name, MemberInfo... members) {
    ImmutableMap.Builder<String, MemberInfo> fields = ImmutableMap.builder();
    for (MemberInfo member : members) {
      fields.put(member.name(), member);
    }
    return ModuleTy.create(name, fields.buildOrThrow());
  }

  private static ImmutableList<Param> withReceiver(String receiver, Param... params) {
    return ImmutableList.<Param>builder()
        .add(Param.simple(receiver, Type.UNKNOWN))
        .add(params)
        .build();
  }

  /** A class under construction; {@link #define} binds its MRO and adds it to the environment. */
  public final class ClassBuilder {
    private final ClassSymbol sym;
    private final ClassInfo.Builder builder;
    private final List<ClassTy> bases = new ArrayList<>();
    private final List<TyVar> typeParameters = new ArrayList<>();
    private final Map<String, MemberInfo> members = new LinkedHashMap<>();

    private ClassBuilder(ClassSymbol sym) {
      this.sym = sym;
      this.builder = ClassInfo.builder(sym);
    }

    @CanIgnoreReturnValue
    public ClassBuilder flags(int flags) {
      builder.addFlags(flags);
      return this;
    }

    @CanIgnoreReturnValue
    public ClassBuilder typeParameters(TyVar... params) {
      typeParameters.addAll(ImmutableList.copyOf(params));
      return this;
    }

    @CanIgnoreReturnValue
    public ClassBuilder base(ClassSymbol base) {
      return base(ClassTy.instantiable(base));
    }

    @CanIgnoreReturnValue
    public ClassBuilder base(ClassTy base) {
      bases.add(base.asInstantiable());
      return this;
    }

    @CanIgnoreReturnValue
    public ClassBuilder metaclass(ClassSymbol metaclass) {
      builder.metaclass(ClassTy.instantiable(metaclass));
      return this;
    }

    @CanIgnoreReturnValue
    public ClassBuilder member(MemberInfo member) {
      members.put(member.name(), member);
      return this;
    }

    @CanIgnoreReturnValue
    public ClassBuilder method(String name, Type returnType, Param... params) {
      return member(
          MemberInfo.classMember(
              name, Declaration.function(TestClasses.method(sym, name, returnType, params))));
    }

    @CanIgnoreReturnValue
    public ClassBuilder function(String name, Type functionType) {
      return member(MemberInfo.classMember(name, Declaration.function(functionType)));
    }

    /** A mutable class-level variable, e.g. {@code x: int}. */
    @CanIgnoreReturnValue
    public ClassBuilder variable(String name, Type type) {
      return member(MemberInfo.classMember(name, Declaration.variable(type)));
    }

    @CanIgnoreReturnValue
    public ClassBuilder property(String name, Type type) {
      return function(name, readOnlyProperty(sym, name, type));
    }

    public ClassSymbol define() {
      builder.typeParameters(ImmutableList.copyOf(typeParameters));
      builder.baseClasses(ImmutableList.copyOf(bases));
      for (MemberInfo member : members.values()) {
        builder.addField(member);
      }
      ClassInfo info = MroBinder.bind(builder, classes.build());
      classes.put(info);
      return info.sym();
    }
  }
}
