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

package com.google.structural.type;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.structural.bound.MemberInfo;
import com.google.structural.model.FunctionFlag;
import com.google.structural.model.Variance;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.sym.FunctionSymbol;
import com.google.structural.sym.TyVarSymbol;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/** Types of the checked language. */
public interface Type {

  /** A type kind. */
  enum TyKind {
    /** A class instance or a class object. */
    CLASS_TY,
    /** A module object. */
    MODULE_TY,
    /** A function or method. */
    FUNCTION_TY,
    /** A set of function overloads. */
    OVERLOADED_TY,
    /** A property object. */
    PROPERTY_TY,
    /** A type variable. */
    TY_VAR,
    /** The type of {@code None}. */
    NONE_TY,
    /** A type that could not be determined; assignable to and from everything. */
    UNKNOWN_TY,
  }

  /** The type kind. */
  TyKind tyKind();

  /** The type of {@code None}. */
  Type NONE =
      new Type() {
        @Override
        public TyKind tyKind() {
          return TyKind.NONE_TY;
        }

        @Override
        public final String toString() {
          return "None";
        }
      };

  /** The unknown type. */
  Type UNKNOWN =
      new Type() {
        @Override
        public TyKind tyKind() {
          return TyKind.UNKNOWN_TY;
        }

        @Override
        public final String toString() {
          return "Unknown";
        }
      };

  /**
   * A class type.
   *
   * <p>A class type is either an instance of the class or the class object itself. Type arguments
   * are absent for a class that has not been specialized, which is distinct from a specialization
   * with an empty argument list.
   */
  @AutoValue
  abstract class ClassTy implements Type {

    public static final ClassTy OBJECT = instance(ClassSymbol.OBJECT);

    /** Returns an instance of the given non-generic class. */
    public static ClassTy instance(ClassSymbol sym) {
      return create(sym, null, true, null);
    }

    /** Returns an instance of the given class specialized with the given type arguments. */
    public static ClassTy instance(ClassSymbol sym, Type... targs) {
      return create(sym, ImmutableList.copyOf(targs), true, null);
    }

    /** Returns the class object for the given class. */
    public static ClassTy instantiable(ClassSymbol sym) {
      return create(sym, null, false, null);
    }

    /** Returns a literal instance of the given class, e.g. {@code Literal[3]}. */
    public static ClassTy literal(ClassSymbol sym, Object value) {
      return create(sym, null, true, value);
    }

    public static ClassTy create(
        ClassSymbol sym,
        @Nullable ImmutableList<Type> targs,
        boolean instance,
        @Nullable Object literalValue) {
      return new AutoValue_Type_ClassTy(sym, targs, instance, literalValue);
    }

    /** The class symbol. */
    public abstract ClassSymbol sym();

    /** The type arguments, or {@code null} if the class has not been specialized. */
    public abstract @Nullable ImmutableList<Type> targs();

    /** True for an instance of the class, false for the class object. */
    public abstract boolean instance();

    /** The literal value of a literal type. */
    public abstract @Nullable Object literalValue();

    @Override
    public TyKind tyKind() {
      return TyKind.CLASS_TY;
    }

    public boolean isInstantiable() {
      return !instance();
    }

    public ClassTy asInstance() {
      return instance() ? this : create(sym(), targs(), true, literalValue());
    }

    public ClassTy asInstantiable() {
      return instance() ? create(sym(), targs(), false, literalValue()) : this;
    }

    /** Returns this class with the given type arguments, or unspecialized if {@code null}. */
    public ClassTy withTypeArguments(@Nullable ImmutableList<Type> targs) {
      return create(sym(), targs, instance(), literalValue());
    }

    public ClassTy withoutLiteral() {
      return literalValue() == null ? this : create(sym(), targs(), instance(), null);
    }

    /** Returns true if both types refer to the same class, ignoring type arguments. */
    public boolean isSameGenericClass(ClassTy other) {
      return sym().equals(other.sym());
    }

    @Memoized
    @Override
    public abstract int hashCode();

    @Override
    public final String toString() {
      StringBuilder sb = new StringBuilder();
      if (literalValue() != null) {
        sb.append("Literal[");
        if (literalValue() instanceof String) {
          sb.append('\'').append(literalValue()).append('\'');
        } else {
          sb.append(literalValue());
        }
        sb.append(']');
      } else {
        sb.append(sym().simpleName());
        if (targs() != null && !targs().isEmpty()) {
          sb.append('[');
          Joiner.on(", ").appendTo(sb, targs());
          sb.append(']');
        }
      }
      return instance() ? sb.toString() : "type[" + sb + "]";
    }
  }

  /** A module object, with a flat member table. */
  @AutoValue
  abstract class ModuleTy implements Type {

    public static ModuleTy create(String name, ImmutableMap<String, MemberInfo> fields) {
      return new AutoValue_Type_ModuleTy(name, fields);
    }

    /** The module's qualified name. */
    public abstract String name();

    /** The module's top-level symbols, in declaration order. */
    public abstract ImmutableMap<String, MemberInfo> fields();

    @Override
    public TyKind tyKind() {
      return TyKind.MODULE_TY;
    }

    @Override
    public final String toString() {
      return "Module(\"" + name() + "\")";
    }
  }

  /** A function parameter. */
  @AutoValue
  abstract class Param {

    /** The parameter category. */
    public enum Category {
      SIMPLE,
      /** {@code *args} */
      VAR_ARGS,
      /** {@code **kwargs} */
      KW_ARGS
    }

    public static Param create(String name, Type type, Category category, boolean hasDefault) {
      return new AutoValue_Type_Param(name, type, category, hasDefault);
    }

    public static Param simple(String name, Type type) {
      return create(name, type, Category.SIMPLE, false);
    }

    public static Param withDefault(String name, Type type) {
      return create(name, type, Category.SIMPLE, true);
    }

    public static Param varArgs(String name, Type type) {
      return create(name, type, Category.VAR_ARGS, false);
    }

    public static Param kwArgs(String name, Type type) {
      return create(name, type, Category.KW_ARGS, false);
    }

    public abstract String name();

    /** The declared parameter type, or {@link Type#UNKNOWN} if unannotated. */
    public abstract Type type();

    public abstract Category category();

    public abstract boolean hasDefault();

    public Param withType(Type type) {
      return create(name(), type, category(), hasDefault());
    }

    /** Positional-only parameters are named with a leading double underscore. */
    public boolean isPositionalOnly() {
      return name().startsWith("__") && !name().endsWith("__");
    }

    @Override
    public final String toString() {
      StringBuilder sb = new StringBuilder();
      switch (category()) {
        case VAR_ARGS:
          sb.append('*');
          break;
        case KW_ARGS:
          sb.append("**");
          break;
        case SIMPLE:
          break;
      }
      sb.append(name());
      if (type().tyKind() != TyKind.UNKNOWN_TY) {
        sb.append(": ").append(type());
      }
      if (hasDefault()) {
        sb.append(" = ...");
      }
      return sb.toString();
    }
  }

  /** A function or method. */
  @AutoValue
  abstract class FunctionTy implements Type {

    public static FunctionTy create(
        FunctionSymbol sym,
        ImmutableList<Param> params,
        @Nullable Type declaredReturnType,
        int flags,
        @Nullable ReturnTypeInference inference) {
      return new AutoValue_Type_FunctionTy(sym, params, declaredReturnType, flags, inference);
    }

    /** Creates a function with a declared return type. */
    public static FunctionTy create(
        FunctionSymbol sym, Type returnType, int flags, Param... params) {
      return create(sym, ImmutableList.copyOf(params), returnType, flags, null);
    }

    /** Creates a function whose return type is inferred on demand. */
    public static FunctionTy inferred(
        FunctionSymbol sym, ReturnTypeInference inference, int flags, Param... params) {
      return create(sym, ImmutableList.copyOf(params), null, flags, inference);
    }

    public abstract FunctionSymbol sym();

    public abstract ImmutableList<Param> params();

    /** The annotated return type, or {@code null} if the return type is inferred. */
    public abstract @Nullable Type declaredReturnType();

    /** {@link FunctionFlag} bits. */
    public abstract int flags();

    /** The return type inference slot of an unannotated function. */
    public abstract @Nullable ReturnTypeInference inference();

    @Override
    public TyKind tyKind() {
      return TyKind.FUNCTION_TY;
    }

    public String name() {
      return sym().name();
    }

    public boolean isStaticMethod() {
      return (flags() & FunctionFlag.STATIC_METHOD) != 0;
    }

    public boolean isClassMethod() {
      return (flags() & FunctionFlag.CLASS_METHOD) != 0;
    }

    public boolean isConstructorMethod() {
      return (flags() & FunctionFlag.CONSTRUCTOR_METHOD) != 0;
    }

    public boolean isInstanceMethod() {
      return (flags()
              & (FunctionFlag.STATIC_METHOD
                  | FunctionFlag.CLASS_METHOD
                  | FunctionFlag.CONSTRUCTOR_METHOD
                  | FunctionFlag.NOT_A_METHOD))
          == 0;
    }

    /**
     * The declared return type, or the inferred one if inference has completed, or {@link
     * Type#UNKNOWN}.
     */
    public Type effectiveReturnType() {
      if (declaredReturnType() != null) {
        return declaredReturnType();
      }
      Type inferred = inference() != null ? inference().inferredType() : null;
      return inferred != null ? inferred : Type.UNKNOWN;
    }

    public FunctionTy withParams(ImmutableList<Param> params) {
      return create(sym(), params, declaredReturnType(), flags(), inference());
    }

    public FunctionTy withReturnType(Type returnType) {
      return create(sym(), params(), returnType, flags(), inference());
    }

    @Override
    public final String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append('(');
      Joiner.on(", ").appendTo(sb, params());
      sb.append(") -> ");
      sb.append(effectiveReturnType());
      return sb.toString();
    }
  }

  /** An overloaded function. */
  @AutoValue
  abstract class OverloadedTy implements Type {

    public static OverloadedTy create(ImmutableList<FunctionTy> overloads) {
      return new AutoValue_Type_OverloadedTy(overloads);
    }

    public static OverloadedTy create(FunctionTy... overloads) {
      return create(ImmutableList.copyOf(Arrays.asList(overloads)));
    }

    public abstract ImmutableList<FunctionTy> overloads();

    @Override
    public TyKind tyKind() {
      return TyKind.OVERLOADED_TY;
    }

    @Override
    public final String toString() {
      return "Overload[" + Joiner.on(", ").join(overloads()) + "]";
    }
  }

  /** A property object. */
  @AutoValue
  abstract class PropertyTy implements Type {

    public static PropertyTy create(
        FunctionTy getter, @Nullable FunctionTy setter, @Nullable FunctionTy deleter) {
      return new AutoValue_Type_PropertyTy(getter, setter, deleter);
    }

    public static PropertyTy readOnly(FunctionTy getter) {
      return create(getter, null, null);
    }

    public abstract FunctionTy getter();

    public abstract @Nullable FunctionTy setter();

    public abstract @Nullable FunctionTy deleter();

    @Override
    public TyKind tyKind() {
      return TyKind.PROPERTY_TY;
    }

    @Override
    public final String toString() {
      return "property";
    }
  }

  /** A type variable. */
  @AutoValue
  abstract class TyVar implements Type {

    /** What kind of type variable. */
    public enum Flavor {
      TYPE_VAR,
      /** A parameter specification, standing for a whole parameter list. */
      PARAM_SPEC,
      /** The synthesized variable for the implementing class. */
      SELF
    }

    public static TyVar create(TyVarSymbol sym, Flavor flavor, Variance variance) {
      return new AutoValue_Type_TyVar(sym, flavor, variance);
    }

    public static TyVar create(TyVarSymbol sym, Variance variance) {
      return create(sym, Flavor.TYPE_VAR, variance);
    }

    public static TyVar paramSpec(TyVarSymbol sym) {
      return create(sym, Flavor.PARAM_SPEC, Variance.INVARIANT);
    }

    /** The synthesized {@code Self} type variable of the given class. */
    public static TyVar self(ClassSymbol owner) {
      return create(TyVarSymbol.selfOf(owner), Flavor.SELF, Variance.INVARIANT);
    }

    public abstract TyVarSymbol sym();

    public abstract Flavor flavor();

    public abstract Variance variance();

    @Override
    public TyKind tyKind() {
      return TyKind.TY_VAR;
    }

    public boolean isParamSpec() {
      return flavor() == Flavor.PARAM_SPEC;
    }

    public boolean isSelf() {
      return flavor() == Flavor.SELF;
    }

    public TyVar withVariance(Variance variance) {
      return create(sym(), flavor(), variance);
    }

    @Memoized
    @Override
    public abstract int hashCode();

    @Override
    public final String toString() {
      return sym().name();
    }
  }
}
