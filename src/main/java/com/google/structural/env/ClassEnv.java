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

package com.google.structural.env;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.structural.bound.ClassInfo;
import com.google.structural.diag.TypeEvaluationError;
import com.google.structural.diag.TypeEvaluationError.ErrorKind;
import com.google.structural.sym.ClassSymbol;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The bound classes visible to an evaluation, keyed by symbol.
 *
 * <p>Types refer to classes only by symbol, so self-referential protocols and mutually recursive
 * classes are represented with immutable nodes: the cycle goes through the env.
 */
public final class ClassEnv {

  private final ImmutableMap<ClassSymbol, ClassInfo> classes;

  private ClassEnv(ImmutableMap<ClassSymbol, ClassInfo> classes) {
    this.classes = classes;
  }

  public static ClassEnv of(ImmutableMap<ClassSymbol, ClassInfo> classes) {
    return new ClassEnv(classes);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the bound class for {@code sym}, or {@code null} if it is not declared here. */
  public @Nullable ClassInfo lookup(ClassSymbol sym) {
    return classes.get(sym);
  }

  public boolean contains(ClassSymbol sym) {
    return classes.containsKey(sym);
  }

  /**
   * Returns the bound class for {@code sym}.
   *
   * @throws TypeEvaluationError with {@link ErrorKind#CLASS_NOT_FOUND} if it is not declared
   */
  public ClassInfo getInfo(ClassSymbol sym) {
    ClassInfo info = classes.get(sym);
    if (info == null) {
      throw TypeEvaluationError.format(ErrorKind.CLASS_NOT_FOUND, sym);
    }
    return info;
  }

  /** Returns an env that also holds {@code overlay}; its classes shadow classes of this env. */
  public ClassEnv withClasses(ImmutableMap<ClassSymbol, ClassInfo> overlay) {
    if (overlay.isEmpty()) {
      return this;
    }
    return new ClassEnv(
        ImmutableMap.<ClassSymbol, ClassInfo>builder()
            .putAll(classes)
            .putAll(overlay)
            .buildKeepingLast());
  }

  public ImmutableMap<ClassSymbol, ClassInfo> asMap() {
    return classes;
  }

  /** A builder for {@link ClassEnv}; classes may be bound against the ones added before them. */
  public static class Builder {
    private final Map<ClassSymbol, ClassInfo> classes = new LinkedHashMap<>();

    @CanIgnoreReturnValue
    public Builder put(ClassInfo info) {
      classes.put(info.sym(), info);
      return this;
    }

    public @Nullable ClassInfo get(ClassSymbol sym) {
      return classes.get(sym);
    }

    public ClassEnv build() {
      return new ClassEnv(ImmutableMap.copyOf(classes));
    }
  }
}
