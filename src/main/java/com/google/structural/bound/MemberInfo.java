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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.structural.model.MemberFlag;
import com.google.structural.type.Type;
import org.jspecify.annotations.Nullable;

/**
 * A named member of a class or module.
 *
 * <p>A member belongs to exactly one class's own member table; inherited members are found by
 * walking the class's ancestors.
 */
public class MemberInfo {

  private final String name;
  private final int flags;
  private final ImmutableList<Declaration> declarations;

  public MemberInfo(String name, int flags, ImmutableList<Declaration> declarations) {
    checkArgument(!declarations.isEmpty(), "member %s has no declarations", name);
    this.name = name;
    this.flags = flags;
    this.declarations = declarations;
  }

  /** A method, or any other member declared in the class body. */
  public static MemberInfo classMember(String name, Declaration... declarations) {
    return new MemberInfo(name, MemberFlag.CLASS_MEMBER, ImmutableList.copyOf(declarations));
  }

  /** A member annotated as {@code ClassVar[...]}. */
  public static MemberInfo classVar(String name, Declaration... declarations) {
    return new MemberInfo(
        name, MemberFlag.CLASS_MEMBER | MemberFlag.CLASS_VAR, ImmutableList.copyOf(declarations));
  }

  /** A member that is only ever assigned through {@code self}. */
  public static MemberInfo instanceMember(String name, Declaration... declarations) {
    return new MemberInfo(name, MemberFlag.INSTANCE_MEMBER, ImmutableList.copyOf(declarations));
  }

  /** The member name. */
  public String name() {
    return name;
  }

  /** {@link MemberFlag} bits. */
  public int flags() {
    return flags;
  }

  public ImmutableList<Declaration> declarations() {
    return declarations;
  }

  /** The first declaration, which decides whether the member is a mutable variable. */
  public Declaration primaryDeclaration() {
    return declarations.get(0);
  }

  /** Declarations that carry a type annotation. */
  public ImmutableList<Declaration> typedDeclarations() {
    ImmutableList.Builder<Declaration> result = ImmutableList.builder();
    for (Declaration decl : declarations) {
      if (decl.hasTypeAnnotation()) {
        result.add(decl);
      }
    }
    return result.build();
  }

  /** True if any typed declaration is a {@code Final} variable. */
  public boolean isFinalVariable() {
    for (Declaration decl : typedDeclarations()) {
      if (decl.kind() == Declaration.Kind.VARIABLE && decl.isFinal()) {
        return true;
      }
    }
    return false;
  }

  /** True if the primary declaration is a variable that may be reassigned. */
  public boolean isMutableVariable() {
    Declaration primary = primaryDeclaration();
    return primary.kind() == Declaration.Kind.VARIABLE && !primary.isFinal();
  }

  public boolean isClassMember() {
    return (flags & MemberFlag.CLASS_MEMBER) != 0;
  }

  public boolean isInstanceMember() {
    return (flags & MemberFlag.INSTANCE_MEMBER) != 0;
  }

  public boolean isClassVar() {
    return (flags & MemberFlag.CLASS_VAR) != 0;
  }

  public boolean isIgnoredForProtocolMatch() {
    return (flags & MemberFlag.IGNORED_FOR_PROTOCOL_MATCH) != 0;
  }

  /** Returns a copy of this member with additional flag bits. */
  public MemberInfo withFlags(int extraFlags) {
    return new MemberInfo(name, flags | extraFlags, declarations);
  }

  /** The declared type of the last annotated declaration, or {@code null}. */
  public @Nullable Type declaredType() {
    ImmutableList<Declaration> typed = typedDeclarations();
    return typed.isEmpty() ? null : typed.get(typed.size() - 1).type();
  }

  @Override
  public String toString() {
    return name;
  }
}
