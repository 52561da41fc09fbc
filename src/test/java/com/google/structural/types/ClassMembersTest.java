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

import static com.google.structural.testing.TestClasses.INT;
import static com.google.structural.testing.TestClasses.STR;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.structural.bound.Declaration;
import com.google.structural.bound.MemberInfo;
import com.google.structural.model.Variance;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.testing.TestClasses;
import com.google.structural.type.Type.ClassTy;
import com.google.structural.type.Type.TyVar;
import com.google.structural.types.ClassMembers.ClassMember;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ClassMembers}. */
@RunWith(JUnit4.class)
public final class ClassMembersTest {

  private final TestClasses classes = new TestClasses();

  @Test
  public void testMostDerivedDeclarationWins() {
    ClassSymbol base = classes.declare("c.Base").variable("x", STR).variable("y", STR).define();
    ClassSymbol derived = classes.declare("c.Derived").base(base).variable("x", INT).define();
    Specialize specialize = new Specialize(classes.env());

    ClassMember x = ClassMembers.lookUpClassMember(specialize, ClassTy.instance(derived), "x");
    assertEquals(INT, x.symbol().declaredType());
    assertEquals(ClassTy.instantiable(derived), x.classType());

    ClassMember y = ClassMembers.lookUpClassMember(specialize, ClassTy.instance(derived), "y");
    assertEquals(ClassTy.instantiable(base), y.classType());

    assertNull(ClassMembers.lookUpClassMember(specialize, ClassTy.instance(derived), "z"));
  }

  @Test
  public void testDeclaringClassIsSpecialized() {
    ClassSymbol box = new ClassSymbol("c.Box");
    TyVar t = TestClasses.typeVar(box, "T", Variance.INVARIANT);
    classes.declare(box).typeParameters(t).method("get", t).define();
    ClassSymbol intBox = classes.declare("c.IntBox").base(ClassTy.instance(box, INT)).define();
    Specialize specialize = new Specialize(classes.env());

    ClassMember get = ClassMembers.lookUpClassMember(specialize, ClassTy.instance(intBox), "get");
    assertEquals(ClassTy.instance(box, INT).asInstantiable(), get.classType());
    assertEquals(
        ClassTy.instance(box, STR).asInstantiable(),
        ClassMembers.lookUpClassMember(specialize, ClassTy.instance(box, STR), "get").classType());
  }

  @Test
  public void testInstanceMember() {
    ClassSymbol point =
        classes
            .declare("c.Point")
            .member(MemberInfo.instanceMember("x", Declaration.variable(INT)))
            .variable("origin", ClassTy.instance(new ClassSymbol("c.Point")))
            .define();
    Specialize specialize = new Specialize(classes.env());

    assertTrue(
        ClassMembers.lookUpClassMember(specialize, ClassTy.instance(point), "x")
            .isInstanceMember());
    assertFalse(
        ClassMembers.lookUpClassMember(specialize, ClassTy.instance(point), "origin")
            .isInstanceMember());
  }
}
