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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.structural.bound.ClassInfo;
import com.google.structural.diag.TypeEvaluationError;
import com.google.structural.diag.TypeEvaluationError.ErrorKind;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.testing.TestClasses;
import com.google.structural.type.Type.ClassTy;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ClassEnv}. */
@RunWith(JUnit4.class)
public final class ClassEnvTest {

  private static ClassInfo leaf(ClassSymbol sym, ClassTy base) {
    return ClassInfo.builder(sym)
        .baseClasses(ImmutableList.of(base))
        .mro(ImmutableList.of(ClassTy.instantiable(sym), base))
        .build();
  }

  @Test
  public void testGetInfo() {
    ClassEnv env = new TestClasses().env();
    assertEquals(ClassSymbol.INT, env.getInfo(ClassSymbol.INT).sym());
    assertTrue(env.contains(ClassSymbol.OBJECT));
    assertNull(env.lookup(new ClassSymbol("m.Absent")));
  }

  @Test
  public void testGetInfoMissing() {
    ClassEnv env = new TestClasses().env();
    TypeEvaluationError e =
        assertThrows(TypeEvaluationError.class, () -> env.getInfo(new ClassSymbol("m.Absent")));
    assertEquals(ErrorKind.CLASS_NOT_FOUND, e.kind());
    assertEquals("could not resolve class m.Absent", e.getMessage());
  }

  @Test
  public void testWithClassesShadows() {
    ClassSymbol thing = new ClassSymbol("m.Thing");
    ClassInfo first = leaf(thing, ClassTy.OBJECT.asInstantiable());
    ClassInfo second = leaf(thing, ClassTy.instantiable(ClassSymbol.INT));
    ClassEnv base = ClassEnv.builder().put(first).build();

    ClassEnv overlaid = base.withClasses(ImmutableMap.of(thing, second));

    assertSame(second, overlaid.getInfo(thing));
    assertSame(first, base.getInfo(thing));
    assertSame(base, base.withClasses(ImmutableMap.of()));
  }

  @Test
  public void testBuilderSeesEarlierClasses() {
    ClassSymbol thing = new ClassSymbol("m.Thing");
    ClassEnv.Builder builder = ClassEnv.builder();
    assertNull(builder.get(thing));
    ClassInfo info = leaf(thing, ClassTy.OBJECT.asInstantiable());
    builder.put(info);
    assertSame(info, builder.get(thing));
    assertFalse(builder.build().asMap().isEmpty());
  }

  @Test
  public void testEvaluatorAddsSyntheticClasses() {
    TestClasses classes = new TestClasses();
    ClassEnv env = classes.evaluator().env();
    assertTrue(env.contains(ClassSymbol.VARIANCE_DUMMY));
    assertTrue(env.contains(ClassSymbol.STR));
    assertFalse(classes.env().contains(ClassSymbol.VARIANCE_DUMMY));
  }
}
