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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.google.structural.model.Variance;
import com.google.structural.sym.ClassSymbol;
import com.google.structural.testing.TestClasses;
import com.google.structural.type.Type.TyVar;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link TypeVarContext}. */
@RunWith(JUnit4.class)
public final class TypeVarContextTest {

  private final ClassSymbol box = new ClassSymbol("c.Box");
  private final TyVar t = TestClasses.typeVar(box, "T", Variance.INVARIANT);

  @Test
  public void testSetRequiresScope() {
    TypeVarContext context = new TypeVarContext();

    assertThrows(IllegalArgumentException.class, () -> context.set(t.sym(), INT));
    context.addSolveForScope(box);
    context.set(t.sym(), INT);
    assertEquals(INT, context.get(t.sym()));
  }

  @Test
  public void testIsEmpty() {
    TypeVarContext context = new TypeVarContext(box);
    assertTrue(context.isEmpty());

    context.setSelfType(STR);
    assertFalse(context.isEmpty());
  }

  @Test
  public void testCopyIsIndependent() {
    TypeVarContext context = new TypeVarContext(box);
    context.set(t.sym(), INT);

    TypeVarContext copy = context.copy();
    copy.set(t.sym(), STR);
    assertEquals(INT, context.get(t.sym()));
    assertEquals(STR, copy.get(t.sym()));
    assertTrue(copy.hasSolveForScope(box));

    context.copyFrom(copy);
    assertEquals(ImmutableMap.of(t.sym(), STR), context.solutions());
    assertNull(context.selfType());
  }
}
