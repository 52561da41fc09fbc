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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.structural.sym.ClassSymbol;
import com.google.structural.type.Type.ClassTy;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ReturnTypeInference}. */
@RunWith(JUnit4.class)
public final class ReturnTypeInferenceTest {

  private static final ClassTy INT = ClassTy.instance(ClassSymbol.INT);

  @Test
  public void testInferenceRunsOnce() {
    AtomicInteger calls = new AtomicInteger();
    ReturnTypeInference inference =
        new ReturnTypeInference(
            () -> {
              calls.incrementAndGet();
              return INT;
            });

    assertNull(inference.inferredType());
    assertFalse(inference.isInferred());
    assertEquals(INT, inference.infer());
    assertEquals(INT, inference.infer());
    assertEquals(INT, inference.inferredType());
    assertTrue(inference.isInferred());
    assertEquals(1, calls.get());
  }

  @Test
  public void testReentrantInferenceIsUnknown() {
    AtomicReference<ReturnTypeInference> self = new AtomicReference<>();
    AtomicReference<Type> nested = new AtomicReference<>();
    ReturnTypeInference inference =
        new ReturnTypeInference(
            () -> {
              nested.set(self.get().infer());
              return INT;
            });
    self.set(inference);

    assertEquals(INT, inference.infer());
    assertSame(Type.UNKNOWN, nested.get());
  }

  @Test
  public void testFailedInferenceCanBeRetried() {
    AtomicInteger calls = new AtomicInteger();
    ReturnTypeInference inference =
        new ReturnTypeInference(
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("not ready");
              }
              return INT;
            });

    assertThrows(IllegalStateException.class, inference::infer);
    assertNull(inference.inferredType());
    assertEquals(INT, inference.infer());
  }

  @Test
  public void testCompleted() {
    ReturnTypeInference inference = ReturnTypeInference.of(INT);

    assertTrue(inference.isInferred());
    assertEquals(INT, inference.infer());
  }
}
