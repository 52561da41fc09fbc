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

package com.google.structural.protocols;

import static com.google.common.base.Verify.verify;

import com.google.structural.type.Type;
import com.google.structural.type.Type.ClassTy;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BiPredicate;

/**
 * The (candidate, protocol) pairs whose comparison is in progress.
 *
 * <p>A protocol that refers to itself, directly or through its members, would otherwise be
 * compared forever. A pair that is already in flight is assumed to be assignable.
 */
public class ProtocolAssignmentStack {

  private final Deque<Entry> entries = new ArrayDeque<>();
  private final BiPredicate<Type, Type> isTypeSame;

  public ProtocolAssignmentStack(BiPredicate<Type, Type> isTypeSame) {
    this.isTypeSame = isTypeSame;
  }

  /** Returns true if the comparison of {@code srcType} against {@code destType} is in flight. */
  public boolean contains(ClassTy srcType, ClassTy destType) {
    for (Entry entry : entries) {
      if (isTypeSame.test(entry.srcType, srcType) && isTypeSame.test(entry.destType, destType)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Records a comparison as in flight until the returned entry is closed.
   *
   * <pre>{@code
   * try (ProtocolAssignmentStack.Entry unused = stack.enter(src, dest)) {
   *   ...
   * }
   * }</pre>
   */
  public Entry enter(ClassTy srcType, ClassTy destType) {
    Entry entry = new Entry(srcType, destType);
    entries.push(entry);
    return entry;
  }

  public int depth() {
    return entries.size();
  }

  /** An in-flight comparison. */
  public final class Entry implements AutoCloseable {
    private final ClassTy srcType;
    private final ClassTy destType;

    private Entry(ClassTy srcType, ClassTy destType) {
      this.srcType = srcType;
      this.destType = destType;
    }

    @Override
    public void close() {
      Entry top = entries.pop();
      verify(top == this, "unbalanced protocol assignment stack: %s", top);
    }

    @Override
    public String toString() {
      return srcType + " -> " + destType;
    }
  }
}
