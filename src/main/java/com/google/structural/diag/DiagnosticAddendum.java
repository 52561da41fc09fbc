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

package com.google.structural.diag;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.structural.diag.AddendumMessage.Kind;
import java.util.ArrayList;
import java.util.List;

/**
 * A tree of messages explaining why a type check failed.
 *
 * <p>Addenda are optional everywhere: callers that do not want diagnostics pass {@code null}, and
 * checks only create child nodes when they have a parent to attach them to.
 */
public class DiagnosticAddendum {

  private static final int DEFAULT_MAX_DEPTH = 8;
  private static final int DEFAULT_MAX_LINE_COUNT = 16;

  private final List<AddendumMessage> messages = new ArrayList<>();
  private final List<DiagnosticAddendum> children = new ArrayList<>();

  /** Creates a nested addendum. */
  public DiagnosticAddendum createAddendum() {
    DiagnosticAddendum child = new DiagnosticAddendum();
    children.add(child);
    return child;
  }

  @CanIgnoreReturnValue
  public DiagnosticAddendum addMessage(Kind kind, Object... args) {
    messages.add(AddendumMessage.create(kind, args));
    return this;
  }

  public ImmutableList<AddendumMessage> messages() {
    return ImmutableList.copyOf(messages);
  }

  public ImmutableList<DiagnosticAddendum> children() {
    return ImmutableList.copyOf(children);
  }

  /** True if neither this node nor any descendant holds a message. */
  public boolean isEmpty() {
    if (!messages.isEmpty()) {
      return false;
    }
    for (DiagnosticAddendum child : children) {
      if (!child.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /** All messages in the tree, in pre-order. */
  public ImmutableList<AddendumMessage> allMessages() {
    ImmutableList.Builder<AddendumMessage> result = ImmutableList.builder();
    collect(result);
    return result.build();
  }

  private void collect(ImmutableList.Builder<AddendumMessage> result) {
    result.addAll(messages);
    for (DiagnosticAddendum child : children) {
      child.collect(result);
    }
  }

  /** Returns true if any message in the tree has the given kind. */
  public boolean contains(Kind kind) {
    for (AddendumMessage message : allMessages()) {
      if (message.kind() == kind) {
        return true;
      }
    }
    return false;
  }

  public String getString() {
    return getString(DEFAULT_MAX_DEPTH, DEFAULT_MAX_LINE_COUNT);
  }

  /** Renders the tree as newline-separated lines, indented two spaces per level. */
  public String getString(int maxDepth, int maxLineCount) {
    List<String> lines = new ArrayList<>();
    render(lines, 0, maxDepth);
    if (lines.size() > maxLineCount) {
      lines = new ArrayList<>(lines.subList(0, maxLineCount));
      lines.add("  ...");
    }
    return String.join("\n", lines);
  }

  private void render(List<String> lines, int depth, int maxDepth) {
    if (depth >= maxDepth) {
      return;
    }
    String indent = Strings.repeat("  ", depth);
    int childDepth = depth;
    for (AddendumMessage message : messages) {
      lines.add(indent + message.message());
    }
    if (!messages.isEmpty()) {
      childDepth++;
    }
    for (DiagnosticAddendum child : children) {
      child.render(lines, childDepth, maxDepth);
    }
  }

  @Override
  public String toString() {
    return getString();
  }
}
