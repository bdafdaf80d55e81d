/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.unparse.gen;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Context for writing a syntax tree out as source code.
 *
 * <p>Output is a list of fragments. Newlines are not written when they are
 * requested, but are held until the next fragment arrives; by then the
 * indentation is known, and several requests have collapsed into the
 * largest of them.
 *
 * <p>A {@link Delimiter} reserves an empty fragment where its opening
 * parenthesis may go, and decides when it is closed whether to fill it.
 */
public class SourceWriter {
  private final List<String> result = new ArrayList<>();
  private final Deque<Delimiter> scopes = new ArrayDeque<>();
  private final String indentWith;
  private int indentation;
  private int newLines;
  /** Index of the fragment in which the current line starts. */
  private int lineFragment;
  /** Offset within that fragment at which the current line starts. */
  private int lineOffset;

  public SourceWriter(String indentWith) {
    this.indentWith = requireNonNull(indentWith);
  }

  /** Appends a fragment to the output, first writing any pending newlines
   * and the current indentation. */
  @CanIgnoreReturnValue
  public SourceWriter write(String s) {
    if (newLines > 0) {
      result.add(Strings.repeat("\n", newLines));
      newLines = 0;
      lineFragment = result.size();
      lineOffset = 0;
      result.add(Strings.repeat(indentWith, indentation));
    }
    if (!s.isEmpty()) {
      result.add(s);
      final int i = s.lastIndexOf('\n');
      if (i >= 0) {
        // a multi-line literal; the current line starts after its last newline
        lineFragment = result.size() - 1;
        lineOffset = i + 1;
      }
    }
    return this;
  }

  /** Requests a line break before the next fragment, followed by
   * {@code extra} blank lines. Requests made before the break is written
   * do not accumulate; the largest wins. */
  public void newline(int extra) {
    newLines = Math.max(newLines, 1 + extra);
  }

  /** Sets the number of pending newlines, overriding any earlier request. */
  public void setNewLines(int newLines) {
    checkArgument(newLines >= 0);
    this.newLines = newLines;
  }

  public int indentation() {
    return indentation;
  }

  public void indent() {
    ++indentation;
  }

  public void dedent() {
    checkState(indentation > 0, "dedent without indent");
    --indentation;
  }

  /** Opens a scope that may be wrapped in delimiters.
   *
   * <p>The delimiters are discarded if {@code precedence}, the binding
   * strength of the node inside the scope, is at least
   * {@code requiredPrecedence}, the strength that the context demands. */
  public Delimiter delimit(String open, String close, int precedence,
      int requiredPrecedence) {
    write("");
    result.add("");
    final Delimiter delimiter =
        new Delimiter(this, result.size() - 1, open, close, precedence,
            requiredPrecedence);
    scopes.push(delimiter);
    return delimiter;
  }

  /** Opens a scope whose delimiters are always written, such as the
   * brackets of a list. */
  public Delimiter delimit(String open, String close) {
    return delimit(open, close, -1, 0);
  }

  /** Called when a delimiter scope closes. */
  void resolve(Delimiter delimiter) {
    final Delimiter top = scopes.poll();
    if (top != delimiter) {
      throw new AssertionError("delimiter scopes must be closed in the "
          + "reverse order that they were opened");
    }
    if (!delimiter.isDiscard()) {
      result.set(delimiter.index, delimiter.open);
      result.add(delimiter.close);
    }
  }

  /** Returns the text of the line being written, from its start to the
   * end of the output. The slot of a scope that is still open is shown with
   * the scope's opening delimiter, as if it will be kept. */
  public String currentLine() {
    final StringBuilder b = new StringBuilder();
    for (int i = lineFragment; i < result.size(); i++) {
      final String fragment = pending(i);
      b.append(i == lineFragment
          ? fragment.substring(Math.min(lineOffset, fragment.length()))
          : fragment);
    }
    return b.toString();
  }

  private String pending(int i) {
    final String fragment = result.get(i);
    if (fragment.isEmpty()) {
      for (Delimiter scope : scopes) {
        if (scope.index == i) {
          return scope.open;
        }
      }
    }
    return fragment;
  }

  /** Starts a region of scratch output. Everything written until
   * {@link #cut} is called will be removed from the output. */
  public Region startRegion() {
    write("");
    return new Region(result.size(), lineFragment, lineOffset,
        scopes.size());
  }

  /** Removes the fragments written since a region started, and returns
   * them as a string. The line position reverts to what it was when the
   * region started. */
  public String cut(Region region) {
    checkState(scopes.size() == region.scopeCount,
        "delimiter scope is open across region");
    final List<String> tail = result.subList(region.start, result.size());
    final String s = String.join("", tail);
    tail.clear();
    lineFragment = region.lineFragment;
    lineOffset = region.lineOffset;
    return s;
  }

  /** Returns the fragments written so far, followed by a final newline.
   *
   * <p>If the first fragment consists only of newlines, it is replaced by
   * an empty string, unless it is the only fragment. */
  public List<String> finish() {
    checkState(scopes.isEmpty(), "delimiter scope is still open");
    final List<String> fragments = new ArrayList<>(result);
    fragments.add("\n");
    if (fragments.size() > 1
        && CharMatcher.is('\n').matchesAllOf(fragments.get(0))) {
      fragments.set(0, "");
    }
    return ImmutableList.copyOf(fragments);
  }

  /** Position in the output at which a scratch region started. */
  public static class Region {
    private final int start;
    private final int lineFragment;
    private final int lineOffset;
    private final int scopeCount;

    Region(int start, int lineFragment, int lineOffset, int scopeCount) {
      this.start = start;
      this.lineFragment = lineFragment;
      this.lineOffset = lineOffset;
      this.scopeCount = scopeCount;
    }
  }
}

// End SourceWriter.java
