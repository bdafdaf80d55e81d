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

import static java.util.Objects.requireNonNull;

/**
 * Scope that may be wrapped in delimiters, usually parentheses.
 *
 * <p>Created by {@link SourceWriter#delimit}, which reserves an empty
 * fragment for the opening delimiter. When the scope is closed, the
 * delimiters are written unless they have been discarded. Scopes must be
 * closed in the reverse order that they were opened, which a
 * {@code try}-with-resources block guarantees.
 */
public class Delimiter implements AutoCloseable {
  private final SourceWriter writer;
  final int index;
  final String open;
  final String close;
  /** Precedence of the node inside the scope. */
  public final int precedence;
  /** Precedence that the context requires. */
  public final int requiredPrecedence;
  private boolean discard;

  Delimiter(SourceWriter writer, int index, String open, String close,
      int precedence, int requiredPrecedence) {
    this.writer = requireNonNull(writer);
    this.index = index;
    this.open = requireNonNull(open);
    this.close = requireNonNull(close);
    this.precedence = precedence;
    this.requiredPrecedence = requiredPrecedence;
    this.discard = precedence >= requiredPrecedence;
  }

  /** Returns whether the delimiters will be omitted. */
  public boolean isDiscard() {
    return discard;
  }

  /** Overrides the decision whether to omit the delimiters. */
  public void setDiscard(boolean discard) {
    this.discard = discard;
  }

  @Override public void close() {
    writer.resolve(this);
  }
}

// End Delimiter.java
