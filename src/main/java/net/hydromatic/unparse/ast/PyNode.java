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
package net.hydromatic.unparse.ast;

import static java.util.Objects.requireNonNull;

import net.hydromatic.unparse.Unparser;

/** Abstract syntax tree node. */
public abstract class PyNode {
  public final Pos pos;
  public final Op op;

  public PyNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into Python source code, without the trailing
   * newline.
   *
   * <p>The purpose of this string is debugging. An expression that is not
   * inside a statement has no context that would let it shed parentheses,
   * so {@code a + b} prints as "(a + b)". To generate a program, call
   * {@link Unparser#toSource} on a module.
   */
  @Override
  public final String toString() {
    // Marked final because you should override SourceGenerator, not toString
    final String s = Unparser.toSource(this);
    return s.substring(0, s.length() - 1);
  }

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End PyNode.java
