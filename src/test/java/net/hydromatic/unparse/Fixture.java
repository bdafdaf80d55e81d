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
package net.hydromatic.unparse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.unparse.ast.PyBuilder.py;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.UnaryOperator;
import net.hydromatic.unparse.ast.Py;
import net.hydromatic.unparse.ast.PyNode;
import net.hydromatic.unparse.gen.UnparseConfig;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Fixture {
  private final PyNode node;
  private final UnparseConfig config;

  private Fixture(PyNode node, UnparseConfig config) {
    this.node = requireNonNull(node);
    this.config = requireNonNull(config);
  }

  /** Creates a fixture for a tree. */
  static Fixture node(PyNode node) {
    return new Fixture(node, UnparseConfig.DEFAULT);
  }

  /** Creates a fixture for a module that contains the given statements. */
  static Fixture stmt(Py.Stmt... statements) {
    return node(py.module(ImmutableList.copyOf(statements)));
  }

  /** Creates a fixture for a module whose only statement is an
   * expression. */
  static Fixture expr(Py.Exp exp) {
    return stmt(py.expr(exp));
  }

  /** Creates a fixture for a module whose only statement assigns an
   * expression to "x". */
  static Fixture assignX(Py.Exp exp) {
    return stmt(py.assign(py.name("x"), exp));
  }

  /** Creates a matcher that checks the class of a throwable and its
   * message. */
  static Matcher<Throwable> throwsA(Class<? extends Throwable> clazz,
      Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  Fixture withConfig(UnaryOperator<UnparseConfig> transform) {
    return new Fixture(node, transform.apply(config));
  }

  String toSource() {
    return Unparser.toSource(node, config);
  }

  /** Checks the generated source, including its final newline. */
  @CanIgnoreReturnValue
  Fixture assertSource(String expected) {
    assertThat(toSource(), is(expected));
    return this;
  }

  /** Checks generated source that consists of a single line. */
  @CanIgnoreReturnValue
  Fixture assertLine(String expected) {
    return assertSource(expected + "\n");
  }

  /** Checks that generating source throws. */
  @CanIgnoreReturnValue
  Fixture assertThrows(Matcher<Throwable> matcher) {
    try {
      final String s = toSource();
      fail("expected error, got " + s);
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
    return this;
  }
}

// End Fixture.java
