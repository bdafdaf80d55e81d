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

import static net.hydromatic.unparse.ast.PyBuilder.py;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link Op} and {@link Visitor}. */
public class OpTest {
  /** Operators that bind tighter have higher precedence. */
  @Test void testOrdering() {
    assertThat(Op.AND.precedence, greaterThan(Op.OR.precedence));
    assertThat(Op.NOT.precedence, greaterThan(Op.AND.precedence));
    assertThat(Op.EQ.precedence, greaterThan(Op.NOT.precedence));
    assertThat(Op.BIT_OR.precedence, greaterThan(Op.IN.precedence));
    assertThat(Op.MULT.precedence, greaterThan(Op.ADD.precedence));
    assertThat(Op.USUB.precedence, greaterThan(Op.MULT.precedence));
    assertThat(Op.POW.precedence, greaterThan(Op.USUB.precedence));
    assertThat(Op.POW_RHS.precedence, lessThan(Op.USUB.precedence));
    assertThat(Op.COMMA.precedence, greaterThan(Op.TUPLE.precedence));
    assertThat(Op.GENERATOR_EXP.precedence, lessThan(Op.ASSIGN.precedence));
    assertThat(Op.CONSTANT.precedence, lessThan(Op.HIGHEST));
  }

  /** Precedences are odd, so "one more than X" is strictly between X and
   * the next level. */
  @Test void testLevelsLeaveGaps() {
    for (Op op : Op.values()) {
      if (op.precedence != Op.NONE) {
        assertThat(op + " is odd", op.precedence % 2, is(1));
      }
    }
    assertThat(Op.ADD.precedence + 1, lessThan(Op.MULT.precedence));
    assertThat(Op.SUB.precedence, is(Op.ADD.precedence));
    assertThat(Op.FLOOR_DIV.precedence, is(Op.MULT.precedence));
  }

  @Test void testSymbols() {
    assertThat(Op.NOT_IN.padded, is(" not in "));
    assertThat(Op.FLOOR_DIV.symbol, is("//"));
    assertThat(Op.NOT.isAlpha(), is(true));
    assertThat(Op.INVERT.isAlpha(), is(false));
    assertThat(Op.NAME.isAlpha(), is(false));
    assertThat(Op.NAME.symbol == null, is(true));
  }

  @Test void testNoPrecedence() {
    assertThat(Op.NAME.precedence, is(Op.NONE));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, Op.NAME::precedence);
    assertThat(e.getMessage(), is("NAME has no precedence"));
    assertThat(Op.TUPLE.precedence(), is(19));
  }

  /** The default traversal reaches every node, in declaration order. */
  @Test void testVisitorReachesEveryName() {
    final List<String> names = new ArrayList<>();
    final Visitor visitor = new Visitor() {
      @Override protected void visit(Py.Name name) {
        names.add(name.id);
      }
    };
    final Py.Module module =
        py.module(
            py.expr(
                py.call(py.attribute(py.name("f"), "g"),
                    py.binOp(py.name("a"), Op.ADD, py.name("b")),
                    py.listComp(py.name("x"),
                        py.comprehension(py.name("x"), py.name("xs"))))));
    module.accept(visitor);
    assertThat(names, contains("f", "a", "b", "x", "x", "xs"));
  }
}

// End OpTest.java
