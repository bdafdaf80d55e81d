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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import net.hydromatic.unparse.ast.Complex;
import org.junit.jupiter.api.Test;

/** Tests {@link Numbers}. */
public class NumbersTest {
  /** Floats are written with the shortest digits that read back the same,
   * in the notation that Python's {@code repr} chooses. */
  @Test void testRepr() {
    assertThat(Numbers.repr(1.0, true), is("1.0"));
    assertThat(Numbers.repr(1.0, false), is("1"));
    assertThat(Numbers.repr(0.1 + 0.2, true), is("0.30000000000000004"));
    assertThat(Numbers.repr(1e15, true), is("1000000000000000.0"));
    assertThat(Numbers.repr(1e16, true), is("1e+16"));
    assertThat(Numbers.repr(1.2345678901234568E17, true),
        is("1.2345678901234568e+17"));
    assertThat(Numbers.repr(0.0001, true), is("0.0001"));
    assertThat(Numbers.repr(0.00001, true), is("1e-05"));
    assertThat(Numbers.repr(-2.5e-10, true), is("-2.5e-10"));
    assertThat(Numbers.repr(Double.MAX_VALUE, true),
        is("1.7976931348623157e+308"));
    assertThat(Numbers.repr(0.0, true), is("0.0"));
    assertThat(Numbers.repr(-0.0, false), is("-0"));
  }

  @Test void testToPython() {
    assertThat(Numbers.toPython(42), is("42"));
    assertThat(Numbers.toPython(-42L), is("-42"));
    assertThat(Numbers.toPython(BigInteger.TEN.pow(30)),
        is("1000000000000000000000000000000"));
    assertThat(Numbers.toPython(2.0), is("2.0"));
    assertThat(Numbers.toPython(Double.NEGATIVE_INFINITY), is("-1e1000"));
    assertThat(Numbers.toPython(Complex.of(0, 0)), is("0j"));
    assertThat(Numbers.toPython(Complex.of(0, 1e20)), is("1e+20j"));
    assertThat(Numbers.toPython(Complex.of(2, Double.NEGATIVE_INFINITY)),
        is("(2-1e1000j)"));
    assertThat(Numbers.toPython(Complex.of(Double.NaN, 1)),
        is("((1e1000 - 1e1000)+1j)"));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.toPython("1"));
  }

  @Test void testIsNegative() {
    assertThat(Numbers.isNegative(-1), is(true));
    assertThat(Numbers.isNegative(0L), is(false));
    assertThat(Numbers.isNegative(BigInteger.ONE.negate()), is(true));
    assertThat(Numbers.isNegative(-0.0), is(false));
    assertThat(Numbers.isNegative(Double.NaN), is(false));
    assertThat(Numbers.isNegative(Complex.of(-1, -1)), is(false));
  }
}

// End NumbersTest.java
