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

import java.math.BigDecimal;
import java.math.BigInteger;
import net.hydromatic.unparse.ast.Complex;

/**
 * Formats numeric constants as Python literals.
 *
 * <p>Floating-point values use the shortest digits that read back as the
 * same value. Infinity has no literal, so it is written as {@code 1e1000},
 * which overflows to infinity when read back; NaN is written as the
 * difference of two infinities.
 */
public abstract class Numbers {
  /** A literal that reads back as positive infinity. */
  static final String INFINITY = "1e1000";

  private Numbers() {}

  /** Converts an int, float or complex value to Python source. */
  public static String toPython(Object value) {
    if (value instanceof Double) {
      return part((Double) value, false, false);
    }
    if (value instanceof Complex) {
      final Complex c = (Complex) value;
      final String imag = part(c.imag, true, true);
      if (c.real == 0) {
        return imag;
      }
      final String real = part(c.real, false, true);
      if (c.imag == 0) {
        return "(" + real + "+0j)";
      }
      return "(" + real + (imag.startsWith("-") ? "" : "+") + imag + ")";
    }
    if (value instanceof Integer
        || value instanceof Long
        || value instanceof BigInteger) {
      return value.toString();
    }
    throw new IllegalArgumentException("not a number: " + value);
  }

  /** Returns whether a numeric value is less than zero. */
  public static boolean isNegative(Object value) {
    if (value instanceof Double) {
      return (Double) value < 0;
    }
    if (value instanceof BigInteger) {
      return ((BigInteger) value).signum() < 0;
    }
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue() < 0;
    }
    return false;
  }

  /** Formats one component of a number.
   *
   * @param d Value
   * @param imaginary Whether to add the "j" suffix
   * @param complex Whether the value is part of a complex number, which
   *   omits the ".0" of integral values, as in "3j"
   */
  private static String part(double d, boolean imaginary, boolean complex) {
    final String suffix = imaginary ? "j" : "";
    if (Double.isNaN(d)) {
      return "(" + INFINITY + suffix + " - " + INFINITY + suffix + ")";
    }
    if (Double.isInfinite(d)) {
      return (d < 0 ? "-" : "") + INFINITY + suffix;
    }
    return repr(d, !complex) + suffix;
  }

  /** Formats a finite double the way Python's {@code repr} does.
   *
   * <p>Uses positional notation if the decimal exponent is between -4
   * and 15, scientific notation otherwise. */
  static String repr(double d, boolean forceDecimalPoint) {
    if (d == 0) {
      final String zero = 1 / d < 0 ? "-0" : "0";
      return forceDecimalPoint ? zero + ".0" : zero;
    }
    final BigDecimal bd =
        new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
    final String digits = bd.unscaledValue().toString();
    final int exponent = digits.length() - 1 - bd.scale();
    final StringBuilder b = new StringBuilder();
    if (d < 0) {
      b.append('-');
    }
    if (exponent < -4 || exponent >= 16) {
      b.append(digits.charAt(0));
      if (digits.length() > 1) {
        b.append('.').append(digits, 1, digits.length());
      }
      b.append('e').append(exponent < 0 ? '-' : '+');
      final int abs = Math.abs(exponent);
      if (abs < 10) {
        b.append('0');
      }
      b.append(abs);
    } else {
      final String plain = bd.toPlainString();
      b.append(plain);
      if (forceDecimalPoint && plain.indexOf('.') < 0) {
        b.append(".0");
      }
    }
    return b.toString();
  }
}

// End Numbers.java
