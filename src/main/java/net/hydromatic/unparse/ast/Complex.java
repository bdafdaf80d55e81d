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

import java.util.Objects;

/** Value of a complex number literal, such as {@code 1+2j}. */
public class Complex {
  public final double real;
  public final double imag;

  private Complex(double real, double imag) {
    this.real = real;
    this.imag = imag;
  }

  /** Creates a complex number. */
  public static Complex of(double real, double imag) {
    return new Complex(real, imag);
  }

  @Override public int hashCode() {
    return Objects.hash(real, imag);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Complex
        && Double.compare(real, ((Complex) o).real) == 0
        && Double.compare(imag, ((Complex) o).imag) == 0;
  }

  @Override public String toString() {
    return "Complex(" + real + ", " + imag + ")";
  }
}

// End Complex.java
