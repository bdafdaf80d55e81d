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

/**
 * Converts the value of a string literal into Python source.
 *
 * <p>The generator calls it for plain string constants and for the
 * assembled body of a formatted string literal (in which case the
 * generator adds the "f" prefix to whatever the formatter returns).
 */
public interface StringFormatter {
  /** Formats a string.
   *
   * @param s Value of the string
   * @param embedded 0 if the string is an expression statement, 1 if it is
   *   part of a larger expression, 2 if it is the value of an assignment
   * @param currentLine Text of the line before the literal
   * @param unicodeLiterals Whether the module has imported
   *   {@code unicode_literals} from {@code __future__}
   * @return Source text of a literal that evaluates to {@code s}
   */
  String format(String s, int embedded, String currentLine,
      boolean unicodeLiterals);
}

// End StringFormatter.java
