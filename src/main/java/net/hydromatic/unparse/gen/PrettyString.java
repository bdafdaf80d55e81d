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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String formatter that prefers readable literals.
 *
 * <p>By default a string is written as Python's {@code repr} would write
 * it. A string is written in triple-quoted form if it stands on a line by
 * itself (a docstring, say), or if it spans several lines and either
 * would make its line too long or its continuation lines are indented at
 * least as far as the line it starts on.
 */
public class PrettyString implements StringFormatter {
  public static final PrettyString INSTANCE = new PrettyString(20, 100);

  private static final Pattern TRIPLE_SPECIAL =
      Pattern.compile("\\\\|\"\"\"|\"$");

  /** Strings whose {@code repr} is shorter than this are never
   * triple-quoted unless they stand alone. */
  private final int minTripleLength;
  private final int maxLineLength;

  public PrettyString(int minTripleLength, int maxLineLength) {
    this.minTripleLength = minTripleLength;
    this.maxLineLength = maxLineLength;
  }

  @Override public String format(String s, int embedded, String currentLine,
      boolean unicodeLiterals) {
    final String repr = repr(s);
    if (!currentLine.trim().isEmpty()) {
      final boolean multiLine = s.indexOf('\n') >= 0;
      if (embedded > 0 && !multiLine) {
        return repr;
      }
      if (repr.length() < minTripleLength) {
        return repr;
      }
      final int lineIndent =
          currentLine.length() - CharMatcher.whitespace().trimLeadingFrom(
              currentLine).length();
      final int totalLength = currentLine.length() + repr.length();
      if (totalLength < maxLineLength && !properlyIndented(s, lineIndent)) {
        return repr;
      }
    }
    if (!canTripleQuote(s)) {
      return repr;
    }
    return tripleQuote(s);
  }

  /** Returns whether every non-blank line after the first is indented at
   * least {@code lineIndent} spaces. */
  static boolean properlyIndented(String s, int lineIndent) {
    final String[] lines = s.split("\n", -1);
    boolean any = false;
    int min = Integer.MAX_VALUE;
    for (int i = 1; i < lines.length; i++) {
      final String line = CharMatcher.whitespace().trimTrailingFrom(lines[i]);
      if (line.isEmpty()) {
        continue;
      }
      any = true;
      final int indent =
          line.length()
              - CharMatcher.whitespace().trimLeadingFrom(line).length();
      min = Math.min(min, indent);
    }
    return any && min >= lineIndent;
  }

  /** Returns whether a string reads back unchanged when written in
   * triple-quoted form. A carriage return would be read back as a
   * newline, and other unprintable characters have no literal form. */
  static boolean canTripleQuote(String s) {
    return s.codePoints()
        .allMatch(c -> c == '\n' || c == '\t' || isPrintable(c));
  }

  /** Writes a string between triple double-quotes, escaping backslashes,
   * embedded triple quotes, and a quote at the very end. */
  static String tripleQuote(String s) {
    final Matcher m = TRIPLE_SPECIAL.matcher(s);
    final StringBuilder b = new StringBuilder("\"\"\"");
    int start = 0;
    while (m.find()) {
      b.append(s, start, m.start());
      switch (m.group()) {
      case "\\":
        b.append("\\\\");
        break;
      case "\"\"\"":
        b.append("\"\"\\\"");
        break;
      default:
        b.append("\\\"");
      }
      start = m.end();
    }
    return b.append(s, start, s.length()).append("\"\"\"").toString();
  }

  /** Converts a string to a literal the way Python's {@code repr} does. */
  public static String repr(String s) {
    final char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    final StringBuilder b = new StringBuilder().append(quote);
    s.codePoints().forEach(c -> {
      switch (c) {
      case '\\':
        b.append("\\\\");
        break;
      case '\t':
        b.append("\\t");
        break;
      case '\n':
        b.append("\\n");
        break;
      case '\r':
        b.append("\\r");
        break;
      default:
        if (c == quote) {
          b.append('\\').append(quote);
        } else if (isPrintable(c)) {
          b.appendCodePoint(c);
        } else if (c < 0x100) {
          b.append("\\x").append(hex(c, 2));
        } else if (c < 0x10000) {
          b.append("\\u").append(hex(c, 4));
        } else {
          b.append("\\U").append(hex(c, 8));
        }
      }
    });
    return b.append(quote).toString();
  }

  /** Converts a byte string to a literal the way Python's {@code repr}
   * does, for example {@code b'a\x00'}. */
  public static String repr(byte[] bytes) {
    boolean single = false;
    boolean dbl = false;
    for (byte x : bytes) {
      single |= x == '\'';
      dbl |= x == '"';
    }
    final char quote = single && !dbl ? '"' : '\'';
    final StringBuilder b = new StringBuilder("b").append(quote);
    for (byte x : bytes) {
      final int c = x & 0xff;
      if (c == '\\' || c == quote) {
        b.append('\\').append((char) c);
      } else if (c == '\t') {
        b.append("\\t");
      } else if (c == '\n') {
        b.append("\\n");
      } else if (c == '\r') {
        b.append("\\r");
      } else if (c < 0x20 || c >= 0x7f) {
        b.append("\\x").append(hex(c, 2));
      } else {
        b.append((char) c);
      }
    }
    return b.append(quote).toString();
  }

  private static String hex(int c, int width) {
    return Strings.padStart(Integer.toHexString(c), width, '0');
  }

  /** Returns whether Python considers a code point printable: a space, or
   * anything that is not a control, format, surrogate, private-use,
   * unassigned or separator character. */
  static boolean isPrintable(int c) {
    if (c == ' ') {
      return true;
    }
    switch (Character.getType(c)) {
    case Character.CONTROL:
    case Character.FORMAT:
    case Character.SURROGATE:
    case Character.PRIVATE_USE:
    case Character.UNASSIGNED:
    case Character.SPACE_SEPARATOR:
    case Character.LINE_SEPARATOR:
    case Character.PARAGRAPH_SEPARATOR:
      return false;
    default:
      return true;
    }
  }
}

// End PrettyString.java
