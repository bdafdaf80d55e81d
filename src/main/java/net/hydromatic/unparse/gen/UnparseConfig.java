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
import static java.util.Objects.requireNonNull;

/** Settings that control how source code is generated.
 *
 * <p>Immutable; each {@code withXxx} method returns a copy with one
 * setting changed. */
public interface UnparseConfig {
  UnparseConfig DEFAULT =
      new ConfigImpl("    ", false, PrettyString.INSTANCE,
          LineFormatters.concat(), SourceGenerator.class, 500,
          Tracers.empty(), false);

  /** String written once per level of indentation. */
  String indentWith();

  /** Whether to write a "# line: N" comment before each statement. */
  boolean addLineInformation();

  StringFormatter stringFormatter();

  LineFormatter lineFormatter();

  /** Class of generator to create; a subclass of {@link SourceGenerator}
   * with a public constructor that takes an {@code UnparseConfig}. */
  Class<?> generatorClass();

  /** Maximum depth of nesting of nodes. */
  int maxDepth();

  Tracer tracer();

  /** Whether legacy number nodes come from a compiler that merges a unary
   * minus into the number it negates. If so, a number that is the operand
   * of a unary minus keeps its parentheses, so that re-parsing yields a
   * unary minus node again. */
  boolean mergedUnaryMinus();

  UnparseConfig withIndentWith(String indentWith);
  UnparseConfig withAddLineInformation(boolean addLineInformation);
  UnparseConfig withStringFormatter(StringFormatter stringFormatter);
  UnparseConfig withLineFormatter(LineFormatter lineFormatter);
  UnparseConfig withGeneratorClass(Class<?> generatorClass);
  UnparseConfig withMaxDepth(int maxDepth);
  UnparseConfig withTracer(Tracer tracer);
  UnparseConfig withMergedUnaryMinus(boolean mergedUnaryMinus);

  /** Implementation of {@link UnparseConfig}. */
  class ConfigImpl implements UnparseConfig {
    private final String indentWith;
    private final boolean addLineInformation;
    private final StringFormatter stringFormatter;
    private final LineFormatter lineFormatter;
    private final Class<?> generatorClass;
    private final int maxDepth;
    private final Tracer tracer;
    private final boolean mergedUnaryMinus;

    private ConfigImpl(String indentWith, boolean addLineInformation,
        StringFormatter stringFormatter, LineFormatter lineFormatter,
        Class<?> generatorClass, int maxDepth, Tracer tracer,
        boolean mergedUnaryMinus) {
      this.indentWith = requireNonNull(indentWith, "indentWith");
      this.addLineInformation = addLineInformation;
      this.stringFormatter = requireNonNull(stringFormatter, "stringFormatter");
      this.lineFormatter = requireNonNull(lineFormatter, "lineFormatter");
      this.generatorClass = requireNonNull(generatorClass, "generatorClass");
      checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
      this.maxDepth = maxDepth;
      this.tracer = requireNonNull(tracer, "tracer");
      this.mergedUnaryMinus = mergedUnaryMinus;
    }

    @Override public String indentWith() {
      return indentWith;
    }

    @Override public boolean addLineInformation() {
      return addLineInformation;
    }

    @Override public StringFormatter stringFormatter() {
      return stringFormatter;
    }

    @Override public LineFormatter lineFormatter() {
      return lineFormatter;
    }

    @Override public Class<?> generatorClass() {
      return generatorClass;
    }

    @Override public int maxDepth() {
      return maxDepth;
    }

    @Override public Tracer tracer() {
      return tracer;
    }

    @Override public boolean mergedUnaryMinus() {
      return mergedUnaryMinus;
    }

    @Override public ConfigImpl withIndentWith(String indentWith) {
      if (this.indentWith.equals(indentWith)) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }

    @Override public ConfigImpl withAddLineInformation(
        boolean addLineInformation) {
      if (this.addLineInformation == addLineInformation) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }

    @Override public ConfigImpl withStringFormatter(
        StringFormatter stringFormatter) {
      if (this.stringFormatter == stringFormatter) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }

    @Override public ConfigImpl withLineFormatter(
        LineFormatter lineFormatter) {
      if (this.lineFormatter == lineFormatter) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }

    @Override public ConfigImpl withGeneratorClass(Class<?> generatorClass) {
      if (this.generatorClass == generatorClass) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }

    @Override public ConfigImpl withMaxDepth(int maxDepth) {
      if (this.maxDepth == maxDepth) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }

    @Override public ConfigImpl withTracer(Tracer tracer) {
      if (this.tracer == tracer) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }

    @Override public ConfigImpl withMergedUnaryMinus(
        boolean mergedUnaryMinus) {
      if (this.mergedUnaryMinus == mergedUnaryMinus) {
        return this;
      }
      return new ConfigImpl(indentWith, addLineInformation, stringFormatter,
          lineFormatter, generatorClass, maxDepth, tracer, mergedUnaryMinus);
    }
  }
}

// End UnparseConfig.java
