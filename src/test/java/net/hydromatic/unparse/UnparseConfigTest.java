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

import static net.hydromatic.unparse.Fixture.expr;
import static net.hydromatic.unparse.Fixture.throwsA;
import static net.hydromatic.unparse.ast.PyBuilder.py;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.unparse.ast.Op;
import net.hydromatic.unparse.ast.Py;
import net.hydromatic.unparse.gen.SourceGenerator;
import net.hydromatic.unparse.gen.Tracers;
import net.hydromatic.unparse.gen.UnparseConfig;
import org.junit.jupiter.api.Test;

/** Tests {@link UnparseConfig} and the errors that
 * {@link Unparser#toSource} reports. */
public class UnparseConfigTest {
  @Test void testDefaults() {
    final UnparseConfig config = UnparseConfig.DEFAULT;
    assertThat(config.indentWith(), is("    "));
    assertThat(config.addLineInformation(), is(false));
    assertThat(config.generatorClass() == SourceGenerator.class, is(true));
    assertThat(config.maxDepth(), is(500));
    assertThat(config.withMaxDepth(500) == config, is(true));
    assertThat(config.withMaxDepth(10).maxDepth(), is(10));
    assertThat(config.mergedUnaryMinus(), is(false));
    assertThat(config.withMergedUnaryMinus(true).mergedUnaryMinus(),
        is(true));
  }

  @Test void testInvalidMaxDepth() {
    try {
      final UnparseConfig config = UnparseConfig.DEFAULT.withMaxDepth(0);
      throw new AssertionError("expected error, got " + config);
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), is("maxDepth must be positive: 0"));
    }
  }

  @Test void testCustomGenerator() {
    expr(py.binOp(py.name("a"), Op.ADD, py.name("b")))
        .withConfig(c -> c.withGeneratorClass(UpperCaseGenerator.class))
        .assertLine("A + B");
  }

  @Test void testGeneratorNotSubclass() {
    expr(py.name("a"))
        .withConfig(c -> c.withGeneratorClass(String.class))
        .assertThrows(
            throwsA(IllegalArgumentException.class,
                is("generator class java.lang.String does not extend "
                    + "net.hydromatic.unparse.gen.SourceGenerator")));
  }

  @Test void testGeneratorAbstract() {
    expr(py.name("a"))
        .withConfig(c -> c.withGeneratorClass(AbstractGenerator.class))
        .assertThrows(
            throwsA(IllegalArgumentException.class,
                containsString("is abstract")));
  }

  @Test void testGeneratorWithoutConstructor() {
    expr(py.name("a"))
        .withConfig(c -> c.withGeneratorClass(NoConfigGenerator.class))
        .assertThrows(
            throwsA(IllegalArgumentException.class,
                containsString("has no public constructor that takes an "
                    + "UnparseConfig")));
  }

  /** An exception thrown by a generator's constructor reaches the caller
   * unchanged. */
  @Test void testGeneratorConstructorThrows() {
    expr(py.name("a"))
        .withConfig(c -> c.withGeneratorClass(FailingGenerator.class))
        .assertThrows(
            throwsA(IllegalStateException.class, is("not today")));
  }

  @Test void testMaxDepth() {
    Py.Exp e = py.name("a");
    for (int i = 0; i < 600; i++) {
      e = py.unaryOp(Op.USUB, e);
    }
    expr(e)
        .assertThrows(
            throwsA(IllegalStateException.class,
                is("syntax tree is nested more than 500 levels deep")));

    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < 600; i++) {
      b.append('-');
    }
    expr(e)
        .withConfig(c -> c.withMaxDepth(1_000))
        .assertLine(b + "a");
  }

  @Test void testTracer() {
    final List<List<String>> fragmentsList = new ArrayList<>();
    final List<String> results = new ArrayList<>();
    final String source =
        expr(py.tuple(py.name("a"), py.name("b")))
            .withConfig(c ->
                c.withTracer(
                    Tracers.withOnResult(
                        Tracers.withOnFragments(Tracers.empty(),
                            fragmentsList::add),
                        results::add)))
            .toSource();
    assertThat(source, is("a, b\n"));
    assertThat(results, hasSize(1));
    assertThat(results.get(0), is(source));
    assertThat(fragmentsList, hasSize(1));
    assertThat(String.join("", fragmentsList.get(0)), is(source));
  }

  @Test void testLineFormatter() {
    expr(py.call(py.name("f"), py.name("x")))
        .withConfig(c ->
            c.withLineFormatter(fragments ->
                String.join("|", fragments)))
        .assertSource("||f|(|x|)|\n");
  }

  /** Generator that writes names in upper case. */
  public static class UpperCaseGenerator extends SourceGenerator {
    public UpperCaseGenerator(UnparseConfig config) {
      super(config);
    }

    @Override protected void visit(Py.Name node) {
      write(node.id.toUpperCase(Locale.ROOT));
    }
  }

  /** Generator that cannot be instantiated because it is abstract. */
  public abstract static class AbstractGenerator extends SourceGenerator {
    public AbstractGenerator(UnparseConfig config) {
      super(config);
    }
  }

  /** Generator that lacks the required constructor. */
  public static class NoConfigGenerator extends SourceGenerator {
    public NoConfigGenerator() {
      super(UnparseConfig.DEFAULT);
    }
  }

  /** Generator whose constructor throws. */
  public static class FailingGenerator extends SourceGenerator {
    public FailingGenerator(UnparseConfig config) {
      super(config);
      throw new IllegalStateException("not today");
    }
  }
}

// End UnparseConfigTest.java
