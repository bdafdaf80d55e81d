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

import com.google.common.base.Throwables;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.List;
import net.hydromatic.unparse.ast.PyNode;
import net.hydromatic.unparse.gen.SourceGenerator;
import net.hydromatic.unparse.gen.UnparseConfig;

/** Converts Python syntax trees into source code. */
public class Unparser {
  private Unparser() {}

  /** Converts a syntax tree into source code, using the default
   * settings. */
  public static String toSource(PyNode node) {
    return toSource(node, UnparseConfig.DEFAULT);
  }

  /** Converts a syntax tree into source code.
   *
   * <p>The result always ends with a newline. Re-parsing the result yields
   * a tree equivalent to {@code node}.
   *
   * @param node Root of the tree; usually a module, but any node is allowed
   * @param config Settings
   * @return Source code
   * @throws IllegalArgumentException if the settings are invalid
   */
  public static String toSource(PyNode node, UnparseConfig config) {
    requireNonNull(node, "node");
    requireNonNull(config, "config");
    final SourceGenerator generator = createGenerator(config);
    final List<String> fragments = generator.generate(node);
    config.tracer().onFragments(fragments);
    final String source = config.lineFormatter().format(fragments);
    config.tracer().onResult(source);
    return source;
  }

  /** Creates an instance of the generator class that the settings name. */
  static SourceGenerator createGenerator(UnparseConfig config) {
    final Class<?> generatorClass = config.generatorClass();
    if (!SourceGenerator.class.isAssignableFrom(generatorClass)) {
      throw new IllegalArgumentException("generator class "
          + generatorClass.getName() + " does not extend "
          + SourceGenerator.class.getName());
    }
    if (Modifier.isAbstract(generatorClass.getModifiers())) {
      throw new IllegalArgumentException("generator class "
          + generatorClass.getName() + " is abstract");
    }
    final Constructor<?> constructor;
    try {
      constructor = generatorClass.getConstructor(UnparseConfig.class);
    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException("generator class "
          + generatorClass.getName()
          + " has no public constructor that takes an UnparseConfig", e);
    }
    try {
      return (SourceGenerator) constructor.newInstance(config);
    } catch (InvocationTargetException e) {
      final Throwable cause = e.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new RuntimeException(cause);
    } catch (InstantiationException | IllegalAccessException e) {
      throw new IllegalArgumentException("cannot instantiate generator class "
          + generatorClass.getName(), e);
    }
  }
}

// End Unparser.java
