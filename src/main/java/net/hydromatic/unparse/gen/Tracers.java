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

import java.util.List;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the generated
   * fragments, then calls the underlying tracer. */
  public static Tracer withOnFragments(Tracer tracer,
      Consumer<List<String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onFragments(List<String> fragments) {
        consumer.accept(fragments);
        super.onFragments(fragments);
      }
    };
  }

  /** Returns a tracer that performs the given action on the generated
   * source code, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(String source) {
        consumer.accept(source);
        super.onResult(source);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onFragments(List<String> fragments) {
    }

    @Override public void onResult(String source) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onFragments(List<String> fragments) {
      tracer.onFragments(fragments);
    }

    @Override public void onResult(String source) {
      tracer.onResult(source);
    }
  }
}

// End Tracers.java
