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
package net.hydromatic.modular.eval;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.modular.arith.Cusp;
import net.hydromatic.modular.coset.CosetTable;

/** Implementations of {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a coset table,
   * then calls the underlying tracer. */
  public static Tracer withOnCosetTable(Tracer tracer,
      Consumer<CosetTable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCosetTable(CosetTable table) {
        consumer.accept(table);
        super.onCosetTable(table);
      }
    };
  }

  /** Returns a tracer that performs the given action on each relation
   * checked by the congruence test, then calls the underlying tracer. */
  public static Tracer withOnRelation(Tracer tracer,
      BiConsumer<String, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRelation(String name, boolean holds) {
        consumer.accept(name, holds);
        super.onRelation(name, holds);
      }
    };
  }

  /** Returns a tracer that performs the given action on a list of cusps,
   * then calls the underlying tracer. */
  public static Tracer withOnCusps(Tracer tracer,
      Consumer<List<Cusp>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCusps(List<Cusp> cusps) {
        consumer.accept(cusps);
        super.onCusps(cusps);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onCosetTable(CosetTable table) {}

    @Override
    public void onRelation(String name, boolean holds) {}

    @Override
    public void onCusps(List<Cusp> cusps) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onCosetTable(CosetTable table) {
      tracer.onCosetTable(table);
    }

    @Override
    public void onRelation(String name, boolean holds) {
      tracer.onRelation(name, holds);
    }

    @Override
    public void onCusps(List<Cusp> cusps) {
      tracer.onCusps(cusps);
    }
  }
}

// End Tracers.java
