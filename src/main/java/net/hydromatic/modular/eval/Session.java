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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.modular.coset.CosetEnumerator;
import net.hydromatic.modular.coset.CosetRepresentatives;
import net.hydromatic.modular.coset.GeneratorExtractor;
import net.hydromatic.modular.coset.SchreierGenerators;
import net.hydromatic.modular.coset.SchreierTree;
import net.hydromatic.modular.coset.ToddCoxeter;

/**
 * Context in which subgroups are built and queried: property values, a
 * tracer, and the algorithms that enumerate cosets, choose coset
 * representatives, and extract generators.
 *
 * <p>A session is immutable; the {@code with} methods return a modified
 * copy. Each {@link net.hydromatic.modular.group.ModularSubgroup} holds the
 * session that created it.
 */
public class Session {
  /** Session with default property values and algorithms. */
  public static final Session DEFAULT =
      new Session(ImmutableMap.of(), Tracers.empty(), new ToddCoxeter(),
          new SchreierTree(), new SchreierGenerators(new SchreierTree()));

  /** Property values. */
  public final ImmutableMap<Prop, Object> map;

  public final Tracer tracer;
  public final CosetEnumerator enumerator;
  public final CosetRepresentatives representatives;
  public final GeneratorExtractor extractor;

  private Session(Map<Prop, Object> map, Tracer tracer,
      CosetEnumerator enumerator, CosetRepresentatives representatives,
      GeneratorExtractor extractor) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer, "tracer");
    this.enumerator = requireNonNull(enumerator, "enumerator");
    this.representatives =
        requireNonNull(representatives, "representatives");
    this.extractor = requireNonNull(extractor, "extractor");
  }

  /** Returns a session with the given property values. */
  public Session withProps(Map<Prop, Object> map) {
    return new Session(map, tracer, enumerator, representatives, extractor);
  }

  /** Returns a session with one property value changed. Strings are
   * converted to the property's type. */
  public Session withProp(Prop prop, Object value) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    prop.setLenient(map2, value);
    return withProps(map2);
  }

  /** Returns a session with a given tracer. */
  public Session withTracer(Tracer tracer) {
    return new Session(map, tracer, enumerator, representatives, extractor);
  }

  /** Returns a session with a given coset enumerator. */
  public Session withEnumerator(CosetEnumerator enumerator) {
    return new Session(map, tracer, enumerator, representatives, extractor);
  }

  /** Returns a session with a given algorithm for coset representatives. */
  public Session withRepresentatives(
      CosetRepresentatives representatives) {
    return new Session(map, tracer, enumerator, representatives, extractor);
  }

  /** Returns a session with a given generator extractor. */
  public Session withExtractor(GeneratorExtractor extractor) {
    return new Session(map, tracer, enumerator, representatives, extractor);
  }

  /** Returns the value of an integer property. */
  public int intValue(Prop prop) {
    return prop.intValue(map);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Prop prop) {
    return prop.booleanValue(map);
  }
}

// End Session.java
