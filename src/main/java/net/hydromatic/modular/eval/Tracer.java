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
import net.hydromatic.modular.arith.Cusp;
import net.hydromatic.modular.coset.CosetTable;

/** Called at various points during computation, so that tests and tools
 * can watch what happens. */
public interface Tracer {
  /** Called when coset enumeration has produced a coset table. */
  void onCosetTable(CosetTable table);

  /**
   * Called each time the congruence test checks a relation.
   *
   * @param name Name of the relation: "A", "B", ... in the order checked
   * @param holds Whether the relation holds
   */
  void onRelation(String name, boolean holds);

  /** Called with the list of inequivalent cusps, when it is computed. */
  void onCusps(List<Cusp> cusps);
}

// End Tracer.java
