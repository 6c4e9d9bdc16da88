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
package net.hydromatic.modular.group;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.modular.arith.Cusp;
import net.hydromatic.modular.arith.Matrix;
import net.hydromatic.modular.util.InconsistentGroupException;

/**
 * Searches that answer questions about cusps of a {@link ModularSubgroup}.
 *
 * <p>Each search tries a bounded number of candidate matrices for
 * membership. The bounds follow from the fact that no cusp of a subgroup of
 * index {@code n} has width greater than {@code n}.
 */
abstract class CuspSearch {
  private CuspSearch() {}

  /** Returns the width of a cusp. */
  static int width(ModularSubgroup g, Cusp cusp) {
    final Matrix conjugator = cusp.conjugator();
    final int bound = g.index() + 1;
    for (int k = 1; k <= bound; k++) {
      final Matrix m = Matrix.t(k).conjugateBy(conjugator);
      if (g.contains(m) || g.contains(m.negate())) {
        return k;
      }
    }
    throw new InconsistentGroupException("no width found for cusp " + cusp
        + " of " + g, bound);
  }

  /** Returns whether two cusps are equivalent: whether some element of the
   * subgroup maps the first to the second. */
  static boolean equivalent(ModularSubgroup g, Cusp cusp1, Cusp cusp2) {
    if (cusp1.kind() == Cusp.Kind.INFINITY) {
      if (cusp2.kind() == Cusp.Kind.INFINITY) {
        return true;
      }
      // equivalence is symmetric
      return equivalent(g, cusp2, cusp1);
    }
    final Matrix g1Inverse = cusp1.conjugator().inverse();
    final Matrix g2 = cusp2.conjugator();
    final boolean tryNegative = !g.containsMinusOne();
    for (int i = 0; i < g.index(); i++) {
      final Matrix m = Matrix.product(g2, Matrix.t(i), g1Inverse);
      if (g.contains(m)) {
        return true;
      }
      if (tryNegative && g.contains(m.negate())) {
        return true;
      }
    }
    return false;
  }

  /** Returns the cusps in {@link ModularSubgroup#cuspsRedundant()}, with
   * each cusp that is equivalent to an earlier one removed. */
  static ImmutableList<Cusp> deduplicate(ModularSubgroup g) {
    final List<Cusp> cusps = new ArrayList<>();
    for (Cusp cusp : g.cuspsRedundant()) {
      if (cusps.stream().noneMatch(c -> equivalent(g, c, cusp))) {
        cusps.add(cusp);
      }
    }
    return ImmutableList.copyOf(cusps);
  }
}

// End CuspSearch.java
