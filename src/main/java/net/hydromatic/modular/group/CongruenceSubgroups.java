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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.modular.eval.Session;
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.util.InvalidInputException;

/**
 * Classical congruence subgroups.
 *
 * <p>Each is built from the action of S and T, by right multiplication, on
 * an orbit of objects reduced modulo {@code N}: row vectors for
 * {@code Gamma1(N)}, points of the projective line for {@code Gamma0(N)},
 * and matrices for {@code Gamma(N)}. The subgroup is the stabilizer of the
 * base object, which is labeled coset 1; other objects are labeled in the
 * order that a breadth-first search finds them.
 */
public abstract class CongruenceSubgroups {
  private CongruenceSubgroups() {}

  /** Returns the principal congruence subgroup {@code Gamma(N)}, the
   * matrices congruent to the identity modulo {@code N}. */
  public static ModularSubgroup gamma(int n) {
    return gamma(Session.DEFAULT, n);
  }

  public static ModularSubgroup gamma(Session session, int n) {
    checkLevel(n);
    return orbit(session, ImmutableList.of(1 % n, 0, 0, 1 % n),
        v -> reduce(n, v.get(1), -v.get(0), v.get(3), -v.get(2)),
        v -> reduce(n, v.get(0), v.get(0) + v.get(1), v.get(2),
            v.get(2) + v.get(3)));
  }

  /** Returns {@code Gamma0(N)}, the matrices whose lower-left entry is
   * divisible by {@code N}. */
  public static ModularSubgroup gamma0(int n) {
    return gamma0(Session.DEFAULT, n);
  }

  public static ModularSubgroup gamma0(Session session, int n) {
    checkLevel(n);
    return orbit(session, projective(n, 0, 1),
        v -> projective(n, v.get(1), -v.get(0)),
        v -> projective(n, v.get(0), v.get(0) + v.get(1)));
  }

  /** Returns {@code Gamma1(N)}, the matrices whose bottom row is congruent
   * to {@code (0, 1)} modulo {@code N}. */
  public static ModularSubgroup gamma1(int n) {
    return gamma1(Session.DEFAULT, n);
  }

  public static ModularSubgroup gamma1(Session session, int n) {
    checkLevel(n);
    return orbit(session, reduce(n, 0, 1),
        v -> reduce(n, v.get(1), -v.get(0)),
        v -> reduce(n, v.get(0), v.get(0) + v.get(1)));
  }

  private static void checkLevel(int n) {
    if (n < 1) {
      throw new InvalidInputException("level must be positive: " + n);
    }
  }

  /** Reduces each of a list of integers modulo {@code n}. */
  private static ImmutableList<Integer> reduce(int n, int... values) {
    final ImmutableList.Builder<Integer> list = ImmutableList.builder();
    for (int value : values) {
      list.add(Math.floorMod(value, n));
    }
    return list.build();
  }

  /** Returns the canonical representative of the point {@code (c : d)} of
   * the projective line modulo {@code n}: the least, in lexicographic
   * order, of its multiples by units. */
  private static ImmutableList<Integer> projective(int n, int c, int d) {
    ImmutableList<Integer> best = reduce(n, c, d);
    for (int unit = 2; unit < n; unit++) {
      if (gcd(unit, n) != 1) {
        continue;
      }
      final ImmutableList<Integer> v = reduce(n, unit * c, unit * d);
      if (v.get(0) < best.get(0)
          || v.get(0).equals(best.get(0)) && v.get(1) < best.get(1)) {
        best = v;
      }
    }
    return best;
  }

  private static int gcd(int a, int b) {
    return b == 0 ? a : gcd(b, a % b);
  }

  /** Labels the orbit of a base object under S and T, and returns the
   * stabilizer of the base object. */
  private static ModularSubgroup orbit(Session session,
      ImmutableList<Integer> base, UnaryOperator<ImmutableList<Integer>> s,
      UnaryOperator<ImmutableList<Integer>> t) {
    final Map<ImmutableList<Integer>, Integer> labels = new HashMap<>();
    final List<ImmutableList<Integer>> objects = new ArrayList<>();
    final Deque<ImmutableList<Integer>> queue = new ArrayDeque<>();
    labels.put(base, 0);
    objects.add(base);
    queue.add(base);
    while (!queue.isEmpty()) {
      final ImmutableList<Integer> v = queue.remove();
      for (ImmutableList<Integer> w
          : ImmutableList.of(s.apply(v), t.apply(v))) {
        if (!labels.containsKey(w)) {
          labels.put(w, objects.size());
          objects.add(w);
          queue.add(w);
        }
      }
    }
    final int[] sImages = new int[objects.size()];
    final int[] tImages = new int[objects.size()];
    for (int i = 0; i < objects.size(); i++) {
      sImages[i] = labels.get(s.apply(objects.get(i))) + 1;
      tImages[i] = labels.get(t.apply(objects.get(i))) + 1;
    }
    return ModularSubgroups.fromPermutations(session, Perm.of(sImages),
        Perm.of(tImages));
  }
}

// End CongruenceSubgroups.java
