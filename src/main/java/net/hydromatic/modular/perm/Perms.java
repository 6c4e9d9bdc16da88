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
package net.hydromatic.modular.perm;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Utilities for sets of permutations. */
public abstract class Perms {
  private Perms() {}

  /** Returns the largest point moved by any of the permutations, or 0 if all
   * are the identity. */
  public static int largestMovedPoint(Iterable<Perm> perms) {
    int n = 0;
    for (Perm perm : perms) {
      n = Math.max(n, perm.largestMovedPoint());
    }
    return n;
  }

  /** Returns the largest point moved by any of the permutations. */
  public static int largestMovedPoint(Perm... perms) {
    return largestMovedPoint(ImmutableList.copyOf(perms));
  }

  /** Returns the orbit of a point under the group generated by some
   * permutations. */
  public static ImmutableSortedSet<Integer> orbit(int point,
      List<Perm> generators) {
    checkArgument(point >= 1, "point must be positive: %s", point);
    final ImmutableSortedSet.Builder<Integer> orbit =
        ImmutableSortedSet.naturalOrder();
    final Deque<Integer> queue = new ArrayDeque<>();
    final Set<Integer> seen = new HashSet<>();
    queue.add(point);
    seen.add(point);
    while (!queue.isEmpty()) {
      final int p = queue.remove();
      orbit.add(p);
      for (Perm generator : generators) {
        final int q = generator.apply(p);
        if (seen.add(q)) {
          queue.add(q);
        }
      }
    }
    return orbit.build();
  }

  /**
   * Returns whether the group generated by some permutations acts
   * transitively on 1 .. n.
   *
   * <p>Requires that no generator moves a point greater than {@code n}.
   */
  public static boolean isTransitive(int n, List<Perm> generators) {
    checkArgument(n >= 1, "domain must be non-empty: %s", n);
    return orbit(1, generators).size() == n
        && largestMovedPoint(generators) <= n;
  }
}

// End Perms.java
