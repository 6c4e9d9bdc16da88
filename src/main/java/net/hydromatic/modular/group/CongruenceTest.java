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

import java.math.BigInteger;
import net.hydromatic.modular.arith.Arithmetic;
import net.hydromatic.modular.eval.Tracer;
import net.hydromatic.modular.perm.Perm;

/**
 * Decides whether a subgroup is a congruence subgroup.
 *
 * <p>By Wohlfahrt's theorem, a subgroup of generalized level {@code L} is a
 * congruence subgroup if and only if it contains the principal congruence
 * subgroup of level {@code L} (or {@code 2L}, if it does not contain -I).
 * Following Hsu, that holds if and only if a few relations hold in the
 * permutation action. Let {@code N} be the level and split {@code N = e * m}
 * where {@code e} is a power of 2 and {@code m} is odd. With {@code l} the
 * action of T and {@code r} the action of {@code [[1, 0], [1, 1]]}:
 *
 * <ul>
 * <li>If {@code e = 1}, the subgroup is congruence if and only if {@code
 *     (r^2 l^-h)^3 = 1}, where {@code h} is the inverse of 2 modulo
 *     {@code N}.
 * <li>If {@code m = 1}, there are four relations, involving {@code u}, the
 *     inverse of 5 modulo {@code N}.
 * <li>Otherwise, {@code l} and {@code r} are split into parts of
 *     order dividing {@code m} and {@code e}, and there are seven
 *     relations.
 * </ul>
 *
 * <p>Relations are checked in order, stopping at the first that fails.
 * Each is reported to {@link Tracer#onRelation(String, boolean)}.
 */
abstract class CongruenceTest {
  private CongruenceTest() {}

  static boolean isCongruence(ModularSubgroup g) {
    final Perm s = g.s();
    final Perm t = g.t();
    final Perm r = Perm.product(s.pow(2), t, s.inverse(), t);
    BigInteger n = g.generalizedLevel();
    if (!g.containsMinusOne()) {
      n = n.shiftLeft(1);
    }
    final Arithmetic.TwoAdic split = Arithmetic.split(n);
    final Relations relations = new Relations(g.session().tracer);
    if (split.e.equals(BigInteger.ONE)) {
      return oddLevel(relations, t, r, n);
    } else if (split.m.equals(BigInteger.ONE)) {
      return twoPowerLevel(relations, t, r, n);
    } else {
      return mixedLevel(relations, t, r, split.e, split.m);
    }
  }

  private static boolean oddLevel(Relations relations, Perm l, Perm r,
      BigInteger n) {
    final BigInteger h = Arithmetic.inverseMod(2, n);
    final Perm x = r.pow(2).multiply(l.pow(h.negate()));
    return relations.check("A", x.pow(3));
  }

  private static boolean twoPowerLevel(Relations relations, Perm l, Perm r,
      BigInteger n) {
    final BigInteger u = Arithmetic.inverseMod(5, n);
    final Perm rInverse = r.inverse();
    final Perm q =
        Perm.product(l.pow(20), r.pow(u), l.pow(-4), rInverse);
    final Perm p = Perm.product(l, rInverse, l);
    return relations.check("A", Perm.product(p.inverse(), q, p, q))
        && relations.check("B",
            Perm.product(q.inverse(), r, q, r.pow(-25)))
        && relations.check("C",
            Perm.product(q, r.pow(5), p).pow(3).multiply(p.pow(-2)))
        && relations.check("D", p.pow(4));
  }

  private static boolean mixedLevel(Relations relations, Perm l, Perm r,
      BigInteger e, BigInteger m) {
    final Arithmetic.CrtBasis basis = Arithmetic.crtBasis(e, m);
    final BigInteger h = Arithmetic.inverseMod(2, m);
    final BigInteger u = Arithmetic.inverseMod(5, e);

    // Parts of order dividing m.
    final Perm a = l.pow(basis.c);
    final Perm b = r.pow(basis.c);
    // Parts of order dividing e.
    final Perm l2 = l.pow(basis.d);
    final Perm r2 = r.pow(basis.d);

    final Perm r2Inverse = r2.inverse();
    final Perm q =
        Perm.product(l2.pow(20), r2.pow(u), l2.pow(-4), r2Inverse);
    final Perm p = Perm.product(l2, r2Inverse, l2);
    final Perm o = Perm.product(a, b.inverse(), a);
    return relations.check("A",
            Perm.product(a.inverse(), r2Inverse, a, r2))
        && relations.check("B", o.pow(4))
        && relations.check("C",
            o.pow(2).multiply(a.inverse().multiply(b).pow(3)))
        && relations.check("D",
            o.pow(2).multiply(b.pow(2).multiply(a.pow(h.negate())).pow(-3)))
        && relations.check("E", Perm.product(p.inverse(), q, p, q))
        && relations.check("F",
            Perm.product(q.inverse(), r2, q, r2.pow(-25)))
        && relations.check("G",
            p.pow(2).multiply(Perm.product(q, r2.pow(5), p).pow(-3)));
  }

  /** Checks relations and reports each to a tracer. */
  private static class Relations {
    final Tracer tracer;

    Relations(Tracer tracer) {
      this.tracer = tracer;
    }

    /** Returns whether a relator evaluates to the identity. */
    boolean check(String name, Perm relator) {
      final boolean holds = relator.isIdentity();
      tracer.onRelation(name, holds);
      return holds;
    }
  }
}

// End CongruenceTest.java
