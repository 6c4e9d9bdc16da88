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

import static net.hydromatic.modular.Matchers.isPerm;
import static net.hydromatic.modular.Matchers.throwsA;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import net.hydromatic.modular.util.InvalidInputException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Perm} and {@link Perms}. */
public class PermTest {
  @Test
  void testParse() {
    assertThat(Perm.parse("(1,2)(3,4)"), hasToString("(1,2)(3,4)"));
    assertThat(Perm.parse("(3,4)(1,2)"), hasToString("(1,2)(3,4)"));
    assertThat(Perm.parse("( 2, 3, 1 )"), hasToString("(1,2,3)"));
    assertThat(Perm.parse("()"), sameInstance(Perm.IDENTITY));
    assertThat(Perm.parse("(5)"), sameInstance(Perm.IDENTITY));
    assertThat(Perm.IDENTITY, hasToString("()"));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Perm.parse("(1,2)(2,3)")),
        throwsA("point 2 occurs more than once"));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Perm.parse("1,2")),
        throwsA("invalid permutation '1,2'"));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Perm.parse("(0,1)")),
        throwsA("invalid point 0"));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Perm.parse("(1,x)")),
        throwsA("invalid permutation '(1,x)'"));
  }

  @Test
  void testOf() {
    assertThat(Perm.of(2, 1, 3), isPerm("(1,2)"));
    assertThat(Perm.of(2, 1, 3).largestMovedPoint(), is(2));
    assertThat(Perm.of(ImmutableList.of(1, 3, 2)), isPerm("(2,3)"));
    assertThat(Perm.of(1, 2, 3).isIdentity(), is(true));
    assertThat(
        assertThrows(InvalidInputException.class, () -> Perm.of(1, 1)),
        throwsA("not a permutation of 1..2"));
    assertThrows(InvalidInputException.class, () -> Perm.of(1, 3));
  }

  /** Permutations act on the right; in a product, the left operand is
   * applied first. */
  @Test
  void testMultiply() {
    final Perm a = Perm.parse("(1,2)");
    final Perm b = Perm.parse("(2,3)");
    assertThat(a.multiply(b), isPerm("(1,3,2)"));
    assertThat(b.multiply(a), isPerm("(1,2,3)"));
    assertThat(a.multiply(b).apply(1), is(b.apply(a.apply(1))));
    assertThat(Perm.product(a, b, a), isPerm("(1,3)"));
    assertThat(Perm.product(), sameInstance(Perm.IDENTITY));
    assertThat(a.multiply(a), sameInstance(Perm.IDENTITY));
    assertThat(a.apply(10), is(10));
  }

  @Test
  void testPower() {
    final Perm p = Perm.parse("(1,2,3)(4,5)");
    assertThat(p.inverse(), isPerm("(1,3,2)(4,5)"));
    assertThat(p.pow(-1), is(p.inverse()));
    assertThat(p.pow(0).isIdentity(), is(true));
    assertThat(p.pow(2), isPerm("(1,3,2)"));
    assertThat(p.pow(3), isPerm("(4,5)"));
    assertThat(p.pow(6).isIdentity(), is(true));
    // 10^20 + 1 = 2 mod 3, = 1 mod 2
    final BigInteger k = BigInteger.TEN.pow(20).add(BigInteger.ONE);
    assertThat(p.pow(k), isPerm("(1,3,2)(4,5)"));
    assertThat(p.apply(1, BigInteger.valueOf(-1)), is(3));
    assertThat(p.apply(4, k), is(5));
    assertThat(p.apply(7, k), is(7));
    assertThat(p.cycleLength(2), is(3));
    assertThat(p.cycleLength(5), is(2));
    assertThat(p.cycleLength(6), is(1));
  }

  @Test
  void testConjugate() {
    final Perm a = Perm.parse("(1,2)");
    final Perm p = Perm.parse("(2,3)");
    assertThat(a.conjugate(p), isPerm("(1,3)"));
    final Perm q = Perm.parse("(1,2,3,4)");
    assertThat(Perm.parse("(1,3)(2,4)").conjugate(q),
        isPerm("(1,3)(2,4)"));
  }

  @Test
  void testCycles() {
    final Perm p = Perm.parse("(1,3)");
    assertThat(p.fixedPointCount(5), is(3));
    assertThat(p.cycles(4), hasToString("[[1, 3], [2], [4]]"));
    assertThat(p.listPerm(4), hasToString("[3, 2, 1, 4]"));
    assertThat(Perm.IDENTITY.cycles(2), hasToString("[[1], [2]]"));
  }

  @Test
  void testPerms() {
    final Perm a = Perm.parse("(1,2)");
    final Perm b = Perm.parse("(3,4)");
    final Perm c = Perm.parse("(2,3,4)");
    assertThat(Perms.largestMovedPoint(a, b), is(4));
    assertThat(Perms.largestMovedPoint(ImmutableList.of()), is(0));
    assertThat(Perms.orbit(1, ImmutableList.of(a, b)), hasToString("[1, 2]"));
    assertThat(Perms.orbit(5, ImmutableList.of(a, b)), hasToString("[5]"));
    assertThat(Perms.isTransitive(4, ImmutableList.of(a, c)), is(true));
    assertThat(Perms.isTransitive(4, ImmutableList.of(a, b)), is(false));
    assertThat(Perms.isTransitive(3, ImmutableList.of(a, c)), is(false));
    assertThat(Perms.isTransitive(1, ImmutableList.of()), is(true));
  }
}

// End PermTest.java
