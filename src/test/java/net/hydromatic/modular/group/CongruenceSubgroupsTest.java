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

import static net.hydromatic.modular.Matchers.hasStrings;
import static net.hydromatic.modular.Matchers.isPerm;
import static net.hydromatic.modular.Matchers.throwsA;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import net.hydromatic.modular.arith.Cusp;
import net.hydromatic.modular.arith.Matrix;
import net.hydromatic.modular.util.InvalidInputException;
import org.junit.jupiter.api.Test;

/** Tests for {@link CongruenceSubgroups}, and for the congruence test
 * applied to them. */
public class CongruenceSubgroupsTest {
  private static Cusp cusp(String s) {
    return Cusp.parse(s);
  }

  @Test
  void testLevelOne() {
    for (ModularSubgroup g
        : new ModularSubgroup[] {
            CongruenceSubgroups.gamma(1), CongruenceSubgroups.gamma0(1),
            CongruenceSubgroups.gamma1(1)}) {
      assertThat(g.index(), is(1));
      assertThat(g.isCongruence(), is(true));
    }
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> CongruenceSubgroups.gamma0(0)),
        throwsA("level must be positive: 0"));
  }

  @Test
  void testGamma0Of2() {
    final ModularSubgroup g = CongruenceSubgroups.gamma0(2);
    assertThat(g.s(), isPerm("(1,2)"));
    assertThat(g.t(), isPerm("(2,3)"));
    assertThat(g.index(), is(3));
    assertThat(g.cusps(), hasStrings("infinity", "0"));
    assertThat(g.cuspsRedundant(), hasSize(3));
    assertThat(g.cuspWidth(Cusp.INFINITY), is(1));
    assertThat(g.cuspWidth(cusp("0")), is(2));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(2)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  @Test
  void testGamma0Of3() {
    final ModularSubgroup g = CongruenceSubgroups.gamma0(3);
    assertThat(g.index(), is(4));
    assertThat(g.cusps(), hasSize(2));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(3)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  @Test
  void testGamma0Of4() {
    final ModularSubgroup g = CongruenceSubgroups.gamma0(4);
    assertThat(g.index(), is(6));
    assertThat(g.containsMinusOne(), is(true));
    assertThat(g.cusps(), hasSize(3));
    assertThat(g.cuspWidth(Cusp.INFINITY), is(1));
    assertThat(g.cuspWidth(cusp("0")), is(4));
    assertThat(g.cuspWidth(cusp("1/2")), is(1));
    assertThat(g.cuspsEquivalent(cusp("1/2"), cusp("-1/2")), is(true));
    assertThat(g.cuspsEquivalent(cusp("1/3"), cusp("0")), is(true));
    assertThat(g.cuspsEquivalent(cusp("1/4"), Cusp.INFINITY), is(true));
    assertThat(g.cuspsEquivalent(cusp("0"), cusp("1/2")), is(false));
    assertThat(g.cuspsEquivalent(Cusp.INFINITY, cusp("0")), is(false));
    assertThat(g.contains(Matrix.of(3, 1, 8, 3)), is(true));
    assertThat(g.contains(Matrix.of(1, 0, 2, 1)), is(false));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(4)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  @Test
  void testGamma0Of11() {
    final ModularSubgroup g = CongruenceSubgroups.gamma0(11);
    assertThat(g.index(), is(12));
    assertThat(g.cusps(), hasStrings("infinity", "0"));
    assertThat(g.cuspWidth(cusp("0")), is(11));
    assertThat(g.contains(Matrix.of(1, 0, 11, 1)), is(true));
    assertThat(g.contains(Matrix.of(2, 1, 11, 6)), is(true));
    assertThat(g.contains(Matrix.of(1, 0, 1, 1)), is(false));
    assertThat(g.contains(Matrix.MINUS_ONE), is(true));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(11)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(1));
  }

  @Test
  void testGammaOf2() {
    final ModularSubgroup g = CongruenceSubgroups.gamma(2);
    assertThat(g.index(), is(6));
    assertThat(g.containsMinusOne(), is(true));
    assertThat(g.cusps(), hasSize(3));
    for (Cusp cusp : g.cusps()) {
      assertThat(g.cuspWidth(cusp), is(2));
    }
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(2)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  @Test
  void testGammaOf3() {
    final ModularSubgroup g = CongruenceSubgroups.gamma(3);
    assertThat(g.index(), is(24));
    assertThat(g.containsMinusOne(), is(false));
    assertThat(g.projectiveIndex(), is(12));
    assertThat(g.cusps(), hasSize(4));
    assertThat(g.contains(Matrix.of(4, 3, 9, 7)), is(true));
    assertThat(g.contains(Matrix.t(3)), is(true));
    assertThat(g.contains(Matrix.T), is(false));
    assertThat(g.contains(Matrix.MINUS_ONE), is(false));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(3)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  @Test
  void testGammaOf4() {
    final ModularSubgroup g = CongruenceSubgroups.gamma(4);
    assertThat(g.index(), is(48));
    assertThat(g.projectiveIndex(), is(24));
    assertThat(g.cusps(), hasSize(6));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(4)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  @Test
  void testGamma1Of4() {
    final ModularSubgroup g = CongruenceSubgroups.gamma1(4);
    assertThat(g.index(), is(12));
    assertThat(g.containsMinusOne(), is(false));
    assertThat(g.cusps(), hasSize(3));
    assertThat(g.contains(Matrix.of(1, 1, 4, 5)), is(true));
    assertThat(g.contains(Matrix.of(3, 1, 8, 3)), is(false));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(4)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  @Test
  void testGamma1Of5() {
    final ModularSubgroup g = CongruenceSubgroups.gamma1(5);
    assertThat(g.index(), is(24));
    assertThat(g.containsMinusOne(), is(false));
    assertThat(g.cusps(), hasSize(4));
    assertThat(g.generalizedLevel(), is(BigInteger.valueOf(5)));
    assertThat(g.isCongruence(), is(true));
    assertThat(g.genus(), is(0));
  }

  /** Conjugates of congruence subgroups are congruence subgroups. */
  @Test
  void testConjugateOfCongruence() {
    final ModularSubgroup g = CongruenceSubgroups.gamma0(5);
    final ModularSubgroup c = g.conjugate(Matrix.of(2, 1, 1, 1));
    assertThat(c.index(), is(6));
    assertThat(c.isCongruence(), is(true));
    assertThat(c.cusps(), hasSize(2));
    assertThat(c.genus(), is(0));
  }
}

// End CongruenceSubgroupsTest.java
