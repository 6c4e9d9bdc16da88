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
package net.hydromatic.modular.arith;

import static net.hydromatic.modular.Matchers.isMatrix;
import static net.hydromatic.modular.Matchers.throwsA;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import net.hydromatic.modular.util.InvalidInputException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Matrix}. */
public class MatrixTest {
  @Test
  void testGenerators() {
    assertThat(Matrix.S.multiply(Matrix.S), is(Matrix.MINUS_ONE));
    assertThat(Matrix.MINUS_ONE.isMinusOne(), is(true));
    assertThat(
        Matrix.product(Matrix.S, Matrix.S, Matrix.S, Matrix.S).isIdentity(),
        is(true));
    final Matrix s3t =
        Matrix.product(Matrix.S, Matrix.S, Matrix.S, Matrix.T);
    assertThat(Matrix.product(s3t, s3t, s3t).isIdentity(), is(true));
    assertThat(Matrix.t(3), isMatrix("[[1,3],[0,1]]"));
    assertThat(Matrix.t(-2).multiply(Matrix.t(2)).isIdentity(), is(true));
    assertThat(Matrix.T.trace(), is(BigInteger.valueOf(2)));
    assertThat(Matrix.T.conjugateBy(Matrix.S), isMatrix("[[1,0],[-1,1]]"));
    assertThat(Matrix.product().isIdentity(), is(true));
  }

  @Test
  void testInverse() {
    final Matrix m = Matrix.of(5, 2, 7, 3);
    assertThat(m.inverse(), isMatrix("[[3,-2],[-7,5]]"));
    assertThat(m.multiply(m.inverse()).isIdentity(), is(true));
    assertThat(m.inverse().multiply(m).isIdentity(), is(true));
    assertThat(m.negate(), isMatrix("[[-5,-2],[-7,-3]]"));
  }

  @Test
  void testDeterminant() {
    final InvalidInputException e =
        assertThrows(InvalidInputException.class,
            () -> Matrix.of(1, 2, 3, 4));
    assertThat(e,
        throwsA("matrix [[1,2],[3,4]] is not in SL(2,Z): determinant is -2"));
    assertThrows(InvalidInputException.class, () -> Matrix.of(2, 0, 0, 2));
  }

  @Test
  void testParse() {
    assertThat(Matrix.parse("[[ 2, 1 ], [ 1, 1 ]]"),
        hasToString("[[2,1],[1,1]]"));
    assertThat(Matrix.parse("[[-1,0],[0,-1]]").isMinusOne(), is(true));
    final String big = "12345678901234567890";
    final Matrix m = Matrix.parse("[[1," + big + "],[0,1]]");
    assertThat(m.b, is(new BigInteger(big)));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Matrix.parse("[[1,2]]")),
        throwsA("expected two rows"));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Matrix.parse("[[1,2,3],[4,5]]")),
        throwsA("expected two entries per row"));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Matrix.parse("[[a,b],[c,d]]")),
        throwsA("invalid matrix '[[a,b],[c,d]]'"));
    assertThat(
        assertThrows(InvalidInputException.class,
            () -> Matrix.parse("(1,2)")),
        throwsA("expected [[a,b],[c,d]]"));
  }
}

// End MatrixTest.java
