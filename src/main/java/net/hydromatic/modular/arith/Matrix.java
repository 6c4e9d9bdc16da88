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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import net.hydromatic.modular.util.InvalidInputException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Element of SL(2,Z): a 2x2 integer matrix with determinant 1.
 *
 * <p>The entries are named
 *
 * <pre>
 *   [[a, b],
 *    [c, d]]
 * </pre>
 *
 * <p>Instances are immutable. Every factory method checks the determinant;
 * a matrix outside SL(2,Z) cannot be created.
 */
public final class Matrix {
  public final BigInteger a;
  public final BigInteger b;
  public final BigInteger c;
  public final BigInteger d;

  /** The identity matrix. */
  public static final Matrix IDENTITY = of(1, 0, 0, 1);

  /** The negative of the identity matrix, -I. */
  public static final Matrix MINUS_ONE = of(-1, 0, 0, -1);

  /** Generator S = [[0, -1], [1, 0]], of order 4. */
  public static final Matrix S = of(0, -1, 1, 0);

  /** Generator T = [[1, 1], [0, 1]]. */
  public static final Matrix T = of(1, 1, 0, 1);

  private Matrix(BigInteger a, BigInteger b, BigInteger c, BigInteger d) {
    this.a = a;
    this.b = b;
    this.c = c;
    this.d = d;
  }

  /**
   * Creates a matrix.
   *
   * @throws InvalidInputException if the determinant is not 1
   */
  public static Matrix of(BigInteger a, BigInteger b, BigInteger c,
      BigInteger d) {
    final BigInteger det = a.multiply(d).subtract(b.multiply(c));
    if (!det.equals(BigInteger.ONE)) {
      throw new InvalidInputException("matrix " + format(a, b, c, d)
          + " is not in SL(2,Z): determinant is " + det);
    }
    return new Matrix(a, b, c, d);
  }

  /** Creates a matrix from {@code long} entries. */
  public static Matrix of(long a, long b, long c, long d) {
    return of(BigInteger.valueOf(a), BigInteger.valueOf(b),
        BigInteger.valueOf(c), BigInteger.valueOf(d));
  }

  /** Returns T<sup>k</sup> = [[1, k], [0, 1]]. */
  public static Matrix t(BigInteger k) {
    return new Matrix(BigInteger.ONE, k, BigInteger.ZERO, BigInteger.ONE);
  }

  /** Returns T<sup>k</sup>. */
  public static Matrix t(long k) {
    return t(BigInteger.valueOf(k));
  }

  /**
   * Parses a matrix written as {@code [[a,b],[c,d]]}. Spaces are ignored.
   *
   * @throws InvalidInputException if the text is malformed or the matrix is
   *     not in SL(2,Z)
   */
  public static Matrix parse(String s) {
    final String t = CharMatcher.whitespace().removeFrom(s);
    if (!t.startsWith("[[") || !t.endsWith("]]")) {
      throw new InvalidInputException("invalid matrix '" + s
          + "'; expected [[a,b],[c,d]]");
    }
    final List<String> rows =
        Splitter.on("],[").splitToList(t.substring(2, t.length() - 2));
    if (rows.size() != 2) {
      throw new InvalidInputException("invalid matrix '" + s
          + "'; expected two rows");
    }
    final List<String> row0 = Splitter.on(',').splitToList(rows.get(0));
    final List<String> row1 = Splitter.on(',').splitToList(rows.get(1));
    if (row0.size() != 2 || row1.size() != 2) {
      throw new InvalidInputException("invalid matrix '" + s
          + "'; expected two entries per row");
    }
    try {
      return of(new BigInteger(row0.get(0)), new BigInteger(row0.get(1)),
          new BigInteger(row1.get(0)), new BigInteger(row1.get(1)));
    } catch (NumberFormatException e) {
      throw new InvalidInputException("invalid matrix '" + s + "'", e);
    }
  }

  /** Returns the product {@code this * m}. */
  public Matrix multiply(Matrix m) {
    return new Matrix(
        a.multiply(m.a).add(b.multiply(m.c)),
        a.multiply(m.b).add(b.multiply(m.d)),
        c.multiply(m.a).add(d.multiply(m.c)),
        c.multiply(m.b).add(d.multiply(m.d)));
  }

  /** Returns the product of several matrices, left to right. */
  public static Matrix product(Matrix... matrices) {
    Matrix m = IDENTITY;
    for (Matrix matrix : matrices) {
      m = m.multiply(matrix);
    }
    return m;
  }

  /** Returns the inverse, [[d, -b], [-c, a]]. */
  public Matrix inverse() {
    return new Matrix(d, b.negate(), c.negate(), a);
  }

  /** Returns the negation, -M. */
  public Matrix negate() {
    return new Matrix(a.negate(), b.negate(), c.negate(), d.negate());
  }

  /** Returns {@code g * this * g^-1}. */
  public Matrix conjugateBy(Matrix g) {
    return g.multiply(this).multiply(g.inverse());
  }

  public boolean isIdentity() {
    return equals(IDENTITY);
  }

  public boolean isMinusOne() {
    return equals(MINUS_ONE);
  }

  /** Returns the trace, a + d. */
  public BigInteger trace() {
    return a.add(d);
  }

  @Override
  public int hashCode() {
    return Objects.hash(a, b, c, d);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Matrix
            && a.equals(((Matrix) o).a)
            && b.equals(((Matrix) o).b)
            && c.equals(((Matrix) o).c)
            && d.equals(((Matrix) o).d);
  }

  @Override
  public String toString() {
    return format(a, b, c, d);
  }

  private static String format(BigInteger a, BigInteger b, BigInteger c,
      BigInteger d) {
    return "[[" + a + "," + b + "],[" + c + "," + d + "]]";
  }
}

// End Matrix.java
