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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import java.util.List;
import net.hydromatic.modular.util.InvalidInputException;

/** Exact integer arithmetic: Bézout coefficients, modular inverses, CRT. */
public class Arithmetic {
  private Arithmetic() {}

  /**
   * Runs the extended Euclidean algorithm.
   *
   * <p>The result satisfies {@code x * a + y * b = gcd}, and {@code gcd} is
   * never negative.
   */
  public static Bezout bezout(BigInteger a, BigInteger b) {
    BigInteger oldR = requireNonNull(a, "a");
    BigInteger r = requireNonNull(b, "b");
    BigInteger oldS = BigInteger.ONE;
    BigInteger s = BigInteger.ZERO;
    BigInteger oldT = BigInteger.ZERO;
    BigInteger t = BigInteger.ONE;
    while (r.signum() != 0) {
      final BigInteger q = oldR.divide(r);
      BigInteger tmp = oldR.subtract(q.multiply(r));
      oldR = r;
      r = tmp;
      tmp = oldS.subtract(q.multiply(s));
      oldS = s;
      s = tmp;
      tmp = oldT.subtract(q.multiply(t));
      oldT = t;
      t = tmp;
    }
    if (oldR.signum() < 0) {
      return new Bezout(oldR.negate(), oldS.negate(), oldT.negate());
    }
    return new Bezout(oldR, oldS, oldT);
  }

  /**
   * Returns the inverse of {@code a} modulo {@code n}, in the range [0, n).
   *
   * @throws InvalidInputException if {@code a} and {@code n} are not coprime
   */
  public static BigInteger inverseMod(BigInteger a, BigInteger n) {
    checkArgument(n.signum() > 0, "modulus must be positive: %s", n);
    final Bezout bezout = bezout(a.mod(n), n);
    if (!bezout.gcd.equals(BigInteger.ONE)) {
      throw new InvalidInputException(
          a + " has no inverse modulo " + n);
    }
    return bezout.x.mod(n);
  }

  /** Shorthand for {@link #inverseMod(BigInteger, BigInteger)}. */
  public static BigInteger inverseMod(long a, BigInteger n) {
    return inverseMod(BigInteger.valueOf(a), n);
  }

  /**
   * Returns the idempotents for coprime moduli {@code e} and {@code m}: a
   * value {@code c} with {@code c = 0 mod e, c = 1 mod m}, and a value {@code
   * d} with {@code d = 1 mod e, d = 0 mod m}. Both lie in [0, e * m).
   */
  public static CrtBasis crtBasis(BigInteger e, BigInteger m) {
    final BigInteger n = e.multiply(m);
    final BigInteger c = e.multiply(inverseMod(e, m)).mod(n);
    final BigInteger d = m.multiply(inverseMod(m, e)).mod(n);
    return new CrtBasis(c, d);
  }

  /**
   * Solves a system of congruences {@code x = residues[i] mod moduli[i]}
   * over pairwise coprime moduli. Returns the solution in [0, product).
   */
  public static BigInteger crt(List<BigInteger> residues,
      List<BigInteger> moduli) {
    checkArgument(residues.size() == moduli.size(),
        "residues and moduli must have the same length");
    BigInteger x = BigInteger.ZERO;
    BigInteger n = BigInteger.ONE;
    for (int i = 0; i < moduli.size(); i++) {
      final BigInteger m = moduli.get(i);
      checkArgument(m.signum() > 0, "modulus must be positive: %s", m);
      final BigInteger r = residues.get(i).mod(m);
      // x + n * k = r (mod m)
      final BigInteger k =
          r.subtract(x).multiply(inverseMod(n, m)).mod(m);
      x = x.add(n.multiply(k));
      n = n.multiply(m);
    }
    return x.mod(n);
  }

  /** Returns the least common multiple of two non-negative integers. */
  public static BigInteger lcm(BigInteger a, BigInteger b) {
    if (a.signum() == 0 || b.signum() == 0) {
      return BigInteger.ZERO;
    }
    return a.divide(a.gcd(b)).multiply(b).abs();
  }

  /** Returns the least common multiple of some integers; 1 if empty. */
  public static BigInteger lcm(Iterable<BigInteger> values) {
    BigInteger lcm = BigInteger.ONE;
    for (BigInteger value : values) {
      lcm = lcm(lcm, value);
    }
    return lcm;
  }

  /**
   * Splits a positive integer {@code n} into {@code e * m} where {@code e}
   * is a power of two and {@code m} is odd.
   */
  public static TwoAdic split(BigInteger n) {
    checkArgument(n.signum() > 0, "expected positive integer: %s", n);
    final int k = n.getLowestSetBit();
    return new TwoAdic(BigInteger.ONE.shiftLeft(k), n.shiftRight(k));
  }

  /** Result of {@link #bezout(BigInteger, BigInteger)}. */
  public static class Bezout {
    public final BigInteger gcd;
    public final BigInteger x;
    public final BigInteger y;

    Bezout(BigInteger gcd, BigInteger x, BigInteger y) {
      this.gcd = gcd;
      this.x = x;
      this.y = y;
    }

    @Override
    public String toString() {
      return "gcd=" + gcd + ", x=" + x + ", y=" + y;
    }
  }

  /** Result of {@link #crtBasis(BigInteger, BigInteger)}. */
  public static class CrtBasis {
    public final BigInteger c;
    public final BigInteger d;

    CrtBasis(BigInteger c, BigInteger d) {
      this.c = c;
      this.d = d;
    }
  }

  /** Result of {@link #split(BigInteger)}. */
  public static class TwoAdic {
    /** Largest power of two dividing the number. */
    public final BigInteger e;
    /** Odd part of the number. */
    public final BigInteger m;

    TwoAdic(BigInteger e, BigInteger m) {
      this.e = e;
      this.m = m;
    }
  }
}

// End Arithmetic.java
