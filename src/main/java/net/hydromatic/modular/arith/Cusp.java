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

import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import net.hydromatic.modular.util.InvalidInputException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Point of the projective line over Q: either a rational number or
 * infinity.
 *
 * <p>A cusp is one of two kinds, {@link Kind#FINITE} or {@link
 * Kind#INFINITY}; code that treats the kinds differently switches on {@link
 * #kind()}.
 *
 * <p>{@link #equals(Object)} compares values. Whether two cusps are
 * equivalent under a subgroup is a different question, answered by {@link
 * net.hydromatic.modular.group.ModularSubgroup#cuspsEquivalent}.
 */
public abstract class Cusp {
  /** The cusp at infinity. */
  public static final Cusp INFINITY = new Infinity();

  private Cusp() {}

  /** Returns the kind of this cusp. */
  public abstract Kind kind();

  /**
   * Returns the numerator; for {@link #INFINITY}, 1.
   *
   * <p>Numerator and denominator are coprime, and the denominator is
   * non-negative.
   */
  public abstract BigInteger numerator();

  /** Returns the denominator; for {@link #INFINITY}, 0. */
  public abstract BigInteger denominator();

  /**
   * Creates the cusp {@code p / q}. If {@code q} is zero, returns {@link
   * #INFINITY}.
   */
  public static Cusp of(BigInteger p, BigInteger q) {
    if (q.signum() == 0) {
      if (p.signum() == 0) {
        throw new InvalidInputException("0/0 is not a cusp");
      }
      return INFINITY;
    }
    BigInteger g = p.gcd(q);
    if (q.signum() < 0) {
      g = g.negate();
    }
    return new Finite(p.divide(g), q.divide(g));
  }

  /** Creates the cusp {@code p / q}. */
  public static Cusp of(long p, long q) {
    return of(BigInteger.valueOf(p), BigInteger.valueOf(q));
  }

  /** Creates the cusp for the integer {@code p}. */
  public static Cusp of(long p) {
    return of(p, 1);
  }

  /**
   * Parses a cusp: "infinity", "oo" or "∞"; an integer; or a fraction
   * "p/q".
   */
  public static Cusp parse(String s) {
    final String t = CharMatcher.whitespace().removeFrom(s);
    switch (t.toLowerCase(Locale.ROOT)) {
      case "infinity":
      case "oo":
      case "∞":
        return INFINITY;
    }
    try {
      final int slash = t.indexOf('/');
      if (slash < 0) {
        return of(new BigInteger(t), BigInteger.ONE);
      }
      return of(new BigInteger(t.substring(0, slash)),
          new BigInteger(t.substring(slash + 1)));
    } catch (NumberFormatException e) {
      throw new InvalidInputException("invalid cusp '" + s + "'", e);
    }
  }

  /**
   * Returns a matrix {@code g} in SL(2,Z) such that {@code g} maps infinity
   * to this cusp.
   *
   * <p>For infinity, the identity. For {@code p / q}, {@code [[p, -y], [q,
   * x]]} where {@code x * p + y * q = 1}.
   */
  public Matrix conjugator() {
    switch (kind()) {
      case INFINITY:
        return Matrix.IDENTITY;
      case FINITE:
        final Arithmetic.Bezout bezout =
            Arithmetic.bezout(numerator(), denominator());
        return Matrix.of(numerator(), bezout.y.negate(), denominator(),
            bezout.x);
      default:
        throw new AssertionError(kind());
    }
  }

  /**
   * Applies a Möbius transformation: returns {@code (a z + b) / (c z + d)}
   * where {@code z} is this cusp and {@code m = [[a, b], [c, d]]}.
   */
  public Cusp apply(Matrix m) {
    final BigInteger p = numerator();
    final BigInteger q = denominator();
    return of(m.a.multiply(p).add(m.b.multiply(q)),
        m.c.multiply(p).add(m.d.multiply(q)));
  }

  /** Returns the image of infinity under a matrix, i.e. {@code a / c}. */
  public static Cusp ofMatrix(Matrix m) {
    return of(m.a, m.c);
  }

  /** Kind of cusp. */
  public enum Kind {
    /** A rational number. */
    FINITE,
    /** The point at infinity. */
    INFINITY
  }

  /** The point at infinity. */
  private static class Infinity extends Cusp {
    @Override
    public Kind kind() {
      return Kind.INFINITY;
    }

    @Override
    public BigInteger numerator() {
      return BigInteger.ONE;
    }

    @Override
    public BigInteger denominator() {
      return BigInteger.ZERO;
    }

    @Override
    public String toString() {
      return "infinity";
    }
  }

  /** A rational number in lowest terms, positive denominator. */
  private static class Finite extends Cusp {
    private final BigInteger p;
    private final BigInteger q;

    Finite(BigInteger p, BigInteger q) {
      this.p = requireNonNull(p, "p");
      this.q = requireNonNull(q, "q");
    }

    @Override
    public Kind kind() {
      return Kind.FINITE;
    }

    @Override
    public BigInteger numerator() {
      return p;
    }

    @Override
    public BigInteger denominator() {
      return q;
    }

    @Override
    public int hashCode() {
      return Objects.hash(p, q);
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o == this
          || o instanceof Finite
              && p.equals(((Finite) o).p)
              && q.equals(((Finite) o).q);
    }

    @Override
    public String toString() {
      return q.equals(BigInteger.ONE) ? p.toString() : p + "/" + q;
    }
  }
}

// End Cusp.java
