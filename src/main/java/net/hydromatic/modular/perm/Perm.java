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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.modular.util.InvalidInputException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Permutation of the positive integers that moves finitely many points.
 *
 * <p>Permutations act on the right: {@code i^(p * q) = (i^p)^q}, so {@link
 * #multiply(Perm)} applies {@code this} first.
 *
 * <p>Instances are immutable, and two permutations that move the same
 * points the same way are equal regardless of how they were created.
 */
public final class Perm {
  /** The identity permutation. */
  public static final Perm IDENTITY = new Perm(new int[0]);

  /**
   * Images of points 1 .. {@code images.length}, each stored zero-based;
   * {@code images[i]} is the image of point {@code i + 1}, minus 1. The array
   * ends at the largest moved point.
   */
  private final int[] images;

  private Perm(int[] images) {
    this.images = images;
  }

  /** Creates a permutation from an array that may have trailing fixed
   * points; the array is not copied. */
  private static Perm trim(int[] images) {
    int n = images.length;
    while (n > 0 && images[n - 1] == n - 1) {
      --n;
    }
    if (n == 0) {
      return IDENTITY;
    }
    return new Perm(n == images.length ? images : Arrays.copyOf(images, n));
  }

  /**
   * Creates a permutation from the list of images of points 1 .. n.
   *
   * @throws InvalidInputException if the list is not a permutation of 1 .. n
   */
  public static Perm of(int... images) {
    final int n = images.length;
    final int[] zeroBased = new int[n];
    final boolean[] seen = new boolean[n];
    for (int i = 0; i < n; i++) {
      final int image = images[i] - 1;
      if (image < 0 || image >= n || seen[image]) {
        throw new InvalidInputException("not a permutation of 1.." + n
            + ": " + Arrays.toString(images));
      }
      seen[image] = true;
      zeroBased[i] = image;
    }
    return trim(zeroBased);
  }

  /** Creates a permutation from the list of images of points 1 .. n. */
  public static Perm of(List<Integer> images) {
    return of(Ints.toArray(images));
  }

  /**
   * Creates a permutation from disjoint cycles.
   *
   * @throws InvalidInputException if a point is not positive, or occurs more
   *     than once
   */
  public static Perm ofCycles(List<? extends List<Integer>> cycles) {
    int n = 0;
    for (List<Integer> cycle : cycles) {
      for (int point : cycle) {
        if (point < 1) {
          throw new InvalidInputException("invalid point " + point
              + " in cycle " + cycle);
        }
        n = Math.max(n, point);
      }
    }
    final int[] images = identityArray(n);
    final boolean[] seen = new boolean[n];
    for (List<Integer> cycle : cycles) {
      for (int i = 0; i < cycle.size(); i++) {
        final int point = cycle.get(i) - 1;
        if (seen[point]) {
          throw new InvalidInputException("point " + (point + 1)
              + " occurs more than once in " + cycles);
        }
        seen[point] = true;
        images[point] = cycle.get((i + 1) % cycle.size()) - 1;
      }
    }
    return trim(images);
  }

  /**
   * Parses a permutation in cycle notation, for example {@code
   * "(1,2,3)(4,5)"}; {@code "()"} is the identity. Spaces are ignored.
   */
  public static Perm parse(String s) {
    final String t = CharMatcher.whitespace().removeFrom(s);
    if (!t.startsWith("(") || !t.endsWith(")")) {
      throw new InvalidInputException("invalid permutation '" + s
          + "'; expected cycles such as (1,2)(3,4)");
    }
    final List<List<Integer>> cycles = new ArrayList<>();
    for (String cycle
        : Splitter.on(")(").split(t.substring(1, t.length() - 1))) {
      if (cycle.isEmpty()) {
        continue;
      }
      final ImmutableList.Builder<Integer> points = ImmutableList.builder();
      for (String point : Splitter.on(',').split(cycle)) {
        try {
          points.add(Integer.parseInt(point));
        } catch (NumberFormatException e) {
          throw new InvalidInputException("invalid permutation '" + s
              + "'", e);
        }
      }
      cycles.add(points.build());
    }
    return ofCycles(cycles);
  }

  private static int[] identityArray(int n) {
    final int[] images = new int[n];
    for (int i = 0; i < n; i++) {
      images[i] = i;
    }
    return images;
  }

  /** Returns the image of a point. Points beyond the largest moved point
   * are fixed. */
  public int apply(int point) {
    checkArgument(point >= 1, "point must be positive: %s", point);
    return point <= images.length ? images[point - 1] + 1 : point;
  }

  /**
   * Returns the image of a point under the {@code k}th power of this
   * permutation, without computing the power.
   */
  public int apply(int point, BigInteger k) {
    final int length = cycleLength(point);
    int steps = k.mod(BigInteger.valueOf(length)).intValue();
    int p = point;
    while (steps-- > 0) {
      p = apply(p);
    }
    return p;
  }

  /** Returns the length of the cycle containing a point; 1 if fixed. */
  public int cycleLength(int point) {
    int length = 1;
    for (int p = apply(point); p != point; p = apply(p)) {
      ++length;
    }
    return length;
  }

  /** Returns the largest point moved by this permutation, or 0 if it is the
   * identity. */
  public int largestMovedPoint() {
    return images.length;
  }

  public boolean isIdentity() {
    return images.length == 0;
  }

  /** Returns the product {@code this * p}; {@code this} is applied first. */
  public Perm multiply(Perm p) {
    final int n = Math.max(images.length, p.images.length);
    final int[] product = new int[n];
    for (int i = 0; i < n; i++) {
      product[i] = p.apply(apply(i + 1)) - 1;
    }
    return trim(product);
  }

  /** Returns the product of several permutations, left to right. */
  public static Perm product(Perm... perms) {
    Perm p = IDENTITY;
    for (Perm perm : perms) {
      p = p.multiply(perm);
    }
    return p;
  }

  /** Returns the inverse permutation. */
  public Perm inverse() {
    final int[] inverse = new int[images.length];
    for (int i = 0; i < images.length; i++) {
      inverse[images[i]] = i;
    }
    return new Perm(inverse);
  }

  /** Returns this permutation raised to an integer power. */
  public Perm pow(long k) {
    return pow(BigInteger.valueOf(k));
  }

  /**
   * Returns this permutation raised to an integer power, which may be
   * negative. Each cycle is rotated by the power modulo its length.
   */
  public Perm pow(BigInteger k) {
    final int[] power = identityArray(images.length);
    final boolean[] done = new boolean[images.length];
    for (int i = 0; i < images.length; i++) {
      if (done[i]) {
        continue;
      }
      final List<Integer> cycle = new ArrayList<>();
      for (int p = i; !done[p]; p = images[p]) {
        done[p] = true;
        cycle.add(p);
      }
      final int length = cycle.size();
      final int shift = k.mod(BigInteger.valueOf(length)).intValue();
      for (int j = 0; j < length; j++) {
        power[cycle.get(j)] = cycle.get((j + shift) % length);
      }
    }
    return trim(power);
  }

  /** Returns the conjugate {@code p^-1 * this * p}. */
  public Perm conjugate(Perm p) {
    return p.inverse().multiply(this).multiply(p);
  }

  /** Returns the number of points in 1 .. n that are fixed. */
  public int fixedPointCount(int n) {
    int count = 0;
    for (int i = 1; i <= n; i++) {
      if (apply(i) == i) {
        ++count;
      }
    }
    return count;
  }

  /** Returns the cycles of this permutation on 1 .. n, including cycles of
   * length 1, each starting at its smallest point. */
  public List<List<Integer>> cycles(int n) {
    final List<List<Integer>> cycles = new ArrayList<>();
    final boolean[] done = new boolean[Math.max(n, images.length) + 1];
    for (int i = 1; i <= n; i++) {
      if (done[i]) {
        continue;
      }
      final ImmutableList.Builder<Integer> cycle = ImmutableList.builder();
      for (int p = i; !done[p]; p = apply(p)) {
        done[p] = true;
        cycle.add(p);
      }
      cycles.add(cycle.build());
    }
    return cycles;
  }

  /** Returns the images of points 1 .. n, as GAP's {@code ListPerm} does. */
  public ImmutableList<Integer> listPerm(int n) {
    final ImmutableList.Builder<Integer> list = ImmutableList.builder();
    for (int i = 1; i <= n; i++) {
      list.add(apply(i));
    }
    return list.build();
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(images);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Perm
            && Arrays.equals(images, ((Perm) o).images);
  }

  /** Returns cycle notation, for example "(1,2,3)(4,5)"; "()" for the
   * identity. */
  @Override
  public String toString() {
    if (isIdentity()) {
      return "()";
    }
    final StringBuilder buf = new StringBuilder();
    for (List<Integer> cycle : cycles(images.length)) {
      if (cycle.size() > 1) {
        buf.append('(');
        for (int i = 0; i < cycle.size(); i++) {
          if (i > 0) {
            buf.append(',');
          }
          buf.append(cycle.get(i));
        }
        buf.append(')');
      }
    }
    return buf.toString();
  }
}

// End Perm.java
