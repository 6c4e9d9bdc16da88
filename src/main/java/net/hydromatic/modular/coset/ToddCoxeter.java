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
package net.hydromatic.modular.coset;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.util.EnumerationLimitException;
import net.hydromatic.modular.word.Generator;
import net.hydromatic.modular.word.Presentation;
import net.hydromatic.modular.word.Word;

/**
 * Coset enumeration by the Todd-Coxeter procedure, Haselgrove-Leech-Trotter
 * (HLT) strategy, for subgroups of SL(2,Z) given by the relators of {@link
 * Presentation#SL2Z}.
 *
 * <p>The table has four columns: S, S<sup>-1</sup>, T, T<sup>-1</sup>.
 * Column {@code x ^ 1} is the inverse of column {@code x}.
 */
public class ToddCoxeter implements CosetEnumerator {
  private static final int S = 0;
  private static final int S_INV = 1;
  private static final int T = 2;
  private static final int T_INV = 3;
  private static final int COLUMNS = 4;

  private final ImmutableList<int[]> relators;

  public ToddCoxeter() {
    final ImmutableList.Builder<int[]> builder = ImmutableList.builder();
    for (Word relator : Presentation.SL2Z.relators.values()) {
      builder.add(letters(relator));
    }
    this.relators = builder.build();
  }

  /** Converts a word to a sequence of column numbers. */
  static int[] letters(Word word) {
    final List<Integer> letters = new ArrayList<>();
    for (Word.Syllable syllable : word.syllables) {
      final int column = syllable.generator == Generator.S
          ? (syllable.exponent.signum() > 0 ? S : S_INV)
          : (syllable.exponent.signum() > 0 ? T : T_INV);
      final BigInteger count = syllable.exponent.abs();
      checkArgument(count.bitLength() < 31, "exponent too large: %s",
          syllable);
      for (int i = 0; i < count.intValue(); i++) {
        letters.add(column);
      }
    }
    return Ints.toArray(letters);
  }

  @Override
  public CosetTable enumerate(List<Word> generators, int limit) {
    checkArgument(limit >= 1, "limit must be positive: %s", limit);
    final Work work = new Work(limit);
    for (Word generator : generators) {
      work.scanAndFill(1, letters(generator));
    }
    for (int coset = 1; coset <= work.n; coset++) {
      for (int[] relator : relators) {
        if (!work.isLive(coset)) {
          break;
        }
        work.scanAndFill(coset, relator);
      }
      if (work.isLive(coset)) {
        for (int x = 0; x < COLUMNS; x++) {
          if (work.get(coset, x) == 0) {
            work.define(coset, x);
          }
        }
      }
    }
    return work.toTable();
  }

  /** State of an enumeration. Cosets are numbered from 1; 0 in the table
   * means "undefined". */
  private static class Work {
    final int limit;
    /** Number of cosets defined so far, live or dead. */
    int n;
    /** Entry {@code coset * COLUMNS + x} is the image of coset under column
     * {@code x}. */
    int[] table;
    /** Union-find forest of coincident cosets; a coset is live if it is its
     * own parent. */
    int[] parent;
    final Deque<Integer> queue = new ArrayDeque<>();

    Work(int limit) {
      this.limit = limit;
      this.table = new int[COLUMNS * 64];
      this.parent = new int[64];
      this.n = 1;
      this.parent[1] = 1;
    }

    boolean isLive(int coset) {
      return parent[coset] == coset;
    }

    int get(int coset, int x) {
      return table[coset * COLUMNS + x];
    }

    void set(int coset, int x, int image) {
      table[coset * COLUMNS + x] = image;
    }

    /** Defines a new coset as the image of {@code coset} under column
     * {@code x}. */
    void define(int coset, int x) {
      if (n >= limit) {
        throw new EnumerationLimitException(limit);
      }
      ++n;
      if (n >= parent.length) {
        parent = Arrays.copyOf(parent, parent.length * 2);
        table = Arrays.copyOf(table, parent.length * COLUMNS);
      }
      parent[n] = n;
      set(coset, x, n);
      set(n, x ^ 1, coset);
    }

    /** Scans a relator (or subgroup generator) {@code w} under coset
     * {@code alpha}, defining cosets as needed and processing any deduction
     * or coincidence found. */
    void scanAndFill(int alpha, int[] w) {
      int f = alpha;
      int b = alpha;
      int i = 0;
      int j = w.length - 1;
      for (;;) {
        // scan forwards
        while (i <= j && get(f, w[i]) != 0) {
          f = get(f, w[i]);
          ++i;
        }
        if (i > j) {
          if (f != alpha) {
            coincidence(f, alpha);
          }
          return;
        }
        // scan backwards
        while (j >= i && get(b, w[j] ^ 1) != 0) {
          b = get(b, w[j] ^ 1);
          --j;
        }
        if (j < i) {
          coincidence(f, b);
          return;
        } else if (i == j) {
          // deduction
          set(f, w[i], b);
          set(b, w[i] ^ 1, f);
          return;
        }
        define(f, w[i]);
      }
    }

    /** Returns the live coset that a coset has been merged into. */
    int rep(int coset) {
      int r = coset;
      while (parent[r] != r) {
        r = parent[r];
      }
      // path compression
      int c = coset;
      while (parent[c] != r) {
        final int next = parent[c];
        parent[c] = r;
        c = next;
      }
      return r;
    }

    void merge(int alpha, int beta) {
      final int phi = rep(alpha);
      final int psi = rep(beta);
      if (phi != psi) {
        final int mu = Math.min(phi, psi);
        final int nu = Math.max(phi, psi);
        parent[nu] = mu;
        queue.add(nu);
      }
    }

    /** Records that two cosets are equal, and processes the consequences
     * until the table is consistent again. */
    void coincidence(int alpha, int beta) {
      merge(alpha, beta);
      while (!queue.isEmpty()) {
        final int gamma = queue.remove();
        for (int x = 0; x < COLUMNS; x++) {
          final int delta = get(gamma, x);
          if (delta == 0) {
            continue;
          }
          set(delta, x ^ 1, 0);
          final int mu = rep(gamma);
          final int nu = rep(delta);
          if (get(mu, x) != 0) {
            merge(nu, get(mu, x));
          } else if (get(nu, x ^ 1) != 0) {
            merge(mu, get(nu, x ^ 1));
          } else {
            set(mu, x, nu);
            set(nu, x ^ 1, mu);
          }
        }
      }
    }

    /** Renumbers the live cosets 1 .. index, in increasing order, and
     * converts the S and T columns to permutations. */
    CosetTable toTable() {
      final int[] number = new int[n + 1];
      int index = 0;
      for (int coset = 1; coset <= n; coset++) {
        if (isLive(coset)) {
          number[coset] = ++index;
        }
      }
      final int[] s = new int[index];
      final int[] t = new int[index];
      for (int coset = 1; coset <= n; coset++) {
        if (isLive(coset)) {
          s[number[coset] - 1] = number[rep(get(coset, S))];
          t[number[coset] - 1] = number[rep(get(coset, T))];
        }
      }
      return CosetTable.of(index, Perm.of(s), Perm.of(t));
    }
  }
}

// End ToddCoxeter.java
