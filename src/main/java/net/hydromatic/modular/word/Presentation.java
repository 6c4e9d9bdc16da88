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
package net.hydromatic.modular.word;

import static net.hydromatic.modular.word.Generator.S;
import static net.hydromatic.modular.word.Generator.T;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Map;
import net.hydromatic.modular.arith.Matrix;
import net.hydromatic.modular.perm.Perm;

/**
 * Finite presentation of SL(2,Z),
 *
 * <blockquote>&lang;S, T | S<sup>4</sup>, (S<sup>3</sup>T)<sup>3</sup>,
 * S<sup>2</sup>TS<sup>-2</sup>T<sup>-1</sup>&rang;</blockquote>
 *
 * <p>together with its homomorphisms to matrices and to permutation groups.
 *
 * <p>There is one instance, {@link #SL2Z}; it is immutable and shared.
 */
public final class Presentation {
  private static final BigInteger FOUR = BigInteger.valueOf(4);

  /** The presentation of SL(2,Z). */
  public static final Presentation SL2Z = new Presentation();

  /** Relators, keyed by name. */
  public final ImmutableMap<String, Word> relators;

  /** Powers S^0 .. S^3 as matrices. */
  private final ImmutableList<Matrix> sPowers;

  private Presentation() {
    final Word s3t = Word.product(Word.of(S, 3), Word.of(T, 1));
    relators =
        ImmutableMap.of(
            "S^4", Word.of(S, 4),
            "(S^3*T)^3", s3t.pow(3),
            "S^2*T*S^-2*T^-1",
            Word.product(Word.of(S, 2), Word.of(T, 1), Word.of(S, -2),
                Word.of(T, -1)));
    final ImmutableList.Builder<Matrix> powers = ImmutableList.builder();
    Matrix m = Matrix.IDENTITY;
    for (int i = 0; i < 4; i++) {
      powers.add(m);
      m = m.multiply(Matrix.S);
    }
    sPowers = powers.build();
  }

  /** Returns the generators, S and T. */
  public ImmutableList<Generator> generators() {
    return ImmutableList.copyOf(Generator.values());
  }

  /** Evaluates a word as a matrix. */
  public Matrix toMatrix(Word word) {
    Matrix m = Matrix.IDENTITY;
    for (Word.Syllable syllable : word.syllables) {
      m = m.multiply(toMatrix(syllable));
    }
    return m;
  }

  private Matrix toMatrix(Word.Syllable syllable) {
    switch (syllable.generator) {
      case S:
        return sPowers.get(syllable.exponent.mod(FOUR).intValue());
      case T:
        return Matrix.t(syllable.exponent);
      default:
        throw new AssertionError(syllable.generator);
    }
  }

  /**
   * Evaluates a word as a permutation, given the images {@code s} and {@code
   * t} of the generators. The word is read left to right, and permutations
   * act on the right.
   */
  public Perm toPerm(Word word, Perm s, Perm t) {
    Perm p = Perm.IDENTITY;
    for (Word.Syllable syllable : word.syllables) {
      p = p.multiply(image(syllable.generator, s, t).pow(syllable.exponent));
    }
    return p;
  }

  /**
   * Returns the image of a point under the permutation of a word, given the
   * images {@code s} and {@code t} of the generators.
   *
   * <p>Equivalent to {@code toPerm(word, s, t).apply(point)}, but follows the
   * point through the cycles of {@code s} and {@code t} rather than
   * computing powers, so large exponents are cheap.
   */
  public int act(int point, Word word, Perm s, Perm t) {
    int p = point;
    for (Word.Syllable syllable : word.syllables) {
      p = image(syllable.generator, s, t).apply(p, syllable.exponent);
    }
    return p;
  }

  private static Perm image(Generator generator, Perm s, Perm t) {
    return generator == S ? s : t;
  }

  /**
   * Returns the relators that are not mapped to the identity by the given
   * images of the generators, keyed by name. Empty if {@code s} and {@code
   * t} satisfy all relations.
   */
  public Map<String, Perm> failedRelators(Perm s, Perm t) {
    final ImmutableMap.Builder<String, Perm> failed = ImmutableMap.builder();
    relators.forEach((name, relator) -> {
      final Perm p = toPerm(relator, s, t);
      if (!p.isIdentity()) {
        failed.put(name, p);
      }
    });
    return failed.build();
  }

  @Override
  public String toString() {
    return "<S, T | " + String.join(", ", relators.keySet()) + ">";
  }
}

// End Presentation.java
