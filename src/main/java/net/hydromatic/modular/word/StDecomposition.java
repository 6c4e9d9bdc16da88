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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.modular.word.Generator.S;
import static net.hydromatic.modular.word.Generator.T;

import java.math.BigInteger;
import net.hydromatic.modular.arith.Matrix;

/**
 * Writes an element of SL(2,Z) as a word in the generators S and T.
 *
 * <p>The algorithm is Euclidean reduction of the bottom row. While the
 * bottom-left entry {@code c} is non-zero, let {@code k = d / c} (division
 * truncating towards zero) and replace {@code M} by {@code M T^-k S}; this
 * replaces {@code c} by {@code d - k c}, which is smaller in absolute
 * value. The factors removed are accumulated at the front of the word. When
 * {@code c} is zero, {@code M} is {@code T^r} or {@code -T^-r = S^2 T^-r},
 * where {@code r} is the top-right entry.
 */
public abstract class StDecomposition {
  private StDecomposition() {}

  /**
   * Returns a word {@code W} such that {@code
   * Presentation.SL2Z.toMatrix(W)} equals {@code m}.
   *
   * <p>The identity matrix yields the empty word; no other matrix does.
   */
  public static Word decompose(Matrix m) {
    requireNonNull(m, "m");
    BigInteger a = m.a;
    BigInteger b = m.b;
    BigInteger c = m.c;
    BigInteger d = m.d;
    Word word = Word.EMPTY;
    while (c.signum() != 0) {
      final BigInteger k = d.divide(c);
      word = Word.product(Word.of(S, -1), Word.of(T, k), word);
      // [[a, b], [c, d]] * T^-k * S = [[b - k a, -a], [d - k c, -c]]
      final BigInteger a2 = b.subtract(k.multiply(a));
      final BigInteger c2 = d.subtract(k.multiply(c));
      b = a.negate();
      d = c.negate();
      a = a2;
      c = c2;
    }
    // The determinant is 1, so a = d = 1 or a = d = -1.
    if (a.signum() > 0) {
      return Word.of(T, b).times(word);
    }
    return Word.product(Word.of(S, 2), Word.of(T, b.negate()), word);
  }
}

// End StDecomposition.java
