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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Element of the free group on {@link Generator#S} and {@link Generator#T},
 * written as a sequence of syllables {@code g^k}.
 *
 * <p>Words are kept freely reduced: no syllable has exponent zero, and
 * adjacent syllables have different generators. Words that are equal
 * modulo the relations of {@link Presentation#SL2Z} may still differ.
 */
public final class Word {
  /** The empty word. */
  public static final Word EMPTY = new Word(ImmutableList.of());

  public final ImmutableList<Syllable> syllables;

  private Word(ImmutableList<Syllable> syllables) {
    this.syllables = requireNonNull(syllables, "syllables");
  }

  /** Creates a word consisting of one syllable, {@code generator^k}. */
  public static Word of(Generator generator, BigInteger k) {
    return k.signum() == 0
        ? EMPTY
        : new Word(ImmutableList.of(new Syllable(generator, k)));
  }

  /** Creates a word consisting of one syllable. */
  public static Word of(Generator generator, long k) {
    return of(generator, BigInteger.valueOf(k));
  }

  /** Creates a word from a list of syllables, reducing it. */
  public static Word of(List<Syllable> syllables) {
    final List<Syllable> list = new ArrayList<>();
    for (Syllable syllable : syllables) {
      push(list, syllable);
    }
    return new Word(ImmutableList.copyOf(list));
  }

  /** Appends a syllable to a reduced list, keeping it reduced. */
  private static void push(List<Syllable> list, Syllable syllable) {
    if (syllable.exponent.signum() == 0) {
      return;
    }
    if (!list.isEmpty()) {
      final Syllable last = list.get(list.size() - 1);
      if (last.generator == syllable.generator) {
        list.remove(list.size() - 1);
        final BigInteger exponent = last.exponent.add(syllable.exponent);
        if (exponent.signum() != 0) {
          list.add(new Syllable(last.generator, exponent));
        }
        return;
      }
    }
    list.add(syllable);
  }

  /** Returns the product {@code this * w}. */
  public Word times(Word w) {
    if (w.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return w;
    }
    final List<Syllable> list = new ArrayList<>(syllables);
    for (Syllable syllable : w.syllables) {
      push(list, syllable);
    }
    return new Word(ImmutableList.copyOf(list));
  }

  /** Returns the product of several words, left to right. */
  public static Word product(Word... words) {
    Word word = EMPTY;
    for (Word w : words) {
      word = word.times(w);
    }
    return word;
  }

  /** Returns the inverse word. */
  public Word inverse() {
    final ImmutableList.Builder<Syllable> list = ImmutableList.builder();
    for (Syllable syllable : syllables.reverse()) {
      list.add(new Syllable(syllable.generator, syllable.exponent.negate()));
    }
    return new Word(list.build());
  }

  /** Returns this word raised to a non-negative power. */
  public Word pow(int n) {
    Word word = EMPTY;
    for (int i = 0; i < n; i++) {
      word = word.times(this);
    }
    return word;
  }

  public boolean isEmpty() {
    return syllables.isEmpty();
  }

  /** Returns the number of letters, the sum of the absolute values of the
   * exponents. */
  public BigInteger length() {
    BigInteger length = BigInteger.ZERO;
    for (Syllable syllable : syllables) {
      length = length.add(syllable.exponent.abs());
    }
    return length;
  }

  @Override
  public int hashCode() {
    return syllables.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Word
            && syllables.equals(((Word) o).syllables);
  }

  /** Returns a string such as "S^-1*T^3*S"; "1" if empty. */
  @Override
  public String toString() {
    if (isEmpty()) {
      return "1";
    }
    final StringBuilder buf = new StringBuilder();
    for (Syllable syllable : syllables) {
      if (buf.length() > 0) {
        buf.append('*');
      }
      syllable.unparse(buf);
    }
    return buf.toString();
  }

  /** Power of a generator, with non-zero exponent. */
  public static class Syllable {
    public final Generator generator;
    public final BigInteger exponent;

    public Syllable(Generator generator, BigInteger exponent) {
      this.generator = requireNonNull(generator, "generator");
      this.exponent = requireNonNull(exponent, "exponent");
    }

    @Override
    public int hashCode() {
      return Objects.hash(generator, exponent);
    }

    @Override
    public boolean equals(@Nullable Object o) {
      return o == this
          || o instanceof Syllable
              && generator == ((Syllable) o).generator
              && exponent.equals(((Syllable) o).exponent);
    }

    StringBuilder unparse(StringBuilder buf) {
      buf.append(generator.name());
      if (!exponent.equals(BigInteger.ONE)) {
        buf.append('^').append(exponent);
      }
      return buf;
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }
  }
}

// End Word.java
