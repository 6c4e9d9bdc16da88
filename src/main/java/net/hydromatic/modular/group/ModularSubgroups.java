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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import net.hydromatic.modular.arith.Matrix;
import net.hydromatic.modular.coset.CosetTable;
import net.hydromatic.modular.eval.Prop;
import net.hydromatic.modular.eval.Session;
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.perm.Perms;
import net.hydromatic.modular.util.InvalidInputException;
import net.hydromatic.modular.word.Presentation;
import net.hydromatic.modular.word.StDecomposition;
import net.hydromatic.modular.word.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Factory methods for {@link ModularSubgroup}. */
public abstract class ModularSubgroups {
  private ModularSubgroups() {}

  /** Returns SL(2,Z) itself, the subgroup of index 1. */
  public static ModularSubgroup sl2z() {
    return fromPermutations(Perm.IDENTITY, Perm.IDENTITY);
  }

  /**
   * Returns the index that a pair of permutations would have as a coset
   * action: the largest point moved by {@code s}, {@code s^-1}, {@code t} or
   * {@code t^-1}, or 1 if that is larger.
   */
  public static int index(Perm s, Perm t) {
    return Math.max(
        Perms.largestMovedPoint(s, s.inverse(), t, t.inverse()), 1);
  }

  /**
   * Returns whether {@code s} and {@code t} describe the action of S and T on
   * the cosets of a subgroup: whether they satisfy the relations of SL(2,Z)
   * and generate a group that is transitive on 1 .. index.
   */
  public static boolean definesCosetAction(Perm s, Perm t) {
    return invalidReason(s, t) == null;
  }

  /** Returns why {@code s} and {@code t} do not define a coset action, or
   * null if they do. */
  static @Nullable String invalidReason(Perm s, Perm t) {
    final Map<String, Perm> failed =
        Presentation.SL2Z.failedRelators(s, t);
    if (!failed.isEmpty()) {
      final String name = failed.keySet().iterator().next();
      return "relation " + name + " does not hold; it evaluates to "
          + failed.get(name);
    }
    final int index = index(s, t);
    if (!Perms.isTransitive(index, ImmutableList.of(s, t))) {
      return "action is not transitive on 1.." + index;
    }
    return null;
  }

  /**
   * Creates the subgroup whose coset action is given by {@code s} and
   * {@code t}, in the default session.
   *
   * @throws InvalidInputException if the permutations do not define a coset
   *     action
   */
  public static ModularSubgroup fromPermutations(Perm s, Perm t) {
    return fromPermutations(Session.DEFAULT, s, t);
  }

  /**
   * Creates the subgroup whose coset action is given by {@code s} and
   * {@code t}.
   *
   * @throws InvalidInputException if the permutations do not define a coset
   *     action
   */
  public static ModularSubgroup fromPermutations(Session session, Perm s,
      Perm t) {
    return fromPermutations(session, s, t, null);
  }

  static ModularSubgroup fromPermutations(Session session, Perm s, Perm t,
      @Nullable List<Matrix> generators) {
    requireNonNull(session, "session");
    final String reason = invalidReason(s, t);
    if (reason != null) {
      throw new InvalidInputException("permutations s=" + s + ", t=" + t
          + " do not define a coset action: " + reason);
    }
    return new ModularSubgroup(session, s, t, index(s, t),
        generators == null ? null : ImmutableList.copyOf(generators));
  }

  /** Creates the subgroup generated by some matrices, in the default
   * session. */
  public static ModularSubgroup fromGenerators(List<Matrix> generators) {
    return fromGenerators(Session.DEFAULT, generators);
  }

  /**
   * Creates the subgroup generated by some matrices.
   *
   * <p>Each matrix is decomposed into a word in S and T, and the cosets of
   * the subgroup generated by those words are enumerated. If the subgroup
   * has infinite index, enumeration will not finish, and will give up after
   * defining {@link Prop#ENUMERATION_LIMIT} cosets.
   *
   * @throws net.hydromatic.modular.util.EnumerationLimitException if
   *     enumeration exceeds its limit
   * @throws InvalidInputException if a generator's word is longer than
   *     {@link Prop#MAX_WORD_LENGTH}
   */
  public static ModularSubgroup fromGenerators(Session session,
      List<Matrix> generators) {
    final int maxWordLength = session.intValue(Prop.MAX_WORD_LENGTH);
    final ImmutableList.Builder<Word> words = ImmutableList.builder();
    for (Matrix generator : generators) {
      final Word word = StDecomposition.decompose(generator);
      if (word.length().compareTo(BigInteger.valueOf(maxWordLength)) > 0) {
        throw new InvalidInputException("word " + word + " for generator "
            + generator + " is longer than " + maxWordLength + " letters");
      }
      words.add(word);
    }
    final CosetTable table =
        session.enumerator.enumerate(words.build(),
            session.intValue(Prop.ENUMERATION_LIMIT));
    session.tracer.onCosetTable(table);
    return fromPermutations(session, table.s, table.t, generators);
  }

  /** Creates the subgroup described by a coset table. */
  public static ModularSubgroup fromCosetTable(Session session,
      CosetTable table) {
    final ModularSubgroup g = fromPermutations(session, table.s, table.t);
    if (g.index() != table.index) {
      throw new InvalidInputException("coset table has " + table.index
          + " rows but its action has index " + g.index());
    }
    return g;
  }
}

// End ModularSubgroups.java
