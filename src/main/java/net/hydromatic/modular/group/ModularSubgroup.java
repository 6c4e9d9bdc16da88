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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.modular.arith.Arithmetic;
import net.hydromatic.modular.arith.Cusp;
import net.hydromatic.modular.arith.Matrix;
import net.hydromatic.modular.coset.CosetTable;
import net.hydromatic.modular.eval.Prop;
import net.hydromatic.modular.eval.Session;
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.word.Presentation;
import net.hydromatic.modular.word.StDecomposition;
import net.hydromatic.modular.word.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Subgroup of finite index in SL(2,Z), described by the action of the
 * generators S and T on its right cosets.
 *
 * <p>Cosets are numbered 1 .. {@link #index()}; coset 1 is the subgroup
 * itself. A matrix {@code A} belongs to the subgroup if the permutation of
 * its word in S and T fixes coset 1.
 *
 * <p>Instances are immutable. Derived values (coset representatives, cusps,
 * level, generators) are computed on first use and then remembered.
 *
 * @see ModularSubgroups
 */
public final class ModularSubgroup {
  private final Session session;
  private final Perm s;
  private final Perm t;
  private final int index;

  /** Generators given when the subgroup was created, or null. */
  private final @Nullable ImmutableList<Matrix> knownGenerators;

  private final Supplier<Boolean> containsMinusOne =
      Suppliers.memoize(() -> contains(Matrix.MINUS_ONE));
  private final Supplier<ImmutableList<Matrix>> representatives =
      Suppliers.memoize(this::computeRepresentatives);
  private final Supplier<ImmutableList<Cusp>> cuspsRedundant =
      Suppliers.memoize(this::computeCuspsRedundant);
  private final Supplier<ImmutableList<Cusp>> cusps =
      Suppliers.memoize(this::computeCusps);
  private final Supplier<BigInteger> generalizedLevel =
      Suppliers.memoize(this::computeGeneralizedLevel);
  private final Supplier<Boolean> congruence =
      Suppliers.memoize(() -> CongruenceTest.isCongruence(this));
  private final Supplier<ImmutableList<Matrix>> generators =
      Suppliers.memoize(this::computeGenerators);

  ModularSubgroup(Session session, Perm s, Perm t, int index,
      @Nullable ImmutableList<Matrix> knownGenerators) {
    this.session = requireNonNull(session, "session");
    this.s = requireNonNull(s, "s");
    this.t = requireNonNull(t, "t");
    this.index = index;
    this.knownGenerators = knownGenerators;
  }

  @Override
  public String toString() {
    return "ModularSubgroup(s=" + s + ", t=" + t + ", index=" + index + ")";
  }

  /** Returns the action of S on the cosets. */
  public Perm s() {
    return s;
  }

  /** Returns the action of T on the cosets. */
  public Perm t() {
    return t;
  }

  /** Returns the session that this subgroup was created in. */
  public Session session() {
    return session;
  }

  /** Returns the index of this subgroup in SL(2,Z). */
  public int index() {
    return index;
  }

  /** Returns the index of the image of this subgroup in PSL(2,Z). */
  public int projectiveIndex() {
    return containsMinusOne() ? index : index / 2;
  }

  /** Returns the coset table. */
  public CosetTable cosetTable() {
    return CosetTable.of(index, s, t);
  }

  /**
   * Returns the coset of SL(2,Z) that contains a matrix: the image of coset 1
   * under the matrix's word.
   */
  public int cosetOf(Matrix m) {
    return Presentation.SL2Z.act(1, StDecomposition.decompose(m), s, t);
  }

  /**
   * Returns whether a matrix is an element of this subgroup.
   *
   * <p>The identity matrix decomposes to the empty word. If {@link
   * Prop#LEGACY_IDENTITY_TEST} is set, the identity is deemed an element only
   * if {@code s} and {@code t} are both the identity.
   */
  public boolean contains(Matrix m) {
    final Word word = StDecomposition.decompose(m);
    if (word.isEmpty()) {
      if (session.booleanValue(Prop.LEGACY_IDENTITY_TEST)) {
        return s.isIdentity() && t.isIdentity();
      }
      return true;
    }
    return Presentation.SL2Z.act(1, word, s, t) == 1;
  }

  /** Returns whether -I is an element of this subgroup. */
  public boolean containsMinusOne() {
    return containsMinusOne.get();
  }

  /**
   * Returns a representative of each right coset, in coset order. The first
   * is the identity.
   */
  public ImmutableList<Matrix> rightCosetRepresentatives() {
    return representatives.get();
  }

  private ImmutableList<Matrix> computeRepresentatives() {
    final List<Word> words =
        session.representatives.representatives(index, s, t);
    final ImmutableList.Builder<Matrix> matrices = ImmutableList.builder();
    for (Word word : words) {
      matrices.add(Presentation.SL2Z.toMatrix(word));
    }
    return matrices.build();
  }

  /**
   * Returns generators of this subgroup.
   *
   * <p>If the subgroup was created from generators, returns those;
   * otherwise computes a (possibly redundant) generating set from the coset
   * table.
   */
  public ImmutableList<Matrix> generators() {
    return generators.get();
  }

  private ImmutableList<Matrix> computeGenerators() {
    if (knownGenerators != null) {
      return knownGenerators;
    }
    final Set<Matrix> matrices = new LinkedHashSet<>();
    for (Word word : session.extractor.generators(cosetTable())) {
      final Matrix m = Presentation.SL2Z.toMatrix(word);
      if (!m.isIdentity() && !matrices.contains(m.inverse())) {
        matrices.add(m);
      }
    }
    return ImmutableList.copyOf(matrices);
  }

  /**
   * Returns the width of a cusp: the least {@code k > 0} such that {@code g
   * T^k g^-1} or its negation is in this subgroup, where {@code g} maps
   * infinity to the cusp.
   *
   * @throws net.hydromatic.modular.util.InconsistentGroupException if no
   *     width is found up to index + 1
   */
  public int cuspWidth(Cusp cusp) {
    return CuspSearch.width(this, cusp);
  }

  /** Returns whether two cusps are equivalent under this subgroup. */
  public boolean cuspsEquivalent(Cusp cusp1, Cusp cusp2) {
    return CuspSearch.equivalent(this, cusp1, cusp2);
  }

  /**
   * Returns the image of infinity under each coset representative, in coset
   * order. The list has {@link #index()} elements and starts with infinity;
   * each cusp of the subgroup occurs at least once.
   */
  public ImmutableList<Cusp> cuspsRedundant() {
    return cuspsRedundant.get();
  }

  private ImmutableList<Cusp> computeCuspsRedundant() {
    final ImmutableList.Builder<Cusp> list = ImmutableList.builder();
    for (Matrix m : rightCosetRepresentatives()) {
      list.add(Cusp.ofMatrix(m));
    }
    return list.build();
  }

  /**
   * Returns a list of inequivalent cusps, one from each equivalence class,
   * starting with infinity.
   */
  public ImmutableList<Cusp> cusps() {
    return cusps.get();
  }

  private ImmutableList<Cusp> computeCusps() {
    final ImmutableList<Cusp> list = CuspSearch.deduplicate(this);
    session.tracer.onCusps(list);
    return list;
  }

  /** Returns the generalized level: the least common multiple of the widths
   * of all cusps. */
  public BigInteger generalizedLevel() {
    return generalizedLevel.get();
  }

  private BigInteger computeGeneralizedLevel() {
    final ImmutableList.Builder<BigInteger> widths = ImmutableList.builder();
    for (Cusp cusp : cuspsRedundant()) {
      widths.add(BigInteger.valueOf(cuspWidth(cusp)));
    }
    return Arithmetic.lcm(widths.build());
  }

  /** Returns whether this is a congruence subgroup, that is, whether it
   * contains the principal congruence subgroup of some level. */
  public boolean isCongruence() {
    return congruence.get();
  }

  /**
   * Returns the genus of the modular curve of this subgroup.
   *
   * <p>Computed on the action of PSL(2,Z) on the cosets of {@code {±1} G}
   * by the Riemann-Hurwitz formula {@code g = 1 + mu/12 - e2/4 - e3/3 -
   * c/2}, where {@code mu} is the projective index, {@code e2} and {@code e3}
   * count the points fixed by S and by ST, and {@code c} counts the cycles of
   * T.
   */
  public int genus() {
    final ProjectiveAction action = ProjectiveAction.of(this);
    final int mu = action.degree;
    final int e2 = action.s.fixedPointCount(mu);
    final int e3 = action.s.multiply(action.t).fixedPointCount(mu);
    final int c = action.t.cycles(mu).size();
    final int twelveG = 12 + mu - 3 * e2 - 4 * e3 - 6 * c;
    checkState(twelveG % 12 == 0 && twelveG >= 0,
        "invalid genus %s/12 for %s", twelveG, this);
    return twelveG / 12;
  }

  /**
   * Returns the conjugate subgroup {@code A^-1 G A}.
   *
   * <p>The conjugate is the stabilizer of the coset containing {@code A};
   * its action is this action with that coset relabeled as 1.
   */
  public ModularSubgroup conjugate(Matrix a) {
    final int coset = cosetOf(a);
    final Perm swap =
        coset == 1 ? Perm.IDENTITY : Perm.of(swapArray(coset));
    @Nullable ImmutableList<Matrix> conjugateGenerators = null;
    if (knownGenerators != null) {
      final ImmutableList.Builder<Matrix> list = ImmutableList.builder();
      for (Matrix g : knownGenerators) {
        list.add(Matrix.product(a.inverse(), g, a));
      }
      conjugateGenerators = list.build();
    }
    return ModularSubgroups.fromPermutations(session, s.conjugate(swap),
        t.conjugate(swap), conjugateGenerators);
  }

  /** Returns the images of the transposition (1, j). */
  private static int[] swapArray(int j) {
    final int[] images = new int[j];
    for (int i = 0; i < j; i++) {
      images[i] = i + 1;
    }
    images[0] = j;
    images[j - 1] = 1;
    return images;
  }

  /** Action of PSL(2,Z) on the cosets of {@code {±1} G}. */
  private static class ProjectiveAction {
    final int degree;
    final Perm s;
    final Perm t;

    ProjectiveAction(int degree, Perm s, Perm t) {
      this.degree = degree;
      this.s = s;
      this.t = t;
    }

    static ProjectiveAction of(ModularSubgroup g) {
      if (g.containsMinusOne()) {
        return new ProjectiveAction(g.index, g.s, g.t);
      }
      // -I fixes no coset; identify each coset i with i^(s^2).
      final Perm minusOne = g.s.pow(2);
      final int[] orbit = new int[g.index + 1];
      int degree = 0;
      for (int i = 1; i <= g.index; i++) {
        if (orbit[i] == 0) {
          ++degree;
          orbit[i] = degree;
          orbit[minusOne.apply(i)] = degree;
        }
      }
      final int[] s = new int[degree];
      final int[] t = new int[degree];
      for (int i = 1; i <= g.index; i++) {
        s[orbit[i] - 1] = orbit[g.s.apply(i)];
        t[orbit[i] - 1] = orbit[g.t.apply(i)];
      }
      return new ProjectiveAction(degree, Perm.of(s), Perm.of(t));
    }
  }
}

// End ModularSubgroup.java
