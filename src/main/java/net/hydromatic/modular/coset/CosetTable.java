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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.util.InvalidInputException;

/**
 * Coset table of a subgroup of SL(2,Z): the action of the generators and
 * their inverses on cosets 1 .. index.
 *
 * <p>The rows are, in order, the images of the cosets under S, S<sup>-1</sup>,
 * T and T<sup>-1</sup> (GAP's {@code ListPerm} of each permutation). Coset 1
 * is the subgroup itself.
 */
public final class CosetTable {
  public final int index;
  public final Perm s;
  public final Perm t;

  private CosetTable(int index, Perm s, Perm t) {
    this.index = index;
    this.s = requireNonNull(s, "s");
    this.t = requireNonNull(t, "t");
  }

  /** Creates a coset table from the actions of S and T. */
  public static CosetTable of(int index, Perm s, Perm t) {
    checkArgument(index >= 1, "index must be positive: %s", index);
    checkArgument(s.largestMovedPoint() <= index
            && t.largestMovedPoint() <= index,
        "permutations move points beyond %s", index);
    return new CosetTable(index, s, t);
  }

  /**
   * Creates a coset table from four rows.
   *
   * @throws InvalidInputException if there are not four rows of the same
   *     length, or if the second and fourth rows are not the inverses of
   *     the first and third
   */
  public static CosetTable ofRows(List<? extends List<Integer>> rows) {
    if (rows.size() != 4) {
      throw new InvalidInputException("coset table must have 4 rows, has "
          + rows.size());
    }
    final int index = rows.get(0).size();
    for (List<Integer> row : rows) {
      if (row.size() != index) {
        throw new InvalidInputException("rows of coset table must have "
            + "equal length");
      }
    }
    final Perm s = Perm.of(rows.get(0));
    final Perm t = Perm.of(rows.get(2));
    if (!Perm.of(rows.get(1)).equals(s.inverse())
        || !Perm.of(rows.get(3)).equals(t.inverse())) {
      throw new InvalidInputException("rows 2 and 4 of coset table must be "
          + "the inverses of rows 1 and 3");
    }
    return of(Math.max(index, 1), s, t);
  }

  /** Returns the four rows. */
  public ImmutableList<ImmutableList<Integer>> rows() {
    return ImmutableList.of(s.listPerm(index), s.inverse().listPerm(index),
        t.listPerm(index), t.inverse().listPerm(index));
  }

  @Override
  public String toString() {
    return rows().toString();
  }
}

// End CosetTable.java
