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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.modular.word.Generator;
import net.hydromatic.modular.word.Word;

/**
 * Finds generators of a subgroup from its coset table, by the
 * Reidemeister-Schreier method.
 *
 * <p>Given a representative {@code w(i)} of each coset {@code i}, the
 * Schreier generators are the words {@code w(i) x w(i^x)^-1} for each coset
 * {@code i} and each generator {@code x}. Those that reduce to the empty
 * word (edges of the spanning tree) are omitted.
 */
public class SchreierGenerators implements GeneratorExtractor {
  private final CosetRepresentatives representatives;

  public SchreierGenerators(CosetRepresentatives representatives) {
    this.representatives =
        requireNonNull(representatives, "representatives");
  }

  @Override
  public List<Word> generators(CosetTable table) {
    final List<Word> words =
        representatives.representatives(table.index, table.s, table.t);
    final Set<Word> generators = new LinkedHashSet<>();
    for (int coset = 1; coset <= table.index; coset++) {
      final Word w = words.get(coset - 1);
      add(generators,
          Word.product(w, Word.of(Generator.S, 1),
              words.get(table.s.apply(coset) - 1).inverse()));
      add(generators,
          Word.product(w, Word.of(Generator.T, 1),
              words.get(table.t.apply(coset) - 1).inverse()));
    }
    return ImmutableList.copyOf(generators);
  }

  private static void add(Set<Word> generators, Word word) {
    if (!word.isEmpty() && !generators.contains(word.inverse())) {
      generators.add(word);
    }
  }
}

// End SchreierGenerators.java
