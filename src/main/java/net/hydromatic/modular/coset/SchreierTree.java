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
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.util.InvalidInputException;
import net.hydromatic.modular.word.Generator;
import net.hydromatic.modular.word.Presentation;
import net.hydromatic.modular.word.Word;

/**
 * Chooses coset representatives by breadth-first search of the Schreier
 * graph, starting at coset 1.
 *
 * <p>Edges are tried in the order S, T, T<sup>-1</sup>, S<sup>-1</sup>, so
 * each representative is a shortest word in those letters, and ties are
 * broken in favor of S and T.
 */
public class SchreierTree implements CosetRepresentatives {
  private static final List<Word> LETTERS =
      ImmutableList.of(Word.of(Generator.S, 1), Word.of(Generator.T, 1),
          Word.of(Generator.T, -1), Word.of(Generator.S, -1));

  @Override
  public List<Word> representatives(int index, Perm s, Perm t) {
    checkArgument(index >= 1, "index must be positive: %s", index);
    final Word[] words = new Word[index];
    words[0] = Word.EMPTY;
    final Deque<Integer> queue = new ArrayDeque<>();
    queue.add(1);
    while (!queue.isEmpty()) {
      final int coset = queue.remove();
      for (Word letter : LETTERS) {
        final int image = Presentation.SL2Z.act(coset, letter, s, t);
        if (image > index) {
          throw new InvalidInputException("coset " + image
              + " is out of range 1.." + index);
        }
        if (words[image - 1] == null) {
          words[image - 1] = words[coset - 1].times(letter);
          queue.add(image);
        }
      }
    }
    if (Arrays.asList(words).contains(null)) {
      throw new InvalidInputException("action on 1.." + index
          + " is not transitive");
    }
    return ImmutableList.copyOf(words);
  }
}

// End SchreierTree.java
