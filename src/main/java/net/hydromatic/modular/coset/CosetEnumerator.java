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

import java.util.List;
import net.hydromatic.modular.word.Word;

/**
 * Algorithm that computes the coset table of a subgroup of SL(2,Z) given by
 * generators.
 *
 * @see ToddCoxeter
 */
public interface CosetEnumerator {
  /**
   * Enumerates the right cosets of the subgroup generated by some words.
   *
   * <p>Coset 1 of the result is the subgroup.
   *
   * @param generators Generators of the subgroup, as words in S and T
   * @param limit Maximum number of cosets to define
   * @throws net.hydromatic.modular.util.EnumerationLimitException if more
   *     than {@code limit} cosets are needed; in particular, if the subgroup
   *     has infinite index
   */
  CosetTable enumerate(List<Word> generators, int limit);
}

// End CosetEnumerator.java
