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
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.word.Word;

/**
 * Algorithm that chooses a representative of each right coset of a
 * subgroup.
 *
 * @see SchreierTree
 */
public interface CosetRepresentatives {
  /**
   * Returns a list of {@code index} words; word {@code i - 1} maps coset 1 to
   * coset {@code i} under the action given by {@code s} and {@code t}. The
   * first word is empty.
   */
  List<Word> representatives(int index, Perm s, Perm t);
}

// End CosetRepresentatives.java
