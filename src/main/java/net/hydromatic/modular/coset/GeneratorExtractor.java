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
 * Algorithm that finds generators of the subgroup described by a coset
 * table.
 *
 * @see SchreierGenerators
 */
public interface GeneratorExtractor {
  /**
   * Returns words that generate the stabilizer of coset 1. The list may be
   * redundant; it contains no empty word.
   */
  List<Word> generators(CosetTable table);
}

// End GeneratorExtractor.java
