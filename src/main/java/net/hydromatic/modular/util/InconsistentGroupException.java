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
package net.hydromatic.modular.util;

/**
 * A search that is guaranteed to succeed for a valid subgroup did not
 * succeed within its bound.
 *
 * <p>Indicates that the permutations describing the subgroup are
 * inconsistent. It is not recoverable.
 */
public class InconsistentGroupException extends IllegalStateException
    implements ModularException {
  public final int bound;

  public InconsistentGroupException(String message, int bound) {
    super(message + " (searched up to " + bound + ")");
    this.bound = bound;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Internal error: ").append(getMessage());
  }
}

// End InconsistentGroupException.java
