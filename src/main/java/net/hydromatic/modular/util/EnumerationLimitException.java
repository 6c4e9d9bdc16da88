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
 * Coset enumeration defined more cosets than its limit allows.
 *
 * <p>The generators may define a subgroup of infinite index, or of an index
 * larger than the limit. The caller may retry with a larger value of {@link
 * net.hydromatic.modular.eval.Prop#ENUMERATION_LIMIT}.
 */
public class EnumerationLimitException extends RuntimeException
    implements ModularException {
  public final int limit;

  public EnumerationLimitException(int limit) {
    super("coset enumeration exceeded limit of " + limit + " cosets");
    this.limit = limit;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End EnumerationLimitException.java
