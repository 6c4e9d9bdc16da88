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
 * Input that violates a precondition: a matrix that is not in SL(2,Z), a
 * pair of permutations that does not define a coset action, or text that
 * cannot be parsed.
 *
 * <p>Nothing is computed from such input; the caller must correct it.
 */
public class InvalidInputException extends IllegalArgumentException
    implements ModularException {
  public InvalidInputException(String message) {
    super(message);
  }

  public InvalidInputException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End InvalidInputException.java
