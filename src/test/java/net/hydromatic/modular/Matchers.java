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
package net.hydromatic.modular;

import com.google.common.collect.Lists;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.modular.arith.Matrix;
import net.hydromatic.modular.perm.Perm;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in tests of modular subgroups. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a permutation whose cycle notation is a given string. */
  public static Matcher<Perm> isPerm(String cycles) {
    final Perm expected = Perm.parse(cycles);
    return new CustomTypeSafeMatcher<Perm>("permutation " + expected) {
      @Override
      protected boolean matchesSafely(Perm item) {
        return item.equals(expected);
      }
    };
  }

  /** Matches a matrix written as "[[a,b],[c,d]]". */
  public static Matcher<Matrix> isMatrix(String matrix) {
    final Matrix expected = Matrix.parse(matrix);
    return new CustomTypeSafeMatcher<Matrix>("matrix " + expected) {
      @Override
      protected boolean matchesSafely(Matrix item) {
        return item.equals(expected);
      }
    };
  }

  /** Matches an iterable whose elements, converted to strings, are the
   * given strings, in order. */
  public static <E> Matcher<Iterable<E>> hasStrings(String... strings) {
    final List<String> expectedList = Arrays.asList(strings);
    return new TypeSafeMatcher<Iterable<E>>() {
      @Override
      protected boolean matchesSafely(Iterable<E> item) {
        return Lists.transform(Lists.newArrayList(item), String::valueOf)
            .equals(expectedList);
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("hasStrings").appendValue(expectedList);
      }
    };
  }

  /** Matches a throwable whose message contains a given string. */
  public static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  /** Matches a throwable of a given class whose message matches. */
  public static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }
}

// End Matchers.java
