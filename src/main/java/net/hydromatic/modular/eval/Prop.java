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
package net.hydromatic.modular.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.modular.util.InvalidInputException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Session#map
 */
public enum Prop {
  /**
   * Integer property "enumerationLimit" is the maximum number of cosets that
   * coset enumeration may define before it gives up and throws {@link
   * net.hydromatic.modular.util.EnumerationLimitException}. Default is
   * 1,000,000.
   */
  ENUMERATION_LIMIT("enumerationLimit", Integer.class, true, 1_000_000),

  /**
   * Boolean property "legacyIdentityTest" controls membership of the
   * identity matrix. The identity decomposes to the empty word. If true, the
   * identity is considered a member only if both generator permutations are
   * the identity (that is, only of SL(2,Z) itself). If false (the default),
   * the identity is a member of every subgroup.
   */
  LEGACY_IDENTITY_TEST("legacyIdentityTest", Boolean.class, true, false),

  /**
   * Integer property "maxWordLength" is the maximum number of letters in a
   * generator word given to coset enumeration. Default is 100,000.
   *
   * <p>A generator matrix with large entries may decompose into a word with
   * a large power of T, each letter of which becomes a step of the
   * enumeration.
   */
  MAX_WORD_LENGTH("maxWordLength", Integer.class, true, 100_000);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new InvalidInputException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    if (o == null) {
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, converting strings to the property's
   * type.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = ((String) value).trim();
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new InvalidInputException(
              "value for property " + camelName + " must be an integer", e);
        }
        return;
      }
      if (type == Boolean.class) {
        switch (s.toLowerCase(Locale.ROOT)) {
          case "true":
            set(map, true);
            return;
          case "false":
            set(map, false);
            return;
          default:
            throw new InvalidInputException(
                "value for property " + camelName + " must be true or false");
        }
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new InvalidInputException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new InvalidInputException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
