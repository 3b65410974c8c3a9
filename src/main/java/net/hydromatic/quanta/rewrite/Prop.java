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
package net.hydromatic.quanta.rewrite;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.quanta.util.Diagnostics.user;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration property of a {@link Simplifier}.
 *
 * @see Simplifier#create(Map)
 */
public enum Prop {
  /**
   * Integer property "maxIterations" is the maximum number of passes that
   * {@link Simplifier#simplify} makes over an expression. Default is 10.
   */
  MAX_ITERATIONS("maxIterations", Integer.class, true, 10),

  /**
   * Boolean property "trace" controls whether the simplifier records each
   * change in its trace log. Default is false.
   */
  TRACE("trace", Boolean.class, true, false),

  /** Number of entries above which the trace log is trimmed. */
  TRACE_CAPACITY("traceCapacity", Integer.class, true, 1000),

  /** Number of oldest entries removed when the trace log is trimmed. */
  TRACE_DROP_COUNT("traceDropCount", Integer.class, true, 100),

  /**
   * Boolean property "recursive" controls whether each pass rewrites every
   * node of the expression, children before parents (true, the default), or
   * applies rules only to the root (false).
   */
  RECURSIVE("recursive", Boolean.class, true, true),

  /**
   * String property "pointGroup" is the name of an abelian point group, such
   * as "C2v". If set, the simplifier uses its multiplication table to remove
   * integrals that vanish by symmetry. Default is null.
   */
  POINT_GROUP("pointGroup", String.class, false, null);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /** Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(Arrays.asList(values()));

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(!required,
          "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name or camel-case name. Throws if not found;
   * never returns null. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw user("property %s not found", propName);
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public @Nullable Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of a string property, or null if it has no value
   * and no default. */
  public @Nullable String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    final Object o = map.get(this);
    return o != null ? (String) o : (String) defaultValue;
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw user("no value for property %s and no default value",
            camelName);
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, converting a string to the property's
   * type if necessary; for example, "20" becomes 20 for an integer
   * property. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = ((String) value).trim();
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw user("value for property %s must be an integer, got '%s'",
              camelName, s);
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
          throw user("value for property %s must be 'true' or 'false',"
              + " got '%s'", camelName, s);
        }
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid, and that
   * integer values are not negative. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw user("property %s is required", camelName);
      }
      map.remove(this);
      return;
    }
    if (!type.isInstance(value)) {
      throw user("value for property %s must have type %s",
          camelName, type.getSimpleName());
    }
    if (value instanceof Integer && (Integer) value < 0) {
      throw user("value for property %s must not be negative, got %s",
          camelName, value);
    }
    map.put(this, value);
  }

  /** Removes the value of this property from a map, returning the previous
   * value or null. */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
