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
package net.hydromatic.quanta.model;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named entity that occurs in an expression: a variable, a constant, a
 * scalar value, or a complex value.
 *
 * <p>Symbols are immutable. Two symbols are equal if they have the same name
 * and kind; properties do not participate in equality.
 */
public class Symbol implements Comparable<Symbol> {
  public final String name;
  public final Kind kind;
  public final ImmutableMap<String, String> properties;

  /** Creates a variable symbol. */
  public Symbol(String name) {
    this(name, Kind.VARIABLE);
  }

  public Symbol(String name, Kind kind) {
    this(name, kind, ImmutableMap.of());
  }

  protected Symbol(
      String name, Kind kind, ImmutableMap<String, String> properties) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.properties = requireNonNull(properties);
  }

  /** Creates a copy of this symbol with different properties. Sub-classes
   * must override, so that the copy has the same class. */
  protected Symbol copy(ImmutableMap<String, String> properties) {
    return new Symbol(name, kind, properties);
  }

  /** Returns a copy of this symbol. */
  public Symbol deepCopy() {
    return copy(properties);
  }

  /** Returns a copy of this symbol with a property set. */
  public Symbol withProperty(String key, String value) {
    final Map<String, String> map = new LinkedHashMap<>(properties);
    map.put(key, value);
    return copy(ImmutableMap.copyOf(map));
  }

  /** Returns the value of a property, or null if it is not set. */
  public @Nullable String property(String key) {
    return properties.get(key);
  }

  public boolean hasProperty(String key) {
    return properties.containsKey(key);
  }

  public boolean isScalar() {
    return kind == Kind.SCALAR;
  }

  public boolean isComplex() {
    return kind == Kind.COMPLEX;
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof Symbol
        && name.equals(((Symbol) o).name)
        && kind == ((Symbol) o).kind;
  }

  @Override public int hashCode() {
    return Objects.hash(name, kind.ordinal());
  }

  @Override public int compareTo(Symbol o) {
    final int c = name.compareTo(o.name);
    return c != 0 ? c : kind.compareTo(o.kind);
  }

  @Override public String toString() {
    return name;
  }

  /** Kind of symbol. */
  public enum Kind {
    SCALAR,
    VARIABLE,
    CONSTANT,
    COMPLEX
  }
}

// End Symbol.java
