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
package net.hydromatic.quanta.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Map with nested scopes.
 *
 * <p>{@link #scope()} pushes a new, empty scope; {@link #unscope()} pops it.
 * {@link #put} writes to the innermost scope. Lookups search from the
 * innermost scope outwards, so an inner binding obscures an outer binding of
 * the same key.
 *
 * <p>Unlike {@link net.hydromatic.quanta.util.NameGenerator}, which only
 * grows, a scoped map is used while walking a tree, and is therefore
 * mutable.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public class ScopedMap<K, V> {
  private final Deque<Map<K, V>> scopes = new ArrayDeque<>();

  /** Creates a map with one (outermost) scope. */
  public ScopedMap() {
    scope();
  }

  /** Pushes a new scope. */
  public void scope() {
    scopes.push(new HashMap<>());
  }

  /** Pops the innermost scope, discarding its bindings. */
  public void unscope() {
    Diagnostics.checkInternal(
        scopes.size() > 1, "scopes.size() > 1", "cannot pop outermost scope");
    scopes.pop();
  }

  /** Returns the number of scopes, including the outermost. */
  public int depth() {
    return scopes.size();
  }

  /** Binds a key in the innermost scope. */
  public void put(K key, V value) {
    scopes.element().put(key, value);
  }

  /** Returns the value bound to a key in the innermost scope that binds it,
   * or null. */
  public @Nullable V getOpt(K key) {
    for (Map<K, V> scope : scopes) {
      final V value = scope.get(key);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Returns the value bound to a key; throws if the key is not in scope. */
  public V get(K key) {
    final V value = getOpt(key);
    if (value == null) {
      throw Diagnostics.user("not in scope: %s", key);
    }
    return value;
  }

  /** Returns whether a key is bound in any scope. */
  public boolean contains(K key) {
    return getOpt(key) != null;
  }

  /** Removes the binding of a key from the innermost scope that binds it;
   * throws if the key is not in scope. */
  public void remove(K key) {
    for (Map<K, V> scope : scopes) {
      if (scope.remove(key) != null) {
        return;
      }
    }
    throw Diagnostics.user("not in scope: %s", key);
  }
}

// End ScopedMap.java
