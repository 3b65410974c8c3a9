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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique names, such as fresh labels for dummy indices.
 *
 * <p>An instance is a context object: callers that need fresh names are
 * given one, so there is no process-wide counter.
 *
 * <p>Also keeps track of how many times each given name has been used, so
 * that a new occurrence of a name can be given a fresh ordinal.
 */
public class NameGenerator {
  private int id = 0;
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  public NameGenerator() {}

  /** Creates a generator that regards the given names as already used. */
  public NameGenerator(Iterable<String> reserved) {
    for (String name : reserved) {
      nameCounts.put(name, new AtomicInteger(1));
    }
  }

  /** Generates a name that is unique in this generator. */
  public String get() {
    return "v" + id++;
  }

  /** Generates a name with a given prefix, e.g. "d3". The numeric suffix is
   * shared by all prefixes. */
  public String uniqueName(String prefix) {
    return prefix + id++;
  }

  /** Returns the number of times that "name" has been used. */
  public int inc(String name) {
    return nameCounts
        .computeIfAbsent(name, n -> new AtomicInteger(0))
        .getAndIncrement();
  }

  /** Marks a name as used, so that {@link #getUniqueName(String)} will not
   * return it. */
  public void reserve(String name) {
    nameCounts.computeIfAbsent(name, n -> new AtomicInteger(1));
  }

  /**
   * Returns {@code name} the first time it is requested, and {@code name}
   * followed by an ordinal on subsequent requests: "i", "i1", "i2".
   * Skips ordinals that give a name already used or reserved, so if "i1"
   * is reserved the second request returns "i2".
   */
  public String getUniqueName(String name) {
    int count = inc(name);
    if (count == 0) {
      return name;
    }
    for (;;) {
      final String candidate = name + count;
      if (!nameCounts.containsKey(candidate)) {
        reserve(candidate);
        return candidate;
      }
      count = inc(name);
    }
  }
}

// End NameGenerator.java
