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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/** Utilities. */
public class Static {
  private Static() {}

  /** Fractional part of the golden ratio, as a 32-bit integer. */
  private static final int GOLDEN = 0x9e3779b9;

  /**
   * Mixes a hash code into a seed.
   *
   * <p>The result depends on the order in which hash codes are combined, so
   * {@code hashCombine(hashCombine(s, a), b)} and
   * {@code hashCombine(hashCombine(s, b), a)} usually differ.
   */
  public static int hashCombine(int seed, int h) {
    return seed ^ (h + GOLDEN + (seed << 6) + (seed >> 2));
  }

  /** Combines the hash codes of a list of objects into a seed, in order. */
  public static int hashCombine(int seed, List<?> list) {
    int h = seed;
    for (Object o : list) {
      h = hashCombine(h, o.hashCode());
    }
    return h;
  }

  /**
   * Formats a number without a redundant fractional part.
   *
   * <p>For example, 2.0 becomes "2", 0.5 becomes "0.5", -1.0 becomes "-1".
   * Infinite and NaN values use {@link Double#toString(double)}.
   */
  public static String formatNumber(double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return Double.toString(d);
    }
    if (d == 0d) {
      return "0"; // also for -0.0
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  /** Returns the last element of a list.
   *
   * @throws java.lang.IndexOutOfBoundsException if the list is empty
   */
  public static <E> E last(List<E> list) {
    return list.get(list.size() - 1);
  }

  /** Returns a list with an element appended. */
  public static <E> ImmutableList<E> append(List<E> list, E e) {
    return ImmutableList.<E>builderWithExpectedSize(list.size() + 1)
        .addAll(list)
        .add(e)
        .build();
  }

  /** Returns whether two lists have the same size and each element of one
   * is the same object as the corresponding element of the other. */
  public static <E> boolean allIdentical(
      List<? extends E> list0, List<? extends E> list1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Returns the number of inversions in a sequence of integers, that is, the
   * number of pairs that are out of order. The parity of a permutation is the
   * parity of its inversion count.
   */
  public static int inversionCount(List<Integer> permutation) {
    int count = 0;
    for (int i = 0; i < permutation.size(); i++) {
      for (int j = i + 1; j < permutation.size(); j++) {
        if (permutation.get(i) > permutation.get(j)) {
          ++count;
        }
      }
    }
    return count;
  }
}

// End Static.java
