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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.quanta.util.Static;

/** Linear combination of operator products. */
public class OperatorSum implements Iterable<OperatorProduct> {
  public static final OperatorSum ZERO = new OperatorSum(ImmutableList.of());

  public final ImmutableList<OperatorProduct> terms;

  private OperatorSum(ImmutableList<OperatorProduct> terms) {
    this.terms = terms;
  }

  public static OperatorSum of(OperatorProduct... terms) {
    return of(Arrays.asList(terms));
  }

  public static OperatorSum of(List<OperatorProduct> terms) {
    return terms.isEmpty()
        ? ZERO
        : new OperatorSum(ImmutableList.copyOf(terms));
  }

  @Override public Iterator<OperatorProduct> iterator() {
    return terms.iterator();
  }

  public int size() {
    return terms.size();
  }

  public OperatorSum plus(OperatorSum other) {
    return of(
        ImmutableList.<OperatorProduct>builder()
            .addAll(terms)
            .addAll(other.terms)
            .build());
  }

  public OperatorSum plus(OperatorProduct term) {
    return of(Static.append(terms, term));
  }

  public OperatorSum minus(OperatorSum other) {
    return plus(other.times(-1d));
  }

  public OperatorSum times(double scalar) {
    return of(Static.transformEager(terms, term -> term.times(scalar)));
  }

  /** Multiplies two sums, term by term, preserving operator order. */
  public OperatorSum times(OperatorSum other) {
    final ImmutableList.Builder<OperatorProduct> b = ImmutableList.builder();
    for (OperatorProduct left : terms) {
      for (OperatorProduct right : other.terms) {
        b.add(left.times(right));
      }
    }
    return of(b.build());
  }

  /** Multiplies each term, on the left, by an operator product. */
  public OperatorSum leftTimes(OperatorProduct left) {
    return of(Static.transformEager(terms, left::times));
  }

  /**
   * Merges terms that have the same operators in the same order, adding their
   * coefficients, and removes terms whose coefficient is zero.
   *
   * <p>Terms keep the order in which their operators first occur.
   */
  public OperatorSum combineLikeTerms() {
    final Map<OperatorProduct, Double> map = new LinkedHashMap<>();
    for (OperatorProduct term : terms) {
      map.merge(term.withCoefficient(1d), term.coefficient, Double::sum);
    }
    final ImmutableList.Builder<OperatorProduct> b = ImmutableList.builder();
    map.forEach((key, coefficient) -> {
      if (coefficient != 0d) {
        b.add(key.withCoefficient(coefficient));
      }
    });
    return of(b.build());
  }

  /** Returns whether this sum is zero after like terms are combined. */
  public boolean isZero() {
    return combineLikeTerms().terms.isEmpty();
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof OperatorSum
        && terms.equals(((OperatorSum) o).terms);
  }

  @Override public int hashCode() {
    return terms.hashCode();
  }

  @Override public String toString() {
    return terms.isEmpty()
        ? "0"
        : terms.stream()
            .map(OperatorProduct::toString)
            .collect(Collectors.joining(" + "));
  }
}

// End OperatorSum.java
