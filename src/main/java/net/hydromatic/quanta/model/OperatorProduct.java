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
import static net.hydromatic.quanta.util.Static.formatNumber;
import static net.hydromatic.quanta.util.Static.hashCombine;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.quanta.util.Static;

/**
 * Ordered product of operators, with a scalar coefficient.
 *
 * <p>A product may be flagged as normal-ordered, meaning that it stands for
 * the normal-ordered product {@code :a†[p] a[q]:}; its vacuum expectation
 * value is zero.
 */
public class OperatorProduct {
  public final ImmutableList<Operator> operators;
  public final double coefficient;
  public final boolean normalOrdered;

  public OperatorProduct(
      List<Operator> operators, double coefficient, boolean normalOrdered) {
    this.operators = ImmutableList.copyOf(requireNonNull(operators));
    this.coefficient = coefficient + 0d; // -0.0 becomes 0.0
    this.normalOrdered = normalOrdered;
  }

  public static OperatorProduct of(Operator... operators) {
    return new OperatorProduct(Arrays.asList(operators), 1d, false);
  }

  public static OperatorProduct of(
      double coefficient, List<Operator> operators) {
    return new OperatorProduct(operators, coefficient, false);
  }

  /** Returns the empty product with a given coefficient; it denotes a
   * scalar. */
  public static OperatorProduct scalar(double coefficient) {
    return new OperatorProduct(ImmutableList.of(), coefficient, false);
  }

  public int size() {
    return operators.size();
  }

  public boolean isEmpty() {
    return operators.isEmpty();
  }

  public OperatorProduct deepCopy() {
    return new OperatorProduct(
        Static.transformEager(operators, Operator::deepCopy),
        coefficient,
        normalOrdered);
  }

  public OperatorProduct withCoefficient(double coefficient) {
    return new OperatorProduct(operators, coefficient, normalOrdered);
  }

  public OperatorProduct withNormalOrdered(boolean normalOrdered) {
    return new OperatorProduct(operators, coefficient, normalOrdered);
  }

  /** Returns the product of this and another product. The result is not
   * flagged as normal-ordered. */
  public OperatorProduct times(OperatorProduct other) {
    return new OperatorProduct(
        ImmutableList.<Operator>builder()
            .addAll(operators)
            .addAll(other.operators)
            .build(),
        coefficient * other.coefficient,
        false);
  }

  public OperatorProduct times(Operator operator) {
    return new OperatorProduct(
        Static.append(operators, operator), coefficient, false);
  }

  public OperatorProduct times(double scalar) {
    return withCoefficient(coefficient * scalar);
  }

  /** Returns the adjoint: operators reversed, each replaced by its
   * adjoint. */
  public OperatorProduct adjoint() {
    return new OperatorProduct(
        Static.transformEager(operators.reverse(), Operator::adjoint),
        coefficient,
        normalOrdered);
  }

  /** Returns whether every annihilation operator follows every other
   * operator. Number operators count as creation-like. */
  public boolean isInNormalOrder() {
    boolean seenAnnihilation = false;
    for (Operator operator : operators) {
      if (operator.isAnnihilation()) {
        seenAnnihilation = true;
      } else if (seenAnnihilation) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the permutation that moves annihilation operators to the right.
   *
   * <p>Element k is the current position of the operator that moves to
   * position k. The partition is stable, so it uses the fewest adjacent
   * transpositions: the inversion count.
   */
  public ImmutableList<Integer> normalOrderingPermutation() {
    final ImmutableList.Builder<Integer> left = ImmutableList.builder();
    final ImmutableList.Builder<Integer> right = ImmutableList.builder();
    for (int i = 0; i < operators.size(); i++) {
      if (operators.get(i).isAnnihilation()) {
        right.add(i);
      } else {
        left.add(i);
      }
    }
    return left.addAll(right.build()).build();
  }

  /**
   * Returns the sign acquired by {@link #normalOrder()}.
   *
   * <p>Each pair of operators that swaps contributes -1 if the two operators
   * anticommute, and +1 otherwise. So the sign is (-1) raised to the
   * inversion count for fermions, and always +1 for bosons.
   */
  public int normalOrderingSign() {
    return permutationSign(normalOrderingPermutation());
  }

  /** Returns the sign of reordering the operators by a permutation. */
  public int permutationSign(List<Integer> permutation) {
    int sign = 1;
    for (int i = 0; i < permutation.size(); i++) {
      for (int j = i + 1; j < permutation.size(); j++) {
        final int a = permutation.get(i);
        final int b = permutation.get(j);
        if (a > b
            && operators.get(a).anticommutesWith(operators.get(b))) {
          sign = -sign;
        }
      }
    }
    return sign;
  }

  /** Returns the normal-ordered product: operators rearranged so that
   * annihilation operators are on the right, coefficient multiplied by the
   * reordering sign, flagged as normal-ordered. */
  public OperatorProduct normalOrder() {
    final ImmutableList<Integer> permutation = normalOrderingPermutation();
    return new OperatorProduct(
        Static.transformEager(permutation, operators::get),
        coefficient * permutationSign(permutation),
        true);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OperatorProduct)) {
      return false;
    }
    final OperatorProduct that = (OperatorProduct) o;
    return operators.equals(that.operators)
        && coefficient == that.coefficient
        && normalOrdered == that.normalOrdered;
  }

  @Override public int hashCode() {
    int h = hashCombine(0, operators);
    h = hashCombine(h, Double.hashCode(coefficient));
    return hashCombine(h, Boolean.hashCode(normalOrdered));
  }

  @Override public String toString() {
    if (operators.isEmpty()) {
      return formatNumber(coefficient);
    }
    String s =
        operators.stream()
            .map(Operator::toString)
            .collect(Collectors.joining(" "));
    if (normalOrdered) {
      s = ":" + s + ":";
    }
    return coefficient == 1d ? s : formatNumber(coefficient) + "*" + s;
  }
}

// End OperatorProduct.java
