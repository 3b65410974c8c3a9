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
package net.hydromatic.quanta.algebra;

import static net.hydromatic.quanta.ast.TreeBuilder.tree;
import static net.hydromatic.quanta.util.Diagnostics.checkUser;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.model.ComplexSymbol;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.OperatorSum;
import net.hydromatic.quanta.model.Symbol;

/**
 * Commutators and anticommutators of operators.
 *
 * <p>The commutator is {@code [A, B] = AB - BA}; the anticommutator is
 * {@code {A, B} = AB + BA}. Results are linear combinations of operator
 * products; like terms are not combined unless you call
 * {@link OperatorSum#combineLikeTerms()}.
 */
public class CommutatorAlgebra {
  private CommutatorAlgebra() {}

  /** Largest order for which {@link #bchCoefficient(int)} is tabulated. */
  private static final int MAX_ORDER = 20;

  /** BCH coefficients, B<sub>k</sub><sup>+</sup> / k!. */
  private static final ImmutableList<Double> BCH_COEFFICIENTS =
      bchCoefficients(MAX_ORDER);

  public static OperatorSum commutator(Operator a, Operator b) {
    return commutator(OperatorProduct.of(a), OperatorProduct.of(b));
  }

  public static OperatorSum commutator(OperatorProduct a, OperatorProduct b) {
    return OperatorSum.of(a.times(b), b.times(a).times(-1d));
  }

  public static OperatorSum commutator(OperatorSum a, OperatorSum b) {
    return a.times(b).minus(b.times(a));
  }

  public static OperatorSum anticommutator(Operator a, Operator b) {
    return anticommutator(OperatorProduct.of(a), OperatorProduct.of(b));
  }

  public static OperatorSum anticommutator(
      OperatorProduct a, OperatorProduct b) {
    return OperatorSum.of(a.times(b), b.times(a));
  }

  public static OperatorSum anticommutator(OperatorSum a, OperatorSum b) {
    return a.times(b).plus(b.times(a));
  }

  /** Returns {@code [...[[A1, A2], A3], ..., An]}. */
  public static OperatorSum nestedCommutator(List<Operator> operators) {
    checkUser(operators.size() >= 2, "operators.size() >= 2",
        "nested commutator needs at least 2 operators, got %s",
        operators.size());
    OperatorSum result = commutator(operators.get(0), operators.get(1));
    for (Operator operator : operators.subList(2, operators.size())) {
      result = commutator(result, OperatorSum.of(OperatorProduct.of(operator)));
    }
    return result;
  }

  /**
   * Returns the terms of the Baker-Campbell-Hausdorff series up to a given
   * order.
   *
   * <p>Term k is {@code c(k) * ad(A)^k (B)}, where {@code ad(A) X = [A, X]}
   * and {@code c(k)} is {@link #bchCoefficient(int)}. The result has
   * {@code order + 1} elements; a term whose coefficient is zero is
   * {@link OperatorSum#ZERO}.
   */
  public static List<OperatorSum> bchExpansion(
      Operator a, Operator b, int order) {
    checkUser(order >= 0 && order <= MAX_ORDER,
        "order >= 0 && order <= MAX_ORDER",
        "BCH order must be between 0 and %s, got %s", MAX_ORDER, order);
    final OperatorSum sumA = OperatorSum.of(OperatorProduct.of(a));
    OperatorSum nested = OperatorSum.of(OperatorProduct.of(b));
    final ImmutableList.Builder<OperatorSum> terms = ImmutableList.builder();
    for (int k = 0; k <= order; k++) {
      if (k > 0) {
        nested = commutator(sumA, nested);
      }
      final double c = bchCoefficient(k);
      terms.add(c == 0d ? OperatorSum.ZERO : nested.times(c));
    }
    return terms.build();
  }

  /** Returns the coefficient of the k-fold nested commutator in the BCH
   * series: B<sub>k</sub><sup>+</sup> / k!, that is 1, 1/2, 1/12, 0, -1/720,
   * 0, 1/30240, ... */
  public static double bchCoefficient(int k) {
    checkUser(k >= 0 && k <= MAX_ORDER, "k >= 0 && k <= MAX_ORDER",
        "BCH order must be between 0 and %s, got %s", MAX_ORDER, k);
    return BCH_COEFFICIENTS.get(k);
  }

  /** Computes Bernoulli numbers by the recurrence
   * {@code sum(j = 0..m, C(m + 1, j) B(j)) = 0}, then divides by k!. */
  private static ImmutableList<Double> bchCoefficients(int maxOrder) {
    final double[] bernoulli = new double[maxOrder + 1];
    bernoulli[0] = 1d;
    for (int m = 1; m <= maxOrder; m++) {
      double sum = 0d;
      for (int j = 0; j < m; j++) {
        sum += binomial(m + 1, j) * bernoulli[j];
      }
      bernoulli[m] = -sum / (m + 1);
    }
    // The recurrence gives B1 = -1/2; the BCH series uses B1+ = +1/2.
    if (maxOrder >= 1) {
      bernoulli[1] = 0.5d;
    }
    final ImmutableList.Builder<Double> b = ImmutableList.builder();
    double factorial = 1d;
    for (int k = 0; k <= maxOrder; k++) {
      if (k > 0) {
        factorial *= k;
      }
      // Odd Bernoulli numbers above B1 are zero; avoid rounding noise.
      b.add(k > 1 && k % 2 == 1 ? 0d : bernoulli[k] / factorial);
    }
    return b.build();
  }

  private static double binomial(int n, int k) {
    double r = 1d;
    for (int i = 1; i <= k; i++) {
      r = r * (n - k + i) / i;
    }
    return r;
  }

  /** Returns the canonical commutator {@code [x, p] = i * ħ}. */
  public static Tree.Exp canonicalCommutation(Operator x, Operator p) {
    return tree.multiply(
        tree.symbol(new ComplexSymbol("i", 0d, 1d)),
        tree.symbol(new Symbol("ħ", Symbol.Kind.CONSTANT)));
  }

  /**
   * Returns the canonical anticommutator {@code {a[p], a†[q]} = δ[p,q]}, or
   * 1 if p and q have the same label.
   */
  public static Tree.Exp canonicalAnticommutation(
      Operator a, Operator aDagger) {
    checkUser(a.isElementary() && aDagger.isElementary(),
        "a.isElementary() && aDagger.isElementary()",
        "canonical anticommutator needs single-index operators, got %s and %s",
        a, aDagger);
    final String p = a.indices.get(0).label;
    final String q = aDagger.indices.get(0).label;
    return p.equals(q)
        ? tree.one()
        : tree.delta(a.indices.get(0), aDagger.indices.get(0));
  }

  /**
   * Returns whether two operators are known to commute.
   *
   * <p>True if the operators are equal, if both are bosonic operators of the
   * same role (creation or annihilation), or if the commutator cancels to
   * zero.
   */
  public static boolean isZeroCommutator(Operator a, Operator b) {
    if (a.equals(b)) {
      return true;
    }
    if (a.commutesWith(b)
        && a.role == b.role
        && (a.isCreation() || a.isAnnihilation())) {
      return true;
    }
    return commutator(a, b).isZero();
  }
}

// End CommutatorAlgebra.java
