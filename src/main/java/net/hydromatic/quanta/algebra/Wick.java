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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quanta.ast.TreeBuilder.tree;
import static net.hydromatic.quanta.util.Diagnostics.checkUser;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.Tensor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Wick's theorem.
 *
 * <p>A product of creation and annihilation operators is equal to the sum,
 * over every set of pairwise contractions, of the contracted factors times
 * the normal-ordered product of the operators that remain.
 *
 * <p>Contractions are taken with respect to the physical vacuum: the
 * contraction of {@code a[p]} with a later {@code a†[q]} is {@code δ[p,q]};
 * every other contraction is zero. For fermions, each term carries the sign
 * of the permutation that brings the contracted pairs together.
 */
public class Wick {
  private Wick() {}

  /** Returns whether Wick's theorem applies to a product: it is not empty,
   * and its operators are single-index creation and annihilation operators
   * of one algebra, either fermionic or bosonic. */
  public static boolean isApplicable(OperatorProduct product) {
    if (product.isEmpty()) {
      return false;
    }
    final Operator.Algebra algebra = product.operators.get(0).algebra;
    if (algebra == Operator.Algebra.GENERAL) {
      return false;
    }
    for (Operator operator : product.operators) {
      if (!operator.isElementary() || operator.algebra != algebra) {
        return false;
      }
    }
    return true;
  }

  /** Returns every term of the Wick expansion of a product: the
   * uncontracted term, and one term for each set of nonzero contractions. */
  public static List<Term> contractions(OperatorProduct product) {
    checkUser(isApplicable(product), "isApplicable(product)",
        "Wick's theorem does not apply to %s", product);
    final List<List<int[]>> pairings = new ArrayList<>();
    enumerate(product, new boolean[product.size()], 0, new ArrayList<>(),
        pairings);
    final ImmutableList.Builder<Term> terms = ImmutableList.builder();
    for (List<int[]> pairing : pairings) {
      terms.add(term(product, pairing));
    }
    return terms.build();
  }

  /** Returns the fully contracted terms of the Wick expansion. Their sum is
   * the vacuum expectation value of the product. */
  public static List<Term> fullContractions(OperatorProduct product) {
    final ImmutableList.Builder<Term> terms = ImmutableList.builder();
    for (Term term : contractions(product)) {
      if (term.remainder.isEmpty()) {
        terms.add(term);
      }
    }
    return terms.build();
  }

  /** Returns the Wick expansion of a product as an expression, or zero if
   * the expansion has no terms. */
  public static Tree.Exp expand(List<Term> terms) {
    switch (terms.size()) {
    case 0:
      return tree.zero();
    case 1:
      return terms.get(0).toExp();
    default:
      final List<Tree.Exp> list = new ArrayList<>();
      terms.forEach(term -> list.add(term.toExp()));
      return tree.sum(list);
    }
  }

  /** Returns whether contracting operator {@code i} with a later operator
   * {@code j} gives a nonzero result. */
  private static boolean contracts(OperatorProduct product, int i, int j) {
    return product.operators.get(i).isAnnihilation()
        && product.operators.get(j).isCreation();
  }

  /** Enumerates sets of disjoint pairs. Position {@code i} is either left
   * uncontracted or paired with a later position. */
  private static void enumerate(OperatorProduct product, boolean[] used,
      int i, List<int[]> pairs, List<List<int[]>> pairings) {
    if (i == used.length) {
      pairings.add(ImmutableList.copyOf(pairs));
      return;
    }
    if (used[i]) {
      enumerate(product, used, i + 1, pairs, pairings);
      return;
    }
    enumerate(product, used, i + 1, pairs, pairings);
    for (int j = i + 1; j < used.length; j++) {
      if (!used[j] && contracts(product, i, j)) {
        used[i] = used[j] = true;
        pairs.add(new int[] {i, j});
        enumerate(product, used, i + 1, pairs, pairings);
        pairs.remove(pairs.size() - 1);
        used[i] = used[j] = false;
      }
    }
  }

  private static Term term(OperatorProduct product, List<int[]> pairs) {
    // Move each pair to the front, then the remaining operators in order.
    final List<Integer> permutation = new ArrayList<>();
    final boolean[] contracted = new boolean[product.size()];
    final ImmutableList.Builder<Tensor> deltas = ImmutableList.builder();
    for (int[] pair : pairs) {
      permutation.add(pair[0]);
      permutation.add(pair[1]);
      contracted[pair[0]] = contracted[pair[1]] = true;
      deltas.add(
          TensorFactory.kroneckerDelta(
              product.operators.get(pair[0]).indices.get(0),
              product.operators.get(pair[1]).indices.get(0)));
    }
    final List<Operator> rest = new ArrayList<>();
    for (int i = 0; i < product.size(); i++) {
      if (!contracted[i]) {
        permutation.add(i);
        rest.add(product.operators.get(i));
      }
    }
    final int sign = product.permutationSign(permutation);
    final OperatorProduct remainder =
        OperatorProduct.of(product.coefficient * sign, rest).normalOrder();
    return new Term(deltas.build(), remainder);
  }

  /** Term of a Wick expansion: a product of Kronecker deltas times a
   * normal-ordered product of operators. The coefficient, including the
   * sign, is held by the remainder. */
  public static class Term {
    public final ImmutableList<Tensor> deltas;
    public final OperatorProduct remainder;

    Term(ImmutableList<Tensor> deltas, OperatorProduct remainder) {
      this.deltas = requireNonNull(deltas);
      this.remainder = requireNonNull(remainder);
    }

    public double coefficient() {
      return remainder.coefficient;
    }

    /** Converts this term to an expression such as
     * {@code -1*δ[p,q] * δ[r,s]} or {@code δ[p,q] * :a†[r] a[s]:}. */
    public Tree.Exp toExp() {
      Tree.@Nullable Exp e = null;
      for (Tensor delta : deltas) {
        e = e == null
            ? tree.tensor(delta)
            : tree.multiply(e, tree.tensor(delta));
      }
      if (!remainder.isEmpty()) {
        final Tree.Exp p = tree.product(remainder);
        return e == null ? p : tree.multiply(e, p);
      }
      if (e == null) {
        return tree.constant(remainder.coefficient);
      }
      return remainder.coefficient == 1d
          ? e
          : tree.multiply(tree.constant(remainder.coefficient), e);
    }

    @Override public String toString() {
      return toExp().toString();
    }
  }
}

// End Wick.java
