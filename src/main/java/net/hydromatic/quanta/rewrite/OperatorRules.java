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

import static net.hydromatic.quanta.ast.TreeBuilder.tree;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.algebra.CommutatorAlgebra;
import net.hydromatic.quanta.algebra.OperatorFactory;
import net.hydromatic.quanta.algebra.Wick;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.ast.TreeBuilder;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.OperatorProduct;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for second-quantized operators. */
public class OperatorRules {
  private OperatorRules() {}

  /**
   * Evaluates the vacuum expectation value {@code vev(e)}.
   *
   * <p>A product of creation and annihilation operators becomes the sum of
   * its full Wick contractions. A normal-ordered product, or a single
   * creation, annihilation or number operator, has expectation value zero.
   * An expression without operators is its own expectation value. The
   * expectation value is linear, so it distributes over sums and
   * differences, and factors without operators move outside it.
   */
  public static Tree.@Nullable Exp vacuumExpectation(Tree.Exp e) {
    if (e.op != Op.FUNCTION_CALL
        || !((Tree.Call) e).isCallTo(TreeBuilder.VEV)) {
      return null;
    }
    final Tree.Exp body = ((Tree.Call) e).args.get(0);
    if (!hasOperators(body)) {
      return body;
    }
    switch (body.op) {
    case OPERATOR:
      final Operator operator = ((Tree.OperatorExp) body).operator;
      switch (operator.role) {
      case CREATION:
      case ANNIHILATION:
      case NUMBER:
        return tree.zero();
      default:
        return null;
      }

    case OPERATOR_PRODUCT:
      final OperatorProduct product = ((Tree.ProductExp) body).product;
      if (product.isEmpty()) {
        return tree.constant(product.coefficient);
      }
      if (product.normalOrdered) {
        return tree.zero();
      }
      if (!Wick.isApplicable(product)) {
        return null;
      }
      return Wick.expand(Wick.fullContractions(product));

    case SUM:
      final Tree.Sum sum = (Tree.Sum) body;
      final List<Tree.Exp> terms = new ArrayList<>();
      for (Tree.Exp term : sum.terms) {
        terms.add(tree.vacuumExpectation(term));
      }
      return tree.sum(terms, sum.coefficients);

    case ADD:
    case SUBTRACT:
      final Tree.Binary binary = (Tree.Binary) body;
      return tree.binary(body.op,
          tree.vacuumExpectation(binary.left),
          tree.vacuumExpectation(binary.right));

    case MULTIPLY:
      final Tree.Binary multiply = (Tree.Binary) body;
      if (!hasOperators(multiply.left)) {
        return tree.multiply(multiply.left,
            tree.vacuumExpectation(multiply.right));
      }
      if (!hasOperators(multiply.right)) {
        return tree.multiply(tree.vacuumExpectation(multiply.left),
            multiply.right);
      }
      return null;

    default:
      return null;
    }
  }

  /** Returns whether an expression contains an operator or a product of
   * operators. */
  static boolean hasOperators(Tree.Exp e) {
    return !e.find(Op.OPERATOR).isEmpty()
        || !e.find(Op.OPERATOR_PRODUCT).isEmpty();
  }

  /** Returns an operator or product of operators as a product, or null. */
  private static @Nullable OperatorProduct asProduct(Tree.Exp e) {
    switch (e.op) {
    case OPERATOR:
      return OperatorProduct.of(((Tree.OperatorExp) e).operator);
    case OPERATOR_PRODUCT:
      return ((Tree.ProductExp) e).product;
    default:
      return null;
    }
  }

  /** Fuses {@code X * Y}, where X and Y are operators or products of
   * operators, into one product. A scalar constant times an operator also
   * becomes a product, with that coefficient. */
  public static Tree.@Nullable Exp fuseOperators(Tree.Exp e) {
    if (e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    final OperatorProduct left = asProduct(multiply.left);
    final OperatorProduct right = asProduct(multiply.right);
    if (left != null && right != null) {
      return tree.product(left.times(right));
    }
    if (right != null) {
      final Double c = tree.scalarValue(multiply.left);
      if (c != null) {
        return tree.product(right.times(c));
      }
    }
    if (left != null) {
      final Double c = tree.scalarValue(multiply.right);
      if (c != null) {
        return tree.product(left.times(c));
      }
    }
    return null;
  }

  /** Expands a number operator {@code n[p]} to the normal-ordered product
   * {@code :a†[p] a[p]:}. */
  public static Tree.@Nullable Exp expandNumberOperator(Tree.Exp e) {
    if (e.op != Op.OPERATOR) {
      return null;
    }
    final Operator operator = ((Tree.OperatorExp) e).operator;
    if (operator.role != Operator.Role.NUMBER
        || operator.indices.size() != 1
        || operator.algebra == Operator.Algebra.GENERAL) {
      return null;
    }
    final Index p = operator.indices.get(0);
    return tree.product(
        OperatorProduct.of(OperatorFactory.creation(p, operator.algebra),
                OperatorFactory.annihilation(p, operator.algebra))
            .withNormalOrdered(true));
  }

  /** Normal-orders a product of creation and annihilation operators by
   * Wick's theorem. The result is the sum of the normal-ordered product and
   * every term with contractions. */
  public static Tree.@Nullable Exp normalOrder(Tree.Exp e) {
    if (e.op != Op.OPERATOR_PRODUCT) {
      return null;
    }
    final OperatorProduct product = ((Tree.ProductExp) e).product;
    if (product.normalOrdered || !Wick.isApplicable(product)) {
      return null;
    }
    return Wick.expand(Wick.contractions(product));
  }

  /**
   * Applies the canonical relations of single-index operators.
   *
   * <ul>
   * <li>Fermions: {@code {a[p], a†[q]} = δ[p,q]}, and the anticommutator of
   *   two creation or two annihilation operators is zero.
   * <li>Bosons: {@code [b[p], b†[q]] = δ[p,q]},
   *   {@code [b†[q], b[p]] = -δ[p,q]}, and the commutator of two creation or
   *   two annihilation operators is zero.
   * </ul>
   *
   * <p>The delta is 1 if p and q have the same label.
   */
  public static Tree.@Nullable Exp canonicalRelations(Tree.Exp e) {
    switch (e.op) {
    case ANTICOMMUTATOR:
      final Tree.Anticommutator anticommutator = (Tree.Anticommutator) e;
      final Operator a0 =
          elementary(anticommutator.left, Operator.Algebra.FERMION);
      final Operator a1 =
          elementary(anticommutator.right, Operator.Algebra.FERMION);
      if (a0 == null || a1 == null) {
        return null;
      }
      if (a0.role == a1.role) {
        return tree.zero();
      }
      return a0.isAnnihilation()
          ? CommutatorAlgebra.canonicalAnticommutation(a0, a1)
          : CommutatorAlgebra.canonicalAnticommutation(a1, a0);

    case COMMUTATOR:
      final Tree.Commutator commutator = (Tree.Commutator) e;
      final Operator b0 = elementary(commutator.left, Operator.Algebra.BOSON);
      final Operator b1 = elementary(commutator.right, Operator.Algebra.BOSON);
      if (b0 == null || b1 == null) {
        return null;
      }
      if (b0.role == b1.role) {
        return tree.zero();
      }
      final Tree.Exp delta = b0.isAnnihilation()
          ? CommutatorAlgebra.canonicalAnticommutation(b0, b1)
          : CommutatorAlgebra.canonicalAnticommutation(b1, b0);
      return b0.isAnnihilation()
          ? delta
          : tree.multiply(tree.constant(-1), delta);

    default:
      return null;
    }
  }

  /** Returns the operator of an expression that is a single-index creation
   * or annihilation operator of a given algebra, or null. */
  private static @Nullable Operator elementary(Tree.Exp e,
      Operator.Algebra algebra) {
    if (e.op != Op.OPERATOR) {
      return null;
    }
    final Operator operator = ((Tree.OperatorExp) e).operator;
    return operator.isElementary() && operator.algebra == algebra
        ? operator
        : null;
  }
}

// End OperatorRules.java
