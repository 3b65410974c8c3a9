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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quanta.ast.TreeBuilder.tree;
import static net.hydromatic.quanta.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.quanta.algebra.PointGroup;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Shuttle;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.ast.TreeBuilder;
import net.hydromatic.quanta.ast.Visitor;
import net.hydromatic.quanta.model.ComplexSymbol;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.Symbol;
import net.hydromatic.quanta.model.Tensor;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Reductions by symmetry. */
public class SymmetryRules {
  private SymmetryRules() {}

  /** Returns the symmetry rules for a point group: the rules that hold in
   * any group, followed by the rule that uses the group's multiplication
   * table.
   *
   * @param id Name of an abelian point group, such as "C2v" */
  public static List<Rule> forGroup(String id) {
    return ImmutableList.of(BuiltInRule.PERMUTATION_SYMMETRY,
        BuiltInRule.TIME_REVERSAL, BuiltInRule.PARTICLE_HOLE, pointGroup(id));
  }

  /** Returns a rule that replaces by zero an integral that vanishes
   * because its integrand is not totally symmetric in a given point
   * group. */
  public static Rule pointGroup(String id) {
    return new PointGroupRule(PointGroup.lookup(id));
  }

  /**
   * Merges the terms of a sum.
   *
   * <p>Nested sums are flattened, and a term {@code c * x}, where c is a
   * scalar constant, is treated as term x with coefficient c. Terms that
   * are structurally equal are merged by adding their coefficients; because
   * the tensor rules put the indices of symmetric and antisymmetric tensors
   * in canonical order, terms that differ by a permutation of such indices
   * merge too. Terms whose coefficient is zero are removed. A sum with no
   * terms becomes 0, and a sum with one term becomes that term.
   */
  public static Tree.@Nullable Exp permutation(Tree.Exp e) {
    if (e.op != Op.SUM) {
      return null;
    }
    final Map<Tree.Exp, Double> terms = new LinkedHashMap<>();
    flatten((Tree.Sum) e, 1d, terms);
    terms.values().removeIf(c -> c == 0d);
    final Tree.Exp result;
    switch (terms.size()) {
    case 0:
      result = tree.zero();
      break;
    case 1:
      final Map.Entry<Tree.Exp, Double> entry =
          terms.entrySet().iterator().next();
      result = entry.getValue() == 1d
          ? entry.getKey()
          : tree.multiply(tree.constant(entry.getValue()), entry.getKey());
      break;
    default:
      result = tree.sum(new ArrayList<>(terms.keySet()),
          new ArrayList<>(terms.values()));
    }
    return result.equals(e) ? null : result;
  }

  private static void flatten(Tree.Sum sum, double factor,
      Map<Tree.Exp, Double> terms) {
    for (int i = 0; i < sum.terms.size(); i++) {
      Tree.Exp term = sum.terms.get(i);
      double c = factor * sum.coefficient(i);
      if (term.op == Op.SUM) {
        flatten((Tree.Sum) term, c, terms);
        continue;
      }
      if (term.op == Op.MULTIPLY) {
        final Tree.Binary multiply = (Tree.Binary) term;
        final Double value = tree.scalarValue(multiply.left);
        if (value != null) {
          c *= value;
          term = multiply.right;
        }
      }
      if (tree.isZero(term)) {
        continue;
      }
      terms.merge(term, c, Double::sum);
    }
  }

  /**
   * Applies complex conjugation, {@code conj(e)}.
   *
   * <p>Conjugation is an involution, so {@code conj(conj(e)) = e}. A real
   * symbol or tensor is its own conjugate. The conjugate of a complex
   * constant negates its imaginary part. Conjugation distributes over
   * arithmetic.
   */
  public static Tree.@Nullable Exp timeReversal(Tree.Exp e) {
    if (e.op != Op.FUNCTION_CALL
        || !((Tree.Call) e).isCallTo(TreeBuilder.CONJ)) {
      return null;
    }
    final Tree.Exp arg = ((Tree.Call) e).args.get(0);
    switch (arg.op) {
    case FUNCTION_CALL:
      return ((Tree.Call) arg).isCallTo(TreeBuilder.CONJ)
          ? ((Tree.Call) arg).args.get(0)
          : null;

    case SYMBOL:
      final Symbol symbol = ((Tree.SymbolExp) arg).symbol;
      if (symbol instanceof ComplexSymbol) {
        return tree.symbol(((ComplexSymbol) symbol).conjugate());
      }
      return symbol.isComplex() ? null : arg;

    case TENSOR:
      final Tensor tensor = ((Tree.TensorExp) arg).tensor;
      return tensor.symbol.isComplex()
          ? tree.tensor(tensor.conjugate())
          : arg;

    case ADD:
    case SUBTRACT:
    case MULTIPLY:
    case DIVIDE:
      final Tree.Binary binary = (Tree.Binary) arg;
      return tree.binary(arg.op, tree.conjugate(binary.left),
          tree.conjugate(binary.right));

    case SUM:
      final Tree.Sum sum = (Tree.Sum) arg;
      return tree.sum(transformEager(sum.terms, tree::conjugate),
          sum.coefficients);

    default:
      return null;
    }
  }

  /** Applies the particle-hole transformation, {@code ph(e)}: occupied and
   * virtual indices swap kinds, and creation and annihilation operators swap
   * roles. */
  public static Tree.@Nullable Exp particleHole(Tree.Exp e) {
    if (e.op != Op.FUNCTION_CALL
        || !((Tree.Call) e).isCallTo(TreeBuilder.PARTICLE_HOLE)) {
      return null;
    }
    return ((Tree.Call) e).args.get(0).accept(new ParticleHoleShuttle());
  }

  /** Shuttle that applies the particle-hole transformation. */
  private static class ParticleHoleShuttle extends Shuttle {
    private static IndexSet swap(IndexSet indices) {
      return indices.transform(i -> i.withKind(i.kind.particleHole()));
    }

    private static Operator swapOperator(Operator operator) {
      final Operator o = operator.isCreation() || operator.isAnnihilation()
          ? operator.adjoint()
          : operator;
      return o.withIndices(swap(o.indices));
    }

    @Override protected Tree.Exp visit(Tree.TensorExp tensorExp) {
      final Tensor tensor = tensorExp.tensor;
      return tensorExp.copy(tensor.withIndices(swap(tensor.indices)));
    }

    @Override protected Tree.Exp visit(Tree.OperatorExp operatorExp) {
      return operatorExp.copy(swapOperator(operatorExp.operator));
    }

    @Override protected Tree.Exp visit(Tree.ProductExp productExp) {
      final OperatorProduct product = productExp.product;
      return productExp.copy(
          OperatorProduct.of(product.coefficient,
              transformEager(product.operators,
                  ParticleHoleShuttle::swapOperator)));
    }

    @Override protected Tree.Exp visit(Tree.IndexSum indexSum) {
      final Index index = indexSum.index;
      return indexSum.copy(index.withKind(index.kind.particleHole()),
          indexSum.child.accept(this));
    }

    @Override protected Tree.Exp visit(Tree.Contraction contraction) {
      return tree.contract(contraction.left.accept(this),
          contraction.right.accept(this), swap(contraction.indices));
    }
  }

  /** Rule that removes integrals that vanish by point-group symmetry. */
  private static class PointGroupRule implements Rule {
    private final PointGroup group;

    PointGroupRule(PointGroup group) {
      this.group = requireNonNull(group);
    }

    @Override public String name() {
      return "POINT_GROUP_" + group;
    }

    @Override public Category category() {
      return Category.SYMMETRY;
    }

    /** Replaces an integral by zero if the irreps of the tensors in its
     * integrand multiply to an irrep that is not totally symmetric. Does
     * not apply if any tensor other than a Kronecker delta has no irrep. */
    @Override public Tree.@Nullable Exp apply(Tree.Exp exp) {
      if (exp.op != Op.INTEGRAL) {
        return null;
      }
      final IrrepCollector collector = new IrrepCollector();
      ((Tree.Integral) exp).child.accept(collector);
      if (collector.unknown || collector.irreps.isEmpty()) {
        return null;
      }
      return group.isTotallySymmetric(collector.irreps) ? null : tree.zero();
    }

    @Override public String toString() {
      return name();
    }
  }

  /** Visitor that collects the irreps of the tensors in an expression. */
  private static class IrrepCollector extends Visitor {
    final List<String> irreps = new ArrayList<>();
    boolean unknown;

    @Override protected void visit(Tree.TensorExp tensorExp) {
      final Tensor tensor = tensorExp.tensor;
      if (tensor.isKroneckerDelta()) {
        return;
      }
      final String irrep = tensor.irrep();
      if (irrep == null) {
        unknown = true;
      } else {
        irreps.add(irrep);
      }
    }
  }
}

// End SymmetryRules.java
