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
import static net.hydromatic.quanta.util.Static.inversionCount;
import static net.hydromatic.quanta.util.Static.transformEager;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Shuttle;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.ast.Visitor;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.Tensor;
import net.hydromatic.quanta.util.NameGenerator;
import net.hydromatic.quanta.util.ScopedMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rules for tensors: Kronecker deltas, implicit and explicit summation, and
 * permutational symmetry.
 *
 * <p>Summation follows the Einstein convention: a label that occurs twice
 * in a product is summed over.
 */
public class TensorRules {
  private TensorRules() {}

  /**
   * Contracts Kronecker deltas.
   *
   * <ul>
   * <li>A delta between an occupied and a virtual index is zero.
   * <li>{@code contract(δ[i,j], B; j)} becomes B with j relabeled to i;
   *   likewise if the delta is on the right, or if i is contracted.
   * <li>{@code δ[i,j] * B}, where j is a free index of B, becomes B with j
   *   relabeled to i; likewise if the delta is on the right.
   * </ul>
   */
  public static Tree.@Nullable Exp contractKroneckerDelta(Tree.Exp e) {
    switch (e.op) {
    case TENSOR:
      final Tensor tensor = ((Tree.TensorExp) e).tensor;
      if (tensor.isKroneckerDelta()) {
        final Index.Kind kind0 = tensor.indices.get(0).kind;
        final Index.Kind kind1 = tensor.indices.get(1).kind;
        if (kind0 != kind1
            && (kind0 == Index.Kind.OCCUPIED || kind0 == Index.Kind.VIRTUAL)
            && (kind1 == Index.Kind.OCCUPIED || kind1 == Index.Kind.VIRTUAL)) {
          return tree.zero();
        }
      }
      return null;

    case CONTRACTION:
      final Tree.Contraction contraction = (Tree.Contraction) e;
      final Tensor left = delta(contraction.left);
      if (left != null) {
        return eliminate(left, contraction.right, contraction.indices);
      }
      final Tensor right = delta(contraction.right);
      if (right != null) {
        return eliminate(right, contraction.left, contraction.indices);
      }
      return null;

    case MULTIPLY:
      final Tree.Binary multiply = (Tree.Binary) e;
      final Tensor l = delta(multiply.left);
      if (l != null) {
        return eliminate(l, multiply.right,
            l.indices.common(multiply.right.freeIndices()));
      }
      final Tensor r = delta(multiply.right);
      if (r != null) {
        return eliminate(r, multiply.left,
            r.indices.common(multiply.left.freeIndices()));
      }
      return null;

    default:
      return null;
    }
  }

  private static @Nullable Tensor delta(Tree.Exp e) {
    if (e.op == Op.TENSOR) {
      final Tensor tensor = ((Tree.TensorExp) e).tensor;
      if (tensor.isKroneckerDelta()) {
        return tensor;
      }
    }
    return null;
  }

  /** Sums a delta against an expression over the given labels, by
   * relabeling the expression. */
  private static Tree.@Nullable Exp eliminate(Tensor delta, Tree.Exp other,
      IndexSet summed) {
    final String x = delta.indices.get(0).label;
    final String y = delta.indices.get(1).label;
    final IndexSet free = other.freeIndices();
    if (summed.containsLabel(y)
        && (!free.containsLabel(x) || summed.containsLabel(x))) {
      return relabel(other, y, x);
    }
    if (summed.containsLabel(x)
        && (!free.containsLabel(y) || summed.containsLabel(y))) {
      return relabel(other, x, y);
    }
    return null;
  }

  /** Replaces free occurrences of an index label. */
  public static Tree.Exp relabel(Tree.Exp e, String from, String to) {
    return e.accept(new Relabeler(from, to));
  }

  /** Rewrites {@code A * B}, where A and B are tensors or contractions that
   * share free index labels, as a contraction over those labels. */
  public static Tree.@Nullable Exp einsteinSummation(Tree.Exp e) {
    if (e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    if (!isTensorial(multiply.left) || !isTensorial(multiply.right)) {
      return null;
    }
    final IndexSet shared =
        multiply.left.freeIndices().common(multiply.right.freeIndices());
    if (shared.isEmpty()) {
      return null;
    }
    return tree.contract(multiply.left, multiply.right, shared);
  }

  private static boolean isTensorial(Tree.Exp e) {
    return e.op == Op.TENSOR || e.op == Op.CONTRACTION;
  }

  /**
   * Simplifies an explicit sum over an index.
   *
   * <p>If the index is already summed implicitly in the body (it occurs
   * there, but not as a free index), the explicit sum is redundant. If the
   * index does not occur in the body and has a known dimension N, the sum
   * is N times the body.
   */
  public static Tree.@Nullable Exp collapseIndexSum(Tree.Exp e) {
    if (e.op != Op.INDEX_SUM) {
      return null;
    }
    final Tree.IndexSum indexSum = (Tree.IndexSum) e;
    final String label = indexSum.index.label;
    if (indexSum.child.freeIndices().containsLabel(label)) {
      return null;
    }
    final LabelCollector collector = new LabelCollector();
    indexSum.child.accept(collector);
    if (collector.labels.contains(label)) {
      return indexSum.child;
    }
    final int dimension = indexSum.index.dimension();
    if (dimension < 0) {
      return null;
    }
    return tree.multiply(tree.constant(dimension), indexSum.child);
  }

  /** Sorts the indices of a symmetric tensor by label. */
  public static Tree.@Nullable Exp symmetricTensor(Tree.Exp e) {
    if (e.op != Op.TENSOR) {
      return null;
    }
    final Tensor tensor = ((Tree.TensorExp) e).tensor;
    if (tensor.type != Tensor.Type.SYMMETRIC) {
      return null;
    }
    final List<Integer> permutation = sortingPermutation(tensor.indices);
    if (inversionCount(permutation) == 0) {
      return null;
    }
    return tree.tensor(tensor.withIndices(tensor.indices.permute(permutation)));
  }

  /** Sorts the indices of an antisymmetric tensor by label, negating it if
   * the permutation is odd. An antisymmetric tensor with a repeated label
   * is zero. */
  public static Tree.@Nullable Exp antisymmetricTensor(Tree.Exp e) {
    if (e.op != Op.TENSOR) {
      return null;
    }
    final Tensor tensor = ((Tree.TensorExp) e).tensor;
    if (tensor.type != Tensor.Type.ANTISYMMETRIC) {
      return null;
    }
    if (tensor.indices.hasRepeatedIndices()) {
      return tree.zero();
    }
    final List<Integer> permutation = sortingPermutation(tensor.indices);
    final int inversions = inversionCount(permutation);
    if (inversions == 0) {
      return null;
    }
    final Tree.Exp sorted =
        tree.tensor(tensor.withIndices(tensor.indices.permute(permutation)));
    return inversions % 2 == 0
        ? sorted
        : tree.multiply(tree.constant(-1), sorted);
  }

  /** Returns the permutation that sorts a list of indices; element k is the
   * position of the index that moves to position k. */
  private static List<Integer> sortingPermutation(IndexSet indices) {
    final List<Integer> positions = new ArrayList<>();
    for (int i = 0; i < indices.size(); i++) {
      positions.add(i);
    }
    positions.sort(Comparator.comparing(indices::get));
    return positions;
  }

  /**
   * Gives the index of each explicit sum a fresh label.
   *
   * <p>Labels come from {@code generator}. The first sum over "j" keeps the
   * label "j", later sums over "j" become "j1", "j2", and so forth. The
   * free labels of the expression are reserved first, so a fresh label
   * never captures a free index.
   */
  public static Tree.Exp relabelDummyIndices(Tree.Exp e,
      NameGenerator generator) {
    e.freeIndices().labels().forEach(generator::reserve);
    return e.accept(new DummyRelabeler(generator));
  }

  /** Shuttle that renames free occurrences of an index label. */
  private static class Relabeler extends Shuttle {
    private final String from;
    private final String to;

    Relabeler(String from, String to) {
      this.from = from;
      this.to = to;
    }

    @Override protected Tree.Exp visit(Tree.TensorExp tensorExp) {
      final Tensor tensor = tensorExp.tensor;
      return tensorExp.copy(
          tensor.withIndices(tensor.indices.relabel(from, to)));
    }

    @Override protected Tree.Exp visit(Tree.OperatorExp operatorExp) {
      return operatorExp.copy(
          operatorExp.operator.withIndices(
              operatorExp.operator.indices.relabel(from, to)));
    }

    @Override protected Tree.Exp visit(Tree.ProductExp productExp) {
      final OperatorProduct product = productExp.product;
      return productExp.copy(
          new OperatorProduct(
              transformEager(product.operators,
                  o -> o.withIndices(o.indices.relabel(from, to))),
              product.coefficient, product.normalOrdered));
    }

    @Override protected Tree.Exp visit(Tree.Contraction contraction) {
      if (contraction.indices.containsLabel(from)) {
        return contraction; // "from" is bound here
      }
      return super.visit(contraction);
    }

    @Override protected Tree.Exp visit(Tree.IndexSum indexSum) {
      if (indexSum.index.label.equals(from)) {
        return indexSum; // "from" is bound here
      }
      return super.visit(indexSum);
    }
  }

  /** Shuttle that gives each summation index a fresh label, and renames
   * its occurrences within the scope of the sum. */
  private static class DummyRelabeler extends Shuttle {
    private final NameGenerator generator;
    private final ScopedMap<String, String> renames = new ScopedMap<>();

    DummyRelabeler(NameGenerator generator) {
      this.generator = generator;
    }

    private Index rename(Index index) {
      final String label = renames.getOpt(index.label);
      return label == null ? index : index.withLabel(label);
    }

    private IndexSet rename(IndexSet indices) {
      return indices.transform(this::rename);
    }

    @Override protected Tree.Exp visit(Tree.IndexSum indexSum) {
      final String label = generator.getUniqueName(indexSum.index.label);
      renames.scope();
      try {
        renames.put(indexSum.index.label, label);
        return indexSum.copy(indexSum.index.withLabel(label),
            indexSum.child.accept(this));
      } finally {
        renames.unscope();
      }
    }

    @Override protected Tree.Exp visit(Tree.TensorExp tensorExp) {
      final Tensor tensor = tensorExp.tensor;
      return tensorExp.copy(tensor.withIndices(rename(tensor.indices)));
    }

    @Override protected Tree.Exp visit(Tree.OperatorExp operatorExp) {
      return operatorExp.copy(
          operatorExp.operator.withIndices(
              rename(operatorExp.operator.indices)));
    }

    @Override protected Tree.Exp visit(Tree.ProductExp productExp) {
      final OperatorProduct product = productExp.product;
      return productExp.copy(
          new OperatorProduct(
              transformEager(product.operators,
                  o -> o.withIndices(rename(o.indices))),
              product.coefficient, product.normalOrdered));
    }

    @Override protected Tree.Exp visit(Tree.Contraction contraction) {
      final Tree.Exp left = contraction.left.accept(this);
      final Tree.Exp right = contraction.right.accept(this);
      final IndexSet indices = rename(contraction.indices);
      if (indices.equals(contraction.indices)) {
        return contraction.copy(left, right);
      }
      return tree.contract(left, right, indices);
    }
  }

  /** Visitor that collects every index label in an expression, free or
   * summed by repetition or contraction, except labels bound by an inner
   * {@link Tree.IndexSum}. */
  private static class LabelCollector extends Visitor {
    final Set<String> labels = new HashSet<>();

    @Override protected void visit(Tree.TensorExp tensorExp) {
      labels.addAll(tensorExp.tensor.indices.labels());
    }

    @Override protected void visit(Tree.OperatorExp operatorExp) {
      labels.addAll(operatorExp.operator.indices.labels());
    }

    @Override protected void visit(Tree.ProductExp productExp) {
      productExp.product.operators.forEach(o ->
          labels.addAll(o.indices.labels()));
    }

    @Override protected void visit(Tree.Contraction contraction) {
      labels.addAll(contraction.indices.labels());
      super.visit(contraction);
    }

    /** A label that an inner sum binds is not a repeated label of the
     * enclosing expression. */
    @Override protected void visit(Tree.IndexSum indexSum) {
      final LabelCollector inner = new LabelCollector();
      indexSum.child.accept(inner);
      inner.labels.remove(indexSum.index.label);
      labels.addAll(inner.labels);
    }
  }
}

// End TensorRules.java
