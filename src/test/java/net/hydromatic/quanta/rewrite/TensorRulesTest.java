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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Tensor;
import net.hydromatic.quanta.util.NameGenerator;
import org.junit.jupiter.api.Test;

/** Tests for {@link TensorRules}. */
public class TensorRulesTest {
  private final Index i = Index.occupied("i");
  private final Index j = Index.occupied("j");
  private final Index k = Index.occupied("k");
  private final Index va = Index.virtual("a");
  private final Index p = Index.general("p");

  @Test void testDeltaMixedKinds() {
    assertThat(TensorRules.contractKroneckerDelta(tree.delta(i, va)),
        hasToString("0"));
    assertThat(TensorRules.contractKroneckerDelta(tree.delta(va, i)),
        hasToString("0"));
    assertThat(TensorRules.contractKroneckerDelta(tree.delta(i, j)),
        nullValue());
    assertThat(TensorRules.contractKroneckerDelta(tree.delta(p, i)),
        nullValue());
    assertThat(TensorRules.contractKroneckerDelta(tree.tensor("t", i, va)),
        nullValue());
  }

  @Test void testDeltaContraction() {
    final Tree.Exp t = tree.tensor("t", j, va);
    assertThat(
        TensorRules.contractKroneckerDelta(
            tree.contract(tree.delta(i, j), t, IndexSet.of(j))),
        hasToString("t[i,a]"));
    assertThat(
        TensorRules.contractKroneckerDelta(
            tree.contract(t, tree.delta(i, j), IndexSet.of(j))),
        hasToString("t[i,a]"));
    assertThat(
        TensorRules.contractKroneckerDelta(tree.multiply(tree.delta(i, j), t)),
        hasToString("t[i,a]"));
    assertThat(
        TensorRules.contractKroneckerDelta(tree.multiply(t, tree.delta(j, k))),
        hasToString("t[k,a]"));
    // No index in common
    assertThat(
        TensorRules.contractKroneckerDelta(
            tree.multiply(tree.delta(i, k), t)),
        nullValue());
  }

  /** A delta is not eliminated if relabeling would capture a free index. */
  @Test void testDeltaCapture() {
    final Tree.Exp t = tree.tensor("t", i, j);
    assertThat(
        TensorRules.contractKroneckerDelta(
            tree.contract(tree.delta(i, j), t, IndexSet.of(j))),
        nullValue());
    // Both labels are summed, so the result is the trace of t
    assertThat(
        TensorRules.contractKroneckerDelta(tree.multiply(tree.delta(i, j), t)),
        hasToString("t[i,i]"));
  }

  @Test void testRelabel() {
    final Tree.Exp e =
        tree.add(tree.tensor("t", i, j), tree.indexSum(j, tree.tensor("u", j)));
    assertThat(TensorRules.relabel(e, "j", "k"),
        hasToString("t[i,k] + sum(j, u[j])"));
    final Tree.Exp c =
        tree.contract(tree.tensor("A", i, j), tree.tensor("B", j),
            IndexSet.of(j));
    assertThat(TensorRules.relabel(c, "j", "k"), sameInstance(c));
    assertThat(TensorRules.relabel(c, "i", "k"),
        hasToString("contract(A[k,j], B[j]; j)"));
  }

  @Test void testEinsteinSummation() {
    final Tree.Exp a = tree.tensor("A", i, j);
    final Tree.Exp b = tree.tensor("B", j, k);
    assertThat(TensorRules.einsteinSummation(tree.multiply(a, b)),
        hasToString("contract(A[i,j], B[j,k]; j)"));
    assertThat(
        TensorRules.einsteinSummation(
            tree.multiply(tree.tensor("A", i), tree.tensor("B", k))),
        nullValue());
    assertThat(
        TensorRules.einsteinSummation(tree.multiply(tree.symbol("x"), a)),
        nullValue());
    final Tree.Exp c = tree.contract(a, b, IndexSet.of(j));
    assertThat(
        TensorRules.einsteinSummation(
            tree.multiply(c, tree.tensor("C", k, i))),
        hasToString("contract(contract(A[i,j], B[j,k]; j), C[k,i]; i k)"));
  }

  @Test void testCollapseIndexSum() {
    final Tree.Exp product =
        tree.multiply(tree.tensor("A", i, j), tree.tensor("B", j, k));
    assertThat(TensorRules.collapseIndexSum(tree.indexSum(j, product)),
        hasToString("A[i,j] * B[j,k]"));
    final Tree.Exp x = tree.symbol("x");
    assertThat(
        TensorRules.collapseIndexSum(
            tree.indexSum(Index.occupied("m", 5), x)),
        hasToString("5 * x"));
    assertThat(TensorRules.collapseIndexSum(tree.indexSum(k, x)),
        nullValue());
    assertThat(
        TensorRules.collapseIndexSum(tree.indexSum(i, tree.tensor("t", i))),
        nullValue());

    // A label bound by a contraction is already summed
    final Tree.Exp contraction =
        tree.contract(tree.tensor("A", i, j), tree.tensor("B", j, k),
            IndexSet.of(j));
    assertThat(TensorRules.collapseIndexSum(tree.indexSum(j, contraction)),
        hasToString("contract(A[i,j], B[j,k]; j)"));

    // A label bound by an inner sum is not; the outer sum is over a
    // summand that does not depend on its index
    final Index m = Index.occupied("m", 5);
    final Tree.Exp inner = tree.indexSum(m, tree.tensor("A", m));
    assertThat(TensorRules.collapseIndexSum(tree.indexSum(m, inner)),
        hasToString("5 * sum(m, A[m])"));
    assertThat(TensorRules.collapseIndexSum(tree.indexSum(j, inner)),
        nullValue());
  }

  @Test void testSymmetricTensor() {
    final Tree.Exp s =
        tree.tensor(new Tensor("S", IndexSet.of(j, i), Tensor.Type.SYMMETRIC));
    assertThat(TensorRules.symmetricTensor(s), hasToString("S[i,j]"));
    assertThat(TensorRules.symmetricTensor(tree.delta(j, i)),
        hasToString("δ[i,j]"));
    assertThat(TensorRules.symmetricTensor(tree.delta(i, j)), nullValue());
    assertThat(TensorRules.symmetricTensor(tree.tensor("t", j, i)),
        nullValue());
  }

  @Test void testAntisymmetricTensor() {
    assertThat(TensorRules.antisymmetricTensor(antisymmetric(j, i)),
        hasToString("-1 * A[i,j]"));
    assertThat(TensorRules.antisymmetricTensor(antisymmetric(i, j)),
        nullValue());
    assertThat(TensorRules.antisymmetricTensor(antisymmetric(k, i, j)),
        hasToString("A[i,j,k]"));
    assertThat(TensorRules.antisymmetricTensor(antisymmetric(i, va, i)),
        hasToString("0"));
  }

  private static Tree.Exp antisymmetric(Index... indices) {
    return tree.tensor(
        new Tensor("A", IndexSet.of(indices), Tensor.Type.ANTISYMMETRIC));
  }

  @Test void testRelabelDummyIndices() {
    final Tree.Exp e =
        tree.add(tree.indexSum(j, tree.tensor("t", j)),
            tree.indexSum(j, tree.tensor("u", i, j)));
    assertThat(
        TensorRules.relabelDummyIndices(e,
            new NameGenerator(ImmutableList.of("i"))),
        hasToString("sum(j, t[j]) + sum(j1, u[i,j1])"));

    // An inner sum over the same label shadows the outer one
    final Tree.Exp nested =
        tree.indexSum(i,
            tree.multiply(tree.tensor("v", i),
                tree.indexSum(i, tree.tensor("t", i))));
    assertThat(TensorRules.relabelDummyIndices(nested, new NameGenerator()),
        hasToString("sum(i, v[i] * sum(i1, t[i1]))"));

    // A reserved label is not reused
    assertThat(
        TensorRules.relabelDummyIndices(
            tree.indexSum(j, tree.tensor("t", j, k)),
            new NameGenerator(ImmutableList.of("j", "k"))),
        hasToString("sum(j1, t[j1,k])"));

    // Nothing to rename
    final Tree.Exp c =
        tree.indexSum(j,
            tree.contract(tree.tensor("A", j, k), tree.tensor("B", k),
                IndexSet.of(k)));
    assertThat(TensorRules.relabelDummyIndices(c, new NameGenerator()),
        sameInstance(c));

    // A fresh label does not capture a free index
    final Index j1 = Index.occupied("j1");
    final Tree.Exp e2 =
        tree.add(tree.indexSum(j, tree.tensor("t", j)),
            tree.indexSum(j, tree.tensor("u", j, j1)));
    assertThat(TensorRules.relabelDummyIndices(e2, new NameGenerator()),
        hasToString("sum(j, t[j]) + sum(j2, u[j2,j1])"));
  }
}

// End TensorRulesTest.java
