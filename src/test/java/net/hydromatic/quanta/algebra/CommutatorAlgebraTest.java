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

import static net.hydromatic.quanta.algebra.OperatorFactory.annihilation;
import static net.hydromatic.quanta.algebra.OperatorFactory.creation;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.OperatorSum;
import net.hydromatic.quanta.model.Tensor;
import net.hydromatic.quanta.util.UserException;
import org.junit.jupiter.api.Test;

/** Tests for {@link CommutatorAlgebra} and {@link OperatorFactory}. */
public class CommutatorAlgebraTest {
  private final Index p = Index.general("p");
  private final Index q = Index.general("q");

  private static Operator general(String name) {
    return new Operator(name, IndexSet.EMPTY, Operator.Role.GENERAL,
        Operator.Algebra.GENERAL);
  }

  @Test void testCommutator() {
    final OperatorSum c =
        CommutatorAlgebra.commutator(annihilation(p), creation(q));
    assertThat(c, hasToString("a[p] a†[q] + -1*a†[q] a[p]"));
    final OperatorSum ac =
        CommutatorAlgebra.anticommutator(annihilation(p), creation(q));
    assertThat(ac, hasToString("a[p] a†[q] + a†[q] a[p]"));

    // [A, A] = 0
    final Operator x = general("X");
    assertThat(CommutatorAlgebra.commutator(x, x).isZero(), is(true));
    assertThat(CommutatorAlgebra.anticommutator(x, x).combineLikeTerms(),
        hasToString("2*X X"));
  }

  @Test void testNestedCommutator() {
    final List<Operator> operators =
        ImmutableList.of(general("A"), general("B"), general("C"));
    assertThat(CommutatorAlgebra.nestedCommutator(operators),
        hasToString("A B C + -1*B A C + -1*C A B + C B A"));
    assertThat(
        CommutatorAlgebra.nestedCommutator(operators.subList(0, 2)),
        hasToString("A B + -1*B A"));

    final UserException e =
        assertThrows(UserException.class, () ->
            CommutatorAlgebra.nestedCommutator(operators.subList(0, 1)));
    assertThat(e.getMessage(),
        is("nested commutator needs at least 2 operators, got 1"));
  }

  @Test void testBchCoefficient() {
    assertThat(CommutatorAlgebra.bchCoefficient(0), is(1d));
    assertThat(CommutatorAlgebra.bchCoefficient(1), is(0.5d));
    assertThat(CommutatorAlgebra.bchCoefficient(2), closeTo(1d / 12, 1e-15));
    assertThat(CommutatorAlgebra.bchCoefficient(3), is(0d));
    assertThat(CommutatorAlgebra.bchCoefficient(4),
        closeTo(-1d / 720, 1e-15));
    assertThat(CommutatorAlgebra.bchCoefficient(5), is(0d));
    assertThat(CommutatorAlgebra.bchCoefficient(6),
        closeTo(1d / 30240, 1e-15));

    final UserException e =
        assertThrows(UserException.class, () ->
            CommutatorAlgebra.bchCoefficient(21));
    assertThat(e.getMessage(),
        is("BCH order must be between 0 and 20, got 21"));
  }

  @Test void testBchExpansion() {
    final List<OperatorSum> terms =
        CommutatorAlgebra.bchExpansion(general("A"), general("B"), 3);
    assertThat(terms, hasSize(4));
    assertThat(terms.get(0), hasToString("B"));
    assertThat(terms.get(1), hasToString("0.5*A B + -0.5*B A"));
    assertThat(terms.get(2).size(), is(4));
    assertThat(terms.get(3), hasToString("0"));
  }

  @Test void testCanonical() {
    assertThat(
        CommutatorAlgebra.canonicalAnticommutation(annihilation(p),
            creation(q)),
        hasToString("δ[p,q]"));
    assertThat(
        CommutatorAlgebra.canonicalAnticommutation(annihilation(p),
            creation(p)),
        hasToString("1"));
    assertThat(CommutatorAlgebra.canonicalCommutation(general("x"),
            general("p")),
        hasToString("i * ħ"));
    assertThrows(UserException.class, () ->
        CommutatorAlgebra.canonicalAnticommutation(general("A"),
            creation(q)));
  }

  @Test void testIsZeroCommutator() {
    final Operator b1 = annihilation(p, Operator.Algebra.BOSON);
    final Operator b2 = annihilation(q, Operator.Algebra.BOSON);
    assertThat(CommutatorAlgebra.isZeroCommutator(b1, b2), is(true));
    assertThat(CommutatorAlgebra.isZeroCommutator(b1, b1.adjoint()),
        is(false));
    assertThat(
        CommutatorAlgebra.isZeroCommutator(annihilation(p), creation(q)),
        is(false));
    assertThat(
        CommutatorAlgebra.isZeroCommutator(general("A"), general("A")),
        is(true));
    assertThat(
        CommutatorAlgebra.isZeroCommutator(general("A"), general("B")),
        is(false));
  }

  @Test void testFactory() {
    final Index i = Index.occupied("i");
    final Index j = Index.occupied("j");
    final Index a = Index.virtual("a");
    final Index b = Index.virtual("b");
    assertThat(OperatorFactory.singleExcitation(i, a),
        hasToString("a†[a] a[i]"));
    assertThat(OperatorFactory.doubleExcitation(i, j, a, b),
        hasToString("a†[a] a†[b] a[j] a[i]"));
    final Tensor h = TensorFactory.oneElectronIntegral("h", p, q);
    assertThat(h.type, is(Tensor.Type.HERMITIAN));
    assertThat(OperatorFactory.oneBodyOperator(h),
        hasToString("h[p,q] * a†[p] a[q]"));
    final Index r = Index.general("r");
    final Index s = Index.general("s");
    assertThat(
        OperatorFactory.twoBodyOperator(
            TensorFactory.twoElectronIntegral("g", p, q, r, s)),
        hasToString("g[p,q,r,s] * 0.25*a†[p] a†[q] a[s] a[r]"));
    assertThat(TensorFactory.amplitudeDoubles(i, j, a, b).type,
        is(Tensor.Type.ANTISYMMETRIC));
    assertThat(OperatorFactory.spinPlus().adjoint(), hasToString("S+†"));

    final UserException e =
        assertThrows(UserException.class, () ->
            OperatorFactory.oneBodyOperator(
                TensorFactory.amplitudeDoubles(i, j, a, b)));
    assertThat(e.getMessage(),
        is("one-body operator needs a rank-2 tensor, got t2[i,j,a,b]"));
  }

  @Test void testClusterOperator() {
    final Index i = Index.occupied("i");
    final Index j = Index.occupied("j");
    final Index a = Index.virtual("a");
    final Index b = Index.virtual("b");
    final Tensor t1 = TensorFactory.amplitudeSingles(i, a);
    final Tensor t2 = TensorFactory.amplitudeDoubles(i, j, a, b);
    assertThat(OperatorFactory.clusterSingles(t1),
        hasToString("t1[i,a] * a†[a] a[i]"));
    assertThat(OperatorFactory.clusterDoubles(t2),
        hasToString("t2[i,j,a,b] * 0.25*a†[a] a†[b] a[j] a[i]"));
    assertThat(OperatorFactory.clusterOperator(ImmutableList.of(t1, t2)),
        hasToString("t1[i,a] * a†[a] a[i]"
            + " + t2[i,j,a,b] * 0.25*a†[a] a†[b] a[j] a[i]"));
    assertThat(OperatorFactory.clusterOperator(ImmutableList.of()),
        hasToString("0"));

    final UserException e =
        assertThrows(UserException.class, () ->
            OperatorFactory.clusterOperator(
                ImmutableList.of(new Tensor("t3", IndexSet.of(i)))));
    assertThat(e.getMessage(),
        is("cluster amplitude must have rank 2 or 4, got t3[i]"));
    assertThrows(UserException.class, () -> OperatorFactory.clusterDoubles(t1));
  }
}

// End CommutatorAlgebraTest.java
