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

import static net.hydromatic.quanta.algebra.OperatorFactory.annihilation;
import static net.hydromatic.quanta.algebra.OperatorFactory.creation;
import static net.hydromatic.quanta.ast.TreeBuilder.tree;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.model.ComplexSymbol;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.Symbol;
import net.hydromatic.quanta.model.Tensor;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymmetryRules}. */
public class SymmetryRulesTest {
  private final Tree.Exp x = tree.symbol("x");
  private final Tree.Exp y = tree.symbol("y");
  private final Index i = Index.occupied("i");
  private final Index a = Index.virtual("a");
  private final Symbol r = new Symbol("r");

  @Test void testPermutation() {
    assertThat(SymmetryRules.permutation(tree.sum(x, x)),
        hasToString("2 * x"));
    assertThat(
        SymmetryRules.permutation(
            tree.sum(Arrays.asList(x, y), Arrays.asList(1d, 0d))),
        hasToString("x"));
    assertThat(SymmetryRules.permutation(tree.sum(x, tree.sum(y, x))),
        hasToString("2*x + y"));
    assertThat(SymmetryRules.permutation(tree.sum(x, tree.zero())),
        hasToString("x"));
    assertThat(
        SymmetryRules.permutation(
            tree.sum(Arrays.asList(tree.multiply(tree.constant(2), x), x),
                Arrays.asList(0.5d, 1d))),
        hasToString("2 * x"));
    assertThat(
        SymmetryRules.permutation(
            tree.sum(x, tree.multiply(tree.constant(-1), x))),
        hasToString("0"));
    assertThat(SymmetryRules.permutation(tree.sum(ImmutableList.of())),
        hasToString("0"));

    // Nothing to merge.
    assertThat(SymmetryRules.permutation(tree.sum(x, y)), nullValue());
    assertThat(SymmetryRules.permutation(tree.add(x, x)), nullValue());
  }

  @Test void testTimeReversal() {
    assertThat(
        SymmetryRules.timeReversal(tree.conjugate(tree.conjugate(x))),
        hasToString("x"));
    assertThat(SymmetryRules.timeReversal(tree.conjugate(x)),
        hasToString("x"));
    assertThat(
        SymmetryRules.timeReversal(
            tree.conjugate(tree.symbol(new ComplexSymbol("z", 1, 2)))),
        hasToString("z*"));
    assertThat(
        SymmetryRules.timeReversal(
            tree.conjugate(tree.symbol(new ComplexSymbol("w", 3, 0)))),
        hasToString("w"));
    assertThat(
        SymmetryRules.timeReversal(
            tree.conjugate(tree.symbol(new Symbol("u", Symbol.Kind.COMPLEX)))),
        nullValue());

    final Tensor complex =
        new Tensor(new Symbol("T", Symbol.Kind.COMPLEX), IndexSet.of(i),
            Tensor.Type.GENERAL);
    assertThat(SymmetryRules.timeReversal(tree.conjugate(tree.tensor(complex))),
        hasToString("T*[i]"));
    assertThat(
        SymmetryRules.timeReversal(tree.conjugate(tree.tensor("t", i))),
        hasToString("t[i]"));

    assertThat(SymmetryRules.timeReversal(tree.conjugate(tree.add(x, y))),
        hasToString("conj(x) + conj(y)"));
    assertThat(SymmetryRules.timeReversal(tree.conjugate(tree.sum(x, y))),
        hasToString("conj(x) + conj(y)"));
    assertThat(
        SymmetryRules.timeReversal(tree.conjugate(tree.vacuumExpectation(x))),
        nullValue());
    assertThat(SymmetryRules.timeReversal(x), nullValue());
  }

  @Test void testParticleHole() {
    final Tree.Exp t =
        SymmetryRules.particleHole(tree.particleHole(tree.tensor("t", i, a)));
    assertThat(t, hasToString("t[i,a]"));
    final Tensor tensor = ((Tree.TensorExp) t).tensor;
    assertThat(tensor.indices.get(0).kind, is(Index.Kind.VIRTUAL));
    assertThat(tensor.indices.get(1).kind, is(Index.Kind.OCCUPIED));

    assertThat(
        SymmetryRules.particleHole(
            tree.particleHole(tree.operator(creation(i)))),
        hasToString("a[i]"));
    assertThat(
        SymmetryRules.particleHole(
            tree.particleHole(
                tree.product(OperatorProduct.of(creation(a),
                    annihilation(i))))),
        hasToString("a[a] a†[i]"));

    final Tree.Exp sum =
        SymmetryRules.particleHole(
            tree.particleHole(tree.indexSum(i, tree.tensor("t", i))));
    assertThat(sum, hasToString("sum(i, t[i])"));
    assertThat(((Tree.IndexSum) sum).index.kind, is(Index.Kind.VIRTUAL));

    assertThat(SymmetryRules.particleHole(tree.particleHole(x)),
        hasToString("x"));
    assertThat(SymmetryRules.particleHole(tree.conjugate(x)), nullValue());
  }

  @Test void testPointGroup() {
    final Rule rule = SymmetryRules.pointGroup("D2h");
    assertThat(rule.name(), is("POINT_GROUP_D2H"));
    assertThat(rule.category(), is(Category.SYMMETRY));

    final Index p = Index.general("p");
    final Index q = Index.general("q");
    final Tree.Exp f = irrepTensor("f", "B1u", p);
    final Tree.Exp g = irrepTensor("g", "B1u", q);
    final Tree.Exp h = irrepTensor("h", "B2u", q);

    // B1u x B1u = Ag
    assertThat(rule.apply(tree.integral(tree.multiply(f, g), r)),
        nullValue());
    // B1u x B2u = B3g
    assertThat(rule.apply(tree.integral(tree.multiply(f, h), r)),
        hasToString("0"));
    assertThat(rule.apply(tree.integral(f, r)), hasToString("0"));
    assertThat(
        rule.apply(tree.integral(tree.multiply(f, tree.delta(p, q)), r)),
        hasToString("0"));

    // A tensor with no irrep, or no tensor at all
    assertThat(
        rule.apply(tree.integral(tree.multiply(f, tree.tensor("t", q)), r)),
        nullValue());
    assertThat(rule.apply(tree.integral(x, r)), nullValue());
    assertThat(rule.apply(tree.multiply(f, h)), nullValue());
  }

  @Test void testForGroup() {
    assertThat(SymmetryRules.forGroup("d2h"),
        hasToString("[PERMUTATION_SYMMETRY, TIME_REVERSAL, PARTICLE_HOLE,"
            + " POINT_GROUP_D2H]"));
  }

  private static Tree.Exp irrepTensor(String name, String irrep, Index i) {
    return tree.tensor(
        new Tensor(new Symbol(name).withProperty(Tensor.IRREP, irrep),
            IndexSet.of(i), Tensor.Type.GENERAL));
  }
}

// End SymmetryRulesTest.java
