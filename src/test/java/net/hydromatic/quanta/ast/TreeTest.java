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
package net.hydromatic.quanta.ast;

import static net.hydromatic.quanta.ast.TreeBuilder.tree;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.Symbol;
import net.hydromatic.quanta.util.UserException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Tree}, {@link TreeBuilder}, {@link Shuttle} and
 * {@link Visitor}. */
public class TreeTest {
  private final Tree.Exp a = tree.symbol("a");
  private final Tree.Exp b = tree.symbol("b");
  private final Tree.Exp c = tree.symbol("c");
  private final Index i = Index.occupied("i");
  private final Index j = Index.occupied("j");
  private final Index k = Index.occupied("k");

  @Test void testUnparse() {
    assertThat(tree.add(a, b), hasToString("a + b"));
    assertThat(tree.multiply(tree.add(a, b), c), hasToString("(a + b) * c"));
    assertThat(tree.multiply(a, tree.subtract(b, c)),
        hasToString("a * (b - c)"));
    assertThat(tree.add(tree.multiply(a, b), c), hasToString("a * b + c"));
    assertThat(tree.power(a, tree.constant(2)), hasToString("a ^ 2"));
    assertThat(tree.divide(a, b), hasToString("a / b"));
    assertThat(tree.commutator(a, b), hasToString("[a, b]"));
    assertThat(tree.anticommutator(a, b), hasToString("{a, b}"));
    assertThat(tree.sum(), hasToString("0"));
    assertThat(tree.sum(ImmutableList.of(a, b), ImmutableList.of(1d, 2d)),
        hasToString("a + 2*b"));
    assertThat(
        tree.contract(tree.tensor("A", i, j), tree.tensor("B", j, k),
            IndexSet.of(j)),
        hasToString("contract(A[i,j], B[j,k]; j)"));
    assertThat(tree.indexSum(i, tree.tensor("t", i, i)),
        hasToString("sum(i, t[i,i])"));
    assertThat(tree.derivative(tree.multiply(a, b), new Symbol("a")),
        hasToString("d/da(a * b)"));
    assertThat(tree.integral(tree.symbol("f"), new Symbol("x")),
        hasToString("integral(f, x)"));
    final Operator operator =
        new Operator("a", IndexSet.of(Index.general("p")),
            Operator.Role.ANNIHILATION, Operator.Algebra.FERMION);
    assertThat(tree.vacuumExpectation(tree.operator(operator)),
        hasToString("vev(a[p])"));
    assertThat(tree.delta(i, j), hasToString("δ[i,j]"));
  }

  /** A sum is not parenthesized as an operand, so two different trees may
   * have the same text. */
  @Test void testUnparseSumOperand() {
    final Tree.Exp d = tree.symbol("d");
    final Tree.Exp x = tree.symbol("x");
    final Tree.Exp e1 =
        tree.multiply(tree.sum(tree.multiply(a, c), tree.multiply(a, d)), x);
    final Tree.Exp e2 =
        tree.sum(tree.multiply(a, c),
            tree.multiply(tree.multiply(a, d), x));
    assertThat(e1, hasToString("a * c + a * d * x"));
    assertThat(e2, hasToString("a * c + a * d * x"));
    assertThat(e1, not(e2));
  }

  @Test void testConstant() {
    assertThat(tree.constant(0.5), hasToString("0.5"));
    assertThat(tree.constant(2), hasToString("2"));
    assertThat(tree.constant(-1), hasToString("-1"));
    assertThat(tree.isZero(tree.zero()), is(true));
    assertThat(tree.isZero(tree.symbol("0")), is(false));
    assertThat(tree.isOne(tree.one()), is(true));
    assertThat(tree.scalarValue(tree.constant(0.25)), is(0.25));
    assertThat(tree.scalarValue(a), nullValue());
  }

  @Test void testEquality() {
    final Tree.Exp e = tree.multiply(tree.add(a, b), tree.tensor("t", i, j));
    final Tree.Exp copy = e.deepCopy();
    assertThat(copy, not(sameInstance(e)));
    assertThat(copy, is(e));
    assertThat(copy.hashCode(), is(e.hashCode()));
    assertThat(tree.add(a, b), not(tree.add(b, a)));
    assertThat(tree.add(a, b), not(tree.subtract(a, b)));
    final Tree.Exp commutator = tree.commutator(a, b);
    assertThat(commutator, not(tree.anticommutator(a, b)));
    assertThat(tree.sum(a, b),
        not(tree.sum(ImmutableList.of(a, b), ImmutableList.of(1d, 2d))));
  }

  @Test void testArgs() {
    final Tree.Binary e = tree.add(a, b);
    assertThat(e.args(), is(Arrays.asList(a, b)));
    assertThat(e.arg(1), sameInstance(b));
    assertThat(e.withArg(1, c), hasToString("a + c"));
    assertThat(e.withArgs(ImmutableList.of(a, b)), sameInstance(e));
    assertThat(a.args(), hasSize(0));

    final UserException e1 =
        assertThrows(UserException.class, () -> e.arg(2));
    assertThat(e1.getMessage(),
        is("child index 2 out of range for ADD with 2 children"));
    final UserException e2 =
        assertThrows(UserException.class, () -> a.withArg(0, b));
    assertThat(e2.getMessage(),
        is("cannot set child 0 of SYMBOL with 0 children"));
    final UserException e3 =
        assertThrows(UserException.class, () ->
            e.withArgs(ImmutableList.of(a)));
    assertThat(e3.getMessage(),
        is("ADD must have exactly 2 children, but has 1"));
    final UserException e4 =
        assertThrows(UserException.class, () ->
            tree.binary(Op.COMMUTATOR, a, b));
    assertThat(e4.getMessage(), is("not a binary operator: COMMUTATOR"));
    final UserException e5 =
        assertThrows(UserException.class, () ->
            tree.sum(ImmutableList.of(a, b), ImmutableList.of(1d)));
    assertThat(e5.getMessage(), is("sum has 2 terms but 1 coefficients"));
  }

  @Test void testDerivative() {
    final Symbol x = new Symbol("x");
    final Tree.Exp xExp = tree.symbol(x);
    assertThat(tree.multiply(xExp, xExp).derivative(x),
        hasToString("1 * x + x * 1"));
    assertThat(tree.add(xExp, a).derivative(x), hasToString("1 + 0"));
    assertThat(tree.power(xExp, tree.constant(2)).derivative(x),
        hasToString("0"));
    assertThat(tree.derivative(tree.subtract(xExp, a), x).evaluate(),
        hasToString("1 - 0"));
    assertThat(
        tree.sum(ImmutableList.of(xExp, a), ImmutableList.of(3d, 1d))
            .derivative(x),
        hasToString("3*1 + 0"));
  }

  @Test void testFreeIndices() {
    final Tree.Exp ta = tree.tensor("A", i, j);
    final Tree.Exp tb = tree.tensor("B", j, k);
    assertThat(ta.freeIndices(), hasToString("i,j"));
    assertThat(tree.multiply(ta, tb).freeIndices(), hasToString("i,k"));
    assertThat(tree.add(ta, tb).freeIndices(), hasToString("i,j,k"));
    assertThat(tree.contract(ta, tb, IndexSet.of(j)).freeIndices(),
        hasToString("i,k"));
    assertThat(tree.indexSum(j, ta).freeIndices(), hasToString("i"));
    assertThat(tree.tensor("t", i, i).freeIndices().isEmpty(), is(true));
    assertThat(a.freeIndices().isEmpty(), is(true));
  }

  @Test void testFind() {
    final Tree.Exp e =
        tree.add(tree.multiply(a, b), tree.commutator(c, tree.add(a, c)));
    final List<Tree.Exp> adds = e.find(Op.ADD);
    assertThat(adds, hasSize(2));
    assertThat(adds.get(0), sameInstance(e));
    assertThat(e.find(Op.SYMBOL), hasToString("[a, b, c, a, c]"));
    final List<Op> ops = new ArrayList<>();
    e.forEach(node -> ops.add(node.op));
    assertThat(ops.get(2), is(Op.SYMBOL));
    assertThat(ops, hasSize(9));
  }

  @Test void testShuttle() {
    final Tree.Exp e =
        tree.sum(tree.multiply(a, b), tree.vacuumExpectation(c),
            tree.indexSum(i, tree.derivative(a, new Symbol("x"))));
    final Shuttle renamer = new Shuttle() {
      @Override protected Tree.Exp visit(Tree.SymbolExp symbolExp) {
        return symbolExp.symbol.name.equals("a") ? tree.symbol("z")
            : symbolExp;
      }
    };
    final Tree.Exp e2 = e.accept(renamer);
    assertThat(e2, hasToString("z * b + vev(c) + sum(i, d/dx(z))"));
    assertThat(e, hasToString("a * b + vev(c) + sum(i, d/dx(a))"));

    // A shuttle that changes nothing returns the same tree
    assertThat(e.accept(new Shuttle()), sameInstance(e));
    assertThat(e2.accept(renamer), sameInstance(e2));
  }

  @Test void testVisitor() {
    final List<String> names = new ArrayList<>();
    final Visitor visitor = new Visitor() {
      @Override protected void visit(Tree.SymbolExp symbolExp) {
        names.add(symbolExp.symbol.name);
      }

      @Override protected void visit(Tree.TensorExp tensorExp) {
        names.add(tensorExp.tensor.name());
      }
    };
    tree.anticommutator(
            tree.contract(tree.tensor("A", i), tree.tensor("B", i),
                IndexSet.of(i)),
            tree.integral(tree.sum(a, b), new Symbol("x")))
        .accept(visitor);
    assertThat(names, hasToString("[A, B, a, b]"));
  }
}

// End TreeTest.java
