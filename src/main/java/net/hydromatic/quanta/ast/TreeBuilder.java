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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.quanta.util.Static.formatNumber;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.hydromatic.quanta.algebra.TensorFactory;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.ScalarSymbol;
import net.hydromatic.quanta.model.Symbol;
import net.hydromatic.quanta.model.Tensor;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Creates expression nodes, and answers questions about constants. */
public enum TreeBuilder {
  /** The instance. Lower-case so that {@code tree.add(a, b)} reads well
   * after a static import. */
  // CHECKSTYLE: IGNORE 1
  tree;

  /** Name of the function that takes the vacuum expectation value. */
  public static final String VEV = "vev";

  /** Name of the function that takes the complex conjugate. */
  public static final String CONJ = "conj";

  /** Name of the function that applies the particle-hole transformation. */
  public static final String PARTICLE_HOLE = "ph";

  // leaves

  public Tree.SymbolExp symbol(Symbol symbol) {
    return new Tree.SymbolExp(symbol);
  }

  /** Creates a leaf for a variable. */
  public Tree.SymbolExp symbol(String name) {
    return symbol(new Symbol(name));
  }

  public Tree.TensorExp tensor(Tensor tensor) {
    return new Tree.TensorExp(tensor);
  }

  /** Creates a general tensor leaf. */
  public Tree.TensorExp tensor(String name, Index... indices) {
    return tensor(new Tensor(name, IndexSet.of(indices)));
  }

  /** Creates a Kronecker delta leaf, "δ[i,j]". */
  public Tree.TensorExp delta(Index i, Index j) {
    return tensor(TensorFactory.kroneckerDelta(i, j));
  }

  public Tree.OperatorExp operator(Operator operator) {
    return new Tree.OperatorExp(operator);
  }

  public Tree.ProductExp product(OperatorProduct product) {
    return new Tree.ProductExp(product);
  }

  /** Returns the constant 0. */
  public Tree.SymbolExp zero() {
    return constant(0d);
  }

  /** Returns the constant 1. */
  public Tree.SymbolExp one() {
    return constant(1d);
  }

  /** Returns a scalar constant, named after its value; for example
   * {@code constant(0.5)} is named "0.5". */
  public Tree.SymbolExp constant(double value) {
    return symbol(new ScalarSymbol(formatNumber(value), value));
  }

  // operators

  public Tree.Binary binary(Op op, Tree.Exp left, Tree.Exp right) {
    return new Tree.Binary(op, left, right);
  }

  public Tree.Binary add(Tree.Exp left, Tree.Exp right) {
    return binary(Op.ADD, left, right);
  }

  public Tree.Binary subtract(Tree.Exp left, Tree.Exp right) {
    return binary(Op.SUBTRACT, left, right);
  }

  public Tree.Binary multiply(Tree.Exp left, Tree.Exp right) {
    return binary(Op.MULTIPLY, left, right);
  }

  public Tree.Binary divide(Tree.Exp left, Tree.Exp right) {
    return binary(Op.DIVIDE, left, right);
  }

  public Tree.Binary power(Tree.Exp base, Tree.Exp exponent) {
    return binary(Op.POWER, base, exponent);
  }

  public Tree.Commutator commutator(Tree.Exp left, Tree.Exp right) {
    return new Tree.Commutator(left, right);
  }

  public Tree.Anticommutator anticommutator(Tree.Exp left, Tree.Exp right) {
    return new Tree.Anticommutator(left, right);
  }

  public Tree.Contraction contract(
      Tree.Exp left, Tree.Exp right, IndexSet indices) {
    return new Tree.Contraction(left, right, indices);
  }

  // aggregates

  /** Creates a sum whose coefficients are all 1. */
  public Tree.Sum sum(List<? extends Tree.Exp> terms) {
    return sum(terms, Collections.nCopies(terms.size(), 1d));
  }

  public Tree.Sum sum(Tree.Exp... terms) {
    return sum(Arrays.asList(terms));
  }

  public Tree.Sum sum(
      List<? extends Tree.Exp> terms, List<Double> coefficients) {
    return new Tree.Sum(
        ImmutableList.copyOf(terms), ImmutableList.copyOf(coefficients));
  }

  public Tree.IndexSum indexSum(Index index, Tree.Exp child) {
    return new Tree.IndexSum(index, child);
  }

  // calculus

  public Tree.Derivative derivative(Tree.Exp child, Symbol var) {
    return new Tree.Derivative(child, var);
  }

  public Tree.Integral integral(Tree.Exp child, Symbol var) {
    return new Tree.Integral(child, var);
  }

  // function calls

  public Tree.Call call(String name, List<? extends Tree.Exp> args) {
    checkArgument(!name.isEmpty(), "function name must not be empty");
    return new Tree.Call(name, ImmutableList.copyOf(args));
  }

  public Tree.Call call(String name, Tree.Exp... args) {
    return call(name, Arrays.asList(args));
  }

  /** Creates "vev(e)", the vacuum expectation value of e. */
  public Tree.Call vacuumExpectation(Tree.Exp e) {
    return call(VEV, e);
  }

  /** Creates "conj(e)", the complex conjugate of e. */
  public Tree.Call conjugate(Tree.Exp e) {
    return call(CONJ, e);
  }

  /** Creates "ph(e)", the particle-hole transform of e. */
  public Tree.Call particleHole(Tree.Exp e) {
    return call(PARTICLE_HOLE, e);
  }

  // predicates

  /** Returns the value of a scalar leaf, or null if the expression is not a
   * scalar leaf. */
  public @Nullable Double scalarValue(Tree.Exp e) {
    if (e.op == Op.SYMBOL) {
      final Symbol symbol = ((Tree.SymbolExp) e).symbol;
      if (symbol instanceof ScalarSymbol) {
        return ((ScalarSymbol) symbol).value;
      }
    }
    return null;
  }

  /** Returns whether an expression is a scalar leaf whose value is exactly
   * 0. */
  public boolean isZero(Tree.Exp e) {
    final Double value = scalarValue(e);
    return value != null && value == 0d;
  }

  /** Returns whether an expression is a scalar leaf whose value is exactly
   * 1. */
  public boolean isOne(Tree.Exp e) {
    final Double value = scalarValue(e);
    return value != null && value == 1d;
  }
}

// End TreeBuilder.java
