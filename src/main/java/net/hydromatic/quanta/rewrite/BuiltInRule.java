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

import com.google.common.collect.ImmutableList;
import java.util.function.Function;
import net.hydromatic.quanta.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in rewrite rules.
 *
 * <p>Within a category, constants are declared in the order in which a
 * {@link Simplifier} tries them. Rules whose {@code registered} flag is
 * false are not in a simplifier's default rule lists, but can be added via
 * {@link Simplifier#addRule(Rule)}.
 *
 * <p>{@link #CANONICAL_RELATIONS} belongs to the commutator category, and
 * precedes {@link #EXPAND_COMMUTATOR}, so that a commutator of elementary
 * boson operators reduces to a delta instead of being expanded.
 */
public enum BuiltInRule implements Rule {
  IDENTITY_ADDITION(Category.ALGEBRAIC, true,
      AlgebraicRules::identityAddition),
  IDENTITY_MULTIPLICATION(Category.ALGEBRAIC, true,
      AlgebraicRules::identityMultiplication),
  ZERO_MULTIPLICATION(Category.ALGEBRAIC, true,
      AlgebraicRules::zeroMultiplication),
  COMBINE_CONSTANTS(Category.ALGEBRAIC, true,
      AlgebraicRules::combineConstants),
  ADDITIVE_INVERSE(Category.ALGEBRAIC, true,
      AlgebraicRules::additiveInverse),
  ZERO_POWER(Category.ALGEBRAIC, true, AlgebraicRules::zeroPower),
  ONE_POWER(Category.ALGEBRAIC, true, AlgebraicRules::onePower),
  POWER_OF_ONE(Category.ALGEBRAIC, true, AlgebraicRules::powerOfOne),
  ZERO_EXPONENT(Category.ALGEBRAIC, true, AlgebraicRules::zeroExponent),
  POWER_OF_POWER(Category.ALGEBRAIC, true, AlgebraicRules::powerOfPower),
  PRODUCT_OF_POWERS(Category.ALGEBRAIC, true,
      AlgebraicRules::productOfPowers),
  EVALUATE_DERIVATIVE(Category.ALGEBRAIC, false,
      AlgebraicRules::evaluateDerivative),

  DISTRIBUTE_MULTIPLICATION(Category.DISTRIBUTIVE, true,
      DistributiveRules::distributeMultiplication),
  FACTOR_COMMON_TERMS(Category.DISTRIBUTIVE, true,
      DistributiveRules::factorCommonTerms),
  DISTRIBUTE_OVER_SUBTRACTION(Category.DISTRIBUTIVE, true,
      DistributiveRules::distributeOverSubtraction),

  ANTISYMMETRY(Category.COMMUTATOR, true, CommutatorRules::antisymmetry),
  ZERO_COMMUTATOR(Category.COMMUTATOR, true, CommutatorRules::zeroCommutator),
  CANONICAL_RELATIONS(Category.COMMUTATOR, true,
      OperatorRules::canonicalRelations),
  LINEARITY_LEFT(Category.COMMUTATOR, true, CommutatorRules::linearityLeft),
  LINEARITY_RIGHT(Category.COMMUTATOR, true,
      CommutatorRules::linearityRight),
  EXPAND_COMMUTATOR(Category.COMMUTATOR, true,
      CommutatorRules::expandCommutator),
  EXPAND_ANTICOMMUTATOR(Category.COMMUTATOR, false,
      CommutatorRules::expandAnticommutator),

  KRONECKER_DELTA(Category.TENSOR, true, TensorRules::contractKroneckerDelta),
  EINSTEIN_SUMMATION(Category.TENSOR, true, TensorRules::einsteinSummation),
  COLLAPSE_INDEX_SUM(Category.TENSOR, true, TensorRules::collapseIndexSum),
  SYMMETRIC_TENSOR(Category.TENSOR, true, TensorRules::symmetricTensor),
  ANTISYMMETRIC_TENSOR(Category.TENSOR, true,
      TensorRules::antisymmetricTensor),

  VACUUM_EXPECTATION(Category.OPERATOR, true,
      OperatorRules::vacuumExpectation),
  FUSE_OPERATORS(Category.OPERATOR, true, OperatorRules::fuseOperators),
  EXPAND_NUMBER_OPERATOR(Category.OPERATOR, true,
      OperatorRules::expandNumberOperator),
  NORMAL_ORDER(Category.OPERATOR, true, OperatorRules::normalOrder),

  PERMUTATION_SYMMETRY(Category.SYMMETRY, true, SymmetryRules::permutation),
  TIME_REVERSAL(Category.SYMMETRY, true, SymmetryRules::timeReversal),
  PARTICLE_HOLE(Category.SYMMETRY, true, SymmetryRules::particleHole);

  private final Category category;

  /** Whether a new simplifier has this rule. */
  public final boolean registered;

  private final Function<Tree.Exp, Tree.@Nullable Exp> function;

  BuiltInRule(Category category, boolean registered,
      Function<Tree.Exp, Tree.@Nullable Exp> function) {
    this.category = category;
    this.registered = registered;
    this.function = function;
  }

  /** Returns the rules that a new simplifier has in a given category, in
   * the order it tries them. */
  public static ImmutableList<Rule> defaults(Category category) {
    final ImmutableList.Builder<Rule> b = ImmutableList.builder();
    for (BuiltInRule rule : values()) {
      if (rule.category == category && rule.registered) {
        b.add(rule);
      }
    }
    return b.build();
  }

  @Override public Category category() {
    return category;
  }

  @Override public Tree.@Nullable Exp apply(Tree.Exp exp) {
    return function.apply(exp);
  }
}

// End BuiltInRule.java
