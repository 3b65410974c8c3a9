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
import static net.hydromatic.quanta.util.Static.transformEager;

import java.util.List;
import java.util.function.Function;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rules for commutators and anticommutators. */
public class CommutatorRules {
  private CommutatorRules() {}

  /** Placeholder for {@code [A, B] = -[B, A]}. It never rewrites, because
   * either form is as simple as the other. */
  public static Tree.@Nullable Exp antisymmetry(Tree.Exp e) {
    return null;
  }

  /** {@code [A, A] = 0}. Operands are compared structurally. */
  public static Tree.@Nullable Exp zeroCommutator(Tree.Exp e) {
    if (e.op != Op.COMMUTATOR) {
      return null;
    }
    final Tree.Commutator commutator = (Tree.Commutator) e;
    return commutator.left.equals(commutator.right) ? tree.zero() : null;
  }

  /** {@code [A + B, C] = [A, C] + [B, C]}, and likewise for a difference,
   * a sum of terms, and a scalar multiple {@code [c * A, C] = c * [A, C]}.
   * Applies to anticommutators too. */
  public static Tree.@Nullable Exp linearityLeft(Tree.Exp e) {
    if (e.op != Op.COMMUTATOR && e.op != Op.ANTICOMMUTATOR) {
      return null;
    }
    final List<Tree.Exp> args = e.args();
    final Tree.Exp right = args.get(1);
    return expand(args.get(0), a -> bracket(e.op, a, right));
  }

  /** {@code [A, B + C] = [A, B] + [A, C]}, and likewise for a difference,
   * a sum of terms, and a scalar multiple. Applies to anticommutators
   * too. */
  public static Tree.@Nullable Exp linearityRight(Tree.Exp e) {
    if (e.op != Op.COMMUTATOR && e.op != Op.ANTICOMMUTATOR) {
      return null;
    }
    final List<Tree.Exp> args = e.args();
    final Tree.Exp left = args.get(0);
    return expand(args.get(1), a -> bracket(e.op, left, a));
  }

  private static Tree.Exp bracket(Op op, Tree.Exp left, Tree.Exp right) {
    return op == Op.COMMUTATOR
        ? tree.commutator(left, right)
        : tree.anticommutator(left, right);
  }

  /** Applies a linear function to an argument that is a sum, difference or
   * scalar multiple; returns null if the argument is none of these. */
  private static Tree.@Nullable Exp expand(Tree.Exp arg,
      Function<Tree.Exp, Tree.Exp> f) {
    switch (arg.op) {
    case ADD:
    case SUBTRACT:
      final Tree.Binary binary = (Tree.Binary) arg;
      return tree.binary(arg.op, f.apply(binary.left),
          f.apply(binary.right));
    case SUM:
      final Tree.Sum sum = (Tree.Sum) arg;
      return tree.sum(transformEager(sum.terms, f), sum.coefficients);
    case MULTIPLY:
      final Tree.Binary multiply = (Tree.Binary) arg;
      if (tree.scalarValue(multiply.left) == null) {
        return null;
      }
      return tree.multiply(multiply.left, f.apply(multiply.right));
    default:
      return null;
    }
  }

  /** {@code [A, B] = A * B - B * A}. */
  public static Tree.@Nullable Exp expandCommutator(Tree.Exp e) {
    if (e.op != Op.COMMUTATOR) {
      return null;
    }
    final Tree.Commutator c = (Tree.Commutator) e;
    return tree.subtract(tree.multiply(c.left, c.right),
        tree.multiply(c.right, c.left));
  }

  /** {@code {A, B} = A * B + B * A}. */
  public static Tree.@Nullable Exp expandAnticommutator(Tree.Exp e) {
    if (e.op != Op.ANTICOMMUTATOR) {
      return null;
    }
    final Tree.Anticommutator a = (Tree.Anticommutator) e;
    return tree.add(tree.multiply(a.left, a.right),
        tree.multiply(a.right, a.left));
  }
}

// End CommutatorRules.java
