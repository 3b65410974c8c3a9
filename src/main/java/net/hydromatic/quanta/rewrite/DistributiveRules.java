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

import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Distribution of multiplication over addition and subtraction, and
 * factoring.
 *
 * <p>These rules recognize binary {@link Op#ADD} and {@link Op#SUBTRACT}
 * nodes only. An n-ary {@link Tree.Sum} is not distributed over.
 */
public class DistributiveRules {
  private DistributiveRules() {}

  /** Expands {@code (a + b) * (c + d)} to the sum
   * {@code a * c + a * d + b * c + b * d}, and {@code (a + b) * c} and
   * {@code a * (b + c)} to two-term sums. */
  public static Tree.@Nullable Exp distributeMultiplication(Tree.Exp e) {
    if (e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    final Tree.Exp left = multiply.left;
    final Tree.Exp right = multiply.right;
    if (left.op == Op.ADD && right.op == Op.ADD) {
      final Tree.Binary l = (Tree.Binary) left;
      final Tree.Binary r = (Tree.Binary) right;
      return tree.sum(tree.multiply(l.left, r.left),
          tree.multiply(l.left, r.right),
          tree.multiply(l.right, r.left),
          tree.multiply(l.right, r.right));
    }
    if (left.op == Op.ADD) {
      final Tree.Binary l = (Tree.Binary) left;
      return tree.sum(tree.multiply(l.left, right),
          tree.multiply(l.right, right));
    }
    if (right.op == Op.ADD) {
      final Tree.Binary r = (Tree.Binary) right;
      return tree.sum(tree.multiply(left, r.left),
          tree.multiply(left, r.right));
    }
    return null;
  }

  /** {@code a * x + b * x = (a + b) * x};
   * {@code x * a + x * b = x * (a + b)}. */
  public static Tree.@Nullable Exp factorCommonTerms(Tree.Exp e) {
    if (e.op != Op.ADD) {
      return null;
    }
    final Tree.Binary add = (Tree.Binary) e;
    if (add.left.op != Op.MULTIPLY || add.right.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary l = (Tree.Binary) add.left;
    final Tree.Binary r = (Tree.Binary) add.right;
    if (l.right.equals(r.right)) {
      return tree.multiply(tree.add(l.left, r.left), l.right);
    }
    if (l.left.equals(r.left)) {
      return tree.multiply(l.left, tree.add(l.right, r.right));
    }
    return null;
  }

  /** {@code a * (b - c) = a * b - a * c};
   * {@code (a - b) * c = a * c - b * c}. */
  public static Tree.@Nullable Exp distributeOverSubtraction(Tree.Exp e) {
    if (e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    if (multiply.right.op == Op.SUBTRACT) {
      final Tree.Binary r = (Tree.Binary) multiply.right;
      return tree.subtract(tree.multiply(multiply.left, r.left),
          tree.multiply(multiply.left, r.right));
    }
    if (multiply.left.op == Op.SUBTRACT) {
      final Tree.Binary l = (Tree.Binary) multiply.left;
      return tree.subtract(tree.multiply(l.left, multiply.right),
          tree.multiply(l.right, multiply.right));
    }
    return null;
  }
}

// End DistributiveRules.java
