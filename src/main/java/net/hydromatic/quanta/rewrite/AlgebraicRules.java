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
 * Identity and zero laws, and constant folding.
 *
 * <p>Zero and one are scalar leaves whose value is exactly 0 or 1; there is
 * no tolerance.
 */
public class AlgebraicRules {
  private AlgebraicRules() {}

  /** {@code x + 0 = x}, {@code 0 + x = x}. */
  public static Tree.@Nullable Exp identityAddition(Tree.Exp e) {
    if (e.op != Op.ADD) {
      return null;
    }
    final Tree.Binary add = (Tree.Binary) e;
    if (tree.isZero(add.right)) {
      return add.left;
    }
    if (tree.isZero(add.left)) {
      return add.right;
    }
    return null;
  }

  /** {@code x * 1 = x}, {@code 1 * x = x}. */
  public static Tree.@Nullable Exp identityMultiplication(Tree.Exp e) {
    if (e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    if (tree.isOne(multiply.right)) {
      return multiply.left;
    }
    if (tree.isOne(multiply.left)) {
      return multiply.right;
    }
    return null;
  }

  /** {@code x * 0 = 0}, {@code 0 * x = 0}. */
  public static Tree.@Nullable Exp zeroMultiplication(Tree.Exp e) {
    if (e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    if (tree.isZero(multiply.left) || tree.isZero(multiply.right)) {
      return tree.zero();
    }
    return null;
  }

  /** Folds the sum or product of two scalar leaves into one scalar
   * leaf. */
  public static Tree.@Nullable Exp combineConstants(Tree.Exp e) {
    if (e.op != Op.ADD && e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary binary = (Tree.Binary) e;
    final Double left = tree.scalarValue(binary.left);
    final Double right = tree.scalarValue(binary.right);
    if (left == null || right == null) {
      return null;
    }
    return tree.constant(e.op == Op.ADD ? left + right : left * right);
  }

  /** {@code x - x = 0}, {@code x + (-1 * x) = 0},
   * {@code (-1 * x) + x = 0}. Operands are compared structurally. */
  public static Tree.@Nullable Exp additiveInverse(Tree.Exp e) {
    switch (e.op) {
    case SUBTRACT:
      final Tree.Binary subtract = (Tree.Binary) e;
      return subtract.left.equals(subtract.right) ? tree.zero() : null;
    case ADD:
      final Tree.Binary add = (Tree.Binary) e;
      return isNegationOf(add.right, add.left)
          || isNegationOf(add.left, add.right)
          ? tree.zero()
          : null;
    default:
      return null;
    }
  }

  /** Returns whether {@code e} is {@code -1 * x}. */
  private static boolean isNegationOf(Tree.Exp e, Tree.Exp x) {
    if (e.op != Op.MULTIPLY) {
      return false;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    final Double c = tree.scalarValue(multiply.left);
    return c != null && c == -1d && multiply.right.equals(x);
  }

  /** {@code 0 ^ n = 0} if n is a positive constant. */
  public static Tree.@Nullable Exp zeroPower(Tree.Exp e) {
    if (e.op != Op.POWER) {
      return null;
    }
    final Tree.Binary power = (Tree.Binary) e;
    final Double n = tree.scalarValue(power.right);
    return tree.isZero(power.left) && n != null && n > 0d
        ? tree.zero()
        : null;
  }

  /** {@code 1 ^ x = 1}. */
  public static Tree.@Nullable Exp onePower(Tree.Exp e) {
    if (e.op != Op.POWER) {
      return null;
    }
    return tree.isOne(((Tree.Binary) e).left) ? tree.one() : null;
  }

  /** {@code x ^ 1 = x}. */
  public static Tree.@Nullable Exp powerOfOne(Tree.Exp e) {
    if (e.op != Op.POWER) {
      return null;
    }
    final Tree.Binary power = (Tree.Binary) e;
    return tree.isOne(power.right) ? power.left : null;
  }

  /** {@code x ^ 0 = 1}. */
  public static Tree.@Nullable Exp zeroExponent(Tree.Exp e) {
    if (e.op != Op.POWER) {
      return null;
    }
    return tree.isZero(((Tree.Binary) e).right) ? tree.one() : null;
  }

  /** {@code (x ^ m) ^ n = x ^ (m * n)}. */
  public static Tree.@Nullable Exp powerOfPower(Tree.Exp e) {
    if (e.op != Op.POWER) {
      return null;
    }
    final Tree.Binary outer = (Tree.Binary) e;
    if (outer.left.op != Op.POWER) {
      return null;
    }
    final Tree.Binary inner = (Tree.Binary) outer.left;
    return tree.power(inner.left,
        combine(Op.MULTIPLY, inner.right, outer.right));
  }

  /** {@code x ^ m * x ^ n = x ^ (m + n)}. Bases are compared
   * structurally. */
  public static Tree.@Nullable Exp productOfPowers(Tree.Exp e) {
    if (e.op != Op.MULTIPLY) {
      return null;
    }
    final Tree.Binary multiply = (Tree.Binary) e;
    if (multiply.left.op != Op.POWER || multiply.right.op != Op.POWER) {
      return null;
    }
    final Tree.Binary left = (Tree.Binary) multiply.left;
    final Tree.Binary right = (Tree.Binary) multiply.right;
    if (!left.left.equals(right.left)) {
      return null;
    }
    return tree.power(left.left, combine(Op.ADD, left.right, right.right));
  }

  /** Adds or multiplies two exponents, folding them if both are
   * constants. */
  private static Tree.Exp combine(Op op, Tree.Exp left, Tree.Exp right) {
    final Double m = tree.scalarValue(left);
    final Double n = tree.scalarValue(right);
    if (m != null && n != null) {
      return tree.constant(op == Op.ADD ? m + n : m * n);
    }
    return tree.binary(op, left, right);
  }

  /** Replaces {@code d/dx(e)} by the derivative of e with respect to x. */
  public static Tree.@Nullable Exp evaluateDerivative(Tree.Exp e) {
    if (e.op != Op.DERIVATIVE) {
      return null;
    }
    return ((Tree.Derivative) e).evaluate();
  }
}

// End AlgebraicRules.java
