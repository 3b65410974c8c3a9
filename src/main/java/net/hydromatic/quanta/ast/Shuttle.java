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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms expression trees.
 *
 * <p>The default implementation of each {@code visit} method visits the
 * children of a node and, if any of them changed, returns a copy of the node
 * with the new children; otherwise it returns the node itself. Sub-classes
 * override the methods for the kinds of node they wish to rewrite.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected List<Tree.Exp> visitList(List<Tree.Exp> nodes) {
    final List<Tree.Exp> list = new ArrayList<>();
    for (Tree.Exp node : nodes) {
      list.add(node.accept(this));
    }
    return list;
  }

  // leaves

  protected Tree.Exp visit(Tree.SymbolExp symbolExp) {
    return symbolExp; // leaf
  }

  protected Tree.Exp visit(Tree.TensorExp tensorExp) {
    return tensorExp; // leaf
  }

  protected Tree.Exp visit(Tree.OperatorExp operatorExp) {
    return operatorExp; // leaf
  }

  protected Tree.Exp visit(Tree.ProductExp productExp) {
    return productExp; // leaf
  }

  // operators

  protected Tree.Exp visit(Tree.Binary binary) {
    return binary.copy(binary.left.accept(this), binary.right.accept(this));
  }

  protected Tree.Exp visit(Tree.Commutator commutator) {
    return commutator.copy(
        commutator.left.accept(this), commutator.right.accept(this));
  }

  protected Tree.Exp visit(Tree.Anticommutator anticommutator) {
    return anticommutator.copy(
        anticommutator.left.accept(this), anticommutator.right.accept(this));
  }

  protected Tree.Exp visit(Tree.Contraction contraction) {
    return contraction.copy(
        contraction.left.accept(this), contraction.right.accept(this));
  }

  // aggregates

  protected Tree.Exp visit(Tree.Sum sum) {
    return sum.copy(visitList(sum.terms));
  }

  protected Tree.Exp visit(Tree.IndexSum indexSum) {
    return indexSum.copy(indexSum.index, indexSum.child.accept(this));
  }

  // calculus

  protected Tree.Exp visit(Tree.Derivative derivative) {
    return derivative.copy(derivative.child.accept(this));
  }

  protected Tree.Exp visit(Tree.Integral integral) {
    return integral.copy(integral.child.accept(this));
  }

  protected Tree.Exp visit(Tree.Call call) {
    return call.copy(visitList(call.args));
  }
}

// End Shuttle.java
