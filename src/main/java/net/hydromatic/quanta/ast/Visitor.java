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

/** Visits expression trees. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Tree.Exp e) {
    e.accept(this);
  }

  // leaves

  protected void visit(Tree.SymbolExp symbolExp) {}

  protected void visit(Tree.TensorExp tensorExp) {}

  protected void visit(Tree.OperatorExp operatorExp) {}

  protected void visit(Tree.ProductExp productExp) {}

  // operators

  protected void visit(Tree.Binary binary) {
    binary.left.accept(this);
    binary.right.accept(this);
  }

  protected void visit(Tree.Commutator commutator) {
    commutator.left.accept(this);
    commutator.right.accept(this);
  }

  protected void visit(Tree.Anticommutator anticommutator) {
    anticommutator.left.accept(this);
    anticommutator.right.accept(this);
  }

  protected void visit(Tree.Contraction contraction) {
    contraction.left.accept(this);
    contraction.right.accept(this);
  }

  // aggregates

  protected void visit(Tree.Sum sum) {
    sum.terms.forEach(this::accept);
  }

  protected void visit(Tree.IndexSum indexSum) {
    indexSum.child.accept(this);
  }

  // calculus

  protected void visit(Tree.Derivative derivative) {
    derivative.child.accept(this);
  }

  protected void visit(Tree.Integral integral) {
    integral.child.accept(this);
  }

  protected void visit(Tree.Call call) {
    call.args.forEach(this::accept);
  }
}

// End Visitor.java
