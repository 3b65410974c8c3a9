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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quanta.ast.TreeBuilder.tree;
import static net.hydromatic.quanta.util.Diagnostics.checkUser;
import static net.hydromatic.quanta.util.Static.hashCombine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.Symbol;
import net.hydromatic.quanta.model.Tensor;
import net.hydromatic.quanta.util.Static;

/**
 * Expression tree.
 *
 * <p>Every node is immutable, and owns its children; a tree is never a DAG.
 * Transformations return a new tree. Use {@link TreeBuilder#tree} to create
 * nodes.
 *
 * <p>Two trees are {@link Object#equals equal} if they have the same shape and
 * equal leaves. The hash code of a node mixes the hash codes of its children
 * in order, so permuting the children usually changes the hash code.
 */
public class Tree {
  private Tree() {}

  /** Checks that a list of children has the right size for a node. */
  private static void checkArity(Op op, List<Exp> args, int arity) {
    checkUser(
        args.size() == arity,
        "args.size() == arity",
        "%s must have exactly %s children, but has %s",
        op,
        arity,
        args.size());
  }

  /** Abstract expression. */
  public abstract static class Exp {
    public final Op op;

    Exp(Op op) {
      this.op = requireNonNull(op);
    }

    /** Returns the children of this node, in order. */
    public List<Exp> args() {
      return ImmutableList.of();
    }

    /** Returns the {@code i}<sup>th</sup> child. */
    public Exp arg(int i) {
      final List<Exp> args = args();
      checkUser(
          i >= 0 && i < args.size(),
          "i >= 0 && i < args.size()",
          "child index %s out of range for %s with %s children",
          i,
          op,
          args.size());
      return args.get(i);
    }

    /** Returns a node of the same kind with different children.
     *
     * @throws net.hydromatic.quanta.util.UserException if the number of
     * children is wrong for this kind of node */
    public abstract Exp withArgs(List<Exp> args);

    /** Returns a node with its {@code i}<sup>th</sup> child replaced. */
    public Exp withArg(int i, Exp e) {
      final List<Exp> args = args();
      checkUser(
          i >= 0 && i < args.size(),
          "i >= 0 && i < args.size()",
          "cannot set child %s of %s with %s children",
          i,
          op,
          args.size());
      final List<Exp> list = new ArrayList<>(args);
      list.set(i, requireNonNull(e));
      return withArgs(list);
    }

    /** Returns a copy of this tree. Leaf domain values are copied too. */
    public abstract Exp deepCopy();

    /** Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
     * to the type of this node, and returning the result. */
    public abstract Exp accept(Shuttle shuttle);

    /** Accepts a visitor, calling the {@link Visitor#visit} method appropriate
     * to the type of this node. */
    public abstract void accept(Visitor visitor);

    abstract TreeWriter unparse(TreeWriter w);

    /** Converts this expression to infix text.
     *
     * <p>Marked final because you should override {@link #unparse}, not
     * toString. */
    @Override public final String toString() {
      return unparse(new TreeWriter()).toString();
    }

    /** Returns the derivative of this expression with respect to a variable.
     * By default, zero. */
    public Exp derivative(Symbol var) {
      return tree.zero();
    }

    /** Returns the indices that are free under the Einstein convention. An
     * index that occurs twice in a product is summed, and not free. */
    public abstract IndexSet freeIndices();

    /** Calls an action on this node and each of its descendants, in
     * pre-order. */
    public void forEach(Consumer<? super Exp> action) {
      action.accept(this);
      for (Exp arg : args()) {
        arg.forEach(action);
      }
    }

    /** Returns this node and its descendants whose op is {@code op}, in
     * pre-order. */
    public List<Exp> find(Op op) {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      forEach(e -> {
        if (e.op == op) {
          b.add(e);
        }
      });
      return b.build();
    }
  }

  /** Leaf whose value is a {@link Symbol}. */
  public static class SymbolExp extends Exp {
    public final Symbol symbol;

    SymbolExp(Symbol symbol) {
      super(Op.SYMBOL);
      this.symbol = requireNonNull(symbol);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 0);
      return this;
    }

    @Override public SymbolExp deepCopy() {
      return new SymbolExp(symbol.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append(symbol.name);
    }

    @Override public Exp derivative(Symbol var) {
      return symbol.equals(var) ? tree.one() : tree.zero();
    }

    @Override public IndexSet freeIndices() {
      return IndexSet.EMPTY;
    }

    @Override public int hashCode() {
      return hashCombine(op.ordinal(), symbol.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SymbolExp
          && symbol.equals(((SymbolExp) o).symbol);
    }
  }

  /** Leaf whose value is a {@link Tensor}. */
  public static class TensorExp extends Exp {
    public final Tensor tensor;

    TensorExp(Tensor tensor) {
      super(Op.TENSOR);
      this.tensor = requireNonNull(tensor);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 0);
      return this;
    }

    @Override public TensorExp deepCopy() {
      return new TensorExp(tensor.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append(tensor.toString());
    }

    @Override public IndexSet freeIndices() {
      return tensor.indices.unique();
    }

    /** Returns a leaf with a different tensor, or this if the tensor is the
     * same. */
    public TensorExp copy(Tensor tensor) {
      return tensor.equals(this.tensor) ? this : new TensorExp(tensor);
    }

    @Override public int hashCode() {
      return hashCombine(op.ordinal(), tensor.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TensorExp
          && tensor.equals(((TensorExp) o).tensor);
    }
  }

  /** Leaf whose value is an {@link Operator}. */
  public static class OperatorExp extends Exp {
    public final Operator operator;

    OperatorExp(Operator operator) {
      super(Op.OPERATOR);
      this.operator = requireNonNull(operator);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 0);
      return this;
    }

    @Override public OperatorExp deepCopy() {
      return new OperatorExp(operator.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append(operator.toString());
    }

    @Override public IndexSet freeIndices() {
      return operator.indices.unique();
    }

    public OperatorExp copy(Operator operator) {
      return operator.equals(this.operator) ? this : new OperatorExp(operator);
    }

    @Override public int hashCode() {
      return hashCombine(op.ordinal(), operator.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof OperatorExp
          && operator.equals(((OperatorExp) o).operator);
    }
  }

  /** Leaf whose value is an {@link OperatorProduct}. */
  public static class ProductExp extends Exp {
    public final OperatorProduct product;

    ProductExp(OperatorProduct product) {
      super(Op.OPERATOR_PRODUCT);
      this.product = requireNonNull(product);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 0);
      return this;
    }

    @Override public ProductExp deepCopy() {
      return new ProductExp(product.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append(product.toString());
    }

    @Override public IndexSet freeIndices() {
      IndexSet indices = IndexSet.EMPTY;
      for (Operator operator : product.operators) {
        indices = indices.plus(operator.indices);
      }
      return indices.unique();
    }

    public ProductExp copy(OperatorProduct product) {
      return product.equals(this.product) ? this : new ProductExp(product);
    }

    @Override public int hashCode() {
      return hashCombine(op.ordinal(), product.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ProductExp
          && product.equals(((ProductExp) o).product);
    }
  }

  /** Call to an infix operator: add, subtract, multiply, divide, or
   * power. */
  public static class Binary extends Exp {
    public final Exp left;
    public final Exp right;

    Binary(Op op, Exp left, Exp right) {
      super(op);
      checkUser(
          op.isBinary(), "op.isBinary()", "not a binary operator: %s", op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(left, right);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 2);
      return copy(args.get(0), args.get(1));
    }

    public Binary copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : new Binary(op, left, right);
    }

    @Override public Binary deepCopy() {
      return new Binary(op, left.deepCopy(), right.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.infix(left, op, right);
    }

    /** {@inheritDoc}
     *
     * <p>Uses the sum rule for addition and subtraction and the product rule
     * for multiplication. Division and power are not differentiated. */
    @Override public Exp derivative(Symbol var) {
      switch (op) {
      case ADD:
        return tree.add(left.derivative(var), right.derivative(var));
      case SUBTRACT:
        return tree.subtract(left.derivative(var), right.derivative(var));
      case MULTIPLY:
        return tree.add(
            tree.multiply(left.derivative(var), right),
            tree.multiply(left, right.derivative(var)));
      default:
        return tree.zero();
      }
    }

    @Override public IndexSet freeIndices() {
      if (op.isAdditive()) {
        return left.freeIndices().union(right.freeIndices());
      }
      return left.freeIndices().plus(right.freeIndices()).unique();
    }

    @Override public int hashCode() {
      return hashCombine(
          hashCombine(op.ordinal(), left.hashCode()), right.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
          && op == ((Binary) o).op
          && left.equals(((Binary) o).left)
          && right.equals(((Binary) o).right);
    }
  }

  /** Commutator "[A, B]", which is equal to "A * B - B * A". */
  public static class Commutator extends Exp {
    public final Exp left;
    public final Exp right;

    Commutator(Exp left, Exp right) {
      super(Op.COMMUTATOR);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(left, right);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 2);
      return copy(args.get(0), args.get(1));
    }

    public Commutator copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : new Commutator(left, right);
    }

    @Override public Commutator deepCopy() {
      return new Commutator(left.deepCopy(), right.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append("[").append(left).append(", ").append(right).append("]");
    }

    @Override public IndexSet freeIndices() {
      return left.freeIndices().plus(right.freeIndices()).unique();
    }

    @Override public int hashCode() {
      return hashCombine(
          hashCombine(op.ordinal(), left.hashCode()), right.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Commutator
          && left.equals(((Commutator) o).left)
          && right.equals(((Commutator) o).right);
    }
  }

  /** Anticommutator "{A, B}", which is equal to "A * B + B * A". */
  public static class Anticommutator extends Exp {
    public final Exp left;
    public final Exp right;

    Anticommutator(Exp left, Exp right) {
      super(Op.ANTICOMMUTATOR);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(left, right);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 2);
      return copy(args.get(0), args.get(1));
    }

    public Anticommutator copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : new Anticommutator(left, right);
    }

    @Override public Anticommutator deepCopy() {
      return new Anticommutator(left.deepCopy(), right.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append("{").append(left).append(", ").append(right).append("}");
    }

    @Override public IndexSet freeIndices() {
      return left.freeIndices().plus(right.freeIndices()).unique();
    }

    @Override public int hashCode() {
      return hashCombine(
          hashCombine(op.ordinal(), left.hashCode()), right.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Anticommutator
          && left.equals(((Anticommutator) o).left)
          && right.equals(((Anticommutator) o).right);
    }
  }

  /** Weighted sum of any number of terms; term {@code i} is multiplied by
   * {@code coefficients.get(i)}. */
  public static class Sum extends Exp {
    public final ImmutableList<Exp> terms;
    public final ImmutableList<Double> coefficients;

    Sum(ImmutableList<Exp> terms, ImmutableList<Double> coefficients) {
      super(Op.SUM);
      this.terms = requireNonNull(terms);
      this.coefficients = requireNonNull(coefficients);
      checkUser(
          terms.size() == coefficients.size(),
          "terms.size() == coefficients.size()",
          "sum has %s terms but %s coefficients",
          terms.size(),
          coefficients.size());
    }

    public double coefficient(int i) {
      return coefficients.get(i);
    }

    @Override public List<Exp> args() {
      return terms;
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, terms.size());
      return copy(args);
    }

    /** Returns a sum with different terms and the same coefficients. */
    public Sum copy(List<Exp> terms) {
      return Static.allIdentical(terms, this.terms)
          ? this
          : new Sum(ImmutableList.copyOf(terms), coefficients);
    }

    @Override public Sum deepCopy() {
      return new Sum(
          Static.transformEager(terms, Exp::deepCopy), coefficients);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      if (terms.isEmpty()) {
        return w.append("0");
      }
      for (int i = 0; i < terms.size(); i++) {
        if (i > 0) {
          w.append(" + ");
        }
        if (coefficient(i) != 1d) {
          w.append(coefficient(i)).append("*");
        }
        w.append(terms.get(i));
      }
      return w;
    }

    /** {@inheritDoc}
     *
     * <p>Differentiates term by term; the coefficients are unchanged. */
    @Override public Exp derivative(Symbol var) {
      return new Sum(
          Static.transformEager(terms, term -> term.derivative(var)),
          coefficients);
    }

    @Override public IndexSet freeIndices() {
      IndexSet indices = IndexSet.EMPTY;
      for (Exp term : terms) {
        indices = indices.union(term.freeIndices());
      }
      return indices;
    }

    @Override public int hashCode() {
      int h = op.ordinal();
      for (int i = 0; i < terms.size(); i++) {
        h = hashCombine(h, terms.get(i).hashCode());
        h = hashCombine(h, Double.hashCode(coefficient(i)));
      }
      return h;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Sum
          && terms.equals(((Sum) o).terms)
          && coefficients.equals(((Sum) o).coefficients);
    }
  }

  /** Contraction of two tensorial expressions over a set of indices, for
   * example "contract(A[i,j], B[j,k]; j)". */
  public static class Contraction extends Exp {
    public final Exp left;
    public final Exp right;
    public final IndexSet indices;

    Contraction(Exp left, Exp right, IndexSet indices) {
      super(Op.CONTRACTION);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      this.indices = requireNonNull(indices);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(left, right);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 2);
      return copy(args.get(0), args.get(1));
    }

    public Contraction copy(Exp left, Exp right) {
      return left == this.left && right == this.right
          ? this
          : new Contraction(left, right, indices);
    }

    @Override public Contraction deepCopy() {
      return new Contraction(left.deepCopy(), right.deepCopy(), indices);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append("contract(")
          .append(left)
          .append(", ")
          .append(right)
          .append("; ")
          .append(indices.join(" "))
          .append(")");
    }

    @Override public IndexSet freeIndices() {
      return left.freeIndices()
          .plus(right.freeIndices())
          .minusLabels(indices.labels())
          .unique();
    }

    @Override public int hashCode() {
      return hashCombine(
          hashCombine(
              hashCombine(op.ordinal(), left.hashCode()), right.hashCode()),
          indices.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Contraction
          && left.equals(((Contraction) o).left)
          && right.equals(((Contraction) o).right)
          && indices.equals(((Contraction) o).indices);
    }
  }

  /** Explicit summation over an index, "sum(i, e)". */
  public static class IndexSum extends Exp {
    public final Index index;
    public final Exp child;

    IndexSum(Index index, Exp child) {
      super(Op.INDEX_SUM);
      this.index = requireNonNull(index);
      this.child = requireNonNull(child);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(child);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 1);
      return copy(index, args.get(0));
    }

    public IndexSum copy(Index index, Exp child) {
      return index.equals(this.index) && child == this.child
          ? this
          : new IndexSum(index, child);
    }

    @Override public IndexSum deepCopy() {
      return new IndexSum(index, child.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append("sum(")
          .append(index.label)
          .append(", ")
          .append(child)
          .append(")");
    }

    @Override public IndexSet freeIndices() {
      return child.freeIndices().minusLabels(ImmutableSet.of(index.label));
    }

    @Override public int hashCode() {
      return hashCombine(
          hashCombine(op.ordinal(), index.hashCode()), child.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IndexSum
          && index.equals(((IndexSum) o).index)
          && child.equals(((IndexSum) o).child);
    }
  }

  /** Derivative of an expression with respect to a variable,
   * "d/dx(e)". */
  public static class Derivative extends Exp {
    public final Exp child;
    public final Symbol var;

    Derivative(Exp child, Symbol var) {
      super(Op.DERIVATIVE);
      this.child = requireNonNull(child);
      this.var = requireNonNull(var);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(child);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 1);
      return copy(args.get(0));
    }

    public Derivative copy(Exp child) {
      return child == this.child ? this : new Derivative(child, var);
    }

    @Override public Derivative deepCopy() {
      return new Derivative(child.deepCopy(), var.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append("d/d")
          .append(var.name)
          .append("(")
          .append(child)
          .append(")");
    }

    /** Evaluates the derivative, by differentiating the child. */
    public Exp evaluate() {
      return child.derivative(var);
    }

    @Override public IndexSet freeIndices() {
      return child.freeIndices();
    }

    @Override public int hashCode() {
      return hashCombine(
          hashCombine(op.ordinal(), child.hashCode()), var.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Derivative
          && child.equals(((Derivative) o).child)
          && var.equals(((Derivative) o).var);
    }
  }

  /** Integral of an expression over a variable, "integral(e, x)". */
  public static class Integral extends Exp {
    public final Exp child;
    public final Symbol var;

    Integral(Exp child, Symbol var) {
      super(Op.INTEGRAL);
      this.child = requireNonNull(child);
      this.var = requireNonNull(var);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(child);
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, 1);
      return copy(args.get(0));
    }

    public Integral copy(Exp child) {
      return child == this.child ? this : new Integral(child, var);
    }

    @Override public Integral deepCopy() {
      return new Integral(child.deepCopy(), var.deepCopy());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append("integral(")
          .append(child)
          .append(", ")
          .append(var.name)
          .append(")");
    }

    @Override public IndexSet freeIndices() {
      return child.freeIndices();
    }

    @Override public int hashCode() {
      return hashCombine(
          hashCombine(op.ordinal(), child.hashCode()), var.hashCode());
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Integral
          && child.equals(((Integral) o).child)
          && var.equals(((Integral) o).var);
    }
  }

  /** Call to a named function, such as "vev(e)" or "conj(e)". */
  public static class Call extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;

    Call(String name, ImmutableList<Exp> args) {
      super(Op.FUNCTION_CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    /** Returns whether this is a call to a given function with one
     * argument. */
    public boolean isCallTo(String name) {
      return this.name.equals(name) && args.size() == 1;
    }

    @Override public List<Exp> args() {
      return args;
    }

    @Override public Exp withArgs(List<Exp> args) {
      checkArity(op, args, this.args.size());
      return copy(args);
    }

    public Call copy(List<Exp> args) {
      return Static.allIdentical(args, this.args)
          ? this
          : new Call(name, ImmutableList.copyOf(args));
    }

    @Override public Call deepCopy() {
      return new Call(name, Static.transformEager(args, Exp::deepCopy));
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override TreeWriter unparse(TreeWriter w) {
      return w.append(name).append("(").appendAll(args, ", ").append(")");
    }

    @Override public IndexSet freeIndices() {
      IndexSet indices = IndexSet.EMPTY;
      for (Exp arg : args) {
        indices = indices.union(arg.freeIndices());
      }
      return indices;
    }

    @Override public int hashCode() {
      return hashCombine(hashCombine(op.ordinal(), name.hashCode()), args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && name.equals(((Call) o).name)
          && args.equals(((Call) o).args);
    }
  }
}

// End Tree.java
