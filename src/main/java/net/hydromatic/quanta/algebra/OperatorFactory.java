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
package net.hydromatic.quanta.algebra;

import static net.hydromatic.quanta.ast.TreeBuilder.tree;
import static net.hydromatic.quanta.util.Diagnostics.checkUser;
import static net.hydromatic.quanta.util.Diagnostics.user;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Operator;
import net.hydromatic.quanta.model.Operator.Algebra;
import net.hydromatic.quanta.model.Operator.Role;
import net.hydromatic.quanta.model.OperatorProduct;
import net.hydromatic.quanta.model.Tensor;

/**
 * Creates second-quantized operators.
 *
 * <p>Fermionic operators are named "a" and "a†", bosonic operators "b" and
 * "b†", and operators of the general algebra "c" and "c†".
 */
public class OperatorFactory {
  private OperatorFactory() {}

  private static String baseName(Algebra algebra) {
    switch (algebra) {
    case FERMION:
      return "a";
    case BOSON:
      return "b";
    default:
      return "c";
    }
  }

  /** Creates a creation operator. */
  public static Operator creation(Index p, Algebra algebra) {
    return new Operator(baseName(algebra) + Operator.DAGGER, IndexSet.of(p),
        Role.CREATION, algebra);
  }

  /** Creates a fermionic creation operator, "a†[p]". */
  public static Operator creation(Index p) {
    return creation(p, Algebra.FERMION);
  }

  /** Creates an annihilation operator. */
  public static Operator annihilation(Index p, Algebra algebra) {
    return new Operator(baseName(algebra), IndexSet.of(p), Role.ANNIHILATION,
        algebra);
  }

  /** Creates a fermionic annihilation operator, "a[p]". */
  public static Operator annihilation(Index p) {
    return annihilation(p, Algebra.FERMION);
  }

  /** Creates a number operator, "n[p]"; it is equal to
   * "a†[p] a[p]". */
  public static Operator number(Index p, Algebra algebra) {
    return new Operator("n", IndexSet.of(p), Role.NUMBER, algebra);
  }

  public static Operator number(Index p) {
    return number(p, Algebra.FERMION);
  }

  /** Creates the single excitation "a†[a] a[i]" from occupied orbital i to
   * virtual orbital a. */
  public static OperatorProduct singleExcitation(Index i, Index a) {
    return OperatorProduct.of(creation(a), annihilation(i));
  }

  /** Creates the double excitation "a†[a] a†[b] a[j] a[i]". */
  public static OperatorProduct doubleExcitation(
      Index i, Index j, Index a, Index b) {
    return OperatorProduct.of(creation(a), creation(b), annihilation(j),
        annihilation(i));
  }

  /** Creates the one-body operator "h[p,q] * a†[p] a[q]" for a rank-2
   * tensor h. Repeated indices are summed. */
  public static Tree.Exp oneBodyOperator(Tensor h) {
    checkUser(h.rank() == 2, "h.rank() == 2",
        "one-body operator needs a rank-2 tensor, got %s", h);
    final Index p = h.indices.get(0);
    final Index q = h.indices.get(1);
    return tree.multiply(tree.tensor(h),
        tree.product(OperatorProduct.of(creation(p), annihilation(q))));
  }

  /** Creates the two-body operator
   * "g[p,q,r,s] * 0.25*a†[p] a†[q] a[s] a[r]" for a rank-4 tensor g. */
  public static Tree.Exp twoBodyOperator(Tensor g) {
    checkUser(g.rank() == 4, "g.rank() == 4",
        "two-body operator needs a rank-4 tensor, got %s", g);
    final IndexSet x = g.indices;
    final OperatorProduct product =
        OperatorProduct.of(0.25,
            ImmutableList.of(creation(x.get(0)), creation(x.get(1)),
                annihilation(x.get(3)), annihilation(x.get(2))));
    return tree.multiply(tree.tensor(g), tree.product(product));
  }

  /** Creates the singles cluster operator "t1[i,a] * a†[a] a[i]" for an
   * amplitude tensor indexed by an occupied and a virtual orbital. */
  public static Tree.Exp clusterSingles(Tensor t1) {
    checkUser(t1.rank() == 2, "t1.rank() == 2",
        "singles cluster operator needs a rank-2 tensor, got %s", t1);
    final IndexSet x = t1.indices;
    return tree.multiply(tree.tensor(t1),
        tree.product(singleExcitation(x.get(0), x.get(1))));
  }

  /** Creates the doubles cluster operator
   * "t2[i,j,a,b] * 0.25*a†[a] a†[b] a[j] a[i]". */
  public static Tree.Exp clusterDoubles(Tensor t2) {
    checkUser(t2.rank() == 4, "t2.rank() == 4",
        "doubles cluster operator needs a rank-4 tensor, got %s", t2);
    final IndexSet x = t2.indices;
    return tree.multiply(tree.tensor(t2),
        tree.product(
            doubleExcitation(x.get(0), x.get(1), x.get(2), x.get(3))
                .times(0.25)));
  }

  /** Creates the cluster operator T = T1 + T2 + ... from a list of
   * amplitudes. Rank-2 amplitudes give singles terms and rank-4 amplitudes
   * give doubles terms. */
  public static Tree.Exp clusterOperator(List<Tensor> amplitudes) {
    final List<Tree.Exp> terms = new ArrayList<>();
    for (Tensor t : amplitudes) {
      switch (t.rank()) {
      case 2:
        terms.add(clusterSingles(t));
        break;
      case 4:
        terms.add(clusterDoubles(t));
        break;
      default:
        throw user("cluster amplitude must have rank 2 or 4, got %s", t);
      }
    }
    return tree.sum(terms);
  }

  /** Creates the z-component of the total spin, "Sz". */
  public static Operator spinZ() {
    return new Operator("Sz", IndexSet.EMPTY, Role.GENERAL, Algebra.GENERAL);
  }

  /** Creates the spin raising operator, "S+". */
  public static Operator spinPlus() {
    return new Operator("S+", IndexSet.EMPTY, Role.GENERAL, Algebra.GENERAL);
  }

  /** Creates the spin lowering operator, "S-". */
  public static Operator spinMinus() {
    return new Operator("S-", IndexSet.EMPTY, Role.GENERAL, Algebra.GENERAL);
  }
}

// End OperatorFactory.java
