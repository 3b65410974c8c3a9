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
package net.hydromatic.quanta.model;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Quantum-mechanical operator, such as the fermionic creation operator
 * "a†[p]".
 *
 * <p>The {@link Role} says what the operator does; the {@link Algebra} says
 * how it reorders with other operators.
 */
public class Operator {
  /** Suffix that marks an adjoint. */
  public static final String DAGGER = "†";

  public final Symbol symbol;
  public final IndexSet indices;
  public final Role role;
  public final Algebra algebra;

  public Operator(Symbol symbol, IndexSet indices, Role role, Algebra algebra) {
    this.symbol = requireNonNull(symbol);
    this.indices = requireNonNull(indices);
    this.role = requireNonNull(role);
    this.algebra = requireNonNull(algebra);
  }

  public Operator(String name, IndexSet indices, Role role, Algebra algebra) {
    this(new Symbol(name), indices, role, algebra);
  }

  public String name() {
    return symbol.name;
  }

  public Operator deepCopy() {
    return new Operator(symbol.deepCopy(), indices, role, algebra);
  }

  public Operator withIndices(IndexSet indices) {
    return indices.equals(this.indices)
        ? this
        : new Operator(symbol, indices, role, algebra);
  }

  public Operator withRole(Role role) {
    return new Operator(symbol, indices, role, algebra);
  }

  public boolean isCreation() {
    return role == Role.CREATION;
  }

  public boolean isAnnihilation() {
    return role == Role.ANNIHILATION;
  }

  /** Returns whether this is a creation or annihilation operator over a
   * single index, the kind of operator that Wick's theorem contracts. */
  public boolean isElementary() {
    return (role == Role.CREATION || role == Role.ANNIHILATION)
        && indices.size() == 1;
  }

  /** Returns whether this operator anticommutes with another: true iff both
   * are fermionic. */
  public boolean anticommutesWith(Operator other) {
    return algebra == Algebra.FERMION && other.algebra == Algebra.FERMION;
  }

  /** Returns whether this operator commutes with another: true iff both are
   * bosonic. Operators of the general algebra neither commute nor
   * anticommute. */
  public boolean commutesWith(Operator other) {
    return algebra == Algebra.BOSON && other.algebra == Algebra.BOSON;
  }

  /**
   * Returns the adjoint.
   *
   * <p>Creation and annihilation operators swap roles; number, Hamiltonian
   * and density operators are self-adjoint. Any operator that is not
   * self-adjoint toggles a trailing "†" on its name.
   */
  public Operator adjoint() {
    switch (role) {
    case NUMBER:
    case HAMILTONIAN:
    case DENSITY:
      return this;
    case CREATION:
      return new Operator(dagger(), indices, Role.ANNIHILATION, algebra);
    case ANNIHILATION:
      return new Operator(dagger(), indices, Role.CREATION, algebra);
    default:
      return new Operator(dagger(), indices, role, algebra);
    }
  }

  public Operator hermitianConjugate() {
    return adjoint();
  }

  private Symbol dagger() {
    final String name = symbol.name;
    return new Symbol(
        name.endsWith(DAGGER)
            ? name.substring(0, name.length() - DAGGER.length())
            : name + DAGGER,
        symbol.kind);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Operator)) {
      return false;
    }
    final Operator that = (Operator) o;
    return symbol.equals(that.symbol)
        && indices.equals(that.indices)
        && role == that.role
        && algebra == that.algebra;
  }

  @Override public int hashCode() {
    return Objects.hash(symbol, indices, role.ordinal(), algebra.ordinal());
  }

  @Override public String toString() {
    return indices.isEmpty()
        ? symbol.name
        : symbol.name + "[" + indices + "]";
  }

  /** What an operator does. */
  public enum Role {
    CREATION,
    ANNIHILATION,
    NUMBER,
    HAMILTONIAN,
    DENSITY,
    GENERAL,
    COMPOSITE
  }

  /** Reordering algebra of an operator. */
  public enum Algebra {
    /** Operators anticommute. */
    FERMION,
    /** Operators commute. */
    BOSON,
    /** Operators neither commute nor anticommute. */
    GENERAL
  }
}

// End Operator.java
