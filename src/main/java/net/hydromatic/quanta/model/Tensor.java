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
import static net.hydromatic.quanta.util.Diagnostics.checkUser;

import com.google.common.primitives.Ints;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Indexed tensor, such as the one-electron integral "h[p,q]".
 *
 * <p>The rank of a tensor is the number of its indices.
 */
public class Tensor {
  /** Name of the Kronecker delta tensor. */
  public static final String DELTA = "δ";

  /** Name of the symbol property that holds a tensor's irreducible
   * representation. */
  public static final String IRREP = "irrep";

  public final Symbol symbol;
  public final IndexSet indices;
  public final Type type;

  public Tensor(Symbol symbol, IndexSet indices, Type type) {
    this.symbol = requireNonNull(symbol);
    this.indices = requireNonNull(indices);
    this.type = requireNonNull(type);
  }

  public Tensor(String name, IndexSet indices, Type type) {
    this(new Symbol(name), indices, type);
  }

  public Tensor(String name, IndexSet indices) {
    this(name, indices, Type.GENERAL);
  }

  public String name() {
    return symbol.name;
  }

  public int rank() {
    return indices.size();
  }

  /** Returns the irreducible representation, or null if not known. */
  public @Nullable String irrep() {
    return symbol.property(IRREP);
  }

  public Tensor deepCopy() {
    return new Tensor(symbol.deepCopy(), indices, type);
  }

  public Tensor withIndices(IndexSet indices) {
    return indices.equals(this.indices)
        ? this
        : new Tensor(symbol, indices, type);
  }

  public Tensor withSymbol(Symbol symbol) {
    return new Tensor(symbol, indices, type);
  }

  public Tensor withType(Type type) {
    return new Tensor(symbol, indices, type);
  }

  /** Returns whether this tensor has an index label in common with
   * another. */
  public boolean sharesIndices(Tensor other) {
    return !commonIndices(other).isEmpty();
  }

  public IndexSet commonIndices(Tensor other) {
    return indices.common(other.indices);
  }

  /** Returns whether this tensor can be contracted with another, that is,
   * whether they share at least one index label. */
  public boolean canContractWith(Tensor other) {
    return sharesIndices(other);
  }

  public boolean isKroneckerDelta() {
    return symbol.name.equals(DELTA) && rank() == 2;
  }

  /** Returns a tensor whose indices are in reverse order. */
  public Tensor transpose() {
    return withIndices(IndexSet.of(indices.indices.reverse()));
  }

  /** Returns a tensor whose indices are permuted. Element k of the
   * permutation is the current position of the index that moves to
   * position k. */
  public Tensor transpose(int... permutation) {
    checkUser(
        permutation.length == rank(),
        "permutation.length == rank()",
        "permutation %s has wrong length for tensor %s",
        Ints.asList(permutation),
        this);
    final Set<Integer> seen = new HashSet<>();
    for (int p : permutation) {
      checkUser(
          p >= 0 && p < rank() && seen.add(p),
          "p >= 0 && p < rank() && seen.add(p)",
          "invalid permutation %s",
          Ints.asList(permutation));
    }
    final List<Integer> list = Ints.asList(permutation);
    return withIndices(indices.permute(list));
  }

  /** Returns the complex conjugate. A "*" suffix is appended to the name,
   * or removed if present, so conjugating twice gives the original. */
  public Tensor conjugate() {
    final String name = symbol.name;
    return withSymbol(
        renamed(name.endsWith("*")
            ? name.substring(0, name.length() - 1)
            : name + "*"));
  }

  /** Returns the Hermitian conjugate. A Hermitian tensor is its own
   * conjugate; any other tensor is transposed and given a "†" suffix. */
  public Tensor hermitianConjugate() {
    if (type == Type.HERMITIAN) {
      return this;
    }
    return transpose().withSymbol(renamed(symbol.name + "†"));
  }

  private Symbol renamed(String name) {
    Symbol s = new Symbol(name, symbol.kind);
    for (Map.Entry<String, String> e : symbol.properties.entrySet()) {
      s = s.withProperty(e.getKey(), e.getValue());
    }
    return s;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Tensor)) {
      return false;
    }
    final Tensor that = (Tensor) o;
    return symbol.equals(that.symbol)
        && indices.equals(that.indices)
        && type == that.type;
  }

  @Override public int hashCode() {
    return Objects.hash(symbol, indices, type.ordinal());
  }

  @Override public String toString() {
    return rank() == 0 ? symbol.name : symbol.name + "[" + indices + "]";
  }

  /** Permutational or algebraic character of a tensor. */
  public enum Type {
    GENERAL,
    SYMMETRIC,
    ANTISYMMETRIC,
    HERMITIAN,
    UNITARY
  }
}

// End Tensor.java
