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

import java.util.Objects;

/**
 * Tensor index, such as the "i" in "t[i,a]".
 *
 * <p>An index ranges over {@code [rangeStart, rangeEnd)}. If {@code rangeEnd}
 * is -1 the range is unknown.
 */
public class Index implements Comparable<Index> {
  public final String label;
  public final Kind kind;
  public final int rangeStart;
  public final int rangeEnd;
  public final Symmetry symmetry;

  public Index(
      String label,
      Kind kind,
      int rangeStart,
      int rangeEnd,
      Symmetry symmetry) {
    this.label = requireNonNull(label);
    this.kind = requireNonNull(kind);
    this.rangeStart = rangeStart;
    this.rangeEnd = rangeEnd;
    this.symmetry = requireNonNull(symmetry);
    checkUser(
        rangeEnd == -1 || rangeEnd >= rangeStart,
        "rangeEnd == -1 || rangeEnd >= rangeStart",
        "invalid range [%s, %s) for index %s",
        rangeStart,
        rangeEnd,
        label);
  }

  public Index(String label, Kind kind) {
    this(label, kind, 0, -1, Symmetry.NONE);
  }

  /** Creates an occupied-orbital index, conventionally i, j, k. */
  public static Index occupied(String label) {
    return new Index(label, Kind.OCCUPIED);
  }

  public static Index occupied(String label, int rangeEnd) {
    return new Index(label, Kind.OCCUPIED, 0, rangeEnd, Symmetry.NONE);
  }

  /** Creates a virtual-orbital index, conventionally a, b, c. */
  public static Index virtual(String label) {
    return new Index(label, Kind.VIRTUAL);
  }

  public static Index virtual(String label, int rangeEnd) {
    return new Index(label, Kind.VIRTUAL, 0, rangeEnd, Symmetry.NONE);
  }

  /** Creates a general index, conventionally p, q, r. */
  public static Index general(String label) {
    return new Index(label, Kind.GENERAL);
  }

  public static Index general(String label, int rangeEnd) {
    return new Index(label, Kind.GENERAL, 0, rangeEnd, Symmetry.NONE);
  }

  /** Creates a spin index, which ranges over α and β. */
  public static Index spin(String label) {
    return new Index(label, Kind.SPIN, 0, 2, Symmetry.NONE);
  }

  public static Index spatial(String label, int rangeEnd) {
    return new Index(label, Kind.SPATIAL, 0, rangeEnd, Symmetry.NONE);
  }

  /** Returns the number of values the index ranges over, or -1 if
   * unknown. */
  public int dimension() {
    return rangeEnd < 0 ? -1 : rangeEnd - rangeStart;
  }

  public boolean isOccupied() {
    return kind == Kind.OCCUPIED;
  }

  public boolean isVirtual() {
    return kind == Kind.VIRTUAL;
  }

  public Index withLabel(String label) {
    return label.equals(this.label)
        ? this
        : new Index(label, kind, rangeStart, rangeEnd, symmetry);
  }

  public Index withKind(Kind kind) {
    return kind == this.kind
        ? this
        : new Index(label, kind, rangeStart, rangeEnd, symmetry);
  }

  public Index withRange(int rangeStart, int rangeEnd) {
    return new Index(label, kind, rangeStart, rangeEnd, symmetry);
  }

  public Index withSymmetry(Symmetry symmetry) {
    return new Index(label, kind, rangeStart, rangeEnd, symmetry);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Index)) {
      return false;
    }
    final Index that = (Index) o;
    return label.equals(that.label)
        && kind == that.kind
        && rangeStart == that.rangeStart
        && rangeEnd == that.rangeEnd
        && symmetry == that.symmetry;
  }

  @Override public int hashCode() {
    return Objects.hash(
        label, kind.ordinal(), rangeStart, rangeEnd, symmetry.ordinal());
  }

  @Override public int compareTo(Index o) {
    final int c = label.compareTo(o.label);
    return c != 0 ? c : kind.compareTo(o.kind);
  }

  @Override public String toString() {
    return label;
  }

  /** What an index ranges over. */
  public enum Kind {
    OCCUPIED,
    VIRTUAL,
    GENERAL,
    SPIN,
    SPATIAL;

    /** Returns the kind that a particle-hole transformation maps this kind
     * to. */
    public Kind particleHole() {
      switch (this) {
      case OCCUPIED:
        return VIRTUAL;
      case VIRTUAL:
        return OCCUPIED;
      default:
        return this;
      }
    }
  }

  /** Permutational symmetry of an index with respect to its neighbors. */
  public enum Symmetry {
    NONE,
    SYMMETRIC,
    ANTISYMMETRIC
  }
}

// End Index.java
