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

import static net.hydromatic.quanta.util.Diagnostics.user;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;

/**
 * Abelian point group, and the multiplication table of its irreducible
 * representations.
 *
 * <p>Each group's irreps are listed in an order such that the product of
 * the irreps at positions i and j is the irrep at position {@code i ^ j}.
 * The totally symmetric irrep is at position 0.
 */
public enum PointGroup {
  C1("A"),
  CI("Ag", "Au"),
  CS("A'", "A\""),
  C2("A", "B"),
  C2V("A1", "A2", "B1", "B2"),
  C2H("Ag", "Bg", "Au", "Bu"),
  D2("A", "B1", "B2", "B3"),
  D2H("Ag", "B1g", "B2g", "B3g", "Au", "B1u", "B2u", "B3u");

  public final ImmutableList<String> irreps;

  PointGroup(String... irreps) {
    this.irreps = ImmutableList.copyOf(irreps);
  }

  /** Looks up a group by name, ignoring case; for example "c2v" and "C2v"
   * both return {@link #C2V}.
   *
   * @throws net.hydromatic.quanta.util.UserException if there is no such
   * group */
  public static PointGroup lookup(String id) {
    try {
      return valueOf(id.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw user("unknown point group '%s'", id);
    }
  }

  /** Returns the position of an irrep in this group. */
  public int irrepIndex(String irrep) {
    final int i = irreps.indexOf(irrep);
    if (i < 0) {
      throw user("unknown irrep '%s' in point group %s", irrep, this);
    }
    return i;
  }

  /** Returns the direct product of two irreps. */
  public String product(String irrep0, String irrep1) {
    return irreps.get(irrepIndex(irrep0) ^ irrepIndex(irrep1));
  }

  /** Returns the direct product of a list of irreps; the totally symmetric
   * irrep if the list is empty. */
  public String product(List<String> irrepList) {
    int i = 0;
    for (String irrep : irrepList) {
      i ^= irrepIndex(irrep);
    }
    return irreps.get(i);
  }

  public String totallySymmetric() {
    return irreps.get(0);
  }

  /** Returns whether the direct product of a list of irreps is totally
   * symmetric. An integral over a product of functions vanishes unless it
   * is. */
  public boolean isTotallySymmetric(List<String> irrepList) {
    return product(irrepList).equals(totallySymmetric());
  }
}

// End PointGroup.java
