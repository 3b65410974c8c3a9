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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.quanta.util.UserException;
import org.junit.jupiter.api.Test;

/** Tests for {@link PointGroup}. */
public class PointGroupTest {
  @Test void testLookup() {
    assertThat(PointGroup.lookup("c2v"), is(PointGroup.C2V));
    assertThat(PointGroup.lookup("D2h"), is(PointGroup.D2H));
    final UserException e =
        assertThrows(UserException.class, () -> PointGroup.lookup("Oh"));
    assertThat(e.getMessage(), is("unknown point group 'Oh'"));
  }

  @Test void testProduct() {
    final PointGroup g = PointGroup.C2V;
    assertThat(g.totallySymmetric(), is("A1"));
    assertThat(g.product("B1", "B2"), is("A2"));
    assertThat(g.product("B1", "B1"), is("A1"));
    assertThat(g.product(ImmutableList.of("A2", "B1", "B2")), is("A1"));
    assertThat(g.product(ImmutableList.of()), is("A1"));
    assertThat(PointGroup.D2H.product("B1u", "B2g"), is("B3u"));
    assertThat(PointGroup.CI.product("Au", "Au"), is("Ag"));
  }

  @Test void testTotallySymmetric() {
    final PointGroup g = PointGroup.D2H;
    assertThat(g.isTotallySymmetric(ImmutableList.of("Au", "Au")), is(true));
    assertThat(g.isTotallySymmetric(ImmutableList.of("Ag", "B1u")),
        is(false));
    final UserException e =
        assertThrows(UserException.class, () -> g.irrepIndex("A1"));
    assertThat(e.getMessage(), is("unknown irrep 'A1' in point group D2H"));
  }
}

// End PointGroupTest.java
