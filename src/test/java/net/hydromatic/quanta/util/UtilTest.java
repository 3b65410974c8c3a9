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
package net.hydromatic.quanta.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Diagnostics}, {@link ScopedMap}, {@link NameGenerator}
 * and {@link Static}. */
public class UtilTest {
  @Test void testCheckUser() {
    Diagnostics.checkUser(true, "true", "never thrown");
    final UserException e =
        assertThrows(UserException.class, () ->
            Diagnostics.checkUser(1 > 2, "1 > 2", "bad value %s in %s",
                42, "foo"));
    assertThat(e.getMessage(), is("bad value 42 in foo"));
    assertThat(e.severity(), is("User"));
    assertThat(e.condition(), is("1 > 2"));
    assertThat(e.location(), startsWith("UtilTest."));
    assertThat(e.toString(),
        startsWith("User error: bad value 42 in foo (condition: 1 > 2)"
            + " at UtilTest."));
  }

  @Test void testCheckInternal() {
    final InternalException e =
        assertThrows(InternalException.class, () ->
            Diagnostics.checkInternal(false, "x != null",
                "broken invariant"));
    assertThat(e.severity(), is("Internal"));
    assertThat(e.condition(), is("x != null"));
    assertThat(e.toString(),
        startsWith("Internal error: broken invariant (condition: x != null)"));
  }

  /** Tests {@link Diagnostics#user}, which creates an exception without a
   * condition. */
  @Test void testUser() {
    final UserException e = Diagnostics.user("unknown group %s", "C7");
    assertThat(e.getMessage(), is("unknown group C7"));
    assertThat(e.condition(), nullValue());
    assertThat(e.toString(), startsWith("User error: unknown group C7 at "));
    assertThat(Diagnostics.internal("oops").severity(), is("Internal"));
  }

  @Test void testScopedMap() {
    final ScopedMap<String, Integer> map = new ScopedMap<>();
    assertThat(map.depth(), is(1));
    map.put("i", 1);
    map.put("j", 2);
    map.scope();
    assertThat(map.depth(), is(2));
    map.put("i", 10);
    assertThat(map.get("i"), is(10));
    assertThat(map.get("j"), is(2));
    assertThat(map.contains("k"), is(false));
    assertThat(map.getOpt("k"), nullValue());
    map.unscope();
    assertThat(map.get("i"), is(1));

    final UserException e =
        assertThrows(UserException.class, () -> map.get("k"));
    assertThat(e.getMessage(), is("not in scope: k"));
    assertThrows(InternalException.class, map::unscope);
  }

  @Test void testScopedMapRemove() {
    final ScopedMap<String, String> map = new ScopedMap<>();
    map.put("a", "outer");
    map.scope();
    map.put("a", "inner");
    map.remove("a");
    assertThat(map.get("a"), is("outer"));
    map.remove("a");
    assertThat(map.contains("a"), is(false));
    assertThrows(UserException.class, () -> map.remove("a"));
  }

  @Test void testNameGenerator() {
    final NameGenerator g = new NameGenerator();
    assertThat(g.get(), is("v0"));
    assertThat(g.get(), is("v1"));
    assertThat(g.uniqueName("d"), is("d2"));
    assertThat(g.getUniqueName("i"), is("i"));
    assertThat(g.getUniqueName("i"), is("i1"));
    assertThat(g.getUniqueName("j"), is("j"));
    assertThat(g.getUniqueName("i"), is("i2"));
    assertThat(g.inc("k"), is(0));
    assertThat(g.inc("k"), is(1));
  }

  /** Two generators are independent; there is no global counter. */
  @Test void testNameGeneratorReserved() {
    final NameGenerator g = new NameGenerator(ImmutableList.of("i", "a"));
    assertThat(g.getUniqueName("i"), is("i1"));
    assertThat(g.getUniqueName("a"), is("a1"));
    assertThat(g.getUniqueName("b"), is("b"));
    assertThat(new NameGenerator().get(), is("v0"));
  }

  /** An ordinal that would give a used name is skipped. */
  @Test void testNameGeneratorSkipsUsed() {
    final NameGenerator g = new NameGenerator(ImmutableList.of("x1"));
    assertThat(g.getUniqueName("x"), is("x"));
    assertThat(g.getUniqueName("x"), is("x2"));
    g.reserve("x3");
    assertThat(g.getUniqueName("x"), is("x4"));
    assertThat(g.getUniqueName("x1"), is("x11"));
    assertThat(g.getUniqueName("x2"), is("x21"));
  }

  @Test void testFormatNumber() {
    assertThat(Static.formatNumber(2d), is("2"));
    assertThat(Static.formatNumber(0.5d), is("0.5"));
    assertThat(Static.formatNumber(-1d), is("-1"));
    assertThat(Static.formatNumber(-0d), is("0"));
    assertThat(Static.formatNumber(100d), is("100"));
    assertThat(Static.formatNumber(1d / 12d), is("0.08333333333333333"));
    assertThat(Static.formatNumber(Double.NaN), is("NaN"));
  }

  @Test void testHashCombine() {
    final int h0 = Static.hashCombine(Static.hashCombine(17, 1), 2);
    final int h1 = Static.hashCombine(Static.hashCombine(17, 2), 1);
    assertThat(h0 == h1, is(false));
    assertThat(Static.hashCombine(17, Arrays.asList(1, 2)),
        is(Static.hashCombine(Static.hashCombine(17, 1), 2)));
  }

  @Test void testInversionCount() {
    assertThat(Static.inversionCount(Arrays.asList(0, 1, 2)), is(0));
    assertThat(Static.inversionCount(Arrays.asList(1, 0, 2)), is(1));
    assertThat(Static.inversionCount(Arrays.asList(2, 1, 0)), is(3));
  }

  @Test void testListHelpers() {
    final List<String> list = Arrays.asList("a", "b");
    assertThat(Static.append(list, "c"), hasToString("[a, b, c]"));
    assertThat(Static.last(list), is("b"));
    assertThat(Static.transformEager(list, String::toUpperCase),
        hasToString("[A, B]"));
    assertThat(Static.allIdentical(list, Arrays.asList("a", "b")), is(true));
    assertThat(Static.allIdentical(list, Arrays.asList("a")), is(false));
  }
}

// End UtilTest.java
