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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Tensor;
import net.hydromatic.quanta.util.UserException;
import org.junit.jupiter.api.Test;

/** Tests for {@link TensorContraction}. */
public class TensorContractionTest {
  @Test void testContract() {
    final Index i = Index.occupied("i");
    final Index j = Index.occupied("j");
    final Index k = Index.occupied("k");
    final Tensor a = new Tensor("A", IndexSet.of(i, j));
    final Tensor b = new Tensor("B", IndexSet.of(j, k));
    assertThat(TensorContraction.contract(a, b), hasToString("(A·B)[i,k]"));
    assertThat(TensorContraction.contract(a, b, IndexSet.EMPTY),
        hasToString("(A·B)[i,j,j,k]"));
    assertThat(TensorContraction.contract(a, a), hasToString("(A·A)"));

    final UserException e =
        assertThrows(UserException.class, () ->
            TensorContraction.contract(a, b, IndexSet.of(i)));
    assertThat(e.getMessage(), is("cannot contract A[i,j] and B[j,k] over i"));
  }

  @Test void testCost() {
    final Index i = Index.occupied("i", 4);
    final Index j = Index.occupied("j");
    final Index k = Index.virtual("k", 3);
    final Tensor a = new Tensor("A", IndexSet.of(i, j));
    final Tensor b = new Tensor("B", IndexSet.of(j, k));
    // 4 * 10 * 3; j has unknown range
    assertThat(
        TensorContraction.estimateContractionCost(a, b, IndexSet.of(j)),
        is(120d));
  }

  /** Matrix chain A[i,j] B[j,k] C[k,l] where i and k are large. Contracting
   * B with C first is 50 times cheaper. */
  private static List<Tensor> chain() {
    final Index i = Index.general("i", 100);
    final Index j = Index.general("j", 2);
    final Index k = Index.general("k", 100);
    final Index l = Index.general("l", 2);
    return ImmutableList.of(new Tensor("A", IndexSet.of(i, j)),
        new Tensor("B", IndexSet.of(j, k)),
        new Tensor("C", IndexSet.of(k, l)));
  }

  @Test void testOptimizeExact() {
    final ContractionPath path = TensorContraction.optimizeContraction(chain());
    assertThat(path.strategy, is(ContractionPath.Strategy.EXACT));
    assertThat(path, hasToString("[(1, 2; k), (0, 1; j)] cost 800"));
    assertThat(path.steps, hasSize(2));
    assertThat(path.steps.get(0).cost, is(400d));
  }

  @Test void testOptimizeGreedy() {
    final ContractionPath path =
        TensorContraction.optimizeContraction(chain(), 0);
    assertThat(path.strategy, is(ContractionPath.Strategy.GREEDY));
    assertThat(path, hasToString("[(1, 2; k), (0, 1; j)] cost 800"));
  }

  /** An index that occurs in only one tensor is an output index and is
   * never summed. */
  @Test void testOutputIndex() {
    final Index i = Index.general("i", 5);
    final Index j = Index.general("j", 5);
    final Index k = Index.general("k", 5);
    final List<Tensor> tensors =
        ImmutableList.of(new Tensor("A", IndexSet.of(i, j)),
            new Tensor("B", IndexSet.of(j, k)));
    assertThat(TensorContraction.optimizeContraction(tensors),
        hasToString("[(0, 1; j)] cost 125"));
    assertThat(TensorContraction.optimizeContraction(tensors, 0),
        hasToString("[(0, 1; j)] cost 125"));
  }

  @Test void testOptimizeSingle() {
    final Tensor a = new Tensor("A", IndexSet.of(Index.occupied("i")));
    assertThat(TensorContraction.optimizeContraction(ImmutableList.of(a)),
        hasToString("[] cost 0"));
  }

  @Test void testOptimizeInvalid() {
    final UserException e =
        assertThrows(UserException.class, () ->
            TensorContraction.optimizeContraction(ImmutableList.of()));
    assertThat(e.getMessage(), is("cannot contract an empty list of tensors"));
    final UserException e2 =
        assertThrows(UserException.class, () ->
            TensorContraction.optimizeContraction(chain(), 17));
    assertThat(e2.getMessage(),
        is("exact threshold must be between 0 and 16, got 17"));
  }
}

// End TensorContractionTest.java
