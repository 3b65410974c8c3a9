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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quanta.util.Static.formatNumber;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.quanta.model.IndexSet;

/**
 * Order in which to contract a network of tensors, pair by pair.
 *
 * <p>Positions refer to a working list. Initially the working list holds the
 * input tensors; each step removes the two tensors it contracts and appends
 * their intermediate result to the end of the list.
 */
public class ContractionPath {
  public final ImmutableList<Step> steps;
  public final double cost;
  public final Strategy strategy;

  ContractionPath(List<Step> steps, Strategy strategy) {
    this.steps = ImmutableList.copyOf(steps);
    this.cost = this.steps.stream().mapToDouble(step -> step.cost).sum();
    this.strategy = requireNonNull(strategy);
  }

  @Override public String toString() {
    return steps.stream()
        .map(Step::toString)
        .collect(Collectors.joining(", ", "[", "]"))
        + " cost " + formatNumber(cost);
  }

  /** One pairwise contraction. */
  public static class Step {
    /** Position of the first tensor in the working list. */
    public final int left;
    /** Position of the second tensor in the working list. */
    public final int right;
    /** Indices summed by this step. */
    public final IndexSet contracted;
    public final double cost;

    Step(int left, int right, IndexSet contracted, double cost) {
      this.left = left;
      this.right = right;
      this.contracted = requireNonNull(contracted);
      this.cost = cost;
    }

    @Override public String toString() {
      return "(" + left + ", " + right + "; " + contracted.join(" ") + ")";
    }
  }

  /** How the path was found. */
  public enum Strategy {
    /** Dynamic programming over subsets; the cost is minimal. */
    EXACT,
    /** Repeatedly contract the cheapest pair. */
    GREEDY
  }
}

// End ContractionPath.java
