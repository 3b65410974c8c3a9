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

import static net.hydromatic.quanta.util.Diagnostics.checkUser;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contracts tensors, and plans the order in which to contract a network of
 * tensors.
 *
 * <p>Tensor values are never computed; only index structure and cost
 * estimates.
 *
 * <p>The cost of contracting A and B is the product of the dimensions of the
 * distinct indices of A and B, which counts the multiply-adds of the
 * equivalent loop nest. An index whose range is unknown has dimension
 * {@link #DEFAULT_DIMENSION}.
 */
public class TensorContraction {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(TensorContraction.class);

  /** Dimension assumed for an index whose range is unknown. */
  public static final int DEFAULT_DIMENSION = 10;

  /** Largest number of tensors for which {@link #optimizeContraction(List)}
   * searches exhaustively; above this it is greedy. */
  public static final int DEFAULT_EXACT_THRESHOLD = 12;

  /** Largest allowed exact threshold. Exhaustive search takes 3<sup>n</sup>
   * steps. */
  private static final int MAX_EXACT_THRESHOLD = 16;

  private TensorContraction() {}

  /**
   * Returns the result of contracting two tensors over a set of indices.
   *
   * <p>The result is a general tensor named "(A·B)" whose indices are those
   * of A then B, less the contracted labels.
   */
  public static Tensor contract(Tensor a, Tensor b, IndexSet indices) {
    for (Index index : indices) {
      checkUser(
          a.indices.containsLabel(index.label)
              && b.indices.containsLabel(index.label),
          "a.indices.containsLabel(index.label)"
              + " && b.indices.containsLabel(index.label)",
          "cannot contract %s and %s over %s",
          a,
          b,
          index);
    }
    return new Tensor("(" + a.name() + "·" + b.name() + ")",
        a.indices.plus(b.indices).minusLabels(indices.labels()));
  }

  /** Contracts two tensors over the index labels they share. */
  public static Tensor contract(Tensor a, Tensor b) {
    return contract(a, b, a.commonIndices(b));
  }

  /** Estimates the cost of contracting two tensors. */
  public static double estimateContractionCost(
      Tensor a, Tensor b, IndexSet indices) {
    final IndexSet all = a.indices.plus(b.indices).plus(indices);
    return cost(all, dimensions(all));
  }

  /** Finds a cheap order in which to contract a list of tensors, using
   * the default threshold for exhaustive search. */
  public static ContractionPath optimizeContraction(List<Tensor> tensors) {
    return optimizeContraction(tensors, DEFAULT_EXACT_THRESHOLD);
  }

  /**
   * Finds a cheap order in which to contract a list of tensors.
   *
   * <p>An index label that occurs in two tensors is summed when they (or
   * intermediates containing them) are contracted. A label that occurs once
   * in the whole network is an output index, and is never summed.
   *
   * <p>If there are at most {@code exactThreshold} tensors, searches all
   * orders by dynamic programming over subsets, and the result has minimal
   * cost. Otherwise repeatedly contracts the pair of tensors whose
   * contraction is cheapest.
   */
  public static ContractionPath optimizeContraction(
      List<Tensor> tensors, int exactThreshold) {
    checkUser(!tensors.isEmpty(), "!tensors.isEmpty()",
        "cannot contract an empty list of tensors");
    checkUser(exactThreshold >= 0 && exactThreshold <= MAX_EXACT_THRESHOLD,
        "exactThreshold >= 0 && exactThreshold <= MAX_EXACT_THRESHOLD",
        "exact threshold must be between 0 and %s, got %s",
        MAX_EXACT_THRESHOLD, exactThreshold);
    final List<IndexSet> indexSets = new ArrayList<>();
    IndexSet all = IndexSet.EMPTY;
    for (Tensor tensor : tensors) {
      indexSets.add(tensor.indices);
      all = all.plus(tensor.indices);
    }
    final Map<String, Integer> dimensions = dimensions(all);
    final Multiset<String> counts = HashMultiset.create();
    all.forEach(index -> counts.add(index.label));

    final ContractionPath path =
        tensors.size() <= exactThreshold
            ? exact(indexSets, dimensions, counts)
            : greedy(indexSets, dimensions, counts);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("contraction of {} tensors by {} search: {}",
          tensors.size(), path.strategy, path);
    }
    return path;
  }

  /** Returns the dimension of each label; the first occurrence of a label
   * with a known range wins. */
  private static Map<String, Integer> dimensions(IndexSet indices) {
    final Map<String, Integer> map = new HashMap<>();
    for (Index index : indices) {
      final int dimension = index.dimension();
      if (dimension >= 0) {
        map.putIfAbsent(index.label, dimension);
      }
    }
    return map;
  }

  /** Returns the product of the dimensions of the distinct labels. */
  private static double cost(IndexSet indices,
      Map<String, Integer> dimensions) {
    double cost = 1d;
    for (String label : indices.labels()) {
      cost *= dimensions.getOrDefault(label, DEFAULT_DIMENSION);
    }
    return cost;
  }

  /** Exhaustive search. Subsets of tensors are bit masks. */
  private static ContractionPath exact(List<IndexSet> indexSets,
      Map<String, Integer> dimensions, Multiset<String> counts) {
    final int n = indexSets.size();
    final int full = (1 << n) - 1;

    // For each label, the set of tensors that contain it.
    final Map<String, Integer> labelMasks = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      for (Index index : indexSets.get(i)) {
        labelMasks.merge(index.label, 1 << i, (x, y) -> x | y);
      }
    }

    // The indices of the intermediate for each subset: labels in the subset
    // that are also needed outside it, or that are output labels.
    final IndexSet[] kept = new IndexSet[full + 1];
    for (int mask = 1; mask <= full; mask++) {
      final int m = mask;
      final List<Index> list = new ArrayList<>();
      final Set<String> seen = new HashSet<>();
      for (int i = 0; i < n; i++) {
        if ((m & (1 << i)) == 0) {
          continue;
        }
        for (Index index : indexSets.get(i)) {
          final int labelMask = labelMasks.get(index.label);
          final boolean needed =
              (labelMask & ~m & full) != 0 || counts.count(index.label) == 1;
          if (needed && seen.add(index.label)) {
            list.add(index);
          }
        }
      }
      kept[mask] = IndexSet.of(list);
    }

    final double[] best = new double[full + 1];
    final int[] split = new int[full + 1];
    for (int mask = 1; mask <= full; mask++) {
      if (Integer.bitCount(mask) == 1) {
        continue;
      }
      best[mask] = Double.POSITIVE_INFINITY;
      // Enumerate proper subsets that contain the lowest member, so that
      // each unordered split is considered once.
      final int low = mask & -mask;
      for (int sub = (mask - 1) & mask; sub > 0; sub = (sub - 1) & mask) {
        if ((sub & low) == 0) {
          continue;
        }
        final int other = mask & ~sub;
        final double c = best[sub] + best[other]
            + cost(kept[sub].plus(kept[other]), dimensions);
        if (c < best[mask]) {
          best[mask] = c;
          split[mask] = sub;
        }
      }
    }

    // Replay the best splits in post-order against a working list.
    final List<Integer> working = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      working.add(1 << i);
    }
    final List<ContractionPath.Step> steps = new ArrayList<>();
    replay(full, split, kept, dimensions, working, steps);
    return new ContractionPath(steps, ContractionPath.Strategy.EXACT);
  }

  private static void replay(int mask, int[] split, IndexSet[] kept,
      Map<String, Integer> dimensions, List<Integer> working,
      List<ContractionPath.Step> steps) {
    if (Integer.bitCount(mask) == 1) {
      return;
    }
    final int sub = split[mask];
    final int other = mask & ~sub;
    replay(sub, split, kept, dimensions, working, steps);
    replay(other, split, kept, dimensions, working, steps);
    final int left = working.indexOf(sub);
    final int right = working.indexOf(other);
    final IndexSet contracted =
        kept[sub].common(kept[other]).minusLabels(kept[mask].labels());
    steps.add(
        new ContractionPath.Step(left, right, contracted,
            cost(kept[sub].plus(kept[other]), dimensions)));
    working.remove(Math.max(left, right));
    working.remove(Math.min(left, right));
    working.add(mask);
  }

  /** Greedy search. */
  private static ContractionPath greedy(List<IndexSet> indexSets,
      Map<String, Integer> dimensions, Multiset<String> counts) {
    final List<IndexSet> working = new ArrayList<>(indexSets);
    final List<ContractionPath.Step> steps = new ArrayList<>();
    while (working.size() > 1) {
      int bestLeft = -1;
      int bestRight = -1;
      double bestCost = Double.POSITIVE_INFINITY;
      for (int i = 0; i < working.size(); i++) {
        for (int j = i + 1; j < working.size(); j++) {
          final double c =
              cost(working.get(i).plus(working.get(j)), dimensions);
          if (c < bestCost) {
            bestCost = c;
            bestLeft = i;
            bestRight = j;
          }
        }
      }
      final IndexSet a = working.get(bestLeft);
      final IndexSet b = working.get(bestRight);

      // Labels still needed by other tensors, or that are output labels.
      final Multiset<String> elsewhere = HashMultiset.create();
      for (int k = 0; k < working.size(); k++) {
        if (k != bestLeft && k != bestRight) {
          working.get(k).forEach(index -> elsewhere.add(index.label));
        }
      }
      final ImmutableSet.Builder<String> summed = ImmutableSet.builder();
      for (String label : a.common(b).labels()) {
        if (!elsewhere.contains(label) && counts.count(label) > 1) {
          summed.add(label);
        }
      }
      final Set<String> summedLabels = summed.build();
      final IndexSet merged = a.union(b).minusLabels(summedLabels);
      steps.add(
          new ContractionPath.Step(bestLeft, bestRight,
              a.common(b).minusLabels(merged.labels()), bestCost));
      working.remove(bestRight);
      working.remove(bestLeft);
      working.add(merged);
    }
    return new ContractionPath(steps, ContractionPath.Strategy.GREEDY);
  }
}

// End TensorContraction.java
