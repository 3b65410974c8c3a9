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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Multiset;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.hydromatic.quanta.util.Static;

/**
 * Ordered, immutable list of indices.
 *
 * <p>Order matters: the indices of a tensor are in positional order, and the
 * same label may occur more than once (as in a trace "t[i,i]").
 *
 * <p>Set-like operations ({@link #common}, {@link #unique},
 * {@link #minusLabels}) compare indices by label, because it is the label
 * that determines whether two index positions are summed together.
 */
public class IndexSet implements Iterable<Index> {
  public static final IndexSet EMPTY = new IndexSet(ImmutableList.of());

  public final ImmutableList<Index> indices;

  private IndexSet(ImmutableList<Index> indices) {
    this.indices = requireNonNull(indices);
  }

  public static IndexSet of(Index... indices) {
    return of(Arrays.asList(indices));
  }

  public static IndexSet of(Collection<Index> indices) {
    return indices.isEmpty()
        ? EMPTY
        : new IndexSet(ImmutableList.copyOf(indices));
  }

  public int size() {
    return indices.size();
  }

  public boolean isEmpty() {
    return indices.isEmpty();
  }

  public Index get(int i) {
    return indices.get(i);
  }

  @Override public Iterator<Index> iterator() {
    return indices.iterator();
  }

  /** Concatenates two index sets, keeping duplicates. */
  public IndexSet plus(IndexSet other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    return of(
        ImmutableList.<Index>builder()
            .addAll(indices)
            .addAll(other.indices)
            .build());
  }

  /** Concatenates two index sets, omitting labels that are already
   * present. */
  public IndexSet union(IndexSet other) {
    final ImmutableList.Builder<Index> b = ImmutableList.builder();
    final Set<String> labels = new HashSet<>();
    for (Index index : Iterables.concat(indices, other.indices)) {
      if (labels.add(index.label)) {
        b.add(index);
      }
    }
    return of(b.build());
  }

  /** Returns the indices of this set whose label occurs in another set,
   * without duplicates, in the order of this set. */
  public IndexSet common(IndexSet other) {
    final ImmutableSet<String> otherLabels = other.labels();
    final ImmutableList.Builder<Index> b = ImmutableList.builder();
    final Set<String> seen = new HashSet<>();
    for (Index index : indices) {
      if (otherLabels.contains(index.label) && seen.add(index.label)) {
        b.add(index);
      }
    }
    return of(b.build());
  }

  /** Returns the indices whose label occurs exactly once. These are the free
   * indices under the Einstein convention. */
  public IndexSet unique() {
    final Multiset<String> counts = labelCounts();
    return of(
        indices.stream()
            .filter(index -> counts.count(index.label) == 1)
            .collect(Collectors.toList()));
  }

  /** Returns whether any label occurs more than once. */
  public boolean hasRepeatedIndices() {
    return labelCounts().entrySet().stream().anyMatch(e -> e.getCount() > 1);
  }

  private Multiset<String> labelCounts() {
    final Multiset<String> counts = HashMultiset.create();
    indices.forEach(index -> counts.add(index.label));
    return counts;
  }

  public boolean contains(Index index) {
    return indices.contains(index);
  }

  public boolean containsLabel(String label) {
    for (Index index : indices) {
      if (index.label.equals(label)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the distinct labels, in order of first occurrence. */
  public ImmutableSet<String> labels() {
    return indices.stream()
        .map(index -> index.label)
        .collect(ImmutableSet.toImmutableSet());
  }

  /** Returns the indices whose labels are not in a given collection. */
  public IndexSet minusLabels(Collection<String> labels) {
    if (labels.isEmpty()) {
      return this;
    }
    return of(
        indices.stream()
            .filter(index -> !labels.contains(index.label))
            .collect(Collectors.toList()));
  }

  /** Applies a function to each index. */
  public IndexSet transform(Function<Index, Index> fn) {
    return of(Static.transformEager(indices, fn));
  }

  /** Replaces every index labeled {@code from} by one labeled {@code to}. */
  public IndexSet relabel(String from, String to) {
    return transform(
        index -> index.label.equals(from) ? index.withLabel(to) : index);
  }

  /** Returns the indices in a given order; {@code permutation[k]} is the
   * position in this set of the index that goes to position k. */
  public IndexSet permute(List<Integer> permutation) {
    return of(Static.transformEager(permutation, indices::get));
  }

  /** Returns the labels separated by a delimiter. */
  public String join(String delimiter) {
    return indices.stream()
        .map(index -> index.label)
        .collect(Collectors.joining(delimiter));
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof IndexSet
        && indices.equals(((IndexSet) o).indices);
  }

  @Override public int hashCode() {
    return indices.hashCode();
  }

  @Override public String toString() {
    return join(",");
  }
}

// End IndexSet.java
