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
package net.hydromatic.quanta.rewrite;

/**
 * Category of rewrite rules.
 *
 * <p>The simplifier applies categories in the order in which they are
 * declared here.
 */
public enum Category {
  /** Identity and zero laws, constant folding. */
  ALGEBRAIC,
  /** Distribution of multiplication over addition and subtraction, and
   * its reverse. */
  DISTRIBUTIVE,
  /** Commutators and anticommutators. */
  COMMUTATOR,
  /** Kronecker deltas, index summation, and permutational symmetry of
   * tensors. */
  TENSOR,
  /** Second-quantized operators: normal ordering, Wick's theorem. */
  OPERATOR,
  /** Reductions by symmetry. */
  SYMMETRY
}

// End Category.java
