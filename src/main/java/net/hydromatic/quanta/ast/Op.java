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
package net.hydromatic.quanta.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link Tree.Exp}. */
public enum Op {
  // leaves
  SYMBOL(true),
  TENSOR(true),
  OPERATOR(true),
  OPERATOR_PRODUCT(true),

  // binary operators
  ADD(" + "),
  SUBTRACT(" - "),
  MULTIPLY(" * "),
  DIVIDE(" / "),
  POWER(" ^ "),

  // quantum combinators
  COMMUTATOR,
  ANTICOMMUTATOR,
  CONTRACTION,

  // aggregates
  SUM,
  INDEX_SUM,

  // calculus
  DERIVATIVE,
  INTEGRAL,

  /** Call to a named function, such as "vev(e)". */
  FUNCTION_CALL;

  /** Operator surrounded by spaces, such as " + ", or null if this is not
   * an infix operator. */
  public final @Nullable String padded;

  /** Whether nodes of this kind have no children. */
  public final boolean leaf;

  Op() {
    this(null, false);
  }

  Op(boolean leaf) {
    this(null, leaf);
  }

  Op(String padded) {
    this(padded, false);
  }

  Op(@Nullable String padded, boolean leaf) {
    this.padded = padded;
    this.leaf = leaf;
  }

  /** Returns whether this is one of the operators of {@link Tree.Binary}. */
  public boolean isBinary() {
    return padded != null;
  }

  /** Returns whether a node of this kind is parenthesized when it is an
   * operand of an infix operator. */
  public boolean isAdditive() {
    return this == ADD || this == SUBTRACT;
  }
}

// End Op.java
