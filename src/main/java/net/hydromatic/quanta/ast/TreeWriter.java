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

import static net.hydromatic.quanta.util.Static.formatNumber;

import java.util.List;

/**
 * Converts an expression tree into infix text.
 *
 * <p>An operand of an infix operator is enclosed in parentheses if and only
 * if it is an addition or subtraction. So {@code (a + b) * c} and
 * {@code a * b + c} render as written, but so does {@code (a + b) + c}.
 *
 * <p>A {@link Tree.Sum} is not parenthesized either, so the text of an
 * expression does not always determine its tree: "a * c + a * d * x" is the
 * rendering of both {@code sum(a * c, a * d) * x} and
 * {@code sum(a * c, a * d * x)}.
 */
public class TreeWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string. */
  public TreeWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a number, without a redundant fractional part. */
  public TreeWriter append(double d) {
    b.append(formatNumber(d));
    return this;
  }

  /** Appends an expression. */
  public TreeWriter append(Tree.Exp e) {
    return e.unparse(this);
  }

  /** Appends an expression that is the operand of an infix operator. */
  public TreeWriter operand(Tree.Exp e) {
    if (e.op.isAdditive()) {
      return append("(").append(e).append(")");
    }
    return append(e);
  }

  /** Appends a call to an infix operator. */
  public TreeWriter infix(Tree.Exp left, Op op, Tree.Exp right) {
    return operand(left).append(op.padded).operand(right);
  }

  /** Appends a list of expressions, separated by a delimiter. */
  public TreeWriter appendAll(List<? extends Tree.Exp> list, String sep) {
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(list.get(i));
    }
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End TreeWriter.java
