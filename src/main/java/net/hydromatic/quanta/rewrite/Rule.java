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

import static java.util.Objects.requireNonNull;

import java.util.function.Function;
import net.hydromatic.quanta.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrite rule.
 *
 * <p>A rule examines the root of the expression it is given. If the pattern
 * matches, it returns a replacement; if not, it returns null. A rule never
 * modifies its argument, and never recurses into children; the
 * {@link Simplifier} is responsible for visiting the tree.
 *
 * <p>Built-in rules are the constants of {@link BuiltInRule}.
 */
public interface Rule {
  /** Returns the name of this rule, for tracing. */
  String name();

  Category category();

  /** Applies this rule to an expression; returns null if the rule does not
   * apply. */
  Tree.@Nullable Exp apply(Tree.Exp exp);

  /** Creates a rule from a function. */
  static Rule of(String name, Category category,
      Function<Tree.Exp, Tree.@Nullable Exp> function) {
    return new FunctionRule(name, category, function);
  }

  /** Rule whose logic is a function. */
  class FunctionRule implements Rule {
    private final String name;
    private final Category category;
    private final Function<Tree.Exp, Tree.@Nullable Exp> function;

    FunctionRule(String name, Category category,
        Function<Tree.Exp, Tree.@Nullable Exp> function) {
      this.name = requireNonNull(name);
      this.category = requireNonNull(category);
      this.function = requireNonNull(function);
    }

    @Override public String name() {
      return name;
    }

    @Override public Category category() {
      return category;
    }

    @Override public Tree.@Nullable Exp apply(Tree.Exp exp) {
      return function.apply(exp);
    }

    @Override public String toString() {
      return name;
    }
  }
}

// End Rule.java
