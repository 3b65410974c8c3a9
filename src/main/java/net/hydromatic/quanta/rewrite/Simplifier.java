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
import static net.hydromatic.quanta.util.Diagnostics.checkUser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.quanta.ast.Tree;
import net.hydromatic.quanta.util.QuantaException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites an expression to a simpler form.
 *
 * <p>The simplifier holds, for each {@link Category}, an ordered list of
 * {@link Rule rules}. Each pass applies the categories in declaration
 * order. Within a category, the first rule that matches a node wins, and
 * the rest of the category's rules are not tried on that node in that pass.
 * If {@link Prop#RECURSIVE} is true, a category visits every node of the
 * tree, children before parents; otherwise it tries only the root.
 *
 * <p>A category is deemed to have changed the expression if the rendered
 * text of the expression changed. Passes continue until a pass makes no
 * change, or {@link Prop#MAX_ITERATIONS} passes have been made.
 *
 * <p>The input expression is never modified; the simplifier copies it.
 *
 * <p>A simplifier is not thread-safe. It owns its rule lists and its trace
 * log.
 */
public class Simplifier {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Simplifier.class);

  private final Map<Category, List<Rule>> rules =
      new EnumMap<>(Category.class);
  private final Set<Category> enabledCategories =
      EnumSet.allOf(Category.class);
  private final List<String> traceLog = new ArrayList<>();
  private final int maxIterations;
  private final int traceCapacity;
  private final int traceDropCount;
  private final boolean recursive;
  private boolean trace;
  private Tracer tracer = Tracers.empty();

  /** Creates a simplifier with the default properties and rules. */
  public Simplifier() {
    this(ImmutableMap.of());
  }

  private Simplifier(Map<Prop, Object> props) {
    this.maxIterations = Prop.MAX_ITERATIONS.intValue(props);
    this.traceCapacity = Prop.TRACE_CAPACITY.intValue(props);
    this.traceDropCount = Prop.TRACE_DROP_COUNT.intValue(props);
    this.recursive = Prop.RECURSIVE.booleanValue(props);
    this.trace = Prop.TRACE.booleanValue(props);
    checkUser(traceCapacity > 0, "traceCapacity > 0",
        "trace capacity must be positive, got %s", traceCapacity);
    checkUser(traceDropCount > 0, "traceDropCount > 0",
        "trace drop count must be positive, got %s", traceDropCount);
    for (Category category : Category.values()) {
      rules.put(category, new ArrayList<>(BuiltInRule.defaults(category)));
    }
    final String pointGroup = Prop.POINT_GROUP.stringValue(props);
    if (pointGroup != null) {
      addSymmetry(pointGroup);
    }
  }

  /** Creates a simplifier with the given properties and the default
   * rules. */
  public static Simplifier create(Map<Prop, Object> props) {
    final Map<Prop, Object> map = new HashMap<>();
    props.forEach((prop, value) -> prop.set(map, value));
    return new Simplifier(map);
  }

  /** Sets the tracer that receives rewrite events. */
  public Simplifier withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
    return this;
  }

  /** Simplifies an expression using every enabled category. */
  public Tree.Exp simplify(Tree.Exp exp) {
    return simplifyWith(exp, enabledCategories);
  }

  /** Simplifies an expression using the enabled categories among those
   * given. Categories are applied in declaration order, regardless of the
   * order of the collection. */
  public Tree.Exp simplifyWith(Tree.Exp exp,
      Collection<Category> categories) {
    final Set<Category> categorySet = EnumSet.noneOf(Category.class);
    categorySet.addAll(categories);
    categorySet.retainAll(enabledCategories);
    try {
      Tree.Exp result = exp.deepCopy();
      for (int pass = 0; pass < maxIterations; pass++) {
        boolean changed = false;
        for (Category category : categorySet) {
          final Tree.Exp before = result;
          final Tree.Exp after = rewrite(category, before);
          final String beforeString = before.toString();
          final String afterString = after.toString();
          if (!afterString.equals(beforeString)) {
            changed = true;
            log("Applied " + category + " rule: " + beforeString + " -> "
                + afterString);
            result = after;
          }
        }
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("pass {} changed={} result={}", pass, changed,
              result);
        }
        tracer.onPass(pass, result, changed);
        if (!changed) {
          break;
        }
      }
      tracer.onResult(result);
      return result;
    } catch (QuantaException e) {
      tracer.onResult(null);
      throw e;
    }
  }

  /** Applies a category's rules to every node of an expression (if
   * recursive) or its root. */
  private Tree.Exp rewrite(Category category, Tree.Exp exp) {
    final List<Rule> list = rules.get(category);
    if (list.isEmpty()) {
      return exp;
    }
    if (!recursive) {
      final Tree.Exp e = applyFirst(list, exp);
      return e == null ? exp : e;
    }
    return rewriteBottomUp(list, exp);
  }

  private Tree.Exp rewriteBottomUp(List<Rule> list, Tree.Exp exp) {
    final List<Tree.Exp> args = exp.args();
    Tree.Exp e = exp;
    if (!args.isEmpty()) {
      final List<Tree.Exp> newArgs = new ArrayList<>(args.size());
      boolean same = true;
      for (Tree.Exp arg : args) {
        final Tree.Exp newArg = rewriteBottomUp(list, arg);
        newArgs.add(newArg);
        same &= newArg == arg;
      }
      if (!same) {
        e = exp.withArgs(newArgs);
      }
    }
    final Tree.Exp e2 = applyFirst(list, e);
    return e2 == null ? e : e2;
  }

  /** Applies the first rule in a list that matches the root of an
   * expression; returns null if none matches. */
  private Tree.@Nullable Exp applyFirst(List<Rule> list, Tree.Exp exp) {
    for (Rule rule : list) {
      final Tree.Exp e = rule.apply(exp);
      if (e != null) {
        if (LOGGER.isTraceEnabled()) {
          LOGGER.trace("rule {} rewrote {} to {}", rule.name(), exp, e);
        }
        tracer.onRewrite(rule, exp, e);
        return e;
      }
    }
    return null;
  }

  /** Applies a category's rules to the root of an expression, once.
   * Returns the result of the first rule that matches, or null if none
   * matches. */
  public Tree.@Nullable Exp applyCategory(Category category, Tree.Exp exp) {
    return applyFirst(rules.get(category), exp);
  }

  /** Appends a rule to the list of its category. */
  public Simplifier addRule(Rule rule) {
    rules.get(rule.category()).add(rule);
    return this;
  }

  /** Removes all rules of a category. */
  public Simplifier removeRules(Category category) {
    rules.get(category).clear();
    return this;
  }

  /** Returns the rules of a category, in the order they are tried. */
  public ImmutableList<Rule> rules(Category category) {
    return ImmutableList.copyOf(rules.get(category));
  }

  public Simplifier enableCategory(Category category, boolean enabled) {
    if (enabled) {
      enabledCategories.add(category);
    } else {
      enabledCategories.remove(category);
    }
    return this;
  }

  public boolean isCategoryEnabled(Category category) {
    return enabledCategories.contains(category);
  }

  /** Adds the symmetry rules of a point group, such as "C2v", that are not
   * already present.
   *
   * @throws net.hydromatic.quanta.util.UserException if the group is not
   * known */
  public Simplifier addSymmetry(String id) {
    final List<Rule> list = rules.get(Category.SYMMETRY);
    for (Rule rule : SymmetryRules.forGroup(id)) {
      if (list.stream().noneMatch(r -> r.name().equals(rule.name()))) {
        list.add(rule);
      }
    }
    return this;
  }

  public Simplifier enableTrace(boolean trace) {
    this.trace = trace;
    return this;
  }

  /** Returns the trace log, oldest entry first. */
  public ImmutableList<String> trace() {
    return ImmutableList.copyOf(traceLog);
  }

  public void clearTrace() {
    traceLog.clear();
  }

  /** Adds an entry to the trace log, if tracing is enabled. If the log is
   * full, first removes the oldest entries. */
  private void log(String message) {
    if (!trace) {
      return;
    }
    if (traceLog.size() >= traceCapacity) {
      traceLog.subList(0, Math.min(traceDropCount, traceLog.size())).clear();
    }
    traceLog.add(message);
  }
}

// End Simplifier.java
