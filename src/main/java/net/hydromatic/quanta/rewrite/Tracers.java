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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.quanta.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the rule and
   * result of each rewrite, then calls the underlying tracer. */
  public static Tracer withOnRewrite(Tracer tracer,
      BiConsumer<Rule, Tree.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(Rule rule, Tree.Exp before,
          Tree.Exp after) {
        consumer.accept(rule, after);
        super.onRewrite(rule, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on the expression at
   * the end of a given pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, int pass,
      Consumer<Tree.Exp> consumer) {
    final int expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override public void onPass(int pass, Tree.Exp exp, boolean changed) {
        if (pass == expectedPass) {
          consumer.accept(exp);
        }
        super.onPass(pass, exp, changed);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of
   * simplification, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      Consumer<Tree.@Nullable Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Tree.@Nullable Exp exp) {
        consumer.accept(exp);
        super.onResult(exp);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRewrite(Rule rule, Tree.Exp before,
        Tree.Exp after) {
    }

    @Override public void onPass(int pass, Tree.Exp exp, boolean changed) {
    }

    @Override public void onResult(Tree.@Nullable Exp exp) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRewrite(Rule rule, Tree.Exp before,
        Tree.Exp after) {
      tracer.onRewrite(rule, before, after);
    }

    @Override public void onPass(int pass, Tree.Exp exp, boolean changed) {
      tracer.onPass(pass, exp, changed);
    }

    @Override public void onResult(Tree.@Nullable Exp exp) {
      tracer.onResult(exp);
    }
  }
}

// End Tracers.java
