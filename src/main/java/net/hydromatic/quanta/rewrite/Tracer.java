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

import net.hydromatic.quanta.ast.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during simplification. */
public interface Tracer {
  /** Called when a rule rewrites an expression. */
  void onRewrite(Rule rule, Tree.Exp before, Tree.Exp after);

  /** Called at the end of each pass, with the expression so far, and
   * whether any category changed it during the pass. */
  void onPass(int pass, Tree.Exp exp, boolean changed);

  /** Called when simplification finishes, with the result, or with null if
   * it failed. */
  void onResult(Tree.@Nullable Exp exp);
}

// End Tracer.java
