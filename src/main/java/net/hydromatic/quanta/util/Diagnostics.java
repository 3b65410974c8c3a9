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
package net.hydromatic.quanta.util;

import static com.google.common.base.Strings.lenientFormat;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reports failures.
 *
 * <p>There are two severities. A <em>user</em> failure ({@link
 * UserException}) means that a caller violated a precondition; an
 * <em>internal</em> failure ({@link InternalException}) means that the engine
 * broke one of its own invariants.
 *
 * <p>Message templates use Guava's {@code %s} placeholders.
 */
public class Diagnostics {
  private static final String THIS_CLASS = Diagnostics.class.getName();

  private Diagnostics() {}

  /** Throws a {@link UserException} if {@code condition} is false. */
  public static void checkUser(
      boolean condition,
      String conditionText,
      String template,
      @Nullable Object... args) {
    if (!condition) {
      throw new UserException(
          lenientFormat(template, args), conditionText, callerLocation());
    }
  }

  /** Throws an {@link InternalException} if {@code condition} is false. */
  public static void checkInternal(
      boolean condition,
      String conditionText,
      String template,
      @Nullable Object... args) {
    if (!condition) {
      throw new InternalException(
          lenientFormat(template, args), conditionText, callerLocation());
    }
  }

  /**
   * Creates a {@link UserException}. The caller throws it, so that the
   * compiler knows that control does not continue:
   *
   * <blockquote><pre>throw Diagnostics.user("unknown group %s", id);</pre>
   * </blockquote>
   */
  public static UserException user(String template, @Nullable Object... args) {
    return new UserException(
        lenientFormat(template, args), null, callerLocation());
  }

  /** Creates an {@link InternalException}. */
  public static InternalException internal(
      String template, @Nullable Object... args) {
    return new InternalException(
        lenientFormat(template, args), null, callerLocation());
  }

  /** Returns "Class.method:line" of the first stack frame outside this
   * class. */
  private static String callerLocation() {
    return StackWalker.getInstance()
        .walk(
            frames ->
                frames
                    .filter(f -> !f.getClassName().equals(THIS_CLASS))
                    .findFirst()
                    .map(
                        f -> {
                          final String className = f.getClassName();
                          return className.substring(
                                  className.lastIndexOf('.') + 1)
                              + "."
                              + f.getMethodName()
                              + ":"
                              + f.getLineNumber();
                        })
                    .orElse("unknown"));
  }
}

// End Diagnostics.java
