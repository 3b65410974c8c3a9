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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class for failures reported by Quanta.
 *
 * <p>Every failure carries the text of the condition that failed (if the
 * failure came from a check) and the location of the check.
 *
 * @see Diagnostics
 */
public abstract class QuantaException extends RuntimeException {
  private final @Nullable String condition;
  private final String location;

  protected QuantaException(
      String message, @Nullable String condition, String location) {
    super(message);
    this.condition = condition;
    this.location = requireNonNull(location);
  }

  /** Returns the severity, "User" or "Internal". */
  public abstract String severity();

  /** Returns the text of the condition that failed, or null. */
  public @Nullable String condition() {
    return condition;
  }

  /** Returns the location of the check, e.g. "Tree.Sum.&lt;init&gt;:120". */
  public String location() {
    return location;
  }

  /** Writes a formatted description of this failure. */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(severity()).append(" error: ").append(getMessage());
    if (condition != null) {
      buf.append(" (condition: ").append(condition).append(")");
    }
    return buf.append(" at ").append(location);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }
}

// End QuantaException.java
