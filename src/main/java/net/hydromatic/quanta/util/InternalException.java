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

import org.checkerframework.checker.nullness.qual.Nullable;

/** An invariant of the engine itself does not hold. Aborts the current
 * operation. */
public class InternalException extends QuantaException {
  public InternalException(
      String message, @Nullable String condition, String location) {
    super(message, condition, location);
  }

  @Override public String severity() {
    return "Internal";
  }
}

// End InternalException.java
