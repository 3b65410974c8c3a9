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
package net.hydromatic.quanta.model;

import com.google.common.collect.ImmutableMap;

/** Symbol that has a real value. */
public class ScalarSymbol extends Symbol {
  public final double value;

  public ScalarSymbol(String name, double value) {
    this(name, value, ImmutableMap.of());
  }

  private ScalarSymbol(
      String name, double value, ImmutableMap<String, String> properties) {
    super(name, Kind.SCALAR, properties);
    this.value = value;
  }

  @Override protected ScalarSymbol copy(
      ImmutableMap<String, String> properties) {
    return new ScalarSymbol(name, value, properties);
  }

  @Override public ScalarSymbol deepCopy() {
    return copy(properties);
  }
}

// End ScalarSymbol.java
