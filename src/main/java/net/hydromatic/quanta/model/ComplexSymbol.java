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

/** Symbol that has a complex value, {@code real + imag * i}. */
public class ComplexSymbol extends Symbol {
  public final double real;
  public final double imag;

  public ComplexSymbol(String name, double real, double imag) {
    this(name, real, imag, ImmutableMap.of());
  }

  private ComplexSymbol(
      String name,
      double real,
      double imag,
      ImmutableMap<String, String> properties) {
    super(name, Kind.COMPLEX, properties);
    this.real = real;
    this.imag = imag;
  }

  @Override protected ComplexSymbol copy(
      ImmutableMap<String, String> properties) {
    return new ComplexSymbol(name, real, imag, properties);
  }

  @Override public ComplexSymbol deepCopy() {
    return copy(properties);
  }

  /** Returns whether the imaginary part is zero. */
  public boolean isReal() {
    return imag == 0d;
  }

  /** Returns the complex conjugate. Its name has a "*" suffix, unless the
   * value is real. */
  public ComplexSymbol conjugate() {
    if (isReal()) {
      return this;
    }
    final String conjugateName =
        name.endsWith("*") ? name.substring(0, name.length() - 1) : name + "*";
    return new ComplexSymbol(conjugateName, real, -imag, properties);
  }
}

// End ComplexSymbol.java
