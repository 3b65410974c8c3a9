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
package net.hydromatic.quanta.algebra;

import net.hydromatic.quanta.model.Index;
import net.hydromatic.quanta.model.IndexSet;
import net.hydromatic.quanta.model.Tensor;

/** Creates the tensors that occur in electronic-structure theory. */
public class TensorFactory {
  private TensorFactory() {}

  /** Creates a one-electron integral such as "h[p,q]". It is Hermitian. */
  public static Tensor oneElectronIntegral(String name, Index i, Index j) {
    return new Tensor(name, IndexSet.of(i, j), Tensor.Type.HERMITIAN);
  }

  /** Creates a two-electron integral such as "v[p,q,r,s]". */
  public static Tensor twoElectronIntegral(
      String name, Index i, Index j, Index k, Index l) {
    return new Tensor(name, IndexSet.of(i, j, k, l), Tensor.Type.GENERAL);
  }

  /** Creates the singles amplitude "t1[i,a]". */
  public static Tensor amplitudeSingles(Index i, Index a) {
    return new Tensor("t1", IndexSet.of(i, a), Tensor.Type.GENERAL);
  }

  /** Creates the doubles amplitude "t2[i,j,a,b]", which is antisymmetric. */
  public static Tensor amplitudeDoubles(Index i, Index j, Index a, Index b) {
    return new Tensor("t2", IndexSet.of(i, j, a, b), Tensor.Type.ANTISYMMETRIC);
  }

  public static Tensor densityMatrix(String name, Index p, Index q) {
    return new Tensor(name, IndexSet.of(p, q), Tensor.Type.HERMITIAN);
  }

  /** Creates the Kronecker delta "δ[i,j]". */
  public static Tensor kroneckerDelta(Index i, Index j) {
    return new Tensor(Tensor.DELTA, IndexSet.of(i, j), Tensor.Type.SYMMETRIC);
  }

  /** Creates the zero tensor with given indices. */
  public static Tensor zero(IndexSet indices) {
    return new Tensor("0", indices, Tensor.Type.SYMMETRIC);
  }
}

// End TensorFactory.java
