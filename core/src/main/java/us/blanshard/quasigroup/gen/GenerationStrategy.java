/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.quasigroup.gen;

import us.blanshard.quasigroup.core.CayleyTable;

import java.util.Random;

/**
 * The ways of producing a quasigroup of a given order without outside input.
 *
 * @author Luke Blanshard
 */
public enum GenerationStrategy {

  /** The cyclic group: addition modulo the order.  Ignores the Random. */
  CYCLIC {
    @Override public CayleyTable generate(Random random, int order) {
      return CyclicGroups.table(order);
    }
  },

  /** An affine quasigroup with random admissible coefficients and permutation. */
  AFFINE {
    @Override public CayleyTable generate(Random random, int order) {
      int alpha = AffineQuasigroups.randomCoefficient(order, random);
      int beta = AffineQuasigroups.randomCoefficient(order, random);
      int c = random.nextInt(order);
      return AffineQuasigroups.table(
          order, alpha, beta, c, AffineQuasigroups.randomPermutation(order, random));
    }
  },

  /** A random Latin square built by the sequential replacement-graph method. */
  REPLACEMENT_GRAPH {
    @Override public CayleyTable generate(Random random, int order) {
      return ReplacementGraphGenerator.generate(order, random);
    }
  };

  /** Produces a table of the given order, which must be positive. */
  public abstract CayleyTable generate(Random random, int order);
}
