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

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.quasigroup.core.CayleyTable;

import com.google.common.math.IntMath;
import com.google.common.primitives.Ints;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Builds Cayley tables of affine quasigroups over the integers modulo n,
 * where {@code a * b = (alpha * a + beta * f(b) + c) mod n} for a permutation
 * {@code f}.
 *
 * @author Luke Blanshard
 */
public final class AffineQuasigroups {
  private AffineQuasigroups() {}

  /**
   * Returns the table for the given coefficients.
   *
   * @throws IllegalArgumentException if alpha or beta is not coprime with the
   *     order, c is out of range, or f is not a permutation of the order's
   *     symbols
   */
  public static CayleyTable table(int order, int alpha, int beta, int c, int[] f) {
    checkArgument(order > 0, "order must be positive, was %s", order);
    checkArgument(isCoprime(alpha, order), "alpha %s is not coprime with %s", alpha, order);
    checkArgument(isCoprime(beta, order), "beta %s is not coprime with %s", beta, order);
    checkArgument(c >= 0 && c < order, "c must be in [0, %s), was %s", order, c);
    checkArgument(isPermutation(f, order), "f is not a permutation of 0..%s", order - 1);

    CayleyTable.Builder builder = CayleyTable.builder(order);
    for (int row = 0; row < order; ++row)
      for (int col = 0; col < order; ++col)
        builder.set(row, col, (int) (((long) alpha * row + (long) beta * f[col] + c) % order));
    return builder.build();
  }

  /** Tells whether the coefficient is usable for a quasigroup of the given order. */
  public static boolean isCoprime(int coefficient, int order) {
    return coefficient >= 0 && order > 0 && IntMath.gcd(coefficient, order) == 1;
  }

  /** Returns a random permutation of {@code 0..order-1}. */
  public static int[] randomPermutation(int order, Random random) {
    List<Integer> list = Ints.asList(identity(order));
    Collections.shuffle(list, random);
    return Ints.toArray(list);
  }

  /** Returns a random coefficient in {@code [1, order]} that is coprime with the order. */
  static int randomCoefficient(int order, Random random) {
    while (true) {
      int coefficient = 1 + random.nextInt(order);
      if (isCoprime(coefficient, order)) return coefficient;
    }
  }

  private static int[] identity(int order) {
    int[] answer = new int[order];
    for (int i = 0; i < order; ++i)
      answer[i] = i;
    return answer;
  }

  private static boolean isPermutation(int[] f, int order) {
    if (f.length != order) return false;
    boolean[] seen = new boolean[order];
    for (int value : f) {
      if (value < 0 || value >= order || seen[value]) return false;
      seen[value] = true;
    }
    return true;
  }
}
