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
package us.blanshard.quasigroup.core;

/**
 * Static methods that check the Latin-square property of a table: every row
 * and every column is a permutation of the symbols {@code 0..order-1}.
 *
 * @author Luke Blanshard
 */
public final class LatinSquares {
  private LatinSquares() {}

  public static boolean isLatinSquare(CayleyTable table) {
    return table.isLatinSquare();
  }

  /**
   * Tells whether the given square matrix is a Latin square.  Row {@code i}
   * and column {@code i} are checked in the same sweep.  Entries out of range
   * make the answer false rather than throwing.
   */
  public static boolean isLatinSquare(int[][] matrix) {
    int order = matrix.length;
    for (int[] row : matrix)
      if (row.length != order) return false;
    for (int i = 0; i < order; ++i) {
      boolean[] rowSeen = new boolean[order];
      boolean[] colSeen = new boolean[order];
      for (int j = 0; j < order; ++j) {
        int rowValue = matrix[i][j];
        int colValue = matrix[j][i];
        if (rowValue < 0 || rowValue >= order || colValue < 0 || colValue >= order
            || rowSeen[rowValue] || colSeen[colValue])
          return false;
        rowSeen[rowValue] = true;
        colSeen[colValue] = true;
      }
    }
    return true;
  }
}
