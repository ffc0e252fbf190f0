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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.primitives.Ints;

import java.util.Arrays;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable Cayley table: an {@code order x order} matrix of symbols in
 * {@code [0, order)} defining a binary operation.  The table does not insist
 * on being a Latin square; see {@link LatinSquares} for that.  The nested
 * Builder class is a mutable working grid used while a table is constructed.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class CayleyTable {

  private static final Joiner SPACE_JOINER = Joiner.on(' ');

  private final int[][] cells;

  private CayleyTable(int[][] cells) {
    this.cells = cells;
  }

  /**
   * Returns a table holding a copy of the given matrix, which must be square,
   * non-empty, and contain only symbols in range.
   */
  public static CayleyTable of(int[][] matrix) {
    checkNotNull(matrix);
    int order = matrix.length;
    checkArgument(order > 0, "empty table");
    int[][] cells = new int[order][];
    for (int row = 0; row < order; ++row) {
      checkArgument(matrix[row].length == order,
          "row %s has %s entries, expected %s", row, matrix[row].length, order);
      for (int col = 0; col < order; ++col) {
        int value = matrix[row][col];
        checkArgument(value >= 0 && value < order,
            "entry (%s, %s) is %s, outside [0, %s)", row, col, value, order);
      }
      cells[row] = matrix[row].clone();
    }
    return new CayleyTable(cells);
  }

  /** Returns a new Builder for a table of the given order. */
  public static Builder builder(int order) {
    return new Builder(order);
  }

  /** The number of elements of the operation's underlying set. */
  public int order() {
    return cells.length;
  }

  /** Returns the entry at the given row and column. */
  public int get(int row, int col) {
    checkElementIndex(row, cells.length, "row");
    checkElementIndex(col, cells.length, "column");
    return cells[row][col];
  }

  /** Returns a copy of the given row. */
  public int[] row(int row) {
    checkElementIndex(row, cells.length, "row");
    return cells[row].clone();
  }

  /** Returns a copy of the whole matrix. */
  public int[][] toArray() {
    int[][] answer = new int[cells.length][];
    for (int row = 0; row < cells.length; ++row)
      answer[row] = cells[row].clone();
    return answer;
  }

  /** Tells whether this table is a Latin square. */
  public boolean isLatinSquare() {
    return LatinSquares.isLatinSquare(cells);
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof CayleyTable)) return false;
    CayleyTable that = (CayleyTable) object;
    return Arrays.deepEquals(this.cells, that.cells);
  }

  @Override public int hashCode() {
    return Arrays.deepHashCode(cells);
  }

  /** Renders the table as its order followed by one line per row. */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder().append(cells.length).append('\n');
    for (int[] row : cells)
      SPACE_JOINER.appendTo(sb, Ints.asList(row)).append('\n');
    return sb.toString();
  }

  /**
   * A mutable grid of the right shape for a table.  Cells start out unset;
   * every cell must be set before the table can be built.
   */
  @NotThreadSafe
  public static final class Builder {
    private static final int UNSET = -1;

    private final int[][] cells;

    private Builder(int order) {
      checkArgument(order > 0, "order must be positive, was %s", order);
      this.cells = new int[order][order];
      for (int[] row : cells)
        Arrays.fill(row, UNSET);
    }

    public int order() {
      return cells.length;
    }

    /** Returns the symbol at the given cell, or -1 if it isn't set. */
    public int get(int row, int col) {
      checkElementIndex(row, cells.length, "row");
      checkElementIndex(col, cells.length, "column");
      return cells[row][col];
    }

    /** Sets the symbol for the given cell. */
    public Builder set(int row, int col, int value) {
      checkElementIndex(row, cells.length, "row");
      checkElementIndex(col, cells.length, "column");
      checkElementIndex(value, cells.length, "value");
      cells[row][col] = value;
      return this;
    }

    /** Sets a whole row at once. */
    public Builder setRow(int row, int[] values) {
      checkArgument(values.length == cells.length,
          "row has %s entries, expected %s", values.length, cells.length);
      for (int col = 0; col < values.length; ++col)
        set(row, col, values[col]);
      return this;
    }

    /** Returns an immutable table built from this grid. */
    public CayleyTable build() {
      for (int row = 0; row < cells.length; ++row)
        for (int col = 0; col < cells.length; ++col)
          checkState(cells[row][col] != UNSET, "cell (%s, %s) is not set", row, col);
      return CayleyTable.of(cells);
    }
  }
}
