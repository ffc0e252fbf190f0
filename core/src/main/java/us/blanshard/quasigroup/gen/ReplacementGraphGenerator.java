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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.quasigroup.core.CayleyTable;
import us.blanshard.quasigroup.core.SymbolSet;

import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Generates random Latin squares row by row.  Each cell of a row gets a
 * random symbol that is still free both in its column and in the row.  When
 * no such symbol exists, a symbol that is free in the column but already used
 * earlier in the row is evicted by a random chain of replacements among the
 * row's earlier cells, after which the row carries on.  Rows are never
 * restarted and the generator never backtracks.
 *
 * <p> An instance is a single generation session: it owns the per-column
 * availability for one table and must not be shared between threads or used
 * for more than one table.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class ReplacementGraphGenerator {

  private static final Logger logger = Logger.getLogger(ReplacementGraphGenerator.class.getName());

  private final int order;
  private final Random random;
  private final SymbolSet[] availableInColumns;
  private boolean used;
  private int repairCount;
  private int chainSteps;

  public ReplacementGraphGenerator(int order, Random random) {
    checkArgument(order > 0, "order must be positive, was %s", order);
    this.order = order;
    this.random = checkNotNull(random);
    this.availableInColumns = new SymbolSet[order];
    for (int col = 0; col < order; ++col)
      availableInColumns[col] = SymbolSet.full(order);
  }

  /** Generates a random Latin square of the given order. */
  public static CayleyTable generate(int order, Random random) {
    return new ReplacementGraphGenerator(order, random).generate();
  }

  /** Builds the table.  May be called only once per instance. */
  public CayleyTable generate() {
    checkState(!used, "generator already used");
    used = true;
    CayleyTable.Builder builder = CayleyTable.builder(order);
    for (int row = 0; row < order; ++row)
      builder.setRow(row, new RowBuilder(row).build());
    if (logger.isLoggable(Level.FINE))
      logger.fine(String.format("Generated order %d with %d repairs, %d chain steps",
                                order, repairCount, chainSteps));
    return builder.build();
  }

  /** The number of times a conflict had to be repaired by a replacement chain. */
  public int getRepairCount() {
    return repairCount;
  }

  /** The total number of replacements made by all chains. */
  public int getChainSteps() {
    return chainSteps;
  }

  /** The transient state for filling one row. */
  private class RowBuilder {
    private final int rowIndex;
    private final SymbolSet availableInRow = SymbolSet.full(order);
    private final SymbolSet[] initialAvailable = new SymbolSet[order];
    private final int[] row = new int[order];
    private int length;

    RowBuilder(int rowIndex) {
      this.rowIndex = rowIndex;
      for (int col = 0; col < order; ++col)
        initialAvailable[col] = SymbolSet.copyOf(availableInColumns[col]);
    }

    int[] build() {
      while (length < order) {
        SymbolSet valid = availableInColumns[length].intersect(availableInRow);
        if (!valid.isEmpty()) {
          int symbol = valid.choose(random);
          availableInColumns[length].remove(symbol);
          availableInRow.remove(symbol);
          row[length++] = symbol;
        } else {
          ReplacementGraph graph = ReplacementGraph.fromSnapshot(initialAvailable, length);
          makeAvailable(availableInColumns[length].choose(random), graph);
        }
      }
      return row;
    }

    /**
     * Frees the given symbol, which is already placed in this row, by walking
     * a chain of replacements through the row's filled cells.  Ends when the
     * chain places a symbol that was not yet in the row.
     */
    private void makeAvailable(int initialSymbol, ReplacementGraph graph) {
      ++repairCount;
      int steps = 0;
      graph.exclude(initialSymbol);
      int oldSymbol = initialSymbol;
      int oldIndex = indexOf(oldSymbol);
      SymbolSet path = SymbolSet.empty(order);
      while (true) {
        int newSymbol = graph.choices(oldIndex, path).choose(random);
        int newIndex = indexOf(newSymbol);
        row[oldIndex] = newSymbol;
        path.add(newSymbol);
        ++steps;
        if (indexOf(oldSymbol) == length)
          availableInRow.add(oldSymbol);
        availableInRow.remove(newSymbol);
        availableInColumns[oldIndex].add(oldSymbol);
        availableInColumns[oldIndex].remove(newSymbol);
        if (newIndex == length)
          break;
        oldIndex = newIndex;
        oldSymbol = newSymbol;
      }
      chainSteps += steps;
      if (logger.isLoggable(Level.FINER))
        logger.finer(String.format("Row %d column %d: freed %d after %d replacements",
                                   rowIndex, length, initialSymbol, steps));
    }

    /** Returns the column holding the symbol, or the row's length if it's absent. */
    private int indexOf(int symbol) {
      for (int i = 0; i < length; ++i)
        if (row[i] == symbol) return i;
      return length;
    }
  }
}
