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

import static com.google.common.base.Preconditions.checkState;

import us.blanshard.quasigroup.core.SymbolSet;

import com.google.common.collect.Maps;

import java.util.SortedMap;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The symbols that may be moved into each already-filled column of the row
 * being repaired by a {@link ReplacementGraphGenerator}.  Columns with no
 * options are absent from the graph, which is distinct from being present
 * with an empty set of options.
 */
@NotThreadSafe
final class ReplacementGraph {

  private final SortedMap<Integer, SymbolSet> options = Maps.newTreeMap();

  /**
   * Builds the graph for columns {@code 0..lastColumn} from the columns'
   * availability as it was at the start of the row.
   */
  static ReplacementGraph fromSnapshot(SymbolSet[] initialAvailable, int lastColumn) {
    ReplacementGraph graph = new ReplacementGraph();
    for (int col = lastColumn; col >= 0; --col) {
      if (!initialAvailable[col].isEmpty())
        graph.options.put(col, SymbolSet.copyOf(initialAvailable[col]));
    }
    return graph;
  }

  /** Removes the given symbol from every column's options. */
  void exclude(int symbol) {
    for (SymbolSet set : options.values())
      set.remove(symbol);
  }

  /**
   * Returns the options for the given column that are not in the path, or all
   * of its options when the path has used them all up.
   */
  SymbolSet choices(int column, SymbolSet path) {
    SymbolSet set = options.get(column);
    checkState(set != null, "no replacement options recorded for column %s", column);
    SymbolSet answer = SymbolSet.copyOf(set).removeAll(path);
    if (answer.isEmpty()) {
      path.clear();
      answer = SymbolSet.copyOf(set);
    }
    checkState(!answer.isEmpty(), "column %s has no replacement options left", column);
    return answer;
  }
}
