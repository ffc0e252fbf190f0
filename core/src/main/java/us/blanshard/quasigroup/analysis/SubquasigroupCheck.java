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
package us.blanshard.quasigroup.analysis;

import us.blanshard.quasigroup.core.SymbolSet;

/**
 * The two questions the {@link ClosureAnalyzer} can answer about a
 * quasigroup.  Each value decides whether a squaring-orbit seed leads to a
 * closed subset of the kind it looks for.
 *
 * @author Luke Blanshard
 */
public enum SubquasigroupCheck {

  /**
   * Looks for a closed subset smaller than the whole quasigroup.  A seed whose
   * closure grows past half the order is abandoned without finishing the
   * closure.  That bound holds for Latin squares but not for arbitrary tables,
   * where a larger proper closed subset can be missed.
   */
  PROPER {
    @Override boolean seedYields(ClosureAnalyzer analyzer, SymbolSet seed) {
      int order = analyzer.order();
      SymbolSet closed = analyzer.closure(seed, order / 2);
      return closed != null && closed.size() < order;
    }
    @Override public String getName() {
      return "proper";
    }
  },

  /** Looks for a closed subset with more than one element. */
  NON_TRIVIAL {
    @Override boolean seedYields(ClosureAnalyzer analyzer, SymbolSet seed) {
      if (seed.size() == 1) return false;
      return analyzer.closure(seed).size() > 1;
    }
    @Override public String getName() {
      return "non-trivial";
    }
  };

  /** Tells whether the closure of the given seed answers this check. */
  abstract boolean seedYields(ClosureAnalyzer analyzer, SymbolSet seed);

  /** A lower-case name for use in messages. */
  public abstract String getName();

  /** Returns the check selected by the given flag. */
  public static SubquasigroupCheck of(boolean checkProper) {
    return checkProper ? PROPER : NON_TRIVIAL;
  }
}
