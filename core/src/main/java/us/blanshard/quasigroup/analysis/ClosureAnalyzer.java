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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.quasigroup.core.Quasigroup;
import us.blanshard.quasigroup.core.SymbolSet;

import com.google.common.primitives.Ints;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Decides whether a quasigroup has proper or non-trivial closed subsets.
 *
 * <p> The search seeds candidate subsets with squaring orbits: starting from
 * an element not yet covered, it follows {@code x -> x*x} until the walk
 * repeats itself, then closes the orbit under the operation.  Elements seen
 * on any orbit are not used as starting points again.  Each closure pass
 * multiplies every ordered pair of the current set, and passes repeat until
 * nothing new turns up, so the whole search is {@code O(n^4)} in the worst
 * case.
 *
 * <p> The analyzer only reads the quasigroup, so one instance may be shared
 * by several threads.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ClosureAnalyzer {

  private final Quasigroup quasigroup;

  public ClosureAnalyzer(Quasigroup quasigroup) {
    this.quasigroup = checkNotNull(quasigroup);
  }

  public Quasigroup quasigroup() {
    return quasigroup;
  }

  public int order() {
    return quasigroup.order();
  }

  /**
   * Tells whether the quasigroup has a closed subset of the kind the given
   * check looks for.
   */
  public boolean hasSubquasigroups(SubquasigroupCheck check) {
    int order = order();
    boolean[] visited = new boolean[order];
    for (int start = 0; start < order; ++start) {
      if (visited[start]) continue;
      SymbolSet orbit = squaringOrbit(start);
      for (int element : orbit)
        visited[element] = true;
      if (check.seedYields(this, orbit))
        return true;
    }
    return false;
  }

  /**
   * Tells whether the quasigroup has proper subquasigroups (if the flag is
   * true) or non-trivial ones (if false).
   */
  public boolean hasSubquasigroups(boolean checkProper) {
    return hasSubquasigroups(SubquasigroupCheck.of(checkProper));
  }

  public boolean hasProperSubquasigroups() {
    return hasSubquasigroups(SubquasigroupCheck.PROPER);
  }

  public boolean hasNonTrivialSubquasigroups() {
    return hasSubquasigroups(SubquasigroupCheck.NON_TRIVIAL);
  }

  /** Runs both checks. */
  public Analysis analyze() {
    return new Analysis(hasProperSubquasigroups(), hasNonTrivialSubquasigroups());
  }

  /**
   * Returns the elements reached from the given one by repeated squaring,
   * including the starting element itself.
   */
  public SymbolSet squaringOrbit(int start) {
    SymbolSet orbit = SymbolSet.empty(order());
    int element = start;
    while (orbit.add(element))
      element = quasigroup.apply(element, element);
    return orbit;
  }

  /** Returns the smallest superset of the given seed that is closed. */
  public SymbolSet closure(SymbolSet seed) {
    return closure(seed, Integer.MAX_VALUE);
  }

  /**
   * Computes the closure of the given seed, giving up and returning null as
   * soon as an insertion makes the set larger than {@code maxSize}.
   */
  @Nullable SymbolSet closure(SymbolSet seed, int maxSize) {
    checkArgument(seed.order() == order(), "seed of order %s for quasigroup of order %s",
        seed.order(), order());
    SymbolSet closed = SymbolSet.copyOf(seed);
    boolean changed = true;
    while (changed) {
      changed = false;
      int[] elements = Ints.toArray(closed);
      for (int a : elements) {
        for (int b : elements) {
          if (closed.add(quasigroup.apply(a, b))) {
            changed = true;
            if (closed.size() > maxSize)
              return null;
          }
        }
      }
    }
    return closed;
  }
}
