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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static us.blanshard.quasigroup.core.SymbolSetTest.set;

import us.blanshard.quasigroup.core.SymbolSet;

import org.junit.Test;

public class ReplacementGraphTest {

  private static final SymbolSet[] SNAPSHOT = {
      set(4, 0, 1, 3), set(4), set(4, 1, 2), set(4, 0, 2, 3)};

  @Test public void fromSnapshot() {
    ReplacementGraph graph = ReplacementGraph.fromSnapshot(SNAPSHOT, 2);
    assertEquals(set(4, 0, 1, 3), graph.choices(0, SymbolSet.empty(4)));
    assertEquals(set(4, 1, 2), graph.choices(2, SymbolSet.empty(4)));
  }

  @Test(expected = IllegalStateException.class)
  public void columnPastTheLastIsAbsent() {
    ReplacementGraph.fromSnapshot(SNAPSHOT, 2).choices(3, SymbolSet.empty(4));
  }

  @Test public void copiesSnapshot() {
    ReplacementGraph graph = ReplacementGraph.fromSnapshot(SNAPSHOT, 3);
    graph.exclude(0);
    assertEquals(set(4, 1, 3), graph.choices(0, SymbolSet.empty(4)));
    assertEquals(set(4, 2, 3), graph.choices(3, SymbolSet.empty(4)));
    assertEquals(set(4, 0, 1, 3), SNAPSHOT[0]);
  }

  @Test public void choicesSkipPath() {
    ReplacementGraph graph = ReplacementGraph.fromSnapshot(SNAPSHOT, 3);
    SymbolSet path = set(4, 1);
    assertEquals(set(4, 0, 3), graph.choices(0, path));
    assertEquals(set(4, 1), path);
  }

  @Test public void choicesResetExhaustedPath() {
    ReplacementGraph graph = ReplacementGraph.fromSnapshot(SNAPSHOT, 3);
    SymbolSet path = set(4, 1, 2);
    assertEquals(set(4, 1, 2), graph.choices(2, path));
    assertTrue(path.isEmpty());
  }

  @Test(expected = IllegalStateException.class)
  public void choicesForAbsentColumn() {
    ReplacementGraph.fromSnapshot(SNAPSHOT, 3).choices(1, SymbolSet.empty(4));
  }

  @Test(expected = IllegalStateException.class)
  public void choicesForEmptiedColumn() {
    ReplacementGraph graph = ReplacementGraph.fromSnapshot(SNAPSHOT, 3);
    graph.exclude(1);
    graph.exclude(2);
    graph.choices(2, SymbolSet.empty(4));
  }
}
