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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import us.blanshard.quasigroup.gen.CyclicGroups;

import org.junit.Test;

public class QuasigroupTest {

  @Test public void apply() {
    Quasigroup q = new Quasigroup(CyclicGroups.table(5));
    assertEquals(5, q.order());
    for (int a = 0; a < 5; ++a)
      for (int b = 0; b < 5; ++b)
        assertEquals((a + b) % 5, q.apply(a, b));
  }

  @Test public void applyOutOfRange() {
    for (int order : new int[] {1, 2, 3, 5, 8}) {
      Quasigroup q = new Quasigroup(CyclicGroups.table(order));
      assertOutOfRange(q, -1, 0);
      assertOutOfRange(q, 0, -1);
      assertOutOfRange(q, order, 0);
      assertOutOfRange(q, 0, order);
      assertOutOfRange(q, order, order);
      assertOutOfRange(q, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }
  }

  @Test public void table() {
    CayleyTable table = CyclicGroups.table(3);
    Quasigroup q = new Quasigroup(table);
    assertSame(table, q.table());
    assertEquals(new Quasigroup(CyclicGroups.table(3)), q);
  }

  @Test(expected = NullPointerException.class)
  public void nullTable() {
    new Quasigroup(null);
  }

  private static void assertOutOfRange(Quasigroup q, int a, int b) {
    try {
      q.apply(a, b);
      fail("expected failure for (" + a + ", " + b + ") in order " + q.order());
    } catch (IndexOutOfBoundsException expected) {
    }
  }
}
