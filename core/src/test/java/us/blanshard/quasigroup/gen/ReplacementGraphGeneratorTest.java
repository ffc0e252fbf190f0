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

import us.blanshard.quasigroup.core.CayleyTable;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Random;
import java.util.Set;

public class ReplacementGraphGeneratorTest {

  private final Random random = new Random(123);

  @Test public void latinSquaresOfManyOrders() {
    for (int order : new int[] {1, 2, 3, 5, 8, 13}) {
      for (int run = 0; run < 20; ++run) {
        CayleyTable table = ReplacementGraphGenerator.generate(order, random);
        assertEquals(order, table.order());
        assertTrue("order " + order + ":\n" + table, table.isLatinSquare());
      }
    }
  }

  @Test public void largerOrders() {
    for (int order : new int[] {17, 24, 31}) {
      assertTrue(ReplacementGraphGenerator.generate(order, random).isLatinSquare());
    }
  }

  @Test public void orderOne() {
    assertEquals(CayleyTable.of(new int[][] {{0}}), ReplacementGraphGenerator.generate(1, random));
  }

  @Test public void reproducibleForSeed() {
    for (int order : new int[] {4, 9, 13}) {
      assertEquals(ReplacementGraphGenerator.generate(order, new Random(77)),
                   ReplacementGraphGenerator.generate(order, new Random(77)));
    }
  }

  @Test public void variesWithSeed() {
    Set<CayleyTable> tables = Sets.newHashSet();
    for (long seed = 0; seed < 10; ++seed)
      tables.add(ReplacementGraphGenerator.generate(8, new Random(seed)));
    assertTrue(tables.size() > 1);
  }

  @Test public void conflictsAreRepaired() {
    int repairs = 0;
    for (int run = 0; run < 20; ++run) {
      ReplacementGraphGenerator generator = new ReplacementGraphGenerator(13, random);
      assertTrue(generator.generate().isLatinSquare());
      assertTrue(generator.getChainSteps() >= generator.getRepairCount());
      repairs += generator.getRepairCount();
    }
    assertTrue(repairs > 0);
  }

  @Test public void smallOrdersNeverConflict() {
    // With two symbols the second row is forced and always free.
    for (int run = 0; run < 10; ++run) {
      ReplacementGraphGenerator generator = new ReplacementGraphGenerator(2, random);
      generator.generate();
      assertEquals(0, generator.getRepairCount());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void singleUse() {
    ReplacementGraphGenerator generator = new ReplacementGraphGenerator(3, random);
    generator.generate();
    generator.generate();
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsZeroOrder() {
    new ReplacementGraphGenerator(0, random);
  }

  @Test(expected = NullPointerException.class)
  public void requiresRandom() {
    new ReplacementGraphGenerator(3, null);
  }
}
