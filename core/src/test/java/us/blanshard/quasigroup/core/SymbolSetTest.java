package us.blanshard.quasigroup.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.junit.Test;

import java.util.Iterator;
import java.util.Random;

public class SymbolSetTest {

  public static SymbolSet set(int order, int... symbols) {
    SymbolSet answer = SymbolSet.empty(order);
    for (int s : symbols)
      answer.add(s);
    return answer;
  }

  @Test public void full() {
    assertEquals(ImmutableSet.of(0, 1, 2, 3), SymbolSet.full(4));
    assertEquals(0, SymbolSet.full(0).size());
    assertTrue(SymbolSet.empty(5).isEmpty());
  }

  @Test public void addRemove() {
    SymbolSet set = SymbolSet.empty(6);
    assertTrue(set.add(3));
    assertFalse(set.add(3));
    assertTrue(set.add(Integer.valueOf(5)));
    assertEquals(ImmutableSet.of(3, 5), set);
    assertTrue(set.remove(3));
    assertFalse(set.remove(3));
    assertFalse(set.remove(99));
    assertFalse(set.remove("5"));
    assertEquals(ImmutableSet.of(5), set);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void addOutOfRange() {
    SymbolSet.empty(3).add(3);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void addNegative() {
    SymbolSet.empty(3).add(-1);
  }

  @Test public void contains() {
    SymbolSet set = set(9, 1, 3, 7, 8);
    assertTrue(set.contains(3));
    assertFalse(set.contains(2));
    assertFalse(set.contains(-1));
    assertFalse(set.contains(9));
    assertFalse(set.contains((Object) "3"));
  }

  @Test public void intersect() {
    SymbolSet a = set(7, 3, 4, 5);
    SymbolSet b = set(7, 4, 5, 6);
    assertEquals(set(7, 4, 5), a.intersect(b));
    assertEquals(set(7, 3, 4, 5), a);  // Unchanged.
    assertEquals(set(7), set(7, 1).intersect(set(7, 2)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void intersectDifferentOrders() {
    SymbolSet.full(3).intersect(SymbolSet.full(4));
  }

  @Test public void removeAll() {
    assertEquals(set(9, 2, 3), set(9, 1, 2, 3, 8).removeAll(set(9, 1, 8)));
  }

  @Test public void copyOf() {
    SymbolSet original = set(5, 1, 2);
    SymbolSet copy = SymbolSet.copyOf(original);
    copy.remove(1);
    assertEquals(set(5, 1, 2), original);
    assertEquals(set(5, 2), copy);
    assertEquals(5, copy.order());
  }

  @Test public void get() {
    SymbolSet set = set(10, 2, 5, 9);
    assertEquals(2, set.get(0));
    assertEquals(5, set.get(1));
    assertEquals(9, set.get(2));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void getPastEnd() {
    set(10, 2, 5, 9).get(3);
  }

  @Test public void iterator() {
    SymbolSet set = set(10, 9, 2, 8);
    Iterator<Integer> it = set.iterator();
    assertTrue(it.hasNext());
    assertEquals(2, (int) it.next());
    assertEquals(8, (int) it.next());
    it.remove();
    assertEquals(9, (int) it.next());
    assertFalse(it.hasNext());
    assertEquals(set(10, 2, 9), set);
  }

  @Test public void choose() {
    Random random = new Random(42);
    SymbolSet set = set(20, 3, 11, 17);
    SymbolSet seen = SymbolSet.empty(20);
    for (int i = 0; i < 200; ++i) {
      int symbol = set.choose(random);
      assertTrue(set.contains(symbol));
      seen.add(symbol);
    }
    assertEquals(set, seen);
  }

  @Test public void chooseIsReproducible() {
    SymbolSet set = SymbolSet.full(12);
    Random r1 = new Random(7);
    Random r2 = new Random(7);
    for (int i = 0; i < 50; ++i)
      assertEquals(set.choose(r1), set.choose(r2));
  }

  @Test(expected = IllegalStateException.class)
  public void chooseFromEmpty() {
    SymbolSet.empty(4).choose(new Random(0));
  }

  @Test public void equalsOtherSets() {
    assertEquals(Lists.newArrayList(0, 2), Lists.newArrayList(set(3, 2, 0)));
    assertEquals(set(3, 0, 2).hashCode(), ImmutableSet.of(0, 2).hashCode());
  }
}
