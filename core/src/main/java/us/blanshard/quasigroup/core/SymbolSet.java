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
import static com.google.common.base.Preconditions.checkState;

import java.util.AbstractSet;
import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A mutable set of the symbols of a quasigroup of a given order, that is, of
 * the integers in {@code [0, order)}.  Iterates in ascending order, which
 * makes random choices from the set reproducible for a seeded Random.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class SymbolSet extends AbstractSet<Integer> implements Set<Integer> {

  private final int order;
  private final BitSet bits;

  private SymbolSet(int order, BitSet bits) {
    this.order = order;
    this.bits = bits;
  }

  /** Returns an empty set of symbols for the given order. */
  public static SymbolSet empty(int order) {
    checkArgument(order >= 0, "negative order %s", order);
    return new SymbolSet(order, new BitSet(order));
  }

  /** Returns the set of all symbols {@code 0..order-1}. */
  public static SymbolSet full(int order) {
    SymbolSet answer = empty(order);
    answer.bits.set(0, order);
    return answer;
  }

  /** Returns a new set with the same order and members as the given one. */
  public static SymbolSet copyOf(SymbolSet set) {
    return new SymbolSet(set.order, (BitSet) set.bits.clone());
  }

  /** The number of symbols this set may hold. */
  public int order() {
    return order;
  }

  public boolean contains(int symbol) {
    return symbol >= 0 && symbol < order && bits.get(symbol);
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Integer) {
      return contains(((Integer) o).intValue());
    }
    return false;
  }

  /** Adds the given symbol, tells whether the set changed. */
  public boolean add(int symbol) {
    checkElementIndex(symbol, order, "symbol");
    if (bits.get(symbol)) return false;
    bits.set(symbol);
    return true;
  }

  @Override public boolean add(Integer symbol) {
    return add(symbol.intValue());
  }

  /** Removes the given symbol, tells whether the set changed. */
  public boolean remove(int symbol) {
    if (!contains(symbol)) return false;
    bits.clear(symbol);
    return true;
  }

  @Override public boolean remove(Object o) {
    if (o instanceof Integer) {
      return remove(((Integer) o).intValue());
    }
    return false;
  }

  /** Removes every member of the given set from this one. */
  public SymbolSet removeAll(SymbolSet that) {
    bits.andNot(that.bits);
    return this;
  }

  @Override public void clear() {
    bits.clear();
  }

  /** Returns a new set holding the symbols in both this set and the other. */
  public SymbolSet intersect(SymbolSet that) {
    checkArgument(this.order == that.order, "orders differ: %s vs %s", this.order, that.order);
    BitSet answer = (BitSet) this.bits.clone();
    answer.and(that.bits);
    return new SymbolSet(order, answer);
  }

  /** Returns the symbol at the given index within this set. */
  public int get(int index) {
    checkElementIndex(index, size());
    int symbol = bits.nextSetBit(0);
    while (index-- > 0)
      symbol = bits.nextSetBit(symbol + 1);
    return symbol;
  }

  /** Returns a member of this set chosen uniformly at random. */
  public int choose(Random random) {
    checkState(!isEmpty(), "no symbols to choose from");
    return get(random.nextInt(size()));
  }

  @Override public boolean isEmpty() {
    return bits.isEmpty();
  }

  @Override public int size() {
    return bits.cardinality();
  }

  @Override public Iterator<Integer> iterator() {
    return new Iter();
  }

  private class Iter implements Iterator<Integer> {
    private int next = bits.nextSetBit(0);
    private int last = -1;

    @Override public boolean hasNext() {
      return next >= 0;
    }

    @Override public Integer next() {
      if (next < 0) throw new NoSuchElementException();
      last = next;
      next = bits.nextSetBit(next + 1);
      return last;
    }

    @Override public void remove() {
      checkState(last >= 0);
      bits.clear(last);
      last = -1;
    }
  }
}
