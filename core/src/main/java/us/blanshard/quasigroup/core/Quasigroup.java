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

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.concurrent.Immutable;

/**
 * A finite quasigroup, defined by its Cayley table.  Elements are the
 * integers {@code 0..order-1}.  Construction does not check that the table is
 * a Latin square, so this class also serves for arbitrary finite magmas read
 * from outside sources.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Quasigroup {

  private final CayleyTable table;

  public Quasigroup(CayleyTable table) {
    this.table = checkNotNull(table);
  }

  public CayleyTable table() {
    return table;
  }

  public int order() {
    return table.order();
  }

  /**
   * Returns the product of the two elements.
   *
   * @throws IndexOutOfBoundsException if either element is outside
   *     {@code [0, order)}
   */
  public int apply(int a, int b) {
    int order = table.order();
    if (a < 0 || a >= order || b < 0 || b >= order)
      throw new IndexOutOfBoundsException(
          String.format("(%d, %d) is outside the Cayley table of order %d", a, b, order));
    return table.get(a, b);
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Quasigroup)) return false;
    return table.equals(((Quasigroup) object).table);
  }

  @Override public int hashCode() {
    return table.hashCode();
  }

  @Override public String toString() {
    return "Quasigroup of order " + order();
  }
}
