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

import us.blanshard.quasigroup.core.CayleyTable;

/**
 * Builds Cayley tables of cyclic groups.
 */
public final class CyclicGroups {
  private CyclicGroups() {}

  /** Returns the table of addition modulo the given order. */
  public static CayleyTable table(int order) {
    checkArgument(order > 0, "order must be positive, was %s", order);
    CayleyTable.Builder builder = CayleyTable.builder(order);
    for (int row = 0; row < order; ++row)
      for (int col = 0; col < order; ++col)
        builder.set(row, col, (row + col) % order);
    return builder.build();
  }
}
