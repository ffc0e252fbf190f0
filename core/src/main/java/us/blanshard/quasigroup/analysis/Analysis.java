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

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * The outcome of running both subquasigroup checks on a quasigroup.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Analysis {
  public final boolean hasProper;
  public final boolean hasNonTrivial;

  public Analysis(boolean hasProper, boolean hasNonTrivial) {
    this.hasProper = hasProper;
    this.hasNonTrivial = hasNonTrivial;
  }

  /** Returns the result of the given check. */
  public boolean get(SubquasigroupCheck check) {
    return check == SubquasigroupCheck.PROPER ? hasProper : hasNonTrivial;
  }

  /** Tells whether both kinds of subquasigroup were found. */
  public boolean hasProperAndNonTrivial() {
    return hasProper && hasNonTrivial;
  }

  /** A one-sentence summary of the combined result. */
  public String summary() {
    return hasProperAndNonTrivial()
        ? "The quasigroup contains proper non-trivial subquasigroups."
        : "The quasigroup does not contain both proper and non-trivial subquasigroups.";
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Analysis)) return false;
    Analysis that = (Analysis) object;
    return this.hasProper == that.hasProper && this.hasNonTrivial == that.hasNonTrivial;
  }

  @Override public int hashCode() {
    return Objects.hashCode(hasProper, hasNonTrivial);
  }

  @Override public String toString() {
    return "proper: " + hasProper + ", non-trivial: " + hasNonTrivial;
  }
}
