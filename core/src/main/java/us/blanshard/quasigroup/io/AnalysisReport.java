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
package us.blanshard.quasigroup.io;

import static java.nio.charset.StandardCharsets.UTF_8;

import us.blanshard.quasigroup.analysis.Analysis;
import us.blanshard.quasigroup.core.CayleyTable;

import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes the results of analyzing a quasigroup: the table in its text form,
 * followed by the verdicts of both subquasigroup checks.
 */
public final class AnalysisReport {
  private AnalysisReport() {}

  public static void write(CayleyTable table, Analysis analysis, File file) throws IOException {
    Files.asCharSink(file, UTF_8).write(format(table, analysis));
  }

  public static void write(CayleyTable table, Analysis analysis, Writer writer)
      throws IOException {
    writer.write(format(table, analysis));
    writer.flush();
  }

  public static String format(CayleyTable table, Analysis analysis) {
    return new StringBuilder(TableFormat.format(table))
        .append("\nResults:\n")
        .append("- Proper subquasigroups: ").append(verdict(analysis.hasProper)).append('\n')
        .append("- Non-trivial subquasigroups: ").append(verdict(analysis.hasNonTrivial))
        .append('\n')
        .append(analysis.summary()).append('\n')
        .toString();
  }

  /** The word used for a check's outcome. */
  public static String verdict(boolean present) {
    return present ? "present" : "absent";
  }
}
