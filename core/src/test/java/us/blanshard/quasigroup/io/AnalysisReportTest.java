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
import static org.junit.Assert.assertEquals;

import us.blanshard.quasigroup.analysis.Analysis;
import us.blanshard.quasigroup.analysis.ClosureAnalyzer;
import us.blanshard.quasigroup.core.CayleyTable;
import us.blanshard.quasigroup.core.Quasigroup;
import us.blanshard.quasigroup.gen.CyclicGroups;

import com.google.common.io.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.StringWriter;

public class AnalysisReportTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private static final String CYCLIC_4_REPORT = "4\n"
      + "0 1 2 3\n"
      + "1 2 3 0\n"
      + "2 3 0 1\n"
      + "3 0 1 2\n"
      + "\n"
      + "Results:\n"
      + "- Proper subquasigroups: present\n"
      + "- Non-trivial subquasigroups: present\n"
      + "The quasigroup contains proper non-trivial subquasigroups.\n";

  @Test public void format() {
    CayleyTable table = CyclicGroups.table(4);
    Analysis analysis = new ClosureAnalyzer(new Quasigroup(table)).analyze();
    assertEquals(CYCLIC_4_REPORT, AnalysisReport.format(table, analysis));
  }

  @Test public void absent() {
    CayleyTable table = CyclicGroups.table(1);
    Analysis analysis = new ClosureAnalyzer(new Quasigroup(table)).analyze();
    assertEquals("1\n0\n\nResults:\n"
        + "- Proper subquasigroups: absent\n"
        + "- Non-trivial subquasigroups: absent\n"
        + "The quasigroup does not contain both proper and non-trivial subquasigroups.\n",
        AnalysisReport.format(table, analysis));
  }

  @Test public void writeAndReadBack() throws Exception {
    CayleyTable table = CyclicGroups.table(4);
    Analysis analysis = new Analysis(true, true);
    File file = folder.newFile("report.txt");
    AnalysisReport.write(table, analysis, file);
    assertEquals(CYCLIC_4_REPORT, Files.asCharSource(file, UTF_8).read());
    assertEquals(table, TableFormat.read(file));

    StringWriter writer = new StringWriter();
    AnalysisReport.write(table, analysis, writer);
    assertEquals(CYCLIC_4_REPORT, writer.toString());
  }

  @Test public void verdict() {
    assertEquals("present", AnalysisReport.verdict(true));
    assertEquals("absent", AnalysisReport.verdict(false));
  }
}
