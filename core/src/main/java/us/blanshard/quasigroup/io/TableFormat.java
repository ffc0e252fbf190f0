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

import us.blanshard.quasigroup.core.CayleyTable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import com.google.common.primitives.Ints;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Iterator;
import java.util.List;

/**
 * Static methods that read and write Cayley tables in their text form: the
 * order on the first line, followed by one line per row holding the row's
 * entries separated by spaces.  When reading, line breaks carry no meaning
 * and anything after the last entry is ignored, so saved analysis reports
 * can be read back as tables.
 *
 * @author Luke Blanshard
 */
public final class TableFormat {
  private TableFormat() {}

  private static final Splitter SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final Joiner JOINER = Joiner.on(' ');

  /** Reads a table from the given file. */
  public static CayleyTable read(File file) throws IOException {
    return parse(Files.asCharSource(file, UTF_8).read());
  }

  /** Reads a table from the given reader, which is consumed but not closed. */
  public static CayleyTable read(Reader reader) throws IOException {
    return parse(CharStreams.toString(reader));
  }

  /** Parses the text form of a table. */
  public static CayleyTable parse(String text) throws TableFormatException {
    List<String> list = SPLITTER.splitToList(text);
    Iterator<String> tokens = list.iterator();
    int order = nextInt(tokens, "the order");
    if (order <= 0)
      throw new TableFormatException("order must be positive, was " + order);
    long available = list.size() - 1;
    if ((long) order * order > available)
      throw new TableFormatException(String.format(
          "missing entry (%d, %d)", available / order, available % order));
    int[][] cells = new int[order][order];
    for (int row = 0; row < order; ++row) {
      for (int col = 0; col < order; ++col) {
        int value = nextInt(tokens, "entry (" + row + ", " + col + ")");
        if (value < 0 || value >= order)
          throw new TableFormatException(String.format(
              "entry (%d, %d) is %d, outside [0, %d)", row, col, value, order));
        cells[row][col] = value;
      }
    }
    return CayleyTable.of(cells);
  }

  private static int nextInt(Iterator<String> tokens, String what) throws TableFormatException {
    if (!tokens.hasNext())
      throw new TableFormatException("missing " + what);
    String token = tokens.next();
    Integer value = Ints.tryParse(token);
    if (value == null)
      throw new TableFormatException("expected a number for " + what + ", found \"" + token + "\"");
    return value;
  }

  /** Writes the table to the given file, replacing its contents. */
  public static void write(CayleyTable table, File file) throws IOException {
    Files.asCharSink(file, UTF_8).write(format(table));
  }

  /** Writes the table to the given writer, which is not closed. */
  public static void write(CayleyTable table, Writer writer) throws IOException {
    writer.write(format(table));
    writer.flush();
  }

  /** Returns the text form of the table. */
  public static String format(CayleyTable table) {
    return table.toString();
  }

  /**
   * Renders the table for people to read: a header of column numbers, a rule,
   * and each row prefixed by its row number.
   */
  public static String render(CayleyTable table) {
    int order = table.order();
    int[] columns = new int[order];
    for (int col = 0; col < order; ++col)
      columns[col] = col;
    StringBuilder sb = new StringBuilder("  | ");
    JOINER.appendTo(sb, Ints.asList(columns)).append('\n');
    sb.append("--+-").append(Strings.repeat("--", order)).append('\n');
    for (int row = 0; row < order; ++row) {
      sb.append(row).append(" | ");
      JOINER.appendTo(sb, Ints.asList(table.row(row))).append('\n');
    }
    return sb.toString();
  }
}
