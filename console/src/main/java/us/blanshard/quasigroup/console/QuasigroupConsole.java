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
package us.blanshard.quasigroup.console;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.logging.Level.WARNING;

import us.blanshard.quasigroup.analysis.Analysis;
import us.blanshard.quasigroup.analysis.ClosureAnalyzer;
import us.blanshard.quasigroup.core.CayleyTable;
import us.blanshard.quasigroup.core.Quasigroup;
import us.blanshard.quasigroup.gen.AffineQuasigroups;
import us.blanshard.quasigroup.gen.CyclicGroups;
import us.blanshard.quasigroup.gen.ReplacementGraphGenerator;
import us.blanshard.quasigroup.io.AnalysisReport;
import us.blanshard.quasigroup.io.TableFormat;
import us.blanshard.quasigroup.io.TableJson;

import com.google.common.base.Joiner;
import com.google.common.io.Files;
import com.google.common.primitives.Ints;
import com.google.gson.JsonParseException;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.util.Random;
import java.util.Scanner;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An interactive, menu-driven shell: loads or generates a quasigroup, shows
 * its Cayley table, checks it for subquasigroups and saves the results.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public class QuasigroupConsole {

  private static final Logger logger = Logger.getLogger(QuasigroupConsole.class.getName());

  private static final String MAIN_MENU = "\nChoose an input method:\n"
      + "1 - Read from a file\n"
      + "2 - Enter manually\n"
      + "3 - Generate a cyclic group\n"
      + "4 - Generate an affine quasigroup (a * b = (alpha * a + beta * f(b) + c) mod n)\n"
      + "5 - Generate by the sequential replacement graph method\n"
      + "6 - Exit\n"
      + "Choice: ";

  private static final String ACTION_MENU = "\nActions:\n"
      + "1 - Check for proper subquasigroups\n"
      + "2 - Check for non-trivial subquasigroups\n"
      + "3 - Both checks\n"
      + "4 - Save the results to a file\n"
      + "5 - Return to the main menu\n"
      + "6 - Exit\n"
      + "Choice: ";

  /** The largest order the shell will build a table for. */
  static final int MAX_ORDER = 1000;

  private final Scanner in;
  private final PrintWriter out;
  private final Random random;

  public QuasigroupConsole(Reader in, PrintWriter out, Random random) {
    this.in = new Scanner(in);
    this.out = out;
    this.random = random;
  }

  public static void main(String[] args) throws IOException {
    configureLogging();
    long seed;
    try {
      seed = args.length > 0 ? Long.decode(args[0]) : System.currentTimeMillis();
    } catch (NumberFormatException e) {
      System.err.println("Usage: QuasigroupConsole [<seed>]");
      System.exit(1);
      return;  // Convince the compiler.
    }
    PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, UTF_8), true);
    new QuasigroupConsole(new InputStreamReader(System.in, UTF_8), out, new Random(seed)).run();
  }

  private static void configureLogging() throws IOException {
    InputStream config = QuasigroupConsole.class.getResourceAsStream("/logging.properties");
    if (config == null) return;
    try {
      LogManager.getLogManager().readConfiguration(config);
    } finally {
      config.close();
    }
  }

  /** Runs the main menu until the user exits or the input runs out. */
  public void run() {
    try {
      while (true) {
        out.print(MAIN_MENU);
        out.flush();
        int choice = nextInt();
        if (choice == 6) return;
        CayleyTable table;
        try {
          table = readTable(choice);
        } catch (EOFException e) {
          throw e;
        } catch (IOException | IllegalArgumentException | JsonParseException e) {
          logger.log(WARNING, "Could not produce a table", e);
          out.println("Error: " + e.getMessage());
          continue;
        }
        if (table == null) continue;
        if (!actOn(table)) return;
      }
    } catch (EOFException e) {
      out.println();
    } finally {
      out.flush();
    }
  }

  /** Produces a table by the given main-menu choice, or null if the choice is unknown. */
  @Nullable private CayleyTable readTable(int choice) throws IOException {
    switch (choice) {
      case 1: {
        File file = new File(prompt("Enter the file name: "));
        if (file.getName().endsWith(".json"))
          return TableJson.tableFromJson(Files.asCharSource(file, UTF_8).read());
        return TableFormat.read(file);
      }
      case 2:
        return readManually();
      case 3:
        return CyclicGroups.table(promptOrder("Enter the order of the quasigroup: "));
      case 4:
        return readAffine(promptOrder("Enter the order of the quasigroup: "));
      case 5:
        return ReplacementGraphGenerator.generate(
            promptOrder("Enter the order of the quasigroup: "), random);
      default:
        return null;
    }
  }

  private CayleyTable readManually() throws IOException {
    int order = promptOrder("\nEnter the order of the quasigroup: ");
    CayleyTable.Builder builder = CayleyTable.builder(order);
    out.printf("%nEnter the Cayley table (%dx%d):%n", order, order);
    for (int row = 0; row < order; ++row) {
      for (int col = 0; col < order; ++col) {
        int value = promptInt(String.format("(%d,%d): ", row, col));
        while (value < 0 || value >= order) {
          out.printf("Entries must be in [0, %d]%nEnter again:%n", order - 1);
          value = promptInt(String.format("(%d,%d): ", row, col));
        }
        builder.set(row, col, value);
      }
    }
    return builder.build();
  }

  private CayleyTable readAffine(int order) throws IOException {
    if (order <= 0)
      throw new IllegalArgumentException("order must be positive, was " + order);
    int alpha = promptInt("Enter the coefficient alpha (coprime with " + order + "): ");
    while (!AffineQuasigroups.isCoprime(alpha, order))
      alpha = promptInt("alpha must be coprime with " + order + ". Enter again: ");
    int beta = promptInt("Enter the coefficient beta (coprime with " + order + "): ");
    while (!AffineQuasigroups.isCoprime(beta, order))
      beta = promptInt("beta must be coprime with " + order + ". Enter again: ");
    int c = promptInt("Enter the constant c (0 <= c < " + order + "): ");
    while (c < 0 || c >= order)
      c = promptInt("c must be in [0, " + (order - 1) + "]. Enter again: ");

    int[] f = AffineQuasigroups.randomPermutation(order, random);
    out.println("Generated permutation f: " + Joiner.on(' ').join(Ints.asList(f)));
    return AffineQuasigroups.table(order, alpha, beta, c, f);
  }

  /**
   * Shows the table and runs the action menu for it.  Returns false if the
   * user asked to exit, true to go back to the main menu.
   */
  private boolean actOn(CayleyTable table) throws EOFException {
    ClosureAnalyzer analyzer = new ClosureAnalyzer(new Quasigroup(table));
    out.println();
    out.print(TableFormat.render(table));
    while (true) {
      out.print(ACTION_MENU);
      out.flush();
      switch (nextInt()) {
        case 1:
          out.println(analyzer.hasProperSubquasigroups()
              ? "Found a proper subquasigroup"
              : "No proper subquasigroups");
          break;
        case 2:
          out.println(analyzer.hasNonTrivialSubquasigroups()
              ? "Found a non-trivial subquasigroup"
              : "No non-trivial subquasigroups");
          break;
        case 3: {
          Analysis analysis = analyzer.analyze();
          out.println("Proper subquasigroup: " + (analysis.hasProper ? "yes" : "no"));
          out.println("Non-trivial subquasigroup: " + (analysis.hasNonTrivial ? "yes" : "no"));
          break;
        }
        case 4:
          save(table, analyzer, prompt("Enter the file name to write: "));
          break;
        case 5:
          return true;
        case 6:
          return false;
        default:
          break;
      }
    }
  }

  private void save(CayleyTable table, ClosureAnalyzer analyzer, String fileName) {
    File file = new File(fileName);
    Analysis analysis = analyzer.analyze();
    try {
      if (file.getName().endsWith(".json"))
        Files.asCharSink(file, UTF_8).write(TableJson.reportToJson(table, analysis));
      else
        AnalysisReport.write(table, analysis, file);
      out.println("Results saved to " + fileName);
    } catch (IOException e) {
      logger.log(WARNING, "Could not save results to " + fileName, e);
      out.println("Error: could not write " + fileName + ": " + e.getMessage());
    }
  }

  private String prompt(String message) throws EOFException {
    out.print(message);
    out.flush();
    if (!in.hasNext()) throw new EOFException();
    return in.next();
  }

  /** Prompts for an order, rejecting ones too large to build a table for. */
  private int promptOrder(String message) throws EOFException {
    int order = promptInt(message);
    if (order > MAX_ORDER)
      throw new IllegalArgumentException(
          "order must be at most " + MAX_ORDER + ", was " + order);
    return order;
  }

  private int promptInt(String message) throws EOFException {
    out.print(message);
    out.flush();
    return nextInt();
  }

  /** Reads the next integer, skipping tokens that aren't numbers. */
  private int nextInt() throws EOFException {
    while (true) {
      if (!in.hasNext()) throw new EOFException();
      String token = in.next();
      Integer value = Ints.tryParse(token);
      if (value != null) return value;
      out.print("Please enter a number: ");
      out.flush();
    }
  }
}
