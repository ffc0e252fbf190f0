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
package us.blanshard.quasigroup.stats;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.MICROSECONDS;

import us.blanshard.quasigroup.analysis.Analysis;
import us.blanshard.quasigroup.analysis.ClosureAnalyzer;
import us.blanshard.quasigroup.core.CayleyTable;
import us.blanshard.quasigroup.core.Quasigroup;
import us.blanshard.quasigroup.gen.ReplacementGraphGenerator;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.List;
import java.util.Random;

/**
 * Generates random quasigroups with the replacement graph generator, checks
 * them, and spits out statistics about generation time, repairs, and how
 * often subquasigroups turn up.
 *
 * @author Luke Blanshard
 */
public class GenStats {

  static final List<Integer> DEFAULT_ORDERS = ImmutableList.of(1, 2, 3, 5, 8, 13);

  public static void main(String[] args) {
    if (args.length < 1 || args.length > 3) exitWithUsage();
    int count;
    long seed;
    List<Integer> orders;
    try {
      count = Integer.decode(args[0]);
      seed = args.length > 1 ? Long.decode(args[1]) : System.currentTimeMillis();
      orders = args.length > 2 ? parseOrders(args[2]) : DEFAULT_ORDERS;
    } catch (IllegalArgumentException e) {
      exitWithUsage();
      return;  // Convince the compiler.
    }
    if (count <= 0) exitWithUsage();

    System.out.printf("Generating %d quasigroups per order from seed %#x%n", count, seed);

    // Warm up the code paths with a fixed seed and no printing.
    measure(8, 20, new Random(0));

    System.out.println("Order\tCount\tMean Micros\tStd Dev\tMax Micros\tMean Repairs"
        + "\tProper\tNon-trivial");
    Random random = new Random(seed);
    for (int order : orders) {
      OrderStats stats = measure(order, count, random);
      System.out.printf("%d\t%d\t%.1f\t%.1f\t%.0f\t%.2f\t%.3f\t%.3f%n",
          stats.order, stats.count, stats.micros.getMean(),
          stats.micros.getStandardDeviation(), stats.micros.getMax(),
          stats.repairs.getMean(), stats.properFraction(), stats.nonTrivialFraction());
    }
  }

  private static void exitWithUsage() {
    System.err.println("Usage: GenStats <count> [<seed>] [<order>,<order>,...]");
    System.exit(1);
  }

  /** Parses a comma-separated list of positive orders. */
  static List<Integer> parseOrders(String arg) {
    List<Integer> orders = Lists.newArrayList();
    for (String part : Splitter.on(',').trimResults().omitEmptyStrings().split(arg)) {
      int order = Integer.decode(part);
      checkArgument(order > 0, "order must be positive, was %s", order);
      orders.add(order);
    }
    checkArgument(!orders.isEmpty(), "no orders given");
    return orders;
  }

  /**
   * Generates {@code count} tables of the given order, each from its own seed
   * drawn from the given random, and gathers statistics about them.
   */
  static OrderStats measure(int order, int count, Random random) {
    SummaryStatistics micros = new SummaryStatistics();
    SummaryStatistics repairs = new SummaryStatistics();
    int proper = 0;
    int nonTrivial = 0;
    for (int i = 0; i < count; ++i) {
      ReplacementGraphGenerator generator =
          new ReplacementGraphGenerator(order, new Random(random.nextLong()));
      Stopwatch stopwatch = Stopwatch.createStarted();
      CayleyTable table = generator.generate();
      stopwatch.stop();

      checkState(table.isLatinSquare(), "generated a table that isn't a Latin square:\n%s", table);
      micros.addValue(stopwatch.elapsed(MICROSECONDS));
      repairs.addValue(generator.getRepairCount());

      Analysis analysis = new ClosureAnalyzer(new Quasigroup(table)).analyze();
      if (analysis.hasProper) ++proper;
      if (analysis.hasNonTrivial) ++nonTrivial;
    }
    return new OrderStats(order, count, micros, repairs, proper, nonTrivial);
  }

  /** The statistics gathered for one order. */
  static final class OrderStats {
    final int order;
    final int count;
    final SummaryStatistics micros;
    final SummaryStatistics repairs;
    final int proper;
    final int nonTrivial;

    OrderStats(int order, int count, SummaryStatistics micros, SummaryStatistics repairs,
               int proper, int nonTrivial) {
      this.order = order;
      this.count = count;
      this.micros = micros;
      this.repairs = repairs;
      this.proper = proper;
      this.nonTrivial = nonTrivial;
    }

    double properFraction() {
      return count == 0 ? 0 : (double) proper / count;
    }

    double nonTrivialFraction() {
      return count == 0 ? 0 : (double) nonTrivial / count;
    }
  }
}
