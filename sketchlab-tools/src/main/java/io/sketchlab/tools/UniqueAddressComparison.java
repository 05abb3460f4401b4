package io.sketchlab.tools;

import com.google.common.base.Stopwatch;
import com.google.common.base.Supplier;
import io.sketchlab.sketch.CardinalityEstimator;
import io.sketchlab.sketch.CardinalityEstimators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Counts distinct client addresses of a log file exactly and with an estimator, and prints both
 * counts with their running times.
 */
public class UniqueAddressComparison
{
  private static final Logger LOG = LoggerFactory.getLogger(UniqueAddressComparison.class);

  private static final String DEFAULT_LOG_FILE = "lms-stage-access.log";
  private static final String DEFAULT_ESTIMATOR = "hll" + CardinalityEstimators.DEFAULT_BUCKET_BITS;

  static class Comparison
  {
    final String estimatorName;
    final long exactCount;
    final double estimate;
    final long exactNanos;
    final long estimateNanos;

    Comparison(String estimatorName, long exactCount, double estimate, long exactNanos, long estimateNanos)
    {
      this.estimatorName = estimatorName;
      this.exactCount = exactCount;
      this.estimate = estimate;
      this.exactNanos = exactNanos;
      this.estimateNanos = estimateNanos;
    }

    double relativeError()
    {
      return exactCount == 0 ? 0.0 : (estimate - exactCount) / exactCount;
    }
  }

  static Comparison compare(List<String> addresses, Supplier<CardinalityEstimator> estimatorSupplier)
  {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Set<String> distinct = new HashSet<>(addresses);
    final long exactNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);

    stopwatch.reset().start();
    CardinalityEstimator estimator = estimatorSupplier.get();
    for (String address : addresses) {
      estimator.add(address);
    }
    final double estimate = estimator.estimate();
    final long estimateNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);

    return new Comparison(estimator.name(), distinct.size(), estimate, exactNanos, estimateNanos);
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length > 2) {
      System.err.println("Arguments: [<logFile>] [<estimator>]");
      System.exit(1);
    }
    Path logFile = Paths.get(args.length > 0 ? args[0] : DEFAULT_LOG_FILE);
    String estimatorName = args.length > 1 ? args[1] : DEFAULT_ESTIMATOR;
    Supplier<CardinalityEstimator> estimatorSupplier = CardinalityEstimators.lazyGet(estimatorName);

    List<String> addresses = LogAddressExtractor.load(logFile);
    Comparison comparison = compare(addresses, estimatorSupplier);
    LOG.info("Relative error of {} : {}%", comparison.estimatorName, String.format("%.3f", 100 * comparison.relativeError()));

    System.out.println("Comparison results:");
    System.out.format("%-20s %20s %22s%n", "", "Unique elements", "Execution time (sec)");
    System.out.format("%-20s %20d %22.6f%n", "Exact count", comparison.exactCount, comparison.exactNanos / 1e9);
    System.out.format("%-20s %20.1f %22.6f%n", comparison.estimatorName, comparison.estimate, comparison.estimateNanos / 1e9);
  }
}
