package io.sketchlab.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Each value is hashed to W bits (W = {@link HashFamily#bits()}). The low {@code bucketBits} bits
 * select one of m = 2^bucketBits buckets, the remaining W - bucketBits bits (taken as
 * {@code hash >>> bucketBits}) give the rank: number of leading zeros within that field plus one, or
 * W - bucketBits + 1 when the field is all zeros. Each bucket keeps the max rank it has seen.
 *
 * <p>{@link #estimate()} picks one of three regimes, reported by {@link #regime()}:
 * <ul>
 *   <li>{@link Regime#LINEAR_COUNTING} when the raw estimate is at most 2.5 * m and some bucket is still
 *   zero: m * ln(m / zeros). An empty estimator lands here and returns exactly 0.
 *   <li>{@link Regime#LARGE_RANGE} when the raw estimate exceeds 2^W / 30: -2^W * ln(1 - E / 2^W).
 *   <li>{@link Regime#RAW} otherwise: alpha(m) * m^2 / sum(2^-bucket).
 * </ul>
 *
 * <p>Run this code to see a simple indication of expected errors based on different bucketBits:
 * <pre>
 * for (int b = 4; b &lt;= 16; ++b) {
 * System.out.printf("b[%,d], m[%,d] =&gt; error[%f%%]%n", b, 1 &lt;&lt; b, 104 / Math.sqrt(1 &lt;&lt; b));
 * }
 * </pre>
 *
 * <p>Single writer. Two concurrent {@code add} calls hitting the same bucket race on the max update,
 * so callers sharing an instance must serialize {@code add}. {@code estimate} never mutates state.
 */
public class HyperLogLog implements CardinalityEstimator
{
  public static final int MIN_BUCKET_BITS = 4;
  public static final int MAX_BUCKET_BITS = 24;

  // every value goes through the same member of the family
  private static final int HASH_INDEX = 0;

  public enum Regime
  {
    LINEAR_COUNTING,
    RAW,
    LARGE_RANGE
  }

  private final int bucketBits;
  private final int bucketCount;
  private final HashFamily hashFamily;
  private final int hashBits;
  private final double twoToTheW;
  private final double highCorrectionThreshold;
  private final double alpha;

  // ranks are at most 61, a byte per bucket is enough
  private final byte[] buckets;

  public HyperLogLog(int bucketBits)
  {
    this(bucketBits, Murmur3HashFamily.murmur3_64());
  }

  public HyperLogLog(int bucketBits, HashFamily hashFamily)
  {
    Preconditions.checkArgument(
        bucketBits >= MIN_BUCKET_BITS && bucketBits <= MAX_BUCKET_BITS,
        "invalid bucketBits [%s] : should be in [%s, %s]",
        bucketBits,
        MIN_BUCKET_BITS,
        MAX_BUCKET_BITS
    );
    this.hashFamily = Preconditions.checkNotNull(hashFamily, "hashFamily");
    this.bucketBits = bucketBits;
    this.bucketCount = 1 << bucketBits;
    this.hashBits = hashFamily.bits();
    Preconditions.checkArgument(
        hashBits > bucketBits,
        "hash width [%s] leaves no rank bits for bucketBits [%s]",
        hashBits,
        bucketBits
    );
    this.twoToTheW = Math.pow(2, hashBits);
    this.highCorrectionThreshold = twoToTheW / 30.0d;
    this.alpha = alpha(bucketCount);
    this.buckets = new byte[bucketCount];
  }

  static double alpha(int m)
  {
    switch (m) {
      case 16:
        return 0.673;
      case 32:
        return 0.697;
      case 64:
        return 0.709;
      default:
        return 0.7213 / (1 + 1.079 / m);
    }
  }

  @Override
  public void add(String value)
  {
    addHash(hashFamily.hash(value, HASH_INDEX));
  }

  @VisibleForTesting
  void addHash(long hash)
  {
    final int bucket = (int) (hash & (bucketCount - 1));
    final byte rank = (byte) rank(hash >>> bucketBits);
    if (buckets[bucket] < rank) {
      buckets[bucket] = rank;
    }
  }

  /**
   * @param w the W - bucketBits remainder bits of a hash
   */
  @VisibleForTesting
  int rank(long w)
  {
    final int fieldBits = hashBits - bucketBits;
    if (w == 0) {
      return fieldBits + 1;
    }
    // zeros above the field are not part of it
    return Long.numberOfLeadingZeros(w) - (Long.SIZE - fieldBits) + 1;
  }

  @Override
  public double estimate()
  {
    final Summary summary = summarize();
    final double e = summary.rawEstimate;
    switch (summary.regime) {
      case LINEAR_COUNTING:
        return bucketCount * Math.log(bucketCount / (double) summary.zeros);
      case LARGE_RANGE:
        if (e >= twoToTheW) {
          // every hash value has been seen, the correction diverges
          return Double.POSITIVE_INFINITY;
        }
        return -twoToTheW * Math.log(1 - e / twoToTheW);
      default:
        return e;
    }
  }

  /**
   * @return the regime {@link #estimate()} uses for the current bucket state
   */
  public Regime regime()
  {
    return summarize().regime;
  }

  private Summary summarize()
  {
    double registerSum = 0.0;
    int zeros = 0;
    for (byte rank : buckets) {
      registerSum += Math.scalb(1.0d, -rank);
      if (rank == 0) {
        zeros++;
      }
    }

    final double e = alpha * bucketCount * bucketCount / registerSum;
    final Regime regime;
    if (e <= 2.5d * bucketCount && zeros > 0) {
      regime = Regime.LINEAR_COUNTING;
    } else if (e > highCorrectionThreshold) {
      regime = Regime.LARGE_RANGE;
    } else {
      regime = Regime.RAW;
    }
    return new Summary(e, zeros, regime);
  }

  public int bucketBits()
  {
    return bucketBits;
  }

  public int bucketCount()
  {
    return bucketCount;
  }

  public int bucket(int index)
  {
    Preconditions.checkElementIndex(index, bucketCount);
    return buckets[index];
  }

  @Override
  public long memoryFootprint()
  {
    return buckets.length; // not counting object headers, `bucketBits`, `hashFamily` reference
  }

  @Override
  public String name()
  {
    return hashBits == Long.SIZE ? "hll" + bucketBits : "hll" + hashBits + "_" + bucketBits;
  }

  private static final class Summary
  {
    final double rawEstimate;
    final int zeros;
    final Regime regime;

    Summary(double rawEstimate, int zeros, Regime regime)
    {
      this.rawEstimate = rawEstimate;
      this.zeros = zeros;
      this.regime = regime;
    }
  }
}
