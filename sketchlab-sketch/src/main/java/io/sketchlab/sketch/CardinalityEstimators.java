package io.sketchlab.sketch;

import com.google.common.base.Supplier;

/**
 * Looks up estimators by the names they report through {@link CardinalityEstimator#name()}:
 * {@code hll<b>} for a 64-bits hash and {@code hll32_<b>} for a 32-bits hash, b being bucketBits.
 * A bare {@code hll} or {@code hll32_} uses {@link #DEFAULT_BUCKET_BITS}.
 */
public final class CardinalityEstimators
{
  public static final int DEFAULT_BUCKET_BITS = 10;

  private static final String HLL32_PREFIX = "hll32_";
  private static final String HLL_PREFIX = "hll";

  private CardinalityEstimators()
  {
  }

  public static CardinalityEstimator get(String name)
  {
    if (name.startsWith(HLL32_PREFIX)) {
      int bucketBits = parseBucketBits(name, name.substring(HLL32_PREFIX.length()));
      return new HyperLogLog(bucketBits, Murmur3HashFamily.murmur3_32());
    }
    if (name.startsWith(HLL_PREFIX)) {
      int bucketBits = parseBucketBits(name, name.substring(HLL_PREFIX.length()));
      return new HyperLogLog(bucketBits, Murmur3HashFamily.murmur3_64());
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator> lazyGet(String name)
  {
    return () -> get(name);
  }

  private static int parseBucketBits(String name, String bStr)
  {
    if (bStr.isEmpty()) {
      return DEFAULT_BUCKET_BITS;
    }
    try {
      return Integer.parseInt(bStr);
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown estimator : " + name, e);
    }
  }
}
