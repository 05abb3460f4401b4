package io.sketchlab.sketch;

import com.google.common.base.Preconditions;

/**
 * Standard Bloom filter sizing formulas.
 *
 * <p>See http://en.wikipedia.org/wiki/Bloom_filter#Optimal_number_of_hash_functions
 */
public final class BloomFilterSizing
{
  private static final double LN2 = Math.log(2);

  private BloomFilterSizing()
  {
  }

  /**
   * m = -n * ln(p) / (ln 2)^2
   *
   * @param n expected insertions (must be positive)
   * @param p false positive rate (must be in (0, 1))
   */
  public static long optimalNumOfBits(long n, double p)
  {
    Preconditions.checkArgument(n > 0, "invalid expected insertions [%s] : should be positive", n);
    Preconditions.checkArgument(p > 0.0 && p < 1.0, "invalid false positive rate [%s] : should be in (0, 1)", p);
    return (long) Math.ceil(-n * Math.log(p) / (LN2 * LN2));
  }

  /**
   * k = (m / n) * ln 2, at least 1.
   *
   * @param n expected insertions (must be positive)
   * @param m total number of bits (must be positive)
   */
  public static int optimalNumOfHashFunctions(long n, long m)
  {
    Preconditions.checkArgument(n > 0, "invalid expected insertions [%s] : should be positive", n);
    Preconditions.checkArgument(m > 0, "invalid number of bits [%s] : should be positive", m);
    // (m / n) * log(2), but avoid truncation due to division!
    return Math.max(1, (int) Math.round((double) m / n * LN2));
  }

  /**
   * (1 - e^(-kn/m))^k
   */
  public static double falsePositiveProbability(long n, long m, int k)
  {
    Preconditions.checkArgument(n >= 0, "invalid insertions [%s] : should be non-negative", n);
    Preconditions.checkArgument(m > 0, "invalid number of bits [%s] : should be positive", m);
    Preconditions.checkArgument(k > 0, "invalid number of hashes [%s] : should be positive", k);
    return Math.pow(1 - Math.exp(-(double) k * n / m), k);
  }
}
