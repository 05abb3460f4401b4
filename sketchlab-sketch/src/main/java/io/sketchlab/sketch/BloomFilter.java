package io.sketchlab.sketch;

import com.google.common.base.Preconditions;

/**
 * Bloom filter over a {@link BitArray} of {@code capacity} bits probed by {@code hashCount} seeded
 * hashes. Probe {@code i} of a value lands on bit {@code hash(value, i) mod capacity}.
 *
 * <p>Bits are only ever set, never cleared, so a value that was added is always reported present.
 * With n values added the false positive probability approaches {@code (1 - e^(-kn/m))^k}; see
 * {@link BloomFilterSizing} for choosing (m, k) from an expected count and a target rate.
 *
 * <p>Single writer. Concurrent {@code add} calls must be serialized by the caller; {@code check}
 * may run concurrently with other checks.
 */
public class BloomFilter implements MembershipFilter
{
  private final int capacity;
  private final int hashCount;
  private final HashFamily hashFamily;
  private final BitArray bits;

  public BloomFilter(int capacity, int hashCount)
  {
    this(capacity, hashCount, Murmur3HashFamily.murmur3_32());
  }

  public BloomFilter(int capacity, int hashCount, HashFamily hashFamily)
  {
    Preconditions.checkArgument(capacity > 0, "invalid capacity [%s] : should be positive", capacity);
    Preconditions.checkArgument(hashCount > 0, "invalid hashCount [%s] : should be positive", hashCount);
    this.capacity = capacity;
    this.hashCount = hashCount;
    this.hashFamily = Preconditions.checkNotNull(hashFamily, "hashFamily");
    this.bits = new BitArray(capacity);
  }

  /**
   * Creates a filter sized for {@code expectedInsertions} values at false positive rate {@code fpp}.
   */
  public static BloomFilter create(long expectedInsertions, double fpp)
  {
    final long numBits = BloomFilterSizing.optimalNumOfBits(expectedInsertions, fpp);
    Preconditions.checkArgument(
        numBits <= Integer.MAX_VALUE,
        "filter for [%s] insertions at fpp [%s] needs too many bits : %s",
        expectedInsertions,
        fpp,
        numBits
    );
    final int numHashes = BloomFilterSizing.optimalNumOfHashFunctions(expectedInsertions, numBits);
    return new BloomFilter((int) numBits, numHashes);
  }

  @Override
  public void add(String value)
  {
    for (int i = 0; i < hashCount; i++) {
      bits.set(position(value, i));
    }
  }

  @Override
  public boolean check(String value)
  {
    for (int i = 0; i < hashCount; i++) {
      if (!bits.get(position(value, i))) {
        return false;
      }
    }
    return true;
  }

  private int position(String value, int index)
  {
    return (int) Long.remainderUnsigned(hashFamily.hash(value, index), capacity);
  }

  /**
   * @return probability that {@link #check} returns true for a value never added, given the bits set so far
   */
  public double expectedFpp()
  {
    return Math.pow((double) bits.bitCount() / capacity, hashCount);
  }

  public int capacity()
  {
    return capacity;
  }

  public int hashCount()
  {
    return hashCount;
  }

  BitArray bits()
  {
    return bits;
  }

  @Override
  public long memoryFootprint()
  {
    return bits.memoryFootprint();
  }
}
