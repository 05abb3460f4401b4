package io.sketchlab.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * {@link HashFamily} backed by murmur3, one seeded function per index (seed = baseSeed + index).
 *
 * <p>The 64-bits variant keeps the first 8 bytes of murmur3_128.
 */
public final class Murmur3HashFamily implements HashFamily
{
  private static final int CACHED_FUNCTIONS = 16;
  private static final long LOW_32_BITS = 0xFFFFFFFFL;

  private final int bits;
  private final int baseSeed;
  private final HashFunction[] functions;

  public Murmur3HashFamily(int bits, int baseSeed)
  {
    Preconditions.checkArgument(bits == 32 || bits == 64, "invalid hash width [%s] : should be 32 or 64", bits);
    this.bits = bits;
    this.baseSeed = baseSeed;
    this.functions = new HashFunction[CACHED_FUNCTIONS];
    for (int i = 0; i < CACHED_FUNCTIONS; i++) {
      functions[i] = newFunction(baseSeed + i);
    }
  }

  public static Murmur3HashFamily murmur3_32()
  {
    return new Murmur3HashFamily(32, 0);
  }

  public static Murmur3HashFamily murmur3_64()
  {
    return new Murmur3HashFamily(64, 0);
  }

  public static Murmur3HashFamily murmur3_64(int baseSeed)
  {
    return new Murmur3HashFamily(64, baseSeed);
  }

  @Override
  public long hash(String value, int index)
  {
    Preconditions.checkNotNull(value, "value");
    Preconditions.checkArgument(index >= 0, "invalid hash index [%s] : should be non-negative", index);
    HashFunction function = index < CACHED_FUNCTIONS ? functions[index] : newFunction(baseSeed + index);
    if (bits == 32) {
      return function.hashString(value, StandardCharsets.UTF_8).asInt() & LOW_32_BITS;
    }
    return function.hashString(value, StandardCharsets.UTF_8).asLong();
  }

  @Override
  public int bits()
  {
    return bits;
  }

  private HashFunction newFunction(int seed)
  {
    return bits == 32 ? Hashing.murmur3_32_fixed(seed) : Hashing.murmur3_128(seed);
  }
}
