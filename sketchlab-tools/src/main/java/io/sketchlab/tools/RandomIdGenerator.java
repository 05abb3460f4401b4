package io.sketchlab.tools;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * A random id generator based on sha1: hashes an incrementing counter together with a seed, so ids of
 * one generator are distinct (up to sha1 collisions) without remembering them.
 *
 * <p>see http://antirez.com/news/99
 */
public class RandomIdGenerator
{
  private final HashFunction sha1 = Hashing.sha1();
  private final ByteBuffer buffer;
  private long counter = 0;

  public RandomIdGenerator()
  {
    this(new Random().nextLong());
  }

  public RandomIdGenerator(long seed)
  {
    buffer = ByteBuffer.allocate(16);
    buffer.putLong(8, seed);
  }

  /**
   * @return a 40 characters hex id
   */
  public String generate()
  {
    buffer.putLong(0, counter++);
    return sha1.hashBytes(buffer.array()).toString();
  }
}
