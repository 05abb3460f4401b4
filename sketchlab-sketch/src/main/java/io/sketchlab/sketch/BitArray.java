package io.sketchlab.sketch;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Fixed-length bit array packed 8 bits per byte, so it takes ceil(length / 8) bytes of storage.
 *
 * <p>Not thread-safe: concurrent {@link #set} calls on bits sharing a byte can lose updates.
 */
public final class BitArray
{
  private final int length;
  private final byte[] data;
  private int bitCount;

  public BitArray(int length)
  {
    Preconditions.checkArgument(length > 0, "invalid length [%s] : should be positive", length);
    this.length = length;
    this.data = new byte[(int) ((length + 7L) >>> 3)];
  }

  public boolean get(int index)
  {
    Preconditions.checkElementIndex(index, length);
    return (data[index >>> 3] & (1 << (index & 7))) != 0;
  }

  /**
   * Sets the bit at {@code index} to one.
   *
   * @return true if the bit was previously zero
   */
  public boolean set(int index)
  {
    Preconditions.checkElementIndex(index, length);
    final int mask = 1 << (index & 7);
    final int slot = index >>> 3;
    if ((data[slot] & mask) != 0) {
      return false;
    }
    data[slot] |= (byte) mask;
    bitCount++;
    return true;
  }

  public void clearAll()
  {
    Arrays.fill(data, (byte) 0);
    bitCount = 0;
  }

  public int length()
  {
    return length;
  }

  /**
   * @return number of bits currently set to one
   */
  public int bitCount()
  {
    return bitCount;
  }

  public long memoryFootprint()
  {
    return data.length; // not counting object headers
  }
}
