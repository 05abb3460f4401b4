package io.sketchlab.sketch;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BitArrayTest
{
  @Test
  public void testSetAndGet()
  {
    BitArray bits = new BitArray(100);
    for (int i = 0; i < 100; i++) {
      assertFalse(bits.get(i));
    }
    assertTrue(bits.set(0));
    assertTrue(bits.set(7));
    assertTrue(bits.set(8));
    assertTrue(bits.set(99));

    assertTrue(bits.get(0));
    assertTrue(bits.get(7));
    assertTrue(bits.get(8));
    assertTrue(bits.get(99));
    assertFalse(bits.get(1));
    assertFalse(bits.get(9));
    assertFalse(bits.get(98));
    assertEquals(4, bits.bitCount());
  }

  @Test
  public void testSetIsIdempotent()
  {
    BitArray bits = new BitArray(16);
    assertTrue(bits.set(3));
    assertFalse(bits.set(3));
    assertTrue(bits.get(3));
    assertEquals(1, bits.bitCount());
  }

  @Test
  public void testClearAll()
  {
    BitArray bits = new BitArray(20);
    bits.set(1);
    bits.set(19);
    bits.clearAll();
    assertFalse(bits.get(1));
    assertFalse(bits.get(19));
    assertEquals(0, bits.bitCount());
  }

  @Test
  public void testPackedFootprint()
  {
    assertEquals(1, new BitArray(1).memoryFootprint());
    assertEquals(1, new BitArray(8).memoryFootprint());
    assertEquals(2, new BitArray(9).memoryFootprint());
    assertEquals(125, new BitArray(1000).memoryFootprint());
    assertEquals(126, new BitArray(1001).memoryFootprint());
  }

  @Test
  public void testIndexOutOfRange()
  {
    BitArray bits = new BitArray(10);
    for (int index : new int[]{-1, 10, 11, Integer.MAX_VALUE}) {
      try {
        bits.get(index);
        fail("get(" + index + ") should fail");
      }
      catch (IndexOutOfBoundsException expected) {
        // ok
      }
      try {
        bits.set(index);
        fail("set(" + index + ") should fail");
      }
      catch (IndexOutOfBoundsException expected) {
        // ok
      }
    }
    assertEquals(0, bits.bitCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroLength()
  {
    new BitArray(0);
  }
}
