package io.sketchlab.sketch;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

public class CardinalityEstimatorsTest
{
  @Test
  public void testLookupByName()
  {
    assertEquals("hll14", CardinalityEstimators.get("hll14").name());
    assertEquals("hll32_8", CardinalityEstimators.get("hll32_8").name());
    assertEquals("hll" + CardinalityEstimators.DEFAULT_BUCKET_BITS, CardinalityEstimators.get("hll").name());
    assertEquals(1 << 12, CardinalityEstimators.get("hll12").memoryFootprint());
  }

  @Test
  public void testLazyGetCreatesFreshInstances()
  {
    assertNotSame(CardinalityEstimators.lazyGet("hll10").get(), CardinalityEstimators.lazyGet("hll10").get());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownName()
  {
    CardinalityEstimators.get("uniq");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedBucketBits()
  {
    CardinalityEstimators.get("hllx");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBucketBitsOutOfRange()
  {
    CardinalityEstimators.get("hll2");
  }
}
