package io.sketchlab.sketch;

import com.google.common.hash.Hashing;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class Murmur3HashFamilyTest
{
  @Test
  public void testDeterministicAcrossInstances()
  {
    Murmur3HashFamily a = Murmur3HashFamily.murmur3_64();
    Murmur3HashFamily b = Murmur3HashFamily.murmur3_64();
    for (String value : new String[]{"", "password123", "192.168.0.1", "пароль"}) {
      for (int i = 0; i < 20; i++) {
        assertEquals(a.hash(value, i), b.hash(value, i));
      }
    }
  }

  @Test
  public void testIndexActsAsSeed()
  {
    Murmur3HashFamily family = Murmur3HashFamily.murmur3_32();
    for (int i = 0; i < 20; i++) {
      long expected = Hashing.murmur3_32_fixed(i).hashString("admin123", StandardCharsets.UTF_8).asInt() & 0xFFFFFFFFL;
      assertEquals(expected, family.hash("admin123", i));
    }

    Murmur3HashFamily seeded = Murmur3HashFamily.murmur3_64(100);
    assertEquals(
        Hashing.murmur3_128(103).hashString("admin123", StandardCharsets.UTF_8).asLong(),
        seeded.hash("admin123", 3)
    );
  }

  @Test
  public void testIndexesGiveDifferentHashes()
  {
    Murmur3HashFamily family = Murmur3HashFamily.murmur3_64();
    Set<Long> hashes = new HashSet<>();
    for (int i = 0; i < 10; i++) {
      hashes.add(family.hash("qwerty123", i));
    }
    assertEquals(10, hashes.size());
  }

  @Test
  public void test32BitsHashIsUnsigned()
  {
    Murmur3HashFamily family = Murmur3HashFamily.murmur3_32();
    assertEquals(32, family.bits());
    for (int i = 0; i < 1000; i++) {
      long hash = family.hash("value-" + i, 1);
      assertTrue(hash >= 0 && hash <= 0xFFFFFFFFL);
    }
  }

  @Test
  public void testEmptyString()
  {
    Murmur3HashFamily family = Murmur3HashFamily.murmur3_64();
    assertEquals(family.hash("", 0), family.hash("", 0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedWidth()
  {
    new Murmur3HashFamily(128, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeIndex()
  {
    Murmur3HashFamily.murmur3_32().hash("x", -1);
  }
}
