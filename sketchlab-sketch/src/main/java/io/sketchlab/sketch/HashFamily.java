package io.sketchlab.sketch;

/**
 * A family of seeded hash functions over strings.
 *
 * <p>{@code hash(value, i)} must be deterministic across processes, and outputs for different
 * {@code i} on the same value should be (at least pairwise) independent. The result is an unsigned
 * value held in the low {@link #bits()} bits of the returned {@code long}; higher bits are zero.
 */
public interface HashFamily
{
  long hash(String value, int index);

  /**
   * @return hash width W in bits, either 32 or 64
   */
  int bits();
}
