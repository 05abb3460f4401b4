package io.sketchlab.sketch;

/**
 * Approximate set membership over strings: no false negatives, bounded false positives.
 */
public interface MembershipFilter
{
  void add(String value);

  /**
   * @return false if {@code value} was definitely never added, true if it might have been
   */
  boolean check(String value);

  long memoryFootprint();
}
