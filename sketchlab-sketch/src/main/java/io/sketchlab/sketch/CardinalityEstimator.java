package io.sketchlab.sketch;

public interface CardinalityEstimator
{
  void add(String value);

  /**
   * @return approximate number of distinct values added so far, never negative
   */
  double estimate();

  long memoryFootprint();

  String name();
}
