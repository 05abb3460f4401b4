package io.sketchlab.tools;

import io.sketchlab.sketch.CardinalityEstimators;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class EstimatorAccuracyReportTest
{
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testErrorsPerCardinality()
  {
    double[][] errors = EstimatorAccuracyReport.testDifferentCardinalities(
        CardinalityEstimators.lazyGet("hll12"),
        1000,
        5000,
        3,
        42L
    );

    assertEquals(5, errors.length);
    for (double[] runs : errors) {
      assertEquals(3, runs.length);
      for (double error : runs) {
        // percent, 1.04 / sqrt(4096) is about 1.6%
        assertTrue("error " + error, error >= 0 && error < 10);
      }
    }
  }

  @Test
  public void testSummarizeAndWrite() throws IOException
  {
    double[][] errors = {{3.0, 1.0, 2.0}, {0.5, 0.25, 0.75}};
    List<EstimatorAccuracyReport.OneResult> results = EstimatorAccuracyReport.summarize(100, errors);

    assertEquals(2, results.size());
    assertEquals(100, results.get(0).cardinality);
    assertEquals(1.0, results.get(0).minError, 0.0);
    assertEquals(2.0, results.get(0).medianError, 0.0);
    assertEquals(3.0, results.get(0).maxError, 0.0);
    assertEquals(200, results.get(1).cardinality);
    assertEquals(0.5, results.get(1).medianError, 0.0);

    Path out = folder.getRoot().toPath().resolve("report.tsv");
    EstimatorAccuracyReport.write(out, results);
    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertEquals("Card\tMin\tMedian\tMax", lines.get(0));
    assertTrue(lines.get(1).startsWith("100\t"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIllegalRange()
  {
    EstimatorAccuracyReport.testDifferentCardinalities(CardinalityEstimators.lazyGet("hll"), 300, 1000, 1, 0L);
  }
}
