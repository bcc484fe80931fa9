package net.larse.insights.timeseries;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class SeasonalDecompositionTest {
  private static final double EPS = 1e-9;

  private double[] weekly;

  @Before
  public void setUp() {
    double[] week = {10, 12, 14, 16, 14, 12, 10};
    weekly = new double[28];
    for (int i = 0; i < weekly.length; i++) {
      weekly[i] = week[i % 7] + 0.5 * i;
    }
  }

  @Test
  public void testHandComputedExample() {
    SeasonalDecomposition decomposition = new SeasonalDecomposition(2, 4);
    DecompositionResult result = decomposition.decompose(new double[] {1, 3, 1, 3});

    assertFalse(result.isDegraded());
    assertArrayEquals(new double[] {2, 5.0 / 3, 7.0 / 3, 2}, result.getTrend(), EPS);
    assertArrayEquals(new double[] {-7.0 / 6, 7.0 / 6, -7.0 / 6, 7.0 / 6},
        result.getSeasonal(), EPS);
    assertArrayEquals(new double[] {1.0 / 6, 1.0 / 6, -1.0 / 6, -1.0 / 6},
        result.getResidual(), EPS);
    assertEquals(0.98, result.getSeasonalStrength(), EPS);
    assertEquals(2.0 / 3, result.getTrendStrength(), EPS);
  }

  @Test
  public void testComponentsAddUpToOriginal() {
    DecompositionResult result = new SeasonalDecomposition().decompose(weekly);
    assertFalse(result.isDegraded());
    double[] trend = result.getTrend();
    double[] seasonal = result.getSeasonal();
    double[] residual = result.getResidual();
    for (int i = 0; i < weekly.length; i++) {
      assertEquals(weekly[i], trend[i] + seasonal[i] + residual[i], EPS);
    }
  }

  @Test
  public void testSeasonalPatternIsCenteredAndRepeats() {
    double[] seasonal = new SeasonalDecomposition().decompose(weekly).getSeasonal();
    double sum = 0;
    for (int p = 0; p < 7; p++) {
      sum += seasonal[p];
    }
    assertEquals(0.0, sum, EPS);
    for (int i = 7; i < seasonal.length; i++) {
      assertEquals(seasonal[i - 7], seasonal[i], EPS);
    }
  }

  @Test
  public void testStrengthsAreInUnitInterval() {
    DecompositionResult result = new SeasonalDecomposition().decompose(weekly);
    assertTrue(result.getSeasonalStrength() >= 0 && result.getSeasonalStrength() <= 1);
    assertTrue(result.getTrendStrength() >= 0 && result.getTrendStrength() <= 1);
  }

  @Test
  public void testMovingAverageClipsAtEdges() {
    double[] ramp = new double[14];
    for (int i = 0; i < ramp.length; i++) {
      ramp[i] = i;
    }
    double[] trend = SeasonalDecomposition.movingAverage(ramp, 7);
    assertEquals(1.5, trend[0], EPS);
    assertEquals(6.0, trend[6], EPS);
    assertEquals(11.5, trend[13], EPS);
  }

  @Test
  public void testEmptyPhaseAveragesToZero() {
    // period longer than the series: phases 2 and 3 have no samples
    double[] seasonal = SeasonalDecomposition.seasonalComponent(new double[] {4, -2}, 4);
    // pattern {4, -2, 0, 0} centered on its mean of 0.5
    assertArrayEquals(new double[] {3.5, -2.5}, seasonal, EPS);
  }

  @Test
  public void testDegradationBoundary() {
    SeasonalDecomposition decomposition = new SeasonalDecomposition();
    double[] thirteen = Arrays.copyOf(weekly, 13);
    double[] fourteen = Arrays.copyOf(weekly, 14);
    assertTrue(decomposition.decompose(thirteen).isDegraded());
    assertFalse(decomposition.decompose(fourteen).isDegraded());
  }

  @Test
  public void testConstantSeriesHasZeroStrengths() {
    double[] constant = new double[21];
    Arrays.fill(constant, 8);
    DecompositionResult result = new SeasonalDecomposition().decompose(constant);
    assertFalse(result.isDegraded());
    assertEquals(0.0, result.getSeasonalStrength(), 0);
    assertEquals(0.0, result.getTrendStrength(), 0);
  }

  @Test
  public void testZeroMinSamplesIsReported() {
    DecompositionResult result = new SeasonalDecomposition(7, 0).decompose(new double[0]);
    assertTrue(result.isDegraded());
    assertEquals(ComputationError.Kind.INVALID_INPUT, result.getError().get().getKind());
    assertEquals(0.0, result.getSeasonalStrength(), 0);
    assertEquals(0.0, result.getTrendStrength(), 0);
  }

  @Test
  public void testShortSeriesPassesThrough() {
    double[] values = {5, 6, 7};
    DecompositionResult result = new SeasonalDecomposition().decompose(values);
    assertTrue(result.isDegraded());
    assertFalse(result.getError().isPresent());
    assertArrayEquals(values, result.getTrend(), 0);
    assertArrayEquals(new double[3], result.getSeasonal(), 0);
    assertArrayEquals(new double[3], result.getResidual(), 0);
    assertEquals(0.0, result.getSeasonalStrength(), 0);
    assertEquals(0.0, result.getTrendStrength(), 0);
  }

  @Test
  public void testNonFiniteInputIsReported() {
    double[] values = weekly.clone();
    values[3] = Double.POSITIVE_INFINITY;
    DecompositionResult result = new SeasonalDecomposition().decompose(values);
    assertTrue(result.isDegraded());
    assertEquals(ComputationError.Kind.INVALID_INPUT, result.getError().get().getKind());
    assertEquals(values.length, result.size());
  }

  @Test
  public void testInvalidPeriodIsReported() {
    DecompositionResult result =
        new SeasonalDecomposition(0, 4).decompose(new double[] {1, 2, 3, 4});
    assertTrue(result.isDegraded());
    assertEquals(ComputationError.Kind.INVALID_INPUT, result.getError().get().getKind());
  }

  @Test
  public void testNullInputIsReported() {
    DecompositionResult result = new SeasonalDecomposition().decompose(null);
    assertTrue(result.isDegraded());
    assertEquals(0, result.size());
    assertTrue(result.getError().isPresent());
  }

  @Test
  public void testResultArraysAreCopies() {
    DecompositionResult result = new SeasonalDecomposition().decompose(weekly);
    result.getTrend()[0] = -1000;
    assertNotEquals(-1000, result.getTrend()[0], 0);
  }
}
