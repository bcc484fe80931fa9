package net.larse.insights.algorithms;

import net.larse.insights.timeseries.DecompositionResult;
import net.larse.insights.timeseries.SeasonalDecomposition;
import net.larse.insights.timeseries.TimeSeries;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class AnomalyScorerTest {
  private static final double EPS = 1e-9;
  private static final double[] WEEK = {10, 12, 14, 16, 14, 12, 10};

  private AnomalyScorer scorer;
  private double[] weekly;

  @Before
  public void setUp() {
    scorer = new AnomalyScorer();
    weekly = new double[28];
    for (int i = 0; i < weekly.length; i++) {
      weekly[i] = WEEK[i % 7];
    }
  }

  @Test
  public void testConstantSeriesHasNoAnomalies() {
    assertTrue(scorer.detectAnomalies(new double[] {5, 5, 5, 5, 5}).isEmpty());
    assertTrue(scorer.detectAnomalies(new double[0]).isEmpty());
  }

  @Test
  public void testSingleOutlier() {
    double[] values = {1, 1, 1, 1, 1, 1, 1, 1, 1, 10};
    List<AnomalyPoint> anomalies = scorer.detectAnomalies(values);

    // mean 1.9, population std 2.7
    assertEquals(1, anomalies.size());
    AnomalyPoint point = anomalies.get(0);
    assertEquals(9, point.getIndex());
    assertEquals(10.0, point.getValue(), 0);
    assertEquals(3.0, point.getZScore(), EPS);

    assertTrue(scorer.detectAnomalies(values, 3.5).isEmpty());
  }

  @Test
  public void testRaisingThresholdNeverAddsAnomalies() {
    double[] values = {3, 8, 1, 9, 2, 15, 4, 7, -6, 5, 3, 11};
    int previous = Integer.MAX_VALUE;
    for (double threshold = 0; threshold <= 4; threshold += 0.25) {
      List<AnomalyPoint> anomalies = scorer.detectAnomalies(values, threshold);
      assertTrue(anomalies.size() <= previous);
      for (int i = 1; i < anomalies.size(); i++) {
        assertTrue(anomalies.get(i - 1).getIndex() < anomalies.get(i).getIndex());
      }
      for (AnomalyPoint point : anomalies) {
        assertTrue(point.getZScore() > threshold);
      }
      previous = anomalies.size();
    }
  }

  @Test
  public void testSeasonalSpike() {
    double[] values = weekly.clone();
    values[17] += 30;
    List<AnomalyPoint> anomalies = scorer.detectSeasonalAnomalies(values);

    assertEquals(1, anomalies.size());
    assertEquals(17, anomalies.get(0).getIndex());
    assertTrue(anomalies.get(0).getZScore() > 4);
  }

  @Test
  public void testSeasonalAnomaliesNeedEnoughData() {
    assertTrue(scorer.detectSeasonalAnomalies(new double[] {1, 50, 1, 1}).isEmpty());
  }

  @Test
  public void testScorerUsesGivenDecomposition() {
    AnomalyScorer.Args args = new AnomalyScorer.Args();
    args.threshold = 1.5;
    SeasonalDecomposition decomposition = new SeasonalDecomposition(4, 8);
    AnomalyScorer custom = new AnomalyScorer(args, decomposition);
    assertEquals(1.5, custom.getThreshold(), 0);
    assertSame(decomposition, custom.getDecomposition());
  }

  @Test
  public void testAdjustForSeasonality() {
    double[] values = weekly.clone();
    for (int i = 0; i < values.length; i++) {
      values[i] += i;
    }
    DecompositionResult result = scorer.getDecomposition().decompose(values);
    double[] adjusted = scorer.adjustForSeasonality(values);
    double[] seasonal = result.getSeasonal();
    for (int i = 0; i < values.length; i++) {
      assertEquals(values[i] - seasonal[i], adjusted[i], EPS);
    }

    TimeSeries series = TimeSeries.daily(Instant.parse("2024-01-01T00:00:00Z"), values);
    assertArrayEquals(adjusted, scorer.adjustForSeasonality(series), EPS);
  }

  @Test
  public void testAdjustShortSeriesIsUnchanged() {
    double[] values = {3, 1, 4, 1, 5};
    assertArrayEquals(values, scorer.adjustForSeasonality(values), 0);
  }

  @Test
  public void testPredictSeasonalPattern() {
    DecompositionResult result = scorer.getDecomposition().decompose(weekly);
    double[] trend = result.getTrend();
    double[] seasonal = result.getSeasonal();
    double lastTrend = trend[trend.length - 1];

    double[] predictions = scorer.predictSeasonalPattern(weekly, 10);
    assertEquals(10, predictions.length);
    for (int i = 0; i < predictions.length; i++) {
      assertEquals(lastTrend + seasonal[21 + i % 7], predictions[i], EPS);
    }
    // one full period ahead repeats the pattern
    assertEquals(predictions[0], predictions[7], EPS);
  }

  @Test
  public void testPredictWithoutDecompositionRepeatsLastValue() {
    double[] predictions = scorer.predictSeasonalPattern(new double[] {4, 5, 6}, 3);
    assertArrayEquals(new double[] {6, 6, 6}, predictions, 0);
  }

  @Test
  public void testPredictEmptyInput() {
    assertArrayEquals(new double[4], scorer.predictSeasonalPattern(new double[0], 4), 0);
    assertEquals(0, scorer.predictSeasonalPattern(weekly, 0).length);
    double[] fromNull = scorer.predictSeasonalPattern(null, 2);
    assertTrue(Arrays.equals(new double[2], fromNull));
  }
}
