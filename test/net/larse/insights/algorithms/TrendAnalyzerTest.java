package net.larse.insights.algorithms;

import net.larse.insights.timeseries.ComputationError;
import net.larse.insights.timeseries.TimeSeries;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class TrendAnalyzerTest {
  private static final double EPS = 1e-9;
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  private TrendAnalyzer analyzer;

  @Before
  public void setUp() {
    analyzer = new TrendAnalyzer();
  }

  private static double[] step(double before, double after) {
    double[] values = new double[20];
    for (int i = 0; i < values.length; i++) {
      values[i] = i < 10 ? before : after;
    }
    return values;
  }

  @Test
  public void testWeekOverWeekStep() {
    TrendResult result = analyzer.analyzeTrend(TimeSeries.daily(START, step(100, 160)),
        ComparisonPeriod.WOW);

    // the last 8 days average 160, the 12 days before average 110
    double pc = 50.0 / 110 * 100;
    double rSquared = 2500.0 / 3325;
    assertFalse(result.isInsufficientData());
    assertFalse(result.getError().isPresent());
    assertEquals(ComparisonPeriod.WOW, result.getPeriod());
    assertEquals(pc, result.getPercentageChange(), EPS);
    assertEquals(60.0, result.getAbsoluteChange(), EPS);
    assertEquals(TrendDirection.UP, result.getDirection());
    assertTrue(result.isSignificant());
    assertEquals(Severity.HIGH, result.getSeverity());
    assertEquals(60.0 * 50 / 665, result.getSlope(), EPS);
    assertEquals(rSquared, result.getRSquared(), EPS);
    assertEquals(30.0 / 130 * 100, result.getVolatility(), EPS);
    assertEquals(0.4 * rSquared + 0.3 * (20.0 / 30) + 0.3 * (pc / 50),
        result.getConfidence(), EPS);
    assertEquals(20, result.getSampleCount());
  }

  @Test
  public void testLargeStepIsCritical() {
    TrendResult result = analyzer.analyzeTrend(TimeSeries.daily(START, step(100, 200)),
        ComparisonPeriod.WOW);
    assertEquals(100.0 / 1.4, result.getPercentageChange(), EPS);
    assertEquals(Severity.CRITICAL, result.getSeverity());
  }

  @Test
  public void testDownwardStep() {
    TrendResult result = analyzer.analyzeTrend(TimeSeries.daily(START, step(160, 100)),
        ComparisonPeriod.WOW);
    assertEquals(TrendDirection.DOWN, result.getDirection());
    assertTrue(result.getPercentageChange() < 0);
    assertTrue(result.isSignificant());
    assertTrue(result.getSlope() < 0);
  }

  @Test
  public void testConstantSeries() {
    double[] values = new double[10];
    Arrays.fill(values, 50);
    TrendResult result = analyzer.analyzeTrend(TimeSeries.daily(START, values),
        ComparisonPeriod.WOW);
    assertEquals(TrendDirection.STABLE, result.getDirection());
    assertEquals(0.0, result.getPercentageChange(), 0);
    assertFalse(result.isSignificant());
    assertEquals(Severity.INFO, result.getSeverity());
    assertEquals(0.0, result.getRSquared(), 0);
    assertEquals(0.0, result.getVolatility(), 0);
    assertEquals(0.1, result.getConfidence(), EPS);
  }

  @Test
  public void testPeriodLongerThanSeriesComparesFirstAndLast() {
    double[] values = {100, 102, 104, 106, 108, 110, 112, 114};
    TrendResult result = analyzer.analyzeTrend(TimeSeries.daily(START, values),
        ComparisonPeriod.MOM);
    assertEquals(14.0, result.getPercentageChange(), EPS);
    assertTrue(result.isSignificant());
    assertEquals(TrendDirection.UP, result.getDirection());
  }

  @Test
  public void testZeroBaseline() {
    double[] values = {0, 1, 2, 3, 4, 5, 6, 7};
    TrendResult result = analyzer.analyzeTrend(TimeSeries.daily(START, values),
        ComparisonPeriod.MOM);
    assertEquals(0.0, result.getPercentageChange(), 0);
    assertEquals(TrendDirection.STABLE, result.getDirection());
    assertFalse(result.isSignificant());
  }

  @Test
  public void testSignificanceThreshold() {
    TimeSeries series = TimeSeries.daily(START, step(100, 160));
    assertFalse(new TrendAnalyzer(0.5, 7).analyzeTrend(series, ComparisonPeriod.WOW)
        .isSignificant());
    assertTrue(new TrendAnalyzer(0.45, 7).analyzeTrend(series, ComparisonPeriod.WOW)
        .isSignificant());
  }

  @Test
  public void testInsufficientData() {
    TrendResult result = analyzer.analyzeTrend(
        TimeSeries.daily(START, 1, 2, 3, 4, 5, 6), ComparisonPeriod.WOW);
    assertTrue(result.isInsufficientData());
    assertEquals(6, result.getSampleCount());
    assertEquals(TrendDirection.STABLE, result.getDirection());
    assertFalse(result.isSignificant());
  }

  @Test
  public void testMismatchedArraysAreReported() {
    double[] values = {1, 2, 3, 4, 5, 6, 7, 8};
    Instant[] timestamps = new Instant[7];
    for (int i = 0; i < timestamps.length; i++) {
      timestamps[i] = START.plus(Duration.ofDays(i));
    }
    TrendResult result = analyzer.analyzeTrend(values, timestamps, ComparisonPeriod.WOW);
    assertFalse(result.isInsufficientData());
    assertEquals(ComputationError.Kind.INVALID_INPUT, result.getError().get().getKind());
    assertFalse(result.isSignificant());
  }

  @Test
  public void testNullSeriesIsReported() {
    TrendResult result = analyzer.analyzeTrend((TimeSeries) null, ComparisonPeriod.WOW);
    assertEquals(ComputationError.Kind.INVALID_INPUT, result.getError().get().getKind());
    assertEquals(0, result.getSampleCount());
    assertFalse(result.isSignificant());
  }

  @Test
  public void testArraysMatchSeries() {
    TimeSeries series = TimeSeries.daily(START, step(100, 160));
    TrendResult fromArrays = analyzer.analyzeTrend(series.getValues(),
        series.getTimestamps().toArray(new Instant[0]), ComparisonPeriod.WOW);
    assertEquals(analyzer.analyzeTrend(series, ComparisonPeriod.WOW).getPercentageChange(),
        fromArrays.getPercentageChange(), 0);
  }

  @Test
  public void testDirectionBand() {
    assertEquals(TrendDirection.STABLE, TrendAnalyzer.direction(1.99));
    assertEquals(TrendDirection.STABLE, TrendAnalyzer.direction(-1.99));
    assertEquals(TrendDirection.UP, TrendAnalyzer.direction(2.0));
    assertEquals(TrendDirection.DOWN, TrendAnalyzer.direction(-2.0));
  }

  @Test
  public void testDetectTrendChanges() {
    TimeSeries series = TimeSeries.daily(START, 1, 2, 3, 4, 5, 5, 4, 3, 2, 1);
    List<TrendChangePoint> changes = analyzer.detectTrendChanges(series, 3);

    assertEquals(3, changes.size());
    assertEquals(4, changes.get(0).getIndex());
    assertEquals(5, changes.get(1).getIndex());
    assertEquals(6, changes.get(2).getIndex());

    TrendChangePoint middle = changes.get(1);
    assertEquals(START.plus(Duration.ofDays(5)), middle.getTimestamp());
    assertEquals(5.0, middle.getValue(), 0);
    assertEquals(1.0, middle.getPreviousSlope(), EPS);
    assertEquals(-1.0, middle.getNextSlope(), EPS);
    assertTrue(middle.isPeak());
  }

  @Test
  public void testTroughIsNotPeak() {
    TimeSeries series = TimeSeries.daily(START, 5, 4, 3, 2, 3, 4, 5);
    List<TrendChangePoint> changes = analyzer.detectTrendChanges(series, 3);
    assertEquals(1, changes.size());
    assertEquals(3, changes.get(0).getIndex());
    assertFalse(changes.get(0).isPeak());
  }

  @Test
  public void testFlatWindowIsNotAReversal() {
    TimeSeries series = TimeSeries.daily(START, 1, 2, 3, 3, 3, 3, 3);
    assertTrue(analyzer.detectTrendChanges(series, 3).isEmpty());
  }

  @Test
  public void testTooShortForWindows() {
    TimeSeries series = TimeSeries.daily(START, 1, 2, 3, 2, 1);
    assertTrue(analyzer.detectTrendChanges(series, 3).isEmpty());
    assertTrue(analyzer.detectTrendChanges(series, 0).isEmpty());
    // default window is 14
    assertTrue(analyzer.detectTrendChanges(series).isEmpty());
  }

  @Test
  public void testForecastLinearSeries() {
    double[] values = new double[10];
    for (int i = 0; i < values.length; i++) {
      values[i] = 3 * i + 7;
    }
    TimeSeries series = TimeSeries.daily(START, values);
    assertEquals(49.0, analyzer.forecastNextValue(series, 5), EPS);
    assertEquals(37.0, analyzer.forecastNextValue(series), EPS);
    assertEquals(1.0,
        analyzer.analyzeTrend(series, ComparisonPeriod.WOW).getRSquared(), EPS);
  }

  @Test
  public void testForecastEmptySeries() {
    TimeSeries empty = new TimeSeries(new Instant[0], new double[0]);
    assertEquals(0.0, analyzer.forecastNextValue(empty, 3), 0);
  }
}
