package net.larse.insights.timeseries;

import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import static org.junit.Assert.*;

public class TimeSeriesTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  public void testDaily() {
    TimeSeries series = TimeSeries.daily(START, 1, 2, 3);
    assertEquals(3, series.size());
    assertEquals(START, series.getFirstTimestamp());
    assertEquals(Instant.parse("2024-01-03T00:00:00Z"), series.getLastTimestamp());
    assertEquals(2.0, series.getValue(1), 0);
    assertArrayEquals(new double[] {0, 1, 2}, series.elapsedDays(), 1e-12);
  }

  @Test
  public void testElapsedDaysIsRelativeToWindowStart() {
    Instant[] timestamps = {
        START, START.plus(Duration.ofHours(12)), START.plus(Duration.ofDays(2)),
        START.plus(Duration.ofDays(5))};
    TimeSeries series = new TimeSeries(timestamps, new double[] {1, 2, 3, 4});
    assertArrayEquals(new double[] {0, 0.5, 2, 5}, series.elapsedDays(), 1e-12);
    assertArrayEquals(new double[] {0, 3}, series.elapsedDays(2, 4), 1e-12);
    assertEquals(0, series.elapsedDays(1, 1).length);
  }

  @Test
  public void testValuesAreCopied() {
    double[] values = {1, 2};
    TimeSeries series = TimeSeries.daily(START, values);
    values[0] = 99;
    series.getValues()[1] = 99;
    assertArrayEquals(new double[] {1, 2}, series.getValues(), 0);
  }

  @Test
  public void testEmpty() {
    TimeSeries series = new TimeSeries(new Instant[0], new double[0]);
    assertTrue(series.isEmpty());
    assertEquals(0, series.elapsedDays().length);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLengthMismatch() {
    new TimeSeries(Arrays.asList(START, START.plusSeconds(1)), new double[] {1});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnorderedTimestamps() {
    new TimeSeries(new Instant[] {START.plusSeconds(10), START}, new double[] {1, 2});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateTimestamps() {
    new TimeSeries(new Instant[] {START, START}, new double[] {1, 2});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonFiniteValue() {
    TimeSeries.daily(START, 1, Double.NaN);
  }
}
