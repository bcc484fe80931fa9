/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.insights.algorithms;

import com.google.common.base.Preconditions;
import net.larse.insights.helper.AlgorithmBase;
import net.larse.insights.helper.ArrayHelper;
import net.larse.insights.helper.LinearFit;
import net.larse.insights.timeseries.ComputationError;
import net.larse.insights.timeseries.TimeSeries;
import org.apache.commons.lang3.ArrayUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Trend analysis of a metric series.
 *
 * <p>Combines a least squares fit over elapsed days with a period-over-period comparison:
 * the mean of the points inside the last period (WoW, MoM, QoQ, YoY) against the mean of the
 * points before it. The direction, significance and severity come from that percentage
 * change alone. The slope and its R-squared are reported and feed the confidence score.
 */
public class TrendAnalyzer {
  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Minimum absolute change for a significant trend, as a fraction "
        + "(0.10 means 10%).")
    @Optional
    public double significanceThreshold = 0.10;

    @Doc(help = "Minimum number of samples needed to analyze a trend.")
    @Optional
    public int minSamples = 7;

    @Doc(help = "Size of each of the two adjacent windows compared when looking for "
        + "trend reversals.")
    @Optional
    public int windowSize = 14;
  }

  // Changes below this many percent are STABLE.
  private static final double STABLE_PERCENT = 2.0;

  // Confidence saturates at this many samples and at this absolute percentage change.
  private static final double FULL_CONFIDENCE_SAMPLES = 30.0;
  private static final double FULL_CONFIDENCE_CHANGE = 50.0;

  private final Args args;

  public TrendAnalyzer() {
    this(new Args());
  }

  public TrendAnalyzer(double significanceThreshold, int minSamples) {
    this(newArgs(significanceThreshold, minSamples));
  }

  public TrendAnalyzer(Args args) {
    this.args = args;
  }

  private static Args newArgs(double significanceThreshold, int minSamples) {
    Args args = new Args();
    args.significanceThreshold = significanceThreshold;
    args.minSamples = minSamples;
    return args;
  }

  public double getSignificanceThreshold() {
    return args.significanceThreshold;
  }

  public int getMinSamples() {
    return args.minSamples;
  }

  public int getWindowSize() {
    return args.windowSize;
  }

  /**
   * Analyzes parallel value and timestamp arrays. Mismatched lengths or unordered
   * timestamps are reported through the result's error rather than thrown.
   */
  public TrendResult analyzeTrend(double[] values, Instant[] timestamps, ComparisonPeriod period) {
    int n = values == null ? 0 : values.length;
    if (n < args.minSamples) {
      return TrendResult.insufficientData(period, n);
    }
    TimeSeries series;
    try {
      series = new TimeSeries(timestamps, values);
    } catch (RuntimeException e) {
      return TrendResult.failed(period, n, ComputationError.from(e));
    }
    return analyzeTrend(series, period);
  }

  /**
   * Analyzes the trend of a series over the given comparison period. Never throws: short
   * series give an insufficient-data result and failures give a result with an error.
   */
  public TrendResult analyzeTrend(TimeSeries series, ComparisonPeriod period) {
    if (series == null) {
      return TrendResult.failed(period, 0,
          new ComputationError(ComputationError.Kind.INVALID_INPUT, "series is null"));
    }
    int n = series.size();
    if (n < args.minSamples) {
      return TrendResult.insufficientData(period, n);
    }

    try {
      Preconditions.checkNotNull(period, "period");
      double[] values = series.getValues();
      LinearFit fit = LinearFit.fit(series.elapsedDays(), values);
      double percentageChange = periodChange(series, period);
      double magnitude = Math.abs(percentageChange);

      TrendResult.Builder b = new TrendResult.Builder(period);
      b.direction = direction(percentageChange);
      b.percentageChange = percentageChange;
      b.absoluteChange = values[n - 1] - values[0];
      b.significant = magnitude >= args.significanceThreshold * 100;
      b.slope = fit.getSlope();
      b.rSquared = fit.getRSquared();
      b.volatility = volatility(values);
      b.severity = Severity.fromThresholds(magnitude, 10, 15, 30, 50);
      b.confidence = confidence(percentageChange, fit.getRSquared(), n);
      b.sampleCount = n;
      return b.build();
    } catch (RuntimeException e) {
      return TrendResult.failed(period, n, ComputationError.from(e));
    }
  }

  /**
   * Percentage change of the points at or after (last - period) against the points before it.
   *
   * <p>If either side is empty the first value is compared with the last instead. A zero
   * baseline gives 0 rather than an infinite change.
   */
  static double periodChange(TimeSeries series, ComparisonPeriod period) {
    int n = series.size();
    Instant cutoff = series.getLastTimestamp().minus(period.getDuration());

    double recentSum = 0;
    int recentCount = 0;
    double oldSum = 0;
    int oldCount = 0;
    for (int i = 0; i < n; i++) {
      if (!series.getTimestamp(i).isBefore(cutoff)) {
        recentSum += series.getValue(i);
        recentCount++;
      } else {
        oldSum += series.getValue(i);
        oldCount++;
      }
    }

    double oldValue;
    double newValue;
    if (recentCount == 0 || oldCount == 0) {
      // The cutoff didn't split the series: compare first and last points.
      if (n < 2) {
        return 0;
      }
      oldValue = series.getValue(0);
      newValue = series.getValue(n - 1);
    } else {
      oldValue = oldSum / oldCount;
      newValue = recentSum / recentCount;
    }

    if (oldValue == 0) {
      return 0;
    }
    return (newValue - oldValue) / Math.abs(oldValue) * 100;
  }

  static TrendDirection direction(double percentageChange) {
    if (Math.abs(percentageChange) < STABLE_PERCENT) {
      return TrendDirection.STABLE;
    }
    return percentageChange > 0 ? TrendDirection.UP : TrendDirection.DOWN;
  }

  /** Coefficient of variation in percent, or 0 when the mean is 0. */
  static double volatility(double[] values) {
    double mean = ArrayHelper.mean(values);
    if (mean == 0) {
      return 0;
    }
    return ArrayHelper.populationStd(values) / Math.abs(mean) * 100;
  }

  static double confidence(double percentageChange, double rSquared, int sampleCount) {
    double sampleConfidence = Math.min(sampleCount / FULL_CONFIDENCE_SAMPLES, 1.0);
    double changeConfidence = Math.min(Math.abs(percentageChange) / FULL_CONFIDENCE_CHANGE, 1.0);
    return ArrayHelper.clamp(
        0.4 * rSquared + 0.3 * sampleConfidence + 0.3 * changeConfidence, 0, 1);
  }

  /** Trend reversals using the configured window size. */
  public List<TrendChangePoint> detectTrendChanges(TimeSeries series) {
    return detectTrendChanges(series, args.windowSize);
  }

  /**
   * Finds trend reversals by sliding two adjacent windows of windowSize points across the
   * series. At every boundary i in [windowSize, n - windowSize) the slope of [i - windowSize, i)
   * is compared with the slope of [i, i + windowSize); a point is emitted when they have
   * strictly opposite signs. A flat window never counts as a reversal.
   */
  public List<TrendChangePoint> detectTrendChanges(TimeSeries series, int windowSize) {
    List<TrendChangePoint> changes = new ArrayList<>();
    int n = series.size();
    if (windowSize < 1 || n < windowSize * 2) {
      return changes;
    }

    double[] values = series.getValues();
    for (int i = windowSize; i < n - windowSize; i++) {
      double previousSlope = windowSlope(series, values, i - windowSize, i);
      double nextSlope = windowSlope(series, values, i, i + windowSize);
      if (previousSlope * nextSlope < 0) {
        changes.add(new TrendChangePoint(
            i, series.getTimestamp(i), values[i], previousSlope, nextSlope));
      }
    }
    return changes;
  }

  private static double windowSlope(TimeSeries series, double[] values, int start, int end) {
    double[] window = ArrayUtils.subarray(values, start, end);
    return LinearFit.fit(series.elapsedDays(start, end), window).getSlope();
  }

  /**
   * Linear extrapolation from the last value along the slope fitted to the whole series,
   * treating each period ahead as one day. An empty series forecasts 0.
   */
  public double forecastNextValue(TimeSeries series, int periodsAhead) {
    if (series.isEmpty()) {
      return 0;
    }
    double slope = LinearFit.fit(series.elapsedDays(), series.getValues()).getSlope();
    return series.getValue(series.size() - 1) + slope * periodsAhead;
  }

  public double forecastNextValue(TimeSeries series) {
    return forecastNextValue(series, 1);
  }
}
