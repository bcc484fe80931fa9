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
package net.larse.insights.timeseries;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import net.larse.insights.helper.AlgorithmBase;
import net.larse.insights.helper.ArrayHelper;

/**
 * Additive seasonal decomposition of a metric series into trend, seasonal and residual
 * components.
 *
 * <p>This is a lightweight approximation of STL (Cleveland et al., 1990). The trend is a
 * centered moving average whose window is one seasonal period. The seasonal component is the
 * per-phase mean of the detrended series, centered to zero mean and tiled over the series.
 * The residual is whatever remains.
 *
 * <p>Windows at the edges of the series are clipped rather than padded, so the first and last
 * period / 2 trend values average fewer points.
 */
public class SeasonalDecomposition {
  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of samples per seasonal cycle, e.g. 7 for weekly seasonality "
        + "on daily data.")
    @Optional
    public int seasonalPeriod = 7;

    @Doc(help = "Minimum number of samples needed to decompose. Shorter series produce "
        + "a degraded passthrough result.")
    @Optional
    public int minSamples = 14;
  }

  private final Args args;

  public SeasonalDecomposition() {
    this(new Args());
  }

  public SeasonalDecomposition(int seasonalPeriod, int minSamples) {
    this(newArgs(seasonalPeriod, minSamples));
  }

  public SeasonalDecomposition(Args args) {
    this.args = args;
  }

  private static Args newArgs(int seasonalPeriod, int minSamples) {
    Args args = new Args();
    args.seasonalPeriod = seasonalPeriod;
    args.minSamples = minSamples;
    return args;
  }

  public int getSeasonalPeriod() {
    return args.seasonalPeriod;
  }

  public int getMinSamples() {
    return args.minSamples;
  }

  /**
   * Decomposes values into trend, seasonal and residual components.
   *
   * <p>Never throws: a series shorter than minSamples gives a degraded result, and any failure
   * (null or non-finite input, a period or minimum sample count below 1) gives a degraded
   * result with an error.
   */
  public DecompositionResult decompose(double[] values) {
    try {
      Preconditions.checkNotNull(values, "values");
      Preconditions.checkArgument(args.minSamples >= 1,
          "minimum sample count must be at least 1, got %s", args.minSamples);
      if (values.length < args.minSamples) {
        return DecompositionResult.insufficientData(values);
      }
      Preconditions.checkArgument(args.seasonalPeriod >= 1,
          "seasonal period must be at least 1, got %s", args.seasonalPeriod);
      Preconditions.checkArgument(ArrayHelper.allFinite(values), "values must be finite");

      double[] data = values.clone();
      double[] trend = movingAverage(data, args.seasonalPeriod);
      double[] detrended = ArrayHelper.subtract(data, trend);
      double[] seasonal = seasonalComponent(detrended, args.seasonalPeriod);
      double[] residual = ArrayHelper.subtract(detrended, seasonal);

      double residualVariance = ArrayHelper.populationVariance(residual);
      return new DecompositionResult(data, trend, seasonal, residual,
          strength(ArrayHelper.populationVariance(seasonal), residualVariance),
          strength(ArrayHelper.populationVariance(trend), residualVariance));
    } catch (RuntimeException e) {
      return DecompositionResult.failed(values, ComputationError.from(e));
    }
  }

  /**
   * Centered moving average: trend[i] is the mean of data[max(0, i - period / 2),
   * min(n, i + period / 2 + 1)).
   */
  @VisibleForTesting
  static double[] movingAverage(double[] data, int period) {
    int half = period / 2;
    double[] trend = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      int start = Math.max(0, i - half);
      int end = Math.min(data.length, i + half + 1);
      trend[i] = ArrayHelper.mean(data, start, end);
    }
    return trend;
  }

  /**
   * Averages the detrended values of each phase i mod period, centers the pattern on zero and
   * tiles it across the series. A phase without samples averages to 0.
   */
  @VisibleForTesting
  static double[] seasonalComponent(double[] detrended, int period) {
    double[] pattern = new double[period];
    DoubleArrayList phase = new DoubleArrayList();
    for (int p = 0; p < period; p++) {
      phase.clear();
      for (int i = p; i < detrended.length; i += period) {
        phase.add(detrended[i]);
      }
      if (!phase.isEmpty()) {
        pattern[p] = ArrayHelper.mean(phase.toDoubleArray());
      }
    }

    double center = ArrayHelper.mean(pattern);
    for (int p = 0; p < period; p++) {
      pattern[p] -= center;
    }
    return ArrayHelper.tile(pattern, detrended.length);
  }

  /** var(component) / (var(component) + var(residual)), clamped to [0, 1]; 0 if undefined. */
  private static double strength(double componentVariance, double residualVariance) {
    double total = componentVariance + residualVariance;
    if (total == 0 || !Doubles.isFinite(total)) {
      return 0;
    }
    return ArrayHelper.clamp(componentVariance / total, 0, 1);
  }
}
