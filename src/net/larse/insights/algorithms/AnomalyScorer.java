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

import net.larse.insights.helper.AlgorithmBase;
import net.larse.insights.helper.ArrayHelper;
import net.larse.insights.timeseries.DecompositionResult;
import net.larse.insights.timeseries.SeasonalDecomposition;
import net.larse.insights.timeseries.TimeSeries;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Residual-based anomaly scoring on top of a {@link SeasonalDecomposition}.
 *
 * <p>{@link #detectAnomalies} scores any series directly. {@link #detectSeasonalAnomalies}
 * first strips trend and seasonality and scores only the residual, skipping series the
 * decomposition could not handle.
 */
public class AnomalyScorer {
  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Absolute z-score a point must exceed (strictly) to be flagged.")
    @Optional
    public double threshold = 2.0;
  }

  private final Args args;
  private final SeasonalDecomposition decomposition;

  public AnomalyScorer() {
    this(new Args(), new SeasonalDecomposition());
  }

  public AnomalyScorer(SeasonalDecomposition decomposition) {
    this(new Args(), decomposition);
  }

  public AnomalyScorer(Args args, SeasonalDecomposition decomposition) {
    this.args = args;
    this.decomposition = decomposition;
  }

  public double getThreshold() {
    return args.threshold;
  }

  public SeasonalDecomposition getDecomposition() {
    return decomposition;
  }

  public List<AnomalyPoint> detectAnomalies(double[] series) {
    return detectAnomalies(series, args.threshold);
  }

  /**
   * Flags every point whose absolute z-score, against the population mean and standard
   * deviation of the series, is strictly greater than threshold. Points come back in index
   * order. A constant or empty series has no anomalies.
   */
  public List<AnomalyPoint> detectAnomalies(double[] series, double threshold) {
    List<AnomalyPoint> anomalies = new ArrayList<>();
    if (series == null || series.length == 0) {
      return anomalies;
    }

    double mean = ArrayHelper.mean(series);
    double std = ArrayHelper.populationStd(series);
    if (std == 0) {
      return anomalies;
    }

    for (int i = 0; i < series.length; i++) {
      double z = Math.abs((series[i] - mean) / std);
      if (z > threshold) {
        anomalies.add(new AnomalyPoint(i, series[i], z));
      }
    }
    return anomalies;
  }

  /** Decomposes values and scores the residual. Empty when the decomposition is degraded. */
  public List<AnomalyPoint> detectSeasonalAnomalies(double[] values) {
    return detectSeasonalAnomalies(decomposition.decompose(values));
  }

  public List<AnomalyPoint> detectSeasonalAnomalies(DecompositionResult result) {
    if (result.isDegraded()) {
      return new ArrayList<>();
    }
    return detectAnomalies(result.getResidual(), args.threshold);
  }

  /**
   * Removes the seasonal component: original[i] - seasonal[i]. Values the decomposition can't
   * handle are returned unchanged.
   */
  public double[] adjustForSeasonality(double[] values) {
    DecompositionResult result = decomposition.decompose(values);
    if (result.isDegraded()) {
      return values == null ? new double[0] : values.clone();
    }
    return ArrayHelper.subtract(result.getOriginal(), result.getSeasonal());
  }

  public double[] adjustForSeasonality(TimeSeries series) {
    return adjustForSeasonality(series.getValues());
  }

  /**
   * Projects periodsAhead values as the last trend value plus the seasonal value of the same
   * phase in the last full cycle. When there is nothing to project from, the last value is
   * repeated (or zeros for an empty input).
   */
  public double[] predictSeasonalPattern(double[] values, int periodsAhead) {
    double[] predictions = new double[Math.max(periodsAhead, 0)];
    if (values == null || values.length == 0) {
      return predictions;
    }

    int period = decomposition.getSeasonalPeriod();
    DecompositionResult result = decomposition.decompose(values);
    if (result.isDegraded() || values.length < period) {
      Arrays.fill(predictions, values[values.length - 1]);
      return predictions;
    }

    double[] trend = result.getTrend();
    double[] seasonal = result.getSeasonal();
    double lastTrend = trend[trend.length - 1];
    int cycleStart = seasonal.length - period;
    for (int i = 0; i < predictions.length; i++) {
      predictions[i] = lastTrend + seasonal[cycleStart + i % period];
    }
    return predictions;
  }
}
