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

import java.util.Optional;

/**
 * Additive decomposition of a series into trend, seasonal and residual components.
 *
 * <p>When not degraded, original[i] == trend[i] + seasonal[i] + residual[i] up to roundoff.
 * A degraded result (too few samples, or a caught failure) passes the original through as
 * the trend with all-zero seasonal and residual components, and zero strengths.
 */
public final class DecompositionResult {
  private final double[] original;
  private final double[] trend;
  private final double[] seasonal;
  private final double[] residual;
  private final double seasonalStrength;
  private final double trendStrength;
  private final boolean degraded;
  private final ComputationError error;

  DecompositionResult(double[] original, double[] trend, double[] seasonal, double[] residual,
      double seasonalStrength, double trendStrength) {
    this(original, trend, seasonal, residual, seasonalStrength, trendStrength, false, null);
  }

  private DecompositionResult(double[] original, double[] trend, double[] seasonal,
      double[] residual, double seasonalStrength, double trendStrength, boolean degraded,
      ComputationError error) {
    this.original = original;
    this.trend = trend;
    this.seasonal = seasonal;
    this.residual = residual;
    this.seasonalStrength = seasonalStrength;
    this.trendStrength = trendStrength;
    this.degraded = degraded;
    this.error = error;
  }

  /** The passthrough result for a series shorter than the minimum sample count. */
  static DecompositionResult insufficientData(double[] values) {
    return passthrough(values, null);
  }

  /** The passthrough result for a decomposition that failed with the given error. */
  static DecompositionResult failed(double[] values, ComputationError error) {
    return passthrough(values == null ? new double[0] : values, error);
  }

  private static DecompositionResult passthrough(double[] values, ComputationError error) {
    int n = values.length;
    return new DecompositionResult(values.clone(), values.clone(), new double[n],
        new double[n], 0, 0, true, error);
  }

  public int size() {
    return original.length;
  }

  public double[] getOriginal() {
    return original.clone();
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getResidual() {
    return residual.clone();
  }

  public double getSeasonalStrength() {
    return seasonalStrength;
  }

  public double getTrendStrength() {
    return trendStrength;
  }

  /** True when no decomposition was computed, either for lack of samples or on failure. */
  public boolean isDegraded() {
    return degraded;
  }

  public Optional<ComputationError> getError() {
    return Optional.ofNullable(error);
  }

  @Override
  public String toString() {
    if (degraded) {
      return String.format("DecompositionResult[degraded, n=%d%s]", size(),
          error == null ? "" : ", error=" + error);
    }
    return String.format("DecompositionResult[n=%d, seasonalStrength=%.3f, trendStrength=%.3f]",
        size(), seasonalStrength, trendStrength);
  }
}
