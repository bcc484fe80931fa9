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

import net.larse.insights.helper.ArrayHelper;
import org.apache.commons.math.stat.StatUtils;

/** Summary statistics of a series. Spread figures are population (divide by N) measures. */
public final class SeriesStatistics {
  private final int count;
  private final double mean;
  private final double median;
  private final double std;
  private final double variance;
  private final double min;
  private final double max;
  private final double q1;
  private final double q3;

  private SeriesStatistics(double[] values) {
    this.count = values.length;
    this.mean = ArrayHelper.mean(values);
    this.variance = ArrayHelper.populationVariance(values);
    this.std = Math.sqrt(variance);
    this.min = StatUtils.min(values);
    this.max = StatUtils.max(values);
    this.median = ArrayHelper.percentile(values, 50);
    this.q1 = ArrayHelper.percentile(values, 25);
    this.q3 = ArrayHelper.percentile(values, 75);
  }

  /** Statistics of a non-empty series. */
  public static SeriesStatistics of(double[] values) {
    return new SeriesStatistics(values);
  }

  public int getCount() {
    return count;
  }

  public double getMean() {
    return mean;
  }

  public double getMedian() {
    return median;
  }

  public double getStd() {
    return std;
  }

  public double getVariance() {
    return variance;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public double getQ1() {
    return q1;
  }

  public double getQ3() {
    return q3;
  }

  public double getIqr() {
    return q3 - q1;
  }

  /** Standard deviation over absolute mean, in percent; 0 when the mean is 0. */
  public double getCoefficientOfVariation() {
    return mean == 0 ? 0 : std / Math.abs(mean) * 100;
  }

  @Override
  public String toString() {
    return String.format("SeriesStatistics[n=%d, mean=%.4f, median=%.4f, std=%.4f, "
        + "min=%.4f, max=%.4f]", count, mean, median, std, min, max);
  }
}
