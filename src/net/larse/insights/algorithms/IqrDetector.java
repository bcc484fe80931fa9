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

import com.google.common.collect.Range;
import net.larse.insights.helper.AlgorithmBase;
import net.larse.insights.helper.ArrayHelper;

import java.util.ArrayList;
import java.util.List;

/** Flags points outside the fences [Q1 - k * IQR, Q3 + k * IQR]. */
public class IqrDetector {
  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "IQR multiplier for the outlier fences: 1.5 for moderate, 3.0 for extreme "
        + "outliers.")
    @Optional
    public double multiplier = 1.5;

    @Doc(help = "Minimum number of samples needed to run detection.")
    @Optional
    public int minSamples = 10;
  }

  private final Args args;

  public IqrDetector() {
    this(new Args());
  }

  public IqrDetector(Args args) {
    this.args = args;
  }

  public double getMultiplier() {
    return args.multiplier;
  }

  /**
   * Anomalies in index order. The deviation is the distance past the nearest fence in IQR
   * units, or 0 when the IQR is 0.
   */
  public List<DetectedAnomaly> detect(double[] values) {
    List<DetectedAnomaly> anomalies = new ArrayList<>();
    if (values.length < args.minSamples || values.length == 0) {
      return anomalies;
    }

    double q1 = ArrayHelper.percentile(values, 25);
    double q3 = ArrayHelper.percentile(values, 75);
    double iqr = q3 - q1;
    double lower = q1 - args.multiplier * iqr;
    double upper = q3 + args.multiplier * iqr;
    double expected = (lower + upper) / 2;

    for (int i = 0; i < values.length; i++) {
      double v = values[i];
      if (v >= lower && v <= upper) {
        continue;
      }
      AnomalyType type;
      double deviation;
      if (v < lower) {
        type = AnomalyType.DROP;
        deviation = iqr > 0 ? Math.abs(v - lower) / iqr : 0;
      } else {
        type = AnomalyType.SPIKE;
        deviation = iqr > 0 ? Math.abs(v - upper) / iqr : 0;
      }
      anomalies.add(new DetectedAnomaly(i, v, expected, deviation, type, severity(deviation),
          DetectionMethod.IQR, confidence(values.length, deviation)));
    }
    return anomalies;
  }

  /** CRITICAL from 3 IQRs past the fence, HIGH from 2, MEDIUM from 1, LOW from 0.5. */
  public static Severity severity(double deviation) {
    return Severity.fromThresholds(deviation, 0.5, 1.0, 2.0, 3.0);
  }

  /** Grows with the sample count (saturating at 100) and the deviation (saturating at 3). */
  public static double confidence(int sampleCount, double deviation) {
    double sampleFactor = Math.min(sampleCount / 100.0, 1.0);
    double deviationFactor = Math.min(deviation / 3.0, 1.0);
    return ArrayHelper.clamp(0.3 * sampleFactor + 0.7 * deviationFactor, 0, 1);
  }

  /** The closed range of values that are not outliers. */
  public Range<Double> expectedRange(double[] values) {
    double q1 = ArrayHelper.percentile(values, 25);
    double q3 = ArrayHelper.percentile(values, 75);
    double iqr = q3 - q1;
    return Range.closed(q1 - args.multiplier * iqr, q3 + args.multiplier * iqr);
  }

  public boolean isOutlier(double value, double[] values) {
    return !expectedRange(values).contains(value);
  }

  public SeriesStatistics statistics(double[] values) {
    return SeriesStatistics.of(values);
  }
}
