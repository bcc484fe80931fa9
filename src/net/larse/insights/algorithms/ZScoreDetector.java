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

import java.util.ArrayList;
import java.util.List;

/**
 * Flags points that lie more than a threshold number of standard deviations from the mean of
 * the whole series.
 */
public class ZScoreDetector {
  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Absolute z-score a point must exceed (strictly) to be flagged.")
    @Optional
    public double threshold = 3.0;

    @Doc(help = "Minimum number of samples needed to run detection.")
    @Optional
    public int minSamples = 10;
  }

  private final Args args;

  public ZScoreDetector() {
    this(new Args());
  }

  public ZScoreDetector(Args args) {
    this.args = args;
  }

  public double getThreshold() {
    return args.threshold;
  }

  /** Anomalies in index order; empty for short or constant series. */
  public List<DetectedAnomaly> detect(double[] values) {
    List<DetectedAnomaly> anomalies = new ArrayList<>();
    if (values.length < args.minSamples || values.length == 0) {
      return anomalies;
    }

    double mean = ArrayHelper.mean(values);
    double std = ArrayHelper.populationStd(values);
    if (std == 0) {
      return anomalies;
    }

    for (int i = 0; i < values.length; i++) {
      double z = Math.abs((values[i] - mean) / std);
      if (z > args.threshold) {
        anomalies.add(new DetectedAnomaly(i, values[i], mean, z,
            values[i] > mean ? AnomalyType.SPIKE : AnomalyType.DROP,
            severity(z), DetectionMethod.ZSCORE, confidence(values.length, z)));
      }
    }
    return anomalies;
  }

  /** CRITICAL from 5 standard deviations, HIGH from 4, MEDIUM from 3.5, LOW from 3. */
  public static Severity severity(double zScore) {
    return Severity.fromThresholds(zScore, 3.0, 3.5, 4.0, 5.0);
  }

  /** Grows with the sample count (saturating at 100) and the z-score (saturating at 5). */
  public static double confidence(int sampleCount, double zScore) {
    double sampleFactor = Math.min(sampleCount / 100.0, 1.0);
    double zFactor = Math.min(zScore / 5.0, 1.0);
    return ArrayHelper.clamp(0.3 * sampleFactor + 0.7 * zFactor, 0, 1);
  }

  /** The value a point is expected to have, which for this detector is the series mean. */
  public double expectedValue(double[] values) {
    return ArrayHelper.mean(values);
  }

  public SeriesStatistics statistics(double[] values) {
    return SeriesStatistics.of(values);
  }
}
