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

/**
 * An anomalous observation as reported by one of the point detectors, with the value it was
 * expected to have and how confident the detector is.
 */
public final class DetectedAnomaly {
  private final int index;
  private final double actualValue;
  private final double expectedValue;
  private final double deviation;
  private final AnomalyType type;
  private final Severity severity;
  private final DetectionMethod method;
  private final double confidence;

  public DetectedAnomaly(int index, double actualValue, double expectedValue, double deviation,
      AnomalyType type, Severity severity, DetectionMethod method, double confidence) {
    this.index = index;
    this.actualValue = actualValue;
    this.expectedValue = expectedValue;
    this.deviation = deviation;
    this.type = type;
    this.severity = severity;
    this.method = method;
    this.confidence = confidence;
  }

  public int getIndex() {
    return index;
  }

  public double getActualValue() {
    return actualValue;
  }

  public double getExpectedValue() {
    return expectedValue;
  }

  /**
   * Method-specific distance from normal: a z-score, a multiple of the interquartile range, or
   * the absolute residual.
   */
  public double getDeviation() {
    return deviation;
  }

  public AnomalyType getType() {
    return type;
  }

  public Severity getSeverity() {
    return severity;
  }

  public DetectionMethod getMethod() {
    return method;
  }

  public double getConfidence() {
    return confidence;
  }

  @Override
  public String toString() {
    return String.format("DetectedAnomaly[%d %s %s by %s, actual=%s, expected=%.4f, "
            + "deviation=%.4f, confidence=%.3f]",
        index, severity, type, method, actualValue, expectedValue, deviation, confidence);
  }
}
