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

import net.larse.insights.timeseries.ComputationError;

import java.util.Optional;

/**
 * Outcome of a single trend analysis.
 *
 * <p>An insufficient-data or failed analysis is STABLE with a zero change and is never
 * significant; the other statistics are zero and severity is INFO.
 */
public final class TrendResult {
  private final ComparisonPeriod period;
  private final TrendDirection direction;
  private final double percentageChange;
  private final double absoluteChange;
  private final boolean significant;
  private final double slope;
  private final double rSquared;
  private final double volatility;
  private final Severity severity;
  private final double confidence;
  private final int sampleCount;
  private final boolean insufficientData;
  private final ComputationError error;

  private TrendResult(Builder b) {
    this.period = b.period;
    this.direction = b.direction;
    this.percentageChange = b.percentageChange;
    this.absoluteChange = b.absoluteChange;
    this.significant = b.significant;
    this.slope = b.slope;
    this.rSquared = b.rSquared;
    this.volatility = b.volatility;
    this.severity = b.severity;
    this.confidence = b.confidence;
    this.sampleCount = b.sampleCount;
    this.insufficientData = b.insufficientData;
    this.error = b.error;
  }

  static TrendResult insufficientData(ComparisonPeriod period, int sampleCount) {
    Builder b = new Builder(period);
    b.sampleCount = sampleCount;
    b.insufficientData = true;
    return b.build();
  }

  static TrendResult failed(ComparisonPeriod period, int sampleCount, ComputationError error) {
    Builder b = new Builder(period);
    b.sampleCount = sampleCount;
    b.error = error;
    return b.build();
  }

  public ComparisonPeriod getPeriod() {
    return period;
  }

  public TrendDirection getDirection() {
    return direction;
  }

  /** Change of the recent window's mean against the older points' mean, in percent. */
  public double getPercentageChange() {
    return percentageChange;
  }

  /** Last value minus first value. */
  public double getAbsoluteChange() {
    return absoluteChange;
  }

  public boolean isSignificant() {
    return significant;
  }

  /** Regression slope in value units per day. */
  public double getSlope() {
    return slope;
  }

  public double getRSquared() {
    return rSquared;
  }

  /** Coefficient of variation, in percent. */
  public double getVolatility() {
    return volatility;
  }

  public Severity getSeverity() {
    return severity;
  }

  public double getConfidence() {
    return confidence;
  }

  public int getSampleCount() {
    return sampleCount;
  }

  public boolean isInsufficientData() {
    return insufficientData;
  }

  public Optional<ComputationError> getError() {
    return Optional.ofNullable(error);
  }

  @Override
  public String toString() {
    return String.format("TrendResult[%s %s %.2f%%, significant=%s, severity=%s, "
            + "slope=%.4f, r2=%.3f, confidence=%.3f%s%s]",
        period, direction, percentageChange, significant, severity, slope, rSquared, confidence,
        insufficientData ? ", insufficient data" : "",
        error == null ? "" : ", error=" + error);
  }

  static final class Builder {
    private final ComparisonPeriod period;
    TrendDirection direction = TrendDirection.STABLE;
    double percentageChange;
    double absoluteChange;
    boolean significant;
    double slope;
    double rSquared;
    double volatility;
    Severity severity = Severity.INFO;
    double confidence;
    int sampleCount;
    boolean insufficientData;
    ComputationError error;

    Builder(ComparisonPeriod period) {
      this.period = period;
    }

    TrendResult build() {
      return new TrendResult(this);
    }
  }
}
