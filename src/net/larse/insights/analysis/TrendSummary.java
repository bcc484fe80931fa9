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
package net.larse.insights.analysis;

import net.larse.insights.algorithms.ComparisonPeriod;
import net.larse.insights.algorithms.TrendDirection;

import java.time.Instant;

/** A significant trend over one comparison window ending at the last observation. */
public final class TrendSummary {
  private final ComparisonPeriod period;
  private final TrendDirection direction;
  private final Instant start;
  private final Instant end;
  private final double startValue;
  private final double endValue;
  private final double percentageChange;
  private final double absoluteChange;
  private final double confidence;

  public TrendSummary(ComparisonPeriod period, TrendDirection direction, Instant start,
      Instant end, double startValue, double endValue, double percentageChange,
      double absoluteChange, double confidence) {
    this.period = period;
    this.direction = direction;
    this.start = start;
    this.end = end;
    this.startValue = startValue;
    this.endValue = endValue;
    this.percentageChange = percentageChange;
    this.absoluteChange = absoluteChange;
    this.confidence = confidence;
  }

  public ComparisonPeriod getPeriod() {
    return period;
  }

  public TrendDirection getDirection() {
    return direction;
  }

  /** Last timestamp minus the period length. */
  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }

  /** Value of the first observation at or after {@link #getStart()}. */
  public double getStartValue() {
    return startValue;
  }

  public double getEndValue() {
    return endValue;
  }

  public double getPercentageChange() {
    return percentageChange;
  }

  public double getAbsoluteChange() {
    return absoluteChange;
  }

  public double getConfidence() {
    return confidence;
  }

  @Override
  public String toString() {
    return String.format("TrendSummary[%s %s %.2f%% (%s -> %s)]",
        period, direction, percentageChange, startValue, endValue);
  }
}
