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

import java.time.Instant;

/**
 * A reversal in local trend: the regression slope of the window ending before index has the
 * opposite sign of the slope of the window starting at index.
 */
public final class TrendChangePoint {
  private final int index;
  private final Instant timestamp;
  private final double value;
  private final double previousSlope;
  private final double nextSlope;

  public TrendChangePoint(int index, Instant timestamp, double value, double previousSlope,
      double nextSlope) {
    this.index = index;
    this.timestamp = timestamp;
    this.value = value;
    this.previousSlope = previousSlope;
    this.nextSlope = nextSlope;
  }

  public int getIndex() {
    return index;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public double getValue() {
    return value;
  }

  public double getPreviousSlope() {
    return previousSlope;
  }

  public double getNextSlope() {
    return nextSlope;
  }

  /** True for a peak (rising then falling), false for a trough. */
  public boolean isPeak() {
    return previousSlope > 0 && nextSlope < 0;
  }

  @Override
  public String toString() {
    return String.format("TrendChangePoint[%d @ %s, value=%s, slope %.4f -> %.4f]",
        index, timestamp, value, previousSlope, nextSlope);
  }
}
