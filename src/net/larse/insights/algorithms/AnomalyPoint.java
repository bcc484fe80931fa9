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

/** A point whose absolute z-score exceeded the detection threshold. */
public final class AnomalyPoint {
  private final int index;
  private final double value;
  private final double zScore;

  public AnomalyPoint(int index, double value, double zScore) {
    this.index = index;
    this.value = value;
    this.zScore = zScore;
  }

  public int getIndex() {
    return index;
  }

  /** The scored value, which is the residual when scoring a decomposition. */
  public double getValue() {
    return value;
  }

  /** Absolute number of standard deviations from the mean. */
  public double getZScore() {
    return zScore;
  }

  @Override
  public String toString() {
    return String.format("AnomalyPoint[%d, value=%s, z=%.3f]", index, value, zScore);
  }
}
