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
package net.larse.insights.helper;

import com.google.common.base.Preconditions;
import org.apache.commons.math.stat.regression.SimpleRegression;

/**
 * A wrapper for ordinary least squares fitting of y = slope * x + intercept.
 *
 * <p>Degenerate inputs don't fail: with fewer than two points, or when every x is identical,
 * the slope is 0 and the intercept is the mean of y. R-squared is 1 - SS_res / SS_tot, and
 * 0 when SS_tot is 0.
 */
public final class LinearFit {
  private final double slope;
  private final double intercept;
  private final double rSquared;
  private final int numInputs;

  private LinearFit(double slope, double intercept, double rSquared, int numInputs) {
    this.slope = slope;
    this.intercept = intercept;
    this.rSquared = rSquared;
    this.numInputs = numInputs;
  }

  public static LinearFit fit(double[] x, double[] y) {
    return fit(x, y, 0, x.length);
  }

  /** Fits the observations between start (incl) and end (excl). */
  public static LinearFit fit(double[] x, double[] y, int start, int end) {
    Preconditions.checkArgument(x.length == y.length,
        "length mismatch: %s vs %s", x.length, y.length);
    Preconditions.checkPositionIndexes(start, end, x.length);

    int n = end - start;
    if (n == 0) {
      return new LinearFit(0, 0, 0, 0);
    }

    SimpleRegression regression = new SimpleRegression();
    for (int i = start; i < end; i++) {
      regression.addData(x[i], y[i]);
    }

    double meanY = ArrayHelper.mean(y, start, end);
    double slope = regression.getSlope();
    double intercept;
    if (n < 2 || Double.isNaN(slope)) {
      // not enough spread in x to define a line
      slope = 0;
      intercept = meanY;
    } else {
      intercept = regression.getIntercept();
    }

    double ssRes = 0;
    double ssTot = 0;
    for (int i = start; i < end; i++) {
      double fitted = slope * x[i] + intercept;
      ssRes += (y[i] - fitted) * (y[i] - fitted);
      ssTot += (y[i] - meanY) * (y[i] - meanY);
    }
    // due to roundoff, 1 - ssRes / ssTot could end up slightly outside [0, 1]
    double rSquared = ssTot != 0 ? ArrayHelper.clamp(1 - ssRes / ssTot, 0, 1) : 0;

    return new LinearFit(slope, intercept, rSquared, n);
  }

  public double getSlope() {
    return slope;
  }

  public double getIntercept() {
    return intercept;
  }

  public double getRSquared() {
    return rSquared;
  }

  public int getNumInputs() {
    return numInputs;
  }

  /** Value of the fitted line at x. */
  public double predict(double x) {
    return slope * x + intercept;
  }
}
