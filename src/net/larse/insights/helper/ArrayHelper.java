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
import com.google.common.primitives.Doubles;
import org.apache.commons.math.stat.StatUtils;
import org.apache.commons.math.stat.descriptive.moment.Variance;

import java.util.Arrays;

/** Static array and moment functions shared by the algorithms. */
public class ArrayHelper {
  private ArrayHelper() {}

  /** Arithmetic mean. Returns NaN for an empty array. */
  public static double mean(double[] values) {
    return StatUtils.mean(values);
  }

  /** Arithmetic mean of values between start (incl) and end (excl). */
  public static double mean(double[] values, int start, int end) {
    return StatUtils.mean(values, start, end - start);
  }

  /**
   * Population variance (divides by N, not N - 1). Returns NaN for an empty array and 0 for a
   * single value.
   */
  public static double populationVariance(double[] values) {
    return new Variance(false).evaluate(values);
  }

  /** Square root of {@link #populationVariance}. */
  public static double populationStd(double[] values) {
    return Math.sqrt(populationVariance(values));
  }

  /**
   * Percentile with linear interpolation between closest ranks, where the rank of percentile p
   * is (n - 1) * p / 100 on the sorted values. Unlike commons-math's Percentile, the 0th and
   * 100th percentiles are the min and max.
   */
  public static double percentile(double[] values, double p) {
    Preconditions.checkArgument(values.length > 0, "percentile of an empty array");
    Preconditions.checkArgument(p >= 0 && p <= 100, "percentile out of range: %s", p);
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    double pos = (sorted.length - 1) * p / 100.0;
    int lower = (int) Math.floor(pos);
    int upper = Math.min(lower + 1, sorted.length - 1);
    double fraction = pos - lower;
    return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
  }

  /** Element-wise a - b. The arrays must have the same length. */
  public static double[] subtract(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length,
        "length mismatch: %s vs %s", a.length, b.length);
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] - b[i];
    }
    return result;
  }

  /**
   * Repeats pattern to fill an array of the given length, truncating the last partial cycle.
   */
  public static double[] tile(double[] pattern, int length) {
    Preconditions.checkArgument(pattern.length > 0 || length == 0, "empty pattern");
    double[] result = new double[length];
    for (int i = 0; i < length; i++) {
      result[i] = pattern[i % pattern.length];
    }
    return result;
  }

  public static double clamp(double value, double min, double max) {
    return Math.min(Math.max(value, min), max);
  }

  /** True if every element is neither NaN nor infinite. */
  public static boolean allFinite(double[] values) {
    for (double v : values) {
      if (!Doubles.isFinite(v)) {
        return false;
      }
    }
    return true;
  }
}
