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
package net.larse.insights.timeseries;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.larse.insights.helper.ArrayHelper;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * One metric's history: values paired with strictly ascending, timezone-normalized
 * timestamps. Instances are immutable and validated on construction.
 */
public final class TimeSeries {
  private static final double SECONDS_PER_DAY = 86400.0;

  private final ImmutableList<Instant> timestamps;
  private final double[] values;

  /**
   * @throws IllegalArgumentException if the lengths differ, a value is not finite or the
   *     timestamps are not strictly ascending
   */
  public TimeSeries(List<Instant> timestamps, double[] values) {
    Preconditions.checkNotNull(timestamps, "timestamps");
    Preconditions.checkNotNull(values, "values");
    Preconditions.checkArgument(timestamps.size() == values.length,
        "%s timestamps for %s values", timestamps.size(), values.length);
    Preconditions.checkArgument(ArrayHelper.allFinite(values), "values must be finite");
    for (int i = 1; i < timestamps.size(); i++) {
      Preconditions.checkArgument(timestamps.get(i).isAfter(timestamps.get(i - 1)),
          "timestamps must be strictly ascending at index %s", i);
    }
    this.timestamps = ImmutableList.copyOf(timestamps);
    this.values = values.clone();
  }

  public TimeSeries(Instant[] timestamps, double[] values) {
    this(Arrays.asList(Preconditions.checkNotNull(timestamps, "timestamps")), values);
  }

  /** A series sampled once a day starting at start. */
  public static TimeSeries daily(Instant start, double... values) {
    Instant[] timestamps = new Instant[values.length];
    for (int i = 0; i < values.length; i++) {
      timestamps[i] = start.plus(Duration.ofDays(i));
    }
    return new TimeSeries(timestamps, values);
  }

  public int size() {
    return values.length;
  }

  public boolean isEmpty() {
    return values.length == 0;
  }

  public double[] getValues() {
    return values.clone();
  }

  public double getValue(int index) {
    return values[index];
  }

  public List<Instant> getTimestamps() {
    return timestamps;
  }

  public Instant getTimestamp(int index) {
    return timestamps.get(index);
  }

  public Instant getFirstTimestamp() {
    return timestamps.get(0);
  }

  public Instant getLastTimestamp() {
    return timestamps.get(timestamps.size() - 1);
  }

  /** Fractional days elapsed since the first timestamp, one entry per point. */
  public double[] elapsedDays() {
    return elapsedDays(0, size());
  }

  /** Fractional days elapsed since the timestamp at start, for points in [start, end). */
  public double[] elapsedDays(int start, int end) {
    Preconditions.checkPositionIndexes(start, end, size());
    double[] days = new double[end - start];
    if (days.length == 0) {
      return days;
    }
    Instant t0 = timestamps.get(start);
    for (int i = start; i < end; i++) {
      Duration d = Duration.between(t0, timestamps.get(i));
      days[i - start] = (d.getSeconds() + d.getNano() / 1e9) / SECONDS_PER_DAY;
    }
    return days;
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return "TimeSeries[]";
    }
    return String.format("TimeSeries[%d points, %s .. %s]",
        size(), getFirstTimestamp(), getLastTimestamp());
  }
}
