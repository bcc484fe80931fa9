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

import java.time.Duration;

/** Period-over-period comparison windows, each a fixed number of days. */
public enum ComparisonPeriod {
  WOW("WoW", 7),
  MOM("MoM", 30),
  QOQ("QoQ", 90),
  YOY("YoY", 365);

  private final String label;
  private final int days;

  ComparisonPeriod(String label, int days) {
    this.label = label;
    this.days = days;
  }

  public String getLabel() {
    return label;
  }

  public int getDays() {
    return days;
  }

  public Duration getDuration() {
    return Duration.ofDays(days);
  }

  @Override
  public String toString() {
    return label;
  }
}
