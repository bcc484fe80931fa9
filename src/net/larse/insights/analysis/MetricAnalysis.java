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

import com.google.common.collect.ImmutableList;
import net.larse.insights.algorithms.DetectedAnomaly;
import net.larse.insights.algorithms.SeriesStatistics;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything known about one metric after {@link MetricAnalyzer#analyze}: detected anomalies,
 * significant trends, summary statistics, the latest change and a list of readable insights.
 */
public final class MetricAnalysis {
  static final String INSUFFICIENT_DATA = "Insufficient data for analysis";

  private final String metricName;
  private final Instant start;
  private final Instant end;
  private final double currentValue;
  private final double previousValue;
  private final ImmutableList<DetectedAnomaly> anomalies;
  private final ImmutableList<TrendSummary> trends;
  private final SeriesStatistics statistics;
  private final ImmutableList<String> insights;

  MetricAnalysis(String metricName, Instant start, Instant end, double currentValue,
      double previousValue, List<DetectedAnomaly> anomalies, List<TrendSummary> trends,
      SeriesStatistics statistics, List<String> insights) {
    this.metricName = metricName;
    this.start = start;
    this.end = end;
    this.currentValue = currentValue;
    this.previousValue = previousValue;
    this.anomalies = ImmutableList.copyOf(anomalies);
    this.trends = ImmutableList.copyOf(trends);
    this.statistics = statistics;
    this.insights = ImmutableList.copyOf(insights);
  }

  static MetricAnalysis empty(String metricName, Instant start, Instant end) {
    return new MetricAnalysis(metricName, start, end, 0, 0, ImmutableList.of(),
        ImmutableList.of(), null, ImmutableList.of(INSUFFICIENT_DATA));
  }

  public String getMetricName() {
    return metricName;
  }

  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }

  public double getCurrentValue() {
    return currentValue;
  }

  public double getPreviousValue() {
    return previousValue;
  }

  public double getAbsoluteChange() {
    return currentValue - previousValue;
  }

  /** Change of the current value against the previous one in percent; 0 if it was 0. */
  public double getPercentageChange() {
    return previousValue == 0 ? 0 : getAbsoluteChange() / Math.abs(previousValue) * 100;
  }

  /** "up", "down" or "stable". */
  public String getChangeDirection() {
    double change = getAbsoluteChange();
    return change > 0 ? "up" : change < 0 ? "down" : "stable";
  }

  public List<DetectedAnomaly> getAnomalies() {
    return anomalies;
  }

  public List<TrendSummary> getTrends() {
    return trends;
  }

  /** Absent when there was too little data to analyze. */
  public Optional<SeriesStatistics> getStatistics() {
    return Optional.ofNullable(statistics);
  }

  public List<String> getInsights() {
    return insights;
  }

  @Override
  public String toString() {
    return String.format("MetricAnalysis[%s, %d anomalies, %d trends, insights=%s]",
        metricName, anomalies.size(), trends.size(), insights);
  }
}
