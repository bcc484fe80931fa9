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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import net.larse.insights.algorithms.AnomalyPoint;
import net.larse.insights.algorithms.AnomalyScorer;
import net.larse.insights.algorithms.AnomalyType;
import net.larse.insights.algorithms.ComparisonPeriod;
import net.larse.insights.algorithms.DetectedAnomaly;
import net.larse.insights.algorithms.DetectionMethod;
import net.larse.insights.algorithms.IqrDetector;
import net.larse.insights.algorithms.SeriesStatistics;
import net.larse.insights.algorithms.Severity;
import net.larse.insights.algorithms.TrendAnalyzer;
import net.larse.insights.algorithms.TrendDirection;
import net.larse.insights.algorithms.TrendResult;
import net.larse.insights.algorithms.ZScoreDetector;
import net.larse.insights.helper.AlgorithmBase;
import net.larse.insights.timeseries.DecompositionResult;
import net.larse.insights.timeseries.SeasonalDecomposition;
import net.larse.insights.timeseries.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the anomaly detectors and the trend analyzer over a metric and turns their output into a
 * {@link MetricAnalysis}. Instances hold no mutable state and can be shared between threads.
 */
public class MetricAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(MetricAnalyzer.class);

  public static final String DEFAULT_CONFIG = "metric-insights.properties";
  public static final List<DetectionMethod> DEFAULT_METHODS =
      ImmutableList.of(DetectionMethod.ZSCORE, DetectionMethod.IQR);
  public static final List<ComparisonPeriod> DEFAULT_PERIODS =
      ImmutableList.of(ComparisonPeriod.WOW, ComparisonPeriod.MOM);

  private static final double SEASONAL_CONFIDENCE = 0.8;
  private static final double HIGH_VOLATILITY_PERCENT = 20.0;

  private final SeasonalDecomposition decomposition;
  private final TrendAnalyzer trendAnalyzer;
  private final AnomalyScorer anomalyScorer;
  private final ZScoreDetector zScoreDetector;
  private final IqrDetector iqrDetector;

  public MetricAnalyzer(SeasonalDecomposition decomposition, TrendAnalyzer trendAnalyzer,
      AnomalyScorer anomalyScorer, ZScoreDetector zScoreDetector, IqrDetector iqrDetector) {
    this.decomposition = Preconditions.checkNotNull(decomposition);
    this.trendAnalyzer = Preconditions.checkNotNull(trendAnalyzer);
    this.anomalyScorer = Preconditions.checkNotNull(anomalyScorer);
    this.zScoreDetector = Preconditions.checkNotNull(zScoreDetector);
    this.iqrDetector = Preconditions.checkNotNull(iqrDetector);
  }

  /** An analyzer configured from {@value #DEFAULT_CONFIG} on the classpath. */
  public static MetricAnalyzer createDefault() {
    return fromProperties(AlgorithmBase.loadProperties(DEFAULT_CONFIG));
  }

  /**
   * Builds every component from properties keyed {@code decomposition.*}, {@code trend.*},
   * {@code anomaly.*}, {@code zscore.*} and {@code iqr.*}. Missing keys keep their defaults.
   *
   * @throws IllegalArgumentException if a value can't be parsed
   */
  public static MetricAnalyzer fromProperties(Properties props) {
    SeasonalDecomposition.Args decompositionArgs = new SeasonalDecomposition.Args();
    decompositionArgs.load(props, "decomposition");
    TrendAnalyzer.Args trendArgs = new TrendAnalyzer.Args();
    trendArgs.load(props, "trend");
    AnomalyScorer.Args anomalyArgs = new AnomalyScorer.Args();
    anomalyArgs.load(props, "anomaly");
    ZScoreDetector.Args zScoreArgs = new ZScoreDetector.Args();
    zScoreArgs.load(props, "zscore");
    IqrDetector.Args iqrArgs = new IqrDetector.Args();
    iqrArgs.load(props, "iqr");

    SeasonalDecomposition decomposition = new SeasonalDecomposition(decompositionArgs);
    return new MetricAnalyzer(
        decomposition,
        new TrendAnalyzer(trendArgs),
        new AnomalyScorer(anomalyArgs, decomposition),
        new ZScoreDetector(zScoreArgs),
        new IqrDetector(iqrArgs));
  }

  public MetricAnalysis analyze(String name, TimeSeries series) {
    return analyze(name, series, DEFAULT_METHODS, DEFAULT_PERIODS);
  }

  public MetricAnalysis analyze(String name, TimeSeries series, List<DetectionMethod> methods,
      List<ComparisonPeriod> periods) {
    Preconditions.checkNotNull(name, "name");
    Preconditions.checkNotNull(series, "series");
    Preconditions.checkNotNull(methods, "methods");
    Preconditions.checkNotNull(periods, "periods");

    if (series.size() < 2) {
      log.debug("{}: only {} points, skipping analysis", name, series.size());
      Instant start = series.isEmpty() ? null : series.getFirstTimestamp();
      Instant end = series.isEmpty() ? null : series.getLastTimestamp();
      return MetricAnalysis.empty(name, start, end);
    }

    double[] values = series.getValues();
    List<DetectedAnomaly> anomalies = detectAnomalies(name, values, methods);
    List<TrendSummary> trends = analyzeTrends(name, series, periods);
    SeriesStatistics statistics = zScoreDetector.statistics(values);
    List<String> insights = insights(name, anomalies, trends, statistics);

    int n = values.length;
    return new MetricAnalysis(name, series.getFirstTimestamp(), series.getLastTimestamp(),
        values[n - 1], values[n - 2], anomalies, trends, statistics, insights);
  }

  /**
   * Analyzes every metric on the given executor. The result keeps the iteration order of
   * metrics.
   *
   * @throws IllegalStateException if an analysis fails or the wait is interrupted
   */
  public Map<String, MetricAnalysis> analyzeAll(
      Map<String, TimeSeries> metrics, ExecutorService executor) {
    Map<String, Future<MetricAnalysis>> futures = new LinkedHashMap<>();
    for (Map.Entry<String, TimeSeries> entry : metrics.entrySet()) {
      futures.put(entry.getKey(),
          executor.submit(() -> analyze(entry.getKey(), entry.getValue())));
    }

    Map<String, MetricAnalysis> results = new LinkedHashMap<>();
    for (Map.Entry<String, Future<MetricAnalysis>> entry : futures.entrySet()) {
      try {
        results.put(entry.getKey(), entry.getValue().get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while analyzing " + entry.getKey(), e);
      } catch (ExecutionException e) {
        throw new IllegalStateException("Analysis failed for " + entry.getKey(), e.getCause());
      }
    }
    return results;
  }

  /**
   * Runs the requested detectors. Z-score hits always come first; the other methods only add
   * indices nobody has flagged yet.
   */
  List<DetectedAnomaly> detectAnomalies(String name, double[] values,
      List<DetectionMethod> methods) {
    List<DetectedAnomaly> anomalies = new ArrayList<>();
    IntSet flagged = new IntOpenHashSet();

    if (methods.contains(DetectionMethod.ZSCORE)) {
      for (DetectedAnomaly anomaly : zScoreDetector.detect(values)) {
        anomalies.add(anomaly);
        flagged.add(anomaly.getIndex());
      }
    }
    if (methods.contains(DetectionMethod.IQR)) {
      for (DetectedAnomaly anomaly : iqrDetector.detect(values)) {
        if (flagged.add(anomaly.getIndex())) {
          anomalies.add(anomaly);
        }
      }
    }
    if (methods.contains(DetectionMethod.SEASONAL_DECOMPOSITION)) {
      DecompositionResult result = decomposition.decompose(values);
      if (result.isDegraded()) {
        logDegraded(name, result);
      }
      double[] residual = result.getResidual();
      for (AnomalyPoint point : anomalyScorer.detectSeasonalAnomalies(result)) {
        int i = point.getIndex();
        if (flagged.add(i)) {
          double r = residual[i];
          anomalies.add(new DetectedAnomaly(i, values[i], values[i] - r, Math.abs(r),
              r > 0 ? AnomalyType.SPIKE : AnomalyType.DROP,
              ZScoreDetector.severity(point.getZScore()),
              DetectionMethod.SEASONAL_DECOMPOSITION, SEASONAL_CONFIDENCE));
        }
      }
    }

    log.info("{}: detected {} anomalies using {}", name, anomalies.size(), methods);
    return anomalies;
  }

  /** Significant trends only, one per period at most. */
  List<TrendSummary> analyzeTrends(String name, TimeSeries series,
      List<ComparisonPeriod> periods) {
    List<TrendSummary> trends = new ArrayList<>();
    double[] values = series.getValues();
    Instant end = series.getLastTimestamp();

    for (ComparisonPeriod period : periods) {
      TrendResult result = trendAnalyzer.analyzeTrend(series, period);
      if (result.getError().isPresent()) {
        log.warn("{}: {} trend analysis failed: {}", name, period, result.getError().get());
        continue;
      }
      if (result.isInsufficientData()) {
        log.debug("{}: not enough points for {} trend ({})",
            name, period, result.getSampleCount());
        continue;
      }
      if (!result.isSignificant()) {
        continue;
      }

      Instant start = end.minus(period.getDuration());
      int startIndex = 0;
      for (int i = 0; i < series.size(); i++) {
        if (!series.getTimestamp(i).isBefore(start)) {
          startIndex = i;
          break;
        }
      }
      trends.add(new TrendSummary(period, result.getDirection(), start, end,
          values[startIndex], values[values.length - 1], result.getPercentageChange(),
          result.getAbsoluteChange(), result.getConfidence()));
    }
    return trends;
  }

  static List<String> insights(String name, List<DetectedAnomaly> anomalies,
      List<TrendSummary> trends, SeriesStatistics statistics) {
    List<String> insights = new ArrayList<>();

    long critical = anomalies.stream()
        .filter(a -> a.getSeverity() == Severity.CRITICAL)
        .count();
    if (critical > 0) {
      insights.add(String.format("%d critical anomalies detected in %s", critical, name));
    }

    for (TrendSummary trend : trends) {
      String verb = trend.getDirection() == TrendDirection.UP ? "increased" : "decreased";
      insights.add(String.format(Locale.ROOT, "%s %s by %.1f%% %s",
          name, verb, Math.abs(trend.getPercentageChange()), trend.getPeriod().getLabel()));
    }

    double cv = statistics.getCoefficientOfVariation();
    if (cv > HIGH_VOLATILITY_PERCENT) {
      insights.add(String.format(Locale.ROOT, "%s shows high volatility (CV: %.1f%%)", name, cv));
    }
    return insights;
  }

  private static void logDegraded(String name, DecompositionResult result) {
    if (result.getError().isPresent()) {
      log.warn("{}: seasonal decomposition failed: {}", name, result.getError().get());
    } else {
      log.debug("{}: too few points ({}) for seasonal decomposition", name, result.size());
    }
  }
}
