package org.workerwatch.alert.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.MetricSnapshot;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.MetricSourceType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.SourceUnavailableException;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.source.MetricFetchResult;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.source.MetricSourceClient;
import org.workerwatch.alert.engine.metric.anomaly.detector.AnomalyDetector;

/**
 * Fetch and detect for one metric source. A source that fails contributes no anomalies; a
 * baseline that fails or is empty only disables the baseline comparison.
 */
public class SourcePipeline<S extends MetricSnapshot> {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourcePipeline.class);
  private static final ConcurrentMap<MetricSourceType, Counter> sourceFailureCounter =
      new ConcurrentHashMap<>();
  private static final String SOURCE_FAILURE_COUNTER = "workerwatch.alert.engine.source.failure";
  private static final ConcurrentMap<AnomalyType, Counter> anomalyCounter =
      new ConcurrentHashMap<>();
  private static final String ANOMALY_COUNTER = "workerwatch.alert.engine.anomaly.detected";

  private final MetricSourceClient<S> client;
  private final AnomalyDetector<S> detector;

  public SourcePipeline(MetricSourceClient<S> client, AnomalyDetector<S> detector) {
    this.client = client;
    this.detector = detector;
  }

  public MetricSourceType getSourceType() {
    return client.getSourceType();
  }

  /**
   * Starts the current and baseline fetches on {@code executor}. The returned future never
   * completes exceptionally. A fetch slower than {@code timeout} is a transport error.
   */
  CompletableFuture<List<Anomaly>> evaluate(
      Executor executor,
      Duration timeout,
      int windowMinutes,
      int baselineHoursAgo,
      ThresholdPolicy policy) {
    CompletableFuture<MetricFetchResult<S>> current =
        fetch(() -> client.getCurrent(windowMinutes), executor, timeout);
    CompletableFuture<MetricFetchResult<S>> baseline =
        fetch(() -> client.getBaseline(baselineHoursAgo), executor, timeout);

    return current
        .thenCombine(
            baseline,
            (currentResult, baselineResult) -> detect(currentResult, baselineResult, policy))
        .exceptionally(
            throwable -> {
              recordFailure(
                  new SourceUnavailableException(getSourceType(), "detection failed", throwable));
              return List.of();
            });
  }

  private static <S extends MetricSnapshot> CompletableFuture<MetricFetchResult<S>> fetch(
      Supplier<MetricFetchResult<S>> call, Executor executor, Duration timeout) {
    return CompletableFuture.supplyAsync(call, executor)
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(MetricFetchResult::transportError);
  }

  private List<Anomaly> detect(
      MetricFetchResult<S> currentResult,
      MetricFetchResult<S> baselineResult,
      ThresholdPolicy policy) {
    switch (currentResult.getStatus()) {
      case TRANSPORT_ERROR:
        recordFailure(
            new SourceUnavailableException(
                getSourceType(),
                "current metrics could not be fetched",
                currentResult.getError().orElse(null)));
        return List.of();
      case EMPTY:
        LOGGER.info("No {} metrics in the current window", getSourceType());
        return List.of();
      default:
        break;
    }

    if (baselineResult.isTransportError()) {
      LOGGER.warn(
          "Baseline {} metrics could not be fetched, skipping baseline comparison",
          getSourceType(),
          baselineResult.getError().orElse(null));
    }
    S current = currentResult.getSnapshot().get();
    S baseline = baselineResult.getSnapshot().orElse(null);
    checkSource(current);
    if (baseline != null) {
      checkSource(baseline);
    }

    List<Anomaly> anomalies = detector.detect(current, baseline, policy);
    LOGGER.info("{}: {} anomalies detected", getSourceType(), anomalies.size());
    recordDetected(anomalies);
    return anomalies;
  }

  private void checkSource(S snapshot) {
    if (snapshot.getSource() != getSourceType()) {
      throw new IllegalStateException(
          String.format(
              "%s client returned a %s snapshot", getSourceType(), snapshot.getSource()));
    }
  }

  private static void recordDetected(List<Anomaly> anomalies) {
    for (Anomaly anomaly : anomalies) {
      anomalyCounter
          .computeIfAbsent(
              anomaly.getType(),
              k -> Metrics.globalRegistry.counter(ANOMALY_COUNTER, "type", k.getKey()))
          .increment();
    }
  }

  private void recordFailure(SourceUnavailableException exception) {
    sourceFailureCounter
        .computeIfAbsent(
            getSourceType(),
            k -> Metrics.globalRegistry.counter(SOURCE_FAILURE_COUNTER, "source", k.name()))
        .increment();
    LOGGER.error("Metric source {} failed for this pass", getSourceType(), exception);
  }
}
