package org.workerwatch.alert.engine.metric.anomaly.detector.evaluator;

import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.formatLimit;
import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.formatMillis;
import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.formatPercent;
import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.isBreach;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Severity;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.WorkerMetrics;
import org.workerwatch.alert.engine.metric.anomaly.detector.AnomalyDetector;

/**
 * Checks worker metrics in a fixed order: error rate, P95 latency, P99 latency, traffic spike.
 */
public class WorkerMetricsAnomalyDetector implements AnomalyDetector<WorkerMetrics> {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerMetricsAnomalyDetector.class);

  @Override
  public List<Anomaly> detect(
      WorkerMetrics current, WorkerMetrics baseline, ThresholdPolicy policy) {
    List<Anomaly> anomalies = new ArrayList<>();

    // no requests means no data, not a 0% error rate
    if (current.getRequestCount() > 0
        && isBreach(current.getErrorRate(), policy.getErrorRatePercent())) {
      anomalies.add(
          Anomaly.builder()
              .type(AnomalyType.HIGH_ERROR_RATE)
              .severity(Severity.HIGH)
              .message(
                  String.format(
                      "Error rate is %s%% (threshold: %s%%)",
                      formatPercent(current.getErrorRate()),
                      formatLimit(policy.getErrorRatePercent())))
              .observedValue(current.getErrorRate())
              .threshold(policy.getErrorRatePercent())
              .occurredAt(current.getTimestamp())
              .build());
    }

    checkLatency("P95", current.getP95LatencyMillis(), policy.getP95LatencyMs(), current)
        .ifPresent(anomalies::add);
    checkLatency("P99", current.getP99LatencyMillis(), policy.getP99LatencyMs(), current)
        .ifPresent(anomalies::add);

    if (baseline != null) {
      EvaluatorUtil.ratio(current.getRequestCount(), (double) baseline.getRequestCount())
          .filter(ratio -> isBreach(ratio, policy.getTrafficSpikeMultiplier()))
          .ifPresent(
              ratio ->
                  anomalies.add(
                      Anomaly.builder()
                          .type(AnomalyType.TRAFFIC_SPIKE)
                          .severity(Severity.DEFAULT)
                          .message(
                              String.format(
                                  "Traffic is %sx baseline (%d vs %d requests)",
                                  formatPercent(ratio),
                                  current.getRequestCount(),
                                  baseline.getRequestCount()))
                          .observedValue(ratio)
                          .threshold(policy.getTrafficSpikeMultiplier())
                          .occurredAt(current.getTimestamp())
                          .build()));
    }

    LOGGER.debug("Worker metrics {}, baseline {}, anomalies {}", current, baseline, anomalies);
    return anomalies;
  }

  private Optional<Anomaly> checkLatency(
      String percentile, double latencyMillis, double limitMillis, WorkerMetrics current) {
    if (!isBreach(latencyMillis, limitMillis)) {
      return Optional.empty();
    }
    return Optional.of(
        Anomaly.builder()
            .type(AnomalyType.HIGH_LATENCY)
            .severity(Severity.HIGH)
            .message(
                String.format(
                    "%s latency is %sms (threshold: %sms)",
                    percentile, formatMillis(latencyMillis), formatLimit(limitMillis)))
            .observedValue(latencyMillis)
            .threshold(limitMillis)
            .occurredAt(current.getTimestamp())
            .build());
  }
}
