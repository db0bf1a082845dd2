package org.workerwatch.alert.engine.metric.anomaly.detector.evaluator;

import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.formatLimit;
import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.formatMillis;
import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.formatPercent;
import static org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil.isBreach;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.LlmRunMetrics;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Severity;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;
import org.workerwatch.alert.engine.metric.anomaly.detector.AnomalyDetector;

/** Checks LLM run metrics in a fixed order: error rate, P95 latency, tokens per run spike. */
public class LlmMetricsAnomalyDetector implements AnomalyDetector<LlmRunMetrics> {

  private static final Logger LOGGER = LoggerFactory.getLogger(LlmMetricsAnomalyDetector.class);

  @Override
  public List<Anomaly> detect(
      LlmRunMetrics current, LlmRunMetrics baseline, ThresholdPolicy policy) {
    List<Anomaly> anomalies = new ArrayList<>();

    if (current.getTotalRuns() > 0
        && isBreach(current.getErrorRate(), policy.getLlmErrorRatePercent())) {
      anomalies.add(
          Anomaly.builder()
              .type(AnomalyType.LLM_ERROR_RATE)
              .severity(Severity.HIGH)
              .message(
                  String.format(
                      "LLM error rate is %s%% (threshold: %s%%, %d/%d runs failed)",
                      formatPercent(current.getErrorRate()),
                      formatLimit(policy.getLlmErrorRatePercent()),
                      current.getErrorCount(),
                      current.getTotalRuns()))
              .observedValue(current.getErrorRate())
              .threshold(policy.getLlmErrorRatePercent())
              .occurredAt(current.getTimestamp())
              .build());
    }

    if (isBreach(current.getP95LatencyMillis(), policy.getLlmP95LatencyMs())) {
      anomalies.add(
          Anomaly.builder()
              .type(AnomalyType.LLM_LATENCY)
              .severity(Severity.HIGH)
              .message(
                  String.format(
                      "LLM P95 latency is %sms (threshold: %sms)",
                      formatMillis(current.getP95LatencyMillis()),
                      formatLimit(policy.getLlmP95LatencyMs())))
              .observedValue(current.getP95LatencyMillis())
              .threshold(policy.getLlmP95LatencyMs())
              .occurredAt(current.getTimestamp())
              .build());
    }

    if (baseline != null) {
      EvaluatorUtil.ratio(current.getAvgTokensPerRun(), baseline.getAvgTokensPerRun())
          .filter(ratio -> isBreach(ratio, policy.getLlmTokenSpikeMultiplier()))
          .ifPresent(
              ratio ->
                  anomalies.add(
                      Anomaly.builder()
                          .type(AnomalyType.LLM_HIGH_TOKENS)
                          .severity(Severity.DEFAULT)
                          .message(
                              String.format(
                                  "Token usage is %sx baseline (%s vs %s tokens/run)",
                                  formatPercent(ratio),
                                  formatMillis(current.getAvgTokensPerRun()),
                                  formatMillis(baseline.getAvgTokensPerRun())))
                          .observedValue(ratio)
                          .threshold(policy.getLlmTokenSpikeMultiplier())
                          .occurredAt(current.getTimestamp())
                          .build()));
    }

    LOGGER.debug("LLM metrics {}, baseline {}, anomalies {}", current, baseline, anomalies);
    return anomalies;
  }
}
