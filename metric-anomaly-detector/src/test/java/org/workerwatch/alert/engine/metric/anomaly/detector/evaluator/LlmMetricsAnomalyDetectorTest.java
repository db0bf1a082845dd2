package org.workerwatch.alert.engine.metric.anomaly.detector.evaluator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.LlmRunMetrics;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Severity;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;
import org.workerwatch.alert.engine.metric.anomaly.detector.ThresholdPolicyReader;

class LlmMetricsAnomalyDetectorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final ThresholdPolicy POLICY = ThresholdPolicyReader.defaults();

  private final LlmMetricsAnomalyDetector detector = new LlmMetricsAnomalyDetector();

  @Test
  void testErrorRate() {
    List<Anomaly> anomalies = detector.detect(metrics(40, 5, 1000, 200), null, POLICY);

    assertEquals(1, anomalies.size());
    Anomaly anomaly = anomalies.get(0);
    assertEquals(AnomalyType.LLM_ERROR_RATE, anomaly.getType());
    assertEquals(Severity.HIGH, anomaly.getSeverity());
    assertEquals(12.5, anomaly.getObservedValue());
    assertEquals(10, anomaly.getThreshold());
    assertEquals(
        "LLM error rate is 12.50% (threshold: 10%, 5/40 runs failed)", anomaly.getMessage());
  }

  @Test
  void testNoRunsSkipsErrorRate() {
    LlmRunMetrics current =
        LlmRunMetrics.builder().totalRuns(0).errorRate(100).timestamp(NOW).build();
    assertTrue(detector.detect(current, null, POLICY).isEmpty());
  }

  @Test
  void testLatency() {
    List<Anomaly> anomalies = detector.detect(metrics(40, 0, 25000, 200), null, POLICY);

    assertEquals(1, anomalies.size());
    assertEquals(AnomalyType.LLM_LATENCY, anomalies.get(0).getType());
    assertEquals(
        "LLM P95 latency is 25000ms (threshold: 20000ms)", anomalies.get(0).getMessage());
  }

  @Test
  void testTokenSpike() {
    List<Anomaly> anomalies =
        detector.detect(metrics(40, 0, 1000, 800), metrics(40, 0, 1000, 200), POLICY);

    assertEquals(1, anomalies.size());
    Anomaly anomaly = anomalies.get(0);
    assertEquals(AnomalyType.LLM_HIGH_TOKENS, anomaly.getType());
    assertEquals(Severity.DEFAULT, anomaly.getSeverity());
    assertEquals(4.0, anomaly.getObservedValue());
    assertEquals(
        "Token usage is 4.00x baseline (800 vs 200 tokens/run)",
        anomaly.getMessage());
  }

  @Test
  void testZeroTokenBaselineSkipsSpike() {
    assertTrue(
        detector.detect(metrics(40, 0, 1000, 800), metrics(0, 0, 0, 0), POLICY).isEmpty());
  }

  @Test
  void testOrder() {
    List<Anomaly> anomalies =
        detector.detect(metrics(10, 5, 30000, 1000), metrics(10, 0, 0, 100), POLICY);

    assertEquals(3, anomalies.size());
    assertEquals(AnomalyType.LLM_ERROR_RATE, anomalies.get(0).getType());
    assertEquals(AnomalyType.LLM_LATENCY, anomalies.get(1).getType());
    assertEquals(AnomalyType.LLM_HIGH_TOKENS, anomalies.get(2).getType());
  }

  private static LlmRunMetrics metrics(
      long totalRuns, long errorCount, double p95, double avgTokensPerRun) {
    return LlmRunMetrics.builder()
        .totalRuns(totalRuns)
        .errorCount(errorCount)
        .errorRate(totalRuns > 0 ? errorCount * 100.0 / totalRuns : 0)
        .p95LatencyMillis(p95)
        .avgLatencyMillis(p95 / 2)
        .totalTokens(Math.round(avgTokensPerRun * totalRuns))
        .avgTokensPerRun(avgTokensPerRun)
        .timestamp(NOW)
        .build();
  }
}
