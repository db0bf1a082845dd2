package org.workerwatch.alert.engine.metric.anomaly.detector.evaluator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Severity;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.WorkerMetrics;
import org.workerwatch.alert.engine.metric.anomaly.detector.ThresholdPolicyReader;

class WorkerMetricsAnomalyDetectorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final ThresholdPolicy POLICY = ThresholdPolicyReader.defaults();

  private final WorkerMetricsAnomalyDetector detector = new WorkerMetricsAnomalyDetector();

  @Test
  void testHighErrorRate() {
    List<Anomaly> anomalies =
        detector.detect(metrics(1000, 7.5, 100, 200), null, POLICY);

    assertEquals(1, anomalies.size());
    Anomaly anomaly = anomalies.get(0);
    assertEquals(AnomalyType.HIGH_ERROR_RATE, anomaly.getType());
    assertEquals(Severity.HIGH, anomaly.getSeverity());
    assertEquals(7.5, anomaly.getObservedValue());
    assertEquals(5, anomaly.getThreshold());
    assertEquals(NOW, anomaly.getOccurredAt());
    assertEquals("Error rate is 7.50% (threshold: 5%)", anomaly.getMessage());
  }

  @ParameterizedTest
  @ValueSource(doubles = {0, 1.2, 4.99, 5})
  void testErrorRateAtOrBelowThreshold(double errorRate) {
    assertTrue(detector.detect(metrics(1000, errorRate, 100, 200), null, POLICY).isEmpty());
  }

  @Test
  void testErrorRateMarginallyAboveThreshold() {
    List<Anomaly> anomalies = detector.detect(metrics(1000, 5.001, 100, 200), null, POLICY);

    assertEquals(1, anomalies.size());
    assertEquals(5.001, anomalies.get(0).getObservedValue());
  }

  @Test
  void testZeroRequestsSkipsErrorRate() {
    assertTrue(detector.detect(metrics(0, 50, 0, 0), null, POLICY).isEmpty());
  }

  @Test
  void testP95AndP99AreSeparateAnomalies() {
    List<Anomaly> anomalies = detector.detect(metrics(1000, 1, 2500, 3500), null, POLICY);

    assertEquals(2, anomalies.size());
    assertEquals(AnomalyType.HIGH_LATENCY, anomalies.get(0).getType());
    assertEquals("P95 latency is 2500ms (threshold: 2000ms)", anomalies.get(0).getMessage());
    assertEquals(AnomalyType.HIGH_LATENCY, anomalies.get(1).getType());
    assertEquals("P99 latency is 3500ms (threshold: 3000ms)", anomalies.get(1).getMessage());
    assertEquals(3500, anomalies.get(1).getObservedValue());
  }

  @Test
  void testTrafficSpike() {
    List<Anomaly> anomalies =
        detector.detect(metrics(300, 0, 100, 200), metrics(100, 0, 0, 0), POLICY);

    assertEquals(1, anomalies.size());
    Anomaly anomaly = anomalies.get(0);
    assertEquals(AnomalyType.TRAFFIC_SPIKE, anomaly.getType());
    assertEquals(Severity.DEFAULT, anomaly.getSeverity());
    assertEquals(3.0, anomaly.getObservedValue());
    assertEquals(2.0, anomaly.getThreshold());
    assertEquals("Traffic is 3.00x baseline (300 vs 100 requests)", anomaly.getMessage());
  }

  @Test
  void testTrafficAtMultiplierIsNotSpike() {
    assertTrue(
        detector.detect(metrics(200, 0, 100, 200), metrics(100, 0, 0, 0), POLICY).isEmpty());
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 1, 1_000_000})
  void testZeroBaselineNeverSpikes(long currentRequests) {
    List<Anomaly> anomalies =
        detector.detect(metrics(currentRequests, 0, 0, 0), metrics(0, 0, 0, 0), POLICY);
    assertTrue(anomalies.stream().noneMatch(a -> a.getType() == AnomalyType.TRAFFIC_SPIKE));
  }

  @ParameterizedTest
  @MethodSource("provideOrderingCases")
  void testEmissionOrder(WorkerMetrics current, WorkerMetrics baseline, List<String> expected) {
    List<String> messages =
        detector.detect(current, baseline, POLICY).stream()
            .map(a -> a.getType().getKey() + ":" + a.getMessage().substring(0, 3))
            .collect(Collectors.toList());
    assertEquals(expected, messages);
  }

  private static Stream<Arguments> provideOrderingCases() {
    return Stream.of(
        Arguments.arguments(
            metrics(1000, 20, 5000, 9000),
            metrics(100, 0, 0, 0),
            List.of(
                "high_error_rate:Err",
                "high_latency:P95",
                "high_latency:P99",
                "traffic_spike:Tra")),
        Arguments.arguments(
            metrics(1000, 1, 100, 9000),
            metrics(100, 0, 0, 0),
            List.of("high_latency:P99", "traffic_spike:Tra")),
        Arguments.arguments(metrics(1000, 1, 100, 200), null, List.of()));
  }

  @Test
  void testDetectionIsDeterministic() {
    WorkerMetrics current = metrics(1000, 20, 5000, 9000);
    WorkerMetrics baseline = metrics(100, 0, 0, 0);
    assertEquals(
        detector.detect(current, baseline, POLICY), detector.detect(current, baseline, POLICY));
  }

  private static WorkerMetrics metrics(
      long requestCount, double errorRate, double p95, double p99) {
    return WorkerMetrics.builder()
        .requestCount(requestCount)
        .errorRate(errorRate)
        .p95LatencyMillis(p95)
        .p99LatencyMillis(p99)
        .errors5xx(Math.round(requestCount * errorRate / 100))
        .timestamp(NOW)
        .build();
  }
}
