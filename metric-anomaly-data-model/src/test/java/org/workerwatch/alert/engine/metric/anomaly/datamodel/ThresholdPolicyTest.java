package org.workerwatch.alert.engine.metric.anomaly.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ThresholdPolicyTest {

  @Test
  void testAllLimitsSet() {
    ThresholdPolicy policy =
        ThresholdPolicy.builder()
            .errorRatePercent(5d)
            .p95LatencyMs(2000d)
            .p99LatencyMs(3000d)
            .trafficSpikeMultiplier(2d)
            .llmErrorRatePercent(10d)
            .llmP95LatencyMs(20000d)
            .llmTokenSpikeMultiplier(3d)
            .build();
    assertEquals(5d, policy.getErrorRatePercent());
    assertEquals(3d, policy.getLlmTokenSpikeMultiplier());
  }

  @Test
  void testMissingLimitIsConfigurationError() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                ThresholdPolicy.builder()
                    .errorRatePercent(5d)
                    .p95LatencyMs(2000d)
                    .p99LatencyMs(3000d)
                    .trafficSpikeMultiplier(2d)
                    .llmErrorRatePercent(10d)
                    .llmP95LatencyMs(20000d)
                    .build());
    assertTrue(exception.getMessage().contains("llmTokenSpikeMultiplier"));
  }

  @Test
  void testNegativeLimitRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ThresholdPolicy.builder()
                .errorRatePercent(-1d)
                .p95LatencyMs(2000d)
                .p99LatencyMs(3000d)
                .trafficSpikeMultiplier(2d)
                .llmErrorRatePercent(10d)
                .llmP95LatencyMs(20000d)
                .llmTokenSpikeMultiplier(3d)
                .build());
  }
}
