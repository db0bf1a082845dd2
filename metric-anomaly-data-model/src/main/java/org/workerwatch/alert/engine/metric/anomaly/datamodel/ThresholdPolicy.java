package org.workerwatch.alert.engine.metric.anomaly.datamodel;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Static limits the detectors compare snapshots against. Every limit must be set: an absent
 * limit is a configuration error and never means "no limit".
 */
@Getter
@ToString
@EqualsAndHashCode
public class ThresholdPolicy {
  private final double errorRatePercent;
  private final double p95LatencyMs;
  private final double p99LatencyMs;
  private final double trafficSpikeMultiplier;
  private final double llmErrorRatePercent;
  private final double llmP95LatencyMs;
  private final double llmTokenSpikeMultiplier;

  @Builder
  private ThresholdPolicy(
      Double errorRatePercent,
      Double p95LatencyMs,
      Double p99LatencyMs,
      Double trafficSpikeMultiplier,
      Double llmErrorRatePercent,
      Double llmP95LatencyMs,
      Double llmTokenSpikeMultiplier) {
    this.errorRatePercent = required(errorRatePercent, "errorRatePercent");
    this.p95LatencyMs = required(p95LatencyMs, "p95LatencyMs");
    this.p99LatencyMs = required(p99LatencyMs, "p99LatencyMs");
    this.trafficSpikeMultiplier = required(trafficSpikeMultiplier, "trafficSpikeMultiplier");
    this.llmErrorRatePercent = required(llmErrorRatePercent, "llmErrorRatePercent");
    this.llmP95LatencyMs = required(llmP95LatencyMs, "llmP95LatencyMs");
    this.llmTokenSpikeMultiplier = required(llmTokenSpikeMultiplier, "llmTokenSpikeMultiplier");
  }

  private static double required(Double value, String name) {
    Preconditions.checkArgument(value != null, "Threshold %s is not configured", name);
    Preconditions.checkArgument(
        !value.isNaN() && value >= 0, "Threshold %s must be a non-negative number", name);
    return value;
  }
}
