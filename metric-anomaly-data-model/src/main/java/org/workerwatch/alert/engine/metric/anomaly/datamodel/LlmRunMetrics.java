package org.workerwatch.alert.engine.metric.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/** Aggregated LLM run metrics for one tracing project. Latencies are in milliseconds. */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class LlmRunMetrics implements MetricSnapshot {
  private final long totalRuns;
  private final long errorCount;
  // percentage, 0-100
  private final double errorRate;
  private final double avgLatencyMillis;
  private final double p95LatencyMillis;
  private final long totalTokens;
  private final double avgTokensPerRun;
  @NonNull private final Instant timestamp;

  @Override
  public MetricSourceType getSource() {
    return MetricSourceType.LLM;
  }
}
