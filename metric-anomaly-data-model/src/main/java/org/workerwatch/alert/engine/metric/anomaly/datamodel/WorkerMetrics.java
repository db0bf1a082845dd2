package org.workerwatch.alert.engine.metric.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/** Request level metrics of the edge workers. Latencies are in milliseconds. */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class WorkerMetrics implements MetricSnapshot {
  private final long requestCount;
  // percentage, 0-100
  private final double errorRate;
  private final double p95LatencyMillis;
  private final double p99LatencyMillis;
  private final long errors5xx;
  private final long errors4xx;
  @NonNull private final Instant timestamp;

  @Override
  public MetricSourceType getSource() {
    return MetricSourceType.WORKER;
  }
}
