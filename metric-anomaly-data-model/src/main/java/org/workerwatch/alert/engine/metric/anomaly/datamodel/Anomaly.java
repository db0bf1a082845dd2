package org.workerwatch.alert.engine.metric.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A single threshold breach found in one detection pass. Anomalies are never persisted, only the
 * time at which a notification was sent for their {@link AnomalyType}.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class Anomaly {
  @NonNull private final AnomalyType type;
  @NonNull private final Severity severity;
  @NonNull private final String message;
  private final double observedValue;
  private final double threshold;
  @NonNull private final Instant occurredAt;
}
