package org.workerwatch.alert.engine.metric.anomaly.datamodel;

import java.time.Instant;

/** Immutable reading of one metric source over one time window. */
public interface MetricSnapshot {

  MetricSourceType getSource();

  Instant getTimestamp();
}
