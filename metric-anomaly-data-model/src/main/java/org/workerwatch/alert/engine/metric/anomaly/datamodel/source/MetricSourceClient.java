package org.workerwatch.alert.engine.metric.anomaly.datamodel.source;

import org.workerwatch.alert.engine.metric.anomaly.datamodel.MetricSnapshot;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.MetricSourceType;

/**
 * Reads snapshots from one metric source. Implementations receive every identifier they need
 * (account, project, session ids) already resolved at construction time.
 */
public interface MetricSourceClient<S extends MetricSnapshot> {

  MetricSourceType getSourceType();

  /** Metrics of the last {@code windowMinutes} minutes. */
  MetricFetchResult<S> getCurrent(int windowMinutes);

  /** Metrics of a window of the same size ending {@code hoursAgo} hours ago. */
  MetricFetchResult<S> getBaseline(int hoursAgo);
}
