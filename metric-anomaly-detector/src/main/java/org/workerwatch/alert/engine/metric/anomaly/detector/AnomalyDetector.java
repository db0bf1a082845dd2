package org.workerwatch.alert.engine.metric.anomaly.detector;

import java.util.List;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.MetricSnapshot;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;

/**
 * Compares a snapshot, and optionally a baseline of the same source, against a {@link
 * ThresholdPolicy}. Implementations are pure: no I/O, no metrics, no state, and the same input
 * always gives the same anomalies in the same order.
 */
public interface AnomalyDetector<S extends MetricSnapshot> {

  /**
   * @param current snapshot of the evaluated window
   * @param baseline snapshot of an earlier comparison window, may be null
   * @param policy limits to compare against
   * @return anomalies in detector specific stable order, empty when nothing is breached
   */
  List<Anomaly> detect(S current, S baseline, ThresholdPolicy policy);
}
