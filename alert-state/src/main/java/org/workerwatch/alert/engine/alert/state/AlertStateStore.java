package org.workerwatch.alert.engine.alert.state;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AlertState;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.StoreUnavailableException;

/**
 * Persistent record of the last notification per {@link AnomalyType}. Failures are always
 * reported as {@link StoreUnavailableException}; it is up to the caller to decide whether a
 * store outage blocks notifications.
 */
public interface AlertStateStore {

  Optional<AlertState> get(AnomalyType type) throws StoreUnavailableException;

  /** Writes the state; once {@code ttl} has elapsed the entry reads as absent. */
  void put(AnomalyType type, AlertState state, Duration ttl) throws StoreUnavailableException;

  void delete(AnomalyType type) throws StoreUnavailableException;

  void deleteAll(Collection<AnomalyType> types) throws StoreUnavailableException;
}
