package org.workerwatch.alert.engine;

public enum PassOutcome {
  NO_ANOMALIES,
  ALL_IN_COOLDOWN,
  NOTIFIED,
  // notification failed, nothing recorded so the anomalies stay eligible
  DELIVERY_FAILED,
  STORE_UNAVAILABLE,
  FAILED
}
