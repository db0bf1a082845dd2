package org.workerwatch.alert.engine.alert.state;

public enum AlertStatus {
  NEVER_ALERTED,
  IN_COOLDOWN,
  ELIGIBLE
}
