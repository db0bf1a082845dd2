package org.workerwatch.alert.engine.metric.anomaly.datamodel;

public enum Severity {
  HIGH,
  DEFAULT
}
