package org.workerwatch.alert.engine.metric.anomaly.datamodel;

public enum MetricSourceType {
  WORKER,
  LLM
}
