package org.workerwatch.alert.engine.metric.anomaly.datamodel;

/** A metric source could not be reached or rejected the request. */
public class SourceUnavailableException extends AlertEngineException {

  public SourceUnavailableException(MetricSourceType source, String message) {
    super(String.format("Metric source %s unavailable: %s", source, message));
  }

  public SourceUnavailableException(MetricSourceType source, String message, Throwable cause) {
    super(String.format("Metric source %s unavailable: %s", source, message), cause);
  }
}
