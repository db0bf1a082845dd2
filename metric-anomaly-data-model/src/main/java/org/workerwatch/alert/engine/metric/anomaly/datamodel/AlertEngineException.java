package org.workerwatch.alert.engine.metric.anomaly.datamodel;

public abstract class AlertEngineException extends Exception {

  protected AlertEngineException(String message) {
    super(message);
  }

  protected AlertEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
