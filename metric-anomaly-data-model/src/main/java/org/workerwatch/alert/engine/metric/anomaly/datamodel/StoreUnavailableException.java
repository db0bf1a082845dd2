package org.workerwatch.alert.engine.metric.anomaly.datamodel;

/** Alert state could not be read or written. */
public class StoreUnavailableException extends AlertEngineException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
