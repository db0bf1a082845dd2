package org.workerwatch.alert.engine.metric.anomaly.datamodel;

public class DeliveryFailedException extends AlertEngineException {

  public DeliveryFailedException(String message) {
    super(message);
  }

  public DeliveryFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
