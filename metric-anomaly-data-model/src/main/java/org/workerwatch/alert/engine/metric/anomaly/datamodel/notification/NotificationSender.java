package org.workerwatch.alert.engine.metric.anomaly.datamodel.notification;

import java.util.List;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.DeliveryFailedException;

public interface NotificationSender {

  /**
   * Delivers all anomalies of one pass as a single notification.
   *
   * @param anomalies non empty list of anomalies to notify about
   * @throws DeliveryFailedException if the notification could not be delivered
   */
  void send(List<Anomaly> anomalies) throws DeliveryFailedException;
}
