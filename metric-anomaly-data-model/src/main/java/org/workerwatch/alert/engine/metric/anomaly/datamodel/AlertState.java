package org.workerwatch.alert.engine.metric.anomaly.datamodel;

import com.google.common.base.Preconditions;
import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class AlertState {
  private final Instant lastAlertTime;
  private final int alertCount;

  public AlertState(Instant lastAlertTime, int alertCount) {
    Preconditions.checkArgument(lastAlertTime != null, "lastAlertTime is required");
    Preconditions.checkArgument(alertCount >= 1, "alertCount must be >= 1, got %s", alertCount);
    this.lastAlertTime = lastAlertTime;
    this.alertCount = alertCount;
  }

  public static AlertState first(Instant alertTime) {
    return new AlertState(alertTime, 1);
  }

  public AlertState next(Instant alertTime) {
    return new AlertState(alertTime, alertCount + 1);
  }
}
