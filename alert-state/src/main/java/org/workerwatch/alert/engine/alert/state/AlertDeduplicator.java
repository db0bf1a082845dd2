package org.workerwatch.alert.engine.alert.state;

import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AlertState;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.StoreUnavailableException;

/**
 * Decides which anomalies may be notified and records the notifications that were sent. An
 * anomaly type is eligible when it was never notified, or when at least {@code cooldown} has
 * passed since its last notification.
 *
 * <p>{@link #recordAlerts(List)} reads then writes each state without any atomicity guarantee.
 * Two overlapping passes recording the same type can both increment {@code alertCount}; callers
 * are expected to run at most one pass at a time.
 */
public class AlertDeduplicator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertDeduplicator.class);

  private final AlertStateStore alertStateStore;
  private final Clock clock;
  private final Duration cooldown;
  private final Duration stateTtl;

  /**
   * @param stateTtl expiry of stored states, must be longer than {@code cooldown} or a state
   *     could expire while its type is still cooling down
   */
  public AlertDeduplicator(
      AlertStateStore alertStateStore, Clock clock, Duration cooldown, Duration stateTtl) {
    Preconditions.checkArgument(!cooldown.isNegative(), "cooldown must not be negative");
    Preconditions.checkArgument(
        stateTtl.compareTo(cooldown) > 0,
        "state ttl %s must be greater than cooldown %s",
        stateTtl,
        cooldown);
    this.alertStateStore = alertStateStore;
    this.clock = clock;
    this.cooldown = cooldown;
    this.stateTtl = stateTtl;
  }

  /**
   * Keeps the anomalies whose type is not cooling down, preserving order. All decisions use the
   * states as read at call start; nothing is written.
   */
  public List<Anomaly> filterNewAlerts(List<Anomaly> anomalies) throws StoreUnavailableException {
    Instant now = clock.instant();
    Map<AnomalyType, Optional<AlertState>> states = readStates(anomalies);

    List<Anomaly> newAlerts = new ArrayList<>();
    for (Anomaly anomaly : anomalies) {
      if (isEligible(states.get(anomaly.getType()), now)) {
        newAlerts.add(anomaly);
      } else {
        LOGGER.debug("Anomaly {} is in cooldown, skipping", anomaly.getType().getKey());
      }
    }
    return newAlerts;
  }

  /** Records one notification per distinct anomaly type in the batch. */
  public void recordAlerts(List<Anomaly> anomalies) throws StoreUnavailableException {
    Instant now = clock.instant();
    Set<AnomalyType> types = new LinkedHashSet<>();
    anomalies.forEach(anomaly -> types.add(anomaly.getType()));

    for (AnomalyType type : types) {
      AlertState state =
          alertStateStore
              .get(type)
              .map(previous -> previous.next(now))
              .orElseGet(() -> AlertState.first(now));
      alertStateStore.put(type, state, stateTtl);
      LOGGER.debug("Recorded alert {} with state {}", type.getKey(), state);
    }
  }

  public Optional<AlertState> getState(AnomalyType type) throws StoreUnavailableException {
    return alertStateStore.get(type);
  }

  public AlertStatus statusOf(AnomalyType type) throws StoreUnavailableException {
    Optional<AlertState> state = alertStateStore.get(type);
    if (state.isEmpty()) {
      return AlertStatus.NEVER_ALERTED;
    }
    return isEligible(state, clock.instant()) ? AlertStatus.ELIGIBLE : AlertStatus.IN_COOLDOWN;
  }

  public void clearAllState() throws StoreUnavailableException {
    alertStateStore.deleteAll(EnumSet.allOf(AnomalyType.class));
    LOGGER.info("Cleared alert state for all anomaly types");
  }

  private Map<AnomalyType, Optional<AlertState>> readStates(List<Anomaly> anomalies)
      throws StoreUnavailableException {
    Map<AnomalyType, Optional<AlertState>> states = new EnumMap<>(AnomalyType.class);
    for (Anomaly anomaly : anomalies) {
      if (!states.containsKey(anomaly.getType())) {
        states.put(anomaly.getType(), alertStateStore.get(anomaly.getType()));
      }
    }
    return states;
  }

  private boolean isEligible(Optional<AlertState> state, Instant now) {
    return state.isEmpty()
        || Duration.between(state.get().getLastAlertTime(), now).compareTo(cooldown) >= 0;
  }
}
