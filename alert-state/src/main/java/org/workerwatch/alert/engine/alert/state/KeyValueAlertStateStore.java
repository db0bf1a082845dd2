package org.workerwatch.alert.engine.alert.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AlertState;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.StoreUnavailableException;

/**
 * {@link AlertStateStore} on top of a {@link KeyValueStore}. Each state is stored as JSON under
 * {@code alert_state:<anomaly type key>}:
 *
 * <pre>{"lastAlertTime": 1714557600000, "alertCount": 3}</pre>
 */
public class KeyValueAlertStateStore implements AlertStateStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyValueAlertStateStore.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static final String KEY_PREFIX = "alert_state:";
  static final String LAST_ALERT_TIME = "lastAlertTime";
  static final String ALERT_COUNT = "alertCount";

  private final KeyValueStore keyValueStore;

  public KeyValueAlertStateStore(KeyValueStore keyValueStore) {
    this.keyValueStore = keyValueStore;
  }

  @Override
  public Optional<AlertState> get(AnomalyType type) throws StoreUnavailableException {
    String key = getStateKey(type);
    Optional<String> stateJson;
    try {
      stateJson = keyValueStore.get(key);
    } catch (IOException e) {
      throw new StoreUnavailableException("Unable to read alert state " + key, e);
    }
    if (stateJson.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(decode(key, stateJson.get()));
  }

  @Override
  public void put(AnomalyType type, AlertState state, Duration ttl)
      throws StoreUnavailableException {
    String key = getStateKey(type);
    try {
      keyValueStore.put(key, encode(state), ttl);
    } catch (IOException e) {
      throw new StoreUnavailableException("Unable to write alert state " + key, e);
    }
    LOGGER.debug("Stored alert state {} for key {} with ttl {}", state, key, ttl);
  }

  @Override
  public void delete(AnomalyType type) throws StoreUnavailableException {
    String key = getStateKey(type);
    try {
      keyValueStore.delete(key);
    } catch (IOException e) {
      throw new StoreUnavailableException("Unable to delete alert state " + key, e);
    }
  }

  @Override
  public void deleteAll(Collection<AnomalyType> types) throws StoreUnavailableException {
    for (AnomalyType type : types) {
      delete(type);
    }
  }

  static String getStateKey(AnomalyType type) {
    return KEY_PREFIX + type.getKey();
  }

  private static String encode(AlertState state) throws StoreUnavailableException {
    ObjectNode node = OBJECT_MAPPER.createObjectNode();
    node.put(LAST_ALERT_TIME, state.getLastAlertTime().toEpochMilli());
    node.put(ALERT_COUNT, state.getAlertCount());
    try {
      return OBJECT_MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new StoreUnavailableException("Unable to serialize alert state " + state, e);
    }
  }

  private static AlertState decode(String key, String stateJson)
      throws StoreUnavailableException {
    try {
      JsonNode node = OBJECT_MAPPER.readTree(stateJson);
      JsonNode lastAlertTime = node.get(LAST_ALERT_TIME);
      JsonNode alertCount = node.get(ALERT_COUNT);
      if (lastAlertTime == null
          || !lastAlertTime.canConvertToLong()
          || alertCount == null
          || !alertCount.canConvertToInt()) {
        throw new StoreUnavailableException(
            String.format("Malformed alert state for key %s: %s", key, stateJson));
      }
      return new AlertState(
          Instant.ofEpochMilli(lastAlertTime.asLong()), alertCount.asInt());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new StoreUnavailableException(
          String.format("Malformed alert state for key %s: %s", key, stateJson), e);
    }
  }
}
