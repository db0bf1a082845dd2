package org.workerwatch.alert.engine.alert.state;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/** String key/value storage with per entry expiry, provided by the hosting environment. */
public interface KeyValueStore {

  Optional<String> get(String key) throws IOException;

  void put(String key, String value, Duration ttl) throws IOException;

  void delete(String key) throws IOException;
}
