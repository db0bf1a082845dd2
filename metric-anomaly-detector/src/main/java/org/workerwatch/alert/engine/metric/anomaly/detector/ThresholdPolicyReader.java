package org.workerwatch.alert.engine.metric.anomaly.detector;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;

/**
 * Reads a {@link ThresholdPolicy} from a {@code thresholds} config block. Values not present in
 * the given config fall back to the defaults shipped in {@code reference.conf}; a key missing
 * from both fails with {@link com.typesafe.config.ConfigException.Missing}.
 */
public class ThresholdPolicyReader {

  static final String THRESHOLDS_CONFIG = "thresholds";
  static final String DEFAULTS_CONFIG = "workerwatch.alert.engine.thresholds";

  static final String ERROR_RATE_PERCENT = "errorRatePercent";
  static final String P95_LATENCY_MS = "p95LatencyMs";
  static final String P99_LATENCY_MS = "p99LatencyMs";
  static final String TRAFFIC_SPIKE_MULTIPLIER = "trafficSpikeMultiplier";
  static final String LLM_ERROR_RATE_PERCENT = "llmErrorRatePercent";
  static final String LLM_P95_LATENCY_MS = "llmP95LatencyMs";
  static final String LLM_TOKEN_SPIKE_MULTIPLIER = "llmTokenSpikeMultiplier";

  private ThresholdPolicyReader() {}

  public static ThresholdPolicy defaults() {
    return read(ConfigFactory.defaultReference().getConfig(DEFAULTS_CONFIG));
  }

  /** @param appConfig config that may contain a {@code thresholds} block */
  public static ThresholdPolicy fromConfig(Config appConfig) {
    Config defaults = ConfigFactory.defaultReference().getConfig(DEFAULTS_CONFIG);
    Config thresholds =
        appConfig.hasPath(THRESHOLDS_CONFIG)
            ? appConfig.getConfig(THRESHOLDS_CONFIG).withFallback(defaults)
            : defaults;
    return read(thresholds);
  }

  /** Reads a thresholds block as-is, without defaults. */
  public static ThresholdPolicy read(Config thresholds) {
    return ThresholdPolicy.builder()
        .errorRatePercent(thresholds.getDouble(ERROR_RATE_PERCENT))
        .p95LatencyMs(thresholds.getDouble(P95_LATENCY_MS))
        .p99LatencyMs(thresholds.getDouble(P99_LATENCY_MS))
        .trafficSpikeMultiplier(thresholds.getDouble(TRAFFIC_SPIKE_MULTIPLIER))
        .llmErrorRatePercent(thresholds.getDouble(LLM_ERROR_RATE_PERCENT))
        .llmP95LatencyMs(thresholds.getDouble(LLM_P95_LATENCY_MS))
        .llmTokenSpikeMultiplier(thresholds.getDouble(LLM_TOKEN_SPIKE_MULTIPLIER))
        .build();
  }
}
