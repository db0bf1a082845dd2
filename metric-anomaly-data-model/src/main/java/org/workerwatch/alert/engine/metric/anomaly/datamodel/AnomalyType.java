package org.workerwatch.alert.engine.metric.anomaly.datamodel;

public enum AnomalyType {
  HIGH_ERROR_RATE("high_error_rate", "High Error Rate"),
  HIGH_LATENCY("high_latency", "High Latency"),
  TRAFFIC_SPIKE("traffic_spike", "Traffic Spike"),
  LLM_ERROR_RATE("llm_error_rate", "LLM Error Rate"),
  LLM_LATENCY("llm_latency", "LLM Latency"),
  LLM_HIGH_TOKENS("llm_high_tokens", "High Token Usage");

  private final String key;
  private final String title;

  AnomalyType(String key, String title) {
    this.key = key;
    this.title = title;
  }

  /** Stable identifier used for persisted alert state. */
  public String getKey() {
    return key;
  }

  public String getTitle() {
    return title;
  }
}
