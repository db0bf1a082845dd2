package org.workerwatch.alert.engine;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;
import org.workerwatch.alert.engine.metric.anomaly.detector.ThresholdPolicyReader;

public class AlertEngineConfig {
  static final String COOLDOWN_CONFIG = "cooldown";
  static final String STATE_TTL_CONFIG = "stateTtl";
  static final String CHECK_INTERVAL_MINUTES_CONFIG = "checkIntervalMinutes";
  static final String BASELINE_PERIOD_HOURS_CONFIG = "baselinePeriodHours";
  static final String FETCH_TIMEOUT_CONFIG = "fetchTimeout";
  static final String FETCH_THREADS_CONFIG = "fetchThreads";

  static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(60);
  static final Duration DEFAULT_STATE_TTL = Duration.ofDays(7);
  static final int DEFAULT_CHECK_INTERVAL_MINUTES = 10;
  static final int DEFAULT_BASELINE_PERIOD_HOURS = 1;
  static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);
  static final int DEFAULT_FETCH_THREADS = 4;

  private final Duration cooldown;
  private final Duration stateTtl;
  private final int checkIntervalMinutes;
  private final int baselinePeriodHours;
  private final Duration fetchTimeout;
  private final int fetchThreads;
  private final ThresholdPolicy thresholdPolicy;

  public static AlertEngineConfig from(Config appConfig) {
    return new AlertEngineConfig(appConfig);
  }

  private AlertEngineConfig(Config appConfig) {
    this.cooldown =
        appConfig.hasPath(COOLDOWN_CONFIG)
            ? appConfig.getDuration(COOLDOWN_CONFIG)
            : DEFAULT_COOLDOWN;
    this.stateTtl =
        appConfig.hasPath(STATE_TTL_CONFIG)
            ? appConfig.getDuration(STATE_TTL_CONFIG)
            : DEFAULT_STATE_TTL;
    this.checkIntervalMinutes =
        appConfig.hasPath(CHECK_INTERVAL_MINUTES_CONFIG)
            ? appConfig.getInt(CHECK_INTERVAL_MINUTES_CONFIG)
            : DEFAULT_CHECK_INTERVAL_MINUTES;
    this.baselinePeriodHours =
        appConfig.hasPath(BASELINE_PERIOD_HOURS_CONFIG)
            ? appConfig.getInt(BASELINE_PERIOD_HOURS_CONFIG)
            : DEFAULT_BASELINE_PERIOD_HOURS;
    this.fetchTimeout =
        appConfig.hasPath(FETCH_TIMEOUT_CONFIG)
            ? appConfig.getDuration(FETCH_TIMEOUT_CONFIG)
            : DEFAULT_FETCH_TIMEOUT;
    this.fetchThreads =
        appConfig.hasPath(FETCH_THREADS_CONFIG)
            ? appConfig.getInt(FETCH_THREADS_CONFIG)
            : DEFAULT_FETCH_THREADS;
    this.thresholdPolicy = ThresholdPolicyReader.fromConfig(appConfig);

    Preconditions.checkArgument(
        stateTtl.compareTo(cooldown) > 0,
        "%s (%s) must be greater than %s (%s)",
        STATE_TTL_CONFIG,
        stateTtl,
        COOLDOWN_CONFIG,
        cooldown);
    Preconditions.checkArgument(
        checkIntervalMinutes > 0, "%s must be positive", CHECK_INTERVAL_MINUTES_CONFIG);
    Preconditions.checkArgument(
        baselinePeriodHours > 0, "%s must be positive", BASELINE_PERIOD_HOURS_CONFIG);
    Preconditions.checkArgument(fetchThreads > 0, "%s must be positive", FETCH_THREADS_CONFIG);
  }

  public Duration getCooldown() {
    return cooldown;
  }

  public Duration getStateTtl() {
    return stateTtl;
  }

  public int getCheckIntervalMinutes() {
    return checkIntervalMinutes;
  }

  public int getBaselinePeriodHours() {
    return baselinePeriodHours;
  }

  public Duration getFetchTimeout() {
    return fetchTimeout;
  }

  public int getFetchThreads() {
    return fetchThreads;
  }

  public ThresholdPolicy getThresholdPolicy() {
    return thresholdPolicy;
  }
}
