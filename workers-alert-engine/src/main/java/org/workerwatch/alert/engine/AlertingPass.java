package org.workerwatch.alert.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.alert.state.AlertDeduplicator;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Anomaly;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.AnomalyType;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.DeliveryFailedException;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.Severity;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.StoreUnavailableException;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.notification.NotificationSender;
import org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.EvaluatorUtil;

/**
 * One detection pass: fetch every source, detect anomalies, drop the ones still in cooldown,
 * notify, and record what was sent.
 *
 * <p>State is recorded only after the sender accepted the batch, so a failed delivery is
 * retried on the next pass. Two passes running at the same time may both notify for the same
 * type; callers are expected to serialize passes.
 */
public class AlertingPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertingPass.class);
  private static final ConcurrentMap<PassOutcome, Counter> passOutcomeCounter =
      new ConcurrentHashMap<>();
  private static final String PASS_OUTCOME_COUNTER = "workerwatch.alert.engine.pass.outcome";
  private static final Timer passTimer =
      Metrics.globalRegistry.timer("workerwatch.alert.engine.pass.time");

  private final List<SourcePipeline<?>> pipelines;
  private final AlertDeduplicator deduplicator;
  private final NotificationSender notificationSender;
  private final AlertEngineConfig config;
  private final Executor executor;

  public AlertingPass(
      List<SourcePipeline<?>> pipelines,
      AlertDeduplicator deduplicator,
      NotificationSender notificationSender,
      AlertEngineConfig config,
      Executor executor) {
    this.pipelines = List.copyOf(pipelines);
    this.deduplicator = deduplicator;
    this.notificationSender = notificationSender;
    this.config = config;
    this.executor = executor;
  }

  /** Runs a full pass. Never throws; every failure is reported through the outcome. */
  public PassOutcome runPass(Instant now) {
    Instant start = Instant.now();
    PassOutcome outcome;
    try {
      List<Anomaly> anomalies = detectAll();
      LOGGER.info("Pass at {}: {} anomalies detected", now, anomalies.size());
      outcome = notifyNew(anomalies);
    } catch (RuntimeException e) {
      LOGGER.error("Pass at {} failed", now, e);
      outcome = PassOutcome.FAILED;
    }
    record(outcome, start);
    return outcome;
  }

  /**
   * Sends a synthetic error rate alert for both sources, bypassing the metric sources. With
   * {@link ForcedAlertOptions#isIgnoreCooldown()} unset the usual cooldown applies.
   */
  public PassOutcome runForcedPass(Instant now, ForcedAlertOptions options) {
    Instant start = Instant.now();
    ThresholdPolicy policy = config.getThresholdPolicy();
    List<Anomaly> anomalies =
        List.of(
            Anomaly.builder()
                .type(AnomalyType.HIGH_ERROR_RATE)
                .severity(Severity.HIGH)
                .message(
                    String.format(
                        "Error rate is %s%% (threshold: %s%%)",
                        EvaluatorUtil.formatPercent(options.getMockErrorRate()),
                        EvaluatorUtil.formatLimit(policy.getErrorRatePercent())))
                .observedValue(options.getMockErrorRate())
                .threshold(policy.getErrorRatePercent())
                .occurredAt(now)
                .build(),
            Anomaly.builder()
                .type(AnomalyType.LLM_ERROR_RATE)
                .severity(Severity.HIGH)
                .message(
                    String.format(
                        "LLM error rate is %s%% (threshold: %s%%)",
                        EvaluatorUtil.formatPercent(options.getMockLlmErrorRate()),
                        EvaluatorUtil.formatLimit(policy.getLlmErrorRatePercent())))
                .observedValue(options.getMockLlmErrorRate())
                .threshold(policy.getLlmErrorRatePercent())
                .occurredAt(now)
                .build());
    LOGGER.info("Forced pass at {} with {}", now, options);

    PassOutcome outcome;
    try {
      outcome =
          options.isIgnoreCooldown() ? deliverAndRecord(anomalies) : notifyNew(anomalies);
    } catch (RuntimeException e) {
      LOGGER.error("Forced pass at {} failed", now, e);
      outcome = PassOutcome.FAILED;
    }
    record(outcome, start);
    return outcome;
  }

  List<Anomaly> detectAll() {
    List<CompletableFuture<List<Anomaly>>> futures =
        pipelines.stream()
            .map(
                pipeline ->
                    pipeline.evaluate(
                        executor,
                        config.getFetchTimeout(),
                        config.getCheckIntervalMinutes(),
                        config.getBaselinePeriodHours(),
                        config.getThresholdPolicy()))
            .collect(Collectors.toList());

    // source order is kept so notifications read the same way every pass
    List<Anomaly> anomalies = new ArrayList<>();
    for (CompletableFuture<List<Anomaly>> future : futures) {
      anomalies.addAll(future.join());
    }
    return anomalies;
  }

  private PassOutcome notifyNew(List<Anomaly> anomalies) {
    if (anomalies.isEmpty()) {
      return PassOutcome.NO_ANOMALIES;
    }

    List<Anomaly> newAlerts;
    try {
      newAlerts = deduplicator.filterNewAlerts(anomalies);
    } catch (StoreUnavailableException e) {
      LOGGER.error("Alert state unavailable, not notifying", e);
      return PassOutcome.STORE_UNAVAILABLE;
    }

    if (newAlerts.isEmpty()) {
      LOGGER.info(
          "All {} anomalies are in cooldown: {}",
          anomalies.size(),
          anomalies.stream()
              .map(a -> a.getType().getTitle())
              .distinct()
              .collect(Collectors.toList()));
      return PassOutcome.ALL_IN_COOLDOWN;
    }
    return deliverAndRecord(newAlerts);
  }

  private PassOutcome deliverAndRecord(List<Anomaly> alerts) {
    try {
      notificationSender.send(alerts);
    } catch (DeliveryFailedException e) {
      LOGGER.error("Failed to deliver {} alerts, will retry next pass", alerts.size(), e);
      return PassOutcome.DELIVERY_FAILED;
    }
    LOGGER.info(
        "Sent {} alerts: {}",
        alerts.size(),
        alerts.stream().map(a -> a.getType().getTitle()).collect(Collectors.toList()));

    try {
      deduplicator.recordAlerts(alerts);
    } catch (StoreUnavailableException e) {
      LOGGER.error("Alerts were sent but their state could not be recorded", e);
      return PassOutcome.STORE_UNAVAILABLE;
    }
    return PassOutcome.NOTIFIED;
  }

  private void record(PassOutcome outcome, Instant start) {
    passTimer.record(Duration.between(start, Instant.now()));
    passOutcomeCounter
        .computeIfAbsent(
            outcome,
            k -> Metrics.globalRegistry.counter(PASS_OUTCOME_COUNTER, "outcome", k.name()))
        .increment();
  }
}
