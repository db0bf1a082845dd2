package org.workerwatch.alert.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.alert.state.AlertDeduplicator;
import org.workerwatch.alert.engine.alert.state.KeyValueAlertStateStore;
import org.workerwatch.alert.engine.alert.state.KeyValueStore;
import org.workerwatch.alert.engine.job.AlertingPassJobManager;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.LlmRunMetrics;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.WorkerMetrics;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.notification.NotificationSender;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.source.MetricSourceClient;
import org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.LlmMetricsAnomalyDetector;
import org.workerwatch.alert.engine.metric.anomaly.detector.evaluator.WorkerMetricsAnomalyDetector;

/**
 * Wires the worker and LLM pipelines, the deduplicator and the notification sender into an
 * {@link AlertingPass}, and optionally schedules it on a Quartz {@link Scheduler}.
 */
public class AlertEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEngine.class);
  static final String ALERTING_CONFIG = "alerting";

  private final AlertEngineConfig engineConfig;
  private final ExecutorService fetchExecutor;
  private final AlertDeduplicator deduplicator;
  private final AlertingPass alertingPass;
  private final AlertingPassJobManager jobManager;
  private final Config alertingConfig;

  public AlertEngine(
      Config appConfig,
      MetricSourceClient<WorkerMetrics> workerClient,
      MetricSourceClient<LlmRunMetrics> llmClient,
      NotificationSender notificationSender,
      KeyValueStore keyValueStore,
      Clock clock) {
    this.alertingConfig =
        appConfig.hasPath(ALERTING_CONFIG) ? appConfig.getConfig(ALERTING_CONFIG) : appConfig;
    this.engineConfig = AlertEngineConfig.from(alertingConfig);
    LOGGER.info(
        "Alert engine config: cooldown {}, state ttl {}, window {}m, baseline {}h ago",
        engineConfig.getCooldown(),
        engineConfig.getStateTtl(),
        engineConfig.getCheckIntervalMinutes(),
        engineConfig.getBaselinePeriodHours());

    this.fetchExecutor =
        Executors.newFixedThreadPool(
            engineConfig.getFetchThreads(),
            new ThreadFactoryBuilder().setNameFormat("alert-fetch-%d").setDaemon(true).build());
    this.deduplicator =
        new AlertDeduplicator(
            new KeyValueAlertStateStore(keyValueStore),
            clock,
            engineConfig.getCooldown(),
            engineConfig.getStateTtl());
    this.alertingPass =
        new AlertingPass(
            List.of(
                new SourcePipeline<>(workerClient, new WorkerMetricsAnomalyDetector()),
                new SourcePipeline<>(llmClient, new LlmMetricsAnomalyDetector())),
            deduplicator,
            notificationSender,
            engineConfig,
            fetchExecutor);
    this.jobManager = new AlertingPassJobManager(alertingPass);
  }

  public AlertingPass getAlertingPass() {
    return alertingPass;
  }

  public AlertDeduplicator getDeduplicator() {
    return deduplicator;
  }

  public AlertEngineConfig getEngineConfig() {
    return engineConfig;
  }

  public void start(Scheduler scheduler) throws SchedulerException {
    jobManager.initJob(alertingConfig);
    jobManager.startJob(scheduler);
  }

  /** Removes the scheduled job and releases the fetch threads. */
  public void stop(Scheduler scheduler) throws SchedulerException {
    try {
      jobManager.stopJob(scheduler);
    } finally {
      shutdownExecutor();
    }
  }

  public void shutdownExecutor() {
    fetchExecutor.shutdown();
    try {
      if (!fetchExecutor.awaitTermination(
          engineConfig.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        fetchExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      fetchExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
