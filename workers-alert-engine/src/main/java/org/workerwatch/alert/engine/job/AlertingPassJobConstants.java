package org.workerwatch.alert.engine.job;

public class AlertingPassJobConstants {
  public static final String JOB_DATA_MAP_ALERTING_PASS = "alertingPass";

  public static final String JOB_NAME = "alerting-pass";
  public static final String JOB_GROUP = "alerting";
  public static final String JOB_TRIGGER_NAME = "alerting-pass-trigger";
  public static final String CRON_EXPRESSION = "0 */10 * * * ?";

  public static final String JOB_CONFIG = "job";
  public static final String JOB_CONFIG_CRON_EXPRESSION = "cronExpression";

  private AlertingPassJobConstants() {}
}
