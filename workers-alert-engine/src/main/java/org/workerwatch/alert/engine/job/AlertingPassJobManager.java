package org.workerwatch.alert.engine.job;

import static org.workerwatch.alert.engine.job.AlertingPassJobConstants.CRON_EXPRESSION;
import static org.workerwatch.alert.engine.job.AlertingPassJobConstants.JOB_CONFIG;
import static org.workerwatch.alert.engine.job.AlertingPassJobConstants.JOB_CONFIG_CRON_EXPRESSION;
import static org.workerwatch.alert.engine.job.AlertingPassJobConstants.JOB_DATA_MAP_ALERTING_PASS;
import static org.workerwatch.alert.engine.job.AlertingPassJobConstants.JOB_GROUP;
import static org.workerwatch.alert.engine.job.AlertingPassJobConstants.JOB_NAME;
import static org.workerwatch.alert.engine.job.AlertingPassJobConstants.JOB_TRIGGER_NAME;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.AlertingPass;

public class AlertingPassJobManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertingPassJobManager.class);

  private final AlertingPass alertingPass;
  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public AlertingPassJobManager(AlertingPass alertingPass) {
    this.alertingPass = alertingPass;
  }

  public void initJob(Config appConfig) {
    Config jobConfig =
        appConfig.hasPath(JOB_CONFIG)
            ? appConfig.getConfig(JOB_CONFIG)
            : ConfigFactory.parseMap(Map.of());

    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_ALERTING_PASS, alertingPass);

    jobDetail =
        JobBuilder.newJob(AlertingPassJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    String cronExpression =
        jobConfig.hasPath(JOB_CONFIG_CRON_EXPRESSION)
            ? jobConfig.getString(JOB_CONFIG_CRON_EXPRESSION)
            : CRON_EXPRESSION;
    LOGGER.info("Alerting pass job {} uses cron expression {}", jobKey, cronExpression);

    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .startNow()
            .build();
  }

  public void startJob(Scheduler scheduler) throws SchedulerException {
    Preconditions.checkState(jobDetail != null, "initJob must be called before startJob");
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  public void stopJob(Scheduler scheduler) throws SchedulerException {
    if (jobKey != null && scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
  }

  JobDetail getJobDetail() {
    return jobDetail;
  }

  Trigger getJobTrigger() {
    return jobTrigger;
  }
}
