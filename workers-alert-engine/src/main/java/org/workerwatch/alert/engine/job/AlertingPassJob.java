package org.workerwatch.alert.engine.job;

import java.time.Instant;
import java.util.Date;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.workerwatch.alert.engine.AlertingPass;
import org.workerwatch.alert.engine.PassOutcome;

/** Quartz entry point for a scheduled pass. Overlapping firings wait for the running pass. */
@DisallowConcurrentExecution
public class AlertingPassJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertingPassJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting alerting pass: {}", jobDetail.getKey());

    AlertingPass alertingPass =
        (AlertingPass)
            jobDetail.getJobDataMap().get(AlertingPassJobConstants.JOB_DATA_MAP_ALERTING_PASS);

    Date fireTime = jobExecutionContext.getScheduledFireTime();
    Instant now = fireTime != null ? fireTime.toInstant() : Instant.now();

    PassOutcome outcome = alertingPass.runPass(now);
    LOGGER.info("Alerting pass {} finished with {}", jobDetail.getKey(), outcome);
  }
}
