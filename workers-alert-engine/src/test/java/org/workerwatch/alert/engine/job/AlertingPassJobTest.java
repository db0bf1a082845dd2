package org.workerwatch.alert.engine.job;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Date;
import org.junit.jupiter.api.Test;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.workerwatch.alert.engine.AlertingPass;
import org.workerwatch.alert.engine.PassOutcome;

class AlertingPassJobTest {

  @Test
  void testRunsPassAtScheduledFireTime() {
    Instant fireTime = Instant.parse("2024-05-01T10:10:00Z");
    AlertingPass alertingPass = mock(AlertingPass.class);
    when(alertingPass.runPass(any(Instant.class))).thenReturn(PassOutcome.NO_ANOMALIES);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(AlertingPassJobConstants.JOB_DATA_MAP_ALERTING_PASS, alertingPass);
    JobDetail jobDetail =
        JobBuilder.newJob(AlertingPassJob.class)
            .withIdentity("alerting-pass", "alerting")
            .usingJobData(jobDataMap)
            .build();
    JobExecutionContext context = mock(JobExecutionContext.class);
    when(context.getJobDetail()).thenReturn(jobDetail);
    when(context.getScheduledFireTime()).thenReturn(Date.from(fireTime));

    new AlertingPassJob().execute(context);

    verify(alertingPass).runPass(fireTime);
  }

  @Test
  void testPassesNeverOverlap() {
    assertTrue(AlertingPassJob.class.isAnnotationPresent(DisallowConcurrentExecution.class));
  }
}
