package br.com.analytics.pipeline.sales_insights_batch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Starts {@code salesInsightsJob} once the application is up.
 */
@Component
public class InsightsJobLauncher implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(InsightsJobLauncher.class);

    private final JobOperator jobOperator;
    private final Job salesInsightsJob;

    public InsightsJobLauncher(JobOperator jobOperator, Job salesInsightsJob) {
        this.jobOperator = jobOperator;
        this.salesInsightsJob = salesInsightsJob;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        JobParameters parameters = new JobParametersBuilder()
                .addLong("launchedAt", System.currentTimeMillis())
                .toJobParameters();
        JobExecution execution = jobOperator.start(salesInsightsJob, parameters);
        log.info("Job {} finished with status {}.", salesInsightsJob.getName(), execution.getStatus());
    }
}
