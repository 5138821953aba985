package br.com.analytics.pipeline.sales_insights_batch.tasklet;

import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.run.PipelineResult;
import br.com.analytics.pipeline.sales_insights_batch.run.PipelineRunCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

public class InsightsRunTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(InsightsRunTasklet.class);

    private final PipelineRunCoordinator coordinator;

    public InsightsRunTasklet(PipelineRunCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        PipelineResult result = coordinator.trigger();
        DashboardMetrics metrics = result.metrics();

        if (!result.executed()) {
            log.info("Sources unchanged (fingerprint {}), dashboard metrics left as stored.", result.fingerprint());
            return RepeatStatus.FINISHED;
        }

        log.info("Dashboard metrics refreshed: {} unique customers from {} source records, {} unique authors, " +
                        "total revenue {}, {} skipped rows, {} unresolved transactions.",
                metrics.uniqueCustomerCount(), metrics.customerSourceRecordCount(), metrics.uniqueAuthorCount(),
                metrics.totalRevenue(), metrics.runSummary().skippedRecords(),
                metrics.runSummary().unresolvedLinkages());
        return RepeatStatus.FINISHED;
    }
}
