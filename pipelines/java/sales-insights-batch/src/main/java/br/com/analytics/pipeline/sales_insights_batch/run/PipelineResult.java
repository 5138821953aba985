package br.com.analytics.pipeline.sales_insights_batch.run;

import br.com.analytics.pipeline.sales_insights_batch.model.DashboardMetrics;
import br.com.analytics.pipeline.sales_insights_batch.model.Fingerprint;

/**
 * @param executed {@code false} when the metrics were served from the store
 *                 because the inputs had not changed since the last run
 */
public record PipelineResult(
        Fingerprint fingerprint,
        DashboardMetrics metrics,
        boolean executed
) {
}
