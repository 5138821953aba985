package br.com.analytics.pipeline.sales_insights_batch.model;

/**
 * Per error kind counts of one pipeline run. Rows and transactions counted
 * here were left out of the metrics without failing the run.
 */
public record RunSummary(
        long malformedRows,
        long normalizationErrors,
        long unresolvedLinkages
) {

    public long skippedRecords() {
        return malformedRows + normalizationErrors;
    }
}
