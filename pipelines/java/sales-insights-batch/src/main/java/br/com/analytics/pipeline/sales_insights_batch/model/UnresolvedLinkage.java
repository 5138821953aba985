package br.com.analytics.pipeline.sales_insights_batch.model;

public record UnresolvedLinkage(
        SourceId sourceId,
        LinkageFailure reason,
        String detail
) {
}
