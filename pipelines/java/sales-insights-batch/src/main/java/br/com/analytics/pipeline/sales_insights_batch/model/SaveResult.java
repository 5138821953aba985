package br.com.analytics.pipeline.sales_insights_batch.model;

public record SaveResult(
        int customerProfiles,
        int bookCatalog,
        int transactionRecords,
        int analyticsMetrics
) {
}
