package br.com.analytics.pipeline.sales_insights_batch.model;

/**
 * The three independent sales data origins. Declaration order is the source
 * priority used to break ties when merging records (S1 wins over S2 over S3).
 */
public enum SourceTag {
    S1,
    S2,
    S3
}
