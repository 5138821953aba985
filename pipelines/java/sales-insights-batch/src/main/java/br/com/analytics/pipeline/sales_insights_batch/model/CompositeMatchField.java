package br.com.analytics.pipeline.sales_insights_batch.model;

/**
 * Fields that can corroborate a name match between two customer records.
 */
public enum CompositeMatchField {
    ADDRESS,
    PHONE
}
