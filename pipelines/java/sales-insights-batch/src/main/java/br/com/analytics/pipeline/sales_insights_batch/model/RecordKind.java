package br.com.analytics.pipeline.sales_insights_batch.model;

public enum RecordKind {
    BOOK,
    CUSTOMER,
    TRANSACTION
}
