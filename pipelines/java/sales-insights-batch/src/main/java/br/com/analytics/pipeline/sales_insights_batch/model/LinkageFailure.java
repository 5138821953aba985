package br.com.analytics.pipeline.sales_insights_batch.model;

public enum LinkageFailure {
    UNKNOWN_CUSTOMER,
    MISSING_BOOK_REFERENCE,
    UNKNOWN_BOOK
}
