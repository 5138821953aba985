package br.com.analytics.pipeline.sales_insights_batch.config;

public enum StoreType {
    JDBC,
    MEMORY
}
